/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.soklet.userprofile.validation;

import com.google.inject.Inject;
import com.soklet.userprofile.exception.ProfileValidationException.ErrorCollector;
import com.soklet.userprofile.model.ProfileField;
import com.soklet.userprofile.model.UserProfileRecord;
import com.soklet.userprofile.model.UserProfileUpdate;
import com.soklet.userprofile.model.UserRole;
import com.soklet.userprofile.model.api.request.UserProfileDraft;
import com.soklet.userprofile.util.NicknameGenerator.NicknameGenerationException;
import com.soklet.userprofile.validation.NicknameResolver.ResolvedNickname;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static com.soklet.userprofile.exception.ValidationErrorType.COLLABORATOR;
import static com.soklet.userprofile.exception.ValidationErrorType.FIELD_REQUIRED;
import static com.soklet.userprofile.exception.ValidationErrorType.RECORD_EMPTY;
import static com.soklet.userprofile.util.Normalizer.trimAggressivelyToNull;
import static com.soklet.userprofile.validation.FieldValidators.validateEmailAddress;
import static com.soklet.userprofile.validation.FieldValidators.validateFreeText;
import static com.soklet.userprofile.validation.FieldValidators.validateGenericUrl;
import static com.soklet.userprofile.validation.FieldValidators.validateGithubUrl;
import static com.soklet.userprofile.validation.FieldValidators.validateLinkedinUrl;
import static com.soklet.userprofile.validation.FieldValidators.validateNickname;
import static com.soklet.userprofile.validation.FieldValidators.validatePassword;
import static com.soklet.userprofile.validation.FieldValidators.validateRole;
import static java.util.Objects.requireNonNull;

/**
 * Composes {@link FieldValidators} into the two writable record shapes: a full record for account creation
 * and a partial record for updates.
 * <p>
 * Both shapes validate every field before deciding, so callers receive all errors for a draft at once.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserProfileValidator {
	@NonNull
	private final NicknameResolver nicknameResolver;
	@NonNull
	private final Logger logger;

	@Inject
	public UserProfileValidator(@NonNull NicknameResolver nicknameResolver) {
		requireNonNull(nicknameResolver);

		this.nicknameResolver = nicknameResolver;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Validates a draft for account creation. Email, password and role are required; a nickname is generated
	 * if none is given.
	 */
	@NonNull
	public RecordResult<UserProfileRecord> validateForCreate(@NonNull UserProfileDraft draft) {
		requireNonNull(draft);

		ErrorCollector errorCollector = new ErrorCollector();

		String email = null;

		if (trimAggressivelyToNull(draft.email()) == null)
			errorCollector.addFieldError(ProfileField.EMAIL.getFieldName(), FIELD_REQUIRED, "Email address is required.");
		else
			email = collect(ProfileField.EMAIL, validateEmailAddress(draft.email()), errorCollector);

		String nickname = null;

		try {
			ResolvedNickname resolvedNickname = getNicknameResolver().resolveNickname(draft.nickname());

			// Generated nicknames are trusted to conform
			nickname = resolvedNickname.generated()
					? resolvedNickname.nickname()
					: collect(ProfileField.NICKNAME, validateNickname(resolvedNickname.nickname()), errorCollector);
		} catch (NicknameGenerationException e) {
			getLogger().warn("Unable to generate a nickname", e);
			errorCollector.addFieldError(ProfileField.NICKNAME.getFieldName(), COLLABORATOR,
					"A nickname could not be generated. Please choose one.");
		}

		String firstName = collect(ProfileField.FIRST_NAME, validateFreeText(draft.firstName()), errorCollector);
		String lastName = collect(ProfileField.LAST_NAME, validateFreeText(draft.lastName()), errorCollector);
		String bio = collect(ProfileField.BIO, validateFreeText(draft.bio()), errorCollector);
		String profilePictureUrl = collect(ProfileField.PROFILE_PICTURE_URL, validateGenericUrl(draft.profilePictureUrl()), errorCollector);
		String linkedinProfileUrl = collect(ProfileField.LINKEDIN_PROFILE_URL, validateLinkedinUrl(draft.linkedinProfileUrl()), errorCollector);
		String githubProfileUrl = collect(ProfileField.GITHUB_PROFILE_URL, validateGithubUrl(draft.githubProfileUrl()), errorCollector);

		UserRole role = null;

		if (trimAggressivelyToNull(draft.role()) == null)
			errorCollector.addFieldError(ProfileField.ROLE.getFieldName(), FIELD_REQUIRED, "Role is required.");
		else
			role = collect(ProfileField.ROLE, validateRole(draft.role()), errorCollector);

		String password = null;

		if (draft.password() == null || draft.password().isEmpty())
			errorCollector.addFieldError(ProfileField.PASSWORD.getFieldName(), FIELD_REQUIRED, "Password is required.");
		else
			password = collect(ProfileField.PASSWORD, validatePassword(draft.password()), errorCollector);

		if (errorCollector.hasErrors())
			return RecordResult.invalid(errorCollector.getErrors());

		return RecordResult.valid(new UserProfileRecord(email, nickname, firstName, lastName, bio, profilePictureUrl,
				linkedinProfileUrl, githubProfileUrl, role, password));
	}

	/**
	 * Validates a draft for a partial update. Every field is optional, but at least one must be present;
	 * an empty draft is rejected before any field is examined. Absent fields stay absent.
	 */
	@NonNull
	public RecordResult<UserProfileUpdate> validateForUpdate(@NonNull UserProfileDraft draft) {
		requireNonNull(draft);

		ErrorCollector errorCollector = new ErrorCollector();

		if (draft.presentFields(ProfileField.getUpdatableFields()).isEmpty()) {
			errorCollector.addGeneralError(RECORD_EMPTY, "At least one field must be provided for update.");
			return RecordResult.invalid(errorCollector.getErrors());
		}

		if (draft.password() != null)
			getLogger().debug("Ignoring password supplied with a profile update");

		String email = collect(ProfileField.EMAIL, validateEmailAddress(draft.email()), errorCollector);
		String nickname = collect(ProfileField.NICKNAME, validateNickname(draft.nickname()), errorCollector);
		String firstName = collect(ProfileField.FIRST_NAME, validateFreeText(draft.firstName()), errorCollector);
		String lastName = collect(ProfileField.LAST_NAME, validateFreeText(draft.lastName()), errorCollector);
		String bio = collect(ProfileField.BIO, validateFreeText(draft.bio()), errorCollector);
		String profilePictureUrl = collect(ProfileField.PROFILE_PICTURE_URL, validateGenericUrl(draft.profilePictureUrl()), errorCollector);
		String linkedinProfileUrl = collect(ProfileField.LINKEDIN_PROFILE_URL, validateLinkedinUrl(draft.linkedinProfileUrl()), errorCollector);
		String githubProfileUrl = collect(ProfileField.GITHUB_PROFILE_URL, validateGithubUrl(draft.githubProfileUrl()), errorCollector);
		UserRole role = collect(ProfileField.ROLE, validateRole(draft.role()), errorCollector);

		if (errorCollector.hasErrors())
			return RecordResult.invalid(errorCollector.getErrors());

		return RecordResult.valid(new UserProfileUpdate(email, nickname, firstName, lastName, bio, profilePictureUrl,
				linkedinProfileUrl, githubProfileUrl, role));
	}

	// Records a failure against the field and yields null, or yields the validated value
	@Nullable
	private <T> T collect(@NonNull ProfileField field,
												@NonNull FieldResult<T> fieldResult,
												@NonNull ErrorCollector errorCollector) {
		requireNonNull(field);
		requireNonNull(fieldResult);
		requireNonNull(errorCollector);

		if (fieldResult instanceof FieldResult.Invalid<T> invalid) {
			errorCollector.addFieldError(field.getFieldName(), invalid.type(), invalid.message());
			return null;
		}

		return ((FieldResult.Valid<T>) fieldResult).value();
	}

	@NonNull
	private NicknameResolver getNicknameResolver() {
		return this.nicknameResolver;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
