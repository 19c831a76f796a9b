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

import com.soklet.userprofile.model.UserRole;
import com.soklet.userprofile.util.Validator.PasswordRule;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;

import static com.soklet.userprofile.exception.ValidationErrorType.FIELD_FORMAT;
import static com.soklet.userprofile.exception.ValidationErrorType.UNRECOGNIZED_ROLE;
import static com.soklet.userprofile.util.Normalizer.normalizeEmailAddress;
import static com.soklet.userprofile.util.Normalizer.trimAggressivelyToNull;
import static com.soklet.userprofile.util.Validator.firstViolatedPasswordRule;
import static com.soklet.userprofile.util.Validator.getNicknameMinLength;
import static com.soklet.userprofile.util.Validator.getPasswordMinLength;
import static com.soklet.userprofile.util.Validator.isNicknameLongEnough;
import static com.soklet.userprofile.util.Validator.isNicknameWellFormed;
import static com.soklet.userprofile.util.Validator.isValidGithubProfileUrl;
import static com.soklet.userprofile.util.Validator.isValidLinkedinProfileUrl;
import static com.soklet.userprofile.util.Validator.isValidUrl;
import static java.lang.String.format;

/**
 * Independent, reusable validators for individual profile fields.
 * <p>
 * Validators for optional fields treat {@code null} (and blank input, which trims to {@code null}) as absent:
 * absence is always valid and skips the format check. URLs are matched as given, never trimmed first.
 * None of these methods throw for bad input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class FieldValidators {
	@NonNull
	public static FieldResult<String> validateGenericUrl(@Nullable String url) {
		if (trimAggressivelyToNull(url) == null)
			return FieldResult.valid(null);

		if (!isValidUrl(url))
			return FieldResult.invalid(FIELD_FORMAT, "Invalid URL format.");

		return FieldResult.valid(url);
	}

	@NonNull
	public static FieldResult<String> validateGithubUrl(@Nullable String url) {
		if (trimAggressivelyToNull(url) == null)
			return FieldResult.valid(null);

		if (!isValidGithubProfileUrl(url))
			return FieldResult.invalid(FIELD_FORMAT, "Invalid GitHub profile URL. The correct format is: https://github.com/<username>.");

		return FieldResult.valid(url);
	}

	@NonNull
	public static FieldResult<String> validateLinkedinUrl(@Nullable String url) {
		if (trimAggressivelyToNull(url) == null)
			return FieldResult.valid(null);

		if (!isValidLinkedinProfileUrl(url))
			return FieldResult.invalid(FIELD_FORMAT, "Invalid LinkedIn profile URL. The correct format is: https://www.linkedin.com/in/<username>.");

		return FieldResult.valid(url);
	}

	/**
	 * Reports only the first violated rule, checking length, then uppercase, then lowercase, then digit.
	 * Passwords are never trimmed.
	 */
	@NonNull
	public static FieldResult<String> validatePassword(@NonNull String password) {
		PasswordRule violatedRule = firstViolatedPasswordRule(password).orElse(null);

		if (violatedRule == null)
			return FieldResult.valid(password);

		String message;

		switch (violatedRule) {
			case MINIMUM_LENGTH -> message = format("Password must be at least %d characters.", getPasswordMinLength());
			case UPPERCASE_LETTER -> message = "Password must contain at least one uppercase letter.";
			case LOWERCASE_LETTER -> message = "Password must contain at least one lowercase letter.";
			case DIGIT -> message = "Password must contain at least one digit.";
			default -> throw new IllegalStateException(format("Unhandled %s %s", PasswordRule.class.getSimpleName(), violatedRule.name()));
		}

		return FieldResult.invalid(FIELD_FORMAT, message);
	}

	@NonNull
	public static FieldResult<String> validateNickname(@Nullable String nickname) {
		nickname = trimAggressivelyToNull(nickname);

		if (nickname == null)
			return FieldResult.valid(null);

		if (!isNicknameLongEnough(nickname))
			return FieldResult.invalid(FIELD_FORMAT, format("Nickname must be at least %d characters.", getNicknameMinLength()));

		if (!isNicknameWellFormed(nickname))
			return FieldResult.invalid(FIELD_FORMAT, "Nickname may only contain letters, numbers, underscores and hyphens.");

		return FieldResult.valid(nickname);
	}

	/**
	 * Valid addresses are normalized to lowercase.
	 */
	@NonNull
	public static FieldResult<String> validateEmailAddress(@Nullable String emailAddress) {
		emailAddress = trimAggressivelyToNull(emailAddress);

		if (emailAddress == null)
			return FieldResult.valid(null);

		String normalizedEmailAddress = normalizeEmailAddress(emailAddress).orElse(null);

		if (normalizedEmailAddress == null)
			return FieldResult.invalid(FIELD_FORMAT, "Email address is invalid.");

		return FieldResult.valid(normalizedEmailAddress);
	}

	@NonNull
	public static FieldResult<UserRole> validateRole(@Nullable String role) {
		role = trimAggressivelyToNull(role);

		if (role == null)
			return FieldResult.valid(null);

		UserRole userRole = UserRole.fromName(role).orElse(null);

		if (userRole == null)
			return FieldResult.invalid(UNRECOGNIZED_ROLE, format("Role '%s' is not recognized.", role));

		return FieldResult.valid(userRole);
	}

	// Names and bio have no format rules
	@NonNull
	public static FieldResult<String> validateFreeText(@Nullable String text) {
		return FieldResult.valid(trimAggressivelyToNull(text));
	}

	private FieldValidators() {
		// Non-instantiable
	}
}
