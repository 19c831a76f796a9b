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

package com.soklet.userprofile.service;

import com.google.inject.Inject;
import com.soklet.userprofile.Configuration;
import com.soklet.userprofile.exception.ProfileValidationException;
import com.soklet.userprofile.exception.ProfileValidationException.ErrorCollector;
import com.soklet.userprofile.model.UserProfileRecord;
import com.soklet.userprofile.model.UserProfileUpdate;
import com.soklet.userprofile.model.api.request.UserProfileDraft;
import com.soklet.userprofile.model.api.response.UserProfileListResponse;
import com.soklet.userprofile.model.api.response.UserProfileResponse;
import com.soklet.userprofile.model.db.UserProfile;
import com.soklet.userprofile.util.PasswordManager;
import com.soklet.userprofile.util.UserProfileStore;
import com.soklet.userprofile.validation.UserProfileValidator;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.soklet.userprofile.exception.ValidationErrorType.FIELD_FORMAT;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for user profiles.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserProfileService {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final UserProfileValidator userProfileValidator;
	@NonNull
	private final UserProfileStore userProfileStore;
	@NonNull
	private final PasswordManager passwordManager;
	@NonNull
	private final Logger logger;

	@Inject
	public UserProfileService(@NonNull Configuration configuration,
														@NonNull UserProfileValidator userProfileValidator,
														@NonNull UserProfileStore userProfileStore,
														@NonNull PasswordManager passwordManager) {
		requireNonNull(configuration);
		requireNonNull(userProfileValidator);
		requireNonNull(userProfileStore);
		requireNonNull(passwordManager);

		this.configuration = configuration;
		this.userProfileValidator = userProfileValidator;
		this.userProfileStore = userProfileStore;
		this.passwordManager = passwordManager;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public Optional<UserProfile> findUserProfileById(@Nullable UUID userProfileId) {
		return getUserProfileStore().findUserProfileById(userProfileId);
	}

	/**
	 * Validates the draft, hashes its password and stores the new profile.
	 *
	 * @return the new profile's identifier
	 * @throws ProfileValidationException if the draft is invalid
	 */
	@NonNull
	public UUID createUserProfile(@NonNull UserProfileDraft draft) {
		requireNonNull(draft);

		UserProfileRecord record = getUserProfileValidator().validateForCreate(draft).orElseThrow();

		UUID userProfileId = UUID.randomUUID();
		Instant now = Instant.now();
		String passwordHash = getPasswordManager().hashPassword(requireNonNull(record.password()));

		getUserProfileStore().insertUserProfile(new UserProfile(
				userProfileId,
				record.email(),
				record.nickname(),
				record.firstName(),
				record.lastName(),
				record.bio(),
				record.profilePictureUrl(),
				record.linkedinProfileUrl(),
				record.githubProfileUrl(),
				record.role(),
				passwordHash,
				false,
				now,
				now
		));

		getLogger().info("Created user profile ID {} with nickname '{}'", userProfileId, record.nickname());

		return userProfileId;
	}

	/**
	 * Validates the draft as a partial update and applies it to an existing profile.
	 * The draft is validated before the profile is looked up.
	 *
	 * @return {@code true} if the profile exists and was updated, {@code false} if there is no such profile
	 * @throws ProfileValidationException if the draft is invalid
	 */
	@NonNull
	public Boolean updateUserProfile(@NonNull UUID userProfileId,
																	 @NonNull UserProfileDraft draft) {
		requireNonNull(userProfileId);
		requireNonNull(draft);

		UserProfileUpdate update = getUserProfileValidator().validateForUpdate(draft).orElseThrow();
		UserProfile userProfile = findUserProfileById(userProfileId).orElse(null);

		if (userProfile == null) {
			getLogger().debug("No user profile ID {} to update", userProfileId);
			return false;
		}

		Boolean updated = getUserProfileStore().updateUserProfile(userProfile.withUpdate(update, Instant.now()));

		if (updated)
			getLogger().info("Updated user profile ID {}", userProfileId);

		return updated;
	}

	/**
	 * Pages through profiles, oldest first.
	 *
	 * @param page 1-based page number, defaults to 1
	 * @param size page size, defaults to the configured default page size
	 * @throws ProfileValidationException if the page or size is out of range
	 */
	@NonNull
	public UserProfileListResponse findUserProfiles(@Nullable Integer page,
																									@Nullable Integer size) {
		if (page == null)
			page = 1;

		if (size == null)
			size = getConfiguration().getDefaultPageSize();

		ErrorCollector errorCollector = new ErrorCollector();

		if (page < 1)
			errorCollector.addGeneralError(FIELD_FORMAT, "Page must be at least 1.");

		if (size < 1 || size > getConfiguration().getMaxPageSize())
			errorCollector.addGeneralError(FIELD_FORMAT, format("Size must be between 1 and %d.", getConfiguration().getMaxPageSize()));

		if (errorCollector.hasErrors())
			throw ProfileValidationException.withErrors(errorCollector);

		// Compute in long space so large page numbers cannot overflow
		long offset = (long) (page - 1) * size;
		Long total = getUserProfileStore().countUserProfiles();

		List<UserProfileResponse> items = offset >= total
				? List.of()
				: getUserProfileStore().findUserProfiles((int) offset, size).stream()
				.map(this::toResponse)
				.toList();

		return new UserProfileListResponse(items, total, page, size);
	}

	@NonNull
	public UserProfileResponse toResponse(@NonNull UserProfile userProfile) {
		requireNonNull(userProfile);
		return UserProfileResponse.fromUserProfile(userProfile);
	}

	@NonNull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	private UserProfileValidator getUserProfileValidator() {
		return this.userProfileValidator;
	}

	@NonNull
	private UserProfileStore getUserProfileStore() {
		return this.userProfileStore;
	}

	@NonNull
	private PasswordManager getPasswordManager() {
		return this.passwordManager;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
