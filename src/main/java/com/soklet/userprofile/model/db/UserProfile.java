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

package com.soklet.userprofile.model.db;

import com.soklet.userprofile.model.UserProfileRecord;
import com.soklet.userprofile.model.UserProfileUpdate;
import com.soklet.userprofile.model.UserRole;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A user profile as held by a {@link com.soklet.userprofile.util.UserProfileStore}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UserProfile(
		@NonNull UUID userProfileId,
		@NonNull String email,
		@NonNull String nickname,
		@Nullable String firstName,
		@Nullable String lastName,
		@Nullable String bio,
		@Nullable String profilePictureUrl,
		@Nullable String linkedinProfileUrl,
		@Nullable String githubProfileUrl,
		@NonNull UserRole role,
		@NonNull String passwordHash,
		@NonNull Boolean professional,
		@NonNull Instant createdAt,
		@NonNull Instant lastUpdatedAt
) {
	public UserProfile {
		requireNonNull(userProfileId);
		requireNonNull(email);
		requireNonNull(nickname);
		requireNonNull(role);
		requireNonNull(passwordHash);
		requireNonNull(professional);
		requireNonNull(createdAt);
		requireNonNull(lastUpdatedAt);
	}

	/**
	 * The validated fields of this profile, without any password.
	 */
	@NonNull
	public UserProfileRecord toRecord() {
		return new UserProfileRecord(email(), nickname(), firstName(), lastName(), bio(), profilePictureUrl(),
				linkedinProfileUrl(), githubProfileUrl(), role(), null);
	}

	/**
	 * A copy of this profile with every present field of {@code update} applied.
	 */
	@NonNull
	public UserProfile withUpdate(@NonNull UserProfileUpdate update,
																@NonNull Instant updatedAt) {
		requireNonNull(update);
		requireNonNull(updatedAt);

		return new UserProfile(
				userProfileId(),
				update.email() == null ? email() : update.email(),
				update.nickname() == null ? nickname() : update.nickname(),
				update.firstName() == null ? firstName() : update.firstName(),
				update.lastName() == null ? lastName() : update.lastName(),
				update.bio() == null ? bio() : update.bio(),
				update.profilePictureUrl() == null ? profilePictureUrl() : update.profilePictureUrl(),
				update.linkedinProfileUrl() == null ? linkedinProfileUrl() : update.linkedinProfileUrl(),
				update.githubProfileUrl() == null ? githubProfileUrl() : update.githubProfileUrl(),
				update.role() == null ? role() : update.role(),
				passwordHash(),
				professional(),
				createdAt(),
				updatedAt
		);
	}
}
