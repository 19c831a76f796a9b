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

package com.soklet.userprofile.model.api.response;

import com.google.gson.annotations.SerializedName;
import com.soklet.userprofile.model.UserProfileRecord;
import com.soklet.userprofile.model.UserRole;
import com.soklet.userprofile.model.db.UserProfile;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of a user profile.
 * <p>
 * Has no password field, whatever the source of the projection.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserProfileResponse {
	@NonNull
	@SerializedName("id")
	private final UUID userProfileId;
	@NonNull
	private final String email;
	@NonNull
	private final String nickname;
	@Nullable
	private final String firstName;
	@Nullable
	private final String lastName;
	@Nullable
	private final String bio;
	@Nullable
	private final String profilePictureUrl;
	@Nullable
	private final String linkedinProfileUrl;
	@Nullable
	private final String githubProfileUrl;
	@NonNull
	private final UserRole role;
	@NonNull
	@SerializedName("is_professional")
	private final Boolean professional;

	/**
	 * Projects a validated record. {@code professional} is owned by the persistence layer and defaults to
	 * {@code false} when unknown.
	 */
	@NonNull
	public static UserProfileResponse fromRecord(@NonNull UUID userProfileId,
																							 @NonNull UserProfileRecord record,
																							 @Nullable Boolean professional) {
		requireNonNull(userProfileId);
		requireNonNull(record);

		return new UserProfileResponse(userProfileId, record, professional == null ? false : professional);
	}

	@NonNull
	public static UserProfileResponse fromUserProfile(@NonNull UserProfile userProfile) {
		requireNonNull(userProfile);
		return fromRecord(userProfile.userProfileId(), userProfile.toRecord(), userProfile.professional());
	}

	private UserProfileResponse(@NonNull UUID userProfileId,
															@NonNull UserProfileRecord record,
															@NonNull Boolean professional) {
		this.userProfileId = userProfileId;
		this.email = record.email();
		this.nickname = record.nickname();
		this.firstName = record.firstName();
		this.lastName = record.lastName();
		this.bio = record.bio();
		this.profilePictureUrl = record.profilePictureUrl();
		this.linkedinProfileUrl = record.linkedinProfileUrl();
		this.githubProfileUrl = record.githubProfileUrl();
		this.role = record.role();
		this.professional = professional;
	}

	public record UserProfileResponseHolder(
			@NonNull UserProfileResponse userProfile
	) {
		public UserProfileResponseHolder {
			requireNonNull(userProfile);
		}
	}

	@NonNull
	public UUID getUserProfileId() {
		return this.userProfileId;
	}

	@NonNull
	public String getEmail() {
		return this.email;
	}

	@NonNull
	public String getNickname() {
		return this.nickname;
	}

	@NonNull
	public Optional<String> getFirstName() {
		return Optional.ofNullable(this.firstName);
	}

	@NonNull
	public Optional<String> getLastName() {
		return Optional.ofNullable(this.lastName);
	}

	@NonNull
	public Optional<String> getBio() {
		return Optional.ofNullable(this.bio);
	}

	@NonNull
	public Optional<String> getProfilePictureUrl() {
		return Optional.ofNullable(this.profilePictureUrl);
	}

	@NonNull
	public Optional<String> getLinkedinProfileUrl() {
		return Optional.ofNullable(this.linkedinProfileUrl);
	}

	@NonNull
	public Optional<String> getGithubProfileUrl() {
		return Optional.ofNullable(this.githubProfileUrl);
	}

	@NonNull
	public UserRole getRole() {
		return this.role;
	}

	@NonNull
	public Boolean getProfessional() {
		return this.professional;
	}
}
