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

package com.soklet.userprofile.model.api.request;

import com.soklet.userprofile.annotation.SensitiveValue;
import com.soklet.userprofile.model.ProfileField;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.soklet.userprofile.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Raw, unvalidated input for creating or updating a user profile.
 * <p>
 * Every component is nullable; which ones are required depends on the operation.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UserProfileDraft(
		@Nullable String email,
		@Nullable String nickname,
		@Nullable String firstName,
		@Nullable String lastName,
		@Nullable String bio,
		@Nullable String profilePictureUrl,
		@Nullable String linkedinProfileUrl,
		@Nullable String githubProfileUrl,
		@Nullable String role,
		@SensitiveValue @Nullable String password
) {
	@NonNull
	public static UserProfileDraft empty() {
		return new UserProfileDraft(null, null, null, null, null, null, null, null, null, null);
	}

	/**
	 * Raw values keyed by field. Absent fields map to {@code null}.
	 */
	@NonNull
	public Map<@NonNull ProfileField, @Nullable String> fieldValues() {
		Map<ProfileField, String> fieldValues = new EnumMap<>(ProfileField.class);
		fieldValues.put(ProfileField.EMAIL, email());
		fieldValues.put(ProfileField.NICKNAME, nickname());
		fieldValues.put(ProfileField.FIRST_NAME, firstName());
		fieldValues.put(ProfileField.LAST_NAME, lastName());
		fieldValues.put(ProfileField.BIO, bio());
		fieldValues.put(ProfileField.PROFILE_PICTURE_URL, profilePictureUrl());
		fieldValues.put(ProfileField.LINKEDIN_PROFILE_URL, linkedinProfileUrl());
		fieldValues.put(ProfileField.GITHUB_PROFILE_URL, githubProfileUrl());
		fieldValues.put(ProfileField.ROLE, role());
		fieldValues.put(ProfileField.PASSWORD, password());
		return Collections.unmodifiableMap(fieldValues);
	}

	/**
	 * The subset of {@code candidateFields} that carry a non-blank value.
	 */
	@NonNull
	public Set<@NonNull ProfileField> presentFields(@NonNull Set<@NonNull ProfileField> candidateFields) {
		requireNonNull(candidateFields);

		Set<ProfileField> presentFields = EnumSet.noneOf(ProfileField.class);

		for (Map.Entry<ProfileField, String> entry : fieldValues().entrySet())
			if (candidateFields.contains(entry.getKey()) && trimAggressivelyToNull(entry.getValue()) != null)
				presentFields.add(entry.getKey());

		return Collections.unmodifiableSet(presentFields);
	}

	@NonNull
	public UserProfileDraft withNickname(@Nullable String nickname) {
		return new UserProfileDraft(email, nickname, firstName, lastName, bio, profilePictureUrl, linkedinProfileUrl,
				githubProfileUrl, role, password);
	}

	@NonNull
	public UserProfileDraft withPassword(@Nullable String password) {
		return new UserProfileDraft(email, nickname, firstName, lastName, bio, profilePictureUrl, linkedinProfileUrl,
				githubProfileUrl, role, password);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{email=%s, nickname=%s, role=%s, password=%s}", getClass().getSimpleName(),
				email(), nickname(), role(), password() == null ? null : "[REDACTED]");
	}
}
