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

package com.soklet.userprofile.model;

import com.soklet.userprofile.model.api.request.UserProfileDraft;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A user profile whose every present field has passed validation and been normalized.
 * <p>
 * {@code password} is the validated plaintext, present only between validation and hashing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UserProfileRecord(
		@NonNull String email,
		@NonNull String nickname,
		@Nullable String firstName,
		@Nullable String lastName,
		@Nullable String bio,
		@Nullable String profilePictureUrl,
		@Nullable String linkedinProfileUrl,
		@Nullable String githubProfileUrl,
		@NonNull UserRole role,
		@Nullable String password
) {
	public UserProfileRecord {
		requireNonNull(email);
		requireNonNull(nickname);
		requireNonNull(role);
	}

	/**
	 * Turns this record back into raw input, e.g. to re-run validation against it.
	 */
	@NonNull
	public UserProfileDraft toDraft() {
		return new UserProfileDraft(email(), nickname(), firstName(), lastName(), bio(), profilePictureUrl(),
				linkedinProfileUrl(), githubProfileUrl(), role().name(), password());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{email=%s, nickname=%s, role=%s}", getClass().getSimpleName(), email(), nickname(), role().name());
	}
}
