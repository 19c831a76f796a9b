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

import org.jspecify.annotations.Nullable;

/**
 * A validated, normalized partial update. Absent ({@code null}) fields are left untouched when applied.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record UserProfileUpdate(
		@Nullable String email,
		@Nullable String nickname,
		@Nullable String firstName,
		@Nullable String lastName,
		@Nullable String bio,
		@Nullable String profilePictureUrl,
		@Nullable String linkedinProfileUrl,
		@Nullable String githubProfileUrl,
		@Nullable UserRole role
) {}
