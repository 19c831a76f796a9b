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

package com.soklet.userprofile.util;

import com.soklet.userprofile.model.db.UserProfile;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract for persisting validated user profiles.
 * <p>
 * A mock implementor might hold profiles in memory, while a real implementor would talk to a database.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface UserProfileStore {
	void insertUserProfile(@NonNull UserProfile userProfile);

	/**
	 * Replaces the stored profile with the same ID.
	 *
	 * @return {@code true} if a profile with that ID existed
	 */
	@NonNull
	Boolean updateUserProfile(@NonNull UserProfile userProfile);

	@NonNull
	Optional<UserProfile> findUserProfileById(@Nullable UUID userProfileId);

	/**
	 * A slice of all profiles, oldest first.
	 */
	@NonNull
	List<@NonNull UserProfile> findUserProfiles(@NonNull Integer offset,
																							@NonNull Integer limit);

	@NonNull
	Long countUserProfiles();

	enum Type {
		MOCK,
		REAL
	}
}
