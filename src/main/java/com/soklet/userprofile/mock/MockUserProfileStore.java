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

package com.soklet.userprofile.mock;

import com.soklet.userprofile.model.db.UserProfile;
import com.soklet.userprofile.util.UserProfileStore;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link UserProfileStore} which keeps profiles in memory for the life of the process.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockUserProfileStore implements UserProfileStore {
	@NonNull
	private static final Comparator<UserProfile> OLDEST_FIRST;

	static {
		// Break creation-time ties by ID so paging is stable
		OLDEST_FIRST = Comparator.comparing(UserProfile::createdAt).thenComparing(UserProfile::userProfileId);
	}

	@NonNull
	private final ConcurrentHashMap<@NonNull UUID, @NonNull UserProfile> userProfilesById;
	@NonNull
	private final Logger logger;

	public MockUserProfileStore() {
		this.userProfilesById = new ConcurrentHashMap<>();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Override
	public void insertUserProfile(@NonNull UserProfile userProfile) {
		requireNonNull(userProfile);

		UserProfile existingUserProfile = getUserProfilesById().putIfAbsent(userProfile.userProfileId(), userProfile);

		if (existingUserProfile != null)
			throw new IllegalStateException(format("User profile ID %s already exists", userProfile.userProfileId()));

		getLogger().debug("Stored user profile ID {}", userProfile.userProfileId());
	}

	@NonNull
	@Override
	public Boolean updateUserProfile(@NonNull UserProfile userProfile) {
		requireNonNull(userProfile);
		return getUserProfilesById().replace(userProfile.userProfileId(), userProfile) != null;
	}

	@NonNull
	@Override
	public Optional<UserProfile> findUserProfileById(@Nullable UUID userProfileId) {
		if (userProfileId == null)
			return Optional.empty();

		return Optional.ofNullable(getUserProfilesById().get(userProfileId));
	}

	@NonNull
	@Override
	public List<@NonNull UserProfile> findUserProfiles(@NonNull Integer offset,
																										 @NonNull Integer limit) {
		requireNonNull(offset);
		requireNonNull(limit);

		return getUserProfilesById().values().stream()
				.sorted(OLDEST_FIRST)
				.skip(offset)
				.limit(limit)
				.toList();
	}

	@NonNull
	@Override
	public Long countUserProfiles() {
		return getUserProfilesById().mappingCount();
	}

	@NonNull
	private ConcurrentHashMap<@NonNull UUID, @NonNull UserProfile> getUserProfilesById() {
		return this.userProfilesById;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
