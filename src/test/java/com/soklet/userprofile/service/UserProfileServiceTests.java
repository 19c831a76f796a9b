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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.soklet.userprofile.App;
import com.soklet.userprofile.Configuration;
import com.soklet.userprofile.exception.ProfileValidationException;
import com.soklet.userprofile.mock.MockNicknameGenerator;
import com.soklet.userprofile.model.UserRole;
import com.soklet.userprofile.model.api.request.UserProfileDraft;
import com.soklet.userprofile.model.api.response.ErrorResponse;
import com.soklet.userprofile.model.api.response.UserProfileListResponse;
import com.soklet.userprofile.model.api.response.UserProfileResponse;
import com.soklet.userprofile.model.db.UserProfile;
import com.soklet.userprofile.util.NicknameGenerator;
import com.soklet.userprofile.util.PasswordManager;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.UUID;

import static java.lang.String.format;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserProfileServiceTests {
	@Test
	public void testCreateUserProfile() {
		App app = createApp();
		UserProfileService userProfileService = app.getInjector().getInstance(UserProfileService.class);
		PasswordManager passwordManager = app.getInjector().getInstance(PasswordManager.class);

		UUID userProfileId = userProfileService.createUserProfile(new UserProfileDraft(" Frank@Example.com ", null, "Frank",
				null, null, null, null, null, "authenticated", "Passw0rd"));

		UserProfile userProfile = userProfileService.findUserProfileById(userProfileId).orElse(null);

		Assertions.assertNotNull(userProfile, "Profile was not stored");
		Assertions.assertEquals("frank@example.com", userProfile.email(), "Email not normalized");
		Assertions.assertEquals("mock_user_1", userProfile.nickname(), "Nickname should come from the mock generator");
		Assertions.assertEquals(UserRole.AUTHENTICATED, userProfile.role(), "Role mismatch");
		Assertions.assertFalse(userProfile.professional(), "New profiles are not professional");
		Assertions.assertNotEquals("Passw0rd", userProfile.passwordHash(), "Password stored in plaintext");
		Assertions.assertTrue(passwordManager.verifyPassword("Passw0rd", userProfile.passwordHash()), "Password hash does not verify");

		UserProfileResponse response = userProfileService.toResponse(userProfile);

		Assertions.assertEquals(userProfileId, response.getUserProfileId(), "Response ID mismatch");
		Assertions.assertEquals("Frank", response.getFirstName().orElse(null), "Response first name mismatch");
	}

	@Test
	public void testCreateUserProfileWithInvalidDraft() {
		App app = createApp();
		UserProfileService userProfileService = app.getInjector().getInstance(UserProfileService.class);

		ProfileValidationException exception = Assertions.assertThrows(ProfileValidationException.class,
				() -> userProfileService.createUserProfile(new UserProfileDraft(null, null, null, null, null, null, null,
						null, "ADMIN", "weak")));

		Assertions.assertEquals(List.of("email", "password"), List.copyOf(exception.getFieldErrors().keySet()), "Wrong invalid fields");
		Assertions.assertEquals(0L, userProfileService.findUserProfiles(null, null).total(), "Nothing should have been stored");

		ErrorResponse errorResponse = ErrorResponse.fromException(exception);

		Assertions.assertEquals("Email address is required. Password must be at least 8 characters.", errorResponse.getSummary(),
				"Summary mismatch");
	}

	@Test
	public void testUpdateUserProfile() {
		App app = createApp();
		UserProfileService userProfileService = app.getInjector().getInstance(UserProfileService.class);

		UUID userProfileId = userProfileService.createUserProfile(new UserProfileDraft("grace@example.com", "grace_h",
				"Grace", "Hopper", null, null, null, null, "ADMIN", "Passw0rd"));
		UserProfile original = userProfileService.findUserProfileById(userProfileId).orElseThrow();

		Boolean updated = userProfileService.updateUserProfile(userProfileId,
				new UserProfileDraft(null, null, null, null, " Rear admiral ", null, null, "https://github.com/grace", null, "Ignored1"));

		Assertions.assertTrue(updated, "Profile should have been updated");

		UserProfile userProfile = userProfileService.findUserProfileById(userProfileId).orElseThrow();

		Assertions.assertEquals("Rear admiral", userProfile.bio(), "Bio not updated");
		Assertions.assertEquals("https://github.com/grace", userProfile.githubProfileUrl(), "GitHub URL not updated");
		Assertions.assertEquals("grace_h", userProfile.nickname(), "Absent fields must be left alone");
		Assertions.assertEquals("Hopper", userProfile.lastName(), "Absent fields must be left alone");
		Assertions.assertEquals(original.passwordHash(), userProfile.passwordHash(), "Password must not change via update");
		Assertions.assertEquals(original.createdAt(), userProfile.createdAt(), "Creation time must not change");

		Assertions.assertFalse(userProfileService.updateUserProfile(UUID.randomUUID(),
				new UserProfileDraft(null, null, null, null, "bio", null, null, null, null, null)), "Unknown profile");

		ProfileValidationException exception = Assertions.assertThrows(ProfileValidationException.class,
				() -> userProfileService.updateUserProfile(userProfileId, UserProfileDraft.empty()));

		Assertions.assertEquals(List.of("At least one field must be provided for update."), exception.getGeneralErrors(),
				"Empty update should be rejected");
	}

	@Test
	public void testFindUserProfilesPaging() {
		App app = createApp();
		UserProfileService userProfileService = app.getInjector().getInstance(UserProfileService.class);

		for (int i = 1; i <= 5; ++i)
			userProfileService.createUserProfile(new UserProfileDraft(format("user%d@example.com", i), format("user_%d", i),
					null, null, null, null, null, null, "AUTHENTICATED", "Passw0rd"));

		UserProfileListResponse firstPage = userProfileService.findUserProfiles(1, 2);

		Assertions.assertEquals(5L, firstPage.total(), "Total mismatch");
		Assertions.assertEquals(1, firstPage.page(), "Page mismatch");
		Assertions.assertEquals(2, firstPage.size(), "Size mismatch");
		Assertions.assertEquals(2, firstPage.items().size(), "First page item count");

		UserProfileListResponse lastPage = userProfileService.findUserProfiles(3, 2);
		Assertions.assertEquals(1, lastPage.items().size(), "Last page item count");

		Assertions.assertTrue(userProfileService.findUserProfiles(4, 2).items().isEmpty(), "Past the end should be empty");

		UserProfileListResponse defaultPage = userProfileService.findUserProfiles(null, null);
		Assertions.assertEquals(10, defaultPage.size(), "Default page size should come from configuration");
		Assertions.assertEquals(5, defaultPage.items().size(), "Default page should hold everything");
	}

	@Test
	public void testFindUserProfilesRejectsBadPaging() {
		App app = createApp();
		UserProfileService userProfileService = app.getInjector().getInstance(UserProfileService.class);

		ProfileValidationException exception = Assertions.assertThrows(ProfileValidationException.class,
				() -> userProfileService.findUserProfiles(0, 101));

		Assertions.assertEquals(List.of("Page must be at least 1.", "Size must be between 1 and 100."), exception.getGeneralErrors(),
				"Both paging errors should be reported");

		Assertions.assertThrows(ProfileValidationException.class, () -> userProfileService.findUserProfiles(1, 0));
	}

	@NonNull
	private App createApp() {
		// Swap in the deterministic nickname generator; each App gets its own in-memory store
		return new App(new Configuration("local"), new AbstractModule() {
			@NonNull
			@Provides
			@Singleton
			public NicknameGenerator provideNicknameGenerator() {
				return new MockNicknameGenerator();
			}

			@Override
			protected void configure() {
				// Guice module configuration; nothing to do
			}
		});
	}
}
