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

import com.soklet.userprofile.exception.ValidationErrorType;
import com.soklet.userprofile.model.UserRole;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class FieldValidatorsTests {
	@Test
	public void testValidPasswordsAreAcceptedUnchanged() {
		for (String password : List.of("Passw0rd", "Sup3rSecret", "  Spaced0ut  ", "\u00c4bcdefG1")) {
			FieldResult<String> result = FieldValidators.validatePassword(password);
			Assertions.assertTrue(result.isValid(), "Password should be valid: " + password);
			Assertions.assertEquals(password, ((FieldResult.Valid<String>) result).value(), "Password should not be altered");
		}
	}

	@Test
	public void testPasswordReportsFirstViolatedRule() {
		// Short and missing everything else: length wins
		assertPasswordError("abc", "Password must be at least 8 characters.");
		// Long enough, but no uppercase/digit: uppercase wins
		assertPasswordError("password", "Password must contain at least one uppercase letter.");
		// No lowercase or digit: lowercase wins
		assertPasswordError("PASSWORD", "Password must contain at least one lowercase letter.");
		assertPasswordError("Password", "Password must contain at least one digit.");
		assertPasswordError("", "Password must be at least 8 characters.");
	}

	@Test
	public void testGenericUrl() {
		for (String url : List.of("http://example.com", "https://example.com/some/path?q=1", "https://a.b"))
			Assertions.assertTrue(FieldValidators.validateGenericUrl(url).isValid(), "URL should be valid: " + url);

		for (String url : List.of("example.com", "ftp://example.com", "https://", "https:// example.com", "https://exa mple.com")) {
			FieldResult<String> result = FieldValidators.validateGenericUrl(url);
			Assertions.assertFalse(result.isValid(), "URL should be invalid: " + url);
			Assertions.assertEquals("Invalid URL format.", result.getErrorMessage().get(), "Wrong message");
		}
	}

	@Test
	public void testGithubUrl() {
		Assertions.assertTrue(FieldValidators.validateGithubUrl("https://github.com/alice").isValid(), "Plain profile URL");
		Assertions.assertTrue(FieldValidators.validateGithubUrl("http://github.com/alice/").isValid(), "Trailing slash over http");
		Assertions.assertTrue(FieldValidators.validateGithubUrl("https://www.github.com/alice-bob_99").isValid(), "www prefix");

		FieldResult<String> result = FieldValidators.validateGithubUrl("https://github.com/alice/repo");
		Assertions.assertFalse(result.isValid(), "Extra path segment should be rejected");
		Assertions.assertEquals("Invalid GitHub profile URL. The correct format is: https://github.com/<username>.",
				result.getErrorMessage().get(), "Wrong message");

		Assertions.assertFalse(FieldValidators.validateGithubUrl("https://gitlab.com/alice").isValid(), "Wrong host");
	}

	@Test
	public void testLinkedinUrl() {
		Assertions.assertTrue(FieldValidators.validateLinkedinUrl("https://www.linkedin.com/in/john-doe").isValid(), "Plain profile URL");
		Assertions.assertTrue(FieldValidators.validateLinkedinUrl("http://linkedin.com/in/john-doe/").isValid(), "No www, trailing slash");

		FieldResult<String> result = FieldValidators.validateLinkedinUrl("https://linkedin.com/john-doe");
		Assertions.assertFalse(result.isValid(), "Missing /in/ should be rejected");
		Assertions.assertEquals("Invalid LinkedIn profile URL. The correct format is: https://www.linkedin.com/in/<username>.",
				result.getErrorMessage().get(), "Wrong message");
	}

	@Test
	public void testUrlsAreNotTrimmedBeforeMatching() {
		for (String url : List.of(" https://github.com/alice", "https://github.com/alice\n", "\u200Bhttps://github.com/alice",
				"https://github.com/\nalice"))
			Assertions.assertFalse(FieldValidators.validateGithubUrl(url).isValid(), "GitHub URL should be invalid: " + url);

		for (String url : List.of("  https://example.com/a.png\t", "https://example.com/a\nb"))
			Assertions.assertFalse(FieldValidators.validateGenericUrl(url).isValid(), "URL should be invalid: " + url);

		Assertions.assertFalse(FieldValidators.validateLinkedinUrl("https://www.linkedin.com/in/john-doe ").isValid(),
				"Trailing space should be rejected");
		Assertions.assertEquals(FieldResult.valid("https://example.com/a.png"), FieldValidators.validateGenericUrl("https://example.com/a.png"),
				"Well-formed URL is returned as given");
	}

	@Test
	public void testAbsentValuesAreValid() {
		for (String absent : new String[]{null, "", "   ", "\u200B"}) {
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateGenericUrl(absent), "URL");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateGithubUrl(absent), "GitHub URL");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateLinkedinUrl(absent), "LinkedIn URL");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateNickname(absent), "Nickname");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateEmailAddress(absent), "Email");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateRole(absent), "Role");
			Assertions.assertEquals(FieldResult.valid(null), FieldValidators.validateFreeText(absent), "Free text");
		}
	}

	@Test
	public void testNickname() {
		Assertions.assertEquals(FieldResult.valid("mark_allen-1"), FieldValidators.validateNickname(" mark_allen-1 "), "Trimmed nickname");
		Assertions.assertTrue(FieldValidators.validateNickname("Jos\u00e9").isValid(), "Letters in any script are allowed");

		Assertions.assertEquals("Nickname must be at least 3 characters.",
				FieldValidators.validateNickname("ab").getErrorMessage().get(), "Too short");
		Assertions.assertEquals("Nickname may only contain letters, numbers, underscores and hyphens.",
				FieldValidators.validateNickname("mark allen").getErrorMessage().get(), "Embedded space");
		Assertions.assertEquals("Nickname may only contain letters, numbers, underscores and hyphens.",
				FieldValidators.validateNickname("mark!").getErrorMessage().get(), "Punctuation");
	}

	@Test
	public void testEmailAddressIsNormalized() {
		Assertions.assertEquals(FieldResult.valid("alice@example.com"),
				FieldValidators.validateEmailAddress("  Alice@Example.COM "), "Email should be trimmed and lowercased");

		for (String email : List.of("alice", "alice@", "@example.com", "alice@example", "alice@@example.com")) {
			FieldResult<String> result = FieldValidators.validateEmailAddress(email);
			Assertions.assertFalse(result.isValid(), "Email should be invalid: " + email);
			Assertions.assertEquals("Email address is invalid.", result.getErrorMessage().get(), "Wrong message");
		}
	}

	@Test
	public void testRole() {
		Assertions.assertEquals(FieldResult.valid(UserRole.ADMIN), FieldValidators.validateRole("admin"), "Lowercase role");
		Assertions.assertEquals(FieldResult.valid(UserRole.MODERATOR), FieldValidators.validateRole(" Moderator "), "Mixed case role");

		FieldResult<UserRole> result = FieldValidators.validateRole("superuser");
		Assertions.assertEquals(FieldResult.invalid(ValidationErrorType.UNRECOGNIZED_ROLE, "Role 'superuser' is not recognized."),
				result, "Unknown role");
	}

	private void assertPasswordError(String password, String expectedMessage) {
		FieldResult<String> result = FieldValidators.validatePassword(password);
		Assertions.assertFalse(result.isValid(), "Password should be invalid: " + password);
		Assertions.assertEquals(expectedMessage, result.getErrorMessage().get(), "Wrong violated rule for " + password);
	}
}
