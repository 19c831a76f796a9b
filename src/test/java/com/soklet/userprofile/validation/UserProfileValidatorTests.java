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

import com.soklet.userprofile.exception.ProfileValidationException;
import com.soklet.userprofile.exception.ValidationError;
import com.soklet.userprofile.exception.ValidationErrorType;
import com.soklet.userprofile.mock.MockNicknameGenerator;
import com.soklet.userprofile.model.UserProfileRecord;
import com.soklet.userprofile.model.UserProfileUpdate;
import com.soklet.userprofile.model.UserRole;
import com.soklet.userprofile.model.api.request.UserProfileDraft;
import com.soklet.userprofile.util.NicknameGenerator;
import com.soklet.userprofile.util.NicknameGenerator.NicknameGenerationException;
import com.soklet.userprofile.util.WordListNicknameGenerator;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UserProfileValidatorTests {
	@Test
	public void testCreateNormalizesEveryField() {
		UserProfileDraft draft = new UserProfileDraft(" Alice@Example.com ", " alice_w ", " Alice ", "Wonderland",
				"  Curious.  ", "https://example.com/alice.png", "https://www.linkedin.com/in/alice-w",
				"https://github.com/alice", " admin ", "Passw0rd!");

		UserProfileRecord record = createValidator(new MockNicknameGenerator()).validateForCreate(draft).orElseThrow();

		Assertions.assertEquals("alice@example.com", record.email(), "Email not normalized");
		Assertions.assertEquals("alice_w", record.nickname(), "Nickname not trimmed");
		Assertions.assertEquals("Alice", record.firstName(), "First name not trimmed");
		Assertions.assertEquals("Wonderland", record.lastName(), "Last name mismatch");
		Assertions.assertEquals("Curious.", record.bio(), "Bio not trimmed");
		Assertions.assertEquals("https://example.com/alice.png", record.profilePictureUrl(), "Picture URL mismatch");
		Assertions.assertEquals("https://www.linkedin.com/in/alice-w", record.linkedinProfileUrl(), "LinkedIn URL mismatch");
		Assertions.assertEquals("https://github.com/alice", record.githubProfileUrl(), "GitHub URL mismatch");
		Assertions.assertEquals(UserRole.ADMIN, record.role(), "Role not parsed");
		Assertions.assertEquals("Passw0rd!", record.password(), "Password should be carried unchanged");
	}

	@Test
	public void testCreateGeneratesNicknameWhenAbsent() {
		UserProfileValidator validator = createValidator(new WordListNicknameGenerator(new Random(42)));

		for (String absentNickname : new String[]{null, "", "  "}) {
			UserProfileRecord record = validator.validateForCreate(minimalDraft().withNickname(absentNickname)).orElseThrow();

			Assertions.assertFalse(record.nickname().isEmpty(), "Generated nickname is empty");
			Assertions.assertTrue(FieldValidators.validateNickname(record.nickname()).isValid(),
					"Generated nickname does not satisfy the nickname rules: " + record.nickname());
		}
	}

	@Test
	public void testCreateCallsGeneratorOnlyWhenNeeded() {
		AtomicInteger invocations = new AtomicInteger();
		UserProfileValidator validator = createValidator(() -> {
			invocations.incrementAndGet();
			return "generated_name";
		});

		validator.validateForCreate(minimalDraft().withNickname("chosen_name")).orElseThrow();
		Assertions.assertEquals(0, invocations.get(), "Generator should not be called when a nickname is given");

		UserProfileRecord record = validator.validateForCreate(minimalDraft()).orElseThrow();
		Assertions.assertEquals(1, invocations.get(), "Generator should be called exactly once");
		Assertions.assertEquals("generated_name", record.nickname(), "Generated nickname not used");
	}

	@Test
	public void testCreateAggregatesMissingRequiredFields() {
		UserProfileDraft draft = new UserProfileDraft(null, "alice_w", null, null, null, null, null, null, null, null);
		RecordResult<UserProfileRecord> result = createValidator(new MockNicknameGenerator()).validateForCreate(draft);

		Assertions.assertFalse(result.isValid(), "Draft should be rejected");

		List<ValidationError> errors = ((RecordResult.Invalid<UserProfileRecord>) result).errors();

		Assertions.assertEquals(List.of(
				ValidationError.forField("email", ValidationErrorType.FIELD_REQUIRED, "Email address is required."),
				ValidationError.forField("role", ValidationErrorType.FIELD_REQUIRED, "Role is required."),
				ValidationError.forField("password", ValidationErrorType.FIELD_REQUIRED, "Password is required.")
		), errors, "Missing fields should be reported together, in field order");
	}

	@Test
	public void testCreateAggregatesFormatErrors() {
		UserProfileDraft draft = new UserProfileDraft("not-an-email", "x", null, null, null, "notaurl",
				"https://linkedin.com/alice", "https://github.com/alice/repo", "superuser", "short");

		ProfileValidationException exception = Assertions.assertThrows(ProfileValidationException.class,
				() -> createValidator(new MockNicknameGenerator()).validateForCreate(draft).orElseThrow());

		Assertions.assertEquals(List.of("email", "nickname", "profile_picture_url", "linkedin_profile_url",
						"github_profile_url", "role", "password"),
				List.copyOf(exception.getFieldErrors().keySet()), "Every invalid field should be reported");
		Assertions.assertEquals(List.of("Role 'superuser' is not recognized."), exception.getFieldErrors().get("role"),
				"Wrong role error");
		Assertions.assertTrue(exception.getGeneralErrors().isEmpty(), "No general errors expected");
	}

	@Test
	public void testCreateReportsNicknameGenerationFailure() {
		NicknameGenerator failingGenerator = () -> {
			throw new NicknameGenerationException("Word list unavailable");
		};

		RecordResult<UserProfileRecord> result = createValidator(failingGenerator).validateForCreate(minimalDraft());

		Assertions.assertEquals(List.of(ValidationError.forField("nickname", ValidationErrorType.COLLABORATOR,
						"A nickname could not be generated. Please choose one.")),
				((RecordResult.Invalid<UserProfileRecord>) result).errors(), "Generation failure should become a nickname error");

		// Unchecked failures and blank nicknames are treated the same way
		NicknameGenerator explodingGenerator = () -> {
			throw new IllegalStateException("Boom");
		};

		Assertions.assertFalse(createValidator(explodingGenerator).validateForCreate(minimalDraft()).isValid(),
				"Unchecked generator failure should be a validation failure");
		Assertions.assertFalse(createValidator(() -> " ").validateForCreate(minimalDraft()).isValid(),
				"Blank generated nickname should be a validation failure");
	}

	@Test
	public void testCreateIsIdempotent() {
		UserProfileValidator validator = createValidator(new MockNicknameGenerator());
		UserProfileDraft draft = new UserProfileDraft("  Bob@Example.com", null, " Bob ", null, " Builder ", null, null,
				"http://github.com/bob/", "Moderator", "Passw0rd");

		UserProfileRecord record = validator.validateForCreate(draft).orElseThrow();
		UserProfileRecord revalidatedRecord = validator.validateForCreate(record.toDraft()).orElseThrow();

		Assertions.assertEquals(record, revalidatedRecord, "Re-validating normalized output should not change it");
	}

	@Test
	public void testUpdateRejectsEmptyDraft() {
		UserProfileValidator validator = createValidator(new MockNicknameGenerator());

		for (UserProfileDraft draft : List.of(UserProfileDraft.empty(),
				new UserProfileDraft(" ", "", null, null, null, null, null, null, null, null),
				// A password alone is not an update
				UserProfileDraft.empty().withPassword("Passw0rd"))) {
			RecordResult<UserProfileUpdate> result = validator.validateForUpdate(draft);

			Assertions.assertEquals(List.of(ValidationError.forRecord(ValidationErrorType.RECORD_EMPTY,
							"At least one field must be provided for update.")),
					((RecordResult.Invalid<UserProfileUpdate>) result).errors(), "Empty update should be rejected");
		}
	}

	@Test
	public void testUpdateValidatesOnlyPresentFields() {
		UserProfileValidator validator = createValidator(new MockNicknameGenerator());

		UserProfileUpdate update = validator.validateForUpdate(
				new UserProfileDraft(null, null, null, null, " New bio ", null, null, null, null, null)).orElseThrow();

		Assertions.assertEquals(new UserProfileUpdate(null, null, null, null, "New bio", null, null, null, null), update,
				"Only the bio should be carried");

		// Role-only updates are permitted
		update = validator.validateForUpdate(
				new UserProfileDraft(null, null, null, null, null, null, null, null, "authenticated", null)).orElseThrow();

		Assertions.assertEquals(UserRole.AUTHENTICATED, update.role(), "Role should be parsed");

		// Passwords are not updatable and are dropped
		update = validator.validateForUpdate(
				new UserProfileDraft(null, "new_nick", null, null, null, null, null, null, null, "x")).orElseThrow();

		Assertions.assertEquals(new UserProfileUpdate(null, "new_nick", null, null, null, null, null, null, null), update,
				"Password should not be validated or carried");
	}

	@Test
	public void testUpdateAggregatesErrors() {
		RecordResult<UserProfileUpdate> result = createValidator(new MockNicknameGenerator()).validateForUpdate(
				new UserProfileDraft("bad", "ok_nickname", null, null, null, null, null, "https://github.com/a/b", "root", null));

		List<ValidationError> errors = ((RecordResult.Invalid<UserProfileUpdate>) result).errors();

		Assertions.assertEquals(3, errors.size(), "Wrong number of errors");
		Assertions.assertEquals(ValidationErrorType.FIELD_FORMAT, errors.get(0).type(), "Email error type");
		Assertions.assertEquals("github_profile_url", errors.get(1).field(), "GitHub error field");
		Assertions.assertEquals(ValidationErrorType.UNRECOGNIZED_ROLE, errors.get(2).type(), "Role error type");
	}

	@NonNull
	private UserProfileValidator createValidator(@NonNull NicknameGenerator nicknameGenerator) {
		return new UserProfileValidator(new NicknameResolver(nicknameGenerator));
	}

	@NonNull
	private UserProfileDraft minimalDraft() {
		return new UserProfileDraft("carol@example.com", null, null, null, null, null, null, null, "AUTHENTICATED", "Passw0rd");
	}
}
