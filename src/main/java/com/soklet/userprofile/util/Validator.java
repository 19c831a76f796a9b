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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Predicates for validating user-supplied input.
 * <p>
 * These answer yes/no only; {@link com.soklet.userprofile.validation.FieldValidators} turns them into
 * field-scoped results with messages.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Validator {
	private static final int EMAIL_ADDRESS_MAX_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH;
	private static final int EMAIL_ADDRESS_MAX_DOMAIN_LENGTH;
	private static final int NICKNAME_MIN_LENGTH;
	private static final int PASSWORD_MIN_LENGTH;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_LOCAL_PART_PATTERN;
	@NonNull
	private static final Pattern EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN;
	@NonNull
	private static final Pattern URL_PATTERN;
	@NonNull
	private static final Pattern GITHUB_PROFILE_URL_PATTERN;
	@NonNull
	private static final Pattern LINKEDIN_PROFILE_URL_PATTERN;
	@NonNull
	private static final Pattern NICKNAME_PATTERN;

	static {
		EMAIL_ADDRESS_MAX_LENGTH = 320;
		EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH = 64;
		EMAIL_ADDRESS_MAX_DOMAIN_LENGTH = 255;
		NICKNAME_MIN_LENGTH = 3;
		PASSWORD_MIN_LENGTH = 8;
		EMAIL_ADDRESS_LOCAL_PART_PATTERN = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*$");
		EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?$");
		URL_PATTERN = Pattern.compile("^https?://[^\\s/$.?#].[^\\s]*$");
		GITHUB_PROFILE_URL_PATTERN = Pattern.compile("^https?://(?:www\\.)?github\\.com/[A-Za-z0-9_-]+/?$");
		LINKEDIN_PROFILE_URL_PATTERN = Pattern.compile("^https?://(?:www\\.)?linkedin\\.com/in/[A-Za-z0-9_%-]+/?$");
		// Word characters in any script, plus hyphens
		NICKNAME_PATTERN = Pattern.compile("^[\\w-]+$", Pattern.UNICODE_CHARACTER_CLASS);
	}

	/**
	 * Password rules, in the order they are checked.
	 */
	public enum PasswordRule {
		MINIMUM_LENGTH,
		UPPERCASE_LETTER,
		LOWERCASE_LETTER,
		DIGIT
	}

	@NonNull
	public static Boolean isValidEmailAddress(@Nullable String emailAddress) {
		if (emailAddress == null)
			return false;

		String trimmed = Normalizer.trimAggressivelyToNull(emailAddress);

		if (trimmed == null || trimmed.length() > EMAIL_ADDRESS_MAX_LENGTH)
			return false;

		if (trimmed.chars().anyMatch(Character::isWhitespace))
			return false;

		int atIndex = trimmed.indexOf('@');

		if (atIndex <= 0 || atIndex != trimmed.lastIndexOf('@') || atIndex == trimmed.length() - 1)
			return false;

		String localPart = trimmed.substring(0, atIndex);
		String domain = trimmed.substring(atIndex + 1);

		if (localPart.length() > EMAIL_ADDRESS_MAX_LOCAL_PART_LENGTH || domain.length() > EMAIL_ADDRESS_MAX_DOMAIN_LENGTH)
			return false;

		if (!EMAIL_ADDRESS_LOCAL_PART_PATTERN.matcher(localPart).matches())
			return false;

		int lastDotIndex = domain.lastIndexOf('.');
		if (lastDotIndex <= 0 || lastDotIndex == domain.length() - 1)
			return false;

		String[] labels = domain.split("\\.");
		if (labels.length < 2)
			return false;

		for (String label : labels)
			if (!EMAIL_ADDRESS_DOMAIN_LABEL_PATTERN.matcher(label).matches())
				return false;

		if (labels[labels.length - 1].length() < 2)
			return false;

		return true;
	}

	@NonNull
	public static Boolean isValidUrl(@Nullable String url) {
		return url != null && URL_PATTERN.matcher(url).matches();
	}

	@NonNull
	public static Boolean isValidGithubProfileUrl(@Nullable String url) {
		return url != null && GITHUB_PROFILE_URL_PATTERN.matcher(url).matches();
	}

	@NonNull
	public static Boolean isValidLinkedinProfileUrl(@Nullable String url) {
		return url != null && LINKEDIN_PROFILE_URL_PATTERN.matcher(url).matches();
	}

	@NonNull
	public static Boolean isNicknameLongEnough(@Nullable String nickname) {
		return nickname != null && nickname.codePointCount(0, nickname.length()) >= NICKNAME_MIN_LENGTH;
	}

	@NonNull
	public static Boolean isNicknameWellFormed(@Nullable String nickname) {
		return nickname != null && NICKNAME_PATTERN.matcher(nickname).matches();
	}

	/**
	 * The first {@link PasswordRule} that {@code password} violates, or empty if it satisfies all of them.
	 */
	@NonNull
	public static Optional<PasswordRule> firstViolatedPasswordRule(@Nullable String password) {
		if (password == null || password.codePointCount(0, password.length()) < PASSWORD_MIN_LENGTH)
			return Optional.of(PasswordRule.MINIMUM_LENGTH);

		if (password.codePoints().noneMatch(Character::isUpperCase))
			return Optional.of(PasswordRule.UPPERCASE_LETTER);

		if (password.codePoints().noneMatch(Character::isLowerCase))
			return Optional.of(PasswordRule.LOWERCASE_LETTER);

		if (password.codePoints().noneMatch(Character::isDigit))
			return Optional.of(PasswordRule.DIGIT);

		return Optional.empty();
	}

	@NonNull
	public static Integer getNicknameMinLength() {
		return NICKNAME_MIN_LENGTH;
	}

	@NonNull
	public static Integer getPasswordMinLength() {
		return PASSWORD_MIN_LENGTH;
	}

	private Validator() {
		// Non-instantiable
	}
}
