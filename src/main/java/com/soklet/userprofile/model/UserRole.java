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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

import static com.soklet.userprofile.util.Normalizer.trimAggressivelyToNull;

/**
 * Closed set of roles a user profile can hold.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum UserRole {
	ANONYMOUS,
	AUTHENTICATED,
	MODERATOR,
	ADMIN;

	/**
	 * Matches {@code role} against member names, ignoring case and surrounding whitespace.
	 */
	@NonNull
	public static Optional<UserRole> fromName(@Nullable String role) {
		role = trimAggressivelyToNull(role);

		if (role == null)
			return Optional.empty();

		String normalizedRole = role.toUpperCase(Locale.ROOT);

		for (UserRole userRole : values())
			if (userRole.name().equals(normalizedRole))
				return Optional.of(userRole);

		return Optional.empty();
	}
}
