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

import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The declared fields of a user profile draft, keyed by the name clients see in error output.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum ProfileField {
	EMAIL("email"),
	NICKNAME("nickname"),
	FIRST_NAME("first_name"),
	LAST_NAME("last_name"),
	BIO("bio"),
	PROFILE_PICTURE_URL("profile_picture_url"),
	LINKEDIN_PROFILE_URL("linkedin_profile_url"),
	GITHUB_PROFILE_URL("github_profile_url"),
	ROLE("role"),
	PASSWORD("password");

	@NonNull
	private static final Set<@NonNull ProfileField> UPDATABLE_FIELDS;

	static {
		// Passwords are write-once through account creation
		UPDATABLE_FIELDS = Set.copyOf(EnumSet.complementOf(EnumSet.of(PASSWORD)));
	}

	@NonNull
	private final String fieldName;

	ProfileField(@NonNull String fieldName) {
		requireNonNull(fieldName);
		this.fieldName = fieldName;
	}

	@NonNull
	public static Set<@NonNull ProfileField> getUpdatableFields() {
		return UPDATABLE_FIELDS;
	}

	@NonNull
	public String getFieldName() {
		return this.fieldName;
	}
}
