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

package com.soklet.userprofile.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A single validation failure. Field-scoped errors name their field; record-level errors do not.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ValidationError(
		@Nullable String field,
		@NonNull ValidationErrorType type,
		@NonNull String message
) {
	public ValidationError {
		requireNonNull(type);
		requireNonNull(message);
	}

	@NonNull
	public static ValidationError forField(@NonNull String field,
																				 @NonNull ValidationErrorType type,
																				 @NonNull String message) {
		requireNonNull(field);
		return new ValidationError(field, type, message);
	}

	@NonNull
	public static ValidationError forRecord(@NonNull ValidationErrorType type,
																					@NonNull String message) {
		return new ValidationError(null, type, message);
	}

	@NonNull
	public Boolean isRecordLevel() {
		return field() == null;
	}
}
