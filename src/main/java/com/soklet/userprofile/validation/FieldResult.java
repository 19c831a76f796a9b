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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of validating a single field: either its (possibly normalized) value, or the reason it was rejected.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface FieldResult<T> permits FieldResult.Valid, FieldResult.Invalid {
	@NonNull
	static <T> FieldResult<T> valid(@Nullable T value) {
		return new Valid<>(value);
	}

	@NonNull
	static <T> FieldResult<T> invalid(@NonNull ValidationErrorType type,
																		@NonNull String message) {
		return new Invalid<>(type, message);
	}

	@NonNull
	default Boolean isValid() {
		return this instanceof Valid;
	}

	@NonNull
	default Optional<String> getErrorMessage() {
		return this instanceof Invalid<T> invalid ? Optional.of(invalid.message()) : Optional.empty();
	}

	/**
	 * A {@code null} value means the field was absent.
	 */
	record Valid<T>(@Nullable T value) implements FieldResult<T> {}

	record Invalid<T>(
			@NonNull ValidationErrorType type,
			@NonNull String message
	) implements FieldResult<T> {
		public Invalid {
			requireNonNull(type);
			requireNonNull(message);
		}
	}
}
