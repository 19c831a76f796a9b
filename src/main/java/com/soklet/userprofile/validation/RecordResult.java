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
import org.jspecify.annotations.NonNull;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of validating a whole draft: either the normalized record, or every error found along the way.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface RecordResult<T> permits RecordResult.Valid, RecordResult.Invalid {
	@NonNull
	static <T> RecordResult<T> valid(@NonNull T record) {
		return new Valid<>(record);
	}

	@NonNull
	static <T> RecordResult<T> invalid(@NonNull List<@NonNull ValidationError> errors) {
		return new Invalid<>(errors);
	}

	@NonNull
	default Boolean isValid() {
		return this instanceof Valid;
	}

	/**
	 * The normalized record.
	 *
	 * @throws ProfileValidationException carrying every error, if validation failed
	 */
	@NonNull
	default T orElseThrow() {
		if (this instanceof Invalid<T> invalid)
			throw ProfileValidationException.withErrors(invalid.errors());

		return ((Valid<T>) this).record();
	}

	record Valid<T>(@NonNull T record) implements RecordResult<T> {
		public Valid {
			requireNonNull(record);
		}
	}

	record Invalid<T>(@NonNull List<@NonNull ValidationError> errors) implements RecordResult<T> {
		public Invalid {
			requireNonNull(errors);

			if (errors.isEmpty())
				throw new IllegalArgumentException("An invalid result requires at least one error");

			errors = List.copyOf(errors);
		}
	}
}
