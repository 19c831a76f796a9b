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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Carries every validation failure from a single attempt to the caller, so that all of them can be rendered at once.
 * <p>
 * Supports the following:
 * <ul>
 *   <li>Record-level ("general") errors</li>
 *   <li>Field-specific errors, keyed by field name</li>
 *   <li>The typed {@link ValidationError}s they were built from</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ProfileValidationException extends RuntimeException {
	@NonNull
	private final List<@NonNull ValidationError> errors;
	@NonNull
	private final List<@NonNull String> generalErrors;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

	@NonNull
	public static ProfileValidationException withErrors(@NonNull ErrorCollector errorCollector) {
		requireNonNull(errorCollector);
		return withErrors(errorCollector.getErrors());
	}

	@NonNull
	public static ProfileValidationException withErrors(@NonNull List<@NonNull ValidationError> errors) {
		requireNonNull(errors);

		if (errors.isEmpty())
			throw new IllegalArgumentException(format("A %s requires at least one error", ProfileValidationException.class.getSimpleName()));

		return new ProfileValidationException(errors);
	}

	private ProfileValidationException(@NonNull List<@NonNull ValidationError> errors) {
		super(createMessage(errors));

		List<String> generalErrors = new ArrayList<>();
		Map<String, List<String>> fieldErrors = new LinkedHashMap<>();

		for (ValidationError error : errors) {
			if (error.isRecordLevel())
				generalErrors.add(error.message());
			else
				fieldErrors.computeIfAbsent(error.field(), (ignored) -> new ArrayList<>(4)).add(error.message());
		}

		fieldErrors.replaceAll((field, messages) -> Collections.unmodifiableList(messages));

		this.errors = List.copyOf(errors);
		this.generalErrors = Collections.unmodifiableList(generalErrors);
		this.fieldErrors = Collections.unmodifiableMap(fieldErrors);
	}

	@NonNull
	private static String createMessage(@NonNull List<@NonNull ValidationError> errors) {
		requireNonNull(errors);

		// Create an exception message by combining fields
		List<String> messageComponents = new ArrayList<>(2);

		List<String> generalErrors = errors.stream()
				.filter(ValidationError::isRecordLevel)
				.map(ValidationError::message)
				.collect(Collectors.toList());

		if (generalErrors.size() > 0)
			messageComponents.add(format("General Errors: %s", generalErrors));

		List<String> fieldErrors = errors.stream()
				.filter(error -> !error.isRecordLevel())
				.map(error -> format("%s (%s): %s", error.field(), error.type().name(), error.message()))
				.collect(Collectors.toList());

		if (fieldErrors.size() > 0)
			messageComponents.add(format("Field Errors: %s", fieldErrors));

		return messageComponents.stream().collect(Collectors.joining(", "));
	}

	/**
	 * Accumulates failures across every field of a record before deciding whether the record is valid.
	 */
	@NotThreadSafe
	public static class ErrorCollector {
		@NonNull
		private final List<@NonNull ValidationError> errors;

		public ErrorCollector() {
			this.errors = new ArrayList<>();
		}

		public void addGeneralError(@NonNull ValidationErrorType type,
																@NonNull String generalError) {
			requireNonNull(type);
			requireNonNull(generalError);

			add(ValidationError.forRecord(type, generalError));
		}

		public void addFieldError(@NonNull String field,
															@NonNull ValidationErrorType type,
															@NonNull String error) {
			requireNonNull(field);
			requireNonNull(type);
			requireNonNull(error);

			add(ValidationError.forField(field, type, error));
		}

		private void add(@NonNull ValidationError error) {
			requireNonNull(error);

			if (!this.errors.contains(error))
				this.errors.add(error);
		}

		@NonNull
		public Boolean hasErrors() {
			return this.errors.size() > 0;
		}

		@NonNull
		public List<@NonNull ValidationError> getErrors() {
			return List.copyOf(this.errors);
		}
	}

	@NonNull
	public List<@NonNull ValidationError> getErrors() {
		return this.errors;
	}

	@NonNull
	public List<@NonNull String> getGeneralErrors() {
		return this.generalErrors;
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getFieldErrors() {
		return this.fieldErrors;
	}
}
