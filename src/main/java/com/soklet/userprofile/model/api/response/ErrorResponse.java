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

package com.soklet.userprofile.model.api.response;

import com.google.gson.annotations.SerializedName;
import com.soklet.userprofile.exception.ProfileValidationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of a failure, e.g. an invalid create or update draft.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ErrorResponse {
	@NonNull
	private static final String DEFAULT_SUMMARY;

	static {
		DEFAULT_SUMMARY = "An unexpected error occurred.";
	}

	@NonNull
	@SerializedName("error")
	private final String summary;
	@Nullable
	private final String details;
	@NonNull
	private final List<@NonNull String> generalErrors;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

	@NonNull
	public static Builder withSummary(@NonNull String summary) {
		requireNonNull(summary);
		return new Builder(summary);
	}

	/**
	 * Combines every message in {@code exception} into a single summary, keeping the per-field breakdown alongside it.
	 */
	@NonNull
	public static ErrorResponse fromException(@NonNull ProfileValidationException exception) {
		requireNonNull(exception);

		Set<String> fieldErrorsSummary = new LinkedHashSet<>();

		for (List<String> fieldErrorValues : exception.getFieldErrors().values())
			fieldErrorsSummary.addAll(fieldErrorValues);

		String summary = format("%s %s",
				String.join(" ", exception.getGeneralErrors()),
				String.join(" ", fieldErrorsSummary)
		).trim();

		if (summary.length() == 0)
			summary = DEFAULT_SUMMARY;

		String details = exception.getFieldErrors().isEmpty() ? null
				: format("Invalid fields: %s", exception.getFieldErrors().keySet().stream().collect(Collectors.joining(", ")));

		return withSummary(summary)
				.details(details)
				.generalErrors(exception.getGeneralErrors())
				.fieldErrors(exception.getFieldErrors())
				.build();
	}

	private ErrorResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		this.summary = requireNonNull(builder.summary);
		this.details = builder.details;
		this.generalErrors = builder.generalErrors == null ? List.of() : List.copyOf(builder.generalErrors);
		this.fieldErrors = builder.fieldErrors == null ? Map.of() : copyFieldErrors(builder.fieldErrors);
	}

	// Keeps field order
	@NonNull
	private static Map<@NonNull String, @NonNull List<@NonNull String>> copyFieldErrors(
			@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors) {
		requireNonNull(fieldErrors);

		Map<String, List<String>> copiedFieldErrors = new LinkedHashMap<>(fieldErrors.size());

		for (Entry<String, List<String>> entry : fieldErrors.entrySet())
			copiedFieldErrors.put(entry.getKey(), List.copyOf(entry.getValue()));

		return Collections.unmodifiableMap(copiedFieldErrors);
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private String summary;
		@Nullable
		private String details;
		@Nullable
		private List<@NonNull String> generalErrors;
		@Nullable
		private Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

		private Builder(@NonNull String summary) {
			requireNonNull(summary);
			this.summary = summary;
		}

		@NonNull
		public Builder summary(@NonNull String summary) {
			requireNonNull(summary);
			this.summary = summary;
			return this;
		}

		@NonNull
		public Builder details(@Nullable String details) {
			this.details = details;
			return this;
		}

		@NonNull
		public Builder generalErrors(@Nullable List<@NonNull String> generalErrors) {
			this.generalErrors = generalErrors;
			return this;
		}

		@NonNull
		public Builder fieldErrors(@Nullable Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors) {
			this.fieldErrors = fieldErrors;
			return this;
		}

		@NonNull
		public ErrorResponse build() {
			return new ErrorResponse(this);
		}
	}

	@NonNull
	public String getSummary() {
		return this.summary;
	}

	@NonNull
	public Optional<String> getDetails() {
		return Optional.ofNullable(this.details);
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
