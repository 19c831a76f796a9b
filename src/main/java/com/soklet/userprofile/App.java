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

package com.soklet.userprofile;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.soklet.userprofile.exception.ProfileValidationException;
import com.soklet.userprofile.model.UserProfileUpdate;
import com.soklet.userprofile.model.api.request.UserProfileDraft;
import com.soklet.userprofile.model.api.response.ErrorResponse;
import com.soklet.userprofile.model.api.response.UserProfileResponse.UserProfileResponseHolder;
import com.soklet.userprofile.model.db.UserProfile;
import com.soklet.userprofile.service.UserProfileService;
import com.soklet.userprofile.util.SensitiveValueRedactor;
import com.soklet.userprofile.validation.UserProfileValidator;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire system in a single reusable type.
 * <p>
 * From the command line, validates a JSON profile draft and prints either the resulting profile or an error
 * envelope:
 * <pre>{@code
 * USERPROFILE_ENVIRONMENT=local java com.soklet.userprofile.App create draft.json
 * USERPROFILE_ENVIRONMENT=local java com.soklet.userprofile.App update draft.json
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	public static void main(String[] args) {
		String environment = System.getenv("USERPROFILE_ENVIRONMENT");

		if (environment == null)
			throw new IllegalArgumentException("You must specify the USERPROFILE_ENVIRONMENT environment variable");

		if (args.length != 2)
			throw new IllegalArgumentException("Usage: App (create|update) <draft JSON file>");

		App app = new App(new Configuration(environment));
		System.out.println(app.runCommand(args[0], Path.of(args[1])));
	}

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a failing nickname generator
		Module module = new AppModule(configuration);

		if (testingModules != null)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);
	}

	/**
	 * Runs {@code create} or {@code update} against the draft in {@code draftFile}.
	 *
	 * @return JSON for the created profile, the normalized update, or an {@link ErrorResponse} if validation failed
	 */
	@NonNull
	public String runCommand(@NonNull String command,
													 @NonNull Path draftFile) {
		requireNonNull(command);
		requireNonNull(draftFile);

		Gson gson = getInjector().getInstance(Gson.class);
		UserProfileDraft draft = readDraft(draftFile, gson);

		getLogger().debug("Running '{}' in {} environment for draft {}", command, getConfiguration().getEnvironment(),
				getInjector().getInstance(SensitiveValueRedactor.class).toRedactedJson(draft));

		try {
			switch (command) {
				case "create" -> {
					UserProfileService userProfileService = getInjector().getInstance(UserProfileService.class);
					UUID userProfileId = userProfileService.createUserProfile(draft);
					UserProfile userProfile = userProfileService.findUserProfileById(userProfileId).orElseThrow();
					return gson.toJson(new UserProfileResponseHolder(userProfileService.toResponse(userProfile)));
				}
				case "update" -> {
					UserProfileUpdate update = getInjector().getInstance(UserProfileValidator.class).validateForUpdate(draft).orElseThrow();
					return gson.toJson(update);
				}
				default -> throw new IllegalArgumentException(format("Unsupported command '%s'", command));
			}
		} catch (ProfileValidationException e) {
			getLogger().debug("Draft failed validation: {}", e.getMessage());
			return gson.toJson(ErrorResponse.fromException(e));
		}
	}

	@NonNull
	private UserProfileDraft readDraft(@NonNull Path draftFile,
																		 @NonNull Gson gson) {
		requireNonNull(draftFile);
		requireNonNull(gson);

		if (!Files.isRegularFile(draftFile))
			throw new IllegalArgumentException(format("Draft file not found at %s", draftFile.toAbsolutePath()));

		try {
			UserProfileDraft draft = gson.fromJson(Files.readString(draftFile, StandardCharsets.UTF_8), UserProfileDraft.class);
			return draft == null ? UserProfileDraft.empty() : draft;
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", draftFile.toAbsolutePath()), e);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException(format("Draft file at %s is not a valid JSON object", draftFile.toAbsolutePath()), e);
		}
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
