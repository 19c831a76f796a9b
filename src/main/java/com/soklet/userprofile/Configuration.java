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
import com.google.gson.GsonBuilder;
import com.soklet.userprofile.util.NicknameGenerator;
import com.soklet.userprofile.util.UserProfileStore;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates system-wide configuration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@NonNull
	private static final Gson GSON;

	static {
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	@NonNull
	private final String environment;
	private final NicknameGenerator.@NonNull Type nicknameGeneratorType;
	private final UserProfileStore.@NonNull Type userProfileStoreType;
	@NonNull
	private final String passwordHashAlgorithm;
	@NonNull
	private final Integer passwordHashIterations;
	@NonNull
	private final Integer passwordSaltLength;
	@NonNull
	private final Integer passwordKeyLength;
	@NonNull
	private final Integer defaultPageSize;
	@NonNull
	private final Integer maxPageSize;

	public Configuration(@NonNull String environment) {
		requireNonNull(environment);

		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.nicknameGeneratorType = configFile.nicknameGenerator().type();
		this.userProfileStoreType = configFile.userProfileStore().type();
		this.passwordHashAlgorithm = configFile.passwordHashing().algorithm();
		this.passwordHashIterations = configFile.passwordHashing().iterations();
		this.passwordSaltLength = configFile.passwordHashing().saltLength();
		this.passwordKeyLength = configFile.passwordHashing().keyLength();
		this.defaultPageSize = configFile.pagination().defaultPageSize();
		this.maxPageSize = configFile.pagination().maxPageSize();

		if (this.maxPageSize < 1)
			throw new IllegalArgumentException(format("Maximum page size must be positive, but was %d", this.maxPageSize));

		if (this.defaultPageSize < 1 || this.defaultPageSize > this.maxPageSize)
			throw new IllegalArgumentException(format("Default page size must be between 1 and %d, but was %d",
					this.maxPageSize, this.defaultPageSize));

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));
	}

	@NonNull
	private ConfigFile loadConfigFileForEnvironment(@NonNull String environment) {
		Path configFile = Path.of(format("config/%s/settings.json", environment));

		if (!Files.isRegularFile(configFile))
			throw new IllegalArgumentException(format("Config file not found at %s", configFile.toAbsolutePath()));

		try {
			return GSON.fromJson(Files.readString(configFile, StandardCharsets.UTF_8), ConfigFile.class);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configFile.toAbsolutePath()), e);
		}
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@NonNull ConfigNicknameGenerator nicknameGenerator,
			@NonNull ConfigUserProfileStore userProfileStore,
			@NonNull ConfigPasswordHashing passwordHashing,
			@NonNull ConfigPagination pagination
	) {
		public ConfigFile {
			requireNonNull(nicknameGenerator);
			requireNonNull(userProfileStore);
			requireNonNull(passwordHashing);
			requireNonNull(pagination);
		}

		private record ConfigNicknameGenerator(
				NicknameGenerator.@NonNull Type type
		) {
			public ConfigNicknameGenerator {
				requireNonNull(type);
			}
		}

		private record ConfigUserProfileStore(
				UserProfileStore.@NonNull Type type
		) {
			public ConfigUserProfileStore {
				requireNonNull(type);
			}
		}

		private record ConfigPasswordHashing(
				@NonNull String algorithm,
				@NonNull Integer iterations,
				@NonNull Integer saltLength,
				@NonNull Integer keyLength
		) {
			public ConfigPasswordHashing {
				requireNonNull(algorithm);
				requireNonNull(iterations);
				requireNonNull(saltLength);
				requireNonNull(keyLength);
			}
		}

		private record ConfigPagination(
				@NonNull Integer defaultPageSize,
				@NonNull Integer maxPageSize
		) {
			public ConfigPagination {
				requireNonNull(defaultPageSize);
				requireNonNull(maxPageSize);
			}
		}
	}

	@NonNull
	public String getEnvironment() {
		return this.environment;
	}

	public NicknameGenerator.@NonNull Type getNicknameGeneratorType() {
		return this.nicknameGeneratorType;
	}

	public UserProfileStore.@NonNull Type getUserProfileStoreType() {
		return this.userProfileStoreType;
	}

	@NonNull
	public String getPasswordHashAlgorithm() {
		return this.passwordHashAlgorithm;
	}

	@NonNull
	public Integer getPasswordHashIterations() {
		return this.passwordHashIterations;
	}

	@NonNull
	public Integer getPasswordSaltLength() {
		return this.passwordSaltLength;
	}

	@NonNull
	public Integer getPasswordKeyLength() {
		return this.passwordKeyLength;
	}

	@NonNull
	public Integer getDefaultPageSize() {
		return this.defaultPageSize;
	}

	@NonNull
	public Integer getMaxPageSize() {
		return this.maxPageSize;
	}
}
