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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.soklet.userprofile.mock.MockNicknameGenerator;
import com.soklet.userprofile.mock.MockUserProfileStore;
import com.soklet.userprofile.util.NicknameGenerator;
import com.soklet.userprofile.util.PasswordManager;
import com.soklet.userprofile.util.UserProfileStore;
import com.soklet.userprofile.util.WordListNicknameGenerator;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@NonNull
	private final Configuration configuration;

	public AppModule(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public PasswordManager providePasswordManager(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		return PasswordManager.withHashAlgorithm(configuration.getPasswordHashAlgorithm())
				.iterations(configuration.getPasswordHashIterations())
				.saltLength(configuration.getPasswordSaltLength())
				.keyLength(configuration.getPasswordKeyLength())
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public NicknameGenerator provideNicknameGenerator(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		NicknameGenerator nicknameGenerator = null;

		switch (configuration.getNicknameGeneratorType()) {
			case MOCK -> nicknameGenerator = new MockNicknameGenerator();
			case REAL -> nicknameGenerator = new WordListNicknameGenerator();
		}

		return nicknameGenerator;
	}

	@NonNull
	@Provides
	@Singleton
	public UserProfileStore provideUserProfileStore(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		UserProfileStore userProfileStore = null;

		switch (configuration.getUserProfileStoreType()) {
			case MOCK -> userProfileStore = new MockUserProfileStore();
			case REAL ->
					throw new IllegalStateException(format("Need to create a real %s implementation", UserProfileStore.class.getSimpleName()));
		}

		return userProfileStore;
	}

	@NonNull
	@Provides
	@Singleton
	public Gson provideGson() {
		return new GsonBuilder()
				.setPrettyPrinting()
				.disableHtmlEscaping()
				// Our logical field names are snake_case, e.g. "profile_picture_url"
				.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
				.create();
	}
}
