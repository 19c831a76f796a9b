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

package com.soklet.userprofile.util;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.util.List;
import java.util.Random;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Builds nicknames of the form {@code <adjective>_<animal>_<number>}, e.g. {@code clever_panda_417}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class WordListNicknameGenerator implements NicknameGenerator {
	@NonNull
	private static final List<@NonNull String> ADJECTIVES;
	@NonNull
	private static final List<@NonNull String> ANIMALS;
	private static final int MAXIMUM_SUFFIX;

	static {
		ADJECTIVES = List.of("clever", "jolly", "brave", "sly", "gentle", "swift", "quiet", "curious", "bold", "merry");
		ANIMALS = List.of("panda", "fox", "raccoon", "koala", "lion", "otter", "falcon", "badger", "heron", "lynx");
		MAXIMUM_SUFFIX = 999;
	}

	@NonNull
	private final Random random;

	public WordListNicknameGenerator() {
		this(new SecureRandom());
	}

	// Callers that supply their own Random are responsible for its thread-safety
	public WordListNicknameGenerator(@NonNull Random random) {
		requireNonNull(random);
		this.random = random;
	}

	@NonNull
	@Override
	public String generateNickname() {
		String adjective = ADJECTIVES.get(getRandom().nextInt(ADJECTIVES.size()));
		String animal = ANIMALS.get(getRandom().nextInt(ANIMALS.size()));
		int suffix = getRandom().nextInt(MAXIMUM_SUFFIX + 1);

		return format("%s_%s_%d", adjective, animal, suffix);
	}

	@NonNull
	private Random getRandom() {
		return this.random;
	}
}
