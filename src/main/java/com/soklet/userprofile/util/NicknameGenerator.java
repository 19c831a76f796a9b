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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Contract for producing a random, human-readable nickname for profiles created without one.
 * <p>
 * Implementations must return values that are at least 3 characters long and consist only of
 * word characters and hyphens.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface NicknameGenerator {
	@NonNull
	String generateNickname() throws NicknameGenerationException;

	enum Type {
		MOCK,
		REAL
	}

	@NotThreadSafe
	class NicknameGenerationException extends Exception {
		public NicknameGenerationException(@NonNull String message) {
			super(message);
		}

		public NicknameGenerationException(@NonNull String message,
																			 @Nullable Throwable cause) {
			super(message, cause);
		}
	}
}
