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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class PasswordManagerTests {
	@Test
	public void testHashAndVerify() {
		PasswordManager passwordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA256")
				.iterations(1_000)
				.saltLength(16)
				.keyLength(256)
				.build();

		String hash = passwordManager.hashPassword("Passw0rd");

		Assertions.assertTrue(hash.startsWith("PBKDF2WithHmacSHA256:1000:256:"), "Unexpected hash format: " + hash);
		Assertions.assertTrue(passwordManager.verifyPassword("Passw0rd", hash), "Correct password should verify");
		Assertions.assertFalse(passwordManager.verifyPassword("passw0rd", hash), "Wrong password should not verify");
		Assertions.assertNotEquals(hash, passwordManager.hashPassword("Passw0rd"), "Salts should differ between hashes");
		Assertions.assertFalse(passwordManager.needsRehash(hash), "Hash matches current settings");

		PasswordManager strongerPasswordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA256")
				.iterations(2_000)
				.saltLength(16)
				.keyLength(256)
				.build();

		Assertions.assertTrue(strongerPasswordManager.needsRehash(hash), "More iterations should require a rehash");
		Assertions.assertTrue(strongerPasswordManager.verifyPassword("Passw0rd", hash), "Old hashes should still verify");
	}

	@Test
	public void testRejectsBadInput() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> PasswordManager.withHashAlgorithm("NoSuchAlgorithm").build());

		PasswordManager passwordManager = PasswordManager.withHashAlgorithm("PBKDF2WithHmacSHA512").iterations(1_000).build();

		Assertions.assertThrows(IllegalArgumentException.class, () -> passwordManager.verifyPassword("x", "not-a-hash"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> passwordManager.verifyPassword("x", "a:b:c:d:e"));
	}
}
