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
import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.Base64;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Hashes validated plaintext passwords before they are stored, and verifies plaintext against stored hashes.
 * <p>
 * Hashes are encoded as {@code <algorithm>:<iterations>:<key length>:<salt>:<hash>} so that verification
 * keeps working after the configured parameters change; {@link #needsRehash(String)} reports hashes produced
 * with outdated parameters.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class PasswordManager {
	@NonNull
	private static final Integer DEFAULT_ITERATIONS;
	@NonNull
	private static final Integer DEFAULT_SALT_LENGTH;
	@NonNull
	private static final Integer DEFAULT_KEY_LENGTH;

	static {
		DEFAULT_ITERATIONS = 210_000;
		DEFAULT_SALT_LENGTH = 64;
		DEFAULT_KEY_LENGTH = 512;
	}

	@NonNull
	private final String hashAlgorithm;
	@NonNull
	private final Integer iterations;
	@NonNull
	private final Integer saltLength;
	@NonNull
	private final Integer keyLength;
	@NonNull
	private final SecureRandom secureRandom;

	@NonNull
	public static Builder withHashAlgorithm(@NonNull String hashAlgorithm) {
		requireNonNull(hashAlgorithm);
		return new Builder(hashAlgorithm);
	}

	private PasswordManager(@NonNull Builder builder) {
		requireNonNull(builder);

		this.hashAlgorithm = requireNonNull(builder.hashAlgorithm);
		this.iterations = builder.iterations == null ? DEFAULT_ITERATIONS : builder.iterations;
		this.saltLength = builder.saltLength == null ? DEFAULT_SALT_LENGTH : builder.saltLength;
		this.keyLength = builder.keyLength == null ? DEFAULT_KEY_LENGTH : builder.keyLength;
		this.secureRandom = new SecureRandom();

		try {
			SecretKeyFactory.getInstance(this.hashAlgorithm);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalArgumentException(format("Unsupported password hash algorithm '%s'", this.hashAlgorithm), e);
		}
	}

	@NonNull
	public String hashPassword(@NonNull String plaintextPassword) {
		requireNonNull(plaintextPassword);

		byte[] salt = new byte[getSaltLength()];
		getSecureRandom().nextBytes(salt);

		byte[] hashedPassword = deriveKey(plaintextPassword, salt, getHashAlgorithm(), getIterations(), getKeyLength());

		return format("%s:%d:%d:%s:%s", getHashAlgorithm(), getIterations(), getKeyLength(),
				base64Encode(salt), base64Encode(hashedPassword));
	}

	@NonNull
	public Boolean verifyPassword(@NonNull String plaintextPassword,
																@NonNull String hashedPassword) {
		requireNonNull(plaintextPassword);
		requireNonNull(hashedPassword);

		EncodedHash encodedHash = EncodedHash.parse(hashedPassword);
		byte[] comparisonHash = deriveKey(plaintextPassword, encodedHash.salt(), encodedHash.hashAlgorithm(),
				encodedHash.iterations(), encodedHash.keyLength());

		return MessageDigest.isEqual(encodedHash.hash(), comparisonHash);
	}

	/**
	 * Was {@code hashedPassword} produced with parameters other than the ones currently configured?
	 */
	@NonNull
	public Boolean needsRehash(@NonNull String hashedPassword) {
		requireNonNull(hashedPassword);

		EncodedHash encodedHash = EncodedHash.parse(hashedPassword);

		return !encodedHash.hashAlgorithm().equals(getHashAlgorithm())
				|| encodedHash.iterations() != getIterations()
				|| encodedHash.keyLength() != getKeyLength()
				|| encodedHash.salt().length != getSaltLength();
	}

	@NonNull
	private static byte[] deriveKey(@NonNull String plaintextPassword,
																	@NonNull byte[] salt,
																	@NonNull String hashAlgorithm,
																	int iterations,
																	int keyLength) {
		char[] passwordCharacters = plaintextPassword.toCharArray();
		PBEKeySpec keySpec = new PBEKeySpec(passwordCharacters, salt, iterations, keyLength);

		try {
			return SecretKeyFactory.getInstance(hashAlgorithm).generateSecret(keySpec).getEncoded();
		} catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
			throw new IllegalArgumentException(format("Unable to hash password using '%s'", hashAlgorithm), e);
		} finally {
			keySpec.clearPassword();
			Arrays.fill(passwordCharacters, '\0');
		}
	}

	private record EncodedHash(
			@NonNull String hashAlgorithm,
			int iterations,
			int keyLength,
			@NonNull byte[] salt,
			@NonNull byte[] hash
	) {
		@NonNull
		static EncodedHash parse(@NonNull String hashedPassword) {
			String[] components = hashedPassword.split(":");

			if (components.length != 5)
				throw new IllegalArgumentException("Malformed password hash");

			try {
				return new EncodedHash(components[0], Integer.parseInt(components[1]), Integer.parseInt(components[2]),
						base64Decode(components[3]), base64Decode(components[4]));
			} catch (IllegalArgumentException e) {
				// Covers both NumberFormatException and bad Base64
				throw new IllegalArgumentException("Malformed password hash", e);
			}
		}
	}

	@NonNull
	private static String base64Encode(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return Base64.getEncoder().withoutPadding().encodeToString(bytes);
	}

	@NonNull
	private static byte[] base64Decode(@NonNull String string) {
		requireNonNull(string);
		return Base64.getDecoder().decode(string);
	}

	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String hashAlgorithm;
		@Nullable
		private Integer iterations;
		@Nullable
		private Integer saltLength;
		@Nullable
		private Integer keyLength;

		private Builder(@NonNull String hashAlgorithm) {
			requireNonNull(hashAlgorithm);
			this.hashAlgorithm = hashAlgorithm;
		}

		@NonNull
		public Builder iterations(@Nullable Integer iterations) {
			this.iterations = iterations;
			return this;
		}

		@NonNull
		public Builder saltLength(@Nullable Integer saltLength) {
			this.saltLength = saltLength;
			return this;
		}

		@NonNull
		public Builder keyLength(@Nullable Integer keyLength) {
			this.keyLength = keyLength;
			return this;
		}

		@NonNull
		public PasswordManager build() {
			return new PasswordManager(this);
		}
	}

	@NonNull
	public String getHashAlgorithm() {
		return this.hashAlgorithm;
	}

	@NonNull
	public Integer getIterations() {
		return this.iterations;
	}

	@NonNull
	public Integer getSaltLength() {
		return this.saltLength;
	}

	@NonNull
	public Integer getKeyLength() {
		return this.keyLength;
	}

	@NonNull
	private SecureRandom getSecureRandom() {
		return this.secureRandom;
	}
}
