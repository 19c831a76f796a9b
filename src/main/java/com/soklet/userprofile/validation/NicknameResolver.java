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

import com.google.inject.Inject;
import com.soklet.userprofile.util.NicknameGenerator;
import com.soklet.userprofile.util.NicknameGenerator.NicknameGenerationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static com.soklet.userprofile.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Supplies a nickname for new profiles: the caller's, if one was given, otherwise a generated one.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class NicknameResolver {
	@NonNull
	private final NicknameGenerator nicknameGenerator;
	@NonNull
	private final Logger logger;

	@Inject
	public NicknameResolver(@NonNull NicknameGenerator nicknameGenerator) {
		requireNonNull(nicknameGenerator);

		this.nicknameGenerator = nicknameGenerator;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Returns {@code rawNickname} unchanged (apart from trimming) if present; otherwise asks the
	 * {@link NicknameGenerator} for exactly one nickname.
	 *
	 * @throws NicknameGenerationException if the generator fails or produces a blank nickname
	 */
	@NonNull
	public ResolvedNickname resolveNickname(@Nullable String rawNickname) throws NicknameGenerationException {
		String nickname = trimAggressivelyToNull(rawNickname);

		if (nickname != null)
			return new ResolvedNickname(nickname, false);

		String generatedNickname;

		try {
			generatedNickname = trimAggressivelyToNull(getNicknameGenerator().generateNickname());
		} catch (RuntimeException e) {
			// The generator is an external collaborator; surface any failure as a generation failure
			throw new NicknameGenerationException("Nickname generator failed unexpectedly", e);
		}

		if (generatedNickname == null)
			throw new NicknameGenerationException("Nickname generator produced a blank nickname");

		getLogger().debug("Generated nickname '{}'", generatedNickname);

		return new ResolvedNickname(generatedNickname, true);
	}

	public record ResolvedNickname(
			@NonNull String nickname,
			@NonNull Boolean generated
	) {
		public ResolvedNickname {
			requireNonNull(nickname);
			requireNonNull(generated);
		}
	}

	@NonNull
	private NicknameGenerator getNicknameGenerator() {
		return this.nicknameGenerator;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
