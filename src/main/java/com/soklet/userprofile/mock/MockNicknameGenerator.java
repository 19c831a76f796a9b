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

package com.soklet.userprofile.mock;

import com.soklet.userprofile.util.NicknameGenerator;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;

/**
 * Mock implementation of {@link NicknameGenerator} which hands out a predictable sequence of nicknames:
 * {@code mock_user_1}, {@code mock_user_2}, ...
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockNicknameGenerator implements NicknameGenerator {
	@NonNull
	private final AtomicInteger sequence;
	@NonNull
	private final Logger logger;

	public MockNicknameGenerator() {
		this.sequence = new AtomicInteger();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	@Override
	public String generateNickname() {
		String nickname = format("mock_user_%d", getSequence().incrementAndGet());
		getLogger().debug("Pretending to generate nickname {}", nickname);
		return nickname;
	}

	@NonNull
	private AtomicInteger getSequence() {
		return this.sequence;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
