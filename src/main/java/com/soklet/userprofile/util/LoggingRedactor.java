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

import ch.qos.logback.classic.pattern.MessageConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts password hashes from log messages.
 * <p>
 * Hashes are identified by the {@link PasswordManager} storage format:
 * {@code <PBKDF2 algorithm>:<iterations>:<key length>:<base64 salt>:<base64 hash>}.
 * <p>
 * Usage in logback.xml:
 * <pre>{@code
 * <conversionRule conversionWord="msg" converterClass="com.soklet.userprofile.util.LoggingRedactor"/>
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactor extends MessageConverter {
	@NonNull
	private static final Pattern PASSWORD_HASH_PATTERN;

	static {
		PASSWORD_HASH_PATTERN = Pattern.compile("PBKDF2With[A-Za-z0-9]+:\\d+:\\d+:[A-Za-z0-9+/]+:[A-Za-z0-9+/]+");
	}

	@Override
	public String convert(ILoggingEvent event) {
		return redact(super.convert(event));
	}

	@Nullable
	public static String redact(@Nullable String message) {
		if (message == null)
			return null;

		return PASSWORD_HASH_PATTERN.matcher(message).replaceAll("[REDACTED]");
	}
}
