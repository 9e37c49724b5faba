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

package com.revetware.vault.util;

import ch.qos.logback.classic.pattern.MessageConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts session tokens and stored-credential ciphertexts from log messages.
 * <p>
 * JWTs are identified by their characteristic structure: three base64url-encoded
 * segments separated by dots, where the header and payload segments start with "eyJ"
 * (the base64url encoding of '{"'). Ciphertexts are identified by their {@code v1:iv:data} shape.
 * <p>
 * Usage in logback.xml:
 * <pre>{@code
 * <conversionRule conversionWord="msg" converterClass="com.revetware.vault.util.LoggingRedactor"/>
 * }</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactor extends MessageConverter {
	@NonNull
	private static final Pattern JWT_PATTERN;
	@NonNull
	private static final Pattern CIPHERTEXT_PATTERN;

	static {
		// eyJ = base64url encoding of '{"' which all JWT headers/payloads begin with
		JWT_PATTERN = Pattern.compile("eyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]+");
		CIPHERTEXT_PATTERN = Pattern.compile("v1:[A-Za-z0-9_-]+:[A-Za-z0-9_-]+");
	}

	@Override
	public String convert(ILoggingEvent event) {
		return redact(super.convert(event));
	}

	@NonNull
	public static String redact(@NonNull String message) {
		String redacted = JWT_PATTERN.matcher(message).replaceAll("[REDACTED]");
		return CIPHERTEXT_PATTERN.matcher(redacted).replaceAll("[REDACTED]");
	}
}
