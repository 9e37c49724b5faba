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

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Produces fresh key material for operators to place in {@code JWT_SECRET_KEY} and {@code ENCRYPTION_KEY}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SecretGenerator {
	private static final int SIGNING_SECRET_LENGTH_IN_BYTES;
	private static final int ENCRYPTION_KEY_LENGTH_IN_BYTES;
	@NonNull
	private static final SecureRandom SECURE_RANDOM;

	static {
		SIGNING_SECRET_LENGTH_IN_BYTES = 64;
		ENCRYPTION_KEY_LENGTH_IN_BYTES = 32;
		SECURE_RANDOM = new SecureRandom();
	}

	@NonNull
	public static String generateSigningSecret() {
		return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(SIGNING_SECRET_LENGTH_IN_BYTES));
	}

	// Standard (not url-safe) base64, the same shape as `openssl rand -base64 32`
	@NonNull
	public static String generateEncryptionKey() {
		return Base64.getEncoder().encodeToString(randomBytes(ENCRYPTION_KEY_LENGTH_IN_BYTES));
	}

	@NonNull
	private static byte[] randomBytes(int length) {
		byte[] bytes = new byte[length];
		SECURE_RANDOM.nextBytes(bytes);
		return bytes;
	}

	private SecretGenerator() {
		// Non-instantiable
	}
}
