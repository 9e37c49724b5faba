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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class LoggingRedactorTests {
	@Test
	public void testTokensAndCiphertextsAreRedacted() {
		String token = new TokenIssuer("logging-redactor-tests-signing-secret-0123", Duration.ofHours(1), Clock.systemUTC())
				.issue(UUID.randomUUID());
		String ciphertext = CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey()).encrypt("app-specific-password");

		String redacted = LoggingRedactor.redact("Authorization: Bearer " + token + " stored " + ciphertext);

		Assertions.assertFalse(redacted.contains(token), "Token was not redacted");
		Assertions.assertFalse(redacted.contains(ciphertext), "Ciphertext was not redacted");
		Assertions.assertEquals("Authorization: Bearer [REDACTED] stored [REDACTED]", redacted, "Unexpected redaction");
	}

	@Test
	public void testOrdinaryMessagesAreUntouched() {
		String message = "Registered account 3d2c6fd1-6d9b-40bb-9ca0-2d2ee00e24b9 for username 'alice'";
		Assertions.assertEquals(message, LoggingRedactor.redact(message), "Message should not change");
	}
}
