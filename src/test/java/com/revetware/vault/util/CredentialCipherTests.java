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

import com.revetware.vault.exception.DecryptionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CredentialCipherTests {
	@Test
	public void testEncryptThenDecrypt() {
		CredentialCipher credentialCipher = CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey());
		String plaintext = "abcd-efgh-ijkl-mnop ✓";

		String ciphertext = credentialCipher.encrypt(plaintext);

		Assertions.assertTrue(ciphertext.startsWith("v1:"), "Missing version prefix");
		Assertions.assertFalse(ciphertext.contains(plaintext), "Plaintext visible in ciphertext");
		Assertions.assertEquals(plaintext, credentialCipher.decrypt(ciphertext), "Round trip failed");
		Assertions.assertNotEquals(ciphertext, credentialCipher.encrypt(plaintext), "Encryption should not be deterministic");
	}

	@Test
	public void testWrongKey() {
		CredentialCipher credentialCipher = CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey());
		CredentialCipher otherCredentialCipher = CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey());

		String ciphertext = credentialCipher.encrypt("app-specific-password");

		Assertions.assertThrows(DecryptionException.class, () -> otherCredentialCipher.decrypt(ciphertext));
	}

	@Test
	public void testTampering() {
		CredentialCipher credentialCipher = CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey());
		String ciphertext = credentialCipher.encrypt("app-specific-password");

		// Alter the first character of the ciphertext segment
		int index = ciphertext.lastIndexOf(':') + 1;
		char original = ciphertext.charAt(index);
		String tampered = ciphertext.substring(0, index) + (original == 'A' ? 'B' : 'A') + ciphertext.substring(index + 1);

		Assertions.assertThrows(DecryptionException.class, () -> credentialCipher.decrypt(tampered));
		Assertions.assertThrows(DecryptionException.class, () -> credentialCipher.decrypt("v2" + ciphertext.substring(2)));
		Assertions.assertThrows(DecryptionException.class, () -> credentialCipher.decrypt("not ciphertext"));
		Assertions.assertThrows(DecryptionException.class, () -> credentialCipher.decrypt("v1:@@@:@@@"));
		Assertions.assertThrows(DecryptionException.class, () -> credentialCipher.decrypt("v1::"));
	}

	@Test
	public void testKeyDecoding() {
		// 32 zero bytes, standard and URL-safe alphabets
		Assertions.assertEquals(32, CredentialCipher.decodeKey("AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA=").getEncoded().length, "Wrong key length");
		Assertions.assertEquals(32, CredentialCipher.decodeKey("__________________________________________8").getEncoded().length, "Wrong key length");

		Assertions.assertThrows(IllegalArgumentException.class, () -> CredentialCipher.decodeKey("c2hvcnQ="));
		Assertions.assertThrows(IllegalArgumentException.class, () -> CredentialCipher.decodeKey("not base64!"));
	}
}
