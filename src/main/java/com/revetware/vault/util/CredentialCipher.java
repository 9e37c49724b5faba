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
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Symmetric authenticated encryption for third-party secrets at rest.
 * <p>
 * Uses AES-256-GCM with a fresh 96-bit IV for every call. Ciphertexts are self-describing strings of the form
 * {@code v1:<base64url(iv)>:<base64url(ciphertext+tag)>}, so encrypting the same plaintext twice produces
 * different output. Decryption either returns the exact original plaintext or throws {@link DecryptionException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CredentialCipher {
	@NonNull
	private static final String TRANSFORMATION;
	@NonNull
	private static final String VERSION_PREFIX;
	private static final int KEY_LENGTH_IN_BYTES;
	private static final int IV_LENGTH_IN_BYTES;
	private static final int TAG_LENGTH_IN_BITS;
	@NonNull
	private static final SecureRandom SECURE_RANDOM;

	static {
		TRANSFORMATION = "AES/GCM/NoPadding";
		VERSION_PREFIX = "v1";
		KEY_LENGTH_IN_BYTES = 32;
		IV_LENGTH_IN_BYTES = 12;
		TAG_LENGTH_IN_BITS = 128;
		SECURE_RANDOM = new SecureRandom();
	}

	@NonNull
	private final SecretKey secretKey;

	public CredentialCipher(@NonNull SecretKey secretKey) {
		requireNonNull(secretKey);

		byte[] encoded = secretKey.getEncoded();

		if (!"AES".equalsIgnoreCase(secretKey.getAlgorithm()) || encoded == null || encoded.length != KEY_LENGTH_IN_BYTES)
			throw new IllegalArgumentException(format("Encryption key must be a %d-bit AES key", KEY_LENGTH_IN_BYTES * 8));

		this.secretKey = secretKey;
	}

	/**
	 * Builds a cipher from a base64 or base64url encoding of exactly 32 key bytes.
	 */
	@NonNull
	public static CredentialCipher fromEncodedKey(@NonNull String encodedKey) {
		requireNonNull(encodedKey);
		return new CredentialCipher(decodeKey(encodedKey));
	}

	@NonNull
	public static SecretKey decodeKey(@NonNull String encodedKey) {
		requireNonNull(encodedKey);

		String trimmed = encodedKey.trim();
		byte[] keyBytes;

		try {
			keyBytes = trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0
					? Base64.getUrlDecoder().decode(trimmed)
					: Base64.getDecoder().decode(trimmed);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Encryption key is not valid base64", e);
		}

		if (keyBytes.length != KEY_LENGTH_IN_BYTES)
			throw new IllegalArgumentException(format("Encryption key must decode to exactly %d bytes, but got %d",
					KEY_LENGTH_IN_BYTES, keyBytes.length));

		return new SecretKeySpec(keyBytes, "AES");
	}

	@NonNull
	public String encrypt(@NonNull String plaintext) {
		requireNonNull(plaintext);

		byte[] iv = new byte[IV_LENGTH_IN_BYTES];
		SECURE_RANDOM.nextBytes(iv);

		try {
			Cipher cipher = Cipher.getInstance(TRANSFORMATION);
			cipher.init(Cipher.ENCRYPT_MODE, getSecretKey(), new GCMParameterSpec(TAG_LENGTH_IN_BITS, iv));
			byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

			Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
			return format("%s:%s:%s", VERSION_PREFIX, encoder.encodeToString(iv), encoder.encodeToString(ciphertext));
		} catch (GeneralSecurityException e) {
			// AES-GCM is mandatory on every JRE, so this indicates a broken runtime
			throw new IllegalStateException("Unable to encrypt value", e);
		}
	}

	@NonNull
	public String decrypt(@NonNull String ciphertext) {
		requireNonNull(ciphertext);

		String[] components = ciphertext.split(":", -1);

		if (components.length != 3)
			throw new DecryptionException("Ciphertext is malformed");

		if (!VERSION_PREFIX.equals(components[0]))
			throw new DecryptionException("Ciphertext has an unsupported version");

		byte[] iv;
		byte[] encrypted;

		try {
			Base64.Decoder decoder = Base64.getUrlDecoder();
			iv = decoder.decode(components[1]);
			encrypted = decoder.decode(components[2]);
		} catch (IllegalArgumentException e) {
			throw new DecryptionException("Ciphertext is not valid base64url", e);
		}

		if (iv.length != IV_LENGTH_IN_BYTES || encrypted.length < TAG_LENGTH_IN_BITS / 8)
			throw new DecryptionException("Ciphertext is malformed");

		try {
			Cipher cipher = Cipher.getInstance(TRANSFORMATION);
			cipher.init(Cipher.DECRYPT_MODE, getSecretKey(), new GCMParameterSpec(TAG_LENGTH_IN_BITS, iv));
			byte[] plaintext = cipher.doFinal(encrypted);
			return new String(plaintext, StandardCharsets.UTF_8);
		} catch (AEADBadTagException e) {
			throw new DecryptionException("Ciphertext failed authentication (wrong key or tampered data)", e);
		} catch (GeneralSecurityException e) {
			throw new DecryptionException("Unable to decrypt ciphertext", e);
		}
	}

	@NonNull
	private SecretKey getSecretKey() {
		return this.secretKey;
	}
}
