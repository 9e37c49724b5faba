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

package com.revetware.vault.model.auth;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.jspecify.annotations.NonNull;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates a JWT which carries the identity of an authenticated user.
 * <p>
 * Tokens are signed with HMAC-SHA256 ({@code HS256}). They are integrity-protected but not encrypted, so the
 * claims are readable by anyone holding the token.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AccessToken(
		@NonNull UUID userId,
		@NonNull Instant issuedAt,
		@NonNull Instant expiresAt
) {
	// Manage our own internal GSON instance because our needs are simple - no need to inject one
	@NonNull
	private static final Gson GSON;
	@NonNull
	private static final String SIGNING_ALGORITHM;
	@NonNull
	private static final String MAC_ALGORITHM;

	static {
		GSON = new GsonBuilder().disableHtmlEscaping().create();
		SIGNING_ALGORITHM = "HS256";
		MAC_ALGORITHM = "HmacSHA256";
	}

	public AccessToken {
		requireNonNull(userId);
		requireNonNull(issuedAt);
		requireNonNull(expiresAt);
	}

	// Parsing an AccessToken can have many outcomes.
	public sealed interface AccessTokenResult {
		record Succeeded(@NonNull AccessToken accessToken) implements AccessTokenResult {}

		record InvalidStructure() implements AccessTokenResult {}

		record SignatureMismatch() implements AccessTokenResult {}

		record Expired(@NonNull AccessToken accessToken, @NonNull Instant expiredAt) implements AccessTokenResult {}

		record MissingHeaders(@NonNull Set<@NonNull String> headers) implements AccessTokenResult {}

		record InvalidHeaders(@NonNull Set<@NonNull String> headers) implements AccessTokenResult {}

		record MissingClaims(@NonNull Set<@NonNull String> claims) implements AccessTokenResult {}

		record InvalidClaims(@NonNull Set<@NonNull String> claims) implements AccessTokenResult {}
	}

	@NonNull
	public Boolean isExpiredAt(@NonNull Instant instant) {
		requireNonNull(instant);
		return !instant.isBefore(expiresAt());
	}

	/**
	 * Encodes this JWT to a string representation and signs it using HMAC-SHA256.
	 */
	@NonNull
	public String toStringRepresentation(@NonNull SecretKey signingKey) {
		requireNonNull(signingKey);

		Map<String, Object> header = new LinkedHashMap<>();
		header.put("alg", SIGNING_ALGORITHM);
		header.put("typ", "JWT");

		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("sub", userId().toString());
		payload.put("iat", issuedAt().getEpochSecond());
		payload.put("exp", expiresAt().getEpochSecond());

		String encodedHeader = base64UrlEncode(GSON.toJson(header).getBytes(StandardCharsets.UTF_8));
		String encodedPayload = base64UrlEncode(GSON.toJson(payload).getBytes(StandardCharsets.UTF_8));
		String signingInput = format("%s.%s", encodedHeader, encodedPayload);

		byte[] signatureBytes;

		try {
			signatureBytes = hmacSha256(signingInput, signingKey);
		} catch (GeneralSecurityException e) {
			throw new IllegalArgumentException("Unable to compute HS256 signature", e);
		}

		return format("%s.%s", signingInput, base64UrlEncode(signatureBytes));
	}

	/**
	 * Parses and verifies an AccessToken from its string representation.
	 * <p>
	 * The signature is checked before any claim is trusted, and expiry is evaluated against {@code now}.
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public static AccessTokenResult fromStringRepresentation(@NonNull String string,
																													 @NonNull SecretKey signingKey,
																													 @NonNull Instant now) {
		requireNonNull(string);
		requireNonNull(signingKey);
		requireNonNull(now);

		String trimmed = trimAggressivelyToNull(string);

		if (trimmed == null)
			return new AccessTokenResult.InvalidStructure();

		String[] components = trimmed.split("\\.", -1);

		if (components.length != 3)
			return new AccessTokenResult.InvalidStructure();

		String encodedHeader = components[0];
		String encodedPayload = components[1];
		String encodedSignature = components[2];

		String decodedHeaderJson;
		String decodedPayloadJson;
		byte[] signatureBytes;

		try {
			decodedHeaderJson = new String(base64UrlDecode(encodedHeader), StandardCharsets.UTF_8);
			decodedPayloadJson = new String(base64UrlDecode(encodedPayload), StandardCharsets.UTF_8);
			signatureBytes = base64UrlDecode(encodedSignature);
		} catch (IllegalArgumentException e) {
			// Bad base64
			return new AccessTokenResult.InvalidStructure();
		}

		Map<String, Object> header;

		try {
			header = GSON.fromJson(decodedHeaderJson, Map.class);
		} catch (RuntimeException e) {
			return new AccessTokenResult.InvalidStructure();
		}

		if (header == null)
			return new AccessTokenResult.InvalidStructure();

		// Only HS256 is acceptable; in particular "none" must never be honored
		Set<String> missingHeaders = new LinkedHashSet<>();
		Set<String> invalidHeaders = new LinkedHashSet<>();

		Object algAsObject = header.get("alg");

		if (algAsObject == null)
			missingHeaders.add("alg");
		else if (!(algAsObject instanceof String alg) || !SIGNING_ALGORITHM.equals(alg))
			invalidHeaders.add("alg");

		if (!missingHeaders.isEmpty())
			return new AccessTokenResult.MissingHeaders(missingHeaders);

		if (!invalidHeaders.isEmpty())
			return new AccessTokenResult.InvalidHeaders(invalidHeaders);

		String signingInput = format("%s.%s", encodedHeader, encodedPayload);
		byte[] expectedSignatureBytes;

		try {
			expectedSignatureBytes = hmacSha256(signingInput, signingKey);
		} catch (GeneralSecurityException e) {
			return new AccessTokenResult.InvalidStructure();
		}

		if (!MessageDigest.isEqual(expectedSignatureBytes, signatureBytes))
			return new AccessTokenResult.SignatureMismatch();

		Map<String, Object> payload;

		try {
			payload = GSON.fromJson(decodedPayloadJson, Map.class);
		} catch (RuntimeException e) {
			return new AccessTokenResult.InvalidStructure();
		}

		if (payload == null)
			return new AccessTokenResult.InvalidStructure();

		Object subAsObject = payload.get("sub");
		Object iatAsObject = payload.get("iat");
		Object expAsObject = payload.get("exp");

		Set<String> missingClaims = new LinkedHashSet<>();

		if (subAsObject == null)
			missingClaims.add("sub");
		if (iatAsObject == null)
			missingClaims.add("iat");
		if (expAsObject == null)
			missingClaims.add("exp");

		if (!missingClaims.isEmpty())
			return new AccessTokenResult.MissingClaims(missingClaims);

		Set<String> invalidClaims = new LinkedHashSet<>();
		UUID sub = null;

		if (subAsObject instanceof String subAsString) {
			try {
				sub = UUID.fromString(subAsString);
			} catch (IllegalArgumentException e) {
				invalidClaims.add("sub");
			}
		} else {
			invalidClaims.add("sub");
		}

		if (!(iatAsObject instanceof Number))
			invalidClaims.add("iat");
		if (!(expAsObject instanceof Number))
			invalidClaims.add("exp");

		if (!invalidClaims.isEmpty())
			return new AccessTokenResult.InvalidClaims(invalidClaims);

		Instant issuedAt = Instant.ofEpochSecond(((Number) iatAsObject).longValue());
		Instant expiresAt = Instant.ofEpochSecond(((Number) expAsObject).longValue());

		AccessToken accessToken = new AccessToken(sub, issuedAt, expiresAt);

		if (accessToken.isExpiredAt(now))
			return new AccessTokenResult.Expired(accessToken, expiresAt);

		return new AccessTokenResult.Succeeded(accessToken);
	}

	@NonNull
	private static byte[] hmacSha256(@NonNull String signingInput,
																	 @NonNull SecretKey signingKey) throws GeneralSecurityException {
		requireNonNull(signingInput);
		requireNonNull(signingKey);

		Mac mac = Mac.getInstance(MAC_ALGORITHM);
		mac.init(signingKey);

		return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
	}

	@NonNull
	private static String base64UrlEncode(@NonNull byte[] bytes) {
		requireNonNull(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	@NonNull
	private static byte[] base64UrlDecode(@NonNull String string) {
		requireNonNull(string);
		return Base64.getUrlDecoder().decode(string);
	}
}
