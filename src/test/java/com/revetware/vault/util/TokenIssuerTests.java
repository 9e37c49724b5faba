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

import com.revetware.vault.model.auth.AccessToken.AccessTokenResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TokenIssuerTests {
	private static final String SIGNING_SECRET = "token-issuer-tests-signing-secret-0123456789";
	private static final Instant NOW = Instant.parse("2025-03-01T12:00:00.750Z");

	@Test
	public void testIssueThenVerify() {
		TokenIssuer tokenIssuer = new TokenIssuer(SIGNING_SECRET, Duration.ofDays(30), Clock.fixed(NOW, ZoneOffset.UTC));
		UUID userId = UUID.randomUUID();
		String token = tokenIssuer.issue(userId);

		Assertions.assertEquals(3, token.split("\\.").length, "Token should have three segments");
		Assertions.assertEquals(Optional.of(userId), tokenIssuer.verify(token), "Token did not verify");

		AccessTokenResult result = tokenIssuer.parse(token);
		Assertions.assertTrue(result instanceof AccessTokenResult.Succeeded, "Unexpected result " + result);

		AccessTokenResult.Succeeded succeeded = (AccessTokenResult.Succeeded) result;
		Assertions.assertEquals(Instant.parse("2025-03-01T12:00:00Z"), succeeded.accessToken().issuedAt(), "iat should be truncated to seconds");
		Assertions.assertEquals(Instant.parse("2025-03-31T12:00:00Z"), succeeded.accessToken().expiresAt(), "Wrong expiration");
	}

	@Test
	public void testExpiry() {
		UUID userId = UUID.randomUUID();
		String token = new TokenIssuer(SIGNING_SECRET, Duration.ofMinutes(5), Clock.fixed(NOW, ZoneOffset.UTC)).issue(userId);

		TokenIssuer justBefore = new TokenIssuer(SIGNING_SECRET, Duration.ofMinutes(5),
				Clock.fixed(Instant.parse("2025-03-01T12:04:59Z"), ZoneOffset.UTC));
		TokenIssuer atExpiry = new TokenIssuer(SIGNING_SECRET, Duration.ofMinutes(5),
				Clock.fixed(Instant.parse("2025-03-01T12:05:00Z"), ZoneOffset.UTC));

		Assertions.assertEquals(Optional.of(userId), justBefore.verify(token), "Token should still be valid");
		Assertions.assertEquals(Optional.empty(), atExpiry.verify(token), "Token should have expired");
		Assertions.assertTrue(atExpiry.parse(token) instanceof AccessTokenResult.Expired, "Expiry should be distinguishable");
	}

	@Test
	public void testTamperedTokens() {
		TokenIssuer tokenIssuer = new TokenIssuer(SIGNING_SECRET, Duration.ofDays(1), Clock.fixed(NOW, ZoneOffset.UTC));
		String token = tokenIssuer.issue(UUID.randomUUID());
		String[] segments = token.split("\\.");

		// Swap in a different subject but keep the original signature
		String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
				String.format("{\"sub\":\"%s\",\"iat\":%d,\"exp\":%d}", UUID.randomUUID(), NOW.getEpochSecond(), NOW.getEpochSecond() + 3600)
						.getBytes(StandardCharsets.UTF_8));
		String forgedToken = segments[0] + "." + forgedPayload + "." + segments[2];

		Assertions.assertTrue(tokenIssuer.parse(forgedToken) instanceof AccessTokenResult.SignatureMismatch, "Forgery was not detected");
		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify(forgedToken), "Forged token verified");

		// An unsigned token must never be accepted
		String noneHeader = Base64.getUrlEncoder().withoutPadding().encodeToString(
				"{\"alg\":\"none\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));

		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify(noneHeader + "." + segments[1] + "."), "Unsigned token verified");
		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify(noneHeader + "." + segments[1] + "." + segments[2]), "alg=none token verified");

		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify(""), "Empty token verified");
		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify("a.b"), "Two-segment token verified");
		Assertions.assertEquals(Optional.empty(), tokenIssuer.verify(null), "Null token verified");
	}

	@Test
	public void testShortSigningSecretIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new TokenIssuer("too-short", Duration.ofDays(1), Clock.systemUTC()));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new TokenIssuer(SIGNING_SECRET, Duration.ZERO, Clock.systemUTC()));
	}
}
