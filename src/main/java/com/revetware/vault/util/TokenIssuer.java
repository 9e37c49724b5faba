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

import com.revetware.vault.model.auth.AccessToken;
import com.revetware.vault.model.auth.AccessToken.AccessTokenResult;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Issues and verifies stateless session tokens.
 * <p>
 * Verification fails closed: every kind of failure yields an empty result rather than an exception.
 * Tokens cannot be revoked before they expire.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TokenIssuer {
	private static final int SIGNING_SECRET_MIN_LENGTH_IN_BYTES;

	static {
		SIGNING_SECRET_MIN_LENGTH_IN_BYTES = 32;
	}

	@NonNull
	private final SecretKey signingKey;
	@NonNull
	private final Duration expiration;
	@NonNull
	private final Clock clock;
	@NonNull
	private final Logger logger;

	public TokenIssuer(@NonNull String signingSecret,
										 @NonNull Duration expiration,
										 @NonNull Clock clock) {
		requireNonNull(signingSecret);
		requireNonNull(expiration);
		requireNonNull(clock);

		byte[] signingSecretBytes = signingSecret.getBytes(StandardCharsets.UTF_8);

		if (signingSecretBytes.length < SIGNING_SECRET_MIN_LENGTH_IN_BYTES)
			throw new IllegalArgumentException(format("Signing secret must be at least %d bytes", SIGNING_SECRET_MIN_LENGTH_IN_BYTES));

		if (expiration.isNegative() || expiration.isZero())
			throw new IllegalArgumentException("Token expiration must be positive");

		this.signingKey = new SecretKeySpec(signingSecretBytes, "HmacSHA256");
		this.expiration = expiration;
		this.clock = clock;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public String issue(@NonNull UUID userId) {
		requireNonNull(userId);

		// JWT timestamps have second precision
		Instant issuedAt = Instant.ofEpochSecond(getClock().instant().getEpochSecond());
		Instant expiresAt = issuedAt.plus(getExpiration());

		return new AccessToken(userId, issuedAt, expiresAt).toStringRepresentation(getSigningKey());
	}

	@NonNull
	public AccessTokenResult parse(@NonNull String token) {
		requireNonNull(token);
		return AccessToken.fromStringRepresentation(token, getSigningKey(), getClock().instant());
	}

	@NonNull
	public Optional<UUID> verify(@Nullable String token) {
		if (token == null)
			return Optional.empty();

		AccessTokenResult result = parse(token);

		if (result instanceof AccessTokenResult.Succeeded succeeded)
			return Optional.of(succeeded.accessToken().userId());

		if (result instanceof AccessTokenResult.Expired expired)
			getLogger().debug("Rejected token for user ID {} which expired at {}", expired.accessToken().userId(), expired.expiredAt());
		else if (result instanceof AccessTokenResult.SignatureMismatch)
			getLogger().warn("Rejected token with a signature mismatch");
		else if (result instanceof AccessTokenResult.MissingHeaders missingHeaders)
			getLogger().warn("Rejected token missing headers {}", missingHeaders.headers());
		else if (result instanceof AccessTokenResult.InvalidHeaders invalidHeaders)
			getLogger().warn("Rejected token with invalid headers {}", invalidHeaders.headers());
		else if (result instanceof AccessTokenResult.MissingClaims missingClaims)
			getLogger().warn("Rejected token missing claims {}", missingClaims.claims());
		else if (result instanceof AccessTokenResult.InvalidClaims invalidClaims)
			getLogger().warn("Rejected token with invalid claims {}", invalidClaims.claims());
		else
			getLogger().warn("Rejected token with invalid structure");

		return Optional.empty();
	}

	@NonNull
	public Duration getExpiration() {
		return this.expiration;
	}

	@NonNull
	private SecretKey getSigningKey() {
		return this.signingKey;
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
