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

package com.revetware.vault.http;

import com.google.inject.Inject;
import com.revetware.vault.exception.AuthenticationException;
import com.revetware.vault.exception.AuthenticationException.Reason;
import com.revetware.vault.util.TokenIssuer;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.UUID;

import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Binds a request to exactly one user by verifying its {@code Authorization: Bearer <token>} header.
 * <p>
 * Authentication only: the gate says who the caller is, not what they may do.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AuthGate {
	@NonNull
	private static final String BEARER_SCHEME;

	static {
		BEARER_SCHEME = "Bearer";
	}

	@NonNull
	private final TokenIssuer tokenIssuer;

	@Inject
	public AuthGate(@NonNull TokenIssuer tokenIssuer) {
		requireNonNull(tokenIssuer);
		this.tokenIssuer = tokenIssuer;
	}

	/**
	 * Returns the authenticated user's ID.
	 *
	 * @throws AuthenticationException if the header is missing, malformed or carries an unusable token
	 */
	@NonNull
	public UUID authenticate(@Nullable String authorizationHeaderValue) {
		String headerValue = trimAggressivelyToNull(authorizationHeaderValue);

		if (headerValue == null)
			throw new AuthenticationException(Reason.MISSING_AUTHORIZATION_HEADER);

		String[] components = headerValue.split(" ", -1);

		if (components.length != 2 || !BEARER_SCHEME.equalsIgnoreCase(components[0]) || components[1].length() == 0)
			throw new AuthenticationException(Reason.MALFORMED_AUTHORIZATION_HEADER);

		return getTokenIssuer().verify(components[1])
				.orElseThrow(() -> new AuthenticationException(Reason.INVALID_OR_EXPIRED_TOKEN));
	}

	@NonNull
	private TokenIssuer getTokenIssuer() {
		return this.tokenIssuer;
	}
}
