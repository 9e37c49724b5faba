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

package com.revetware.vault.exception;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a request that requires an authenticated user does not carry a usable bearer token.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class AuthenticationException extends RuntimeException {
	@NonNull
	private final Reason reason;

	public AuthenticationException(@NonNull Reason reason) {
		super(format("Authentication failed: %s", requireNonNull(reason).name()));
		this.reason = reason;
	}

	public enum Reason {
		MISSING_AUTHORIZATION_HEADER,
		MALFORMED_AUTHORIZATION_HEADER,
		INVALID_OR_EXPIRED_TOKEN
	}

	@NonNull
	public Reason getReason() {
		return this.reason;
	}
}
