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

import org.jspecify.annotations.NonNull;

import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Result of a successful registration or login: the user's ID and a freshly-issued session token.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AccountSession(
		@NonNull UUID userId,
		@NonNull String accessToken
) {
	public AccountSession {
		requireNonNull(userId);
		requireNonNull(accessToken);
	}

	@Override
	public String toString() {
		return format("%s{userId=%s}", getClass().getSimpleName(), userId());
	}
}
