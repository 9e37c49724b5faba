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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A user's decrypted third-party credentials, meant to live only for the duration of one outbound call.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ExternalCredentials(
		@NonNull String externalIdentity,
		@NonNull String secret
) {
	public ExternalCredentials {
		requireNonNull(externalIdentity);
		requireNonNull(secret);
	}

	@Override
	public String toString() {
		return format("%s{externalIdentity=%s, secret=[REDACTED]}", getClass().getSimpleName(), externalIdentity());
	}
}
