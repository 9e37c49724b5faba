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

package com.revetware.vault.model.db;

import org.jspecify.annotations.NonNull;

import java.time.Instant;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code accounts} table in the database.
 * <p>
 * {@code encryptedSecret} is opaque ciphertext and is deliberately left out of {@link #toString()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Account(
		@NonNull UUID id,
		@NonNull String username,
		@NonNull String externalIdentity,
		@NonNull String encryptedSecret,
		@NonNull Instant createdAt
) {
	public Account {
		requireNonNull(id);
		requireNonNull(username);
		requireNonNull(externalIdentity);
		requireNonNull(encryptedSecret);
		requireNonNull(createdAt);
	}

	@Override
	public String toString() {
		return format("%s{id=%s, username=%s, createdAt=%s}", getClass().getSimpleName(), id(), username(), createdAt());
	}
}
