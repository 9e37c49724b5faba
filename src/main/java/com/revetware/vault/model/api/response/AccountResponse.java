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

package com.revetware.vault.model.api.response;

import com.revetware.vault.model.db.Account;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an {@link Account}.
 * <p>
 * Never includes the stored secret, encrypted or otherwise.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountResponse {
	@NonNull
	private final UUID userId;
	@NonNull
	private final String username;
	@NonNull
	private final String externalIdentity;
	@NonNull
	private final Instant createdAt;

	public AccountResponse(@NonNull Account account) {
		requireNonNull(account);

		this.userId = account.id();
		this.username = account.username();
		this.externalIdentity = account.externalIdentity();
		this.createdAt = account.createdAt();
	}

	@NonNull
	public UUID getUserId() {
		return this.userId;
	}

	@NonNull
	public String getUsername() {
		return this.username;
	}

	@NonNull
	public String getExternalIdentity() {
		return this.externalIdentity;
	}

	@NonNull
	public Instant getCreatedAt() {
		return this.createdAt;
	}
}
