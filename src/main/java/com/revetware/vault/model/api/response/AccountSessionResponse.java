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

import com.revetware.vault.model.auth.AccountSession;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an {@link AccountSession}, returned by registration and login.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountSessionResponse {
	@NonNull
	private final Boolean success;
	@NonNull
	private final String token;
	@NonNull
	private final UUID userId;

	public AccountSessionResponse(@NonNull AccountSession accountSession) {
		requireNonNull(accountSession);

		this.success = true;
		this.token = accountSession.accessToken();
		this.userId = accountSession.userId();
	}

	@NonNull
	public Boolean getSuccess() {
		return this.success;
	}

	@NonNull
	public String getToken() {
		return this.token;
	}

	@NonNull
	public UUID getUserId() {
		return this.userId;
	}
}
