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

package com.revetware.vault.resource;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.revetware.vault.CurrentContext;
import com.revetware.vault.annotation.AuthenticationRequired;
import com.revetware.vault.exception.AuthenticationException;
import com.revetware.vault.exception.AuthenticationException.Reason;
import com.revetware.vault.model.api.request.AccountAuthenticateRequest;
import com.revetware.vault.model.api.request.AccountRegisterRequest;
import com.revetware.vault.model.api.response.AccountResponse;
import com.revetware.vault.model.api.response.AccountSessionResponse;
import com.revetware.vault.model.auth.AccountSession;
import com.revetware.vault.model.db.Account;
import com.revetware.vault.service.AccountService;
import com.soklet.Response;
import com.soklet.annotation.GET;
import com.soklet.annotation.POST;
import com.soklet.annotation.RequestBody;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Contains Account-related Resource Methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountResource {
	@NonNull
	private final AccountService accountService;
	@NonNull
	private final Provider<CurrentContext> currentContextProvider;

	@Inject
	public AccountResource(@NonNull AccountService accountService,
												 @NonNull Provider<CurrentContext> currentContextProvider) {
		requireNonNull(accountService);
		requireNonNull(currentContextProvider);

		this.accountService = accountService;
		this.currentContextProvider = currentContextProvider;
	}

	@NonNull
	@POST("/api/auth/register")
	public Response register(@NonNull @RequestBody AccountRegisterRequest request) {
		requireNonNull(request);

		AccountSession accountSession = getAccountService().register(request);

		return Response.withStatusCode(201)
				.body(new AccountSessionResponse(accountSession))
				.build();
	}

	@NonNull
	@POST("/api/auth/login")
	public AccountSessionResponse login(@NonNull @RequestBody AccountAuthenticateRequest request) {
		requireNonNull(request);

		AccountSession accountSession = getAccountService().login(request);
		return new AccountSessionResponse(accountSession);
	}

	@NonNull
	@AuthenticationRequired
	@GET("/api/auth/session")
	public AccountResponse session() {
		// The interceptor has already authenticated, so the current context always carries a user ID
		UUID userId = getCurrentContext().getUserId()
				.orElseThrow(() -> new AuthenticationException(Reason.MISSING_AUTHORIZATION_HEADER));

		// A valid token for an account that no longer exists is treated like any other unusable token
		Account account = getAccountService().findAccountById(userId)
				.orElseThrow(() -> new AuthenticationException(Reason.INVALID_OR_EXPIRED_TOKEN));

		return new AccountResponse(account);
	}

	@NonNull
	private AccountService getAccountService() {
		return this.accountService;
	}

	@NonNull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}
}
