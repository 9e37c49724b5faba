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

package com.revetware.vault.service;

import com.google.inject.AbstractModule;
import com.revetware.vault.App;
import com.revetware.vault.Configuration;
import com.revetware.vault.exception.ApplicationException;
import com.revetware.vault.exception.ApplicationException.ErrorCode;
import com.revetware.vault.exception.DecryptionException;
import com.revetware.vault.model.api.request.AccountAuthenticateRequest;
import com.revetware.vault.model.api.request.AccountRegisterRequest;
import com.revetware.vault.model.auth.AccountSession;
import com.revetware.vault.model.auth.ExternalCredentials;
import com.revetware.vault.model.db.Account;
import com.revetware.vault.util.CredentialCipher;
import com.revetware.vault.util.SecretGenerator;
import com.revetware.vault.util.TokenIssuer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountServiceTests {
	@Test
	public void testRegisterThenRetrieveCredentials() {
		App app = new App(new Configuration("test", Map.of()));
		AccountService accountService = app.getInjector().getInstance(AccountService.class);
		AccountStore accountStore = app.getInjector().getInstance(AccountStore.class);
		TokenIssuer tokenIssuer = app.getInjector().getInstance(TokenIssuer.class);

		AccountSession accountSession = accountService.register(
				new AccountRegisterRequest("  Frank  ", " frank@example.com ", "frank-app-password"));

		Assertions.assertEquals(Optional.of(accountSession.userId()), tokenIssuer.verify(accountSession.accessToken()), "Token does not identify the new account");

		Account account = accountStore.findByUsername("frank").orElse(null);

		Assertions.assertNotNull(account, "Account was not stored under its normalized username");
		Assertions.assertEquals("frank@example.com", account.externalIdentity(), "External identity was not trimmed");
		Assertions.assertTrue(account.encryptedSecret().startsWith("v1:"), "Secret was not encrypted");
		Assertions.assertFalse(account.encryptedSecret().contains("frank-app-password"), "Secret stored in plaintext");
		Assertions.assertFalse(account.toString().contains(account.encryptedSecret()), "toString() exposes the stored secret");

		ExternalCredentials externalCredentials = accountService.getCredentialsForUser(accountSession.userId()).orElse(null);

		Assertions.assertNotNull(externalCredentials, "No credentials for the new account");
		Assertions.assertEquals("frank@example.com", externalCredentials.externalIdentity(), "Wrong external identity");
		Assertions.assertEquals("frank-app-password", externalCredentials.secret(), "Wrong secret");
		Assertions.assertFalse(externalCredentials.toString().contains("frank-app-password"), "toString() exposes the secret");

		Assertions.assertEquals(Optional.of(18), accountService.withCredentials(accountSession.userId(), credentials -> credentials.secret().length()),
				"Credentials were not passed through");
		Assertions.assertEquals(Optional.empty(), accountService.getCredentialsForUser(UUID.randomUUID()), "Unknown user has credentials");
	}

	@Test
	public void testMultibyteSecretsAtMaximumLength() {
		App app = new App(new Configuration("test", Map.of()));
		AccountService accountService = app.getInjector().getInstance(AccountService.class);

		// 512 characters of three UTF-8 bytes each, and 256 four-byte code points (also 512 characters)
		String cjkSecret = "密".repeat(512);
		String emojiSecret = "\uD83D\uDD11".repeat(256);

		AccountSession cjkSession = accountService.register(new AccountRegisterRequest("grace", "grace@example.com", cjkSecret));
		AccountSession emojiSession = accountService.register(new AccountRegisterRequest("heidi", "heidi@example.com", emojiSecret));

		Assertions.assertEquals(cjkSecret, accountService.getCredentialsForUser(cjkSession.userId()).get().secret(), "Wrong secret");
		Assertions.assertEquals(emojiSecret, accountService.getCredentialsForUser(emojiSession.userId()).get().secret(), "Wrong secret");

		ApplicationException applicationException = Assertions.assertThrows(ApplicationException.class, () ->
				accountService.register(new AccountRegisterRequest("ivan", "ivan@example.com", "密".repeat(513))));

		Assertions.assertEquals(ErrorCode.VALIDATION_FAILED, applicationException.getErrorCode(), "Wrong error code");
		Assertions.assertTrue(applicationException.getFieldErrors().containsKey("secret"), "Missing secret error");
	}

	@Test
	public void testLoginValidation() {
		App app = new App(new Configuration("test", Map.of()));
		AccountService accountService = app.getInjector().getInstance(AccountService.class);

		ApplicationException e = Assertions.assertThrows(ApplicationException.class,
				() -> accountService.login(new AccountAuthenticateRequest("grace", null, "")));

		Assertions.assertEquals(400, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(ErrorCode.VALIDATION_FAILED, e.getErrorCode(), "Wrong error code");
		Assertions.assertTrue(e.getFieldErrors().containsKey("external_identity"), "Missing external identity error");
		Assertions.assertTrue(e.getFieldErrors().containsKey("secret"), "Missing secret error");

		// A username that could never have been registered is just an unknown username
		e = Assertions.assertThrows(ApplicationException.class,
				() -> accountService.login(new AccountAuthenticateRequest("no spaces allowed", "grace@example.com", "grace-password")));

		Assertions.assertEquals(401, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(ErrorCode.INVALID_CREDENTIALS, e.getErrorCode(), "Wrong error code");
	}

	@Test
	public void testConcurrentDuplicateRegistration() throws Exception {
		App app = new App(new Configuration("test", Map.of()));
		AccountService accountService = app.getInjector().getInstance(AccountService.class);

		int threadCount = 8;
		ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
		CountDownLatch startLatch = new CountDownLatch(1);
		List<Future<Boolean>> futures = new ArrayList<>(threadCount);

		try {
			for (int i = 0; i < threadCount; ++i) {
				String externalIdentity = "heidi" + i + "@example.com";

				futures.add(executorService.submit(() -> {
					startLatch.await();

					try {
						accountService.register(new AccountRegisterRequest("heidi", externalIdentity, "heidi-password"));
						return true;
					} catch (ApplicationException e) {
						Assertions.assertEquals(ErrorCode.DUPLICATE_USERNAME, e.getErrorCode(), "Wrong error code");
						return false;
					}
				}));
			}

			startLatch.countDown();

			int successes = 0;

			for (Future<Boolean> future : futures)
				if (future.get(30, TimeUnit.SECONDS))
					++successes;

			Assertions.assertEquals(1, successes, "Exactly one registration should win");
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testChangedEncryptionKey() {
		// Two apps share one database but hold different encryption keys
		Map<String, String> environmentVariables = Map.of(Configuration.DATABASE_URL_VARIABLE_NAME,
				"jdbc:hsqldb:mem:" + UUID.randomUUID());

		App app = new App(new Configuration("test", environmentVariables));
		AccountSession accountSession = app.getInjector().getInstance(AccountService.class)
				.register(new AccountRegisterRequest("ivan", "ivan@example.com", "ivan-password"));

		App rekeyedApp = new App(new Configuration("test", environmentVariables), new AbstractModule() {
			@Override
			protected void configure() {
				bind(CredentialCipher.class).toInstance(CredentialCipher.fromEncodedKey(SecretGenerator.generateEncryptionKey()));
			}
		});

		AccountService rekeyedAccountService = rekeyedApp.getInjector().getInstance(AccountService.class);

		ApplicationException e = Assertions.assertThrows(ApplicationException.class,
				() -> rekeyedAccountService.login(new AccountAuthenticateRequest("ivan", "ivan@example.com", "ivan-password")));

		Assertions.assertEquals(401, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertEquals(ErrorCode.INVALID_CREDENTIALS, e.getErrorCode(), "Wrong error code");
		Assertions.assertThrows(DecryptionException.class, () -> rekeyedAccountService.getCredentialsForUser(accountSession.userId()));
	}
}
