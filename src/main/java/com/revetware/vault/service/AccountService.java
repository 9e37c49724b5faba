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

import com.google.inject.Inject;
import com.revetware.vault.exception.ApplicationException;
import com.revetware.vault.exception.ApplicationException.ErrorCode;
import com.revetware.vault.exception.ApplicationException.ErrorCollector;
import com.revetware.vault.exception.DecryptionException;
import com.revetware.vault.exception.DuplicateUsernameException;
import com.revetware.vault.model.api.request.AccountAuthenticateRequest;
import com.revetware.vault.model.api.request.AccountRegisterRequest;
import com.revetware.vault.model.auth.AccountSession;
import com.revetware.vault.model.auth.ExternalCredentials;
import com.revetware.vault.model.db.Account;
import com.revetware.vault.util.CredentialCipher;
import com.revetware.vault.util.TokenIssuer;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static com.revetware.vault.util.Normalizer.normalizeUsername;
import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static com.revetware.vault.util.Validator.SECRET_MAX_LENGTH;
import static com.revetware.vault.util.Validator.SECRET_MIN_LENGTH;
import static com.revetware.vault.util.Validator.isValidEmailAddress;
import static com.revetware.vault.util.Validator.isValidSecret;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Business logic for accounts: registration, login and access to a user's decrypted credentials.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountService {
	@NonNull
	private static final String INVALID_CREDENTIALS_MESSAGE;
	@NonNull
	private static final String DUPLICATE_USERNAME_MESSAGE;

	static {
		INVALID_CREDENTIALS_MESSAGE = "Invalid credentials";
		DUPLICATE_USERNAME_MESSAGE = "Username already exists";
	}

	@NonNull
	private final AccountStore accountStore;
	@NonNull
	private final CredentialCipher credentialCipher;
	@NonNull
	private final TokenIssuer tokenIssuer;
	@NonNull
	private final Logger logger;

	@Inject
	public AccountService(@NonNull AccountStore accountStore,
												@NonNull CredentialCipher credentialCipher,
												@NonNull TokenIssuer tokenIssuer) {
		requireNonNull(accountStore);
		requireNonNull(credentialCipher);
		requireNonNull(tokenIssuer);

		this.accountStore = accountStore;
		this.credentialCipher = credentialCipher;
		this.tokenIssuer = tokenIssuer;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public AccountSession register(@NonNull AccountRegisterRequest request) {
		requireNonNull(request);

		String username = trimAggressivelyToNull(request.username());
		String externalIdentity = trimAggressivelyToNull(request.externalIdentity());
		// Secrets are stored exactly as supplied
		String secret = request.secret();
		ErrorCollector errorCollector = new ErrorCollector();

		if (username == null)
			errorCollector.addFieldError("username", "Username is required.");
		else if (normalizeUsername(username).isEmpty())
			errorCollector.addFieldError("username", "Username must be 3 to 30 characters long and contain only letters, numbers, underscores or hyphens.");

		if (externalIdentity == null)
			errorCollector.addFieldError("external_identity", "External identity is required.");
		else if (!isValidEmailAddress(externalIdentity))
			errorCollector.addFieldError("external_identity", "External identity must be a valid email address.");

		if (secret == null || secret.length() == 0)
			errorCollector.addFieldError("secret", "Secret is required.");
		else if (!isValidSecret(secret))
			errorCollector.addFieldError("secret", format("Secret must be between %d and %d characters long.", SECRET_MIN_LENGTH, SECRET_MAX_LENGTH));

		if (errorCollector.hasErrors())
			throw ApplicationException.withStatusCodeAndErrors(400, ErrorCode.VALIDATION_FAILED, errorCollector).build();

		String normalizedUsername = normalizeUsername(username).orElseThrow();
		String encryptedSecret = getCredentialCipher().encrypt(secret);
		UUID userId;

		try {
			userId = getAccountStore().insert(normalizedUsername, externalIdentity, encryptedSecret);
		} catch (DuplicateUsernameException e) {
			getLogger().info("Rejected registration for username '{}' because it is already taken", normalizedUsername);

			throw ApplicationException.withStatusCode(400, ErrorCode.DUPLICATE_USERNAME)
					.generalError(DUPLICATE_USERNAME_MESSAGE)
					.build();
		}

		getLogger().info("Registered account {} for username '{}'", userId, normalizedUsername);

		return new AccountSession(userId, getTokenIssuer().issue(userId));
	}

	@NonNull
	public AccountSession login(@NonNull AccountAuthenticateRequest request) {
		requireNonNull(request);

		String username = trimAggressivelyToNull(request.username());
		String externalIdentity = trimAggressivelyToNull(request.externalIdentity());
		String secret = request.secret();
		ErrorCollector errorCollector = new ErrorCollector();

		if (username == null)
			errorCollector.addFieldError("username", "Username is required.");

		if (externalIdentity == null)
			errorCollector.addFieldError("external_identity", "External identity is required.");

		if (secret == null || secret.length() == 0)
			errorCollector.addFieldError("secret", "Secret is required.");

		if (errorCollector.hasErrors())
			throw ApplicationException.withStatusCodeAndErrors(400, ErrorCode.VALIDATION_FAILED, errorCollector).build();

		// A malformed username cannot belong to any account, so it is indistinguishable from an unknown one
		Account account = normalizeUsername(username)
				.flatMap(normalizedUsername -> getAccountStore().findByUsername(normalizedUsername))
				.orElse(null);

		if (account == null) {
			getLogger().debug("Login failed: no such username");
			throw invalidCredentials();
		}

		if (!constantTimeEquals(externalIdentity, account.externalIdentity())) {
			getLogger().debug("Login failed for account {}: external identity mismatch", account.id());
			throw invalidCredentials();
		}

		String storedSecret;

		try {
			storedSecret = getCredentialCipher().decrypt(account.encryptedSecret());
		} catch (DecryptionException e) {
			// Most likely the encryption key changed since this account registered
			getLogger().error("Unable to decrypt stored secret for account {}", account.id(), e);
			throw invalidCredentials();
		}

		if (!constantTimeEquals(secret, storedSecret)) {
			getLogger().debug("Login failed for account {}: secret mismatch", account.id());
			throw invalidCredentials();
		}

		getLogger().info("Account {} logged in", account.id());

		return new AccountSession(account.id(), getTokenIssuer().issue(account.id()));
	}

	@NonNull
	public Optional<Account> findAccountById(@Nullable UUID userId) {
		return getAccountStore().findById(userId);
	}

	/**
	 * Decrypts the credentials stored for {@code userId}.
	 * <p>
	 * Callers should use the result for a single outbound call and then drop it.
	 *
	 * @throws DecryptionException if the stored ciphertext cannot be decrypted with the current key
	 */
	@NonNull
	public Optional<ExternalCredentials> getCredentialsForUser(@Nullable UUID userId) {
		Account account = findAccountById(userId).orElse(null);

		if (account == null)
			return Optional.empty();

		String secret = getCredentialCipher().decrypt(account.encryptedSecret());
		return Optional.of(new ExternalCredentials(account.externalIdentity(), secret));
	}

	/**
	 * Runs {@code function} with the decrypted credentials for {@code userId}, keeping the plaintext scoped to that call.
	 */
	@NonNull
	public <T> Optional<T> withCredentials(@Nullable UUID userId,
																				 @NonNull Function<@NonNull ExternalCredentials, T> function) {
		requireNonNull(function);
		return getCredentialsForUser(userId).map(function);
	}

	@NonNull
	private ApplicationException invalidCredentials() {
		return ApplicationException.withStatusCode(401, ErrorCode.INVALID_CREDENTIALS)
				.generalError(INVALID_CREDENTIALS_MESSAGE)
				.build();
	}

	@NonNull
	private Boolean constantTimeEquals(@NonNull String first,
																		 @NonNull String second) {
		requireNonNull(first);
		requireNonNull(second);

		return MessageDigest.isEqual(first.getBytes(StandardCharsets.UTF_8), second.getBytes(StandardCharsets.UTF_8));
	}

	@NonNull
	private AccountStore getAccountStore() {
		return this.accountStore;
	}

	@NonNull
	private CredentialCipher getCredentialCipher() {
		return this.credentialCipher;
	}

	@NonNull
	private TokenIssuer getTokenIssuer() {
		return this.tokenIssuer;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
