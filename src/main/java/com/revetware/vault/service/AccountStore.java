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
import com.pyranid.Database;
import com.pyranid.DatabaseException;
import com.revetware.vault.exception.DuplicateUsernameException;
import com.revetware.vault.exception.StorageUnavailableException;
import com.revetware.vault.model.db.Account;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persists {@link Account} rows.
 * <p>
 * Username uniqueness is enforced only by the {@code accounts_username_unique_idx} constraint, which makes
 * concurrent registrations of the same username safe without any application-level locking.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AccountStore {
	@NonNull
	private static final String USERNAME_UNIQUE_CONSTRAINT_NAME;
	@NonNull
	private static final String INTEGRITY_CONSTRAINT_VIOLATION_SQL_STATE_CLASS;

	static {
		USERNAME_UNIQUE_CONSTRAINT_NAME = "ACCOUNTS_USERNAME_UNIQUE_IDX";
		INTEGRITY_CONSTRAINT_VIOLATION_SQL_STATE_CLASS = "23";
	}

	@NonNull
	private final Database database;
	@NonNull
	private final Logger logger;

	@Inject
	public AccountStore(@NonNull Database database) {
		requireNonNull(database);

		this.database = database;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	// A real system would keep its DDL in migration files outside of Java code
	public void initializeSchema() {
		try {
			getDatabase().execute("""
					CREATE TABLE IF NOT EXISTS accounts (
						id UUID PRIMARY KEY,
						username VARCHAR(30) NOT NULL,
						external_identity VARCHAR(320) NOT NULL,
						encrypted_secret VARCHAR(4096) NOT NULL,
						created_at TIMESTAMP DEFAULT NOW() NOT NULL,
						CONSTRAINT accounts_username_unique_idx UNIQUE (username)
					)
					""");
		} catch (DatabaseException e) {
			throw new StorageUnavailableException("Unable to initialize the accounts schema", e);
		}
	}

	/**
	 * Inserts a new account and returns its newly-assigned ID.
	 *
	 * @throws DuplicateUsernameException  if the username is already taken
	 * @throws StorageUnavailableException for any other storage failure
	 */
	@NonNull
	public UUID insert(@NonNull String username,
										 @NonNull String externalIdentity,
										 @NonNull String encryptedSecret) {
		requireNonNull(username);
		requireNonNull(externalIdentity);
		requireNonNull(encryptedSecret);

		UUID id = UUID.randomUUID();

		try {
			getDatabase().execute("""
					INSERT INTO accounts (
						id,
						username,
						external_identity,
						encrypted_secret
					) VALUES (?,?,?,?)
					""", id, username, externalIdentity, encryptedSecret);
		} catch (DatabaseException e) {
			if (isUsernameUniqueConstraintViolation(e))
				throw new DuplicateUsernameException(username, e);

			throw new StorageUnavailableException(format("Unable to insert account for username '%s'", username), e);
		}

		getLogger().debug("Inserted account {} for username '{}'", id, username);

		return id;
	}

	@NonNull
	public Optional<Account> findByUsername(@Nullable String username) {
		if (username == null)
			return Optional.empty();

		try {
			return getDatabase().queryForObject("""
					SELECT *
					FROM accounts
					WHERE username=?
					""", Account.class, username);
		} catch (DatabaseException e) {
			throw new StorageUnavailableException("Unable to look up account by username", e);
		}
	}

	@NonNull
	public Optional<Account> findById(@Nullable UUID id) {
		if (id == null)
			return Optional.empty();

		try {
			return getDatabase().queryForObject("""
					SELECT *
					FROM accounts
					WHERE id=?
					""", Account.class, id);
		} catch (DatabaseException e) {
			throw new StorageUnavailableException("Unable to look up account by ID", e);
		}
	}

	@NonNull
	protected Boolean isUsernameUniqueConstraintViolation(@NonNull DatabaseException databaseException) {
		requireNonNull(databaseException);

		// Prefer the driver's SQL state and constraint name over the wrapper's message text
		Throwable throwable = databaseException;

		while (throwable != null) {
			if (throwable instanceof SQLException sqlException) {
				String sqlState = sqlException.getSQLState();

				if (sqlState != null && sqlState.startsWith(INTEGRITY_CONSTRAINT_VIOLATION_SQL_STATE_CLASS)
						&& mentionsUsernameConstraint(sqlException.getMessage()))
					return true;
			}

			throwable = throwable.getCause() == throwable ? null : throwable.getCause();
		}

		return mentionsUsernameConstraint(databaseException.getMessage());
	}

	@NonNull
	private Boolean mentionsUsernameConstraint(@Nullable String message) {
		return message != null && message.toUpperCase(Locale.ROOT).contains(USERNAME_UNIQUE_CONSTRAINT_NAME);
	}

	@NonNull
	protected Database getDatabase() {
		return this.database;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
