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

package com.revetware.vault;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.revetware.vault.mock.MockSecretsManager;
import com.revetware.vault.util.EncryptionKeyLoader;
import com.revetware.vault.util.EncryptionKeyLoader.EncryptionKey;
import com.revetware.vault.util.EnvironmentSecretsManager;
import com.revetware.vault.util.SecretGenerator;
import com.revetware.vault.util.SecretsManager;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates system-wide configuration.
 * <p>
 * Settings come from {@code config/{environment}/settings.json} on the classpath; secrets come from the configured
 * {@link SecretsManager}. When {@code requireExternalSecrets} is set, construction fails unless both the signing
 * secret and the encryption key are supplied externally.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@NonNull
	public static final String DATABASE_URL_VARIABLE_NAME;
	@NonNull
	public static final String PORT_VARIABLE_NAME;
	@NonNull
	private static final String DEFAULT_ENCRYPTION_KEY_FILE;
	@NonNull
	private static final Gson GSON;

	static {
		DATABASE_URL_VARIABLE_NAME = "VAULT_DATABASE_URL";
		PORT_VARIABLE_NAME = "PORT";
		DEFAULT_ENCRYPTION_KEY_FILE = ".encryption_key";
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	@NonNull
	private final String environment;
	@NonNull
	private final Integer port;
	@NonNull
	private final Boolean stopOnKeypress;
	@NonNull
	private final Duration accessTokenExpiration;
	@NonNull
	private final Boolean requireExternalSecrets;
	private final SecretsManager.@NonNull Type secretsManagerType;
	@NonNull
	private final StorageType storageType;
	@Nullable
	private final String databaseUrl;
	@NonNull
	private final SecretsManager secretsManager;
	@NonNull
	private final String signingSecret;
	@NonNull
	private final EncryptionKey encryptionKey;

	public Configuration(@NonNull String environment) {
		this(environment, System.getenv());
	}

	public Configuration(@NonNull String environment,
											 @NonNull Map<@NonNull String, @NonNull String> environmentVariables) {
		requireNonNull(environment);
		requireNonNull(environmentVariables);

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));

		Logger logger = LoggerFactory.getLogger(Configuration.class);
		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.port = determinePort(configFile, environmentVariables);
		this.stopOnKeypress = configFile.stopOnKeypress() == null ? false : configFile.stopOnKeypress();
		this.accessTokenExpiration = Duration.ofSeconds(configFile.accessTokenExpirationInSeconds());
		this.requireExternalSecrets = configFile.requireExternalSecrets() == null ? false : configFile.requireExternalSecrets();
		this.secretsManagerType = configFile.secretsManager().type();
		this.storageType = configFile.storage().type();
		this.databaseUrl = determineDatabaseUrl(configFile, environmentVariables);

		if (this.accessTokenExpiration.isNegative() || this.accessTokenExpiration.isZero())
			throw new IllegalStateException("accessTokenExpirationInSeconds must be positive");

		// Use the appropriate SecretsManager to pull data
		this.secretsManager = this.secretsManagerType == SecretsManager.Type.MOCK
				? new MockSecretsManager(environment)
				: new EnvironmentSecretsManager(environmentVariables);

		String signingSecret = this.secretsManager.getSigningSecret().orElse(null);

		if (signingSecret == null) {
			if (this.requireExternalSecrets)
				throw new IllegalStateException(format("A signing secret is required in the '%s' environment. Set %s.",
						environment, EnvironmentSecretsManager.SIGNING_SECRET_VARIABLE_NAME));

			logger.warn("No signing secret is configured; generated a random one. Sessions will not survive a restart.");
			signingSecret = SecretGenerator.generateSigningSecret();
		}

		this.signingSecret = signingSecret;

		String encryptionKeyFile = trimAggressivelyToNull(configFile.encryptionKeyFile());

		this.encryptionKey = new EncryptionKeyLoader().load(
				this.secretsManager.getEncryptionKey().orElse(null),
				Path.of(encryptionKeyFile == null ? DEFAULT_ENCRYPTION_KEY_FILE : encryptionKeyFile),
				this.requireExternalSecrets);

		logger.debug("Loaded configuration for '{}' environment (encryption key source: {})", environment,
				this.encryptionKey.source().name());
	}

	@NonNull
	private Integer determinePort(@NonNull ConfigFile configFile,
																@NonNull Map<@NonNull String, @NonNull String> environmentVariables) {
		requireNonNull(configFile);
		requireNonNull(environmentVariables);

		String overriddenPort = trimAggressivelyToNull(environmentVariables.get(PORT_VARIABLE_NAME));

		if (overriddenPort == null)
			return configFile.port();

		try {
			return Integer.valueOf(overriddenPort);
		} catch (NumberFormatException e) {
			throw new IllegalStateException(format("%s must be a number, but was '%s'", PORT_VARIABLE_NAME, overriddenPort), e);
		}
	}

	@Nullable
	private String determineDatabaseUrl(@NonNull ConfigFile configFile,
																			@NonNull Map<@NonNull String, @NonNull String> environmentVariables) {
		requireNonNull(configFile);
		requireNonNull(environmentVariables);

		String overriddenDatabaseUrl = trimAggressivelyToNull(environmentVariables.get(DATABASE_URL_VARIABLE_NAME));

		if (overriddenDatabaseUrl != null)
			return overriddenDatabaseUrl;

		if (configFile.storage().type() == StorageType.MEMORY)
			return null;

		String path = trimAggressivelyToNull(configFile.storage().path());

		if (path == null)
			throw new IllegalStateException("storage.path is required for FILE storage");

		return format("jdbc:hsqldb:file:%s;shutdown=true", path);
	}

	@NonNull
	private ConfigFile loadConfigFileForEnvironment(@NonNull String environment) {
		requireNonNull(environment);

		String resourceName = format("config/%s/settings.json", environment);

		try (InputStream inputStream = Configuration.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (inputStream == null)
				throw new IllegalArgumentException(format("Config file not found on classpath at %s", resourceName));

			ConfigFile configFile = GSON.fromJson(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), ConfigFile.class);

			if (configFile == null)
				throw new IllegalArgumentException(format("Config file at %s is empty", resourceName));

			return configFile;
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", resourceName), e);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException(format("Config file at %s is malformed", resourceName), e);
		}
	}

	public enum StorageType {
		MEMORY,
		FILE
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@NonNull Integer port,
			@Nullable Boolean stopOnKeypress,
			@NonNull Integer accessTokenExpirationInSeconds,
			@Nullable Boolean requireExternalSecrets,
			@Nullable String encryptionKeyFile,
			@NonNull ConfigSecretsManager secretsManager,
			@NonNull ConfigStorage storage
	) {
		public ConfigFile {
			requireNonNull(port);
			requireNonNull(accessTokenExpirationInSeconds);
			requireNonNull(secretsManager);
			requireNonNull(storage);
		}

		private record ConfigSecretsManager(
				SecretsManager.@NonNull Type type
		) {
			public ConfigSecretsManager {
				requireNonNull(type);
			}
		}

		private record ConfigStorage(
				@NonNull StorageType type,
				@Nullable String path
		) {
			public ConfigStorage {
				requireNonNull(type);
			}
		}
	}

	@NonNull
	public String getEnvironment() {
		return this.environment;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@NonNull
	public Boolean getStopOnKeypress() {
		return this.stopOnKeypress;
	}

	@NonNull
	public Duration getAccessTokenExpiration() {
		return this.accessTokenExpiration;
	}

	@NonNull
	public Boolean getRequireExternalSecrets() {
		return this.requireExternalSecrets;
	}

	public SecretsManager.@NonNull Type getSecretsManagerType() {
		return this.secretsManagerType;
	}

	@NonNull
	public StorageType getStorageType() {
		return this.storageType;
	}

	/**
	 * The JDBC URL to connect to, or empty for a private in-memory database.
	 */
	@NonNull
	public Optional<String> getDatabaseUrl() {
		return Optional.ofNullable(this.databaseUrl);
	}

	@NonNull
	public SecretsManager getSecretsManager() {
		return this.secretsManager;
	}

	@NonNull
	public String getSigningSecret() {
		return this.signingSecret;
	}

	@NonNull
	public SecretKey getEncryptionKey() {
		return this.encryptionKey.secretKey();
	}

	public EncryptionKey.@NonNull Source getEncryptionKeySource() {
		return this.encryptionKey.source();
	}

	@Override
	public String toString() {
		// Secrets are never included
		return format("%s{environment=%s, port=%d, storageType=%s, encryptionKeySource=%s}", getClass().getSimpleName(),
				getEnvironment(), getPort(), getStorageType().name(), getEncryptionKeySource().name());
	}
}
