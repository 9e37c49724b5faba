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

package com.revetware.vault.util;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;

import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static java.util.Objects.requireNonNull;

/**
 * Reads secrets from {@code JWT_SECRET_KEY} and {@code ENCRYPTION_KEY} environment variables.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EnvironmentSecretsManager implements SecretsManager {
	@NonNull
	public static final String SIGNING_SECRET_VARIABLE_NAME;
	@NonNull
	public static final String ENCRYPTION_KEY_VARIABLE_NAME;

	static {
		SIGNING_SECRET_VARIABLE_NAME = "JWT_SECRET_KEY";
		ENCRYPTION_KEY_VARIABLE_NAME = "ENCRYPTION_KEY";
	}

	@NonNull
	private final Map<@NonNull String, @NonNull String> environmentVariables;

	public EnvironmentSecretsManager() {
		this(System.getenv());
	}

	public EnvironmentSecretsManager(@NonNull Map<@NonNull String, @NonNull String> environmentVariables) {
		requireNonNull(environmentVariables);
		this.environmentVariables = Map.copyOf(environmentVariables);
	}

	@NonNull
	@Override
	public Optional<String> getSigningSecret() {
		return Optional.ofNullable(trimAggressivelyToNull(getEnvironmentVariables().get(SIGNING_SECRET_VARIABLE_NAME)));
	}

	@NonNull
	@Override
	public Optional<String> getEncryptionKey() {
		return Optional.ofNullable(trimAggressivelyToNull(getEnvironmentVariables().get(ENCRYPTION_KEY_VARIABLE_NAME)));
	}

	@NonNull
	private Map<@NonNull String, @NonNull String> getEnvironmentVariables() {
		return this.environmentVariables;
	}
}
