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

package com.revetware.vault.mock;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.revetware.vault.util.SecretsManager;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static com.revetware.vault.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link SecretsManager} which pulls secrets from
 * {@code config/{environment}/mock-secrets.json} on the classpath.
 * <p>
 * Either secret may be omitted from the file.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockSecretsManager implements SecretsManager {
	@NonNull
	private static final Gson GSON;

	static {
		GSON = new Gson();
	}

	@Nullable
	private final String signingSecret;
	@Nullable
	private final String encryptionKey;

	public MockSecretsManager(@NonNull String environment) {
		requireNonNull(environment);

		MockSecretsFile mockSecretsFile = loadMockSecretsFile(environment);

		this.signingSecret = trimAggressivelyToNull(mockSecretsFile.signingSecret());
		this.encryptionKey = trimAggressivelyToNull(mockSecretsFile.encryptionKey());
	}

	@NonNull
	@Override
	public Optional<String> getSigningSecret() {
		return Optional.ofNullable(this.signingSecret);
	}

	@NonNull
	@Override
	public Optional<String> getEncryptionKey() {
		return Optional.ofNullable(this.encryptionKey);
	}

	@NonNull
	private MockSecretsFile loadMockSecretsFile(@NonNull String environment) {
		requireNonNull(environment);

		// Hardcode a path; this is a mock implementation
		String resourceName = format("config/%s/mock-secrets.json", environment);

		try (InputStream inputStream = MockSecretsManager.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (inputStream == null)
				return new MockSecretsFile(null, null);

			MockSecretsFile mockSecretsFile = GSON.fromJson(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), MockSecretsFile.class);
			return mockSecretsFile == null ? new MockSecretsFile(null, null) : mockSecretsFile;
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading mock secrets from %s", resourceName), e);
		} catch (JsonParseException e) {
			throw new IllegalStateException(format("Mock secrets file %s is malformed", resourceName), e);
		}
	}

	// Record that maps to the config/{environment}/mock-secrets.json file format
	private record MockSecretsFile(
			@Nullable String signingSecret,
			@Nullable String encryptionKey
	) {}
}
