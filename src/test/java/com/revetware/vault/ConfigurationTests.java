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

import com.revetware.vault.util.EncryptionKeyLoader.EncryptionKey;
import com.revetware.vault.util.EnvironmentSecretsManager;
import com.revetware.vault.util.SecretGenerator;
import com.revetware.vault.util.SecretsManager;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ConfigurationTests {
	@Test
	public void testTestEnvironment() {
		Configuration configuration = new Configuration("test", Map.of());

		Assertions.assertEquals("test", configuration.getEnvironment(), "Wrong environment");
		Assertions.assertEquals(Duration.ofHours(1), configuration.getAccessTokenExpiration(), "Wrong token expiration");
		Assertions.assertEquals(SecretsManager.Type.MOCK, configuration.getSecretsManagerType(), "Wrong secrets manager");
		Assertions.assertEquals(Configuration.StorageType.MEMORY, configuration.getStorageType(), "Wrong storage type");
		Assertions.assertEquals(Optional.empty(), configuration.getDatabaseUrl(), "In-memory storage should have no URL");
		Assertions.assertEquals(EncryptionKey.Source.EXTERNAL, configuration.getEncryptionKeySource(), "Wrong key source");
		Assertions.assertFalse(configuration.toString().contains(configuration.getSigningSecret()), "toString() exposes the signing secret");
	}

	@Test
	public void testDatabaseUrlOverride() {
		Configuration configuration = new Configuration("test",
				Map.of(Configuration.DATABASE_URL_VARIABLE_NAME, "jdbc:hsqldb:mem:override"));

		Assertions.assertEquals(Optional.of("jdbc:hsqldb:mem:override"), configuration.getDatabaseUrl(), "Override was ignored");
	}

	@Test
	public void testProductionRequiresExternalSecrets() {
		Assertions.assertThrows(IllegalStateException.class, () -> new Configuration("production", Map.of()));

		// A signing secret alone is not enough
		Assertions.assertThrows(IllegalStateException.class, () -> new Configuration("production",
				Map.of(EnvironmentSecretsManager.SIGNING_SECRET_VARIABLE_NAME, SecretGenerator.generateSigningSecret())));

		Assertions.assertThrows(IllegalStateException.class, () -> new Configuration("production", Map.of(
				EnvironmentSecretsManager.SIGNING_SECRET_VARIABLE_NAME, SecretGenerator.generateSigningSecret(),
				EnvironmentSecretsManager.ENCRYPTION_KEY_VARIABLE_NAME, "not-a-key")));
	}

	@Test
	public void testProductionWithExternalSecrets() {
		String signingSecret = SecretGenerator.generateSigningSecret();

		Configuration configuration = new Configuration("production", Map.of(
				EnvironmentSecretsManager.SIGNING_SECRET_VARIABLE_NAME, signingSecret,
				EnvironmentSecretsManager.ENCRYPTION_KEY_VARIABLE_NAME, SecretGenerator.generateEncryptionKey()));

		Assertions.assertEquals(signingSecret, configuration.getSigningSecret(), "Wrong signing secret");
		Assertions.assertEquals(EncryptionKey.Source.EXTERNAL, configuration.getEncryptionKeySource(), "Wrong key source");
		Assertions.assertEquals(SecretsManager.Type.REAL, configuration.getSecretsManagerType(), "Wrong secrets manager");
		Assertions.assertTrue(configuration.getDatabaseUrl().orElseThrow().startsWith("jdbc:hsqldb:file:"), "Wrong database URL");
	}

	@Test
	public void testUnknownEnvironment() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new Configuration("nonexistent", Map.of()));
	}
}
