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

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.revetware.vault.service.AccountStore;
import com.revetware.vault.util.SecretGenerator;
import com.soklet.ShutdownTrigger;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire system in a single reusable type.
 * <p>
 * Commands: {@code serve} (the default) starts the HTTP server, {@code init-db} validates configuration and migrates
 * the schema, and {@code generate-secrets} prints fresh values for {@code JWT_SECRET_KEY} and {@code ENCRYPTION_KEY}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	public static void main(String[] args) throws Exception {
		String command = args.length == 0 ? "serve" : args[0];

		// Secret generation needs no configuration at all
		if ("generate-secrets".equals(command)) {
			System.out.println("JWT_SECRET_KEY=" + SecretGenerator.generateSigningSecret());
			System.out.println("ENCRYPTION_KEY=" + SecretGenerator.generateEncryptionKey());
			return;
		}

		if (!"serve".equals(command) && !"init-db".equals(command))
			throw new IllegalArgumentException("Unsupported command '" + command + "'. Use 'serve', 'init-db' or 'generate-secrets'.");

		String environment = System.getenv("VAULT_ENVIRONMENT");

		if (environment == null)
			throw new IllegalArgumentException("You must specify the VAULT_ENVIRONMENT environment variable");

		// Constructing the app validates secrets and migrates the schema
		App app = new App(new Configuration(environment));

		if ("init-db".equals(command))
			app.getLogger().info("Database initialized for '{}' environment.", app.getConfiguration().getEnvironment());
		else
			app.startServer();
	}

	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a failing store
		Module module = new AppModule(configuration);

		if (testingModules != null && testingModules.length > 0)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		getInjector().getInstance(AccountStore.class).initializeSchema();
	}

	public void startServer() throws InterruptedException {
		SokletConfig config = getInjector().getInstance(SokletConfig.class);

		try (Soklet soklet = Soklet.fromConfig(config)) {
			soklet.start();

			if (getConfiguration().getStopOnKeypress()) {
				getLogger().debug("Press [enter] to exit");
				soklet.awaitShutdown(ShutdownTrigger.ENTER_KEY);
			} else {
				soklet.awaitShutdown();
			}
		}
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
