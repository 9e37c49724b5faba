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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.pyranid.Database;
import com.pyranid.DefaultStatementLogger;
import com.pyranid.StatementLog;
import com.revetware.vault.annotation.AuthenticationRequired;
import com.revetware.vault.exception.ApplicationException;
import com.revetware.vault.exception.AuthenticationException;
import com.revetware.vault.exception.RequestBodyParsingException;
import com.revetware.vault.http.AuthGate;
import com.revetware.vault.model.api.response.ErrorResponse;
import com.revetware.vault.util.CredentialCipher;
import com.revetware.vault.util.RequestBodyParser;
import com.revetware.vault.util.SecretsManager;
import com.revetware.vault.util.SensitiveValueRedactor;
import com.revetware.vault.util.TokenIssuer;
import com.soklet.HttpMethod;
import com.soklet.LifecycleObserver;
import com.soklet.LogEvent;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.RequestBodyMarshaler;
import com.soklet.RequestInterceptor;
import com.soklet.ResourceMethod;
import com.soklet.Response;
import com.soklet.ResponseMarshaler;
import com.soklet.Server;
import com.soklet.ServerType;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.exception.BadRequestException;
import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Google Guice bindings for the vault, including the Soklet configuration that wires HTTP requests to Resource Methods.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@NonNull
	private final Configuration configuration;

	public AppModule(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@NonNull
	@Provides
	@Singleton
	public SokletConfig provideSokletConfig(@NonNull Injector injector,
																					@NonNull Configuration configuration,
																					@NonNull Database database,
																					@NonNull AuthGate authGate,
																					@NonNull RequestBodyParser requestBodyParser,
																					@NonNull SensitiveValueRedactor sensitiveValueRedactor,
																					@NonNull Gson gson) {
		requireNonNull(injector);
		requireNonNull(configuration);
		requireNonNull(database);
		requireNonNull(authGate);
		requireNonNull(requestBodyParser);
		requireNonNull(sensitiveValueRedactor);
		requireNonNull(gson);

		Logger responseMarshalerLogger = LoggerFactory.getLogger("com.revetware.vault.ResponseMarshaler");

		return SokletConfig.withServer(Server.withPort(configuration.getPort()).build())
				.lifecycleObserver(new LifecycleObserver() {
					@NonNull
					private final Logger logger = LoggerFactory.getLogger("com.revetware.vault.LifecycleObserver");

					@Override
					public void didStartRequestHandling(@NonNull ServerType serverType,
							@NonNull Request request,
																							@Nullable ResourceMethod resourceMethod) {
						if (shouldPerformRequestLogging(request))
							logger.debug("Received {} {}", request.getHttpMethod(), request.getRawPathAndQuery());
					}

					@Override
					public void didFinishRequestHandling(@NonNull ServerType serverType,
							@NonNull Request request,
																							 @Nullable ResourceMethod resourceMethod,
																							 @NonNull MarshaledResponse marshaledResponse,
																							 @NonNull Duration processingDuration,
																							 @NonNull List<Throwable> throwables) {
						if (shouldPerformRequestLogging(request))
							logger.debug(format("Finished processing %s %s (HTTP %d) in %.2fms", request.getHttpMethod(),
									request.getRawPathAndQuery(), marshaledResponse.getStatusCode(), processingDuration.toNanos() / 1000000.0));
					}

					@NonNull
					private Boolean shouldPerformRequestLogging(@NonNull Request request) {
						requireNonNull(request);

						// Special OPTIONS * requests are generally health checks and should not be logged
						return !(request.getHttpMethod() == HttpMethod.OPTIONS && request.getPath().equals("*"));
					}

					@Override
					public void willStartSoklet(@NonNull Soklet soklet) {
						logger.debug("Vault starting in {} environment...", configuration.getEnvironment());
					}

					@Override
					public void didStopSoklet(@NonNull Soklet soklet) {
						logger.debug("Vault stopped.");
					}

					@Override
					public void didStartServer(@NonNull Server server) {
						logger.info("Server started on port {}", configuration.getPort());
					}

					@Override
					public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
						requireNonNull(logEvent);
						logger.warn(logEvent.getMessage(), logEvent.getThrowable().orElse(null));
					}
				})
				.requestInterceptor(new RequestInterceptor() {
					@Override
					public void wrapRequest(@NonNull Request request,
																	@Nullable ResourceMethod resourceMethod,
																	@NonNull Consumer<Request> requestProcessor) {
						requireNonNull(request);
						requireNonNull(requestProcessor);

						// Ensure a "current context" scope exists for all request-handling code
						CurrentContext.withRequest(request, resourceMethod).build().run(() -> {
							requestProcessor.accept(request);
						});
					}

					@Override
					public void interceptRequest(@NonNull ServerType serverType,
							@NonNull Request request,
																			 @Nullable ResourceMethod resourceMethod,
																			 @NonNull Function<Request, MarshaledResponse> responseGenerator,
																			 @NonNull Consumer<MarshaledResponse> responseWriter) {
						requireNonNull(request);
						requireNonNull(responseGenerator);
						requireNonNull(responseWriter);

						UUID userId = null;

						// Only Resource Methods marked @AuthenticationRequired are gated
						if (resourceMethod != null && resourceMethod.getMethod().isAnnotationPresent(AuthenticationRequired.class))
							userId = authGate.authenticate(request.getHeader("Authorization").orElse(null));

						// Create a new current context scope to apply the authenticated user (if present)
						CurrentContext currentContext = CurrentContext.withRequest(request, resourceMethod)
								.userId(userId)
								.build();

						currentContext.run(() -> {
							// Wrap the resource method execution (not including the writing of bytes over the wire) in a database transaction.
							// If an exception occurs during this process, the transaction will roll back.
							MarshaledResponse marshaledResponse = database.transaction(() ->
									Optional.of(responseGenerator.apply(request))
							).get();

							responseWriter.accept(marshaledResponse);
						});
					}
				})
				.requestBodyMarshaler(new RequestBodyMarshaler() {
					@NonNull
					private final Logger logger = LoggerFactory.getLogger("com.revetware.vault.RequestBodyMarshaler");

					@NonNull
					@Override
					public Optional<Object> marshalRequestBody(@NonNull Request request,
																										 @NonNull ResourceMethod resourceMethod,
																										 @NonNull Parameter parameter,
																										 @NonNull Type requestBodyType) {
						requireNonNull(request);
						requireNonNull(parameter);

						String requestBodyAsString = request.getBodyAsString().orElse(null);

						// Log out the request body, taking care to redact any fields marked with the @SensitiveValue annotation
						if (requestBodyAsString != null && logger.isDebugEnabled())
							logger.debug("Request body:\n{}", sensitiveValueRedactor.performRedactions(requestBodyAsString, parameter.getType()));

						// A missing body parses as {} so that validation can report the missing fields
						return Optional.of(requestBodyParser.parse(requestBodyAsString, parameter.getType()));
					}
				})
				.responseMarshaler(ResponseMarshaler.builder()
						.resourceMethodHandler((@NonNull Request request,
																		@NonNull Response response,
																		@NonNull ResourceMethod resourceMethod) -> {
							// Use Gson to turn response objects into JSON to go over the wire
							Object bodyObject = response.getBody().orElse(null);
							byte[] body = (bodyObject == null ? "{}" : gson.toJson(bodyObject)).getBytes(StandardCharsets.UTF_8);

							// Ensure content type header is set
							Map<String, Set<String>> headers = new HashMap<>(response.getHeaders());
							headers.put("Content-Type", Set.of("application/json;charset=UTF-8"));

							return MarshaledResponse.withStatusCode(response.getStatusCode())
									.headers(headers)
									.cookies(response.getCookies())
									.body(body)
									.build();
						})
						.notFoundHandler((@NonNull Request request) -> {
							ErrorResponse errorResponse = ErrorResponse.withError("The resource you requested was not found.", "NOT_FOUND")
									.generalErrors(List.of("The resource you requested was not found."))
									.build();

							byte[] body = gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8);

							Map<String, Set<String>> headers = new HashMap<>();
							headers.put("Content-Type", Set.of("application/json;charset=UTF-8"));

							return MarshaledResponse.withStatusCode(404)
									.headers(headers)
									.body(body)
									.build();
						})
						.throwableHandler((@NonNull Request request,
															 @NonNull Throwable throwable,
															 @Nullable ResourceMethod resourceMethod) -> {
							// Collect error information for display to client
							int statusCode;
							String code;
							List<String> generalErrors = new ArrayList<>();
							Map<String, List<String>> fieldErrors = new LinkedHashMap<>();

							// Unwrap CompletionExceptions
							if (throwable instanceof CompletionException) {
								Throwable cause = throwable.getCause();
								if (cause != null)
									throwable = cause;
							}

							// Request body marshaling failures may arrive wrapped in a BadRequestException
							if (throwable instanceof BadRequestException && throwable.getCause() instanceof RequestBodyParsingException)
								throwable = throwable.getCause();

							if (throwable instanceof ApplicationException applicationException) {
								statusCode = applicationException.getStatusCode();
								code = applicationException.getErrorCode().name();
								generalErrors.addAll(applicationException.getGeneralErrors());
								fieldErrors.putAll(applicationException.getFieldErrors());
								responseMarshalerLogger.debug("{} {} failed with {}", request.getHttpMethod(), request.getPath(), applicationException.getMessage());
							} else if (throwable instanceof AuthenticationException authenticationException) {
								statusCode = 401;
								code = authenticationException.getReason().name();
								generalErrors.add(messageForReason(authenticationException.getReason()));
								responseMarshalerLogger.debug("{} {} was not authenticated: {}", request.getHttpMethod(), request.getPath(),
										authenticationException.getReason().name());
							} else if (throwable instanceof RequestBodyParsingException || throwable instanceof BadRequestException) {
								statusCode = 400;
								code = "MALFORMED_REQUEST";
								generalErrors.add("Your request was improperly formatted.");
								responseMarshalerLogger.debug("{} {} was improperly formatted", request.getHttpMethod(), request.getPath());
							} else {
								// Infrastructure failures are reported to clients generically and logged in detail
								statusCode = 500;
								code = "INTERNAL_ERROR";
								generalErrors.add("An unexpected error occurred.");
								responseMarshalerLogger.error(format("An unexpected error occurred while processing %s %s",
										request.getHttpMethod(), request.getPath()), throwable);
							}

							// Combine all the error messages into one field for easy access by clients
							Set<String> fieldErrorsSummary = new LinkedHashSet<>();

							for (List<String> fieldErrorValues : fieldErrors.values())
								fieldErrorsSummary.addAll(fieldErrorValues);

							String error = format("%s %s",
									generalErrors.stream().collect(Collectors.joining(" ")),
									fieldErrorsSummary.stream().collect(Collectors.joining(" "))
							).trim();

							// Ensure there is always an error message
							if (error.length() == 0)
								error = "An unexpected error occurred.";

							ErrorResponse errorResponse = ErrorResponse.withError(error, code)
									.generalErrors(generalErrors)
									.fieldErrors(fieldErrors)
									.build();

							byte[] body = gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8);

							Map<String, Set<String>> headers = new HashMap<>();
							headers.put("Content-Type", Set.of("application/json;charset=UTF-8"));

							return MarshaledResponse.withStatusCode(statusCode)
									.headers(headers)
									.body(body)
									.build();
						}).build()
				)
				// Use Google Guice when Soklet needs to vend instances
				.instanceProvider(injector::getInstance)
				.build();
	}

	@NonNull
	private static String messageForReason(AuthenticationException.@NonNull Reason reason) {
		requireNonNull(reason);

		if (reason == AuthenticationException.Reason.MISSING_AUTHORIZATION_HEADER)
			return "Authorization header missing";

		if (reason == AuthenticationException.Reason.MALFORMED_AUTHORIZATION_HEADER)
			return "Invalid authorization header format";

		return "Invalid or expired token";
	}

	// What context is bound to the current execution scope?
	@NonNull
	@Provides
	public CurrentContext provideCurrentContext() {
		return CurrentContext.get();
	}

	@NonNull
	@Provides
	@Singleton
	public Clock provideClock() {
		return Clock.systemUTC();
	}

	@NonNull
	@Provides
	@Singleton
	public Database provideDatabase(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		// No configured URL means a private in-memory database, one per application instance
		String databaseUrl = configuration.getDatabaseUrl()
				.orElse(format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(databaseUrl);
		dataSource.setUser("sa");
		dataSource.setPassword("");

		// Use Pyranid to simplify JDBC operations
		return Database.forDataSource(dataSource)
				.statementLogger(new DefaultStatementLogger() {
					@NonNull
					private final Logger logger = LoggerFactory.getLogger("com.revetware.vault.StatementLogger");

					@Override
					public void log(@NonNull StatementLog statementLog) {
						logger.trace("SQL took {}ms:\n{}\nParameters: {}", statementLog.getTotalDuration().toNanos() / 1000000.0,
								statementLog.getStatementContext().getStatement().getSql().stripIndent().trim(),
								statementLog.getStatementContext().getParameters());
					}
				})
				.build();
	}

	@NonNull
	@Provides
	@Singleton
	public SecretsManager provideSecretsManager(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		return configuration.getSecretsManager();
	}

	@NonNull
	@Provides
	@Singleton
	public CredentialCipher provideCredentialCipher(@NonNull Configuration configuration) {
		requireNonNull(configuration);
		return new CredentialCipher(configuration.getEncryptionKey());
	}

	@NonNull
	@Provides
	@Singleton
	public TokenIssuer provideTokenIssuer(@NonNull Configuration configuration,
																				@NonNull Clock clock) {
		requireNonNull(configuration);
		requireNonNull(clock);

		return new TokenIssuer(configuration.getSigningSecret(), configuration.getAccessTokenExpiration(), clock);
	}

	@NonNull
	@Provides
	@Singleton
	public Gson provideGson() {
		return new GsonBuilder()
				.disableHtmlEscaping()
				.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
				// Use ISO formatting for Instants
				.registerTypeAdapter(Instant.class, new TypeAdapter<Instant>() {
					@Override
					public void write(@NonNull JsonWriter jsonWriter,
														@Nullable Instant instant) throws IOException {
						if (instant == null)
							jsonWriter.nullValue();
						else
							jsonWriter.value(instant.toString());
					}

					@Override
					@Nullable
					public Instant read(@NonNull JsonReader jsonReader) throws IOException {
						return Instant.parse(jsonReader.nextString());
					}
				})
				.create();
	}
}
