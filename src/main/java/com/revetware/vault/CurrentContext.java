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

import com.soklet.Request;
import com.soklet.ResourceMethod;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.MDC;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of context: which request and which authenticated user is applied to the current thread of execution?
 * <p>
 * Contexts nest. {@link #run(Supplier)} binds this context for the duration of the call and then restores whatever
 * was bound before, including the logging MDC.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CurrentContext {
	@NonNull
	private static final ThreadLocal<CurrentContext> CURRENT_CONTEXT_THREAD_LOCAL;
	@NonNull
	private static final String MDC_KEY;

	static {
		CURRENT_CONTEXT_THREAD_LOCAL = new ThreadLocal<>();
		MDC_KEY = "CURRENT_CONTEXT";
	}

	@NonNull
	public static CurrentContext get() {
		CurrentContext currentContext = CURRENT_CONTEXT_THREAD_LOCAL.get();

		if (currentContext == null)
			throw new IllegalStateException(format("No %s is bound to the current thread", CurrentContext.class.getSimpleName()));

		return currentContext;
	}

	@NonNull
	public static Optional<CurrentContext> find() {
		return Optional.ofNullable(CURRENT_CONTEXT_THREAD_LOCAL.get());
	}

	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Request request;
		@Nullable
		private ResourceMethod resourceMethod;
		@Nullable
		private UUID userId;

		private Builder() {}

		@NonNull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@NonNull
		public Builder resourceMethod(@Nullable ResourceMethod resourceMethod) {
			this.resourceMethod = resourceMethod;
			return this;
		}

		@NonNull
		public Builder userId(@Nullable UUID userId) {
			this.userId = userId;
			return this;
		}

		@NonNull
		public CurrentContext build() {
			return new CurrentContext(this);
		}
	}

	@NonNull
	public static Builder withRequest(@Nullable Request request,
																		@Nullable ResourceMethod resourceMethod) {
		return new Builder().request(request).resourceMethod(resourceMethod);
	}

	@Nullable
	private final Request request;
	@Nullable
	private final ResourceMethod resourceMethod;
	@Nullable
	private final UUID userId;

	private CurrentContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.request = builder.request;
		this.resourceMethod = builder.resourceMethod;
		this.userId = builder.userId;
	}

	public void run(@NonNull Runnable runnable) {
		requireNonNull(runnable);
		run(() -> {
			runnable.run();
			return null;
		});
	}

	@Nullable
	public <T> T run(@NonNull Supplier<T> supplier) {
		requireNonNull(supplier);

		// Capture the previous binding and MDC value to restore them later
		CurrentContext previousContext = CURRENT_CONTEXT_THREAD_LOCAL.get();
		String previousMdc = MDC.get(MDC_KEY);

		CURRENT_CONTEXT_THREAD_LOCAL.set(this);

		try {
			MDC.put(MDC_KEY, determineLoggingDescription());
			return supplier.get();
		} finally {
			if (previousContext != null)
				CURRENT_CONTEXT_THREAD_LOCAL.set(previousContext);
			else
				CURRENT_CONTEXT_THREAD_LOCAL.remove();

			// Restore previous logging context (or clear if we were at the root)
			if (previousMdc != null)
				MDC.put(MDC_KEY, previousMdc);
			else
				MDC.remove(MDC_KEY);
		}
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", format("%s{", CurrentContext.class.getSimpleName()), "}");

		getUserId().ifPresent(userId -> joiner.add(format("userId=%s", userId)));
		getRequest().ifPresent(request -> joiner.add(format("request=%s %s", request.getHttpMethod().name(), request.getRawPathAndQuery())));

		return joiner.toString();
	}

	@NonNull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	@NonNull
	public Optional<ResourceMethod> getResourceMethod() {
		return Optional.ofNullable(this.resourceMethod);
	}

	@NonNull
	public Optional<UUID> getUserId() {
		return Optional.ofNullable(this.userId);
	}

	@NonNull
	private String determineLoggingDescription() {
		Request request = getRequest().orElse(null);
		UUID userId = getUserId().orElse(null);

		String requestDescription = request == null ? "background thread" : request.getId().toString();
		String userDescription = userId == null ? "unauthenticated" : userId.toString();

		return format("%s (%s)", requestDescription, userDescription);
	}
}
