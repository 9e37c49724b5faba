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

package com.revetware.vault.resource;

import com.google.inject.Inject;
import com.revetware.vault.model.api.response.HealthResponse;
import com.soklet.annotation.GET;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;

import static java.util.Objects.requireNonNull;

/**
 * Liveness check for load balancers and orchestration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HealthResource {
	@NonNull
	private final Clock clock;

	@Inject
	public HealthResource(@NonNull Clock clock) {
		requireNonNull(clock);
		this.clock = clock;
	}

	@NonNull
	@GET("/health")
	public HealthResponse health() {
		return new HealthResponse("healthy", getClock().instant());
	}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}
}
