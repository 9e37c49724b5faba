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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.revetware.vault.App;
import com.revetware.vault.Configuration;
import com.soklet.HttpMethod;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class HealthResourceTests {
	@Test
	public void testHealth() {
		App app = new App(new Configuration("test", Map.of()));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			MarshaledResponse marshaledResponse = simulator.performRequest(Request.withPath(HttpMethod.GET, "/health").build())
					.getMarshaledResponse();

			JsonObject response = gson.fromJson(new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8), JsonObject.class);

			Assertions.assertEquals(200, marshaledResponse.getStatusCode().intValue(), "Bad status code");
			Assertions.assertEquals("healthy", response.get("status").getAsString(), "Wrong status");
			Assertions.assertNotNull(response.get("timestamp"), "Missing timestamp");
			Assertions.assertEquals(Set.of("application/json;charset=UTF-8"), marshaledResponse.getHeaders().get("Content-Type"), "Wrong content type");
		}));
	}

	@Test
	public void testUnknownRoute() {
		App app = new App(new Configuration("test", Map.of()));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			// Reminder endpoints are not part of the vault
			MarshaledResponse marshaledResponse = simulator.performRequest(Request.withPath(HttpMethod.GET, "/api/reminders").build())
					.getMarshaledResponse();

			JsonObject response = gson.fromJson(new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8), JsonObject.class);

			Assertions.assertEquals(404, marshaledResponse.getStatusCode().intValue(), "Bad status code");
			Assertions.assertEquals("NOT_FOUND", response.get("code").getAsString(), "Wrong error code");
		}));
	}
}
