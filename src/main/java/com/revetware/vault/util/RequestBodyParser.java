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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.inject.Inject;
import com.revetware.vault.exception.RequestBodyParsingException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Turns a JSON request body into its typed request record.
 * <p>
 * A missing or blank body is treated as an empty JSON object so that field-level validation can report
 * what is missing.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestBodyParser {
	@NonNull
	private final Gson gson;

	@Inject
	public RequestBodyParser(@NonNull Gson gson) {
		requireNonNull(gson);
		this.gson = gson;
	}

	@NonNull
	public <T> T parse(@Nullable String requestBody,
										 @NonNull Class<T> requestBodyType) {
		requireNonNull(requestBodyType);

		String json = requestBody == null || requestBody.isBlank() ? "{}" : requestBody;
		T parsed;

		try {
			parsed = getGson().fromJson(json, requestBodyType);
		} catch (JsonParseException | IllegalStateException | ClassCastException e) {
			throw new RequestBodyParsingException(requestBody, e);
		}

		// Literal "null" bodies parse to null
		if (parsed == null)
			throw new RequestBodyParsingException(requestBody);

		return parsed;
	}

	@NonNull
	protected Gson getGson() {
		return this.gson;
	}
}
