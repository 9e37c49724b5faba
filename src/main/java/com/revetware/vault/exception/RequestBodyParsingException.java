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

package com.revetware.vault.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

/**
 * The request body could not be parsed into the expected request type.
 * <p>
 * The raw body may contain secrets, so it is kept out of the exception message.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class RequestBodyParsingException extends RuntimeException {
	@Nullable
	private final String requestBody;

	public RequestBodyParsingException(@Nullable String requestBody) {
		this(requestBody, null);
	}

	public RequestBodyParsingException(@Nullable String requestBody,
																		 @Nullable Throwable cause) {
		super("Unable to parse request body", cause);
		this.requestBody = requestBody;
	}

	@NonNull
	public Optional<String> getRequestBody() {
		return Optional.ofNullable(this.requestBody);
	}
}
