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

package com.revetware.vault.model.api.request;

import com.google.gson.annotations.SerializedName;
import com.revetware.vault.annotation.SensitiveValue;
import org.jspecify.annotations.Nullable;

import static java.lang.String.format;

/**
 * Request body for {@code POST /api/auth/login}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record AccountAuthenticateRequest(
		@Nullable String username,
		@SerializedName(value = "external_identity", alternate = {"apple_id"}) @Nullable String externalIdentity,
		@SensitiveValue @SerializedName(value = "secret", alternate = {"apple_password"}) @Nullable String secret
) {
	@Override
	public String toString() {
		return format("%s{username=%s, externalIdentity=%s, secret=[REDACTED]}", getClass().getSimpleName(), username(), externalIdentity());
	}
}
