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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utility methods for normalizing user input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Normalizer {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	/**
	 * Usernames are case-insensitive, so they are stored and looked up in lower case.
	 * <p>
	 * Returns empty if the value is not a valid username after trimming.
	 */
	@NonNull
	public static Optional<String> normalizeUsername(@Nullable String username) {
		username = trimAggressivelyToNull(username);

		if (!Validator.isValidUsername(username))
			return Optional.empty();

		return Optional.of(username.toLowerCase(Locale.ROOT));
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@NonNull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return Optional.of(string);

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return Optional.of(string);
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.length() == 0 ? null : trimmed;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
