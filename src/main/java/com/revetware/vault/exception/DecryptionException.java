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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A stored ciphertext could not be decrypted: it is malformed, was produced under another key, or was tampered with.
 * <p>
 * The message never includes the ciphertext itself.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class DecryptionException extends RuntimeException {
	public DecryptionException(@Nullable String message) {
		super(message);
	}

	public DecryptionException(@Nullable String message,
														 @Nullable Throwable cause) {
		super(message, cause);
	}
}
