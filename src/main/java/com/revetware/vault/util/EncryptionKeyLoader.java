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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decides which 256-bit key protects stored credentials for the lifetime of this process.
 * <p>
 * Order of precedence:
 * <ol>
 *   <li>An externally supplied key (environment variable or secrets file)</li>
 *   <li>An existing key file</li>
 *   <li>A freshly generated key, persisted to the key file with owner-only permissions</li>
 *   <li>If persisting fails, the generated key is kept in memory only</li>
 * </ol>
 * A present but malformed key always fails. An existing key file is never overwritten.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EncryptionKeyLoader {
	@NonNull
	private static final Set<PosixFilePermission> OWNER_ONLY_PERMISSIONS;

	static {
		OWNER_ONLY_PERMISSIONS = PosixFilePermissions.fromString("rw-------");
	}

	@NonNull
	private final Logger logger;

	public EncryptionKeyLoader() {
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@NonNull
	public EncryptionKey load(@Nullable String externalKey,
														@Nullable Path keyFile,
														@NonNull Boolean externalKeyRequired) {
		requireNonNull(externalKeyRequired);

		String trimmedExternalKey = Normalizer.trimAggressivelyToNull(externalKey);

		if (trimmedExternalKey != null) {
			try {
				return new EncryptionKey(CredentialCipher.decodeKey(trimmedExternalKey), EncryptionKey.Source.EXTERNAL);
			} catch (IllegalArgumentException e) {
				throw new IllegalStateException("The externally supplied encryption key is malformed", e);
			}
		}

		if (externalKeyRequired)
			throw new IllegalStateException("An externally supplied encryption key is required in this environment, but none was provided");

		if (keyFile == null)
			throw new IllegalStateException("No encryption key was supplied and no key file is configured");

		if (Files.exists(keyFile))
			return new EncryptionKey(readKeyFile(keyFile), EncryptionKey.Source.KEY_FILE);

		String encodedKey = SecretGenerator.generateEncryptionKey();
		SecretKey secretKey = CredentialCipher.decodeKey(encodedKey);

		try {
			writeKeyFile(keyFile, encodedKey);
			getLogger().info("Generated a new encryption key and saved it to {}", keyFile.toAbsolutePath());
			return new EncryptionKey(secretKey, EncryptionKey.Source.GENERATED);
		} catch (FileAlreadyExistsException e) {
			// Another process created the key file first; its key wins
			if (Files.isRegularFile(keyFile))
				return new EncryptionKey(readKeyFile(keyFile), EncryptionKey.Source.KEY_FILE);

			return ephemeralKey(secretKey, keyFile, e);
		} catch (IOException | UnsupportedOperationException | SecurityException e) {
			return ephemeralKey(secretKey, keyFile, e);
		}
	}

	@NonNull
	private EncryptionKey ephemeralKey(@NonNull SecretKey secretKey,
																		 @NonNull Path keyFile,
																		 @NonNull Exception cause) {
		requireNonNull(secretKey);
		requireNonNull(keyFile);
		requireNonNull(cause);

		getLogger().warn("Unable to save generated encryption key to {}. Credentials stored by this process "
				+ "will be unreadable after a restart unless ENCRYPTION_KEY is set.", keyFile.toAbsolutePath(), cause);

		return new EncryptionKey(secretKey, EncryptionKey.Source.EPHEMERAL);
	}

	@NonNull
	private SecretKey readKeyFile(@NonNull Path keyFile) {
		requireNonNull(keyFile);

		String contents;

		try {
			contents = Files.readString(keyFile, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read encryption key file at %s", keyFile.toAbsolutePath()), e);
		}

		try {
			return CredentialCipher.decodeKey(contents);
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(format("Encryption key file at %s is malformed", keyFile.toAbsolutePath()), e);
		}
	}

	private void writeKeyFile(@NonNull Path keyFile,
														@NonNull String encodedKey) throws IOException {
		requireNonNull(keyFile);
		requireNonNull(encodedKey);

		Path parent = keyFile.toAbsolutePath().getParent();

		if (parent != null)
			Files.createDirectories(parent);

		// CREATE_NEW refuses to clobber a file that appeared after our existence check
		Files.writeString(keyFile, encodedKey, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);

		if (Files.getFileStore(keyFile).supportsFileAttributeView("posix"))
			Files.setPosixFilePermissions(keyFile, OWNER_ONLY_PERMISSIONS);
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * The loaded key and where it came from.
	 */
	public record EncryptionKey(
			@NonNull SecretKey secretKey,
			@NonNull Source source
	) {
		public EncryptionKey {
			requireNonNull(secretKey);
			requireNonNull(source);
		}

		public enum Source {
			EXTERNAL,
			KEY_FILE,
			GENERATED,
			EPHEMERAL
		}

		@Override
		public String toString() {
			return format("%s{source=%s}", getClass().getSimpleName(), source().name());
		}
	}
}
