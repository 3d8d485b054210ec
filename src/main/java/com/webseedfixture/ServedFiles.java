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

package com.webseedfixture;

import com.webseedfixture.FileLoadException.Reason;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Loads files from a document root fully into memory, fresh for every request.
 * <p>
 * The requested path is handed to the filesystem as-is (not normalized), so a path like {@code relative/../test_file}
 * only resolves if the {@code relative} directory exists. Paths that would escape the document root are treated as not found.
 */
@ThreadSafe
public class ServedFiles {
	/**
	 * Largest file size that can be held in a single array.
	 */
	@Nonnull
	public static final Long MAXIMUM_SUPPORTED_FILE_SIZE_IN_BYTES = (long) Integer.MAX_VALUE - 8;
	@Nonnull
	private static final String GZIP_EXTENSION = ".gz";

	@Nonnull
	private final Path documentRoot;
	@Nonnull
	private final Path normalizedDocumentRoot;
	@Nonnull
	private final Long maximumFileSizeInBytes;

	public ServedFiles(@Nonnull Path documentRoot,
										 @Nonnull Long maximumFileSizeInBytes) {
		requireNonNull(documentRoot);
		requireNonNull(maximumFileSizeInBytes);

		if (maximumFileSizeInBytes < 0)
			throw new IllegalArgumentException("Maximum file size cannot be negative");

		if (maximumFileSizeInBytes > MAXIMUM_SUPPORTED_FILE_SIZE_IN_BYTES)
			throw new IllegalArgumentException(format("Maximum file size cannot exceed %d bytes", MAXIMUM_SUPPORTED_FILE_SIZE_IN_BYTES));

		this.documentRoot = documentRoot;
		this.normalizedDocumentRoot = documentRoot.toAbsolutePath().normalize();
		this.maximumFileSizeInBytes = maximumFileSizeInBytes;
	}

	/**
	 * Reads an entire file.
	 *
	 * @param relativePath path relative to the document root, without a leading {@code /}
	 * @return the file's bytes
	 * @throws FileLoadException if the file is missing, too large or cannot be read
	 */
	@Nonnull
	public byte[] load(@Nonnull String relativePath) {
		requireNonNull(relativePath);

		Path file;

		try {
			file = getDocumentRoot().resolve(relativePath);
		} catch (InvalidPathException e) {
			throw new FileLoadException(Reason.NOT_FOUND, relativePath, format("Invalid path '%s'", relativePath), e);
		}

		if (!file.toAbsolutePath().normalize().startsWith(getNormalizedDocumentRoot()))
			throw new FileLoadException(Reason.NOT_FOUND, relativePath, format("Path '%s' is outside of the document root", relativePath));

		if (Files.isDirectory(file))
			throw new FileLoadException(Reason.NOT_FOUND, relativePath, format("Path '%s' is a directory", relativePath));

		try {
			if (Files.size(file) > getMaximumFileSizeInBytes())
				throw tooLarge(relativePath);

			byte[] bytes = Files.readAllBytes(file);

			// The file may have grown since it was sized
			if (bytes.length > getMaximumFileSizeInBytes())
				throw tooLarge(relativePath);

			return bytes;
		} catch (NoSuchFileException e) {
			throw new FileLoadException(Reason.NOT_FOUND, relativePath, format("No file at '%s'", relativePath), e);
		} catch (IOException e) {
			throw new FileLoadException(Reason.UNREADABLE, relativePath, format("Unable to read '%s'", relativePath), e);
		}
	}

	/**
	 * The {@code Content-Encoding} of a precompressed variant, detected by file naming convention.
	 *
	 * @param path a request path or file name
	 * @return {@code gzip} for {@code .gz} paths, otherwise {@link Optional#empty()}
	 */
	@Nonnull
	public static Optional<String> precompressedContentEncodingFor(@Nonnull String path) {
		requireNonNull(path);
		return path.endsWith(GZIP_EXTENSION) ? Optional.of("gzip") : Optional.empty();
	}

	@Nonnull
	private FileLoadException tooLarge(@Nonnull String relativePath) {
		return new FileLoadException(Reason.TOO_LARGE, relativePath,
				format("File '%s' exceeds maximum size of %d bytes", relativePath, getMaximumFileSizeInBytes()));
	}

	@Nonnull
	public Path getDocumentRoot() {
		return this.documentRoot;
	}

	@Nonnull
	protected Path getNormalizedDocumentRoot() {
		return this.normalizedDocumentRoot;
	}

	@Nonnull
	public Long getMaximumFileSizeInBytes() {
		return this.maximumFileSizeInBytes;
	}
}
