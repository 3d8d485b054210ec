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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown by {@link ServedFiles} when a requested file cannot be served.
 */
@NotThreadSafe
public class FileLoadException extends RuntimeException {
	@Nonnull
	private final Reason reason;
	@Nonnull
	private final String requestedPath;

	public FileLoadException(@Nonnull Reason reason,
													 @Nonnull String requestedPath,
													 @Nullable String message) {
		super(message);
		this.reason = requireNonNull(reason);
		this.requestedPath = requireNonNull(requestedPath);
	}

	public FileLoadException(@Nonnull Reason reason,
													 @Nonnull String requestedPath,
													 @Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);
		this.reason = requireNonNull(reason);
		this.requestedPath = requireNonNull(requestedPath);
	}

	@Nonnull
	public Reason getReason() {
		return this.reason;
	}

	@Nonnull
	public String getRequestedPath() {
		return this.requestedPath;
	}

	public enum Reason {
		NOT_FOUND,
		TOO_LARGE,
		UNREADABLE
	}
}
