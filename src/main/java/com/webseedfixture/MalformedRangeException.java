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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a {@code Range} request header value cannot be resolved to a {@link ByteRange}.
 */
@NotThreadSafe
public class MalformedRangeException extends RuntimeException {
	@Nonnull
	private final Reason reason;
	@Nullable
	private final String rangeHeaderValue;

	public MalformedRangeException(@Nonnull Reason reason,
																 @Nullable String message,
																 @Nullable String rangeHeaderValue) {
		super(message);
		this.reason = requireNonNull(reason);
		this.rangeHeaderValue = rangeHeaderValue;
	}

	public MalformedRangeException(@Nonnull Reason reason,
																 @Nullable String message,
																 @Nullable String rangeHeaderValue,
																 @Nullable Throwable cause) {
		super(message, cause);
		this.reason = requireNonNull(reason);
		this.rangeHeaderValue = rangeHeaderValue;
	}

	@Nonnull
	public Reason getReason() {
		return this.reason;
	}

	@Nonnull
	public Optional<String> getRangeHeaderValue() {
		return Optional.ofNullable(this.rangeHeaderValue);
	}

	/**
	 * Why a range could not be resolved.
	 */
	public enum Reason {
		/**
		 * The header value is not a single {@code bytes=<start>-<end>} or {@code bytes=<start>-} range.
		 */
		MALFORMED_SYNTAX,
		/**
		 * The range is well-formed but falls outside the content or has {@code start > end}.
		 */
		UNSATISFIABLE
	}
}
