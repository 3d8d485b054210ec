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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A response decided by a {@link RequestDispatcher}, ready to be framed and written to the client.
 * <p>
 * {@code content-length} and {@code connection} headers are not part of this representation; they are always written
 * by the framer. Headers listed here are written verbatim, in insertion order, after them.
 */
@ThreadSafe
public class FixtureResponse {
	@Nonnull
	private static final byte[] EMPTY_BODY;

	static {
		EMPTY_BODY = new byte[0];
	}

	@Nonnull
	private final StatusCode statusCode;
	@Nonnull
	private final Map<String, String> headers;
	@Nonnull
	private final byte[] body;

	@Nonnull
	public static Builder withStatusCode(@Nonnull StatusCode statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	protected FixtureResponse(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.body = builder.body == null ? EMPTY_BODY : builder.body;
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, contentLength=%d}", getClass().getSimpleName(),
				getStatusCode().getStatusCode(), getHeaders(), getContentLength());
	}

	@Nonnull
	public Optional<String> getHeader(@Nonnull String name) {
		requireNonNull(name);

		for (Map.Entry<String, String> entry : getHeaders().entrySet())
			if (entry.getKey().equalsIgnoreCase(name))
				return Optional.of(entry.getValue());

		return Optional.empty();
	}

	@Nonnull
	public StatusCode getStatusCode() {
		return this.statusCode;
	}

	@Nonnull
	public Map<String, String> getHeaders() {
		return this.headers;
	}

	@Nonnull
	public byte[] getBody() {
		return this.body.clone();
	}

	@Nonnull
	public Integer getContentLength() {
		return this.body.length;
	}

	// Avoids a copy when writing to the wire
	@Nonnull
	byte[] getBodyWithoutCopying() {
		return this.body;
	}

	/**
	 * Builder used to construct instances of {@link FixtureResponse} via {@link FixtureResponse#withStatusCode(StatusCode)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final StatusCode statusCode;
		@Nonnull
		private final Map<String, String> headers;
		@Nullable
		private byte[] body;

		protected Builder(@Nonnull StatusCode statusCode) {
			requireNonNull(statusCode);

			this.statusCode = statusCode;
			this.headers = new LinkedHashMap<>();
		}

		@Nonnull
		public Builder header(@Nonnull String name,
													@Nonnull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.put(name, value);
			return this;
		}

		@Nonnull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@Nonnull
		public FixtureResponse build() {
			return new FixtureResponse(this);
		}
	}
}
