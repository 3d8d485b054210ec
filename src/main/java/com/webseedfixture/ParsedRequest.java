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
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * A completely-received HTTP request head, plus any {@code content-length} delimited body.
 * <p>
 * Method and header names are lower-cased. The path always begins with {@code /}.
 * If a header is repeated, the last value wins.
 */
@ThreadSafe
public class ParsedRequest {
	@Nonnull
	private static final byte[] EMPTY_BODY;

	static {
		EMPTY_BODY = new byte[0];
	}

	@Nonnull
	private final String method;
	@Nonnull
	private final String path;
	@Nonnull
	private final String version;
	@Nonnull
	private final Map<String, String> headers;
	@Nonnull
	private final byte[] body;

	@Nonnull
	public static Builder withMethodAndPath(@Nonnull String method,
																					@Nonnull String path) {
		requireNonNull(method);
		requireNonNull(path);

		return new Builder(method, path);
	}

	protected ParsedRequest(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.method = builder.method.toLowerCase(ENGLISH);
		this.path = builder.path.startsWith("/") ? builder.path : "/" + builder.path;
		this.version = builder.version == null ? "HTTP/1.0" : builder.version;

		Map<String, String> headers = new LinkedHashMap<>(builder.headers.size());

		for (Map.Entry<String, String> entry : builder.headers.entrySet())
			headers.put(entry.getKey().toLowerCase(ENGLISH), entry.getValue());

		this.headers = Collections.unmodifiableMap(headers);
		this.body = builder.body == null ? EMPTY_BODY : builder.body.clone();
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{method=%s, path=%s, version=%s, headers=%s, bodyLength=%d}", getClass().getSimpleName(),
				getMethod(), getPath(), getVersion(), getHeaders(), this.body.length);
	}

	/**
	 * Case-insensitive header lookup.
	 *
	 * @param name the header name
	 * @return the header value, or {@link Optional#empty()} if the header was not sent
	 */
	@Nonnull
	public Optional<String> getHeader(@Nonnull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getHeaders().get(name.toLowerCase(ENGLISH)));
	}

	@Nonnull
	public String getMethod() {
		return this.method;
	}

	@Nonnull
	public String getPath() {
		return this.path;
	}

	@Nonnull
	public String getVersion() {
		return this.version;
	}

	@Nonnull
	public Map<String, String> getHeaders() {
		return this.headers;
	}

	@Nonnull
	public byte[] getBody() {
		return this.body.clone();
	}

	/**
	 * Builder used to construct instances of {@link ParsedRequest} via {@link ParsedRequest#withMethodAndPath(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final String method;
		@Nonnull
		private final String path;
		@Nullable
		private String version;
		@Nonnull
		private final Map<String, String> headers;
		@Nullable
		private byte[] body;

		protected Builder(@Nonnull String method,
											@Nonnull String path) {
			requireNonNull(method);
			requireNonNull(path);

			this.method = method;
			this.path = path;
			this.headers = new LinkedHashMap<>();
		}

		@Nonnull
		public Builder version(@Nullable String version) {
			this.version = version;
			return this;
		}

		@Nonnull
		public Builder header(@Nonnull String name,
													@Nonnull String value) {
			requireNonNull(name);
			requireNonNull(value);

			this.headers.put(name.toLowerCase(ENGLISH), value);
			return this;
		}

		@Nonnull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@Nonnull
		public ParsedRequest build() {
			return new ParsedRequest(this);
		}
	}
}
