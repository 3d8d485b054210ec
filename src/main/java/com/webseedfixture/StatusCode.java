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
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Status lines the fixture server is able to write.
 * <p>
 * Reason phrases are the ones transfer clients under test have historically been exercised against,
 * so {@code 206} is "Partial" and {@code 503} is "Internal Error".
 */
public enum StatusCode {
	HTTP_200(200, "OK"),
	HTTP_206(206, "Partial"),
	HTTP_301(301, "Moved Permanently"),
	HTTP_400(400, "Bad Request"),
	HTTP_404(404, "Not Found"),
	HTTP_416(416, "Range Not Satisfiable"),
	HTTP_503(503, "Internal Error");

	@Nonnull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@Nonnull
	private final Integer statusCode;
	@Nonnull
	private final String reasonPhrase;

	StatusCode(@Nonnull Integer statusCode,
						 @Nonnull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	@Nonnull
	public static Optional<StatusCode> fromStatusCode(@Nonnull Integer statusCode) {
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@Nonnull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Nonnull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
