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

import com.webseedfixture.MalformedRangeException.Reason;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An inclusive {@code [start, end]} interval over the bytes of a served file.
 * <p>
 * Instances are acquired by resolving a {@code Range} request header value against a content length via
 * {@link #fromRangeHeaderValue(String, Long)}, which guarantees {@code 0 <= start <= end < contentLength}.
 * <p>
 * Only a single range is supported, either closed ({@code bytes=100-199}) or open-ended ({@code bytes=100-}).
 * Multiple ranges and suffix ranges ({@code bytes=-500}) are rejected as malformed.
 */
@Immutable
public final class ByteRange {
	@Nonnull
	private static final String BYTES_UNIT_PREFIX;
	@Nonnull
	private static final Pattern RANGE_SPEC_PATTERN;

	static {
		BYTES_UNIT_PREFIX = "bytes=";
		RANGE_SPEC_PATTERN = Pattern.compile("^(\\d+)\\s*-\\s*(\\d*)$");
	}

	@Nonnull
	private final Long start;
	@Nonnull
	private final Long end;

	private ByteRange(@Nonnull Long start,
										@Nonnull Long end) {
		requireNonNull(start);
		requireNonNull(end);

		this.start = start;
		this.end = end;
	}

	/**
	 * Parses a {@code Range} header value and validates it against the length of the content it applies to.
	 *
	 * @param rangeHeaderValue the raw header value, for example {@code bytes=100-199}
	 * @param contentLength    total number of bytes in the content
	 * @return the validated range
	 * @throws MalformedRangeException if the value is not a supported range or cannot be satisfied
	 */
	@Nonnull
	public static ByteRange fromRangeHeaderValue(@Nullable String rangeHeaderValue,
																							 @Nonnull Long contentLength) {
		requireNonNull(contentLength);

		if (contentLength < 0)
			throw new IllegalArgumentException(format("Content length cannot be negative (was %d)", contentLength));

		if (rangeHeaderValue == null)
			throw new MalformedRangeException(Reason.MALFORMED_SYNTAX, "Range header value is missing", null);

		String value = rangeHeaderValue.trim();

		if (value.length() < BYTES_UNIT_PREFIX.length() || !value.regionMatches(true, 0, BYTES_UNIT_PREFIX, 0, BYTES_UNIT_PREFIX.length()))
			throw new MalformedRangeException(Reason.MALFORMED_SYNTAX, format("Unsupported range unit in '%s'", rangeHeaderValue), rangeHeaderValue);

		String rangeSpec = value.substring(BYTES_UNIT_PREFIX.length()).trim();

		if (rangeSpec.indexOf(',') >= 0)
			throw new MalformedRangeException(Reason.MALFORMED_SYNTAX, format("Multiple ranges are not supported: '%s'", rangeHeaderValue), rangeHeaderValue);

		Matcher matcher = RANGE_SPEC_PATTERN.matcher(rangeSpec);

		if (!matcher.matches())
			throw new MalformedRangeException(Reason.MALFORMED_SYNTAX, format("Unable to parse range '%s'", rangeHeaderValue), rangeHeaderValue);

		long start;
		long end;

		try {
			start = Long.parseLong(matcher.group(1));
			end = matcher.group(2).isEmpty() ? contentLength - 1 : Long.parseLong(matcher.group(2));
		} catch (NumberFormatException e) {
			// Well-formed digits too large for a long cannot address any byte of the content
			throw new MalformedRangeException(Reason.UNSATISFIABLE,
					format("Range bounds in '%s' exceed the largest supported offset", rangeHeaderValue), rangeHeaderValue, e);
		}

		if (start > end || end >= contentLength)
			throw new MalformedRangeException(Reason.UNSATISFIABLE,
					format("Range '%s' cannot be satisfied for content of length %d", rangeHeaderValue, contentLength), rangeHeaderValue);

		return new ByteRange(start, end);
	}

	/**
	 * The value of a {@code Content-Range} response header describing this range.
	 *
	 * @param contentLength total number of bytes in the content
	 * @return a header value, for example {@code bytes 100-199/1000}
	 */
	@Nonnull
	public String toContentRangeHeaderValue(@Nonnull Long contentLength) {
		requireNonNull(contentLength);
		return format("bytes %d-%d/%d", getStart(), getEnd(), contentLength);
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{start=%d, end=%d}", getClass().getSimpleName(), getStart(), getEnd());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ByteRange byteRange))
			return false;

		return Objects.equals(getStart(), byteRange.getStart())
				&& Objects.equals(getEnd(), byteRange.getEnd());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStart(), getEnd());
	}

	@Nonnull
	public Long getStart() {
		return this.start;
	}

	@Nonnull
	public Long getEnd() {
		return this.end;
	}

	/**
	 * @return number of bytes covered by this range, {@code end - start + 1}
	 */
	@Nonnull
	public Long getLength() {
		return getEnd() - getStart() + 1;
	}
}
