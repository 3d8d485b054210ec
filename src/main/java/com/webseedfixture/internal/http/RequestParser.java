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

package com.webseedfixture.internal.http;

import com.webseedfixture.ParsedRequest;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.function.BiConsumer;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Incremental HTTP/1.0 request parser.
 * <p>
 * Bytes are fed in whatever chunks the transport delivers them via {@link #add(ByteBuffer)}, and {@link #parse()} is
 * invoked after each chunk. It returns {@code false} while more bytes are needed, {@code true} once the request line,
 * all headers and any {@code content-length} body have arrived, and throws {@link MalformedRequestException} if the
 * bytes can never form a request. The parser never blocks.
 * <p>
 * One instance parses exactly one request.
 */
@NotThreadSafe
public class RequestParser {
	@Nonnull
	private static final String HEADER_CONTENT_LENGTH = "content-length";
	@Nonnull
	private static final byte[] EMPTY_BODY = new byte[0];

	enum State {
		REQUEST_LINE(p -> p.tokenizer.nextLine(), RequestParser::parseRequestLine),
		HEADER(p -> p.tokenizer.nextLine(), RequestParser::parseHeader),
		BODY(p -> p.tokenizer.next(p.contentLength), RequestParser::parseBody),
		DONE(null, null);

		final Function<RequestParser, byte[]> tokenSupplier;
		final BiConsumer<RequestParser, byte[]> tokenConsumer;

		State(Function<RequestParser, byte[]> tokenSupplier, BiConsumer<RequestParser, byte[]> tokenConsumer) {
			this.tokenSupplier = tokenSupplier;
			this.tokenConsumer = tokenConsumer;
		}
	}

	@Nonnull
	private final ByteTokenizer tokenizer;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;

	@Nonnull
	private State state = State.REQUEST_LINE;
	private int contentLength;
	@Nullable
	private ParsedRequest.Builder requestBuilder;
	@Nullable
	private ParsedRequest request;

	public RequestParser(@Nonnull Integer maximumRequestSizeInBytes) {
		requireNonNull(maximumRequestSizeInBytes);

		if (maximumRequestSizeInBytes <= 0)
			throw new IllegalArgumentException("Maximum request size must be > 0");

		this.tokenizer = new ByteTokenizer();
		this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
	}

	/**
	 * Appends the readable bytes of {@code buffer} to the accumulation buffer, consuming them.
	 *
	 * @param buffer bytes that just arrived
	 * @throws MalformedRequestException if the accumulated request is larger than permitted
	 */
	public void add(@Nonnull ByteBuffer buffer) {
		requireNonNull(buffer);

		tokenizer.add(buffer);

		if (state != State.DONE && tokenizer.size() > getMaximumRequestSizeInBytes())
			throw new MalformedRequestException(format("Request exceeds maximum size of %d bytes", getMaximumRequestSizeInBytes()));
	}

	/**
	 * Consumes as much of the accumulated input as possible.
	 *
	 * @return {@code true} if a complete request is now available via {@link #request()}
	 * @throws MalformedRequestException if the input can never form a valid request
	 */
	public boolean parse() {
		while (state != State.DONE) {
			byte[] token = state.tokenSupplier.apply(this);

			if (token == null)
				return false;

			state.tokenConsumer.accept(this, token);
		}

		return true;
	}

	@Nonnull
	public ParsedRequest request() {
		if (request == null)
			throw new IllegalStateException("Request has not been completely parsed");

		return request;
	}

	@Nonnull
	public Boolean isComplete() {
		return state == State.DONE;
	}

	/**
	 * @return the number of bytes handed to {@link #add(ByteBuffer)} so far
	 */
	@Nonnull
	public Integer getBytesReceived() {
		return tokenizer.size();
	}

	private void parseRequestLine(@Nonnull byte[] token) {
		// Tolerate stray line breaks ahead of the request line
		if (token.length == 0)
			return;

		requireAscii(token, "request line");

		String requestLine = new String(token, StandardCharsets.US_ASCII).trim();
		String[] components = requestLine.split("[ \t]+");

		if (components.length < 3)
			throw new MalformedRequestException(format("Malformed request line '%s'", requestLine));

		requestBuilder = ParsedRequest.withMethodAndPath(components[0].toLowerCase(ENGLISH), pathFromRequestTarget(components[1]))
				.version(components[2]);

		state = State.HEADER;
	}

	private void parseHeader(@Nonnull byte[] token) {
		if (token.length == 0) { // Empty line, end of headers
			finishHeaders();
			return;
		}

		int colonIndex = indexOfColon(token);

		// Lines without a name/value separator are skipped rather than failing the request
		if (colonIndex < 0)
			return;

		String name = new String(token, 0, colonIndex, StandardCharsets.ISO_8859_1).trim();

		if (name.isEmpty())
			return;

		String value = new String(token, colonIndex + 1, token.length - colonIndex - 1, StandardCharsets.ISO_8859_1).trim();
		requestBuilder().header(name, value);
	}

	private void finishHeaders() {
		ParsedRequest headersOnly = requestBuilder().build();
		String contentLengthValue = headersOnly.getHeader(HEADER_CONTENT_LENGTH).orElse(null);

		if (contentLengthValue == null) {
			complete(EMPTY_BODY);
			return;
		}

		try {
			contentLength = Integer.parseInt(contentLengthValue);
		} catch (NumberFormatException e) {
			throw new MalformedRequestException(format("Invalid content-length '%s'", contentLengthValue), e);
		}

		if (contentLength < 0)
			throw new MalformedRequestException(format("Invalid content-length '%s'", contentLengthValue));

		if (contentLength > getMaximumRequestSizeInBytes())
			throw new MalformedRequestException(format("Content-length %d exceeds maximum request size of %d bytes", contentLength, getMaximumRequestSizeInBytes()));

		if (contentLength == 0)
			complete(EMPTY_BODY);
		else
			state = State.BODY;
	}

	private void parseBody(@Nonnull byte[] token) {
		complete(token);
	}

	private void complete(@Nonnull byte[] body) {
		request = requestBuilder().body(body).build();
		state = State.DONE;
	}

	@Nonnull
	private ParsedRequest.Builder requestBuilder() {
		if (requestBuilder == null)
			throw new IllegalStateException("Request line has not been parsed");

		return requestBuilder;
	}

	/**
	 * Reduces an absolute-form target like {@code http://host:8080/file} to its path, and guarantees a leading {@code /}.
	 */
	@Nonnull
	static String pathFromRequestTarget(@Nonnull String requestTarget) {
		requireNonNull(requestTarget);

		String path = requestTarget;
		int schemeSeparatorIndex = path.indexOf("://");

		if (schemeSeparatorIndex > 0 && path.indexOf('/') > schemeSeparatorIndex) {
			int pathIndex = path.indexOf('/', schemeSeparatorIndex + 3);
			path = pathIndex < 0 ? "/" : path.substring(pathIndex);
		}

		return path.startsWith("/") ? path : "/" + path;
	}

	private static int indexOfColon(@Nonnull byte[] line) {
		for (int i = 0; i < line.length; i++)
			if (line[i] == ':')
				return i;

		return -1;
	}

	private static void requireAscii(@Nonnull byte[] token,
																	 @Nonnull String field) {
		for (byte b : token)
			if ((b & 0x80) != 0)
				throw new MalformedRequestException("Non-ASCII " + field);
	}

	@Nonnull
	private Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}
}
