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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Frames HTTP/1.0 response heads.
 * <p>
 * Every head carries {@code content-length} and {@code connection: close}, followed by any extra headers verbatim and
 * the terminating blank line. The body is always written as a separate operation after the head.
 */
@ThreadSafe
public final class ResponseFramer {
	@Nonnull
	private static final String HTTP_VERSION = "HTTP/1.0";
	@Nonnull
	private static final byte[] COLON_SPACE = ": ".getBytes(StandardCharsets.US_ASCII);
	@Nonnull
	private static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);
	@Nonnull
	private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

	private ResponseFramer() {
		// Non-instantiable
	}

	/**
	 * Builds the status line and headers for a response.
	 *
	 * @param statusCode    numeric status, for example {@code 206}
	 * @param reasonPhrase  reason phrase, for example {@code Partial}
	 * @param extraHeaders  headers to write after {@code content-length} and {@code connection}, may be {@code null}
	 * @param contentLength number of body bytes that will follow the head
	 * @return the framed head, ending in a blank line
	 */
	@Nonnull
	public static byte[] frameHead(@Nonnull Integer statusCode,
																 @Nonnull String reasonPhrase,
																 @Nullable Map<String, String> extraHeaders,
																 @Nonnull Long contentLength) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);
		requireNonNull(contentLength);

		if (contentLength < 0)
			throw new IllegalArgumentException("Content length cannot be negative");

		ByteArrayOutputStream head = new ByteArrayOutputStream(128);

		head.writeBytes(HTTP_VERSION.getBytes(StandardCharsets.US_ASCII));
		head.writeBytes(SPACE);
		head.writeBytes(Integer.toString(statusCode).getBytes(StandardCharsets.US_ASCII));
		head.writeBytes(SPACE);
		head.writeBytes(reasonPhrase.getBytes(StandardCharsets.ISO_8859_1));
		head.writeBytes(CRLF);

		appendHeader(head, "content-length", Long.toString(contentLength));
		appendHeader(head, "connection", "close");

		if (extraHeaders != null)
			for (Map.Entry<String, String> extraHeader : extraHeaders.entrySet())
				appendHeader(head, extraHeader.getKey(), extraHeader.getValue());

		head.writeBytes(CRLF);

		return head.toByteArray();
	}

	/**
	 * Writes every byte of {@code bytes} to a blocking channel.
	 *
	 * @throws IOException if the channel fails before all bytes are written
	 */
	public static void writeFully(@Nonnull WritableByteChannel channel,
																@Nonnull byte[] bytes) throws IOException {
		requireNonNull(channel);
		requireNonNull(bytes);

		ByteBuffer buffer = ByteBuffer.wrap(bytes);

		while (buffer.hasRemaining())
			channel.write(buffer);
	}

	private static void appendHeader(@Nonnull ByteArrayOutputStream head,
																	 @Nonnull String name,
																	 @Nonnull String value) {
		head.writeBytes(name.getBytes(StandardCharsets.US_ASCII));
		head.writeBytes(COLON_SPACE);
		head.writeBytes(value.getBytes(StandardCharsets.ISO_8859_1));
		head.writeBytes(CRLF);
	}
}
