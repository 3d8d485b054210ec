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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@ThreadSafe
public class ResponseFramerTests {
	@Test
	public void head_has_fixed_header_order() {
		Map<String, String> extraHeaders = new LinkedHashMap<>();
		extraHeaders.put("Content-Range", "bytes 100-199/1000");
		extraHeaders.put("Content-Encoding", "gzip");

		byte[] head = ResponseFramer.frameHead(206, "Partial", extraHeaders, 100L);

		Assertions.assertEquals("HTTP/1.0 206 Partial\r\n"
				+ "content-length: 100\r\n"
				+ "connection: close\r\n"
				+ "Content-Range: bytes 100-199/1000\r\n"
				+ "Content-Encoding: gzip\r\n"
				+ "\r\n", new String(head, StandardCharsets.US_ASCII));
	}

	@Test
	public void head_without_extra_headers() {
		Assertions.assertEquals("HTTP/1.0 404 Not Found\r\ncontent-length: 0\r\nconnection: close\r\n\r\n",
				new String(ResponseFramer.frameHead(404, "Not Found", null, 0L), StandardCharsets.US_ASCII));
	}

	@Test
	public void negative_content_length_is_rejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ResponseFramer.frameHead(200, "OK", Map.of(), -1L));
	}

	@Test
	public void write_fully_survives_short_writes() throws IOException {
		ByteArrayOutputStream sink = new ByteArrayOutputStream();
		WritableByteChannel target = Channels.newChannel(sink);

		// Accepts at most 3 bytes per call
		WritableByteChannel trickleChannel = new WritableByteChannel() {
			@Override
			public int write(ByteBuffer source) throws IOException {
				int length = Math.min(3, source.remaining());
				ByteBuffer slice = source.slice();
				slice.limit(length);
				target.write(slice);
				source.position(source.position() + length);
				return length;
			}

			@Override
			public boolean isOpen() {
				return true;
			}

			@Override
			public void close() {
				// Nothing to release
			}
		};

		byte[] payload = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
		ResponseFramer.writeFully(trickleChannel, payload);

		Assertions.assertArrayEquals(payload, sink.toByteArray());
	}
}
