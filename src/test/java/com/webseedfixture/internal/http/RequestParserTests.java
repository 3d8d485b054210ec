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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

@ThreadSafe
public class RequestParserTests {
	private static final int MAXIMUM_REQUEST_SIZE = 10_000;

	private static ParsedRequest parseWhole(String request) {
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
		parser.add(ByteBuffer.wrap(request.getBytes(StandardCharsets.ISO_8859_1)));
		Assertions.assertTrue(parser.parse(), "Request should be complete");
		return parser.request();
	}

	@Test
	public void parses_request_line_and_headers() {
		ParsedRequest request = parseWhole("GET /data.bin HTTP/1.0\r\nRange: bytes=100-199\r\nHost: localhost\r\n\r\n");

		Assertions.assertEquals("get", request.getMethod());
		Assertions.assertEquals("/data.bin", request.getPath());
		Assertions.assertEquals("HTTP/1.0", request.getVersion());
		Assertions.assertEquals("bytes=100-199", request.getHeader("range").orElse(null));
		Assertions.assertEquals("bytes=100-199", request.getHeader("RANGE").orElse(null));
		Assertions.assertEquals(0, request.getBody().length);
	}

	@Test
	public void byte_at_a_time_delivery_parses_identically() {
		String raw = "POST /upload HTTP/1.1\r\nContent-Length: 5\r\nX-Test:  padded  \r\n\r\nhello";
		byte[] bytes = raw.getBytes(StandardCharsets.ISO_8859_1);
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);

		for (int i = 0; i < bytes.length; i++) {
			parser.add(ByteBuffer.wrap(bytes, i, 1));
			boolean complete = parser.parse();
			Assertions.assertEquals(i == bytes.length - 1, complete, "Completion after byte " + i);
		}

		ParsedRequest incremental = parser.request();
		ParsedRequest whole = parseWhole(raw);

		Assertions.assertEquals(whole.getMethod(), incremental.getMethod());
		Assertions.assertEquals(whole.getPath(), incremental.getPath());
		Assertions.assertEquals(whole.getHeaders(), incremental.getHeaders());
		Assertions.assertArrayEquals("hello".getBytes(StandardCharsets.US_ASCII), incremental.getBody());
		Assertions.assertEquals("padded", incremental.getHeader("x-test").orElse(null));
		Assertions.assertEquals(bytes.length, parser.getBytesReceived());
	}

	@Test
	public void bare_line_feeds_are_accepted() {
		ParsedRequest request = parseWhole("GET /test_file HTTP/1.0\nRange: bytes=0-1\n\n");

		Assertions.assertEquals("/test_file", request.getPath());
		Assertions.assertEquals("bytes=0-1", request.getHeader("range").orElse(null));
	}

	@Test
	public void incomplete_request_is_not_done() {
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
		parser.add(ByteBuffer.wrap("GET /test_file HTTP/1.0\r\nHost: x\r\n".getBytes(StandardCharsets.US_ASCII)));

		Assertions.assertFalse(parser.parse());
		Assertions.assertFalse(parser.isComplete());
		Assertions.assertThrows(IllegalStateException.class, parser::request);
	}

	@Test
	public void body_waits_for_content_length_bytes() {
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
		parser.add(ByteBuffer.wrap("POST /x HTTP/1.0\r\nContent-Length: 4\r\n\r\nab".getBytes(StandardCharsets.US_ASCII)));
		Assertions.assertFalse(parser.parse());

		parser.add(ByteBuffer.wrap("cd".getBytes(StandardCharsets.US_ASCII)));
		Assertions.assertTrue(parser.parse());
		Assertions.assertArrayEquals("abcd".getBytes(StandardCharsets.US_ASCII), parser.request().getBody());
	}

	@Test
	public void header_lines_without_colon_are_ignored() {
		ParsedRequest request = parseWhole("GET /a HTTP/1.0\r\nthis is not a header\r\n: no name\r\nAccept: */*\r\n\r\n");

		Assertions.assertEquals(1, request.getHeaders().size());
		Assertions.assertEquals("*/*", request.getHeader("accept").orElse(null));
	}

	@Test
	public void repeated_header_keeps_last_value() {
		ParsedRequest request = parseWhole("GET /a HTTP/1.0\r\nRange: bytes=0-1\r\nrange: bytes=5-9\r\n\r\n");

		Assertions.assertEquals("bytes=5-9", request.getHeader("range").orElse(null));
	}

	@Test
	public void header_value_may_contain_colons() {
		ParsedRequest request = parseWhole("GET /a HTTP/1.0\r\nHost: 127.0.0.1:8080\r\n\r\n");

		Assertions.assertEquals("127.0.0.1:8080", request.getHeader("host").orElse(null));
	}

	@Test
	public void method_is_normalized_to_lowercase() {
		Assertions.assertEquals("post", parseWhole("PoSt /a HTTP/1.0\r\n\r\n").getMethod());
	}

	@Test
	public void leading_blank_lines_are_skipped() {
		Assertions.assertEquals("/a", parseWhole("\r\n\r\nGET /a HTTP/1.0\r\n\r\n").getPath());
	}

	@Test
	public void query_string_stays_in_path() {
		Assertions.assertEquals("/test_file?x=1", parseWhole("GET /test_file?x=1 HTTP/1.0\r\n\r\n").getPath());
	}

	@Test
	public void absolute_form_target_is_reduced_to_path() {
		Assertions.assertEquals("/test_file", RequestParser.pathFromRequestTarget("http://127.0.0.1:8080/test_file"));
		Assertions.assertEquals("/", RequestParser.pathFromRequestTarget("http://127.0.0.1:8080"));
		Assertions.assertEquals("/relative", RequestParser.pathFromRequestTarget("relative"));
		Assertions.assertEquals("/a/b", RequestParser.pathFromRequestTarget("/a/b"));
	}

	@Test
	public void short_request_line_is_malformed() {
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
		parser.add(ByteBuffer.wrap("GET /a\r\n\r\n".getBytes(StandardCharsets.US_ASCII)));

		Assertions.assertThrows(MalformedRequestException.class, parser::parse);
	}

	@Test
	public void non_ascii_request_line_is_malformed() {
		RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
		parser.add(ByteBuffer.wrap(new byte[]{'G', 'E', 'T', ' ', '/', (byte) 0xE9, ' ', 'H', '\r', '\n', '\r', '\n'}));

		Assertions.assertThrows(MalformedRequestException.class, parser::parse);
	}

	@Test
	public void invalid_content_length_is_malformed() {
		for (String contentLength : new String[]{"abc", "-1", "20000"}) {
			RequestParser parser = new RequestParser(MAXIMUM_REQUEST_SIZE);
			parser.add(ByteBuffer.wrap(("POST /a HTTP/1.0\r\nContent-Length: " + contentLength + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII)));

			Assertions.assertThrows(MalformedRequestException.class, parser::parse, contentLength);
		}
	}

	@Test
	public void oversized_request_is_malformed() {
		RequestParser parser = new RequestParser(64);
		String request = "GET /a HTTP/1.0\r\nX-Padding: " + "x".repeat(100) + "\r\n\r\n";

		Assertions.assertThrows(MalformedRequestException.class,
				() -> parser.add(ByteBuffer.wrap(request.getBytes(StandardCharsets.US_ASCII))));
	}

	@Test
	public void maximum_size_must_be_positive() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new RequestParser(0));
	}
}
