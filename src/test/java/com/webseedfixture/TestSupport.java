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
import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

final class TestSupport {
	private TestSupport() {}

	static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	static byte[] readAll(InputStream in) throws IOException {
		if (in == null) return new byte[0];
		try (InputStream is = in) {
			ByteArrayOutputStream bos = new ByteArrayOutputStream();
			byte[] buf = new byte[8192];
			int n;
			while ((n = is.read(buf)) != -1) {
				bos.write(buf, 0, n);
			}
			return bos.toByteArray();
		}
	}

	static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	/**
	 * Writes {@code request} in chunks of at most {@code chunkSize} bytes, then reads until the server closes the connection.
	 */
	static byte[] exchange(int port, String request, int chunkSize) throws IOException, InterruptedException {
		try (Socket socket = connectWithRetry("127.0.0.1", port, 2000)) {
			socket.setSoTimeout(5000);
			OutputStream out = socket.getOutputStream();
			byte[] bytes = request.getBytes(StandardCharsets.ISO_8859_1);

			for (int i = 0; i < bytes.length; i += chunkSize) {
				out.write(bytes, i, Math.min(chunkSize, bytes.length - i));
				out.flush();
				if (chunkSize < bytes.length) Thread.sleep(2);
			}

			return readAll(socket.getInputStream());
		}
	}

	static byte[] exchange(int port, String request) throws IOException, InterruptedException {
		return exchange(port, request, Integer.MAX_VALUE);
	}

	/**
	 * A response as seen on the wire by a raw socket client.
	 */
	static final class RawResponse {
		final String statusLine;
		final Map<String, String> headers;
		final byte[] body;

		private RawResponse(String statusLine, Map<String, String> headers, byte[] body) {
			this.statusLine = statusLine;
			this.headers = headers;
			this.body = body;
		}

		static RawResponse parse(byte[] bytes) {
			String text = new String(bytes, StandardCharsets.ISO_8859_1);
			int headEnd = text.indexOf("\r\n\r\n");

			if (headEnd < 0)
				throw new IllegalArgumentException("No response head in: " + text);

			String[] lines = text.substring(0, headEnd).split("\r\n");
			Map<String, String> headers = new LinkedHashMap<>();

			for (int i = 1; i < lines.length; i++) {
				int colon = lines[i].indexOf(':');
				headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ENGLISH), lines[i].substring(colon + 1).trim());
			}

			byte[] body = new byte[bytes.length - headEnd - 4];
			System.arraycopy(bytes, headEnd + 4, body, 0, body.length);

			return new RawResponse(lines[0], Collections.unmodifiableMap(headers), body);
		}

		int statusCode() {
			return Integer.parseInt(statusLine.split(" ")[1]);
		}

		@Nullable
		String header(String name) {
			return headers.get(name.toLowerCase(Locale.ENGLISH));
		}
	}

	/**
	 * Keeps log events in memory instead of writing them out.
	 */
	@ThreadSafe
	static class RecordingLifecycleObserver implements LifecycleObserver {
		final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();

		@Override
		public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
			logEvents.add(logEvent);
		}

		List<LogEventType> logEventTypes() {
			return logEvents.stream().map(LogEvent::getLogEventType).collect(Collectors.toList());
		}
	}
}
