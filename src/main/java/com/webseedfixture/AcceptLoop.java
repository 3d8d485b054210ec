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

import com.webseedfixture.internal.http.MalformedRequestException;
import com.webseedfixture.internal.http.RequestParser;
import com.webseedfixture.internal.http.ResponseFramer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Body of a fixture server's accept loop thread: accept, read, parse, dispatch, write, close, repeat.
 * <p>
 * Connections are served strictly in accept order.  A single read buffer is reused across all of them.
 */
@NotThreadSafe
final class AcceptLoop {
	@Nonnull
	private final ServerSocketChannel serverSocketChannel;
	@Nonnull
	private final RequestDispatcher requestDispatcher;
	@Nonnull
	private final LifecycleObserver lifecycleObserver;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;
	@Nonnull
	private final Duration socketReadTimeout;
	@Nonnull
	private final ByteBuffer readBuffer;

	AcceptLoop(@Nonnull ServerSocketChannel serverSocketChannel,
						 @Nonnull RequestDispatcher requestDispatcher,
						 @Nonnull LifecycleObserver lifecycleObserver,
						 @Nonnull Integer maximumRequestSizeInBytes,
						 @Nonnull Integer socketReadBufferSizeInBytes,
						 @Nonnull Duration socketReadTimeout) {
		requireNonNull(serverSocketChannel);
		requireNonNull(requestDispatcher);
		requireNonNull(lifecycleObserver);
		requireNonNull(maximumRequestSizeInBytes);
		requireNonNull(socketReadBufferSizeInBytes);
		requireNonNull(socketReadTimeout);

		this.serverSocketChannel = serverSocketChannel;
		this.requestDispatcher = requestDispatcher;
		this.lifecycleObserver = lifecycleObserver;
		this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
		this.socketReadTimeout = socketReadTimeout;
		this.readBuffer = ByteBuffer.allocate(socketReadBufferSizeInBytes);
	}

	/**
	 * Serves connections until {@code accept()} fails, then closes the listening socket.
	 *
	 * @return {@link ServerState#STOPPED} if the listening socket was closed out from under the loop, {@link ServerState#FAILED} otherwise
	 */
	@Nonnull
	ServerState acceptUntilClosed() {
		try {
			while (true) {
				SocketChannel socketChannel;

				try {
					socketChannel = getServerSocketChannel().accept();
				} catch (ClosedChannelException e) {
					// Includes AsynchronousCloseException, which is how stop() unblocks us
					return ServerState.STOPPED;
				} catch (IOException e) {
					log(LogEvent.with(LogEventType.SERVER_ACCEPT_FAILED, "Unable to accept connection, terminating accept loop")
							.throwable(e)
							.build());
					return ServerState.FAILED;
				}

				try {
					serveConnection(socketChannel);
				} finally {
					closeConnection(socketChannel);
				}
			}
		} finally {
			try {
				getServerSocketChannel().close();
			} catch (IOException e) {
				log(LogEvent.with(LogEventType.SERVER_STOP_FAILED, "Unable to close listening socket").throwable(e).build());
			}
		}
	}

	private void serveConnection(@Nonnull SocketChannel socketChannel) {
		requireNonNull(socketChannel);

		getLifecycleObserver().didAcceptConnection(remoteAddress(socketChannel));

		ParsedRequest request = readRequest(socketChannel).orElse(null);

		if (request == null)
			return;

		long startedAtNanos = System.nanoTime();

		getLifecycleObserver().didReceiveRequest(request);

		FixtureResponse response;

		try {
			response = getRequestDispatcher().dispatch(request).orElse(null);
		} catch (RuntimeException e) {
			log(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED,
							format("An unexpected error occurred while processing %s %s, abandoning connection", request.getMethod(), request.getPath()))
					.throwable(e)
					.request(request)
					.build());
			return;
		}

		// Declined by the dispatcher: close without writing anything
		if (response == null)
			return;

		try {
			byte[] body = response.getBodyWithoutCopying();
			byte[] head = ResponseFramer.frameHead(response.getStatusCode().getStatusCode(),
					response.getStatusCode().getReasonPhrase(), response.getHeaders(), (long) body.length);

			ResponseFramer.writeFully(socketChannel, head);

			if (body.length > 0)
				ResponseFramer.writeFully(socketChannel, body);
		} catch (IOException e) {
			log(LogEvent.with(LogEventType.RESPONSE_WRITE_FAILED,
							format("Unable to write %d response for %s %s", response.getStatusCode().getStatusCode(), request.getMethod(), request.getPath()))
					.throwable(e)
					.request(request)
					.response(response)
					.build());
			getLifecycleObserver().didFailToWriteResponse(request, response, e);
			return;
		}

		getLifecycleObserver().didWriteResponse(request, response, Duration.ofNanos(System.nanoTime() - startedAtNanos));
	}

	@Nonnull
	private Optional<ParsedRequest> readRequest(@Nonnull SocketChannel socketChannel) {
		requireNonNull(socketChannel);

		RequestParser requestParser = new RequestParser(getMaximumRequestSizeInBytes());
		ByteBuffer readBuffer = getReadBuffer();

		try {
			// SO_TIMEOUT applies to the socket's stream, not to channel reads
			Socket socket = socketChannel.socket();
			socket.setSoTimeout((int) getSocketReadTimeout().toMillis());
			InputStream inputStream = socket.getInputStream();

			while (true) {
				readBuffer.clear();

				int bytesRead = inputStream.read(readBuffer.array(), readBuffer.arrayOffset(), readBuffer.capacity());

				if (bytesRead < 0) {
					log(LogEvent.with(LogEventType.CONNECTION_READ_FAILED, format("Connection closed after %d byte[s] without a complete request",
							requestParser.getBytesReceived())).build());
					return Optional.empty();
				}

				readBuffer.limit(bytesRead);
				requestParser.add(readBuffer);

				if (requestParser.parse())
					return Optional.of(requestParser.request());
			}
		} catch (MalformedRequestException e) {
			log(LogEvent.with(LogEventType.REQUEST_MALFORMED, format("Malformed request, abandoning connection: %s", e.getMessage()))
					.throwable(e)
					.build());
		} catch (IOException e) {
			log(LogEvent.with(LogEventType.CONNECTION_READ_FAILED, "Unable to read request, abandoning connection")
					.throwable(e)
					.build());
		}

		return Optional.empty();
	}

	private void closeConnection(@Nonnull SocketChannel socketChannel) {
		requireNonNull(socketChannel);

		try {
			socketChannel.close();
		} catch (IOException e) {
			log(LogEvent.with(LogEventType.CONNECTION_CLOSE_FAILED, "Unable to close connection").throwable(e).build());
		}
	}

	@Nullable
	private static InetSocketAddress remoteAddress(@Nonnull SocketChannel socketChannel) {
		requireNonNull(socketChannel);

		try {
			SocketAddress socketAddress = socketChannel.getRemoteAddress();
			return socketAddress instanceof InetSocketAddress ? (InetSocketAddress) socketAddress : null;
		} catch (IOException ignored) {
			// Best effort
			return null;
		}
	}

	private void log(@Nonnull LogEvent logEvent) {
		getLifecycleObserver().didReceiveLogEvent(logEvent);
	}

	@Nonnull
	private ServerSocketChannel getServerSocketChannel() {
		return this.serverSocketChannel;
	}

	@Nonnull
	private RequestDispatcher getRequestDispatcher() {
		return this.requestDispatcher;
	}

	@Nonnull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@Nonnull
	private Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@Nonnull
	private Duration getSocketReadTimeout() {
		return this.socketReadTimeout;
	}

	@Nonnull
	private ByteBuffer getReadBuffer() {
		return this.readBuffer;
	}
}
