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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link FixtureServer} implementation: a blocking {@link ServerSocketChannel} served by one accept loop thread.
 * <p>
 * Instances are acquired via {@link FixtureServer#withPort(Integer)}.
 */
@ThreadSafe
public class DefaultFixtureServer implements FixtureServer {
	@Nonnull
	private static final String DEFAULT_HOST;
	@Nonnull
	private static final Long DEFAULT_MAXIMUM_FILE_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_SOCKET_READ_BUFFER_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@Nonnull
	private static final Duration DEFAULT_SOCKET_READ_TIMEOUT;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_MAXIMUM_FILE_SIZE_IN_BYTES = 8_000_000L;
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 10_000;
		DEFAULT_SOCKET_READ_BUFFER_SIZE_IN_BYTES = 10_000;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 10;
		DEFAULT_SOCKET_READ_TIMEOUT = Duration.ofSeconds(60);
	}

	@Nonnull
	private final Integer port;
	@Nonnull
	private final String host;
	@Nonnull
	private final Boolean secure;
	@Nonnull
	private final Path documentRoot;
	@Nonnull
	private final Long maximumFileSizeInBytes;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;
	@Nonnull
	private final Integer socketReadBufferSizeInBytes;
	@Nonnull
	private final Integer socketPendingConnectionLimit;
	@Nonnull
	private final Duration socketReadTimeout;
	@Nonnull
	private final Routes routes;
	@Nonnull
	private final LifecycleObserver lifecycleObserver;
	@Nonnull
	private final RequestDispatcher requestDispatcher;
	@Nonnull
	private final ReentrantLock lock;
	@Nullable
	private volatile ServerHandle serverHandle;

	protected DefaultFixtureServer(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.secure = builder.secure != null ? builder.secure : false;
		this.documentRoot = builder.documentRoot != null ? builder.documentRoot : Paths.get("");
		this.maximumFileSizeInBytes = builder.maximumFileSizeInBytes != null ? builder.maximumFileSizeInBytes : DEFAULT_MAXIMUM_FILE_SIZE_IN_BYTES;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.socketReadBufferSizeInBytes = builder.socketReadBufferSizeInBytes != null ? builder.socketReadBufferSizeInBytes : DEFAULT_SOCKET_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.socketReadTimeout = builder.socketReadTimeout != null ? builder.socketReadTimeout : DEFAULT_SOCKET_READ_TIMEOUT;
		this.routes = builder.routes != null ? builder.routes : Routes.defaultInstance();
		this.lifecycleObserver = GuardedLifecycleObserver.guard(builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance());
		this.requestDispatcher = builder.requestDispatcher != null ? builder.requestDispatcher
				: new DefaultRequestDispatcher(getRoutes(), new ServedFiles(getDocumentRoot(), getMaximumFileSizeInBytes()), getLifecycleObserver());

		if (getPort() < 0 || getPort() > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", getPort()));

		if (getMaximumFileSizeInBytes() < 0 || getMaximumFileSizeInBytes() > ServedFiles.MAXIMUM_SUPPORTED_FILE_SIZE_IN_BYTES)
			throw new IllegalArgumentException(format("Illegal maximum file size %d", getMaximumFileSizeInBytes()));

		if (getMaximumRequestSizeInBytes() <= 0)
			throw new IllegalArgumentException("Maximum request size must be > 0");

		if (getSocketReadBufferSizeInBytes() <= 0)
			throw new IllegalArgumentException("Socket read buffer size must be > 0");

		if (getSocketPendingConnectionLimit() <= 0)
			throw new IllegalArgumentException("Socket pending connection limit must be > 0");

		if (getSocketReadTimeout().isNegative() || getSocketReadTimeout().toMillis() > Integer.MAX_VALUE)
			throw new IllegalArgumentException(format("Illegal socket read timeout %s", getSocketReadTimeout()));
	}

	@Nonnull
	@Override
	public ServerHandle start() {
		getLock().lock();

		try {
			ServerHandle currentServerHandle = this.serverHandle;

			if (currentServerHandle != null && currentServerHandle.isRunning())
				return currentServerHandle;

			getLifecycleObserver().willStartServer(this);

			if (getSecure())
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SECURE_TRANSPORT_UNSUPPORTED,
						format("Secure transport was requested for port %d but is not supported, serving plaintext", getPort())).build());

			ServerSocketChannel serverSocketChannel = null;

			try {
				serverSocketChannel = ServerSocketChannel.open();
				serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
				serverSocketChannel.bind(new InetSocketAddress(getHost(), getPort()), getSocketPendingConnectionLimit());
			} catch (IOException e) {
				if (serverSocketChannel != null) {
					try {
						serverSocketChannel.close();
					} catch (IOException closeException) {
						e.addSuppressed(closeException);
					}
				}

				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_START_FAILED,
						format("Unable to listen on %s:%d", getHost(), getPort())).throwable(e).build());
				getLifecycleObserver().didFailToStartServer(this, e);

				throw new UncheckedIOException(format("Unable to listen on %s:%d", getHost(), getPort()), e);
			}

			AcceptLoop acceptLoop = new AcceptLoop(serverSocketChannel, getRequestDispatcher(), getLifecycleObserver(),
					getMaximumRequestSizeInBytes(), getSocketReadBufferSizeInBytes(), getSocketReadTimeout());

			ServerHandle newServerHandle = new ServerHandle(boundPort(serverSocketChannel), serverSocketChannel, acceptLoop, getLifecycleObserver());
			newServerHandle.startAcceptLoop();

			this.serverHandle = newServerHandle;

			getLifecycleObserver().didStartServer(newServerHandle);

			return newServerHandle;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop(@Nonnull ServerHandle serverHandle) {
		requireNonNull(serverHandle);
		serverHandle.stop();
	}

	@Nonnull
	protected Integer boundPort(@Nonnull ServerSocketChannel serverSocketChannel) {
		requireNonNull(serverSocketChannel);

		try {
			SocketAddress localAddress = serverSocketChannel.getLocalAddress();
			return localAddress instanceof InetSocketAddress ? ((InetSocketAddress) localAddress).getPort() : getPort();
		} catch (IOException e) {
			return getPort();
		}
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{host=%s, port=%d, secure=%s, documentRoot=%s}", getClass().getSimpleName(),
				getHost(), getPort(), getSecure(), getDocumentRoot());
	}

	@Nonnull
	@Override
	public Integer getPort() {
		return this.port;
	}

	@Nonnull
	@Override
	public Boolean getSecure() {
		return this.secure;
	}

	@Nonnull
	@Override
	public Path getDocumentRoot() {
		return this.documentRoot;
	}

	@Nonnull
	public String getHost() {
		return this.host;
	}

	@Nonnull
	public Long getMaximumFileSizeInBytes() {
		return this.maximumFileSizeInBytes;
	}

	@Nonnull
	public Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@Nonnull
	public Integer getSocketReadBufferSizeInBytes() {
		return this.socketReadBufferSizeInBytes;
	}

	@Nonnull
	public Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@Nonnull
	public Duration getSocketReadTimeout() {
		return this.socketReadTimeout;
	}

	@Nonnull
	public Routes getRoutes() {
		return this.routes;
	}

	@Nonnull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@Nonnull
	protected RequestDispatcher getRequestDispatcher() {
		return this.requestDispatcher;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	/**
	 * Builder used to construct instances of {@link DefaultFixtureServer} via {@link FixtureServer#withPort(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final Integer port;
		@Nullable
		private String host;
		@Nullable
		private Boolean secure;
		@Nullable
		private Path documentRoot;
		@Nullable
		private Long maximumFileSizeInBytes;
		@Nullable
		private Integer maximumRequestSizeInBytes;
		@Nullable
		private Integer socketReadBufferSizeInBytes;
		@Nullable
		private Integer socketPendingConnectionLimit;
		@Nullable
		private Duration socketReadTimeout;
		@Nullable
		private Routes routes;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private RequestDispatcher requestDispatcher;

		protected Builder(@Nonnull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@Nonnull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@Nonnull
		public Builder secure(@Nullable Boolean secure) {
			this.secure = secure;
			return this;
		}

		@Nonnull
		public Builder documentRoot(@Nullable Path documentRoot) {
			this.documentRoot = documentRoot;
			return this;
		}

		@Nonnull
		public Builder maximumFileSizeInBytes(@Nullable Long maximumFileSizeInBytes) {
			this.maximumFileSizeInBytes = maximumFileSizeInBytes;
			return this;
		}

		@Nonnull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@Nonnull
		public Builder socketReadBufferSizeInBytes(@Nullable Integer socketReadBufferSizeInBytes) {
			this.socketReadBufferSizeInBytes = socketReadBufferSizeInBytes;
			return this;
		}

		@Nonnull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@Nonnull
		public Builder socketReadTimeout(@Nullable Duration socketReadTimeout) {
			this.socketReadTimeout = socketReadTimeout;
			return this;
		}

		@Nonnull
		public Builder routes(@Nullable Routes routes) {
			this.routes = routes;
			return this;
		}

		@Nonnull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		/**
		 * Replaces the standard routing entirely; {@link #routes(Routes)}, {@link #documentRoot(Path)} and
		 * {@link #maximumFileSizeInBytes(Long)} are then ignored.
		 */
		@Nonnull
		public Builder requestDispatcher(@Nullable RequestDispatcher requestDispatcher) {
			this.requestDispatcher = requestDispatcher;
			return this;
		}

		@Nonnull
		public DefaultFixtureServer build() {
			return new DefaultFixtureServer(this);
		}
	}
}
