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
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.channels.ServerSocketChannel;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Handle to a running {@link FixtureServer}, returned by {@link FixtureServer#start()}.
 * <p>
 * Stopping closes the listening socket from the calling thread, which unblocks the accept loop,
 * and then waits for the accept loop thread to exit.  A request already being served runs to completion first.
 * Once {@link #stop()} returns, the port can be bound again.
 */
@ThreadSafe
public class ServerHandle implements AutoCloseable {
	@Nonnull
	private final Integer port;
	@Nonnull
	private final ServerSocketChannel serverSocketChannel;
	@Nonnull
	private final LifecycleObserver lifecycleObserver;
	@Nonnull
	private final Thread acceptLoopThread;
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private volatile ServerState state;
	private volatile boolean stopRequested;

	ServerHandle(@Nonnull Integer port,
							 @Nonnull ServerSocketChannel serverSocketChannel,
							 @Nonnull AcceptLoop acceptLoop,
							 @Nonnull LifecycleObserver lifecycleObserver) {
		requireNonNull(port);
		requireNonNull(serverSocketChannel);
		requireNonNull(acceptLoop);
		requireNonNull(lifecycleObserver);

		this.port = port;
		this.serverSocketChannel = serverSocketChannel;
		this.lifecycleObserver = lifecycleObserver;
		this.lock = new ReentrantLock();
		this.state = ServerState.RUNNING;
		this.acceptLoopThread = new Thread(() -> {
			ServerState terminalState = ServerState.FAILED;

			try {
				terminalState = acceptLoop.acceptUntilClosed();
			} finally {
				// A failure racing with stop() still counts as a stop
				this.state = this.stopRequested ? ServerState.STOPPED : terminalState;
			}
		}, format("fixture-server-accept-loop-%d", port));
	}

	void startAcceptLoop() {
		getAcceptLoopThread().start();
	}

	/**
	 * Closes the listening socket and waits for the accept loop thread to exit.
	 * <p>
	 * Calling this more than once has no further effect.
	 * <p>
	 * A request already being served is allowed to finish, bounded by the socket read timeout.
	 * If the calling thread is interrupted while waiting, this method stops waiting, restores the thread's
	 * interrupt status and returns with the handle reporting {@link ServerState#STOPPED}. The accept loop thread
	 * then exits on its own once the in-flight connection completes.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (this.stopRequested)
				return;

			this.stopRequested = true;

			getLifecycleObserver().willStopServer(this);

			try {
				getServerSocketChannel().close();
			} catch (IOException e) {
				getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_STOP_FAILED,
						format("Unable to close listening socket on port %d", getPort())).throwable(e).build());
			}

			// Stopping from inside a dispatcher or observer callback cannot wait on its own thread
			if (Thread.currentThread() != getAcceptLoopThread()) {
				boolean interrupted = false;

				try {
					getAcceptLoopThread().join();
				} catch (InterruptedException e) {
					interrupted = true;
				} finally {
					if (interrupted)
						Thread.currentThread().interrupt();
				}
			}

			this.state = ServerState.STOPPED;

			getLifecycleObserver().didStopServer(this);
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void close() {
		stop();
	}

	/**
	 * @return the port the listening socket is bound to, which is the ephemeral port actually assigned when the server was configured with port {@code 0}
	 */
	@Nonnull
	public Integer getPort() {
		return this.port;
	}

	@Nonnull
	public ServerState getState() {
		return this.state;
	}

	@Nonnull
	public Boolean isRunning() {
		return getState() == ServerState.RUNNING;
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{port=%d, state=%s}", getClass().getSimpleName(), getPort(), getState());
	}

	@Nonnull
	protected ServerSocketChannel getServerSocketChannel() {
		return this.serverSocketChannel;
	}

	@Nonnull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@Nonnull
	protected Thread getAcceptLoopThread() {
		return this.acceptLoopThread;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}
}
