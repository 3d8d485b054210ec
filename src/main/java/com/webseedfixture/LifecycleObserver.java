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
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Read-only hook methods for observing server and request lifecycle events.
 * <p>
 * Exceptions thrown by these methods are caught by the server and surfaced via {@link #didReceiveLogEvent(LogEvent)};
 * they never affect request processing.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface LifecycleObserver {
	@Nonnull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}

	/**
	 * Called before the listening socket is opened.
	 */
	default void willStartServer(@Nonnull FixtureServer server) {
		// No-op by default
	}

	/**
	 * Called once the listening socket is bound and the accept loop thread is running.
	 */
	default void didStartServer(@Nonnull ServerHandle serverHandle) {
		// No-op by default
	}

	/**
	 * Called if the listening socket could not be opened, configured or bound.
	 */
	default void didFailToStartServer(@Nonnull FixtureServer server,
																		@Nonnull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before the listening socket is closed from the control side.
	 */
	default void willStopServer(@Nonnull ServerHandle serverHandle) {
		// No-op by default
	}

	/**
	 * Called after the accept loop thread has exited.
	 */
	default void didStopServer(@Nonnull ServerHandle serverHandle) {
		// No-op by default
	}

	/**
	 * Called on the accept loop thread for each accepted connection.
	 */
	default void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called once a complete request has been parsed, before it is dispatched.
	 */
	default void didReceiveRequest(@Nonnull ParsedRequest request) {
		// No-op by default
	}

	/**
	 * Called after a response was completely written.
	 */
	default void didWriteResponse(@Nonnull ParsedRequest request,
																@Nonnull FixtureResponse response,
																@Nonnull Duration duration) {
		// No-op by default
	}

	/**
	 * Called when a response could not be completely written.
	 */
	default void didFailToWriteResponse(@Nonnull ParsedRequest request,
																			@Nonnull FixtureResponse response,
																			@Nonnull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when an event suitable for logging occurs.
	 * <p>
	 * By default, events are written to a {@code java.util.logging} logger at the level given by
	 * {@link LogEventType#getLevel()}.
	 */
	default void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
		Logger logger = Logger.getLogger(LifecycleObserver.class.getName());

		if (!logger.isLoggable(logEvent.getLogEventType().getLevel()))
			return;

		String message = String.format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());
		logger.log(logEvent.getLogEventType().getLevel(), message, logEvent.getThrowable().orElse(null));
	}
}
