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
import java.util.logging.Level;

import static java.util.Objects.requireNonNull;

/**
 * Kinds of {@link LogEvent} instances that a fixture server can produce.
 */
public enum LogEventType {
	/**
	 * The listening socket could not be opened, configured or bound.
	 */
	SERVER_START_FAILED(Level.SEVERE),
	/**
	 * A secure server was requested; requests are still served in plaintext.
	 */
	SECURE_TRANSPORT_UNSUPPORTED(Level.WARNING),
	/**
	 * {@code accept()} failed for a reason other than the server being stopped, which terminates the accept loop.
	 */
	SERVER_ACCEPT_FAILED(Level.SEVERE),
	/**
	 * The listening socket could not be closed cleanly when the server was stopped.
	 */
	SERVER_STOP_FAILED(Level.WARNING),
	/**
	 * Reading a request failed or the client closed the connection before the request was complete.
	 */
	CONNECTION_READ_FAILED(Level.INFO),
	/**
	 * The request bytes could never form a valid request; the connection was abandoned.
	 */
	REQUEST_MALFORMED(Level.INFO),
	/**
	 * The request method was neither GET nor POST; the connection was abandoned without a response.
	 */
	UNSUPPORTED_METHOD(Level.INFO),
	/**
	 * An exception was thrown while deciding the response; the connection was abandoned.
	 */
	REQUEST_PROCESSING_FAILED(Level.SEVERE),
	/**
	 * Writing the response failed part-way; there is no retry.
	 */
	RESPONSE_WRITE_FAILED(Level.INFO),
	/**
	 * A connection could not be closed cleanly.
	 */
	CONNECTION_CLOSE_FAILED(Level.FINE),
	/**
	 * A {@link LifecycleObserver} method threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED(Level.WARNING);

	@Nonnull
	private final Level level;

	LogEventType(@Nonnull Level level) {
		requireNonNull(level);
		this.level = level;
	}

	/**
	 * @return the {@code java.util.logging} level events of this type are logged at by default
	 */
	@Nonnull
	public Level getLevel() {
		return this.level;
	}
}
