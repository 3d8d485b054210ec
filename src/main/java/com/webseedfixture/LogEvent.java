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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A loggable event that occurs while a fixture server accepts, parses, dispatches or writes.
 * <p>
 * These events are exposed via {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 */
@ThreadSafe
public class LogEvent {
	@Nonnull
	private final LogEventType logEventType;
	@Nonnull
	private final String message;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final ParsedRequest request;
	@Nullable
	private final FixtureResponse response;

	@Nonnull
	public static Builder with(@Nonnull LogEventType logEventType,
														 @Nonnull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	protected LogEvent(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.throwable = builder.throwable;
		this.request = builder.request;
		this.response = builder.response;
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{logEventType=%s, message=%s, throwable=%s}", getClass().getSimpleName(),
				getLogEventType(), getMessage(), getThrowable().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getThrowable(), logEvent.getThrowable())
				&& Objects.equals(getRequest(), logEvent.getRequest())
				&& Objects.equals(getResponse(), logEvent.getResponse());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getMessage(), getThrowable(), getRequest(), getResponse());
	}

	@Nonnull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@Nonnull
	public String getMessage() {
		return this.message;
	}

	@Nonnull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	@Nonnull
	public Optional<ParsedRequest> getRequest() {
		return Optional.ofNullable(this.request);
	}

	@Nonnull
	public Optional<FixtureResponse> getResponse() {
		return Optional.ofNullable(this.response);
	}

	/**
	 * Builder used to construct instances of {@link LogEvent} via {@link LogEvent#with(LogEventType, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final LogEventType logEventType;
		@Nonnull
		private final String message;
		@Nullable
		private Throwable throwable;
		@Nullable
		private ParsedRequest request;
		@Nullable
		private FixtureResponse response;

		protected Builder(@Nonnull LogEventType logEventType,
											@Nonnull String message) {
			requireNonNull(logEventType);
			requireNonNull(message);

			this.logEventType = logEventType;
			this.message = message;
		}

		@Nonnull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@Nonnull
		public Builder request(@Nullable ParsedRequest request) {
			this.request = request;
			return this;
		}

		@Nonnull
		public Builder response(@Nullable FixtureResponse response) {
			this.response = response;
			return this;
		}

		@Nonnull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
