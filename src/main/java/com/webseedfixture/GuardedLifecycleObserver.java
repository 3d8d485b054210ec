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
import java.net.InetSocketAddress;
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Wraps a {@link LifecycleObserver} so that exceptions it throws are reported as
 * {@link LogEventType#LIFECYCLE_OBSERVER_FAILED} events instead of reaching the caller.
 */
@ThreadSafe
final class GuardedLifecycleObserver implements LifecycleObserver {
	@Nonnull
	private final LifecycleObserver lifecycleObserver;

	@Nonnull
	static LifecycleObserver guard(@Nonnull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);

		if (lifecycleObserver instanceof GuardedLifecycleObserver)
			return lifecycleObserver;

		return new GuardedLifecycleObserver(lifecycleObserver);
	}

	private GuardedLifecycleObserver(@Nonnull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);
		this.lifecycleObserver = lifecycleObserver;
	}

	@Override
	public void willStartServer(@Nonnull FixtureServer server) {
		invoke("willStartServer", () -> getLifecycleObserver().willStartServer(server));
	}

	@Override
	public void didStartServer(@Nonnull ServerHandle serverHandle) {
		invoke("didStartServer", () -> getLifecycleObserver().didStartServer(serverHandle));
	}

	@Override
	public void didFailToStartServer(@Nonnull FixtureServer server,
																	 @Nonnull Throwable throwable) {
		invoke("didFailToStartServer", () -> getLifecycleObserver().didFailToStartServer(server, throwable));
	}

	@Override
	public void willStopServer(@Nonnull ServerHandle serverHandle) {
		invoke("willStopServer", () -> getLifecycleObserver().willStopServer(serverHandle));
	}

	@Override
	public void didStopServer(@Nonnull ServerHandle serverHandle) {
		invoke("didStopServer", () -> getLifecycleObserver().didStopServer(serverHandle));
	}

	@Override
	public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		invoke("didAcceptConnection", () -> getLifecycleObserver().didAcceptConnection(remoteAddress));
	}

	@Override
	public void didReceiveRequest(@Nonnull ParsedRequest request) {
		invoke("didReceiveRequest", () -> getLifecycleObserver().didReceiveRequest(request));
	}

	@Override
	public void didWriteResponse(@Nonnull ParsedRequest request,
															 @Nonnull FixtureResponse response,
															 @Nonnull Duration duration) {
		invoke("didWriteResponse", () -> getLifecycleObserver().didWriteResponse(request, response, duration));
	}

	@Override
	public void didFailToWriteResponse(@Nonnull ParsedRequest request,
																		 @Nonnull FixtureResponse response,
																		 @Nonnull Throwable throwable) {
		invoke("didFailToWriteResponse", () -> getLifecycleObserver().didFailToWriteResponse(request, response, throwable));
	}

	@Override
	public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// Nowhere left to report to
			throwable.printStackTrace(System.err);
		}
	}

	private void invoke(@Nonnull String methodName,
											@Nonnull Runnable runnable) {
		requireNonNull(methodName);
		requireNonNull(runnable);

		try {
			runnable.run();
		} catch (Throwable throwable) {
			didReceiveLogEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s#%s", LifecycleObserver.class.getSimpleName(), methodName))
					.throwable(throwable)
					.build());
		}
	}

	@Nonnull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
