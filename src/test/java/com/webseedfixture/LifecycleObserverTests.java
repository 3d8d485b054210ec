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

import com.webseedfixture.TestSupport.RecordingLifecycleObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

@ThreadSafe
public class LifecycleObserverTests {
	@Test
	public void default_observer_logs_at_event_level() {
		Logger logger = Logger.getLogger(LifecycleObserver.class.getName());
		List<LogRecord> records = new CopyOnWriteArrayList<>();
		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				records.add(record);
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		logger.addHandler(handler);

		try {
			IOException cause = new IOException("boom");
			LifecycleObserver.defaultInstance().didReceiveLogEvent(LogEvent.with(LogEventType.SERVER_START_FAILED, "Unable to listen")
					.throwable(cause)
					.build());

			Assertions.assertEquals(1, records.size());
			Assertions.assertEquals(Level.SEVERE, records.get(0).getLevel());
			Assertions.assertEquals("[SERVER_START_FAILED] Unable to listen", records.get(0).getMessage());
			Assertions.assertSame(cause, records.get(0).getThrown());
		} finally {
			logger.removeHandler(handler);
		}
	}

	@Test
	public void guarded_observer_reports_callback_failures() {
		RecordingLifecycleObserver recorder = new RecordingLifecycleObserver() {
			@Override
			public void didAcceptConnection(java.net.InetSocketAddress remoteAddress) {
				throw new IllegalStateException("Callback failure");
			}
		};

		LifecycleObserver guarded = GuardedLifecycleObserver.guard(recorder);
		guarded.didAcceptConnection(null);

		Assertions.assertEquals(List.of(LogEventType.LIFECYCLE_OBSERVER_FAILED), recorder.logEventTypes());
		Assertions.assertTrue(recorder.logEvents.get(0).getThrowable().orElseThrow() instanceof IllegalStateException);
		Assertions.assertSame(guarded, GuardedLifecycleObserver.guard(guarded));
	}

	@Test
	public void guarded_observer_swallows_logging_failures() {
		LifecycleObserver guarded = GuardedLifecycleObserver.guard(new LifecycleObserver() {
			@Override
			public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
				throw new IllegalStateException("Logging failure");
			}
		});

		Assertions.assertDoesNotThrow(() -> guarded.didReceiveLogEvent(LogEvent.with(LogEventType.REQUEST_MALFORMED, "bad").build()));
	}
}
