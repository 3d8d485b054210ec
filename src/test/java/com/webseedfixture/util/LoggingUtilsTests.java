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

package com.webseedfixture.util;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.LogManager;

@ThreadSafe
public class LoggingUtilsTests {
	@TempDir
	Path directory;

	private Handler[] originalRootHandlers;

	@BeforeEach
	public void saveJulHandlers() {
		originalRootHandlers = LogManager.getLogManager().getLogger("").getHandlers();
	}

	@AfterEach
	public void restoreJulHandlers() {
		LoggingUtils.uninstallLogback();

		java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger("");

		for (Handler handler : rootLogger.getHandlers())
			rootLogger.removeHandler(handler);

		for (Handler handler : originalRootHandlers)
			rootLogger.addHandler(handler);

		((LoggerContext) LoggerFactory.getILoggerFactory()).reset();
	}

	@Test
	@SuppressWarnings("unchecked")
	public void jul_records_reach_logback() throws IOException {
		Path configuration = directory.resolve("logback.xml");
		Files.writeString(configuration, """
				<configuration>
				  <appender name="LIST" class="ch.qos.logback.core.read.ListAppender"/>
				  <root level="INFO">
				    <appender-ref ref="LIST"/>
				  </root>
				</configuration>
				""", StandardCharsets.UTF_8);

		LoggingUtils.initializeLogback(configuration);

		Assertions.assertTrue(LoggingUtils.isJulBridgeInstalled());

		java.util.logging.Logger.getLogger("com.webseedfixture.LoggingUtilsTests").info("bridged message");

		Logger rootLogger = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		ListAppender<ILoggingEvent> appender = (ListAppender<ILoggingEvent>) rootLogger.getAppender("LIST");

		Assertions.assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().equals("bridged message")));
	}

	@Test
	public void uninstall_removes_bridge() throws IOException {
		Path configuration = directory.resolve("logback.xml");
		Files.writeString(configuration, "<configuration/>", StandardCharsets.UTF_8);

		LoggingUtils.initializeLogback(configuration, LoggingUtils.LogbackOption.DEBUGGING_ENABLED);
		LoggingUtils.uninstallLogback();

		Assertions.assertFalse(LoggingUtils.isJulBridgeInstalled());
	}

	@Test
	public void missing_configuration_is_rejected() {
		IllegalArgumentException missing = Assertions.assertThrows(IllegalArgumentException.class,
				() -> LoggingUtils.initializeLogback(directory.resolve("absent.xml")));
		IllegalArgumentException notAFile = Assertions.assertThrows(IllegalArgumentException.class,
				() -> LoggingUtils.initializeLogback(directory));

		Assertions.assertTrue(missing.getMessage().contains("webseed fixture server"), missing.getMessage());
		Assertions.assertTrue(missing.getMessage().contains("absent.xml"), missing.getMessage());
		Assertions.assertTrue(notAFile.getMessage().contains("webseed fixture server"), notAFile.getMessage());
		Assertions.assertTrue(notAFile.getMessage().contains("does not appear to be a regular file"), notAFile.getMessage());
	}
}
