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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.LogManager.getLogManager;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Routes the server's {@code java.util.logging} output through SLF4J to a Logback configuration file.
 */
@ThreadSafe
public final class LoggingUtils {
	@Nonnull
	private static final Object LOCK;

	static {
		LOCK = new Object();
	}

	public enum LogbackOption {
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Configures Logback from {@code logbackConfigurationFile} and installs the JUL-to-SLF4J bridge in place of
	 * any handlers on the root JUL logger.
	 *
	 * @throws IllegalArgumentException if the file does not exist or is not a regular file
	 * @throws IllegalStateException    if Logback rejects the configuration
	 */
	public static void initializeLogback(@Nonnull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		synchronized (LOCK) {
			List<LogbackOption> logbackOptionsAsList = logbackOptions == null ? List.of() : Arrays.asList(logbackOptions);

			if (!Files.exists(logbackConfigurationFile))
				throw new IllegalArgumentException(format("Unable to initialize Logback logging for the webseed fixture server. Could not find a configuration file at %s",
						logbackConfigurationFile.toAbsolutePath()));

			if (!Files.isRegularFile(logbackConfigurationFile))
				throw new IllegalArgumentException(format("Unable to initialize Logback logging for the webseed fixture server. The configuration path %s does not appear to be a regular file",
						logbackConfigurationFile.toAbsolutePath()));

			uninstallLogback();

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();

			try {
				JoranConfigurator configurator = new JoranConfigurator();
				configurator.setContext(loggerContext);
				loggerContext.reset();
				configurator.doConfigure(logbackConfigurationFile.toFile().getAbsolutePath());
			} catch (JoranException e) {
				throw new IllegalStateException("Unable to configure Logback logging", e);
			}

			if (logbackOptionsAsList.contains(LogbackOption.DEBUGGING_ENABLED))
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			java.util.logging.Logger rootLogger = getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers())
				rootLogger.removeHandler(handler);

			SLF4JBridgeHandler.install();
		}
	}

	public static void uninstallLogback() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}

	@Nonnull
	public static Boolean isJulBridgeInstalled() {
		synchronized (LOCK) {
			return SLF4JBridgeHandler.isInstalled();
		}
	}
}
