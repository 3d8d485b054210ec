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

package com.webseedfixture.launcher;

import com.webseedfixture.FixtureServer;
import com.webseedfixture.FixtureServerConfiguration;
import com.webseedfixture.ServerHandle;
import com.webseedfixture.util.LoggingUtils;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Command-line entry point: {@code ServerLauncher [config.properties] [ON_KEYPRESS|ON_SHUTDOWN]}.
 * <p>
 * The properties file defaults to {@code webseed-fixture.properties} in the working directory.
 * With {@link StoppingStrategy#ON_KEYPRESS} (the default) the server stops when a key is pressed;
 * either way it is also stopped by a JVM shutdown hook.
 */
@ThreadSafe
public class ServerLauncher {
	@Nonnull
	private static final Path DEFAULT_PROPERTIES_FILE;

	static {
		DEFAULT_PROPERTIES_FILE = Paths.get("webseed-fixture.properties");
	}

	public enum StoppingStrategy {
		ON_KEYPRESS,
		ON_SHUTDOWN
	}

	@Nonnull
	private final FixtureServer fixtureServer;
	@Nonnull
	private final Logger logger;

	public ServerLauncher(@Nonnull FixtureServer fixtureServer) {
		requireNonNull(fixtureServer);

		this.fixtureServer = fixtureServer;
		this.logger = Logger.getLogger(ServerLauncher.class.getName());
	}

	public static void main(@Nonnull String[] args) {
		requireNonNull(args);

		Path propertiesFile = args.length > 0 ? Paths.get(args[0]) : DEFAULT_PROPERTIES_FILE;
		StoppingStrategy stoppingStrategy = args.length > 1
				? StoppingStrategy.valueOf(args[1].trim().toUpperCase(Locale.ENGLISH))
				: StoppingStrategy.ON_KEYPRESS;

		FixtureServerConfiguration configuration = FixtureServerConfiguration.fromPropertiesFile(propertiesFile);
		configuration.getLogbackConfigurationFile().ifPresent(LoggingUtils::initializeLogback);

		new ServerLauncher(configuration.toFixtureServer(null)).launch(stoppingStrategy, System.in);
	}

	/**
	 * Starts the server and registers a shutdown hook that stops it.
	 * <p>
	 * For {@link StoppingStrategy#ON_KEYPRESS}, blocks until a byte is read from {@code keypressInputStream}
	 * and then stops the server before returning.
	 *
	 * @return the handle of the started server
	 */
	@Nonnull
	public ServerHandle launch(@Nonnull StoppingStrategy stoppingStrategy,
														 @Nonnull InputStream keypressInputStream) {
		requireNonNull(stoppingStrategy);
		requireNonNull(keypressInputStream);

		ServerHandle serverHandle = getFixtureServer().start();

		getLogger().info(format("Fixture server listening on port %d, serving %s", serverHandle.getPort(),
				getFixtureServer().getDocumentRoot().toAbsolutePath()));

		Runtime.getRuntime().addShutdownHook(new Thread(serverHandle::stop, "fixture-server-shutdown-hook"));

		if (stoppingStrategy == StoppingStrategy.ON_KEYPRESS) {
			getLogger().info("Press any key to stop the server");

			try {
				keypressInputStream.read();
			} catch (IOException e) {
				getLogger().log(Level.WARNING, "Unable to read from standard input, stopping server...", e);
			}

			serverHandle.stop();
			getLogger().info("Fixture server stopped");
		}

		return serverHandle;
	}

	@Nonnull
	protected FixtureServer getFixtureServer() {
		return this.fixtureServer;
	}

	@Nonnull
	protected Logger getLogger() {
		return this.logger;
	}
}
