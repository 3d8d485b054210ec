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

import com.webseedfixture.util.PropertiesFileReader;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fixture server settings read from a properties file.
 * <p>
 * Every key is optional except {@code server.port}; absent keys fall back to the {@link DefaultFixtureServer}
 * and {@link Routes} defaults.
 */
@ThreadSafe
public class FixtureServerConfiguration {
	@Nonnull
	public static final String SERVER_PORT = "server.port";
	@Nonnull
	public static final String SERVER_HOST = "server.host";
	@Nonnull
	public static final String SERVER_SECURE = "server.secure";
	@Nonnull
	public static final String SERVER_DOCUMENT_ROOT = "server.documentRoot";
	@Nonnull
	public static final String SERVER_MAXIMUM_FILE_SIZE_IN_BYTES = "server.maximumFileSizeInBytes";
	@Nonnull
	public static final String SERVER_MAXIMUM_REQUEST_SIZE_IN_BYTES = "server.maximumRequestSizeInBytes";
	@Nonnull
	public static final String SERVER_SOCKET_PENDING_CONNECTION_LIMIT = "server.socketPendingConnectionLimit";
	@Nonnull
	public static final String SERVER_SOCKET_READ_TIMEOUT_MILLIS = "server.socketReadTimeoutMillis";
	@Nonnull
	public static final String ROUTES_REDIRECT_PATH = "routes.redirectPath";
	@Nonnull
	public static final String ROUTES_REDIRECT_TARGET = "routes.redirectTarget";
	@Nonnull
	public static final String ROUTES_INFINITE_REDIRECT_PATH = "routes.infiniteRedirectPath";
	@Nonnull
	public static final String ROUTES_RELATIVE_REDIRECT_PATH = "routes.relativeRedirectPath";
	@Nonnull
	public static final String ROUTES_RELATIVE_REDIRECT_TARGET = "routes.relativeRedirectTarget";
	@Nonnull
	public static final String LOGGING_LOGBACK_CONFIGURATION = "logging.logbackConfiguration";

	@Nonnull
	private final PropertiesFileReader propertiesFileReader;

	@Nonnull
	public static FixtureServerConfiguration fromPropertiesFile(@Nonnull Path propertiesFile) {
		requireNonNull(propertiesFile);
		return new FixtureServerConfiguration(new PropertiesFileReader(propertiesFile));
	}

	public FixtureServerConfiguration(@Nonnull PropertiesFileReader propertiesFileReader) {
		requireNonNull(propertiesFileReader);
		this.propertiesFileReader = propertiesFileReader;
	}

	/**
	 * Builds the routing table, applying any {@code routes.*} overrides to the defaults.
	 *
	 * @throws IllegalStateException if the overrides produce an invalid routing table
	 */
	@Nonnull
	public Routes routes() {
		Routes.Builder builder = Routes.withDefaults();

		value(ROUTES_REDIRECT_PATH, String.class).ifPresent(builder::redirectPath);
		value(ROUTES_REDIRECT_TARGET, String.class).ifPresent(builder::redirectTarget);
		value(ROUTES_INFINITE_REDIRECT_PATH, String.class).ifPresent(builder::infiniteRedirectPath);
		value(ROUTES_RELATIVE_REDIRECT_PATH, String.class).ifPresent(builder::relativeRedirectPath);
		value(ROUTES_RELATIVE_REDIRECT_TARGET, String.class).ifPresent(builder::relativeRedirectTarget);

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(format("Invalid routes in %s: %s",
					getPropertiesFileReader().getPropertiesFile().toAbsolutePath(), e.getMessage()), e);
		}
	}

	/**
	 * Builds a server from this configuration.
	 *
	 * @param lifecycleObserver observer to install, or {@code null} for the default
	 * @throws IllegalStateException if {@code server.port} is missing or any value is invalid
	 */
	@Nonnull
	public FixtureServer toFixtureServer(@Nullable LifecycleObserver lifecycleObserver) {
		DefaultFixtureServer.Builder builder = FixtureServer.withPort(value(SERVER_PORT, Integer.class).orElseThrow(() ->
						new IllegalStateException(format("No value for required key '%s' in %s", SERVER_PORT,
								getPropertiesFileReader().getPropertiesFile().toAbsolutePath()))))
				.host(value(SERVER_HOST, String.class).orElse(null))
				.secure(value(SERVER_SECURE, Boolean.class).orElse(null))
				.documentRoot(value(SERVER_DOCUMENT_ROOT, Path.class).orElse(null))
				.maximumFileSizeInBytes(value(SERVER_MAXIMUM_FILE_SIZE_IN_BYTES, Long.class).orElse(null))
				.maximumRequestSizeInBytes(value(SERVER_MAXIMUM_REQUEST_SIZE_IN_BYTES, Integer.class).orElse(null))
				.socketPendingConnectionLimit(value(SERVER_SOCKET_PENDING_CONNECTION_LIMIT, Integer.class).orElse(null))
				.socketReadTimeout(value(SERVER_SOCKET_READ_TIMEOUT_MILLIS, Duration.class).orElse(null))
				.routes(routes())
				.lifecycleObserver(lifecycleObserver);

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(format("Invalid server configuration in %s: %s",
					getPropertiesFileReader().getPropertiesFile().toAbsolutePath(), e.getMessage()), e);
		}
	}

	@Nonnull
	public Optional<Path> getLogbackConfigurationFile() {
		return value(LOGGING_LOGBACK_CONFIGURATION, Path.class);
	}

	@Nonnull
	private <T> Optional<T> value(@Nonnull String key,
																@Nonnull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		try {
			return getPropertiesFileReader().optionalValueFor(key, type);
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(e.getMessage(), e);
		}
	}

	@Nonnull
	protected PropertiesFileReader getPropertiesFileReader() {
		return this.propertiesFileReader;
	}
}
