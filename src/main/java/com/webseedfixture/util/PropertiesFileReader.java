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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Reads a properties file from disk and converts its values to {@link String}, {@link Integer}, {@link Long},
 * {@link Boolean}, {@link Path} or {@link Duration} (given in milliseconds).
 */
@ThreadSafe
public class PropertiesFileReader {
	@Nonnull
	private static final Map<Class<?>, Function<String, ?>> VALUE_CONVERTERS;

	static {
		VALUE_CONVERTERS = Map.of(
				String.class, value -> value,
				Integer.class, Integer::valueOf,
				Long.class, Long::valueOf,
				Boolean.class, PropertiesFileReader::parseBoolean,
				Path.class, Paths::get,
				Duration.class, value -> Duration.ofMillis(Long.parseLong(value))
		);
	}

	@Nonnull
	private final Path propertiesFile;
	@Nonnull
	private final Map<String, String> properties;

	public PropertiesFileReader(@Nonnull Path propertiesFile) {
		requireNonNull(propertiesFile);

		this.propertiesFile = propertiesFile;
		this.properties = unmodifiableMap(new HashMap<>(loadPropertiesForPath(propertiesFile)));
	}

	/**
	 * @throws IllegalStateException    if there is no non-blank value for {@code key}
	 * @throws IllegalArgumentException if the value cannot be converted to {@code type}
	 */
	@Nonnull
	public <T> T valueFor(@Nonnull String key,
												@Nonnull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		return optionalValueFor(key, type).orElseThrow(() ->
				new IllegalStateException(format("No value was found for key '%s' in properties file %s", key, getPropertiesFile().toAbsolutePath())));
	}

	/**
	 * @throws IllegalArgumentException if the value cannot be converted to {@code type}
	 */
	@Nonnull
	public <T> Optional<T> optionalValueFor(@Nonnull String key,
																					@Nonnull Class<T> type) {
		requireNonNull(key);
		requireNonNull(type);

		String value = getProperties().get(key);

		if (value == null || value.isBlank())
			return Optional.empty();

		Function<String, ?> valueConverter = VALUE_CONVERTERS.get(type);

		if (valueConverter == null)
			throw new IllegalArgumentException(format("Not sure how to convert value '%s' for key '%s' to requested type %s", value, key, type.getName()));

		try {
			return Optional.of(type.cast(valueConverter.apply(value.trim())));
		} catch (RuntimeException e) {
			throw new IllegalArgumentException(format("Unable to convert value '%s' for key '%s' to requested type %s", value, key, type.getName()), e);
		}
	}

	@Nonnull
	protected Map<String, String> loadPropertiesForPath(@Nonnull Path propertiesFile) {
		requireNonNull(propertiesFile);

		if (!Files.exists(propertiesFile))
			throw new IllegalArgumentException(format("Unable to find properties file at %s", propertiesFile.toAbsolutePath()));

		if (!Files.isRegularFile(propertiesFile))
			throw new IllegalArgumentException(format("Properties file at %s is not a regular file", propertiesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(propertiesFile)) {
			properties.load(inputStream);
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for properties file at %s", propertiesFile.toAbsolutePath()), e);
		}

		Map<String, String> propertiesMap = new HashMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}

	@Nonnull
	private static Boolean parseBoolean(@Nullable String value) {
		String normalizedValue = value == null ? "" : value.trim().toLowerCase(Locale.ENGLISH);

		if (normalizedValue.equals("true"))
			return true;

		if (normalizedValue.equals("false"))
			return false;

		throw new IllegalArgumentException(format("'%s' is not a boolean value", value));
	}

	@Nonnull
	public Map<String, String> getProperties() {
		return this.properties;
	}

	@Nonnull
	public Path getPropertiesFile() {
		return this.propertiesFile;
	}
}
