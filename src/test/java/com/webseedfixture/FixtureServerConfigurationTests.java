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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@ThreadSafe
public class FixtureServerConfigurationTests {
	@TempDir
	Path directory;

	private FixtureServerConfiguration configuration(String contents) throws IOException {
		Path propertiesFile = directory.resolve("webseed-fixture.properties");
		Files.writeString(propertiesFile, contents, StandardCharsets.ISO_8859_1);
		return FixtureServerConfiguration.fromPropertiesFile(propertiesFile);
	}

	@Test
	public void minimal_configuration_uses_defaults() throws IOException {
		DefaultFixtureServer server = (DefaultFixtureServer) configuration("server.port=8080\n").toFixtureServer(null);

		Assertions.assertEquals(8080, server.getPort());
		Assertions.assertEquals("0.0.0.0", server.getHost());
		Assertions.assertFalse(server.getSecure());
		Assertions.assertEquals(8_000_000L, server.getMaximumFileSizeInBytes());
		Assertions.assertEquals(10_000, server.getMaximumRequestSizeInBytes());
		Assertions.assertEquals(10, server.getSocketPendingConnectionLimit());
		Assertions.assertEquals(Duration.ofSeconds(60), server.getSocketReadTimeout());
		Assertions.assertEquals(Routes.DEFAULT_REDIRECT_PATH, server.getRoutes().getRedirectPath());
	}

	@Test
	public void every_key_is_applied() throws IOException {
		FixtureServerConfiguration configuration = configuration("""
				server.port=9000
				server.host=127.0.0.1
				server.secure=true
				server.documentRoot=/srv/fixtures
				server.maximumFileSizeInBytes=1024
				server.maximumRequestSizeInBytes=2048
				server.socketPendingConnectionLimit=4
				server.socketReadTimeoutMillis=250
				routes.redirectPath=/go
				routes.redirectTarget=/data.bin
				routes.infiniteRedirectPath=/loop
				routes.relativeRedirectPath=/nested/go
				routes.relativeRedirectTarget=../data.bin
				logging.logbackConfiguration=conf/logback.xml
				""");

		DefaultFixtureServer server = (DefaultFixtureServer) configuration.toFixtureServer(null);

		Assertions.assertEquals(9000, server.getPort());
		Assertions.assertEquals("127.0.0.1", server.getHost());
		Assertions.assertTrue(server.getSecure());
		Assertions.assertEquals(Paths.get("/srv/fixtures"), server.getDocumentRoot());
		Assertions.assertEquals(1024L, server.getMaximumFileSizeInBytes());
		Assertions.assertEquals(2048, server.getMaximumRequestSizeInBytes());
		Assertions.assertEquals(4, server.getSocketPendingConnectionLimit());
		Assertions.assertEquals(Duration.ofMillis(250), server.getSocketReadTimeout());

		Routes routes = server.getRoutes();
		Assertions.assertEquals(RouteType.REDIRECT, routes.routeTypeForPath("/go"));
		Assertions.assertEquals("/data.bin", routes.getRedirectTarget());
		Assertions.assertEquals(RouteType.INFINITE_REDIRECT, routes.routeTypeForPath("/loop"));
		Assertions.assertEquals(RouteType.RELATIVE_REDIRECT, routes.routeTypeForPath("/nested/go"));
		Assertions.assertEquals("../data.bin", routes.getRelativeRedirectTarget());

		Assertions.assertEquals(Paths.get("conf/logback.xml"), configuration.getLogbackConfigurationFile().orElse(null));
	}

	@Test
	public void missing_port_is_rejected() throws IOException {
		Assertions.assertThrows(IllegalStateException.class, () -> configuration("server.host=127.0.0.1\n").toFixtureServer(null));
	}

	@Test
	public void invalid_values_are_rejected() throws IOException {
		Assertions.assertThrows(IllegalStateException.class, () -> configuration("server.port=http\n").toFixtureServer(null));
		Assertions.assertThrows(IllegalStateException.class, () -> configuration("server.port=70000\n").toFixtureServer(null));
		Assertions.assertThrows(IllegalStateException.class,
				() -> configuration("server.port=80\nroutes.relativeRedirectTarget=/absolute\n").toFixtureServer(null));
	}
}
