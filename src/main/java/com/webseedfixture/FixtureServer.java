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
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * A single-connection HTTP/1.0 server that answers test clients with redirects and file content.
 * <p>
 * Each call to {@link #start()} binds the listening socket and spins up one dedicated accept loop thread,
 * which serves connections strictly one at a time. The returned {@link ServerHandle} is the only way to stop it.
 * <p>
 * Example:
 * <pre>{@code FixtureServer server = FixtureServer.withPort(8080)
 *   .documentRoot(Path.of("/tmp/fixtures"))
 *   .build();
 *
 * ServerHandle serverHandle = server.start();
 *
 * try {
 *   // Point a client at http://127.0.0.1:8080/test_file
 * } finally {
 *   serverHandle.stop();
 * }}</pre>
 */
public interface FixtureServer {
	/**
	 * Acquires a builder for a server that will listen on the given port ({@code 0} binds an ephemeral port).
	 *
	 * @param port the port to listen on
	 * @return a builder for a {@link FixtureServer}
	 */
	@Nonnull
	static DefaultFixtureServer.Builder withPort(@Nonnull Integer port) {
		return new DefaultFixtureServer.Builder(port);
	}

	/**
	 * Binds the listening socket and starts the accept loop thread.
	 * <p>
	 * If this server is already running, its current handle is returned.
	 *
	 * @return a handle to the running server
	 * @throws UncheckedIOException if the listening socket could not be opened, configured or bound
	 */
	@Nonnull
	ServerHandle start();

	/**
	 * Stops a server previously started by this instance.  Equivalent to {@link ServerHandle#stop()}.
	 *
	 * @param serverHandle the handle returned by {@link #start()}
	 */
	void stop(@Nonnull ServerHandle serverHandle);

	/**
	 * @return the port this server was configured with
	 */
	@Nonnull
	Integer getPort();

	/**
	 * @return {@code true} if a secure server was requested (requests are nonetheless served in plaintext)
	 */
	@Nonnull
	Boolean getSecure();

	/**
	 * @return the directory that files are served from
	 */
	@Nonnull
	Path getDocumentRoot();
}
