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

/**
 * The kinds of behavior a request path can be routed to.
 */
public enum RouteType {
	/**
	 * A single {@code 301} hop to a fixed target path.
	 */
	REDIRECT,
	/**
	 * A {@code 301} whose {@code Location} is the requested path itself, so it never resolves.
	 */
	INFINITE_REDIRECT,
	/**
	 * A {@code 301} whose {@code Location} is a relative reference the client must resolve against the request path.
	 */
	RELATIVE_REDIRECT,
	/**
	 * Serve a file from the document root, optionally a byte range of it.
	 */
	FILE
}
