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

import javax.annotation.concurrent.ThreadSafe;

@ThreadSafe
public class RoutesTests {
	@Test
	public void default_marker_paths() {
		Routes routes = Routes.defaultInstance();

		Assertions.assertEquals(RouteType.REDIRECT, routes.routeTypeForPath("/redirect"));
		Assertions.assertEquals(RouteType.INFINITE_REDIRECT, routes.routeTypeForPath("/infinite_redirect"));
		Assertions.assertEquals(RouteType.RELATIVE_REDIRECT, routes.routeTypeForPath("/relative/redirect"));
		Assertions.assertEquals(RouteType.FILE, routes.routeTypeForPath("/test_file"));
		Assertions.assertEquals(RouteType.FILE, routes.routeTypeForPath("/redirect/"));
		Assertions.assertEquals(RouteType.FILE, routes.routeTypeForPath("/redirect?x=1"));
	}

	@Test
	public void default_locations() {
		Routes routes = Routes.defaultInstance();

		Assertions.assertEquals("/test_file", routes.locationFor(RouteType.REDIRECT, "/redirect").orElse(null));
		Assertions.assertEquals("/infinite_redirect", routes.locationFor(RouteType.INFINITE_REDIRECT, "/infinite_redirect").orElse(null));
		Assertions.assertEquals("../test_file", routes.locationFor(RouteType.RELATIVE_REDIRECT, "/relative/redirect").orElse(null));
		Assertions.assertTrue(routes.locationFor(RouteType.FILE, "/test_file").isEmpty());
	}

	@Test
	public void overridden_paths_replace_defaults() {
		Routes routes = Routes.withDefaults()
				.redirectPath("/go")
				.redirectTarget("http://127.0.0.1:9000/elsewhere")
				.build();

		Assertions.assertEquals(RouteType.REDIRECT, routes.routeTypeForPath("/go"));
		Assertions.assertEquals(RouteType.FILE, routes.routeTypeForPath("/redirect"));
		Assertions.assertEquals("http://127.0.0.1:9000/elsewhere", routes.locationFor(RouteType.REDIRECT, "/go").orElse(null));
	}

	@Test
	public void marker_paths_must_be_absolute() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Routes.withDefaults().redirectPath("redirect").build());
	}

	@Test
	public void marker_paths_must_be_distinct() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Routes.withDefaults().infiniteRedirectPath("/redirect").build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Routes.withDefaults().relativeRedirectPath("/infinite_redirect").build());
	}

	@Test
	public void relative_target_must_be_relative() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Routes.withDefaults().relativeRedirectTarget("/test_file").build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Routes.withDefaults().relativeRedirectTarget("http://x/test_file").build());
	}
}
