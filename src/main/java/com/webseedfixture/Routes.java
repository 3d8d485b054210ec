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
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The fixed routing table of a fixture server: which marker paths redirect, and where to.
 * Any path that is not a marker is routed to {@link RouteType#FILE}.
 * <p>
 * Defaults:
 * <ul>
 *   <li>{@code /redirect} redirects to {@code /test_file}</li>
 *   <li>{@code /infinite_redirect} redirects to itself</li>
 *   <li>{@code /relative/redirect} redirects to {@code ../test_file}</li>
 * </ul>
 */
@ThreadSafe
public class Routes {
	@Nonnull
	public static final String DEFAULT_REDIRECT_PATH;
	@Nonnull
	public static final String DEFAULT_REDIRECT_TARGET;
	@Nonnull
	public static final String DEFAULT_INFINITE_REDIRECT_PATH;
	@Nonnull
	public static final String DEFAULT_RELATIVE_REDIRECT_PATH;
	@Nonnull
	public static final String DEFAULT_RELATIVE_REDIRECT_TARGET;
	@Nonnull
	private static final Routes DEFAULT_INSTANCE;

	static {
		DEFAULT_REDIRECT_PATH = "/redirect";
		DEFAULT_REDIRECT_TARGET = "/test_file";
		DEFAULT_INFINITE_REDIRECT_PATH = "/infinite_redirect";
		DEFAULT_RELATIVE_REDIRECT_PATH = "/relative/redirect";
		DEFAULT_RELATIVE_REDIRECT_TARGET = "../test_file";
		DEFAULT_INSTANCE = withDefaults().build();
	}

	@Nonnull
	private final String redirectPath;
	@Nonnull
	private final String redirectTarget;
	@Nonnull
	private final String infiniteRedirectPath;
	@Nonnull
	private final String relativeRedirectPath;
	@Nonnull
	private final String relativeRedirectTarget;
	@Nonnull
	private final Map<String, RouteType> routeTypesByPath;

	@Nonnull
	public static Routes defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@Nonnull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected Routes(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.redirectPath = requireMarkerPath(builder.redirectPath, "redirect path");
		this.redirectTarget = requireNonNull(builder.redirectTarget);
		this.infiniteRedirectPath = requireMarkerPath(builder.infiniteRedirectPath, "infinite redirect path");
		this.relativeRedirectPath = requireMarkerPath(builder.relativeRedirectPath, "relative redirect path");
		this.relativeRedirectTarget = requireNonNull(builder.relativeRedirectTarget);

		if (this.relativeRedirectTarget.startsWith("/") || this.relativeRedirectTarget.contains("://"))
			throw new IllegalArgumentException(format("Relative redirect target must be a relative reference (was '%s')", this.relativeRedirectTarget));

		Map<String, RouteType> routeTypesByPath = new LinkedHashMap<>();
		routeTypesByPath.put(this.redirectPath, RouteType.REDIRECT);

		if (routeTypesByPath.putIfAbsent(this.infiniteRedirectPath, RouteType.INFINITE_REDIRECT) != null
				|| routeTypesByPath.putIfAbsent(this.relativeRedirectPath, RouteType.RELATIVE_REDIRECT) != null)
			throw new IllegalArgumentException(format("Redirect marker paths must be distinct (were %s, %s, %s)",
					this.redirectPath, this.infiniteRedirectPath, this.relativeRedirectPath));

		this.routeTypesByPath = Collections.unmodifiableMap(routeTypesByPath);
	}

	@Nonnull
	public RouteType routeTypeForPath(@Nonnull String path) {
		requireNonNull(path);
		return getRouteTypesByPath().getOrDefault(path, RouteType.FILE);
	}

	/**
	 * The {@code Location} header value for a redirect route.
	 *
	 * @param routeType   the route that matched
	 * @param requestPath the path that was requested
	 * @return the location, or {@link Optional#empty()} for {@link RouteType#FILE}
	 */
	@Nonnull
	public Optional<String> locationFor(@Nonnull RouteType routeType,
																			@Nonnull String requestPath) {
		requireNonNull(routeType);
		requireNonNull(requestPath);

		switch (routeType) {
			case REDIRECT:
				return Optional.of(getRedirectTarget());
			case INFINITE_REDIRECT:
				return Optional.of(requestPath);
			case RELATIVE_REDIRECT:
				return Optional.of(getRelativeRedirectTarget());
			case FILE:
				return Optional.empty();
			default:
				throw new IllegalStateException(format("Unhandled %s.%s", RouteType.class.getSimpleName(), routeType.name()));
		}
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{routeTypesByPath=%s, redirectTarget=%s, relativeRedirectTarget=%s}", getClass().getSimpleName(),
				getRouteTypesByPath(), getRedirectTarget(), getRelativeRedirectTarget());
	}

	@Nonnull
	private static String requireMarkerPath(@Nullable String path,
																					@Nonnull String description) {
		requireNonNull(path, description);

		if (!path.startsWith("/"))
			throw new IllegalArgumentException(format("The %s must start with '/' (was '%s')", description, path));

		return path;
	}

	@Nonnull
	public String getRedirectPath() {
		return this.redirectPath;
	}

	@Nonnull
	public String getRedirectTarget() {
		return this.redirectTarget;
	}

	@Nonnull
	public String getInfiniteRedirectPath() {
		return this.infiniteRedirectPath;
	}

	@Nonnull
	public String getRelativeRedirectPath() {
		return this.relativeRedirectPath;
	}

	@Nonnull
	public String getRelativeRedirectTarget() {
		return this.relativeRedirectTarget;
	}

	@Nonnull
	protected Map<String, RouteType> getRouteTypesByPath() {
		return this.routeTypesByPath;
	}

	/**
	 * Builder used to construct instances of {@link Routes} via {@link Routes#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private String redirectPath;
		@Nonnull
		private String redirectTarget;
		@Nonnull
		private String infiniteRedirectPath;
		@Nonnull
		private String relativeRedirectPath;
		@Nonnull
		private String relativeRedirectTarget;

		protected Builder() {
			this.redirectPath = DEFAULT_REDIRECT_PATH;
			this.redirectTarget = DEFAULT_REDIRECT_TARGET;
			this.infiniteRedirectPath = DEFAULT_INFINITE_REDIRECT_PATH;
			this.relativeRedirectPath = DEFAULT_RELATIVE_REDIRECT_PATH;
			this.relativeRedirectTarget = DEFAULT_RELATIVE_REDIRECT_TARGET;
		}

		@Nonnull
		public Builder redirectPath(@Nonnull String redirectPath) {
			this.redirectPath = requireNonNull(redirectPath);
			return this;
		}

		@Nonnull
		public Builder redirectTarget(@Nonnull String redirectTarget) {
			this.redirectTarget = requireNonNull(redirectTarget);
			return this;
		}

		@Nonnull
		public Builder infiniteRedirectPath(@Nonnull String infiniteRedirectPath) {
			this.infiniteRedirectPath = requireNonNull(infiniteRedirectPath);
			return this;
		}

		@Nonnull
		public Builder relativeRedirectPath(@Nonnull String relativeRedirectPath) {
			this.relativeRedirectPath = requireNonNull(relativeRedirectPath);
			return this;
		}

		@Nonnull
		public Builder relativeRedirectTarget(@Nonnull String relativeRedirectTarget) {
			this.relativeRedirectTarget = requireNonNull(relativeRedirectTarget);
			return this;
		}

		@Nonnull
		public Routes build() {
			return new Routes(this);
		}
	}
}
