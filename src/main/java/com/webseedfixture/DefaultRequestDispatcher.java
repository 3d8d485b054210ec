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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Routes requests to redirects or to file content from a {@link ServedFiles} document root.
 * <ul>
 *   <li>Methods other than {@code GET} and {@code POST} are abandoned with no response</li>
 *   <li>Redirect marker paths get a {@code 301} with the {@code Location} given by {@link Routes}</li>
 *   <li>Missing files get {@code 404}, oversized or unreadable files get {@code 503}</li>
 *   <li>A {@code Range} header gets {@code 206} with the requested slice, {@code 400} if the header is malformed
 *   and {@code 416} if it cannot be satisfied</li>
 *   <li>Anything else gets {@code 200} with the whole file</li>
 * </ul>
 * {@code .gz} files are served with {@code Content-Encoding: gzip}.
 */
@ThreadSafe
public class DefaultRequestDispatcher implements RequestDispatcher {
	@Nonnull
	private static final Set<String> SUPPORTED_METHODS;
	@Nonnull
	private static final String HEADER_RANGE;

	static {
		SUPPORTED_METHODS = Set.of("get", "post");
		HEADER_RANGE = "range";
	}

	@Nonnull
	private final Routes routes;
	@Nonnull
	private final ServedFiles servedFiles;
	@Nonnull
	private final LifecycleObserver lifecycleObserver;

	public DefaultRequestDispatcher(@Nonnull Routes routes,
																	@Nonnull ServedFiles servedFiles,
																	@Nonnull LifecycleObserver lifecycleObserver) {
		requireNonNull(routes);
		requireNonNull(servedFiles);
		requireNonNull(lifecycleObserver);

		this.routes = routes;
		this.servedFiles = servedFiles;
		this.lifecycleObserver = lifecycleObserver;
	}

	@Nonnull
	@Override
	public Optional<FixtureResponse> dispatch(@Nonnull ParsedRequest request) {
		requireNonNull(request);

		if (!SUPPORTED_METHODS.contains(request.getMethod())) {
			getLifecycleObserver().didReceiveLogEvent(LogEvent.with(LogEventType.UNSUPPORTED_METHOD,
							format("Incorrect method '%s' for %s, abandoning connection", request.getMethod(), request.getPath()))
					.request(request)
					.build());
			return Optional.empty();
		}

		RouteType routeType = getRoutes().routeTypeForPath(request.getPath());

		switch (routeType) {
			case REDIRECT:
			case INFINITE_REDIRECT:
			case RELATIVE_REDIRECT:
				return Optional.of(FixtureResponse.withStatusCode(StatusCode.HTTP_301)
						.header("Location", getRoutes().locationFor(routeType, request.getPath()).get())
						.build());
			case FILE:
				return Optional.of(fileResponse(request));
			default:
				throw new IllegalStateException(format("Unhandled %s.%s", RouteType.class.getSimpleName(), routeType.name()));
		}
	}

	@Nonnull
	protected FixtureResponse fileResponse(@Nonnull ParsedRequest request) {
		requireNonNull(request);

		String relativePath = request.getPath().substring(1);
		byte[] content;

		try {
			content = getServedFiles().load(relativePath);
		} catch (FileLoadException e) {
			StatusCode statusCode = e.getReason() == FileLoadException.Reason.NOT_FOUND ? StatusCode.HTTP_404 : StatusCode.HTTP_503;
			return FixtureResponse.withStatusCode(statusCode).build();
		}

		String contentEncoding = ServedFiles.precompressedContentEncodingFor(relativePath).orElse(null);
		String rangeHeaderValue = request.getHeader(HEADER_RANGE).orElse(null);

		if (rangeHeaderValue == null || rangeHeaderValue.isBlank())
			return withContentEncoding(FixtureResponse.withStatusCode(StatusCode.HTTP_200), contentEncoding)
					.body(content)
					.build();

		long contentLength = content.length;
		ByteRange byteRange;

		try {
			byteRange = ByteRange.fromRangeHeaderValue(rangeHeaderValue, contentLength);
		} catch (MalformedRangeException e) {
			if (e.getReason() == MalformedRangeException.Reason.UNSATISFIABLE)
				return FixtureResponse.withStatusCode(StatusCode.HTTP_416)
						.header("Content-Range", format("bytes */%d", contentLength))
						.build();

			return FixtureResponse.withStatusCode(StatusCode.HTTP_400).build();
		}

		byte[] slice = Arrays.copyOfRange(content, byteRange.getStart().intValue(), byteRange.getEnd().intValue() + 1);

		return withContentEncoding(FixtureResponse.withStatusCode(StatusCode.HTTP_206), contentEncoding)
				.header("Content-Range", byteRange.toContentRangeHeaderValue(contentLength))
				.body(slice)
				.build();
	}

	@Nonnull
	private static FixtureResponse.Builder withContentEncoding(@Nonnull FixtureResponse.Builder builder,
																														 @Nullable String contentEncoding) {
		return contentEncoding == null ? builder : builder.header("Content-Encoding", contentEncoding);
	}

	@Nonnull
	protected Routes getRoutes() {
		return this.routes;
	}

	@Nonnull
	protected ServedFiles getServedFiles() {
		return this.servedFiles;
	}

	@Nonnull
	protected LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
