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
import java.util.Optional;

/**
 * Decides how a fixture server answers a completely-parsed request.
 * <p>
 * Implementations are invoked on the server's single accept loop thread, one request at a time.
 * <p>
 * <strong>Most usages will rely on {@link DefaultRequestDispatcher} and therefore do not need to implement this interface directly.</strong>
 */
@FunctionalInterface
public interface RequestDispatcher {
	/**
	 * Produces the response for a request.
	 *
	 * @param request the parsed request
	 * @return the response to write, or {@link Optional#empty()} to abandon the connection without writing any bytes
	 */
	@Nonnull
	Optional<FixtureResponse> dispatch(@Nonnull ParsedRequest request);
}
