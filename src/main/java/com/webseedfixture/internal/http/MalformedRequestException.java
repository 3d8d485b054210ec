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

package com.webseedfixture.internal.http;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown by {@link RequestParser} when the bytes received so far can never form a valid request.
 */
@NotThreadSafe
public class MalformedRequestException extends RuntimeException {
	public MalformedRequestException(@Nullable String message) {
		super(message);
	}

	public MalformedRequestException(@Nullable String message,
																	 @Nullable Throwable cause) {
		super(message, cause);
	}
}
