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
 * Lifecycle state of a started fixture server, as reported by {@link ServerHandle#getState()}.
 */
public enum ServerState {
	/**
	 * The listening socket is bound and the accept loop thread is running.
	 */
	RUNNING,
	/**
	 * {@link ServerHandle#stop()} closed the listening socket and the accept loop thread has exited.
	 */
	STOPPED,
	/**
	 * The accept loop thread exited because {@code accept()} failed; the listening socket has been closed.
	 */
	FAILED
}
