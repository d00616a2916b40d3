/*
 * Copyright 2022-2025 Revetware LLC.
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

package com.edgelet.core;

import javax.annotation.Nonnull;

/**
 * The connection-side sink a {@link Response} writes into.
 * <p>
 * Implementations must be safe to call from any thread and must preserve call order for a given request.
 * A request gets exactly one of: a single {@link #writeResponse(MarshaledResponse)}, or
 * {@link #startStream(MarshaledResponse)} followed by any number of {@link #writeStreamChunk(byte[])} calls and one
 * {@link #finishStream()} or {@link #abortStream()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ResponseChannel {
	/**
	 * Writes a complete response.
	 */
	void writeResponse(@Nonnull MarshaledResponse marshaledResponse);

	/**
	 * Writes the head of a streamed response; any body on {@code head} is ignored.
	 */
	void startStream(@Nonnull MarshaledResponse head);

	/**
	 * Queues a chunk of a streamed response body for immediate transmission.
	 *
	 * @param chunk the bytes to send
	 * @return {@code false} if the peer has gone away and the chunk was dropped, {@code true} otherwise
	 */
	@Nonnull
	Boolean writeStreamChunk(@Nonnull byte[] chunk);

	/**
	 * Terminates a streamed response body.
	 */
	void finishStream();

	/**
	 * Gives up on a streamed response body without terminating it, so the client sees a truncated response rather
	 * than a complete one. The connection is closed once the chunks already written have been flushed.
	 */
	void abortStream();

	/**
	 * Is the underlying connection still usable?
	 */
	@Nonnull
	Boolean isOpen();
}
