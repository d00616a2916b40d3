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
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Incremental body of a streaming {@link Response}, acquired via {@link Response#stream()}.
 * <p>
 * Each appended chunk is flushed to the client immediately. Closing the stream finishes the response; appending
 * after that throws {@link IllegalStateException}. If the client goes away, appends report {@code false} and are
 * otherwise ignored.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResponseStream implements AutoCloseable {
	@Nonnull
	private final Response response;
	private volatile boolean failed;

	protected ResponseStream(@Nonnull Response response) {
		requireNonNull(response);
		this.response = response;
	}

	/**
	 * @return {@code true} if the chunk was handed to the client connection, {@code false} if the client is gone
	 * @throws IllegalStateException if this stream was already closed
	 */
	@Nonnull
	public Boolean append(@Nonnull byte[] chunk) {
		requireNonNull(chunk);
		return getResponse().appendChunk(this, chunk);
	}

	@Nonnull
	public Boolean append(@Nonnull String chunk) {
		requireNonNull(chunk);
		return append(chunk.getBytes(StandardCharsets.UTF_8));
	}

	@Nonnull
	public Boolean isOpen() {
		return getResponse().getState() == Response.State.STREAMING && !hasFailed();
	}

	/**
	 * Finishes the response. Idempotent.
	 */
	@Override
	public void close() {
		getResponse().finishStream();
	}

	@Override
	public String toString() {
		return format("%s{response=%s}", getClass().getSimpleName(), getResponse());
	}

	@Nonnull
	protected Boolean hasFailed() {
		return this.failed;
	}

	protected void markFailed() {
		this.failed = true;
	}

	@Nonnull
	protected Response getResponse() {
		return this.response;
	}
}
