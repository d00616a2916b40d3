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

import com.edgelet.EdgeletConfiguration;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Contract for HTTP server implementations that are designed to be managed by a {@link com.edgelet.Edgelet} instance.
 * <p>
 * <strong>Most applications will use {@link com.edgelet.core.impl.DefaultServer} and therefore do not need to implement this interface directly.</strong>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Starts the server, which makes it able to accept requests from clients.
	 * <p>
	 * If the server is already started, no action is taken.
	 */
	void start();

	/**
	 * Stops the server: no further connections are accepted and in-flight work is given the configured shutdown
	 * timeout to finish.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 */
	void stop();

	@Nonnull
	Boolean isStarted();

	/**
	 * The {@link com.edgelet.Edgelet} instance which manages this {@link Server} invokes this method exactly once,
	 * before {@link #start()}.
	 *
	 * @param edgeletConfiguration configuration for the instance that controls this server
	 * @param requestHandler       receives each parsed request along with a channel for writing its response
	 */
	void initialize(@Nonnull EdgeletConfiguration<?> edgeletConfiguration,
									@Nonnull RequestHandler requestHandler);

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	default void close() throws Exception {
		stop();
	}

	/**
	 * Request dispatch contract for {@link Server} implementations.
	 * <p>
	 * Invoked on a connection-handling thread, so it must not block. Requests that can be answered immediately
	 * (e.g. no matching route) are answered through the channel right away; otherwise the returned task performs the
	 * potentially blocking work and the server runs it on its worker pool.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@FunctionalInterface
	interface RequestHandler {
		/**
		 * @param request         the parsed request
		 * @param responseChannel where the response for {@code request} must be written, exactly once
		 * @return work to run on the worker pool, or empty if the request was already answered
		 */
		@Nonnull
		Optional<Runnable> handleRequest(@Nonnull Request request,
																		 @Nonnull ResponseChannel responseChannel);
	}
}
