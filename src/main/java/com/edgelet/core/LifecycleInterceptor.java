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

import com.edgelet.core.impl.DefaultLifecycleInterceptor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * "Hook" methods for observing system lifecycle events - server started, request received, response finished, and so on.
 * <p>
 * Some of these methods are "fail-fast" - exceptions thrown will bubble out and stop execution - and for others, Edgelet will
 * catch exceptions and surface them separately via {@link #didReceiveLogEvent(LogEvent)}. Lifecycle events scoped
 * at the server level (e.g. {@link #willStartServer(Server)}) fail fast; events scoped at the request level
 * (e.g. {@link #didStartRequestHandling(Request, Route)}) do not.
 * <p>
 * Edgelet does not bind a logging backend. Route {@link #didReceiveLogEvent(LogEvent)} to whatever your application uses.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleInterceptor {
	/**
	 * Called before the server starts.
	 * <p>
	 * This method <strong>is</strong> fail-fast.
	 *
	 * @param server the server that will start
	 */
	default void willStartServer(@Nonnull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server starts.
	 * <p>
	 * This method <strong>is</strong> fail-fast.
	 *
	 * @param server the server that started
	 */
	default void didStartServer(@Nonnull Server server) {
		// No-op by default
	}

	/**
	 * Called before the server stops.
	 * <p>
	 * This method <strong>is</strong> fail-fast.
	 *
	 * @param server the server that will stop
	 */
	default void willStopServer(@Nonnull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server stops.
	 * <p>
	 * This method <strong>is</strong> fail-fast.
	 *
	 * @param server the server that stopped
	 */
	default void didStopServer(@Nonnull Server server) {
		// No-op by default
	}

	/**
	 * Called on a worker thread as soon as a routed request begins processing.
	 * <p>
	 * This method <strong>is not</strong> fail-fast. If an exception occurs when Edgelet invokes this method, Edgelet will catch it and invoke
	 * {@link #didReceiveLogEvent(LogEvent)} with type {@link LogEventType#LIFECYCLE_INTERCEPTOR_DID_START_REQUEST_HANDLING_FAILED}.
	 *
	 * @param request the request that was received
	 * @param route   the route that will handle the request, or {@code null} if none matched (i.e. a 404)
	 */
	default void didStartRequestHandling(@Nonnull Request request,
																			 @Nullable Route<?> route) {
		// No-op by default
	}

	/**
	 * Called once a response has been fully committed - for streamed responses, when the stream is closed.
	 * <p>
	 * This method <strong>is not</strong> fail-fast. If an exception occurs when Edgelet invokes this method, Edgelet will catch it and invoke
	 * {@link #didReceiveLogEvent(LogEvent)} with type {@link LogEventType#LIFECYCLE_INTERCEPTOR_DID_FINISH_REQUEST_HANDLING_FAILED}.
	 *
	 * @param request            the request that was received
	 * @param route              the route that handled the request, or {@code null} if none matched
	 * @param statusCode         the status code sent to the client
	 * @param processingDuration how long the request took, from dispatch until the response was committed
	 * @param throwables         exceptions that occurred during request handling
	 */
	default void didFinishRequestHandling(@Nonnull Request request,
																				@Nullable Route<?> route,
																				@Nonnull Integer statusCode,
																				@Nonnull Duration processingDuration,
																				@Nonnull List<Throwable> throwables) {
		// No-op by default
	}

	/**
	 * Called when Edgelet's internal logging system emits a log event.
	 * <p>
	 * The default implementation writes the event to {@code stderr}.
	 *
	 * @param logEvent the event that occurred
	 */
	default void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		Throwable throwable = logEvent.getThrowable().orElse(null);
		String message = format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());

		if (throwable == null) {
			System.err.println(message);
		} else {
			StringWriter stringWriter = new StringWriter();
			PrintWriter printWriter = new PrintWriter(stringWriter);
			throwable.printStackTrace(printWriter);

			String throwableWithStackTrace = stringWriter.toString().trim();
			System.err.printf("%s\n%s\n", message, throwableWithStackTrace);
		}
	}

	/**
	 * Acquires a {@link LifecycleInterceptor} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleInterceptor} with default settings
	 */
	@Nonnull
	static LifecycleInterceptor withDefaults() {
		return DefaultLifecycleInterceptor.sharedInstance();
	}
}
