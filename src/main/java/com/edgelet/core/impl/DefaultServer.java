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

package com.edgelet.core.impl;

import com.edgelet.EdgeletConfiguration;
import com.edgelet.core.HttpMethod;
import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.LogEvent;
import com.edgelet.core.LogEventType;
import com.edgelet.core.Request;
import com.edgelet.core.Server;
import com.edgelet.core.StatusCode;
import com.edgelet.internal.microhttp.EventLoop;
import com.edgelet.internal.microhttp.Exchange;
import com.edgelet.internal.microhttp.Handler;
import com.edgelet.internal.microhttp.Header;
import com.edgelet.internal.microhttp.LogEntry;
import com.edgelet.internal.microhttp.Logger;
import com.edgelet.internal.microhttp.MicrohttpRequest;
import com.edgelet.internal.microhttp.MicrohttpResponse;
import com.edgelet.internal.microhttp.Options;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.edgelet.core.Utilities.caseInsensitiveMap;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link Server}: a group of listener threads accepting on one socket, plus a separate fixed-size worker pool
 * on which route callbacks run.
 * <p>
 * For example:
 * <pre>{@code  Server server = DefaultServer.withPort(8080)
 *   .listenerCount(2)
 *   .workerCount(8)
 *   .build();}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DefaultServer implements Server {
	@Nonnull
	private static final String DEFAULT_HOST;
	@Nonnull
	private static final Integer DEFAULT_CONCURRENCY;
	@Nonnull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@Nonnull
	private static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@Nonnull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_CONCURRENCY = Math.max(Runtime.getRuntime().availableProcessors() / 2, 1);
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 1_024 * 10;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 0;
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
	}

	@Nonnull
	private final Integer port;
	@Nonnull
	private final String host;
	@Nonnull
	private final Integer listenerCount;
	@Nonnull
	private final Integer workerCount;
	@Nonnull
	private final Duration requestTimeout;
	@Nonnull
	private final Duration socketSelectTimeout;
	@Nonnull
	private final Duration shutdownTimeout;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;
	@Nonnull
	private final Integer requestReadBufferSizeInBytes;
	@Nonnull
	private final Integer socketPendingConnectionLimit;
	@Nonnull
	private final Supplier<ExecutorService> workerExecutorServiceSupplier;
	@Nonnull
	private final ReentrantLock lock;
	@Nullable
	private volatile ExecutorService workerExecutorService;
	@Nullable
	private volatile RequestHandler requestHandler;
	@Nullable
	private volatile LifecycleInterceptor lifecycleInterceptor;
	@Nullable
	private volatile EventLoop eventLoop;

	@Nonnull
	public static Builder withPort(@Nonnull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	private DefaultServer(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.listenerCount = builder.listenerCount != null ? builder.listenerCount : DEFAULT_CONCURRENCY;
		this.workerCount = builder.workerCount != null ? builder.workerCount : DEFAULT_CONCURRENCY;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.workerExecutorServiceSupplier = builder.workerExecutorServiceSupplier != null ? builder.workerExecutorServiceSupplier : () ->
				Executors.newFixedThreadPool(getWorkerCount(), new NonvirtualThreadFactory("worker"));

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be in the range 0-65535 (0 picks a free port), but was %d", this.port));

		if (this.listenerCount < 1)
			throw new IllegalArgumentException("Listener count must be > 0");

		if (this.workerCount < 1)
			throw new IllegalArgumentException("Worker count must be > 0");

		if (this.requestTimeout.isNegative() || this.requestTimeout.isZero())
			throw new IllegalArgumentException("Request timeout must be > 0");

		if (this.socketSelectTimeout.isNegative() || this.socketSelectTimeout.isZero())
			throw new IllegalArgumentException("Socket select timeout must be > 0");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");

		if (this.maximumRequestSizeInBytes < 1)
			throw new IllegalArgumentException("Maximum request size must be > 0");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException("Request read buffer size must be > 0");

		if (this.socketPendingConnectionLimit < 0)
			throw new IllegalArgumentException("Socket pending connection limit must be >= 0");
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			if (getRequestHandler().isEmpty())
				throw new IllegalStateException(format("No %s was registered for %s", RequestHandler.class.getSimpleName(), getClass().getSimpleName()));

			Options options = new Options()
					.withHost(getHost())
					.withPort(getPort())
					.withListenerCount(getListenerCount())
					.withRequestTimeout(getRequestTimeout())
					.withResolution(getSocketSelectTimeout())
					.withReadBufferSize(getRequestReadBufferSizeInBytes())
					.withMaxRequestSize(getMaximumRequestSizeInBytes())
					.withAcceptLength(getSocketPendingConnectionLimit());

			this.workerExecutorService = getWorkerExecutorServiceSupplier().get();

			EventLoop eventLoop = null;

			try {
				eventLoop = new EventLoop(options, new LogEventLogger(), this::handleMicrohttpRequest);
				eventLoop.start();
				this.eventLoop = eventLoop;
			} catch (BindException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(format("Unable to start the HTTP server - port %d is already in use.", getPort()), e);
			} catch (IOException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(e);
			} catch (RuntimeException e) {
				cleanupFailedStart(eventLoop);
				throw e;
			}
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			boolean interrupted = false;

			try {
				EventLoop eventLoop = getEventLoop().get();
				eventLoop.stop();

				ExecutorService workerExecutorService = getWorkerExecutorService().orElse(null);

				if (workerExecutorService != null) {
					// Graceful first: no new tasks, give running ones the configured shutdown timeout
					workerExecutorService.shutdown();

					long deadlineNanos = System.nanoTime() + getShutdownTimeout().toNanos();
					long remainingMillis = Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
					boolean done = remainingMillis > 0L && workerExecutorService.awaitTermination(remainingMillis, TimeUnit.MILLISECONDS);

					if (!done) {
						workerExecutorService.shutdownNow();
						workerExecutorService.awaitTermination(100L, TimeUnit.MILLISECONDS);
					}
				}

				eventLoop.join();
			} catch (InterruptedException e) {
				interrupted = true;
			} catch (Exception e) {
				safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to shut down server cleanly")
						.throwable(e)
						.build());
			} finally {
				if (interrupted)
					Thread.currentThread().interrupt();
			}
		} finally {
			this.eventLoop = null;
			this.workerExecutorService = null;

			getLock().unlock();
		}
	}

	@Nonnull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getEventLoop().isPresent();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void initialize(@Nonnull EdgeletConfiguration<?> edgeletConfiguration,
												 @Nonnull RequestHandler requestHandler) {
		requireNonNull(edgeletConfiguration);
		requireNonNull(requestHandler);

		this.requestHandler = requestHandler;
		this.lifecycleInterceptor = edgeletConfiguration.getLifecycleInterceptor();
	}

	/**
	 * The port actually bound, which differs from the configured one when that was {@code 0}.
	 *
	 * @return the bound port, or empty if the server is not started
	 */
	@Nonnull
	public Optional<Integer> getBoundPort() {
		EventLoop eventLoop = this.eventLoop;

		if (eventLoop == null)
			return Optional.empty();

		try {
			return Optional.of(eventLoop.getPort());
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	// Runs on a listener thread
	protected void handleMicrohttpRequest(@Nonnull MicrohttpRequest microhttpRequest,
																				@Nonnull Exchange exchange) {
		requireNonNull(microhttpRequest);
		requireNonNull(exchange);

		MicrohttpResponseChannel responseChannel = new MicrohttpResponseChannel(exchange);
		RequestHandler requestHandler = getRequestHandler().orElse(null);

		if (requestHandler == null) {
			exchange.respond(provideMicrohttpFailsafeResponse(503));
			return;
		}

		HttpMethod httpMethod = HttpMethod.fromName(microhttpRequest.method()).orElse(null);

		if (httpMethod == null) {
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, format("Unsupported HTTP method specified: '%s'", microhttpRequest.method())).build());
			exchange.respond(provideMicrohttpFailsafeResponse(501));
			return;
		}

		Request request;

		try {
			byte[] body = microhttpRequest.body();

			request = Request.with(httpMethod, microhttpRequest.uri())
					.headers(headersFromMicrohttpRequest(microhttpRequest))
					.body(body == null || body.length == 0 ? null : body)
					.remoteAddress(microhttpRequest.remoteAddress())
					.build();
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, format("Unable to parse request URI: %s", microhttpRequest.uri()))
					.throwable(e)
					.build());
			exchange.respond(provideMicrohttpFailsafeResponse(400));
			return;
		}

		Runnable task;

		try {
			task = requestHandler.handleRequest(request, responseChannel).orElse(null);
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An unexpected error occurred during request routing")
					.throwable(e)
					.request(request)
					.build());
			writeFailsafeIfPossible(responseChannel, exchange, 500);
			return;
		}

		// Already answered on this thread (e.g. no matching route)
		if (task == null)
			return;

		ExecutorService workerExecutorService = this.workerExecutorService;

		if (workerExecutorService == null) {
			writeFailsafeIfPossible(responseChannel, exchange, 503);
			return;
		}

		try {
			workerExecutorService.execute(() -> {
				try {
					task.run();
				} catch (Throwable t) {
					safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unexpected exception occurred during request processing")
							.throwable(t)
							.request(request)
							.build());
					writeFailsafeIfPossible(responseChannel, exchange, 500);
				}
			});
		} catch (RejectedExecutionException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Worker pool rejected request task")
					.throwable(e)
					.request(request)
					.build());
			writeFailsafeIfPossible(responseChannel, exchange, 503);
		}
	}

	protected void writeFailsafeIfPossible(@Nonnull MicrohttpResponseChannel responseChannel,
																				 @Nonnull Exchange exchange,
																				 @Nonnull Integer statusCode) {
		requireNonNull(responseChannel);
		requireNonNull(exchange);
		requireNonNull(statusCode);

		if (responseChannel.isStarted())
			return;

		try {
			exchange.respond(provideMicrohttpFailsafeResponse(statusCode));
		} catch (RuntimeException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An error occurred while writing a failsafe response")
					.throwable(e)
					.build());
		}
	}

	@Nonnull
	protected MicrohttpResponse provideMicrohttpFailsafeResponse(@Nonnull Integer statusCode) {
		requireNonNull(statusCode);

		String reasonPhrase = StatusCode.reasonPhraseFor(statusCode);
		List<Header> headers = List.of(new Header("Content-Type", "text/plain; charset=UTF-8"));
		byte[] body = format("HTTP %d: %s", statusCode, reasonPhrase).getBytes(StandardCharsets.UTF_8);

		return new MicrohttpResponse(statusCode, reasonPhrase, headers, body);
	}

	@Nonnull
	protected Map<String, Set<String>> headersFromMicrohttpRequest(@Nonnull MicrohttpRequest microhttpRequest) {
		requireNonNull(microhttpRequest);

		Map<String, Set<String>> headers = caseInsensitiveMap();

		for (Header header : microhttpRequest.headers())
			headers.computeIfAbsent(header.name(), name -> new LinkedHashSet<>()).add(header.value() == null ? "" : header.value());

		return headers;
	}

	protected void safelyLog(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleInterceptor().ifPresent(lifecycleInterceptor -> lifecycleInterceptor.didReceiveLogEvent(logEvent));
		} catch (Throwable throwable) {
			// The interceptor itself failed; stderr is all that is left
			throwable.printStackTrace(System.err);
		}
	}

	private void cleanupFailedStart(@Nullable EventLoop eventLoop) {
		if (eventLoop != null)
			eventLoop.stop();

		ExecutorService workerExecutorService = this.workerExecutorService;

		if (workerExecutorService != null)
			workerExecutorService.shutdownNow();

		this.eventLoop = null;
		this.workerExecutorService = null;
	}

	@Nonnull
	protected Integer getPort() {
		return this.port;
	}

	@Nonnull
	protected String getHost() {
		return this.host;
	}

	@Nonnull
	public Integer getListenerCount() {
		return this.listenerCount;
	}

	@Nonnull
	public Integer getWorkerCount() {
		return this.workerCount;
	}

	@Nonnull
	protected Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@Nonnull
	protected Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@Nonnull
	protected Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@Nonnull
	protected Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@Nonnull
	protected Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@Nonnull
	protected Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@Nonnull
	protected Supplier<ExecutorService> getWorkerExecutorServiceSupplier() {
		return this.workerExecutorServiceSupplier;
	}

	@Nonnull
	protected Optional<ExecutorService> getWorkerExecutorService() {
		return Optional.ofNullable(this.workerExecutorService);
	}

	@Nonnull
	protected Optional<RequestHandler> getRequestHandler() {
		return Optional.ofNullable(this.requestHandler);
	}

	@Nonnull
	protected Optional<LifecycleInterceptor> getLifecycleInterceptor() {
		return Optional.ofNullable(this.lifecycleInterceptor);
	}

	@Nonnull
	protected Optional<EventLoop> getEventLoop() {
		return Optional.ofNullable(this.eventLoop);
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@Override
	public String toString() {
		return format("%s{host=%s, port=%s, listenerCount=%s, workerCount=%s}", getClass().getSimpleName(),
				getHost(), getPort(), getListenerCount(), getWorkerCount());
	}

	/**
	 * Forwards transport failures as {@link LogEvent}s; routine connection chatter is dropped.
	 */
	private final class LogEventLogger implements Logger {
		@Override
		public boolean enabled() {
			return true;
		}

		@Override
		public void log(@Nullable LogEntry... logEntries) {
			// Only failures are of interest
		}

		@Override
		public void log(@Nullable Exception e,
										@Nullable LogEntry... logEntries) {
			String event = eventName(logEntries);

			// Peers hanging up mid-read or mid-write are routine
			if ("read_error".equals(event) || "write_error".equals(event))
				return;

			LogEventType logEventType = "malformed_request".equals(event)
					? LogEventType.SERVER_UNPARSEABLE_REQUEST
					: LogEventType.SERVER_INTERNAL_ERROR;

			safelyLog(LogEvent.with(logEventType, format("Transport event '%s'", event))
					.throwable(e)
					.build());
		}

		@Nonnull
		private String eventName(@Nullable LogEntry... logEntries) {
			if (logEntries != null)
				for (LogEntry logEntry : logEntries)
					if ("event".equals(logEntry.key()))
						return logEntry.value();

			return "unknown";
		}
	}

	/**
	 * Names threads {@code <prefix>-<n>}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@ThreadSafe
	protected static class NonvirtualThreadFactory implements ThreadFactory {
		@Nonnull
		private final String namePrefix;
		@Nonnull
		private final AtomicInteger idGenerator;

		public NonvirtualThreadFactory(@Nonnull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@Nonnull
		public Thread newThread(@Nonnull Runnable runnable) {
			String name = format("%s-%s", getNamePrefix(), getIdGenerator().incrementAndGet());
			return new Thread(runnable, name);
		}

		@Nonnull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@Nonnull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}

	/**
	 * Builder used to construct instances of {@link DefaultServer} via {@link DefaultServer#withPort(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nonnull
		private Integer port;
		@Nullable
		private String host;
		@Nullable
		private Integer listenerCount;
		@Nullable
		private Integer workerCount;
		@Nullable
		private Duration requestTimeout;
		@Nullable
		private Duration socketSelectTimeout;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private Integer maximumRequestSizeInBytes;
		@Nullable
		private Integer requestReadBufferSizeInBytes;
		@Nullable
		private Integer socketPendingConnectionLimit;
		@Nullable
		private Supplier<ExecutorService> workerExecutorServiceSupplier;

		private Builder(@Nonnull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@Nonnull
		public Builder port(@Nonnull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@Nonnull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * Number of threads accepting and serving connections. Defaults to half the available processors, minimum 1.
		 */
		@Nonnull
		public Builder listenerCount(@Nullable Integer listenerCount) {
			this.listenerCount = listenerCount;
			return this;
		}

		/**
		 * Number of threads running route callbacks. Defaults to half the available processors, minimum 1.
		 */
		@Nonnull
		public Builder workerCount(@Nullable Integer workerCount) {
			this.workerCount = workerCount;
			return this;
		}

		@Nonnull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		@Nonnull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		@Nonnull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@Nonnull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@Nonnull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@Nonnull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		/**
		 * Replaces the default fixed-size worker pool. The supplied executor is shut down when the server stops.
		 */
		@Nonnull
		public Builder workerExecutorServiceSupplier(@Nullable Supplier<ExecutorService> workerExecutorServiceSupplier) {
			this.workerExecutorServiceSupplier = workerExecutorServiceSupplier;
			return this;
		}

		@Nonnull
		public DefaultServer build() {
			return new DefaultServer(this);
		}
	}
}
