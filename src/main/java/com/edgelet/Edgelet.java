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


package com.edgelet;

import com.edgelet.core.Callback;
import com.edgelet.core.Copyable;
import com.edgelet.core.InstanceFactory;
import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.LogEvent;
import com.edgelet.core.LogEventType;
import com.edgelet.core.Request;
import com.edgelet.core.Response;
import com.edgelet.core.ResponseChannel;
import com.edgelet.core.Route;
import com.edgelet.core.RouteMatch;
import com.edgelet.core.RouteTable;
import com.edgelet.core.Server;
import com.edgelet.exception.HandlerException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Edgelet's main class - manages a {@link Server} using the provided system configuration.
 * <p>
 * Requests are matched against the configured {@link RouteTable} on the server's listener threads. Unmatched requests
 * are answered with a 404 immediately; matched requests are handed to the server's worker pool, which obtains an
 * application instance from the {@link InstanceFactory} (if the route needs one), runs middleware and then the handler.
 * <p>
 * <pre>{@code // Blocks until the JVM shuts down
 * Edgelet.withConfiguration(EdgeletConfiguration.withServer(server, routeTable).build())
 *   .start(App::new);}</pre>
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Edgelet<T> implements AutoCloseable {
	@Nonnull
	private final EdgeletConfiguration<T> edgeletConfiguration;
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;
	@Nullable
	private volatile InstanceFactory<T> instanceFactory;

	@Nonnull
	public static <T> Edgelet<T> withConfiguration(@Nonnull EdgeletConfiguration<T> edgeletConfiguration) {
		requireNonNull(edgeletConfiguration);
		return new Edgelet<>(edgeletConfiguration);
	}

	private Edgelet(@Nonnull EdgeletConfiguration<T> edgeletConfiguration) {
		requireNonNull(edgeletConfiguration);

		this.edgeletConfiguration = edgeletConfiguration;
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		// Indirection so request handling is not part of Edgelet's public surface
		Edgelet<T> edgelet = this;

		edgeletConfiguration.getServer().initialize(edgeletConfiguration,
				(request, responseChannel) -> edgelet.handleRequest(request, responseChannel));
	}

	/**
	 * Starts the server with a fresh application instance per request and blocks until the JVM shuts down.
	 *
	 * @param constructor creates one application instance
	 * @throws InterruptedException if interrupted while waiting for shutdown
	 */
	public void start(@Nonnull Supplier<T> constructor) throws InterruptedException {
		requireNonNull(constructor);
		serve(InstanceFactory.fresh(constructor));
	}

	/**
	 * Starts the server, giving each request a copy of {@code seed}, and blocks until the JVM shuts down.
	 *
	 * @param seed   the instance created once at startup
	 * @param copier produces a per-request copy of the seed
	 * @throws InterruptedException if interrupted while waiting for shutdown
	 */
	public void startWith(@Nonnull T seed,
												@Nonnull UnaryOperator<T> copier) throws InterruptedException {
		requireNonNull(seed);
		requireNonNull(copier);

		serve(InstanceFactory.copying(seed, copier));
	}

	/**
	 * Starts the server with the given instance factory and blocks until the JVM shuts down.
	 * <p>
	 * {@link Copyable} applications can use {@code serve(InstanceFactory.copying(seed))}.
	 *
	 * @param instanceFactory vends application instances
	 * @throws InterruptedException if interrupted while waiting for shutdown
	 */
	public void serve(@Nonnull InstanceFactory<T> instanceFactory) throws InterruptedException {
		requireNonNull(instanceFactory);

		launch(instanceFactory);
		awaitShutdown();
	}

	/**
	 * Starts the managed server without blocking.
	 * <p>
	 * The route table is frozen. If the server is already started, this is a no-op.
	 *
	 * @param instanceFactory vends application instances
	 */
	public void launch(@Nonnull InstanceFactory<T> instanceFactory) {
		requireNonNull(instanceFactory);

		getLock().lock();

		try {
			if (isStarted())
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			this.instanceFactory = instanceFactory;
			getEdgeletConfiguration().getRouteTable().freeze();

			Server server = getEdgeletConfiguration().getServer();
			LifecycleInterceptor lifecycleInterceptor = getEdgeletConfiguration().getLifecycleInterceptor();

			lifecycleInterceptor.willStartServer(server);
			server.start();
			lifecycleInterceptor.didStartServer(server);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops the managed server.
	 * <p>
	 * If the managed server is already stopped, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (isStarted()) {
				Server server = getEdgeletConfiguration().getServer();
				LifecycleInterceptor lifecycleInterceptor = getEdgeletConfiguration().getLifecycleInterceptor();

				lifecycleInterceptor.willStopServer(server);
				server.stop();
				lifecycleInterceptor.didStopServer(server);
			}
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until JVM shutdown ({@code SIGTERM/SIGINT/System.exit(...)} and so forth) or until
	 * {@link #stop()} is called from another thread.
	 *
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(() -> {
			try {
				stop();
			} catch (Throwable ignored) {
				// Nothing to do
			}
		}, "edgelet-shutdown-hook");

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException ignored) {
				// JVM shutting down
			}
		}
	}

	/**
	 * Synonym for {@link #stop()}.
	 */
	@Override
	public void close() {
		stop();
	}

	@Nonnull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getEdgeletConfiguration().getServer().isStarted();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Matches the request and either answers it on the spot (no route matched) or returns the work to be run on a
	 * worker thread.
	 * <p>
	 * Called by the managed server on its listener thread, so nothing here may block.
	 */
	@Nonnull
	protected Optional<Runnable> handleRequest(@Nonnull Request request,
																						 @Nonnull ResponseChannel responseChannel) {
		requireNonNull(request);
		requireNonNull(responseChannel);

		long startNanos = System.nanoTime();
		RouteTable<T> routeTable = getEdgeletConfiguration().getRouteTable();
		RouteMatch<T> routeMatch = routeTable.match(request.getHttpMethod(), request.getRequestPath()).orElse(null);

		if (routeMatch == null) {
			List<Throwable> throwables = new CopyOnWriteArrayList<>();
			Response response = createResponse(request, null, responseChannel, startNanos, throwables);

			safelyDidStartRequestHandling(request, null);
			response.sendFailsafe(404, null);

			return Optional.empty();
		}

		Request routedRequest = request.withRouteMatch(routeMatch);

		return Optional.of(() -> {
			List<Throwable> throwables = new CopyOnWriteArrayList<>();
			Response response = createResponse(routedRequest, routeMatch.getRoute(), responseChannel, startNanos, throwables);

			safelyDidStartRequestHandling(routedRequest, routeMatch.getRoute());
			processRoutedRequest(routedRequest, response, routeMatch, throwables);
		});
	}

	protected void processRoutedRequest(@Nonnull Request request,
																			@Nonnull Response response,
																			@Nonnull RouteMatch<T> routeMatch,
																			@Nonnull List<Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(response);
		requireNonNull(routeMatch);
		requireNonNull(throwables);

		Route<T> route = routeMatch.getRoute();
		Callback<T> callback = routeMatch.getCallback();
		T instance = null;

		if (callback.requiresInstance()) {
			InstanceFactory<T> currentInstanceFactory = this.instanceFactory;

			if (currentInstanceFactory == null)
				throw new IllegalStateException("Edgelet has not been started");

			try {
				instance = currentInstanceFactory.create();
			} catch (Throwable t) {
				throwables.add(t);
				safelyLog(LogEvent.with(LogEventType.INSTANCE_CREATION_FAILED, format("Unable to create application instance for %s", route))
						.throwable(t)
						.request(request)
						.route(route)
						.build());
				response.sendFailsafe(500, null);
				return;
			}

			try (Request.Editor requestEditor = request.edit()) {
				getEdgeletConfiguration().getRouteTable().getMiddleware().before(instance, requestEditor);
			} catch (HandlerException e) {
				throwables.add(e);
				response.sendFailsafe(e.getStatusCode(), e.getMessage());
				return;
			} catch (Throwable t) {
				throwables.add(t);
				safelyLog(LogEvent.with(LogEventType.MIDDLEWARE_FAILED, format("Middleware failed for %s", route))
						.throwable(t)
						.request(request)
						.route(route)
						.build());
				response.sendFailsafe(500, null);
				return;
			}
		} else {
			request.seal();
		}

		try {
			callback.invoke(instance, request, response);
		} catch (HandlerException e) {
			throwables.add(e);

			if (!response.sendFailsafe(e.getStatusCode(), e.getMessage()))
				safelyLog(LogEvent.with(LogEventType.CALLBACK_FAILED,
								format("Handler for %s failed with status %d after its response was committed", route, e.getStatusCode()))
						.throwable(e)
						.request(request)
						.route(route)
						.build());

			return;
		} catch (Throwable t) {
			throwables.add(t);
			safelyLog(LogEvent.with(LogEventType.CALLBACK_FAILED, format("Handler for %s failed", route))
					.throwable(t)
					.request(request)
					.route(route)
					.build());
			response.sendFailsafe(500, null);
			return;
		}

		if (!response.isDeferred() && response.commitIfBuilding())
			safelyLog(LogEvent.with(LogEventType.RESPONSE_NOT_COMMITTED,
							format("Handler for %s returned without sending a response; committed status %d with an empty body", route, response.getStatusCode()))
					.request(request)
					.route(route)
					.build());
	}

	@Nonnull
	protected Response createResponse(@Nonnull Request request,
																		@Nullable Route<T> route,
																		@Nonnull ResponseChannel responseChannel,
																		long startNanos,
																		@Nonnull List<Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(responseChannel);
		requireNonNull(throwables);

		EdgeletConfiguration<T> edgeletConfiguration = getEdgeletConfiguration();

		return Response.withChannel(request, responseChannel)
				.templateEngine(edgeletConfiguration.getTemplateEngine().orElse(null))
				.fileLoader(edgeletConfiguration.getFileLoader())
				.logEventConsumer(this::safelyLog)
				.completionListener(statusCode -> safelyDidFinishRequestHandling(request, route, statusCode,
						Duration.ofNanos(System.nanoTime() - startNanos), List.copyOf(throwables)))
				.build();
	}

	protected void safelyDidStartRequestHandling(@Nonnull Request request,
																							 @Nullable Route<T> route) {
		requireNonNull(request);

		try {
			getEdgeletConfiguration().getLifecycleInterceptor().didStartRequestHandling(request, route);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_INTERCEPTOR_DID_START_REQUEST_HANDLING_FAILED,
							format("An exception occurred while invoking %s::didStartRequestHandling", LifecycleInterceptor.class.getSimpleName()))
					.throwable(t)
					.request(request)
					.route(route)
					.build());
		}
	}

	protected void safelyDidFinishRequestHandling(@Nonnull Request request,
																								@Nullable Route<T> route,
																								@Nonnull Integer statusCode,
																								@Nonnull Duration processingDuration,
																								@Nonnull List<Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(statusCode);
		requireNonNull(processingDuration);
		requireNonNull(throwables);

		try {
			getEdgeletConfiguration().getLifecycleInterceptor().didFinishRequestHandling(request, route, statusCode, processingDuration, throwables);
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_INTERCEPTOR_DID_FINISH_REQUEST_HANDLING_FAILED,
							format("An exception occurred while invoking %s::didFinishRequestHandling", LifecycleInterceptor.class.getSimpleName()))
					.throwable(t)
					.request(request)
					.route(route)
					.build());
		}
	}

	protected void safelyLog(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getEdgeletConfiguration().getLifecycleInterceptor().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The log sink itself failed; stderr is all that is left
			throwable.printStackTrace();
		}
	}

	@Nonnull
	public EdgeletConfiguration<T> getEdgeletConfiguration() {
		return this.edgeletConfiguration;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@Nonnull
	protected AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}
}
