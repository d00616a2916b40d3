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

import com.edgelet.core.InstanceFactory;
import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.LogEvent;
import com.edgelet.core.LogEventType;
import com.edgelet.core.Request;
import com.edgelet.core.Route;
import com.edgelet.core.RouteTable;
import com.edgelet.core.Server;
import com.edgelet.core.impl.DefaultServer;
import com.edgelet.exception.BadRequestException;
import com.edgelet.exception.HandlerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Failure handling and lifecycle callbacks of {@link Edgelet}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class EdgeletTests {
	private final List<String> lifecycleEvents = new CopyOnWriteArrayList<>();
	private final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
	private final BlockingQueue<List<Throwable>> finishedThrowables = new LinkedBlockingQueue<>();
	private final HttpClient httpClient = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(5))
			.build();

	private DefaultServer server;
	private Edgelet<App> edgelet;

	@AfterEach
	public void shutDown() {
		if (edgelet != null)
			edgelet.close();
	}

	@Test
	public void handlerFailureIsInternalServerError() throws Exception {
		launch(RouteTable.<App>create().get("/fail", (app, request, response) -> {
			throw new IllegalStateException("broken handler");
		}), InstanceFactory.fresh(App::new));

		HttpResponse<String> response = get("/fail");

		Assertions.assertEquals(500, response.statusCode());
		Assertions.assertEquals("HTTP 500: Internal Server Error", response.body());

		List<Throwable> throwables = finishedThrowables.poll(5, TimeUnit.SECONDS);

		Assertions.assertNotNull(throwables);
		Assertions.assertEquals("broken handler", throwables.get(0).getMessage());
		Assertions.assertTrue(loggedTypes().contains(LogEventType.CALLBACK_FAILED));
	}

	@Test
	public void handlerExceptionCarriesItsStatus() throws Exception {
		launch(RouteTable.<App>create().get("/conflict", (app, request, response) -> {
			response.header("X-Discarded", "yes");
			throw new HandlerException(409, "already exists");
		}), InstanceFactory.fresh(App::new));

		HttpResponse<String> response = get("/conflict");

		Assertions.assertEquals(409, response.statusCode());
		Assertions.assertEquals("already exists", response.body());
		Assertions.assertTrue(response.headers().firstValue("X-Discarded").isEmpty());
	}

	@Test
	public void uncommittedResponseIsCommittedEmpty() throws Exception {
		launch(RouteTable.<App>create().get("/quiet", (app, request, response) -> response.header("X-Quiet", "true")),
				InstanceFactory.fresh(App::new));

		HttpResponse<String> response = get("/quiet");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("", response.body());
		Assertions.assertEquals("true", response.headers().firstValue("X-Quiet").orElse(null));
		awaitLogged(LogEventType.RESPONSE_NOT_COMMITTED);
	}

	@Test
	public void deferredResponseIsCompletedLater() throws Exception {
		launch(RouteTable.<App>create().get("/later", (app, request, response) -> {
			response.defer();
			CompletableFuture.runAsync(() -> response.send("done later"));
		}), InstanceFactory.fresh(App::new));

		HttpResponse<String> response = get("/later");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("done later", response.body());
		Assertions.assertFalse(loggedTypes().contains(LogEventType.RESPONSE_NOT_COMMITTED));
	}

	@Test
	public void instanceCreationFailureIsInternalServerError() throws Exception {
		RouteTable<App> routeTable = RouteTable.<App>create()
				.get("/instance", (app, request, response) -> response.send(app.name))
				.getStatic("/static", (request, response) -> response.send("no instance needed"));

		launch(routeTable, InstanceFactory.fresh(() -> {
			throw new IllegalStateException("no instances today");
		}));

		Assertions.assertEquals(500, get("/instance").statusCode());
		Assertions.assertTrue(loggedTypes().contains(LogEventType.INSTANCE_CREATION_FAILED));

		HttpResponse<String> staticResponse = get("/static");

		Assertions.assertEquals(200, staticResponse.statusCode());
		Assertions.assertEquals("no instance needed", staticResponse.body());
	}

	@Test
	public void middlewareFailureIsInternalServerError() throws Exception {
		RouteTable<App> routeTable = RouteTable.<App>create()
				.get("/guarded", (app, request, response) -> response.send("unreachable"))
				.registerMiddleware((app, requestEditor) -> {
					throw new IllegalStateException("middleware refused");
				});

		launch(routeTable, InstanceFactory.fresh(App::new));

		Assertions.assertEquals(500, get("/guarded").statusCode());
		Assertions.assertTrue(loggedTypes().contains(LogEventType.MIDDLEWARE_FAILED));
	}

	@Test
	public void middlewareHandlerExceptionCarriesItsStatus() throws Exception {
		RouteTable<App> routeTable = RouteTable.<App>create()
				.get("/guarded", (app, request, response) -> response.send("unreachable"))
				.registerMiddleware((app, requestEditor) -> {
					throw new BadRequestException("missing token");
				});

		launch(routeTable, InstanceFactory.fresh(App::new));

		HttpResponse<String> response = get("/guarded");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("missing token", response.body());

		List<Throwable> throwables = finishedThrowables.poll(5, TimeUnit.SECONDS);

		Assertions.assertNotNull(throwables);
		Assertions.assertTrue(throwables.get(0) instanceof BadRequestException);
		Assertions.assertFalse(loggedTypes().contains(LogEventType.MIDDLEWARE_FAILED));
	}

	@Test
	public void handlerFailureMidStreamTruncatesTheBody() throws Exception {
		launch(RouteTable.<App>create().get("/partial", (app, request, response) -> {
			response.stream().append("part");
			throw new IllegalStateException("failed mid-stream");
		}), InstanceFactory.fresh(App::new));

		// The chunked body is never terminated, so the client cannot read it as a complete response
		Assertions.assertThrows(IOException.class, () -> get("/partial"));
		awaitLogged(LogEventType.CALLBACK_FAILED);
	}

	@Test
	public void middlewareEditsAreVisibleToHandler() throws Exception {
		RouteTable<App> routeTable = RouteTable.<App>create()
				.get("/users/:id", (app, request, response) -> response.send(request.getParameter("id").orElse("?") + " "
						+ request.getAttribute("user", String.class).orElse("anonymous") + " "
						+ request.getHeader("X-Added").orElse("none")))
				.registerMiddleware((app, requestEditor) -> requestEditor
						.putAttribute("user", app.name)
						.putHeader("X-Added", "added"));

		launch(routeTable, InstanceFactory.fresh(App::new));

		Assertions.assertEquals("42 app added", get("/users/42").body());
	}

	@Test
	public void mountedRoutesAndSeedCopies() throws Exception {
		RouteTable<App> api = RouteTable.<App>create()
				.get("/whoami", (app, request, response) -> response.send(app.name));

		launch(RouteTable.<App>create().mount("/api", api), InstanceFactory.copying(new App("seed"), (seed) -> new App(seed.name + "-copy")));

		Assertions.assertEquals("seed-copy", get("/api/whoami").body());
		Assertions.assertEquals(404, get("/whoami").statusCode());
	}

	@Test
	public void lifecycleCallbacksRunInOrder() throws Exception {
		launch(RouteTable.<App>create().get("/", (app, request, response) -> response.send("ok")), InstanceFactory.fresh(App::new));

		Assertions.assertEquals("ok", get("/").body());
		Assertions.assertNotNull(finishedThrowables.poll(5, TimeUnit.SECONDS));

		edgelet.stop();

		Assertions.assertEquals(List.of("willStartServer", "didStartServer", "didStartRequestHandling /", "didFinishRequestHandling / 200",
				"willStopServer", "didStopServer"), lifecycleEvents);
	}

	@Test
	public void failingInterceptorDoesNotBreakRequests() throws Exception {
		server = DefaultServer.withPort(0).host("127.0.0.1").listenerCount(1).workerCount(2).build();

		EdgeletConfiguration<App> configuration = EdgeletConfiguration.withServer(server,
						RouteTable.<App>create().get("/", (app, request, response) -> response.send("still fine")))
				.lifecycleInterceptor(new LifecycleInterceptor() {
					@Override
					public void didStartRequestHandling(@Nonnull Request request,
																							@Nullable Route<?> route) {
						throw new IllegalStateException("interceptor failure");
					}

					@Override
					public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		edgelet = Edgelet.withConfiguration(configuration);
		edgelet.launch(InstanceFactory.fresh(App::new));

		Assertions.assertEquals("still fine", get("/").body());
		Assertions.assertTrue(loggedTypes().contains(LogEventType.LIFECYCLE_INTERCEPTOR_DID_START_REQUEST_HANDLING_FAILED));
	}

	private void launch(@Nonnull RouteTable<App> routeTable,
											@Nonnull InstanceFactory<App> instanceFactory) {
		server = DefaultServer.withPort(0)
				.host("127.0.0.1")
				.listenerCount(1)
				.workerCount(2)
				.shutdownTimeout(Duration.ofSeconds(1))
				.build();

		EdgeletConfiguration<App> configuration = EdgeletConfiguration.withServer(server, routeTable)
				.lifecycleInterceptor(new RecordingLifecycleInterceptor())
				.build();

		edgelet = Edgelet.withConfiguration(configuration);
		edgelet.launch(instanceFactory);
	}

	// Some events are logged after the response has already reached the client
	private void awaitLogged(@Nonnull LogEventType logEventType) throws InterruptedException {
		long deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);

		while (!loggedTypes().contains(logEventType)) {
			if (System.nanoTime() > deadlineNanos)
				Assertions.fail(String.format("%s was never logged; saw %s", logEventType, loggedTypes()));

			Thread.sleep(10L);
		}
	}

	@Nonnull
	private List<LogEventType> loggedTypes() {
		return logEvents.stream().map(LogEvent::getLogEventType).toList();
	}

	@Nonnull
	private HttpResponse<String> get(@Nonnull String path) throws IOException, InterruptedException {
		URI uri = URI.create("http://127.0.0.1:" + server.getBoundPort().orElseThrow() + path);
		return httpClient.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
	}

	static class App {
		final String name;

		App() {
			this("app");
		}

		App(@Nonnull String name) {
			this.name = name;
		}
	}

	private class RecordingLifecycleInterceptor implements LifecycleInterceptor {
		@Override
		public void willStartServer(@Nonnull Server server) {
			lifecycleEvents.add("willStartServer");
		}

		@Override
		public void didStartServer(@Nonnull Server server) {
			lifecycleEvents.add("didStartServer");
		}

		@Override
		public void willStopServer(@Nonnull Server server) {
			lifecycleEvents.add("willStopServer");
		}

		@Override
		public void didStopServer(@Nonnull Server server) {
			lifecycleEvents.add("didStopServer");
		}

		@Override
		public void didStartRequestHandling(@Nonnull Request request,
																				@Nullable Route<?> route) {
			lifecycleEvents.add("didStartRequestHandling " + request.getPath());
		}

		@Override
		public void didFinishRequestHandling(@Nonnull Request request,
																				 @Nullable Route<?> route,
																				 @Nonnull Integer statusCode,
																				 @Nonnull Duration processingDuration,
																				 @Nonnull List<Throwable> throwables) {
			lifecycleEvents.add("didFinishRequestHandling " + request.getPath() + " " + statusCode);
			finishedThrowables.add(throwables);
		}

		@Override
		public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
			logEvents.add(logEvent);
		}
	}
}
