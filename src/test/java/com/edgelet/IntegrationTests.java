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
import com.edgelet.core.Request;
import com.edgelet.core.Route;
import com.edgelet.core.impl.DefaultServer;
import com.edgelet.core.impl.HandlebarsTemplateEngine;
import com.edgelet.example.ExampleApp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link ExampleApp} on a real socket and talks to it over HTTP.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class IntegrationTests {
	private static final String HOME_HTML = "<html><head><title>home</title></head><body><h1>Hello, world!</h1></body></html>";
	private static final Duration STREAM_DELAY = Duration.ofMillis(250);

	private final AtomicInteger counter = new AtomicInteger();
	private final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
	private final BlockingQueue<String> finishedRequests = new LinkedBlockingQueue<>();
	private final HttpClient httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(5))
			.version(HttpClient.Version.HTTP_1_1)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build();

	private DefaultServer server;
	private Edgelet<ExampleApp> edgelet;

	@BeforeEach
	public void launch() {
		this.server = DefaultServer.withPort(0)
				.host("127.0.0.1")
				.listenerCount(1)
				.workerCount(4)
				.shutdownTimeout(Duration.ofSeconds(1))
				.build();

		EdgeletConfiguration<ExampleApp> configuration = EdgeletConfiguration.withServer(server,
						ExampleApp.routes(ExampleApp.resourceDirectory("web")))
				.templateEngine(HandlebarsTemplateEngine.withViewsDirectory(ExampleApp.resourceDirectory("views")).build()
						.registerTemplate("hello"))
				.lifecycleInterceptor(new LifecycleInterceptor() {
					@Override
					public void didFinishRequestHandling(@Nonnull Request request,
																							 @Nullable Route<?> route,
																							 @Nonnull Integer statusCode,
																							 @Nonnull Duration processingDuration,
																							 @Nonnull List<Throwable> throwables) {
						finishedRequests.add(request.getHttpMethod().name() + " " + request.getPath() + " " + statusCode);
					}

					@Override
					public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		this.edgelet = Edgelet.withConfiguration(configuration);
		this.edgelet.launch(InstanceFactory.fresh(() -> new ExampleApp(counter, STREAM_DELAY)));
	}

	@AfterEach
	public void shutDown() {
		this.edgelet.close();
		Assertions.assertFalse(this.edgelet.isStarted());
	}

	@Test
	public void homeSendsExactBody() throws Exception {
		HttpResponse<String> response = get("/");

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals(HOME_HTML, response.body());
		Assertions.assertEquals("text/html; charset=UTF-8", response.headers().firstValue("Content-Type").orElse(null));
		Assertions.assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
		Assertions.assertEquals("GET / 200", finishedRequests.poll(5, TimeUnit.SECONDS));
	}

	@Test
	public void helloBindsPathParameters() throws Exception {
		HttpResponse<String> first = get("/hello/Jane/Doe");
		HttpResponse<String> second = get("/hello/Ada/Lovelace");

		Assertions.assertEquals(200, first.statusCode());
		Assertions.assertTrue(first.body().contains("<title>hello</title>"), first.body());
		Assertions.assertTrue(first.body().contains("Hello, Jane Doe!"), first.body());
		Assertions.assertTrue(first.body().contains("Visitor #0"), first.body());
		Assertions.assertTrue(first.body().contains("<h2>Contents</h2>"), first.body());
		Assertions.assertTrue(first.body().contains("<li>item 2</li>"), first.body());

		// Fresh instance per request, shared counter
		Assertions.assertTrue(second.body().contains("Hello, Ada Lovelace!"), second.body());
		Assertions.assertTrue(second.body().contains("Visitor #1"), second.body());
	}

	@Test
	public void missingPathSegmentsAreNotFound() throws Exception {
		HttpResponse<String> response = get("/hello");

		Assertions.assertEquals(404, response.statusCode());
		Assertions.assertEquals("HTTP 404: Not Found", response.body());
		Assertions.assertEquals("GET /hello 404", finishedRequests.poll(5, TimeUnit.SECONDS));

		Assertions.assertEquals(404, get("/hello/Jane").statusCode());
		Assertions.assertEquals(404, get("/hello/Jane/Doe/Smith").statusCode());
	}

	@Test
	public void streamingIsObservedProgressively() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(uri("/streaming")).GET().build();
		HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

		Assertions.assertEquals(200, response.statusCode());

		try (InputStream body = response.body()) {
			byte[] first = body.readNBytes(4);
			long firstChunkNanos = System.nanoTime();

			byte[] rest = body.readAllBytes();
			long lastChunkNanos = System.nanoTime();

			Assertions.assertEquals("toto", new String(first, StandardCharsets.UTF_8));
			Assertions.assertEquals("tatatiti", new String(rest, StandardCharsets.UTF_8));
			Assertions.assertTrue(Duration.ofNanos(lastChunkNanos - firstChunkNanos).compareTo(STREAM_DELAY) >= 0,
					"The first chunk should arrive before the handler finishes");
		}

		Assertions.assertEquals("GET /streaming 200", finishedRequests.poll(5, TimeUnit.SECONDS));
	}

	@Test
	public void loginSetsCookie() throws Exception {
		HttpResponse<String> response = postForm("/login", "username=jane");

		Assertions.assertEquals(204, response.statusCode());

		String setCookie = response.headers().firstValue("Set-Cookie").orElse("");

		Assertions.assertTrue(setCookie.startsWith("name=jane"), setCookie);
		Assertions.assertTrue(setCookie.contains("Domain=localhost"), setCookie);
		Assertions.assertTrue(setCookie.contains("HttpOnly"), setCookie);
	}

	@Test
	public void loginRejectsReservedUserName() throws Exception {
		HttpResponse<String> response = postForm("/login", "username=error");

		Assertions.assertEquals(400, response.statusCode());
		Assertions.assertEquals("bad user name: error", response.body());
		Assertions.assertTrue(response.headers().firstValue("Set-Cookie").isEmpty());
	}

	@Test
	public void loginRejectsMalformedForm() throws Exception {
		Assertions.assertEquals(400, postForm("/login", "username=%zz").statusCode());
	}

	@Test
	public void settingsSeesCookieAndMiddleware() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(uri("/settings"))
				.header("Cookie", "name=jane")
				.GET()
				.build();

		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertTrue(response.body().contains("<p>jane</p>"), response.body());
		Assertions.assertEquals("/settings", response.headers().firstValue("X-Middleware-Path").orElse(null));

		Assertions.assertTrue(get("/settings").body().contains("<p>nope</p>"));
	}

	@Test
	public void redirectSendsLocation() throws Exception {
		HttpResponse<String> response = get("/redirect");

		Assertions.assertEquals(302, response.statusCode());
		Assertions.assertEquals("http://google.com", response.headers().firstValue("Location").orElse(null));
	}

	@Test
	public void staticFilesAreServed() throws Exception {
		HttpResponse<String> css = get("/static/css/site.css");

		Assertions.assertEquals(200, css.statusCode());
		Assertions.assertEquals("body { font-family: sans-serif; }\n", css.body());
		Assertions.assertEquals("text/css; charset=UTF-8", css.headers().firstValue("Content-Type").orElse(null));

		Assertions.assertEquals(200, get("/static/index.html").statusCode());
		Assertions.assertEquals(404, get("/static/missing.js").statusCode());
		Assertions.assertEquals(404, get("/static").statusCode());
	}

	@Test
	public void headFallsBackToGet() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(uri("/"))
				.method("HEAD", HttpRequest.BodyPublishers.noBody())
				.build();

		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

		Assertions.assertEquals(200, response.statusCode());
		Assertions.assertEquals("", response.body());
		Assertions.assertEquals(String.valueOf(HOME_HTML.length()), response.headers().firstValue("Content-Length").orElse(null));
	}

	@Test
	public void routesAreFrozenOnceLaunched() {
		Assertions.assertThrows(IllegalStateException.class, () ->
				edgelet.getEdgeletConfiguration().getRouteTable().get("/late", (app, request, response) -> response.send("late")));
	}

	@Test
	public void launchingTwiceIsHarmless() throws Exception {
		edgelet.launch(InstanceFactory.fresh(() -> new ExampleApp(counter, STREAM_DELAY)));
		Assertions.assertEquals(200, get("/").statusCode());
	}

	@Nonnull
	private HttpResponse<String> get(@Nonnull String path) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
		return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	@Nonnull
	private HttpResponse<String> postForm(@Nonnull String path,
																				@Nonnull String form) throws IOException, InterruptedException {
		HttpRequest request = HttpRequest.newBuilder(uri(path))
				.header("Content-Type", "application/x-www-form-urlencoded")
				.POST(HttpRequest.BodyPublishers.ofString(form))
				.build();

		return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
	}

	@Nonnull
	private URI uri(@Nonnull String path) {
		return URI.create("http://127.0.0.1:" + server.getBoundPort().orElseThrow() + path);
	}
}
