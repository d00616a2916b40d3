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
import com.edgelet.core.LifecycleInterceptor;
import com.edgelet.core.LogEvent;
import com.edgelet.core.LogEventType;
import com.edgelet.core.MarshaledResponse;
import com.edgelet.core.RouteTable;
import com.edgelet.core.Server;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class DefaultServerTests {
	@Test
	public void builderValidation() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(-1).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(70_000).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(0).listenerCount(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(0).workerCount(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(0).requestTimeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> DefaultServer.withPort(0).maximumRequestSizeInBytes(0).build());

		DefaultServer server = DefaultServer.withPort(0).listenerCount(3).workerCount(5).build();

		Assertions.assertEquals(3, server.getListenerCount());
		Assertions.assertEquals(5, server.getWorkerCount());
		Assertions.assertFalse(server.isStarted());
		Assertions.assertEquals(Optional.empty(), server.getBoundPort());
	}

	@Test
	public void startWithoutInitializationFails() {
		DefaultServer server = DefaultServer.withPort(0).build();
		Assertions.assertThrows(IllegalStateException.class, server::start);
	}

	@Test
	public void portInUseFails() throws IOException {
		try (ServerSocket occupied = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
			DefaultServer server = DefaultServer.withPort(occupied.getLocalPort()).host("127.0.0.1").build();
			initialize(server, new CopyOnWriteArrayList<>(), (request, responseChannel) -> Optional.empty());

			Assertions.assertThrows(UncheckedIOException.class, server::start);
			Assertions.assertFalse(server.isStarted());
		}
	}

	@Test
	public void tasksRunOnWorkerThreads() throws IOException {
		List<String> threadNames = new CopyOnWriteArrayList<>();

		DefaultServer server = startedServer(new CopyOnWriteArrayList<>(), (request, responseChannel) -> Optional.of(() -> {
			threadNames.add(Thread.currentThread().getName());
			responseChannel.writeResponse(MarshaledResponse.withStatusCode(200)
					.body(request.getPath().getBytes(StandardCharsets.UTF_8))
					.build());
		}));

		try {
			Assertions.assertEquals("HTTP/1.1 200 OK", statusLine(server, "GET /work HTTP/1.1\r\nConnection: close\r\n\r\n"));
			Assertions.assertEquals(1, threadNames.size());
			Assertions.assertTrue(threadNames.get(0).contains("worker"), threadNames.get(0));
		} finally {
			server.stop();
		}

		Assertions.assertFalse(server.isStarted());
	}

	@Test
	public void unknownMethodIsNotImplemented() throws IOException {
		List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		DefaultServer server = startedServer(logEvents, (request, responseChannel) -> Optional.empty());

		try {
			Assertions.assertEquals("HTTP/1.1 501 Not Implemented", statusLine(server, "BREW /pot HTTP/1.1\r\nConnection: close\r\n\r\n"));
			Assertions.assertEquals(LogEventType.SERVER_UNPARSEABLE_REQUEST, logEvents.get(0).getLogEventType());
		} finally {
			server.stop();
		}
	}

	@Test
	public void failingTaskGetsInternalServerError() throws IOException {
		List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		DefaultServer server = startedServer(logEvents, (request, responseChannel) -> Optional.of(() -> {
			throw new IllegalStateException("task failed");
		}));

		try {
			Assertions.assertEquals("HTTP/1.1 500 Internal Server Error", statusLine(server, "GET / HTTP/1.1\r\nConnection: close\r\n\r\n"));
			Assertions.assertEquals(LogEventType.SERVER_INTERNAL_ERROR, logEvents.get(0).getLogEventType());
		} finally {
			server.stop();
		}
	}

	@Test
	public void failingRoutingGetsInternalServerError() throws IOException {
		DefaultServer server = startedServer(new CopyOnWriteArrayList<>(), (request, responseChannel) -> {
			throw new IllegalStateException("routing failed");
		});

		try {
			Assertions.assertEquals("HTTP/1.1 500 Internal Server Error", statusLine(server, "GET / HTTP/1.1\r\nConnection: close\r\n\r\n"));
		} finally {
			server.stop();
		}
	}

	@Test
	public void clientHangingUpMidStreamIsNotAnInternalError() throws Exception {
		List<LogEvent> logEvents = new CopyOnWriteArrayList<>();
		CountDownLatch streamingStopped = new CountDownLatch(1);
		byte[] chunk = new byte[16 * 1_024];

		DefaultServer server = startedServer(logEvents, (request, responseChannel) -> Optional.of(() -> {
			responseChannel.startStream(MarshaledResponse.withStatusCode(200).build());

			try {
				for (int i = 0; i < 1_000; ++i) {
					if (!responseChannel.writeStreamChunk(chunk)) {
						streamingStopped.countDown();
						return;
					}

					Thread.sleep(5L);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}));

		try {
			try (Socket socket = new Socket("127.0.0.1", server.getBoundPort().orElseThrow())) {
				socket.setSoTimeout(5_000);
				socket.setSoLinger(true, 0);
				socket.getOutputStream().write("GET /stream HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
				socket.getOutputStream().flush();

				BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
				Assertions.assertEquals("HTTP/1.1 200 OK", reader.readLine());
			}

			Assertions.assertTrue(streamingStopped.await(10, TimeUnit.SECONDS), "Stream never noticed the client was gone");
			Assertions.assertTrue(logEvents.stream().noneMatch(logEvent -> logEvent.getLogEventType() == LogEventType.SERVER_INTERNAL_ERROR),
					logEvents::toString);
		} finally {
			server.stop();
		}
	}

	@Test
	public void startAndStopAreIdempotent() {
		DefaultServer server = startedServer(new CopyOnWriteArrayList<>(), (request, responseChannel) -> Optional.empty());
		Integer port = server.getBoundPort().orElseThrow();

		server.start();
		Assertions.assertEquals(port, server.getBoundPort().orElseThrow());

		server.stop();
		server.stop();

		Assertions.assertFalse(server.isStarted());
	}

	@Nonnull
	private DefaultServer startedServer(@Nonnull List<LogEvent> logEvents,
																			@Nonnull Server.RequestHandler requestHandler) {
		DefaultServer server = DefaultServer.withPort(0)
				.host("127.0.0.1")
				.listenerCount(1)
				.workerCount(2)
				.shutdownTimeout(Duration.ofSeconds(1))
				.build();

		initialize(server, logEvents, requestHandler);
		server.start();

		return server;
	}

	private void initialize(@Nonnull DefaultServer server,
													@Nonnull List<LogEvent> logEvents,
													@Nonnull Server.RequestHandler requestHandler) {
		EdgeletConfiguration<Object> configuration = EdgeletConfiguration.withServer(server, RouteTable.create())
				.lifecycleInterceptor(new LifecycleInterceptor() {
					@Override
					public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				})
				.build();

		server.initialize(configuration, requestHandler);
	}

	@Nonnull
	private String statusLine(@Nonnull DefaultServer server,
														@Nonnull String rawRequest) throws IOException {
		try (Socket socket = new Socket("127.0.0.1", server.getBoundPort().orElseThrow())) {
			socket.setSoTimeout(5_000);
			socket.getOutputStream().write(rawRequest.getBytes(StandardCharsets.ISO_8859_1));
			socket.getOutputStream().flush();

			BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
			String statusLine = reader.readLine();

			// Drain so the server finishes writing before the socket closes
			while (reader.readLine() != null) {
				// Nothing to do
			}

			return statusLine;
		}
	}
}
