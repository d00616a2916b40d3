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

import com.edgelet.exception.HandlerException;
import com.edgelet.exception.TemplateRenderException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.edgelet.core.Utilities.firstHeaderValue;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Writes the response to one request.
 * <p>
 * A response moves through {@link State#BUILDING} to {@link State#COMMITTED}, optionally passing through
 * {@link State#STREAMING}:
 * <ul>
 *   <li>While building, status, headers and cookies may be set freely</li>
 *   <li>{@link #send(byte[])} (and friends) commits at once; {@link #stream()} switches to streaming, after which
 *   body chunks are flushed as they are appended until the {@link ResponseStream} is closed</li>
 *   <li>Once committed, every mutator throws {@link IllegalStateException}</li>
 * </ul>
 * <p>
 * Exactly one response is ever written per request. Instances may be handed to other threads, e.g. to finish a
 * {@link #defer() deferred} response asynchronously.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Response {
	@Nonnull
	private static final String DEFAULT_TEXT_CONTENT_TYPE;
	@Nonnull
	private static final String DEFAULT_TEMPLATE_CONTENT_TYPE;

	static {
		DEFAULT_TEXT_CONTENT_TYPE = "text/plain; charset=UTF-8";
		DEFAULT_TEMPLATE_CONTENT_TYPE = "text/html; charset=UTF-8";
	}

	@Nonnull
	private final Request request;
	@Nonnull
	private final ResponseChannel responseChannel;
	@Nullable
	private final TemplateEngine templateEngine;
	@Nullable
	private final FileLoader fileLoader;
	@Nonnull
	private final Consumer<LogEvent> logEventConsumer;
	@Nullable
	private final Consumer<Integer> completionListener;
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private final Map<String, Set<String>> headers;
	@Nonnull
	private final List<ResponseCookie> cookies;
	@Nonnull
	private State state;
	@Nonnull
	private Integer statusCode;
	@Nonnull
	private Boolean deferred;
	@Nullable
	private ResponseStream responseStream;

	@Nonnull
	public static Builder withChannel(@Nonnull Request request,
																		@Nonnull ResponseChannel responseChannel) {
		requireNonNull(request);
		requireNonNull(responseChannel);

		return new Builder(request, responseChannel);
	}

	protected Response(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.request = builder.request;
		this.responseChannel = builder.responseChannel;
		this.templateEngine = builder.templateEngine;
		this.fileLoader = builder.fileLoader;
		this.logEventConsumer = builder.logEventConsumer == null ? (logEvent -> {}) : builder.logEventConsumer;
		this.completionListener = builder.completionListener;
		this.lock = new ReentrantLock();
		this.headers = Utilities.caseInsensitiveMap();
		this.cookies = new ArrayList<>();
		this.state = State.BUILDING;
		this.statusCode = 200;
		this.deferred = false;
	}

	@Nonnull
	public Response status(@Nonnull Integer statusCode) {
		requireNonNull(statusCode);

		if (statusCode < 100 || statusCode > 599)
			throw new IllegalArgumentException(format("Illegal HTTP status code %d", statusCode));

		getLock().lock();

		try {
			ensureState(State.BUILDING);
			this.statusCode = statusCode;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Response status(@Nonnull StatusCode statusCode) {
		requireNonNull(statusCode);
		return status(statusCode.getStatusCode());
	}

	/**
	 * Sets a header, replacing any existing values for the same (case-insensitive) name.
	 */
	@Nonnull
	public Response header(@Nonnull String name,
												 @Nonnull String value) {
		requireNonNull(name);
		requireNonNull(value);

		getLock().lock();

		try {
			ensureState(State.BUILDING);

			Set<String> values = new LinkedHashSet<>();
			values.add(value);
			this.headers.put(name, values);
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Adds a header value, keeping any existing values for the same name.
	 */
	@Nonnull
	public Response addHeader(@Nonnull String name,
														@Nonnull String value) {
		requireNonNull(name);
		requireNonNull(value);

		getLock().lock();

		try {
			ensureState(State.BUILDING);
			this.headers.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(value);
			return this;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Response contentType(@Nonnull String contentType) {
		requireNonNull(contentType);
		return header("Content-Type", contentType);
	}

	@Nonnull
	public Response cookie(@Nonnull ResponseCookie responseCookie) {
		requireNonNull(responseCookie);

		getLock().lock();

		try {
			ensureState(State.BUILDING);
			this.cookies.add(responseCookie);
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Commits the response with the given body.
	 */
	public void send(@Nonnull byte[] body) {
		requireNonNull(body);
		commit(body, null);
	}

	/**
	 * Commits the response with the given text as a UTF-8 body, defaulting the content type to {@code text/plain}.
	 */
	public void send(@Nonnull String body) {
		requireNonNull(body);
		commit(body.getBytes(StandardCharsets.UTF_8), DEFAULT_TEXT_CONTENT_TYPE);
	}

	/**
	 * Commits an empty-bodied response with the given status.
	 */
	public void sendStatus(@Nonnull StatusCode statusCode) {
		requireNonNull(statusCode);

		Integer finalStatusCode;

		getLock().lock();

		try {
			status(statusCode);
			finalStatusCode = commitWhileLocked(null, null);
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
	}

	/**
	 * Renders a template and commits the result, defaulting the content type to {@code text/html}.
	 * <p>
	 * If rendering fails, an HTTP 500 is committed instead and the failure is logged.
	 *
	 * @param templateName the registered template name, e.g. {@code hello} for {@code views/hello.hbs}
	 * @param data         values made available to the template
	 */
	public void render(@Nonnull String templateName,
										 @Nonnull Map<String, ?> data) {
		requireNonNull(templateName);
		requireNonNull(data);

		getLock().lock();

		try {
			ensureState(State.BUILDING);
		} finally {
			getLock().unlock();
		}

		String html;

		try {
			if (this.templateEngine == null)
				throw new TemplateRenderException(format("Unable to render '%s' because no template engine is configured", templateName));

			html = this.templateEngine.render(templateName, data);
		} catch (RuntimeException e) {
			log(LogEvent.with(LogEventType.TEMPLATE_RENDERING_FAILED, format("Unable to render template '%s'", templateName))
					.throwable(e)
					.request(getRequest())
					.build());

			sendFailsafe(500, null);
			return;
		}

		commit(html.getBytes(StandardCharsets.UTF_8), DEFAULT_TEMPLATE_CONTENT_TYPE);
	}

	/**
	 * Commits an HTTP 302 redirect to the given URL.
	 */
	public void redirect(@Nonnull String url) {
		requireNonNull(url);
		redirect(url, RedirectType.HTTP_302_FOUND);
	}

	public void redirect(@Nonnull String url,
											 @Nonnull RedirectType redirectType) {
		requireNonNull(url);
		requireNonNull(redirectType);

		Integer finalStatusCode;

		getLock().lock();

		try {
			status(redirectType.getStatusCode());
			header("Location", url);
			finalStatusCode = commitWhileLocked(null, null);
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
	}

	/**
	 * Commits the contents of a file, picking a content type from its extension if none was set.
	 * <p>
	 * A missing file commits an HTTP 404; an unreadable one commits an HTTP 500 and is logged.
	 */
	public void sendFile(@Nonnull Path path) {
		requireNonNull(path);

		getLock().lock();

		try {
			ensureState(State.BUILDING);
		} finally {
			getLock().unlock();
		}

		byte[] bytes;

		try {
			if (this.fileLoader == null)
				throw new IOException(format("Unable to load %s because no file loader is configured", path));

			bytes = this.fileLoader.load(path);
		} catch (NoSuchFileException | FileNotFoundException e) {
			sendFailsafe(404, null);
			return;
		} catch (IOException | RuntimeException e) {
			log(LogEvent.with(LogEventType.FILE_LOADING_FAILED, format("Unable to load file %s", path))
					.throwable(e)
					.request(getRequest())
					.build());

			sendFailsafe(500, null);
			return;
		}

		Path fileName = path.getFileName();
		commit(bytes, Utilities.contentTypeForFileName(fileName == null ? "" : fileName.toString()));
	}

	/**
	 * Switches to streaming: the head is sent now and body chunks follow as they are appended.
	 *
	 * @return the stream; it must be {@link ResponseStream#close() closed} to finish the response
	 * @throws IllegalStateException if the response is not {@link State#BUILDING}
	 */
	@Nonnull
	public ResponseStream stream() {
		getLock().lock();

		try {
			ensureState(State.BUILDING);

			getResponseChannel().startStream(toMarshaledResponse(null));

			this.state = State.STREAMING;
			this.responseStream = new ResponseStream(this);
			return this.responseStream;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Declares that the response will be completed later, from another thread.
	 */
	@Nonnull
	public Response defer() {
		getLock().lock();

		try {
			this.deferred = true;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Runs {@code responseFunction}; its returned status commits an empty-bodied response, and a thrown
	 * {@link HandlerException} commits that exception's status and message instead.
	 * <p>
	 * If the function commits the response itself, its outcome is ignored. Other exceptions propagate.
	 */
	public void handle(@Nonnull ResponseFunction responseFunction) throws Exception {
		requireNonNull(responseFunction);

		StatusCode outcome;

		try {
			outcome = responseFunction.apply(this);
		} catch (HandlerException e) {
			if (getState() != State.BUILDING)
				throw e;

			sendFailsafe(e.getStatusCode(), e.getMessage());
			return;
		}

		Integer finalStatusCode = null;

		getLock().lock();

		try {
			if (getState() == State.BUILDING) {
				status(outcome);
				finalStatusCode = commitWhileLocked(null, null);
			}
		} finally {
			getLock().unlock();
		}

		if (finalStatusCode != null)
			notifyCompletion(finalStatusCode);
	}

	/**
	 * Discards any headers and cookies set so far and commits a plain-text error response.
	 * <p>
	 * A response that is already streaming is aborted instead: the chunks sent so far stand, but the body is left
	 * unterminated and the connection is closed.
	 *
	 * @param statusCode the error status
	 * @param message    the body, or {@code null} for the stock {@code HTTP <code>: <reason>} text
	 * @return {@code true} if the error response was written, {@code false} if the response was already committed or streaming
	 */
	@Nonnull
	public Boolean sendFailsafe(@Nonnull Integer statusCode,
															@Nullable String message) {
		requireNonNull(statusCode);

		Integer finalStatusCode;
		boolean written;

		getLock().lock();

		try {
			if (getState() == State.STREAMING) {
				getResponseChannel().abortStream();
				this.state = State.COMMITTED;
				finalStatusCode = this.statusCode;
				written = false;
			} else if (getState() == State.BUILDING) {
				this.headers.clear();
				this.cookies.clear();
				this.statusCode = statusCode;

				String body = message == null ? format("HTTP %d: %s", statusCode, StatusCode.reasonPhraseFor(statusCode)) : message;
				finalStatusCode = commitWhileLocked(body.getBytes(StandardCharsets.UTF_8), DEFAULT_TEXT_CONTENT_TYPE);
				written = true;
			} else {
				return false;
			}
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
		return written;
	}

	/**
	 * Commits the response as it stands (current status and headers, empty body) if it is still being built.
	 *
	 * @return {@code true} if this call committed the response
	 */
	@Nonnull
	public Boolean commitIfBuilding() {
		Integer finalStatusCode;

		getLock().lock();

		try {
			if (getState() != State.BUILDING)
				return false;

			finalStatusCode = commitWhileLocked(null, null);
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
		return true;
	}

	protected void commit(@Nullable byte[] body,
												@Nullable String defaultContentType) {
		Integer finalStatusCode;

		getLock().lock();

		try {
			finalStatusCode = commitWhileLocked(body, defaultContentType);
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
	}

	// Caller holds the lock and notifies completion with the returned status after releasing it
	@Nonnull
	protected Integer commitWhileLocked(@Nullable byte[] body,
																			@Nullable String defaultContentType) {
		ensureState(State.BUILDING);

		if (defaultContentType != null && body != null && body.length > 0 && !this.headers.containsKey("Content-Type"))
			this.headers.put("Content-Type", new LinkedHashSet<>(List.of(defaultContentType)));

		getResponseChannel().writeResponse(toMarshaledResponse(body));

		this.state = State.COMMITTED;
		return this.statusCode;
	}

	// Called by ResponseStream
	@Nonnull
	protected Boolean appendChunk(@Nonnull ResponseStream responseStream,
																@Nonnull byte[] chunk) {
		requireNonNull(responseStream);
		requireNonNull(chunk);

		getLock().lock();

		try {
			if (getState() != State.STREAMING)
				throw new IllegalStateException("Unable to append to a stream that has already been closed");

			if (responseStream.hasFailed())
				return false;

			// An empty chunk would terminate chunked encoding early
			if (chunk.length == 0)
				return getResponseChannel().isOpen();

			if (getResponseChannel().writeStreamChunk(chunk))
				return true;

			responseStream.markFailed();
		} finally {
			getLock().unlock();
		}

		log(LogEvent.with(LogEventType.STREAM_WRITING_FAILED, "Client went away during a streamed response; further chunks will be dropped")
				.request(getRequest())
				.build());

		return false;
	}

	// Called by ResponseStream
	protected void finishStream() {
		Integer finalStatusCode;

		getLock().lock();

		try {
			if (getState() != State.STREAMING)
				return;

			getResponseChannel().finishStream();

			this.state = State.COMMITTED;
			finalStatusCode = this.statusCode;
		} finally {
			getLock().unlock();
		}

		notifyCompletion(finalStatusCode);
	}

	@Nonnull
	protected MarshaledResponse toMarshaledResponse(@Nullable byte[] body) {
		return MarshaledResponse.withStatusCode(this.statusCode)
				.headers(this.headers)
				.cookies(this.cookies)
				.body(body)
				.build();
	}

	protected void notifyCompletion(@Nonnull Integer finalStatusCode) {
		requireNonNull(finalStatusCode);

		if (this.completionListener != null)
			this.completionListener.accept(finalStatusCode);
	}

	protected void ensureState(@Nonnull State requiredState) {
		requireNonNull(requiredState);

		if (this.state != requiredState)
			throw new IllegalStateException(format("Response for %s is %s, but this operation requires it to be %s", getRequest(), this.state, requiredState));
	}

	protected void log(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);
		this.logEventConsumer.accept(logEvent);
	}

	@Nonnull
	public State getState() {
		getLock().lock();

		try {
			return this.state;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Integer getStatusCode() {
		getLock().lock();

		try {
			return this.statusCode;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Optional<String> getHeader(@Nonnull String name) {
		requireNonNull(name);

		getLock().lock();

		try {
			return firstHeaderValue(this.headers, name);
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Boolean isDeferred() {
		getLock().lock();

		try {
			return this.deferred;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Boolean isCommitted() {
		return getState() == State.COMMITTED;
	}

	@Nonnull
	public Optional<ResponseStream> getResponseStream() {
		getLock().lock();

		try {
			return Optional.ofNullable(this.responseStream);
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Request getRequest() {
		return this.request;
	}

	@Nonnull
	protected ResponseChannel getResponseChannel() {
		return this.responseChannel;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@Override
	public String toString() {
		return format("%s{request=%s, state=%s, statusCode=%s}", getClass().getSimpleName(), getRequest(), getState(), getStatusCode());
	}

	/**
	 * Lifecycle states of a {@link Response}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum State {
		BUILDING,
		STREAMING,
		COMMITTED
	}

	/**
	 * Builder used to construct instances of {@link Response} via {@link Response#withChannel(Request, ResponseChannel)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final Request request;
		@Nonnull
		private final ResponseChannel responseChannel;
		@Nullable
		private TemplateEngine templateEngine;
		@Nullable
		private FileLoader fileLoader;
		@Nullable
		private Consumer<LogEvent> logEventConsumer;
		@Nullable
		private Consumer<Integer> completionListener;

		protected Builder(@Nonnull Request request,
											@Nonnull ResponseChannel responseChannel) {
			requireNonNull(request);
			requireNonNull(responseChannel);

			this.request = request;
			this.responseChannel = responseChannel;
		}

		@Nonnull
		public Builder templateEngine(@Nullable TemplateEngine templateEngine) {
			this.templateEngine = templateEngine;
			return this;
		}

		@Nonnull
		public Builder fileLoader(@Nullable FileLoader fileLoader) {
			this.fileLoader = fileLoader;
			return this;
		}

		@Nonnull
		public Builder logEventConsumer(@Nullable Consumer<LogEvent> logEventConsumer) {
			this.logEventConsumer = logEventConsumer;
			return this;
		}

		/**
		 * Called once, with the final status code, when the response is committed.
		 */
		@Nonnull
		public Builder completionListener(@Nullable Consumer<Integer> completionListener) {
			this.completionListener = completionListener;
			return this;
		}

		@Nonnull
		public Response build() {
			return new Response(this);
		}
	}
}
