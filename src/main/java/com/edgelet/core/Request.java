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

import com.edgelet.exception.IllegalFormException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.edgelet.core.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request as seen by middleware and handlers.
 * <p>
 * Handlers get a read-only view. The only way to change a request is through the {@link Editor} handed to
 * {@link Middleware#before(Object, Editor)}; once middleware returns, the request is sealed for good.
 * <p>
 * Header names are case-insensitive. Cookies and form data are parsed on demand.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Request {
	@Nonnull
	private static final Charset DEFAULT_CHARSET;
	@Nonnull
	private static final String FORM_CONTENT_TYPE;

	static {
		DEFAULT_CHARSET = StandardCharsets.UTF_8;
		FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
	}

	@Nonnull
	private final HttpMethod httpMethod;
	@Nonnull
	private final String rawUrl;
	@Nonnull
	private final RequestPath requestPath;
	@Nonnull
	private final Map<String, Set<String>> queryParameters;
	@Nullable
	private final byte[] body;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@Nullable
	private final String remainder;
	@Nonnull
	private final AtomicBoolean sealed;
	@Nonnull
	private final AtomicBoolean editorIssued;
	// Copy-on-write: the editor swaps in new unmodifiable maps, readers never lock
	@Nonnull
	private volatile Map<String, Set<String>> headers;
	@Nonnull
	private volatile Map<String, String> parameters;
	@Nonnull
	private volatile Map<String, Object> attributes;

	@Nonnull
	public static Builder with(@Nonnull HttpMethod httpMethod,
														 @Nonnull String rawUrl) {
		requireNonNull(httpMethod);
		requireNonNull(rawUrl);

		return new Builder(httpMethod, rawUrl);
	}

	protected Request(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.httpMethod = builder.httpMethod;
		this.rawUrl = builder.rawUrl;
		this.requestPath = RequestPath.fromRawUrl(builder.rawUrl);

		int indexOfQuery = builder.rawUrl.indexOf('?');
		this.queryParameters = indexOfQuery == -1 ? Map.of() : Utilities.extractQueryParametersFromQuery(builder.rawUrl.substring(indexOfQuery + 1));

		this.body = builder.body == null || builder.body.length == 0 ? null : builder.body;
		this.remoteAddress = builder.remoteAddress;
		this.remainder = builder.remainder;
		this.headers = unmodifiableHeaders(builder.headers == null ? Map.of() : builder.headers);
		this.parameters = builder.parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
		this.attributes = Map.of();
		this.sealed = new AtomicBoolean(false);
		this.editorIssued = new AtomicBoolean(false);
	}

	/**
	 * Produces a copy of this request carrying the parameters and remainder of a route match.
	 */
	@Nonnull
	public Request withRouteMatch(@Nonnull RouteMatch<?> routeMatch) {
		requireNonNull(routeMatch);

		return Request.with(getHttpMethod(), getRawUrl())
				.headers(getHeaders())
				.body(this.body)
				.remoteAddress(this.remoteAddress)
				.parameters(routeMatch.getParameters())
				.remainder(routeMatch.getRemainder().orElse(null))
				.build();
	}

	/**
	 * Issues the one-and-only editor for this request.
	 *
	 * @return the editor
	 * @throws IllegalStateException if an editor was already issued or the request is sealed
	 */
	@Nonnull
	public Editor edit() {
		if (isSealed() || !this.editorIssued.compareAndSet(false, true))
			throw new IllegalStateException("Requests may only be edited by middleware, before the handler runs");

		return new Editor(this);
	}

	/**
	 * Prevents any further editing. Idempotent.
	 */
	public void seal() {
		this.sealed.set(true);
	}

	@Nonnull
	public Boolean isSealed() {
		return this.sealed.get();
	}

	@Nonnull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	/**
	 * The request target exactly as it appeared on the request line, e.g. {@code /hello/Jane%20Q?x=1}.
	 */
	@Nonnull
	public String getRawUrl() {
		return this.rawUrl;
	}

	/**
	 * The normalized, decoded path, e.g. {@code /hello/Jane Q}.
	 */
	@Nonnull
	public String getPath() {
		return getRequestPath().getPath();
	}

	@Nonnull
	public List<String> getPathComponents() {
		return getRequestPath().getComponents();
	}

	@Nonnull
	public RequestPath getRequestPath() {
		return this.requestPath;
	}

	/**
	 * Route parameters in pattern order, e.g. {@code {first_name=Jane, last_name=Doe}}.
	 */
	@Nonnull
	public Map<String, String> getParameters() {
		return this.parameters;
	}

	@Nonnull
	public Optional<String> getParameter(@Nonnull String name) {
		requireNonNull(name);
		return Optional.ofNullable(getParameters().get(name));
	}

	/**
	 * For requests routed to a static mount, the path beneath the mount prefix.
	 */
	@Nonnull
	public Optional<String> getRemainder() {
		return Optional.ofNullable(this.remainder);
	}

	@Nonnull
	public Map<String, Set<String>> getQueryParameters() {
		return this.queryParameters;
	}

	@Nonnull
	public Optional<String> getQueryParameter(@Nonnull String name) {
		requireNonNull(name);
		return firstValue(getQueryParameters().get(name));
	}

	@Nonnull
	public Map<String, Set<String>> getHeaders() {
		return this.headers;
	}

	@Nonnull
	public Optional<String> getHeader(@Nonnull String name) {
		requireNonNull(name);
		return firstValue(getHeaders().get(name));
	}

	@Nonnull
	public Optional<String> getContentType() {
		return Utilities.extractContentTypeFromHeaders(getHeaders());
	}

	@Nonnull
	public Optional<Charset> getCharset() {
		return Utilities.extractCharsetFromHeaders(getHeaders());
	}

	@Nonnull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * The body decoded using the request's charset, or UTF-8 if none was specified.
	 */
	@Nonnull
	public Optional<String> getBodyAsString() {
		if (this.body == null)
			return Optional.empty();

		return Optional.of(new String(this.body, getCharset().orElse(DEFAULT_CHARSET)));
	}

	/**
	 * Cookies sent via {@code Cookie} headers, keyed by name, in the order the client sent them.
	 */
	@Nonnull
	public Map<String, Set<String>> getCookies() {
		return Collections.unmodifiableMap(Utilities.extractCookiesFromHeaders(getHeaders()));
	}

	@Nonnull
	public Optional<String> getCookie(@Nonnull String name) {
		requireNonNull(name);
		return firstValue(getCookies().get(name));
	}

	/**
	 * Parses the body as an {@code application/x-www-form-urlencoded} form.
	 * <p>
	 * A request with no body yields an empty form.
	 *
	 * @return field names mapped to their values, in body order
	 * @throws IllegalFormException if the request declares another content type or the body is malformed
	 */
	@Nonnull
	public Map<String, Set<String>> getForm() {
		String contentType = getContentType().orElse(null);

		if (contentType != null && !contentType.equals(FORM_CONTENT_TYPE))
			throw new IllegalFormException(format("Expected content type %s but request specified %s", FORM_CONTENT_TYPE, contentType));

		String bodyAsString = getBodyAsString().orElse(null);

		if (bodyAsString == null)
			return Map.of();

		try {
			return Collections.unmodifiableMap(Utilities.extractFormParametersFromBody(bodyAsString));
		} catch (IllegalArgumentException e) {
			throw new IllegalFormException(format("Malformed form data: %s", e.getMessage()), e);
		}
	}

	@Nonnull
	public Optional<String> getFormParameter(@Nonnull String name) {
		requireNonNull(name);
		return firstValue(getForm().get(name));
	}

	/**
	 * Values attached by middleware, e.g. an authenticated user.
	 */
	@Nonnull
	public Map<String, Object> getAttributes() {
		return this.attributes;
	}

	@Nonnull
	public <V> Optional<V> getAttribute(@Nonnull String name,
																			@Nonnull Class<V> type) {
		requireNonNull(name);
		requireNonNull(type);

		Object value = getAttributes().get(name);

		if (value == null)
			return Optional.empty();

		if (!type.isInstance(value))
			throw new IllegalArgumentException(format("Attribute '%s' is of type %s, not %s", name, value.getClass().getName(), type.getName()));

		return Optional.of(type.cast(value));
	}

	@Nonnull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@Override
	public String toString() {
		return format("%s{httpMethod=%s, path=%s}", getClass().getSimpleName(), getHttpMethod(), getPath());
	}

	@Nonnull
	protected static Map<String, Set<String>> unmodifiableHeaders(@Nonnull Map<String, Set<String>> headers) {
		requireNonNull(headers);

		Map<String, Set<String>> copy = Utilities.caseInsensitiveMap();

		for (Map.Entry<String, Set<String>> entry : headers.entrySet()) {
			Set<String> values = copy.computeIfAbsent(entry.getKey(), k -> new LinkedHashSet<>());

			for (String value : entry.getValue())
				if (trimAggressivelyToNull(value) != null)
					values.add(value);
		}

		for (Map.Entry<String, Set<String>> entry : copy.entrySet())
			entry.setValue(Collections.unmodifiableSet(entry.getValue()));

		return Collections.unmodifiableMap(copy);
	}

	@Nonnull
	private static Optional<String> firstValue(@Nullable Set<String> values) {
		if (values == null || values.isEmpty())
			return Optional.empty();

		return Optional.of(values.iterator().next());
	}

	/**
	 * Mutable view of a {@link Request} available to {@link Middleware} only.
	 * <p>
	 * Every method throws {@link IllegalStateException} once the request has been sealed.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Editor implements AutoCloseable {
		@Nonnull
		private final Request request;

		protected Editor(@Nonnull Request request) {
			requireNonNull(request);
			this.request = request;
		}

		@Nonnull
		public Request getRequest() {
			return this.request;
		}

		@Nonnull
		public Editor putHeader(@Nonnull String name,
														@Nonnull String value) {
			requireNonNull(name);
			requireNonNull(value);

			ensureEditable();

			Map<String, Set<String>> headers = mutableHeaders();
			headers.put(name, new LinkedHashSet<>(List.of(value)));
			getRequest().headers = unmodifiableHeaders(headers);
			return this;
		}

		@Nonnull
		public Editor addHeader(@Nonnull String name,
														@Nonnull String value) {
			requireNonNull(name);
			requireNonNull(value);

			ensureEditable();

			Map<String, Set<String>> headers = mutableHeaders();
			headers.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(value);
			getRequest().headers = unmodifiableHeaders(headers);
			return this;
		}

		@Nonnull
		public Editor removeHeader(@Nonnull String name) {
			requireNonNull(name);

			ensureEditable();

			Map<String, Set<String>> headers = mutableHeaders();
			headers.remove(name);
			getRequest().headers = unmodifiableHeaders(headers);
			return this;
		}

		@Nonnull
		public Editor putParameter(@Nonnull String name,
															 @Nonnull String value) {
			requireNonNull(name);
			requireNonNull(value);

			ensureEditable();

			Map<String, String> parameters = new LinkedHashMap<>(getRequest().getParameters());
			parameters.put(name, value);
			getRequest().parameters = Collections.unmodifiableMap(parameters);
			return this;
		}

		@Nonnull
		public Editor putAttribute(@Nonnull String name,
															 @Nonnull Object value) {
			requireNonNull(name);
			requireNonNull(value);

			ensureEditable();

			Map<String, Object> attributes = new LinkedHashMap<>(getRequest().getAttributes());
			attributes.put(name, value);
			getRequest().attributes = Collections.unmodifiableMap(attributes);
			return this;
		}

		@Nonnull
		public Editor removeAttribute(@Nonnull String name) {
			requireNonNull(name);

			ensureEditable();

			Map<String, Object> attributes = new LinkedHashMap<>(getRequest().getAttributes());
			attributes.remove(name);
			getRequest().attributes = Collections.unmodifiableMap(attributes);
			return this;
		}

		/**
		 * Seals the request.
		 */
		@Override
		public void close() {
			getRequest().seal();
		}

		@Nonnull
		protected Map<String, Set<String>> mutableHeaders() {
			Map<String, Set<String>> headers = Utilities.caseInsensitiveMap();

			for (Map.Entry<String, Set<String>> entry : getRequest().getHeaders().entrySet())
				headers.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));

			return headers;
		}

		protected void ensureEditable() {
			if (getRequest().isSealed())
				throw new IllegalStateException(format("%s has been sealed and can no longer be edited", getRequest()));
		}
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(HttpMethod, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final HttpMethod httpMethod;
		@Nonnull
		private final String rawUrl;
		@Nullable
		private Map<String, Set<String>> headers;
		@Nullable
		private byte[] body;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private Map<String, String> parameters;
		@Nullable
		private String remainder;

		protected Builder(@Nonnull HttpMethod httpMethod,
											@Nonnull String rawUrl) {
			requireNonNull(httpMethod);
			requireNonNull(rawUrl);

			this.httpMethod = httpMethod;
			this.rawUrl = rawUrl;
		}

		@Nonnull
		public Builder headers(@Nullable Map<String, Set<String>> headers) {
			this.headers = headers;
			return this;
		}

		@Nonnull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@Nonnull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@Nonnull
		public Builder parameters(@Nullable Map<String, String> parameters) {
			this.parameters = parameters;
			return this;
		}

		@Nonnull
		public Builder remainder(@Nullable String remainder) {
			this.remainder = remainder;
			return this;
		}

		@Nonnull
		public Request build() {
			return new Request(this);
		}
	}
}
