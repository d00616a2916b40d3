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
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A finalized response - status, headers, cookies and body bytes - ready to go over the wire.
 * <p>
 * For streamed responses, the {@link MarshaledResponse} describes only the head; body bytes follow as chunks.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MarshaledResponse {
	@Nonnull
	private final Integer statusCode;
	@Nonnull
	private final Map<String, Set<String>> headers;
	@Nonnull
	private final List<ResponseCookie> cookies;
	@Nullable
	private final byte[] body;

	@Nonnull
	public static Builder withStatusCode(@Nonnull Integer statusCode) {
		requireNonNull(statusCode);
		return new Builder(statusCode);
	}

	protected MarshaledResponse(@Nonnull Builder builder) {
		requireNonNull(builder);

		Map<String, Set<String>> headers = Utilities.caseInsensitiveMap();

		if (builder.headers != null)
			for (Map.Entry<String, Set<String>> entry : builder.headers.entrySet())
				headers.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));

		this.statusCode = builder.statusCode;
		this.headers = Collections.unmodifiableMap(headers);
		this.cookies = builder.cookies == null ? List.of() : List.copyOf(builder.cookies);
		this.body = builder.body == null || builder.body.length == 0 ? null : builder.body;
	}

	@Override
	public String toString() {
		return format("%s{statusCode=%s, headers=%s, cookies=%s, body=%s}", getClass().getSimpleName(),
				getStatusCode(), getHeaders(), getCookies(), format("%d bytes", getBody().isPresent() ? getBody().get().length : 0));
	}

	@Nonnull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@Nonnull
	public Map<String, Set<String>> getHeaders() {
		return this.headers;
	}

	@Nonnull
	public List<ResponseCookie> getCookies() {
		return this.cookies;
	}

	@Nonnull
	public Optional<byte[]> getBody() {
		return Optional.ofNullable(this.body);
	}

	/**
	 * Builder used to construct instances of {@link MarshaledResponse} via {@link MarshaledResponse#withStatusCode(Integer)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final Integer statusCode;
		@Nullable
		private Map<String, Set<String>> headers;
		@Nullable
		private List<ResponseCookie> cookies;
		@Nullable
		private byte[] body;

		protected Builder(@Nonnull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@Nonnull
		public Builder headers(@Nullable Map<String, Set<String>> headers) {
			this.headers = headers;
			return this;
		}

		@Nonnull
		public Builder cookies(@Nullable List<ResponseCookie> cookies) {
			this.cookies = cookies;
			return this;
		}

		@Nonnull
		public Builder body(@Nullable byte[] body) {
			this.body = body;
			return this;
		}

		@Nonnull
		public MarshaledResponse build() {
			return new MarshaledResponse(this);
		}
	}
}
