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

import com.edgelet.core.MarshaledResponse;
import com.edgelet.core.ResponseChannel;
import com.edgelet.core.ResponseCookie;
import com.edgelet.core.StatusCode;
import com.edgelet.internal.microhttp.Exchange;
import com.edgelet.internal.microhttp.Header;
import com.edgelet.internal.microhttp.MicrohttpResponse;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.edgelet.core.Utilities.emptyByteArray;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Adapts a transport {@link Exchange} to the {@link ResponseChannel} contract.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class MicrohttpResponseChannel implements ResponseChannel {
	@Nonnull
	private final Exchange exchange;
	@Nonnull
	private final AtomicBoolean started;

	MicrohttpResponseChannel(@Nonnull Exchange exchange) {
		requireNonNull(exchange);

		this.exchange = exchange;
		this.started = new AtomicBoolean(false);
	}

	@Override
	public void writeResponse(@Nonnull MarshaledResponse marshaledResponse) {
		requireNonNull(marshaledResponse);

		this.started.set(true);
		getExchange().respond(toMicrohttpResponse(marshaledResponse));
	}

	@Override
	public void startStream(@Nonnull MarshaledResponse head) {
		requireNonNull(head);

		this.started.set(true);
		getExchange().beginStream(toMicrohttpResponse(head));
	}

	@Nonnull
	@Override
	public Boolean writeStreamChunk(@Nonnull byte[] chunk) {
		requireNonNull(chunk);
		return getExchange().writeChunk(chunk);
	}

	@Override
	public void finishStream() {
		getExchange().endStream();
	}

	@Override
	public void abortStream() {
		getExchange().abortStream();
	}

	@Nonnull
	@Override
	public Boolean isOpen() {
		return getExchange().isOpen();
	}

	/**
	 * Has anything been written through this channel yet?
	 */
	@Nonnull
	Boolean isStarted() {
		return this.started.get();
	}

	@Nonnull
	static MicrohttpResponse toMicrohttpResponse(@Nonnull MarshaledResponse marshaledResponse) {
		requireNonNull(marshaledResponse);

		List<Header> headers = new ArrayList<>();

		// Multiple values for the same name go out as repeated header lines
		for (Map.Entry<String, Set<String>> entry : marshaledResponse.getHeaders().entrySet())
			for (String value : entry.getValue())
				headers.add(new Header(entry.getKey(), value == null ? "" : value));

		for (ResponseCookie cookie : marshaledResponse.getCookies())
			headers.add(new Header("Set-Cookie", cookie.toSetCookieHeaderRepresentation()));

		Integer statusCode = marshaledResponse.getStatusCode();
		byte[] body = marshaledResponse.getBody().orElse(emptyByteArray());

		return new MicrohttpResponse(statusCode, StatusCode.reasonPhraseFor(statusCode), headers, body);
	}

	@Nonnull
	private Exchange getExchange() {
		return this.exchange;
	}

	@Override
	public String toString() {
		return format("%s{started=%s, open=%s}", getClass().getSimpleName(), isStarted(), isOpen());
	}
}
