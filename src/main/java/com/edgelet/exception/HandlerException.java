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

package com.edgelet.exception;

import com.edgelet.core.StatusCode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown by handler code to abort request processing with a specific HTTP status.
 * <p>
 * The dispatcher responds with {@link #getStatusCode()} and the exception message as a plain-text body.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class HandlerException extends RuntimeException {
	@Nonnull
	private final Integer statusCode;

	public HandlerException(@Nonnull Integer statusCode,
													@Nullable String message) {
		this(statusCode, message, null);
	}

	public HandlerException(@Nonnull StatusCode statusCode,
													@Nullable String message) {
		this(requireNonNull(statusCode).getStatusCode(), message, null);
	}

	public HandlerException(@Nonnull Integer statusCode,
													@Nullable String message,
													@Nullable Throwable cause) {
		super(message, cause);
		requireNonNull(statusCode);

		if (statusCode < 100 || statusCode > 599)
			throw new IllegalArgumentException(format("Illegal HTTP status code %d", statusCode));

		this.statusCode = statusCode;
	}

	@Nonnull
	public Integer getStatusCode() {
		return this.statusCode;
	}
}
