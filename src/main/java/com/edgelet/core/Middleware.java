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

/**
 * The single hook run on each fresh application instance before its route handler.
 * <p>
 * Middleware may rewrite request state through the supplied {@link Request.Editor} (for example, attaching an
 * authenticated user) but has no access to the response. It is not run for {@link StaticHandler} routes.
 * <p>
 * A failure thrown from {@link #before(Object, Request.Editor)} aborts the request the same way a handler failure would:
 * a {@link com.edgelet.exception.HandlerException} (for example, a
 * {@link com.edgelet.exception.BadRequestException}) commits its own status and message, anything else an HTTP 500.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Middleware<T> {
	void before(@Nonnull T instance,
							@Nonnull Request.Editor requestEditor) throws Exception;

	/**
	 * Acquires middleware that does nothing.
	 */
	@Nonnull
	static <T> Middleware<T> noop() {
		return (instance, requestEditor) -> {
			// No-op
		};
	}
}
