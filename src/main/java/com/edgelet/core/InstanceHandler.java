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
 * A route handler that runs against the per-request application instance.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface InstanceHandler<T> {
	/**
	 * Handles a request.
	 * <p>
	 * Implementations must either complete {@code response} (e.g. {@link Response#send(String)}), switch it to streaming via
	 * {@link Response#stream()}, or mark it {@link Response#defer() deferred}.
	 *
	 * @param instance the application instance created for this request
	 * @param request  the request
	 * @param response the response to write
	 * @throws Exception if an error occurs; a {@link com.edgelet.exception.HandlerException} carries its own status
	 */
	void handle(@Nonnull T instance,
							@Nonnull Request request,
							@Nonnull Response response) throws Exception;
}
