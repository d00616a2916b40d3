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
import javax.annotation.concurrent.Immutable;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of a successful {@link RouteTable#match(HttpMethod, RequestPath)}.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public class RouteMatch<T> {
	@Nonnull
	private final Route<T> route;
	@Nonnull
	private final RequestPath requestPath;
	@Nonnull
	private final Map<String, String> parameters;
	@Nullable
	private final String remainder;

	public RouteMatch(@Nonnull Route<T> route,
										@Nonnull RequestPath requestPath) {
		requireNonNull(route);
		requireNonNull(requestPath);

		this.route = route;
		this.requestPath = requestPath;
		this.parameters = route.getRoutePattern().extractParameters(requestPath);
		this.remainder = route.getRoutePattern().extractRemainder(requestPath).orElse(null);
	}

	@Override
	public String toString() {
		return format("%s{route=%s, requestPath=%s, parameters=%s, remainder=%s}", getClass().getSimpleName(),
				getRoute(), getRequestPath().getPath(), getParameters(), getRemainder().orElse(null));
	}

	@Nonnull
	public Route<T> getRoute() {
		return this.route;
	}

	@Nonnull
	public Callback<T> getCallback() {
		return getRoute().getCallback();
	}

	@Nonnull
	public RequestPath getRequestPath() {
		return this.requestPath;
	}

	/**
	 * Parameter names mapped to their matched values, in pattern order.
	 */
	@Nonnull
	public Map<String, String> getParameters() {
		return this.parameters;
	}

	/**
	 * The path beneath a mount prefix, present only for mount routes.
	 */
	@Nonnull
	public Optional<String> getRemainder() {
		return Optional.ofNullable(this.remainder);
	}
}
