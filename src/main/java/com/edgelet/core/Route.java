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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP method and path pattern bound to the {@link Callback} that handles it.
 * <p>
 * Routes are created by {@link RouteTable} at registration time and never change afterwards.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Immutable
public class Route<T> {
	@Nonnull
	private final HttpMethod httpMethod;
	@Nonnull
	private final RoutePattern routePattern;
	@Nonnull
	private final Callback<T> callback;
	@Nonnull
	private final Integer registrationOrder;

	public Route(@Nonnull HttpMethod httpMethod,
							 @Nonnull RoutePattern routePattern,
							 @Nonnull Callback<T> callback,
							 @Nonnull Integer registrationOrder) {
		requireNonNull(httpMethod);
		requireNonNull(routePattern);
		requireNonNull(callback);
		requireNonNull(registrationOrder);

		this.httpMethod = httpMethod;
		this.routePattern = routePattern;
		this.callback = callback;
		this.registrationOrder = registrationOrder;
	}

	@Override
	public String toString() {
		return format("%s{httpMethod=%s, routePattern=%s, static=%s}", getClass().getSimpleName(),
				getHttpMethod(), getRoutePattern().getPattern(), !getCallback().requiresInstance());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Route<?> route))
			return false;

		return Objects.equals(getHttpMethod(), route.getHttpMethod())
				&& Objects.equals(getRoutePattern(), route.getRoutePattern())
				&& Objects.equals(getRegistrationOrder(), route.getRegistrationOrder());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHttpMethod(), getRoutePattern(), getRegistrationOrder());
	}

	@Nonnull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	@Nonnull
	public RoutePattern getRoutePattern() {
		return this.routePattern;
	}

	@Nonnull
	public Callback<T> getCallback() {
		return this.callback;
	}

	/**
	 * Position of this route among all registrations on its table, starting at 0.
	 */
	@Nonnull
	public Integer getRegistrationOrder() {
		return this.registrationOrder;
	}
}
