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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps (HTTP method, path pattern) pairs to handlers and resolves incoming requests against them.
 * <p>
 * Registration happens up front; once {@link #freeze()} is called (which happens automatically when serving starts),
 * the table is read-only and may be consulted concurrently without locking.
 * <p>
 * Lookup is a linear scan over the routes registered for the request's method. When more than one route matches,
 * the table's {@link MatchPolicy} picks the winner. Registering the same pattern twice for a method is permitted;
 * under either policy the earlier registration serves requests.
 * <p>
 * {@code HEAD} requests with no {@code HEAD} route fall back to the matching {@code GET} route.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RouteTable<T> {
	// Exact patterns beat mounts, then more literal components win, then more components, then earlier registration
	@Nonnull
	private static final Comparator<Route<?>> SPECIFICITY_COMPARATOR;

	static {
		SPECIFICITY_COMPARATOR = Comparator
				.comparing((Route<?> route) -> route.getRoutePattern().isWildcard())
				.thenComparing((Route<?> route) -> route.getRoutePattern().getLiteralComponentCount(), Comparator.reverseOrder())
				.thenComparing((Route<?> route) -> route.getRoutePattern().getComponents().size(), Comparator.reverseOrder())
				.thenComparing((Route<?> route) -> route.getRegistrationOrder());
	}

	@Nonnull
	private final MatchPolicy matchPolicy;
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private final Map<HttpMethod, List<Route<T>>> routesByHttpMethod;
	@Nonnull
	private volatile Middleware<T> middleware;
	@Nullable
	private volatile Map<HttpMethod, List<Route<T>>> frozenRoutesByHttpMethod;
	private int registrationCount;

	@Nonnull
	public static <T> RouteTable<T> create() {
		return new RouteTable<>(MatchPolicy.FIRST_REGISTERED);
	}

	@Nonnull
	public static <T> RouteTable<T> withMatchPolicy(@Nonnull MatchPolicy matchPolicy) {
		requireNonNull(matchPolicy);
		return new RouteTable<>(matchPolicy);
	}

	protected RouteTable(@Nonnull MatchPolicy matchPolicy) {
		requireNonNull(matchPolicy);

		this.matchPolicy = matchPolicy;
		this.lock = new ReentrantLock();
		this.routesByHttpMethod = new EnumMap<>(HttpMethod.class);
		this.middleware = Middleware.noop();

		for (HttpMethod httpMethod : HttpMethod.values())
			this.routesByHttpMethod.put(httpMethod, new ArrayList<>());
	}

	/**
	 * Registers a handler for the given method and pattern.
	 *
	 * @param httpMethod the HTTP method
	 * @param pattern    the path pattern, e.g. {@code /hello/:name}
	 * @param callback   the handler
	 * @return this table, for chaining
	 * @throws IllegalArgumentException if the pattern is illegal
	 * @throws IllegalStateException    if the table is frozen
	 */
	@Nonnull
	public RouteTable<T> register(@Nonnull HttpMethod httpMethod,
																@Nonnull String pattern,
																@Nonnull Callback<T> callback) {
		requireNonNull(httpMethod);
		requireNonNull(pattern);
		requireNonNull(callback);

		return register(httpMethod, RoutePattern.withPattern(pattern), callback);
	}

	@Nonnull
	public RouteTable<T> register(@Nonnull HttpMethod httpMethod,
																@Nonnull RoutePattern routePattern,
																@Nonnull Callback<T> callback) {
		requireNonNull(httpMethod);
		requireNonNull(routePattern);
		requireNonNull(callback);

		getLock().lock();

		try {
			ensureNotFrozen();
			getRoutesByHttpMethod().get(httpMethod).add(new Route<>(httpMethod, routePattern, callback, this.registrationCount++));
			return this;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public RouteTable<T> get(@Nonnull String pattern,
													 @Nonnull InstanceHandler<T> instanceHandler) {
		return register(HttpMethod.GET, pattern, Callback.forInstance(instanceHandler));
	}

	@Nonnull
	public RouteTable<T> post(@Nonnull String pattern,
														@Nonnull InstanceHandler<T> instanceHandler) {
		return register(HttpMethod.POST, pattern, Callback.forInstance(instanceHandler));
	}

	@Nonnull
	public RouteTable<T> put(@Nonnull String pattern,
													 @Nonnull InstanceHandler<T> instanceHandler) {
		return register(HttpMethod.PUT, pattern, Callback.forInstance(instanceHandler));
	}

	@Nonnull
	public RouteTable<T> delete(@Nonnull String pattern,
															@Nonnull InstanceHandler<T> instanceHandler) {
		return register(HttpMethod.DELETE, pattern, Callback.forInstance(instanceHandler));
	}

	@Nonnull
	public RouteTable<T> head(@Nonnull String pattern,
														@Nonnull InstanceHandler<T> instanceHandler) {
		return register(HttpMethod.HEAD, pattern, Callback.forInstance(instanceHandler));
	}

	/**
	 * Registers an instance-free {@code GET} handler for an exact pattern.
	 */
	@Nonnull
	public RouteTable<T> getStatic(@Nonnull String pattern,
																 @Nonnull StaticHandler staticHandler) {
		return register(HttpMethod.GET, pattern, Callback.forStatic(staticHandler));
	}

	/**
	 * Registers an instance-free {@code GET} handler for everything beneath {@code prefix}.
	 * <p>
	 * The handler sees the path below the prefix via {@link Request#getRemainder()}.
	 */
	@Nonnull
	public RouteTable<T> registerStaticMount(@Nonnull String prefix,
																					 @Nonnull StaticHandler staticHandler) {
		requireNonNull(prefix);
		requireNonNull(staticHandler);

		return register(HttpMethod.GET, RoutePattern.withMountPrefix(prefix), Callback.forStatic(staticHandler));
	}

	/**
	 * Copies every route of {@code routeTable} into this table beneath {@code prefix}, preserving their relative order.
	 * <p>
	 * The mounted table's middleware is not carried over; this table's middleware applies to all of its routes.
	 *
	 * @param prefix     the path prefix, e.g. {@code /api}
	 * @param routeTable the routes to mount
	 * @return this table, for chaining
	 */
	@Nonnull
	public RouteTable<T> mount(@Nonnull String prefix,
														 @Nonnull RouteTable<T> routeTable) {
		requireNonNull(prefix);
		requireNonNull(routeTable);

		if (routeTable == this)
			throw new IllegalArgumentException("A route table cannot be mounted into itself");

		for (Route<T> route : routeTable.getRoutes())
			register(route.getHttpMethod(), route.getRoutePattern().withPrefix(prefix), route.getCallback());

		return this;
	}

	/**
	 * Installs the hook run before every instance handler, replacing any previously installed one.
	 */
	@Nonnull
	public RouteTable<T> registerMiddleware(@Nonnull Middleware<T> middleware) {
		requireNonNull(middleware);

		getLock().lock();

		try {
			ensureNotFrozen();
			this.middleware = middleware;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Finds the route that should handle a request.
	 *
	 * @param httpMethod  the request's method
	 * @param requestPath the request's path
	 * @return the match, or {@link Optional#empty()} if no route applies
	 */
	@Nonnull
	public Optional<RouteMatch<T>> match(@Nonnull HttpMethod httpMethod,
																			 @Nonnull RequestPath requestPath) {
		requireNonNull(httpMethod);
		requireNonNull(requestPath);

		Optional<RouteMatch<T>> routeMatch = matchForHttpMethod(httpMethod, requestPath);

		if (routeMatch.isEmpty() && httpMethod == HttpMethod.HEAD)
			routeMatch = matchForHttpMethod(HttpMethod.GET, requestPath);

		return routeMatch;
	}

	@Nonnull
	public Optional<RouteMatch<T>> match(@Nonnull HttpMethod httpMethod,
																			 @Nonnull String path) {
		requireNonNull(httpMethod);
		requireNonNull(path);

		return match(httpMethod, RequestPath.fromRawUrl(path));
	}

	@Nonnull
	protected Optional<RouteMatch<T>> matchForHttpMethod(@Nonnull HttpMethod httpMethod,
																											 @Nonnull RequestPath requestPath) {
		requireNonNull(httpMethod);
		requireNonNull(requestPath);

		Route<T> bestRoute = null;

		for (Route<T> route : routesFor(httpMethod)) {
			if (!route.getRoutePattern().matches(requestPath))
				continue;

			if (getMatchPolicy() == MatchPolicy.FIRST_REGISTERED)
				return Optional.of(new RouteMatch<>(route, requestPath));

			if (bestRoute == null || SPECIFICITY_COMPARATOR.compare(route, bestRoute) < 0)
				bestRoute = route;
		}

		return bestRoute == null ? Optional.empty() : Optional.of(new RouteMatch<>(bestRoute, requestPath));
	}

	@Nonnull
	protected List<Route<T>> routesFor(@Nonnull HttpMethod httpMethod) {
		requireNonNull(httpMethod);

		Map<HttpMethod, List<Route<T>>> frozenRoutesByHttpMethod = this.frozenRoutesByHttpMethod;

		if (frozenRoutesByHttpMethod != null)
			return frozenRoutesByHttpMethod.get(httpMethod);

		getLock().lock();

		try {
			return List.copyOf(getRoutesByHttpMethod().get(httpMethod));
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Makes the table read-only. Idempotent.
	 */
	public void freeze() {
		getLock().lock();

		try {
			if (isFrozen())
				return;

			Map<HttpMethod, List<Route<T>>> frozenRoutesByHttpMethod = new EnumMap<>(HttpMethod.class);

			for (Map.Entry<HttpMethod, List<Route<T>>> entry : getRoutesByHttpMethod().entrySet())
				frozenRoutesByHttpMethod.put(entry.getKey(), List.copyOf(entry.getValue()));

			this.frozenRoutesByHttpMethod = Collections.unmodifiableMap(frozenRoutesByHttpMethod);
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Boolean isFrozen() {
		return this.frozenRoutesByHttpMethod != null;
	}

	/**
	 * All registered routes, in registration order.
	 */
	@Nonnull
	public List<Route<T>> getRoutes() {
		List<Route<T>> routes = new ArrayList<>();

		for (HttpMethod httpMethod : HttpMethod.values())
			routes.addAll(routesFor(httpMethod));

		routes.sort(Comparator.comparing(Route::getRegistrationOrder));
		return Collections.unmodifiableList(routes);
	}

	@Nonnull
	public Middleware<T> getMiddleware() {
		return this.middleware;
	}

	@Nonnull
	public MatchPolicy getMatchPolicy() {
		return this.matchPolicy;
	}

	protected void ensureNotFrozen() {
		if (isFrozen())
			throw new IllegalStateException(format("%s is frozen; routes must be registered before serving starts", getClass().getSimpleName()));
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@Nonnull
	protected Map<HttpMethod, List<Route<T>>> getRoutesByHttpMethod() {
		return this.routesByHttpMethod;
	}

	@Override
	public String toString() {
		return format("%s{matchPolicy=%s, routes=%s}", getClass().getSimpleName(), getMatchPolicy(), getRoutes());
	}

	/**
	 * How a {@link RouteTable} chooses between several routes that all match a request.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum MatchPolicy {
		/**
		 * The earliest-registered matching route wins.
		 */
		FIRST_REGISTERED,
		/**
		 * Exact patterns beat mount prefixes, then the route with the most literal components wins;
		 * remaining ties go to the earliest registration.
		 */
		MOST_SPECIFIC
	}
}
