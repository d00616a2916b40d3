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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RouteTableTests {
	@Test
	public void literalPatternResolvesToItsHandler() {
		Callback<Object> home = callback();
		Callback<Object> settings = callback();

		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/", home)
				.register(HttpMethod.GET, "/settings", settings);

		Assertions.assertSame(home, routeTable.match(HttpMethod.GET, "/").get().getCallback());
		Assertions.assertSame(settings, routeTable.match(HttpMethod.GET, "/settings").get().getCallback());
	}

	@Test
	public void missesAreEmpty() {
		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/hello/:first_name/:last_name", callback());

		Assertions.assertTrue(routeTable.match(HttpMethod.GET, "/hello").isEmpty());
		Assertions.assertTrue(routeTable.match(HttpMethod.POST, "/hello/Jane/Doe").isEmpty());
		Assertions.assertTrue(routeTable.match(HttpMethod.GET, "/nope").isEmpty());
	}

	@Test
	public void matchCarriesParameters() {
		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/hello/:first_name/:last_name", callback());

		RouteMatch<Object> routeMatch = routeTable.match(HttpMethod.GET, "/hello/Jane/Doe").get();

		Assertions.assertEquals(Map.of("first_name", "Jane", "last_name", "Doe"), routeMatch.getParameters());
		Assertions.assertTrue(routeMatch.getRemainder().isEmpty());
	}

	@Test
	public void duplicateRegistrationsServeTheFirst() {
		Callback<Object> first = callback();
		Callback<Object> second = callback();

		for (RouteTable.MatchPolicy matchPolicy : RouteTable.MatchPolicy.values()) {
			RouteTable<Object> routeTable = RouteTable.withMatchPolicy(matchPolicy)
					.register(HttpMethod.GET, "/dup", first)
					.register(HttpMethod.GET, "/dup", second);

			Assertions.assertSame(first, routeTable.match(HttpMethod.GET, "/dup").get().getCallback(), matchPolicy.name());
		}
	}

	@Test
	public void firstRegisteredPolicyIsTheDefault() {
		Callback<Object> byId = callback();
		Callback<Object> me = callback();

		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/users/:id", byId)
				.register(HttpMethod.GET, "/users/me", me);

		Assertions.assertEquals(RouteTable.MatchPolicy.FIRST_REGISTERED, routeTable.getMatchPolicy());
		Assertions.assertSame(byId, routeTable.match(HttpMethod.GET, "/users/me").get().getCallback());
	}

	@Test
	public void mostSpecificPolicyPrefersLiterals() {
		Callback<Object> byId = callback();
		Callback<Object> me = callback();
		Callback<Object> files = callback();

		RouteTable<Object> routeTable = RouteTable.<Object>withMatchPolicy(RouteTable.MatchPolicy.MOST_SPECIFIC)
				.register(HttpMethod.GET, RoutePattern.withMountPrefix("/users"), files)
				.register(HttpMethod.GET, "/users/:id", byId)
				.register(HttpMethod.GET, "/users/me", me);

		Assertions.assertSame(me, routeTable.match(HttpMethod.GET, "/users/me").get().getCallback());
		Assertions.assertSame(byId, routeTable.match(HttpMethod.GET, "/users/123").get().getCallback());
		Assertions.assertSame(files, routeTable.match(HttpMethod.GET, "/users/123/avatar.png").get().getCallback());
	}

	@Test
	public void staticMountExposesRemainder() {
		StaticHandler files = (request, response) -> response.sendStatus(StatusCode.HTTP_204);

		RouteTable<Object> routeTable = RouteTable.create()
				.registerStaticMount("/static", files);

		RouteMatch<Object> routeMatch = routeTable.match(HttpMethod.GET, "/static/css/site.css").get();

		Assertions.assertEquals("css/site.css", routeMatch.getRemainder().get());
		Assertions.assertFalse(routeMatch.getCallback().requiresInstance());
	}

	@Test
	public void headFallsBackToGet() {
		Callback<Object> get = callback();
		Callback<Object> head = callback();

		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/", get)
				.register(HttpMethod.GET, "/explicit", get)
				.register(HttpMethod.HEAD, "/explicit", head);

		Assertions.assertSame(get, routeTable.match(HttpMethod.HEAD, "/").get().getCallback());
		Assertions.assertSame(head, routeTable.match(HttpMethod.HEAD, "/explicit").get().getCallback());
		Assertions.assertTrue(routeTable.match(HttpMethod.HEAD, "/missing").isEmpty());
	}

	@Test
	public void mountNestsAnotherTable() {
		Callback<Object> user = callback();
		Callback<Object> index = callback();

		RouteTable<Object> api = RouteTable.create()
				.register(HttpMethod.GET, "/", index)
				.register(HttpMethod.DELETE, "/users/:id", user);

		RouteTable<Object> routeTable = RouteTable.create()
				.mount("/api", api);

		Assertions.assertSame(index, routeTable.match(HttpMethod.GET, "/api").get().getCallback());

		RouteMatch<Object> routeMatch = routeTable.match(HttpMethod.DELETE, "/api/users/7").get();

		Assertions.assertSame(user, routeMatch.getCallback());
		Assertions.assertEquals("7", routeMatch.getParameters().get("id"));
		Assertions.assertTrue(routeTable.match(HttpMethod.DELETE, "/users/7").isEmpty());
		Assertions.assertEquals(List.of("/api", "/api/users/:id"), routeTable.getRoutes().stream()
				.map(route -> route.getRoutePattern().getPattern())
				.collect(Collectors.toList()));
	}

	@Test
	public void tableCannotBeMountedIntoItself() {
		RouteTable<Object> routeTable = RouteTable.create();
		Assertions.assertThrows(IllegalArgumentException.class, () -> routeTable.mount("/again", routeTable));
	}

	@Test
	public void frozenTableRejectsChanges() {
		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.GET, "/", callback());

		routeTable.freeze();
		routeTable.freeze();

		Assertions.assertTrue(routeTable.isFrozen());
		Assertions.assertThrows(IllegalStateException.class, () -> routeTable.register(HttpMethod.GET, "/late", callback()));
		Assertions.assertThrows(IllegalStateException.class, () -> routeTable.registerMiddleware(Middleware.noop()));
		Assertions.assertTrue(routeTable.match(HttpMethod.GET, "/").isPresent());
	}

	@Test
	public void routesAreListedInRegistrationOrder() {
		RouteTable<Object> routeTable = RouteTable.create()
				.register(HttpMethod.POST, "/login", callback())
				.register(HttpMethod.GET, "/", callback())
				.register(HttpMethod.PUT, "/settings", callback());

		Assertions.assertEquals(List.of(HttpMethod.POST, HttpMethod.GET, HttpMethod.PUT), routeTable.getRoutes().stream()
				.map(Route::getHttpMethod)
				.collect(Collectors.toList()));
	}

	private static Callback<Object> callback() {
		// A distinct handler instance per call, so callbacks can be told apart by identity
		InstanceHandler<Object> instanceHandler = new InstanceHandler<>() {
			@Override
			public void handle(Object instance, Request request, Response response) {
				response.sendStatus(StatusCode.HTTP_204);
			}
		};

		return Callback.forInstance(instanceHandler);
	}
}
