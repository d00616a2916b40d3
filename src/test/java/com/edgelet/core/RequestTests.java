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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestTests {
	@Test
	public void basics() {
		Request request = Request.with(HttpMethod.GET, "/hello/Jane%20Q/Doe?x=1&x=2&y=").build();

		Assertions.assertEquals(HttpMethod.GET, request.getHttpMethod());
		Assertions.assertEquals("/hello/Jane%20Q/Doe?x=1&x=2&y=", request.getRawUrl());
		Assertions.assertEquals("/hello/Jane Q/Doe", request.getPath());
		Assertions.assertEquals(List.of("hello", "Jane Q", "Doe"), request.getPathComponents());
		Assertions.assertEquals(List.of("1", "2"), List.copyOf(request.getQueryParameters().get("x")));
		Assertions.assertEquals("1", request.getQueryParameter("x").get());
		Assertions.assertTrue(request.getBody().isEmpty());
		Assertions.assertTrue(request.getRemainder().isEmpty());
		Assertions.assertTrue(request.getParameter("first_name").isEmpty());
	}

	@Test
	public void headerNamesAreCaseInsensitive() {
		Request request = Request.with(HttpMethod.GET, "/")
				.headers(Map.of("X-Custom", Set.of("value")))
				.build();

		Assertions.assertEquals("value", request.getHeader("x-custom").get());
		Assertions.assertEquals("value", request.getHeader("X-CUSTOM").get());
		Assertions.assertTrue(request.getHeader("X-Other").isEmpty());
	}

	@Test
	public void cookiesAreParsed() {
		Request request = Request.with(HttpMethod.GET, "/settings")
				.headers(Map.of("Cookie", Set.of("name=Jane; theme=\"dark\"; flag")))
				.build();

		Assertions.assertEquals("Jane", request.getCookie("name").get());
		Assertions.assertEquals("dark", request.getCookie("theme").get());
		Assertions.assertTrue(request.getCookies().containsKey("flag"));
		Assertions.assertTrue(request.getCookie("flag").isEmpty());
		Assertions.assertTrue(request.getCookie("missing").isEmpty());
	}

	@Test
	public void formIsParsed() {
		Request request = Request.with(HttpMethod.POST, "/login")
				.headers(Map.of("Content-Type", Set.of("application/x-www-form-urlencoded; charset=UTF-8")))
				.body("username=Jane+Doe&remember=on&remember=yes".getBytes(StandardCharsets.UTF_8))
				.build();

		Assertions.assertEquals("Jane Doe", request.getFormParameter("username").get());
		Assertions.assertEquals(List.of("on", "yes"), List.copyOf(request.getForm().get("remember")));
		Assertions.assertTrue(request.getFormParameter("password").isEmpty());
	}

	@Test
	public void emptyBodyYieldsEmptyForm() {
		Request request = Request.with(HttpMethod.POST, "/login").build();
		Assertions.assertEquals(Map.of(), request.getForm());
	}

	@Test
	public void malformedFormIsRejected() {
		Request badEncoding = Request.with(HttpMethod.POST, "/login")
				.headers(Map.of("Content-Type", Set.of("application/x-www-form-urlencoded")))
				.body("username=%zz".getBytes(StandardCharsets.UTF_8))
				.build();

		IllegalFormException e = Assertions.assertThrows(IllegalFormException.class, badEncoding::getForm);
		Assertions.assertEquals(400, e.getStatusCode());

		Request missingName = Request.with(HttpMethod.POST, "/login")
				.headers(Map.of("Content-Type", Set.of("application/x-www-form-urlencoded")))
				.body("=value".getBytes(StandardCharsets.UTF_8))
				.build();

		Assertions.assertThrows(IllegalFormException.class, missingName::getForm);
	}

	@Test
	public void formRequiresFormContentType() {
		Request request = Request.with(HttpMethod.POST, "/login")
				.headers(Map.of("Content-Type", Set.of("application/json")))
				.body("{\"username\":\"jane\"}".getBytes(StandardCharsets.UTF_8))
				.build();

		Assertions.assertThrows(IllegalFormException.class, request::getForm);
	}

	@Test
	public void bodyIsDecodedWithDeclaredCharset() {
		Request request = Request.with(HttpMethod.POST, "/echo")
				.headers(Map.of("Content-Type", Set.of("text/plain; charset=ISO-8859-1")))
				.body("café".getBytes(StandardCharsets.ISO_8859_1))
				.build();

		Assertions.assertEquals("café", request.getBodyAsString().get());
		Assertions.assertEquals("text/plain", request.getContentType().get());
	}

	@Test
	public void routeMatchBindsParametersAndRemainder() {
		RouteTable<Object> routeTable = RouteTable.create()
				.registerStaticMount("/static", (request, response) -> response.sendStatus(StatusCode.HTTP_204))
				.get("/hello/:first_name/:last_name", (instance, request, response) -> response.sendStatus(StatusCode.HTTP_204));

		Request request = Request.with(HttpMethod.GET, "/hello/Jane/Doe").build();
		Request routed = request.withRouteMatch(routeTable.match(HttpMethod.GET, request.getRequestPath()).get());

		Assertions.assertEquals("Jane", routed.getParameter("first_name").get());
		Assertions.assertEquals("Doe", routed.getParameter("last_name").get());

		Request file = Request.with(HttpMethod.GET, "/static/css/site.css").build();
		Request routedFile = file.withRouteMatch(routeTable.match(HttpMethod.GET, file.getRequestPath()).get());

		Assertions.assertEquals("css/site.css", routedFile.getRemainder().get());
	}

	@Test
	public void editorChangesAreVisibleAndThenSealed() {
		Request request = Request.with(HttpMethod.GET, "/")
				.headers(Map.of("X-Remove", Set.of("gone")))
				.build();

		Request.Editor editor = request.edit();

		try (editor) {
			editor.putHeader("X-User", "jane")
					.addHeader("X-User", "admin")
					.removeHeader("x-remove")
					.putParameter("tenant", "acme")
					.putAttribute("user", 42);
		}

		Assertions.assertTrue(request.isSealed());
		Assertions.assertEquals(List.of("jane", "admin"), List.copyOf(request.getHeaders().get("x-user")));
		Assertions.assertTrue(request.getHeader("X-Remove").isEmpty());
		Assertions.assertEquals("acme", request.getParameter("tenant").get());
		Assertions.assertEquals(42, request.getAttribute("user", Integer.class).get());
		Assertions.assertThrows(IllegalArgumentException.class, () -> request.getAttribute("user", String.class));

		Assertions.assertThrows(IllegalStateException.class, () -> editor.putHeader("X-Late", "nope"));
		Assertions.assertThrows(IllegalStateException.class, request::edit);
	}

	@Test
	public void onlyOneEditorIsIssued() {
		Request request = Request.with(HttpMethod.GET, "/").build();

		request.edit();

		Assertions.assertThrows(IllegalStateException.class, request::edit);
	}

	@Test
	public void sealedRequestCannotBeEdited() {
		Request request = Request.with(HttpMethod.GET, "/").build();

		request.seal();

		Assertions.assertThrows(IllegalStateException.class, request::edit);
		Assertions.assertThrows(UnsupportedOperationException.class, () -> request.getHeaders().put("X", Set.of("y")));
	}
}
