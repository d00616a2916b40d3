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
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Utilities {
	@Nonnull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@Nonnull
	private static final Map<String, String> CONTENT_TYPES_BY_FILE_EXTENSION;
	@Nonnull
	private static final String DEFAULT_FILE_CONTENT_TYPE;
	@Nonnull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];
		DEFAULT_FILE_CONTENT_TYPE = "application/octet-stream";

		Map<String, String> contentTypesByFileExtension = new LinkedHashMap<>();
		contentTypesByFileExtension.put("html", "text/html; charset=UTF-8");
		contentTypesByFileExtension.put("htm", "text/html; charset=UTF-8");
		contentTypesByFileExtension.put("css", "text/css; charset=UTF-8");
		contentTypesByFileExtension.put("js", "text/javascript; charset=UTF-8");
		contentTypesByFileExtension.put("mjs", "text/javascript; charset=UTF-8");
		contentTypesByFileExtension.put("json", "application/json; charset=UTF-8");
		contentTypesByFileExtension.put("txt", "text/plain; charset=UTF-8");
		contentTypesByFileExtension.put("md", "text/markdown; charset=UTF-8");
		contentTypesByFileExtension.put("xml", "application/xml; charset=UTF-8");
		contentTypesByFileExtension.put("svg", "image/svg+xml");
		contentTypesByFileExtension.put("png", "image/png");
		contentTypesByFileExtension.put("jpg", "image/jpeg");
		contentTypesByFileExtension.put("jpeg", "image/jpeg");
		contentTypesByFileExtension.put("gif", "image/gif");
		contentTypesByFileExtension.put("webp", "image/webp");
		contentTypesByFileExtension.put("ico", "image/x-icon");
		contentTypesByFileExtension.put("woff", "font/woff");
		contentTypesByFileExtension.put("woff2", "font/woff2");
		contentTypesByFileExtension.put("pdf", "application/pdf");
		contentTypesByFileExtension.put("wasm", "application/wasm");

		CONTENT_TYPES_BY_FILE_EXTENSION = Collections.unmodifiableMap(contentTypesByFileExtension);

		// \p{Z} is any kind of whitespace or invisible separator; \s picks up tabs and line breaks.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	@Nonnull
	public static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Creates a mutable map whose keys compare case-insensitively, suitable for HTTP header names.
	 */
	@Nonnull
	public static <V> Map<String, V> caseInsensitiveMap() {
		return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
	}

	/**
	 * Lenient parse of a URL query string: malformed pairs are skipped rather than reported.
	 */
	@Nonnull
	public static Map<String, Set<String>> extractQueryParametersFromQuery(@Nullable String query) {
		query = trimAggressivelyToNull(query);

		if (query == null)
			return Map.of();

		Map<String, Set<String>> queryParameters = new LinkedHashMap<>();

		for (String component : query.split("&")) {
			try {
				addUrlEncodedPair(queryParameters, component);
			} catch (IllegalArgumentException ignored) {
				// Query strings come straight from clients; we ignore pairs we can't decode
			}
		}

		return Collections.unmodifiableMap(queryParameters);
	}

	/**
	 * Strict parse of an {@code application/x-www-form-urlencoded} body.
	 *
	 * @throws IllegalArgumentException if any pair is malformed (bad percent-encoding or missing name)
	 */
	@Nonnull
	public static Map<String, Set<String>> extractFormParametersFromBody(@Nonnull String body) {
		requireNonNull(body);

		Map<String, Set<String>> formParameters = new LinkedHashMap<>();

		if (body.isEmpty())
			return formParameters;

		for (String component : body.split("&", -1))
			addUrlEncodedPair(formParameters, component);

		return formParameters;
	}

	private static void addUrlEncodedPair(@Nonnull Map<String, Set<String>> parameters,
																				@Nonnull String component) {
		if (component.isEmpty())
			return;

		int indexOfEquals = component.indexOf('=');
		String encodedName = indexOfEquals == -1 ? component : component.substring(0, indexOfEquals);
		String encodedValue = indexOfEquals == -1 ? "" : component.substring(indexOfEquals + 1);

		String name = URLDecoder.decode(encodedName, StandardCharsets.UTF_8);
		String value = URLDecoder.decode(encodedValue, StandardCharsets.UTF_8);

		if (trimAggressivelyToNull(name) == null)
			throw new IllegalArgumentException(format("Missing name in pair '%s'", component));

		parameters.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(value);
	}

	@Nonnull
	public static Map<String, Set<String>> extractCookiesFromHeaders(@Nonnull Map<String, Set<String>> headers) {
		requireNonNull(headers);

		Map<String, Set<String>> cookies = new LinkedHashMap<>();

		for (Map.Entry<String, Set<String>> entry : headers.entrySet()) {
			if (!entry.getKey().equalsIgnoreCase("Cookie"))
				continue;

			for (String value : entry.getValue()) {
				value = trimAggressivelyToNull(value);

				if (value == null)
					continue;

				for (String cookieComponent : value.split(";")) {
					cookieComponent = trimAggressivelyToNull(cookieComponent);

					if (cookieComponent == null)
						continue;

					int indexOfEquals = cookieComponent.indexOf('=');
					String cookieName = trimAggressivelyToNull(indexOfEquals == -1 ? cookieComponent : cookieComponent.substring(0, indexOfEquals));
					String cookieValue = indexOfEquals == -1 ? null : trimAggressivelyToNull(cookieComponent.substring(indexOfEquals + 1));

					if (cookieName == null)
						continue;

					// Quoted cookie values are permitted by RFC 6265
					if (cookieValue != null && cookieValue.length() >= 2 && cookieValue.startsWith("\"") && cookieValue.endsWith("\""))
						cookieValue = cookieValue.substring(1, cookieValue.length() - 1);

					Set<String> cookieValues = cookies.computeIfAbsent(cookieName, k -> new LinkedHashSet<>());

					if (cookieValue != null)
						cookieValues.add(cookieValue);
				}
			}
		}

		return cookies;
	}

	@Nonnull
	public static Optional<String> extractContentTypeFromHeaders(@Nonnull Map<String, Set<String>> headers) {
		requireNonNull(headers);
		return firstHeaderValue(headers, "Content-Type").flatMap(Utilities::extractContentTypeFromHeaderValue);
	}

	@Nonnull
	public static Optional<String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		// e.g. "text/html; charset=utf-8" -> "text/html"
		int indexOfSemicolon = contentTypeHeaderValue.indexOf(";");
		String contentType = indexOfSemicolon == -1 ? contentTypeHeaderValue : contentTypeHeaderValue.substring(0, indexOfSemicolon);

		return Optional.ofNullable(trimAggressivelyToNull(contentType)).map(value -> value.toLowerCase(Locale.ENGLISH));
	}

	@Nonnull
	public static Optional<Charset> extractCharsetFromHeaders(@Nonnull Map<String, Set<String>> headers) {
		requireNonNull(headers);

		String contentTypeHeaderValue = firstHeaderValue(headers, "Content-Type").orElse(null);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		for (String component : contentTypeHeaderValue.split(";")) {
			component = trimAggressivelyToEmpty(component);

			if (!component.toLowerCase(Locale.ENGLISH).startsWith("charset="))
				continue;

			String charsetName = trimAggressivelyToNull(component.substring("charset=".length()).replace("\"", ""));

			if (charsetName == null)
				return Optional.empty();

			try {
				return Optional.of(Charset.forName(charsetName));
			} catch (IllegalCharsetNameException | UnsupportedCharsetException ignored) {
				return Optional.empty();
			}
		}

		return Optional.empty();
	}

	@Nonnull
	public static Optional<String> firstHeaderValue(@Nonnull Map<String, Set<String>> headers,
																									@Nonnull String name) {
		requireNonNull(headers);
		requireNonNull(name);

		for (Map.Entry<String, Set<String>> entry : headers.entrySet())
			if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty())
				return Optional.of(entry.getValue().iterator().next());

		return Optional.empty();
	}

	/**
	 * Picks a {@code Content-Type} for a file based on its extension.
	 */
	@Nonnull
	public static String contentTypeForFileName(@Nonnull String fileName) {
		requireNonNull(fileName);

		int indexOfDot = fileName.lastIndexOf('.');

		if (indexOfDot == -1 || indexOfDot == fileName.length() - 1)
			return DEFAULT_FILE_CONTENT_TYPE;

		String extension = fileName.substring(indexOfDot + 1).toLowerCase(Locale.ENGLISH);
		return CONTENT_TYPES_BY_FILE_EXTENSION.getOrDefault(extension, DEFAULT_FILE_CONTENT_TYPE);
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@Nonnull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}
}
