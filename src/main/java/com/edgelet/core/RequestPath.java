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
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The runtime path of a request, such as {@code /hello/Jane/Doe}, split into decoded components.
 * <p>
 * Construction from a raw request target:
 * <ul>
 *   <li>drops any query string and fragment</li>
 *   <li>collapses duplicate slashes and drops a trailing slash</li>
 *   <li>percent-decodes each component individually (so {@code %2F} stays inside its component; {@code +} is literal)</li>
 *   <li>removes {@code .} components and resolves {@code ..} without ever climbing above the root</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestPath {
	@Nonnull
	private final String path;
	@Nonnull
	private final List<String> components;

	/**
	 * Vends a path for the given raw request target, e.g. {@code /hello/Jane%20Q/Doe?x=y}.
	 *
	 * @param rawUrl the request target as it appeared on the request line
	 * @return the path
	 */
	@Nonnull
	public static RequestPath fromRawUrl(@Nonnull String rawUrl) {
		requireNonNull(rawUrl);
		return new RequestPath(rawUrl);
	}

	protected RequestPath(@Nonnull String rawUrl) {
		requireNonNull(rawUrl);

		String rawPath = rawUrl;

		int indexOfFragment = rawPath.indexOf('#');

		if (indexOfFragment != -1)
			rawPath = rawPath.substring(0, indexOfFragment);

		int indexOfQuery = rawPath.indexOf('?');

		if (indexOfQuery != -1)
			rawPath = rawPath.substring(0, indexOfQuery);

		// Absolute-form request targets, e.g. "http://example.com/path"
		int indexOfScheme = rawPath.indexOf("://");

		if (indexOfScheme != -1) {
			int indexOfPathStart = rawPath.indexOf('/', indexOfScheme + 3);
			rawPath = indexOfPathStart == -1 ? "/" : rawPath.substring(indexOfPathStart);
		}

		Deque<String> stack = new ArrayDeque<>();

		for (String rawComponent : rawPath.split("/")) {
			if (rawComponent.isEmpty())
				continue;

			String component = percentDecode(rawComponent);

			if (component.isEmpty() || ".".equals(component))
				continue;

			if ("..".equals(component)) {
				if (!stack.isEmpty())
					stack.removeLast();
			} else {
				stack.addLast(component);
			}
		}

		this.components = List.copyOf(stack);
		this.path = "/" + String.join("/", this.components);
	}

	@Nonnull
	protected static String percentDecode(@Nonnull String rawComponent) {
		requireNonNull(rawComponent);

		if (rawComponent.indexOf('%') == -1)
			return rawComponent;

		ByteArrayOutputStream out = new ByteArrayOutputStream(rawComponent.length());

		for (int i = 0; i < rawComponent.length(); ) {
			int codePoint = rawComponent.codePointAt(i);

			if (codePoint == '%' && i + 2 < rawComponent.length() && isHexDigit(rawComponent.charAt(i + 1)) && isHexDigit(rawComponent.charAt(i + 2))) {
				out.write(Integer.parseInt(rawComponent.substring(i + 1, i + 3), 16));
				i += 3;
			} else {
				// Malformed escapes are kept verbatim
				byte[] bytes = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
				out.write(bytes, 0, bytes.length);
				i += Character.charCount(codePoint);
			}
		}

		return out.toString(StandardCharsets.UTF_8);
	}

	private static boolean isHexDigit(char c) {
		return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	/**
	 * The normalized path, always starting with {@code /}.
	 */
	@Nonnull
	public String getPath() {
		return this.path;
	}

	/**
	 * The decoded components, or the empty list for {@code /}.
	 */
	@Nonnull
	public List<String> getComponents() {
		return Collections.unmodifiableList(this.components);
	}

	@Override
	public String toString() {
		return format("%s{path=%s}", getClass().getSimpleName(), getPath());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RequestPath requestPath))
			return false;

		return Objects.equals(getComponents(), requestPath.getComponents());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getComponents());
	}
}
