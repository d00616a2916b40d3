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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.edgelet.core.Utilities.trimAggressively;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A registration-time path pattern, such as {@code /hello/:first_name/:last_name}.
 * <p>
 * Patterns are split on {@code /} into components, each of which is one of:
 * <ul>
 *   <li>{@link ComponentType#LITERAL} - must equal the corresponding request path component exactly</li>
 *   <li>{@link ComponentType#PARAMETER} - written {@code :name}, matches any single non-empty component and binds it to {@code name}</li>
 *   <li>{@link ComponentType#WILDCARD} - only ever the final component, added by {@link #withMountPrefix(String)};
 *   matches zero or more trailing components and binds them, {@code /}-joined, as the "remainder"</li>
 * </ul>
 * <p>
 * For example, mount prefix {@code /static} matches request path {@code /static/css/site.css} with remainder {@code css/site.css}.
 * <p>
 * Restrictions:
 * <ul>
 *   <li>A parameter name may appear at most once in a pattern</li>
 *   <li>A parameter name may not be empty, i.e. a bare {@code :} component is illegal</li>
 * </ul>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RoutePattern {
	@Nonnull
	private static final String PARAMETER_PREFIX;

	static {
		PARAMETER_PREFIX = ":";
	}

	@Nonnull
	private final String pattern;
	@Nonnull
	private final List<Component> components;

	/**
	 * Vends a pattern that matches request paths with exactly as many components as it has.
	 *
	 * @param pattern the pattern, e.g. {@code /users/:userId}
	 * @return the pattern
	 * @throws IllegalArgumentException if the pattern is illegal
	 */
	@Nonnull
	public static RoutePattern withPattern(@Nonnull String pattern) {
		requireNonNull(pattern);
		return new RoutePattern(pattern, false);
	}

	/**
	 * Vends a pattern that matches its prefix followed by any number of additional components.
	 *
	 * @param prefix the mount prefix, e.g. {@code /static}
	 * @return the pattern
	 * @throws IllegalArgumentException if the prefix is illegal
	 */
	@Nonnull
	public static RoutePattern withMountPrefix(@Nonnull String prefix) {
		requireNonNull(prefix);
		return new RoutePattern(prefix, true);
	}

	protected RoutePattern(@Nonnull String pattern,
												 @Nonnull Boolean mount) {
		requireNonNull(pattern);
		requireNonNull(mount);

		String normalizedPattern = normalizePattern(pattern);
		List<Component> components = extractComponents(normalizedPattern);

		if (mount) {
			components.add(new Component("*", ComponentType.WILDCARD));
			normalizedPattern = "/".equals(normalizedPattern) ? "/*" : normalizedPattern + "/*";
		}

		this.pattern = normalizedPattern;
		this.components = Collections.unmodifiableList(components);
	}

	/**
	 * Places this pattern beneath {@code prefix}, e.g. {@code /users/:id} under {@code /api} becomes {@code /api/users/:id}.
	 * Mount patterns stay mounts.
	 *
	 * @param prefix the path prefix; parameters are allowed
	 * @return the prefixed pattern
	 */
	@Nonnull
	public RoutePattern withPrefix(@Nonnull String prefix) {
		requireNonNull(prefix);

		String basePattern = isWildcard() ? getPattern().substring(0, getPattern().length() - "/*".length()) : getPattern();
		return new RoutePattern(format("%s/%s", normalizePattern(prefix), basePattern), isWildcard());
	}

	/**
	 * Does this pattern match the given request path?
	 *
	 * @param requestPath the request path against which to match
	 * @return {@code true} if the path matches, {@code false} otherwise
	 */
	@Nonnull
	public Boolean matches(@Nonnull RequestPath requestPath) {
		requireNonNull(requestPath);

		List<String> pathComponents = requestPath.getComponents();
		int fixedComponentCount = getFixedComponentCount();

		if (isWildcard()) {
			if (pathComponents.size() < fixedComponentCount)
				return false;
		} else if (pathComponents.size() != fixedComponentCount) {
			return false;
		}

		for (int i = 0; i < fixedComponentCount; ++i) {
			Component component = getComponents().get(i);
			String pathComponent = pathComponents.get(i);

			if (component.getType() == ComponentType.LITERAL) {
				if (!component.getValue().equals(pathComponent))
					return false;
			} else if (pathComponent.isEmpty()) {
				return false;
			}
		}

		return true;
	}

	/**
	 * Binds this pattern's parameter names to the given path's values, in pattern order.
	 * <p>
	 * For example, {@code /hello/:first_name/:last_name} and {@code /hello/Jane/Doe} yield
	 * {@code {first_name=Jane, last_name=Doe}}.
	 *
	 * @param requestPath the request path that supplies parameter values
	 * @return parameter names mapped to values, or the empty map if this pattern has no parameters
	 * @throws IllegalArgumentException if the path does not match this pattern
	 */
	@Nonnull
	public Map<String, String> extractParameters(@Nonnull RequestPath requestPath) {
		requireNonNull(requestPath);

		if (!matches(requestPath))
			throw new IllegalArgumentException(format("%s is not a match for %s so we cannot extract parameters", this, requestPath));

		Map<String, String> parameters = new LinkedHashMap<>();

		for (int i = 0; i < getFixedComponentCount(); ++i) {
			Component component = getComponents().get(i);

			if (component.getType() == ComponentType.PARAMETER)
				parameters.put(component.getValue(), requestPath.getComponents().get(i));
		}

		return Collections.unmodifiableMap(parameters);
	}

	/**
	 * The {@code /}-joined path components matched by a trailing wildcard.
	 *
	 * @param requestPath the request path that supplies the remainder
	 * @return the remainder (possibly the empty string), or {@link Optional#empty()} if this is not a mount pattern
	 * @throws IllegalArgumentException if the path does not match this pattern
	 */
	@Nonnull
	public Optional<String> extractRemainder(@Nonnull RequestPath requestPath) {
		requireNonNull(requestPath);

		if (!matches(requestPath))
			throw new IllegalArgumentException(format("%s is not a match for %s so we cannot extract a remainder", this, requestPath));

		if (!isWildcard())
			return Optional.empty();

		List<String> pathComponents = requestPath.getComponents();
		return Optional.of(String.join("/", pathComponents.subList(getFixedComponentCount(), pathComponents.size())));
	}

	@Nonnull
	public Boolean isWildcard() {
		return !getComponents().isEmpty() && getComponents().get(getComponents().size() - 1).getType() == ComponentType.WILDCARD;
	}

	@Nonnull
	public Boolean isLiteral() {
		for (Component component : getComponents())
			if (component.getType() != ComponentType.LITERAL)
				return false;

		return true;
	}

	/**
	 * How many literal components this pattern has; more literals means a more specific pattern.
	 */
	@Nonnull
	public Integer getLiteralComponentCount() {
		int count = 0;

		for (Component component : getComponents())
			if (component.getType() == ComponentType.LITERAL)
				++count;

		return count;
	}

	@Nonnull
	protected Integer getFixedComponentCount() {
		return isWildcard() ? getComponents().size() - 1 : getComponents().size();
	}

	@Nonnull
	static String normalizePattern(@Nonnull String pattern) {
		requireNonNull(pattern);

		pattern = trimAggressively(pattern);

		if (pattern.length() == 0)
			return "/";

		// Remove any duplicate slashes, e.g. //test///something -> /test/something
		pattern = pattern.replaceAll("(/)\\1+", "$1");

		if (!pattern.startsWith("/"))
			pattern = format("/%s", pattern);

		if ("/".equals(pattern))
			return pattern;

		if (pattern.endsWith("/"))
			pattern = pattern.substring(0, pattern.length() - 1);

		return pattern;
	}

	@Nonnull
	protected List<Component> extractComponents(@Nonnull String normalizedPattern) {
		requireNonNull(normalizedPattern);

		List<Component> components = new ArrayList<>();

		if ("/".equals(normalizedPattern))
			return components;

		Set<String> parameterNames = new HashSet<>();

		for (String value : normalizedPattern.substring(1).split("/")) {
			if (value.startsWith(PARAMETER_PREFIX)) {
				String parameterName = value.substring(PARAMETER_PREFIX.length());

				if (parameterName.isEmpty())
					throw new IllegalArgumentException(format("Pattern '%s' has a parameter with no name", normalizedPattern));

				if (!parameterNames.add(parameterName))
					throw new IllegalArgumentException(format("Pattern '%s' declares parameter '%s' more than once", normalizedPattern, parameterName));

				components.add(new Component(parameterName, ComponentType.PARAMETER));
			} else {
				components.add(new Component(value, ComponentType.LITERAL));
			}
		}

		return components;
	}

	@Nonnull
	public String getPattern() {
		return this.pattern;
	}

	@Nonnull
	public List<Component> getComponents() {
		return this.components;
	}

	@Override
	public String toString() {
		return format("%s{pattern=%s}", getClass().getSimpleName(), getPattern());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RoutePattern routePattern))
			return false;

		return Objects.equals(getPattern(), routePattern.getPattern()) && Objects.equals(getComponents(), routePattern.getComponents());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPattern(), getComponents());
	}

	/**
	 * How to interpret a {@link Component} of a {@link RoutePattern}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum ComponentType {
		LITERAL,
		PARAMETER,
		WILDCARD
	}

	/**
	 * A {@code /}-delimited part of a {@link RoutePattern}.
	 * <p>
	 * The value of a {@link ComponentType#PARAMETER} component is the parameter name without its leading {@code :}.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@Immutable
	public static class Component {
		@Nonnull
		private final String value;
		@Nonnull
		private final ComponentType type;

		public Component(@Nonnull String value,
										 @Nonnull ComponentType type) {
			requireNonNull(value);
			requireNonNull(type);

			this.value = value;
			this.type = type;
		}

		@Override
		public String toString() {
			return format("%s{value=%s, type=%s}", getClass().getSimpleName(), getValue(), getType());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Component component))
				return false;

			return Objects.equals(getValue(), component.getValue()) && Objects.equals(getType(), component.getType());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getValue(), getType());
		}

		@Nonnull
		public String getValue() {
			return this.value;
		}

		@Nonnull
		public ComponentType getType() {
			return this.type;
		}
	}
}
