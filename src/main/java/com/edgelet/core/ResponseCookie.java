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
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * HTTP "response" cookie representation which supports {@code Set-Cookie} header encoding.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ResponseCookie {
	@Nonnull
	private final String name;
	@Nullable
	private final String value;
	@Nullable
	private final Duration maxAge;
	@Nullable
	private final String domain;
	@Nullable
	private final String path;
	@Nonnull
	private final Boolean secure;
	@Nonnull
	private final Boolean httpOnly;
	@Nullable
	private final SameSite sameSite;

	@Nonnull
	public static Builder with(@Nonnull String name,
														 @Nullable String value) {
		requireNonNull(name);
		return new Builder(name, value);
	}

	protected ResponseCookie(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name;
		this.value = builder.value;
		this.maxAge = builder.maxAge;
		this.domain = builder.domain;
		this.path = builder.path;
		this.secure = builder.secure == null ? false : builder.secure;
		this.httpOnly = builder.httpOnly == null ? false : builder.httpOnly;
		this.sameSite = builder.sameSite;

		validateToken(getName(), "name");

		if (getName().isEmpty())
			throw new IllegalArgumentException("Cookie name must not be empty");

		if (this.value != null)
			for (char c : this.value.toCharArray())
				if (c < 0x21 || c == '"' || c == ',' || c == ';' || c == '\\' || c > 0x7E)
					throw new IllegalArgumentException(format("Illegal character in cookie value '%s'", this.value));

		if (this.domain != null)
			validateToken(this.domain, "domain");

		if (this.path != null && this.path.indexOf(';') != -1)
			throw new IllegalArgumentException(format("Illegal cookie path '%s'", this.path));
	}

	private static void validateToken(@Nonnull String token,
																		@Nonnull String description) {
		for (char c : token.toCharArray())
			if (c <= 0x20 || c >= 0x7F || "()<>@,;:\\\"/[]?={}".indexOf(c) != -1 && !description.equals("domain"))
				throw new IllegalArgumentException(format("Illegal character in cookie %s '%s'", description, token));
	}

	/**
	 * Generates a {@code Set-Cookie} header value, for example {@code name=value; Domain=localhost; HttpOnly}.
	 */
	@Nonnull
	public String toSetCookieHeaderRepresentation() {
		List<String> components = new ArrayList<>(8);

		components.add(format("%s=%s", getName(), getValue().orElse("")));

		if (getPath().isPresent())
			components.add(format("Path=%s", getPath().get()));

		if (getDomain().isPresent())
			components.add(format("Domain=%s", getDomain().get()));

		long maxAge = getMaxAge().isPresent() ? getMaxAge().get().toSeconds() : -1;

		if (maxAge >= 0)
			components.add(format("Max-Age=%d", maxAge));

		if (getSecure())
			components.add("Secure");

		if (getHttpOnly())
			components.add("HttpOnly");

		if (getSameSite().isPresent())
			components.add(format("SameSite=%s", getSameSite().get().getHeaderRepresentation()));

		return String.join("; ", components);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValue(), getMaxAge(), getDomain(), getPath(), getSecure(), getHttpOnly(), getSameSite());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResponseCookie responseCookie))
			return false;

		return Objects.equals(getName(), responseCookie.getName())
				&& Objects.equals(getValue(), responseCookie.getValue())
				&& Objects.equals(getMaxAge(), responseCookie.getMaxAge())
				&& Objects.equals(getDomain(), responseCookie.getDomain())
				&& Objects.equals(getPath(), responseCookie.getPath())
				&& Objects.equals(getSecure(), responseCookie.getSecure())
				&& Objects.equals(getHttpOnly(), responseCookie.getHttpOnly())
				&& Objects.equals(getSameSite(), responseCookie.getSameSite());
	}

	@Override
	public String toString() {
		return toSetCookieHeaderRepresentation();
	}

	@Nonnull
	public String getName() {
		return this.name;
	}

	@Nonnull
	public Optional<String> getValue() {
		return Optional.ofNullable(this.value);
	}

	@Nonnull
	public Optional<Duration> getMaxAge() {
		return Optional.ofNullable(this.maxAge);
	}

	@Nonnull
	public Optional<String> getDomain() {
		return Optional.ofNullable(this.domain);
	}

	@Nonnull
	public Optional<String> getPath() {
		return Optional.ofNullable(this.path);
	}

	@Nonnull
	public Boolean getSecure() {
		return this.secure;
	}

	@Nonnull
	public Boolean getHttpOnly() {
		return this.httpOnly;
	}

	@Nonnull
	public Optional<SameSite> getSameSite() {
		return Optional.ofNullable(this.sameSite);
	}

	/**
	 * Values for the {@code SameSite} attribute.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	public enum SameSite {
		STRICT("Strict"),
		LAX("Lax"),
		NONE("None");

		@Nonnull
		private final String headerRepresentation;

		SameSite(@Nonnull String headerRepresentation) {
			requireNonNull(headerRepresentation);
			this.headerRepresentation = headerRepresentation;
		}

		@Nonnull
		public String getHeaderRepresentation() {
			return this.headerRepresentation;
		}
	}

	/**
	 * Builder used to construct instances of {@link ResponseCookie} via {@link ResponseCookie#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final String name;
		@Nullable
		private final String value;
		@Nullable
		private Duration maxAge;
		@Nullable
		private String domain;
		@Nullable
		private String path;
		@Nullable
		private Boolean secure;
		@Nullable
		private Boolean httpOnly;
		@Nullable
		private SameSite sameSite;

		protected Builder(@Nonnull String name,
											@Nullable String value) {
			requireNonNull(name);

			this.name = name;
			this.value = value;
		}

		@Nonnull
		public Builder maxAge(@Nullable Duration maxAge) {
			this.maxAge = maxAge;
			return this;
		}

		@Nonnull
		public Builder domain(@Nullable String domain) {
			this.domain = domain;
			return this;
		}

		@Nonnull
		public Builder path(@Nullable String path) {
			this.path = path;
			return this;
		}

		@Nonnull
		public Builder secure(@Nullable Boolean secure) {
			this.secure = secure;
			return this;
		}

		@Nonnull
		public Builder httpOnly(@Nullable Boolean httpOnly) {
			this.httpOnly = httpOnly;
			return this;
		}

		@Nonnull
		public Builder sameSite(@Nullable SameSite sameSite) {
			this.sameSite = sameSite;
			return this;
		}

		@Nonnull
		public ResponseCookie build() {
			return new ResponseCookie(this);
		}
	}
}
