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

package com.edgelet.core.impl;

import com.edgelet.core.Request;
import com.edgelet.core.Response;
import com.edgelet.core.StaticHandler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link StaticHandler} that serves files below a root directory, for use with
 * {@link com.edgelet.core.RouteTable#registerStaticMount(String, StaticHandler)}.
 * <p>
 * The part of the path matched by the mount's wildcard is resolved against the root; a request for {@code /static/css/site.css}
 * on a mount at {@code /static} serves {@code <root>/css/site.css}. Anything that would resolve outside the root is a 404.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StaticFiles implements StaticHandler {
	@Nonnull
	private final Path rootDirectory;

	@Nonnull
	public static StaticFiles fromDirectory(@Nonnull Path rootDirectory) {
		requireNonNull(rootDirectory);
		return new StaticFiles(rootDirectory);
	}

	private StaticFiles(@Nonnull Path rootDirectory) {
		requireNonNull(rootDirectory);
		this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
	}

	@Override
	public void handle(@Nonnull Request request,
										 @Nonnull Response response) {
		requireNonNull(request);
		requireNonNull(response);

		String remainder = request.getRemainder().orElse("");

		if (remainder.isEmpty()) {
			response.sendFailsafe(404, null);
			return;
		}

		Path file = getRootDirectory().resolve(remainder).normalize();

		if (!file.startsWith(getRootDirectory())) {
			response.sendFailsafe(404, null);
			return;
		}

		response.sendFile(file);
	}

	@Nonnull
	public Path getRootDirectory() {
		return this.rootDirectory;
	}

	@Override
	public String toString() {
		return format("%s{rootDirectory=%s}", getClass().getSimpleName(), getRootDirectory());
	}
}
