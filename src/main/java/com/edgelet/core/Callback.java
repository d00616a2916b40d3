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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The handler registered for a route: either bound to the application type or free-standing.
 * <p>
 * The dispatcher treats both uniformly through {@link #invoke(Object, Request, Response)}, consulting
 * {@link #requiresInstance()} to decide whether an application instance must be created first.
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public sealed interface Callback<T> permits Callback.Instance, Callback.Static {
	@Nonnull
	static <T> Callback<T> forInstance(@Nonnull InstanceHandler<T> instanceHandler) {
		requireNonNull(instanceHandler);
		return new Instance<>(instanceHandler);
	}

	@Nonnull
	static <T> Callback<T> forStatic(@Nonnull StaticHandler staticHandler) {
		requireNonNull(staticHandler);
		return new Static<>(staticHandler);
	}

	@Nonnull
	Boolean requiresInstance();

	/**
	 * Runs the handler.
	 *
	 * @param instance the application instance; required if {@link #requiresInstance()}, ignored otherwise
	 * @param request  the request
	 * @param response the response
	 * @throws Exception whatever the handler throws
	 */
	void invoke(@Nullable T instance,
							@Nonnull Request request,
							@Nonnull Response response) throws Exception;

	record Instance<T>(@Nonnull InstanceHandler<T> instanceHandler) implements Callback<T> {
		public Instance {
			requireNonNull(instanceHandler);
		}

		@Nonnull
		@Override
		public Boolean requiresInstance() {
			return true;
		}

		@Override
		public void invoke(@Nullable T instance,
											 @Nonnull Request request,
											 @Nonnull Response response) throws Exception {
			if (instance == null)
				throw new IllegalStateException(format("%s requires an application instance", this));

			instanceHandler().handle(instance, request, response);
		}
	}

	record Static<T>(@Nonnull StaticHandler staticHandler) implements Callback<T> {
		public Static {
			requireNonNull(staticHandler);
		}

		@Nonnull
		@Override
		public Boolean requiresInstance() {
			return false;
		}

		@Override
		public void invoke(@Nullable T instance,
											 @Nonnull Request request,
											 @Nonnull Response response) throws Exception {
			staticHandler().handle(request, response);
		}
	}
}
