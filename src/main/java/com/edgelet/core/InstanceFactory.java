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

import com.edgelet.core.impl.FreshInstanceFactory;
import com.edgelet.core.impl.SeedCopyingInstanceFactory;

import javax.annotation.Nonnull;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Vends one application instance per request.
 * <p>
 * Two modes are provided:
 * <ul>
 *   <li>{@link #fresh(Supplier)} - a brand-new instance for each request, so no state leaks between requests</li>
 *   <li>{@link #copying(Object, UnaryOperator)} - a copy of a single seed created at startup, suited to applications
 *   whose state is a set of thread-safe shared handles</li>
 * </ul>
 *
 * @param <T> the application type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface InstanceFactory<T> {
	/**
	 * Vends the instance for one request.
	 *
	 * @return the instance
	 * @throws com.edgelet.exception.InstanceCreationException if construction or copying fails
	 */
	@Nonnull
	T create();

	@Nonnull
	Mode getMode();

	@Nonnull
	static <T> InstanceFactory<T> fresh(@Nonnull Supplier<T> supplier) {
		requireNonNull(supplier);
		return new FreshInstanceFactory<>(supplier);
	}

	@Nonnull
	static <T> InstanceFactory<T> copying(@Nonnull T seed,
																				@Nonnull UnaryOperator<T> copier) {
		requireNonNull(seed);
		requireNonNull(copier);
		return new SeedCopyingInstanceFactory<>(seed, copier);
	}

	@Nonnull
	static <T extends Copyable<T>> InstanceFactory<T> copying(@Nonnull T seed) {
		requireNonNull(seed);
		return new SeedCopyingInstanceFactory<>(seed, Copyable::copy);
	}

	/**
	 * How instances are produced.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	enum Mode {
		FRESH,
		SEED_COPY
	}
}
