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

import com.edgelet.core.InstanceFactory;
import com.edgelet.exception.InstanceCreationException;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.function.UnaryOperator;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Hands each request a copy of one seed instance.
 * <p>
 * The seed itself is never given to a request, so handlers can't mutate state that other requests see
 * unless the copier deliberately shares it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SeedCopyingInstanceFactory<T> implements InstanceFactory<T> {
	@Nonnull
	private final T seed;
	@Nonnull
	private final UnaryOperator<T> copier;

	public SeedCopyingInstanceFactory(@Nonnull T seed,
																		@Nonnull UnaryOperator<T> copier) {
		requireNonNull(seed);
		requireNonNull(copier);

		this.seed = seed;
		this.copier = copier;
	}

	@Nonnull
	@Override
	public T create() {
		T instance;

		try {
			instance = getCopier().apply(getSeed());
		} catch (Exception e) {
			throw new InstanceCreationException("Unable to copy the seed application instance", e);
		}

		if (instance == null)
			throw new InstanceCreationException(format("%s returned null instead of a copy of the seed", getCopier()), null);

		return instance;
	}

	@Nonnull
	@Override
	public Mode getMode() {
		return Mode.SEED_COPY;
	}

	@Nonnull
	protected T getSeed() {
		return this.seed;
	}

	@Nonnull
	protected UnaryOperator<T> getCopier() {
		return this.copier;
	}
}
