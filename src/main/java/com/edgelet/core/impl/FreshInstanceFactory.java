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
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class FreshInstanceFactory<T> implements InstanceFactory<T> {
	@Nonnull
	private final Supplier<T> supplier;

	public FreshInstanceFactory(@Nonnull Supplier<T> supplier) {
		requireNonNull(supplier);
		this.supplier = supplier;
	}

	@Nonnull
	@Override
	public T create() {
		T instance;

		try {
			instance = getSupplier().get();
		} catch (Exception e) {
			throw new InstanceCreationException("Unable to create an application instance", e);
		}

		if (instance == null)
			throw new InstanceCreationException(format("%s returned null instead of an application instance", getSupplier()), null);

		return instance;
	}

	@Nonnull
	@Override
	public Mode getMode() {
		return Mode.FRESH;
	}

	@Nonnull
	protected Supplier<T> getSupplier() {
		return this.supplier;
	}
}
