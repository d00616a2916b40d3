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

import com.edgelet.core.FileLoader;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Reads files straight from the filesystem.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class DefaultFileLoader implements FileLoader {
	@Nonnull
	private static final DefaultFileLoader SHARED_INSTANCE;

	static {
		SHARED_INSTANCE = new DefaultFileLoader();
	}

	@Nonnull
	public static DefaultFileLoader sharedInstance() {
		return SHARED_INSTANCE;
	}

	private DefaultFileLoader() {
		// Non-instantiable
	}

	@Nonnull
	@Override
	public byte[] load(@Nonnull Path path) throws IOException {
		requireNonNull(path);

		// Directories count as missing so they never surface as a 500
		if (!Files.isRegularFile(path))
			throw new NoSuchFileException(path.toString());

		return Files.readAllBytes(path);
	}
}
