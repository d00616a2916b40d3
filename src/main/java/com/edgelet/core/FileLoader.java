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
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads static files for {@link Response#sendFile(Path)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface FileLoader {
	/**
	 * Reads a file fully.
	 *
	 * @param path the file to read
	 * @return the file's bytes
	 * @throws java.nio.file.NoSuchFileException if the file does not exist or is not a regular file
	 * @throws IOException                       if the file exists but cannot be read
	 */
	@Nonnull
	byte[] load(@Nonnull Path path) throws IOException;
}
