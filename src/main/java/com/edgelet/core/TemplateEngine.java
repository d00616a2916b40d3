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
import java.util.Map;

/**
 * Renders named templates, e.g. {@code views/hello.hbs}, against key-ordered data.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface TemplateEngine {
	/**
	 * Renders the template registered under {@code templateName}.
	 *
	 * @param templateName the registered template name
	 * @param data         values made available to the template
	 * @return the rendered text
	 * @throws com.edgelet.exception.TemplateRenderException if the template is unknown or rendering fails
	 */
	@Nonnull
	String render(@Nonnull String templateName,
								@Nonnull Map<String, ?> data);
}
