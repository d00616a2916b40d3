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

import com.edgelet.core.MarkdownRenderer;
import com.edgelet.core.TemplateEngine;
import com.edgelet.exception.TemplateRenderException;
import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.HandlebarsException;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.CompositeTemplateLoader;
import com.github.jknack.handlebars.io.FileTemplateLoader;
import com.github.jknack.handlebars.io.TemplateLoader;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link TemplateEngine} backed by Handlebars.java.
 * <p>
 * Templates live in a views directory ({@code views} by default) as {@code <name>.hbs} files and must be registered via
 * {@link #registerTemplate(String)} before they can be rendered. Every {@code .hbs} file in the {@code partials}
 * subdirectory, if present, is registered at construction time under its file name, and can be used both as a partial
 * ({@code {{> header}}}) and as a template.
 * <p>
 * A {@code markdown} helper is available to all templates: {@code {{markdown content}}} renders the string
 * {@code content} through the configured {@link MarkdownRenderer} and inserts the result unescaped.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class HandlebarsTemplateEngine implements TemplateEngine {
	@Nonnull
	private static final String TEMPLATE_SUFFIX;
	@Nonnull
	private static final String PARTIALS_DIRECTORY_NAME;
	@Nonnull
	private static final String MARKDOWN_HELPER_NAME;

	static {
		TEMPLATE_SUFFIX = ".hbs";
		PARTIALS_DIRECTORY_NAME = "partials";
		MARKDOWN_HELPER_NAME = "markdown";
	}

	@Nonnull
	private final Path viewsDirectory;
	@Nonnull
	private final MarkdownRenderer markdownRenderer;
	@Nonnull
	private final Handlebars handlebars;
	@Nonnull
	private final Map<String, Template> templatesByName;

	@Nonnull
	public static Builder withViewsDirectory(@Nonnull Path viewsDirectory) {
		requireNonNull(viewsDirectory);
		return new Builder(viewsDirectory);
	}

	/**
	 * Acquires an engine for the {@code views} directory relative to the working directory.
	 */
	@Nonnull
	public static HandlebarsTemplateEngine withDefaults() {
		return withViewsDirectory(Path.of("views")).build();
	}

	private HandlebarsTemplateEngine(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.viewsDirectory = builder.viewsDirectory;
		this.markdownRenderer = builder.markdownRenderer != null ? builder.markdownRenderer : CommonmarkMarkdownRenderer.sharedInstance();
		this.templatesByName = new ConcurrentHashMap<>();

		Path partialsDirectory = this.viewsDirectory.resolve(PARTIALS_DIRECTORY_NAME);
		boolean hasPartials = Files.isDirectory(partialsDirectory);

		TemplateLoader templateLoader = hasPartials
				? new CompositeTemplateLoader(
				new FileTemplateLoader(this.viewsDirectory.toFile(), TEMPLATE_SUFFIX),
				new FileTemplateLoader(partialsDirectory.toFile(), TEMPLATE_SUFFIX))
				: new FileTemplateLoader(this.viewsDirectory.toFile(), TEMPLATE_SUFFIX);

		this.handlebars = new Handlebars(templateLoader);
		this.handlebars.registerHelper(MARKDOWN_HELPER_NAME, (Helper<Object>) (context, options) -> {
			if (!(context instanceof String))
				throw new IllegalArgumentException(format("The '%s' helper expects a string parameter, but got %s",
						MARKDOWN_HELPER_NAME, context == null ? "nothing" : context.getClass().getSimpleName()));

			return new Handlebars.SafeString(getMarkdownRenderer().toHtml((String) context));
		});

		if (hasPartials)
			registerPartials(partialsDirectory);
	}

	/**
	 * Compiles {@code <views>/<templateName>.hbs} and makes it available to {@link #render(String, Map)}.
	 *
	 * @param templateName the template name, e.g. {@code hello}
	 * @return this engine, for chaining
	 * @throws TemplateRenderException if the file is missing or does not compile
	 */
	@Nonnull
	public HandlebarsTemplateEngine registerTemplate(@Nonnull String templateName) {
		requireNonNull(templateName);

		try {
			getTemplatesByName().put(templateName, getHandlebars().compile(templateName));
		} catch (IOException | HandlebarsException e) {
			throw new TemplateRenderException(format("Unable to register template '%s' from %s", templateName,
					getViewsDirectory().resolve(templateName + TEMPLATE_SUFFIX)), e);
		}

		return this;
	}

	@Nonnull
	@Override
	public String render(@Nonnull String templateName,
											 @Nonnull Map<String, ?> data) {
		requireNonNull(templateName);
		requireNonNull(data);

		Template template = getTemplatesByName().get(templateName);

		if (template == null)
			throw new TemplateRenderException(format("No template is registered under the name '%s'", templateName));

		try {
			return template.apply(data);
		} catch (IOException | RuntimeException e) {
			throw new TemplateRenderException(format("Unable to render template '%s'", templateName), e);
		}
	}

	@Nonnull
	public Set<String> getRegisteredTemplateNames() {
		return Set.copyOf(getTemplatesByName().keySet());
	}

	private void registerPartials(@Nonnull Path partialsDirectory) {
		requireNonNull(partialsDirectory);

		try (DirectoryStream<Path> paths = Files.newDirectoryStream(partialsDirectory, "*" + TEMPLATE_SUFFIX)) {
			for (Path path : paths) {
				String fileName = path.getFileName().toString();
				String name = fileName.substring(0, fileName.length() - TEMPLATE_SUFFIX.length());
				getTemplatesByName().put(name, getHandlebars().compile(name));
			}
		} catch (IOException | HandlebarsException e) {
			throw new TemplateRenderException(format("Unable to register partials from %s", partialsDirectory), e);
		}
	}

	@Nonnull
	public Path getViewsDirectory() {
		return this.viewsDirectory;
	}

	@Nonnull
	private MarkdownRenderer getMarkdownRenderer() {
		return this.markdownRenderer;
	}

	@Nonnull
	private Handlebars getHandlebars() {
		return this.handlebars;
	}

	@Nonnull
	private Map<String, Template> getTemplatesByName() {
		return this.templatesByName;
	}

	@Override
	public String toString() {
		return format("%s{viewsDirectory=%s, templates=%s}", getClass().getSimpleName(), getViewsDirectory(), getRegisteredTemplateNames());
	}

	/**
	 * Builder used to construct instances of {@link HandlebarsTemplateEngine} via
	 * {@link HandlebarsTemplateEngine#withViewsDirectory(Path)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nonnull
		private final Path viewsDirectory;
		@Nullable
		private MarkdownRenderer markdownRenderer;

		private Builder(@Nonnull Path viewsDirectory) {
			requireNonNull(viewsDirectory);
			this.viewsDirectory = viewsDirectory;
		}

		@Nonnull
		public Builder markdownRenderer(@Nullable MarkdownRenderer markdownRenderer) {
			this.markdownRenderer = markdownRenderer;
			return this;
		}

		@Nonnull
		public HandlebarsTemplateEngine build() {
			return new HandlebarsTemplateEngine(this);
		}
	}
}
