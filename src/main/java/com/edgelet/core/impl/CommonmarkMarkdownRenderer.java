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
import org.commonmark.Extension;
import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link MarkdownRenderer} backed by commonmark-java, with tables and footnotes enabled.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CommonmarkMarkdownRenderer implements MarkdownRenderer {
	@Nonnull
	private static final CommonmarkMarkdownRenderer SHARED_INSTANCE;

	static {
		SHARED_INSTANCE = new CommonmarkMarkdownRenderer();
	}

	// Both are immutable and safe to share across threads
	@Nonnull
	private final Parser parser;
	@Nonnull
	private final HtmlRenderer htmlRenderer;

	@Nonnull
	public static CommonmarkMarkdownRenderer sharedInstance() {
		return SHARED_INSTANCE;
	}

	private CommonmarkMarkdownRenderer() {
		List<Extension> extensions = List.of(TablesExtension.create(), FootnotesExtension.create());

		this.parser = Parser.builder().extensions(extensions).build();
		this.htmlRenderer = HtmlRenderer.builder().extensions(extensions).build();
	}

	@Nonnull
	@Override
	public String toHtml(@Nonnull String markdown) {
		requireNonNull(markdown);
		return getHtmlRenderer().render(getParser().parse(markdown));
	}

	@Nonnull
	private Parser getParser() {
		return this.parser;
	}

	@Nonnull
	private HtmlRenderer getHtmlRenderer() {
		return this.htmlRenderer;
	}
}
