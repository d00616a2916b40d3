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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class CommonmarkMarkdownRendererTests {
	@Test
	public void headingsAndLists() {
		MarkdownRenderer markdownRenderer = CommonmarkMarkdownRenderer.sharedInstance();
		String html = markdownRenderer.toHtml("## Contents\nThis is a list:\n\n- item 1\n- item 2\n");

		Assertions.assertEquals("<h2>Contents</h2>\n<p>This is a list:</p>\n<ul>\n<li>item 1</li>\n<li>item 2</li>\n</ul>\n", html);
	}

	@Test
	public void tables() {
		String html = CommonmarkMarkdownRenderer.sharedInstance().toHtml("| a | b |\n|---|---|\n| 1 | 2 |\n");

		Assertions.assertTrue(html.contains("<table>"), html);
		Assertions.assertTrue(html.contains("<th>a</th>"), html);
		Assertions.assertTrue(html.contains("<td>2</td>"), html);
	}

	@Test
	public void footnotes() {
		String html = CommonmarkMarkdownRenderer.sharedInstance().toHtml("Text with a note[^1].\n\n[^1]: The note.\n");

		Assertions.assertTrue(html.contains("footnote"), html);
		Assertions.assertTrue(html.contains("The note."), html);
	}

	@Test
	public void emptyInput() {
		Assertions.assertEquals("", CommonmarkMarkdownRenderer.sharedInstance().toHtml(""));
	}
}
