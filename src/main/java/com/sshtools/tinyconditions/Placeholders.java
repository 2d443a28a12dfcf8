/**
 * Copyright © 2023 JAdaptive Limited (support@jadaptive.com)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this
 * software and associated documentation files (the “Software”), to deal in the Software
 * without restriction, including without limitation the rights to use, copy, modify,
 * merge, publish, distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies
 * or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED “AS IS”, WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED,
 * INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A
 * PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION
 * OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
 * SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */
package com.sshtools.tinyconditions;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.sshtools.tinyconditions.Conditionals.Logger;

/**
 * Substitution of <code>{{NAME}}</code> placeholders, normally done once
 * conditional blocks have been resolved.
 */
public final class Placeholders {

	final static String NAME_REGEXP = "[A-Z][A-Z0-9_]*(?:\\.[A-Z][A-Z0-9_]*)*";

	private final static Pattern PLACEHOLDER = Pattern.compile("\\{\\{(" + NAME_REGEXP + ")(?::-([^}]*))?\\}\\}");

	private Placeholders() {
	}

	/**
	 * The distinct placeholder names in a document, in the order they first
	 * appear.
	 *
	 * @param text document
	 * @return names
	 */
	public static List<String> names(String text) {
		var names = new LinkedHashSet<String>();
		var matcher = PLACEHOLDER.matcher(text);
		while (matcher.find()) {
			names.add(matcher.group(1));
		}
		return new ArrayList<>(names);
	}

	/**
	 * Replaces placeholders with values from a {@link ValueResolver}.
	 * <ul>
	 * <li><code>{{NAME}}</code> is replaced by the value of <code>NAME</code>.
	 * Names may be dotted paths, such as <code>{{USER.EMAIL}}</code>.</li>
	 * <li><code>{{NAME:-word}}</code> is replaced by the value of
	 * <code>NAME</code>, or <code>word</code> if it has no value.</li>
	 * </ul>
	 */
	public final static class PlaceholderExpander {

		public final static class Builder {
			private boolean missingThrowsException = true;
			private boolean missingAsEmpty = true;
			private Optional<Logger> logger = Optional.empty();
			private ValueResolver resolver = ValueTree.empty();

			public Builder withMissingAsEmpty() {
				this.missingAsEmpty = true;
				return withMissingThrowsException(false);
			}

			public Builder withMissingAsIs() {
				this.missingAsEmpty = false;
				return withMissingThrowsException(false);
			}

			public Builder withMissingThrowsException(boolean missingThrowsException) {
				this.missingThrowsException = missingThrowsException;
				return this;
			}

			public Builder withResolver(ValueResolver resolver) {
				this.resolver = resolver;
				return this;
			}

			public Builder fromSimpleMap(Map<String, ? extends Object> map) {
				return withResolver(ValueTree.ofMap(map));
			}

			public Builder withLogger(Logger logger) {
				return withLogger(Optional.of(logger));
			}

			public Builder withLogger(Optional<Logger> logger) {
				this.logger = logger;
				return this;
			}

			public PlaceholderExpander build() {
				return new PlaceholderExpander(this);
			}
		}

		private final boolean missingThrowsException;
		private final boolean missingAsEmpty;
		private final Optional<Logger> logger;
		private final ValueResolver resolver;

		private PlaceholderExpander(Builder bldr) {
			this.missingThrowsException = bldr.missingThrowsException;
			this.missingAsEmpty = bldr.missingAsEmpty;
			this.logger = bldr.logger;
			this.resolver = bldr.resolver;
		}

		public String process(String text) {
			var matcher = PLACEHOLDER.matcher(text);
			var builder = new StringBuilder();
			var i = 0;

			while (matcher.find()) {
				builder.append(text, i, matcher.start());
				builder.append(expand(matcher.group(1), matcher.group(2), matcher.group()));
				i = matcher.end();
			}

			builder.append(text, i, text.length());
			return builder.toString();
		}

		/**
		 * The names of placeholders in a document that would not be given a value,
		 * ignoring those with a fallback.
		 *
		 * @param text document
		 * @return unresolved names
		 */
		public List<String> unresolved(String text) {
			var names = new LinkedHashSet<String>();
			var matcher = PLACEHOLDER.matcher(text);
			while (matcher.find()) {
				if (matcher.group(2) == null && resolver.resolve(matcher.group(1)).isAbsent())
					names.add(matcher.group(1));
			}
			return new ArrayList<>(names);
		}

		private String expand(String name, String fallback, String placeholder) {
			logger.ifPresent(l -> l.debug("Expanding `{0}`", name));

			var val = resolver.resolve(name);
			if (!val.isAbsent())
				return val.text();

			if (fallback != null)
				return fallback;

			if (missingThrowsException)
				throw new IllegalArgumentException(MessageFormat.format("Required variable `{0}` is missing", name));

			if (missingAsEmpty)
				return "";

			logger.ifPresent(l -> l.warning("No value for `{0}`, leaving placeholder as is", name));
			return placeholder;
		}
	}
}
