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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import com.sshtools.tinyconditions.Conditionals.ConditionalOptions;
import com.sshtools.tinyconditions.Conditionals.ConditionalProcessor;
import com.sshtools.tinyconditions.Conditionals.ConditionalTrace;
import com.sshtools.tinyconditions.Conditionals.Logger;
import com.sshtools.tinyconditions.Placeholders.PlaceholderExpander;

/**
 * Processing of whole Markdown templates. Conditional blocks are resolved
 * first, then placeholders in whatever text remains are substituted.
 */
public final class MarkdownTemplates {

	private MarkdownTemplates() {
	}

	/**
	 * A variable declared by a template, usually in its front matter.
	 */
	public final static class VariableDefinition {
		private final String name;
		private final String description;
		private final boolean required;
		private final Object defaultValue;

		private VariableDefinition(String name, String description, boolean required, Object defaultValue) {
			this.name = Objects.requireNonNull(name);
			this.description = description == null ? "" : description;
			this.required = required;
			this.defaultValue = defaultValue;
		}

		public static VariableDefinition required(String name, String description) {
			return new VariableDefinition(name, description, true, null);
		}

		public static VariableDefinition optional(String name, String description, Object defaultValue) {
			return new VariableDefinition(name, description, false, defaultValue);
		}

		public String name() {
			return name;
		}

		public String description() {
			return description;
		}

		public boolean required() {
			return required;
		}

		public Optional<Object> defaultValue() {
			return Optional.ofNullable(defaultValue);
		}

		@Override
		public String toString() {
			return "VariableDefinition [name=" + name + ", required=" + required + ", defaultValue=" + defaultValue
					+ "]";
		}
	}

	/**
	 * Thrown when placeholders remain that have no value, or that name variables
	 * the template does not declare.
	 */
	@SuppressWarnings("serial")
	public final static class MissingVariablesException extends IllegalArgumentException {
		private final List<String> names;

		MissingVariablesException(List<String> names) {
			super(MessageFormat.format("Missing variable(s): {0}", String.join(", ", names)));
			this.names = Collections.unmodifiableList(new ArrayList<>(names));
		}

		public List<String> names() {
			return names;
		}
	}

	public final static class DocumentProcessor {

		public final static class Builder {
			private boolean conditions = true;
			private ConditionalOptions options = ConditionalOptions.defaults();
			private final Map<String, VariableDefinition> variables = new LinkedHashMap<>();
			private Optional<Consumer<ConditionalTrace>> traceSink = Optional.empty();
			private Optional<Logger> logger = Optional.empty();

			public Builder withConditions(boolean conditions) {
				this.conditions = conditions;
				return this;
			}

			public Builder withoutConditions() {
				return withConditions(false);
			}

			public Builder withOptions(ConditionalOptions options) {
				this.options = options;
				return this;
			}

			public Builder withVariables(VariableDefinition... variables) {
				return withVariables(List.of(variables));
			}

			public Builder withVariables(Collection<VariableDefinition> variables) {
				variables.forEach(v -> this.variables.put(v.name().toUpperCase(Locale.ROOT), v));
				return this;
			}

			/**
			 * Receives the trace of conditional evaluation, for diagnostics.
			 *
			 * @param traceSink sink
			 * @return this for chaining
			 */
			public Builder withTraceSink(Consumer<ConditionalTrace> traceSink) {
				this.traceSink = Optional.of(traceSink);
				return this;
			}

			public Builder withLogger(Logger logger) {
				return withLogger(Optional.of(logger));
			}

			public Builder withLogger(Optional<Logger> logger) {
				this.logger = logger;
				return this;
			}

			public DocumentProcessor build() {
				return new DocumentProcessor(this);
			}
		}

		private final boolean conditions;
		private final ConditionalProcessor processor;
		private final Map<String, VariableDefinition> variables;
		private final Optional<Consumer<ConditionalTrace>> traceSink;
		private final Optional<Logger> logger;

		private DocumentProcessor(Builder bldr) {
			this.conditions = bldr.conditions;
			this.processor = new ConditionalProcessor.Builder().withOptions(bldr.options).withLogger(bldr.logger)
					.build();
			this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(bldr.variables));
			this.traceSink = bldr.traceSink;
			this.logger = bldr.logger;
		}

		/**
		 * Process a template.
		 *
		 * @param text template content, without front matter
		 * @param args argument values
		 * @return processed document
		 * @throws Conditionals.ConditionalException if conditional blocks are malformed or cannot be evaluated
		 * @throws MissingVariablesException if placeholders are left without values
		 */
		public String process(String text, ValueTree args) {
			var merged = mergeDefaults(args);

			var content = text == null ? "" : text;
			if (conditions) {
				var result = processor.process(content, merged);
				traceSink.ifPresent(s -> s.accept(result.trace()));
				content = result.text();
			}

			var expander = new PlaceholderExpander.Builder().withResolver(merged).withLogger(logger).build();

			var missing = new ArrayList<String>();
			if (!variables.isEmpty()) {
				for (var name : Placeholders.names(content)) {
					var root = name.split("\\.")[0];
					if (!variables.containsKey(root.toUpperCase(Locale.ROOT)))
						missing.add(name);
				}
			}
			for (var name : expander.unresolved(content)) {
				if (!missing.contains(name))
					missing.add(name);
			}
			if (!missing.isEmpty())
				throw new MissingVariablesException(missing);

			return expander.process(content);
		}

		private ValueTree mergeDefaults(ValueTree args) {
			var defaults = new LinkedHashMap<String, Object>();
			for (var def : variables.values()) {
				if (!def.required())
					def.defaultValue().ifPresent(v -> defaults.put(def.name(), v));
			}
			if (defaults.isEmpty())
				return args;
			logger.ifPresent(l -> l.debug("Applying defaults for {0}", defaults.keySet()));
			return args.withDefaults(defaults);
		}
	}
}
