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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.sshtools.tinyconditions.Expressions.Evaluator;
import com.sshtools.tinyconditions.Expressions.ExpressionException;

/**
 * Conditional blocks for plain text and Markdown documents.
 * <p>
 * A block starts with a <code>{{#if expression}}</code> line, may contain any
 * number of <code>{{else if expression}}</code> lines followed by at most one
 * <code>{{else}}</code> line, and ends with a <code>{{/if}}</code> line. Each
 * directive must be the only thing on its line apart from whitespace. Blocks
 * may be nested. Directives inside fenced code (<code>```</code> or
 * <code>~~~</code>) are left alone.
 * <p>
 * The {@link ConditionalProcessor} keeps the body of the first branch whose
 * expression is true (or the <code>else</code> branch) and removes everything
 * else in the block, including the directive lines themselves.
 */
public final class Conditionals {

	private Conditionals() {
	}

	public interface Logger {
		void warning(String message, Object... args);

		void debug(String message, Object... args);
	}

	private final static class LazyDefaultStdOutLogger {
		final static Logger DEFAULT = new Logger() {

			@Override
			public void warning(String message, Object... args) {
				System.out.println("[WARNING] " + MessageFormat.format(message, args));
			}

			@Override
			public void debug(String message, Object... args) {
				System.out.println("[DEBUG] " + MessageFormat.format(message, args));
			}
		};
	}

	public final static Logger defaultStdOutLogger() {
		return LazyDefaultStdOutLogger.DEFAULT;
	}

	/**
	 * Options that control scanning and evaluation. Immutable, create with
	 * {@link Builder}.
	 */
	public final static class ConditionalOptions {

		private final static ConditionalOptions DEFAULTS = new Builder().build();

		public final static class Builder {
			private boolean strict;
			private boolean caseSensitiveStrings;
			private int maxNesting = 10;
			private boolean parseFences;

			public Builder() {
			}

			public Builder(ConditionalOptions options) {
				this.strict = options.strict;
				this.caseSensitiveStrings = options.caseSensitiveStrings;
				this.maxNesting = options.maxNesting;
				this.parseFences = options.parseFences;
			}

			/**
			 * Unknown variables and comparisons between values of different kinds
			 * become errors instead of evaluating as false.
			 *
			 * @return this for chaining
			 */
			public Builder withStrict() {
				return withStrict(true);
			}

			public Builder withStrict(boolean strict) {
				this.strict = strict;
				return this;
			}

			public Builder withCaseSensitiveStrings() {
				return withCaseSensitiveStrings(true);
			}

			public Builder withCaseSensitiveStrings(boolean caseSensitiveStrings) {
				this.caseSensitiveStrings = caseSensitiveStrings;
				return this;
			}

			public Builder withMaxNesting(int maxNesting) {
				if (maxNesting < 1)
					throw new IllegalArgumentException("Maximum nesting must be at least 1.");
				this.maxNesting = maxNesting;
				return this;
			}

			/**
			 * Recognise directives inside fenced code as well.
			 *
			 * @return this for chaining
			 */
			public Builder withParseFences() {
				return withParseFences(true);
			}

			public Builder withParseFences(boolean parseFences) {
				this.parseFences = parseFences;
				return this;
			}

			public ConditionalOptions build() {
				return new ConditionalOptions(this);
			}
		}

		private final boolean strict;
		private final boolean caseSensitiveStrings;
		private final int maxNesting;
		private final boolean parseFences;

		private ConditionalOptions(Builder bldr) {
			this.strict = bldr.strict;
			this.caseSensitiveStrings = bldr.caseSensitiveStrings;
			this.maxNesting = bldr.maxNesting;
			this.parseFences = bldr.parseFences;
		}

		public static ConditionalOptions defaults() {
			return DEFAULTS;
		}

		public boolean strict() {
			return strict;
		}

		public boolean caseSensitiveStrings() {
			return caseSensitiveStrings;
		}

		public int maxNesting() {
			return maxNesting;
		}

		public boolean parseFences() {
			return parseFences;
		}

		@Override
		public String toString() {
			return "ConditionalOptions [strict=" + strict + ", caseSensitiveStrings=" + caseSensitiveStrings
					+ ", maxNesting=" + maxNesting + ", parseFences=" + parseFences + "]";
		}
	}

	public enum BranchKind {
		IF("if"), ELSE_IF("else-if"), ELSE("else");

		private final String label;

		BranchKind(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}
	}

	public final static class ConditionalBranch {
		private final BranchKind kind;
		private final String expression;
		private final int startLine;
		private final int endLine;

		ConditionalBranch(BranchKind kind, String expression, int startLine, int endLine) {
			this.kind = kind;
			this.expression = expression;
			this.startLine = startLine;
			this.endLine = endLine;
		}

		public BranchKind kind() {
			return kind;
		}

		/**
		 * The raw expression text, or empty for an <code>else</code> branch.
		 *
		 * @return expression
		 */
		public Optional<String> expression() {
			return Optional.ofNullable(expression);
		}

		/**
		 * Line of the directive that opens this branch.
		 *
		 * @return start line
		 */
		public int startLine() {
			return startLine;
		}

		/**
		 * Last line of the branch body. Less than {@link #startLine()} + 1 when the
		 * body is empty.
		 *
		 * @return end line
		 */
		public int endLine() {
			return endLine;
		}

		@Override
		public String toString() {
			return "ConditionalBranch [kind=" + kind + ", expression=" + expression + ", startLine=" + startLine
					+ ", endLine=" + endLine + "]";
		}
	}

	public final static class ConditionalBlock {
		private final int startLine;
		private final int endLine;
		private final List<ConditionalBranch> branches;

		ConditionalBlock(int startLine, int endLine, List<ConditionalBranch> branches) {
			this.startLine = startLine;
			this.endLine = endLine;
			this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
		}

		public int startLine() {
			return startLine;
		}

		public int endLine() {
			return endLine;
		}

		public List<ConditionalBranch> branches() {
			return branches;
		}

		@Override
		public String toString() {
			return "ConditionalBlock [startLine=" + startLine + ", endLine=" + endLine + ", branches=" + branches
					+ "]";
		}
	}

	/**
	 * Thrown for any failure while scanning or evaluating a document. Nothing is
	 * output when this happens.
	 */
	@SuppressWarnings("serial")
	public final static class ConditionalException extends IllegalStateException {

		public enum Type {
			/** Dangling, misplaced or unclosed directives, or nesting too deep. */
			STRUCTURE,
			/** An expression that could not be tokenized, parsed or evaluated. */
			EXPRESSION
		}

		private final Type type;
		private final int line;
		private final String expression;

		ConditionalException(Type type, int line, String expression, String message, Throwable cause) {
			super(MessageFormat.format("Line {0,number,#}: {1}", line, message), cause);
			this.type = type;
			this.line = line;
			this.expression = expression;
		}

		static ConditionalException structure(int line, String pattern, Object... args) {
			return new ConditionalException(Type.STRUCTURE, line, null, MessageFormat.format(pattern, args), null);
		}

		static ConditionalException expression(int line, String expression, ExpressionException cause) {
			return new ConditionalException(Type.EXPRESSION, line, expression,
					MessageFormat.format("Invalid expression `{0}`. {1}", expression, cause.getMessage()), cause);
		}

		public Type type() {
			return type;
		}

		/**
		 * The 1-based line the problem was found on.
		 *
		 * @return line
		 */
		public int line() {
			return line;
		}

		public Optional<String> expression() {
			return Optional.ofNullable(expression);
		}
	}

	/**
	 * A record of which branch of each block was taken.
	 */
	public final static class ConditionalTrace {

		public final static class BranchTrace {
			private final BranchKind kind;
			private final String expr;
			private final boolean taken;

			BranchTrace(BranchKind kind, String expr, boolean taken) {
				this.kind = kind;
				this.expr = expr;
				this.taken = taken;
			}

			public BranchKind kind() {
				return kind;
			}

			public Optional<String> expr() {
				return Optional.ofNullable(expr);
			}

			public boolean taken() {
				return taken;
			}

			@Override
			public String toString() {
				return kind.label() + (expr == null ? "" : " " + expr) + (taken ? " [taken]" : "");
			}
		}

		public final static class BlockTrace {
			private final int startLine;
			private final int endLine;
			private final List<BranchTrace> branches;

			BlockTrace(int startLine, int endLine, List<BranchTrace> branches) {
				this.startLine = startLine;
				this.endLine = endLine;
				this.branches = Collections.unmodifiableList(branches);
			}

			public int startLine() {
				return startLine;
			}

			public int endLine() {
				return endLine;
			}

			public List<BranchTrace> branches() {
				return branches;
			}

			public Optional<BranchTrace> taken() {
				return branches.stream().filter(BranchTrace::taken).findFirst();
			}

			@Override
			public String toString() {
				return startLine + "-" + endLine + " " + branches;
			}
		}

		private final static ConditionalTrace EMPTY = new ConditionalTrace(Collections.emptyList());

		private final List<BlockTrace> blocks;

		ConditionalTrace(List<BlockTrace> blocks) {
			this.blocks = Collections.unmodifiableList(blocks);
		}

		public static ConditionalTrace empty() {
			return EMPTY;
		}

		public List<BlockTrace> blocks() {
			return blocks;
		}

		/**
		 * Render as pretty printed JSON, in the form
		 * <code>{"blocks":[{"startLine":1,"endLine":3,"branches":[{"kind":"if","expr":"A","taken":true}]}]}</code>.
		 *
		 * @return json
		 */
		public String toJson() {
			var root = new JsonObject();
			var jsonBlocks = new JsonArray();
			for (var block : blocks) {
				var jsonBlock = new JsonObject();
				jsonBlock.addProperty("startLine", block.startLine);
				jsonBlock.addProperty("endLine", block.endLine);
				var jsonBranches = new JsonArray();
				for (var branch : block.branches) {
					var jsonBranch = new JsonObject();
					jsonBranch.addProperty("kind", branch.kind.label());
					if (branch.expr != null)
						jsonBranch.addProperty("expr", branch.expr);
					jsonBranch.addProperty("taken", branch.taken);
					jsonBranches.add(jsonBranch);
				}
				jsonBlock.add("branches", jsonBranches);
				jsonBlocks.add(jsonBlock);
			}
			root.add("blocks", jsonBlocks);
			return new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create().toJson(root);
		}

		@Override
		public String toString() {
			return "ConditionalTrace " + blocks;
		}
	}

	/**
	 * The pruned document and the trace of how it was pruned.
	 */
	public final static class Result {
		private final String text;
		private final ConditionalTrace trace;

		Result(String text, ConditionalTrace trace) {
			this.text = text;
			this.trace = trace;
		}

		public String text() {
			return text;
		}

		public ConditionalTrace trace() {
			return trace;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Finds the conditional blocks in a document, line by line.
	 */
	public final static class DirectiveScanner {

		private final static String EXPR = "((?:(?!\\}\\}).)+?)";
		private final static Pattern IF = Pattern.compile("^\\s*\\{\\{\\s*#if\\s+" + EXPR + "\\s*\\}\\}\\s*$",
				Pattern.CASE_INSENSITIVE);
		private final static Pattern ELSE_IF = Pattern
				.compile("^\\s*\\{\\{\\s*else\\s+if\\s+" + EXPR + "\\s*\\}\\}\\s*$", Pattern.CASE_INSENSITIVE);
		private final static Pattern ELSE = Pattern.compile("^\\s*\\{\\{\\s*else\\s*\\}\\}\\s*$",
				Pattern.CASE_INSENSITIVE);
		private final static Pattern MISSING_EXPR = Pattern.compile("^\\s*\\{\\{\\s*(?:#if|else\\s+if)\\s*\\}\\}\\s*$",
				Pattern.CASE_INSENSITIVE);
		private final static Pattern END_IF = Pattern.compile("^\\s*\\{\\{\\s*/if\\s*\\}\\}\\s*$",
				Pattern.CASE_INSENSITIVE);

		private final static class BlockBuilder {
			final int startLine;
			final List<ConditionalBranch> branches = new ArrayList<>();
			BranchKind kind = BranchKind.IF;
			String expression;
			int branchStart;

			BlockBuilder(int startLine, String expression) {
				this.startLine = startLine;
				this.expression = expression;
				this.branchStart = startLine;
			}

			void next(BranchKind kind, String expression, int line) {
				closeBranch(line - 1);
				this.kind = kind;
				this.expression = expression;
				this.branchStart = line;
			}

			void closeBranch(int endLine) {
				branches.add(new ConditionalBranch(kind, expression, branchStart, endLine));
			}

			ConditionalBlock close(int line) {
				closeBranch(line - 1);
				return new ConditionalBlock(startLine, line, branches);
			}
		}

		private final ConditionalOptions options;
		private final Optional<Logger> logger;

		public DirectiveScanner(ConditionalOptions options) {
			this(options, Optional.empty());
		}

		public DirectiveScanner(ConditionalOptions options, Optional<Logger> logger) {
			this.options = options;
			this.logger = logger;
		}

		/**
		 * Scan a document. Blocks are returned in the order they are closed, so
		 * nested blocks come before the block that contains them.
		 *
		 * @param text document, <code>null</code> is treated as empty
		 * @return blocks
		 * @throws ConditionalException on any structural problem
		 */
		public List<ConditionalBlock> scan(String text) {
			var blocks = new ArrayList<ConditionalBlock>();
			Deque<BlockBuilder> stack = new ArrayDeque<>();
			var lines = (text == null ? "" : text).split("\n", -1);
			var inFence = false;

			for (int i = 0; i < lines.length; i++) {
				var line = lines[i];
				var lineNumber = i + 1;

				if (!options.parseFences() && isFence(line)) {
					inFence = !inFence;
					continue;
				}
				if (inFence)
					continue;

				var mtchr = IF.matcher(line);
				if (mtchr.matches()) {
					if (stack.size() >= options.maxNesting())
						throw ConditionalException.structure(lineNumber, "Maximum nesting depth of {0,number,#} exceeded",
								options.maxNesting());
					var expr = mtchr.group(1).trim();
					stack.push(new BlockBuilder(lineNumber, expr));
					debug(stack.size(), "Block opened at line {0,number,#}, if `{1}`", lineNumber, expr);
					continue;
				}

				mtchr = ELSE_IF.matcher(line);
				if (mtchr.matches()) {
					var block = current(stack, lineNumber, "{{else if}}");
					if (block.kind == BranchKind.ELSE)
						throw ConditionalException.structure(lineNumber, "'{{else if}}' after '{{else}}' in block started at line {0,number,#}",
								block.startLine);
					var expr = mtchr.group(1).trim();
					block.next(BranchKind.ELSE_IF, expr, lineNumber);
					debug(stack.size(), "Else if `{0}` at line {1,number,#}", expr, lineNumber);
					continue;
				}

				if (ELSE.matcher(line).matches()) {
					var block = current(stack, lineNumber, "{{else}}");
					if (block.kind == BranchKind.ELSE)
						throw ConditionalException.structure(lineNumber, "Second '{{else}}' in block started at line {0,number,#}",
								block.startLine);
					block.next(BranchKind.ELSE, null, lineNumber);
					debug(stack.size(), "Else at line {0,number,#}", lineNumber);
					continue;
				}

				if (MISSING_EXPR.matcher(line).matches())
					throw ConditionalException.structure(lineNumber, "Directive `{0}` has no expression", line.strip());

				if (END_IF.matcher(line).matches()) {
					current(stack, lineNumber, "{{/if}}");
					var depth = stack.size();
					var block = stack.pop().close(lineNumber);
					debug(depth, "Block closed at line {0,number,#} with {1,number,#} branch(es)", lineNumber,
							block.branches().size());
					blocks.add(block);
				}
			}

			if (!stack.isEmpty()) {
				var unclosed = stack.peek();
				throw ConditionalException.structure(unclosed.startLine, "Unclosed '{{#if}}' starting at line {0,number,#}",
						unclosed.startLine);
			}

			return blocks;
		}

		private BlockBuilder current(Deque<BlockBuilder> stack, int line, String directive) {
			if (stack.isEmpty())
				throw ConditionalException.structure(line, "{0} without matching '{{#if}}'", directive);
			return stack.peek();
		}

		private void debug(int depth, String message, Object... args) {
			if (logger.isPresent()) {
				var indented = depth == 0 ? message : String.format("%" + (depth * 4) + "s%s", "", message);
				logger.get().debug(indented, args);
			}
		}

		static boolean isFence(String line) {
			var trimmed = line.stripLeading();
			return trimmed.startsWith("```") || trimmed.startsWith("~~~");
		}
	}

	/**
	 * Evaluates the conditional blocks in a document against a set of values,
	 * keeping only the taken branch of each.
	 * <p>
	 * Instances are immutable and may be shared between threads.
	 */
	public final static class ConditionalProcessor {

		public final static class Builder {
			private ConditionalOptions.Builder options = new ConditionalOptions.Builder();
			private Optional<Logger> logger = Optional.empty();

			public Builder withOptions(ConditionalOptions options) {
				this.options = new ConditionalOptions.Builder(options);
				return this;
			}

			public Builder withStrict() {
				options.withStrict();
				return this;
			}

			public Builder withCaseSensitiveStrings() {
				options.withCaseSensitiveStrings();
				return this;
			}

			public Builder withMaxNesting(int maxNesting) {
				options.withMaxNesting(maxNesting);
				return this;
			}

			public Builder withParseFences() {
				options.withParseFences();
				return this;
			}

			public Builder withLogger(Logger logger) {
				return withLogger(Optional.of(logger));
			}

			public Builder withLogger(Optional<Logger> logger) {
				this.logger = logger;
				return this;
			}

			public ConditionalProcessor build() {
				return new ConditionalProcessor(this);
			}
		}

		private final ConditionalOptions options;
		private final Optional<Logger> logger;

		private ConditionalProcessor(Builder bldr) {
			this.options = bldr.options.build();
			this.logger = bldr.logger;
		}

		public ConditionalOptions options() {
			return options;
		}

		/**
		 * Check the structure of a document and the syntax of every expression in
		 * it, without evaluating anything.
		 *
		 * @param text document
		 * @return blocks found
		 * @throws ConditionalException on the first problem found
		 */
		public List<ConditionalBlock> validate(String text) {
			var blocks = new DirectiveScanner(options, logger).scan(text == null ? "" : text);
			for (var block : blocks) {
				for (var branch : block.branches()) {
					if (branch.expression != null) {
						try {
							Evaluator.check(branch.expression);
						} catch (ExpressionException ee) {
							throw ConditionalException.expression(branch.startLine, branch.expression, ee);
						}
					}
				}
			}
			return blocks;
		}

		/**
		 * Evaluate and prune a document.
		 *
		 * @param text     document
		 * @param resolver values for variables used in expressions
		 * @return pruned text and trace
		 * @throws ConditionalException on any structural or expression problem
		 */
		public Result process(String text, ValueResolver resolver) {
			if (text == null || text.isEmpty())
				return new Result("", ConditionalTrace.empty());

			var blocks = new DirectiveScanner(options, logger).scan(text);
			if (blocks.isEmpty())
				return new Result(text, ConditionalTrace.empty());

			var lines = text.split("\n", -1);
			var removed = new boolean[lines.length + 1];
			var traces = new ArrayList<ConditionalTrace.BlockTrace>();

			for (var block : blocks) {
				ConditionalBranch takenBranch = null;
				var branchTraces = new ArrayList<ConditionalTrace.BranchTrace>();

				for (var branch : block.branches()) {
					var taken = false;
					if (takenBranch == null) {
						taken = branch.kind == BranchKind.ELSE || evaluate(branch, resolver);
						if (taken)
							takenBranch = branch;
					}
					branchTraces.add(new ConditionalTrace.BranchTrace(branch.kind, branch.expression, taken));
				}

				for (int i = block.startLine(); i <= block.endLine(); i++) {
					if (takenBranch == null || i <= takenBranch.startLine || i > takenBranch.endLine)
						removed[i] = true;
				}

				var fTaken = takenBranch;
				logger.ifPresent(l -> l.debug("Block at lines {0,number,#}-{1,number,#} takes {2}", block.startLine(),
						block.endLine(), fTaken == null ? "no branch" : fTaken.kind.label()));

				traces.add(new ConditionalTrace.BlockTrace(block.startLine(), block.endLine(), branchTraces));
			}

			var kept = new ArrayList<String>(lines.length);
			for (int i = 0; i < lines.length; i++) {
				if (!removed[i + 1])
					kept.add(lines[i]);
			}

			return new Result(String.join("\n", kept), new ConditionalTrace(traces));
		}

		private boolean evaluate(ConditionalBranch branch, ValueResolver resolver) {
			try {
				var result = Evaluator.evaluate(branch.expression, resolver, options);
				logger.ifPresent(l -> l.debug("Line {0,number,#}: `{1}` evaluates to {2}", branch.startLine,
						branch.expression, result));
				return result;
			} catch (ExpressionException ee) {
				throw ConditionalException.expression(branch.startLine, branch.expression, ee);
			}
		}
	}
}
