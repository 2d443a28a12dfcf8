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
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.sshtools.tinyconditions.Conditionals.ConditionalOptions;

/**
 * The boolean expression language used in <code>{{#if}}</code> and
 * <code>{{else if}}</code> directives.
 * <p>
 * Expressions are made of variable paths, string, number and boolean literals,
 * the operators <code>!</code>, <code>==</code>, <code>!=</code>,
 * <code>&amp;&amp;</code> and <code>||</code>, parentheses, and calls to the
 * built in functions <code>contains</code>, <code>startsWith</code>,
 * <code>endsWith</code>, <code>in</code> and <code>exists</code>. A function
 * may also be called on a variable, so <code>ROLE.contains('x')</code> is the
 * same as <code>contains(ROLE, 'x')</code>.
 */
public final class Expressions {

	private final static double EPSILON = 0.0000001;

	private Expressions() {
	}

	public enum TokenKind {
		IDENTIFIER, STRING, NUMBER, BOOLEAN, EQUALS, NOT_EQUALS, AND, OR, NOT, LEFT_PAREN, RIGHT_PAREN, COMMA,
		LEFT_BRACKET, RIGHT_BRACKET, DOT
	}

	public final static class Token {
		private final TokenKind kind;
		private final String text;

		public Token(TokenKind kind, String text) {
			this.kind = kind;
			this.text = text;
		}

		public TokenKind kind() {
			return kind;
		}

		public String text() {
			return text;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, text);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null || getClass() != obj.getClass())
				return false;
			var other = (Token) obj;
			return kind == other.kind && Objects.equals(text, other.text);
		}

		@Override
		public String toString() {
			return kind + "[" + text + "]";
		}
	}

	/**
	 * Thrown when an expression cannot be tokenized, is malformed, or (in strict
	 * mode) refers to an unknown variable or compares values of different kinds.
	 */
	@SuppressWarnings("serial")
	public final static class ExpressionException extends IllegalArgumentException {

		public ExpressionException(String pattern, Object... args) {
			super(MessageFormat.format(pattern, args));
		}
	}

	public final static class Tokenizer {

		private Tokenizer() {
		}

		public static List<Token> tokenize(String expression) {
			var tokens = new ArrayList<Token>();
			var len = expression.length();
			var i = 0;

			while (i < len) {
				var ch = expression.charAt(i);

				if (Character.isWhitespace(ch)) {
					i++;
					continue;
				}

				var two = i + 1 < len ? expression.substring(i, i + 2) : "";
				if (two.equals("==")) {
					tokens.add(new Token(TokenKind.EQUALS, two));
					i += 2;
				} else if (two.equals("!=")) {
					tokens.add(new Token(TokenKind.NOT_EQUALS, two));
					i += 2;
				} else if (two.equals("&&")) {
					tokens.add(new Token(TokenKind.AND, two));
					i += 2;
				} else if (two.equals("||")) {
					tokens.add(new Token(TokenKind.OR, two));
					i += 2;
				} else if (ch == '!') {
					tokens.add(new Token(TokenKind.NOT, "!"));
					i++;
				} else if (ch == '(') {
					tokens.add(new Token(TokenKind.LEFT_PAREN, "("));
					i++;
				} else if (ch == ')') {
					tokens.add(new Token(TokenKind.RIGHT_PAREN, ")"));
					i++;
				} else if (ch == ',') {
					tokens.add(new Token(TokenKind.COMMA, ","));
					i++;
				} else if (ch == '[') {
					tokens.add(new Token(TokenKind.LEFT_BRACKET, "["));
					i++;
				} else if (ch == ']') {
					tokens.add(new Token(TokenKind.RIGHT_BRACKET, "]"));
					i++;
				} else if (ch == '.') {
					tokens.add(new Token(TokenKind.DOT, "."));
					i++;
				} else if (ch == '"' || ch == '\'') {
					var end = expression.indexOf(ch, i + 1);
					if (end == -1)
						throw new ExpressionException("Unterminated string literal starting at position {0,number,#}",
								i + 1);
					tokens.add(new Token(TokenKind.STRING, expression.substring(i + 1, end)));
					i = end + 1;
				} else if (isDigit(ch) || (ch == '-' && i + 1 < len && isDigit(expression.charAt(i + 1)))) {
					var start = i;
					i++;
					while (i < len && isDigit(expression.charAt(i)))
						i++;
					if (i + 1 < len && expression.charAt(i) == '.' && isDigit(expression.charAt(i + 1))) {
						i++;
						while (i < len && isDigit(expression.charAt(i)))
							i++;
					}
					tokens.add(new Token(TokenKind.NUMBER, expression.substring(start, i)));
				} else if (Character.isLetter(ch) || ch == '_') {
					var start = i;
					while (i < len && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_'))
						i++;
					var word = expression.substring(start, i);
					if (word.equalsIgnoreCase("true") || word.equalsIgnoreCase("false"))
						tokens.add(new Token(TokenKind.BOOLEAN, word));
					else
						tokens.add(new Token(TokenKind.IDENTIFIER, word));
				} else {
					throw new ExpressionException("Unexpected character `{0}` at position {1,number,#}", ch, i + 1);
				}
			}

			return tokens;
		}

		private static boolean isDigit(char ch) {
			return ch >= '0' && ch <= '9';
		}
	}

	/**
	 * Recursive descent evaluator. Values are computed as the tokens are parsed,
	 * there is no intermediate tree. From lowest to highest precedence the
	 * grammar is <code>||</code>, <code>&amp;&amp;</code>, unary
	 * <code>!</code>, a single <code>==</code> or <code>!=</code>, and finally
	 * primaries.
	 */
	public final static class Evaluator {

		private final List<Token> tokens;
		private final ValueResolver resolver;
		private final ConditionalOptions options;
		private final boolean checkOnly;
		private int pos;

		private Evaluator(List<Token> tokens, ValueResolver resolver, ConditionalOptions options, boolean checkOnly) {
			this.tokens = tokens;
			this.resolver = resolver;
			this.options = options;
			this.checkOnly = checkOnly;
		}

		public static boolean evaluate(String expression, ValueResolver resolver, ConditionalOptions options) {
			return evaluate(Tokenizer.tokenize(expression), resolver, options);
		}

		public static boolean evaluate(List<Token> tokens, ValueResolver resolver, ConditionalOptions options) {
			return new Evaluator(tokens, resolver, options, false).run();
		}

		/**
		 * Check an expression is well formed without looking up any variables.
		 * Unknown functions and wrong argument counts are still reported.
		 *
		 * @param expression expression
		 */
		public static void check(String expression) {
			new Evaluator(Tokenizer.tokenize(expression), path -> Value.absent(), ConditionalOptions.defaults(), true)
					.run();
		}

		private boolean run() {
			if (tokens.isEmpty())
				throw new ExpressionException("Empty expression");
			var result = parseOr();
			if (pos < tokens.size())
				throw new ExpressionException("Unexpected `{0}` after end of expression", tokens.get(pos).text());
			return result;
		}

		private boolean parseOr() {
			var left = parseAnd();
			while (at(TokenKind.OR)) {
				pos++;
				var right = parseAnd();
				left = left || right;
			}
			return left;
		}

		private boolean parseAnd() {
			var left = parseUnary();
			while (at(TokenKind.AND)) {
				pos++;
				var right = parseUnary();
				left = left && right;
			}
			return left;
		}

		private boolean parseUnary() {
			if (at(TokenKind.NOT)) {
				pos++;
				return !parseUnary();
			}
			return parseComparison();
		}

		private boolean parseComparison() {
			var left = parsePrimary();
			if (at(TokenKind.EQUALS) || at(TokenKind.NOT_EQUALS)) {
				var equals = tokens.get(pos).kind() == TokenKind.EQUALS;
				pos++;
				var right = parsePrimary();
				return compare(left, right, equals);
			}
			return left.toCondition();
		}

		private Value parsePrimary() {
			if (pos >= tokens.size())
				throw new ExpressionException("Unexpected end of expression");

			var token = tokens.get(pos);
			switch (token.kind()) {
			case LEFT_PAREN:
				pos++;
				var value = parseOr();
				expect(TokenKind.RIGHT_PAREN, "Missing closing parenthesis");
				return Value.of(value);
			case STRING:
				pos++;
				return Value.of(token.text());
			case NUMBER:
				pos++;
				return Value.of(Double.parseDouble(token.text()));
			case BOOLEAN:
				pos++;
				return Value.of(token.text().equalsIgnoreCase("true"));
			case IDENTIFIER:
				return parseReference();
			case LEFT_BRACKET:
				throw new ExpressionException("Array literals may only be used as function arguments");
			default:
				throw new ExpressionException("Unexpected `{0}`", token.text());
			}
		}

		/*
		 * name, name(args), a.b.c, or a.b.fn(args)
		 */
		private Value parseReference() {
			var path = new StringBuilder(tokens.get(pos++).text());

			if (at(TokenKind.LEFT_PAREN))
				return parseCall(path.toString(), null);

			while (at(TokenKind.DOT)) {
				pos++;
				if (!at(TokenKind.IDENTIFIER))
					throw new ExpressionException("Expected a name after `.` in `{0}`", path);
				var name = tokens.get(pos++).text();
				if (at(TokenKind.LEFT_PAREN))
					return parseCall(name, resolveVariable(path.toString()));
				path.append('.').append(name);
			}

			return resolveVariable(path.toString());
		}

		private Value parseCall(String function, Value receiver) {
			pos++;
			var args = new ArrayList<Value>();
			if (receiver != null)
				args.add(receiver);

			if (!at(TokenKind.RIGHT_PAREN)) {
				while (true) {
					args.add(parseArgument());
					if (at(TokenKind.COMMA))
						pos++;
					else
						break;
				}
			}

			expect(TokenKind.RIGHT_PAREN, "Missing closing parenthesis in call to " + function + "()");
			return Value.of(call(function, args));
		}

		private Value parseArgument() {
			if (!at(TokenKind.LEFT_BRACKET))
				return parsePrimary();

			pos++;
			var elements = new ArrayList<Value>();
			if (!at(TokenKind.RIGHT_BRACKET)) {
				while (true) {
					elements.add(parsePrimary());
					if (at(TokenKind.COMMA))
						pos++;
					else
						break;
				}
			}
			expect(TokenKind.RIGHT_BRACKET, "Missing closing bracket in array literal");
			return Value.array(elements);
		}

		private Value resolveVariable(String path) {
			var value = resolver.resolve(path);
			if (value == null || value.isAbsent()) {
				if (options.strict())
					throw new ExpressionException("Unknown variable `{0}`", path);
				return Value.absent();
			}
			return value;
		}

		private boolean call(String function, List<Value> args) {
			switch (function.toLowerCase(Locale.ROOT)) {
			case "contains":
				arity(function, args, 2);
				return indexOf(textOf(args.get(0)), textOf(args.get(1))) != -1;
			case "startswith":
				arity(function, args, 2);
				var text = textOf(args.get(0));
				var prefix = textOf(args.get(1));
				return text.regionMatches(!options.caseSensitiveStrings(), 0, prefix, 0, prefix.length());
			case "endswith":
				arity(function, args, 2);
				var str = textOf(args.get(0));
				var suffix = textOf(args.get(1));
				return str.length() >= suffix.length() && str.regionMatches(!options.caseSensitiveStrings(),
						str.length() - suffix.length(), suffix, 0, suffix.length());
			case "in":
				arity(function, args, 2);
				return in(args.get(0), args.get(1));
			case "exists":
				arity(function, args, 1);
				var val = args.get(0);
				return !val.isAbsent() && !(val.kind() == Value.Kind.BOOLEAN && !val.asBoolean());
			default:
				throw new ExpressionException("Unknown function `{0}`", function);
			}
		}

		private boolean in(Value needle, Value haystack) {
			if (haystack.kind() != Value.Kind.ARRAY) {
				if (checkOnly)
					return false;
				throw new ExpressionException("Second argument to in() must be an array, not {0}", haystack.kind());
			}
			for (var element : haystack.asArray()) {
				if (kindOf(needle) == kindOf(element) && equal(needle, element))
					return true;
			}
			return false;
		}

		private boolean compare(Value left, Value right, boolean equals) {
			var leftKind = kindOf(left);
			var rightKind = kindOf(right);
			if (leftKind != rightKind) {
				if (options.strict())
					throw new ExpressionException("Cannot compare {0} with {1}", leftKind, rightKind);
				return !equals;
			}
			var eq = equal(left, right);
			return equals ? eq : !eq;
		}

		private boolean equal(Value left, Value right) {
			switch (kindOf(left)) {
			case STRING:
				return options.caseSensitiveStrings() ? left.asString().equals(right.asString())
						: left.asString().equalsIgnoreCase(right.asString());
			case NUMBER:
				return Math.abs(left.asNumber() - right.asNumber()) < EPSILON;
			case BOOLEAN:
				return left.toCondition() == right.toCondition();
			default:
				return false;
			}
		}

		private int indexOf(String haystack, String needle) {
			if (options.caseSensitiveStrings())
				return haystack.indexOf(needle);
			else
				return haystack.toLowerCase(Locale.ROOT).indexOf(needle.toLowerCase(Locale.ROOT));
		}

		private boolean at(TokenKind kind) {
			return pos < tokens.size() && tokens.get(pos).kind() == kind;
		}

		private void expect(TokenKind kind, String message) {
			if (!at(kind))
				throw new ExpressionException(message.replace("'", "''"));
			pos++;
		}

		private static void arity(String function, List<Value> args, int expected) {
			if (args.size() != expected)
				throw new ExpressionException("{0}() requires {1,number,#} argument(s), got {2,number,#}", function,
						expected, args.size());
		}

		/* An absent value compares as false */
		private static Value.Kind kindOf(Value value) {
			return value.isAbsent() ? Value.Kind.BOOLEAN : value.kind();
		}

		/* An absent value has the text of false, never the empty string */
		private static String textOf(Value value) {
			return value.isAbsent() ? Value.of(false).text() : value.text();
		}
	}
}
