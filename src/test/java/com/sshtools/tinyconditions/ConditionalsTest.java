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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.sshtools.tinyconditions.Conditionals.BranchKind;
import com.sshtools.tinyconditions.Conditionals.ConditionalException;
import com.sshtools.tinyconditions.Conditionals.ConditionalOptions;
import com.sshtools.tinyconditions.Conditionals.ConditionalProcessor;
import com.sshtools.tinyconditions.Conditionals.DirectiveScanner;
import com.sshtools.tinyconditions.Conditionals.Logger;

public class ConditionalsTest {

	@Test
	public void testNoBlocksUnchanged() {
		var text = "# Title\n\nSome {{NAME}} text\r\nwith {{else}} inline\n";
		var result = createProcessor().process(text, createVars());
		assertSame(text, result.text());
		assertTrue(result.trace().blocks().isEmpty());
	}

	@Test
	public void testEmptyAndNull() {
		assertEquals("", createProcessor().process("", createVars()).text());
		assertEquals("", createProcessor().process(null, createVars()).text());
	}

	@Test
	public void testIfTrue() {
		var result = createProcessor().process("{{#if ROLE == 'TEST'}}\nA\n{{/if}}", createVars());
		assertEquals("A", result.text());
	}

	@Test
	public void testIfFalse() {
		var result = createProcessor().process("{{#if ROLE == 'TEST'}}\nA\n{{/if}}",
				ValueTree.ofMap(Map.of("ROLE", "PROD")));
		assertFalse(result.text().contains("A"));
		assertFalse(result.text().contains("{{"));
	}

	@Test
	public void testVariableNameCaseInsensitive() {
		assertEquals("A", createProcessor().process("{{#if role == 'test'}}\nA\n{{/if}}", createVars()).text());
	}

	@Test
	public void testTemplate() {
		Assertions.assertEquals("""
				# Report
				Testing mode
				Always here
				""",
				createProcessor().process("""
				# Report
				{{#if ROLE == 'TEST'}}
				Testing mode
				{{else}}
				Production mode
				{{/if}}
				Always here
				""", createVars()).text());
	}

	@Test
	public void testElseAlwaysTakenWhenNothingElseIs() {
		var result = createProcessor().process("""
				{{#if false}}
				X
				{{else if false}}
				Y
				{{else}}
				Z
				{{/if}}""", createVars());
		assertEquals("Z", result.text());

		var branches = result.trace().blocks().get(0).branches();
		assertEquals(3, branches.size());
		assertFalse(branches.get(0).taken());
		assertFalse(branches.get(1).taken());
		assertTrue(branches.get(2).taken());
		assertEquals(BranchKind.ELSE, branches.get(2).kind());
		assertTrue(branches.get(2).expr().isEmpty());
	}

	@Test
	public void testElseIf() {
		Assertions.assertEquals("""
				Report content
				""",
				createProcessor().process("""
				{{#if ROLE == 'PROD'}}
				Prod content
				{{else if ROLE == 'TEST'}}
				Report content
				{{else if ROLE == 'TEST'}}
				Second match
				{{else}}
				Default content
				{{/if}}
				""", createVars()).text());
	}

	@Test
	public void testNoBranchTakenRemovesBlock() {
		Assertions.assertEquals("""
				before
				after
				""",
				createProcessor().process("""
				before
				{{#if DEBUG}}
				verbose
				{{else if ROLE == 'PROD'}}
				prod
				{{/if}}
				after
				""", createVars()).text());
	}

	@Test
	public void testDebugFalse() {
		var result = createProcessor().process("{{#if DEBUG}}\nverbose\n{{/if}}\nend", createVars());
		assertTrue(result.text().contains("end"));
		assertFalse(result.text().contains("verbose"));
	}

	@Test
	public void testLaterBranchesNotEvaluated() {
		/* would fail in strict mode if it were evaluated */
		var result = new ConditionalProcessor.Builder().withStrict().build().process("""
				{{#if ROLE == 'TEST'}}
				A
				{{else if UNKNOWN == 'X'}}
				B
				{{/if}}""", createVars());
		assertEquals("A", result.text());
		var branches = result.trace().blocks().get(0).branches();
		assertTrue(branches.get(0).taken());
		assertFalse(branches.get(1).taken());
		assertEquals("UNKNOWN == 'X'", branches.get(1).expr().get());
	}

	@Test
	public void testNested() {
		var result = createProcessor().process("""
				{{#if OUTER == 'true'}}
				Outer content
				{{#if ROLE == 'TEST'}}
				Inner content
				{{else}}
				Inner else
				{{/if}}
				{{#if DEBUG}}
				Debug content
				{{/if}}
				Outer end
				{{else}}
				Outer else
				{{/if}}
				""", createVars());

		Assertions.assertEquals("""
				Outer content
				Inner content
				Outer end
				""", result.text());

		/* closing order, inner blocks first */
		var blocks = result.trace().blocks();
		assertEquals(3, blocks.size());
		assertEquals(3, blocks.get(0).startLine());
		assertEquals(7, blocks.get(0).endLine());
		assertEquals(8, blocks.get(1).startLine());
		assertEquals(10, blocks.get(1).endLine());
		assertEquals(1, blocks.get(2).startLine());
		assertEquals(14, blocks.get(2).endLine());
	}

	@Test
	public void testNestedInsideDiscardedBranch() {
		Assertions.assertEquals("""
				Outer else
				""",
				createProcessor().process("""
				{{#if DEBUG}}
				{{#if ROLE == 'TEST'}}
				Inner content
				{{/if}}
				{{else}}
				Outer else
				{{/if}}
				""", createVars()).text());
	}

	@Test
	public void testAtMostOneBranchTaken() {
		var result = createProcessor().process("""
				{{#if ROLE == 'TEST'}}
				1
				{{else if ROLE == 'TEST'}}
				2
				{{else if true}}
				3
				{{else}}
				4
				{{/if}}
				{{#if false}}
				5
				{{/if}}
				""", createVars());
		for (var block : result.trace().blocks()) {
			assertTrue(block.branches().stream().filter(b -> b.taken()).count() <= 1);
		}
		assertEquals(BranchKind.IF, result.trace().blocks().get(0).taken().get().kind());
		assertTrue(result.trace().blocks().get(1).taken().isEmpty());
	}

	@Test
	public void testWhitespaceAndCaseInDirectives() {
		Assertions.assertEquals("""
				yes
				""",
				createProcessor().process("""
				  {{ #IF   ROLE == 'TEST'  }}
				yes
				{{  Else  }}
				no
				  {{ /If }}  
				""", createVars()).text());
	}

	@Test
	public void testDirectiveMustBeWholeLine() {
		var text = "Text {{#if ROLE == 'TEST'}}\nA\nB {{/if}}";
		assertSame(text, createProcessor().process(text, createVars()).text());
	}

	@Test
	public void testCrLfLines() {
		assertEquals("A\r", createProcessor().process("{{#if ROLE == 'TEST'}}\r\nA\r\n{{/if}}\r", createVars()).text());
	}

	@Test
	public void testFencedDirectivesIgnored() {
		var text = """
				Some content
				```
				{{#if ROLE == 'TEST'}}
				This should be ignored
				{{/if}}
				```
				~~~markdown
				{{else}}
				~~~
				""";
		var result = createProcessor().process(text, createVars());
		assertEquals(text, result.text());
		assertTrue(result.trace().blocks().isEmpty());
	}

	@Test
	public void testFenceInsideBranch() {
		Assertions.assertEquals("""
				```
				{{/if}}
				```
				""",
				createProcessor().process("""
				{{#if ROLE == 'TEST'}}
				```
				{{/if}}
				```
				{{/if}}
				""", createVars()).text());
	}

	@Test
	public void testParseFences() {
		Assertions.assertEquals("""
				```
				A
				```
				""",
				new ConditionalProcessor.Builder().withParseFences().build().process("""
				```
				{{#if ROLE == 'TEST'}}
				A
				{{/if}}
				```
				""", createVars()).text());
	}

	@Test
	public void testMaxNesting() {
		var ok = nested(10);
		assertEquals("core", createProcessor().process(ok, createVars()).text().strip());

		var ex = assertThrows(ConditionalException.class,
				() -> createProcessor().process(nested(11), createVars()));
		assertEquals(ConditionalException.Type.STRUCTURE, ex.type());
		assertEquals(11, ex.line());

		assertEquals("core", new ConditionalProcessor.Builder().withMaxNesting(3).build()
				.process(nested(3), createVars()).text().strip());
		assertThrows(ConditionalException.class,
				() -> new ConditionalProcessor.Builder().withMaxNesting(3).build().process(nested(4), createVars()));
	}

	@Test
	public void testDanglingDirectives() {
		assertStructureError("Content\n{{/if}}", 2);
		assertStructureError("Content\n{{else}}\nMore", 2);
		assertStructureError("{{else if ROLE == 'TEST'}}", 1);
	}

	@Test
	public void testUnclosedBlock() {
		var ex = assertStructureError("Intro\n{{#if ROLE == 'TEST'}}\nContent", 2);
		assertTrue(ex.getMessage().contains("Unclosed"));
		assertStructureError("{{#if ROLE == 'TEST'}}\nContent\n{{/else}}", 1);
		assertStructureError("{{#if A}}\n{{#if B}}\n{{/if}}\n", 1);
	}

	@Test
	public void testElseMustBeLast() {
		assertStructureError("{{#if A}}\n{{else}}\n{{else}}\n{{/if}}", 3);
		assertStructureError("{{#if A}}\n{{else}}\n{{else if B}}\n{{/if}}", 3);
	}

	@Test
	public void testExpressionErrorsAbort() {
		var ex = assertThrows(ConditionalException.class, () -> createProcessor().process("""
				first
				{{#if ROLE == 'TEST'}}
				A
				{{/if}}
				{{#if ROLE == 'TEST}}
				B
				{{/if}}
				""", createVars()));
		assertEquals(ConditionalException.Type.EXPRESSION, ex.type());
		assertEquals(5, ex.line());
		assertEquals("ROLE == 'TEST", ex.expression().get());
		assertTrue(ex.getCause() instanceof Expressions.ExpressionException);
	}

	@Test
	public void testStrictErrors() {
		var processor = new ConditionalProcessor.Builder().withStrict().build();
		var ex = assertThrows(ConditionalException.class,
				() -> processor.process("{{#if UNKNOWN_VAR == 'TEST'}}\nContent\n{{/if}}", createVars()));
		assertEquals(ConditionalException.Type.EXPRESSION, ex.type());
		assertThrows(ConditionalException.class,
				() -> processor.process("{{#if COUNT == 'five'}}\nContent\n{{/if}}", createVars()));
	}

	@Test
	public void testStrictExistsOfUnknown() {
		var processor = new ConditionalProcessor.Builder().withStrict().build();
		var ex = assertThrows(ConditionalException.class,
				() -> processor.process("{{#if exists(UNKNOWN_VAR)}}\nContent\n{{/if}}", createVars()));
		assertEquals(ConditionalException.Type.EXPRESSION, ex.type());
		assertEquals("exists(UNKNOWN_VAR)", ex.expression().get());
	}

	@Test
	public void testStringFunctionOfUnknownVariableExcludes() {
		var vars = ValueTree.ofMap(Map.of("TAGS", "alpha,beta"));
		assertEquals("", createProcessor().process("{{#if contains(TAGS, FILTER)}}\nSECRET\n{{/if}}", vars).text());
		assertEquals("", createProcessor().process("{{#if TAGS.startsWith(FILTER)}}\nSECRET\n{{/if}}", vars).text());
		assertEquals("public", createProcessor().process("""
				{{#if endsWith(TAGS, FILTER)}}
				SECRET
				{{else}}
				public
				{{/if}}""", vars).text());
	}

	@Test
	public void testDirectiveWithoutExpression() {
		var ex = assertStructureError("Intro\n{{#if}}\nA\n{{/if}}", 2);
		assertTrue(ex.getMessage().contains("{{#if}}"));
		assertStructureError("{{#if ROLE == 'TEST'}}\nA\n{{ else if }}\nB\n{{/if}}", 3);
		var text = "```\n{{#if}}\n```";
		assertSame(text, createProcessor().process(text, createVars()).text());
	}

	@Test
	public void testScanNull() {
		assertTrue(new DirectiveScanner(ConditionalOptions.defaults()).scan(null).isEmpty());
	}

	@Test
	public void testNonStrictDefaults() {
		Assertions.assertEquals("""
				Included
				""",
				createProcessor().process("""
				{{#if UNKNOWN_VAR == 'TEST'}}
				Excluded
				{{/if}}
				{{#if COUNT == 'five'}}
				Excluded
				{{/if}}
				Included
				""", createVars()).text());
	}

	@Test
	public void testExists() {
		var processor = createProcessor();
		var text = "{{#if exists(AGENT)}}\nyes\n{{else}}\nno\n{{/if}}";
		assertEquals("yes", processor.process(text, ValueTree.ofMap(Map.of("AGENT", "QA"))).text());
		assertEquals("yes", processor.process(text, ValueTree.ofMap(Map.of("AGENT", 0))).text());
		assertEquals("no", processor.process(text, ValueTree.empty()).text());
		assertEquals("no", processor.process(text, ValueTree.ofMap(Map.of("AGENT", false))).text());
	}

	@Test
	public void testEmptyBranch() {
		Assertions.assertEquals("""
				Content
				""",
				createProcessor().process("""
				{{#if ROLE == 'TEST'}}
				{{else}}
				Other
				{{/if}}
				Content
				""", createVars()).text());
	}

	@Test
	public void testScanner() {
		var blocks = new DirectiveScanner(ConditionalOptions.defaults()).scan("""
				{{#if A}}
				a
				{{else if B}}
				{{else}}
				c
				c
				{{/if}}""");
		assertEquals(1, blocks.size());
		var block = blocks.get(0);
		assertEquals(1, block.startLine());
		assertEquals(7, block.endLine());
		var branches = block.branches();
		assertEquals(BranchKind.IF, branches.get(0).kind());
		assertEquals("A", branches.get(0).expression().get());
		assertEquals(1, branches.get(0).startLine());
		assertEquals(2, branches.get(0).endLine());
		assertEquals(BranchKind.ELSE_IF, branches.get(1).kind());
		assertEquals(3, branches.get(1).startLine());
		assertEquals(3, branches.get(1).endLine());
		assertEquals(BranchKind.ELSE, branches.get(2).kind());
		assertTrue(branches.get(2).expression().isEmpty());
		assertEquals(4, branches.get(2).startLine());
		assertEquals(6, branches.get(2).endLine());
	}

	@Test
	public void testValidate() {
		var processor = createProcessor();
		assertEquals(2, processor.validate("""
				{{#if in(ROLE, ROLES)}}
				{{/if}}
				{{#if contains(USER.NAME, 'x') || !DEBUG}}
				{{/if}}
				""").size());

		var ex = assertThrows(ConditionalException.class, () -> processor.validate("""
				{{#if true}}
				{{else if nosuch(ROLE)}}
				{{/if}}
				"""));
		assertEquals(2, ex.line());
		assertEquals("nosuch(ROLE)", ex.expression().get());
	}

	@Test
	public void testTraceJson() {
		var result = createProcessor().process("""
				{{#if ROLE == 'PROD'}}
				A
				{{else}}
				B
				{{/if}}""", createVars());
		Assertions.assertEquals("""
				{
				  "blocks": [
				    {
				      "startLine": 1,
				      "endLine": 5,
				      "branches": [
				        {
				          "kind": "if",
				          "expr": "ROLE == 'PROD'",
				          "taken": false
				        },
				        {
				          "kind": "else",
				          "taken": true
				        }
				      ]
				    }
				  ]
				}""", result.trace().toJson());
	}

	@Test
	public void testLogger() {
		var out = new ArrayList<String>();
		var processor = new ConditionalProcessor.Builder().
				withLogger(new Logger() {

					@Override
					public void warning(String message, Object... args) {
						out.add("WARN: " + MessageFormat.format(message, args));
					}

					@Override
					public void debug(String message, Object... args) {
						out.add("DEBUG: " + MessageFormat.format(message, args));
					}
				}).
				build();

		processor.process("{{#if ROLE == 'TEST'}}\nA\n{{/if}}", createVars());

		assertEquals("DEBUG:     Block opened at line 1, if `ROLE == 'TEST'`", out.get(0));
		assertTrue(out.contains("DEBUG: Line 1: `ROLE == 'TEST'` evaluates to true"));
		assertTrue(out.contains("DEBUG: Block at lines 1-3 takes if"));
	}

	@Test
	public void testOptions() {
		var options = new ConditionalOptions.Builder().withStrict().withMaxNesting(4).build();
		assertTrue(options.strict());
		assertFalse(options.caseSensitiveStrings());
		assertEquals(4, options.maxNesting());
		assertFalse(ConditionalOptions.defaults().strict());
		assertEquals(10, ConditionalOptions.defaults().maxNesting());
		assertEquals(options.toString(), new ConditionalOptions.Builder(options).build().toString());
		assertThrows(IllegalArgumentException.class, () -> new ConditionalOptions.Builder().withMaxNesting(0));

		var processor = new ConditionalProcessor.Builder().withOptions(options).withCaseSensitiveStrings().build();
		assertTrue(processor.options().strict());
		assertTrue(processor.options().caseSensitiveStrings());
		assertEquals(4, processor.options().maxNesting());
	}

	@Test
	public void testDefaultLogger() {
		var processor = new ConditionalProcessor.Builder().
				withLogger(Conditionals.defaultStdOutLogger()).
				build();
		assertEquals("A", processor.process("{{#if ROLE == 'TEST'}}\n{{#if COUNT == 5}}\nA\n{{/if}}\n{{/if}}",
				createVars()).text());
	}

	private static ConditionalException assertStructureError(String text, int line) {
		var ex = assertThrows(ConditionalException.class, () -> createProcessor().process(text, createVars()));
		assertEquals(ConditionalException.Type.STRUCTURE, ex.type());
		assertEquals(line, ex.line());
		return ex;
	}

	private static String nested(int depth) {
		var b = new StringBuilder();
		for (int i = 0; i < depth; i++)
			b.append("{{#if true}}\n");
		b.append("core\n");
		for (int i = 0; i < depth; i++)
			b.append("{{/if}}\n");
		return b.toString();
	}

	private static ConditionalProcessor createProcessor() {
		return new ConditionalProcessor.Builder().build();
	}

	private static ValueTree createVars() {
		return new ValueTree.Builder().
				variable("ROLE", "TEST").
				variable("OUTER", "true").
				variable("COUNT", 5).
				variable("DEBUG", false).
				build();
	}
}
