package org.metricshub.jash.backend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jash.JashTestSupport;
import org.metricshub.jash.intermediate.ArithmeticOp;
import org.metricshub.jash.intermediate.CaseArm;
import org.metricshub.jash.intermediate.CasePattern;
import org.metricshub.jash.intermediate.CommandEffects;
import org.metricshub.jash.intermediate.ComparisonOp;
import org.metricshub.jash.intermediate.LogicalOp;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.intermediate.ShellValue;
import org.metricshub.jash.verify.VerificationLevel;

public class PosixEmitterTest {

	private static ShellValue str(String value) {
		return new ShellValue.Str(value);
	}

	private static ShellValue var(String name) {
		return new ShellValue.Variable(name);
	}

	/**
	 * Emits a single node, and returns what follows the preamble.
	 */
	private static String emitBody(ShellIR node) throws EmitException {
		String script = new PosixEmitter().emit(node);
		return script.substring(script.indexOf("export LC_ALL=C\n\n") + "export LC_ALL=C\n\n".length());
	}

	private static String word(ShellValue value) throws EmitException {
		String let = emitBody(new ShellIR.Let("x", value));
		return let.substring("x=".length(), let.length() - 1);
	}

	private static String condition(ShellValue value) throws EmitException {
		String test = emitBody(new ShellIR.If(value, new ShellIR.Noop(), null));
		return test.substring("if ".length(), test.indexOf("; then"));
	}

	@Test
	public void testPreamble() throws Exception {
		String script = new PosixEmitter().emit(new ShellIR.Noop());
		assertEquals("#!/bin/sh\n# Generated by Jash. Do not edit.\nset -euf\nIFS=' \t\n'\nexport LC_ALL=C\n\n:\n", script);

		String bash = new PosixEmitter(TargetDialect.BASH, false).emit(new ShellIR.Noop());
		assertTrue(bash.startsWith("#!/bin/bash\n"));
		assertTrue(bash.contains("\nset -uf\n"));
	}

	@Test
	public void testLiteralWords() throws Exception {
		assertEquals("hello", word(str("hello")));
		assertEquals("/usr/local/bin", word(str("/usr/local/bin")));
		assertEquals("'Hello, World!'", word(str("Hello, World!")));
		assertEquals("''", word(str("")));
		assertEquals("'it'\\''s'", word(str("it's")));
		assertEquals("'$(whoami)'", word(str("$(whoami)")));
		assertEquals("'*'", word(str("*")));
		assertEquals("'~'", word(str("~")));
		assertEquals("true", word(new ShellValue.Bool(true)));
	}

	@Test
	public void testVariablesAreQuoted() throws Exception {
		assertEquals("\"$name\"", word(var("name")));
		assertEquals("\"${greeting}, ${name}\"", word(new ShellValue.Concat(Arrays.asList(var("greeting"), str(", "), var("name")))));
		assertEquals("\"cost: \\$5 \\\"net\\\"${x}\"", word(new ShellValue.Concat(Arrays.asList(str("cost: $5 \"net\""), var("x")))));
		assertEquals("ab", word(new ShellValue.Concat(Arrays.asList(str("a"), str("b")))));
		assertEquals("'a b'", word(new ShellValue.Concat(Arrays.asList(str("a "), str("b")))));
	}

	@Test
	public void testInvalidNames() {
		assertThrows(EmitException.class, () -> word(var("not-a-name")));
		assertThrows(EmitException.class, () -> emitBody(new ShellIR.Let("1x", str("a"))));
		assertThrows(
				EmitException.class,
				() -> emitBody(new ShellIR.Exec("rm -rf /;", Collections.<ShellValue>emptyList(), CommandEffects.UNKNOWN)));
	}

	@Test
	public void testArguments() throws Exception {
		assertEquals("\"$1\"", word(new ShellValue.Arg(Integer.valueOf(1))));
		assertEquals("\"${10}\"", word(new ShellValue.Arg(Integer.valueOf(10))));
		assertEquals("\"$@\"", word(new ShellValue.Arg(null)));
		assertEquals("\"$#\"", word(new ShellValue.ArgCount()));
		assertEquals("\"$?\"", word(new ShellValue.ExitCode()));
		assertEquals("\"arg: ${1}\"", word(new ShellValue.Concat(Arrays.asList(str("arg: "), new ShellValue.Arg(Integer.valueOf(1))))));
		assertThrows(
				EmitException.class,
				() -> word(new ShellValue.Concat(Arrays.asList(str("all: "), new ShellValue.Arg(null)))));
	}

	@Test
	public void testEnvironment() throws Exception {
		assertEquals("\"${HOME}\"", word(new ShellValue.EnvVar("HOME", null)));
		assertEquals("\"${LEVEL:-info}\"", word(new ShellValue.EnvVar("LEVEL", str("info"))));
		assertEquals(
				"\"$(if [ -n \"${NAME:-}\" ]; then printf '%s' \"${NAME}\"; else printf '%s' 'a}b'; fi)\"",
				word(new ShellValue.EnvVar("NAME", str("a}b"))));
	}

	@Test
	public void testArithmetic() throws Exception {
		ShellValue sum = new ShellValue.Arithmetic(ArithmeticOp.ADD, var("a"), var("b"));
		assertEquals("\"$((a + b))\"", word(sum));
		ShellValue nested = new ShellValue.Arithmetic(ArithmeticOp.MUL, sum, str("-2"));
		assertEquals("\"$(((a + b) * (-2)))\"", word(nested));
		assertEquals("\"$(($# % 2))\"", word(new ShellValue.Arithmetic(ArithmeticOp.MOD, new ShellValue.ArgCount(), str("2"))));
		assertThrows(EmitException.class, () -> word(new ShellValue.Arithmetic(ArithmeticOp.ADD, str("x"), str("1"))));
	}

	@Test
	public void testCommandSubstitution() throws Exception {
		ShellIR call = new ShellIR.Exec("add", Arrays.asList(str("1"), str("2")), CommandEffects.classify("add"));
		assertEquals("\"$(add 1 2)\"", word(new ShellValue.CommandSubst(call)));
	}

	@Test
	public void testConditions() throws Exception {
		assertEquals("[ \"$x\" -gt 5 ]", condition(new ShellValue.Comparison(ComparisonOp.NUM_GT, var("x"), str("5"))));
		assertEquals("[ \"$s\" = 'a b' ]", condition(new ShellValue.Comparison(ComparisonOp.STR_EQ, var("s"), str("a b"))));
		assertEquals("[ \"$s\" != x ]", condition(new ShellValue.Comparison(ComparisonOp.STR_NE, var("s"), str("x"))));
		assertEquals("true", condition(new ShellValue.Bool(true)));
		assertEquals("[ \"$flag\" = true ]", condition(var("flag")));

		ShellValue a = new ShellValue.Comparison(ComparisonOp.NUM_EQ, var("a"), str("1"));
		ShellValue b = new ShellValue.Comparison(ComparisonOp.NUM_EQ, var("b"), str("2"));
		ShellValue c = var("c");
		assertEquals(
				"[ \"$a\" -eq 1 ] && [ \"$b\" -eq 2 ]",
				condition(new ShellValue.Logical(LogicalOp.AND, a, b)));
		assertEquals(
				"{ [ \"$a\" -eq 1 ] && [ \"$b\" -eq 2 ]; } || [ \"$c\" = true ]",
				condition(new ShellValue.Logical(LogicalOp.OR, new ShellValue.Logical(LogicalOp.AND, a, b), c)));
		assertEquals("! [ \"$a\" -eq 1 ]", condition(new ShellValue.Not(a)));
		assertEquals("! { [ \"$a\" -eq 1 ] && [ \"$b\" -eq 2 ]; }", condition(new ShellValue.Not(new ShellValue.Logical(LogicalOp.AND, a, b))));
	}

	@Test
	public void testComparisonAsValue() throws Exception {
		assertEquals(
				"\"$(if [ \"$x\" -lt 3 ]; then printf '%s' true; else printf '%s' false; fi)\"",
				word(new ShellValue.Comparison(ComparisonOp.NUM_LT, var("x"), str("3"))));
	}

	@Test
	public void testIfElifElse() throws Exception {
		ShellIR chain = new ShellIR.If(
				new ShellValue.Comparison(ComparisonOp.STR_EQ, var("s"), str("a")),
				new ShellIR.Echo(str("first")),
				new ShellIR.If(
						new ShellValue.Comparison(ComparisonOp.STR_EQ, var("s"), str("b")),
						new ShellIR.Noop(),
						new ShellIR.Echo(str("other"))));
		assertEquals(
				"if [ \"$s\" = a ]; then\n"
						+ "    printf '%s\\n' first\n"
						+ "elif [ \"$s\" = b ]; then\n"
						+ "    :\n"
						+ "else\n"
						+ "    printf '%s\\n' other\n"
						+ "fi\n",
				emitBody(chain));
	}

	@Test
	public void testEcho() throws Exception {
		assertEquals("printf '%s' done >&2\n", emitBody(new ShellIR.Echo(str("done"), false, true)));
	}

	@Test
	public void testFunction() throws Exception {
		ShellIR function = new ShellIR.Function(
				"add",
				Arrays.asList("a", "b"),
				new ShellIR.Echo(new ShellValue.Arithmetic(ArithmeticOp.ADD, var("a"), var("b"))));
		ShellIR program = new ShellIR.Sequence(
				Arrays.asList(
						function,
						new ShellIR.Function("main", Collections.<String>emptyList(), new ShellIR.Sequence(Collections.<ShellIR>emptyList())),
						new ShellIR.Exec("main", Collections.<ShellValue>singletonList(new ShellValue.Arg(null)), CommandEffects.UNKNOWN)));
		assertEquals(
				"add() {\n"
						+ "    a=\"$1\"\n"
						+ "    b=\"$2\"\n"
						+ "    printf '%s\\n' \"$((a + b))\"\n"
						+ "}\n"
						+ "\n"
						+ "main() {\n"
						+ "    :\n"
						+ "}\n"
						+ "\n"
						+ "main \"$@\"\n",
				emitBody(program));
	}

	@Test
	public void testCountingLoop() throws Exception {
		ShellIR loop = new ShellIR.For("i", str("0"), str("2"), new ShellIR.Echo(var("i")));
		assertEquals(
				"__jash_loop0=0\n"
						+ "__jash_end0=2\n"
						+ "while [ \"$__jash_loop0\" -le \"$__jash_end0\" ]; do\n"
						+ "    i=\"$__jash_loop0\"\n"
						+ "    __jash_loop0=$((__jash_loop0 + 1))\n"
						+ "    printf '%s\\n' \"$i\"\n"
						+ "done\n",
				emitBody(loop));
	}

	@Test
	public void testForIn() throws Exception {
		ShellIR loop = new ShellIR.ForIn("f", Arrays.asList(str("a b"), var("x")), new ShellIR.Continue());
		assertEquals("for f in 'a b' \"$x\"; do\n    continue\ndone\n", emitBody(loop));
	}

	@Test
	public void testBoundedWhile() throws Exception {
		ShellIR loop = new ShellIR.While(new ShellValue.Bool(true), new ShellIR.Break(), Long.valueOf(5));
		assertEquals(
				"__jash_guard0=0\n"
						+ "while true; do\n"
						+ "    __jash_guard0=$((__jash_guard0 + 1))\n"
						+ "    if [ \"$__jash_guard0\" -gt 5 ]; then\n"
						+ "        printf '%s\\n' 'jash: loop exceeded 5 iterations' >&2\n"
						+ "        exit 1\n"
						+ "    fi\n"
						+ "    break\n"
						+ "done\n",
				emitBody(loop));
		assertEquals("while true; do\n    break\ndone\n", emitBody(new ShellIR.While(new ShellValue.Bool(true), new ShellIR.Break(), null)));
	}

	@Test
	public void testCase() throws Exception {
		ShellIR match = new ShellIR.Case(
				var("cmd"),
				Arrays.asList(
						new CaseArm(CasePattern.literal("start"), new ShellIR.Echo(str("starting"))),
						new CaseArm(CasePattern.literal("two words"), new ShellIR.Noop()),
						new CaseArm(CasePattern.wildcard(), new ShellIR.Exit(str("2")))));
		assertEquals(
				"case \"$cmd\" in\n"
						+ "    start)\n"
						+ "        printf '%s\\n' starting\n"
						+ "        ;;\n"
						+ "    'two words')\n"
						+ "        :\n"
						+ "        ;;\n"
						+ "    *)\n"
						+ "        exit 2\n"
						+ "        ;;\n"
						+ "esac\n",
				emitBody(match));
	}

	@Test
	public void testReturn() throws Exception {
		assertEquals("printf '%s\\n' 5\nreturn 0\n", emitBody(new ShellIR.Return(str("5"))));
		assertEquals("return 0\n", emitBody(new ShellIR.Return(null)));
	}

	@Test
	public void testCompiledProgram() throws Exception {
		JashTestSupport
				.jashTest("function call as a value")
				.source("fn add(a: u32, b: u32) -> u32 { a + b }\nfn main() { let x = add(1, 2); println!(\"{}\", x); }")
				.expectContains("x=\"$(add 1 2)\"")
				.expectContains("printf '%s\\n' \"$x\"")
				.expectContains("main \"$@\"")
				.expectLines("3")
				.build()
				.runAndAssert();
	}

	@Test
	public void testLoopProgram() throws Exception {
		JashTestSupport
				.jashTest("infinite loop with break")
				.main("let mut n = 0;", "loop {", "    n += 1;", "    if n == 3 { break; }", "}", "println!(\"{}\", n);")
				.expectContains("while true; do")
				.expectLines("3")
				.build()
				.runAndAssert();
	}

	@Test
	public void testLoopGuardAbortsScript() throws Exception {
		JashTestSupport
				.jashTest("loop exceeding its bound")
				.main("#[max_iterations = 3]", "loop {", "    println!(\"tick\");", "}")
				.expectLines("tick", "tick", "tick")
				.expectError("jash: loop exceeded 3 iterations\n")
				.expectExitCode(1)
				.build()
				.runAndAssert();
	}

	@Test
	public void testEmptyBodiesRunOnSh() throws Exception {
		JashTestSupport
				.jashTest("empty bodies")
				.main(
						"let n = 1;",
						"if n == 1 {",
						"} else {",
						"}",
						"while n > 5 {",
						"}",
						"for _ in 0..2 {",
						"}",
						"println!(\"ok\");")
				.verification(VerificationLevel.BASIC)
				.expectNotContains("then\n    else")
				.expectLines("ok")
				.build()
				.runAndAssert();
	}

	@Test
	public void testHostileArgumentIsData() throws Exception {
		JashTestSupport
				.jashTest("argument with shell syntax")
				.main("let name = arg(1);", "println!(\"Hello, {}\", name);")
				.args("$(touch /tmp/jash-pwned); `id` * ;")
				.expectLines("Hello, $(touch /tmp/jash-pwned); `id` * ;")
				.build()
				.runAndAssert();
	}

	@Test
	public void testDialects() throws Exception {
		for (TargetDialect dialect : TargetDialect.values()) {
			JashTestSupport
					.jashTest("shebang of " + dialect)
					.target(dialect)
					.main("println!(\"x\");")
					.expectContains(dialect.getShebang() + "\n")
					.build()
					.runAndAssert();
		}
	}
}
