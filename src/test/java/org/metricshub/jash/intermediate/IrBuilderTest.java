package org.metricshub.jash.intermediate;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jash.frontend.JashParser;
import org.metricshub.jash.util.ScriptSource;

public class IrBuilderTest {

	private static ShellIR.Sequence lower(String source) throws Exception {
		return (ShellIR.Sequence) new IrBuilder().lower(new JashParser().parse(ScriptSource.fromString(source)));
	}

	private static ShellIR.Function function(ShellIR.Sequence program, String name) {
		for (ShellIR node : program.getNodes()) {
			if (node instanceof ShellIR.Function && ((ShellIR.Function) node).getName().equals(name)) {
				return (ShellIR.Function) node;
			}
		}
		throw new AssertionError("No function " + name);
	}

	private static List<ShellIR> statements(ShellIR body) {
		if (body instanceof ShellIR.Sequence) {
			return ((ShellIR.Sequence) body).getNodes();
		}
		return Collections.singletonList(body);
	}

	private static List<ShellIR> mainBody(String... lines) throws Exception {
		StringBuilder source = new StringBuilder("fn main() {\n");
		for (String line : lines) {
			source.append(line).append('\n');
		}
		source.append("}\n");
		return statements(function(lower(source.toString()), "main").getBody());
	}

	private static ShellValue letValue(ShellIR node) {
		return ((ShellIR.Let) node).getValue();
	}

	private static LoweringException failure(String... lines) {
		return assertThrows(LoweringException.class, () -> mainBody(lines));
	}

	@Test
	public void testProgramShape() throws Exception {
		ShellIR.Sequence program = lower("fn helper() { println!(\"hi\"); }\nfn main() { helper(); }");
		List<ShellIR> nodes = program.getNodes();
		assertEquals(3, nodes.size());
		assertEquals("helper", ((ShellIR.Function) nodes.get(0)).getName());
		assertEquals("main", ((ShellIR.Function) nodes.get(1)).getName());
		ShellIR.Exec entry = (ShellIR.Exec) nodes.get(2);
		assertEquals("main", entry.getCommand());
		assertNull(((ShellValue.Arg) entry.getArgs().get(0)).getPosition());
	}

	@Test
	public void testReturnValueIsEchoed() throws Exception {
		ShellIR.Sequence program = lower("fn add(a: u32, b: u32) -> u32 {\n    a + b\n}\nfn main() { let x = add(1, 2); }");
		ShellIR.Function add = function(program, "add");
		assertEquals(Arrays.asList("__jash_add_a", "__jash_add_b"), add.getParams());
		ShellIR.Echo echo = (ShellIR.Echo) add.getBody();
		ShellValue.Arithmetic sum = (ShellValue.Arithmetic) echo.getValue();
		assertEquals(ArithmeticOp.ADD, sum.getOp());
		assertEquals("__jash_add_a", ((ShellValue.Variable) sum.getLeft()).getName());

		ShellIR.Let let = (ShellIR.Let) function(program, "main").getBody();
		ShellIR.Exec call = (ShellIR.Exec) ((ShellValue.CommandSubst) let.getValue()).getCommand();
		assertEquals("add", call.getCommand());
		assertEquals("1", ((ShellValue.Str) call.getArgs().get(0)).getValue());
	}

	@Test
	public void testExplicitReturn() throws Exception {
		ShellIR.Sequence program = lower("fn five() -> u32 { return 5; }\nfn main() { let x = five(); }");
		ShellIR.Return ret = (ShellIR.Return) function(program, "five").getBody();
		assertEquals("5", ((ShellValue.Str) ret.getValue()).getValue());
	}

	@Test
	public void testIfAsTailValue() throws Exception {
		ShellIR.Sequence program = lower(
				"fn sign(x: u32) -> &str {\n    if x > 0 { \"positive\" } else { \"zero\" }\n}\nfn main() { let s = sign(1); }");
		ShellIR.If test = (ShellIR.If) function(program, "sign").getBody();
		assertEquals(ComparisonOp.NUM_GT, ((ShellValue.Comparison) test.getCondition()).getOp());
		assertEquals("positive", ((ShellValue.Str) ((ShellIR.Echo) test.getThenBranch()).getValue()).getValue());
		assertEquals("zero", ((ShellValue.Str) ((ShellIR.Echo) test.getElseBranch()).getValue()).getValue());
	}

	@Test
	public void testLetBlockAssignsInBranches() throws Exception {
		List<ShellIR> body = mainBody("let n = arg_count();", "let s = if n > 1 { \"many\" } else { \"few\" };");
		ShellIR.If test = (ShellIR.If) body.get(1);
		assertEquals("s", ((ShellIR.Let) test.getThenBranch()).getName());
		assertEquals("s", ((ShellIR.Let) test.getElseBranch()).getName());
	}

	@Test
	public void testOperatorClassification() throws Exception {
		List<ShellIR> body = mainBody(
				"let n = arg_count();",
				"let s = arg(1);",
				"let a = n * 2 - 1;",
				"let b = s + \"!\";",
				"let c = n <= 3;",
				"let d = s == \"x\";",
				"let e = s != \"y\";",
				"let f = c && d || false;",
				"let g = !c;",
				"let h = n % 2 == 0;",
				"let i = \"n=\" + n;",
				"let j = n / 2 + n;",
				"let k = n < 1;",
				"let l = n > 1;",
				"let m = n >= 1;",
				"let o = n != 1;");
		ShellValue.Arithmetic difference = (ShellValue.Arithmetic) letValue(body.get(2));
		assertEquals(ArithmeticOp.SUB, difference.getOp());
		assertEquals(ArithmeticOp.MUL, ((ShellValue.Arithmetic) difference.getLeft()).getOp());
		assertTrue(letValue(body.get(3)) instanceof ShellValue.Concat);
		assertEquals(ComparisonOp.NUM_LE, ((ShellValue.Comparison) letValue(body.get(4))).getOp());
		assertEquals(ComparisonOp.STR_EQ, ((ShellValue.Comparison) letValue(body.get(5))).getOp());
		assertEquals(ComparisonOp.STR_NE, ((ShellValue.Comparison) letValue(body.get(6))).getOp());
		ShellValue.Logical or = (ShellValue.Logical) letValue(body.get(7));
		assertEquals(LogicalOp.OR, or.getOp());
		assertEquals(LogicalOp.AND, ((ShellValue.Logical) or.getLeft()).getOp());
		assertTrue(letValue(body.get(8)) instanceof ShellValue.Not);
		ShellValue.Comparison parity = (ShellValue.Comparison) letValue(body.get(9));
		assertEquals(ComparisonOp.NUM_EQ, parity.getOp());
		assertEquals(ArithmeticOp.MOD, ((ShellValue.Arithmetic) parity.getLeft()).getOp());
		assertEquals(2, ((ShellValue.Concat) letValue(body.get(10))).getParts().size());
		ShellValue.Arithmetic sum = (ShellValue.Arithmetic) letValue(body.get(11));
		assertEquals(ArithmeticOp.ADD, sum.getOp());
		assertEquals(ArithmeticOp.DIV, ((ShellValue.Arithmetic) sum.getLeft()).getOp());
		assertEquals(ComparisonOp.NUM_LT, ((ShellValue.Comparison) letValue(body.get(12))).getOp());
		assertEquals(ComparisonOp.NUM_GT, ((ShellValue.Comparison) letValue(body.get(13))).getOp());
		assertEquals(ComparisonOp.NUM_GE, ((ShellValue.Comparison) letValue(body.get(14))).getOp());
		assertEquals(ComparisonOp.NUM_NE, ((ShellValue.Comparison) letValue(body.get(15))).getOp());
	}

	@Test
	public void testNestedConcatIsFlattened() throws Exception {
		List<ShellIR> body = mainBody("let s = arg(1);", "let t = \"a\" + s + \"b\" + s;");
		assertEquals(4, ((ShellValue.Concat) letValue(body.get(1))).getParts().size());
	}

	@Test
	public void testNegation() throws Exception {
		List<ShellIR> body = mainBody("let n = arg_count();", "let m = -n;");
		ShellValue.Arithmetic negation = (ShellValue.Arithmetic) letValue(body.get(1));
		assertEquals(ArithmeticOp.SUB, negation.getOp());
		assertEquals("0", ((ShellValue.Str) negation.getLeft()).getValue());
	}

	@Test
	public void testOperatorTypeErrors() {
		LoweringException e = failure("let x = \"a\" - 1;");
		assertTrue(e.getMessage(), e.getMessage().startsWith("Operator - requires u32 operands"));
		assertNotNull(e.getSuggestion());

		failure("let x = 1 && true;");
		failure("let x = \"a\" < \"b\";");
	}

	@Test
	public void testArgPosition() throws Exception {
		List<ShellIR> body = mainBody("let first = arg(1);", "let tenth = arg(10);", "let n = arg_count();", "let status = exit_code();");
		assertEquals(Integer.valueOf(1), ((ShellValue.Arg) letValue(body.get(0))).getPosition());
		assertEquals(Integer.valueOf(10), ((ShellValue.Arg) letValue(body.get(1))).getPosition());
		assertTrue(letValue(body.get(2)) instanceof ShellValue.ArgCount);
		assertTrue(letValue(body.get(3)) instanceof ShellValue.ExitCode);

		LoweringException e = failure("let zero = arg(0);");
		assertEquals("arg() position must be >= 1", e.getMessage());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testArgsOnlyInForLoops() throws Exception {
		List<ShellIR> body = mainBody("for a in args() { println!(\"{}\", a); }");
		ShellIR.ForIn loop = (ShellIR.ForIn) body.get(0);
		assertNull(((ShellValue.Arg) loop.getItems().get(0)).getPosition());

		assertEquals("args() is only supported as the iterable of a for loop", failure("let all = args();").getMessage());
	}

	@Test
	public void testEnvironment() throws Exception {
		List<ShellIR> body = mainBody("let home = env(\"HOME\");", "let level = env_var_or(\"LEVEL\", \"info\");");
		ShellValue.EnvVar home = (ShellValue.EnvVar) letValue(body.get(0));
		assertEquals("HOME", home.getName());
		assertNull(home.getDefaultValue());
		ShellValue.EnvVar level = (ShellValue.EnvVar) letValue(body.get(1));
		assertEquals("info", ((ShellValue.Str) level.getDefaultValue()).getValue());
		assertTrue(level.effects().contains(Effect.ENV_READ));

		failure("let x = env(\"NOT-A-NAME\");");
	}

	@Test
	public void testFormatSplitting() throws Exception {
		List<ShellIR> body = mainBody(
				"let a = arg(1);",
				"let b = arg(2);",
				"println!(\"a={} b={}\", a, b);",
				"println!(\"{{literal}}\");",
				"println!();",
				"eprint!(\"{}\", a);");
		ShellIR.Echo both = (ShellIR.Echo) body.get(2);
		List<ShellValue> parts = ((ShellValue.Concat) both.getValue()).getParts();
		assertEquals(4, parts.size());
		assertEquals("a=", ((ShellValue.Str) parts.get(0)).getValue());
		assertEquals("b", ((ShellValue.Variable) parts.get(3)).getName());
		assertTrue(both.isNewline());
		assertFalse(both.isStderr());

		assertEquals("{literal}", ((ShellValue.Str) ((ShellIR.Echo) body.get(3)).getValue()).getValue());
		assertEquals("", ((ShellValue.Str) ((ShellIR.Echo) body.get(4)).getValue()).getValue());

		ShellIR.Echo error = (ShellIR.Echo) body.get(5);
		assertTrue(error.getValue() instanceof ShellValue.Variable);
		assertFalse(error.isNewline());
		assertTrue(error.isStderr());
	}

	@Test
	public void testFormatErrors() {
		assertTrue(failure("println!(\"{} {}\", 1);").getMessage().startsWith("Too few arguments"));
		assertTrue(failure("println!(\"{}\", 1, 2);").getMessage().startsWith("Too many arguments"));
		assertTrue(failure("println!(\"{0}\", 1);").getMessage().startsWith("Unsupported placeholder"));
		assertTrue(failure("println!(\"}\");").getMessage().startsWith("Unmatched }"));
	}

	@Test
	public void testRanges() throws Exception {
		List<ShellIR> body = mainBody("for i in 0..3 { }", "for j in 1..=3 { }", "let n = arg_count();", "for k in 0..n { }");
		ShellIR.For exclusive = (ShellIR.For) body.get(0);
		assertEquals("i", exclusive.getVariable());
		assertEquals("0", ((ShellValue.Str) exclusive.getStart()).getValue());
		assertEquals("2", ((ShellValue.Str) exclusive.getEnd()).getValue());
		assertTrue(exclusive.getBody() instanceof ShellIR.Noop);

		assertEquals("3", ((ShellValue.Str) ((ShellIR.For) body.get(1)).getEnd()).getValue());

		ShellValue.Arithmetic end = (ShellValue.Arithmetic) ((ShellIR.For) body.get(3)).getEnd();
		assertEquals(ArithmeticOp.SUB, end.getOp());
		assertTrue(end.getLeft() instanceof ShellValue.Variable);
	}

	@Test
	public void testArrays() throws Exception {
		List<ShellIR> body = mainBody(
				"let names = [\"ann\", \"bob\"];",
				"println!(\"{}\", names[1]);",
				"let n = names.len();",
				"for name in names { println!(\"{}\", name); }");
		List<ShellIR> elements = ((ShellIR.Sequence) body.get(0)).getNodes();
		assertEquals("names_0", ((ShellIR.Let) elements.get(0)).getName());
		assertEquals("names_1", ((ShellIR.Let) elements.get(1)).getName());
		assertEquals("names_1", ((ShellValue.Variable) ((ShellIR.Echo) body.get(1)).getValue()).getName());
		assertEquals("2", ((ShellValue.Str) letValue(body.get(2))).getValue());
		assertEquals(2, ((ShellIR.ForIn) body.get(3)).getItems().size());

		assertTrue(failure("let a = [1, 2];", "let b = a[2];").getMessage().startsWith("Array index out of bounds"));
		assertTrue(failure("let a = [1, \"x\"];").getMessage().startsWith("Array elements must share one type"));
	}

	@Test
	public void testWhileKeepsItsBound() throws Exception {
		List<ShellIR> body = mainBody("#[max_iterations = 7]", "loop { break; }");
		ShellIR.While loop = (ShellIR.While) body.get(0);
		assertEquals(Long.valueOf(7), loop.getMaxIterations());
		assertTrue(((ShellValue.Bool) loop.getCondition()).getValue());
		assertTrue(loop.getBody() instanceof ShellIR.Break);
	}

	@Test
	public void testMatchBecomesCase() throws Exception {
		List<ShellIR> body = mainBody(
				"let s = arg(1);",
				"match s {",
				"    \"start\" => { println!(\"starting\"); }",
				"    _ => { println!(\"unknown\"); }",
				"    \"stop\" => { println!(\"never\"); }",
				"}");
		ShellIR.Case match = (ShellIR.Case) body.get(1);
		assertEquals(2, match.getArms().size());
		assertEquals("start", match.getArms().get(0).getPattern().getLiteral());
		assertTrue(match.getArms().get(1).getPattern().isWildcard());
	}

	@Test
	public void testGuardedMatchBecomesIfChain() throws Exception {
		List<ShellIR> body = mainBody(
				"let n = arg_count();",
				"match n {",
				"    0 => { println!(\"none\"); }",
				"    m if m > 5 => { println!(\"lots\"); }",
				"    _ => { println!(\"some\"); }",
				"}");
		List<ShellIR> nodes = ((ShellIR.Sequence) body.get(1)).getNodes();
		assertEquals("m", ((ShellIR.Let) nodes.get(0)).getName());
		ShellIR.If first = (ShellIR.If) nodes.get(1);
		assertEquals(ComparisonOp.STR_EQ, ((ShellValue.Comparison) first.getCondition()).getOp());
		ShellIR.If second = (ShellIR.If) first.getElseBranch();
		assertEquals(ComparisonOp.NUM_GT, ((ShellValue.Comparison) second.getCondition()).getOp());
		assertTrue(second.getElseBranch() instanceof ShellIR.Echo);
	}

	@Test
	public void testGuardedMatchOnCallUsesTemporary() throws Exception {
		List<ShellIR> body = mainBody("match basename(arg(1)) {", "    p if p == \"tmp\" => { println!(\"temporary\"); }", "    _ => { }", "}");
		ShellIR.Let temporary = (ShellIR.Let) body.get(0);
		assertTrue(temporary.getName().startsWith("__jash_match_"));
		assertTrue(temporary.getValue() instanceof ShellValue.CommandSubst);
		List<ShellIR> chain = ((ShellIR.Sequence) body.get(1)).getNodes();
		assertEquals(temporary.getName(), ((ShellValue.Variable) letValue(chain.get(0))).getName());
	}

	@Test
	public void testMatchPatternType() {
		assertTrue(failure("let n = arg_count();", "match n { \"x\" => { } _ => { } }").getMessage().startsWith("Pattern"));
	}

	@Test
	public void testCommandEffects() throws Exception {
		ShellIR.Sequence program = lower(
				"fn fetch() { curl(\"-fsSL\", \"https://example.com\"); }\n"
						+ "fn main() {\n"
						+ "    mkdir(\"-p\", \"/tmp/jash\");\n"
						+ "    fetch();\n"
						+ "    let listing = ls(\"/tmp\");\n"
						+ "}\n");
		ShellIR.Function main = function(program, "main");
		EffectSet effects = main.effects();
		assertTrue(effects.contains(Effect.FILE_WRITE));
		assertTrue(effects.contains(Effect.NETWORK_ACCESS));
		assertTrue(effects.contains(Effect.FILE_READ));

		List<ShellIR> body = statements(main.getBody());
		ShellIR.Exec fetch = (ShellIR.Exec) body.get(1);
		assertTrue(fetch.effects().contains(Effect.NETWORK_ACCESS));
		assertTrue(letValue(body.get(2)) instanceof ShellValue.CommandSubst);

		assertTrue(function(program, "fetch").effects().contains(Effect.NETWORK_ACCESS));
	}

	@Test
	public void testPureProgram() throws Exception {
		assertTrue(lower("fn main() { let x = 1 + 2; println!(\"{}\", x); }").effects().isPure());
	}

	@Test
	public void testUnusedValues() {
		assertTrue(failure("1 + 2;").getMessage().startsWith("Expression statement has no effect"));
		assertEquals("Result of arg is not used", failure("arg(1);").getMessage());
		assertTrue(failure("let x = println!(\"a\");").getMessage().contains("does not produce a value"));
	}

	@Test
	public void testVoidFunctionHasNoValue() {
		LoweringException e = assertThrows(LoweringException.class, () -> lower("fn f() { }\nfn main() { let x = f(); }"));
		assertEquals("Function 'f' returns no value", e.getMessage());
	}

	@Test
	public void testConditionMustBeBool() {
		assertTrue(failure("if 1 { }").getMessage().startsWith("Condition must be a bool"));
		assertTrue(failure("while \"yes\" { }").getMessage().startsWith("Condition must be a bool"));
	}

	@Test
	public void testUnknownVariable() {
		LoweringException e = failure("println!(\"{}\", missing);");
		assertEquals("Unknown variable 'missing'", e.getMessage());
	}

	@Test
	public void testMethods() throws Exception {
		List<ShellIR> body = mainBody("let s = arg(1);", "let t = s.to_string();", "let u = s.clone();");
		assertEquals("s", ((ShellValue.Variable) letValue(body.get(1))).getName());
		assertEquals("s", ((ShellValue.Variable) letValue(body.get(2))).getName());

		assertTrue(failure("let s = arg(1);", "let t = s.to_uppercase();").getMessage().startsWith("Unsupported method"));
	}

	@Test
	public void testExit() throws Exception {
		List<ShellIR> body = mainBody("std::process::exit(3);");
		assertEquals("3", ((ShellValue.Str) ((ShellIR.Exit) body.get(0)).getCode()).getValue());
		assertTrue(failure("exit(\"x\");").getMessage().startsWith("Expecting a u32 value"));
	}

	private static LoweringException programFailure(String source) {
		return assertThrows(LoweringException.class, () -> lower(source));
	}

	@Test
	public void testArgumentsMustMatchParameterTypes() throws Exception {
		LoweringException e = programFailure("fn inc(n: u32) -> u32 { n + 1 }\nfn main() { let x = inc(arg(1)); }");
		assertEquals("Mismatched types: parameter 'n' of 'inc' expects u32, got str", e.getMessage());
		assertEquals(2, e.getLineNumber());

		programFailure("fn greet(name: &str) { println!(\"{}\", name); }\nfn main() { greet(5); }");
		lower("fn greet(name: &str) { println!(\"{}\", name); }\nfn main() { greet(\"x\"); greet(arg(1)); }");
	}

	@Test
	public void testDeclaredTypeMustMatchValue() throws Exception {
		assertEquals("Mismatched types: 'n' expects u32, got str", failure("let n: u32 = arg(1);", "let y = n * 2;").getMessage());
		assertEquals("Mismatched types: 'v' expects str, got u32", failure("let v: &str = if arg_count() > 1 { 1 } else { 2 };").getMessage());
		assertEquals(
				"Mismatched types: 'v' expects u32, got str",
				failure("let v = if arg_count() > 1 { 1 } else { \"a\" };").getMessage());

		List<ShellIR> body = mainBody("let n: u32 = arg_count();", "let s: String = arg(1);");
		assertEquals("n", ((ShellIR.Let) body.get(0)).getName());
	}

	@Test
	public void testResultMustMatchReturnType() throws Exception {
		assertEquals(
				"Mismatched types: the result of 'f' expects u32, got str",
				programFailure("fn f() -> u32 { \"abc\" }\nfn main() { let x = f() + 1; }").getMessage());
		assertEquals(
				"Mismatched types: the result of 'f' expects u32, got str",
				programFailure("fn f() -> u32 { return \"abc\"; }\nfn main() { let x = f(); }").getMessage());
		assertEquals(
				"Mismatched types: the result of 'f' expects str, got bool",
				programFailure("fn f(n: u32) -> &str { if n > 1 { \"many\" } else { n == 0 } }\nfn main() { let x = f(1); }")
						.getMessage());
		assertEquals(
				"Expecting a value of type u32, got ()",
				programFailure("fn g() { }\nfn f() -> u32 { g() }\nfn main() { let x = f(); }").getMessage());

		// exiting is allowed in place of a value
		lower("fn f(n: u32) -> u32 { if n > 0 { n } else { exit(2) } }\nfn main() { let x = f(1); }");
	}

	@Test
	public void testVariableKeepsItsType() {
		LoweringException e = failure("let mut n = 0;", "loop {", "    let y = n * 2;", "    n = arg(1);", "    break;", "}");
		assertEquals("Mismatched types: 'n' has type u32, cannot bind a value of type str", e.getMessage());
		assertNotNull(e.getSuggestion());

		failure("let n = 1;", "let n = [\"a\"];");
		failure("let a = [1, 2];", "let a = [\"x\"];");
		failure("let s = arg(1);", "for s in 0..3 { }");
	}

	@Test
	public void testUnusedFunctionResult() throws Exception {
		LoweringException e = programFailure("fn f() -> u32 { 42 }\nfn main() { f(); println!(\"done\"); }");
		assertEquals("Result of f is not used", e.getMessage());
		assertNotNull(e.getSuggestion());
	}

	@Test
	public void testValueFunctionsOnlyWriteTheirResult() throws Exception {
		LoweringException e = programFailure("fn f() -> u32 { println!(\"{}\", arg(1)); 0 }\nfn main() { let x = f() + 1; }");
		assertTrue(e.getMessage(), e.getMessage().startsWith("Function 'f' returns its value on the standard output"));

		programFailure("fn g() { println!(\"x\"); }\nfn f() -> u32 { g(); 0 }\nfn main() { let x = f(); }");
		programFailure("fn f() -> u32 { mkdir(\"-p\", \"/tmp/jash\"); 0 }\nfn main() { let x = f(); }");

		lower("fn g() { eprintln!(\"x\"); }\nfn f() -> u32 { g(); eprint!(\"y\"); 0 }\nfn main() { let x = f(); println!(\"{}\", x); }");
		lower("fn f() -> &str { let out = ls(\"/tmp\"); out }\nfn main() { let x = f(); }");
	}

	@Test
	public void testFunctionVariablesAreScoped() throws Exception {
		ShellIR.Sequence program = lower(
				"fn show(x: &str) { let y = x; println!(\"{}\", y); }\n"
						+ "fn main() { let x = \"outer\"; show(\"inner\"); println!(\"{}\", x); }");
		ShellIR.Function show = function(program, "show");
		assertEquals(Collections.singletonList("__jash_show_x"), show.getParams());
		ShellIR.Let let = (ShellIR.Let) statements(show.getBody()).get(0);
		assertEquals("__jash_show_y", let.getName());
		assertEquals("__jash_show_x", ((ShellValue.Variable) let.getValue()).getName());

		List<ShellIR> main = statements(function(program, "main").getBody());
		assertEquals("x", ((ShellIR.Let) main.get(0)).getName());
		assertEquals("x", ((ShellValue.Variable) ((ShellIR.Echo) main.get(2)).getValue()).getName());
	}

	@Test
	public void testScopedNamesNeverCollide() throws Exception {
		ShellIR.Sequence program = lower("fn f(x_y: u32) { }\nfn f_x(y: u32) { }\nfn main() { f(1); f_x(2); }");
		assertEquals(Collections.singletonList("__jash_f_x_y"), function(program, "f").getParams());
		assertEquals(Collections.singletonList("__jash_f_x_y_1"), function(program, "f_x").getParams());

		List<ShellIR> body = mainBody("let xs = [1];", "let xs_0 = \"a\";", "println!(\"{} {}\", xs[0], xs_0);");
		assertEquals("xs_0", ((ShellIR.Let) body.get(0)).getName());
		assertEquals("xs_0_1", ((ShellIR.Let) body.get(1)).getName());
	}
}
