package org.metricshub.jash;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.Test;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.frontend.ParserException;
import org.metricshub.jash.intermediate.LoweringException;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.util.JashSettings;
import org.metricshub.jash.validation.InjectionException;
import org.metricshub.jash.validation.ValidationException;
import org.metricshub.jash.verify.CompilationProof;
import org.metricshub.jash.verify.VerificationLevel;

public class JashTest {

	private static final String GREETER = "fn greet(name: &str) {\n"
			+ "    println!(\"Hello, {}!\", name);\n"
			+ "}\n"
			+ "\n"
			+ "fn twice(n: u32) -> u32 {\n"
			+ "    n * 2\n"
			+ "}\n"
			+ "\n"
			+ "fn main() {\n"
			+ "    let who = env_var_or(\"WHO\", \"world\");\n"
			+ "    greet(who);\n"
			+ "    for i in 0..3 {\n"
			+ "        if i == 1 {\n"
			+ "            continue;\n"
			+ "        }\n"
			+ "        println!(\"{} -> {}\", i, twice(i));\n"
			+ "    }\n"
			+ "}\n";

	@Test
	public void testDefaultCompilation() throws Exception {
		String script = new Jash().compile(GREETER);
		assertTrue(script, script.startsWith("#!/bin/sh\n# Generated by Jash. Do not edit.\nset -euf\n"));
		assertTrue(script, script.contains("greet() {"));
		assertTrue(script, script.endsWith("main \"$@\"\n"));
	}

	@Test
	public void testDeterminism() throws Exception {
		Set<String> scripts = new HashSet<>();
		for (int i = 0; i < 10; i++) {
			scripts.add(new Jash().compile(GREETER));
		}
		assertEquals(1, scripts.size());

		Set<String> digests = new HashSet<>();
		for (int i = 0; i < 10; i++) {
			digests.add(CompilationProof.sha256(new Jash().compile(GREETER)));
		}
		assertEquals(1, digests.size());
	}

	@Test
	public void testRunsOnShell() throws Exception {
		JashTestSupport
				.jashTest("greeter")
				.source(GREETER)
				.expectLines("Hello, world!", "0 -> 0", "2 -> 4")
				.build()
				.runAndAssert();
		JashTestSupport
				.jashTest("greeter with WHO")
				.source(GREETER)
				.env("WHO", "Ada; rm -rf /")
				.expectLines("Hello, Ada; rm -rf /!", "0 -> 0", "2 -> 4")
				.build()
				.runAndAssert();
	}

	@Test
	public void testSettings() throws Exception {
		JashSettings settings = new JashSettings();
		settings.setTargetDialect(TargetDialect.BASH);
		settings.setStrictMode(false);
		settings.setOptimize(true);
		settings.setEmitProof(true);
		settings.setVerificationLevel(VerificationLevel.BASIC);
		CompilationResult result = new Jash(JashTestSupport.fixedLinter(false)).compile(GREETER, settings);
		assertTrue(result.getScript(), result.getScript().startsWith("#!/bin/bash\n# Generated by Jash. Do not edit.\nset -uf\n"));
		assertTrue(result.getIr() instanceof ShellIR.Sequence);
		assertTrue(result.getDiagnostics().isEmpty());
		assertNotNull(result.getProof());
		assertEquals(CompilationProof.sha256(result.getScript()), result.getProof().getScriptDigest());
	}

	@Test
	public void testOptimizationKeepsBehavior() throws Exception {
		String source = JashTestSupport.program("let n = 6 * 7;", "println!(\"{}\", n + 0 * 5);");
		JashTestSupport.jashTest("unoptimized").source(source).expectLines("42").build().runAndAssert();
		String optimized = JashTestSupport
				.jashTest("optimized")
				.source(source)
				.optimize()
				.expectLines("42")
				.build()
				.runAndAssert()
				.script();
		assertTrue(optimized, optimized.contains("n=42"));
	}

	@Test
	public void testErrorsOfEachStage() {
		Jash jash = new Jash();
		assertThrows(ParserException.class, () -> jash.compile("fn main( {"));
		assertThrows(ValidationException.class, () -> jash.compile("fn helper() {}"));
		assertThrows(InjectionException.class, () -> jash.compile(JashTestSupport.program("println!(\"`id`\");")));
		assertThrows(LoweringException.class, () -> jash.compile(JashTestSupport.program("let x = 1 - \"a\";")));
	}

	@Test
	public void testTypesAreChecked() {
		Jash jash = new Jash();
		assertThrows(
				LoweringException.class,
				() -> jash
						.compile(
								"fn inc(n: u32) -> u32 {\n    n + 1\n}\n"
										+ "fn main() {\n    let x = inc(arg(1));\n    println!(\"{}\", x);\n}\n"));
		assertThrows(LoweringException.class, () -> jash.compile(JashTestSupport.program("let n: u32 = arg(1);", "println!(\"{}\", n);")));
		assertThrows(
				LoweringException.class,
				() -> jash
						.compile(
								"fn f() -> u32 {\n    arg(1)\n}\n"
										+ "fn main() {\n    let x = f();\n    println!(\"{}\", x + 1);\n}\n"));
		assertThrows(LoweringException.class, () -> jash.compile("fn f() -> u32 {\n    1\n}\nfn main() {\n    f();\n}\n"));
	}

	@Test
	public void testCallKeepsCallerVariables() throws Exception {
		JashTestSupport
				.jashTest("function variables")
				.source(
						"fn show(x: &str) {\n"
								+ "    let label = x;\n"
								+ "    println!(\"{} call\", label);\n"
								+ "}\n"
								+ "fn main() {\n"
								+ "    let label = \"outer\";\n"
								+ "    let x = \"kept\";\n"
								+ "    show(\"inner\");\n"
								+ "    println!(\"{} {}\", label, x);\n"
								+ "}\n")
				.expectLines("inner call", "outer kept")
				.build()
				.runAndAssert();
	}
}
