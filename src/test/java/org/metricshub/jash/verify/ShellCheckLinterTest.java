package org.metricshub.jash.verify;

import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jash.Jash;
import org.metricshub.jash.backend.TargetDialect;

public class ShellCheckLinterTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testParseReport() {
		List<LintDiagnostic> diagnostics = ShellCheckLinter
				.parse(
						"-:3:5: warning: Double quote to prevent globbing and word splitting. [SC2086]\n"
								+ "-:7:1: error: Couldn't parse this function. [SC1073]\n"
								+ "-:9:3: note: Not following: ./lib.sh was not specified as input. [SC1091]\n"
								+ "-:10:3: style: Use $(...) notation instead of legacy backticks. [SC2006]\n"
								+ "garbage line\n");
		assertEquals(4, diagnostics.size());

		LintDiagnostic first = diagnostics.get(0);
		assertEquals(3, first.getLineNumber());
		assertEquals(LintDiagnostic.Severity.WARNING, first.getSeverity());
		assertEquals("SC2086", first.getCode());
		assertEquals("Double quote to prevent globbing and word splitting.", first.getMessage());
		assertFalse(first.isError());

		assertTrue(diagnostics.get(1).isError());
		assertEquals(LintDiagnostic.Severity.INFO, diagnostics.get(2).getSeverity());
		assertEquals(LintDiagnostic.Severity.STYLE, diagnostics.get(3).getSeverity());
	}

	@Test
	public void testParseEmptyReport() {
		assertTrue(ShellCheckLinter.parse("").isEmpty());
	}

	@Test
	public void testMissingExecutable() {
		assertFalse(new ShellCheckLinter("/nonexistent/shellcheck").isAvailable());
	}

	@Test
	public void testGeneratedScriptPassesShellCheck() throws Exception {
		ShellCheckLinter linter = new ShellCheckLinter();
		assumeTrue("shellcheck is required", linter.isAvailable());
		String script = new Jash()
				.compile(
						"fn add(a: u32, b: u32) -> u32 { a + b }\n"
								+ "fn main() {\n"
								+ "    let n = add(arg_count(), 1);\n"
								+ "    for a in args() { println!(\"arg {}\", a); }\n"
								+ "    if n > 2 && n < 10 { eprintln!(\"between\"); }\n"
								+ "}\n");
		for (TargetDialect dialect : TargetDialect.values()) {
			List<LintDiagnostic> diagnostics = linter.lint(script, dialect);
			for (LintDiagnostic diagnostic : diagnostics) {
				assertFalse(dialect + ": " + diagnostic, diagnostic.isError());
			}
		}
	}

	@Test
	public void testLargeReport() throws Exception {
		assumeTrue("/bin/sh is required", new File("/bin/sh").canExecute());

		// Reports every line while still reading, like a linter with a lot to say
		File linter = folder.newFile("linter");
		Files.write(
				linter.toPath(),
				("#!/bin/sh\n"
						+ "n=0\n"
						+ "while IFS= read -r line; do\n"
						+ "    n=$((n + 1))\n"
						+ "    echo \"-:$n:1: warning: Line checked by the test linter. [SC2000]\"\n"
						+ "done\n"
						+ "exit 1\n").getBytes(StandardCharsets.UTF_8));
		assertTrue(linter.setExecutable(true));

		StringBuilder script = new StringBuilder("#!/bin/sh\n");
		for (int i = 2; i <= 5000; i++) {
			script.append("printf '%s\\n' 'line ").append(i).append("'\n");
		}

		List<LintDiagnostic> diagnostics = new ShellCheckLinter(linter.getPath()).lint(script.toString(), TargetDialect.POSIX);
		assertEquals(5000, diagnostics.size());
		assertEquals(5000, diagnostics.get(4999).getLineNumber());
		assertEquals("SC2000", diagnostics.get(0).getCode());
	}
}
