package org.metricshub.jash.validation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jash.JashTestSupport;

/**
 * Text that looks like shell syntax but is harmless must compile, and must be
 * printed back as is.
 */
@RunWith(Parameterized.class)
public class BenignLiteralsTest {

	@Parameters(name = "{index}: {0}")
	public static Iterable<String> literals() {
		return Arrays
				.asList(
						"Price: $19.99",
						"Hello, World!",
						"Don't panic",
						"It's 5 o'clock",
						"line one\nline two",
						"tab\tseparated",
						"50% done",
						"user@example.com",
						"/usr/local/bin",
						"a = b + c",
						"x > y",
						"(parenthesized)",
						"Café crème",
						"costs 5$",
						"*.txt");
	}

	@Parameter
	public String literal;

	@Test
	public void testNoPatternMatches() {
		for (ValidationLevel level : ValidationLevel.values()) {
			assertNull(level + ": " + literal, InjectionPattern.find(literal, level, false));
		}
	}

	@Test
	public void testPrintedAsIs() throws Exception {
		String escaped = literal.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t");
		JashTestSupport.TestResult result = JashTestSupport
				.jashTest("benign literal " + literal)
				.validation(ValidationLevel.PARANOID)
				.main("print!(\"{}\", \"" + escaped + "\");")
				.expectExitCode(0)
				.build()
				.runAndAssert();
		if (result.shellRun() != null) {
			assertEquals(literal, result.shellRun().output());
		}
	}
}
