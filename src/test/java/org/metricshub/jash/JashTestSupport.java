package org.metricshub.jash;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assume.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.util.JashSettings;
import org.metricshub.jash.validation.ValidationLevel;
import org.metricshub.jash.verify.LintDiagnostic;
import org.metricshub.jash.verify.ShellLinter;
import org.metricshub.jash.verify.VerificationLevel;

/**
 * Reusable helpers for building and executing Jash tests. A test describes the
 * program, the settings of the compilation and its expectations with the
 * fluent builder returned by {@link #jashTest(String)}: text the script must
 * (or must not) contain, the output of the script when a shell runs it, or
 * the exception the compilation must fail with.
 * <p>
 * Tests that run the script are skipped when the shell is missing.
 */
public final class JashTestSupport {

	private static final boolean IS_POSIX = !System
			.getProperty("os.name", "")
			.toLowerCase(Locale.ROOT)
			.contains("win");

	private static final long TIMEOUT_SECONDS = 30;

	private static final Map<String, Boolean> SHELLS = new ConcurrentHashMap<>();

	private JashTestSupport() {}

	/**
	 * Creates a builder for a test that compiles a program with {@link Jash}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static JashTestBuilder jashTest(String description) {
		return new JashTestBuilder(description);
	}

	/**
	 * Wraps a <code>main</code> body into a complete program.
	 *
	 * @param body statements of <code>main</code>
	 * @return the program
	 */
	public static String program(String... body) {
		StringBuilder source = new StringBuilder("fn main() {\n");
		for (String line : body) {
			source.append("    ").append(line).append('\n');
		}
		return source.append("}\n").toString();
	}

	/**
	 * Whether the specified shell can be run on this machine.
	 *
	 * @param shell name of the shell, looked up in the PATH
	 * @return {@code true} if <code>shell -c :</code> succeeds
	 */
	public static boolean isShellAvailable(String shell) {
		if (!IS_POSIX) {
			return false;
		}
		return SHELLS.computeIfAbsent(shell, JashTestSupport::runsScripts).booleanValue();
	}

	private static Boolean runsScripts(String shell) {
		try {
			Process process = new ProcessBuilder(shell, "-c", ":").redirectErrorStream(true).start();
			process.getInputStream().readAllBytes();
			return Boolean.valueOf(process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS) && process.exitValue() == 0);
		} catch (IOException e) {
			return Boolean.FALSE;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return Boolean.FALSE;
		}
	}

	/**
	 * Skips the current test when the specified shell is missing.
	 *
	 * @param shell name of the shell
	 */
	public static void assumeShell(String shell) {
		assumeTrue(shell + " is required", isShellAvailable(shell));
	}

	/**
	 * Runs a script with the specified shell.
	 *
	 * @param shell name of the shell
	 * @param script text of the script
	 * @param args arguments of the script
	 * @param env environment variables added to the environment of the test
	 * @return what the script printed, and its exit status
	 * @throws IOException when the script cannot be written or run
	 * @throws InterruptedException when interrupted while waiting for the shell
	 */
	public static ShellRun runScript(String shell, String script, List<String> args, Map<String, String> env)
			throws IOException,
			InterruptedException {
		Path file = Files.createTempFile("jash", ".sh");
		Path err = Files.createTempFile("jash", ".err");
		try {
			Files.write(file, script.getBytes(StandardCharsets.UTF_8));
			List<String> command = new ArrayList<>();
			command.add(shell);
			command.add(file.toString());
			command.addAll(args);
			ProcessBuilder pb = new ProcessBuilder(command);
			pb.environment().putAll(env);
			pb.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
			pb.redirectError(err.toFile());
			Process process = pb.start();
			String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
			if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				process.destroyForcibly();
				throw new IOException(shell + " timed out");
			}
			String error = new String(Files.readAllBytes(err), StandardCharsets.UTF_8);
			return new ShellRun(output, error, process.exitValue());
		} finally {
			Files.deleteIfExists(file);
			Files.deleteIfExists(err);
		}
	}

	/**
	 * Runs a script with <code>sh</code>, without arguments.
	 *
	 * @param script text of the script
	 * @return what the script printed, and its exit status
	 * @throws Exception when the script cannot be run
	 */
	public static ShellRun runScript(String script) throws Exception {
		return runScript("sh", script, Collections.<String>emptyList(), Collections.<String, String>emptyMap());
	}

	/**
	 * Splits an output into lines, ignoring the trailing line break.
	 *
	 * @param output text printed by a script
	 * @return the lines, empty when nothing was printed
	 */
	public static List<String> lines(String output) {
		if (output.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = output.replace("\r\n", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	/**
	 * A linter that answers with the same findings whatever the script.
	 *
	 * @param available what {@link ShellLinter#isAvailable()} returns
	 * @param findings findings returned by every lint
	 * @return the linter
	 */
	public static ShellLinter fixedLinter(boolean available, LintDiagnostic... findings) {
		List<LintDiagnostic> result = Arrays.asList(findings);
		return new ShellLinter() {
			@Override
			public String getName() {
				return "fixed";
			}

			@Override
			public boolean isAvailable() {
				return available;
			}

			@Override
			public List<LintDiagnostic> lint(String script, TargetDialect dialect) {
				return result;
			}
		};
	}

	/**
	 * Output and exit status of a script run by a shell.
	 */
	public static final class ShellRun {
		private final String output;
		private final String error;
		private final int exitCode;

		ShellRun(String output, String error, int exitCode) {
			this.output = output;
			this.error = error;
			this.exitCode = exitCode;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		public int exitCode() {
			return exitCode;
		}

		public List<String> lines() {
			return JashTestSupport.lines(output);
		}
	}

	/**
	 * Fluent builder for tests that compile a program, and optionally run the
	 * script.
	 */
	public static final class JashTestBuilder {
		private final String description;
		private final JashSettings settings = new JashSettings();
		private final List<String> args = new ArrayList<>();
		private final Map<String, String> env = new LinkedHashMap<>();
		private final List<String> contains = new ArrayList<>();
		private final List<String> notContains = new ArrayList<>();
		private String source;
		private String shell = "sh";
		private ShellLinter linter = fixedLinter(false);
		private List<String> expectedLines;
		private String expectedError;
		private Integer expectedExitCode;
		private Class<? extends Throwable> expectedException;

		private JashTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param sourceText text of the program
		 * @return this builder for method chaining
		 */
		public JashTestBuilder source(String sourceText) {
			this.source = sourceText;
			return this;
		}

		/**
		 * @param body statements of <code>main</code>
		 * @return this builder for method chaining
		 */
		public JashTestBuilder main(String... body) {
			return source(program(body));
		}

		public JashTestBuilder target(TargetDialect dialect) {
			settings.setTargetDialect(dialect);
			return this;
		}

		public JashTestBuilder validation(ValidationLevel level) {
			settings.setValidationLevel(level);
			return this;
		}

		public JashTestBuilder verification(VerificationLevel level) {
			settings.setVerificationLevel(level);
			return this;
		}

		public JashTestBuilder optimize() {
			settings.setOptimize(true);
			return this;
		}

		public JashTestBuilder noStrict() {
			settings.setStrictMode(false);
			return this;
		}

		public JashTestBuilder linter(ShellLinter shellLinter) {
			this.linter = shellLinter;
			return this;
		}

		/**
		 * @param shellName shell that runs the script, <code>sh</code> by default
		 * @return this builder for method chaining
		 */
		public JashTestBuilder shell(String shellName) {
			this.shell = shellName;
			return this;
		}

		public JashTestBuilder args(String... arguments) {
			args.addAll(Arrays.asList(arguments));
			return this;
		}

		public JashTestBuilder env(String name, String value) {
			env.put(name, value);
			return this;
		}

		public JashTestBuilder expectContains(String text) {
			contains.add(text);
			return this;
		}

		public JashTestBuilder expectNotContains(String text) {
			notContains.add(text);
			return this;
		}

		/**
		 * Runs the script and compares its output, line by line.
		 *
		 * @param lines expected lines of the standard output
		 * @return this builder for method chaining
		 */
		public JashTestBuilder expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return this;
		}

		/**
		 * Runs the script and compares its standard error.
		 *
		 * @param error expected text of the standard error
		 * @return this builder for method chaining
		 */
		public JashTestBuilder expectError(String error) {
			this.expectedError = error;
			return this;
		}

		/**
		 * Runs the script and checks its exit status, 0 by default.
		 *
		 * @param exitCode expected exit status
		 * @return this builder for method chaining
		 */
		public JashTestBuilder expectExitCode(int exitCode) {
			this.expectedExitCode = Integer.valueOf(exitCode);
			return this;
		}

		public JashTestBuilder expectThrows(Class<? extends Throwable> exception) {
			this.expectedException = exception;
			return this;
		}

		public JashTestCase build() {
			if (source == null) {
				throw new IllegalStateException("No source for " + description);
			}
			return new JashTestCase(this);
		}
	}

	/**
	 * A configured test case.
	 */
	public static final class JashTestCase {
		private final JashTestBuilder spec;

		private JashTestCase(JashTestBuilder spec) {
			this.spec = spec;
		}

		private boolean runsScript() {
			return spec.expectedLines != null || spec.expectedError != null || spec.expectedExitCode != null;
		}

		/**
		 * Compiles the program, and runs the script when an output or an exit
		 * status is expected.
		 *
		 * @return the captured result
		 * @throws Exception when running the script fails unexpectedly
		 */
		public TestResult run() throws Exception {
			CompilationResult result;
			try {
				result = new Jash(spec.linter).compile(spec.source, spec.settings);
			} catch (CompilationException e) {
				return new TestResult(spec, null, null, null, e);
			}
			ShellRun shellRun = null;
			if (spec.expectedException == null && runsScript()) {
				assumeShell(spec.shell);
				shellRun = runScript(spec.shell, result.getScript(), spec.args, spec.env);
			}
			return new TestResult(spec, result.getScript(), result, shellRun, null);
		}

		/**
		 * Runs the test case and asserts its expectations.
		 *
		 * @return the captured result, for further assertions
		 * @throws Exception when running the script fails unexpectedly
		 */
		public TestResult runAndAssert() throws Exception {
			TestResult result = run();
			result.assertExpected();
			return result;
		}
	}

	/**
	 * Outcome of a test case.
	 */
	public static final class TestResult {
		private final JashTestBuilder spec;
		private final String script;
		private final CompilationResult compilation;
		private final ShellRun shellRun;
		private final CompilationException thrown;

		TestResult(JashTestBuilder spec, String script, CompilationResult compilation, ShellRun shellRun, CompilationException thrown) {
			this.spec = spec;
			this.script = script;
			this.compilation = compilation;
			this.shellRun = shellRun;
			this.thrown = thrown;
		}

		public String script() {
			return script;
		}

		public CompilationResult compilation() {
			return compilation;
		}

		public ShellRun shellRun() {
			return shellRun;
		}

		public CompilationException thrown() {
			return thrown;
		}

		/**
		 * Verifies the expectations of the builder.
		 */
		public void assertExpected() {
			String description = spec.description;
			if (spec.expectedException != null) {
				if (thrown == null) {
					throw new AssertionError(
							"Expected exception "
									+ spec.expectedException.getName()
									+ " for "
									+ description
									+ " but compilation succeeded:\n"
									+ script);
				}
				if (!spec.expectedException.isInstance(thrown)) {
					AssertionError error = new AssertionError(
							"Expected exception "
									+ spec.expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrown.getClass().getName()
									+ ": "
									+ thrown.getMessage());
					error.initCause(thrown);
					throw error;
				}
				return;
			}
			if (thrown != null) {
				AssertionError error = new AssertionError("Compilation failed for " + description + ": " + thrown.getMessage());
				error.initCause(thrown);
				throw error;
			}
			for (String text : spec.contains) {
				assertTrue("Script of " + description + " must contain [" + text + "]:\n" + script, script.contains(text));
			}
			for (String text : spec.notContains) {
				assertFalse("Script of " + description + " must not contain [" + text + "]:\n" + script, script.contains(text));
			}
			if (shellRun == null) {
				return;
			}
			if (spec.expectedLines != null) {
				assertEquals("Unexpected output for " + description + ":\n" + script, spec.expectedLines, shellRun.lines());
			}
			if (spec.expectedError != null) {
				assertEquals("Unexpected error output for " + description, spec.expectedError, shellRun.error());
			}
			int exitCode = spec.expectedExitCode == null ? 0 : spec.expectedExitCode.intValue();
			assertEquals("Unexpected exit code for " + description + " (stderr: " + shellRun.error() + ")", exitCode, shellRun.exitCode());
		}
	}
}
