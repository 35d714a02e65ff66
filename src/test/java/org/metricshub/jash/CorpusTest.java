package org.metricshub.jash;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.verify.ShellCheckLinter;
import org.metricshub.jash.verify.VerificationLevel;

/**
 * Each program in the src/test/resources/corpus/scripts directory is compiled
 * and run, and its output is compared to the corresponding *.ok file in
 * results.
 * <p>
 * A program may come with a *.args file in scripts (one argument per line)
 * and a *.exit file in results holding its expected exit status.
 */
@RunWith(Parameterized.class)
public class CorpusTest {

	private static final String CORPUS_PATH = "/corpus";
	private static Path scriptsDirectory;
	private static Path resultsDirectory;

	@BeforeClass
	public static void beforeAll() throws Exception {
		locate();
	}

	private static void locate() throws Exception {
		if (scriptsDirectory != null) {
			return;
		}
		URL corpusUrl = CorpusTest.class.getResource(CORPUS_PATH);
		if (corpusUrl == null) {
			throw new IOException("Couldn't find resource " + CORPUS_PATH);
		}
		Path corpus = Paths.get(corpusUrl.toURI());
		scriptsDirectory = corpus.resolve("scripts");
		resultsDirectory = corpus.resolve("results");
		if (!scriptsDirectory.toFile().isDirectory() || !resultsDirectory.toFile().isDirectory()) {
			throw new IOException(CORPUS_PATH + " must hold the scripts and results directories");
		}
	}

	/**
	 * @return the names of the programs in /src/test/resources/corpus/scripts
	 * @throws Exception when the corpus cannot be found
	 */
	@Parameters(name = "CORPUS {0}")
	public static Iterable<String> programs() throws Exception {
		locate();
		return Arrays
				.stream(scriptsDirectory.toFile().listFiles())
				.map(File::getName)
				.filter(name -> name.endsWith(".jash"))
				.map(name -> name.substring(0, name.length() - ".jash".length()))
				.sorted()
				.collect(Collectors.toList());
	}

	/** Name of the program, without extension */
	@Parameter
	public String programName;

	private String source() throws IOException {
		return read(scriptsDirectory.resolve(programName + ".jash"));
	}

	private String[] args() throws IOException {
		Path argsFile = scriptsDirectory.resolve(programName + ".args");
		List<String> args = argsFile.toFile().exists()
				? Files.readAllLines(argsFile, StandardCharsets.UTF_8)
				: Collections.<String>emptyList();
		return args.toArray(new String[0]);
	}

	private String[] expectedLines() throws IOException {
		return JashTestSupport.lines(read(resultsDirectory.resolve(programName + ".ok"))).toArray(new String[0]);
	}

	private int expectedExitCode() throws IOException {
		Path exitFile = resultsDirectory.resolve(programName + ".exit");
		return exitFile.toFile().exists() ? Integer.parseInt(read(exitFile).trim()) : 0;
	}

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	private void run(String shell, TargetDialect dialect) throws Exception {
		JashTestSupport
				.jashTest("CORPUS " + programName + " (" + shell + ")")
				.source(source())
				.target(dialect)
				.verification(VerificationLevel.STRICT)
				.linter(new ShellCheckLinter())
				.shell(shell)
				.args(args())
				.expectLines(expectedLines())
				.expectExitCode(expectedExitCode())
				.build()
				.runAndAssert();
	}

	/**
	 * Compiles for sh and checks the output of the script, with ShellCheck
	 * when it is installed.
	 *
	 * @throws Exception
	 */
	@Test
	public void testSh() throws Exception {
		run("sh", TargetDialect.POSIX);
	}

	@Test
	public void testDash() throws Exception {
		run("dash", TargetDialect.DASH);
	}

	@Test
	public void testBash() throws Exception {
		run("bash", TargetDialect.BASH);
	}

	@Test
	public void testOptimizedOutputIsTheSame() throws Exception {
		JashTestSupport
				.jashTest("CORPUS " + programName + " (optimized)")
				.source(source())
				.optimize()
				.args(args())
				.expectLines(expectedLines())
				.expectExitCode(expectedExitCode())
				.build()
				.runAndAssert();
	}

	@Test
	public void testDeterministic() throws Exception {
		String script = new Jash().compile(source());
		for (int i = 0; i < 3; i++) {
			assertEquals(script, new Jash().compile(source()));
		}
	}
}
