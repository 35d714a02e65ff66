package org.metricshub.jash;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.util.JashSettings;
import org.metricshub.jash.util.ScriptFileSource;
import org.metricshub.jash.validation.ValidationLevel;
import org.metricshub.jash.verify.VerificationLevel;

public class CliTest {

	private static final String HELLO = JashTestSupport.program("println!(\"hello\");");

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private Cli run(String stdin, String... args) throws Exception {
		return Cli
				.create(
						args,
						new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
						new PrintStream(out, true, StandardCharsets.UTF_8.name()),
						new PrintStream(err, true, StandardCharsets.UTF_8.name()));
	}

	private File source(String text) throws Exception {
		File file = folder.newFile("program.jash");
		Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static Cli parse(String... args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	@Test
	public void testParseOptions() {
		Cli cli = parse(
				"-o",
				"out.sh",
				"--target",
				"dash",
				"--validation",
				"paranoid",
				"--verify",
				"basic",
				"--emit-proof",
				"-O",
				"--no-strict",
				"program.jash");
		JashSettings settings = cli.getSettings();
		assertEquals(TargetDialect.DASH, settings.getTargetDialect());
		assertEquals(ValidationLevel.PARANOID, settings.getValidationLevel());
		assertEquals(VerificationLevel.BASIC, settings.getVerificationLevel());
		assertTrue(settings.isEmitProof());
		assertTrue(settings.isOptimize());
		assertFalse(settings.isStrictMode());
		assertEquals(new File("out.sh"), cli.getOutputFile());
		assertEquals("program.jash", ((ScriptFileSource) cli.getScriptSource()).getFilePath());
		assertFalse(cli.isDumpIr());
	}

	@Test
	public void testDefaults() {
		JashSettings settings = parse("program.jash").getSettings();
		assertEquals(TargetDialect.POSIX, settings.getTargetDialect());
		assertEquals(ValidationLevel.STRICT, settings.getValidationLevel());
		assertEquals(VerificationLevel.NONE, settings.getVerificationLevel());
		assertFalse(settings.isEmitProof());
		assertFalse(settings.isOptimize());
		assertTrue(settings.isStrictMode());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> parse("--bogus", "program.jash"));
		assertThrows(IllegalArgumentException.class, () -> parse("-o"));
		assertThrows(IllegalArgumentException.class, () -> parse("--target", "zsh", "program.jash"));
		assertThrows(IllegalArgumentException.class, () -> parse("--verify", "extreme", "program.jash"));
		assertThrows(IllegalArgumentException.class, () -> parse("--emit-proof"));
		assertThrows(IllegalArgumentException.class, () -> parse("a.jash", "b.jash"));
		assertThrows(IllegalArgumentException.class, () -> parse("-h", "program.jash"));
		assertThrows(IllegalArgumentException.class, () -> parse(""));
	}

	@Test
	public void testUsage() throws Exception {
		assertTrue(parse().isPrintUsage());
		assertTrue(parse("--help").isPrintUsage());
		run("", "-h");
		String usage = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(usage, usage.startsWith("Usage:"));
		assertTrue(usage, usage.contains("--emit-proof"));
	}

	@Test
	public void testStandardInput() throws Exception {
		Cli cli = run(HELLO, "-");
		assertEquals("<stdin>", cli.getScriptSource().getDescription());
		String script = out.toString(StandardCharsets.UTF_8.name());
		assertEquals(new Jash().compile(HELLO), script);
		assertEquals("", err.toString(StandardCharsets.UTF_8.name()));
	}

	@Test
	public void testOutputFileAndProof() throws Exception {
		File program = source(HELLO);
		File output = new File(folder.getRoot(), "hello.sh");
		run("", "-o", output.getPath(), "--emit-proof", program.getPath());

		String script = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
		assertEquals(new Jash().compile(HELLO), script);
		assertTrue(output.canExecute());
		assertEquals("", out.toString(StandardCharsets.UTF_8.name()));

		File proof = new File(output.getPath() + Cli.PROOF_SUFFIX);
		String report = new String(Files.readAllBytes(proof.toPath()), StandardCharsets.UTF_8);
		assertTrue(report, report.startsWith("format=1\n"));
		assertTrue(report, report.contains("effects.main=pure\n"));
	}

	@Test
	public void testProofOnStandardError() throws Exception {
		run(HELLO, "--emit-proof", "-");
		assertTrue(out.toString(StandardCharsets.UTF_8.name()).startsWith("#!/bin/sh\n"));
		assertTrue(err.toString(StandardCharsets.UTF_8.name()).startsWith("format=1\n"));
	}

	@Test
	public void testDumpIr() throws Exception {
		run(HELLO, "--dump-ir", "-");
		String dump = out.toString(StandardCharsets.UTF_8.name());
		assertTrue(dump, dump.startsWith("Sequence("));
		assertTrue(dump, dump.contains("  Function(main"));
		assertFalse(dump, dump.contains("#!/bin/sh"));
	}
}
