package org.metricshub.jash;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.intermediate.ShellIRPrinter;
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.util.JashSettings;
import org.metricshub.jash.util.ScriptFileSource;
import org.metricshub.jash.util.ScriptSource;
import org.metricshub.jash.validation.ValidationLevel;
import org.metricshub.jash.verify.LintDiagnostic;
import org.metricshub.jash.verify.ShellCheckLinter;
import org.metricshub.jash.verify.ShellLinter;
import org.metricshub.jash.verify.VerificationLevel;
import org.slf4j.Logger;

/**
 * Command line of the compiler:
 *
 * <pre>
 * jash [options] &lt;input-file | -&gt;
 * </pre>
 *
 * The script is written to the standard output, or to the file given with
 * <code>-o</code>.
 */
public final class Cli {

	private static final Logger LOG = JashLogger.getLogger(Cli.class);

	/**
	 * Suffix of the proof file written next to the script
	 */
	public static final String PROOF_SUFFIX = ".proof";

	private final JashSettings settings = new JashSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private final ShellLinter linter;

	private ScriptSource scriptSource;
	private File outputFile;
	private boolean dumpIr;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * @param in stream the program is read from with <code>-</code>
	 * @param out stream the script, the IR dump or the usage is written to
	 * @param err stream warnings and the proof (without <code>-o</code>) are written to
	 */
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this(in, out, err, new ShellCheckLinter());
	}

	/**
	 * @param in stream the program is read from with <code>-</code>
	 * @param out stream the script, the IR dump or the usage is written to
	 * @param err stream warnings and the proof (without <code>-o</code>) are written to
	 * @param linter external linter for <code>--verify strict</code> and above
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err, ShellLinter linter) {
		this.in = in;
		this.out = out;
		this.err = err;
		this.linter = linter;
	}

	/**
	 * Returns the mutable {@link JashSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JashSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * @return the file given with <code>-o</code>, or {@code null}
	 */
	public File getOutputFile() {
		return outputFile;
	}

	public boolean isDumpIr() {
		return dumpIr;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if an argument is unknown, lacks its value or has a wrong value
	 */
	public void parse(String[] args) {

		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.equals("-") || arg.charAt(0) != '-') {
				// the program
				break;
			} else if (arg.equals("-o") || arg.equals("--output")) {
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("--target")) {
				checkParameterHasArgument(args, argIdx);
				settings.setTargetDialect(TargetDialect.fromName(args[++argIdx]));
			} else if (arg.equals("--validation")) {
				checkParameterHasArgument(args, argIdx);
				settings.setValidationLevel(level(ValidationLevel.class, args[argIdx], args[++argIdx]));
			} else if (arg.equals("--verify")) {
				checkParameterHasArgument(args, argIdx);
				settings.setVerificationLevel(level(VerificationLevel.class, args[argIdx], args[++argIdx]));
			} else if (arg.equals("--emit-proof")) {
				settings.setEmitProof(true);
			} else if (arg.equals("-O") || arg.equals("--optimize")) {
				settings.setOptimize(true);
			} else if (arg.equals("--no-strict")) {
				settings.setStrictMode(false);
			} else if (arg.equals("--dump-ir")) {
				dumpIr = true;
			} else if (arg.equals("-h") || arg.equals("--help") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("Jash program not provided.");
		}
		if (argIdx + 1 < args.length) {
			throw new IllegalArgumentException("Only one program can be compiled, unexpected argument: " + args[argIdx + 1]);
		}
		String input = args[argIdx];
		if ("-".equals(input)) {
			scriptSource = new ScriptSource(
					ScriptSource.DESCRIPTION_STANDARD_INPUT,
					new InputStreamReader(in, StandardCharsets.UTF_8));
		} else {
			scriptSource = new ScriptFileSource(input);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static <E extends Enum<E>> E level(Class<E> type, String option, String value) {
		try {
			return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
		}
	}

	/**
	 * Compiles the program according to the previously parsed arguments.
	 *
	 * @throws IOException if the program cannot be read or the script cannot be written
	 * @throws CompilationException if the program is rejected
	 */
	public void run() throws IOException, CompilationException {
		if (printUsage) {
			usage(out);
			return;
		}

		Jash jash = new Jash(linter);
		CompilationResult result = jash.compile(scriptSource, settings);

		for (LintDiagnostic diagnostic : result.getDiagnostics()) {
			err.println("warning: " + diagnostic);
		}

		if (dumpIr) {
			new ShellIRPrinter(out).dump(result.getIr());
			return;
		}

		if (outputFile == null) {
			out.print(result.getScript());
			out.flush();
		} else {
			write(outputFile, result.getScript());
			if (!outputFile.setExecutable(true)) {
				LOG.warn("Could not make {} executable", outputFile);
			}
			LOG.debug("Wrote {}", outputFile);
		}

		if (result.getProof() != null) {
			if (outputFile == null) {
				err.print(result.getProof().toReport());
			} else {
				File proofFile = new File(outputFile.getPath() + PROOF_SUFFIX);
				write(proofFile, result.getProof().toReport());
				LOG.debug("Wrote {}", proofFile);
			}
		}
	}

	private static void write(File file, String text) throws IOException {
		try (Writer writer = new OutputStreamWriter(Files.newOutputStream(file.toPath()), StandardCharsets.UTF_8)) {
			writer.write(text);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"jash" +
								" [-o output-filename]" +
								" [--target sh|bash|dash|ash]" +
								" [--validation none|minimal|strict|paranoid]" +
								" [--verify none|basic|strict|paranoid]" +
								" [--emit-proof]" +
								" [-O|--optimize]" +
								" [--no-strict]" +
								" [--dump-ir]" +
								" <input-file | ->");
		dest.println();
		dest.println(" -o filename = Write the script to filename instead of the standard output.");
		dest.println(" --target dialect = Shell the script is written for (default: sh).");
		dest.println(" --validation level = Injection checks on string literals (default: strict).");
		dest.println(" --verify level = Checks on the generated script (default: none).");
		dest.println(" --emit-proof = Write a compilation proof to <output-filename>" + PROOF_SUFFIX + ",");
		dest.println("                or to the standard error without -o.");
		dest.println(" -O, --optimize = Fold constant expressions.");
		dest.println(" --no-strict = Do not exit on the first failing command (no set -e).");
		dest.println(" --dump-ir = Print the intermediate representation instead of the script.");
		dest.println(" - = Read the program from the standard input.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is stream the program is read from with <code>-</code>
	 * @param os stream the script is written to
	 * @param es stream for warnings
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read or the script cannot be written
	 * @throws CompilationException if the program is rejected
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es)
			throws IOException,
			CompilationException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}
}
