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
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;

/**
 * Entry point of the <code>jash</code> command.
 * <p>
 * Exit status: 0 when the script was produced, 1 when the program was
 * rejected or could not be read, 2 when the command line is invalid.
 */
public final class Main {

	/** Exit status when the program was rejected or an I/O error occurred */
	public static final int EXIT_FAILURE = 1;

	/** Exit status when the command line is invalid */
	public static final int EXIT_USAGE = 2;

	private Main() {}

	/**
	 * The entry point to Jash for the VM.
	 *
	 * @param args Command line arguments to the VM.
	 */
	public static void main(String[] args) {
		int status = run(args, System.in, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}

	/**
	 * Runs the command line with the specified streams.
	 *
	 * @param args command-line arguments
	 * @param is stream the program is read from with <code>-</code>
	 * @param os stream the script is written to
	 * @param es stream errors are written to
	 * @return the exit status
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int run(String[] args, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(is, os, es);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			es.printf("%s\n", e.getMessage());
			es.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE;
		}
		try {
			cli.run();
			return 0;
		} catch (CompilationException e) {
			report(e, es);
			return EXIT_FAILURE;
		} catch (IOException e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return EXIT_FAILURE;
		}
	}

	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	static void report(CompilationException e, PrintStream es) {
		if (e.getLineNumber() >= 0) {
			es.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
		} else {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
		if (e.getSuggestion() != null) {
			es.printf("hint: %s\n", e.getSuggestion());
		}
	}
}
