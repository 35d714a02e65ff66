package org.metricshub.jash.verify;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jash.backend.EmitException;
import org.metricshub.jash.backend.PosixEmitter;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.verify.LintDiagnostic.Severity;
import org.slf4j.Logger;

/**
 * Checks a generated script according to a {@link VerificationLevel}.
 * <p>
 * Each level runs the checks of the previous one:
 * <ul>
 * <li>{@link VerificationLevel#BASIC}: {@link EmbeddedLintRules}
 * <li>{@link VerificationLevel#STRICT}: the IR is emitted again and must give the
 * same text (<code>JASH007</code>), and the external linter runs when it is installed
 * <li>{@link VerificationLevel#PARANOID}: {@link IdempotenceChecker}
 * </ul>
 * Any finding of {@link Severity#ERROR} severity fails the verification.
 */
public class Verifier {

	private static final Logger LOG = JashLogger.getLogger(Verifier.class);

	private final VerificationLevel level;
	private final ShellLinter linter;

	/**
	 * Creates a verifier that uses ShellCheck as the external linter.
	 *
	 * @param level checks to run
	 */
	public Verifier(VerificationLevel level) {
		this(level, new ShellCheckLinter());
	}

	/**
	 * @param level checks to run
	 * @param linter external linter, used from {@link VerificationLevel#STRICT} on
	 */
	public Verifier(VerificationLevel level, ShellLinter linter) {
		this.level = level;
		this.linter = linter;
	}

	/**
	 * Verifies the specified script.
	 *
	 * @param script the generated script
	 * @param ir the IR the script was generated from
	 * @param dialect target shell of the script
	 * @param strictMode whether the script was generated in strict mode
	 * @return every finding, none of them errors
	 * @throws VerificationException if a check finds an error or cannot run
	 */
	public List<LintDiagnostic> verify(String script, ShellIR ir, TargetDialect dialect, boolean strictMode)
			throws VerificationException {
		if (level == VerificationLevel.NONE) {
			return Collections.emptyList();
		}
		List<LintDiagnostic> diagnostics = new ArrayList<LintDiagnostic>(EmbeddedLintRules.check(script));

		if (level == VerificationLevel.STRICT || level == VerificationLevel.PARANOID) {
			diagnostics.addAll(checkDeterminism(script, ir, dialect, strictMode));
			diagnostics.addAll(runLinter(script, dialect));
		}
		if (level == VerificationLevel.PARANOID) {
			diagnostics.addAll(IdempotenceChecker.check(script));
		}

		List<LintDiagnostic> errors = new ArrayList<LintDiagnostic>();
		for (LintDiagnostic diagnostic : diagnostics) {
			if (diagnostic.isError()) {
				errors.add(diagnostic);
			}
		}
		LOG.debug("Verification at {} level: {} finding(s), {} error(s)", level, diagnostics.size(), errors.size());
		if (!errors.isEmpty()) {
			throw new VerificationException(
					"Generated script failed verification: " + errors.get(0)
							+ (errors.size() > 1 ? " (and " + (errors.size() - 1) + " more)" : ""),
					errors);
		}
		return diagnostics;
	}

	private static List<LintDiagnostic> checkDeterminism(String script, ShellIR ir, TargetDialect dialect, boolean strictMode)
			throws VerificationException {
		String again;
		try {
			again = new PosixEmitter(dialect, strictMode).emit(ir);
		} catch (EmitException e) {
			throw new VerificationException("Re-emission failed: " + e.getMessage(), "JASH007", e);
		}
		if (again.equals(script)) {
			return Collections.emptyList();
		}
		return Collections.singletonList(
				new LintDiagnostic(firstDifference(script, again), Severity.ERROR, "JASH007", "Re-emission gave a different script"));
	}

	/**
	 * @return the first line where the two texts differ
	 */
	private static int firstDifference(String a, String b) {
		int line = 1;
		int length = Math.min(a.length(), b.length());
		for (int i = 0; i < length; i++) {
			if (a.charAt(i) != b.charAt(i)) {
				return line;
			}
			if (a.charAt(i) == '\n') {
				line++;
			}
		}
		return line;
	}

	private List<LintDiagnostic> runLinter(String script, TargetDialect dialect) throws VerificationException {
		if (linter == null || !linter.isAvailable()) {
			LOG.warn("{} is not available, skipping the external lint of the generated script",
					linter == null ? "External linter" : linter.getName());
			return Collections.emptyList();
		}
		try {
			return linter.lint(script, dialect);
		} catch (IOException e) {
			throw new VerificationException("Could not run " + linter.getName() + ": " + e.getMessage(), linter.getName(), e);
		}
	}
}
