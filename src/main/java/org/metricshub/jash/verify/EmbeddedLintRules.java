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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.metricshub.jash.verify.LintDiagnostic.Severity;

/**
 * Lint rules that need no external tool. They check the properties every
 * script written by the emitter has:
 * <ul>
 * <li><code>JASH001</code> the script starts with a shebang
 * <li><code>JASH002</code> the safety preamble is present
 * <li><code>JASH003</code> quotes and substitutions are all closed
 * <li><code>JASH004</code> no backtick command substitution
 * <li><code>JASH005</code> no <code>[ true ]</code> or <code>[ false ]</code>, which test a non-empty string
 * <li><code>JASH006</code> no empty body, which <code>sh</code> rejects as a syntax error
 * </ul>
 */
public final class EmbeddedLintRules {

	private static final Pattern CONSTANT_TEST = Pattern.compile("\\[ (true|false) \\]");

	/**
	 * Lines that open a body
	 */
	private static final Pattern OPENS_BODY = Pattern.compile("^(if|elif|while|for|until) .*; (then|do)$|^(then|do|else)$|.*\\{$");

	/**
	 * Lines that close a body
	 */
	private static final Pattern CLOSES_BODY = Pattern.compile("^(fi|done|else|elif .*|\\}|;;|esac)$");

	/**
	 * A case arm pattern alone on its line, after masking
	 */
	private static final Pattern CASE_ARM = Pattern.compile("^[^\\s()]+\\)$");

	private EmbeddedLintRules() {}

	/**
	 * Applies every rule to the specified script.
	 *
	 * @param script text of the script
	 * @return the findings, in the order of the rules, possibly empty
	 */
	public static List<LintDiagnostic> check(String script) {
		ScriptLines lines = ScriptLines.of(script);
		List<LintDiagnostic> diagnostics = new ArrayList<LintDiagnostic>();

		if (!lines.getFirstLine().startsWith("#!/")) {
			diagnostics.add(new LintDiagnostic(1, Severity.ERROR, "JASH001", "Script does not start with a shebang"));
		}

		checkPreamble(lines, diagnostics);

		if (lines.getUnclosedLine() > 0) {
			diagnostics.add(
					new LintDiagnostic(
							lines.getUnclosedLine(),
							Severity.ERROR,
							"JASH003",
							"Unterminated " + lines.getUnclosedQuote()));
		}

		for (Integer line : lines.getBacktickLines()) {
			diagnostics.add(
					new LintDiagnostic(line.intValue(), Severity.ERROR, "JASH004", "Backtick command substitution, use $(...)"));
		}

		List<ScriptLines.Line> code = lines.getCodeLines();
		for (int i = 0; i < code.size(); i++) {
			ScriptLines.Line line = code.get(i);
			String text = line.getMasked();
			if (CONSTANT_TEST.matcher(text).find()) {
				diagnostics.add(
						new LintDiagnostic(
								line.getNumber(),
								Severity.ERROR,
								"JASH005",
								"Test of a constant string is always true, use the true or false command"));
			}
			if (i + 1 < code.size() && CLOSES_BODY.matcher(code.get(i + 1).getMasked()).matches()) {
				String closing = code.get(i + 1).getMasked();
				boolean emptyArm = CASE_ARM.matcher(text).matches() && ";;".equals(closing);
				if (OPENS_BODY.matcher(text).matches() || emptyArm) {
					diagnostics.add(
							new LintDiagnostic(
									line.getNumber(),
									Severity.ERROR,
									"JASH006",
									"Empty body before '" + closing + "', use ':'"));
				}
			}
		}
		return diagnostics;
	}

	private static void checkPreamble(ScriptLines lines, List<LintDiagnostic> diagnostics) {
		boolean set = false;
		boolean ifs = false;
		boolean locale = false;
		for (ScriptLines.Line line : lines.getCodeLines()) {
			String text = line.getMasked();
			if ("set -euf".equals(text) || "set -uf".equals(text)) {
				set = true;
			} else if (text.startsWith("IFS=")) {
				ifs = true;
			} else if ("export LC_ALL=C".equals(text)) {
				locale = true;
			}
		}
		if (!set) {
			diagnostics.add(new LintDiagnostic(1, Severity.ERROR, "JASH002", "Missing 'set -euf' or 'set -uf'"));
		}
		if (!ifs) {
			diagnostics.add(new LintDiagnostic(1, Severity.ERROR, "JASH002", "Missing IFS assignment"));
		}
		if (!locale) {
			diagnostics.add(new LintDiagnostic(1, Severity.ERROR, "JASH002", "Missing 'export LC_ALL=C'"));
		}
	}
}
