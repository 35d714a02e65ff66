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
import org.metricshub.jash.verify.LintDiagnostic.Severity;

/**
 * Finds commands that fail when a script runs a second time:
 * <ul>
 * <li><code>JASH101</code> <code>mkdir</code> without <code>-p</code>
 * <li><code>JASH102</code> <code>rm</code> without <code>-f</code>
 * <li><code>JASH103</code> <code>ln -s</code> without <code>-f</code>
 * </ul>
 * Only commands at the start of a line are checked, which is where the
 * emitter writes them.
 */
public final class IdempotenceChecker {

	private IdempotenceChecker() {}

	/**
	 * @param script text of the script
	 * @return the findings, all of them errors
	 */
	public static List<LintDiagnostic> check(String script) {
		List<LintDiagnostic> diagnostics = new ArrayList<LintDiagnostic>();
		for (ScriptLines.Line line : ScriptLines.of(script).getCodeLines()) {
			String[] words = line.getMasked().split("\\s+");
			String command = words[0];
			String flags = flags(words);
			if ("mkdir".equals(command) && flags.indexOf('p') < 0) {
				diagnostics.add(
						new LintDiagnostic(line.getNumber(), Severity.ERROR, "JASH101", "mkdir without -p fails if the directory exists"));
			} else if ("rm".equals(command) && flags.indexOf('f') < 0) {
				diagnostics.add(
						new LintDiagnostic(line.getNumber(), Severity.ERROR, "JASH102", "rm without -f fails if the file is missing"));
			} else if ("ln".equals(command) && flags.indexOf('s') >= 0 && flags.indexOf('f') < 0) {
				diagnostics.add(
						new LintDiagnostic(line.getNumber(), Severity.ERROR, "JASH103", "ln -s without -f fails if the link exists"));
			}
		}
		return diagnostics;
	}

	/**
	 * Concatenates the short options given before the operands.
	 */
	private static String flags(String[] words) {
		StringBuilder flags = new StringBuilder();
		for (int i = 1; i < words.length; i++) {
			String word = words[i];
			if ("--".equals(word) || !word.startsWith("-") || word.length() < 2) {
				break;
			}
			if (word.startsWith("--")) {
				// --parents, --force, --symbolic
				if ("--parents".equals(word)) {
					flags.append('p');
				} else if ("--force".equals(word)) {
					flags.append('f');
				} else if ("--symbolic".equals(word)) {
					flags.append('s');
				}
			} else {
				flags.append(word, 1, word.length());
			}
		}
		return flags.toString();
	}
}
