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

import java.util.Objects;

/**
 * One finding of a lint rule on a generated script.
 */
public final class LintDiagnostic {

	/**
	 * Severities, in the order ShellCheck uses them
	 */
	public enum Severity {
		ERROR,
		WARNING,
		INFO,
		STYLE
	}

	private final int lineNumber;
	private final Severity severity;
	private final String code;
	private final String message;

	/**
	 * @param lineNumber line of the script, starting at 1
	 * @param severity severity of the finding
	 * @param code identifier of the rule, like <code>SC2086</code> or <code>JASH003</code>
	 * @param message description of the finding
	 */
	public LintDiagnostic(int lineNumber, Severity severity, String code, String message) {
		this.lineNumber = lineNumber;
		this.severity = Objects.requireNonNull(severity);
		this.code = Objects.requireNonNull(code);
		this.message = Objects.requireNonNull(message);
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public Severity getSeverity() {
		return severity;
	}

	public String getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		return lineNumber + ": " + severity.name().toLowerCase(java.util.Locale.ROOT) + ": " + message + " [" + code + "]";
	}
}
