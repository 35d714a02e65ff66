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

import java.util.Collections;
import java.util.List;
import org.metricshub.jash.CompilationException;

/**
 * A generated script failed verification.
 */
public class VerificationException extends CompilationException {

	private static final long serialVersionUID = 1L;

	private final transient List<LintDiagnostic> diagnostics;

	/**
	 * @param message description of the failure
	 * @param diagnostics the diagnostics that failed the script, first one first
	 */
	public VerificationException(String message, List<LintDiagnostic> diagnostics) {
		super(
				message,
				diagnostics.isEmpty() ? null : diagnostics.get(0).getCode(),
				diagnostics.isEmpty() ? -1 : diagnostics.get(0).getLineNumber(),
				null);
		this.diagnostics = Collections.unmodifiableList(diagnostics);
	}

	/**
	 * @param message description of the failure
	 * @param construct the check that could not be completed
	 * @param cause the error that stopped the check
	 */
	public VerificationException(String message, String construct, Throwable cause) {
		super(message, construct, -1, null, cause);
		this.diagnostics = Collections.emptyList();
	}

	/**
	 * @return the diagnostics that failed the script
	 */
	public List<LintDiagnostic> getDiagnostics() {
		return diagnostics;
	}
}
