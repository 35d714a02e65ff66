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

/**
 * Base class of every error the compilation pipeline reports.
 * <p>
 * Each stage of the pipeline declares the subclass it may throw, so that a
 * caller can tell a parse error from an injection attempt without looking at
 * the message. An exception carries the offending construct (an identifier,
 * a literal, a node description), the source line when it is known, and
 * optionally a suggestion on how to fix the input.
 * <p>
 * Compilation stops at the first exception: no shell text is ever returned
 * for an input that failed any stage.
 */
public abstract class CompilationException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String construct;
	private final int lineNumber;
	private final String suggestion;

	/**
	 * @param message description of the problem
	 * @param construct offending construct, may be {@code null}
	 * @param lineNumber source line of the construct, or {@code -1} if unknown
	 * @param suggestion suggested fix, may be {@code null}
	 */
	protected CompilationException(String message, String construct, int lineNumber, String suggestion) {
		super(message);
		this.construct = construct;
		this.lineNumber = lineNumber;
		this.suggestion = suggestion;
	}

	/**
	 * @param message description of the problem
	 * @param construct offending construct, may be {@code null}
	 * @param lineNumber source line of the construct, or {@code -1} if unknown
	 * @param suggestion suggested fix, may be {@code null}
	 * @param cause underlying exception
	 */
	protected CompilationException(String message, String construct, int lineNumber, String suggestion, Throwable cause) {
		super(message, cause);
		this.construct = construct;
		this.lineNumber = lineNumber;
		this.suggestion = suggestion;
	}

	/**
	 * Returns the offending construct, as it appears in the source or in the
	 * intermediate representation.
	 *
	 * @return the construct or {@code null} when the error is not tied to one
	 */
	public String getConstruct() {
		return construct;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return a suggested fix, or {@code null}
	 */
	public String getSuggestion() {
		return suggestion;
	}
}
