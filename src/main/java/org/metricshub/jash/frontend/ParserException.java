package org.metricshub.jash.frontend;

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

import org.metricshub.jash.CompilationException;

/**
 * The source text does not follow the grammar of the language.
 */
public class ParserException extends CompilationException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	/**
	 * @param msg description of the problem
	 * @param sourceDescription description of the source being parsed
	 * @param lineNumber line where the problem was found
	 * @param construct text of the offending token
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber, String construct) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ")", construct, lineNumber, null);
		this.sourceDescription = sourceDescription;
	}

	/**
	 * @param msg description of the problem
	 * @param sourceDescription description of the source being parsed
	 * @param lineNumber line where the problem was found
	 * @param construct text of the offending token
	 * @param suggestion how to fix the source
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber, String construct, String suggestion) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ")", construct, lineNumber, suggestion);
		this.sourceDescription = sourceDescription;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
