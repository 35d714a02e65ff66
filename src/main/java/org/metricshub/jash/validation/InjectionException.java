package org.metricshub.jash.validation;

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
 * A string literal contains a shell injection vector.
 */
public class InjectionException extends ValidationException {

	private static final long serialVersionUID = 1L;

	private static final int MAX_CONSTRUCT_LENGTH = 60;

	private final InjectionPattern pattern;

	/**
	 * @param pattern the vector found in the literal
	 * @param literal the offending literal
	 * @param lineNumber source line of the literal, or {@code -1}
	 */
	public InjectionException(InjectionPattern pattern, String literal, int lineNumber) {
		super(
				"String literal contains " + pattern.getDescription() + ": \"" + printable(literal) + "\"",
				printable(literal),
				lineNumber,
				pattern.getSuggestion());
		this.pattern = pattern;
	}

	/**
	 * @return the injection vector that was found
	 */
	public InjectionPattern getPattern() {
		return pattern;
	}

	/**
	 * Escapes control characters and shortens long literals, so that the
	 * literal can be shown in a diagnostic.
	 */
	static String printable(String literal) {
		StringBuilder result = new StringBuilder();
		for (int i = 0; i < literal.length() && result.length() < MAX_CONSTRUCT_LENGTH; i++) {
			char c = literal.charAt(i);
			if (c == '\n') {
				result.append("\\n");
			} else if (c == '\r') {
				result.append("\\r");
			} else if (c == '\t') {
				result.append("\\t");
			} else if (c == 0) {
				result.append("\\0");
			} else if (c < 0x20 || c == 0x7f) {
				result.append(String.format("\\x%02x", Integer.valueOf(c)));
			} else {
				result.append(c);
			}
		}
		if (result.length() >= MAX_CONSTRUCT_LENGTH && literal.length() > MAX_CONSTRUCT_LENGTH) {
			result.append("...");
		}
		return result.toString();
	}
}
