package org.metricshub.jash.intermediate;

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
 * Pattern of a <code>case</code> arm: a literal word, or <code>*</code>.
 */
public final class CasePattern {

	private static final CasePattern WILDCARD = new CasePattern(null);

	private final String literal;

	private CasePattern(String literal) {
		this.literal = literal;
	}

	/**
	 * @param value the word the scrutinee must equal
	 * @return a pattern matching exactly this word, with no glob semantics
	 */
	public static CasePattern literal(String value) {
		return new CasePattern(Objects.requireNonNull(value));
	}

	public static CasePattern wildcard() {
		return WILDCARD;
	}

	public boolean isWildcard() {
		return literal == null;
	}

	/**
	 * @return the literal word, or <code>null</code> for the wildcard
	 */
	public String getLiteral() {
		return literal;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CasePattern)) {
			return false;
		}
		return Objects.equals(literal, ((CasePattern) o).literal);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(literal);
	}

	@Override
	public String toString() {
		return isWildcard() ? "*" : "'" + literal + "'";
	}
}
