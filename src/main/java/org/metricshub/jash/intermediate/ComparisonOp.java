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

/**
 * Comparisons the <code>test</code> builtin performs, numeric or on strings.
 */
public enum ComparisonOp {
	NUM_EQ("-eq"),
	NUM_NE("-ne"),
	NUM_LT("-lt"),
	NUM_LE("-le"),
	NUM_GT("-gt"),
	NUM_GE("-ge"),
	STR_EQ("="),
	STR_NE("!=");

	private final String testOperator;

	ComparisonOp(String testOperator) {
		this.testOperator = testOperator;
	}

	/**
	 * @return the operator as written between the operands of <code>[ ]</code>
	 */
	public String getTestOperator() {
		return testOperator;
	}
}
