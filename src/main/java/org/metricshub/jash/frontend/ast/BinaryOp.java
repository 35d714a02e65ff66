package org.metricshub.jash.frontend.ast;

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
 * Binary operators of the language.
 */
public enum BinaryOp {
	/** <code>+</code>, addition of numbers or concatenation of strings */
	ADD("+"),
	/** <code>-</code> */
	SUB("-"),
	/** <code>*</code> */
	MUL("*"),
	/** <code>/</code>, integer division */
	DIV("/"),
	/** <code>%</code> */
	MOD("%"),
	/** <code>==</code> */
	EQ("=="),
	/** <code>!=</code> */
	NE("!="),
	/** <code>&lt;</code> */
	LT("<"),
	/** <code>&lt;=</code> */
	LE("<="),
	/** <code>&gt;</code> */
	GT(">"),
	/** <code>&gt;=</code> */
	GE(">="),
	/** <code>&amp;&amp;</code> */
	AND("&&"),
	/** <code>||</code> */
	OR("||");

	private final String symbol;

	BinaryOp(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the operator as written in the source
	 */
	public String getSymbol() {
		return symbol;
	}
}
