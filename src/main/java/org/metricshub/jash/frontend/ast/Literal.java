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

import java.util.Objects;

/**
 * A literal value: a boolean, an unsigned 32-bit integer or a string.
 */
public final class Literal {

	/**
	 * Kinds of literals.
	 */
	public enum Kind {
		BOOL,
		U32,
		STR
	}

	/** Largest value a <code>u32</code> literal can hold */
	public static final long MAX_U32 = 0xFFFFFFFFL;

	private final Kind kind;
	private final boolean boolValue;
	private final long numberValue;
	private final String stringValue;

	private Literal(Kind kind, boolean boolValue, long numberValue, String stringValue) {
		this.kind = kind;
		this.boolValue = boolValue;
		this.numberValue = numberValue;
		this.stringValue = stringValue;
	}

	public static Literal bool(boolean value) {
		return new Literal(Kind.BOOL, value, 0, null);
	}

	/**
	 * @param value value between 0 and {@link #MAX_U32}
	 * @return a new <code>u32</code> literal
	 * @throws IllegalArgumentException if the value is out of range
	 */
	public static Literal u32(long value) {
		if (value < 0 || value > MAX_U32) {
			throw new IllegalArgumentException("u32 literal out of range: " + value);
		}
		return new Literal(Kind.U32, false, value, null);
	}

	public static Literal str(String value) {
		return new Literal(Kind.STR, false, 0, Objects.requireNonNull(value));
	}

	public Kind getKind() {
		return kind;
	}

	public boolean getBoolValue() {
		return boolValue;
	}

	public long getNumberValue() {
		return numberValue;
	}

	public String getStringValue() {
		return stringValue;
	}

	/**
	 * @return the type of this literal
	 */
	public Type getType() {
		switch (kind) {
		case BOOL:
			return Type.BOOL;
		case U32:
			return Type.U32;
		case STR:
			return Type.STR;
		}
		throw new IllegalStateException("Unknown literal kind: " + kind);
	}

	/**
	 * @return the literal as the shell sees it: <code>true</code>/<code>false</code>,
	 *         the decimal number, or the string itself
	 */
	public String toShellText() {
		switch (kind) {
		case BOOL:
			return boolValue ? "true" : "false";
		case U32:
			return Long.toString(numberValue);
		case STR:
			return stringValue;
		}
		throw new IllegalStateException("Unknown literal kind: " + kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Literal)) {
			return false;
		}
		Literal other = (Literal) o;
		return kind == other.kind
				&& boolValue == other.boolValue
				&& numberValue == other.numberValue
				&& Objects.equals(stringValue, other.stringValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, boolValue, numberValue, stringValue);
	}

	@Override
	public String toString() {
		return kind == Kind.STR ? '"' + stringValue + '"' : toShellText();
	}
}
