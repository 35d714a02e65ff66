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
 * Type of a parameter, of a function result, or of a <code>let</code>
 * binding.
 * <p>
 * The vocabulary is closed: <code>()</code>, <code>bool</code>,
 * <code>u32</code>, strings, <code>Option&lt;T&gt;</code> and
 * <code>Result&lt;T, E&gt;</code>. Anything else the parser comes across
 * (<code>i64</code>, <code>Vec&lt;T&gt;</code>, user types...) is kept as an
 * {@link Kind#UNSUPPORTED} leaf so that the validator can reject it with the
 * name the user wrote.
 */
public final class Type {

	/**
	 * Kinds of types.
	 */
	public enum Kind {
		/** <code>()</code>, the result of functions that return nothing */
		VOID,
		/** <code>bool</code> */
		BOOL,
		/** <code>u32</code> */
		U32,
		/** <code>&amp;str</code> and <code>String</code> */
		STR,
		/** <code>Option&lt;T&gt;</code> */
		OPTION,
		/** <code>Result&lt;T, E&gt;</code> */
		RESULT,
		/** any type the compiler cannot translate */
		UNSUPPORTED
	}

	/** <code>()</code> */
	public static final Type VOID = new Type(Kind.VOID, "()", null, null);
	/** <code>bool</code> */
	public static final Type BOOL = new Type(Kind.BOOL, "bool", null, null);
	/** <code>u32</code> */
	public static final Type U32 = new Type(Kind.U32, "u32", null, null);
	/** <code>&amp;str</code> */
	public static final Type STR = new Type(Kind.STR, "str", null, null);

	private final Kind kind;
	private final String name;
	private final Type first;
	private final Type second;

	private Type(Kind kind, String name, Type first, Type second) {
		this.kind = kind;
		this.name = name;
		this.first = first;
		this.second = second;
	}

	/**
	 * @param inner type of the optional value
	 * @return <code>Option&lt;inner&gt;</code>
	 */
	public static Type option(Type inner) {
		return new Type(Kind.OPTION, "Option", Objects.requireNonNull(inner), null);
	}

	/**
	 * @param ok type of the success value
	 * @param err type of the error value
	 * @return <code>Result&lt;ok, err&gt;</code>
	 */
	public static Type result(Type ok, Type err) {
		return new Type(Kind.RESULT, "Result", Objects.requireNonNull(ok), Objects.requireNonNull(err));
	}

	/**
	 * @param name the type as written in the source
	 * @return a type that {@link #isAllowed()} rejects
	 */
	public static Type unsupported(String name) {
		return new Type(Kind.UNSUPPORTED, name, null, null);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the wrapped type of an <code>Option</code>, or the success type
	 *         of a <code>Result</code>; <code>null</code> for leaves
	 */
	public Type getFirst() {
		return first;
	}

	/**
	 * @return the error type of a <code>Result</code>; <code>null</code> otherwise
	 */
	public Type getSecond() {
		return second;
	}

	/**
	 * Whether this type may appear in a program. Composite types are allowed
	 * only if every nested type is allowed.
	 *
	 * @return <code>true</code> if the compiler can translate values of this type
	 */
	public boolean isAllowed() {
		switch (kind) {
		case VOID:
		case BOOL:
		case U32:
		case STR:
			return true;
		case OPTION:
			return first.isAllowed();
		case RESULT:
			return first.isAllowed() && second.isAllowed();
		case UNSUPPORTED:
			return false;
		}
		throw new IllegalStateException("Unknown type kind: " + kind);
	}

	public boolean isNumeric() {
		return kind == Kind.U32;
	}

	public boolean isString() {
		return kind == Kind.STR;
	}

	public boolean isBool() {
		return kind == Kind.BOOL;
	}

	public boolean isVoid() {
		return kind == Kind.VOID;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Type)) {
			return false;
		}
		Type other = (Type) o;
		return kind == other.kind
				&& name.equals(other.name)
				&& Objects.equals(first, other.first)
				&& Objects.equals(second, other.second);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name, first, second);
	}

	@Override
	public String toString() {
		if (kind == Kind.OPTION) {
			return "Option<" + first + ">";
		}
		if (kind == Kind.RESULT) {
			return "Result<" + first + ", " + second + ">";
		}
		return name;
	}
}
