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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pattern of a <code>match</code> arm or of a <code>for</code> loop.
 */
public abstract class Pattern {

	private Pattern() {}

	public abstract <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X;

	/**
	 * A literal to compare the scrutinee with.
	 */
	public static final class LiteralPattern extends Pattern {
		private final Literal literal;

		public LiteralPattern(Literal literal) {
			this.literal = Objects.requireNonNull(literal);
		}

		public Literal getLiteral() {
			return literal;
		}

		@Override
		public <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X {
			return visitor.visitLiteral(this);
		}

		@Override
		public String toString() {
			return literal.toString();
		}
	}

	/**
	 * Matches anything and binds it to a name.
	 */
	public static final class VariablePattern extends Pattern {
		private final String name;

		public VariablePattern(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X {
			return visitor.visitVariable(this);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * <code>_</code>
	 */
	public static final class Wildcard extends Pattern {

		@Override
		public <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X {
			return visitor.visitWildcard(this);
		}

		@Override
		public String toString() {
			return "_";
		}
	}

	/**
	 * <code>(a, b)</code>
	 */
	public static final class TuplePattern extends Pattern {
		private final List<Pattern> elements;

		public TuplePattern(List<Pattern> elements) {
			this.elements = Collections.unmodifiableList(new ArrayList<Pattern>(elements));
		}

		public List<Pattern> getElements() {
			return elements;
		}

		@Override
		public <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X {
			return visitor.visitTuple(this);
		}

		@Override
		public String toString() {
			return elements.toString().replace('[', '(').replace(']', ')');
		}
	}

	/**
	 * <code>Name { field: pattern }</code>, and also <code>Name(pattern)</code>
	 * whose fields are named after their position.
	 */
	public static final class StructPattern extends Pattern {
		private final String name;
		private final List<Field> fields;

		public StructPattern(String name, List<Field> fields) {
			this.name = Objects.requireNonNull(name);
			this.fields = Collections.unmodifiableList(new ArrayList<Field>(fields));
		}

		public String getName() {
			return name;
		}

		public List<Field> getFields() {
			return fields;
		}

		@Override
		public <R, X extends Exception> R accept(PatternVisitor<R, X> visitor) throws X {
			return visitor.visitStruct(this);
		}

		@Override
		public String toString() {
			return name + " { " + fields.size() + " field(s) }";
		}
	}

	/**
	 * A field of a {@link StructPattern}.
	 */
	public static final class Field {
		private final String name;
		private final Pattern pattern;

		public Field(String name, Pattern pattern) {
			this.name = Objects.requireNonNull(name);
			this.pattern = Objects.requireNonNull(pattern);
		}

		public String getName() {
			return name;
		}

		public Pattern getPattern() {
			return pattern;
		}
	}
}
