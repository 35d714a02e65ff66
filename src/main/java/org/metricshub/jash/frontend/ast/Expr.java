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
 * Expression of the restricted language.
 * <p>
 * The set of variants is closed: every class extending <code>Expr</code> is
 * nested here, and consumers handle them through {@link ExprVisitor}, which
 * forces a decision for each variant.
 */
public abstract class Expr {

	/**
	 * Maximum nesting depth of an expression. Deeper expressions are rejected
	 * by validation, before any stage recurses into them.
	 */
	public static final int MAX_NESTING_DEPTH = 30;

	private final int lineNumber;
	private final int nestingDepth;

	private Expr(int lineNumber, int nestingDepth) {
		this.lineNumber = lineNumber;
		this.nestingDepth = nestingDepth;
	}

	/**
	 * @return the source line of this expression, or <code>-1</code> for
	 *         expressions built programmatically
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Dispatches to the method of the visitor matching this variant.
	 *
	 * @param visitor the visitor
	 * @param <R> result of the visit
	 * @param <X> exception the visit may throw
	 * @return the visitor's result
	 * @throws X when the visitor fails
	 */
	public abstract <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X;

	/**
	 * Returns how deeply this expression nests: <code>0</code> for leaves,
	 * <code>1 + max(children)</code> otherwise.
	 * <p>
	 * The depth is computed once, when the node is built from its already
	 * built children, so reading it never recurses.
	 *
	 * @return the nesting depth
	 */
	public final int nestingDepth() {
		return nestingDepth;
	}

	private static int maxDepth(List<Expr> exprs) {
		int max = 0;
		for (Expr e : exprs) {
			max = Math.max(max, e.nestingDepth());
		}
		return max;
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/**
	 * A literal: <code>true</code>, <code>42</code>, <code>"text"</code>.
	 */
	public static final class LiteralExpr extends Expr {
		private final Literal literal;

		public LiteralExpr(Literal literal, int lineNumber) {
			super(lineNumber, 0);
			this.literal = Objects.requireNonNull(literal);
		}

		public Literal getLiteral() {
			return literal;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitLiteral(this);
		}


		@Override
		public String toString() {
			return literal.toString();
		}
	}

	/**
	 * Reference to a parameter or a <code>let</code> binding.
	 */
	public static final class Variable extends Expr {
		private final String name;

		public Variable(String name, int lineNumber) {
			super(lineNumber, 0);
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitVariable(this);
		}


		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Call of a user function, of an intrinsic, of an allow-listed command,
	 * or of an output macro (whose name ends with <code>!</code>).
	 */
	public static final class FunctionCall extends Expr {
		private final String name;
		private final List<Expr> args;

		public FunctionCall(String name, List<Expr> args, int lineNumber) {
			super(lineNumber, 1 + maxDepth(args));
			this.name = Objects.requireNonNull(name);
			this.args = freeze(args);
		}

		public String getName() {
			return name;
		}

		public List<Expr> getArgs() {
			return args;
		}

		/**
		 * @return whether this call is one of the output macros
		 */
		public boolean isMacro() {
			return name.endsWith("!");
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitFunctionCall(this);
		}


		@Override
		public String toString() {
			return name + args.toString().replace('[', '(').replace(']', ')');
		}
	}

	/**
	 * <code>left op right</code>
	 */
	public static final class Binary extends Expr {
		private final BinaryOp op;
		private final Expr left;
		private final Expr right;

		public Binary(BinaryOp op, Expr left, Expr right, int lineNumber) {
			super(lineNumber, 1 + Math.max(left.nestingDepth(), right.nestingDepth()));
			this.op = Objects.requireNonNull(op);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		public BinaryOp getOp() {
			return op;
		}

		public Expr getLeft() {
			return left;
		}

		public Expr getRight() {
			return right;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitBinary(this);
		}


		@Override
		public String toString() {
			return "(" + left + " " + op.getSymbol() + " " + right + ")";
		}
	}

	/**
	 * <code>op operand</code>
	 */
	public static final class Unary extends Expr {
		private final UnaryOp op;
		private final Expr operand;

		public Unary(UnaryOp op, Expr operand, int lineNumber) {
			super(lineNumber, 1 + operand.nestingDepth());
			this.op = Objects.requireNonNull(op);
			this.operand = Objects.requireNonNull(operand);
		}

		public UnaryOp getOp() {
			return op;
		}

		public Expr getOperand() {
			return operand;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitUnary(this);
		}


		@Override
		public String toString() {
			return op.getSymbol() + operand;
		}
	}

	/**
	 * <code>receiver.method(args)</code>
	 */
	public static final class MethodCall extends Expr {
		private final Expr receiver;
		private final String method;
		private final List<Expr> args;

		public MethodCall(Expr receiver, String method, List<Expr> args, int lineNumber) {
			super(lineNumber, 1 + Math.max(receiver.nestingDepth(), maxDepth(args)));
			this.receiver = Objects.requireNonNull(receiver);
			this.method = Objects.requireNonNull(method);
			this.args = freeze(args);
		}

		public Expr getReceiver() {
			return receiver;
		}

		public String getMethod() {
			return method;
		}

		public List<Expr> getArgs() {
			return args;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitMethodCall(this);
		}


		@Override
		public String toString() {
			return receiver + "." + method + args.toString().replace('[', '(').replace(']', ')');
		}
	}

	/**
	 * <code>start..end</code> or <code>start..=end</code>
	 */
	public static final class Range extends Expr {
		private final Expr start;
		private final Expr end;
		private final boolean inclusive;

		public Range(Expr start, Expr end, boolean inclusive, int lineNumber) {
			super(lineNumber, 1 + Math.max(start.nestingDepth(), end.nestingDepth()));
			this.start = Objects.requireNonNull(start);
			this.end = Objects.requireNonNull(end);
			this.inclusive = inclusive;
		}

		public Expr getStart() {
			return start;
		}

		public Expr getEnd() {
			return end;
		}

		public boolean isInclusive() {
			return inclusive;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitRange(this);
		}


		@Override
		public String toString() {
			return start + (inclusive ? "..=" : "..") + end;
		}
	}

	/**
	 * <code>[a, b, c]</code>
	 */
	public static final class ArrayLiteral extends Expr {
		private final List<Expr> elements;

		public ArrayLiteral(List<Expr> elements, int lineNumber) {
			super(lineNumber, 1 + maxDepth(elements));
			this.elements = freeze(elements);
		}

		public List<Expr> getElements() {
			return elements;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitArray(this);
		}


		@Override
		public String toString() {
			return elements.toString();
		}
	}

	/**
	 * <code>array[index]</code>
	 */
	public static final class Index extends Expr {
		private final Expr object;
		private final Expr index;

		public Index(Expr object, Expr index, int lineNumber) {
			super(lineNumber, 1 + Math.max(object.nestingDepth(), index.nestingDepth()));
			this.object = Objects.requireNonNull(object);
			this.index = Objects.requireNonNull(index);
		}

		public Expr getObject() {
			return object;
		}

		public Expr getIndex() {
			return index;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitIndex(this);
		}


		@Override
		public String toString() {
			return object + "[" + index + "]";
		}
	}

	/**
	 * <code>expr?</code>
	 */
	public static final class Try extends Expr {
		private final Expr expr;

		public Try(Expr expr, int lineNumber) {
			super(lineNumber, 1 + expr.nestingDepth());
			this.expr = Objects.requireNonNull(expr);
		}

		public Expr getExpr() {
			return expr;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitTry(this);
		}


		@Override
		public String toString() {
			return expr + "?";
		}
	}

	/**
	 * A block in expression position. The parser also represents
	 * <code>if</code> and <code>match</code> expressions as a block holding
	 * the single corresponding statement.
	 */
	public static final class Block extends Expr {
		private final List<Stmt> statements;

		public Block(List<Stmt> statements, int lineNumber) {
			super(lineNumber, 1 + Stmt.maxNestingDepth(statements));
			this.statements = freeze(statements);
		}

		public List<Stmt> getStatements() {
			return statements;
		}

		@Override
		public <R, X extends Exception> R accept(ExprVisitor<R, X> visitor) throws X {
			return visitor.visitBlock(this);
		}


		@Override
		public String toString() {
			return "{ " + statements.size() + " statement(s) }";
		}
	}
}
