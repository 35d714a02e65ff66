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
 * Statement of the restricted language.
 * <p>
 * Like {@link Expr}, the set of variants is closed and consumed through
 * {@link StmtVisitor}.
 */
public abstract class Stmt {

	private final int lineNumber;

	private Stmt(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public abstract <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X;

	/**
	 * @return the deepest nesting of any expression held by this statement,
	 *         including the statements of its nested blocks
	 */
	public abstract int maxNestingDepth();

	/**
	 * @param statements a block
	 * @return the deepest nesting of any expression in the block
	 */
	public static int maxNestingDepth(List<Stmt> statements) {
		int max = 0;
		for (Stmt s : statements) {
			max = Math.max(max, s.maxNestingDepth());
		}
		return max;
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/**
	 * <code>let name = value;</code>, and also re-assignment
	 * (<code>name = value;</code>), which binds the same shell variable again.
	 */
	public static final class Let extends Stmt {
		private final String name;
		private final Type declaredType;
		private final Expr value;

		public Let(String name, Type declaredType, Expr value, int lineNumber) {
			super(lineNumber);
			this.name = Objects.requireNonNull(name);
			this.declaredType = declaredType;
			this.value = Objects.requireNonNull(value);
		}

		public String getName() {
			return name;
		}

		/**
		 * @return the type annotation, or <code>null</code> when the type is inferred
		 */
		public Type getDeclaredType() {
			return declaredType;
		}

		public Expr getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitLet(this);
		}

		@Override
		public int maxNestingDepth() {
			return value.nestingDepth();
		}
	}

	/**
	 * <code>if cond { ... } else { ... }</code>. An <code>else if</code> is an
	 * else block holding a single <code>If</code>.
	 */
	public static final class If extends Stmt {
		private final Expr condition;
		private final List<Stmt> thenBlock;
		private final List<Stmt> elseBlock;

		/**
		 * @param condition the condition
		 * @param thenBlock statements run when the condition holds
		 * @param elseBlock statements run otherwise, <code>null</code> when there is no <code>else</code>
		 * @param lineNumber source line
		 */
		public If(Expr condition, List<Stmt> thenBlock, List<Stmt> elseBlock, int lineNumber) {
			super(lineNumber);
			this.condition = Objects.requireNonNull(condition);
			this.thenBlock = freeze(thenBlock);
			this.elseBlock = elseBlock == null ? null : freeze(elseBlock);
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Stmt> getThenBlock() {
			return thenBlock;
		}

		/**
		 * @return the else block, or <code>null</code>
		 */
		public List<Stmt> getElseBlock() {
			return elseBlock;
		}

		public boolean hasElse() {
			return elseBlock != null;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitIf(this);
		}

		@Override
		public int maxNestingDepth() {
			int max = Math.max(condition.nestingDepth(), maxNestingDepth(thenBlock));
			return elseBlock == null ? max : Math.max(max, maxNestingDepth(elseBlock));
		}
	}

	/**
	 * <code>match scrutinee { arms }</code>
	 */
	public static final class Match extends Stmt {
		private final Expr scrutinee;
		private final List<MatchArm> arms;

		public Match(Expr scrutinee, List<MatchArm> arms, int lineNumber) {
			super(lineNumber);
			this.scrutinee = Objects.requireNonNull(scrutinee);
			this.arms = freeze(arms);
		}

		public Expr getScrutinee() {
			return scrutinee;
		}

		public List<MatchArm> getArms() {
			return arms;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitMatch(this);
		}

		@Override
		public int maxNestingDepth() {
			int max = scrutinee.nestingDepth();
			for (MatchArm arm : arms) {
				if (arm.getGuard() != null) {
					max = Math.max(max, arm.getGuard().nestingDepth());
				}
				max = Math.max(max, maxNestingDepth(arm.getBody()));
			}
			return max;
		}
	}

	/**
	 * <code>for pattern in iter { body }</code>, with an optional iteration bound
	 * given by a <code>#[max_iterations = N]</code> attribute.
	 */
	public static final class For extends Stmt {
		private final Pattern pattern;
		private final Expr iterable;
		private final List<Stmt> body;
		private final Long maxIterations;

		public For(Pattern pattern, Expr iterable, List<Stmt> body, Long maxIterations, int lineNumber) {
			super(lineNumber);
			this.pattern = Objects.requireNonNull(pattern);
			this.iterable = Objects.requireNonNull(iterable);
			this.body = freeze(body);
			this.maxIterations = maxIterations;
		}

		public Pattern getPattern() {
			return pattern;
		}

		public Expr getIterable() {
			return iterable;
		}

		public List<Stmt> getBody() {
			return body;
		}

		/**
		 * @return the declared iteration bound, or <code>null</code> when unbounded
		 */
		public Long getMaxIterations() {
			return maxIterations;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitFor(this);
		}

		@Override
		public int maxNestingDepth() {
			return Math.max(iterable.nestingDepth(), maxNestingDepth(body));
		}
	}

	/**
	 * <code>while cond { body }</code>; <code>loop { body }</code> is parsed as
	 * <code>while true { body }</code>.
	 */
	public static final class While extends Stmt {
		private final Expr condition;
		private final List<Stmt> body;
		private final Long maxIterations;

		public While(Expr condition, List<Stmt> body, Long maxIterations, int lineNumber) {
			super(lineNumber);
			this.condition = Objects.requireNonNull(condition);
			this.body = freeze(body);
			this.maxIterations = maxIterations;
		}

		public Expr getCondition() {
			return condition;
		}

		public List<Stmt> getBody() {
			return body;
		}

		public Long getMaxIterations() {
			return maxIterations;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitWhile(this);
		}

		@Override
		public int maxNestingDepth() {
			return Math.max(condition.nestingDepth(), maxNestingDepth(body));
		}
	}

	/**
	 * <code>break;</code>
	 */
	public static final class Break extends Stmt {
		public Break(int lineNumber) {
			super(lineNumber);
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitBreak(this);
		}

		@Override
		public int maxNestingDepth() {
			return 0;
		}
	}

	/**
	 * <code>continue;</code>
	 */
	public static final class Continue extends Stmt {
		public Continue(int lineNumber) {
			super(lineNumber);
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitContinue(this);
		}

		@Override
		public int maxNestingDepth() {
			return 0;
		}
	}

	/**
	 * <code>return;</code> or <code>return value;</code>
	 */
	public static final class Return extends Stmt {
		private final Expr value;

		public Return(Expr value, int lineNumber) {
			super(lineNumber);
			this.value = value;
		}

		/**
		 * @return the returned value, or <code>null</code>
		 */
		public Expr getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitReturn(this);
		}

		@Override
		public int maxNestingDepth() {
			return value == null ? 0 : value.nestingDepth();
		}
	}

	/**
	 * An expression used as a statement, with or without the trailing
	 * semicolon.
	 */
	public static final class ExprStmt extends Stmt {
		private final Expr expr;

		public ExprStmt(Expr expr, int lineNumber) {
			super(lineNumber);
			this.expr = Objects.requireNonNull(expr);
		}

		public Expr getExpr() {
			return expr;
		}

		@Override
		public <R, X extends Exception> R accept(StmtVisitor<R, X> visitor) throws X {
			return visitor.visitExpr(this);
		}

		@Override
		public int maxNestingDepth() {
			return expr.nestingDepth();
		}
	}
}
