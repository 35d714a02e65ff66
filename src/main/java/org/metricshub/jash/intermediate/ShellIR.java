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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Instruction of the shell IR, the representation between the syntax tree
 * and the shell text.
 * <p>
 * Nodes are immutable and carry the {@link EffectSet} of what they do when
 * the script runs: leaves are annotated by the builder, composite nodes hold
 * the union of their children. Effects are informational; they never change
 * what is emitted.
 */
public abstract class ShellIR {

	private final EffectSet effects;

	private ShellIR(EffectSet effects) {
		this.effects = Objects.requireNonNull(effects);
	}

	public abstract <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X;

	/**
	 * @return side effects of running this node
	 */
	public final EffectSet effects() {
		return effects;
	}

	private static EffectSet unionOf(List<? extends ShellIR> nodes) {
		EffectSet union = EffectSet.pure();
		for (ShellIR node : nodes) {
			union = union.union(node.effects());
		}
		return union;
	}

	private static EffectSet unionOfValues(List<ShellValue> values) {
		EffectSet union = EffectSet.pure();
		for (ShellValue value : values) {
			union = union.union(value.effects());
		}
		return union;
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(list));
	}

	/**
	 * <code>name=value</code>
	 */
	public static final class Let extends ShellIR {
		private final String name;
		private final ShellValue value;

		public Let(String name, ShellValue value) {
			super(value.effects());
			this.name = Objects.requireNonNull(name);
			this.value = value;
		}

		public String getName() {
			return name;
		}

		public ShellValue getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitLet(this);
		}

		@Override
		public String toString() {
			return "Let(" + name + ", " + value + ", " + effects() + ")";
		}
	}

	/**
	 * Runs a command: a function of the program or an allowed external command.
	 */
	public static final class Exec extends ShellIR {
		private final String command;
		private final List<ShellValue> args;

		/**
		 * @param command name of the function or command
		 * @param args arguments
		 * @param commandEffects effects of the command itself; the effects of
		 *        computing the arguments are added
		 */
		public Exec(String command, List<ShellValue> args, EffectSet commandEffects) {
			super(commandEffects.union(unionOfValues(args)));
			this.command = Objects.requireNonNull(command);
			this.args = freeze(args);
		}

		public String getCommand() {
			return command;
		}

		public List<ShellValue> getArgs() {
			return args;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitExec(this);
		}

		@Override
		public String toString() {
			return "Exec(" + command + ", " + args + ", " + effects() + ")";
		}
	}

	/**
	 * <code>if condition; then ...; else ...; fi</code>
	 */
	public static final class If extends ShellIR {
		private final ShellValue condition;
		private final ShellIR thenBranch;
		private final ShellIR elseBranch;

		/**
		 * @param condition a boolean value
		 * @param thenBranch run when the condition holds
		 * @param elseBranch run otherwise, <code>null</code> for no else branch
		 */
		public If(ShellValue condition, ShellIR thenBranch, ShellIR elseBranch) {
			super(condition.effects().union(thenBranch.effects()).union(elseBranch == null ? EffectSet.pure() : elseBranch.effects()));
			this.condition = condition;
			this.thenBranch = thenBranch;
			this.elseBranch = elseBranch;
		}

		public ShellValue getCondition() {
			return condition;
		}

		public ShellIR getThenBranch() {
			return thenBranch;
		}

		/**
		 * @return the else branch, or <code>null</code>
		 */
		public ShellIR getElseBranch() {
			return elseBranch;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitIf(this);
		}

		@Override
		public String toString() {
			return "If(" + condition + ")";
		}
	}

	/**
	 * Nodes run one after the other.
	 */
	public static final class Sequence extends ShellIR {
		private final List<ShellIR> nodes;

		public Sequence(List<ShellIR> nodes) {
			super(unionOf(nodes));
			this.nodes = freeze(nodes);
		}

		public List<ShellIR> getNodes() {
			return nodes;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitSequence(this);
		}

		@Override
		public String toString() {
			return "Sequence(" + nodes.size() + " node(s))";
		}
	}

	/**
	 * Definition of a shell function. Parameters are bound from the
	 * positional arguments of the function, in order.
	 */
	public static final class Function extends ShellIR {
		private final String name;
		private final List<String> params;
		private final ShellIR body;

		public Function(String name, List<String> params, ShellIR body) {
			super(body.effects());
			this.name = Objects.requireNonNull(name);
			this.params = freeze(params);
			this.body = body;
		}

		public String getName() {
			return name;
		}

		public List<String> getParams() {
			return params;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitFunction(this);
		}

		@Override
		public String toString() {
			return "Function(" + name + ", " + params + ", " + effects() + ")";
		}
	}

	/**
	 * Writes a value to the standard output or the standard error.
	 */
	public static final class Echo extends ShellIR {
		private final ShellValue value;
		private final boolean newline;
		private final boolean stderr;

		/**
		 * Writes the value and a newline to the standard output.
		 *
		 * @param value the value
		 */
		public Echo(ShellValue value) {
			this(value, true, false);
		}

		public Echo(ShellValue value, boolean newline, boolean stderr) {
			super(value.effects());
			this.value = value;
			this.newline = newline;
			this.stderr = stderr;
		}

		public ShellValue getValue() {
			return value;
		}

		public boolean isNewline() {
			return newline;
		}

		public boolean isStderr() {
			return stderr;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitEcho(this);
		}

		@Override
		public String toString() {
			return "Echo(" + value + (stderr ? ", stderr" : "") + ")";
		}
	}

	/**
	 * Counts <code>variable</code> from <code>start</code> to <code>end</code>,
	 * both included.
	 */
	public static final class For extends ShellIR {
		private final String variable;
		private final ShellValue start;
		private final ShellValue end;
		private final ShellIR body;

		public For(String variable, ShellValue start, ShellValue end, ShellIR body) {
			super(start.effects().union(end.effects()).union(body.effects()));
			this.variable = Objects.requireNonNull(variable);
			this.start = start;
			this.end = end;
			this.body = body;
		}

		public String getVariable() {
			return variable;
		}

		public ShellValue getStart() {
			return start;
		}

		/**
		 * @return the last value of the variable, included
		 */
		public ShellValue getEnd() {
			return end;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitFor(this);
		}

		@Override
		public String toString() {
			return "For(" + variable + ", " + start + ", " + end + ")";
		}
	}

	/**
	 * <code>for variable in items; do ...; done</code>
	 */
	public static final class ForIn extends ShellIR {
		private final String variable;
		private final List<ShellValue> items;
		private final ShellIR body;

		public ForIn(String variable, List<ShellValue> items, ShellIR body) {
			super(unionOfValues(items).union(body.effects()));
			this.variable = Objects.requireNonNull(variable);
			this.items = freeze(items);
			this.body = body;
		}

		public String getVariable() {
			return variable;
		}

		public List<ShellValue> getItems() {
			return items;
		}

		public ShellIR getBody() {
			return body;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitForIn(this);
		}

		@Override
		public String toString() {
			return "ForIn(" + variable + ", " + items + ")";
		}
	}

	/**
	 * <code>while condition; do ...; done</code>, optionally aborting the
	 * script when the body runs more than <code>maxIterations</code> times.
	 */
	public static final class While extends ShellIR {
		private final ShellValue condition;
		private final ShellIR body;
		private final Long maxIterations;

		public While(ShellValue condition, ShellIR body, Long maxIterations) {
			super(condition.effects().union(body.effects()));
			this.condition = condition;
			this.body = body;
			this.maxIterations = maxIterations;
		}

		public ShellValue getCondition() {
			return condition;
		}

		public ShellIR getBody() {
			return body;
		}

		/**
		 * @return the iteration bound, or <code>null</code>
		 */
		public Long getMaxIterations() {
			return maxIterations;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitWhile(this);
		}

		@Override
		public String toString() {
			return "While(" + condition + (maxIterations == null ? "" : ", max " + maxIterations) + ")";
		}
	}

	/**
	 * <code>break</code>
	 */
	public static final class Break extends ShellIR {
		public Break() {
			super(EffectSet.pure());
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitBreak(this);
		}

		@Override
		public String toString() {
			return "Break";
		}
	}

	/**
	 * <code>continue</code>
	 */
	public static final class Continue extends ShellIR {
		public Continue() {
			super(EffectSet.pure());
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitContinue(this);
		}

		@Override
		public String toString() {
			return "Continue";
		}
	}

	/**
	 * <code>case scrutinee in ... esac</code>
	 */
	public static final class Case extends ShellIR {
		private final ShellValue scrutinee;
		private final List<CaseArm> arms;

		public Case(ShellValue scrutinee, List<CaseArm> arms) {
			super(scrutinee.effects().union(armEffects(arms)));
			this.scrutinee = scrutinee;
			this.arms = freeze(arms);
		}

		private static EffectSet armEffects(List<CaseArm> arms) {
			EffectSet union = EffectSet.pure();
			for (CaseArm arm : arms) {
				union = union.union(arm.getBody().effects());
			}
			return union;
		}

		public ShellValue getScrutinee() {
			return scrutinee;
		}

		public List<CaseArm> getArms() {
			return arms;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitCase(this);
		}

		@Override
		public String toString() {
			return "Case(" + scrutinee + ", " + arms.size() + " arm(s))";
		}
	}

	/**
	 * Leaves the current function. A value, if any, is written to the
	 * standard output first, following the return-value convention.
	 */
	public static final class Return extends ShellIR {
		private final ShellValue value;

		public Return(ShellValue value) {
			super(value == null ? EffectSet.pure() : value.effects());
			this.value = value;
		}

		/**
		 * @return the returned value, or <code>null</code>
		 */
		public ShellValue getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitReturn(this);
		}

		@Override
		public String toString() {
			return "Return(" + value + ")";
		}
	}

	/**
	 * Ends the script with the specified status.
	 */
	public static final class Exit extends ShellIR {
		private final ShellValue code;

		public Exit(ShellValue code) {
			super(code.effects());
			this.code = code;
		}

		public ShellValue getCode() {
			return code;
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitExit(this);
		}

		@Override
		public String toString() {
			return "Exit(" + code + ")";
		}
	}

	/**
	 * Does nothing. Emitted as <code>:</code>, since the shell does not accept
	 * an empty body.
	 */
	public static final class Noop extends ShellIR {
		public Noop() {
			super(EffectSet.pure());
		}

		@Override
		public <R, X extends Exception> R accept(ShellIRVisitor<R, X> visitor) throws X {
			return visitor.visitNoop(this);
		}

		@Override
		public String toString() {
			return "Noop";
		}
	}
}
