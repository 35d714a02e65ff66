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
 * A value in the shell IR: the leaves that the emitter turns into words of
 * the generated script.
 * <p>
 * Values are immutable. {@link #isConstant()} holds only for values made of
 * literals; anything that reads a variable, an argument, the environment or
 * the output of a command is not constant and must be quoted when emitted.
 */
public abstract class ShellValue {

	private ShellValue() {}

	public abstract <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X;

	/**
	 * @return whether this value is known at compile time
	 */
	public abstract boolean isConstant();

	/**
	 * @return side effects of computing this value
	 */
	public abstract EffectSet effects();

	private static EffectSet union(List<ShellValue> values) {
		EffectSet effects = EffectSet.pure();
		for (ShellValue value : values) {
			effects = effects.union(value.effects());
		}
		return effects;
	}

	/**
	 * A literal string. Numbers are strings too.
	 */
	public static final class Str extends ShellValue {
		private final String value;

		public Str(String value) {
			this.value = Objects.requireNonNull(value);
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitString(this);
		}

		@Override
		public boolean isConstant() {
			return true;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "Str(" + value + ")";
		}
	}

	/**
	 * <code>true</code> or <code>false</code>.
	 */
	public static final class Bool extends ShellValue {
		private final boolean value;

		public Bool(boolean value) {
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitBool(this);
		}

		@Override
		public boolean isConstant() {
			return true;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "Bool(" + value + ")";
		}
	}

	/**
	 * Value of a shell variable.
	 */
	public static final class Variable extends ShellValue {
		private final String name;

		public Variable(String name) {
			this.name = Objects.requireNonNull(name);
		}

		public String getName() {
			return name;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitVariable(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "Variable(" + name + ")";
		}
	}

	/**
	 * Output of a command, <code>$( ... )</code>. This is how a function
	 * returns a value to its caller.
	 */
	public static final class CommandSubst extends ShellValue {
		private final ShellIR command;

		public CommandSubst(ShellIR command) {
			this.command = Objects.requireNonNull(command);
		}

		public ShellIR getCommand() {
			return command;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitCommandSubst(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return command.effects();
		}

		@Override
		public String toString() {
			return "CommandSubst(" + command + ")";
		}
	}

	/**
	 * Parts joined into one word.
	 */
	public static final class Concat extends ShellValue {
		private final List<ShellValue> parts;

		public Concat(List<ShellValue> parts) {
			this.parts = Collections.unmodifiableList(new ArrayList<ShellValue>(parts));
		}

		public List<ShellValue> getParts() {
			return parts;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitConcat(this);
		}

		@Override
		public boolean isConstant() {
			for (ShellValue part : parts) {
				if (!part.isConstant()) {
					return false;
				}
			}
			return true;
		}

		@Override
		public EffectSet effects() {
			return union(parts);
		}

		@Override
		public String toString() {
			return "Concat" + parts.toString().replace('[', '(').replace(']', ')');
		}
	}

	/**
	 * A <code>test</code> comparison, which is a boolean.
	 */
	public static final class Comparison extends ShellValue {
		private final ComparisonOp op;
		private final ShellValue left;
		private final ShellValue right;

		public Comparison(ComparisonOp op, ShellValue left, ShellValue right) {
			this.op = Objects.requireNonNull(op);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		public ComparisonOp getOp() {
			return op;
		}

		public ShellValue getLeft() {
			return left;
		}

		public ShellValue getRight() {
			return right;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitComparison(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return left.effects().union(right.effects());
		}

		@Override
		public String toString() {
			return "Comparison(" + op + ", " + left + ", " + right + ")";
		}
	}

	/**
	 * An arithmetic expansion, <code>$(( ... ))</code>.
	 */
	public static final class Arithmetic extends ShellValue {
		private final ArithmeticOp op;
		private final ShellValue left;
		private final ShellValue right;

		public Arithmetic(ArithmeticOp op, ShellValue left, ShellValue right) {
			this.op = Objects.requireNonNull(op);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		public ArithmeticOp getOp() {
			return op;
		}

		public ShellValue getLeft() {
			return left;
		}

		public ShellValue getRight() {
			return right;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitArithmetic(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return left.effects().union(right.effects());
		}

		@Override
		public String toString() {
			return "Arithmetic(" + op + ", " + left + ", " + right + ")";
		}
	}

	/**
	 * Two conditions joined by <code>&amp;&amp;</code> or <code>||</code>.
	 */
	public static final class Logical extends ShellValue {
		private final LogicalOp op;
		private final ShellValue left;
		private final ShellValue right;

		public Logical(LogicalOp op, ShellValue left, ShellValue right) {
			this.op = Objects.requireNonNull(op);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		public LogicalOp getOp() {
			return op;
		}

		public ShellValue getLeft() {
			return left;
		}

		public ShellValue getRight() {
			return right;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitLogical(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return left.effects().union(right.effects());
		}

		@Override
		public String toString() {
			return "Logical(" + op + ", " + left + ", " + right + ")";
		}
	}

	/**
	 * Negation of a condition.
	 */
	public static final class Not extends ShellValue {
		private final ShellValue operand;

		public Not(ShellValue operand) {
			this.operand = Objects.requireNonNull(operand);
		}

		public ShellValue getOperand() {
			return operand;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitNot(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return operand.effects();
		}

		@Override
		public String toString() {
			return "Not(" + operand + ")";
		}
	}

	/**
	 * A positional argument of the script, or all of them.
	 */
	public static final class Arg extends ShellValue {
		private final Integer position;

		/**
		 * @param position position, starting at 1; <code>null</code> for all the arguments
		 */
		public Arg(Integer position) {
			if (position != null && position.intValue() < 1) {
				throw new IllegalArgumentException("Argument position must be >= 1: " + position);
			}
			this.position = position;
		}

		/**
		 * @return the position, or <code>null</code> for all the arguments
		 */
		public Integer getPosition() {
			return position;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitArg(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "Arg(" + (position == null ? "*" : position.toString()) + ")";
		}
	}

	/**
	 * Number of arguments of the script.
	 */
	public static final class ArgCount extends ShellValue {

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitArgCount(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "ArgCount";
		}
	}

	/**
	 * Value of an environment variable, with an optional default used when
	 * the variable is unset or empty.
	 */
	public static final class EnvVar extends ShellValue {
		private final String name;
		private final ShellValue defaultValue;

		public EnvVar(String name, ShellValue defaultValue) {
			this.name = Objects.requireNonNull(name);
			this.defaultValue = defaultValue;
		}

		public String getName() {
			return name;
		}

		/**
		 * @return the default value, or <code>null</code>
		 */
		public ShellValue getDefaultValue() {
			return defaultValue;
		}

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitEnvVar(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			EffectSet read = EffectSet.of(Effect.ENV_READ);
			return defaultValue == null ? read : read.union(defaultValue.effects());
		}

		@Override
		public String toString() {
			return "EnvVar(" + name + (defaultValue == null ? "" : ", " + defaultValue) + ")";
		}
	}

	/**
	 * Exit status of the last command.
	 */
	public static final class ExitCode extends ShellValue {

		@Override
		public <R, X extends Exception> R accept(ShellValueVisitor<R, X> visitor) throws X {
			return visitor.visitExitCode(this);
		}

		@Override
		public boolean isConstant() {
			return false;
		}

		@Override
		public EffectSet effects() {
			return EffectSet.pure();
		}

		@Override
		public String toString() {
			return "ExitCode";
		}
	}
}
