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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jash.util.JashLogger;
import org.slf4j.Logger;

/**
 * Constant folding over the shell IR.
 * <p>
 * Folds arithmetic and comparisons between literal numbers, joins adjacent
 * literal parts of a concatenation, simplifies boolean operators with a
 * literal operand, and keeps only the taken branch of an <code>if</code> whose
 * condition is a literal. Nothing that reads a variable, an argument or the
 * output of a command is ever folded, and the evaluation of a non-constant
 * operand is never dropped.
 * <p>
 * Folding never changes what the script prints. Divisions by zero and results
 * beyond the range of shell arithmetic are left for the shell to report.
 */
public class IrOptimizer implements ShellIRVisitor<ShellIR, RuntimeException>, ShellValueVisitor<ShellValue, RuntimeException> {

	private static final Logger LOG = JashLogger.getLogger(IrOptimizer.class);

	private static final java.util.regex.Pattern INTEGER = java.util.regex.Pattern.compile("-?[0-9]{1,18}");

	private static final BigInteger MIN = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger MAX = BigInteger.valueOf(Long.MAX_VALUE);

	private int folded;

	/**
	 * @param ir the IR to optimize
	 * @return an equivalent IR, possibly the same instance
	 */
	public ShellIR optimize(ShellIR ir) {
		folded = 0;
		ShellIR result = ir.accept(this);
		LOG.debug("Constant folding simplified {} node(s)", folded);
		return result;
	}

	private ShellValue fold(ShellValue value) {
		return value.accept(this);
	}

	private List<ShellValue> fold(List<ShellValue> values) {
		List<ShellValue> result = new ArrayList<ShellValue>(values.size());
		for (ShellValue value : values) {
			result.add(fold(value));
		}
		return result;
	}

	// IR nodes

	@Override
	public ShellIR visitLet(ShellIR.Let node) {
		return new ShellIR.Let(node.getName(), fold(node.getValue()));
	}

	@Override
	public ShellIR visitExec(ShellIR.Exec node) {
		return new ShellIR.Exec(node.getCommand(), fold(node.getArgs()), node.effects());
	}

	@Override
	public ShellIR visitIf(ShellIR.If node) {
		ShellValue condition = fold(node.getCondition());
		if (condition instanceof ShellValue.Bool) {
			folded++;
			if (((ShellValue.Bool) condition).getValue()) {
				return node.getThenBranch().accept(this);
			}
			return node.getElseBranch() == null ? new ShellIR.Noop() : node.getElseBranch().accept(this);
		}
		ShellIR elseBranch = node.getElseBranch() == null ? null : node.getElseBranch().accept(this);
		return new ShellIR.If(condition, node.getThenBranch().accept(this), elseBranch);
	}

	@Override
	public ShellIR visitSequence(ShellIR.Sequence node) {
		List<ShellIR> nodes = new ArrayList<ShellIR>();
		for (ShellIR child : node.getNodes()) {
			ShellIR optimized = child.accept(this);
			if (!(optimized instanceof ShellIR.Noop)) {
				nodes.add(optimized);
			}
		}
		if (nodes.isEmpty()) {
			return new ShellIR.Noop();
		}
		return new ShellIR.Sequence(nodes);
	}

	@Override
	public ShellIR visitFunction(ShellIR.Function node) {
		return new ShellIR.Function(node.getName(), node.getParams(), node.getBody().accept(this));
	}

	@Override
	public ShellIR visitEcho(ShellIR.Echo node) {
		return new ShellIR.Echo(fold(node.getValue()), node.isNewline(), node.isStderr());
	}

	@Override
	public ShellIR visitFor(ShellIR.For node) {
		return new ShellIR.For(node.getVariable(), fold(node.getStart()), fold(node.getEnd()), node.getBody().accept(this));
	}

	@Override
	public ShellIR visitForIn(ShellIR.ForIn node) {
		return new ShellIR.ForIn(node.getVariable(), fold(node.getItems()), node.getBody().accept(this));
	}

	@Override
	public ShellIR visitWhile(ShellIR.While node) {
		ShellValue condition = fold(node.getCondition());
		if (condition instanceof ShellValue.Bool && !((ShellValue.Bool) condition).getValue()) {
			folded++;
			return new ShellIR.Noop();
		}
		return new ShellIR.While(condition, node.getBody().accept(this), node.getMaxIterations());
	}

	@Override
	public ShellIR visitBreak(ShellIR.Break node) {
		return node;
	}

	@Override
	public ShellIR visitContinue(ShellIR.Continue node) {
		return node;
	}

	@Override
	public ShellIR visitCase(ShellIR.Case node) {
		List<CaseArm> arms = new ArrayList<CaseArm>();
		for (CaseArm arm : node.getArms()) {
			arms.add(new CaseArm(arm.getPattern(), arm.getBody().accept(this)));
		}
		return new ShellIR.Case(fold(node.getScrutinee()), arms);
	}

	@Override
	public ShellIR visitReturn(ShellIR.Return node) {
		return node.getValue() == null ? node : new ShellIR.Return(fold(node.getValue()));
	}

	@Override
	public ShellIR visitExit(ShellIR.Exit node) {
		return new ShellIR.Exit(fold(node.getCode()));
	}

	@Override
	public ShellIR visitNoop(ShellIR.Noop node) {
		return node;
	}

	// values

	@Override
	public ShellValue visitString(ShellValue.Str value) {
		return value;
	}

	@Override
	public ShellValue visitBool(ShellValue.Bool value) {
		return value;
	}

	@Override
	public ShellValue visitVariable(ShellValue.Variable value) {
		return value;
	}

	@Override
	public ShellValue visitCommandSubst(ShellValue.CommandSubst value) {
		return new ShellValue.CommandSubst(value.getCommand().accept(this));
	}

	@Override
	public ShellValue visitConcat(ShellValue.Concat value) {
		List<ShellValue> parts = new ArrayList<ShellValue>();
		StringBuilder pending = null;
		for (ShellValue part : flatten(fold(value.getParts()))) {
			String text = constantText(part);
			if (text != null) {
				pending = pending == null ? new StringBuilder() : pending;
				pending.append(text);
			} else {
				if (pending != null) {
					parts.add(new ShellValue.Str(pending.toString()));
					pending = null;
				}
				parts.add(part);
			}
		}
		if (pending != null) {
			parts.add(new ShellValue.Str(pending.toString()));
		}
		if (parts.size() < value.getParts().size()) {
			folded++;
		}
		if (parts.isEmpty()) {
			return new ShellValue.Str("");
		}
		return parts.size() == 1 ? parts.get(0) : new ShellValue.Concat(parts);
	}

	private List<ShellValue> flatten(List<ShellValue> parts) {
		List<ShellValue> flat = new ArrayList<ShellValue>();
		for (ShellValue part : parts) {
			if (part instanceof ShellValue.Concat) {
				flat.addAll(((ShellValue.Concat) part).getParts());
			} else {
				flat.add(part);
			}
		}
		return flat;
	}

	@Override
	public ShellValue visitComparison(ShellValue.Comparison value) {
		ShellValue left = fold(value.getLeft());
		ShellValue right = fold(value.getRight());
		String leftText = constantText(left);
		String rightText = constantText(right);
		if (leftText != null && rightText != null) {
			Boolean result = compare(value.getOp(), leftText, rightText);
			if (result != null) {
				folded++;
				return new ShellValue.Bool(result.booleanValue());
			}
		}
		return new ShellValue.Comparison(value.getOp(), left, right);
	}

	/**
	 * @return the result of the comparison, or <code>null</code> when a
	 *         numeric comparison has an operand that is not a number
	 */
	private static Boolean compare(ComparisonOp op, String left, String right) {
		switch (op) {
		case STR_EQ:
			return Boolean.valueOf(left.equals(right));
		case STR_NE:
			return Boolean.valueOf(!left.equals(right));
		case NUM_EQ:
		case NUM_NE:
		case NUM_LT:
		case NUM_LE:
		case NUM_GT:
		case NUM_GE:
			if (!INTEGER.matcher(left).matches() || !INTEGER.matcher(right).matches()) {
				return null;
			}
			return Boolean.valueOf(numericComparison(op, Long.compare(Long.parseLong(left), Long.parseLong(right))));
		}
		throw new IllegalStateException("Unknown comparison: " + op);
	}

	private static boolean numericComparison(ComparisonOp op, int comparison) {
		switch (op) {
		case NUM_EQ:
			return comparison == 0;
		case NUM_NE:
			return comparison != 0;
		case NUM_LT:
			return comparison < 0;
		case NUM_LE:
			return comparison <= 0;
		case NUM_GT:
			return comparison > 0;
		case NUM_GE:
			return comparison >= 0;
		case STR_EQ:
		case STR_NE:
			throw new IllegalStateException("Not a numeric comparison: " + op);
		}
		throw new IllegalStateException("Unknown comparison: " + op);
	}

	@Override
	public ShellValue visitArithmetic(ShellValue.Arithmetic value) {
		ShellValue left = fold(value.getLeft());
		ShellValue right = fold(value.getRight());
		if (isInteger(left) && isInteger(right)) {
			BigInteger result = compute(
					value.getOp(),
					new BigInteger(((ShellValue.Str) left).getValue()),
					new BigInteger(((ShellValue.Str) right).getValue()));
			if (result != null && result.compareTo(MIN) >= 0 && result.compareTo(MAX) <= 0) {
				folded++;
				return new ShellValue.Str(result.toString());
			}
		}
		return new ShellValue.Arithmetic(value.getOp(), left, right);
	}

	private static boolean isInteger(ShellValue value) {
		return value instanceof ShellValue.Str && INTEGER.matcher(((ShellValue.Str) value).getValue()).matches();
	}

	/**
	 * Shell arithmetic truncates divisions toward zero, and the remainder
	 * takes the sign of the dividend, like {@link BigInteger#divide} and
	 * {@link BigInteger#remainder}.
	 *
	 * @return the result, or <code>null</code> for a division by zero
	 */
	private static BigInteger compute(ArithmeticOp op, BigInteger left, BigInteger right) {
		switch (op) {
		case ADD:
			return left.add(right);
		case SUB:
			return left.subtract(right);
		case MUL:
			return left.multiply(right);
		case DIV:
			return right.signum() == 0 ? null : left.divide(right);
		case MOD:
			return right.signum() == 0 ? null : left.remainder(right);
		}
		throw new IllegalStateException("Unknown arithmetic operator: " + op);
	}

	@Override
	public ShellValue visitLogical(ShellValue.Logical value) {
		ShellValue left = fold(value.getLeft());
		ShellValue right = fold(value.getRight());
		boolean and = value.getOp() == LogicalOp.AND;
		if (left instanceof ShellValue.Bool) {
			folded++;
			boolean constant = ((ShellValue.Bool) left).getValue();
			if (and) {
				return constant ? right : left;
			}
			return constant ? left : right;
		}
		if (right instanceof ShellValue.Bool && ((ShellValue.Bool) right).getValue() == and) {
			// x && true, x || false
			folded++;
			return left;
		}
		return new ShellValue.Logical(value.getOp(), left, right);
	}

	@Override
	public ShellValue visitNot(ShellValue.Not value) {
		ShellValue operand = fold(value.getOperand());
		if (operand instanceof ShellValue.Bool) {
			folded++;
			return new ShellValue.Bool(!((ShellValue.Bool) operand).getValue());
		}
		if (operand instanceof ShellValue.Not) {
			folded++;
			return ((ShellValue.Not) operand).getOperand();
		}
		return new ShellValue.Not(operand);
	}

	@Override
	public ShellValue visitArg(ShellValue.Arg value) {
		return value;
	}

	@Override
	public ShellValue visitArgCount(ShellValue.ArgCount value) {
		return value;
	}

	@Override
	public ShellValue visitEnvVar(ShellValue.EnvVar value) {
		if (value.getDefaultValue() == null) {
			return value;
		}
		return new ShellValue.EnvVar(value.getName(), fold(value.getDefaultValue()));
	}

	@Override
	public ShellValue visitExitCode(ShellValue.ExitCode value) {
		return value;
	}

	/**
	 * @return the text of a literal string or boolean, <code>null</code> otherwise
	 */
	private static String constantText(ShellValue value) {
		if (value instanceof ShellValue.Str) {
			return ((ShellValue.Str) value).getValue();
		} else if (value instanceof ShellValue.Bool) {
			return ((ShellValue.Bool) value).getValue() ? "true" : "false";
		}
		return null;
	}
}
