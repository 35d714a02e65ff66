package org.metricshub.jash.backend;

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

import java.util.List;
import java.util.regex.Pattern;
import org.metricshub.jash.intermediate.CaseArm;
import org.metricshub.jash.intermediate.CommandEffects;
import org.metricshub.jash.intermediate.LogicalOp;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.intermediate.ShellIRVisitor;
import org.metricshub.jash.intermediate.ShellValue;
import org.metricshub.jash.intermediate.ShellValueVisitor;
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.validation.IdentifierRules;
import org.slf4j.Logger;

/**
 * Renders the shell IR as POSIX shell text.
 * <p>
 * The script starts with the shebang of the {@link TargetDialect} and a safety
 * preamble: <code>set -euf</code> (<code>set -uf</code> without strict mode),
 * a fixed <code>IFS</code> and <code>LC_ALL=C</code>. Function definitions
 * follow, then the invocation of the entry point.
 * <p>
 * Every value that is not a constant is double-quoted. Constants are written
 * bare when they hold no character the shell would interpret, single-quoted
 * otherwise. An empty body is written as <code>:</code>.
 * <p>
 * The output depends on nothing but the IR: the same IR always gives the same
 * text, byte for byte. An instance must not be shared between threads.
 */
public class PosixEmitter implements ShellIRVisitor<Void, EmitException> {

	private static final Logger LOG = JashLogger.getLogger(PosixEmitter.class);

	private static final String INDENT = "    ";

	private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

	/**
	 * Defaults that can be written inside <code>${NAME:-...}</code> as they are
	 */
	private static final Pattern PLAIN_DEFAULT = Pattern.compile("[A-Za-z0-9_./:,+@% -]*");

	private static final String BOOL_CAPTURE_THEN = "; then printf '%s' true; else printf '%s' false; fi";

	private final TargetDialect dialect;
	private final boolean strictMode;

	private final WordRenderer words = new WordRenderer();
	private final DoubleQuotedRenderer doubleQuoted = new DoubleQuotedRenderer();
	private final ArithmeticRenderer arithmetic = new ArithmeticRenderer();
	private final ConditionRenderer conditions = new ConditionRenderer();

	private StringBuilder out;
	private int level;
	private int loops;

	/**
	 * Creates an emitter for POSIX sh in strict mode.
	 */
	public PosixEmitter() {
		this(TargetDialect.POSIX, true);
	}

	/**
	 * @param dialect target shell, which decides the shebang
	 * @param strictMode whether the script exits on the first failing command (<code>set -e</code>)
	 */
	public PosixEmitter(TargetDialect dialect, boolean strictMode) {
		this.dialect = dialect;
		this.strictMode = strictMode;
	}

	/**
	 * Renders the specified IR as a complete script.
	 *
	 * @param ir the IR of the program
	 * @return the text of the script
	 * @throws EmitException if a node has no rendering
	 */
	public String emit(ShellIR ir) throws EmitException {
		out = new StringBuilder();
		level = 0;
		loops = 0;
		preamble();
		ir.accept(this);
		LOG.debug("Emitted {} characters for {}", out.length(), dialect);
		return out.toString();
	}

	private void preamble() {
		line(dialect.getShebang());
		line("# Generated by Jash. Do not edit.");
		line(strictMode ? "set -euf" : "set -uf");
		out.append("IFS=' \t\n'\n");
		line("export LC_ALL=C");
		out.append('\n');
	}

	private void line(String text) {
		for (int i = 0; i < level; i++) {
			out.append(INDENT);
		}
		out.append(text).append('\n');
	}

	private void body(ShellIR node) throws EmitException {
		level++;
		node.accept(this);
		level--;
	}

	private static String name(String name, String what) throws EmitException {
		if (!ShellQuoting.isShellName(name)) {
			throw new EmitException("Invalid " + what + " name: " + name, name);
		}
		return name;
	}

	private static String generated(String purpose, int number) {
		return IdentifierRules.GENERATED_PREFIX + purpose + number;
	}

	String word(ShellValue value) throws EmitException {
		return value.accept(words);
	}

	String condition(ShellValue value) throws EmitException {
		return value.accept(conditions);
	}

	private String command(ShellIR.Exec exec) throws EmitException {
		String command = exec.getCommand();
		if (!CommandEffects.isAllowed(command)) {
			name(command, "command");
		}
		StringBuilder text = new StringBuilder(command);
		for (ShellValue arg : exec.getArgs()) {
			text.append(' ').append(word(arg));
		}
		return text.toString();
	}

	private String inlineCommand(ShellIR node) throws EmitException {
		if (node instanceof ShellIR.Exec) {
			return command((ShellIR.Exec) node);
		}
		throw new EmitException("A command substitution must hold a single command", node.toString());
	}

	private String boolCapture(ShellValue value) throws EmitException {
		return "$(if " + condition(value) + BOOL_CAPTURE_THEN + ")";
	}

	private static String positional(int position, boolean braces) {
		return braces || position > 9 ? "${" + position + "}" : "$" + position;
	}

	// nodes

	@Override
	public Void visitLet(ShellIR.Let node) throws EmitException {
		line(name(node.getName(), "variable") + "=" + word(node.getValue()));
		return null;
	}

	@Override
	public Void visitExec(ShellIR.Exec node) throws EmitException {
		line(command(node));
		return null;
	}

	@Override
	public Void visitIf(ShellIR.If node) throws EmitException {
		line("if " + condition(node.getCondition()) + "; then");
		body(node.getThenBranch());
		ShellIR elseBranch = node.getElseBranch();
		while (elseBranch instanceof ShellIR.If) {
			ShellIR.If elif = (ShellIR.If) elseBranch;
			line("elif " + condition(elif.getCondition()) + "; then");
			body(elif.getThenBranch());
			elseBranch = elif.getElseBranch();
		}
		if (elseBranch != null) {
			line("else");
			body(elseBranch);
		}
		line("fi");
		return null;
	}

	@Override
	public Void visitSequence(ShellIR.Sequence node) throws EmitException {
		List<ShellIR> nodes = node.getNodes();
		if (nodes.isEmpty()) {
			line(":");
			return null;
		}
		for (ShellIR child : nodes) {
			child.accept(this);
			if (level == 0 && child instanceof ShellIR.Function) {
				out.append('\n');
			}
		}
		return null;
	}

	@Override
	public Void visitFunction(ShellIR.Function node) throws EmitException {
		line(name(node.getName(), "function") + "() {");
		level++;
		int position = 1;
		for (String param : node.getParams()) {
			line(name(param, "parameter") + "=\"" + positional(position++, false) + "\"");
		}
		node.getBody().accept(this);
		level--;
		line("}");
		return null;
	}

	@Override
	public Void visitEcho(ShellIR.Echo node) throws EmitException {
		String format = node.isNewline() ? "'%s\\n'" : "'%s'";
		line("printf " + format + " " + word(node.getValue()) + (node.isStderr() ? " >&2" : ""));
		return null;
	}

	/**
	 * A counting loop is a <code>while</code> over a generated counter, which
	 * is advanced before the body so that <code>continue</code> works.
	 */
	@Override
	public Void visitFor(ShellIR.For node) throws EmitException {
		int number = loops++;
		String counter = generated("loop", number);
		String end = generated("end", number);
		line(counter + "=" + word(node.getStart()));
		line(end + "=" + word(node.getEnd()));
		line("while [ \"$" + counter + "\" -le \"$" + end + "\" ]; do");
		level++;
		line(name(node.getVariable(), "variable") + "=\"$" + counter + "\"");
		line(counter + "=$((" + counter + " + 1))");
		node.getBody().accept(this);
		level--;
		line("done");
		return null;
	}

	@Override
	public Void visitForIn(ShellIR.ForIn node) throws EmitException {
		StringBuilder items = new StringBuilder();
		for (ShellValue item : node.getItems()) {
			items.append(' ').append(word(item));
		}
		line("for " + name(node.getVariable(), "variable") + " in" + items + "; do");
		body(node.getBody());
		line("done");
		return null;
	}

	/**
	 * With an iteration bound, a guard counts the iterations and aborts the
	 * script when the bound is exceeded.
	 */
	@Override
	public Void visitWhile(ShellIR.While node) throws EmitException {
		Long max = node.getMaxIterations();
		String guard = null;
		if (max != null) {
			guard = generated("guard", loops++);
			line(guard + "=0");
		}
		line("while " + condition(node.getCondition()) + "; do");
		level++;
		if (guard != null) {
			line(guard + "=$((" + guard + " + 1))");
			line("if [ \"$" + guard + "\" -gt " + max + " ]; then");
			level++;
			line("printf '%s\\n' " + ShellQuoting.singleQuote("jash: loop exceeded " + max + " iterations") + " >&2");
			line("exit 1");
			level--;
			line("fi");
		}
		node.getBody().accept(this);
		level--;
		line("done");
		return null;
	}

	@Override
	public Void visitBreak(ShellIR.Break node) {
		line("break");
		return null;
	}

	@Override
	public Void visitContinue(ShellIR.Continue node) {
		line("continue");
		return null;
	}

	@Override
	public Void visitCase(ShellIR.Case node) throws EmitException {
		line("case " + word(node.getScrutinee()) + " in");
		level++;
		for (CaseArm arm : node.getArms()) {
			String pattern = arm.getPattern().isWildcard() ? "*" : ShellQuoting.literalWord(arm.getPattern().getLiteral());
			line(pattern + ")");
			level++;
			arm.getBody().accept(this);
			line(";;");
			level--;
		}
		level--;
		line("esac");
		return null;
	}

	@Override
	public Void visitReturn(ShellIR.Return node) throws EmitException {
		if (node.getValue() != null) {
			line("printf '%s\\n' " + word(node.getValue()));
		}
		line("return 0");
		return null;
	}

	@Override
	public Void visitExit(ShellIR.Exit node) throws EmitException {
		line("exit " + word(node.getCode()));
		return null;
	}

	@Override
	public Void visitNoop(ShellIR.Noop node) {
		line(":");
		return null;
	}

	/**
	 * A value as one complete word: quoted unless it is a safe constant
	 */
	private final class WordRenderer implements ShellValueVisitor<String, EmitException> {

		@Override
		public String visitString(ShellValue.Str value) {
			return ShellQuoting.literalWord(value.getValue());
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return value.getValue() ? "true" : "false";
		}

		@Override
		public String visitVariable(ShellValue.Variable value) throws EmitException {
			return "\"$" + name(value.getName(), "variable") + "\"";
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) throws EmitException {
			return "\"$(" + inlineCommand(value.getCommand()) + ")\"";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) throws EmitException {
			if (value.isConstant()) {
				StringBuilder text = new StringBuilder();
				for (ShellValue part : value.getParts()) {
					text.append(part.accept(doubleQuoted.constantText));
				}
				return ShellQuoting.literalWord(text.toString());
			}
			return "\"" + value.accept(doubleQuoted) + "\"";
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) throws EmitException {
			return "\"" + boolCapture(value) + "\"";
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) throws EmitException {
			return "\"$((" + arithmetic.expression(value) + "))\"";
		}

		@Override
		public String visitLogical(ShellValue.Logical value) throws EmitException {
			return "\"" + boolCapture(value) + "\"";
		}

		@Override
		public String visitNot(ShellValue.Not value) throws EmitException {
			return "\"" + boolCapture(value) + "\"";
		}

		@Override
		public String visitArg(ShellValue.Arg value) {
			if (value.getPosition() == null) {
				return "\"$@\"";
			}
			return "\"" + positional(value.getPosition().intValue(), false) + "\"";
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "\"$#\"";
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) throws EmitException {
			return "\"" + value.accept(doubleQuoted) + "\"";
		}

		@Override
		public String visitExitCode(ShellValue.ExitCode value) {
			return "\"$?\"";
		}
	}

	/**
	 * A value as the content of a double-quoted word
	 */
	private final class DoubleQuotedRenderer implements ShellValueVisitor<String, EmitException> {

		/**
		 * Raw text of the constant parts of a concatenation
		 */
		private final ShellValueVisitor<String, EmitException> constantText = new ConstantText();

		@Override
		public String visitString(ShellValue.Str value) {
			return ShellQuoting.escapeDoubleQuoted(value.getValue());
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return value.getValue() ? "true" : "false";
		}

		@Override
		public String visitVariable(ShellValue.Variable value) throws EmitException {
			return "${" + name(value.getName(), "variable") + "}";
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) throws EmitException {
			return "$(" + inlineCommand(value.getCommand()) + ")";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) throws EmitException {
			StringBuilder text = new StringBuilder();
			for (ShellValue part : value.getParts()) {
				text.append(part.accept(this));
			}
			return text.toString();
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) throws EmitException {
			return boolCapture(value);
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) throws EmitException {
			return "$((" + arithmetic.expression(value) + "))";
		}

		@Override
		public String visitLogical(ShellValue.Logical value) throws EmitException {
			return boolCapture(value);
		}

		@Override
		public String visitNot(ShellValue.Not value) throws EmitException {
			return boolCapture(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) throws EmitException {
			if (value.getPosition() == null) {
				throw new EmitException("All the arguments cannot be part of a string", value.toString());
			}
			return positional(value.getPosition().intValue(), true);
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "$#";
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) throws EmitException {
			String name = name(value.getName(), "environment variable");
			ShellValue defaultValue = value.getDefaultValue();
			if (defaultValue == null) {
				return "${" + name + "}";
			}
			if (defaultValue instanceof ShellValue.Str && PLAIN_DEFAULT.matcher(((ShellValue.Str) defaultValue).getValue()).matches()) {
				return "${" + name + ":-" + ((ShellValue.Str) defaultValue).getValue() + "}";
			}
			return "$(if [ -n \"${" + name + ":-}\" ]; then printf '%s' \"${" + name + "}\"; else printf '%s' " + word(defaultValue) + "; fi)";
		}

		@Override
		public String visitExitCode(ShellValue.ExitCode value) {
			return "$?";
		}
	}

	/**
	 * Text of a constant value, before any quoting
	 */
	private static final class ConstantText implements ShellValueVisitor<String, EmitException> {

		@Override
		public String visitString(ShellValue.Str value) {
			return value.getValue();
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return value.getValue() ? "true" : "false";
		}

		@Override
		public String visitVariable(ShellValue.Variable value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitConcat(ShellValue.Concat value) throws EmitException {
			StringBuilder text = new StringBuilder();
			for (ShellValue part : value.getParts()) {
				text.append(part.accept(this));
			}
			return text.toString();
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitLogical(ShellValue.Logical value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitNot(ShellValue.Not value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) throws EmitException {
			throw notConstant(value);
		}

		@Override
		public String visitExitCode(ShellValue.ExitCode value) throws EmitException {
			throw notConstant(value);
		}

		private EmitException notConstant(ShellValue value) {
			return new EmitException("Not a constant: " + value, value.toString());
		}
	}

	/**
	 * A value as an operand between <code>$((</code> and <code>))</code>.
	 * Nested operations are parenthesized.
	 */
	private final class ArithmeticRenderer implements ShellValueVisitor<String, EmitException> {

		String expression(ShellValue.Arithmetic value) throws EmitException {
			return value.getLeft().accept(this) + " " + value.getOp().getSymbol() + " " + value.getRight().accept(this);
		}

		private EmitException notArithmetic(ShellValue value) {
			return new EmitException("Value cannot be used in arithmetic: " + value, value.toString());
		}

		@Override
		public String visitString(ShellValue.Str value) throws EmitException {
			String text = value.getValue();
			if (!INTEGER.matcher(text).matches()) {
				throw notArithmetic(value);
			}
			return text.startsWith("-") ? "(" + text + ")" : text;
		}

		@Override
		public String visitBool(ShellValue.Bool value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitVariable(ShellValue.Variable value) throws EmitException {
			return name(value.getName(), "variable");
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) throws EmitException {
			return "$(" + inlineCommand(value.getCommand()) + ")";
		}

		@Override
		public String visitConcat(ShellValue.Concat value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) throws EmitException {
			return "(" + expression(value) + ")";
		}

		@Override
		public String visitLogical(ShellValue.Logical value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitNot(ShellValue.Not value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitArg(ShellValue.Arg value) throws EmitException {
			if (value.getPosition() == null) {
				throw notArithmetic(value);
			}
			return positional(value.getPosition().intValue(), false);
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) {
			return "$#";
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) throws EmitException {
			throw notArithmetic(value);
		}

		@Override
		public String visitExitCode(ShellValue.ExitCode value) {
			return "$?";
		}
	}

	/**
	 * A boolean value as the condition of <code>if</code> or <code>while</code>.
	 * A value that is not a test compares its text to <code>true</code>.
	 */
	private final class ConditionRenderer implements ShellValueVisitor<String, EmitException> {

		private String isTrue(ShellValue value) throws EmitException {
			return "[ " + word(value) + " = true ]";
		}

		@Override
		public String visitString(ShellValue.Str value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitBool(ShellValue.Bool value) {
			return value.getValue() ? "true" : "false";
		}

		@Override
		public String visitVariable(ShellValue.Variable value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitCommandSubst(ShellValue.CommandSubst value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitConcat(ShellValue.Concat value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitComparison(ShellValue.Comparison value) throws EmitException {
			return "[ " + word(value.getLeft()) + " " + value.getOp().getTestOperator() + " " + word(value.getRight()) + " ]";
		}

		@Override
		public String visitArithmetic(ShellValue.Arithmetic value) throws EmitException {
			return isTrue(value);
		}

		/**
		 * <code>&amp;&amp;</code> and <code>||</code> have the same precedence
		 * in the shell, so an operand mixing the other operator is grouped.
		 */
		@Override
		public String visitLogical(ShellValue.Logical value) throws EmitException {
			String operator = value.getOp() == LogicalOp.AND ? " && " : " || ";
			return operand(value.getLeft(), value.getOp()) + operator + operand(value.getRight(), value.getOp());
		}

		private String operand(ShellValue operand, LogicalOp parent) throws EmitException {
			String text = operand.accept(this);
			if (operand instanceof ShellValue.Logical && ((ShellValue.Logical) operand).getOp() != parent) {
				return "{ " + text + "; }";
			}
			return text;
		}

		@Override
		public String visitNot(ShellValue.Not value) throws EmitException {
			ShellValue operand = value.getOperand();
			String text = operand.accept(this);
			if (operand instanceof ShellValue.Logical || operand instanceof ShellValue.Not) {
				return "! { " + text + "; }";
			}
			return "! " + text;
		}

		@Override
		public String visitArg(ShellValue.Arg value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitArgCount(ShellValue.ArgCount value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitEnvVar(ShellValue.EnvVar value) throws EmitException {
			return isTrue(value);
		}

		@Override
		public String visitExitCode(ShellValue.ExitCode value) throws EmitException {
			return isTrue(value);
		}
	}
}
