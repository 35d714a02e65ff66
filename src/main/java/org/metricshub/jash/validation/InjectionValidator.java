package org.metricshub.jash.validation;

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
import org.metricshub.jash.frontend.ast.Expr;
import org.metricshub.jash.frontend.ast.ExprVisitor;
import org.metricshub.jash.frontend.ast.Function;
import org.metricshub.jash.frontend.ast.Literal;
import org.metricshub.jash.frontend.ast.MatchArm;
import org.metricshub.jash.frontend.ast.Pattern;
import org.metricshub.jash.frontend.ast.PatternVisitor;
import org.metricshub.jash.frontend.ast.RestrictedAst;
import org.metricshub.jash.frontend.ast.Stmt;
import org.metricshub.jash.frontend.ast.StmtVisitor;
import org.metricshub.jash.intermediate.CaseArm;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.intermediate.ShellIRVisitor;
import org.metricshub.jash.intermediate.ShellValue;
import org.metricshub.jash.intermediate.ShellValueVisitor;
import org.metricshub.jash.util.JashLogger;
import org.slf4j.Logger;

/**
 * Scans string literals for the shell injection vectors of
 * {@link InjectionPattern}.
 * <p>
 * The syntax tree is scanned before lowering: every string literal of an
 * expression, and every literal pattern of a match arm. The shell IR is
 * scanned again before emission, with the constant parts of each
 * concatenation joined, so that a vector split over several literals
 * (<code>"$" + "(reboot)"</code>) is caught as well.
 */
public class InjectionValidator {

	private static final Logger LOG = JashLogger.getLogger(InjectionValidator.class);

	private final ValidationLevel level;

	/**
	 * Creates a validator for the {@link ValidationLevel#STRICT} level.
	 */
	public InjectionValidator() {
		this(ValidationLevel.STRICT);
	}

	public InjectionValidator(ValidationLevel level) {
		this.level = level;
	}

	/**
	 * Checks a string literal.
	 *
	 * @param literal text of the literal
	 * @throws InjectionException if the literal contains an injection vector
	 */
	public void checkLiteral(String literal) throws InjectionException {
		check(literal, false, -1);
	}

	/**
	 * Checks the literal of a match pattern, which also rejects glob
	 * characters.
	 *
	 * @param literal text of the pattern
	 * @throws InjectionException if the literal contains an injection vector
	 */
	public void checkPatternLiteral(String literal) throws InjectionException {
		check(literal, true, -1);
	}

	private void check(String literal, boolean matchPattern, int lineNumber) throws InjectionException {
		InjectionPattern pattern = InjectionPattern.find(literal, level, matchPattern);
		if (pattern != null) {
			LOG.debug("Rejecting literal at line {}: {}", lineNumber, pattern);
			throw new InjectionException(pattern, literal, lineNumber);
		}
	}

	/**
	 * Scans every string literal of the specified syntax tree.
	 *
	 * @param ast a validated syntax tree
	 * @throws InjectionException at the first unsafe literal
	 */
	public void validate(RestrictedAst ast) throws InjectionException {
		if (level == ValidationLevel.NONE) {
			LOG.debug("Injection scanning disabled");
			return;
		}
		AstScanner scanner = new AstScanner();
		for (Function function : ast.getFunctions()) {
			scanner.scan(function.getBody());
		}
	}

	/**
	 * Scans every string of the specified IR.
	 *
	 * @param ir the IR about to be emitted
	 * @throws InjectionException at the first unsafe string
	 */
	public void validate(ShellIR ir) throws InjectionException {
		if (level == ValidationLevel.NONE) {
			return;
		}
		ir.accept(new IrScanner());
	}

	/**
	 * Walks statements, expressions and patterns of the syntax tree
	 */
	private final class AstScanner
			implements StmtVisitor<Void, InjectionException>, ExprVisitor<Void, InjectionException>, PatternVisitor<Void, InjectionException> {

		private int lineNumber = -1;

		void scan(List<Stmt> statements) throws InjectionException {
			for (Stmt stmt : statements) {
				lineNumber = stmt.getLineNumber();
				stmt.accept(this);
			}
		}

		private void scan(Expr expr) throws InjectionException {
			if (expr != null) {
				expr.accept(this);
			}
		}

		private void scanAll(List<Expr> exprs) throws InjectionException {
			for (Expr expr : exprs) {
				expr.accept(this);
			}
		}

		@Override
		public Void visitLet(Stmt.Let stmt) throws InjectionException {
			scan(stmt.getValue());
			return null;
		}

		@Override
		public Void visitIf(Stmt.If stmt) throws InjectionException {
			scan(stmt.getCondition());
			scan(stmt.getThenBlock());
			if (stmt.hasElse()) {
				scan(stmt.getElseBlock());
			}
			return null;
		}

		@Override
		public Void visitMatch(Stmt.Match stmt) throws InjectionException {
			scan(stmt.getScrutinee());
			for (MatchArm arm : stmt.getArms()) {
				lineNumber = stmt.getLineNumber();
				arm.getPattern().accept(this);
				scan(arm.getGuard());
				scan(arm.getBody());
			}
			return null;
		}

		@Override
		public Void visitFor(Stmt.For stmt) throws InjectionException {
			scan(stmt.getIterable());
			scan(stmt.getBody());
			return null;
		}

		@Override
		public Void visitWhile(Stmt.While stmt) throws InjectionException {
			scan(stmt.getCondition());
			scan(stmt.getBody());
			return null;
		}

		@Override
		public Void visitBreak(Stmt.Break stmt) {
			return null;
		}

		@Override
		public Void visitContinue(Stmt.Continue stmt) {
			return null;
		}

		@Override
		public Void visitReturn(Stmt.Return stmt) throws InjectionException {
			scan(stmt.getValue());
			return null;
		}

		@Override
		public Void visitExpr(Stmt.ExprStmt stmt) throws InjectionException {
			scan(stmt.getExpr());
			return null;
		}

		@Override
		public Void visitLiteral(Expr.LiteralExpr expr) throws InjectionException {
			Literal literal = expr.getLiteral();
			if (literal.getKind() == Literal.Kind.STR) {
				check(literal.getStringValue(), false, expr.getLineNumber());
			}
			return null;
		}

		@Override
		public Void visitVariable(Expr.Variable expr) {
			return null;
		}

		@Override
		public Void visitFunctionCall(Expr.FunctionCall expr) throws InjectionException {
			scanAll(expr.getArgs());
			return null;
		}

		@Override
		public Void visitBinary(Expr.Binary expr) throws InjectionException {
			scan(expr.getLeft());
			scan(expr.getRight());
			return null;
		}

		@Override
		public Void visitUnary(Expr.Unary expr) throws InjectionException {
			scan(expr.getOperand());
			return null;
		}

		@Override
		public Void visitMethodCall(Expr.MethodCall expr) throws InjectionException {
			scan(expr.getReceiver());
			scanAll(expr.getArgs());
			return null;
		}

		@Override
		public Void visitRange(Expr.Range expr) throws InjectionException {
			scan(expr.getStart());
			scan(expr.getEnd());
			return null;
		}

		@Override
		public Void visitArray(Expr.ArrayLiteral expr) throws InjectionException {
			scanAll(expr.getElements());
			return null;
		}

		@Override
		public Void visitIndex(Expr.Index expr) throws InjectionException {
			scan(expr.getObject());
			scan(expr.getIndex());
			return null;
		}

		@Override
		public Void visitTry(Expr.Try expr) throws InjectionException {
			scan(expr.getExpr());
			return null;
		}

		@Override
		public Void visitBlock(Expr.Block expr) throws InjectionException {
			int line = lineNumber;
			scan(expr.getStatements());
			lineNumber = line;
			return null;
		}

		@Override
		public Void visitLiteral(Pattern.LiteralPattern pattern) throws InjectionException {
			Literal literal = pattern.getLiteral();
			if (literal.getKind() == Literal.Kind.STR) {
				check(literal.getStringValue(), true, lineNumber);
			}
			return null;
		}

		@Override
		public Void visitVariable(Pattern.VariablePattern pattern) {
			return null;
		}

		@Override
		public Void visitWildcard(Pattern.Wildcard pattern) {
			return null;
		}

		@Override
		public Void visitTuple(Pattern.TuplePattern pattern) throws InjectionException {
			for (Pattern element : pattern.getElements()) {
				element.accept(this);
			}
			return null;
		}

		@Override
		public Void visitStruct(Pattern.StructPattern pattern) throws InjectionException {
			for (Pattern.Field field : pattern.getFields()) {
				field.getPattern().accept(this);
			}
			return null;
		}
	}

	/**
	 * Walks the IR. Line numbers are not known at this stage.
	 */
	private final class IrScanner implements ShellIRVisitor<Void, InjectionException>, ShellValueVisitor<Void, InjectionException> {

		private void scan(ShellValue value) throws InjectionException {
			if (value != null) {
				value.accept(this);
			}
		}

		private void scan(ShellIR node) throws InjectionException {
			if (node != null) {
				node.accept(this);
			}
		}

		private void scanAll(List<ShellValue> values) throws InjectionException {
			for (ShellValue value : values) {
				value.accept(this);
			}
		}

		@Override
		public Void visitLet(ShellIR.Let node) throws InjectionException {
			scan(node.getValue());
			return null;
		}

		@Override
		public Void visitExec(ShellIR.Exec node) throws InjectionException {
			scanAll(node.getArgs());
			return null;
		}

		@Override
		public Void visitIf(ShellIR.If node) throws InjectionException {
			scan(node.getCondition());
			scan(node.getThenBranch());
			scan(node.getElseBranch());
			return null;
		}

		@Override
		public Void visitSequence(ShellIR.Sequence node) throws InjectionException {
			for (ShellIR child : node.getNodes()) {
				child.accept(this);
			}
			return null;
		}

		@Override
		public Void visitFunction(ShellIR.Function node) throws InjectionException {
			scan(node.getBody());
			return null;
		}

		@Override
		public Void visitEcho(ShellIR.Echo node) throws InjectionException {
			scan(node.getValue());
			return null;
		}

		@Override
		public Void visitFor(ShellIR.For node) throws InjectionException {
			scan(node.getStart());
			scan(node.getEnd());
			scan(node.getBody());
			return null;
		}

		@Override
		public Void visitForIn(ShellIR.ForIn node) throws InjectionException {
			scanAll(node.getItems());
			scan(node.getBody());
			return null;
		}

		@Override
		public Void visitWhile(ShellIR.While node) throws InjectionException {
			scan(node.getCondition());
			scan(node.getBody());
			return null;
		}

		@Override
		public Void visitBreak(ShellIR.Break node) {
			return null;
		}

		@Override
		public Void visitContinue(ShellIR.Continue node) {
			return null;
		}

		@Override
		public Void visitCase(ShellIR.Case node) throws InjectionException {
			scan(node.getScrutinee());
			for (CaseArm arm : node.getArms()) {
				if (!arm.getPattern().isWildcard()) {
					check(arm.getPattern().getLiteral(), true, -1);
				}
				scan(arm.getBody());
			}
			return null;
		}

		@Override
		public Void visitReturn(ShellIR.Return node) throws InjectionException {
			scan(node.getValue());
			return null;
		}

		@Override
		public Void visitExit(ShellIR.Exit node) throws InjectionException {
			scan(node.getCode());
			return null;
		}

		@Override
		public Void visitNoop(ShellIR.Noop node) {
			return null;
		}

		@Override
		public Void visitString(ShellValue.Str value) throws InjectionException {
			check(value.getValue(), false, -1);
			return null;
		}

		@Override
		public Void visitBool(ShellValue.Bool value) {
			return null;
		}

		@Override
		public Void visitVariable(ShellValue.Variable value) {
			return null;
		}

		@Override
		public Void visitCommandSubst(ShellValue.CommandSubst value) throws InjectionException {
			scan(value.getCommand());
			return null;
		}

		@Override
		public Void visitConcat(ShellValue.Concat value) throws InjectionException {
			StringBuilder run = new StringBuilder();
			for (ShellValue part : value.getParts()) {
				if (part instanceof ShellValue.Str) {
					run.append(((ShellValue.Str) part).getValue());
				} else if (part instanceof ShellValue.Bool) {
					run.append(((ShellValue.Bool) part).getValue());
				} else {
					check(run.toString(), false, -1);
					run.setLength(0);
					part.accept(this);
				}
			}
			check(run.toString(), false, -1);
			return null;
		}

		@Override
		public Void visitComparison(ShellValue.Comparison value) throws InjectionException {
			scan(value.getLeft());
			scan(value.getRight());
			return null;
		}

		@Override
		public Void visitArithmetic(ShellValue.Arithmetic value) throws InjectionException {
			scan(value.getLeft());
			scan(value.getRight());
			return null;
		}

		@Override
		public Void visitLogical(ShellValue.Logical value) throws InjectionException {
			scan(value.getLeft());
			scan(value.getRight());
			return null;
		}

		@Override
		public Void visitNot(ShellValue.Not value) throws InjectionException {
			scan(value.getOperand());
			return null;
		}

		@Override
		public Void visitArg(ShellValue.Arg value) {
			return null;
		}

		@Override
		public Void visitArgCount(ShellValue.ArgCount value) {
			return null;
		}

		@Override
		public Void visitEnvVar(ShellValue.EnvVar value) throws InjectionException {
			scan(value.getDefaultValue());
			return null;
		}

		@Override
		public Void visitExitCode(ShellValue.ExitCode value) {
			return null;
		}
	}
}
