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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jash.frontend.ast.Expr;
import org.metricshub.jash.frontend.ast.ExprVisitor;
import org.metricshub.jash.frontend.ast.Function;
import org.metricshub.jash.frontend.ast.Literal;
import org.metricshub.jash.frontend.ast.MatchArm;
import org.metricshub.jash.frontend.ast.Parameter;
import org.metricshub.jash.frontend.ast.Pattern;
import org.metricshub.jash.frontend.ast.PatternVisitor;
import org.metricshub.jash.frontend.ast.RestrictedAst;
import org.metricshub.jash.frontend.ast.Stmt;
import org.metricshub.jash.frontend.ast.StmtVisitor;
import org.metricshub.jash.frontend.ast.Type;
import org.metricshub.jash.intermediate.CommandEffects;
import org.metricshub.jash.intermediate.Intrinsic;
import org.metricshub.jash.util.JashLogger;
import org.slf4j.Logger;

/**
 * Structural checks of a {@link RestrictedAst}, run before anything is
 * lowered.
 * <p>
 * The checks run in this order, and the first violation is reported:
 * <ol>
 * <li>the entry point exists, once, without parameters and without result</li>
 * <li>no two functions share a name</li>
 * <li>every identifier is safe ({@link IdentifierRules}), every type is allowed,
 * expressions nest at most {@link Expr#MAX_NESTING_DEPTH} levels, string
 * literals hold no NUL byte, patterns are not empty, <code>break</code> and
 * <code>continue</code> sit in a loop, and loops respect their bound; this is
 * done function by function, in source order</li>
 * <li>no function calls itself, directly or through other functions</li>
 * <li>every call targets a function of the program, an intrinsic or an
 * allow-listed command, with the right number of arguments</li>
 * </ol>
 * The nesting depth of an expression is checked before the validator descends
 * into it, so that no stage can be driven into a deep recursion.
 */
public class AstValidator {

	private static final Logger LOG = JashLogger.getLogger(AstValidator.class);

	private final ValidationLevel level;

	/**
	 * Creates a validator for the {@link ValidationLevel#STRICT} level.
	 */
	public AstValidator() {
		this(ValidationLevel.STRICT);
	}

	/**
	 * @param level validation level; {@link ValidationLevel#PARANOID} also
	 *        rejects loops without an iteration bound
	 */
	public AstValidator(ValidationLevel level) {
		this.level = level;
	}

	/**
	 * Validates the specified syntax tree.
	 *
	 * @param ast the syntax tree
	 * @throws ValidationException describing the first violation found
	 */
	public void validate(RestrictedAst ast) throws ValidationException {
		LOG.debug("Validating {} function(s) at level {}", ast.getFunctions().size(), level);

		checkEntryPoint(ast);

		Map<String, Function> functions = new LinkedHashMap<String, Function>();
		for (Function function : ast.getFunctions()) {
			if (functions.containsKey(function.getName())) {
				throw new ValidationException(
						"Duplicate function: " + function.getName(),
						function.getName(),
						function.getLineNumber(),
						"Rename one of the functions");
			}
			functions.put(function.getName(), function);
		}

		Map<String, List<CallSite>> callGraph = new LinkedHashMap<String, List<CallSite>>();
		for (Function function : ast.getFunctions()) {
			FunctionChecker checker = new FunctionChecker(function);
			checker.checkSignature();
			checker.checkBlock(function.getBody());
			callGraph.put(function.getName(), checker.callSites);
		}

		checkRecursion(callGraph);
		checkCallTargets(functions, callGraph);
	}

	private void checkEntryPoint(RestrictedAst ast) throws ValidationException {
		String entryPoint = ast.getEntryPoint();
		Function entry = null;
		for (Function function : ast.getFunctions()) {
			if (function.getName().equals(entryPoint)) {
				if (entry != null) {
					throw new ValidationException(
							"Duplicate entry point: " + entryPoint,
							entryPoint,
							function.getLineNumber());
				}
				entry = function;
			}
		}
		if (entry == null) {
			throw new ValidationException(
					"Missing entry point function '" + entryPoint + "'",
					entryPoint,
					-1,
					"Add fn " + entryPoint + "() { ... }");
		}
		if (!entry.getParams().isEmpty()) {
			throw new ValidationException(
					"The entry point " + entryPoint + " cannot take parameters",
					entry.toString(),
					entry.getLineNumber(),
					"Read the script arguments with arg(n), args() and arg_count()");
		}
		if (!entry.getReturnType().isVoid()) {
			throw new ValidationException(
					"The entry point " + entryPoint + " cannot return a value",
					entry.toString(),
					entry.getLineNumber(),
					"Use exit(code) to set the exit status of the script");
		}
	}

	/**
	 * Depth-first search of the call graph, keeping the functions of the
	 * current path in <code>visiting</code>. Reaching one of them again means
	 * the graph has a cycle.
	 */
	private void checkRecursion(Map<String, List<CallSite>> callGraph) throws ValidationException {
		Set<String> visited = new HashSet<String>();
		for (String function : callGraph.keySet()) {
			visit(function, -1, callGraph, visited, new HashSet<String>());
		}
	}

	private void visit(
			String function,
			int lineNumber,
			Map<String, List<CallSite>> callGraph,
			Set<String> visited,
			Set<String> visiting)
			throws ValidationException {
		if (visiting.contains(function)) {
			throw new ValidationException(
					"Recursion detected involving function '" + function + "'",
					function,
					lineNumber,
					"Rewrite the recursion as a loop");
		}
		if (!visited.add(function)) {
			return;
		}
		visiting.add(function);
		for (CallSite call : callGraph.get(function)) {
			if (callGraph.containsKey(call.name)) {
				visit(call.name, call.lineNumber, callGraph, visited, visiting);
			}
		}
		visiting.remove(function);
	}

	private static void checkCallTargets(Map<String, Function> functions, Map<String, List<CallSite>> callGraph)
			throws ValidationException {
		for (List<CallSite> calls : callGraph.values()) {
			for (CallSite call : calls) {
				Function target = functions.get(call.name);
				if (target != null) {
					if (target.getParams().size() != call.argumentCount) {
						throw new ValidationException(
								"Function " + call.name + " expects " + target.getParams().size()
										+ " argument(s), got " + call.argumentCount,
								call.name,
								call.lineNumber);
					}
					continue;
				}
				Intrinsic intrinsic = Intrinsic.lookup(call.name);
				if (intrinsic != null) {
					if (!intrinsic.acceptsArgumentCount(call.argumentCount)) {
						throw new ValidationException(
								call.name + " does not accept " + call.argumentCount + " argument(s)",
								call.name,
								call.lineNumber);
					}
					continue;
				}
				if (!CommandEffects.isAllowed(call.name)) {
					throw new ValidationException(
							"Call to undefined function '" + call.name + "'",
							call.name,
							call.lineNumber,
							"Define the function, or call one of the allowed commands: " + CommandEffects.allowedCommands());
				}
			}
		}
	}

	/**
	 * A call found in the body of a function.
	 */
	private static final class CallSite {
		private final String name;
		private final int argumentCount;
		private final int lineNumber;

		private CallSite(String name, int argumentCount, int lineNumber) {
			this.name = name;
			this.argumentCount = argumentCount;
			this.lineNumber = lineNumber;
		}
	}

	/**
	 * Walks the body of one function.
	 */
	private final class FunctionChecker
			implements
			StmtVisitor<Void, ValidationException>,
			ExprVisitor<Void, ValidationException>,
			PatternVisitor<Void, ValidationException> {

		private final Function function;
		private final List<CallSite> callSites = new ArrayList<CallSite>();
		private int loopDepth;
		private int lineNumber;

		private FunctionChecker(Function function) {
			this.function = function;
			this.lineNumber = function.getLineNumber();
		}

		private void checkSignature() throws ValidationException {
			IdentifierRules.validate(function.getName(), IdentifierRules.Role.FUNCTION, lineNumber);
			Set<String> names = new HashSet<String>();
			for (Parameter param : function.getParams()) {
				IdentifierRules.validate(param.getName(), IdentifierRules.Role.PARAMETER, lineNumber);
				if (!names.add(param.getName())) {
					throw new ValidationException(
							"Duplicate parameter " + param.getName() + " in function " + function.getName(),
							param.getName(),
							lineNumber);
				}
				checkType(param.getType(), param.toString());
				if (param.getType().isVoid()) {
					throw new ValidationException("Parameters cannot have type ()", param.toString(), lineNumber);
				}
			}
			checkType(function.getReturnType(), function.toString());
		}

		private void checkType(Type type, String construct) throws ValidationException {
			if (!type.isAllowed()) {
				throw new ValidationException(
						"Unsupported type: " + type,
						construct,
						lineNumber,
						"Use (), bool, u32, &str, String, Option or Result");
			}
		}

		private void checkBlock(List<Stmt> block) throws ValidationException {
			for (Stmt stmt : block) {
				lineNumber = stmt.getLineNumber();
				stmt.accept(this);
			}
		}

		private void checkExpr(Expr expr) throws ValidationException {
			int depth = expr.nestingDepth();
			if (depth > Expr.MAX_NESTING_DEPTH) {
				throw new ValidationException(
						"Expression nesting too deep: " + depth + " levels (max " + Expr.MAX_NESTING_DEPTH + ")",
						function.getName(),
						expr.getLineNumber() > 0 ? expr.getLineNumber() : lineNumber,
						"Split the expression with let bindings");
			}
			expr.accept(this);
		}

		private void checkLoopBody(List<Stmt> body) throws ValidationException {
			loopDepth++;
			checkBlock(body);
			loopDepth--;
		}

		private void checkStringLiteral(Literal literal) throws ValidationException {
			if (literal.getKind() == Literal.Kind.STR && literal.getStringValue().indexOf('\0') >= 0) {
				throw new InjectionException(InjectionPattern.NUL_BYTE, literal.getStringValue(), lineNumber);
			}
		}

		@Override
		public Void visitLet(Stmt.Let stmt) throws ValidationException {
			IdentifierRules.validate(stmt.getName(), IdentifierRules.Role.VARIABLE, lineNumber);
			if (stmt.getDeclaredType() != null) {
				checkType(stmt.getDeclaredType(), stmt.getName() + ": " + stmt.getDeclaredType());
			}
			checkExpr(stmt.getValue());
			return null;
		}

		@Override
		public Void visitIf(Stmt.If stmt) throws ValidationException {
			checkExpr(stmt.getCondition());
			checkBlock(stmt.getThenBlock());
			if (stmt.hasElse()) {
				checkBlock(stmt.getElseBlock());
			}
			return null;
		}

		@Override
		public Void visitMatch(Stmt.Match stmt) throws ValidationException {
			checkExpr(stmt.getScrutinee());
			if (stmt.getArms().isEmpty()) {
				throw new ValidationException(
						"match without any arm",
						stmt.getScrutinee().toString(),
						lineNumber,
						"Add a _ => { } arm");
			}
			int matchLine = lineNumber;
			for (MatchArm arm : stmt.getArms()) {
				lineNumber = matchLine;
				arm.getPattern().accept(this);
				if (arm.getGuard() != null) {
					checkExpr(arm.getGuard());
				}
				checkBlock(arm.getBody());
			}
			return null;
		}

		@Override
		public Void visitFor(Stmt.For stmt) throws ValidationException {
			Pattern pattern = stmt.getPattern();
			if (pattern instanceof Pattern.VariablePattern) {
				IdentifierRules.validate(
						((Pattern.VariablePattern) pattern).getName(),
						IdentifierRules.Role.LOOP_VARIABLE,
						lineNumber);
			} else {
				pattern.accept(this);
			}
			checkExpr(stmt.getIterable());
			checkForBound(stmt);
			checkLoopBody(stmt.getBody());
			return null;
		}

		private void checkForBound(Stmt.For stmt) throws ValidationException {
			Expr iterable = stmt.getIterable();
			Long bound = stmt.getMaxIterations();
			if (iterable instanceof Expr.Range) {
				Expr.Range range = (Expr.Range) iterable;
				if (range.getStart() instanceof Expr.LiteralExpr && range.getEnd() instanceof Expr.LiteralExpr) {
					Literal start = ((Expr.LiteralExpr) range.getStart()).getLiteral();
					Literal end = ((Expr.LiteralExpr) range.getEnd()).getLiteral();
					if (start.getKind() == Literal.Kind.U32 && end.getKind() == Literal.Kind.U32) {
						long count = Math.max(0, end.getNumberValue() - start.getNumberValue() + (range.isInclusive() ? 1 : 0));
						if (bound != null && count > bound.longValue()) {
							throw new ValidationException(
									"Loop runs " + count + " iterations, more than its bound of " + bound,
									range.toString(),
									lineNumber);
						}
						return;
					}
				}
			} else if (iterable instanceof Expr.ArrayLiteral || iterable instanceof Expr.Variable) {
				return;
			}
			if (bound == null && level == ValidationLevel.PARANOID) {
				throw new ValidationException(
						"Unbounded for loop",
						iterable.toString(),
						lineNumber,
						"Add #[max_iterations = N] before the loop");
			}
		}

		@Override
		public Void visitWhile(Stmt.While stmt) throws ValidationException {
			checkExpr(stmt.getCondition());
			if (stmt.getMaxIterations() == null && level == ValidationLevel.PARANOID) {
				throw new ValidationException(
						"Unbounded while loop",
						stmt.getCondition().toString(),
						lineNumber,
						"Add #[max_iterations = N] before the loop");
			}
			checkLoopBody(stmt.getBody());
			return null;
		}

		@Override
		public Void visitBreak(Stmt.Break stmt) throws ValidationException {
			if (loopDepth == 0) {
				throw new ValidationException("break outside of a loop", "break", lineNumber);
			}
			return null;
		}

		@Override
		public Void visitContinue(Stmt.Continue stmt) throws ValidationException {
			if (loopDepth == 0) {
				throw new ValidationException("continue outside of a loop", "continue", lineNumber);
			}
			return null;
		}

		@Override
		public Void visitReturn(Stmt.Return stmt) throws ValidationException {
			if (stmt.getValue() != null) {
				checkExpr(stmt.getValue());
			}
			return null;
		}

		@Override
		public Void visitExpr(Stmt.ExprStmt stmt) throws ValidationException {
			checkExpr(stmt.getExpr());
			return null;
		}

		@Override
		public Void visitLiteral(Expr.LiteralExpr expr) throws ValidationException {
			checkStringLiteral(expr.getLiteral());
			return null;
		}

		@Override
		public Void visitVariable(Expr.Variable expr) {
			return null;
		}

		@Override
		public Void visitFunctionCall(Expr.FunctionCall expr) throws ValidationException {
			callSites.add(new CallSite(expr.getName(), expr.getArgs().size(), lineNumber));
			for (Expr arg : expr.getArgs()) {
				arg.accept(this);
			}
			return null;
		}

		@Override
		public Void visitBinary(Expr.Binary expr) throws ValidationException {
			expr.getLeft().accept(this);
			expr.getRight().accept(this);
			return null;
		}

		@Override
		public Void visitUnary(Expr.Unary expr) throws ValidationException {
			expr.getOperand().accept(this);
			return null;
		}

		@Override
		public Void visitMethodCall(Expr.MethodCall expr) throws ValidationException {
			expr.getReceiver().accept(this);
			for (Expr arg : expr.getArgs()) {
				arg.accept(this);
			}
			return null;
		}

		@Override
		public Void visitRange(Expr.Range expr) throws ValidationException {
			expr.getStart().accept(this);
			expr.getEnd().accept(this);
			return null;
		}

		@Override
		public Void visitArray(Expr.ArrayLiteral expr) throws ValidationException {
			for (Expr element : expr.getElements()) {
				element.accept(this);
			}
			return null;
		}

		@Override
		public Void visitIndex(Expr.Index expr) throws ValidationException {
			expr.getObject().accept(this);
			expr.getIndex().accept(this);
			return null;
		}

		@Override
		public Void visitTry(Expr.Try expr) throws ValidationException {
			expr.getExpr().accept(this);
			return null;
		}

		@Override
		public Void visitBlock(Expr.Block expr) throws ValidationException {
			int blockLine = lineNumber;
			checkBlock(expr.getStatements());
			lineNumber = blockLine;
			return null;
		}

		@Override
		public Void visitLiteral(Pattern.LiteralPattern pattern) throws ValidationException {
			checkStringLiteral(pattern.getLiteral());
			return null;
		}

		@Override
		public Void visitVariable(Pattern.VariablePattern pattern) throws ValidationException {
			IdentifierRules.validate(pattern.getName(), IdentifierRules.Role.PATTERN_VARIABLE, lineNumber);
			return null;
		}

		@Override
		public Void visitWildcard(Pattern.Wildcard pattern) {
			return null;
		}

		@Override
		public Void visitTuple(Pattern.TuplePattern pattern) throws ValidationException {
			if (pattern.getElements().isEmpty()) {
				throw new ValidationException("Empty tuple pattern", pattern.toString(), lineNumber);
			}
			for (Pattern element : pattern.getElements()) {
				element.accept(this);
			}
			return null;
		}

		@Override
		public Void visitStruct(Pattern.StructPattern pattern) throws ValidationException {
			if (pattern.getFields().isEmpty()) {
				throw new ValidationException("Empty struct pattern", pattern.toString(), lineNumber);
			}
			for (Pattern.Field field : pattern.getFields()) {
				field.getPattern().accept(this);
			}
			return null;
		}
	}
}
