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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jash.frontend.ast.BinaryOp;
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
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.validation.IdentifierRules;
import org.slf4j.Logger;

/**
 * Lowers a validated {@link RestrictedAst} into the shell IR.
 * <p>
 * The result is a {@link ShellIR.Sequence} holding one {@link ShellIR.Function}
 * per function of the program (the entry point last) followed by the
 * invocation of the entry point with all the arguments of the script.
 * <p>
 * Conventions:
 * <ul>
 * <li>A function with a result writes it to the standard output: its last
 * expression becomes an {@link ShellIR.Echo}, and a call used as a value
 * becomes a {@link ShellValue.CommandSubst} of the call. Such a function may
 * not write anything else to the standard output.</li>
 * <li>Values must have the type declared for them: parameters, results and
 * annotated <code>let</code> bindings. A variable keeps the type of its first
 * binding, so that no string ever reaches an arithmetic expansion.</li>
 * <li>Binary operators are classified by the types of their operands:
 * <code>+</code> on strings is a {@link ShellValue.Concat}, arithmetic on
 * <code>u32</code> is a {@link ShellValue.Arithmetic}, and anything else is
 * rejected.</li>
 * <li>Arrays become one variable per element, <code>name_0</code>,
 * <code>name_1</code>..., and may only be indexed with a literal.</li>
 * <li>An empty block becomes a {@link ShellIR.Noop}.</li>
 * </ul>
 * Constructs without a translation throw a {@link LoweringException}; nothing
 * is dropped silently.
 */
public class IrBuilder {

	private static final Logger LOG = JashLogger.getLogger(IrBuilder.class);

	/**
	 * Conversions that are the identity once in the shell, where every value
	 * is a string
	 */
	private static final Set<String> IDENTITY_METHODS = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("to_string", "to_owned", "clone", "as_str", "into")));

	private static final java.util.regex.Pattern ENV_NAME = java.util.regex.Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/**
	 * Lowers the specified program.
	 *
	 * @param ast a program that passed validation
	 * @return the IR of the whole script
	 * @throws LoweringException when a construct has no shell translation
	 */
	public ShellIR lower(RestrictedAst ast) throws LoweringException {
		LOG.debug("Lowering {} function(s)", ast.getFunctions().size());
		ShellIR program = new ProgramLowering(ast).lower();
		LOG.debug("Lowered program, effects: {}", program.effects());
		return program;
	}

	/**
	 * How the operands of a binary operator are combined
	 */
	private enum OperatorClass {
		ARITHMETIC,
		CONCAT,
		NUMERIC_COMPARISON,
		STRING_COMPARISON,
		LOGICAL
	}

	/**
	 * What happens to the value of the last statement of a block, and the type
	 * that value must have. An assignment without a declared type takes the
	 * type of the first value assigned.
	 */
	private static final class Tail {
		private static final Tail NONE = new Tail(false, null, null);

		private final boolean echo;
		private final String assignTo;
		private Type type;

		private Tail(boolean echo, String assignTo, Type type) {
			this.echo = echo;
			this.assignTo = assignTo;
			this.type = type;
		}

		static Tail echo(Type type) {
			return new Tail(true, null, type);
		}

		static Tail assign(String name, Type type) {
			return new Tail(false, name, type);
		}

		boolean isNone() {
			return !echo && assignTo == null;
		}

		ShellIR apply(ShellValue value) {
			if (echo) {
				return new ShellIR.Echo(value);
			}
			return new ShellIR.Let(assignTo, value);
		}
	}

	private static Type arrayType(Type elementType) {
		return Type.unsupported("[" + elementType + "]");
	}

	private static final class ArrayInfo {
		private final int size;
		private final Type elementType;

		ArrayInfo(int size, Type elementType) {
			this.size = size;
			this.elementType = elementType;
		}
	}

	/**
	 * State of one call to {@link IrBuilder#lower(RestrictedAst)}
	 * <p>
	 * Shell variables are global, and a function called as a statement runs in
	 * the shell of its caller. So the variables of every function but the entry
	 * point are renamed <code>__jash_&lt;function&gt;_&lt;name&gt;</code>, and
	 * no two source names ever share a shell name. Recursion is rejected, so a
	 * function has at most one activation at a time.
	 */
	private static final class ProgramLowering {

		private final RestrictedAst ast;
		private final Map<String, Function> functions = new HashMap<String, Function>();
		private final Map<String, ShellIR.Function> lowered = new HashMap<String, ShellIR.Function>();
		private final Set<String> inProgress = new HashSet<String>();
		private final Set<String> writers = new HashSet<String>();
		private final Map<String, String> shellNames = new HashMap<String, String>();
		private final Set<String> usedNames = new HashSet<String>();
		private int generatedNames;

		ProgramLowering(RestrictedAst ast) {
			this.ast = ast;
			for (Function function : ast.getFunctions()) {
				functions.put(function.getName(), function);
			}
		}

		ShellIR lower() throws LoweringException {
			Function entry = ast.getFunction(ast.getEntryPoint());
			if (entry == null) {
				throw new LoweringException("Missing entry point function '" + ast.getEntryPoint() + "'", ast.getEntryPoint(), -1);
			}
			List<ShellIR> nodes = new ArrayList<ShellIR>();
			for (Function function : ast.getFunctions()) {
				if (function != entry) {
					nodes.add(lowerFunction(function.getName()));
				}
			}
			ShellIR.Function main = lowerFunction(entry.getName());
			nodes.add(main);
			nodes.add(new ShellIR.Exec(main.getName(), Collections.<ShellValue>singletonList(new ShellValue.Arg(null)), main.effects()));
			return new ShellIR.Sequence(nodes);
		}

		/**
		 * Lowers a function once, callees first, so that the effects of a call
		 * are known when the call is lowered.
		 */
		ShellIR.Function lowerFunction(String name) throws LoweringException {
			ShellIR.Function done = lowered.get(name);
			if (done != null) {
				return done;
			}
			Function function = functions.get(name);
			if (!inProgress.add(name)) {
				throw new LoweringException("Recursion detected involving function '" + name + "'", name, function.getLineNumber());
			}
			FunctionLowering lowering = new FunctionLowering(this, function);
			ShellIR.Function result = lowering.lower();
			inProgress.remove(name);
			lowered.put(name, result);
			if (lowering.writesOutput) {
				writers.add(name);
			}
			LOG.debug("Lowered function {}: {}", name, result.effects());
			return result;
		}

		/**
		 * @return whether calling the (already lowered) function may write to
		 *         the standard output
		 */
		boolean writesOutput(String name) {
			return writers.contains(name);
		}

		/**
		 * @return the shell variable holding the source variable <code>name</code>
		 *         of <code>function</code>
		 */
		String variableName(Function function, String name) {
			return shellName(function, name, name);
		}

		/**
		 * @return the shell variable holding element <code>index</code> of the
		 *         source array <code>array</code> of <code>function</code>
		 */
		String elementName(Function function, String array, long index) {
			return shellName(function, array + "[" + index + "]", array + "_" + index);
		}

		private String shellName(Function function, String key, String name) {
			String scopedKey = function.getName() + " " + key;
			String shellName = shellNames.get(scopedKey);
			if (shellName == null) {
				String base = function.getName().equals(ast.getEntryPoint())
						? name
						: IdentifierRules.GENERATED_PREFIX + function.getName() + "_" + name;
				shellName = unique(base);
				shellNames.put(scopedKey, shellName);
			}
			return shellName;
		}

		String generatedName(String purpose) {
			return unique(IdentifierRules.GENERATED_PREFIX + purpose + "_" + generatedNames++);
		}

		private String unique(String base) {
			String name = base;
			int suffix = 1;
			while (!usedNames.add(name)) {
				name = base + "_" + suffix++;
			}
			return name;
		}
	}

	/**
	 * Lowers the body of one function. Statements lower to {@link ShellIR},
	 * expressions to {@link ShellValue}.
	 */
	private static final class FunctionLowering implements StmtVisitor<ShellIR, LoweringException>, ExprVisitor<ShellValue, LoweringException> {

		private final ProgramLowering program;
		private final Function function;
		private final Map<String, Type> variables = new HashMap<String, Type>();
		private final Map<String, ArrayInfo> arrays = new HashMap<String, ArrayInfo>();
		private final TypeInference typer = new TypeInference();
		private final CasePatterns casePatterns = new CasePatterns();
		private boolean writesOutput;

		FunctionLowering(ProgramLowering program, Function function) {
			this.program = program;
			this.function = function;
		}

		ShellIR.Function lower() throws LoweringException {
			List<String> params = new ArrayList<String>();
			for (Parameter param : function.getParams()) {
				params.add(shellName(param.getName()));
				variables.put(param.getName(), param.getType());
			}
			Type returnType = function.getReturnType();
			Tail tail = returnType.isVoid() ? Tail.NONE : Tail.echo(returnType);
			return new ShellIR.Function(function.getName(), params, block(function.getBody(), tail));
		}

		private String shellName(String name) {
			return program.variableName(function, name);
		}

		private String elementName(String array, long index) {
			return program.elementName(function, array, index);
		}

		/**
		 * The standard output of a function with a result carries that result,
		 * and nothing else may be written to it.
		 */
		private void output(Expr.FunctionCall call, String what) throws LoweringException {
			writesOutput = true;
			if (!function.getReturnType().isVoid()) {
				throw new LoweringException(
						"Function '" + function.getName() + "' returns its value on the standard output, which " + what + " would also write to",
						call.toString(),
						call.getLineNumber(),
						"Use eprintln! for messages, or bind the output of the call with let");
			}
		}

		private void requireType(Type expected, Type actual, Expr expr, String what) throws LoweringException {
			if (!expected.equals(actual)) {
				throw new LoweringException(
						"Mismatched types: " + what + " expects " + expected + ", got " + actual,
						expr.toString(),
						expr.getLineNumber());
			}
		}

		// statements

		private ShellIR block(List<Stmt> statements, Tail tail) throws LoweringException {
			if (statements.isEmpty()) {
				return new ShellIR.Noop();
			}
			List<ShellIR> nodes = new ArrayList<ShellIR>();
			int last = statements.size() - 1;
			for (int i = 0; i <= last; i++) {
				Stmt statement = statements.get(i);
				if (i == last && !tail.isNone()) {
					nodes.add(tailStatement(statement, tail));
				} else {
					nodes.add(statement.accept(this));
				}
			}
			return nodes.size() == 1 ? nodes.get(0) : new ShellIR.Sequence(nodes);
		}

		private ShellIR tailStatement(Stmt statement, Tail tail) throws LoweringException {
			if (statement instanceof Stmt.ExprStmt) {
				Expr expr = ((Stmt.ExprStmt) statement).getExpr();
				if (expr instanceof Expr.Block) {
					return block(((Expr.Block) expr).getStatements(), tail);
				}
				Type type = typeOf(expr);
				if (type.isVoid()) {
					if (!exits(expr)) {
						throw new LoweringException(
								"Expecting a value" + (tail.type != null ? " of type " + tail.type : "") + ", got ()",
								expr.toString(),
								expr.getLineNumber());
					}
					return statement.accept(this);
				}
				if (tail.type == null) {
					tail.type = type;
				} else {
					requireType(tail.type, type, expr, tail.echo ? "the result of '" + function.getName() + "'" : "'" + tail.assignTo + "'");
				}
				return tail.apply(value(expr));
			} else if (statement instanceof Stmt.If) {
				return lowerIf((Stmt.If) statement, tail);
			} else if (statement instanceof Stmt.Match) {
				return lowerMatch((Stmt.Match) statement, tail);
			}
			return statement.accept(this);
		}

		private boolean exits(Expr expr) {
			if (expr instanceof Expr.FunctionCall) {
				Intrinsic intrinsic = Intrinsic.lookup(((Expr.FunctionCall) expr).getName());
				return intrinsic == Intrinsic.EXIT || intrinsic == Intrinsic.PROCESS_EXIT;
			}
			return false;
		}

		@Override
		public ShellIR visitLet(Stmt.Let let) throws LoweringException {
			String name = let.getName();
			Expr value = let.getValue();
			Type declared = let.getDeclaredType();
			if (value instanceof Expr.ArrayLiteral) {
				if (declared != null) {
					throw new LoweringException(
							"Arrays cannot have a declared type",
							name,
							let.getLineNumber(),
							"Remove the type annotation of '" + name + "'");
				}
				return bindArray(name, (Expr.ArrayLiteral) value);
			}
			if (value instanceof Expr.Block) {
				Tail tail = Tail.assign(shellName(name), declared);
				ShellIR assignments = block(((Expr.Block) value).getStatements(), tail);
				bind(name, tail.type != null ? tail.type : typeOf(value), let.getLineNumber());
				return assignments;
			}
			Type type = typeOf(value);
			if (declared != null) {
				requireType(declared, type, value, "'" + name + "'");
			}
			ShellValue shellValue = value(value);
			bind(name, type, let.getLineNumber());
			return new ShellIR.Let(shellName(name), shellValue);
		}

		/**
		 * A name keeps the type it was first bound with: a shell variable may
		 * be read again by code lowered before the new binding, in a loop.
		 */
		private void bind(String name, Type type, int lineNumber) throws LoweringException {
			if (type.isVoid()) {
				throw new LoweringException("Cannot bind a value of type () to '" + name + "'", name, lineNumber);
			}
			Type previous = boundType(name);
			if (previous != null && !previous.equals(type)) {
				throw new LoweringException(
						"Mismatched types: '" + name + "' has type " + previous + ", cannot bind a value of type " + type,
						name,
						lineNumber,
						"Use a new variable name");
			}
			variables.put(name, type);
		}

		private Type boundType(String name) {
			ArrayInfo array = arrays.get(name);
			if (array != null) {
				return arrayType(array.elementType);
			}
			return variables.get(name);
		}

		private ShellIR bindArray(String name, Expr.ArrayLiteral array) throws LoweringException {
			List<Expr> elements = array.getElements();
			Type elementType = elements.isEmpty() ? Type.STR : typeOf(elements.get(0));
			List<ShellIR> nodes = new ArrayList<ShellIR>();
			for (int i = 0; i < elements.size(); i++) {
				Expr element = elements.get(i);
				Type type = typeOf(element);
				if (!type.equals(elementType)) {
					throw new LoweringException(
							"Array elements must share one type: " + elementType + " and " + type,
							element.toString(),
							element.getLineNumber());
				}
				nodes.add(new ShellIR.Let(elementName(name, i), value(element)));
			}
			Type previous = boundType(name);
			if (previous != null && !previous.equals(arrayType(elementType))) {
				throw new LoweringException(
						"Mismatched types: '" + name + "' has type " + previous + ", cannot bind a value of type " + arrayType(elementType),
						name,
						array.getLineNumber(),
						"Use a new variable name");
			}
			arrays.put(name, new ArrayInfo(elements.size(), elementType));
			if (nodes.isEmpty()) {
				return new ShellIR.Noop();
			}
			return nodes.size() == 1 ? nodes.get(0) : new ShellIR.Sequence(nodes);
		}

		@Override
		public ShellIR visitIf(Stmt.If ifStmt) throws LoweringException {
			return lowerIf(ifStmt, Tail.NONE);
		}

		private ShellIR lowerIf(Stmt.If ifStmt, Tail tail) throws LoweringException {
			ShellValue condition = condition(ifStmt.getCondition());
			ShellIR thenBranch = block(ifStmt.getThenBlock(), tail);
			ShellIR elseBranch = ifStmt.hasElse() ? block(ifStmt.getElseBlock(), tail) : null;
			return new ShellIR.If(condition, thenBranch, elseBranch);
		}

		@Override
		public ShellIR visitMatch(Stmt.Match match) throws LoweringException {
			return lowerMatch(match, Tail.NONE);
		}

		private ShellIR lowerMatch(Stmt.Match match, Tail tail) throws LoweringException {
			Expr scrutineeExpr = match.getScrutinee();
			Type scrutineeType = typeOf(scrutineeExpr);
			ShellValue scrutinee = value(scrutineeExpr);

			boolean guarded = false;
			boolean binds = false;
			for (MatchArm arm : match.getArms()) {
				CasePattern pattern = arm.getPattern().accept(casePatterns);
				if (!pattern.isWildcard()) {
					Literal literal = ((Pattern.LiteralPattern) arm.getPattern()).getLiteral();
					if (!scrutineeType.equals(literal.getType())) {
						throw new LoweringException(
								"Pattern " + arm.getPattern() + " does not match a value of type " + scrutineeType,
								arm.getPattern().toString(),
								match.getLineNumber());
					}
				}
				guarded |= arm.getGuard() != null;
				binds |= arm.getPattern() instanceof Pattern.VariablePattern;
			}

			List<ShellIR> nodes = new ArrayList<ShellIR>();
			if ((guarded || binds) && !(scrutinee instanceof ShellValue.Variable) && !scrutinee.isConstant()) {
				String temp = program.generatedName("match");
				nodes.add(new ShellIR.Let(temp, scrutinee));
				scrutinee = new ShellValue.Variable(temp);
			}
			if (guarded) {
				nodes.add(ifChain(match, scrutinee, scrutineeType, tail));
			} else {
				nodes.add(caseStatement(match, scrutinee, scrutineeType, tail));
			}
			return nodes.size() == 1 ? nodes.get(0) : new ShellIR.Sequence(nodes);
		}

		private ShellIR caseStatement(Stmt.Match match, ShellValue scrutinee, Type scrutineeType, Tail tail) throws LoweringException {
			List<CaseArm> arms = new ArrayList<CaseArm>();
			for (MatchArm arm : match.getArms()) {
				CasePattern pattern = arm.getPattern().accept(casePatterns);
				ShellIR body;
				if (arm.getPattern() instanceof Pattern.VariablePattern) {
					String name = ((Pattern.VariablePattern) arm.getPattern()).getName();
					bind(name, scrutineeType, match.getLineNumber());
					body = prepend(new ShellIR.Let(shellName(name), scrutinee), block(arm.getBody(), tail));
				} else {
					body = block(arm.getBody(), tail);
				}
				arms.add(new CaseArm(pattern, body));
				if (pattern.isWildcard()) {
					// later arms are unreachable
					break;
				}
			}
			return new ShellIR.Case(scrutinee, arms);
		}

		private ShellIR ifChain(Stmt.Match match, ShellValue scrutinee, Type scrutineeType, Tail tail) throws LoweringException {
			// guards may read the bound variables, so bind them all first
			List<ShellIR> bindings = new ArrayList<ShellIR>();
			Set<String> bound = new LinkedHashSet<String>();
			for (MatchArm arm : match.getArms()) {
				if (arm.getPattern() instanceof Pattern.VariablePattern) {
					String name = ((Pattern.VariablePattern) arm.getPattern()).getName();
					if (bound.add(name)) {
						bind(name, scrutineeType, match.getLineNumber());
						bindings.add(new ShellIR.Let(shellName(name), scrutinee));
					}
				}
			}

			List<ShellValue> conditions = new ArrayList<ShellValue>();
			List<ShellIR> bodies = new ArrayList<ShellIR>();
			for (MatchArm arm : match.getArms()) {
				CasePattern pattern = arm.getPattern().accept(casePatterns);
				ShellValue condition = null;
				if (!pattern.isWildcard()) {
					condition = new ShellValue.Comparison(ComparisonOp.STR_EQ, scrutinee, new ShellValue.Str(pattern.getLiteral()));
				}
				if (arm.getGuard() != null) {
					ShellValue guard = condition(arm.getGuard());
					condition = condition == null ? guard : new ShellValue.Logical(LogicalOp.AND, condition, guard);
				}
				conditions.add(condition);
				bodies.add(block(arm.getBody(), tail));
				if (condition == null) {
					break;
				}
			}

			ShellIR chain = null;
			for (int i = conditions.size() - 1; i >= 0; i--) {
				if (conditions.get(i) == null) {
					chain = bodies.get(i);
				} else {
					chain = new ShellIR.If(conditions.get(i), bodies.get(i), chain);
				}
			}
			if (chain == null) {
				chain = new ShellIR.Noop();
			}
			if (bindings.isEmpty()) {
				return chain;
			}
			bindings.add(chain);
			return new ShellIR.Sequence(bindings);
		}

		private ShellIR prepend(ShellIR first, ShellIR rest) {
			if (rest instanceof ShellIR.Noop) {
				return first;
			}
			List<ShellIR> nodes = new ArrayList<ShellIR>();
			nodes.add(first);
			if (rest instanceof ShellIR.Sequence) {
				nodes.addAll(((ShellIR.Sequence) rest).getNodes());
			} else {
				nodes.add(rest);
			}
			return new ShellIR.Sequence(nodes);
		}

		@Override
		public ShellIR visitFor(Stmt.For forStmt) throws LoweringException {
			Pattern pattern = forStmt.getPattern();
			String variable = null;
			String shellVariable;
			if (pattern instanceof Pattern.VariablePattern) {
				variable = ((Pattern.VariablePattern) pattern).getName();
				shellVariable = shellName(variable);
			} else if (pattern instanceof Pattern.Wildcard) {
				shellVariable = program.generatedName("item");
			} else {
				throw new LoweringException("Unsupported for loop pattern: " + pattern, pattern.toString(), forStmt.getLineNumber());
			}

			Expr iterable = forStmt.getIterable();
			if (iterable instanceof Expr.Range) {
				Expr.Range range = (Expr.Range) iterable;
				requireNumeric(range.getStart());
				requireNumeric(range.getEnd());
				ShellValue start = value(range.getStart());
				ShellValue end = value(range.getEnd());
				if (!range.isInclusive()) {
					end = predecessor(end);
				}
				if (variable != null) {
					bind(variable, Type.U32, forStmt.getLineNumber());
				}
				return new ShellIR.For(shellVariable, start, end, block(forStmt.getBody(), Tail.NONE));
			}

			List<ShellValue> items = new ArrayList<ShellValue>();
			Type itemType;
			if (iterable instanceof Expr.ArrayLiteral) {
				List<Expr> elements = ((Expr.ArrayLiteral) iterable).getElements();
				itemType = elements.isEmpty() ? Type.STR : typeOf(elements.get(0));
				for (Expr element : elements) {
					items.add(value(element));
				}
			} else if (iterable instanceof Expr.Variable && arrays.containsKey(((Expr.Variable) iterable).getName())) {
				String array = ((Expr.Variable) iterable).getName();
				ArrayInfo info = arrays.get(array);
				itemType = info.elementType;
				for (int i = 0; i < info.size; i++) {
					items.add(new ShellValue.Variable(elementName(array, i)));
				}
			} else if (iterable instanceof Expr.FunctionCall && Intrinsic.lookup(((Expr.FunctionCall) iterable).getName()) == Intrinsic.ARGS) {
				itemType = Type.STR;
				items.add(new ShellValue.Arg(null));
			} else {
				throw new LoweringException(
						"Unsupported for loop iterable: " + iterable,
						iterable.toString(),
						forStmt.getLineNumber(),
						"Iterate over a range, an array or args()");
			}
			if (items.isEmpty()) {
				return new ShellIR.Noop();
			}
			if (variable != null) {
				bind(variable, itemType, forStmt.getLineNumber());
			}
			return new ShellIR.ForIn(shellVariable, items, block(forStmt.getBody(), Tail.NONE));
		}

		private ShellValue predecessor(ShellValue end) {
			if (end instanceof ShellValue.Str) {
				long bound = Long.parseLong(((ShellValue.Str) end).getValue());
				return new ShellValue.Str(Long.toString(bound - 1));
			}
			return new ShellValue.Arithmetic(ArithmeticOp.SUB, end, new ShellValue.Str("1"));
		}

		@Override
		public ShellIR visitWhile(Stmt.While whileStmt) throws LoweringException {
			ShellValue condition = condition(whileStmt.getCondition());
			return new ShellIR.While(condition, block(whileStmt.getBody(), Tail.NONE), whileStmt.getMaxIterations());
		}

		@Override
		public ShellIR visitBreak(Stmt.Break breakStmt) {
			return new ShellIR.Break();
		}

		@Override
		public ShellIR visitContinue(Stmt.Continue continueStmt) {
			return new ShellIR.Continue();
		}

		@Override
		public ShellIR visitReturn(Stmt.Return returnStmt) throws LoweringException {
			Expr value = returnStmt.getValue();
			if (value == null) {
				return new ShellIR.Return(null);
			}
			if (function.getReturnType().isVoid()) {
				throw new LoweringException(
						"Function '" + function.getName() + "' returns no value",
						value.toString(),
						returnStmt.getLineNumber(),
						"Declare a return type, or use return without a value");
			}
			requireType(function.getReturnType(), typeOf(value), value, "the result of '" + function.getName() + "'");
			return new ShellIR.Return(value(value));
		}

		@Override
		public ShellIR visitExpr(Stmt.ExprStmt exprStmt) throws LoweringException {
			Expr expr = exprStmt.getExpr();
			if (expr instanceof Expr.FunctionCall) {
				return callStatement((Expr.FunctionCall) expr);
			} else if (expr instanceof Expr.Block) {
				return block(((Expr.Block) expr).getStatements(), Tail.NONE);
			}
			throw new LoweringException(
					"Expression statement has no effect: " + expr,
					expr.toString(),
					exprStmt.getLineNumber(),
					"Bind the value with let, or remove the statement");
		}

		private ShellIR callStatement(Expr.FunctionCall call) throws LoweringException {
			String name = call.getName();
			Intrinsic intrinsic = Intrinsic.lookup(name);
			if (intrinsic != null) {
				switch (intrinsic) {
				case PRINTLN:
					output(call, name);
					return new ShellIR.Echo(format(call), true, false);
				case PRINT:
					output(call, name);
					return new ShellIR.Echo(format(call), false, false);
				case EPRINTLN:
					return new ShellIR.Echo(format(call), true, true);
				case EPRINT:
					return new ShellIR.Echo(format(call), false, true);
				case EXIT:
				case PROCESS_EXIT:
					requireNumeric(call.getArgs().get(0));
					return new ShellIR.Exit(value(call.getArgs().get(0)));
				case ARG:
				case ARGS:
				case ARG_COUNT:
				case EXIT_CODE:
				case ENV:
				case ENV_VAR_OR:
				case STRING_FROM:
				case FORMAT:
					throw new LoweringException(
							"Result of " + name + " is not used",
							call.toString(),
							call.getLineNumber(),
							"Bind the value with let, or remove the call");
				}
				throw new IllegalStateException("Unknown intrinsic: " + intrinsic);
			}
			Function callee = program.functions.get(name);
			if (callee != null && !callee.getReturnType().isVoid()) {
				throw new LoweringException(
						"Result of " + name + " is not used",
						call.toString(),
						call.getLineNumber(),
						"Bind the value with let, or remove the call");
			}
			ShellIR.Exec exec = execution(call);
			if (callee == null || program.writesOutput(name)) {
				output(call, callee == null ? "command '" + name + "'" : "'" + name + "'");
			}
			return exec;
		}

		private ShellIR.Exec execution(Expr.FunctionCall call) throws LoweringException {
			String name = call.getName();
			Function callee = program.functions.get(name);
			List<Expr> argExprs = call.getArgs();
			List<ShellValue> args = new ArrayList<ShellValue>();
			for (int i = 0; i < argExprs.size(); i++) {
				Expr arg = argExprs.get(i);
				if (callee != null && i < callee.getParams().size()) {
					Parameter param = callee.getParams().get(i);
					requireType(param.getType(), typeOf(arg), arg, "parameter '" + param.getName() + "' of '" + name + "'");
				}
				args.add(value(arg));
			}
			if (callee != null) {
				return new ShellIR.Exec(name, args, program.lowerFunction(name).effects());
			}
			if (CommandEffects.isAllowed(name)) {
				return new ShellIR.Exec(name, args, CommandEffects.classify(name));
			}
			throw undefinedFunction(call);
		}

		private LoweringException undefinedFunction(Expr.FunctionCall call) {
			return new LoweringException("Call to undefined function '" + call.getName() + "'", call.getName(), call.getLineNumber());
		}

		// expressions

		private Type typeOf(Expr expr) throws LoweringException {
			return expr.accept(typer);
		}

		private ShellValue value(Expr expr) throws LoweringException {
			return expr.accept(this);
		}

		private ShellValue condition(Expr expr) throws LoweringException {
			Type type = typeOf(expr);
			if (!type.isBool()) {
				throw new LoweringException("Condition must be a bool, got " + type, expr.toString(), expr.getLineNumber());
			}
			return value(expr);
		}

		private void requireNumeric(Expr expr) throws LoweringException {
			Type type = typeOf(expr);
			if (!type.isNumeric()) {
				throw new LoweringException("Expecting a u32 value, got " + type, expr.toString(), expr.getLineNumber());
			}
		}

		@Override
		public ShellValue visitLiteral(Expr.LiteralExpr expr) {
			Literal literal = expr.getLiteral();
			switch (literal.getKind()) {
			case BOOL:
				return new ShellValue.Bool(literal.getBoolValue());
			case U32:
				return new ShellValue.Str(Long.toString(literal.getNumberValue()));
			case STR:
				return new ShellValue.Str(literal.getStringValue());
			}
			throw new IllegalStateException("Unknown literal kind: " + literal.getKind());
		}

		@Override
		public ShellValue visitVariable(Expr.Variable expr) throws LoweringException {
			String name = expr.getName();
			if (arrays.containsKey(name)) {
				throw new LoweringException(
						"Array '" + name + "' cannot be used as a value",
						name,
						expr.getLineNumber(),
						"Index it with an integer literal, or iterate over it with for");
			}
			if (!variables.containsKey(name)) {
				throw unknownVariable(expr);
			}
			return new ShellValue.Variable(shellName(name));
		}

		@Override
		public ShellValue visitFunctionCall(Expr.FunctionCall call) throws LoweringException {
			String name = call.getName();
			List<Expr> args = call.getArgs();
			Intrinsic intrinsic = Intrinsic.lookup(name);
			if (intrinsic != null) {
				switch (intrinsic) {
				case ARG:
					return new ShellValue.Arg(Integer.valueOf(argPosition(call)));
				case ARGS:
					throw new LoweringException(
							"args() is only supported as the iterable of a for loop",
							call.toString(),
							call.getLineNumber());
				case ARG_COUNT:
					return new ShellValue.ArgCount();
				case EXIT_CODE:
					return new ShellValue.ExitCode();
				case ENV:
					return new ShellValue.EnvVar(envName(call), null);
				case ENV_VAR_OR:
					return new ShellValue.EnvVar(envName(call), value(args.get(1)));
				case STRING_FROM:
					return value(args.get(0));
				case FORMAT:
					return format(call);
				case EXIT:
				case PROCESS_EXIT:
				case PRINTLN:
				case PRINT:
				case EPRINTLN:
				case EPRINT:
					throw new LoweringException(name + " does not produce a value", call.toString(), call.getLineNumber());
				}
				throw new IllegalStateException("Unknown intrinsic: " + intrinsic);
			}
			Function callee = program.functions.get(name);
			if (callee != null && callee.getReturnType().isVoid()) {
				throw new LoweringException(
						"Function '" + name + "' returns no value",
						call.toString(),
						call.getLineNumber(),
						"Declare a return type for '" + name + "'");
			}
			return new ShellValue.CommandSubst(execution(call));
		}

		private int argPosition(Expr.FunctionCall call) throws LoweringException {
			Expr position = call.getArgs().get(0);
			if (!(position instanceof Expr.LiteralExpr) || ((Expr.LiteralExpr) position).getLiteral().getKind() != Literal.Kind.U32) {
				throw new LoweringException(
						"arg() position must be an integer literal",
						position.toString(),
						call.getLineNumber());
			}
			long value = ((Expr.LiteralExpr) position).getLiteral().getNumberValue();
			if (value < 1) {
				throw new LoweringException(
						"arg() position must be >= 1",
						call.toString(),
						call.getLineNumber(),
						"Arguments start at 1; position 0 would be the name of the script");
			}
			if (value > Integer.MAX_VALUE) {
				throw new LoweringException("arg() position is too large: " + value, call.toString(), call.getLineNumber());
			}
			return (int) value;
		}

		private String envName(Expr.FunctionCall call) throws LoweringException {
			Expr name = call.getArgs().get(0);
			if (name instanceof Expr.LiteralExpr && ((Expr.LiteralExpr) name).getLiteral().getKind() == Literal.Kind.STR) {
				String value = ((Expr.LiteralExpr) name).getLiteral().getStringValue();
				if (ENV_NAME.matcher(value).matches()) {
					return value;
				}
			}
			throw new LoweringException(
					"Environment variable name must be a string literal made of letters, digits and _",
					name.toString(),
					call.getLineNumber());
		}

		/**
		 * Splits the format string of a macro on its <code>{}</code>
		 * placeholders. <code>{{</code> and <code>}}</code> stand for literal
		 * braces.
		 */
		private ShellValue format(Expr.FunctionCall call) throws LoweringException {
			List<Expr> args = call.getArgs();
			if (args.isEmpty()) {
				return new ShellValue.Str("");
			}
			Expr first = args.get(0);
			if (!(first instanceof Expr.LiteralExpr) || ((Expr.LiteralExpr) first).getLiteral().getKind() != Literal.Kind.STR) {
				throw new LoweringException(
						"Format string of " + call.getName() + " must be a string literal",
						first.toString(),
						call.getLineNumber(),
						"Use " + call.getName() + "(\"{}\", value)");
			}
			String format = ((Expr.LiteralExpr) first).getLiteral().getStringValue();
			List<ShellValue> parts = new ArrayList<ShellValue>();
			StringBuilder literal = new StringBuilder();
			int next = 1;
			for (int i = 0; i < format.length(); i++) {
				char c = format.charAt(i);
				char following = i + 1 < format.length() ? format.charAt(i + 1) : 0;
				if (c == '{' && following == '{') {
					literal.append('{');
					i++;
				} else if (c == '{' && following == '}') {
					if (next >= args.size()) {
						throw new LoweringException("Too few arguments for the format string", format, call.getLineNumber());
					}
					if (literal.length() > 0) {
						parts.add(new ShellValue.Str(literal.toString()));
						literal.setLength(0);
					}
					Expr arg = args.get(next++);
					if (typeOf(arg).isVoid()) {
						throw new LoweringException("Cannot format a value of type ()", arg.toString(), arg.getLineNumber());
					}
					parts.add(value(arg));
					i++;
				} else if (c == '{') {
					throw new LoweringException(
							"Unsupported placeholder in format string",
							format,
							call.getLineNumber(),
							"Only {} placeholders are supported");
				} else if (c == '}' && following == '}') {
					literal.append('}');
					i++;
				} else if (c == '}') {
					throw new LoweringException("Unmatched } in format string", format, call.getLineNumber(), "Write }} for a literal brace");
				} else {
					literal.append(c);
				}
			}
			if (next != args.size()) {
				throw new LoweringException("Too many arguments for the format string", format, call.getLineNumber());
			}
			if (literal.length() > 0 || parts.isEmpty()) {
				parts.add(new ShellValue.Str(literal.toString()));
			}
			return parts.size() == 1 ? parts.get(0) : new ShellValue.Concat(parts);
		}

		@Override
		public ShellValue visitBinary(Expr.Binary expr) throws LoweringException {
			BinaryOp op = expr.getOp();
			OperatorClass operatorClass = classify(expr, typeOf(expr.getLeft()), typeOf(expr.getRight()));
			ShellValue left = value(expr.getLeft());
			ShellValue right = value(expr.getRight());
			switch (operatorClass) {
			case ARITHMETIC:
				return new ShellValue.Arithmetic(arithmeticOp(op), left, right);
			case CONCAT:
				return concat(left, right);
			case NUMERIC_COMPARISON:
				return new ShellValue.Comparison(numericComparison(op), left, right);
			case STRING_COMPARISON:
				return new ShellValue.Comparison(op == BinaryOp.EQ ? ComparisonOp.STR_EQ : ComparisonOp.STR_NE, left, right);
			case LOGICAL:
				return new ShellValue.Logical(op == BinaryOp.AND ? LogicalOp.AND : LogicalOp.OR, left, right);
			}
			throw new IllegalStateException("Unknown operator class: " + operatorClass);
		}

		private ShellValue concat(ShellValue left, ShellValue right) {
			List<ShellValue> parts = new ArrayList<ShellValue>();
			for (ShellValue side : Arrays.asList(left, right)) {
				if (side instanceof ShellValue.Concat) {
					parts.addAll(((ShellValue.Concat) side).getParts());
				} else {
					parts.add(side);
				}
			}
			return new ShellValue.Concat(parts);
		}

		@Override
		public ShellValue visitUnary(Expr.Unary expr) throws LoweringException {
			switch (expr.getOp()) {
			case NOT:
				return new ShellValue.Not(condition(expr.getOperand()));
			case NEG:
				requireNumeric(expr.getOperand());
				return new ShellValue.Arithmetic(ArithmeticOp.SUB, new ShellValue.Str("0"), value(expr.getOperand()));
			}
			throw new IllegalStateException("Unknown unary operator: " + expr.getOp());
		}

		@Override
		public ShellValue visitMethodCall(Expr.MethodCall expr) throws LoweringException {
			String method = expr.getMethod();
			if (expr.getArgs().isEmpty()) {
				if (IDENTITY_METHODS.contains(method)) {
					return value(expr.getReceiver());
				}
				ArrayInfo array = receiverArray(expr);
				if ("len".equals(method) && array != null) {
					return new ShellValue.Str(Integer.toString(array.size));
				}
			}
			throw unsupportedMethod(expr);
		}

		private ArrayInfo receiverArray(Expr.MethodCall expr) {
			if (expr.getReceiver() instanceof Expr.Variable) {
				return arrays.get(((Expr.Variable) expr.getReceiver()).getName());
			}
			return null;
		}

		private LoweringException unsupportedMethod(Expr.MethodCall expr) {
			return new LoweringException(
					"Unsupported method '" + expr.getMethod() + "'",
					expr.toString(),
					expr.getLineNumber(),
					"Supported methods: len() on arrays, and " + new java.util.TreeSet<String>(IDENTITY_METHODS));
		}

		@Override
		public ShellValue visitRange(Expr.Range expr) throws LoweringException {
			throw rangeOutsideFor(expr);
		}

		private LoweringException rangeOutsideFor(Expr.Range expr) {
			return new LoweringException("Range is only supported as the iterable of a for loop", expr.toString(), expr.getLineNumber());
		}

		@Override
		public ShellValue visitArray(Expr.ArrayLiteral expr) throws LoweringException {
			throw new LoweringException(
					"Array literal is only supported as the value of a let binding or the iterable of a for loop",
					expr.toString(),
					expr.getLineNumber());
		}

		@Override
		public ShellValue visitIndex(Expr.Index expr) throws LoweringException {
			String array = arrayName(expr);
			return new ShellValue.Variable(elementName(array, index(expr, arrays.get(array))));
		}

		private String arrayName(Expr.Index expr) throws LoweringException {
			Expr object = expr.getObject();
			if (object instanceof Expr.Variable && arrays.containsKey(((Expr.Variable) object).getName())) {
				return ((Expr.Variable) object).getName();
			}
			throw new LoweringException("Only arrays bound with let can be indexed", object.toString(), expr.getLineNumber());
		}

		private long index(Expr.Index expr, ArrayInfo array) throws LoweringException {
			Expr index = expr.getIndex();
			if (!(index instanceof Expr.LiteralExpr) || ((Expr.LiteralExpr) index).getLiteral().getKind() != Literal.Kind.U32) {
				throw new LoweringException(
						"Array index must be an integer literal",
						index.toString(),
						expr.getLineNumber(),
						"Iterate over the array with for instead");
			}
			long value = ((Expr.LiteralExpr) index).getLiteral().getNumberValue();
			if (value >= array.size) {
				throw new LoweringException(
						"Array index out of bounds: " + value + " (length " + array.size + ")",
						expr.toString(),
						expr.getLineNumber());
			}
			return value;
		}

		@Override
		public ShellValue visitTry(Expr.Try expr) throws LoweringException {
			throw tryOperator(expr);
		}

		private LoweringException tryOperator(Expr.Try expr) {
			return new LoweringException("The ? operator has no shell translation", expr.toString(), expr.getLineNumber());
		}

		@Override
		public ShellValue visitBlock(Expr.Block expr) throws LoweringException {
			List<Stmt> statements = expr.getStatements();
			if (statements.size() == 1 && statements.get(0) instanceof Stmt.ExprStmt) {
				return value(((Stmt.ExprStmt) statements.get(0)).getExpr());
			}
			throw new LoweringException(
					"Block expression is only supported as the value of a let binding",
					expr.toString(),
					expr.getLineNumber(),
					"Bind the block to a variable with let first");
		}

		private LoweringException unknownVariable(Expr.Variable expr) {
			return new LoweringException(
					"Unknown variable '" + expr.getName() + "'",
					expr.getName(),
					expr.getLineNumber(),
					"Declare it with let before using it");
		}

		private OperatorClass classify(Expr.Binary expr, Type left, Type right) throws LoweringException {
			BinaryOp op = expr.getOp();
			switch (op) {
			case ADD:
				if (left.isNumeric() && right.isNumeric()) {
					return OperatorClass.ARITHMETIC;
				}
				if ((left.isString() || right.isString()) && isScalar(left) && isScalar(right)) {
					return OperatorClass.CONCAT;
				}
				throw operandError(expr, left, right, "u32 or str");
			case SUB:
			case MUL:
			case DIV:
			case MOD:
				if (left.isNumeric() && right.isNumeric()) {
					return OperatorClass.ARITHMETIC;
				}
				throw operandError(expr, left, right, "u32");
			case EQ:
			case NE:
				if (left.isNumeric() && right.isNumeric()) {
					return OperatorClass.NUMERIC_COMPARISON;
				}
				if (isScalar(left) && isScalar(right) && (left.equals(right) || left.isString() || right.isString())) {
					return OperatorClass.STRING_COMPARISON;
				}
				throw operandError(expr, left, right, "comparable");
			case LT:
			case LE:
			case GT:
			case GE:
				if (left.isNumeric() && right.isNumeric()) {
					return OperatorClass.NUMERIC_COMPARISON;
				}
				throw operandError(expr, left, right, "u32");
			case AND:
			case OR:
				if (left.isBool() && right.isBool()) {
					return OperatorClass.LOGICAL;
				}
				throw operandError(expr, left, right, "bool");
			}
			throw new IllegalStateException("Unknown operator: " + op);
		}

		private boolean isScalar(Type type) {
			return type.isNumeric() || type.isString() || type.isBool();
		}

		private LoweringException operandError(Expr.Binary expr, Type left, Type right, String expected) {
			String suggestion = null;
			if (expr.getOp() != BinaryOp.ADD && (left.isString() || right.isString())) {
				suggestion = "Strings only support + (concatenation), == and !=";
			}
			return new LoweringException(
					"Operator " + expr.getOp().getSymbol() + " requires " + expected + " operands, got " + left + " and " + right,
					expr.toString(),
					expr.getLineNumber(),
					suggestion);
		}

		private ArithmeticOp arithmeticOp(BinaryOp op) {
			switch (op) {
			case ADD:
				return ArithmeticOp.ADD;
			case SUB:
				return ArithmeticOp.SUB;
			case MUL:
				return ArithmeticOp.MUL;
			case DIV:
				return ArithmeticOp.DIV;
			case MOD:
				return ArithmeticOp.MOD;
			case EQ:
			case NE:
			case LT:
			case LE:
			case GT:
			case GE:
			case AND:
			case OR:
				throw new IllegalStateException("Not an arithmetic operator: " + op);
			}
			throw new IllegalStateException("Unknown operator: " + op);
		}

		private ComparisonOp numericComparison(BinaryOp op) {
			switch (op) {
			case EQ:
				return ComparisonOp.NUM_EQ;
			case NE:
				return ComparisonOp.NUM_NE;
			case LT:
				return ComparisonOp.NUM_LT;
			case LE:
				return ComparisonOp.NUM_LE;
			case GT:
				return ComparisonOp.NUM_GT;
			case GE:
				return ComparisonOp.NUM_GE;
			case ADD:
			case SUB:
			case MUL:
			case DIV:
			case MOD:
			case AND:
			case OR:
				throw new IllegalStateException("Not a comparison operator: " + op);
			}
			throw new IllegalStateException("Unknown operator: " + op);
		}

		/**
		 * Static type of an expression, as far as the shell needs it: whether
		 * an operator works on numbers, strings or booleans.
		 */
		private final class TypeInference implements ExprVisitor<Type, LoweringException> {

			@Override
			public Type visitLiteral(Expr.LiteralExpr expr) {
				return expr.getLiteral().getType();
			}

			@Override
			public Type visitVariable(Expr.Variable expr) throws LoweringException {
				ArrayInfo array = arrays.get(expr.getName());
				if (array != null) {
					return arrayType(array.elementType);
				}
				Type type = variables.get(expr.getName());
				if (type == null) {
					throw unknownVariable(expr);
				}
				return type;
			}

			@Override
			public Type visitFunctionCall(Expr.FunctionCall call) throws LoweringException {
				Intrinsic intrinsic = Intrinsic.lookup(call.getName());
				if (intrinsic != null) {
					switch (intrinsic) {
					case ARG:
					case ENV:
					case ENV_VAR_OR:
					case FORMAT:
						return Type.STR;
					case STRING_FROM:
						return Type.STR;
					case ARG_COUNT:
					case EXIT_CODE:
						return Type.U32;
					case ARGS:
						return Type.unsupported("args()");
					case EXIT:
					case PROCESS_EXIT:
					case PRINTLN:
					case PRINT:
					case EPRINTLN:
					case EPRINT:
						return Type.VOID;
					}
					throw new IllegalStateException("Unknown intrinsic: " + intrinsic);
				}
				Function callee = program.functions.get(call.getName());
				if (callee != null) {
					return callee.getReturnType();
				}
				if (CommandEffects.isAllowed(call.getName())) {
					// the output of the command
					return Type.STR;
				}
				throw undefinedFunction(call);
			}

			@Override
			public Type visitBinary(Expr.Binary expr) throws LoweringException {
				OperatorClass operatorClass = classify(expr, expr.getLeft().accept(this), expr.getRight().accept(this));
				switch (operatorClass) {
				case ARITHMETIC:
					return Type.U32;
				case CONCAT:
					return Type.STR;
				case NUMERIC_COMPARISON:
				case STRING_COMPARISON:
				case LOGICAL:
					return Type.BOOL;
				}
				throw new IllegalStateException("Unknown operator class: " + operatorClass);
			}

			@Override
			public Type visitUnary(Expr.Unary expr) throws LoweringException {
				switch (expr.getOp()) {
				case NOT:
					return Type.BOOL;
				case NEG:
					return Type.U32;
				}
				throw new IllegalStateException("Unknown unary operator: " + expr.getOp());
			}

			@Override
			public Type visitMethodCall(Expr.MethodCall expr) throws LoweringException {
				String method = expr.getMethod();
				if (expr.getArgs().isEmpty()) {
					if ("to_string".equals(method) || "to_owned".equals(method)) {
						return Type.STR;
					}
					if (IDENTITY_METHODS.contains(method)) {
						return expr.getReceiver().accept(this);
					}
					if ("len".equals(method) && receiverArray(expr) != null) {
						return Type.U32;
					}
				}
				throw unsupportedMethod(expr);
			}

			@Override
			public Type visitRange(Expr.Range expr) throws LoweringException {
				throw rangeOutsideFor(expr);
			}

			@Override
			public Type visitArray(Expr.ArrayLiteral expr) throws LoweringException {
				return arrayType(expr.getElements().isEmpty() ? Type.STR : expr.getElements().get(0).accept(this));
			}

			@Override
			public Type visitIndex(Expr.Index expr) throws LoweringException {
				return arrays.get(arrayName(expr)).elementType;
			}

			@Override
			public Type visitTry(Expr.Try expr) throws LoweringException {
				throw tryOperator(expr);
			}

			@Override
			public Type visitBlock(Expr.Block expr) throws LoweringException {
				return typeOfStatements(expr.getStatements());
			}

			private Type typeOfStatements(List<Stmt> statements) throws LoweringException {
				if (statements.isEmpty()) {
					return Type.VOID;
				}
				Stmt last = statements.get(statements.size() - 1);
				if (last instanceof Stmt.ExprStmt) {
					return ((Stmt.ExprStmt) last).getExpr().accept(this);
				} else if (last instanceof Stmt.If) {
					return typeOfStatements(((Stmt.If) last).getThenBlock());
				} else if (last instanceof Stmt.Match && !((Stmt.Match) last).getArms().isEmpty()) {
					return typeOfStatements(((Stmt.Match) last).getArms().get(0).getBody());
				}
				return Type.VOID;
			}
		}

		/**
		 * Patterns a <code>case</code> arm can express
		 */
		private final class CasePatterns implements PatternVisitor<CasePattern, LoweringException> {

			@Override
			public CasePattern visitLiteral(Pattern.LiteralPattern pattern) {
				return CasePattern.literal(pattern.getLiteral().toShellText());
			}

			@Override
			public CasePattern visitVariable(Pattern.VariablePattern pattern) {
				return CasePattern.wildcard();
			}

			@Override
			public CasePattern visitWildcard(Pattern.Wildcard pattern) {
				return CasePattern.wildcard();
			}

			@Override
			public CasePattern visitTuple(Pattern.TuplePattern pattern) throws LoweringException {
				throw unsupportedPattern(pattern);
			}

			@Override
			public CasePattern visitStruct(Pattern.StructPattern pattern) throws LoweringException {
				throw unsupportedPattern(pattern);
			}

			private LoweringException unsupportedPattern(Pattern pattern) {
				return new LoweringException(
						"Unsupported match pattern: " + pattern,
						pattern.toString(),
						function.getLineNumber(),
						"Match on literals, a variable or _");
			}
		}
	}
}
