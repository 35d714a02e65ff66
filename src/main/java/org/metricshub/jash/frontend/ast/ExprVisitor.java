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

/**
 * Visitor over the closed set of {@link Expr} variants.
 *
 * @param <R> result of a visit
 * @param <X> exception a visit may throw
 */
public interface ExprVisitor<R, X extends Exception> {

	R visitLiteral(Expr.LiteralExpr expr) throws X;

	R visitVariable(Expr.Variable expr) throws X;

	R visitFunctionCall(Expr.FunctionCall expr) throws X;

	R visitBinary(Expr.Binary expr) throws X;

	R visitUnary(Expr.Unary expr) throws X;

	R visitMethodCall(Expr.MethodCall expr) throws X;

	R visitRange(Expr.Range expr) throws X;

	R visitArray(Expr.ArrayLiteral expr) throws X;

	R visitIndex(Expr.Index expr) throws X;

	R visitTry(Expr.Try expr) throws X;

	R visitBlock(Expr.Block expr) throws X;
}
