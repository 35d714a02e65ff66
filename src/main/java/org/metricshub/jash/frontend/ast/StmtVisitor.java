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
 * Visitor over the closed set of {@link Stmt} variants.
 *
 * @param <R> result of a visit
 * @param <X> exception a visit may throw
 */
public interface StmtVisitor<R, X extends Exception> {

	R visitLet(Stmt.Let stmt) throws X;

	R visitIf(Stmt.If stmt) throws X;

	R visitMatch(Stmt.Match stmt) throws X;

	R visitFor(Stmt.For stmt) throws X;

	R visitWhile(Stmt.While stmt) throws X;

	R visitBreak(Stmt.Break stmt) throws X;

	R visitContinue(Stmt.Continue stmt) throws X;

	R visitReturn(Stmt.Return stmt) throws X;

	R visitExpr(Stmt.ExprStmt stmt) throws X;
}
