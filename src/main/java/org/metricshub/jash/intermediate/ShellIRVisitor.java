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

/**
 * Visitor over the closed set of {@link ShellIR} variants.
 *
 * @param <R> result of a visit
 * @param <X> exception a visit may throw
 */
public interface ShellIRVisitor<R, X extends Exception> {

	R visitLet(ShellIR.Let node) throws X;

	R visitExec(ShellIR.Exec node) throws X;

	R visitIf(ShellIR.If node) throws X;

	R visitSequence(ShellIR.Sequence node) throws X;

	R visitFunction(ShellIR.Function node) throws X;

	R visitEcho(ShellIR.Echo node) throws X;

	R visitFor(ShellIR.For node) throws X;

	R visitForIn(ShellIR.ForIn node) throws X;

	R visitWhile(ShellIR.While node) throws X;

	R visitBreak(ShellIR.Break node) throws X;

	R visitContinue(ShellIR.Continue node) throws X;

	R visitCase(ShellIR.Case node) throws X;

	R visitReturn(ShellIR.Return node) throws X;

	R visitExit(ShellIR.Exit node) throws X;

	R visitNoop(ShellIR.Noop node) throws X;
}
