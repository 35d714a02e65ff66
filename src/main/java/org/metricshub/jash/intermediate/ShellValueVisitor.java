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
 * Visitor over the closed set of {@link ShellValue} variants.
 *
 * @param <R> result of a visit
 * @param <X> exception a visit may throw
 */
public interface ShellValueVisitor<R, X extends Exception> {

	R visitString(ShellValue.Str value) throws X;

	R visitBool(ShellValue.Bool value) throws X;

	R visitVariable(ShellValue.Variable value) throws X;

	R visitCommandSubst(ShellValue.CommandSubst value) throws X;

	R visitConcat(ShellValue.Concat value) throws X;

	R visitComparison(ShellValue.Comparison value) throws X;

	R visitArithmetic(ShellValue.Arithmetic value) throws X;

	R visitLogical(ShellValue.Logical value) throws X;

	R visitNot(ShellValue.Not value) throws X;

	R visitArg(ShellValue.Arg value) throws X;

	R visitArgCount(ShellValue.ArgCount value) throws X;

	R visitEnvVar(ShellValue.EnvVar value) throws X;

	R visitExitCode(ShellValue.ExitCode value) throws X;
}
