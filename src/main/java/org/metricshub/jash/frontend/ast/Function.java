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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function definition. Functions are the only top-level items of a program.
 */
public final class Function {

	private final String name;
	private final List<Parameter> params;
	private final Type returnType;
	private final List<Stmt> body;
	private final int lineNumber;

	/**
	 * @param name function name
	 * @param params formal parameters, in order
	 * @param returnType declared result type, {@link Type#VOID} when omitted
	 * @param body statements of the function
	 * @param lineNumber source line of the <code>fn</code> keyword
	 */
	public Function(String name, List<Parameter> params, Type returnType, List<Stmt> body, int lineNumber) {
		this.name = Objects.requireNonNull(name);
		this.params = Collections.unmodifiableList(new ArrayList<Parameter>(params));
		this.returnType = Objects.requireNonNull(returnType);
		this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
		this.lineNumber = lineNumber;
	}

	public String getName() {
		return name;
	}

	public List<Parameter> getParams() {
		return params;
	}

	public Type getReturnType() {
		return returnType;
	}

	public List<Stmt> getBody() {
		return body;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public String toString() {
		return "fn " + name + params.toString().replace('[', '(').replace(']', ')') + " -> " + returnType;
	}
}
