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
 * Root of the syntax tree: the functions of a program, in source order, and
 * the name of the function the generated script starts with.
 */
public final class RestrictedAst {

	/** Name of the entry function */
	public static final String DEFAULT_ENTRY_POINT = "main";

	private final List<Function> functions;
	private final String entryPoint;

	public RestrictedAst(List<Function> functions, String entryPoint) {
		this.functions = Collections.unmodifiableList(new ArrayList<Function>(functions));
		this.entryPoint = Objects.requireNonNull(entryPoint);
	}

	public List<Function> getFunctions() {
		return functions;
	}

	public String getEntryPoint() {
		return entryPoint;
	}

	/**
	 * @param name function name
	 * @return the first function with this name, or <code>null</code>
	 */
	public Function getFunction(String name) {
		for (Function f : functions) {
			if (f.getName().equals(name)) {
				return f;
			}
		}
		return null;
	}
}
