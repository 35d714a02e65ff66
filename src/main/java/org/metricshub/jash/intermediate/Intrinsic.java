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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Functions and macros the language provides without a definition in the
 * program. Each one has a dedicated lowering in {@link IrBuilder}.
 */
public enum Intrinsic {
	/** <code>arg(n)</code>: the n-th argument of the script, n &gt;= 1 */
	ARG("arg", 1, 1),
	/** <code>args()</code>: all the arguments of the script */
	ARGS("args", 0, 0),
	/** <code>arg_count()</code>: number of arguments of the script */
	ARG_COUNT("arg_count", 0, 0),
	/** <code>exit_code()</code>: exit status of the last command */
	EXIT_CODE("exit_code", 0, 0),
	/** <code>env("NAME")</code>: value of an environment variable */
	ENV("env", 1, 1),
	/** <code>env_var_or("NAME", "default")</code> */
	ENV_VAR_OR("env_var_or", 2, 2),
	/** <code>exit(code)</code> */
	EXIT("exit", 1, 1),
	/** <code>std::process::exit(code)</code> */
	PROCESS_EXIT("std::process::exit", 1, 1),
	/** <code>String::from(value)</code>, the identity in the shell */
	STRING_FROM("String::from", 1, 1),
	/** <code>println!(format, args...)</code> */
	PRINTLN("println!", 0, Integer.MAX_VALUE),
	/** <code>print!(format, args...)</code> */
	PRINT("print!", 1, Integer.MAX_VALUE),
	/** <code>eprintln!(format, args...)</code> */
	EPRINTLN("eprintln!", 0, Integer.MAX_VALUE),
	/** <code>eprint!(format, args...)</code> */
	EPRINT("eprint!", 1, Integer.MAX_VALUE),
	/** <code>format!(format, args...)</code> */
	FORMAT("format!", 1, Integer.MAX_VALUE);

	private static final Map<String, Intrinsic> BY_NAME;

	static {
		Map<String, Intrinsic> byName = new HashMap<String, Intrinsic>();
		for (Intrinsic intrinsic : values()) {
			byName.put(intrinsic.name, intrinsic);
		}
		BY_NAME = Collections.unmodifiableMap(byName);
	}

	private final String name;
	private final int minArgs;
	private final int maxArgs;

	Intrinsic(String name, int minArgs, int maxArgs) {
		this.name = name;
		this.minArgs = minArgs;
		this.maxArgs = maxArgs;
	}

	/**
	 * @param name name used at the call site
	 * @return the intrinsic with this name, or <code>null</code>
	 */
	public static Intrinsic lookup(String name) {
		return BY_NAME.get(name);
	}

	public String getName() {
		return name;
	}

	public int getMinArgs() {
		return minArgs;
	}

	public int getMaxArgs() {
		return maxArgs;
	}

	/**
	 * @param count number of arguments at a call site
	 * @return whether the intrinsic accepts that many arguments
	 */
	public boolean acceptsArgumentCount(int count) {
		return count >= minArgs && count <= maxArgs;
	}
}
