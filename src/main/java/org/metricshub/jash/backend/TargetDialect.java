package org.metricshub.jash.backend;

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

import java.util.Locale;

/**
 * Shell the generated script is written for. The script itself is POSIX
 * sh in every case; the dialect decides the interpreter named in the shebang
 * and the shell the external linter checks against.
 */
public enum TargetDialect {
	POSIX("sh", "#!/bin/sh", "sh"),
	BASH("bash", "#!/bin/bash", "bash"),
	DASH("dash", "#!/bin/dash", "dash"),
	ASH("ash", "#!/bin/ash", "sh");

	private final String shellName;
	private final String shebang;
	private final String lintShell;

	TargetDialect(String shellName, String shebang, String lintShell) {
		this.shellName = shellName;
		this.shebang = shebang;
		this.lintShell = lintShell;
	}

	/**
	 * @return name of the interpreter: <code>sh</code>, <code>bash</code>...
	 */
	public String getShellName() {
		return shellName;
	}

	/**
	 * @return first line of the generated script
	 */
	public String getShebang() {
		return shebang;
	}

	/**
	 * @return the value of ShellCheck's <code>--shell</code> option for this dialect
	 */
	public String getLintShell() {
		return lintShell;
	}

	/**
	 * Parses a dialect name as typed on the command line: <code>sh</code>,
	 * <code>posix</code>, <code>bash</code>, <code>dash</code> or <code>ash</code>.
	 *
	 * @param name the name, in any case
	 * @return the dialect
	 * @throws IllegalArgumentException for an unknown name
	 */
	public static TargetDialect fromName(String name) {
		String lower = name.toLowerCase(Locale.ROOT);
		if ("posix".equals(lower)) {
			return POSIX;
		}
		for (TargetDialect dialect : values()) {
			if (dialect.shellName.equals(lower)) {
				return dialect;
			}
		}
		throw new IllegalArgumentException("Unknown target shell: " + name + " (expecting sh, bash, dash or ash)");
	}
}
