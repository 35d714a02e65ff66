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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.jash.intermediate.CommandEffects;
import org.metricshub.jash.intermediate.Intrinsic;

/**
 * The one place where names chosen by the program are checked before they
 * become shell function or variable names.
 */
public final class IdentifierRules {

	/**
	 * What an identifier names, which decides the reserved names it must avoid.
	 */
	public enum Role {
		FUNCTION("function"),
		PARAMETER("parameter"),
		VARIABLE("variable"),
		LOOP_VARIABLE("loop variable"),
		PATTERN_VARIABLE("pattern variable");

		private final String description;

		Role(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	/** Prefix of the names the emitter generates */
	public static final String GENERATED_PREFIX = "__jash_";

	private static final Pattern SHELL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/**
	 * Special builtins and keywords of the POSIX shell. A function with one of
	 * these names would never be called, or would break the script.
	 */
	private static final Set<String> RESERVED_FUNCTION_NAMES = new HashSet<String>();

	static {
		Collections.addAll(
				RESERVED_FUNCTION_NAMES,
				"break", "continue", "exit", "return", "shift", "trap", "unset", "export", "readonly", "set",
				"times", "exec", "eval", "true", "false", "test", "local", "read", "cd", "command", "type",
				"wait", "kill", "alias", "unalias", "getopts", "hash", "umask", "ulimit",
				"if", "then", "else", "elif", "fi", "case", "esac", "for", "while", "until", "do", "done", "in",
				"function", "select", "time");
	}

	/**
	 * Variables whose assignment changes how the shell itself behaves.
	 */
	private static final Set<String> RESERVED_VARIABLE_NAMES = new HashSet<String>();

	static {
		Collections.addAll(
				RESERVED_VARIABLE_NAMES,
				"IFS", "PATH", "ENV", "BASH_ENV", "CDPATH", "LC_ALL", "LANG", "PS1", "PS2", "PS4", "OPTIND",
				"OPTARG", "PPID", "SHELLOPTS", "POSIXLY_CORRECT", "HOME", "PWD", "OLDPWD");
	}

	private IdentifierRules() {
		// utility class
	}

	/**
	 * Checks a name the program defines.
	 *
	 * @param name the identifier
	 * @param role what the identifier names
	 * @param lineNumber source line, for the diagnostic
	 * @throws ValidationException when the name is not safe to use in the shell
	 */
	public static void validate(String name, Role role, int lineNumber) throws ValidationException {
		String what = role.getDescription();
		if (name == null || name.isEmpty()) {
			throw new ValidationException("Empty " + what + " name", name, lineNumber);
		}
		if (name.indexOf('\0') >= 0) {
			throw new ValidationException("The " + what + " name contains a NUL byte", name, lineNumber);
		}
		for (char unsafe : new char[] { '$', '`', '\\' }) {
			if (name.indexOf(unsafe) >= 0) {
				throw new ValidationException(
						"The " + what + " name '" + name + "' contains the unsafe character '" + unsafe + "'",
						name,
						lineNumber);
			}
		}
		if (!SHELL_NAME.matcher(name).matches()) {
			throw new ValidationException(
					"The " + what + " name '" + name + "' is not a valid shell identifier",
					name,
					lineNumber,
					"Use letters, digits and underscores, not starting with a digit");
		}
		if ("_".equals(name) || name.startsWith(GENERATED_PREFIX)) {
			throw new ValidationException("The " + what + " name '" + name + "' is reserved", name, lineNumber);
		}
		if (role == Role.FUNCTION) {
			if (RESERVED_FUNCTION_NAMES.contains(name)) {
				throw new ValidationException(
						"The function name '" + name + "' is a reserved shell builtin or keyword",
						name,
						lineNumber,
						"Rename the function");
			}
			if (CommandEffects.isAllowed(name) || Intrinsic.lookup(name) != null) {
				throw new ValidationException(
						"The function name '" + name + "' shadows a built-in function or an allowed command",
						name,
						lineNumber,
						"Rename the function");
			}
		} else if (RESERVED_VARIABLE_NAMES.contains(name)) {
			throw new ValidationException(
					"The " + what + " name '" + name + "' would change the behavior of the shell",
					name,
					lineNumber,
					"Rename the " + what);
		}
	}
}
