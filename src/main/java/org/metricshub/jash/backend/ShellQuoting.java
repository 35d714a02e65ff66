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

import java.util.regex.Pattern;

/**
 * Quoting rules of the POSIX shell.
 */
public final class ShellQuoting {

	/**
	 * Words made only of these characters mean the same quoted or not: no
	 * expansion, no globbing, no field splitting, no tilde.
	 */
	private static final Pattern BARE_WORD = Pattern.compile("[A-Za-z0-9_./:,+-]+");

	private static final Pattern SHELL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private ShellQuoting() {}

	/**
	 * @param text any text
	 * @return the text as one shell word with no expansion at all
	 */
	public static String singleQuote(String text) {
		return "'" + text.replace("'", "'\\''") + "'";
	}

	/**
	 * @param text any text
	 * @return the text as a word, bare when that is provably safe, single-quoted otherwise
	 */
	public static String literalWord(String text) {
		return isBareWord(text) ? text : singleQuote(text);
	}

	/**
	 * @param text any text
	 * @return whether the text can be written unquoted
	 */
	public static boolean isBareWord(String text) {
		return BARE_WORD.matcher(text).matches();
	}

	/**
	 * Escapes the characters that keep a special meaning between double
	 * quotes: <code>$</code>, backtick, <code>\</code> and <code>"</code>.
	 *
	 * @param text any text
	 * @return the text, ready to be placed between double quotes
	 */
	public static String escapeDoubleQuoted(String text) {
		StringBuilder result = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '$' || c == '`' || c == '\\' || c == '"') {
				result.append('\\');
			}
			result.append(c);
		}
		return result.toString();
	}

	/**
	 * @param name a variable or function name
	 * @return whether the shell accepts it as a name
	 */
	public static boolean isShellName(String name) {
		return SHELL_NAME.matcher(name).matches();
	}
}
