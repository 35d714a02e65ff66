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

import java.util.regex.Pattern;

/**
 * Shell injection vectors a string literal is scanned for.
 * <p>
 * Literals are checked against the patterns in declaration order and the
 * first match is reported. Each pattern applies from a minimum
 * {@link ValidationLevel}; {@link ValidationLevel#NONE} scans for nothing.
 * <p>
 * A newline on its own is legitimate in a multi-line literal: only a newline
 * followed by a dangerous command is rejected.
 */
public enum InjectionPattern {

	NUL_BYTE("a NUL byte", ValidationLevel.MINIMAL, false, "\\x00", "Remove the \\0 character"),

	CONTROL_CHARACTER(
			"a control character",
			ValidationLevel.PARANOID,
			false,
			"[\\x01-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]",
			"Only tabs and line breaks are accepted in paranoid mode"),

	NEWLINE_COMMAND(
			"a line break followed by a command",
			ValidationLevel.MINIMAL,
			false,
			"[\\r\\n]\\s*(rm|curl|wget|eval|exec|bash|sh|sudo|chmod|chown|nc|dd|mkfs|kill|reboot|shutdown|python|perl)(\\s|$|;)",
			"Print each line with its own println! call"),

	SHELLSHOCK("a function definition (Shellshock)", ValidationLevel.MINIMAL, false, "\\(\\)\\s*\\{", null),

	JNDI_LOOKUP("a JNDI lookup", ValidationLevel.MINIMAL, false, "(?i)\\$\\{\\s*jndi:", null),

	COMMAND_SUBSTITUTION(
			"a command substitution $(...)",
			ValidationLevel.MINIMAL,
			false,
			"\\$\\(",
			"Call the command as a function and bind its output with let"),

	BACKTICK("a backtick command substitution", ValidationLevel.MINIMAL, false, "`", null),

	HERE_DOCUMENT("a here-document <<", ValidationLevel.STRICT, false, "<<", null),

	AND_OPERATOR("the && operator", ValidationLevel.STRICT, false, "&&", "Run each command with its own statement"),

	OR_OPERATOR("the || operator", ValidationLevel.STRICT, false, "\\|\\|", "Run each command with its own statement"),

	PIPE("a pipe |", ValidationLevel.STRICT, false, "\\|", null),

	COMMAND_SEPARATOR("a command separator ;", ValidationLevel.STRICT, false, ";", "Run each command with its own statement"),

	VARIABLE_EXPANSION(
			"a variable expansion",
			ValidationLevel.STRICT,
			false,
			"\\$[A-Za-z_{(@*#?!$-]",
			"Read variables with env(\"NAME\") and concatenate them with +"),

	UNBALANCED_QUOTE("an unbalanced quote next to a shell metacharacter", ValidationLevel.STRICT, false, null, null),

	GLOB("a glob character", ValidationLevel.STRICT, true, "[*?\\[]", "Match on exact values only");

	private static final String METACHARACTERS = ";&|$`<>(){}\\";

	private final String description;
	private final ValidationLevel minimumLevel;
	private final boolean patternOnly;
	private final Pattern regex;
	private final String suggestion;

	InjectionPattern(String description, ValidationLevel minimumLevel, boolean patternOnly, String regex, String suggestion) {
		this.description = description;
		this.minimumLevel = minimumLevel;
		this.patternOnly = patternOnly;
		this.regex = regex == null ? null : Pattern.compile(regex);
		this.suggestion = suggestion;
	}

	/**
	 * @return what the pattern detects, in the words of an error message
	 */
	public String getDescription() {
		return description;
	}

	/**
	 * @return how to fix a literal that matches, or <code>null</code>
	 */
	public String getSuggestion() {
		return suggestion;
	}

	/**
	 * @param level the validation level in effect
	 * @param matchPattern whether the literal is a pattern of a match arm
	 * @return whether this pattern is scanned for
	 */
	public boolean appliesTo(ValidationLevel level, boolean matchPattern) {
		if (level == ValidationLevel.NONE || (patternOnly && !matchPattern)) {
			return false;
		}
		return level.compareTo(minimumLevel) >= 0;
	}

	/**
	 * @param literal the text of a string literal
	 * @return whether the literal contains this vector
	 */
	public boolean matches(String literal) {
		if (regex != null) {
			return regex.matcher(literal).find();
		}
		return hasUnbalancedQuote(literal, '\'') || hasUnbalancedQuote(literal, '"');
	}

	/**
	 * An odd number of quotes, one of which touches a metacharacter. An
	 * apostrophe between letters ("Don't") is left alone.
	 */
	private static boolean hasUnbalancedQuote(String literal, char quote) {
		int count = 0;
		boolean adjacent = false;
		for (int i = 0; i < literal.length(); i++) {
			if (literal.charAt(i) != quote) {
				continue;
			}
			count++;
			if ((i > 0 && METACHARACTERS.indexOf(literal.charAt(i - 1)) >= 0)
					|| (i + 1 < literal.length() && METACHARACTERS.indexOf(literal.charAt(i + 1)) >= 0)) {
				adjacent = true;
			}
		}
		return count % 2 == 1 && adjacent;
	}

	/**
	 * Returns the first pattern the literal matches.
	 *
	 * @param literal the text of a string literal
	 * @param level the validation level in effect
	 * @param matchPattern whether the literal is a pattern of a match arm
	 * @return the first matching pattern, or <code>null</code> if the literal is safe
	 */
	public static InjectionPattern find(String literal, ValidationLevel level, boolean matchPattern) {
		for (InjectionPattern pattern : values()) {
			if (pattern.appliesTo(level, matchPattern) && pattern.matches(literal)) {
				return pattern;
			}
		}
		return null;
	}
}
