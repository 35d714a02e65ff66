package org.metricshub.jash.verify;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * The lines of a shell script, as seen by a quote-aware scanner.
 * <p>
 * A line is a <em>code</em> line when it does not start inside a quoted
 * string and holds something else than a comment. The text of a code line is
 * <em>masked</em>: every character between single quotes is replaced by
 * <code>_</code> and comments are removed, so that rules can look for
 * keywords without being fooled by literal text.
 */
final class ScriptLines {

	private enum State {
		NORMAL,
		SINGLE_QUOTE,
		DOUBLE_QUOTE,
		COMMAND_SUBSTITUTION,
		ARITHMETIC,
		PARENTHESIS
	}

	private static final class Frame {
		private final State state;
		private final int lineNumber;

		private Frame(State state, int lineNumber) {
			this.state = state;
			this.lineNumber = lineNumber;
		}
	}

	/**
	 * One code line of the script
	 */
	static final class Line {
		private final int number;
		private final String masked;

		private Line(int number, String masked) {
			this.number = number;
			this.masked = masked;
		}

		int getNumber() {
			return number;
		}

		/**
		 * @return the masked text, without leading and trailing blanks
		 */
		String getMasked() {
			return masked;
		}

		@Override
		public String toString() {
			return number + ": " + masked;
		}
	}

	private final List<Line> codeLines = new ArrayList<Line>();
	private final List<Integer> backticks = new ArrayList<Integer>();
	private final String firstLine;
	private int unclosedLine = -1;
	private String unclosedQuote;

	private ScriptLines(String script) {
		int end = script.indexOf('\n');
		firstLine = end < 0 ? script : script.substring(0, end);
		scan(script);
	}

	static ScriptLines of(String script) {
		return new ScriptLines(script);
	}

	List<Line> getCodeLines() {
		return Collections.unmodifiableList(codeLines);
	}

	String getFirstLine() {
		return firstLine;
	}

	/**
	 * @return the line numbers where a backtick appears outside single quotes, each line once
	 */
	List<Integer> getBacktickLines() {
		return Collections.unmodifiableList(backticks);
	}

	/**
	 * @return the line where the innermost unterminated construct starts, or {@code -1}
	 */
	int getUnclosedLine() {
		return unclosedLine;
	}

	/**
	 * @return what is left open at the end of the script, or {@code null}
	 */
	String getUnclosedQuote() {
		return unclosedQuote;
	}

	private void scan(String script) {
		Deque<Frame> stack = new ArrayDeque<Frame>();
		stack.push(new Frame(State.NORMAL, 1));
		int lineNumber = 1;
		boolean lineIsCode = true;
		boolean comment = false;
		StringBuilder masked = new StringBuilder();
		int length = script.length();
		for (int i = 0; i < length; i++) {
			char c = script.charAt(i);
			State state = stack.peek().state;
			if (c == '\n') {
				if (state == State.SINGLE_QUOTE) {
					masked.append('_');
				}
				endLine(lineNumber, lineIsCode, masked);
				lineNumber++;
				masked.setLength(0);
				comment = false;
				lineIsCode = stack.peek().state == State.NORMAL;
				continue;
			}
			if (comment) {
				continue;
			}
			char next = i + 1 < length ? script.charAt(i + 1) : '\0';
			switch (state) {
			case SINGLE_QUOTE:
				if (c == '\'') {
					stack.pop();
					masked.append(c);
				} else {
					masked.append('_');
				}
				break;
			case DOUBLE_QUOTE:
				masked.append(c);
				if (c == '\\' && next != '\0' && next != '\n') {
					masked.append(next);
					i++;
				} else if (c == '"') {
					stack.pop();
				} else if (c == '`') {
					backtick(lineNumber);
				} else if (c == '$' && next == '(') {
					i += open(script, i, stack, lineNumber, masked);
				}
				break;
			case ARITHMETIC:
			case PARENTHESIS:
				masked.append(c);
				if (c == '(') {
					stack.push(new Frame(State.PARENTHESIS, lineNumber));
				} else if (c == ')') {
					if (state == State.ARITHMETIC && next == ')') {
						masked.append(next);
						i++;
					}
					stack.pop();
				} else if (c == '$' && next == '(') {
					i += open(script, i, stack, lineNumber, masked);
				}
				break;
			case NORMAL:
			case COMMAND_SUBSTITUTION:
				if (c == '#' && (masked.length() == 0 || Character.isWhitespace(masked.charAt(masked.length() - 1)))) {
					comment = true;
					break;
				}
				masked.append(c);
				if (c == '\\' && next != '\0' && next != '\n') {
					masked.append(next);
					i++;
				} else if (c == '\'') {
					stack.push(new Frame(State.SINGLE_QUOTE, lineNumber));
				} else if (c == '"') {
					stack.push(new Frame(State.DOUBLE_QUOTE, lineNumber));
				} else if (c == '`') {
					backtick(lineNumber);
				} else if (c == '$' && next == '(') {
					i += open(script, i, stack, lineNumber, masked);
				} else if (c == ')' && state == State.COMMAND_SUBSTITUTION) {
					stack.pop();
				}
				break;
			}
		}
		endLine(lineNumber, lineIsCode, masked);
		if (stack.size() > 1) {
			Frame open = stack.peek();
			unclosedLine = open.lineNumber;
			unclosedQuote = describe(open.state);
		}
	}

	/**
	 * Opens <code>$(</code> or <code>$((</code> at position <code>i</code>.
	 *
	 * @return how many characters were consumed after the <code>$</code>
	 */
	private static int open(String script, int i, Deque<Frame> stack, int lineNumber, StringBuilder masked) {
		if (i + 2 < script.length() && script.charAt(i + 2) == '(') {
			stack.push(new Frame(State.ARITHMETIC, lineNumber));
			masked.append("((");
			return 2;
		}
		stack.push(new Frame(State.COMMAND_SUBSTITUTION, lineNumber));
		masked.append('(');
		return 1;
	}

	private void endLine(int lineNumber, boolean lineIsCode, StringBuilder masked) {
		String text = masked.toString().trim();
		if (lineIsCode && !text.isEmpty()) {
			codeLines.add(new Line(lineNumber, text));
		}
	}

	// Lines are scanned in order, so a repeated line can only be the last one
	private void backtick(int lineNumber) {
		if (backticks.isEmpty() || backticks.get(backticks.size() - 1).intValue() != lineNumber) {
			backticks.add(Integer.valueOf(lineNumber));
		}
	}

	private static String describe(State state) {
		switch (state) {
		case SINGLE_QUOTE:
			return "single quote";
		case DOUBLE_QUOTE:
			return "double quote";
		case COMMAND_SUBSTITUTION:
			return "command substitution";
		case ARITHMETIC:
			return "arithmetic expansion";
		case PARENTHESIS:
			return "parenthesis";
		case NORMAL:
			return "nothing";
		}
		throw new IllegalStateException("Unexpected scanner state: " + state);
	}
}
