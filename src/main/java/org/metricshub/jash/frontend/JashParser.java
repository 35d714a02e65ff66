package org.metricshub.jash.frontend;

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

import java.io.IOException;
import java.io.LineNumberReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jash.frontend.ast.BinaryOp;
import org.metricshub.jash.frontend.ast.Expr;
import org.metricshub.jash.frontend.ast.Function;
import org.metricshub.jash.frontend.ast.Literal;
import org.metricshub.jash.frontend.ast.MatchArm;
import org.metricshub.jash.frontend.ast.Parameter;
import org.metricshub.jash.frontend.ast.Pattern;
import org.metricshub.jash.frontend.ast.RestrictedAst;
import org.metricshub.jash.frontend.ast.Stmt;
import org.metricshub.jash.frontend.ast.Type;
import org.metricshub.jash.frontend.ast.UnaryOp;
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts the source text of a Jash program into a {@link RestrictedAst}.
 * <p>
 * The lexer and the recursive descent parser are hand-written. The lexer
 * reads one character ahead and produces one token at a time; the parser
 * never needs more than the current token to decide which rule applies.
 * <p>
 * The parser only knows the grammar. It accepts programs that later stages
 * will reject (recursive functions, unsafe identifiers, unsupported types),
 * so that those stages can report them with a precise diagnostic. It does
 * refuse programs nested deeper than {@link #MAX_PARSE_DEPTH}, to keep its
 * own recursion bounded.
 */
public class JashParser {

	private static final Logger LOG = JashLogger.getLogger(JashParser.class);

	/**
	 * Maximum recursion depth of the parser (nested blocks, parenthesized and
	 * unary expressions). Well beyond what validation accepts.
	 */
	public static final int MAX_PARSE_DEPTH = 200;

	/** Lexer token values. */
	enum Token {
		EOF,
		IDENT,
		MACRO,
		INTEGER,
		STRING,

		KW_FN,
		KW_LET,
		KW_MUT,
		KW_IF,
		KW_ELSE,
		KW_MATCH,
		KW_FOR,
		KW_IN,
		KW_WHILE,
		KW_LOOP,
		KW_BREAK,
		KW_CONTINUE,
		KW_RETURN,
		KW_TRUE,
		KW_FALSE,

		OPEN_PAREN,
		CLOSE_PAREN,
		OPEN_BRACE,
		CLOSE_BRACE,
		OPEN_BRACKET,
		CLOSE_BRACKET,
		COMMA,
		SEMICOLON,
		COLON,
		PATH_SEP,
		ARROW,
		FAT_ARROW,
		DOT,
		DOT_DOT,
		DOT_DOT_EQ,
		HASH,
		QUESTION,
		AMPERSAND,

		PLUS,
		MINUS,
		STAR,
		SLASH,
		PERCENT,

		ASSIGN,
		PLUS_ASSIGN,
		MINUS_ASSIGN,
		STAR_ASSIGN,
		SLASH_ASSIGN,
		PERCENT_ASSIGN,

		EQ,
		NE,
		LT,
		LE,
		GT,
		GE,
		AND,
		OR,
		NOT
	}

	/**
	 * Contains a mapping of Jash keywords to their token values.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("fn", Token.KW_FN);
		KEYWORDS.put("let", Token.KW_LET);
		KEYWORDS.put("mut", Token.KW_MUT);

		// statements
		KEYWORDS.put("if", Token.KW_IF);
		KEYWORDS.put("else", Token.KW_ELSE);
		KEYWORDS.put("match", Token.KW_MATCH);
		KEYWORDS.put("for", Token.KW_FOR);
		KEYWORDS.put("in", Token.KW_IN);
		KEYWORDS.put("while", Token.KW_WHILE);
		KEYWORDS.put("loop", Token.KW_LOOP);
		KEYWORDS.put("break", Token.KW_BREAK);
		KEYWORDS.put("continue", Token.KW_CONTINUE);
		KEYWORDS.put("return", Token.KW_RETURN);

		// literals
		KEYWORDS.put("true", Token.KW_TRUE);
		KEYWORDS.put("false", Token.KW_FALSE);
	}

	/**
	 * Keywords of the host language whose features are deliberately left out.
	 * Meeting one of them is a parse error naming the keyword.
	 */
	private static final Set<String> UNSUPPORTED_KEYWORDS = new HashSet<String>();

	static {
		String[] keywords = {
				"as", "async", "await", "const", "crate", "dyn", "enum", "extern", "impl", "macro_rules", "mod",
				"move", "pub", "ref", "self", "Self", "static", "struct", "super", "trait", "type", "unsafe", "use",
				"where", "yield" };
		Collections.addAll(UNSUPPORTED_KEYWORDS, keywords);
	}

	/**
	 * The only macros a program may invoke. Everything else ending with
	 * <code>!</code> is rejected.
	 */
	private static final Set<String> MACROS = new HashSet<String>();

	static {
		Collections.addAll(MACROS, "println", "print", "eprintln", "eprint", "format");
	}

	private ScriptSource scriptSource;
	private LineNumberReader reader;
	private int c;
	private Token token;
	private int tokenLineNumber;
	private int depth;

	private StringBuffer text = new StringBuffer();
	private StringBuffer string = new StringBuffer();

	/**
	 * Parse the program read from the specified source.
	 *
	 * @param source the program source
	 * @return the syntax tree of the program, whose entry point is
	 *         {@link RestrictedAst#DEFAULT_ENTRY_POINT}
	 * @throws IOException upon an error reading the source
	 * @throws ParserException when the source is not a valid program
	 */
	public RestrictedAst parse(ScriptSource source) throws IOException, ParserException {
		if (source == null) {
			throw new IOException("No source supplied");
		}
		this.scriptSource = source;
		this.reader = new LineNumberReader(source.getReader());
		this.depth = 0;
		text.setLength(0);
		read();
		lexer();
		RestrictedAst ast = PROGRAM();
		LOG.debug("Parsed {} function(s) from {}", ast.getFunctions().size(), source.getDescription());
		return ast;
	}

	private void read() throws IOException {
		text.append((char) c);
		c = reader.read();
		// completely bypass \r's
		while (c == '\r') {
			c = reader.read();
		}
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, scriptSource.getDescription(), reader.getLineNumber() + 1, text.toString());
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, scriptSource.getDescription(), tokenLineNumber, text.toString());
	}

	private ParserException parserException(String msg, String suggestion) {
		return new ParserException(msg, scriptSource.getDescription(), tokenLineNumber, text.toString(), suggestion);
	}

	/**
	 * Reads the string and handle all escape codes.
	 * On entry, <code>c</code> is the opening double quote.
	 */
	private void readString() throws IOException, LexerException {
		string.setLength(0);
		read();
		while (c != '"') {
			if (c < 0) {
				throw lexerException("Unterminated string: " + text);
			}
			if (c == '\\') {
				read();
				switch (c) {
				case 'n':
					string.append('\n');
					break;
				case 't':
					string.append('\t');
					break;
				case 'r':
					string.append('\r');
					break;
				case '0':
					string.append('\0');
					break;
				case '\\':
					string.append('\\');
					break;
				case '"':
					string.append('"');
					break;
				case '\'':
					string.append('\'');
					break;
				case 'u':
					read();
					readUnicodeEscape();
					continue;
				case '\n':
					// line continuation: the newline and the indentation that follows are dropped
					read();
					while (c == ' ' || c == '\t' || c == '\n') {
						read();
					}
					continue;
				default:
					throw lexerException("Unknown escape sequence: \\" + (char) c);
				}
				read();
			} else {
				string.append((char) c);
				read();
			}
		}
		// closing quote
		read();
	}

	/**
	 * Reads <code>{XXXX}</code> after <code>\\u</code>.
	 */
	private void readUnicodeEscape() throws IOException, LexerException {
		if (c != '{') {
			throw lexerException("Expecting { after \\u");
		}
		read();
		StringBuilder hex = new StringBuilder();
		while (c >= 0 && c != '}' && hex.length() <= 6) {
			hex.append((char) c);
			read();
		}
		if (c != '}' || hex.length() == 0 || hex.length() > 6) {
			throw lexerException("Malformed unicode escape: \\u{" + hex);
		}
		int codePoint;
		try {
			codePoint = Integer.parseInt(hex.toString(), 16);
		} catch (NumberFormatException nfe) {
			throw lexerException("Malformed unicode escape: \\u{" + hex + "}");
		}
		if (!Character.isValidCodePoint(codePoint)) {
			throw lexerException("Invalid code point in unicode escape: \\u{" + hex + "}");
		}
		string.appendCodePoint(codePoint);
		read();
	}

	/**
	 * Skips a <code>/* ... *&#47;</code> comment. On entry, <code>c</code> is
	 * the star following the slash.
	 */
	private void skipBlockComment() throws IOException, LexerException {
		read();
		while (true) {
			if (c < 0) {
				throw lexerException("Unterminated comment");
			}
			if (c == '*') {
				read();
				if (c == '/') {
					read();
					return;
				}
			} else {
				read();
			}
		}
	}

	private Token lexer(Token expectedToken) throws IOException, ParserException {
		if (token != expectedToken) {
			throw parserException("Expecting " + expectedToken.name() + ". Found: " + token.name() + " (" + text + ")");
		}
		return lexer();
	}

	private Token lexer() throws IOException, ParserException {
		while (true) {
			// clear whitespace
			while (c == ' ' || c == '\t' || c == '\n') {
				read();
			}
			text.setLength(0);
			tokenLineNumber = reader.getLineNumber() + 1;
			if (c != '/') {
				break;
			}
			read();
			if (c == '/') {
				// kill comment
				while (c >= 0 && c != '\n') {
					read();
				}
			} else if (c == '*') {
				skipBlockComment();
			} else if (c == '=') {
				read();
				return token = Token.SLASH_ASSIGN;
			} else {
				return token = Token.SLASH;
			}
		}

		if (c < 0) {
			return token = Token.EOF;
		}

		if (Character.isDigit(c)) {
			while (Character.isDigit(c) || c == '_') {
				read();
			}
			if (Character.isLetter(c)) {
				throw lexerException("Number literals cannot have a suffix: " + text + (char) c);
			}
			return token = Token.INTEGER;
		}

		if (Character.isLetter(c) || c == '_') {
			while (Character.isLetterOrDigit(c) || c == '_') {
				read();
			}
			String word = text.toString();
			Token keyword = KEYWORDS.get(word);
			if (keyword != null) {
				return token = keyword;
			}
			if (UNSUPPORTED_KEYWORDS.contains(word)) {
				throw parserException("Unsupported language feature: '" + word + "'");
			}
			if (c == '!' && MACROS.contains(word)) {
				read();
				return token = Token.MACRO;
			}
			return token = Token.IDENT;
		}

		switch (c) {
		case '"':
			readString();
			return token = Token.STRING;
		case '\'':
			throw lexerException("Character literals and lifetimes are not supported");
		case '(':
			read();
			return token = Token.OPEN_PAREN;
		case ')':
			read();
			return token = Token.CLOSE_PAREN;
		case '{':
			read();
			return token = Token.OPEN_BRACE;
		case '}':
			read();
			return token = Token.CLOSE_BRACE;
		case '[':
			read();
			return token = Token.OPEN_BRACKET;
		case ']':
			read();
			return token = Token.CLOSE_BRACKET;
		case ',':
			read();
			return token = Token.COMMA;
		case ';':
			read();
			return token = Token.SEMICOLON;
		case '#':
			read();
			return token = Token.HASH;
		case '?':
			read();
			return token = Token.QUESTION;
		case ':':
			read();
			if (c == ':') {
				read();
				return token = Token.PATH_SEP;
			}
			return token = Token.COLON;
		case '.':
			read();
			if (c == '.') {
				read();
				if (c == '=') {
					read();
					return token = Token.DOT_DOT_EQ;
				}
				return token = Token.DOT_DOT;
			}
			return token = Token.DOT;
		case '+':
			read();
			if (c == '=') {
				read();
				return token = Token.PLUS_ASSIGN;
			}
			return token = Token.PLUS;
		case '-':
			read();
			if (c == '>') {
				read();
				return token = Token.ARROW;
			} else if (c == '=') {
				read();
				return token = Token.MINUS_ASSIGN;
			}
			return token = Token.MINUS;
		case '*':
			read();
			if (c == '=') {
				read();
				return token = Token.STAR_ASSIGN;
			}
			return token = Token.STAR;
		case '%':
			read();
			if (c == '=') {
				read();
				return token = Token.PERCENT_ASSIGN;
			}
			return token = Token.PERCENT;
		case '=':
			read();
			if (c == '=') {
				read();
				return token = Token.EQ;
			} else if (c == '>') {
				read();
				return token = Token.FAT_ARROW;
			}
			return token = Token.ASSIGN;
		case '!':
			read();
			if (c == '=') {
				read();
				return token = Token.NE;
			}
			return token = Token.NOT;
		case '<':
			read();
			if (c == '=') {
				read();
				return token = Token.LE;
			} else if (c == '<') {
				throw lexerException("Shift operators are not supported");
			}
			return token = Token.LT;
		case '>':
			read();
			if (c == '=') {
				read();
				return token = Token.GE;
			}
			return token = Token.GT;
		case '&':
			read();
			if (c == '&') {
				read();
				return token = Token.AND;
			}
			return token = Token.AMPERSAND;
		case '|':
			read();
			if (c == '|') {
				read();
				return token = Token.OR;
			}
			throw lexerException("Closures and bitwise operators are not supported");
		default:
			throw lexerException("Invalid character (" + c + "): " + ((char) c));
		}
	}

	// SUPPORTING FUNCTIONS/METHODS

	/**
	 * Consumes the semicolon ending a simple statement. The semicolon may be
	 * omitted before the closing brace of a block.
	 */
	private void terminator() throws IOException, ParserException {
		if (token == Token.SEMICOLON) {
			lexer();
		} else if (token != Token.CLOSE_BRACE) {
			throw parserException("Expecting ;. Got " + token.name() + ": " + text);
		}
	}

	private void optSemicolon() throws IOException, ParserException {
		if (token == Token.SEMICOLON) {
			lexer();
		}
	}

	private void enterNesting() throws ParserException {
		if (++depth > MAX_PARSE_DEPTH) {
			throw parserException("Program nests deeper than " + MAX_PARSE_DEPTH + " levels");
		}
	}

	private void exitNesting() {
		depth--;
	}

	private String identifier() throws IOException, ParserException {
		if (token != Token.IDENT) {
			throw parserException("Expecting an identifier. Got " + token.name() + ": " + text);
		}
		String name = text.toString();
		lexer();
		return name;
	}

	private long integerValue() throws ParserException {
		String digits = text.toString().replace("_", "");
		try {
			long value = Long.parseLong(digits);
			if (value > Literal.MAX_U32) {
				throw parserException("Integer literal out of u32 range: " + digits);
			}
			return value;
		} catch (NumberFormatException nfe) {
			throw parserException("Integer literal out of u32 range: " + digits);
		}
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : FUNCTION* EOF
	RestrictedAst PROGRAM() throws IOException, ParserException {
		List<Function> functions = new ArrayList<Function>();
		while (token != Token.EOF) {
			if (token == Token.HASH) {
				throw parserException("Attributes are only supported on loops");
			}
			functions.add(FUNCTION());
		}
		return new RestrictedAst(functions, RestrictedAst.DEFAULT_ENTRY_POINT);
	}

	// FUNCTION : fn IDENT ( [PARAM {, PARAM}] ) [-> TYPE] BLOCK
	Function FUNCTION() throws IOException, ParserException {
		if (token != Token.KW_FN) {
			throw parserException("Expecting a function definition. Got " + token.name() + ": " + text,
					"Only functions may appear at the top level of a program");
		}
		int lineNumber = tokenLineNumber;
		lexer();
		String name = identifier();
		lexer(Token.OPEN_PAREN);
		List<Parameter> params = new ArrayList<Parameter>();
		while (token != Token.CLOSE_PAREN) {
			String paramName = identifier();
			lexer(Token.COLON);
			params.add(new Parameter(paramName, TYPE()));
			if (token == Token.COMMA) {
				lexer();
			} else if (token != Token.CLOSE_PAREN) {
				throw parserException("Expecting , or ) in the parameter list of " + name);
			}
		}
		lexer(Token.CLOSE_PAREN);
		Type returnType = Type.VOID;
		if (token == Token.ARROW) {
			lexer();
			returnType = TYPE();
		}
		List<Stmt> body = BLOCK();
		return new Function(name, params, returnType, body, lineNumber);
	}

	// TYPE : & [mut] TYPE | ( ) | u32 | bool | str | String | Option<TYPE> | Result<TYPE, TYPE> | IDENT [<...>]
	Type TYPE() throws IOException, ParserException {
		if (token == Token.AMPERSAND) {
			lexer();
			if (token == Token.KW_MUT) {
				lexer();
			}
			return TYPE();
		}
		if (token == Token.OPEN_PAREN) {
			lexer();
			if (token == Token.CLOSE_PAREN) {
				lexer();
				return Type.VOID;
			}
			StringBuilder tuple = new StringBuilder("(");
			tuple.append(TYPE());
			while (token == Token.COMMA) {
				lexer();
				tuple.append(", ").append(TYPE());
			}
			lexer(Token.CLOSE_PAREN);
			return Type.unsupported(tuple.append(')').toString());
		}
		if (token == Token.OPEN_BRACKET) {
			lexer();
			Type element = TYPE();
			if (token == Token.SEMICOLON) {
				lexer();
				lexer(Token.INTEGER);
			}
			lexer(Token.CLOSE_BRACKET);
			return Type.unsupported("[" + element + "]");
		}
		String name = identifier();
		if ("u32".equals(name)) {
			return Type.U32;
		} else if ("bool".equals(name)) {
			return Type.BOOL;
		} else if ("str".equals(name) || "String".equals(name)) {
			return Type.STR;
		} else if ("Option".equals(name)) {
			lexer(Token.LT);
			Type inner = TYPE();
			lexer(Token.GT);
			return Type.option(inner);
		} else if ("Result".equals(name)) {
			lexer(Token.LT);
			Type ok = TYPE();
			lexer(Token.COMMA);
			Type err = TYPE();
			lexer(Token.GT);
			return Type.result(ok, err);
		}
		if (token == Token.LT) {
			StringBuilder generic = new StringBuilder(name).append('<');
			lexer();
			generic.append(TYPE());
			while (token == Token.COMMA) {
				lexer();
				generic.append(", ").append(TYPE());
			}
			lexer(Token.GT);
			return Type.unsupported(generic.append('>').toString());
		}
		return Type.unsupported(name);
	}

	// BLOCK : { STATEMENT* }
	List<Stmt> BLOCK() throws IOException, ParserException {
		enterNesting();
		lexer(Token.OPEN_BRACE);
		List<Stmt> statements = new ArrayList<Stmt>();
		while (token != Token.CLOSE_BRACE) {
			if (token == Token.EOF) {
				throw parserException("Unexpected end of source: missing }");
			}
			Stmt stmt = STATEMENT();
			if (stmt != null) {
				statements.add(stmt);
			}
		}
		lexer(Token.CLOSE_BRACE);
		exitNesting();
		return statements;
	}

	// STATEMENT : ; | [ATTRIBUTE] LOOP | LET | IF | MATCH | break | continue | return [EXPRESSION] | ASSIGNMENT | EXPRESSION
	Stmt STATEMENT() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		switch (token) {
		case SEMICOLON:
			lexer();
			return null;
		case HASH:
			Long maxIterations = ATTRIBUTE();
			if (token != Token.KW_FOR && token != Token.KW_WHILE && token != Token.KW_LOOP) {
				throw parserException("#[max_iterations] must precede a loop");
			}
			return LOOP(maxIterations);
		case KW_FOR:
		case KW_WHILE:
		case KW_LOOP:
			return LOOP(null);
		case KW_LET:
			return LET();
		case KW_IF:
			Stmt ifStmt = IF_STATEMENT();
			optSemicolon();
			return ifStmt;
		case KW_MATCH:
			Stmt matchStmt = MATCH_STATEMENT();
			optSemicolon();
			return matchStmt;
		case KW_BREAK:
		case KW_CONTINUE:
		case KW_RETURN:
			Stmt jump = JUMP();
			terminator();
			return jump;
		default:
			return EXPRESSION_STATEMENT(lineNumber);
		}
	}

	// ATTRIBUTE : # [ max_iterations = INTEGER ]
	Long ATTRIBUTE() throws IOException, ParserException {
		lexer(Token.HASH);
		lexer(Token.OPEN_BRACKET);
		String name = identifier();
		if (!"max_iterations".equals(name)) {
			throw parserException("Unsupported attribute: " + name, "The only supported attribute is #[max_iterations = N]");
		}
		lexer(Token.ASSIGN);
		if (token != Token.INTEGER) {
			throw parserException("Expecting an integer for max_iterations. Got " + token.name() + ": " + text);
		}
		long bound = integerValue();
		lexer();
		lexer(Token.CLOSE_BRACKET);
		return Long.valueOf(bound);
	}

	// LOOP : for PATTERN in EXPRESSION BLOCK | while EXPRESSION BLOCK | loop BLOCK
	Stmt LOOP(Long maxIterations) throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		Stmt loop;
		if (token == Token.KW_FOR) {
			lexer();
			Pattern pattern = PATTERN();
			lexer(Token.KW_IN);
			Expr iterable = EXPRESSION();
			loop = new Stmt.For(pattern, iterable, BLOCK(), maxIterations, lineNumber);
		} else if (token == Token.KW_WHILE) {
			lexer();
			Expr condition = EXPRESSION();
			loop = new Stmt.While(condition, BLOCK(), maxIterations, lineNumber);
		} else {
			lexer(Token.KW_LOOP);
			Expr always = new Expr.LiteralExpr(Literal.bool(true), lineNumber);
			loop = new Stmt.While(always, BLOCK(), maxIterations, lineNumber);
		}
		optSemicolon();
		return loop;
	}

	// LET : let [mut] IDENT [: TYPE] = EXPRESSION ;
	Stmt LET() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		lexer(Token.KW_LET);
		if (token == Token.KW_MUT) {
			lexer();
		}
		String name = identifier();
		Type declaredType = null;
		if (token == Token.COLON) {
			lexer();
			declaredType = TYPE();
		}
		if (token != Token.ASSIGN) {
			throw parserException("Expecting = in the definition of " + name, "Every let binding needs an initial value");
		}
		lexer();
		Expr value = EXPRESSION();
		terminator();
		return new Stmt.Let(name, declaredType, value, lineNumber);
	}

	// IF_STATEMENT : if EXPRESSION BLOCK [else (IF_STATEMENT | BLOCK)]
	Stmt.If IF_STATEMENT() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		lexer(Token.KW_IF);
		Expr condition = EXPRESSION();
		List<Stmt> thenBlock = BLOCK();
		List<Stmt> elseBlock = null;
		if (token == Token.KW_ELSE) {
			lexer();
			if (token == Token.KW_IF) {
				elseBlock = Collections.<Stmt>singletonList(IF_STATEMENT());
			} else {
				elseBlock = BLOCK();
			}
		}
		return new Stmt.If(condition, thenBlock, elseBlock, lineNumber);
	}

	// MATCH_STATEMENT : match EXPRESSION { ARM {, ARM} [,] }
	Stmt.Match MATCH_STATEMENT() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		lexer(Token.KW_MATCH);
		Expr scrutinee = EXPRESSION();
		enterNesting();
		lexer(Token.OPEN_BRACE);
		List<MatchArm> arms = new ArrayList<MatchArm>();
		while (token != Token.CLOSE_BRACE) {
			Pattern pattern = PATTERN();
			Expr guard = null;
			if (token == Token.KW_IF) {
				lexer();
				guard = EXPRESSION();
			}
			lexer(Token.FAT_ARROW);
			List<Stmt> body;
			if (token == Token.OPEN_BRACE) {
				body = BLOCK();
				if (token == Token.COMMA) {
					lexer();
				}
			} else {
				int armLine = tokenLineNumber;
				if (token == Token.KW_BREAK || token == Token.KW_CONTINUE || token == Token.KW_RETURN) {
					body = Collections.singletonList(JUMP());
				} else {
					body = Collections.<Stmt>singletonList(new Stmt.ExprStmt(EXPRESSION(), armLine));
				}
				if (token == Token.COMMA) {
					lexer();
				} else if (token != Token.CLOSE_BRACE) {
					throw parserException("Expecting , or } after a match arm. Got " + token.name() + ": " + text);
				}
			}
			arms.add(new MatchArm(pattern, guard, body));
		}
		lexer(Token.CLOSE_BRACE);
		exitNesting();
		return new Stmt.Match(scrutinee, arms, lineNumber);
	}

	// JUMP : break | continue | return [EXPRESSION]
	Stmt JUMP() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		if (token == Token.KW_BREAK) {
			lexer();
			return new Stmt.Break(lineNumber);
		} else if (token == Token.KW_CONTINUE) {
			lexer();
			return new Stmt.Continue(lineNumber);
		}
		lexer(Token.KW_RETURN);
		Expr value = null;
		if (token != Token.SEMICOLON && token != Token.CLOSE_BRACE && token != Token.COMMA) {
			value = EXPRESSION();
		}
		return new Stmt.Return(value, lineNumber);
	}

	// EXPRESSION_STATEMENT : IDENT (= | += | -= | *= | /= | %=) EXPRESSION ; | EXPRESSION [;]
	Stmt EXPRESSION_STATEMENT(int lineNumber) throws IOException, ParserException {
		Expr expr = EXPRESSION();
		BinaryOp compound;
		switch (token) {
		case ASSIGN:
			compound = null;
			break;
		case PLUS_ASSIGN:
			compound = BinaryOp.ADD;
			break;
		case MINUS_ASSIGN:
			compound = BinaryOp.SUB;
			break;
		case STAR_ASSIGN:
			compound = BinaryOp.MUL;
			break;
		case SLASH_ASSIGN:
			compound = BinaryOp.DIV;
			break;
		case PERCENT_ASSIGN:
			compound = BinaryOp.MOD;
			break;
		default:
			if (expr instanceof Expr.Block) {
				optSemicolon();
			} else {
				terminator();
			}
			return new Stmt.ExprStmt(expr, lineNumber);
		}
		if (!(expr instanceof Expr.Variable)) {
			throw parserException("Only variables can be assigned. Got: " + expr);
		}
		lexer();
		Expr value = EXPRESSION();
		if (compound != null) {
			value = new Expr.Binary(compound, expr, value, lineNumber);
		}
		terminator();
		return new Stmt.Let(((Expr.Variable) expr).getName(), null, value, lineNumber);
	}

	// PATTERN : INTEGER | STRING | true | false | _ | IDENT | ( [PATTERN {, PATTERN}] ) | IDENT { FIELD,* } | IDENT ( PATTERN,* )
	Pattern PATTERN() throws IOException, ParserException {
		switch (token) {
		case INTEGER:
			Literal number = Literal.u32(integerValue());
			lexer();
			return new Pattern.LiteralPattern(number);
		case STRING:
			Literal str = Literal.str(string.toString());
			lexer();
			return new Pattern.LiteralPattern(str);
		case KW_TRUE:
			lexer();
			return new Pattern.LiteralPattern(Literal.bool(true));
		case KW_FALSE:
			lexer();
			return new Pattern.LiteralPattern(Literal.bool(false));
		case MINUS:
			throw parserException("Negative literal patterns are not supported", "Values are unsigned 32-bit integers");
		case OPEN_PAREN:
			lexer();
			List<Pattern> elements = new ArrayList<Pattern>();
			while (token != Token.CLOSE_PAREN) {
				elements.add(PATTERN());
				if (token == Token.COMMA) {
					lexer();
				} else if (token != Token.CLOSE_PAREN) {
					throw parserException("Expecting , or ) in a tuple pattern. Got " + token.name() + ": " + text);
				}
			}
			lexer(Token.CLOSE_PAREN);
			return new Pattern.TuplePattern(elements);
		case IDENT:
			String name = identifier();
			if (token == Token.OPEN_BRACE) {
				return STRUCT_PATTERN(name);
			} else if (token == Token.OPEN_PAREN) {
				lexer();
				List<Pattern.Field> fields = new ArrayList<Pattern.Field>();
				while (token != Token.CLOSE_PAREN) {
					fields.add(new Pattern.Field(Integer.toString(fields.size()), PATTERN()));
					if (token == Token.COMMA) {
						lexer();
					} else if (token != Token.CLOSE_PAREN) {
						throw parserException("Expecting , or ) in a pattern. Got " + token.name() + ": " + text);
					}
				}
				lexer(Token.CLOSE_PAREN);
				return new Pattern.StructPattern(name, fields);
			} else if ("_".equals(name)) {
				return new Pattern.Wildcard();
			}
			return new Pattern.VariablePattern(name);
		default:
			throw parserException("Expecting a pattern. Got " + token.name() + ": " + text);
		}
	}

	// STRUCT_PATTERN : { [IDENT [: PATTERN] {, IDENT [: PATTERN]}] }
	Pattern STRUCT_PATTERN(String name) throws IOException, ParserException {
		lexer(Token.OPEN_BRACE);
		List<Pattern.Field> fields = new ArrayList<Pattern.Field>();
		while (token != Token.CLOSE_BRACE) {
			String field = identifier();
			Pattern pattern;
			if (token == Token.COLON) {
				lexer();
				pattern = PATTERN();
			} else {
				pattern = new Pattern.VariablePattern(field);
			}
			fields.add(new Pattern.Field(field, pattern));
			if (token == Token.COMMA) {
				lexer();
			} else if (token != Token.CLOSE_BRACE) {
				throw parserException("Expecting , or } in a struct pattern. Got " + token.name() + ": " + text);
			}
		}
		lexer(Token.CLOSE_BRACE);
		return new Pattern.StructPattern(name, fields);
	}

	// EXPRESSION : OR_EXPRESSION [(.. | ..=) OR_EXPRESSION]
	Expr EXPRESSION() throws IOException, ParserException {
		enterNesting();
		int lineNumber = tokenLineNumber;
		Expr expr = OR_EXPRESSION();
		if (token == Token.DOT_DOT || token == Token.DOT_DOT_EQ) {
			boolean inclusive = token == Token.DOT_DOT_EQ;
			lexer();
			expr = new Expr.Range(expr, OR_EXPRESSION(), inclusive, lineNumber);
		}
		exitNesting();
		return expr;
	}

	// OR_EXPRESSION : AND_EXPRESSION {|| AND_EXPRESSION}
	Expr OR_EXPRESSION() throws IOException, ParserException {
		Expr expr = AND_EXPRESSION();
		while (token == Token.OR) {
			int lineNumber = tokenLineNumber;
			lexer();
			expr = new Expr.Binary(BinaryOp.OR, expr, AND_EXPRESSION(), lineNumber);
		}
		return expr;
	}

	// AND_EXPRESSION : COMPARISON {&& COMPARISON}
	Expr AND_EXPRESSION() throws IOException, ParserException {
		Expr expr = COMPARISON();
		while (token == Token.AND) {
			int lineNumber = tokenLineNumber;
			lexer();
			expr = new Expr.Binary(BinaryOp.AND, expr, COMPARISON(), lineNumber);
		}
		return expr;
	}

	// COMPARISON : ADDITIVE [(== | != | < | <= | > | >=) ADDITIVE]
	Expr COMPARISON() throws IOException, ParserException {
		Expr expr = ADDITIVE();
		BinaryOp op = comparisonOperator();
		if (op != null) {
			int lineNumber = tokenLineNumber;
			lexer();
			expr = new Expr.Binary(op, expr, ADDITIVE(), lineNumber);
			if (comparisonOperator() != null) {
				throw parserException("Comparison operators cannot be chained", "Use parentheses or &&");
			}
		}
		return expr;
	}

	private BinaryOp comparisonOperator() {
		switch (token) {
		case EQ:
			return BinaryOp.EQ;
		case NE:
			return BinaryOp.NE;
		case LT:
			return BinaryOp.LT;
		case LE:
			return BinaryOp.LE;
		case GT:
			return BinaryOp.GT;
		case GE:
			return BinaryOp.GE;
		default:
			return null;
		}
	}

	// ADDITIVE : MULTIPLICATIVE {(+ | -) MULTIPLICATIVE}
	Expr ADDITIVE() throws IOException, ParserException {
		Expr expr = MULTIPLICATIVE();
		while (token == Token.PLUS || token == Token.MINUS) {
			BinaryOp op = token == Token.PLUS ? BinaryOp.ADD : BinaryOp.SUB;
			int lineNumber = tokenLineNumber;
			lexer();
			expr = new Expr.Binary(op, expr, MULTIPLICATIVE(), lineNumber);
		}
		return expr;
	}

	// MULTIPLICATIVE : UNARY {(* | / | %) UNARY}
	Expr MULTIPLICATIVE() throws IOException, ParserException {
		Expr expr = UNARY();
		while (token == Token.STAR || token == Token.SLASH || token == Token.PERCENT) {
			BinaryOp op;
			if (token == Token.STAR) {
				op = BinaryOp.MUL;
			} else if (token == Token.SLASH) {
				op = BinaryOp.DIV;
			} else {
				op = BinaryOp.MOD;
			}
			int lineNumber = tokenLineNumber;
			lexer();
			expr = new Expr.Binary(op, expr, UNARY(), lineNumber);
		}
		return expr;
	}

	// UNARY : ! UNARY | - UNARY | & [mut] UNARY | * UNARY | POSTFIX
	Expr UNARY() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		Expr expr;
		switch (token) {
		case NOT:
			enterNesting();
			lexer();
			expr = new Expr.Unary(UnaryOp.NOT, UNARY(), lineNumber);
			exitNesting();
			return expr;
		case MINUS:
			enterNesting();
			lexer();
			expr = new Expr.Unary(UnaryOp.NEG, UNARY(), lineNumber);
			exitNesting();
			return expr;
		case AMPERSAND:
		case STAR:
			// borrows and dereferences have no meaning in the shell: the operand is used as is
			enterNesting();
			lexer();
			if (token == Token.KW_MUT) {
				lexer();
			}
			expr = UNARY();
			exitNesting();
			return expr;
		default:
			return POSTFIX();
		}
	}

	// POSTFIX : PRIMARY {. IDENT ( [ARGS] ) | [ EXPRESSION ] | ?}
	Expr POSTFIX() throws IOException, ParserException {
		Expr expr = PRIMARY();
		while (true) {
			int lineNumber = tokenLineNumber;
			if (token == Token.DOT) {
				lexer();
				String method = identifier();
				if (token != Token.OPEN_PAREN) {
					throw parserException("Field access is not supported: ." + method);
				}
				expr = new Expr.MethodCall(expr, method, ARGUMENTS(), lineNumber);
			} else if (token == Token.OPEN_BRACKET) {
				lexer();
				Expr index = EXPRESSION();
				lexer(Token.CLOSE_BRACKET);
				expr = new Expr.Index(expr, index, lineNumber);
			} else if (token == Token.QUESTION) {
				lexer();
				expr = new Expr.Try(expr, lineNumber);
			} else {
				return expr;
			}
		}
	}

	// ARGUMENTS : ( [EXPRESSION {, EXPRESSION} [,]] )
	List<Expr> ARGUMENTS() throws IOException, ParserException {
		lexer(Token.OPEN_PAREN);
		List<Expr> args = new ArrayList<Expr>();
		while (token != Token.CLOSE_PAREN) {
			args.add(EXPRESSION());
			if (token == Token.COMMA) {
				lexer();
			} else if (token != Token.CLOSE_PAREN) {
				throw parserException("Expecting , or ) in an argument list. Got " + token.name() + ": " + text);
			}
		}
		lexer(Token.CLOSE_PAREN);
		return args;
	}

	// PRIMARY : INTEGER | STRING | true | false | MACRO ARGUMENTS | IDENT {:: IDENT} [ARGUMENTS]
	// | ( EXPRESSION ) | [ EXPRESSION,* ] | BLOCK | IF_STATEMENT | MATCH_STATEMENT
	Expr PRIMARY() throws IOException, ParserException {
		int lineNumber = tokenLineNumber;
		Expr expr;
		switch (token) {
		case INTEGER:
			expr = new Expr.LiteralExpr(Literal.u32(integerValue()), lineNumber);
			lexer();
			return expr;
		case STRING:
			expr = new Expr.LiteralExpr(Literal.str(string.toString()), lineNumber);
			lexer();
			return expr;
		case KW_TRUE:
			lexer();
			return new Expr.LiteralExpr(Literal.bool(true), lineNumber);
		case KW_FALSE:
			lexer();
			return new Expr.LiteralExpr(Literal.bool(false), lineNumber);
		case MACRO:
			String macro = text.toString();
			lexer();
			return new Expr.FunctionCall(macro, ARGUMENTS(), lineNumber);
		case IDENT:
			StringBuilder path = new StringBuilder(identifier());
			while (token == Token.PATH_SEP) {
				lexer();
				path.append("::").append(identifier());
			}
			if (token == Token.OPEN_PAREN) {
				return new Expr.FunctionCall(path.toString(), ARGUMENTS(), lineNumber);
			}
			if (path.indexOf("::") >= 0) {
				throw parserException("Paths are only supported in function calls: " + path);
			}
			if (token == Token.NOT) {
				throw parserException("Unsupported macro: " + path + "!",
						"Only println!, print!, eprintln!, eprint! and format! are allowed");
			}
			return new Expr.Variable(path.toString(), lineNumber);
		case OPEN_PAREN:
			lexer();
			if (token == Token.CLOSE_PAREN) {
				throw parserException("The unit value () is not supported as an expression");
			}
			expr = EXPRESSION();
			if (token == Token.COMMA) {
				throw parserException("Tuples are not supported");
			}
			lexer(Token.CLOSE_PAREN);
			return expr;
		case OPEN_BRACKET:
			lexer();
			List<Expr> elements = new ArrayList<Expr>();
			while (token != Token.CLOSE_BRACKET) {
				elements.add(EXPRESSION());
				if (token == Token.COMMA) {
					lexer();
				} else if (token == Token.SEMICOLON) {
					throw parserException("Repeat expressions [value; count] are not supported");
				} else if (token != Token.CLOSE_BRACKET) {
					throw parserException("Expecting , or ] in an array. Got " + token.name() + ": " + text);
				}
			}
			lexer(Token.CLOSE_BRACKET);
			return new Expr.ArrayLiteral(elements, lineNumber);
		case OPEN_BRACE:
			return new Expr.Block(BLOCK(), lineNumber);
		case KW_IF:
			return new Expr.Block(Collections.<Stmt>singletonList(IF_STATEMENT()), lineNumber);
		case KW_MATCH:
			return new Expr.Block(Collections.<Stmt>singletonList(MATCH_STATEMENT()), lineNumber);
		default:
			throw parserException("Unexpected " + token.name() + ": " + text);
		}
	}
	// CHECKSTYLE.ON MethodName
}
