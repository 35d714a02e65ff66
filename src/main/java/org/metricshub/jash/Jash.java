package org.metricshub.jash;

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
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import org.metricshub.jash.backend.EmitException;
import org.metricshub.jash.backend.PosixEmitter;
import org.metricshub.jash.frontend.JashParser;
import org.metricshub.jash.frontend.ParserException;
import org.metricshub.jash.frontend.ast.RestrictedAst;
import org.metricshub.jash.intermediate.IrBuilder;
import org.metricshub.jash.intermediate.IrOptimizer;
import org.metricshub.jash.intermediate.LoweringException;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.util.JashLogger;
import org.metricshub.jash.util.JashSettings;
import org.metricshub.jash.util.ScriptSource;
import org.metricshub.jash.validation.AstValidator;
import org.metricshub.jash.validation.InjectionValidator;
import org.metricshub.jash.validation.ValidationException;
import org.metricshub.jash.validation.ValidationLevel;
import org.metricshub.jash.verify.CompilationProof;
import org.metricshub.jash.verify.LintDiagnostic;
import org.metricshub.jash.verify.ShellCheckLinter;
import org.metricshub.jash.verify.ShellLinter;
import org.metricshub.jash.verify.Verifier;
import org.slf4j.Logger;

/**
 * Entry point into the compilation of Jash programs to POSIX shell scripts.
 * <p>
 * A compilation runs these stages, and stops at the first one that fails:
 * <ol>
 * <li>{@link JashParser}: source text to syntax tree</li>
 * <li>{@link AstValidator}: structural checks</li>
 * <li>{@link InjectionValidator} on the syntax tree (skipped with {@link ValidationLevel#NONE})</li>
 * <li>{@link IrBuilder}: syntax tree to shell IR</li>
 * <li>{@link IrOptimizer}, when {@link JashSettings#isOptimize()} is set</li>
 * <li>{@link InjectionValidator} on the IR</li>
 * <li>{@link PosixEmitter}: shell IR to script text</li>
 * <li>{@link Verifier}, according to {@link JashSettings#getVerificationLevel()}</li>
 * </ol>
 * An instance holds no state between compilations and may be used from
 * several threads.
 *
 * <pre>
 * String script = new Jash().compile("fn main() { println!(\"Hello\"); }");
 * </pre>
 */
public class Jash {

	private static final Logger LOG = JashLogger.getLogger(Jash.class);

	private final ShellLinter linter;

	/**
	 * Creates a compiler that uses ShellCheck when verification asks for an
	 * external linter.
	 */
	public Jash() {
		this(new ShellCheckLinter());
	}

	/**
	 * @param linter external linter used from {@link org.metricshub.jash.verify.VerificationLevel#STRICT} on
	 */
	public Jash(ShellLinter linter) {
		this.linter = linter;
	}

	/**
	 * Compiles the specified program with the default settings.
	 *
	 * @param source text of the program
	 * @return the text of the shell script
	 * @throws CompilationException if the program is rejected by any stage
	 */
	public String compile(String source) throws CompilationException {
		return compile(source, new JashSettings()).getScript();
	}

	/**
	 * Compiles the specified program.
	 *
	 * @param source text of the program
	 * @param settings settings of the compilation
	 * @return the script and what comes with it
	 * @throws CompilationException if the program is rejected by any stage
	 */
	public CompilationResult compile(String source, JashSettings settings) throws CompilationException {
		try {
			return compile(ScriptSource.fromString(source), settings);
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Compiles the program read from the specified source.
	 *
	 * @param source the program source
	 * @param settings settings of the compilation
	 * @return the script and what comes with it
	 * @throws IOException if the source cannot be read
	 * @throws CompilationException if the program is rejected by any stage
	 */
	public CompilationResult compile(ScriptSource source, JashSettings settings) throws IOException, CompilationException {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Compiling {} with settings:\n{}", source.getDescription(), settings.toDescriptionString());
		}
		String text = readFully(source.getReader());

		RestrictedAst ast = parse(new ScriptSource(source.getDescription(), new StringReader(text)));
		ShellIR ir = lower(ast, settings);
		String script = emit(ir, settings);

		List<LintDiagnostic> diagnostics = new Verifier(settings.getVerificationLevel(), linter)
				.verify(script, ir, settings.getTargetDialect(), settings.isStrictMode());

		CompilationProof proof = null;
		if (settings.isEmitProof()) {
			proof = CompilationProof.create(text, script, ir, settings);
		}
		return new CompilationResult(script, ir, diagnostics, proof);
	}

	/**
	 * Parses the program read from the specified source, without validating it.
	 *
	 * @param source the program source
	 * @return the syntax tree
	 * @throws IOException if the source cannot be read
	 * @throws ParserException if the source is not a valid program
	 */
	public RestrictedAst parse(ScriptSource source) throws IOException, ParserException {
		return new JashParser().parse(source);
	}

	/**
	 * Validates the syntax tree and lowers it to the shell IR, optimized if
	 * the settings ask for it.
	 *
	 * @param ast the syntax tree
	 * @param settings settings of the compilation
	 * @return the IR of the program
	 * @throws ValidationException if the program breaks a structural rule or carries an injection
	 * @throws LoweringException if the program uses a construct that has no shell equivalent
	 */
	public ShellIR lower(RestrictedAst ast, JashSettings settings) throws ValidationException, LoweringException {
		ValidationLevel level = settings.getValidationLevel();
		new AstValidator(level).validate(ast);
		InjectionValidator injections = new InjectionValidator(level);
		injections.validate(ast);

		ShellIR ir = new IrBuilder().lower(ast);
		if (settings.isOptimize()) {
			ir = new IrOptimizer().optimize(ir);
		}
		injections.validate(ir);
		return ir;
	}

	/**
	 * Renders the IR as a script for the dialect of the settings.
	 *
	 * @param ir the IR of the program
	 * @param settings settings of the compilation
	 * @return the text of the script
	 * @throws EmitException if a node has no rendering
	 */
	public String emit(ShellIR ir, JashSettings settings) throws EmitException {
		return new PosixEmitter(settings.getTargetDialect(), settings.isStrictMode()).emit(ir);
	}

	private static String readFully(Reader reader) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader r = reader) {
			int count;
			while ((count = r.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString();
	}
}
