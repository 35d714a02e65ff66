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

import java.util.Collections;
import java.util.List;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.verify.CompilationProof;
import org.metricshub.jash.verify.LintDiagnostic;

/**
 * Output of a successful compilation: the script, the IR it was emitted
 * from, the non-fatal findings of the verifier and, when requested, the
 * compilation proof.
 */
public final class CompilationResult {

	private final String script;
	private final ShellIR ir;
	private final List<LintDiagnostic> diagnostics;
	private final CompilationProof proof;

	CompilationResult(String script, ShellIR ir, List<LintDiagnostic> diagnostics, CompilationProof proof) {
		this.script = script;
		this.ir = ir;
		this.diagnostics = Collections.unmodifiableList(diagnostics);
		this.proof = proof;
	}

	/**
	 * @return the text of the generated script
	 */
	public String getScript() {
		return script;
	}

	/**
	 * @return the IR the script was emitted from, after optimization
	 */
	public ShellIR getIr() {
		return ir;
	}

	/**
	 * @return the warnings of the verifier, empty when verification is off
	 */
	public List<LintDiagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return the compilation proof, or {@code null} if it was not requested
	 */
	public CompilationProof getProof() {
		return proof;
	}
}
