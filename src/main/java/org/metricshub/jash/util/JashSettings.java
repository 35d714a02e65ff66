package org.metricshub.jash.util;

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

import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.validation.ValidationLevel;
import org.metricshub.jash.verify.VerificationLevel;

/**
 * Settings of a compilation.
 * <p>
 * The defaults produce a POSIX <code>sh</code> script in strict mode, with
 * {@link ValidationLevel#STRICT} injection checks and no verification.
 */
public class JashSettings {

	/**
	 * Shell the script is written for;
	 * {@link TargetDialect#POSIX} by default.
	 */
	private TargetDialect targetDialect = TargetDialect.POSIX;

	/**
	 * Checks applied to the generated script;
	 * {@link VerificationLevel#NONE} by default.
	 */
	private VerificationLevel verificationLevel = VerificationLevel.NONE;

	/**
	 * Injection checks applied to string literals;
	 * {@link ValidationLevel#STRICT} by default.
	 */
	private ValidationLevel validationLevel = ValidationLevel.STRICT;

	/**
	 * Whether a compilation proof is produced along with the script;
	 * <code>false</code> by default.
	 */
	private boolean emitProof = false;

	/**
	 * Whether constant expressions are folded;
	 * <code>false</code> by default.
	 */
	private boolean optimize = false;

	/**
	 * Whether the script exits on the first failing command
	 * (<code>set -e</code>); <code>true</code> by default.
	 */
	private boolean strictMode = true;

	/**
	 * @return a human readable representation of the settings
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("targetDialect = ").append(getTargetDialect()).append(newLine);
		desc.append("validationLevel = ").append(getValidationLevel()).append(newLine);
		desc.append("verificationLevel = ").append(getVerificationLevel()).append(newLine);
		desc.append("emitProof = ").append(isEmitProof()).append(newLine);
		desc.append("optimize = ").append(isOptimize()).append(newLine);
		desc.append("strictMode = ").append(isStrictMode()).append(newLine);

		return desc.toString();
	}

	/**
	 * Shell the script is written for;
	 * {@link TargetDialect#POSIX} by default.
	 *
	 * @return the targetDialect
	 */
	public TargetDialect getTargetDialect() {
		return targetDialect;
	}

	/**
	 * @param targetDialect the targetDialect to set
	 */
	public void setTargetDialect(TargetDialect targetDialect) {
		this.targetDialect = targetDialect;
	}

	/**
	 * Checks applied to the generated script;
	 * {@link VerificationLevel#NONE} by default.
	 *
	 * @return the verificationLevel
	 */
	public VerificationLevel getVerificationLevel() {
		return verificationLevel;
	}

	/**
	 * @param verificationLevel the verificationLevel to set
	 */
	public void setVerificationLevel(VerificationLevel verificationLevel) {
		this.verificationLevel = verificationLevel;
	}

	/**
	 * Injection checks applied to string literals;
	 * {@link ValidationLevel#STRICT} by default.
	 *
	 * @return the validationLevel
	 */
	public ValidationLevel getValidationLevel() {
		return validationLevel;
	}

	/**
	 * @param validationLevel the validationLevel to set
	 */
	public void setValidationLevel(ValidationLevel validationLevel) {
		this.validationLevel = validationLevel;
	}

	/**
	 * @return whether a compilation proof is produced
	 */
	public boolean isEmitProof() {
		return emitProof;
	}

	/**
	 * @param emitProof whether a compilation proof is produced
	 */
	public void setEmitProof(boolean emitProof) {
		this.emitProof = emitProof;
	}

	/**
	 * @return whether constant expressions are folded
	 */
	public boolean isOptimize() {
		return optimize;
	}

	/**
	 * @param optimize whether constant expressions are folded
	 */
	public void setOptimize(boolean optimize) {
		this.optimize = optimize;
	}

	/**
	 * Whether the script exits on the first failing command
	 * (<code>set -e</code>); <code>true</code> by default.
	 *
	 * @return the strictMode
	 */
	public boolean isStrictMode() {
		return strictMode;
	}

	/**
	 * @param strictMode the strictMode to set
	 */
	public void setStrictMode(boolean strictMode) {
		this.strictMode = strictMode;
	}
}
