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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.jash.intermediate.Effect;
import org.metricshub.jash.intermediate.EffectSet;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.util.JashSettings;

/**
 * A record of how a script was produced: the digests of the source and of
 * the script, the settings of the compilation and the effects of every
 * function.
 * <p>
 * The report holds nothing that varies between two runs (no date, no host
 * name), so compiling the same source with the same settings always gives
 * the same report.
 */
public final class CompilationProof {

	/**
	 * Version of the report format
	 */
	public static final String FORMAT_VERSION = "1";

	private static final char[] HEX = "0123456789abcdef".toCharArray();

	private final String sourceDigest;
	private final String scriptDigest;
	private final JashSettings settings;
	private final Map<String, EffectSet> functionEffects;

	private CompilationProof(String sourceDigest, String scriptDigest, JashSettings settings, Map<String, EffectSet> functionEffects) {
		this.sourceDigest = sourceDigest;
		this.scriptDigest = scriptDigest;
		this.settings = settings;
		this.functionEffects = Collections.unmodifiableMap(functionEffects);
	}

	/**
	 * Builds the proof of a compilation.
	 *
	 * @param source text of the source program
	 * @param script text of the generated script
	 * @param ir IR the script was generated from
	 * @param settings settings of the compilation
	 * @return the proof
	 */
	public static CompilationProof create(String source, String script, ShellIR ir, JashSettings settings) {
		Map<String, EffectSet> effects = new TreeMap<String, EffectSet>();
		if (ir instanceof ShellIR.Sequence) {
			for (ShellIR node : ((ShellIR.Sequence) ir).getNodes()) {
				if (node instanceof ShellIR.Function) {
					effects.put(((ShellIR.Function) node).getName(), node.effects());
				}
			}
		}
		JashSettings copy = new JashSettings();
		copy.setTargetDialect(settings.getTargetDialect());
		copy.setValidationLevel(settings.getValidationLevel());
		copy.setVerificationLevel(settings.getVerificationLevel());
		copy.setEmitProof(settings.isEmitProof());
		copy.setOptimize(settings.isOptimize());
		copy.setStrictMode(settings.isStrictMode());
		return new CompilationProof(sha256(source), sha256(script), copy, effects);
	}

	/**
	 * @param text text to hash, encoded as UTF-8
	 * @return the SHA-256 digest of the text, in lowercase hexadecimal
	 */
	public static String sha256(String text) {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
		byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
		char[] hex = new char[hash.length * 2];
		for (int i = 0; i < hash.length; i++) {
			int b = hash[i] & 0xff;
			hex[i * 2] = HEX[b >>> 4];
			hex[i * 2 + 1] = HEX[b & 0x0f];
		}
		return new String(hex);
	}

	public String getSourceDigest() {
		return sourceDigest;
	}

	public String getScriptDigest() {
		return scriptDigest;
	}

	/**
	 * @return the effects of each function, by function name
	 */
	public Map<String, EffectSet> getFunctionEffects() {
		return functionEffects;
	}

	/**
	 * Renders the proof as <code>key=value</code> lines, keys in a fixed order.
	 *
	 * @return the text of the report
	 */
	public String toReport() {
		StringBuilder report = new StringBuilder();
		final char newLine = '\n';
		report.append("format=").append(FORMAT_VERSION).append(newLine);
		report.append("source.sha256=").append(sourceDigest).append(newLine);
		report.append("script.sha256=").append(scriptDigest).append(newLine);
		report.append("target=").append(settings.getTargetDialect().getShellName()).append(newLine);
		report.append("validation=").append(settings.getValidationLevel()).append(newLine);
		report.append("verification=").append(settings.getVerificationLevel()).append(newLine);
		report.append("optimize=").append(settings.isOptimize()).append(newLine);
		report.append("strict=").append(settings.isStrictMode()).append(newLine);
		for (Map.Entry<String, EffectSet> entry : functionEffects.entrySet()) {
			report.append("effects.").append(entry.getKey()).append('=').append(describe(entry.getValue())).append(newLine);
		}
		return report.toString();
	}

	private static String describe(EffectSet effects) {
		if (effects.isPure()) {
			return "pure";
		}
		StringBuilder text = new StringBuilder();
		for (Effect effect : effects.asSet()) {
			if (text.length() > 0) {
				text.append(',');
			}
			text.append(effect);
		}
		return text.toString();
	}

	@Override
	public String toString() {
		return toReport();
	}
}
