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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.util.JashLogger;
import org.slf4j.Logger;

/**
 * Runs <a href="https://www.shellcheck.net">ShellCheck</a>, if it is
 * installed, on a generated script.
 * <p>
 * The script is fed to <code>shellcheck --shell=&lt;dialect&gt; --format=gcc -</code>
 * and each line of the report becomes a {@link LintDiagnostic}.
 */
public class ShellCheckLinter implements ShellLinter {

	private static final Logger LOG = JashLogger.getLogger(ShellCheckLinter.class);

	private static final long TIMEOUT_SECONDS = 30;

	/**
	 * <code>-:3:5: warning: Double quote to prevent globbing. [SC2086]</code>
	 */
	private static final Pattern GCC_LINE = Pattern.compile("^[^:]*:(\\d+):(\\d+): (\\w+): (.*) \\[(SC\\d+)\\]$");

	private final String executable;
	private Boolean available;

	/**
	 * Uses the <code>shellcheck</code> of the <code>PATH</code>.
	 */
	public ShellCheckLinter() {
		this("shellcheck");
	}

	/**
	 * @param executable path of the ShellCheck executable
	 */
	public ShellCheckLinter(String executable) {
		this.executable = executable;
	}

	@Override
	public String getName() {
		return "shellcheck";
	}

	@Override
	public synchronized boolean isAvailable() {
		if (available == null) {
			available = Boolean.valueOf(runsVersion());
		}
		return available.booleanValue();
	}

	private boolean runsVersion() {
		try {
			Process process = new ProcessBuilder(executable, "--version").redirectErrorStream(true).start();
			process.getInputStream().readAllBytes();
			if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				process.destroyForcibly();
				LOG.debug("{} --version timed out", executable);
				return false;
			}
			return process.exitValue() == 0;
		} catch (IOException e) {
			LOG.debug("{} cannot be run: {}", executable, e.getMessage());
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			LOG.debug("Interrupted while running {} --version", executable);
			return false;
		}
	}

	@Override
	public List<LintDiagnostic> lint(String script, TargetDialect dialect) throws IOException {
		// The script is read from a file: a pipe would block once ShellCheck fills its own output
		Path input = Files.createTempFile("jash-lint", ".sh");
		String report;
		int status;
		try {
			Files.write(input, script.getBytes(StandardCharsets.UTF_8));
			ProcessBuilder pb = new ProcessBuilder(executable, "--shell=" + dialect.getLintShell(), "--format=gcc", "-");
			pb.redirectInput(input.toFile());
			pb.redirectError(ProcessBuilder.Redirect.DISCARD);
			Process process = pb.start();
			report = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
			try {
				if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
					process.destroyForcibly();
					throw new IOException(executable + " timed out after " + TIMEOUT_SECONDS + "s");
				}
				status = process.exitValue();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				process.destroyForcibly();
				throw new IOException("Interrupted while waiting for " + executable, e);
			}
		} finally {
			Files.deleteIfExists(input);
		}
		// 0: clean, 1: findings, anything else: shellcheck itself failed
		if (status > 1) {
			throw new IOException(executable + " failed with exit status " + status);
		}
		List<LintDiagnostic> diagnostics = parse(report);
		LOG.debug("{} reported {} finding(s) for {}", executable, diagnostics.size(), dialect);
		return diagnostics;
	}

	static List<LintDiagnostic> parse(String report) {
		List<LintDiagnostic> diagnostics = new ArrayList<LintDiagnostic>();
		for (String line : report.split("\n")) {
			Matcher matcher = GCC_LINE.matcher(line.trim());
			if (matcher.matches()) {
				diagnostics.add(
						new LintDiagnostic(
								Integer.parseInt(matcher.group(1)),
								severity(matcher.group(3)),
								matcher.group(5),
								matcher.group(4)));
			}
		}
		return diagnostics;
	}

	private static LintDiagnostic.Severity severity(String level) {
		if ("error".equals(level)) {
			return LintDiagnostic.Severity.ERROR;
		} else if ("warning".equals(level)) {
			return LintDiagnostic.Severity.WARNING;
		} else if ("style".equals(level)) {
			return LintDiagnostic.Severity.STYLE;
		}
		return LintDiagnostic.Severity.INFO;
	}
}
