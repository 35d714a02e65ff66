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
import java.util.List;
import org.metricshub.jash.backend.TargetDialect;

/**
 * An external linter that checks generated scripts for a dialect.
 */
public interface ShellLinter {

	/**
	 * @return name of the linter, for diagnostics
	 */
	String getName();

	/**
	 * @return whether the linter can run on this machine
	 */
	boolean isAvailable();

	/**
	 * Lints the specified script.
	 *
	 * @param script text of the script
	 * @param dialect shell the script is written for
	 * @return the findings, possibly empty
	 * @throws IOException when the linter cannot be run
	 */
	List<LintDiagnostic> lint(String script, TargetDialect dialect) throws IOException;
}
