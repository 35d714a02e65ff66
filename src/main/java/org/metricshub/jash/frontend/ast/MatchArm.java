package org.metricshub.jash.frontend.ast;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One arm of a <code>match</code>: <code>pattern [if guard] =&gt; body</code>.
 */
public final class MatchArm {

	private final Pattern pattern;
	private final Expr guard;
	private final List<Stmt> body;

	public MatchArm(Pattern pattern, Expr guard, List<Stmt> body) {
		this.pattern = Objects.requireNonNull(pattern);
		this.guard = guard;
		this.body = Collections.unmodifiableList(new ArrayList<Stmt>(body));
	}

	public Pattern getPattern() {
		return pattern;
	}

	/**
	 * @return the guard, or <code>null</code>
	 */
	public Expr getGuard() {
		return guard;
	}

	public List<Stmt> getBody() {
		return body;
	}
}
