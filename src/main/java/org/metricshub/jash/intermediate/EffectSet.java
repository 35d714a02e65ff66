package org.metricshub.jash.intermediate;

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
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of {@link Effect}s. Iteration follows the declaration order
 * of {@link Effect}, so that anything rendered from an effect set is
 * deterministic.
 */
public final class EffectSet {

	private static final EffectSet PURE = new EffectSet(EnumSet.noneOf(Effect.class));

	private final Set<Effect> effects;

	private EffectSet(EnumSet<Effect> effects) {
		this.effects = Collections.unmodifiableSet(effects);
	}

	/**
	 * @return the empty effect set
	 */
	public static EffectSet pure() {
		return PURE;
	}

	/**
	 * @param first an effect
	 * @param rest more effects
	 * @return a set holding the specified effects
	 */
	public static EffectSet of(Effect first, Effect... rest) {
		return new EffectSet(EnumSet.of(first, rest));
	}

	/**
	 * @param other another set
	 * @return the union of this set and the other one
	 */
	public EffectSet union(EffectSet other) {
		if (other.effects.isEmpty()) {
			return this;
		}
		if (effects.isEmpty()) {
			return other;
		}
		EnumSet<Effect> union = EnumSet.noneOf(Effect.class);
		union.addAll(effects);
		union.addAll(other.effects);
		return new EffectSet(union);
	}

	public boolean isPure() {
		return effects.isEmpty();
	}

	public boolean contains(Effect effect) {
		return effects.contains(effect);
	}

	/**
	 * @return a read-only view of the effects
	 */
	public Set<Effect> asSet() {
		return effects;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof EffectSet && effects.equals(((EffectSet) o).effects);
	}

	@Override
	public int hashCode() {
		return effects.hashCode();
	}

	@Override
	public String toString() {
		return effects.isEmpty() ? "pure" : effects.toString();
	}
}
