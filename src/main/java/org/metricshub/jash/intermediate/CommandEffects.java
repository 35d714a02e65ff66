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
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Side effects of the external commands a program may call.
 * <p>
 * The table is also the allow-list of external commands: a call to a name
 * that is neither a function of the program, an {@link Intrinsic}, nor a key
 * of this table is rejected by validation. The classification is total:
 * {@link #classify(String)} answers {@link Effect#PROCESS_EXEC} for anything
 * it does not know, never "pure".
 */
public final class CommandEffects {

	private static final Map<String, EffectSet> TABLE;

	static {
		Map<String, EffectSet> table = new TreeMap<String, EffectSet>();

		EffectSet pure = EffectSet.pure();
		for (String command : new String[] { "echo", "printf", "test", "[", "true", "false", "basename", "dirname" }) {
			table.put(command, pure);
		}

		EffectSet fileRead = EffectSet.of(Effect.FILE_READ);
		for (String command : new String[] { "cat", "ls", "find", "grep", "head", "tail", "wc", "sort", "uniq", "cut", "stat", "sha256sum" }) {
			table.put(command, fileRead);
		}

		EffectSet fileWrite = EffectSet.of(Effect.FILE_WRITE, Effect.SYSTEM_MODIFICATION);
		for (String command : new String[] { "cp", "mv", "rm", "mkdir", "rmdir", "touch", "chmod", "chown", "ln" }) {
			table.put(command, fileWrite);
		}

		EffectSet network = EffectSet.of(Effect.NETWORK_ACCESS, Effect.FILE_WRITE);
		for (String command : new String[] { "curl", "wget", "ssh", "scp", "rsync" }) {
			table.put(command, network);
		}

		EffectSet archive = EffectSet.of(Effect.FILE_READ, Effect.FILE_WRITE);
		for (String command : new String[] { "tar", "gzip", "gunzip", "zip", "unzip" }) {
			table.put(command, archive);
		}

		EffectSet system = EffectSet.of(Effect.SYSTEM_MODIFICATION, Effect.PROCESS_EXEC);
		for (String command : new String[] { "sudo", "su", "systemctl", "service" }) {
			table.put(command, system);
		}

		TABLE = Collections.unmodifiableMap(table);
	}

	/** Effect of any command missing from the table */
	public static final EffectSet UNKNOWN = EffectSet.of(Effect.PROCESS_EXEC);

	private CommandEffects() {
		// utility class
	}

	/**
	 * @param command name of an external command
	 * @return its effects, {@link #UNKNOWN} when the command is not in the table
	 */
	public static EffectSet classify(String command) {
		EffectSet effects = TABLE.get(command);
		return effects == null ? UNKNOWN : effects;
	}

	/**
	 * @param command name of an external command
	 * @return whether a program may call this command
	 */
	public static boolean isAllowed(String command) {
		return TABLE.containsKey(command);
	}

	/**
	 * @return the allow-listed command names, sorted
	 */
	public static Set<String> allowedCommands() {
		return TABLE.keySet();
	}
}
