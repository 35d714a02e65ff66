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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one Jash source text.
 * This is usually either a string handed over by a Java caller,
 * the standard input of the command line,
 * or a source file given as a path on the command line.
 *
 * @author Danny Daglas
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_INLINE_SOURCE="&lt;inline-source&gt;"</code> */
	public static final String DESCRIPTION_INLINE_SOURCE = "<inline-source>";

	/** Constant <code>DESCRIPTION_STANDARD_INPUT="&lt;stdin&gt;"</code> */
	public static final String DESCRIPTION_STANDARD_INPUT = "<stdin>";

	private String description;
	private Reader reader;

	/**
	 * <p>
	 * Constructor for ScriptSource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source wrapping an in-memory program text.
	 *
	 * @param sourceText program text
	 * @return a new source described as {@link #DESCRIPTION_INLINE_SOURCE}
	 */
	public static ScriptSource fromString(String sourceText) {
		return new ScriptSource(DESCRIPTION_INLINE_SOURCE, new StringReader(sourceText));
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the source contents.
	 *
	 * @return The reader which contains the source contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
