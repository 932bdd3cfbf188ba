package org.metricshub.jsh.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsh
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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.Reader;

/**
 * Represents one shell script content source: a description, used to
 * identify the source in error messages, and the {@link Reader} serving the
 * script text.
 * <p>
 * The description has no effect on parsing. The reader is owned by the
 * caller: the parser reads it to the end (or to the first error) but never
 * closes it.
 */
public class ScriptSource {

	/** Description used when the caller does not provide one */
	public static final String DESCRIPTION_UNNAMED_SCRIPT = "<unnamed-script>";

	private final String description;
	private final Reader reader;

	/**
	 * Creates a new script source.
	 *
	 * @param description label of the source, typically a file name;
	 *        {@code null} or empty stands for {@link #DESCRIPTION_UNNAMED_SCRIPT}
	 * @param reader the script contents
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The caller-supplied Reader is consumed in place; it cannot be copied.")
	public ScriptSource(String description, Reader reader) {
		if (reader == null) {
			throw new IllegalArgumentException("Script reader must not be null");
		}
		this.description = description == null || description.isEmpty() ? DESCRIPTION_UNNAMED_SCRIPT : description;
		this.reader = reader;
	}

	/**
	 * @return the description of this source, never {@code null}
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The Reader is shared with the parser that consumes it.")
	public Reader getReader() {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
