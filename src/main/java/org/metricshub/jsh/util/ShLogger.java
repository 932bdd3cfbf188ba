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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logging helpers of the shell parser: SLF4J loggers, and the
 * {@code <source>:<line>:<column>} notation used by log lines and error
 * messages to point into a script.
 * <p>
 * Loading this class lowers SLF4J's internal verbosity, so that an
 * application embedding the parser does not get SLF4J's provider notices.
 */
public final class ShLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private ShLogger() {
		// utility class
	}

	/**
	 * @param clazz the class that logs
	 * @return the SLF4J logger named after the class
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Formats a position in a script, like {@code build.sh:12:5}.
	 *
	 * @param sourceDescription description of the script source
	 * @param line 1-based line
	 * @param column 1-based column
	 * @return the position, as {@code <source>:<line>:<column>}
	 */
	public static String position(String sourceDescription, int line, int column) {
		return sourceDescription + ":" + line + ":" + column;
	}
}
