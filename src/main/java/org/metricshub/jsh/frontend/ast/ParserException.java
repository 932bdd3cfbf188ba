package org.metricshub.jsh.frontend.ast;

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

import org.metricshub.jsh.util.ShLogger;

/**
 * Thrown when the shell script is not syntactically valid: unexpected token,
 * missing closing keyword or bracket, missing word.
 * <p>
 * The parser stops at the first such error; no syntax tree is produced.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int lineNumber;
	private final int columnNumber;

	/**
	 * Creates a new parser exception.
	 *
	 * @param msg description of the problem
	 * @param sourceDescription description of the script source
	 * @param lineNumber 1-based line where the problem was detected
	 * @param columnNumber 1-based column where the problem was detected
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber, int columnNumber) {
		super(msg + " (" + ShLogger.position(sourceDescription, lineNumber, columnNumber) + ")");
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.columnNumber = columnNumber;
	}

	/**
	 * @return the description of the script source (usually a file name)
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return 1-based line number of the fault
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return 1-based column number of the fault
	 */
	public int getColumnNumber() {
		return columnNumber;
	}
}
