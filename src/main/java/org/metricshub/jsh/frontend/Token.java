package org.metricshub.jsh.frontend;

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

/** Lexer token values. */
enum Token {
	EOF("end of input"),
	NEWLINE("newline"),
	SEMICOLON(";"),
	WORD("word"),
	COMMENT("comment"),

	AND("&&"),
	OR("||"),
	PIPE("|"),

	OPEN_PAREN("("),
	CLOSE_PAREN(")"),
	OPEN_BRACE("{"),
	CLOSE_BRACE("}"),

	GT(">"),
	APPEND(">>"),
	LT("<");

	private final String symbol;

	Token(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the operator as written in scripts, or a short description
	 *         for the tokens that have no fixed spelling
	 */
	String getSymbol() {
		return symbol;
	}

	/**
	 * @return whether this token ends a statement
	 */
	boolean isSeparator() {
		return this == NEWLINE || this == SEMICOLON;
	}

	/**
	 * @return whether this token combines two commands
	 */
	boolean isCombinator() {
		return this == AND || this == OR || this == PIPE;
	}

	/**
	 * @return whether this token starts a redirection
	 */
	boolean isRedirection() {
		return this == GT || this == APPEND || this == LT;
	}
}
