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

/**
 * An opaque word: command name, argument or redirect target.
 * <p>
 * The text is stored exactly as written, quotes and expansions included
 * ({@code 'a b'}, {@code "$x"}, {@code ${y}}); it is never unescaped nor
 * expanded.
 */
public final class Literal extends Node {

	private final String text;

	/**
	 * @param text the word, as written in the script
	 */
	public Literal(String text) {
		this.text = requireNonNull(text, "Literal text");
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Literal && text.equals(((Literal) o).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}
}
