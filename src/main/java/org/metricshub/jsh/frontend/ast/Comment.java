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
 * A comment, from {@code #} to the end of the line.
 */
public final class Comment extends Node {

	private final String text;

	/**
	 * @param text everything after the {@code #}, including the leading space if any
	 */
	public Comment(String text) {
		this.text = requireNonNull(text, "Comment text");
		if (text.indexOf('\n') >= 0) {
			throw new IllegalArgumentException("Comment text cannot span several lines");
		}
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Comment && text.equals(((Comment) o).text);
	}

	@Override
	public int hashCode() {
		return 31 + text.hashCode();
	}
}
