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
 * A single redirection of a command, like {@code > out.txt}.
 */
public final class Redirect extends Node {

	/** Output redirection */
	public static final String OUTPUT = ">";

	/** Output redirection, appending */
	public static final String APPEND = ">>";

	/** Input redirection */
	public static final String INPUT = "<";

	private final String op;
	private final Node target;

	/**
	 * @param op one of {@link #OUTPUT}, {@link #APPEND} or {@link #INPUT}
	 * @param target the redirected word
	 */
	public Redirect(String op, Node target) {
		if (!OUTPUT.equals(op) && !APPEND.equals(op) && !INPUT.equals(op)) {
			throw new IllegalArgumentException("Unsupported redirection operator: " + op);
		}
		this.op = op;
		this.target = requireNonNull(target, "Redirect target");
	}

	public String getOp() {
		return op;
	}

	public Node getTarget() {
		return target;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Redirect)) {
			return false;
		}
		Redirect other = (Redirect) o;
		return op.equals(other.op) && target.equals(other.target);
	}

	@Override
	public int hashCode() {
		return 31 * op.hashCode() + target.hashCode();
	}
}
