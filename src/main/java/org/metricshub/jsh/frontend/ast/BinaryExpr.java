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
 * Two commands combined with {@code &&}, {@code ||} or {@code |}.
 * <p>
 * Chains are right-leaning: {@code a && b || c} is
 * {@code &&(a, ||(b, c))}. The three operators bind equally.
 */
public final class BinaryExpr extends Node {

	/** Run the right side if the left side succeeds */
	public static final String AND = "&&";

	/** Run the right side if the left side fails */
	public static final String OR = "||";

	/** Feed the output of the left side into the right side */
	public static final String PIPE = "|";

	private final String operator;
	private final Node left;
	private final Node right;

	/** Computed once: the right operand, built first, already knows its own */
	private final int hash;

	/**
	 * @param operator one of {@link #AND}, {@link #OR}, {@link #PIPE}
	 * @param left left operand
	 * @param right right operand, the rest of the chain
	 */
	public BinaryExpr(String operator, Node left, Node right) {
		if (!AND.equals(operator) && !OR.equals(operator) && !PIPE.equals(operator)) {
			throw new IllegalArgumentException("Unsupported binary operator: " + operator);
		}
		this.operator = operator;
		this.left = requireNonNull(left, "Left operand");
		this.right = requireNonNull(right, "Right operand");
		this.hash = 31 * (31 * operator.hashCode() + left.hashCode()) + right.hashCode();
	}

	public String getOperator() {
		return operator;
	}

	public Node getLeft() {
		return left;
	}

	public Node getRight() {
		return right;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof BinaryExpr)) {
			return false;
		}
		// walk the right spine in a loop, chains can be very long
		Node mine = this;
		Node theirs = (Node) o;
		while (mine instanceof BinaryExpr && theirs instanceof BinaryExpr) {
			BinaryExpr a = (BinaryExpr) mine;
			BinaryExpr b = (BinaryExpr) theirs;
			if (a == b) {
				return true;
			}
			if (a.hash != b.hash || !a.operator.equals(b.operator) || !a.left.equals(b.left)) {
				return false;
			}
			mine = a.right;
			theirs = b.right;
		}
		return mine.equals(theirs);
	}

	@Override
	public int hashCode() {
		return hash;
	}
}
