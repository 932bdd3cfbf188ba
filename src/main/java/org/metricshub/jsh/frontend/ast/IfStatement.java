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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code if <condition>; then ...; [elif ...; then ...;]* [else ...;] fi}
 */
public final class IfStatement extends Node {

	private final Node condition;
	private final List<Node> thenBranch;
	private final List<ElifClause> elifClauses;
	private final List<Node> elseBranch;

	/**
	 * Creates an {@code if} statement without {@code elif} nor {@code else}.
	 *
	 * @param condition the tested command or chain
	 * @param thenBranch statements run when the condition succeeds
	 */
	public IfStatement(Node condition, List<? extends Node> thenBranch) {
		this(condition, thenBranch, Collections.<ElifClause>emptyList(), Collections.<Node>emptyList());
	}

	/**
	 * @param condition the tested command or chain
	 * @param thenBranch statements run when the condition succeeds
	 * @param elifClauses the {@code elif} links, in order; may be {@code null} or empty
	 * @param elseBranch the {@code else} statements; {@code null} or empty when there is no {@code else}
	 */
	public IfStatement(
			Node condition,
			List<? extends Node> thenBranch,
			List<ElifClause> elifClauses,
			List<? extends Node> elseBranch) {
		this.condition = requireNonNull(condition, "If condition");
		this.thenBranch = copyOf(thenBranch, "Then statement");
		this.elifClauses = copyOf(elifClauses, "Elif clause");
		this.elseBranch = copyOf(elseBranch, "Else statement");
	}

	public Node getCondition() {
		return condition;
	}

	public List<Node> getThenBranch() {
		return thenBranch;
	}

	public List<ElifClause> getElifClauses() {
		return elifClauses;
	}

	/**
	 * @return the {@code else} statements, empty when there is no {@code else}
	 */
	public List<Node> getElseBranch() {
		return elseBranch;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof IfStatement)) {
			return false;
		}
		IfStatement other = (IfStatement) o;
		return condition.equals(other.condition)
				&& thenBranch.equals(other.thenBranch)
				&& elifClauses.equals(other.elifClauses)
				&& elseBranch.equals(other.elseBranch);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenBranch, elifClauses, elseBranch);
	}
}
