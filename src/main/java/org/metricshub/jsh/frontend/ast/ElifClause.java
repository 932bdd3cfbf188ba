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

import java.util.List;

/**
 * One {@code elif <condition>; then <statements>} link of an {@link IfStatement}.
 */
public final class ElifClause extends Node {

	private final Node condition;
	private final List<Node> thenBranch;

	public ElifClause(Node condition, List<? extends Node> thenBranch) {
		this.condition = requireNonNull(condition, "Elif condition");
		this.thenBranch = copyOf(thenBranch, "Then statement");
	}

	public Node getCondition() {
		return condition;
	}

	public List<Node> getThenBranch() {
		return thenBranch;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ElifClause)) {
			return false;
		}
		ElifClause other = (ElifClause) o;
		return condition.equals(other.condition) && thenBranch.equals(other.thenBranch);
	}

	@Override
	public int hashCode() {
		return 31 * condition.hashCode() + thenBranch.hashCode();
	}
}
