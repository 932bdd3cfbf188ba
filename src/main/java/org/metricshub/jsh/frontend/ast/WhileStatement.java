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
 * {@code while <condition>; do ...; done}
 */
public final class WhileStatement extends Node {

	private final Node condition;
	private final List<Node> doBranch;

	public WhileStatement(Node condition, List<? extends Node> doBranch) {
		this.condition = requireNonNull(condition, "While condition");
		this.doBranch = copyOf(doBranch, "Do statement");
	}

	public Node getCondition() {
		return condition;
	}

	public List<Node> getDoBranch() {
		return doBranch;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof WhileStatement)) {
			return false;
		}
		WhileStatement other = (WhileStatement) o;
		return condition.equals(other.condition) && doBranch.equals(other.doBranch);
	}

	@Override
	public int hashCode() {
		return 31 * condition.hashCode() + doBranch.hashCode();
	}
}
