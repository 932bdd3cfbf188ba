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
 * Common base of the nodes made of a plain sequence of statements.
 */
abstract class StatementsNode extends Node {

	private final List<Node> statements;

	StatementsNode(List<? extends Node> statements) {
		this.statements = copyOf(statements, "Statement");
	}

	/**
	 * @return the statements, in source order, unmodifiable
	 */
	public List<Node> getStatements() {
		return statements;
	}

	@Override
	public boolean equals(Object o) {
		return o != null && o.getClass() == getClass() && statements.equals(((StatementsNode) o).statements);
	}

	@Override
	public int hashCode() {
		return 31 * getClass().hashCode() + statements.hashCode();
	}
}
