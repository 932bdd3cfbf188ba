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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of all the nodes of the shell syntax tree.
 * <p>
 * Nodes are immutable values: they are built once, own their children
 * (there is no link to the parent node) and compare structurally with
 * {@link #equals(Object)}. The set of node types is closed, see the
 * subclasses in this package.
 *
 * @see AstPrinter
 */
public abstract class Node {

	// only the node types of this package
	Node() {}

	/**
	 * Renders this node, and all its children, in the canonical shell syntax.
	 *
	 * @return the canonical text of this node
	 */
	public final String render() {
		return AstPrinter.print(this);
	}

	/**
	 * Same as {@link #render()}.
	 */
	@Override
	public final String toString() {
		return render();
	}

	static <T> T requireNonNull(T value, String what) {
		if (value == null) {
			throw new IllegalArgumentException(what + " must not be null");
		}
		return value;
	}

	static <T extends Node> List<T> copyOf(List<? extends T> nodes, String what) {
		if (nodes == null) {
			return Collections.emptyList();
		}
		List<T> copy = new ArrayList<T>(nodes.size());
		for (T node : nodes) {
			copy.add(requireNonNull(node, what));
		}
		return Collections.unmodifiableList(copy);
	}
}
