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
 * A simple command: words and redirections, in the order they were written.
 * <p>
 * The first word is usually the command name, but redirections may appear
 * anywhere, including before it.
 */
public final class Command extends Node {

	private final List<Node> args;

	/**
	 * @param args {@link Literal} and {@link Redirect} nodes, at least one
	 */
	public Command(List<? extends Node> args) {
		if (args == null || args.isEmpty()) {
			throw new IllegalArgumentException("A command needs at least one word or redirection");
		}
		for (Node arg : args) {
			if (!(arg instanceof Literal) && !(arg instanceof Redirect)) {
				throw new IllegalArgumentException("Command arguments must be words or redirections, got: " + arg);
			}
		}
		this.args = copyOf(args, "Command argument");
	}

	/**
	 * @return the words and redirections, unmodifiable
	 */
	public List<Node> getArgs() {
		return args;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Command && args.equals(((Command) o).args);
	}

	@Override
	public int hashCode() {
		return args.hashCode();
	}
}
