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
 * Function definition: {@code name() { ...; }}
 */
public final class FuncDecl extends Node {

	private final Literal name;
	private final Block body;

	public FuncDecl(Literal name, Block body) {
		this.name = requireNonNull(name, "Function name");
		this.body = requireNonNull(body, "Function body");
	}

	public Literal getName() {
		return name;
	}

	public Block getBody() {
		return body;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FuncDecl)) {
			return false;
		}
		FuncDecl other = (FuncDecl) o;
		return name.equals(other.name) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return 31 * name.hashCode() + body.hashCode();
	}
}
