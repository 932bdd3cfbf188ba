package org.metricshub.jsh.util;

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
 * Settings used while parsing shell scripts.
 * <p>
 * Instances are mutable and not thread-safe; configure them before handing
 * them to {@link org.metricshub.jsh.Sh}.
 */
public class ShSettings {

	/**
	 * Whether comments are kept as statements of the syntax tree.
	 */
	private boolean keepComments = true;

	/**
	 * @return {@code true} when comments are added to the syntax tree
	 */
	public boolean isKeepComments() {
		return keepComments;
	}

	/**
	 * Choose whether comments are added to the syntax tree. When disabled,
	 * comments are still recognized (so they never end up in a command), but
	 * dropped.
	 *
	 * @param keepComments {@code false} to drop comments
	 */
	public void setKeepComments(boolean keepComments) {
		this.keepComments = keepComments;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "ShSettings{keepComments=" + keepComments + "}";
	}
}
