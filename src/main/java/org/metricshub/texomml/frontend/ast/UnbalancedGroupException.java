package org.metricshub.texomml.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * TexOmml
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
 * Thrown by the parser when a required closing brace or bracket is missing.
 * This is the only condition that aborts parsing: every other unrecognized
 * construct ends the current production and yields a partial result.
 */
public class UnbalancedGroupException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int position;

	/**
	 * @param message what was expected
	 * @param position offset in the source text where it was expected
	 */
	public UnbalancedGroupException(String message, int position) {
		super(message + " at position " + position);
		this.position = position;
	}

	/**
	 * @return offset in the source text where the closing character was expected
	 */
	public int getPosition() {
		return position;
	}
}
