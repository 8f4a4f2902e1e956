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

import java.util.Locale;

/**
 * How a formula is laid out in the target document.
 */
public enum DisplayType {
	/** Centered paragraph of its own ({@code m:oMathPara}) */
	BLOCK,
	/** Inline with the surrounding text ({@code m:oMath}) */
	INLINE;

	/**
	 * Parses a display type name, case-insensitively.
	 *
	 * @param name {@code block} or {@code inline}
	 * @return the matching display type
	 * @throws IllegalArgumentException if the name is neither
	 */
	public static DisplayType fromName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Display type must not be null");
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown display type: " + name, e);
		}
	}
}
