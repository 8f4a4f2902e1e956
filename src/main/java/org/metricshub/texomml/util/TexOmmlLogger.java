package org.metricshub.texomml.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for SLF4J loggers of the converter. Keeps SLF4J quiet about its
 * own initialization, and renders the place in a formula where parsing
 * degraded.
 */
public final class TexOmmlLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	/** Number of characters shown on each side of a position */
	static final int CONTEXT_WIDTH = 12;

	private TexOmmlLogger() {
		// utility class
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Returns a log argument showing the formula around the specified position,
	 * like {@code ...\frac{1}{ >>> \foo}}. The excerpt is only built when the
	 * message is actually logged.
	 *
	 * @param formula the formula being parsed
	 * @param position offset in the formula, clamped to its bounds
	 * @return an object whose {@code toString()} is the excerpt
	 */
	public static Object excerpt(final String formula, final int position) {
		return new Object() {
			@Override
			public String toString() {
				return formatExcerpt(formula, position);
			}
		};
	}

	static String formatExcerpt(String formula, int position) {
		if (formula == null) {
			return "";
		}
		int at = Math.max(0, Math.min(position, formula.length()));
		int from = Math.max(0, at - CONTEXT_WIDTH);
		int to = Math.min(formula.length(), at + CONTEXT_WIDTH);
		StringBuilder excerpt = new StringBuilder();
		if (from > 0) {
			excerpt.append("...");
		}
		excerpt.append(formula, from, at).append(" >>> ").append(formula, at, to);
		if (to < formula.length()) {
			excerpt.append("...");
		}
		return excerpt.toString();
	}
}
