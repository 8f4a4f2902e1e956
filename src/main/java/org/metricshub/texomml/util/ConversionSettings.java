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

import org.metricshub.texomml.frontend.ast.DisplayType;

/**
 * A simple container for the parameters of a single conversion.
 * These values have defaults, which may be changed through command line
 * arguments, through the script engine context, or from Java code.
 */
public class ConversionSettings {

	/** Default indentation written once per nesting level */
	public static final String DEFAULT_INDENT = "  ";

	/**
	 * Whether the formula is a display block or runs inline with text;
	 * {@link DisplayType#INLINE} by default.
	 */
	private DisplayType displayType = DisplayType.INLINE;

	/**
	 * Whether the root element carries the {@code xmlns:m} declaration;
	 * <code>false</code> by default, since the output is usually pasted into
	 * a document which already declares it.
	 */
	private boolean declareNamespace = false;

	/**
	 * What is written once per nesting level in front of each output line.
	 */
	private String indent = DEFAULT_INDENT;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("displayType = ").append(getDisplayType()).append(newLine);
		desc.append("declareNamespace = ").append(isDeclareNamespace()).append(newLine);
		desc.append("indent = \"").append(getIndent()).append('"').append(newLine);

		return desc.toString();
	}

	/**
	 * @return the display type
	 */
	public DisplayType getDisplayType() {
		return displayType;
	}

	/**
	 * @param displayType the display type to set, must not be {@code null}
	 */
	public void setDisplayType(DisplayType displayType) {
		if (displayType == null) {
			throw new IllegalArgumentException("displayType must not be null");
		}
		this.displayType = displayType;
	}

	/**
	 * @return whether the namespace is declared on the root element
	 */
	public boolean isDeclareNamespace() {
		return declareNamespace;
	}

	/**
	 * @param declareNamespace whether to declare the namespace on the root element
	 */
	public void setDeclareNamespace(boolean declareNamespace) {
		this.declareNamespace = declareNamespace;
	}

	/**
	 * @return the indentation unit
	 */
	public String getIndent() {
		return indent;
	}

	/**
	 * @param indent the indentation unit; {@code null} means no indentation
	 */
	public void setIndent(String indent) {
		this.indent = indent == null ? "" : indent;
	}
}
