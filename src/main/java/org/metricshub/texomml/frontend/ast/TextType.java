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
 * Font variants applied by text and style commands
 * ({@code \text}, {@code \mathbf}, {@code \mathbb}, ...).
 */
public enum TextType {
	NORMAL,
	BOLD,
	ITALIC,
	MONOSPACE,
	SANS_SERIF,
	DOUBLE_STRUCK,
	SCRIPT,
	FRAKTUR,
	BOLD_ITALIC,
	SANS_SERIF_BOLD,
	SANS_SERIF_BOLD_ITALIC,
	BOLD_SCRIPT,
	BOLD_FRAKTUR,
	SANS_SERIF_ITALIC
}
