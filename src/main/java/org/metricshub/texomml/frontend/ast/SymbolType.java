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
 * TeX atom classes carried by a {@link Exp.Symbol}.
 * The class of a symbol drives the spacing and the OMML construct
 * used to render it.
 */
public enum SymbolType {
	/** Ordinary atom */
	ORD,
	/** Large operator (sum, integral, ...) */
	OP,
	/** Binary operator */
	BIN,
	/** Relation */
	REL,
	/** Opening delimiter */
	OPEN,
	/** Closing delimiter */
	CLOSE,
	/** Punctuation */
	PUN,
	/** Accent placed over its argument */
	ACCENT,
	/** Fence (vertical bars) */
	FENCE,
	/** Bar or brace placed over its argument */
	T_OVER,
	/** Bar or brace placed under its argument */
	T_UNDER,
	/** Alphabetic */
	ALPHA,
	/** Accent placed under its argument */
	BOT_ACCENT,
	/** Radical */
	RAD
}
