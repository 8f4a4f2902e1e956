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

import java.util.Objects;

/**
 * One item of a {@link Exp.Delimited} region: either a {@code \middle}
 * separator or an expression.
 */
public final class InDelimited {

	private final String separator;
	private final Exp exp;

	private InDelimited(String separator, Exp exp) {
		this.separator = separator;
		this.exp = exp;
	}

	/**
	 * @param separator the delimiter given to {@code \middle}
	 * @return a separator item
	 */
	public static InDelimited separator(String separator) {
		return new InDelimited(Objects.requireNonNull(separator), null);
	}

	/**
	 * @param exp the expression
	 * @return an expression item
	 */
	public static InDelimited exp(Exp exp) {
		return new InDelimited(null, Objects.requireNonNull(exp));
	}

	public boolean isSeparator() {
		return separator != null;
	}

	/**
	 * @return the separator, or {@code null} for an expression item
	 */
	public String getSeparator() {
		return separator;
	}

	/**
	 * @return the expression, or {@code null} for a separator item
	 */
	public Exp getExp() {
		return exp;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof InDelimited)) {
			return false;
		}
		InDelimited other = (InDelimited) o;
		return Objects.equals(separator, other.separator) && Objects.equals(exp, other.exp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(separator, exp);
	}

	@Override
	public String toString() {
		return isSeparator() ? "Separator(" + separator + ")" : exp.toString();
	}
}
