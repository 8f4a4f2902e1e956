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
 * Handles every kind of {@link Exp}. Adding a node kind breaks every
 * implementation, which is how the parser, the writer and the dumper stay
 * exhaustive.
 *
 * @param <R> result of a visit
 */
public interface ExpVisitor<R> {

	R visitNumber(Exp.Number exp);

	R visitIdentifier(Exp.Identifier exp);

	R visitSymbol(Exp.Symbol exp);

	R visitText(Exp.Text exp);

	R visitSpace(Exp.Space exp);

	R visitMathOperator(Exp.MathOperator exp);

	R visitGrouped(Exp.Grouped exp);

	R visitSqrt(Exp.Sqrt exp);

	R visitRoot(Exp.Root exp);

	R visitPhantom(Exp.Phantom exp);

	R visitBoxed(Exp.Boxed exp);

	R visitCancel(Exp.Cancel exp);

	R visitScaled(Exp.Scaled exp);

	R visitSub(Exp.Sub exp);

	R visitSuper(Exp.Super exp);

	R visitSubsup(Exp.Subsup exp);

	R visitFraction(Exp.Fraction exp);

	R visitOver(Exp.Over exp);

	R visitUnder(Exp.Under exp);

	R visitUnderOver(Exp.UnderOver exp);

	R visitDelimited(Exp.Delimited exp);

	R visitArray(Exp.Array exp);

	R visitStyled(Exp.Styled exp);
}
