package org.metricshub.texomml.backend;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.SymbolType;

/**
 * Rewrites the top-level sequence before emission.
 * <ul>
 * <li>In inline mode, convertible under/over attachments (limits of
 * {@code \lim}, {@code \max}, ...) are turned into sub/superscripts.</li>
 * <li>An n-ary operator, with or without limits, is paired with the element
 * following it (its operand) in a two-element {@link Exp.Grouped} whose
 * first element carries both limits. The writer turns that pair into a
 * single {@code m:nary} construct.</li>
 * </ul>
 * Only the top level is rewritten; nested sequences are left alone.
 */
public final class LimitsRewriter {

	private static final Set<String> NARY_SYMBOLS = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("∫", "∬", "∭", "∮", "∯", "∰", "∏", "∐", "∑")));

	private LimitsRewriter() {
		// utility class
	}

	/**
	 * @param exp any expression
	 * @return whether {@code exp} is an n-ary operator symbol (sum, product,
	 *         coproduct or one of the integrals)
	 */
	public static boolean isNary(Exp exp) {
		if (!(exp instanceof Exp.Symbol)) {
			return false;
		}
		Exp.Symbol symbol = (Exp.Symbol) exp;
		return symbol.getType() == SymbolType.OP && NARY_SYMBOLS.contains(symbol.getValue());
	}

	/**
	 * @param displayType display mode of the formula
	 * @param exps top-level sequence
	 * @return the rewritten sequence
	 */
	public static List<Exp> rewrite(DisplayType displayType, List<Exp> exps) {
		List<Exp> result = new ArrayList<Exp>(exps.size());
		for (int i = 0; i < exps.size(); i++) {
			Exp exp = exps.get(i);
			if (displayType == DisplayType.INLINE) {
				exp = toScripts(exp);
			}
			Exp limits = withBothLimits(exp);
			if (limits == null) {
				result.add(exp);
				continue;
			}
			Exp operand = i + 1 < exps.size() ? exps.get(i + 1) : Exp.empty();
			result.add(new Exp.Grouped(Arrays.asList(limits, operand)));
			i++;
		}
		return result;
	}

	/**
	 * Turns a convertible attachment into the matching script.
	 */
	static Exp toScripts(Exp exp) {
		if (exp instanceof Exp.Under && ((Exp.Under) exp).isConvertible()) {
			Exp.Under under = (Exp.Under) exp;
			return new Exp.Sub(under.getBase(), under.getUnder());
		}
		if (exp instanceof Exp.Over && ((Exp.Over) exp).isConvertible()) {
			Exp.Over over = (Exp.Over) exp;
			return new Exp.Super(over.getBase(), over.getOver());
		}
		if (exp instanceof Exp.UnderOver && ((Exp.UnderOver) exp).isConvertible()) {
			Exp.UnderOver underOver = (Exp.UnderOver) exp;
			return new Exp.Subsup(underOver.getBase(), underOver.getUnder(), underOver.getOver());
		}
		return exp;
	}

	/**
	 * @return the n-ary operator with both limit slots filled (missing ones
	 *         empty), or {@code null} when {@code exp} is not an n-ary operator
	 */
	private static Exp withBothLimits(Exp exp) {
		if (isNary(exp)) {
			return new Exp.Subsup(exp, Exp.empty(), Exp.empty());
		}
		if (exp instanceof Exp.Over && isNary(((Exp.Over) exp).getBase())) {
			Exp.Over over = (Exp.Over) exp;
			return new Exp.UnderOver(over.isConvertible(), over.getBase(), Exp.empty(), over.getOver());
		}
		if (exp instanceof Exp.Under && isNary(((Exp.Under) exp).getBase())) {
			Exp.Under under = (Exp.Under) exp;
			return new Exp.UnderOver(under.isConvertible(), under.getBase(), under.getUnder(), Exp.empty());
		}
		if (exp instanceof Exp.UnderOver && isNary(((Exp.UnderOver) exp).getBase())) {
			return exp;
		}
		if (exp instanceof Exp.Sub && isNary(((Exp.Sub) exp).getBase())) {
			Exp.Sub sub = (Exp.Sub) exp;
			return new Exp.Subsup(sub.getBase(), sub.getSub(), Exp.empty());
		}
		if (exp instanceof Exp.Super && isNary(((Exp.Super) exp).getBase())) {
			Exp.Super sup = (Exp.Super) exp;
			return new Exp.Subsup(sup.getBase(), Exp.empty(), sup.getSup());
		}
		if (exp instanceof Exp.Subsup && isNary(((Exp.Subsup) exp).getBase())) {
			return exp;
		}
		return null;
	}
}
