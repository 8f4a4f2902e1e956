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

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a syntax tree, one node per line, children indented below their
 * parent. Used by the {@code --dump-syntax} command line switch.
 */
public final class AstDumper implements ExpVisitor<Void> {

	private final PrintStream out;
	private int indent;

	private AstDumper(PrintStream out) {
		this.out = out;
	}

	/**
	 * Dumps a sequence of top-level expressions.
	 *
	 * @param exps the parsed expressions
	 * @param out where to print
	 */
	public static void dump(List<Exp> exps, PrintStream out) {
		AstDumper dumper = new AstDumper(out);
		for (Exp exp : exps) {
			exp.accept(dumper);
		}
	}

	private void line(String text) {
		for (int i = 0; i < indent; i++) {
			out.print("  ");
		}
		out.println(text);
	}

	private void children(Exp... exps) {
		indent++;
		for (Exp exp : exps) {
			exp.accept(this);
		}
		indent--;
	}

	private void labelled(String label, Exp exp) {
		indent++;
		line(label + ":");
		children(exp);
		indent--;
	}

	private void sequence(List<Exp> exps) {
		indent++;
		for (Exp exp : exps) {
			exp.accept(this);
		}
		indent--;
	}

	@Override
	public Void visitNumber(Exp.Number exp) {
		line("Number " + exp.getValue());
		return null;
	}

	@Override
	public Void visitIdentifier(Exp.Identifier exp) {
		line("Identifier " + exp.getValue());
		return null;
	}

	@Override
	public Void visitSymbol(Exp.Symbol exp) {
		line("Symbol " + exp.getType() + " " + exp.getValue());
		return null;
	}

	@Override
	public Void visitText(Exp.Text exp) {
		line("Text " + exp.getTextType() + " \"" + exp.getValue() + "\"");
		return null;
	}

	@Override
	public Void visitSpace(Exp.Space exp) {
		line("Space " + exp.getWidth());
		return null;
	}

	@Override
	public Void visitMathOperator(Exp.MathOperator exp) {
		line("MathOperator " + exp.getValue());
		return null;
	}

	@Override
	public Void visitGrouped(Exp.Grouped exp) {
		line("Grouped");
		sequence(exp.getValue());
		return null;
	}

	@Override
	public Void visitSqrt(Exp.Sqrt exp) {
		line("Sqrt");
		children(exp.getValue());
		return null;
	}

	@Override
	public Void visitRoot(Exp.Root exp) {
		line("Root");
		labelled("index", exp.getIndex());
		labelled("base", exp.getBase());
		return null;
	}

	@Override
	public Void visitPhantom(Exp.Phantom exp) {
		line("Phantom");
		children(exp.getValue());
		return null;
	}

	@Override
	public Void visitBoxed(Exp.Boxed exp) {
		line("Boxed");
		children(exp.getValue());
		return null;
	}

	@Override
	public Void visitCancel(Exp.Cancel exp) {
		line("Cancel " + exp.getStrokeType());
		children(exp.getValue());
		return null;
	}

	@Override
	public Void visitScaled(Exp.Scaled exp) {
		line("Scaled " + exp.getScale());
		children(exp.getValue());
		return null;
	}

	@Override
	public Void visitSub(Exp.Sub exp) {
		line("Sub");
		labelled("base", exp.getBase());
		labelled("sub", exp.getSub());
		return null;
	}

	@Override
	public Void visitSuper(Exp.Super exp) {
		line("Super");
		labelled("base", exp.getBase());
		labelled("sup", exp.getSup());
		return null;
	}

	@Override
	public Void visitSubsup(Exp.Subsup exp) {
		line("Subsup");
		labelled("base", exp.getBase());
		labelled("sub", exp.getSub());
		labelled("sup", exp.getSup());
		return null;
	}

	@Override
	public Void visitFraction(Exp.Fraction exp) {
		line("Fraction " + exp.getFractionType());
		labelled("num", exp.getNumerator());
		labelled("den", exp.getDenominator());
		return null;
	}

	@Override
	public Void visitOver(Exp.Over exp) {
		line("Over" + (exp.isConvertible() ? " convertible" : ""));
		labelled("base", exp.getBase());
		labelled("over", exp.getOver());
		return null;
	}

	@Override
	public Void visitUnder(Exp.Under exp) {
		line("Under" + (exp.isConvertible() ? " convertible" : ""));
		labelled("base", exp.getBase());
		labelled("under", exp.getUnder());
		return null;
	}

	@Override
	public Void visitUnderOver(Exp.UnderOver exp) {
		line("UnderOver" + (exp.isConvertible() ? " convertible" : ""));
		labelled("base", exp.getBase());
		labelled("under", exp.getUnder());
		labelled("over", exp.getOver());
		return null;
	}

	@Override
	public Void visitDelimited(Exp.Delimited exp) {
		line("Delimited \"" + exp.getOpen() + "\" \"" + exp.getClose() + "\"");
		indent++;
		for (InDelimited item : exp.getContent()) {
			if (item.isSeparator()) {
				line("Separator \"" + item.getSeparator() + "\"");
			} else {
				item.getExp().accept(this);
			}
		}
		indent--;
		return null;
	}

	@Override
	public Void visitArray(Exp.Array exp) {
		line("Array " + exp.getAlignments());
		indent++;
		for (List<List<Exp>> row : exp.getRows()) {
			line("Row");
			indent++;
			for (List<Exp> cell : row) {
				line("Cell");
				sequence(cell);
			}
			indent--;
		}
		indent--;
		return null;
	}

	@Override
	public Void visitStyled(Exp.Styled exp) {
		line("Styled " + exp.getTextType());
		sequence(exp.getValue());
		return null;
	}
}
