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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of the math syntax tree produced by the TeX parser.
 * <p>
 * The set of node kinds is closed: every kind is a nested class of
 * {@code Exp} and the constructor of {@code Exp} is private, so no other
 * class can extend it. Nodes are immutable. Code that needs to handle every
 * kind implements {@link ExpVisitor}.
 */
public abstract class Exp {

	private Exp() {}

	/**
	 * Dispatches to the method of the visitor matching this node kind.
	 *
	 * @param visitor the visitor
	 * @param <R> result type of the visitor
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(ExpVisitor<R> visitor);

	/**
	 * @return an empty group, used as a placeholder for missing limits and operands
	 */
	public static Grouped empty() {
		return new Grouped(Collections.<Exp>emptyList());
	}

	/**
	 * @param exp any node
	 * @return whether the node is a group without children
	 */
	public static boolean isEmptyGroup(Exp exp) {
		return exp instanceof Grouped && ((Grouped) exp).getValue().isEmpty();
	}

	private static <T> List<T> freeze(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<T>(Objects.requireNonNull(list)));
	}

	/** A number literal such as {@code 3.14} */
	public static final class Number extends Exp {
		private final String value;

		public Number(String value) {
			this.value = Objects.requireNonNull(value);
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Number && value.equals(((Number) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Number", value);
		}

		@Override
		public String toString() {
			return "Number(" + value + ")";
		}
	}

	/** A single-letter variable or a Greek letter */
	public static final class Identifier extends Exp {
		private final String value;

		public Identifier(String value) {
			this.value = Objects.requireNonNull(value);
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitIdentifier(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Identifier && value.equals(((Identifier) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Identifier", value);
		}

		@Override
		public String toString() {
			return "Identifier(" + value + ")";
		}
	}

	/** A symbol with its TeX atom class */
	public static final class Symbol extends Exp {
		private final SymbolType type;
		private final String value;

		public Symbol(SymbolType type, String value) {
			this.type = Objects.requireNonNull(type);
			this.value = Objects.requireNonNull(value);
		}

		public SymbolType getType() {
			return type;
		}

		public String getValue() {
			return value;
		}

		/**
		 * @param newType the class of the copy
		 * @return a copy of this symbol with another class
		 */
		public Symbol withType(SymbolType newType) {
			return new Symbol(newType, value);
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSymbol(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Symbol)) {
				return false;
			}
			Symbol other = (Symbol) o;
			return type == other.type && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Symbol", type, value);
		}

		@Override
		public String toString() {
			return "Symbol(" + type + ", " + value + ")";
		}
	}

	/** A run of raw text, such as the argument of {@code \text} */
	public static final class Text extends Exp {
		private final TextType textType;
		private final String value;

		public Text(TextType textType, String value) {
			this.textType = Objects.requireNonNull(textType);
			this.value = Objects.requireNonNull(value);
		}

		public TextType getTextType() {
			return textType;
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitText(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Text)) {
				return false;
			}
			Text other = (Text) o;
			return textType == other.textType && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Text", textType, value);
		}

		@Override
		public String toString() {
			return "Text(" + textType + ", " + value + ")";
		}
	}

	/** Horizontal space, with its width in em */
	public static final class Space extends Exp {
		private final double width;

		public Space(double width) {
			this.width = width;
		}

		public double getWidth() {
			return width;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSpace(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Space && Double.compare(width, ((Space) o).width) == 0;
		}

		@Override
		public int hashCode() {
			return Objects.hash("Space", width);
		}

		@Override
		public String toString() {
			return "Space(" + width + ")";
		}
	}

	/** A named operator such as {@code \sin} or {@code \operatorname{rank}} */
	public static final class MathOperator extends Exp {
		private final String value;

		public MathOperator(String value) {
			this.value = Objects.requireNonNull(value);
		}

		public String getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitMathOperator(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof MathOperator && value.equals(((MathOperator) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("MathOperator", value);
		}

		@Override
		public String toString() {
			return "MathOperator(" + value + ")";
		}
	}

	/** A braced sequence of expressions */
	public static final class Grouped extends Exp {
		private final List<Exp> value;

		public Grouped(List<Exp> value) {
			this.value = freeze(value);
		}

		public List<Exp> getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitGrouped(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Grouped && value.equals(((Grouped) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Grouped", value);
		}

		@Override
		public String toString() {
			return "Grouped" + value;
		}
	}

	/** Square root */
	public static final class Sqrt extends Exp {
		private final Exp value;

		public Sqrt(Exp value) {
			this.value = Objects.requireNonNull(value);
		}

		public Exp getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSqrt(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Sqrt && value.equals(((Sqrt) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Sqrt", value);
		}

		@Override
		public String toString() {
			return "Sqrt(" + value + ")";
		}
	}

	/** Root with an explicit index, {@code \sqrt[n]{x}} */
	public static final class Root extends Exp {
		private final Exp index;
		private final Exp base;

		public Root(Exp index, Exp base) {
			this.index = Objects.requireNonNull(index);
			this.base = Objects.requireNonNull(base);
		}

		public Exp getIndex() {
			return index;
		}

		public Exp getBase() {
			return base;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitRoot(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Root)) {
				return false;
			}
			Root other = (Root) o;
			return index.equals(other.index) && base.equals(other.base);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Root", index, base);
		}

		@Override
		public String toString() {
			return "Root(" + index + ", " + base + ")";
		}
	}

	/** Invisible content that still takes up its space */
	public static final class Phantom extends Exp {
		private final Exp value;

		public Phantom(Exp value) {
			this.value = Objects.requireNonNull(value);
		}

		public Exp getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitPhantom(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Phantom && value.equals(((Phantom) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Phantom", value);
		}

		@Override
		public String toString() {
			return "Phantom(" + value + ")";
		}
	}

	/** Content surrounded by a frame */
	public static final class Boxed extends Exp {
		private final Exp value;

		public Boxed(Exp value) {
			this.value = Objects.requireNonNull(value);
		}

		public Exp getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitBoxed(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Boxed && value.equals(((Boxed) o).value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Boxed", value);
		}

		@Override
		public String toString() {
			return "Boxed(" + value + ")";
		}
	}

	/** Struck-through content */
	public static final class Cancel extends Exp {
		private final StrokeType strokeType;
		private final Exp value;

		public Cancel(StrokeType strokeType, Exp value) {
			this.strokeType = Objects.requireNonNull(strokeType);
			this.value = Objects.requireNonNull(value);
		}

		public StrokeType getStrokeType() {
			return strokeType;
		}

		public Exp getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitCancel(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Cancel)) {
				return false;
			}
			Cancel other = (Cancel) o;
			return strokeType == other.strokeType && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Cancel", strokeType, value);
		}

		@Override
		public String toString() {
			return "Cancel(" + strokeType + ", " + value + ")";
		}
	}

	/** Content scaled by a factor, as produced by {@code \big(} and friends */
	public static final class Scaled extends Exp {
		private final double scale;
		private final Exp value;

		public Scaled(double scale, Exp value) {
			this.scale = scale;
			this.value = Objects.requireNonNull(value);
		}

		public double getScale() {
			return scale;
		}

		public Exp getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitScaled(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Scaled)) {
				return false;
			}
			Scaled other = (Scaled) o;
			return Double.compare(scale, other.scale) == 0 && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Scaled", scale, value);
		}

		@Override
		public String toString() {
			return "Scaled(" + scale + ", " + value + ")";
		}
	}

	/** {@code base_sub} */
	public static final class Sub extends Exp {
		private final Exp base;
		private final Exp sub;

		public Sub(Exp base, Exp sub) {
			this.base = Objects.requireNonNull(base);
			this.sub = Objects.requireNonNull(sub);
		}

		public Exp getBase() {
			return base;
		}

		public Exp getSub() {
			return sub;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSub(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Sub)) {
				return false;
			}
			Sub other = (Sub) o;
			return base.equals(other.base) && sub.equals(other.sub);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Sub", base, sub);
		}

		@Override
		public String toString() {
			return "Sub(" + base + ", " + sub + ")";
		}
	}

	/** {@code base^sup} */
	public static final class Super extends Exp {
		private final Exp base;
		private final Exp sup;

		public Super(Exp base, Exp sup) {
			this.base = Objects.requireNonNull(base);
			this.sup = Objects.requireNonNull(sup);
		}

		public Exp getBase() {
			return base;
		}

		public Exp getSup() {
			return sup;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSuper(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Super)) {
				return false;
			}
			Super other = (Super) o;
			return base.equals(other.base) && sup.equals(other.sup);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Super", base, sup);
		}

		@Override
		public String toString() {
			return "Super(" + base + ", " + sup + ")";
		}
	}

	/** {@code base_sub^sup} */
	public static final class Subsup extends Exp {
		private final Exp base;
		private final Exp sub;
		private final Exp sup;

		public Subsup(Exp base, Exp sub, Exp sup) {
			this.base = Objects.requireNonNull(base);
			this.sub = Objects.requireNonNull(sub);
			this.sup = Objects.requireNonNull(sup);
		}

		public Exp getBase() {
			return base;
		}

		public Exp getSub() {
			return sub;
		}

		public Exp getSup() {
			return sup;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitSubsup(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Subsup)) {
				return false;
			}
			Subsup other = (Subsup) o;
			return base.equals(other.base) && sub.equals(other.sub) && sup.equals(other.sup);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Subsup", base, sub, sup);
		}

		@Override
		public String toString() {
			return "Subsup(" + base + ", " + sub + ", " + sup + ")";
		}
	}

	/** A fraction */
	public static final class Fraction extends Exp {
		private final FractionType fractionType;
		private final Exp numerator;
		private final Exp denominator;

		public Fraction(FractionType fractionType, Exp numerator, Exp denominator) {
			this.fractionType = Objects.requireNonNull(fractionType);
			this.numerator = Objects.requireNonNull(numerator);
			this.denominator = Objects.requireNonNull(denominator);
		}

		public FractionType getFractionType() {
			return fractionType;
		}

		public Exp getNumerator() {
			return numerator;
		}

		public Exp getDenominator() {
			return denominator;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitFraction(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Fraction)) {
				return false;
			}
			Fraction other = (Fraction) o;
			return fractionType == other.fractionType
					&& numerator.equals(other.numerator)
					&& denominator.equals(other.denominator);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Fraction", fractionType, numerator, denominator);
		}

		@Override
		public String toString() {
			return "Fraction(" + fractionType + ", " + numerator + ", " + denominator + ")";
		}
	}

	/**
	 * {@code over} placed above {@code base}. A convertible attachment may be
	 * rendered as a superscript in inline mode.
	 */
	public static final class Over extends Exp {
		private final boolean convertible;
		private final Exp base;
		private final Exp over;

		public Over(boolean convertible, Exp base, Exp over) {
			this.convertible = convertible;
			this.base = Objects.requireNonNull(base);
			this.over = Objects.requireNonNull(over);
		}

		public boolean isConvertible() {
			return convertible;
		}

		public Exp getBase() {
			return base;
		}

		public Exp getOver() {
			return over;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitOver(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Over)) {
				return false;
			}
			Over other = (Over) o;
			return convertible == other.convertible && base.equals(other.base) && over.equals(other.over);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Over", convertible, base, over);
		}

		@Override
		public String toString() {
			return "Over(" + convertible + ", " + base + ", " + over + ")";
		}
	}

	/**
	 * {@code under} placed below {@code base}. A convertible attachment may be
	 * rendered as a subscript in inline mode.
	 */
	public static final class Under extends Exp {
		private final boolean convertible;
		private final Exp base;
		private final Exp under;

		public Under(boolean convertible, Exp base, Exp under) {
			this.convertible = convertible;
			this.base = Objects.requireNonNull(base);
			this.under = Objects.requireNonNull(under);
		}

		public boolean isConvertible() {
			return convertible;
		}

		public Exp getBase() {
			return base;
		}

		public Exp getUnder() {
			return under;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitUnder(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Under)) {
				return false;
			}
			Under other = (Under) o;
			return convertible == other.convertible && base.equals(other.base) && under.equals(other.under);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Under", convertible, base, under);
		}

		@Override
		public String toString() {
			return "Under(" + convertible + ", " + base + ", " + under + ")";
		}
	}

	/** Both an under and an over attachment */
	public static final class UnderOver extends Exp {
		private final boolean convertible;
		private final Exp base;
		private final Exp under;
		private final Exp over;

		public UnderOver(boolean convertible, Exp base, Exp under, Exp over) {
			this.convertible = convertible;
			this.base = Objects.requireNonNull(base);
			this.under = Objects.requireNonNull(under);
			this.over = Objects.requireNonNull(over);
		}

		public boolean isConvertible() {
			return convertible;
		}

		public Exp getBase() {
			return base;
		}

		public Exp getUnder() {
			return under;
		}

		public Exp getOver() {
			return over;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitUnderOver(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof UnderOver)) {
				return false;
			}
			UnderOver other = (UnderOver) o;
			return convertible == other.convertible
					&& base.equals(other.base)
					&& under.equals(other.under)
					&& over.equals(other.over);
		}

		@Override
		public int hashCode() {
			return Objects.hash("UnderOver", convertible, base, under, over);
		}

		@Override
		public String toString() {
			return "UnderOver(" + convertible + ", " + base + ", " + under + ", " + over + ")";
		}
	}

	/**
	 * A region between stretchy delimiters, {@code \left( ... \middle| ... \right)}.
	 * Empty delimiter strings stand for the null delimiter {@code .}.
	 */
	public static final class Delimited extends Exp {
		private final String open;
		private final String close;
		private final List<InDelimited> content;

		public Delimited(String open, String close, List<InDelimited> content) {
			this.open = Objects.requireNonNull(open);
			this.close = Objects.requireNonNull(close);
			this.content = freeze(content);
		}

		public String getOpen() {
			return open;
		}

		public String getClose() {
			return close;
		}

		public List<InDelimited> getContent() {
			return content;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitDelimited(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Delimited)) {
				return false;
			}
			Delimited other = (Delimited) o;
			return open.equals(other.open) && close.equals(other.close) && content.equals(other.content);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Delimited", open, close, content);
		}

		@Override
		public String toString() {
			return "Delimited(" + open + ", " + close + ", " + content + ")";
		}
	}

	/**
	 * A matrix-like layout. Each row is a list of cells and each cell a
	 * sequence of expressions. Rows may have different lengths.
	 */
	public static final class Array extends Exp {
		private final List<Alignment> alignments;
		private final List<List<List<Exp>>> rows;

		public Array(List<Alignment> alignments, List<List<List<Exp>>> rows) {
			this.alignments = freeze(alignments);
			List<List<List<Exp>>> frozenRows = new ArrayList<List<List<Exp>>>(rows.size());
			for (List<List<Exp>> row : rows) {
				List<List<Exp>> frozenRow = new ArrayList<List<Exp>>(row.size());
				for (List<Exp> cell : row) {
					frozenRow.add(freeze(cell));
				}
				frozenRows.add(Collections.unmodifiableList(frozenRow));
			}
			this.rows = Collections.unmodifiableList(frozenRows);
		}

		public List<Alignment> getAlignments() {
			return alignments;
		}

		public List<List<List<Exp>>> getRows() {
			return rows;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitArray(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Array)) {
				return false;
			}
			Array other = (Array) o;
			return alignments.equals(other.alignments) && rows.equals(other.rows);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Array", alignments, rows);
		}

		@Override
		public String toString() {
			return "Array(" + alignments + ", " + rows + ")";
		}
	}

	/** A sequence rendered with a font variant, {@code \mathbf{...}} */
	public static final class Styled extends Exp {
		private final TextType textType;
		private final List<Exp> value;

		public Styled(TextType textType, List<Exp> value) {
			this.textType = Objects.requireNonNull(textType);
			this.value = freeze(value);
		}

		public TextType getTextType() {
			return textType;
		}

		public List<Exp> getValue() {
			return value;
		}

		@Override
		public <R> R accept(ExpVisitor<R> visitor) {
			return visitor.visitStyled(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Styled)) {
				return false;
			}
			Styled other = (Styled) o;
			return textType == other.textType && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("Styled", textType, value);
		}

		@Override
		public String toString() {
			return "Styled(" + textType + ", " + value + ")";
		}
	}
}
