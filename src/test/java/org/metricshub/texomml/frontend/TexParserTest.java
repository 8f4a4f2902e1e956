package org.metricshub.texomml.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.texomml.frontend.ast.Alignment;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.FractionType;
import org.metricshub.texomml.frontend.ast.InDelimited;
import org.metricshub.texomml.frontend.ast.StrokeType;
import org.metricshub.texomml.frontend.ast.SymbolType;
import org.metricshub.texomml.frontend.ast.TextType;
import org.metricshub.texomml.frontend.ast.UnbalancedGroupException;

public class TexParserTest {

	private static List<Exp> parse(String tex) {
		return new TexParser().parse(tex);
	}

	private static Exp parseOne(String tex) {
		List<Exp> exps = parse(tex);
		assertEquals("Expected a single expression for " + tex + ": " + exps, 1, exps.size());
		return exps.get(0);
	}

	private static Exp id(String name) {
		return new Exp.Identifier(name);
	}

	private static Exp num(String value) {
		return new Exp.Number(value);
	}

	private static Exp sym(SymbolType type, String value) {
		return new Exp.Symbol(type, value);
	}

	private static List<Exp> cell(Exp... exps) {
		return Arrays.asList(exps);
	}

	@SafeVarargs
	private static List<List<Exp>> row(List<Exp>... cells) {
		return Arrays.asList(cells);
	}

	@Test
	public void testBinaryAfterRelationBecomesOrdinary() {
		List<Exp> fixed = TexParser.fixBinList(Arrays.asList(sym(SymbolType.REL, "="), sym(SymbolType.BIN, "−")));
		assertEquals(Arrays.asList(sym(SymbolType.REL, "="), sym(SymbolType.ORD, "−")), fixed);
	}

	@Test
	public void testLeadingBinaryBecomesOrdinary() {
		List<Exp> fixed = TexParser.fixBinList(Collections.singletonList(sym(SymbolType.BIN, "+")));
		assertEquals(Collections.singletonList(sym(SymbolType.ORD, "+")), fixed);
	}

	@Test
	public void testBinaryBetweenOperandsStaysBinary() {
		List<Exp> input = Arrays.asList(sym(SymbolType.ORD, "a"), sym(SymbolType.BIN, "+"), sym(SymbolType.ORD, "b"));
		assertEquals(input, TexParser.fixBinList(input));
	}

	@Test
	public void testBinaryBeforeClosingBecomesOrdinary() {
		List<Exp> fixed = TexParser
				.fixBinList(Arrays.asList(sym(SymbolType.ORD, "a"), sym(SymbolType.BIN, "+"), sym(SymbolType.CLOSE, ")")));
		assertEquals(SymbolType.ORD, ((Exp.Symbol) fixed.get(1)).getType());
	}

	@Test
	public void testBinaryReclassifiedOnlyAtTopLevel() {
		assertEquals(
				Arrays.asList(sym(SymbolType.ORD, "−"), id("x")),
				parse("-x"));
		assertEquals(
				new Exp.Grouped(Arrays.asList(sym(SymbolType.BIN, "−"), id("x"))),
				parseOne("{-x}"));
	}

	@Test
	public void testFraction() {
		assertEquals(new Exp.Fraction(FractionType.NORMAL, num("1"), num("2")), parseOne("\\frac{1}{2}"));
		assertEquals(new Exp.Fraction(FractionType.DISPLAY, id("a"), id("b")), parseOne("\\dfrac{a}{b}"));
		assertEquals(new Exp.Fraction(FractionType.INLINE, num("1"), num("2")), parseOne("\\tfrac12"));
	}

	@Test
	public void testSuperscript() {
		assertEquals(new Exp.Super(id("x"), num("2")), parseOne("x^2"));
	}

	@Test
	public void testSubSuperscriptInBothOrders() {
		Exp expected = new Exp.Subsup(id("x"), id("i"), num("2"));
		assertEquals(expected, parseOne("x_i^2"));
		assertEquals(expected, parseOne("x^2_i"));
	}

	@Test
	public void testSquareRoot() {
		Exp expected = new Exp.Sqrt(new Exp.Grouped(Arrays.asList(id("x"), sym(SymbolType.BIN, "+"), num("1"))));
		assertEquals(expected, parseOne("\\sqrt{x+1}"));
	}

	@Test
	public void testRootWithIndex() {
		assertEquals(new Exp.Root(num("3"), id("x")), parseOne("\\sqrt[3]{x}"));
	}

	@Test
	public void testParenthesizedMatrix() {
		Exp array = new Exp.Array(
				Arrays.asList(Alignment.CENTER, Alignment.CENTER),
				Arrays.asList(row(cell(id("a")), cell(id("b"))), row(cell(id("c")), cell(id("d")))));
		Exp expected = new Exp.Delimited("(", ")", Collections.singletonList(InDelimited.exp(array)));
		assertEquals(expected, parseOne("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}"));
	}

	@Test
	public void testPlainMatrixIgnoresTrailingRowBreak() {
		Exp expected = new Exp.Array(
				Arrays.asList(Alignment.CENTER, Alignment.CENTER),
				Arrays.asList(row(cell(num("1")), cell(num("0"))), row(cell(num("0")), cell(num("1")))));
		assertEquals(expected, parseOne("\\begin{matrix} 1 & 0 \\\\ 0 & 1 \\\\ \\end{matrix}"));
	}

	@Test
	public void testArrayColumnSpecification() {
		Exp expected = new Exp.Array(
				Arrays.asList(Alignment.LEFT, Alignment.RIGHT),
				Collections.singletonList(row(cell(id("a")), cell(id("b")))));
		assertEquals(expected, parseOne("\\begin{array}{lr} a & b \\end{array}"));
	}

	@Test
	public void testAlignAlternatesRightAndLeft() {
		Exp expected = new Exp.Array(
				Arrays.asList(Alignment.RIGHT, Alignment.LEFT),
				Arrays
						.asList(
								row(cell(id("x")), cell(sym(SymbolType.REL, "="), num("1"))),
								row(cell(id("y")), cell(sym(SymbolType.REL, "="), num("2")))));
		assertEquals(expected, parseOne("\\begin{align} x &= 1 \\\\ y &= 2 \\end{align}"));
	}

	@Test
	public void testCases() {
		Exp.Delimited cases = (Exp.Delimited) parseOne("\\begin{cases} 1 & x > 0 \\\\ 0 & x \\leq 0 \\end{cases}");
		assertEquals("{", cases.getOpen());
		assertEquals("", cases.getClose());
		Exp.Array array = (Exp.Array) cases.getContent().get(0).getExp();
		assertEquals(Arrays.asList(Alignment.LEFT, Alignment.LEFT), array.getAlignments());
		assertEquals(2, array.getRows().size());
	}

	@Test
	public void testUnbalancedGroup() {
		UnbalancedGroupException e = assertThrows(UnbalancedGroupException.class, () -> parse("\\frac{1}{2"));
		assertEquals(10, e.getPosition());
	}

	@Test
	public void testUnbalancedBracket() {
		assertThrows(UnbalancedGroupException.class, () -> parse("\\sqrt[3{x}"));
	}

	@Test
	public void testUnrecognizedCommandYieldsPartialResult() {
		assertEquals(Collections.emptyList(), parse("\\binom{n}{k}"));
		assertEquals(Arrays.asList(id("x"), sym(SymbolType.BIN, "+")), parse("x + \\binom{n}{k}"));
	}

	@Test
	public void testUnknownEnvironmentYieldsNothing() {
		assertEquals(Collections.emptyList(), parse("\\begin{foo} x \\end{foo}"));
	}

	@Test
	public void testUnrecognizedCommandInsideBracesIsSkipped() {
		assertEquals(new Exp.Sqrt(id("x")), parseOne("\\sqrt{\\foo x}"));
	}

	@Test
	public void testMiddleSeparator() {
		Exp expected = new Exp.Delimited(
				"(",
				")",
				Arrays.asList(InDelimited.exp(id("a")), InDelimited.separator("|"), InDelimited.exp(id("b"))));
		assertEquals(expected, parseOne("\\left( a \\middle| b \\right)"));
	}

	@Test
	public void testNullDelimiter() {
		Exp expected = new Exp.Delimited("{", "", Collections.singletonList(InDelimited.exp(id("x"))));
		assertEquals(expected, parseOne("\\left\\{ x \\right."));
	}

	@Test
	public void testPrimes() {
		assertEquals(Arrays.asList(id("f"), sym(SymbolType.PUN, "″")), parse("f''"));
		assertEquals(new Exp.Super(id("f"), sym(SymbolType.PUN, "′")), parseOne("f^'"));
	}

	@Test
	public void testLimitsOperatorTakesConvertibleLimits() {
		Exp expected = new Exp.Under(
				true,
				new Exp.MathOperator("lim"),
				new Exp.Grouped(Arrays.asList(id("x"), sym(SymbolType.REL, "→"), num("0"))));
		assertEquals(Arrays.asList(expected, id("f")), parse("\\lim_{x \\to 0} f"));
	}

	@Test
	public void testOrdinaryMathOperatorTakesScripts() {
		assertEquals(new Exp.Super(new Exp.MathOperator("sin"), num("2")), parse("\\sin^2 x").get(0));
	}

	@Test
	public void testStarredOperatorName() {
		Exp expected = new Exp.Under(true, new Exp.MathOperator("argmax"), id("x"));
		assertEquals(expected, parse("\\operatorname*{argmax}_x f").get(0));
		assertEquals(new Exp.Sub(new Exp.MathOperator("rank"), id("x")), parse("\\operatorname{rank}_x").get(0));
	}

	@Test
	public void testAccentsAndBars() {
		assertEquals(new Exp.Over(false, id("x"), sym(SymbolType.ACCENT, "^")), parseOne("\\hat{x}"));
		assertEquals(new Exp.Over(false, id("x"), sym(SymbolType.T_OVER, "¯")), parseOne("\\overline{x}"));
		assertEquals(new Exp.Under(false, id("x"), sym(SymbolType.T_UNDER, "_")), parseOne("\\underline x"));
	}

	@Test
	public void testOversetAndUnderset() {
		assertEquals(new Exp.Over(false, sym(SymbolType.REL, "="), id("a")), parseOne("\\overset{a}{=}"));
		assertEquals(new Exp.Under(false, sym(SymbolType.REL, "="), id("b")), parseOne("\\underset{b}{=}"));
	}

	@Test
	public void testTextAndStyle() {
		assertEquals(new Exp.Text(TextType.NORMAL, "if x > 0"), parseOne("\\text{if x > 0}"));
		assertEquals(new Exp.Styled(TextType.BOLD, Arrays.asList(id("x"), id("y"))), parseOne("\\mathbf{xy}"));
		assertEquals(new Exp.Styled(TextType.DOUBLE_STRUCK, Collections.singletonList(id("R"))), parseOne("\\mathbb R"));
	}

	@Test
	public void testBoxPhantomAndCancel() {
		assertEquals(new Exp.Boxed(id("x")), parseOne("\\boxed{x}"));
		assertEquals(new Exp.Phantom(id("x")), parseOne("\\phantom{x}"));
		assertEquals(new Exp.Cancel(StrokeType.FORWARD_SLASH, id("x")), parseOne("\\cancel{x}"));
		assertEquals(new Exp.Cancel(StrokeType.BACK_SLASH, id("x")), parseOne("\\bcancel{x}"));
		assertEquals(new Exp.Cancel(StrokeType.X_SLASH, id("x")), parseOne("\\xcancel{x}"));
	}

	@Test
	public void testScaledDelimiters() {
		assertEquals(new Exp.Scaled(1.2, sym(SymbolType.OPEN, "(")), parseOne("\\bigl("));
		assertEquals(new Exp.Scaled(2.6, sym(SymbolType.CLOSE, "]")), parseOne("\\Biggr]"));
	}

	@Test
	public void testSpaces() {
		assertEquals(new Exp.Space(1.0), parseOne("\\quad"));
		assertEquals(new Exp.Space(0.167), parseOne("\\,"));
		assertEquals(new Exp.Space(2.0), parseOne("\\hspace{2em}"));
		assertEquals(new Exp.Space(1.0), parseOne("\\hspace{1EM}"));
	}

	@Test
	public void testDimensionsToEm() {
		assertEquals(1.0, TexParser.toEm("1em"), 1e-9);
		assertEquals(1.0, TexParser.toEm("10pt"), 1e-9);
		assertEquals(1.0, TexParser.toEm("18mu"), 1e-9);
		assertEquals(0.86, TexParser.toEm("2ex"), 1e-9);
		assertEquals(0.333, TexParser.toEm("wide"), 1e-9);
		assertEquals(1.5, TexParser.toEm("1.5EM"), 1e-9);
		assertEquals(1.2, TexParser.toEm("12Pt"), 1e-9);
	}

	@Test
	public void testNumbers() {
		assertEquals(num("3.14"), parseOne("3.14"));
		assertEquals(Arrays.asList(id("x"), sym(SymbolType.ORD, ".")), parse("x."));
	}

	@Test
	public void testGreekAndSymbols() {
		assertEquals(Arrays.asList(id("α"), sym(SymbolType.BIN, "±"), id("Γ")), parse("\\alpha \\pm \\Gamma"));
	}

	@Test
	public void testCommentsAndWhitespaceAreIgnored() {
		assertEquals(
				Arrays.asList(id("x"), sym(SymbolType.BIN, "+"), id("y")),
				parse("  x % the first operand\n  +   y  "));
	}

	@Test
	public void testEmptyInput() {
		assertEquals(Collections.emptyList(), parse(""));
		assertEquals(Collections.emptyList(), parse("   % only a comment"));
	}
}
