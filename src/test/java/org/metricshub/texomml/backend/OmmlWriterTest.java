package org.metricshub.texomml.backend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.texomml.TexOmmlTestSupport;
import org.metricshub.texomml.frontend.TexParser;
import org.metricshub.texomml.frontend.ast.Alignment;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.FractionType;
import org.metricshub.texomml.frontend.ast.InDelimited;
import org.metricshub.texomml.frontend.ast.StrokeType;
import org.metricshub.texomml.frontend.ast.SymbolType;
import org.metricshub.texomml.frontend.ast.TextType;
import org.metricshub.texomml.util.ConversionSettings;
import org.w3c.dom.Element;

public class OmmlWriterTest {

	private static final OmmlWriter WRITER = new OmmlWriter();

	private static XmlNode.Element markup(DisplayType displayType, String tex) {
		return WRITER.toMarkup(displayType, new TexParser().parse(tex));
	}

	/**
	 * The only element below the inline root.
	 */
	private static XmlNode.Element single(String tex) {
		return single(new TexParser().parse(tex));
	}

	private static XmlNode.Element single(List<Exp> exps) {
		XmlNode.Element root = WRITER.toMarkup(DisplayType.INLINE, exps);
		assertEquals("Expected one node in " + root, 1, root.getChildren().size());
		return (XmlNode.Element) root.getChildren().get(0);
	}

	private static XmlNode.Element single(Exp exp) {
		return single(Collections.singletonList(exp));
	}

	private static String val(XmlNode.Element parent, String tag) {
		XmlNode.Element child = parent.child(tag);
		assertNotNull("No " + tag + " in " + parent, child);
		return child.getAttribute("m:val");
	}

	@Test
	public void testInlineAndBlockRoots() {
		XmlNode.Element inline = markup(DisplayType.INLINE, "x");
		assertEquals("m:oMath", inline.getTag());

		XmlNode.Element block = markup(DisplayType.BLOCK, "x");
		assertEquals("m:oMathPara", block.getTag());
		assertEquals("center", val(block.child("m:oMathParaPr"), "m:jc"));
		assertEquals("x", block.child("m:oMath").textContent());
	}

	@Test
	public void testNamespaceDeclaration() {
		ConversionSettings settings = new ConversionSettings();
		assertNull(new OmmlWriter(settings).toMarkup(DisplayType.INLINE, Collections.<Exp>emptyList()).getAttribute("xmlns:m"));
		settings.setDeclareNamespace(true);
		assertEquals(
				OmmlWriter.MATH_NAMESPACE,
				new OmmlWriter(settings).toMarkup(DisplayType.BLOCK, Collections.<Exp>emptyList()).getAttribute("xmlns:m"));
	}

	@Test
	public void testEmptyFormula() {
		assertEquals("<m:oMath/>", WRITER.write(DisplayType.INLINE, Collections.<Exp>emptyList()));
	}

	@Test
	public void testFraction() {
		XmlNode.Element fraction = single("\\frac{1}{2}");
		assertEquals("m:f", fraction.getTag());
		assertEquals("bar", val(fraction.child("m:fPr"), "m:type"));
		assertEquals("1", fraction.child("m:num").textContent());
		assertEquals("2", fraction.child("m:den").textContent());

		assertEquals("lin", val(single(new Exp.Fraction(FractionType.INLINE, new Exp.Number("1"), new Exp.Number("2"))).child("m:fPr"), "m:type"));
		assertEquals("noBar", val(single(new Exp.Fraction(FractionType.NO_LINE, new Exp.Number("1"), new Exp.Number("2"))).child("m:fPr"), "m:type"));
	}

	@Test
	public void testScripts() {
		XmlNode.Element sup = single("x^2");
		assertEquals("m:sSup", sup.getTag());
		assertEquals("x", sup.child("m:e").textContent());
		assertEquals("2", sup.child("m:sup").textContent());

		XmlNode.Element sub = single("x_i");
		assertEquals("m:sSub", sub.getTag());
		assertEquals("i", sub.child("m:sub").textContent());

		XmlNode.Element subsup = single("x_i^2");
		assertEquals("m:sSubSup", subsup.getTag());
		assertEquals(Arrays.asList("m:e", "m:sub", "m:sup"), tags(subsup));
	}

	@Test
	public void testRadicals() {
		XmlNode.Element sqrt = single("\\sqrt{x+1}");
		assertEquals("m:rad", sqrt.getTag());
		assertEquals("on", val(sqrt.child("m:radPr"), "m:degHide"));
		assertTrue(sqrt.child("m:deg").getChildren().isEmpty());
		assertEquals("x+1", sqrt.child("m:e").textContent());

		XmlNode.Element root = single("\\sqrt[3]{x}");
		assertNull(root.child("m:radPr"));
		assertEquals("3", root.child("m:deg").textContent());
	}

	@Test
	public void testNaryWithLimits() {
		XmlNode.Element nary = single("\\sum_{i=1}^{n} i");
		assertEquals("m:nary", nary.getTag());
		XmlNode.Element props = nary.child("m:naryPr");
		assertEquals("∑", val(props, "m:chr"));
		assertEquals("subSup", val(props, "m:limLoc"));
		assertEquals("off", val(props, "m:subHide"));
		assertEquals("off", val(props, "m:supHide"));
		assertEquals("i=1", nary.child("m:sub").textContent());
		assertEquals("n", nary.child("m:sup").textContent());
		assertEquals("i", nary.child("m:e").textContent());
	}

	@Test
	public void testNaryWithoutLimits() {
		XmlNode.Element nary = single("\\sum i");
		assertEquals("m:nary", nary.getTag());
		XmlNode.Element props = nary.child("m:naryPr");
		assertEquals("on", val(props, "m:subHide"));
		assertEquals("on", val(props, "m:supHide"));
		assertEquals("i", nary.child("m:e").textContent());
	}

	@Test
	public void testNaryUnderOverLimits() {
		Exp sum = new Exp.Symbol(SymbolType.OP, "∑");
		Exp limits = new Exp.UnderOver(false, sum, new Exp.Identifier("k"), new Exp.Identifier("n"));
		XmlNode.Element nary = single(Arrays.asList(limits, new Exp.Identifier("k")));
		assertEquals("undOvr", val(nary.child("m:naryPr"), "m:limLoc"));
		assertEquals("k", nary.child("m:sub").textContent());
		assertEquals("n", nary.child("m:sup").textContent());
	}

	@Test
	public void testIntegralWithoutOperand() {
		XmlNode.Element nary = single("\\int");
		assertEquals("∫", val(nary.child("m:naryPr"), "m:chr"));
		assertEquals("\u200B", nary.child("m:e").textContent());
	}

	@Test
	public void testConvertibleLimitsFollowDisplay() {
		XmlNode.Element block = markup(DisplayType.BLOCK, "\\lim_{x \\to 0} f").child("m:oMath");
		XmlNode.Element limLow = (XmlNode.Element) block.getChildren().get(0);
		assertEquals("m:limLow", limLow.getTag());
		assertEquals("lim", limLow.child("m:e").textContent());
		assertEquals("x→0", limLow.child("m:lim").textContent());

		XmlNode.Element inline = (XmlNode.Element) markup(DisplayType.INLINE, "\\lim_{x \\to 0} f").getChildren().get(0);
		assertEquals("m:sSub", inline.getTag());
	}

	@Test
	public void testOverAndUnderConstructs() {
		XmlNode.Element accent = single("\\hat{x}");
		assertEquals("m:acc", accent.getTag());
		assertEquals("^", val(accent.child("m:accPr"), "m:chr"));

		XmlNode.Element overline = single("\\overline{x}");
		assertEquals("m:bar", overline.getTag());
		assertEquals("top", val(overline.child("m:barPr"), "m:pos"));

		XmlNode.Element underline = single("\\underline{x}");
		assertEquals("m:bar", underline.getTag());
		assertEquals("bot", val(underline.child("m:barPr"), "m:pos"));

		XmlNode.Element overbrace = single("\\overbrace{x}");
		assertEquals("m:groupChr", overbrace.getTag());
		assertEquals("top", val(overbrace.child("m:groupChrPr"), "m:pos"));
		assertEquals("bot", val(overbrace.child("m:groupChrPr"), "m:vertJc"));

		XmlNode.Element underbrace = single("\\underbrace{x}");
		assertEquals("m:groupChr", underbrace.getTag());
		assertEquals("bot", val(underbrace.child("m:groupChrPr"), "m:pos"));
		assertEquals("top", val(underbrace.child("m:groupChrPr"), "m:vertJc"));

		XmlNode.Element overset = single("\\overset{a}{=}");
		assertEquals("m:limUpp", overset.getTag());
		assertEquals("a", overset.child("m:lim").textContent());
	}

	@Test
	public void testUnderOverDecomposesIntoUnderThenOver() {
		Exp exp = new Exp.UnderOver(false, new Exp.Identifier("x"), new Exp.Identifier("a"), new Exp.Identifier("b"));
		XmlNode.Element upper = single(exp);
		assertEquals("m:limUpp", upper.getTag());
		XmlNode.Element lower = (XmlNode.Element) upper.child("m:e").getChildren().get(0);
		assertEquals("m:limLow", lower.getTag());
		assertEquals("a", lower.child("m:lim").textContent());
		assertEquals("b", upper.child("m:lim").textContent());
	}

	@Test
	public void testDelimitedWithSeparators() {
		XmlNode.Element delimited = single("\\left( a \\middle| b \\right)");
		assertEquals("m:d", delimited.getTag());
		XmlNode.Element props = delimited.child("m:dPr");
		assertEquals("(", val(props, "m:begChr"));
		assertEquals("|", val(props, "m:sepChr"));
		assertEquals(")", val(props, "m:endChr"));
		assertNotNull(props.child("m:grow"));
		assertEquals(Arrays.asList("m:dPr", "m:e", "m:e"), tags(delimited));
	}

	@Test
	public void testEmptyDelimitedHasOneEmptyElement() {
		XmlNode.Element delimited = single(new Exp.Delimited("(", ")", Collections.<InDelimited>emptyList()));
		assertEquals(Arrays.asList("m:dPr", "m:e"), tags(delimited));
		assertEquals("", val(delimited.child("m:dPr"), "m:sepChr"));
	}

	@Test
	public void testMatrix() {
		XmlNode.Element delimited = single("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}");
		XmlNode.Element matrix = (XmlNode.Element) delimited.child("m:e").getChildren().get(0);
		assertEquals("m:m", matrix.getTag());
		XmlNode.Element props = matrix.child("m:mPr");
		assertEquals("center", val(props, "m:baseJc"));
		assertEquals("on", val(props, "m:plcHide"));
		List<XmlNode> columns = props.child("m:mcs").getChildren();
		assertEquals(2, columns.size());
		XmlNode.Element columnProps = ((XmlNode.Element) columns.get(0)).child("m:mcPr");
		assertEquals("center", val(columnProps, "m:mcJc"));
		assertEquals("1", val(columnProps, "m:count"));
		assertEquals(Arrays.asList("m:mPr", "m:mr", "m:mr"), tags(matrix));
		XmlNode.Element secondRow = (XmlNode.Element) matrix.getChildren().get(2);
		assertEquals("cd", secondRow.textContent());
	}

	@Test
	public void testAlignColumns() {
		XmlNode.Element matrix = single("\\begin{align} x &= 1 \\end{align}");
		List<XmlNode> columns = matrix.child("m:mPr").child("m:mcs").getChildren();
		assertEquals("right", val(((XmlNode.Element) columns.get(0)).child("m:mcPr"), "m:mcJc"));
		assertEquals("left", val(((XmlNode.Element) columns.get(1)).child("m:mcPr"), "m:mcJc"));
	}

	@Test
	public void testTextRun() {
		XmlNode.Element run = single("\\text{if}");
		assertEquals("m:r", run.getTag());
		XmlNode.Element props = run.child("m:rPr");
		assertNotNull(props.child("m:nor"));
		assertEquals("p", val(props, "m:sty"));
		assertEquals("if", run.textContent());
	}

	@Test
	public void testStyleInheritance() {
		assertEquals("b", val(single("\\mathbf{x}").child("m:rPr"), "m:sty"));

		// the innermost style wins
		assertEquals("i", val(single("\\mathbf{\\mathit{x}}").child("m:rPr"), "m:sty"));

		XmlNode.Element props = single("\\mathbb{\\mathbf{x}}").child("m:rPr");
		assertEquals("b", val(props, "m:sty"));
		assertEquals("double-struck", val(props, "m:scr"));
		assertEquals(2, props.getChildren().size());
	}

	@Test
	public void testStyleIsScopedToItsContent() {
		XmlNode.Element root = markup(DisplayType.INLINE, "\\mathbf{x} y");
		XmlNode.Element second = (XmlNode.Element) root.getChildren().get(1);
		assertNull(second.child("m:rPr"));
	}

	@Test
	public void testIdentifiersAndOperators() {
		assertNull(single("x").child("m:rPr"));
		assertEquals("p", val(single("\\Gamma").child("m:rPr"), "m:sty"));
		assertEquals("p", val(single("\\sin").child("m:rPr"), "m:sty"));
		assertEquals("\u200B", single(new Exp.Identifier("")).textContent());
	}

	@Test
	public void testOperatorNamesKeepEnclosingStyle() {
		XmlNode.Element root = markup(DisplayType.INLINE, "\\mathbf{\\sin x}");
		XmlNode.Element sin = (XmlNode.Element) root.getChildren().get(0);
		assertEquals("sin", sin.textContent());
		assertEquals(1, sin.child("m:rPr").getChildren().size());
		assertEquals("b", val(sin.child("m:rPr"), "m:sty"));

		XmlNode.Element props = single("\\mathbb{\\sin}").child("m:rPr");
		assertEquals("double-struck", val(props, "m:scr"));
		assertEquals("p", val(props, "m:sty"));
	}

	@Test
	public void testSymbols() {
		XmlNode.Element plus = single(new Exp.Symbol(SymbolType.BIN, "+"));
		assertEquals("m:r", plus.getTag());
		assertEquals("p", val(plus.child("m:rPr"), "m:sty"));

		XmlNode.Element box = single(new Exp.Symbol(SymbolType.BIN, "mod"));
		assertEquals("m:box", box.getTag());
		assertEquals("on", val(box.child("m:boxPr"), "m:opEmu"));
		assertEquals("mod", box.child("m:e").textContent());

		assertEquals("m:r", single(new Exp.Symbol(SymbolType.ORD, "ab")).getTag());
	}

	@Test
	public void testSpaces() {
		assertEquals("\u2009", OmmlWriter.spaceCharacter(0.167));
		assertEquals("\u2005", OmmlWriter.spaceCharacter(0.222));
		assertEquals("\u2004", OmmlWriter.spaceCharacter(0.278));
		assertEquals("\u2004", OmmlWriter.spaceCharacter(0.333));
		assertEquals("\u2001", OmmlWriter.spaceCharacter(1.0));
		assertEquals("\u2001\u2001", OmmlWriter.spaceCharacter(2.0));
		assertEquals("\u200B", OmmlWriter.spaceCharacter(0));
		assertEquals("\u200B", OmmlWriter.spaceCharacter(-0.167));
	}

	@Test
	public void testBoxPhantomAndCancel() {
		XmlNode.Element boxed = single("\\boxed{x}");
		assertEquals("m:borderBox", boxed.getTag());
		assertNull(boxed.child("m:borderBoxPr"));

		XmlNode.Element phantom = single("\\phantom{x}");
		assertEquals("m:phant", phantom.getTag());
		assertEquals("off", val(phantom.child("m:phantPr"), "m:show"));

		XmlNode.Element cancel = single("\\cancel{x}");
		XmlNode.Element props = cancel.child("m:borderBoxPr");
		assertEquals("1", val(props, "m:hideTop"));
		assertEquals("1", val(props, "m:strikeBLTR"));
		assertNull(props.child("m:strikeTLBR"));

		XmlNode.Element both = single(new Exp.Cancel(StrokeType.X_SLASH, new Exp.Identifier("x")));
		assertEquals(6, both.child("m:borderBoxPr").getChildren().size());
	}

	@Test
	public void testScaledRendersItsContent() {
		XmlNode.Element run = single("\\Bigl(");
		assertEquals("m:r", run.getTag());
		assertEquals("(", run.textContent());
	}

	@Test
	public void testEmptyGroupIsZeroWidthSpace() {
		assertEquals("\u200B", single(Exp.empty()).textContent());
	}

	@Test
	public void testEveryVariantIsWritten() {
		Exp x = new Exp.Identifier("x");
		Exp op = new Exp.Symbol(SymbolType.OP, "∫");
		List<Exp> exps = new ArrayList<Exp>();
		exps.add(new Exp.Number("1"));
		exps.add(new Exp.Identifier(""));
		exps.add(new Exp.Symbol(SymbolType.RAD, "√"));
		exps.add(new Exp.Text(TextType.SANS_SERIF_BOLD_ITALIC, "<&>"));
		exps.add(new Exp.Space(0.5));
		exps.add(new Exp.MathOperator("log"));
		exps.add(Exp.empty());
		exps.add(new Exp.Sqrt(Exp.empty()));
		exps.add(new Exp.Root(Exp.empty(), Exp.empty()));
		exps.add(new Exp.Phantom(Exp.empty()));
		exps.add(new Exp.Boxed(Exp.empty()));
		exps.add(new Exp.Cancel(StrokeType.BACK_SLASH, Exp.empty()));
		exps.add(new Exp.Scaled(2.1, Exp.empty()));
		exps.add(new Exp.Sub(x, Exp.empty()));
		exps.add(new Exp.Super(x, Exp.empty()));
		exps.add(new Exp.Subsup(x, Exp.empty(), Exp.empty()));
		exps.add(new Exp.Fraction(FractionType.DISPLAY, Exp.empty(), Exp.empty()));
		exps.add(new Exp.Over(true, Exp.empty(), Exp.empty()));
		exps.add(new Exp.Under(true, Exp.empty(), Exp.empty()));
		exps.add(new Exp.UnderOver(true, Exp.empty(), Exp.empty(), Exp.empty()));
		exps.add(new Exp.Over(false, op, x));
		exps.add(new Exp.Delimited("", "", Collections.singletonList(InDelimited.separator("|"))));
		exps.add(new Exp.Array(Collections.<Alignment>emptyList(), Collections.<List<List<Exp>>>emptyList()));
		exps.add(new Exp.Array(Collections.singletonList(Alignment.LEFT), Collections.singletonList(Collections.singletonList(Collections.<Exp>emptyList()))));
		exps.add(new Exp.Styled(TextType.FRAKTUR, Collections.<Exp>emptyList()));
		exps.add(new Exp.Styled(TextType.BOLD_SCRIPT, Collections.singletonList(new Exp.Grouped(Arrays.asList(op, x)))));
		exps.add(op);

		for (DisplayType displayType : DisplayType.values()) {
			String omml = WRITER.write(displayType, exps);
			Element root = TexOmmlTestSupport.parseXml(omml).getDocumentElement();
			assertEquals(displayType == DisplayType.BLOCK ? "m:oMathPara" : "m:oMath", root.getTagName());
		}
	}

	private static List<String> tags(XmlNode.Element element) {
		List<String> tags = new ArrayList<String>();
		for (XmlNode child : element.getChildren()) {
			tags.add(((XmlNode.Element) child).getTag());
		}
		return tags;
	}
}
