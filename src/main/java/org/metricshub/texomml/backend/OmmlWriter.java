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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.texomml.frontend.ast.Alignment;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.ExpVisitor;
import org.metricshub.texomml.frontend.ast.FractionType;
import org.metricshub.texomml.frontend.ast.InDelimited;
import org.metricshub.texomml.frontend.ast.StrokeType;
import org.metricshub.texomml.frontend.ast.SymbolType;
import org.metricshub.texomml.frontend.ast.TextType;
import org.metricshub.texomml.util.ConversionSettings;
import org.metricshub.texomml.util.TexOmmlLogger;
import org.slf4j.Logger;

/**
 * Turns a parsed formula into Office Math Markup Language.
 * <p>
 * The top-level sequence first goes through the {@link LimitsRewriter}, then
 * every expression is emitted as zero or more {@code m:} elements, and the
 * result is wrapped in {@code m:oMathPara} (block display) or
 * {@code m:oMath} (inline display) and serialized by the
 * {@link XmlSerializer}.
 * <p>
 * Writing never fails: constructs with no OMML equivalent are rendered with
 * the closest available element.
 */
public class OmmlWriter {

	private static final Logger LOGGER = TexOmmlLogger.getLogger(OmmlWriter.class);

	/** Namespace bound to the {@code m} prefix */
	public static final String MATH_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";

	private static final String ZERO_WIDTH_SPACE = "\u200B";

	private static final Pattern SYMBOL_OR_PUNCTUATION = Pattern.compile("[^\\w\\s]");

	private static final Set<String> UPPERCASE_GREEK = Collections
			.unmodifiableSet(
					new HashSet<String>(Arrays.asList("Γ", "Δ", "Θ", "Λ", "Ξ", "Π", "Σ", "Υ", "Φ", "Ψ", "Ω")));

	private static final Set<String> BAR_CHARACTERS = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("\u203E", "\u00AF", "\u0304", "\u0333", "_")));

	private final ConversionSettings settings;

	/**
	 * Creates a writer with default settings.
	 */
	public OmmlWriter() {
		this(new ConversionSettings());
	}

	/**
	 * @param settings namespace declaration, indentation and default display type
	 */
	public OmmlWriter(ConversionSettings settings) {
		this.settings = settings;
	}

	/**
	 * Writes a formula in the display type of the settings.
	 *
	 * @param exps parsed formula
	 * @return the OMML text
	 */
	public String write(List<Exp> exps) {
		return write(settings.getDisplayType(), exps);
	}

	/**
	 * @param displayType block or inline display
	 * @param exps parsed formula
	 * @return the OMML text
	 */
	public String write(DisplayType displayType, List<Exp> exps) {
		return new XmlSerializer(settings.getIndent()).serialize(toMarkup(displayType, exps));
	}

	/**
	 * Builds the markup tree without serializing it.
	 *
	 * @param displayType block or inline display
	 * @param exps parsed formula
	 * @return the root element, {@code m:oMathPara} or {@code m:oMath}
	 */
	public XmlNode.Element toMarkup(DisplayType displayType, List<Exp> exps) {
		List<XmlNode> nodes = new Emitter(Collections.<XmlNode.Element>emptyList())
				.all(LimitsRewriter.rewrite(displayType, exps));
		XmlNode.Element root;
		if (displayType == DisplayType.BLOCK) {
			root = node("oMathPara", node("oMathParaPr", val("jc", "center")), node("oMath", nodes));
		} else {
			root = node("oMath", nodes);
		}
		if (settings.isDeclareNamespace()) {
			root = root.withAttribute("xmlns:m", MATH_NAMESPACE);
		}
		return root;
	}

	static XmlNode.Element node(String tag, List<? extends XmlNode> children) {
		return new XmlNode.Element("m:" + tag, Collections.<String, String>emptyMap(), new ArrayList<XmlNode>(children));
	}

	static XmlNode.Element node(String tag, XmlNode... children) {
		return node(tag, Arrays.asList(children));
	}

	static XmlNode.Element val(String tag, String value) {
		Map<String, String> attributes = new LinkedHashMap<String, String>();
		attributes.put("m:val", value);
		return new XmlNode.Element("m:" + tag, attributes, Collections.<XmlNode>emptyList());
	}

	/**
	 * A text run, {@code m:r}, with its run properties when there are any.
	 */
	static XmlNode.Element run(List<XmlNode.Element> props, String text) {
		XmlNode.Element t = node("t", new XmlNode.Text(text));
		if (props.isEmpty()) {
			return node("r", t);
		}
		return node("r", node("rPr", props), t);
	}

	/**
	 * Run properties of a text style.
	 */
	static List<XmlNode.Element> styleProperties(TextType textType) {
		switch (textType) {
		case BOLD:
			return Arrays.asList(val("sty", "b"));
		case ITALIC:
			return Arrays.asList(val("sty", "i"));
		case BOLD_ITALIC:
			return Arrays.asList(val("sty", "bi"));
		case MONOSPACE:
			return Arrays.asList(val("scr", "monospace"), val("sty", "p"));
		case SANS_SERIF:
			return Arrays.asList(val("scr", "sans-serif"), val("sty", "p"));
		case DOUBLE_STRUCK:
			return Arrays.asList(val("scr", "double-struck"), val("sty", "p"));
		case SCRIPT:
			return Arrays.asList(val("scr", "script"), val("sty", "p"));
		case FRAKTUR:
			return Arrays.asList(val("scr", "fraktur"), val("sty", "p"));
		case SANS_SERIF_BOLD:
			return Arrays.asList(val("scr", "sans-serif"), val("sty", "b"));
		case BOLD_SCRIPT:
			return Arrays.asList(val("scr", "script"), val("sty", "b"));
		case BOLD_FRAKTUR:
			return Arrays.asList(val("scr", "fraktur"), val("sty", "b"));
		case SANS_SERIF_ITALIC:
			return Arrays.asList(val("scr", "sans-serif"), val("sty", "i"));
		case SANS_SERIF_BOLD_ITALIC:
			return Arrays.asList(val("scr", "sans-serif"), val("sty", "bi"));
		case NORMAL:
		default:
			return Arrays.asList(val("sty", "p"));
		}
	}

	/**
	 * Puts {@code inner} in front of {@code outer}. When both hold a property
	 * with the same tag, the inner one is kept.
	 */
	static List<XmlNode.Element> mergeProperties(List<XmlNode.Element> inner, List<XmlNode.Element> outer) {
		List<XmlNode.Element> merged = new ArrayList<XmlNode.Element>(inner);
		Set<String> tags = new HashSet<String>();
		for (XmlNode.Element property : inner) {
			tags.add(property.getTag());
		}
		for (XmlNode.Element property : outer) {
			if (tags.add(property.getTag())) {
				merged.add(property);
			}
		}
		return merged;
	}

	/**
	 * Maps a width in em to the closest Unicode space.
	 */
	static String spaceCharacter(double width) {
		if (width > 0 && width <= 0.17) {
			return "\u2009";
		} else if (width > 0.17 && width <= 0.23) {
			return "\u2005";
		} else if (width > 0.23 && width <= 0.5) {
			return "\u2004";
		} else if (width > 0.5 && width <= 1.8) {
			return "\u2001";
		} else if (width > 1.8) {
			return "\u2001\u2001";
		}
		return ZERO_WIDTH_SPACE;
	}

	private static boolean isSymbolOfType(Exp exp, SymbolType type) {
		return exp instanceof Exp.Symbol && ((Exp.Symbol) exp).getType() == type;
	}

	private static boolean isBarCharacter(Exp exp) {
		return BAR_CHARACTERS.contains(((Exp.Symbol) exp).getValue());
	}

	/**
	 * Emits the nodes of one expression. The run properties in effect are
	 * fixed for an emitter; styled runs emit their content with a new one.
	 */
	private static final class Emitter implements ExpVisitor<List<XmlNode>> {

		private final List<XmlNode.Element> props;

		private Emitter(List<XmlNode.Element> props) {
			this.props = props;
		}

		private List<XmlNode> show(Exp exp) {
			return exp.accept(this);
		}

		private List<XmlNode> all(List<Exp> exps) {
			List<XmlNode> nodes = new ArrayList<XmlNode>();
			for (Exp exp : exps) {
				nodes.addAll(show(exp));
			}
			return nodes;
		}

		private List<XmlNode.Element> propsOrDefault() {
			return props.isEmpty() ? styleProperties(TextType.NORMAL) : props;
		}

		private List<XmlNode> single(XmlNode node) {
			return Collections.singletonList(node);
		}

		private List<XmlNode> text(String value) {
			return single(run(props, value));
		}

		@Override
		public List<XmlNode> visitNumber(Exp.Number exp) {
			return text(exp.getValue());
		}

		@Override
		public List<XmlNode> visitIdentifier(Exp.Identifier exp) {
			if (exp.getValue().isEmpty()) {
				return text(ZERO_WIDTH_SPACE);
			}
			if (props.isEmpty() && UPPERCASE_GREEK.contains(exp.getValue())) {
				return single(run(styleProperties(TextType.NORMAL), exp.getValue()));
			}
			return text(exp.getValue());
		}

		@Override
		public List<XmlNode> visitSymbol(Exp.Symbol exp) {
			String value = exp.getValue();
			if (value.length() == 1 && SYMBOL_OR_PUNCTUATION.matcher(value).matches()) {
				return single(run(propsOrDefault(), value));
			}
			SymbolType type = exp.getType();
			if (type == SymbolType.OP || type == SymbolType.BIN || type == SymbolType.REL) {
				return single(
						node(
								"box",
								node("boxPr", val("opEmu", "on")),
								node("e", run(propsOrDefault(), value))));
			}
			return single(run(propsOrDefault(), value));
		}

		@Override
		public List<XmlNode> visitText(Exp.Text exp) {
			List<XmlNode.Element> textProps = new ArrayList<XmlNode.Element>();
			textProps.add(node("nor"));
			textProps.addAll(styleProperties(exp.getTextType()));
			return single(run(textProps, exp.getValue()));
		}

		@Override
		public List<XmlNode> visitSpace(Exp.Space exp) {
			return text(spaceCharacter(exp.getWidth()));
		}

		/**
		 * Operator names are upright unless an enclosing style sets {@code m:sty}.
		 */
		@Override
		public List<XmlNode> visitMathOperator(Exp.MathOperator exp) {
			return single(run(mergeProperties(props, styleProperties(TextType.NORMAL)), exp.getValue()));
		}

		@Override
		public List<XmlNode> visitGrouped(Exp.Grouped exp) {
			List<Exp> value = exp.getValue();
			if (value.isEmpty()) {
				return text(ZERO_WIDTH_SPACE);
			}
			if (value.size() == 2) {
				Exp first = value.get(0);
				Exp operand = value.get(1);
				if (first instanceof Exp.UnderOver && LimitsRewriter.isNary(((Exp.UnderOver) first).getBase())) {
					Exp.UnderOver limits = (Exp.UnderOver) first;
					return single(nary("undOvr", limits.getBase(), limits.getUnder(), limits.getOver(), operand));
				}
				if (first instanceof Exp.Subsup && LimitsRewriter.isNary(((Exp.Subsup) first).getBase())) {
					Exp.Subsup limits = (Exp.Subsup) first;
					return single(nary("subSup", limits.getBase(), limits.getSub(), limits.getSup(), operand));
				}
			}
			return all(value);
		}

		private XmlNode nary(String limitLocation, Exp operator, Exp sub, Exp sup, Exp operand) {
			return node(
					"nary",
					node(
							"naryPr",
							val("chr", ((Exp.Symbol) operator).getValue()),
							val("limLoc", limitLocation),
							val("subHide", Exp.isEmptyGroup(sub) ? "on" : "off"),
							val("supHide", Exp.isEmptyGroup(sup) ? "on" : "off")),
					node("sub", show(sub)),
					node("sup", show(sup)),
					node("e", show(operand)));
		}

		@Override
		public List<XmlNode> visitSqrt(Exp.Sqrt exp) {
			return single(node("rad", node("radPr", val("degHide", "on")), node("deg"), node("e", show(exp.getValue()))));
		}

		@Override
		public List<XmlNode> visitRoot(Exp.Root exp) {
			return single(node("rad", node("deg", show(exp.getIndex())), node("e", show(exp.getBase()))));
		}

		@Override
		public List<XmlNode> visitPhantom(Exp.Phantom exp) {
			return single(node("phant", node("phantPr", val("show", "off")), node("e", show(exp.getValue()))));
		}

		@Override
		public List<XmlNode> visitBoxed(Exp.Boxed exp) {
			return single(node("borderBox", node("e", show(exp.getValue()))));
		}

		@Override
		public List<XmlNode> visitCancel(Exp.Cancel exp) {
			List<XmlNode> borderProps = new ArrayList<XmlNode>();
			borderProps.add(val("hideTop", "1"));
			borderProps.add(val("hideBot", "1"));
			borderProps.add(val("hideLeft", "1"));
			borderProps.add(val("hideRight", "1"));
			StrokeType stroke = exp.getStrokeType();
			if (stroke == StrokeType.FORWARD_SLASH || stroke == StrokeType.X_SLASH) {
				borderProps.add(val("strikeBLTR", "1"));
			}
			if (stroke == StrokeType.BACK_SLASH || stroke == StrokeType.X_SLASH) {
				borderProps.add(val("strikeTLBR", "1"));
			}
			return single(node("borderBox", node("borderBoxPr", borderProps), node("e", show(exp.getValue()))));
		}

		@Override
		public List<XmlNode> visitScaled(Exp.Scaled exp) {
			LOGGER.debug("No OMML scaling construct, rendering scale {} unscaled", exp.getScale());
			return show(exp.getValue());
		}

		@Override
		public List<XmlNode> visitSub(Exp.Sub exp) {
			return single(node("sSub", node("e", show(exp.getBase())), node("sub", show(exp.getSub()))));
		}

		@Override
		public List<XmlNode> visitSuper(Exp.Super exp) {
			return single(node("sSup", node("e", show(exp.getBase())), node("sup", show(exp.getSup()))));
		}

		@Override
		public List<XmlNode> visitSubsup(Exp.Subsup exp) {
			return single(
					node(
							"sSubSup",
							node("e", show(exp.getBase())),
							node("sub", show(exp.getSub())),
							node("sup", show(exp.getSup()))));
		}

		@Override
		public List<XmlNode> visitFraction(Exp.Fraction exp) {
			String type;
			if (exp.getFractionType() == FractionType.INLINE) {
				type = "lin";
			} else if (exp.getFractionType() == FractionType.NO_LINE) {
				type = "noBar";
			} else {
				type = "bar";
			}
			return single(
					node(
							"f",
							node("fPr", val("type", type)),
							node("num", show(exp.getNumerator())),
							node("den", show(exp.getDenominator()))));
		}

		@Override
		public List<XmlNode> visitOver(Exp.Over exp) {
			Exp over = exp.getOver();
			if (isSymbolOfType(over, SymbolType.T_OVER) && isBarCharacter(over)) {
				return single(node("bar", node("barPr", val("pos", "top")), node("e", show(exp.getBase()))));
			}
			if (isSymbolOfType(over, SymbolType.ACCENT)) {
				return single(
						node("acc", node("accPr", val("chr", ((Exp.Symbol) over).getValue())), node("e", show(exp.getBase()))));
			}
			if (isSymbolOfType(over, SymbolType.T_OVER)) {
				return single(
						node(
								"groupChr",
								node("groupChrPr", val("chr", ((Exp.Symbol) over).getValue()), val("pos", "top"), val("vertJc", "bot")),
								node("e", show(exp.getBase()))));
			}
			return single(node("limUpp", node("e", show(exp.getBase())), node("lim", show(over))));
		}

		@Override
		public List<XmlNode> visitUnder(Exp.Under exp) {
			Exp under = exp.getUnder();
			if (isSymbolOfType(under, SymbolType.T_UNDER) && isBarCharacter(under)) {
				return single(node("bar", node("barPr", val("pos", "bot")), node("e", show(exp.getBase()))));
			}
			if (isSymbolOfType(under, SymbolType.T_UNDER)) {
				return single(
						node(
								"groupChr",
								node("groupChrPr", val("chr", ((Exp.Symbol) under).getValue()), val("pos", "bot"), val("vertJc", "top")),
								node("e", show(exp.getBase()))));
			}
			return single(node("limLow", node("e", show(exp.getBase())), node("lim", show(under))));
		}

		@Override
		public List<XmlNode> visitUnderOver(Exp.UnderOver exp) {
			Exp under = new Exp.Under(exp.isConvertible(), exp.getBase(), exp.getUnder());
			return show(new Exp.Over(exp.isConvertible(), under, exp.getOver()));
		}

		@Override
		public List<XmlNode> visitDelimited(Exp.Delimited exp) {
			String separator = "";
			List<List<Exp>> groups = new ArrayList<List<Exp>>();
			List<Exp> current = new ArrayList<Exp>();
			for (InDelimited item : exp.getContent()) {
				if (item.isSeparator()) {
					if (separator.isEmpty()) {
						separator = item.getSeparator();
					}
					if (!current.isEmpty()) {
						groups.add(current);
						current = new ArrayList<Exp>();
					}
				} else {
					current.add(item.getExp());
				}
			}
			if (!current.isEmpty()) {
				groups.add(current);
			}

			List<XmlNode> children = new ArrayList<XmlNode>();
			children
					.add(
							node(
									"dPr",
									val("begChr", exp.getOpen()),
									val("sepChr", separator),
									val("endChr", exp.getClose()),
									node("grow")));
			if (groups.isEmpty()) {
				children.add(node("e"));
			}
			for (List<Exp> group : groups) {
				children.add(node("e", all(group)));
			}
			return single(node("d", children));
		}

		@Override
		public List<XmlNode> visitArray(Exp.Array exp) {
			List<XmlNode> columns = new ArrayList<XmlNode>();
			for (Alignment alignment : exp.getAlignments()) {
				columns.add(node("mc", node("mcPr", val("mcJc", alignmentName(alignment)), val("count", "1"))));
			}
			List<XmlNode> children = new ArrayList<XmlNode>();
			children.add(node("mPr", val("baseJc", "center"), val("plcHide", "on"), node("mcs", columns)));
			for (List<List<Exp>> row : exp.getRows()) {
				List<XmlNode> cells = new ArrayList<XmlNode>();
				for (List<Exp> cell : row) {
					cells.add(node("e", all(cell)));
				}
				children.add(node("mr", cells));
			}
			return single(node("m", children));
		}

		private String alignmentName(Alignment alignment) {
			switch (alignment) {
			case LEFT:
				return "left";
			case RIGHT:
				return "right";
			case CENTER:
			default:
				return "center";
			}
		}

		@Override
		public List<XmlNode> visitStyled(Exp.Styled exp) {
			return new Emitter(mergeProperties(styleProperties(exp.getTextType()), props)).all(exp.getValue());
		}
	}
}
