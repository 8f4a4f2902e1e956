package org.metricshub.texomml.frontend;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.SymbolType;
import org.metricshub.texomml.frontend.ast.TextType;

/**
 * Static lookup tables from TeX tokens to syntax tree leaves.
 * <p>
 * The tables are filled once, at class initialization, and never modified
 * afterwards, so they can be shared by any number of concurrent parsers.
 * <p>
 * Keys of the command tables include the leading backslash.
 */
public final class TexSymbols {

	/**
	 * Commands that stand for a symbol, an identifier, a named operator
	 * or a fixed space.
	 */
	private static final Map<String, Exp> SYMBOLS = new HashMap<String, Exp>();

	/**
	 * Single characters (and runs of primes) that stand for an operator.
	 */
	private static final Map<String, Exp> OPERATORS = new HashMap<String, Exp>();

	/**
	 * Delimiters, as characters or as commands.
	 */
	private static final Map<String, Exp.Symbol> ENCLOSURES = new HashMap<String, Exp.Symbol>();

	/**
	 * Commands whose argument is raw text.
	 */
	private static final Map<String, Function<String, Exp>> TEXT_OPS = new HashMap<String, Function<String, Exp>>();

	/**
	 * Commands whose argument is math rendered with a font variant.
	 */
	private static final Map<String, Function<List<Exp>, Exp>> STYLE_OPS = new HashMap<String, Function<List<Exp>, Exp>>();

	/**
	 * Named operators whose sub- and superscripts are placed under and over
	 * them in display mode.
	 */
	private static final Set<String> LIMITS_OPERATORS = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"lim",
											"liminf",
											"limsup",
											"max",
											"min",
											"sup",
											"inf",
											"det",
											"gcd",
											"Pr",
											"argmax",
											"argmin")));

	/** Scale factors of the {@code \big} family */
	private static final Map<String, Double> SCALES = new HashMap<String, Double>();

	static {
		// lower-case Greek
		identifier("\\alpha", "α");
		identifier("\\beta", "β");
		identifier("\\gamma", "γ");
		identifier("\\delta", "δ");
		identifier("\\epsilon", "ϵ");
		identifier("\\varepsilon", "ε");
		identifier("\\zeta", "ζ");
		identifier("\\eta", "η");
		identifier("\\theta", "θ");
		identifier("\\vartheta", "ϑ");
		identifier("\\iota", "ι");
		identifier("\\kappa", "κ");
		identifier("\\lambda", "λ");
		identifier("\\mu", "μ");
		identifier("\\nu", "ν");
		identifier("\\xi", "ξ");
		identifier("\\pi", "π");
		identifier("\\varpi", "ϖ");
		identifier("\\rho", "ρ");
		identifier("\\varrho", "ϱ");
		identifier("\\sigma", "σ");
		identifier("\\varsigma", "ς");
		identifier("\\tau", "τ");
		identifier("\\upsilon", "υ");
		identifier("\\phi", "ϕ");
		identifier("\\varphi", "φ");
		identifier("\\chi", "χ");
		identifier("\\psi", "ψ");
		identifier("\\omega", "ω");

		// upper-case Greek
		identifier("\\Gamma", "Γ");
		identifier("\\Delta", "Δ");
		identifier("\\Theta", "Θ");
		identifier("\\Lambda", "Λ");
		identifier("\\Xi", "Ξ");
		identifier("\\Pi", "Π");
		identifier("\\Sigma", "Σ");
		identifier("\\Upsilon", "Υ");
		identifier("\\Phi", "Φ");
		identifier("\\Psi", "Ψ");
		identifier("\\Omega", "Ω");

		// large operators
		symbol("\\sum", SymbolType.OP, "∑");
		symbol("\\prod", SymbolType.OP, "∏");
		symbol("\\coprod", SymbolType.OP, "∐");
		symbol("\\int", SymbolType.OP, "∫");
		symbol("\\iint", SymbolType.OP, "∬");
		symbol("\\iiint", SymbolType.OP, "∭");
		symbol("\\oint", SymbolType.OP, "∮");
		symbol("\\oiint", SymbolType.OP, "∯");
		symbol("\\oiiint", SymbolType.OP, "∰");
		symbol("\\bigcup", SymbolType.OP, "⋃");
		symbol("\\bigcap", SymbolType.OP, "⋂");
		symbol("\\bigvee", SymbolType.OP, "⋁");
		symbol("\\bigwedge", SymbolType.OP, "⋀");
		symbol("\\bigoplus", SymbolType.OP, "⨁");
		symbol("\\bigotimes", SymbolType.OP, "⨂");
		symbol("\\bigodot", SymbolType.OP, "⨀");
		symbol("\\biguplus", SymbolType.OP, "⨄");
		symbol("\\bigsqcup", SymbolType.OP, "⨆");

		// binary operators
		symbol("\\pm", SymbolType.BIN, "±");
		symbol("\\mp", SymbolType.BIN, "∓");
		symbol("\\times", SymbolType.BIN, "×");
		symbol("\\div", SymbolType.BIN, "÷");
		symbol("\\cdot", SymbolType.BIN, "⋅");
		symbol("\\ast", SymbolType.BIN, "∗");
		symbol("\\star", SymbolType.BIN, "⋆");
		symbol("\\circ", SymbolType.BIN, "∘");
		symbol("\\bullet", SymbolType.BIN, "∙");
		symbol("\\cap", SymbolType.BIN, "∩");
		symbol("\\cup", SymbolType.BIN, "∪");
		symbol("\\uplus", SymbolType.BIN, "⊎");
		symbol("\\sqcap", SymbolType.BIN, "⊓");
		symbol("\\sqcup", SymbolType.BIN, "⊔");
		symbol("\\vee", SymbolType.BIN, "∨");
		symbol("\\lor", SymbolType.BIN, "∨");
		symbol("\\wedge", SymbolType.BIN, "∧");
		symbol("\\land", SymbolType.BIN, "∧");
		symbol("\\setminus", SymbolType.BIN, "∖");
		symbol("\\oplus", SymbolType.BIN, "⊕");
		symbol("\\ominus", SymbolType.BIN, "⊖");
		symbol("\\otimes", SymbolType.BIN, "⊗");
		symbol("\\oslash", SymbolType.BIN, "⊘");
		symbol("\\odot", SymbolType.BIN, "⊙");
		symbol("\\dagger", SymbolType.BIN, "†");
		symbol("\\ddagger", SymbolType.BIN, "‡");
		symbol("\\amalg", SymbolType.BIN, "⨿");
		symbol("\\wr", SymbolType.BIN, "≀");

		// relations
		symbol("\\leq", SymbolType.REL, "≤");
		symbol("\\le", SymbolType.REL, "≤");
		symbol("\\geq", SymbolType.REL, "≥");
		symbol("\\ge", SymbolType.REL, "≥");
		symbol("\\neq", SymbolType.REL, "≠");
		symbol("\\ne", SymbolType.REL, "≠");
		symbol("\\equiv", SymbolType.REL, "≡");
		symbol("\\approx", SymbolType.REL, "≈");
		symbol("\\cong", SymbolType.REL, "≅");
		symbol("\\simeq", SymbolType.REL, "≃");
		symbol("\\sim", SymbolType.REL, "∼");
		symbol("\\propto", SymbolType.REL, "∝");
		symbol("\\ll", SymbolType.REL, "≪");
		symbol("\\gg", SymbolType.REL, "≫");
		symbol("\\prec", SymbolType.REL, "≺");
		symbol("\\succ", SymbolType.REL, "≻");
		symbol("\\preceq", SymbolType.REL, "⪯");
		symbol("\\succeq", SymbolType.REL, "⪰");
		symbol("\\subset", SymbolType.REL, "⊂");
		symbol("\\supset", SymbolType.REL, "⊃");
		symbol("\\subseteq", SymbolType.REL, "⊆");
		symbol("\\supseteq", SymbolType.REL, "⊇");
		symbol("\\sqsubseteq", SymbolType.REL, "⊑");
		symbol("\\sqsupseteq", SymbolType.REL, "⊒");
		symbol("\\in", SymbolType.REL, "∈");
		symbol("\\ni", SymbolType.REL, "∋");
		symbol("\\notin", SymbolType.REL, "∉");
		symbol("\\parallel", SymbolType.REL, "∥");
		symbol("\\perp", SymbolType.REL, "⊥");
		symbol("\\mid", SymbolType.REL, "∣");
		symbol("\\vdash", SymbolType.REL, "⊢");
		symbol("\\dashv", SymbolType.REL, "⊣");
		symbol("\\models", SymbolType.REL, "⊨");
		symbol("\\asymp", SymbolType.REL, "≍");
		symbol("\\doteq", SymbolType.REL, "≐");
		symbol("\\coloneqq", SymbolType.REL, "≔");

		// arrows
		symbol("\\to", SymbolType.REL, "→");
		symbol("\\rightarrow", SymbolType.REL, "→");
		symbol("\\leftarrow", SymbolType.REL, "←");
		symbol("\\gets", SymbolType.REL, "←");
		symbol("\\leftrightarrow", SymbolType.REL, "↔");
		symbol("\\Rightarrow", SymbolType.REL, "⇒");
		symbol("\\Leftarrow", SymbolType.REL, "⇐");
		symbol("\\Leftrightarrow", SymbolType.REL, "⇔");
		symbol("\\implies", SymbolType.REL, "⟹");
		symbol("\\impliedby", SymbolType.REL, "⟸");
		symbol("\\iff", SymbolType.REL, "⟺");
		symbol("\\mapsto", SymbolType.REL, "↦");
		symbol("\\longrightarrow", SymbolType.REL, "⟶");
		symbol("\\longleftarrow", SymbolType.REL, "⟵");
		symbol("\\longmapsto", SymbolType.REL, "⟼");
		symbol("\\uparrow", SymbolType.REL, "↑");
		symbol("\\downarrow", SymbolType.REL, "↓");
		symbol("\\updownarrow", SymbolType.REL, "↕");
		symbol("\\Uparrow", SymbolType.REL, "⇑");
		symbol("\\Downarrow", SymbolType.REL, "⇓");
		symbol("\\nearrow", SymbolType.REL, "↗");
		symbol("\\searrow", SymbolType.REL, "↘");
		symbol("\\hookrightarrow", SymbolType.REL, "↪");
		symbol("\\hookleftarrow", SymbolType.REL, "↩");

		// ordinary symbols
		symbol("\\infty", SymbolType.ORD, "∞");
		symbol("\\partial", SymbolType.ORD, "∂");
		symbol("\\nabla", SymbolType.ORD, "∇");
		symbol("\\forall", SymbolType.ORD, "∀");
		symbol("\\exists", SymbolType.ORD, "∃");
		symbol("\\nexists", SymbolType.ORD, "∄");
		symbol("\\emptyset", SymbolType.ORD, "∅");
		symbol("\\varnothing", SymbolType.ORD, "∅");
		symbol("\\neg", SymbolType.ORD, "¬");
		symbol("\\lnot", SymbolType.ORD, "¬");
		symbol("\\angle", SymbolType.ORD, "∠");
		symbol("\\triangle", SymbolType.ORD, "△");
		symbol("\\hbar", SymbolType.ORD, "ℏ");
		symbol("\\ell", SymbolType.ORD, "ℓ");
		symbol("\\Re", SymbolType.ORD, "ℜ");
		symbol("\\Im", SymbolType.ORD, "ℑ");
		symbol("\\aleph", SymbolType.ORD, "ℵ");
		symbol("\\wp", SymbolType.ORD, "℘");
		symbol("\\prime", SymbolType.ORD, "′");
		symbol("\\top", SymbolType.ORD, "⊤");
		symbol("\\bot", SymbolType.ORD, "⊥");
		symbol("\\therefore", SymbolType.ORD, "∴");
		symbol("\\because", SymbolType.ORD, "∵");
		symbol("\\degree", SymbolType.ORD, "°");
		symbol("\\dots", SymbolType.ORD, "…");
		symbol("\\ldots", SymbolType.ORD, "…");
		symbol("\\cdots", SymbolType.ORD, "⋯");
		symbol("\\vdots", SymbolType.ORD, "⋮");
		symbol("\\ddots", SymbolType.ORD, "⋱");
		symbol("\\colon", SymbolType.PUN, ":");
		symbol("\\%", SymbolType.ORD, "%");
		symbol("\\$", SymbolType.ORD, "$");
		symbol("\\#", SymbolType.ORD, "#");
		symbol("\\&", SymbolType.ORD, "&");
		symbol("\\_", SymbolType.ORD, "_");

		// accents
		symbol("\\hat", SymbolType.ACCENT, "^");
		symbol("\\widehat", SymbolType.ACCENT, "̂");
		symbol("\\tilde", SymbolType.ACCENT, "~");
		symbol("\\widetilde", SymbolType.ACCENT, "̃");
		symbol("\\bar", SymbolType.ACCENT, "‾");
		symbol("\\vec", SymbolType.ACCENT, "⃗");
		symbol("\\dot", SymbolType.ACCENT, "˙");
		symbol("\\ddot", SymbolType.ACCENT, "¨");
		symbol("\\acute", SymbolType.ACCENT, "´");
		symbol("\\grave", SymbolType.ACCENT, "`");
		symbol("\\breve", SymbolType.ACCENT, "˘");
		symbol("\\check", SymbolType.ACCENT, "ˇ");
		symbol("\\mathring", SymbolType.ACCENT, "˚");
		symbol("\\overrightarrow", SymbolType.ACCENT, "⃗");
		symbol("\\overleftarrow", SymbolType.ACCENT, "⃖");

		// over and under bars and braces
		symbol("\\overline", SymbolType.T_OVER, "¯");
		symbol("\\underline", SymbolType.T_UNDER, "_");
		symbol("\\overbrace", SymbolType.T_OVER, "⏞");
		symbol("\\underbrace", SymbolType.T_UNDER, "⏟");
		symbol("\\overbracket", SymbolType.T_OVER, "⎴");
		symbol("\\underbracket", SymbolType.T_UNDER, "⎵");
		symbol("\\overparen", SymbolType.T_OVER, "⏜");
		symbol("\\underparen", SymbolType.T_UNDER, "⏝");

		// named operators
		for (String name : Arrays
				.asList(
						"arccos",
						"arcsin",
						"arctan",
						"arg",
						"cos",
						"cosh",
						"cot",
						"coth",
						"csc",
						"deg",
						"det",
						"dim",
						"exp",
						"gcd",
						"hom",
						"inf",
						"ker",
						"lg",
						"lim",
						"liminf",
						"limsup",
						"ln",
						"log",
						"max",
						"min",
						"Pr",
						"sec",
						"sin",
						"sinh",
						"sup",
						"tan",
						"tanh")) {
			SYMBOLS.put("\\" + name, new Exp.MathOperator(name));
		}

		// fixed spaces
		SYMBOLS.put("\\,", new Exp.Space(0.167));
		SYMBOLS.put("\\thinspace", new Exp.Space(0.167));
		SYMBOLS.put("\\:", new Exp.Space(0.222));
		SYMBOLS.put("\\>", new Exp.Space(0.222));
		SYMBOLS.put("\\medspace", new Exp.Space(0.222));
		SYMBOLS.put("\\;", new Exp.Space(0.278));
		SYMBOLS.put("\\thickspace", new Exp.Space(0.278));
		SYMBOLS.put("\\!", new Exp.Space(-0.167));
		SYMBOLS.put("\\ ", new Exp.Space(0.333));
		SYMBOLS.put("\\enspace", new Exp.Space(0.5));
		SYMBOLS.put("\\quad", new Exp.Space(1.0));
		SYMBOLS.put("\\qquad", new Exp.Space(2.0));
	}

	static {
		operator("+", SymbolType.BIN, "+");
		operator("-", SymbolType.BIN, "−");
		operator("*", SymbolType.BIN, "∗");
		operator("=", SymbolType.REL, "=");
		operator("<", SymbolType.REL, "<");
		operator(">", SymbolType.REL, ">");
		operator(":", SymbolType.REL, ":");
		operator(",", SymbolType.PUN, ",");
		operator(";", SymbolType.PUN, ";");
		operator("!", SymbolType.ORD, "!");
		operator("?", SymbolType.ORD, "?");
		operator("/", SymbolType.ORD, "/");
		operator(".", SymbolType.ORD, ".");
		operator("@", SymbolType.ORD, "@");
		operator("~", SymbolType.ORD, " ");
		operator("'", SymbolType.PUN, "′");
		operator("''", SymbolType.PUN, "″");
		operator("'''", SymbolType.PUN, "‴");
		operator("''''", SymbolType.PUN, "⁗");
	}

	static {
		enclosure("(", SymbolType.OPEN, "(");
		enclosure(")", SymbolType.CLOSE, ")");
		enclosure("[", SymbolType.OPEN, "[");
		enclosure("]", SymbolType.CLOSE, "]");
		enclosure("|", SymbolType.FENCE, "|");
		enclosure("\\{", SymbolType.OPEN, "{");
		enclosure("\\}", SymbolType.CLOSE, "}");
		enclosure("\\lbrace", SymbolType.OPEN, "{");
		enclosure("\\rbrace", SymbolType.CLOSE, "}");
		enclosure("\\lbrack", SymbolType.OPEN, "[");
		enclosure("\\rbrack", SymbolType.CLOSE, "]");
		enclosure("\\langle", SymbolType.OPEN, "⟨");
		enclosure("\\rangle", SymbolType.CLOSE, "⟩");
		enclosure("\\lfloor", SymbolType.OPEN, "⌊");
		enclosure("\\rfloor", SymbolType.CLOSE, "⌋");
		enclosure("\\lceil", SymbolType.OPEN, "⌈");
		enclosure("\\rceil", SymbolType.CLOSE, "⌉");
		enclosure("\\lvert", SymbolType.OPEN, "|");
		enclosure("\\rvert", SymbolType.CLOSE, "|");
		enclosure("\\lVert", SymbolType.OPEN, "∥");
		enclosure("\\rVert", SymbolType.CLOSE, "∥");
		enclosure("\\vert", SymbolType.FENCE, "|");
		enclosure("\\|", SymbolType.FENCE, "∥");
		enclosure("\\Vert", SymbolType.FENCE, "∥");
	}

	static {
		textOperator("\\text", TextType.NORMAL);
		textOperator("\\textrm", TextType.NORMAL);
		textOperator("\\textnormal", TextType.NORMAL);
		textOperator("\\textup", TextType.NORMAL);
		textOperator("\\mbox", TextType.NORMAL);
		textOperator("\\textbf", TextType.BOLD);
		textOperator("\\textit", TextType.ITALIC);
		textOperator("\\emph", TextType.ITALIC);
		textOperator("\\texttt", TextType.MONOSPACE);
		textOperator("\\textsf", TextType.SANS_SERIF);

		styleOperator("\\mathrm", TextType.NORMAL);
		styleOperator("\\mathup", TextType.NORMAL);
		styleOperator("\\mathbf", TextType.BOLD);
		styleOperator("\\mathit", TextType.ITALIC);
		styleOperator("\\mathsf", TextType.SANS_SERIF);
		styleOperator("\\mathtt", TextType.MONOSPACE);
		styleOperator("\\mathbb", TextType.DOUBLE_STRUCK);
		styleOperator("\\mathcal", TextType.SCRIPT);
		styleOperator("\\mathscr", TextType.SCRIPT);
		styleOperator("\\mathfrak", TextType.FRAKTUR);
		styleOperator("\\boldsymbol", TextType.BOLD_ITALIC);
		styleOperator("\\bm", TextType.BOLD_ITALIC);
		styleOperator("\\mathbfit", TextType.BOLD_ITALIC);
		styleOperator("\\mathbfsf", TextType.SANS_SERIF_BOLD);
		styleOperator("\\mathsfit", TextType.SANS_SERIF_ITALIC);
		styleOperator("\\mathbfsfit", TextType.SANS_SERIF_BOLD_ITALIC);
		styleOperator("\\mathbfcal", TextType.BOLD_SCRIPT);
		styleOperator("\\mathbffrak", TextType.BOLD_FRAKTUR);
	}

	static {
		for (String suffix : Arrays.asList("", "l", "r", "m")) {
			SCALES.put("\\big" + suffix, 1.2);
			SCALES.put("\\Big" + suffix, 1.6);
			SCALES.put("\\bigg" + suffix, 2.1);
			SCALES.put("\\Bigg" + suffix, 2.6);
		}
	}

	private TexSymbols() {
		// static tables only
	}

	private static void identifier(String command, String value) {
		SYMBOLS.put(command, new Exp.Identifier(value));
	}

	private static void symbol(String command, SymbolType type, String value) {
		SYMBOLS.put(command, new Exp.Symbol(type, value));
	}

	private static void operator(String token, SymbolType type, String value) {
		OPERATORS.put(token, new Exp.Symbol(type, value));
	}

	private static void enclosure(String token, SymbolType type, String value) {
		ENCLOSURES.put(token, new Exp.Symbol(type, value));
	}

	private static void textOperator(String command, TextType textType) {
		TEXT_OPS.put(command, text -> new Exp.Text(textType, text));
	}

	private static void styleOperator(String command, TextType textType) {
		STYLE_OPS.put(command, exps -> new Exp.Styled(textType, exps));
	}

	/**
	 * @param command backslash command, such as {@code \alpha}
	 * @return the leaf for the command, or {@code null} if unknown
	 */
	public static Exp symbol(String command) {
		return SYMBOLS.get(command);
	}

	/**
	 * @param token single operator character, or a run of one to four primes
	 * @return the operator symbol, or {@code null} if unknown
	 */
	public static Exp operator(String token) {
		return OPERATORS.get(token);
	}

	/**
	 * @param token delimiter character or command
	 * @return the delimiter symbol, or {@code null} if unknown
	 */
	public static Exp.Symbol enclosure(String token) {
		return ENCLOSURES.get(token);
	}

	/**
	 * @param command text command, such as {@code \text}
	 * @return the constructor turning raw text into a node, or {@code null} if unknown
	 */
	public static Function<String, Exp> textOperator(String command) {
		return TEXT_OPS.get(command);
	}

	/**
	 * @param command style command, such as {@code \mathbf}
	 * @return the constructor turning a sequence into a styled node, or {@code null} if unknown
	 */
	public static Function<List<Exp>, Exp> styleOperator(String command) {
		return STYLE_OPS.get(command);
	}

	/**
	 * @param command one of {@code \big}, {@code \Bigl}, ...
	 * @return the scale factor, or {@code null} if the command is not a sizing command
	 */
	public static Double scale(String command) {
		return SCALES.get(command);
	}

	/**
	 * @param name operator name without backslash
	 * @return whether scripts attached to the operator are limits
	 */
	public static boolean isLimitsOperator(String name) {
		return LIMITS_OPERATORS.contains(name);
	}
}
