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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.texomml.frontend.ast.Alignment;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.FractionType;
import org.metricshub.texomml.frontend.ast.InDelimited;
import org.metricshub.texomml.frontend.ast.StrokeType;
import org.metricshub.texomml.frontend.ast.SymbolType;
import org.metricshub.texomml.frontend.ast.UnbalancedGroupException;
import org.metricshub.texomml.util.TexOmmlLogger;
import org.slf4j.Logger;

/**
 * Converts TeX math notation into a sequence of {@link Exp} nodes.
 * <p>
 * This is a recursive descent parser working directly on the characters of
 * the source: every {@code parseXxx()} method either consumes the construct
 * it is named after and returns its node, or returns {@code null} when the
 * construct is not found at the current position. Whitespace and
 * {@code %} comments are skipped between tokens.
 * <p>
 * Parsing never fails on unknown notation: an unrecognized command or
 * character ends the current sequence and what was parsed so far is
 * returned. The only hard failure is a missing closing brace or bracket,
 * reported with an {@link UnbalancedGroupException}.
 * <p>
 * An instance holds the state of one parse and is not thread-safe.
 */
public class TexParser {

	private static final Logger LOGGER = TexOmmlLogger.getLogger(TexParser.class);

	/** Characters accepted as delimiters after {@code \left}, {@code \right} and {@code \big} */
	private static final String DELIMITER_CHARS = "()[]|";

	/** Prime runs, longest first */
	private static final String[] PRIMES = { "''''", "'''", "''", "'" };

	private static final Pattern DIMENSION = Pattern.compile("(-?(?:\\d+\\.?\\d*|\\.\\d+))\\s*([a-zA-Z]{2})?");

	private String input = "";
	private int pos;

	/**
	 * The last node built by {@code \operatorname*}, whose scripts are limits.
	 */
	private Exp starredOperator;

	/**
	 * Parses TeX math notation.
	 *
	 * @param text the notation, without {@code $} delimiters
	 * @return the top-level expressions, possibly fewer than the text
	 *         contains when an unrecognized construct was met
	 * @throws UnbalancedGroupException when a closing brace or bracket is missing
	 */
	public List<Exp> parse(String text) {
		this.input = text == null ? "" : text;
		this.pos = 0;
		this.starredOperator = null;

		skipIgnorable();
		List<Exp> exps = new ArrayList<Exp>();
		while (!isEOF()) {
			Exp exp = parseExpr();
			if (exp == null) {
				LOGGER.debug("Stopped parsing at position {}: {}", pos, TexOmmlLogger.excerpt(input, pos));
				break;
			}
			exps.add(exp);
			skipIgnorable();
		}
		return fixBinList(exps);
	}

	/**
	 * Reclassifies binary operators that have no left operand as ordinary
	 * symbols. Only the top-level sequence is processed.
	 */
	static List<Exp> fixBinList(List<Exp> exps) {
		List<Exp> result = new ArrayList<Exp>(exps.size());
		for (Exp exp : exps) {
			Exp.Symbol previous = result.isEmpty() ? null : asSymbol(result.get(result.size() - 1));
			Exp.Symbol symbol = asSymbol(exp);
			if (symbol != null && symbol.getType() == SymbolType.BIN) {
				if (result.isEmpty()) {
					result.add(symbol.withType(SymbolType.ORD));
				} else if (previous != null && isOneOf(previous, SymbolType.BIN, SymbolType.OP, SymbolType.REL, SymbolType.OPEN, SymbolType.PUN)) {
					result.add(symbol.withType(SymbolType.ORD));
				} else {
					result.add(exp);
				}
			} else if (symbol != null && isOneOf(symbol, SymbolType.REL, SymbolType.CLOSE, SymbolType.PUN)) {
				if (previous != null && previous.getType() == SymbolType.BIN) {
					result.set(result.size() - 1, previous.withType(SymbolType.ORD));
				}
				result.add(exp);
			} else {
				result.add(exp);
			}
		}
		return result;
	}

	private static Exp.Symbol asSymbol(Exp exp) {
		return exp instanceof Exp.Symbol ? (Exp.Symbol) exp : null;
	}

	private static boolean isOneOf(Exp.Symbol symbol, SymbolType... types) {
		for (SymbolType type : types) {
			if (symbol.getType() == type) {
				return true;
			}
		}
		return false;
	}

	// Cursor

	private boolean isEOF() {
		return pos >= input.length();
	}

	/**
	 * @return the current character, or -1 at the end of the input
	 */
	private int peek() {
		return isEOF() ? -1 : input.charAt(pos);
	}

	private void advance() {
		pos++;
	}

	private boolean match(String token) {
		if (input.startsWith(token, pos)) {
			pos += token.length();
			return true;
		}
		return false;
	}

	private static boolean isAsciiLetter(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * Skip all whitespaces and comments
	 */
	private void skipIgnorable() {
		while (!isEOF()) {
			int c = peek();
			if (Character.isWhitespace(c)) {
				advance();
			} else if (c == '%') {
				while (!isEOF() && peek() != '\n') {
					advance();
				}
			} else {
				break;
			}
		}
	}

	/**
	 * Reads a control sequence: a backslash followed by either a run of
	 * letters or a single other character.
	 *
	 * @return the control sequence including its backslash, or {@code null}
	 *         (without moving) if there is none here
	 */
	private String readControlSequence() {
		if (peek() != '\\') {
			return null;
		}
		int start = pos;
		advance();
		if (isEOF()) {
			pos = start;
			return null;
		}
		if (!isAsciiLetter(peek())) {
			advance();
			return input.substring(start, pos);
		}
		while (isAsciiLetter(peek())) {
			advance();
		}
		return input.substring(start, pos);
	}

	private <T> T readBraces(Supplier<T> parser) {
		return readGroup('{', '}', parser);
	}

	private <T> T readBrackets(Supplier<T> parser) {
		return readGroup('[', ']', parser);
	}

	/**
	 * Parses {@code open content close} with the supplied content parser.
	 *
	 * @return the content, or {@code null} if the current character is not {@code open}
	 * @throws UnbalancedGroupException if {@code close} does not follow the content
	 */
	private <T> T readGroup(char open, char close, Supplier<T> parser) {
		skipIgnorable();
		if (peek() != open) {
			return null;
		}
		advance();
		skipIgnorable();
		T result = parser.get();
		skipIgnorable();
		if (peek() != close) {
			throw new UnbalancedGroupException("Expected '" + close + "'", pos);
		}
		advance();
		skipIgnorable();
		return result;
	}

	/**
	 * Reads the verbatim content of a braced group, honoring nested braces.
	 *
	 * @return the text between the braces, or {@code null} if there is no group here
	 * @throws UnbalancedGroupException if the group is not closed
	 */
	private String readRawBraces() {
		skipIgnorable();
		if (peek() != '{') {
			return null;
		}
		advance();
		int start = pos;
		int depth = 0;
		while (!isEOF()) {
			int c = peek();
			if (c == '\\' && pos + 1 < input.length()) {
				pos += 2;
				continue;
			}
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				if (depth == 0) {
					break;
				}
				depth--;
			}
			advance();
		}
		if (isEOF()) {
			throw new UnbalancedGroupException("Expected '}'", pos);
		}
		String text = input.substring(start, pos);
		advance();
		skipIgnorable();
		return text;
	}

	// Expressions

	/**
	 * An expression followed by its optional sub- and superscripts.
	 */
	private Exp parseExpr() {
		skipIgnorable();
		Exp base = parseExpr1();
		if (base == null) {
			return null;
		}
		skipIgnorable();
		Exp scripted = parseSubSup(base);
		return scripted != null ? scripted : base;
	}

	/**
	 * An expression without scripts. The alternatives are tried in order
	 * and the first match wins.
	 */
	private Exp parseExpr1() {
		skipIgnorable();
		Exp exp = parseInBraces();
		if (exp == null) {
			exp = parseNumber();
		}
		if (exp == null) {
			exp = parseVariable();
		}
		if (exp == null) {
			exp = parseCommand();
		}
		if (exp == null) {
			exp = parseOperator();
		}
		if (exp == null) {
			exp = parseEnclosure();
		}
		return exp;
	}

	private Exp parseInBraces() {
		return readBraces(() -> parseGroupedExpr('}'));
	}

	/**
	 * Parses expressions until {@code terminator}, skipping characters that
	 * cannot be parsed.
	 */
	private List<Exp> parseGroupedList(char terminator) {
		List<Exp> exps = new ArrayList<Exp>();
		while (!isEOF() && peek() != terminator) {
			int start = pos;
			Exp exp = parseExpr();
			if (exp != null) {
				exps.add(exp);
			} else if (pos == start) {
				LOGGER.debug("Skipping '{}' at position {}: {}", (char) peek(), pos, TexOmmlLogger.excerpt(input, pos));
				advance();
			}
			skipIgnorable();
		}
		return exps;
	}

	private Exp parseGroupedExpr(char terminator) {
		return group(parseGroupedList(terminator));
	}

	private static Exp group(List<Exp> exps) {
		if (exps.size() == 1) {
			return exps.get(0);
		}
		return new Exp.Grouped(exps);
	}

	/**
	 * A mandatory command argument: a braced group, a single digit, or a
	 * single expression.
	 */
	private Exp parseArgument() {
		Exp arg = readBraces(() -> parseGroupedExpr('}'));
		if (arg != null) {
			return arg;
		}
		skipIgnorable();
		if (isDigit(peek())) {
			String digit = String.valueOf((char) peek());
			advance();
			skipIgnorable();
			return new Exp.Number(digit);
		}
		return parseExpr1();
	}

	private Exp parseNumber() {
		skipIgnorable();
		int start = pos;
		boolean hasDigits = false;
		while (isDigit(peek())) {
			hasDigits = true;
			advance();
		}
		if (peek() == '.') {
			int dotPos = pos;
			advance();
			if (isDigit(peek())) {
				while (isDigit(peek())) {
					advance();
				}
			} else if (!hasDigits) {
				// a lone dot is not a number
				pos = dotPos;
				return null;
			}
		}
		if (pos == start) {
			return null;
		}
		String number = input.substring(start, pos);
		skipIgnorable();
		return new Exp.Number(number);
	}

	private Exp parseVariable() {
		skipIgnorable();
		int c = peek();
		if (isAsciiLetter(c)) {
			advance();
			skipIgnorable();
			return new Exp.Identifier(String.valueOf((char) c));
		}
		return null;
	}

	private Exp parseOperator() {
		skipIgnorable();
		for (String prime : PRIMES) {
			if (match(prime)) {
				skipIgnorable();
				return TexSymbols.operator(prime);
			}
		}
		int c = peek();
		if (c < 0) {
			return null;
		}
		Exp op = TexSymbols.operator(String.valueOf((char) c));
		if (op != null) {
			advance();
			skipIgnorable();
		}
		return op;
	}

	private Exp parseEnclosure() {
		int c = peek();
		if (c >= 0 && DELIMITER_CHARS.indexOf(c) >= 0) {
			Exp enclosure = TexSymbols.enclosure(String.valueOf((char) c));
			if (enclosure != null) {
				advance();
				skipIgnorable();
				return enclosure;
			}
		}
		return null;
	}

	/**
	 * Attaches the scripts following {@code base}, if any.
	 *
	 * @return the scripted expression, or {@code null} if no script follows
	 */
	private Exp parseSubSup(Exp base) {
		skipIgnorable();
		boolean limits = takesLimits(base);
		int c = peek();

		if (c == '_') {
			advance();
			skipIgnorable();
			Exp sub = parseExpr1();
			if (sub == null) {
				return null;
			}
			skipIgnorable();
			if (peek() == '^') {
				advance();
				skipIgnorable();
				Exp sup = parseExpr1();
				if (sup != null) {
					return limits ? new Exp.UnderOver(true, base, sub, sup) : new Exp.Subsup(base, sub, sup);
				}
			}
			return limits ? new Exp.Under(true, base, sub) : new Exp.Sub(base, sub);
		}

		if (c == '^') {
			advance();
			skipIgnorable();
			Exp sup;
			if (peek() == '\'') {
				int primeCount = 0;
				while (peek() == '\'') {
					primeCount++;
					advance();
				}
				sup = new Exp.Symbol(SymbolType.PUN, primeSymbol(primeCount));
			} else {
				sup = parseExpr1();
				if (sup == null) {
					return null;
				}
			}
			skipIgnorable();
			if (peek() == '_') {
				advance();
				skipIgnorable();
				Exp sub = parseExpr1();
				if (sub != null) {
					return limits ? new Exp.UnderOver(true, base, sub, sup) : new Exp.Subsup(base, sub, sup);
				}
			}
			return limits ? new Exp.Over(true, base, sup) : new Exp.Super(base, sup);
		}

		return null;
	}

	private static String primeSymbol(int count) {
		switch (count) {
		case 1:
			return "′";
		case 2:
			return "″";
		case 3:
			return "‴";
		default:
			return "⁗";
		}
	}

	private boolean takesLimits(Exp base) {
		if (!(base instanceof Exp.MathOperator)) {
			return false;
		}
		return base == starredOperator || TexSymbols.isLimitsOperator(((Exp.MathOperator) base).getValue());
	}

	// Commands

	private Exp parseCommand() {
		String cmd = readControlSequence();
		if (cmd == null) {
			return null;
		}
		skipIgnorable();

		Exp symbol = TexSymbols.symbol(cmd);
		if (symbol != null) {
			if (symbol instanceof Exp.Symbol) {
				SymbolType type = ((Exp.Symbol) symbol).getType();
				if (type == SymbolType.ACCENT || type == SymbolType.T_OVER) {
					Exp arg = parseExpr1();
					if (arg != null) {
						return new Exp.Over(false, arg, symbol);
					}
				} else if (type == SymbolType.T_UNDER || type == SymbolType.BOT_ACCENT) {
					Exp arg = parseExpr1();
					if (arg != null) {
						return new Exp.Under(false, arg, symbol);
					}
				}
			}
			return symbol;
		}

		Exp.Symbol enclosure = TexSymbols.enclosure(cmd);
		if (enclosure != null) {
			return enclosure;
		}

		Double scale = TexSymbols.scale(cmd);
		if (scale != null) {
			return parseScaled(cmd, scale);
		}

		switch (cmd) {
		case "\\frac":
			return parseFrac(FractionType.NORMAL);
		case "\\dfrac":
			return parseFrac(FractionType.DISPLAY);
		case "\\tfrac":
			return parseFrac(FractionType.INLINE);
		case "\\sqrt":
			return parseSqrt();
		case "\\overset":
		case "\\stackrel":
			return parseOverset();
		case "\\underset":
			return parseUnderset();
		case "\\left":
			return parseDelimited();
		case "\\right":
			// only meaningful inside parseDelimited()
			return null;
		case "\\operatorname":
			return parseOperatorName();
		case "\\boxed":
			return parseBoxed();
		case "\\phantom":
			return parsePhantom();
		case "\\cancel":
			return parseCancel(StrokeType.FORWARD_SLASH);
		case "\\bcancel":
			return parseCancel(StrokeType.BACK_SLASH);
		case "\\xcancel":
			return parseCancel(StrokeType.X_SLASH);
		case "\\begin":
			return parseEnvironment();
		case "\\hspace":
			return parseHSpace();
		default:
			break;
		}

		Function<String, Exp> textOp = TexSymbols.textOperator(cmd);
		if (textOp != null) {
			String text = readRawBraces();
			return text == null ? null : textOp.apply(text);
		}

		Function<List<Exp>, Exp> styleOp = TexSymbols.styleOperator(cmd);
		if (styleOp != null) {
			return parseStyled(styleOp);
		}

		LOGGER.debug("Unrecognized command {} at position {}: {}", cmd, pos, TexOmmlLogger.excerpt(input, pos));
		return null;
	}

	private Exp parseFrac(FractionType fractionType) {
		Exp numerator = parseArgument();
		if (numerator == null) {
			return null;
		}
		Exp denominator = parseArgument();
		if (denominator == null) {
			return null;
		}
		return new Exp.Fraction(fractionType, numerator, denominator);
	}

	private Exp parseSqrt() {
		Exp index = readBrackets(() -> parseGroupedExpr(']'));
		Exp base = parseArgument();
		if (base == null) {
			return null;
		}
		return index != null ? new Exp.Root(index, base) : new Exp.Sqrt(base);
	}

	private Exp parseOverset() {
		Exp over = parseArgument();
		Exp base = over == null ? null : parseArgument();
		if (base == null) {
			return null;
		}
		return new Exp.Over(false, base, over);
	}

	private Exp parseUnderset() {
		Exp under = parseArgument();
		Exp base = under == null ? null : parseArgument();
		if (base == null) {
			return null;
		}
		return new Exp.Under(false, base, under);
	}

	private Exp parseBoxed() {
		Exp content = parseArgument();
		return content == null ? null : new Exp.Boxed(content);
	}

	private Exp parsePhantom() {
		Exp content = parseArgument();
		return content == null ? null : new Exp.Phantom(content);
	}

	private Exp parseCancel(StrokeType strokeType) {
		Exp content = parseArgument();
		return content == null ? null : new Exp.Cancel(strokeType, content);
	}

	private Exp parseStyled(Function<List<Exp>, Exp> styleOp) {
		List<Exp> content = readBraces(() -> parseGroupedList('}'));
		if (content == null) {
			Exp single = parseExpr1();
			content = single == null ? Collections.<Exp>emptyList() : Collections.singletonList(single);
		}
		if (content.isEmpty()) {
			return null;
		}
		return styleOp.apply(content);
	}

	private Exp parseScaled(String cmd, double scale) {
		Exp.Symbol delimiter = parseDelimiterSymbol();
		if (delimiter == null) {
			return null;
		}
		if (cmd.endsWith("l")) {
			delimiter = delimiter.withType(SymbolType.OPEN);
		} else if (cmd.endsWith("r")) {
			delimiter = delimiter.withType(SymbolType.CLOSE);
		}
		return new Exp.Scaled(scale, delimiter);
	}

	private Exp parseOperatorName() {
		boolean starred = peek() == '*';
		if (starred) {
			advance();
		}
		String name = readBraces(() -> {
			StringBuilder text = new StringBuilder();
			while (!isEOF() && peek() != '}') {
				Exp exp = parseExpr1();
				if (exp == null) {
					break;
				}
				text.append(toText(exp));
			}
			return text.toString();
		});
		if (name == null || name.isEmpty()) {
			return null;
		}
		Exp operator = new Exp.MathOperator(name);
		if (starred) {
			starredOperator = operator;
		}
		return operator;
	}

	private static String toText(Exp exp) {
		if (exp instanceof Exp.Identifier) {
			return ((Exp.Identifier) exp).getValue();
		}
		if (exp instanceof Exp.Number) {
			return ((Exp.Number) exp).getValue();
		}
		if (exp instanceof Exp.MathOperator) {
			return ((Exp.MathOperator) exp).getValue();
		}
		if (exp instanceof Exp.Text) {
			return ((Exp.Text) exp).getValue();
		}
		if (exp instanceof Exp.Symbol) {
			return ((Exp.Symbol) exp).getValue();
		}
		if (exp instanceof Exp.Grouped) {
			StringBuilder text = new StringBuilder();
			for (Exp child : ((Exp.Grouped) exp).getValue()) {
				text.append(toText(child));
			}
			return text.toString();
		}
		return "";
	}

	private Exp parseHSpace() {
		if (peek() == '*') {
			advance();
		}
		String dimension = readRawBraces();
		if (dimension == null) {
			return null;
		}
		return new Exp.Space(toEm(dimension.trim()));
	}

	/**
	 * Converts a TeX dimension into em, assuming a 10pt font.
	 * Unknown units and unparseable dimensions count as a third of an em.
	 */
	static double toEm(String dimension) {
		Matcher m = DIMENSION.matcher(dimension);
		if (!m.matches()) {
			return 0.333;
		}
		double value = Double.parseDouble(m.group(1));
		String unit = m.group(2) == null ? "em" : m.group(2).toLowerCase(Locale.ROOT);
		switch (unit) {
		case "em":
			return value;
		case "ex":
			return value * 0.43;
		case "pt":
			return value / 10.0;
		case "mu":
			return value / 18.0;
		case "pc":
			return value * 1.2;
		case "in":
			return value * 7.227;
		case "cm":
			return value * 2.845;
		case "mm":
			return value * 0.2845;
		default:
			return 0.333;
		}
	}

	// Delimited regions

	private Exp parseDelimited() {
		String open = parseDelimiter();
		if (open == null) {
			return null;
		}
		List<InDelimited> content = new ArrayList<InDelimited>();
		while (true) {
			skipIgnorable();
			int saved = pos;
			String cmd = readControlSequence();
			if ("\\right".equals(cmd)) {
				break;
			}
			if ("\\middle".equals(cmd)) {
				String separator = parseDelimiter();
				if (separator != null) {
					content.add(InDelimited.separator(separator));
				}
				continue;
			}
			pos = saved;
			Exp exp = parseExpr();
			if (exp == null) {
				break;
			}
			content.add(InDelimited.exp(exp));
		}
		String close = parseDelimiter();
		return new Exp.Delimited(open, close == null ? "" : close, content);
	}

	/**
	 * A delimiter after {@code \left}, {@code \middle} or {@code \right}.
	 *
	 * @return the delimiter glyph, an empty string for the null delimiter
	 *         {@code .}, or {@code null} if there is no delimiter here
	 */
	private String parseDelimiter() {
		skipIgnorable();
		if (peek() == '.') {
			advance();
			skipIgnorable();
			return "";
		}
		Exp.Symbol symbol = parseDelimiterSymbol();
		return symbol == null ? null : symbol.getValue();
	}

	private Exp.Symbol parseDelimiterSymbol() {
		skipIgnorable();
		int saved = pos;
		String cmd = readControlSequence();
		if (cmd != null) {
			Exp.Symbol enclosure = TexSymbols.enclosure(cmd);
			if (enclosure != null) {
				skipIgnorable();
				return enclosure;
			}
			pos = saved;
			return null;
		}
		int c = peek();
		if (c >= 0 && DELIMITER_CHARS.indexOf(c) >= 0) {
			advance();
			skipIgnorable();
			return TexSymbols.enclosure(String.valueOf((char) c));
		}
		return null;
	}

	// Environments

	private Exp parseEnvironment() {
		String name = readRawBraces();
		if (name == null || name.isEmpty()) {
			return null;
		}
		name = name.trim();

		if (name.contains("matrix") || "array".equals(name)) {
			String columnSpec = "array".equals(name) ? readRawBraces() : null;
			return parseMatrix(name, columnSpec);
		}
		if (name.contains("align") || "eqnarray".equals(name)) {
			if (name.startsWith("alignat")) {
				// column count argument
				readRawBraces();
			}
			return parseAlign();
		}
		if ("cases".equals(name)) {
			List<List<List<Exp>>> rows = parseRows();
			Exp.Array array = new Exp.Array(alignments(rows, "ll"), rows);
			return new Exp.Delimited("{", "", Collections.singletonList(InDelimited.exp(array)));
		}

		LOGGER.debug("Unsupported environment {}", name);
		return null;
	}

	private Exp parseMatrix(String name, String columnSpec) {
		List<List<List<Exp>>> rows = parseRows();
		Exp.Array array = new Exp.Array(alignments(rows, columnSpec), rows);

		String open;
		String close;
		switch (name) {
		case "pmatrix":
			open = "(";
			close = ")";
			break;
		case "bmatrix":
			open = "[";
			close = "]";
			break;
		case "Bmatrix":
			open = "{";
			close = "}";
			break;
		case "vmatrix":
			open = "|";
			close = "|";
			break;
		case "Vmatrix":
			open = "∥";
			close = "∥";
			break;
		default:
			return array;
		}
		return new Exp.Delimited(open, close, Collections.singletonList(InDelimited.exp(array)));
	}

	private Exp parseAlign() {
		List<List<List<Exp>>> rows = parseRows();
		List<Alignment> alignments = new ArrayList<Alignment>();
		int columns = maxColumns(rows);
		for (int i = 0; i < columns; i++) {
			alignments.add(i % 2 == 0 ? Alignment.RIGHT : Alignment.LEFT);
		}
		return new Exp.Array(alignments, rows);
	}

	/**
	 * One alignment per column of the widest row, taken from the
	 * {@code l}, {@code c}, {@code r} letters of the column specification
	 * when there is one, centered otherwise.
	 */
	private static List<Alignment> alignments(List<List<List<Exp>>> rows, String columnSpec) {
		List<Alignment> specified = new ArrayList<Alignment>();
		if (columnSpec != null) {
			for (char c : columnSpec.toCharArray()) {
				if (c == 'l') {
					specified.add(Alignment.LEFT);
				} else if (c == 'c') {
					specified.add(Alignment.CENTER);
				} else if (c == 'r') {
					specified.add(Alignment.RIGHT);
				}
			}
		}
		List<Alignment> alignments = new ArrayList<Alignment>();
		int columns = maxColumns(rows);
		for (int i = 0; i < columns; i++) {
			alignments.add(i < specified.size() ? specified.get(i) : Alignment.CENTER);
		}
		return alignments;
	}

	private static int maxColumns(List<List<List<Exp>>> rows) {
		int max = 0;
		for (List<List<Exp>> row : rows) {
			max = Math.max(max, row.size());
		}
		return max;
	}

	/**
	 * Parses the rows of an environment body up to and including its
	 * {@code \end{...}}. Rows are separated by {@code \\}, cells by {@code &}.
	 */
	private List<List<List<Exp>>> parseRows() {
		List<List<List<Exp>>> rows = new ArrayList<List<List<Exp>>>();
		while (true) {
			skipIgnorable();
			if (atEnd()) {
				readControlSequence();
				readRawBraces();
				break;
			}
			rows.add(parseArrayLine());
			if (match("\\\\")) {
				skipIgnorable();
				// optional vertical space, as in \\[2pt]
				readBrackets(() -> parseGroupedExpr(']'));
			} else if (!atEnd()) {
				break;
			}
		}
		// a trailing \\ right before \end does not open a row
		if (!rows.isEmpty()) {
			List<List<Exp>> last = rows.get(rows.size() - 1);
			if (last.size() == 1 && last.get(0).isEmpty()) {
				rows.remove(rows.size() - 1);
			}
		}
		return rows;
	}

	private boolean atEnd() {
		return input.startsWith("\\end", pos) && !isAsciiLetter(pos + 4 < input.length() ? input.charAt(pos + 4) : -1);
	}

	private List<List<Exp>> parseArrayLine() {
		List<List<Exp>> cells = new ArrayList<List<Exp>>();
		List<Exp> cell = new ArrayList<Exp>();
		while (true) {
			skipIgnorable();
			if (peek() == '&') {
				cells.add(cell);
				cell = new ArrayList<Exp>();
				advance();
				continue;
			}
			if (isEOF() || input.startsWith("\\\\", pos) || atEnd()) {
				cells.add(cell);
				break;
			}
			int start = pos;
			Exp exp = parseExpr();
			if (exp != null) {
				cell.add(exp);
			} else if (pos == start) {
				LOGGER.debug("Skipping '{}' at position {}: {}", (char) peek(), pos, TexOmmlLogger.excerpt(input, pos));
				advance();
			}
		}
		return cells;
	}
}
