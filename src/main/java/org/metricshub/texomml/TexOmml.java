package org.metricshub.texomml;

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

import java.util.List;
import org.metricshub.texomml.backend.OmmlWriter;
import org.metricshub.texomml.frontend.TexParser;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.frontend.ast.UnbalancedGroupException;
import org.metricshub.texomml.util.ConversionSettings;

/**
 * Converts LaTeX math notation into Office Math Markup Language.
 * <p>
 * Typical usage:
 *
 * <pre>
 * String omml = TexOmml.convert("\\frac{a}{b}", DisplayType.BLOCK);
 * </pre>
 * <p>
 * Conversion is stateless; concurrent calls need no synchronization.
 * Unsupported notation degrades silently to a partial result. The only
 * failure is a missing closing brace or bracket, reported as a
 * {@link TexOmmlException}.
 */
public final class TexOmml {

	private TexOmml() {
		// utility class
	}

	/**
	 * Converts an inline formula.
	 *
	 * @param tex LaTeX math source
	 * @return the OMML text, rooted at {@code m:oMath}
	 * @throws TexOmmlException if a group is not closed
	 */
	public static String convert(String tex) {
		return convert(tex, DisplayType.INLINE);
	}

	/**
	 * @param tex LaTeX math source
	 * @param displayType {@link DisplayType#BLOCK} for a centered
	 *        {@code m:oMathPara}, {@link DisplayType#INLINE} for a bare
	 *        {@code m:oMath}
	 * @return the OMML text
	 * @throws TexOmmlException if a group is not closed
	 */
	public static String convert(String tex, DisplayType displayType) {
		ConversionSettings settings = new ConversionSettings();
		settings.setDisplayType(displayType);
		return convert(tex, settings);
	}

	/**
	 * @param tex LaTeX math source
	 * @param settings display type, namespace declaration and indentation
	 * @return the OMML text
	 * @throws TexOmmlException if a group is not closed
	 */
	public static String convert(String tex, ConversionSettings settings) {
		return new OmmlWriter(settings).write(parse(tex));
	}

	/**
	 * Parses a formula without writing it.
	 *
	 * @param tex LaTeX math source
	 * @return the top-level expressions
	 * @throws TexOmmlException if a group is not closed
	 */
	public static List<Exp> parse(String tex) {
		try {
			return new TexParser().parse(tex);
		} catch (UnbalancedGroupException e) {
			throw new TexOmmlException(e);
		}
	}
}
