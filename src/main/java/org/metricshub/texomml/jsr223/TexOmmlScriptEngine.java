package org.metricshub.texomml.jsr223;

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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.texomml.TexOmml;
import org.metricshub.texomml.TexOmmlException;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.util.ConversionSettings;
import org.metricshub.texomml.util.FormulaSource;

/**
 * JSR-223 script engine for TexOmml. The "script" is a LaTeX formula and
 * evaluating it returns the OMML text, which is also written to the context
 * writer.
 * <p>
 * Context attributes:
 * <ul>
 * <li>{@code displayType}: {@code "block"}, {@code "inline"} or a
 * {@link DisplayType}; inline by default</li>
 * <li>{@code declareNamespace}: {@code true} (or {@code "true"}) to declare
 * {@code xmlns:m} on the root element</li>
 * </ul>
 */
public class TexOmmlScriptEngine extends AbstractScriptEngine {

	/** Context attribute selecting the display type */
	public static final String DISPLAY_TYPE_ATTRIBUTE = "displayType";

	/** Context attribute requesting the namespace declaration */
	public static final String DECLARE_NAMESPACE_ATTRIBUTE = "declareNamespace";

	private final ScriptEngineFactory factory;

	public TexOmmlScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			ConversionSettings settings = new ConversionSettings();
			Object displayType = context.getAttribute(DISPLAY_TYPE_ATTRIBUTE);
			if (displayType instanceof DisplayType) {
				settings.setDisplayType((DisplayType) displayType);
			} else if (displayType != null) {
				settings.setDisplayType(DisplayType.fromName(displayType.toString()));
			}
			Object declareNamespace = context.getAttribute(DECLARE_NAMESPACE_ATTRIBUTE);
			if (declareNamespace != null) {
				settings.setDeclareNamespace(Boolean.parseBoolean(declareNamespace.toString()));
			}
			String formula = new FormulaSource(FormulaSource.DESCRIPTION_COMMAND_LINE_FORMULA, scriptReader).readAll();
			String out = TexOmml.convert(formula, settings);
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			return out;
		} catch (IOException | TexOmmlException | IllegalArgumentException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
