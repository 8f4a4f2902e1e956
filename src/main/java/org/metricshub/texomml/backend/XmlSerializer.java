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

import java.util.Map;

/**
 * Renders a markup tree as text, one element per line.
 * <p>
 * Empty elements are self-closed, an element whose only child is text is
 * written on a single line, and any other element has its children on the
 * following lines, indented one level deeper.
 */
public final class XmlSerializer {

	private final String indentUnit;

	/**
	 * @param indentUnit what is written once per nesting level in front of each line
	 */
	public XmlSerializer(String indentUnit) {
		this.indentUnit = indentUnit == null ? "" : indentUnit;
	}

	/**
	 * @param root the tree to render
	 * @return the markup text, without trailing newline
	 */
	public String serialize(XmlNode root) {
		StringBuilder out = new StringBuilder();
		write(root, 0, out);
		return out.toString();
	}

	private void write(XmlNode node, int level, StringBuilder out) {
		indent(level, out);
		if (node instanceof XmlNode.Text) {
			out.append(escape(((XmlNode.Text) node).getValue()));
			return;
		}
		XmlNode.Element element = (XmlNode.Element) node;
		out.append('<').append(element.getTag());
		for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
			out.append(' ').append(attribute.getKey()).append("=\"").append(escape(attribute.getValue())).append('"');
		}
		if (element.getChildren().isEmpty()) {
			out.append("/>");
			return;
		}
		if (element.getChildren().size() == 1 && element.getChildren().get(0) instanceof XmlNode.Text) {
			out.append('>');
			out.append(escape(((XmlNode.Text) element.getChildren().get(0)).getValue()));
			out.append("</").append(element.getTag()).append('>');
			return;
		}
		out.append('>');
		for (XmlNode child : element.getChildren()) {
			out.append('\n');
			write(child, level + 1, out);
		}
		out.append('\n');
		indent(level, out);
		out.append("</").append(element.getTag()).append('>');
	}

	private void indent(int level, StringBuilder out) {
		for (int i = 0; i < level; i++) {
			out.append(indentUnit);
		}
	}

	/**
	 * Escapes the characters that are not allowed verbatim in XML text or
	 * attribute values.
	 *
	 * @param text raw text
	 * @return the escaped text
	 */
	public static String escape(String text) {
		StringBuilder escaped = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '&':
				escaped.append("&amp;");
				break;
			case '<':
				escaped.append("&lt;");
				break;
			case '>':
				escaped.append("&gt;");
				break;
			case '"':
				escaped.append("&quot;");
				break;
			case '\'':
				escaped.append("&apos;");
				break;
			default:
				escaped.append(c);
				break;
			}
		}
		return escaped.toString();
	}
}
