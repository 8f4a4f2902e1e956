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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Markup tree built by the {@link OmmlWriter} before it is serialized.
 * A node is either an {@link Element} or a {@link Text} leaf.
 */
public abstract class XmlNode {

	private XmlNode() {}

	/**
	 * An element with a qualified tag name, attributes kept in insertion
	 * order, and child nodes.
	 */
	public static final class Element extends XmlNode {
		private final String tag;
		private final Map<String, String> attributes;
		private final List<XmlNode> children;

		public Element(String tag, Map<String, String> attributes, List<XmlNode> children) {
			this.tag = Objects.requireNonNull(tag);
			this.attributes = Collections.unmodifiableMap(new LinkedHashMap<String, String>(attributes));
			this.children = Collections.unmodifiableList(new ArrayList<XmlNode>(children));
		}

		public String getTag() {
			return tag;
		}

		public Map<String, String> getAttributes() {
			return attributes;
		}

		public List<XmlNode> getChildren() {
			return children;
		}

		/**
		 * @param name attribute name
		 * @return the attribute value, or {@code null}
		 */
		public String getAttribute(String name) {
			return attributes.get(name);
		}

		/**
		 * Returns a copy of this element with one more attribute.
		 *
		 * @param name attribute name
		 * @param value attribute value
		 * @return the new element
		 */
		public Element withAttribute(String name, String value) {
			Map<String, String> copy = new LinkedHashMap<String, String>(attributes);
			copy.put(name, value);
			return new Element(tag, copy, children);
		}

		/**
		 * @param childTag tag of the wanted child
		 * @return the first child element with that tag, or {@code null}
		 */
		public Element child(String childTag) {
			for (XmlNode child : children) {
				if (child instanceof Element && ((Element) child).tag.equals(childTag)) {
					return (Element) child;
				}
			}
			return null;
		}

		/**
		 * @return the concatenation of all text leaves below this element
		 */
		public String textContent() {
			StringBuilder text = new StringBuilder();
			for (XmlNode child : children) {
				if (child instanceof Text) {
					text.append(((Text) child).getValue());
				} else {
					text.append(((Element) child).textContent());
				}
			}
			return text.toString();
		}

		@Override
		public String toString() {
			return "<" + tag + attributes + children + ">";
		}
	}

	/** Character data */
	public static final class Text extends XmlNode {
		private final String value;

		public Text(String value) {
			this.value = Objects.requireNonNull(value);
		}

		public String getValue() {
			return value;
		}

		@Override
		public String toString() {
			return value;
		}
	}
}
