package org.metricshub.texomml.util;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.texomml.frontend.ast.DisplayType;

public class ConversionSettingsTest {

	@Test
	public void testDefaults() {
		ConversionSettings settings = new ConversionSettings();
		assertEquals(DisplayType.INLINE, settings.getDisplayType());
		assertFalse(settings.isDeclareNamespace());
		assertEquals("  ", settings.getIndent());
		assertEquals(
				"displayType = INLINE\ndeclareNamespace = false\nindent = \"  \"\n",
				settings.toDescriptionString());
	}

	@Test
	public void testSetters() {
		ConversionSettings settings = new ConversionSettings();
		settings.setIndent(null);
		assertEquals("", settings.getIndent());
		assertThrows(IllegalArgumentException.class, () -> settings.setDisplayType(null));
	}
}
