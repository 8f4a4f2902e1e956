package org.metricshub.texomml.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class TexOmmlLoggerTest {

	@Test
	public void testShortFormulaExcerpt() {
		assertEquals("x^ >>> \\foo", TexOmmlLogger.formatExcerpt("x^\\foo", 2));
		assertEquals(" >>> x", TexOmmlLogger.formatExcerpt("x", -3));
		assertEquals("x >>> ", TexOmmlLogger.formatExcerpt("x", 7));
		assertEquals("", TexOmmlLogger.formatExcerpt(null, 0));
	}

	@Test
	public void testLongFormulaExcerptIsTrimmed() {
		String formula = "\\frac{a+b+c+d}{e+f+g+h} \\unknown{z+y+x+w+v+u}";
		int position = formula.indexOf("\\unknown");
		String excerpt = TexOmmlLogger.formatExcerpt(formula, position);
		assertEquals("...d}{e+f+g+h}  >>> \\unknown{z+y...", excerpt);
		assertEquals(excerpt, TexOmmlLogger.excerpt(formula, position).toString());
	}
}
