package org.metricshub.texomml.util;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Test;

public class FormulaSourceTest {

	@Test
	public void testFormulaSources() throws Exception {
		FormulaSource source = new FormulaSource("test", new StringReader("\\alpha"));
		assertEquals("test", source.toString());
		assertEquals("\\alpha", source.readAll());

		Path file = Files.createTempFile("formula", ".tex");
		try {
			Files.write(file, "\uFEFF\\sum_{i}".getBytes(StandardCharsets.UTF_8));
			FormulaSource fileSource = FormulaSource.fromFile(file.toString());
			assertEquals(file.toString(), fileSource.getDescription());
			assertEquals(file, fileSource.getFile());
			assertEquals("\\sum_{i}", fileSource.readAll());
		} finally {
			Files.deleteIfExists(file);
		}
	}

	@Test
	public void testMissingFormulaFile() {
		FormulaSource source = FormulaSource.fromFile("no-such-formula.tex");
		assertEquals("no-such-formula.tex", source.toString());
		assertThrows(NoSuchFileException.class, source::getReader);
	}
}
