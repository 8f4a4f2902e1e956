package org.metricshub.texomml;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.util.FormulaSource;

public class CliTest {

	private static final String[] X_INLINE = {
			"<m:oMath>",
			"  <m:r>",
			"    <m:t>x</m:t>",
			"  </m:r>",
			"</m:oMath>" };

	@Test
	public void testFormulaArgument() throws Exception {
		TexOmmlTestSupport.cliTest("formula argument").formula("x").expectLines(X_INLINE).runAndAssert();
	}

	@Test
	public void testFormulaFromStdin() throws Exception {
		TexOmmlTestSupport.cliTest("stdin").stdin("x\n").expectLines(X_INLINE).argument("-i").runAndAssert();
		TexOmmlTestSupport.cliTest("stdin with dash").stdin("x").argument("-").expectLines(X_INLINE).runAndAssert();
	}

	@Test
	public void testFormulaFile() throws Exception {
		TexOmmlTestSupport.cliTest("formula file").formulaFile("x\n").expectLines(X_INLINE).runAndAssert();
	}

	@Test
	public void testBlockAndNamespace() throws Exception {
		String[] lines = TexOmmlTestSupport.cliTest("block").argument("-b", "--namespace").formula("x").run().lines();
		assertEquals(
				"<m:oMathPara xmlns:m=\"http://schemas.openxmlformats.org/officeDocument/2006/math\">",
				lines[0]);
	}

	@Test
	public void testLeadingMinusFormulaIsNotAnOption() throws Exception {
		String output = TexOmmlTestSupport.cliTest("negative fraction").formula("-\\frac12").run().output();
		assertTrue(output.contains("<m:f>"));
	}

	@Test
	public void testDumpSyntax() throws Exception {
		TexOmmlTestSupport
				.cliTest("dump syntax")
				.argument("--dump-syntax")
				.formula("x^2")
				.expectLines("Super", "  base:", "    Identifier x", "  sup:", "    Number 2")
				.runAndAssert();
	}

	@Test
	public void testUsage() throws Exception {
		String[] lines = TexOmmlTestSupport.cliTest("usage").argument("-h").run().lines();
		assertEquals("Usage:", lines[0]);
		assertTrue(TexOmmlTestSupport.cliTest("no argument").run().output().startsWith("Usage:"));
	}

	@Test
	public void testInvalidArguments() throws Exception {
		TexOmmlTestSupport
				.cliTest("unknown option")
				.argument("--bogus")
				.formula("x")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
		TexOmmlTestSupport.cliTest("missing file name").argument("-f").expectExit(1).runAndAssert();
		TexOmmlTestSupport.cliTest("two formulas").argument("x", "y").expectExit(1).runAndAssert();
		TexOmmlTestSupport
				.cliTest("help with others")
				.argument("-b", "-h")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
		TexOmmlTestSupport
				.cliTest("missing file")
				.argument("-f", "does-not-exist.tex")
				.expectThrow(IllegalArgumentException.class)
				.runAndAssert();
	}

	@Test
	public void testUnbalancedFormula() throws Exception {
		TexOmmlTestSupport
				.cliTest("unbalanced")
				.formula("\\frac{1}{2")
				.expectThrow(TexOmmlException.class)
				.runAndAssert();
	}

	@Test
	public void testStandardOutputIsUtf8() throws IOException {
		PrintStream standardOut = System.out;
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try (PrintStream asciiOut = new PrintStream(bytes, true, StandardCharsets.US_ASCII.name())) {
			System.setOut(asciiOut);
			Cli cli = Cli.parseCommandLineArguments(new String[] { "\\sum_{i=1}^{n} \\alpha'" });
			cli.run();
		} finally {
			System.setOut(standardOut);
		}
		String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(output, output.contains("<m:chr m:val=\"\u2211\"/>"));
		assertTrue(output, output.contains("\u03b1"));
		assertTrue(output, output.contains("\u2032"));
		assertFalse(output, output.contains("?"));
	}

	@Test
	public void testParsedSettings() throws IOException {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "-b", "-n", "x" });
		assertEquals(DisplayType.BLOCK, cli.getSettings().getDisplayType());
		assertTrue(cli.getSettings().isDeclareNamespace());
		assertFalse(cli.isDumpSyntaxTree());
		assertEquals(FormulaSource.DESCRIPTION_COMMAND_LINE_FORMULA, cli.getFormulaSource().getDescription());
		assertEquals("x", cli.getFormulaSource().readAll());

		Cli stdin = Cli.parseCommandLineArguments(new String[] { "-i" });
		assertEquals(DisplayType.INLINE, stdin.getSettings().getDisplayType());
		assertEquals(FormulaSource.DESCRIPTION_STDIN, stdin.getFormulaSource().getDescription());
		assertNull(stdin.getFormulaSource().getFile());
	}
}
