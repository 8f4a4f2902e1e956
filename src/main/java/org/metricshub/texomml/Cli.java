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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.metricshub.texomml.backend.OmmlWriter;
import org.metricshub.texomml.frontend.ast.AstDumper;
import org.metricshub.texomml.frontend.ast.DisplayType;
import org.metricshub.texomml.frontend.ast.Exp;
import org.metricshub.texomml.util.ConversionSettings;
import org.metricshub.texomml.util.FormulaSource;

/**
 * Command-line interface for TexOmml.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "TexOmml.jar";
		}
		JAR_NAME = myName;
	}

	private final ConversionSettings settings = new ConversionSettings();
	private final InputStream in;
	private final PrintStream out;

	private FormulaSource formulaSource;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 * The OMML is written to the standard output in UTF-8, whatever the
	 * platform default charset, since formulas are read in UTF-8 too.
	 */
	public Cli() {
		this(System.in, new PrintStream(System.out, true, StandardCharsets.UTF_8), System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The error stream is
	 * currently unused but kept for API symmetry with typical Java main methods.
	 *
	 * @param in stream from which the formula is read when none is given
	 * @param out stream where the OMML is written
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.in = in;
		this.out = out;
	}

	/**
	 * Returns the mutable {@link ConversionSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ConversionSettings getSettings() {
		return settings;
	}

	/**
	 * @return where the formula will be read from, {@code null} before {@link #parse(String[])}
	 */
	public FormulaSource getFormulaSource() {
		return formulaSource;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || arg.length() > 1 && arg.charAt(1) == '\\') {
				// end of options: a formula such as "-\frac12" is not an option either
				break;
			} else if (arg.equals("-")) {
				// single dash: read the formula from the standard input
				break;
			} else if (arg.equals("-b") || arg.equals("--block")) {
				settings.setDisplayType(DisplayType.BLOCK);
			} else if (arg.equals("-i") || arg.equals("--inline")) {
				settings.setDisplayType(DisplayType.INLINE);
			} else if (arg.equals("-n") || arg.equals("--namespace")) {
				settings.setDeclareNamespace(true);
			} else if (arg.equals("-f")) {
				// -f filename : read the formula from a file
				checkParameterHasArgument(args, argIdx);
				if (formulaSource != null) {
					throw new IllegalArgumentException("Only one formula file can be given.");
				}
				formulaSource = FormulaSource.fromFile(args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		int remaining = args.length - argIdx;
		if (formulaSource != null) {
			if (remaining > 0) {
				throw new IllegalArgumentException("Unexpected argument after -f: " + args[argIdx]);
			}
			try {
				formulaSource.getReader();
			} catch (IOException | RuntimeException ex) {
				throw new IllegalArgumentException(
						"Failed to read formula '" + formulaSource.getDescription() + "': " + ex.getMessage(),
						ex);
			}
		} else if (remaining == 0 || remaining == 1 && args[argIdx].equals("-")) {
			formulaSource = new FormulaSource(
					FormulaSource.DESCRIPTION_STDIN,
					new InputStreamReader(in, StandardCharsets.UTF_8));
		} else if (remaining == 1) {
			formulaSource = new FormulaSource(FormulaSource.DESCRIPTION_COMMAND_LINE_FORMULA, new StringReader(args[argIdx]));
		} else {
			throw new IllegalArgumentException("Only one formula can be given, quote it if it contains spaces.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Converts the formula given on the command line.
	 *
	 * @throws IOException if the formula cannot be read
	 * @throws TexOmmlException if the formula has an unclosed group
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		String formula = formulaSource.readAll().trim();
		List<Exp> exps = TexOmml.parse(formula);
		if (dumpSyntaxTree) {
			AstDumper.dump(exps, out);
			return;
		}
		out.println(new OmmlWriter(settings).write(exps));
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-b|--block]" +
								" [-i|--inline]" +
								" [-n|--namespace]" +
								" [-f formula-filename]" +
								" [--dump-syntax]" +
								" [formula | -]");
		dest.println();
		dest.println(" -b, --block = Centered display block (m:oMathPara).");
		dest.println(" -i, --inline = Inline with text (m:oMath), the default.");
		dest.println(" -n, --namespace = Declare the xmlns:m namespace on the root element.");
		dest.println(" -f filename = Read the formula from filename (UTF-8).");
		dest.println(" --dump-syntax = Print the syntax tree instead of the OMML.");
		dest.println();
		dest.println(" Without formula, or with '-', the formula is read from the standard input.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the formula
	 * @param os output stream for the OMML
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the formula cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (TexOmmlException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
