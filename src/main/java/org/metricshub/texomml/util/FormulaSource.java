package org.metricshub.texomml.util;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where a formula is read from: a string given on the command line, the
 * standard input, or a UTF-8 file given with the "-f" command line switch.
 * <p>
 * A file is only opened when its reader is first requested. A leading byte
 * order mark, as written by some editors, is not part of the formula.
 */
public class FormulaSource {

	/** Description of a formula given as a command line argument */
	public static final String DESCRIPTION_COMMAND_LINE_FORMULA = "<command-line-supplied-formula>";

	/** Description of a formula read from the standard input */
	public static final String DESCRIPTION_STDIN = "<stdin>";

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final String description;
	private final Path file;
	private Reader reader;

	/**
	 * @param description where the formula comes from
	 * @param reader serves the formula text
	 */
	public FormulaSource(String description, Reader reader) {
		this(description, null, reader);
	}

	private FormulaSource(String description, Path file, Reader reader) {
		this.description = description;
		this.file = file;
		this.reader = reader;
	}

	/**
	 * @param filePath path of the UTF-8 file holding the formula
	 * @return a source which opens the file on first use
	 */
	public static FormulaSource fromFile(String filePath) {
		return new FormulaSource(filePath, Paths.get(filePath), null);
	}

	/**
	 * @return where the formula comes from
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * @return the file holding the formula, or {@code null} when it does not
	 *         come from a file
	 */
	public Path getFile() {
		return file;
	}

	/**
	 * Obtain the {@link Reader} serving the formula text, opening the file
	 * first if needed.
	 *
	 * @return The reader which contains the formula text.
	 * @throws IOException if the file cannot be opened
	 */
	public Reader getReader() throws IOException {
		if (reader == null && file != null) {
			reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
		}
		return reader;
	}

	/**
	 * Reads the whole formula text.
	 *
	 * @return the formula text, without a leading byte order mark
	 * @throws IOException if reading fails
	 */
	public String readAll() throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader in = getReader()) {
			int read;
			while ((read = in.read(buffer)) != -1) {
				text.append(buffer, 0, read);
			}
		}
		if (text.length() > 0 && text.charAt(0) == BYTE_ORDER_MARK) {
			text.deleteCharAt(0);
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
