package org.metricshub.jsh;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsh
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.metricshub.jsh.frontend.ShParser;
import org.metricshub.jsh.frontend.ast.Node;
import org.metricshub.jsh.frontend.ast.Program;
import org.metricshub.jsh.util.ScriptSource;
import org.metricshub.jsh.util.ShLogger;
import org.metricshub.jsh.util.ShSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing of shell scripts.
 * <p>
 * A script is parsed into a {@link Program}, an immutable syntax tree that
 * callers traverse (to execute or analyze the script) or render back to
 * text with {@link Node#render()}.
 * <p>
 * Each call creates its own parser, so a single {@code Sh} instance may be
 * shared between threads. Errors are reported with
 * {@link org.metricshub.jsh.frontend.ast.ParserException} and its subclass
 * {@link org.metricshub.jsh.frontend.ast.LexerException}, which both carry
 * the name of the script and the position of the fault.
 */
public class Sh {

	private static final Logger LOG = ShLogger.getLogger(Sh.class);

	private final boolean keepComments;

	/**
	 * Create a new instance of Sh with default settings
	 */
	public Sh() {
		this(new ShSettings());
	}

	/**
	 * Create a new instance of Sh with the specified settings. The settings
	 * are read once, later changes have no effect on this instance.
	 *
	 * @param settings parse settings
	 */
	public Sh(ShSettings settings) {
		if (settings == null) {
			throw new IllegalArgumentException("Settings must not be null");
		}
		this.keepComments = settings.isKeepComments();
	}

	/**
	 * Parses the script read from the specified stream, decoded as UTF-8.
	 * The stream is read until its end (or the first error), but not closed.
	 *
	 * @param inputStream the script
	 * @param name name of the script, used in error messages only
	 * @return the syntax tree of the script
	 * @throws IOException when reading the stream fails
	 */
	public Program parse(InputStream inputStream, String name) throws IOException {
		if (inputStream == null) {
			throw new IllegalArgumentException("Input stream must not be null");
		}
		return parse(new InputStreamReader(inputStream, StandardCharsets.UTF_8), name);
	}

	/**
	 * Parses the script read from the specified reader, which is not closed.
	 *
	 * @param reader the script
	 * @param name name of the script, used in error messages only
	 * @return the syntax tree of the script
	 * @throws IOException when reading fails
	 */
	public Program parse(Reader reader, String name) throws IOException {
		return parse(new ScriptSource(name, reader));
	}

	/**
	 * Parses the specified script source.
	 *
	 * @param scriptSource the script and its description
	 * @return the syntax tree of the script
	 * @throws IOException when reading the script fails
	 */
	public Program parse(ScriptSource scriptSource) throws IOException {
		LOG.debug("Parsing {}", scriptSource);
		ShSettings settings = new ShSettings();
		settings.setKeepComments(keepComments);
		return new ShParser(scriptSource, settings).parse();
	}

	/**
	 * Parses the specified script text.
	 *
	 * @param script the script
	 * @return the syntax tree of the script
	 * @throws IOException never in practice, as the script is in memory
	 */
	public Program parse(String script) throws IOException {
		return parse(new StringReader(script), ScriptSource.DESCRIPTION_UNNAMED_SCRIPT);
	}

	/**
	 * Parses the specified script and renders it back in the canonical syntax.
	 *
	 * @param script the script
	 * @return the canonical form of the script
	 * @throws IOException never in practice, as the script is in memory
	 */
	public String format(String script) throws IOException {
		return parse(script).render();
	}
}
