package org.metricshub.jsh.frontend;

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
import java.io.Reader;
import org.metricshub.jsh.frontend.ast.LexerException;
import org.metricshub.jsh.util.ScriptSource;
import org.metricshub.jsh.util.ShLogger;
import org.slf4j.Logger;

/**
 * Splits the shell script text into tokens: words, operators, separators
 * and comments.
 * <p>
 * Words are opaque: quotes, backslashes and {@code $} expansions are kept
 * verbatim in the token text, and a quoted span never ends a word, even when
 * it contains blanks. <code>{</code> and <code>}</code> are operators only at the start
 * of a token.
 * <p>
 * The lexer reads its source forward only, one token at a time, and keeps
 * the state of a single parse.
 */
class ShLexer {

	private static final Logger LOG = ShLogger.getLogger(ShLexer.class);

	private final String sourceDescription;
	private final Reader reader;

	/** Current character, -1 at the end of the input */
	private int c;

	/** The character after {@link #c}, for line continuations */
	private int ahead;

	/** Position of {@link #c} */
	private int line = 1;
	private int column = 1;

	private Token token;
	private final StringBuilder text = new StringBuilder();
	private int tokenLine;
	private int tokenColumn;

	/**
	 * Creates a lexer reading the specified source. Nothing is read until
	 * {@link #start()} is called.
	 *
	 * @param scriptSource the script to tokenize
	 */
	ShLexer(ScriptSource scriptSource) {
		this.sourceDescription = scriptSource.getDescription();
		this.reader = scriptSource.getReader();
	}

	/**
	 * Reads the first token.
	 *
	 * @return the first token
	 * @throws IOException when the reader fails
	 */
	Token start() throws IOException {
		c = readRaw();
		ahead = c < 0 ? -1 : readRaw();
		return lexer();
	}

	private int readRaw() throws IOException {
		int r = reader.read();
		// completely bypass \r's
		while (r == '\r') {
			r = reader.read();
		}
		return r;
	}

	private void read() throws IOException {
		if (c == '\n') {
			line++;
			column = 1;
		} else if (c >= 0) {
			column++;
		}
		c = ahead;
		ahead = c < 0 ? -1 : readRaw();
	}

	/**
	 * @return the current token
	 */
	Token getToken() {
		return token;
	}

	/**
	 * @return the text of the current word or comment (without the {@code #})
	 */
	String getText() {
		return text.toString();
	}

	int getTokenLine() {
		return tokenLine;
	}

	int getTokenColumn() {
		return tokenColumn;
	}

	String getSourceDescription() {
		return sourceDescription;
	}

	private LexerException lexerException(String msg, int errorLine, int errorColumn) {
		return new LexerException(msg, sourceDescription, errorLine, errorColumn);
	}

	/**
	 * Advances to the next token.
	 *
	 * @return the new current token
	 * @throws IOException when the reader fails
	 */
	Token lexer() throws IOException {
		// clear blanks and line continuations
		while (c == ' ' || c == '\t' || (c == '\\' && ahead == '\n')) {
			if (c == '\\') {
				read();
			}
			read();
		}
		text.setLength(0);
		tokenLine = line;
		tokenColumn = column;
		token = scan();
		if (LOG.isTraceEnabled()) {
			LOG.trace("{} {} {}", ShLogger.position(sourceDescription, tokenLine, tokenColumn), token, text);
		}
		return token;
	}

	private Token scan() throws IOException {
		if (c < 0) {
			return Token.EOF;
		}
		switch (c) {
		case '#':
			read();
			while (c >= 0 && c != '\n') {
				text.append((char) c);
				read();
			}
			return Token.COMMENT;
		case '\n':
			read();
			return Token.NEWLINE;
		case ';':
			read();
			return Token.SEMICOLON;
		case '(':
			read();
			return Token.OPEN_PAREN;
		case ')':
			read();
			return Token.CLOSE_PAREN;
		case '{':
			read();
			return Token.OPEN_BRACE;
		case '}':
			read();
			return Token.CLOSE_BRACE;
		case '&':
			read();
			if (c == '&') {
				read();
				return Token.AND;
			}
			throw lexerException("Unsupported operator &, use && to chain commands", tokenLine, tokenColumn);
		case '|':
			read();
			if (c == '|') {
				read();
				return Token.OR;
			}
			return Token.PIPE;
		case '>':
			read();
			if (c == '>') {
				read();
				return Token.APPEND;
			}
			return Token.GT;
		case '<':
			read();
			return Token.LT;
		default:
			readWord();
			return Token.WORD;
		}
	}

	private static boolean isWordBreak(int ch) {
		switch (ch) {
		case ' ':
		case '\t':
		case '\n':
		case ';':
		case '&':
		case '|':
		case '<':
		case '>':
		case '(':
		case ')':
			return true;
		default:
			return ch < 0;
		}
	}

	/**
	 * Reads a word, made of plain characters and quoted spans, as is.
	 *
	 * @throws IOException
	 */
	private void readWord() throws IOException {
		while (!isWordBreak(c)) {
			if (c == '\'' || c == '"') {
				readQuoted();
			} else if (c == '\\') {
				if (ahead == '\n') {
					// line continuation separates words
					return;
				}
				text.append('\\');
				read();
				if (c >= 0) {
					text.append((char) c);
					read();
				}
			} else {
				text.append((char) c);
				read();
			}
		}
	}

	/**
	 * Reads a quoted span, quotes included. Only double-quoted spans know
	 * about backslashes, so that {@code "a\"b"} is read in full.
	 *
	 * @throws IOException
	 */
	private void readQuoted() throws IOException {
		int quote = c;
		int startLine = line;
		int startColumn = column;
		text.append((char) quote);
		read();
		while (c >= 0 && c != quote) {
			if (c == '\\' && quote == '"') {
				text.append('\\');
				read();
				if (c < 0) {
					break;
				}
			}
			text.append((char) c);
			read();
		}
		if (c < 0) {
			throw lexerException("Unterminated quoted string: " + text, startLine, startColumn);
		}
		text.append((char) quote);
		read();
	}
}
