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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jsh.frontend.ast.BinaryExpr;
import org.metricshub.jsh.frontend.ast.Block;
import org.metricshub.jsh.frontend.ast.Command;
import org.metricshub.jsh.frontend.ast.Comment;
import org.metricshub.jsh.frontend.ast.ElifClause;
import org.metricshub.jsh.frontend.ast.FuncDecl;
import org.metricshub.jsh.frontend.ast.IfStatement;
import org.metricshub.jsh.frontend.ast.Literal;
import org.metricshub.jsh.frontend.ast.Node;
import org.metricshub.jsh.frontend.ast.ParserException;
import org.metricshub.jsh.frontend.ast.Program;
import org.metricshub.jsh.frontend.ast.Redirect;
import org.metricshub.jsh.frontend.ast.Subshell;
import org.metricshub.jsh.frontend.ast.WhileStatement;
import org.metricshub.jsh.util.ScriptSource;
import org.metricshub.jsh.util.ShLogger;
import org.metricshub.jsh.util.ShSettings;
import org.slf4j.Logger;

/**
 * Converts a shell script into a syntax tree ({@link Program}), by recursive
 * descent over the tokens of {@link ShLexer}.
 * <p>
 * {@code &&}, {@code ||} and {@code |} all bind equally and chain to the
 * right: {@code a | b && c} is parsed as {@code |(a, &&(b, c))}.
 * <p>
 * Reserved words ({@code if}, {@code then}, {@code fi}, ...) are recognized
 * only where a command name is expected, and a list of statements only stops
 * at the reserved words that close its own construct. Elsewhere they are
 * plain words.
 * <p>
 * An instance parses a single source. The first error stops the parse with a
 * {@link ParserException} (or its subclass
 * {@link org.metricshub.jsh.frontend.ast.LexerException}); there is no
 * recovery.
 */
public class ShParser {

	private static final Logger LOG = ShLogger.getLogger(ShParser.class);

	private static final Set<String> NO_RESERVED_WORDS = Collections.emptySet();
	private static final Set<String> THEN_BRANCH_END = reservedWords("elif", "else", "fi");
	private static final Set<String> DO_BRANCH_END = reservedWords("done");

	private static Set<String> reservedWords(String... words) {
		return Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(words)));
	}

	private final ShLexer lexer;
	private final boolean keepComments;
	private Token token;

	/**
	 * Creates a parser for the specified script.
	 *
	 * @param scriptSource the script to parse; its reader is not closed
	 * @param settings parse settings
	 */
	public ShParser(ScriptSource scriptSource, ShSettings settings) {
		if (scriptSource == null) {
			throw new IllegalArgumentException("No script source supplied");
		}
		this.lexer = new ShLexer(scriptSource);
		this.keepComments = settings == null || settings.isKeepComments();
	}

	/**
	 * Parse the script. Build and return the root of the syntax tree.
	 *
	 * @return the syntax tree of the script
	 * @throws IOException upon an IO error of the script reader
	 * @throws ParserException when the script is not valid
	 */
	public Program parse() throws IOException {
		if (token != null) {
			throw new IllegalStateException("A parser instance can only be used once");
		}
		token = lexer.start();
		Program program = PROGRAM();
		LOG.debug("Parsed {} top-level statement(s) from {}", program.getStatements().size(), lexer.getSourceDescription());
		return program;
	}

	private Token lexer() throws IOException {
		token = lexer.lexer();
		return token;
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, lexer.getSourceDescription(), lexer.getTokenLine(), lexer.getTokenColumn());
	}

	private String found() {
		switch (token) {
		case WORD:
			return "'" + lexer.getText() + "'";
		case COMMENT:
		case EOF:
		case NEWLINE:
			return token.getSymbol();
		default:
			return "'" + token.getSymbol() + "'";
		}
	}

	private static String at(int line, int column) {
		return "line " + line + ", column " + column;
	}

	private boolean isReservedWord(String word) {
		return token == Token.WORD && word.equals(lexer.getText());
	}

	private boolean isAnyReservedWord(Set<String> words) {
		return token == Token.WORD && words.contains(lexer.getText());
	}

	// SUPPORTING FUNCTIONS/METHODS

	/**
	 * Skips {@code ;} and newlines, but stops at comments which are
	 * statements on their own.
	 */
	private void optSeparators() throws IOException {
		while (token.isSeparator()) {
			lexer();
		}
	}

	/**
	 * Skips at least one {@code ;} or newline, in a place where there cannot
	 * be any statement (before {@code then} or {@code do}). Comments found
	 * there are dropped.
	 *
	 * @param what what is expected after the separator, for the error message
	 * @param construct the construct being parsed, for the error message
	 */
	private void separators(String what, String construct, int openLine, int openColumn) throws IOException {
		int count = 0;
		while (token.isSeparator() || token == Token.COMMENT) {
			if (token == Token.COMMENT) {
				dropComment();
			} else {
				count++;
			}
			lexer();
		}
		if (count == 0 && token == Token.EOF) {
			throw parserException(
					"Unclosed " + construct + " opened at " + at(openLine, openColumn)
							+ ": expecting '" + what + "' before end of input");
		}
		if (count == 0) {
			throw parserException("Expecting ; or newline before '" + what + "'. Found: " + found());
		}
	}

	/**
	 * Skips the newlines allowed after an operator or after {@code if},
	 * {@code elif} and {@code while} (and the comments on these lines, which
	 * are dropped).
	 */
	private void optNewlines() throws IOException {
		while (token == Token.NEWLINE || token == Token.COMMENT) {
			if (token == Token.COMMENT) {
				dropComment();
			}
			lexer();
		}
	}

	private void dropComment() {
		LOG.debug(
				"Dropping comment at {}, comments are not allowed there",
				ShLogger.position(lexer.getSourceDescription(), lexer.getTokenLine(), lexer.getTokenColumn()));
	}

	/**
	 * A statement must be followed by a separator, a comment or the end of
	 * the enclosing construct: a closing bracket, or one of the reserved
	 * words that close the current list.
	 */
	private void endOfStatement(Set<String> closingWords) {
		if (isAnyReservedWord(closingWords)) {
			return;
		}
		switch (token) {
		case SEMICOLON:
		case NEWLINE:
		case COMMENT:
		case EOF:
		case CLOSE_PAREN:
		case CLOSE_BRACE:
			return;
		default:
			throw parserException("Expecting ; or newline after statement. Found: " + found());
		}
	}

	/**
	 * Consumes the reserved word that closes a construct.
	 */
	private void closingWord(String word, String construct, int openLine, int openColumn) throws IOException {
		if (token == Token.EOF) {
			throw parserException(
					"Unclosed " + construct + " opened at " + at(openLine, openColumn)
							+ ": expecting '" + word + "' before end of input");
		}
		if (!isReservedWord(word)) {
			throw parserException(
					"Expecting '" + word + "' in " + construct + " opened at " + at(openLine, openColumn)
							+ ". Found: " + found());
		}
		lexer();
	}

	/**
	 * Consumes the bracket that closes a construct.
	 */
	private void closingToken(Token expected, int openLine, int openColumn) throws IOException {
		if (token == Token.EOF) {
			throw parserException(
					"Unclosed '" + (expected == Token.CLOSE_PAREN ? "(" : "{") + "' opened at " + at(openLine, openColumn)
							+ ": expecting '" + expected.getSymbol() + "' before end of input");
		}
		if (token != expected) {
			throw parserException("Expecting '" + expected.getSymbol() + "'. Found: " + found());
		}
		lexer();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : STATEMENT_LIST Token.EOF
	Program PROGRAM() throws IOException {
		List<Node> statements = STATEMENT_LIST(NO_RESERVED_WORDS);
		if (token != Token.EOF) {
			throw parserException("Unexpected " + found());
		}
		return new Program(statements);
	}

	// STATEMENT_LIST : [separators] [ STATEMENT [separators] ]*
	// stops at the end of input, at a closing bracket, or at one of the closing reserved words;
	// the caller checks that it is the expected one
	List<Node> STATEMENT_LIST(Set<String> closingWords) throws IOException {
		List<Node> statements = new ArrayList<Node>();
		optSeparators();
		while (token != Token.EOF
				&& token != Token.CLOSE_PAREN
				&& token != Token.CLOSE_BRACE
				&& !isAnyReservedWord(closingWords)) {
			if (token == Token.COMMENT) {
				if (keepComments) {
					statements.add(new Comment(lexer.getText()));
				}
				lexer();
			} else {
				statements.add(CHAIN());
				endOfStatement(closingWords);
			}
			optSeparators();
		}
		return statements;
	}

	// CHAIN : UNIT [ ( && | || | '|' ) [newlines] CHAIN ]
	// read in a loop and folded from the right, so that long chains do not exhaust the stack
	Node CHAIN() throws IOException {
		List<Node> units = new ArrayList<Node>();
		List<String> operators = new ArrayList<String>();
		units.add(UNIT());
		while (token.isCombinator()) {
			operators.add(token.getSymbol());
			lexer();
			optNewlines();
			units.add(UNIT());
		}
		Node chain = units.get(units.size() - 1);
		for (int i = operators.size() - 1; i >= 0; i--) {
			chain = new BinaryExpr(operators.get(i), units.get(i), chain);
		}
		return chain;
	}

	// UNIT : SUBSHELL | BLOCK | IF_STATEMENT | WHILE_STATEMENT | COMMAND | FUNC_DECL
	Node UNIT() throws IOException {
		if (token == Token.OPEN_PAREN) {
			return SUBSHELL();
		} else if (token == Token.OPEN_BRACE) {
			return BLOCK();
		} else if (isReservedWord("if")) {
			return IF_STATEMENT();
		} else if (isReservedWord("while")) {
			return WHILE_STATEMENT();
		} else if (token == Token.WORD || token.isRedirection()) {
			return COMMAND();
		} else {
			throw parserException("Expecting a command. Found: " + found());
		}
	}

	// COMMAND : ( WORD | REDIRECT )+
	// a single word followed by '(' is the name of a function definition
	Node COMMAND() throws IOException {
		List<Node> args = new ArrayList<Node>();
		while (true) {
			if (token == Token.WORD) {
				Literal word = new Literal(lexer.getText());
				lexer();
				if (args.isEmpty() && token == Token.OPEN_PAREN) {
					return FUNC_DECL(word);
				}
				args.add(word);
			} else if (token.isRedirection()) {
				args.add(REDIRECT());
			} else {
				break;
			}
		}
		return new Command(args);
	}

	// REDIRECT : ( > | >> | < ) WORD
	Node REDIRECT() throws IOException {
		String op = token.getSymbol();
		lexer();
		if (token != Token.WORD) {
			throw parserException("Expecting a word after '" + op + "'. Found: " + found());
		}
		Redirect redirect = new Redirect(op, new Literal(lexer.getText()));
		lexer();
		return redirect;
	}

	// FUNC_DECL : WORD ( ) [newlines] BLOCK
	Node FUNC_DECL(Literal name) throws IOException {
		lexer();
		if (token != Token.CLOSE_PAREN) {
			throw parserException("Expecting ')' after '" + name.getText() + " ('. Found: " + found());
		}
		lexer();
		optNewlines();
		if (token != Token.OPEN_BRACE) {
			throw parserException("Expecting '{' to start the body of function " + name.getText() + ". Found: " + found());
		}
		return new FuncDecl(name, BLOCK());
	}

	// SUBSHELL : ( STATEMENT_LIST )
	Node SUBSHELL() throws IOException {
		int openLine = lexer.getTokenLine();
		int openColumn = lexer.getTokenColumn();
		lexer();
		List<Node> statements = STATEMENT_LIST(NO_RESERVED_WORDS);
		closingToken(Token.CLOSE_PAREN, openLine, openColumn);
		return new Subshell(statements);
	}

	// BLOCK : { STATEMENT_LIST }
	Block BLOCK() throws IOException {
		int openLine = lexer.getTokenLine();
		int openColumn = lexer.getTokenColumn();
		lexer();
		List<Node> statements = STATEMENT_LIST(NO_RESERVED_WORDS);
		closingToken(Token.CLOSE_BRACE, openLine, openColumn);
		return new Block(statements);
	}

	// IF_STATEMENT : if CHAIN separators then STATEMENT_LIST
	// [ elif CHAIN separators then STATEMENT_LIST ]* [ else STATEMENT_LIST ] fi
	Node IF_STATEMENT() throws IOException {
		int openLine = lexer.getTokenLine();
		int openColumn = lexer.getTokenColumn();
		lexer();
		optNewlines();
		Node condition = CHAIN();
		separators("then", "if", openLine, openColumn);
		closingWord("then", "if", openLine, openColumn);
		List<Node> thenBranch = STATEMENT_LIST(THEN_BRANCH_END);

		List<ElifClause> elifClauses = new ArrayList<ElifClause>();
		while (isReservedWord("elif")) {
			lexer();
			optNewlines();
			Node elifCondition = CHAIN();
			separators("then", "if", openLine, openColumn);
			closingWord("then", "if", openLine, openColumn);
			elifClauses.add(new ElifClause(elifCondition, STATEMENT_LIST(THEN_BRANCH_END)));
		}

		List<Node> elseBranch = Collections.emptyList();
		if (isReservedWord("else")) {
			lexer();
			elseBranch = STATEMENT_LIST(THEN_BRANCH_END);
		}
		closingWord("fi", "if", openLine, openColumn);
		return new IfStatement(condition, thenBranch, elifClauses, elseBranch);
	}

	// WHILE_STATEMENT : while CHAIN separators do STATEMENT_LIST done
	Node WHILE_STATEMENT() throws IOException {
		int openLine = lexer.getTokenLine();
		int openColumn = lexer.getTokenColumn();
		lexer();
		optNewlines();
		Node condition = CHAIN();
		separators("do", "while", openLine, openColumn);
		closingWord("do", "while", openLine, openColumn);
		List<Node> doBranch = STATEMENT_LIST(DO_BRANCH_END);
		closingWord("done", "while", openLine, openColumn);
		return new WhileStatement(condition, doBranch);
	}
	// CHECKSTYLE.ON: MethodName
}
