package org.metricshub.jsh.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import org.junit.Test;
import org.metricshub.jsh.frontend.ast.LexerException;
import org.metricshub.jsh.frontend.ast.ParserException;
import org.metricshub.jsh.util.ScriptSource;
import org.metricshub.jsh.util.ShSettings;

public class ShParserErrorTest {

	private static ParserException parseError(String script) {
		return assertThrows(
				"Parsing must fail: " + script,
				ParserException.class,
				() -> new ShParser(new ScriptSource("test.sh", new StringReader(script)), new ShSettings()).parse());
	}

	private static ParserException syntaxError(String script) {
		ParserException e = parseError(script);
		assertEquals("Must be a syntax error, not a lexical one: " + e.getMessage(), ParserException.class, e.getClass());
		return e;
	}

	private static LexerException lexicalError(String script) {
		ParserException e = parseError(script);
		assertTrue("Must be a lexical error: " + e.getMessage(), e instanceof LexerException);
		return (LexerException) e;
	}

	private static void assertMessageContains(ParserException e, String... parts) {
		for (String part : parts) {
			assertTrue("'" + e.getMessage() + "' must contain '" + part + "'", e.getMessage().contains(part));
		}
	}

	@Test
	public void unterminatedSingleQuote() {
		LexerException e = lexicalError("echo 'unterminated");
		assertEquals("test.sh", e.getSourceDescription());
		assertEquals(1, e.getLineNumber());
		assertEquals(6, e.getColumnNumber());
		assertMessageContains(e, "Unterminated", "(test.sh:1:6)");
	}

	@Test
	public void unterminatedDoubleQuote() {
		LexerException e = lexicalError("echo ok\necho \"abc\\\" def\n");
		assertEquals(2, e.getLineNumber());
		assertEquals(6, e.getColumnNumber());
	}

	@Test
	public void unterminatedQuoteInsideWord() {
		lexicalError("foo a'b");
	}

	@Test
	public void singleAmpersand() {
		LexerException e = lexicalError("sleep 1 & wait");
		assertEquals(9, e.getColumnNumber());
	}

	@Test
	public void missingFi() {
		ParserException e = syntaxError("if a; then b");
		assertMessageContains(e, "Unclosed if", "line 1, column 1", "'fi'");
		assertEquals("test.sh", e.getSourceDescription());
	}

	@Test
	public void missingFiReportsWhereIfWasOpened() {
		ParserException e = syntaxError("foo\n  if a; then b\n");
		assertMessageContains(e, "Unclosed if opened at line 2, column 3");
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void missingThen() {
		assertMessageContains(syntaxError("if a; b; fi"), "'then'", "Found: 'b'");
		assertMessageContains(syntaxError("if a"), "Unclosed if", "'then'");
		assertMessageContains(syntaxError("if a; then b; elif c; fi"), "'then'");
	}

	@Test
	public void conditionNeedsSeparator() {
		// then, b and fi are arguments of a
		assertMessageContains(syntaxError("if a then b fi"), "Unclosed if", "'then'");
	}

	@Test
	public void missingDone() {
		assertMessageContains(syntaxError("while a; do b"), "Unclosed while", "'done'");
		assertMessageContains(syntaxError("while a; b; done"), "'do'");
	}

	@Test
	public void unclosedBrackets() {
		assertMessageContains(syntaxError("( foo"), "Unclosed '('", "line 1, column 1");
		assertMessageContains(syntaxError("x\n{ foo;"), "Unclosed '{'", "line 2, column 1");
		assertMessageContains(syntaxError("{ foo )"), "Expecting '}'", "Found: ')'");
	}

	@Test
	public void ifClosedByBracket() {
		assertMessageContains(syntaxError("{ if a; then b; }"), "Expecting 'fi'", "Found: '}'");
	}

	@Test
	public void unexpectedClosingBracket() {
		assertMessageContains(syntaxError("foo; )"), "Unexpected ')'");
		assertMessageContains(syntaxError("}"), "Unexpected '}'");
	}

	@Test
	public void missingCommand() {
		assertMessageContains(syntaxError("foo &&"), "Expecting a command", "end of input");
		assertMessageContains(syntaxError("| foo"), "Expecting a command", "'|'");
		assertMessageContains(syntaxError("foo || ;"), "Expecting a command", "';'");
	}

	@Test
	public void missingRedirectTarget() {
		assertMessageContains(syntaxError("foo >"), "Expecting a word after '>'");
		assertMessageContains(syntaxError("foo >> ;"), "Expecting a word after '>>'");
		assertMessageContains(syntaxError("foo < (a)"), "Expecting a word after '<'");
	}

	@Test
	public void badFunctionDeclarations() {
		assertMessageContains(syntaxError("foo(x) { a; }"), "Expecting ')'");
		assertMessageContains(syntaxError("foo() bar"), "Expecting '{'", "function foo");
		assertMessageContains(syntaxError("foo()"), "Expecting '{'", "end of input");
	}

	@Test
	public void statementsNeedSeparators() {
		assertMessageContains(syntaxError("(foo) bar"), "Expecting ; or newline after statement", "'bar'");
		assertMessageContains(syntaxError("if a; then b; fi c"), "Expecting ; or newline after statement");
		assertMessageContains(syntaxError("echo a (b)"), "Found: '('");
	}

	@Test
	public void parserIsSingleUse() throws Exception {
		ShParser parser = new ShParser(new ScriptSource("test.sh", new StringReader("foo")), new ShSettings());
		parser.parse();
		assertThrows(IllegalStateException.class, parser::parse);
	}
}
