package org.metricshub.jsh.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import org.junit.Test;
import org.metricshub.jsh.frontend.ShParser;
import org.metricshub.jsh.frontend.ast.ParserException;

public class ShLoggerTest {

	@Test
	public void position() {
		assertEquals("build.sh:12:5", ShLogger.position("build.sh", 12, 5));
	}

	@Test
	public void errorMessagesUseThePositionNotation() {
		ParserException e = assertThrows(
				ParserException.class,
				() -> new ShParser(new ScriptSource("deploy.sh", new StringReader("a\n  ( b")), new ShSettings()).parse());
		assertTrue(
				e.getMessage(),
				e.getMessage().endsWith("(" + ShLogger.position("deploy.sh", e.getLineNumber(), e.getColumnNumber()) + ")"));
	}

	@Test
	public void loggerIsNamedAfterTheClass() {
		assertEquals(ShParser.class.getName(), ShLogger.getLogger(ShParser.class).getName());
	}
}
