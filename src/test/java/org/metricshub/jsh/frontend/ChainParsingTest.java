package org.metricshub.jsh.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsh.ShTestSupport.binary;
import static org.metricshub.jsh.ShTestSupport.cmd;
import static org.metricshub.jsh.ShTestSupport.parse;
import static org.metricshub.jsh.ShTestSupport.prog;
import static org.metricshub.jsh.ShTestSupport.subshell;

import org.junit.Test;
import org.metricshub.jsh.frontend.ast.BinaryExpr;
import org.metricshub.jsh.frontend.ast.Command;
import org.metricshub.jsh.frontend.ast.Node;

/**
 * {@code &&}, {@code ||} and {@code |} chain to the right and bind equally.
 */
public class ChainParsingTest {

	@Test
	public void pipeDoesNotBindTighterThanAnd() throws Exception {
		assertEquals(
				prog(binary("|", cmd("a"), binary("&&", cmd("b"), cmd("c")))),
				parse("a | b && c"));
		assertEquals(
				prog(binary("&&", cmd("a"), binary("|", cmd("b"), cmd("c")))),
				parse("a && b | c"));
	}

	@Test
	public void longChainsLeanRight() throws Exception {
		String[] operators = { "&&", "||", "|", "||", "&&", "|" };
		StringBuilder script = new StringBuilder("c0");
		for (int i = 0; i < operators.length; i++) {
			script.append(' ').append(operators[i]).append(" c").append(i + 1);
		}

		Node node = parse(script.toString()).getStatements().get(0);
		for (int i = 0; i < operators.length; i++) {
			assertTrue("link " + i + " must be a binary expression", node instanceof BinaryExpr);
			BinaryExpr expr = (BinaryExpr) node;
			assertEquals(operators[i], expr.getOperator());
			assertEquals(cmd("c" + i), expr.getLeft());
			node = expr.getRight();
		}
		assertEquals(cmd("c" + operators.length), node);
	}

	@Test
	public void veryLongChains() throws Exception {
		int links = 50000;
		StringBuilder script = new StringBuilder("a");
		for (int i = 0; i < links; i++) {
			script.append(i % 3 == 0 ? " && " : i % 3 == 1 ? " || " : " | ").append('a');
		}

		Node node = parse(script.toString()).getStatements().get(0);
		int depth = 0;
		while (node instanceof BinaryExpr) {
			BinaryExpr expr = (BinaryExpr) node;
			assertEquals(cmd("a"), expr.getLeft());
			node = expr.getRight();
			depth++;
		}
		assertEquals(links, depth);
		assertEquals(script.toString(), parse(script.toString()).render());
		assertEquals(parse(script.toString()), parse(script.toString()));
	}

	@Test
	public void compoundCommandsInChains() throws Exception {
		assertEquals(
				prog(binary("||", subshell(cmd("a")), binary("|", cmd("b", "x"), subshell(cmd("c"))))),
				parse("(a) || b x | (c)"));
	}

	@Test
	public void chainIsOneStatement() throws Exception {
		assertEquals(2, parse("a && b; c || d").getStatements().size());
		assertTrue(parse("a && b").getStatements().get(0) instanceof BinaryExpr);
		assertTrue(parse("a b").getStatements().get(0) instanceof Command);
	}

	@Test
	public void renderHasNoParentheses() throws Exception {
		assertEquals("a | b && c || d", parse("a|b&&c||d").render());
		// a left-leaning tree can only be built by hand, and is printed the same way
		assertEquals("a && b || c", binary("||", binary("&&", cmd("a"), cmd("b")), cmd("c")).render());
	}
}
