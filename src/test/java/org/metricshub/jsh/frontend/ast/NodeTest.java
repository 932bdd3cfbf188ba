package org.metricshub.jsh.frontend.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsh.ShTestSupport.block;
import static org.metricshub.jsh.ShTestSupport.cmd;
import static org.metricshub.jsh.ShTestSupport.elif;
import static org.metricshub.jsh.ShTestSupport.lit;
import static org.metricshub.jsh.ShTestSupport.lits;
import static org.metricshub.jsh.ShTestSupport.redirect;
import static org.metricshub.jsh.ShTestSupport.subshell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class NodeTest {

	@Test
	public void structuralEquality() {
		assertEquals(cmd("a", "b"), cmd("a", "b"));
		assertEquals(cmd("a", "b").hashCode(), cmd("a", "b").hashCode());
		assertNotEquals(cmd("a", "b"), cmd("b", "a"));
		assertNotEquals(lit("a"), new Comment("a"));
		assertNotEquals("Same statements in different groupings", subshell(cmd("a")), block(cmd("a")));
		assertNotEquals(new Program(Arrays.asList(cmd("a"))), block(cmd("a")));
		assertEquals(
				new IfStatement(cmd("a"), Arrays.asList(cmd("b"))),
				new IfStatement(cmd("a"), Arrays.asList(cmd("b")), null, Collections.<Node>emptyList()));
	}

	@Test
	public void listsAreDefensiveCopies() {
		List<Node> args = new ArrayList<Node>(lits("a", "b"));
		Command command = new Command(args);
		args.add(lit("c"));
		assertEquals(2, command.getArgs().size());
		assertThrows(UnsupportedOperationException.class, () -> command.getArgs().add(lit("d")));
		assertThrows(UnsupportedOperationException.class, () -> block(cmd("a")).getStatements().clear());
	}

	@Test
	public void invalidConstructions() {
		assertThrows(IllegalArgumentException.class, () -> new Literal(null));
		assertThrows(IllegalArgumentException.class, () -> new Comment("two\nlines"));
		assertThrows(IllegalArgumentException.class, () -> new Command(Collections.<Node>emptyList()));
		assertThrows(IllegalArgumentException.class, () -> new Command(Arrays.<Node>asList(lit("a"), block(cmd("b")))));
		assertThrows(IllegalArgumentException.class, () -> new Redirect("2>", lit("a")));
		assertThrows(IllegalArgumentException.class, () -> new BinaryExpr("&", cmd("a"), cmd("b")));
		assertThrows(IllegalArgumentException.class, () -> new BinaryExpr("&&", cmd("a"), null));
		assertThrows(IllegalArgumentException.class, () -> new Block(Arrays.<Node>asList(cmd("a"), null)));
		assertThrows(IllegalArgumentException.class, () -> new FuncDecl(lit("f"), null));
	}

	@Test
	public void renderSingleNodes() {
		assertEquals(">a", redirect(">", "a").render());
		assertEquals(">>'log file'", redirect(">>", "'log file'").render());
		assertEquals("'x y'", lit("'x y'").render());
		assertEquals("# note", new Comment(" note").render());
		assertEquals("elif b; then c; ", elif(cmd("b"), cmd("c")).render());
		assertEquals("( a; b; )", subshell(cmd("a"), cmd("b")).render());
		assertEquals("f() { }", new FuncDecl(lit("f"), block()).render());
		assertEquals("", Program.EMPTY.render());
	}

	@Test
	public void longChainEqualityAndHash() {
		Node a = cmd("a");
		Node b = cmd("a");
		for (int i = 0; i < 50000; i++) {
			a = new BinaryExpr(BinaryExpr.AND, cmd("c" + i), a);
			b = new BinaryExpr(BinaryExpr.AND, cmd("c" + i), b);
		}
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, new BinaryExpr(BinaryExpr.OR, cmd("x"), b));
		assertNotEquals(new BinaryExpr(BinaryExpr.AND, cmd("x"), a), new BinaryExpr(BinaryExpr.AND, cmd("x"), cmd("a")));
	}

	@Test
	public void renderCommentsBeforeClosingWords() {
		IfStatement ifStatement = new IfStatement(
				cmd("a"),
				Arrays.<Node>asList(new Comment(" then")),
				null,
				Arrays.<Node>asList(cmd("b"), new Comment(" else")));
		assertEquals("if a; then # then\nelse b; # else\nfi", ifStatement.render());
		assertTrue(ifStatement.getElifClauses().isEmpty());
	}
}
