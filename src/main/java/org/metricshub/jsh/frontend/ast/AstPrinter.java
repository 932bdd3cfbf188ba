package org.metricshub.jsh.frontend.ast;

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

import java.util.List;

/**
 * Serializes syntax tree nodes in the canonical shell syntax.
 * <p>
 * Each construct has exactly one canonical spelling, using single spaces and
 * {@code ;} terminators on a single line:
 * <ul>
 * <li>{@code foo a >out}
 * <li>{@code foo && bar || baz}
 * <li>{@code ( foo; )} and {@code { foo; bar; }}
 * <li>{@code if a; then b; elif c; then d; else e; fi}
 * <li>{@code while a; do b; done}
 * <li>{@code foo() { a; }}
 * </ul>
 * Comments run to the end of the line, so a comment is always followed by a
 * newline (instead of {@code ;}) when something comes after it.
 * <p>
 * Printing has no error path: any tree accepted by the node constructors can
 * be printed.
 */
public final class AstPrinter {

	private final StringBuilder out = new StringBuilder();

	private AstPrinter() {}

	/**
	 * Renders the specified node in the canonical syntax.
	 *
	 * @param node the node to render
	 * @return the canonical text
	 */
	public static String print(Node node) {
		AstPrinter printer = new AstPrinter();
		printer.node(node);
		return printer.out.toString();
	}

	private void node(Node node) {
		if (node instanceof Literal) {
			out.append(((Literal) node).getText());
		} else if (node instanceof Comment) {
			out.append('#').append(((Comment) node).getText());
		} else if (node instanceof Command) {
			command((Command) node);
		} else if (node instanceof Redirect) {
			Redirect redirect = (Redirect) node;
			out.append(redirect.getOp());
			node(redirect.getTarget());
		} else if (node instanceof BinaryExpr) {
			chain((BinaryExpr) node);
		} else if (node instanceof Subshell) {
			out.append("( ");
			terminatedList(((Subshell) node).getStatements());
			out.append(')');
		} else if (node instanceof Block) {
			out.append("{ ");
			terminatedList(((Block) node).getStatements());
			out.append('}');
		} else if (node instanceof IfStatement) {
			ifStatement((IfStatement) node);
		} else if (node instanceof ElifClause) {
			elifClause((ElifClause) node);
		} else if (node instanceof WhileStatement) {
			WhileStatement whileStatement = (WhileStatement) node;
			out.append("while ");
			node(whileStatement.getCondition());
			out.append("; do ");
			terminatedList(whileStatement.getDoBranch());
			out.append("done");
		} else if (node instanceof FuncDecl) {
			FuncDecl funcDecl = (FuncDecl) node;
			node(funcDecl.getName());
			out.append("() ");
			node(funcDecl.getBody());
		} else if (node instanceof Program) {
			program((Program) node);
		} else {
			// the node hierarchy is closed, see Node's constructor
			throw new IllegalStateException("Unknown node type: " + node.getClass().getName());
		}
	}

	private void command(Command command) {
		boolean first = true;
		for (Node arg : command.getArgs()) {
			if (!first) {
				out.append(' ');
			}
			node(arg);
			first = false;
		}
	}

	/**
	 * Chains can be very long, so their right spine is walked in a loop.
	 */
	private void chain(BinaryExpr expr) {
		Node link = expr;
		while (link instanceof BinaryExpr) {
			BinaryExpr binary = (BinaryExpr) link;
			node(binary.getLeft());
			out.append(' ').append(binary.getOperator()).append(' ');
			link = binary.getRight();
		}
		node(link);
	}

	private void ifStatement(IfStatement ifStatement) {
		out.append("if ");
		node(ifStatement.getCondition());
		out.append("; then ");
		terminatedList(ifStatement.getThenBranch());
		for (ElifClause elif : ifStatement.getElifClauses()) {
			elifClause(elif);
		}
		if (!ifStatement.getElseBranch().isEmpty()) {
			out.append("else ");
			terminatedList(ifStatement.getElseBranch());
		}
		out.append("fi");
	}

	private void elifClause(ElifClause elif) {
		out.append("elif ");
		node(elif.getCondition());
		out.append("; then ");
		terminatedList(elif.getThenBranch());
	}

	/**
	 * Statements of a compound command: each one is terminated, so that the
	 * closing keyword or bracket can follow directly.
	 */
	private void terminatedList(List<Node> statements) {
		for (Node statement : statements) {
			node(statement);
			if (statement instanceof Comment) {
				out.append('\n');
			} else {
				out.append("; ");
			}
		}
	}

	/**
	 * Top-level statements are separated, not terminated.
	 */
	private void program(Program program) {
		Node previous = null;
		for (Node statement : program.getStatements()) {
			if (previous instanceof Comment) {
				out.append('\n');
			} else if (previous != null) {
				out.append("; ");
			}
			node(statement);
			previous = statement;
		}
	}
}
