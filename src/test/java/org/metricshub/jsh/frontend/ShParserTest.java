package org.metricshub.jsh.frontend;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jsh.ShTestSupport;
import org.metricshub.jsh.frontend.ast.Program;

/**
 * Every spelling of each construct must parse to the same syntax tree.
 */
@RunWith(Parameterized.class)
public class ShParserTest {

	@Parameter(0)
	public String script;

	@Parameter(1)
	public Program expected;

	/**
	 * @return one parameter set per spelling: the script and its expected tree
	 */
	@Parameters(name = "{index}: {0}")
	public static Iterable<Object[]> spellings() {
		List<Object[]> parameters = new ArrayList<Object[]>();
		for (ShTestSupport.Case c : ShTestSupport.cases()) {
			for (String spelling : c.getSpellings()) {
				parameters.add(new Object[] { spelling, c.getTree() });
			}
		}
		return parameters;
	}

	@Test
	public void parsesToExpectedTree() throws Exception {
		Program actual = ShTestSupport.parse(script);
		assertEquals("AST mismatch in " + script, expected, actual);
	}
}
