package results;

import java.io.IOException;
import java.io.StringWriter;

import junit.framework.TestCase;

import org.json.JSONArray;
import org.json.JSONObject;

import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.engine.StructAliasAnalysis;
import analysis.pointer.registrar.ObjectDescriptor;

/**
 * Test the JSON output of a solution
 */
public class TestSolutionJSON extends TestCase {

    private static PointsToSolution solve() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int p = analysis.createVariable(ObjectDescriptor.scalar("p", 64));
        int a = analysis.createVariable(ObjectDescriptor.scalar("a", 64));
        analysis.createVariable(ObjectDescriptor.scalar("g", 64).asGlobal());
        analysis.emitConstraint(ConstraintExpression.scalar(p), ConstraintExpression.addressOf(a));
        return analysis.run();
    }

    public static void testVariables() {
        PointsToSolution solution = solve();
        JSONObject json = SolutionJSON.toJSON(solution);

        JSONArray variables = json.getJSONArray("variables");
        assertEquals(solution.numVariables(), variables.length());

        JSONObject p = variables.getJSONObject(solution.findVariable("p"));
        assertEquals("p", p.getString("name"));
        assertEquals(solution.findVariable("p"), p.getInt("id"));
        assertEquals(solution.getRepresentative(p.getInt("id")), p.getInt("representative"));
        assertFalse(p.getBoolean("unknown"));
        assertEquals(1, p.getJSONArray("pointsTo").length());
        assertEquals("a", p.getJSONArray("pointsTo").getString(0));

        JSONObject g = variables.getJSONObject(solution.findVariable("g"));
        assertTrue(g.getBoolean("unknown"));
        assertEquals("ANYTHING", g.getJSONArray("pointsTo").getString(0));
    }

    public static void testStatistics() {
        PointsToSolution solution = solve();
        JSONObject stats = SolutionJSON.toJSON(solution).getJSONObject("statistics");
        assertEquals(solution.numVariables(), stats.getInt("totalVars"));
        assertEquals(solution.getStatistics().getNumConstraints(), stats.getInt("constraints"));
        assertEquals(solution.getStatistics().getIterations(), stats.getInt("iterations"));
        assertTrue(stats.has("collapsedVars"));
        assertTrue(stats.has("initialEdges"));
    }

    public static void testWrite() throws IOException {
        PointsToSolution solution = solve();
        StringWriter out = new StringWriter();
        SolutionJSON.writeJSON(solution, out, 2);

        JSONObject parsed = new JSONObject(out.toString());
        assertEquals(solution.numVariables(), parsed.getJSONArray("variables").length());
        assertTrue(out.toString().contains("\n  \"variables\""));
    }
}
