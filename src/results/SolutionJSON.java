package results;

import java.io.IOException;
import java.io.Writer;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.pointer.engine.SolverStatistics;
import analysis.pointer.graph.ConstraintVariable;

import com.ibm.wala.util.intset.IntIterator;

/**
 * Serialization of a {@link PointsToSolution} to JSON
 */
public class SolutionJSON {

    /**
     * Serialize the solution
     *
     * @param solution solution to serialize
     * @return {@link JSONObject} with a "variables" array and a "statistics" object
     */
    public static JSONObject toJSON(PointsToSolution solution) {
        JSONObject json = new JSONObject();
        try {
            JSONArray variables = new JSONArray();
            for (ConstraintVariable v : solution.getVariableTable()) {
                variables.put(toJSON(solution, v));
            }
            json.put("variables", variables);
            json.put("statistics", toJSON(solution.getStatistics()));
        }
        catch (JSONException e) {
            System.err.println("Serialization error for points-to solution, message: " + e.getMessage());
        }
        return json;
    }

    private static JSONObject toJSON(PointsToSolution solution, ConstraintVariable v) {
        JSONObject json = new JSONObject();
        try {
            json.put("id", v.getId());
            json.put("name", v.getName());
            json.put("representative", solution.getRepresentative(v.getId()));
            json.put("unknown", solution.queryPointsTo(v.getId()).isUnknown());
            JSONArray pointsTo = new JSONArray();
            IntIterator iter = solution.getSolution(v.getId()).intIterator();
            while (iter.hasNext()) {
                pointsTo.put(solution.getName(iter.next()));
            }
            json.put("pointsTo", pointsTo);
        }
        catch (JSONException e) {
            System.err.println("Serialization error for " + v.getName() + ", message: " + e.getMessage());
        }
        return json;
    }

    private static JSONObject toJSON(SolverStatistics stats) {
        JSONObject json = new JSONObject();
        try {
            json.put("totalVars", stats.getTotalVars());
            json.put("constraints", stats.getNumConstraints());
            json.put("staticallyUnifiedVars", stats.getUnifiedVarsStatic());
            json.put("collapsedVars", stats.getCollapsedVars());
            json.put("dynamicallyUnifiedVars", stats.getUnifiedVarsDynamic());
            json.put("iterations", stats.getIterations());
            json.put("initialEdges", stats.getInitialEdges());
        }
        catch (JSONException e) {
            System.err.println("Serialization error for statistics, message: " + e.getMessage());
        }
        return json;
    }

    /**
     * Write the JSON for the solution
     *
     * @param solution solution to serialize
     * @param out where to write the JSON
     * @param indent number of spaces to indent each level
     * @throws IOException if the writer fails
     */
    public static void writeJSON(PointsToSolution solution, Writer out, int indent) throws IOException {
        try {
            toJSON(solution).write(out, indent, 0);
        }
        catch (JSONException e) {
            throw new IOException("Could not write points-to solution", e);
        }
        out.flush();
    }
}
