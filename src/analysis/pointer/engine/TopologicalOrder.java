package analysis.pointer.engine;

import java.util.ArrayDeque;
import java.util.List;

import analysis.pointer.graph.ConstraintEdge;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.VariableTable;

import com.ibm.wala.util.intset.BitVectorIntSet;

/**
 * Topological order of the representative nodes of the constraint graph: reverse post-order of a depth first search
 * started from each unvisited representative in increasing id order. If the graph has cycles (e.g., through non-zero
 * weight edges) the order is a topological order of its components.
 */
public final class TopologicalOrder {

    private TopologicalOrder() {
        // static methods only
    }

    /**
     * @return the representatives of the graph, sources first
     */
    public static int[] compute(VariableTable vars, ConstraintGraph graph) {
        int size = vars.size();
        BitVectorIntSet visited = new BitVectorIntSet();
        int[] postOrder = new int[size];
        int count = 0;

        ArrayDeque<Integer> nodes = new ArrayDeque<>();
        ArrayDeque<List<ConstraintEdge>> succs = new ArrayDeque<>();
        ArrayDeque<int[]> positions = new ArrayDeque<>();
        for (int i = 0; i < size; i++) {
            if (visited.contains(i) || !vars.isRepresentative(i)) {
                continue;
            }
            visited.add(i);
            nodes.push(i);
            succs.push(graph.getSuccessors(i));
            positions.push(new int[] { 0 });
            while (!nodes.isEmpty()) {
                List<ConstraintEdge> out = succs.peek();
                int[] pos = positions.peek();
                boolean descended = false;
                while (pos[0] < out.size()) {
                    int w = out.get(pos[0]++).getTo();
                    if (!visited.contains(w)) {
                        visited.add(w);
                        nodes.push(w);
                        succs.push(graph.getSuccessors(w));
                        positions.push(new int[] { 0 });
                        descended = true;
                        break;
                    }
                }
                if (!descended) {
                    postOrder[count++] = nodes.pop();
                    succs.pop();
                    positions.pop();
                }
            }
        }

        int[] order = new int[count];
        for (int i = 0; i < count; i++) {
            order[i] = postOrder[count - 1 - i];
        }
        return order;
    }
}
