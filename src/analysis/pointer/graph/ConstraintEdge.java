package analysis.pointer.graph;

import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Copy edge of the constraint graph. Points-to information flows from the source to the target: for every offset k in
 * the weights, shift(solution(from), k) is included in solution(to). The same edge object is reachable from the
 * successors of the source and the predecessors of the target.
 */
public final class ConstraintEdge {

    private final int from;
    private final int to;
    private final MutableSparseIntSet weights = MutableSparseIntSet.makeEmpty();

    ConstraintEdge(int from, int to) {
        this.from = from;
        this.to = to;
    }

    public int getFrom() {
        return this.from;
    }

    public int getTo() {
        return this.to;
    }

    public IntSet getWeights() {
        return this.weights;
    }

    /**
     * @return true if the weight was not already present
     */
    boolean addWeight(int weight) {
        return this.weights.add(weight);
    }

    boolean addWeights(IntSet other) {
        return this.weights.addAll(other);
    }

    boolean removeWeight(int weight) {
        return this.weights.remove(weight);
    }

    /**
     * @return true if the only weight of this edge is 0
     */
    public boolean isZeroWeightOnly() {
        return this.weights.size() == 1 && this.weights.contains(0);
    }

    public boolean hasZeroWeight() {
        return this.weights.contains(0);
    }

    @Override
    public String toString() {
        return this.from + " -> " + this.to + " " + this.weights;
    }
}
