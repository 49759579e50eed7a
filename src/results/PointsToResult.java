package results;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;

/**
 * Answer to a points-to query: either a set of variable ids or unknown, meaning the variable may point to anything.
 */
public final class PointsToResult {

    /**
     * The variable may point to any object
     */
    public static final PointsToResult UNKNOWN = new PointsToResult(null);

    /**
     * Pointed-to variables, null if unknown
     */
    private final IntSet pointees;

    private PointsToResult(IntSet pointees) {
        this.pointees = pointees;
    }

    /**
     * Result for a known set of pointed-to variables. The set is copied.
     */
    public static PointsToResult of(IntSet pointees) {
        return new PointsToResult(new BitVectorIntSet(pointees));
    }

    public boolean isUnknown() {
        return this.pointees == null;
    }

    /**
     * @return the pointed-to variables
     * @throws IllegalStateException if the result is unknown
     */
    public IntSet getPointees() {
        if (isUnknown()) {
            throw new IllegalStateException("Unknown points-to set");
        }
        return this.pointees;
    }

    /**
     * Could the variable point to var? Always true for an unknown result.
     */
    public boolean mayPointTo(int var) {
        return isUnknown() || this.pointees.contains(var);
    }

    public int size() {
        return isUnknown() ? -1 : this.pointees.size();
    }

    @Override
    public int hashCode() {
        if (isUnknown()) {
            return 0;
        }
        int result = 1;
        IntIterator iter = this.pointees.intIterator();
        while (iter.hasNext()) {
            result = 31 * result + iter.next();
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || this.getClass() != obj.getClass()) {
            return false;
        }
        PointsToResult other = (PointsToResult) obj;
        if (isUnknown() || other.isUnknown()) {
            return isUnknown() && other.isUnknown();
        }
        return this.pointees.sameValue(other.pointees);
    }

    @Override
    public String toString() {
        return isUnknown() ? "UNKNOWN" : this.pointees.toString();
    }
}
