package analysis.pointer.graph;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;

/**
 * Operations on points-to sets that need the field layout of the pointed-to objects.
 */
public final class SolutionSets {

    private SolutionSets() {
        // static utility methods only
    }

    /**
     * Compute the set of fields reached by adding offset to each member of set. A member whose object has no field at
     * the new offset is dropped, unless it is artificial or of unknown size, in which case it stands for itself.
     *
     * @param vars variable table used to look up fields
     * @param set set of variable ids
     * @param offset offset in bits
     * @return new set containing the shifted members
     */
    public static MutableIntSet shift(VariableTable vars, IntSet set, int offset) {
        BitVectorIntSet result = new BitVectorIntSet();
        IntIterator iter = set.intIterator();
        while (iter.hasNext()) {
            int i = iter.next();
            ConstraintVariable v = vars.get(i);
            long fieldOffset = (long) v.getOffset() + offset;
            if (fieldOffset < v.getFullSize()) {
                int f = vars.firstFieldAtOffset(i, fieldOffset);
                assert f != FieldLayout.NO_FIELD;
                result.add(f);
            }
            else if (v.isArtificial() || v.isUnknownSize()) {
                result.add(i);
            }
        }
        return result;
    }

    /**
     * Union shift(from, inc) into to.
     *
     * @return true if to changed
     */
    public static boolean unionWithIncrement(VariableTable vars, MutableIntSet to, IntSet from, int inc) {
        if (inc == 0) {
            return to.addAll(from);
        }
        return to.addAll(shift(vars, from, inc));
    }
}
