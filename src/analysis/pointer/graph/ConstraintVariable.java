package analysis.pointer.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import analysis.pointer.constraints.Constraint;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Node of the constraint graph: one field of an addressable object (or the whole object if it was not decomposed).
 */
public class ConstraintVariable {

    /**
     * Size used for objects whose extent is not statically known
     */
    public static final int UNKNOWN_SIZE = Integer.MAX_VALUE;

    /**
     * Dense unique id
     */
    private final int id;
    /**
     * Name used when printing
     */
    private final String name;
    /**
     * Offset of this field within the base object, in bits
     */
    private final int offset;
    /**
     * Size of this field, in bits
     */
    private final int size;
    /**
     * Size of the base object, in bits
     */
    private final int fullSize;
    /**
     * Fields of the base object this variable is part of
     */
    private final FieldLayout layout;
    /**
     * Variables introduced by the analysis itself (temporaries, heap objects, reserved variables)
     */
    private final boolean artificial;
    /**
     * Object that was not split into fields, all accesses go to this variable
     */
    private final boolean unknownSize;
    /**
     * Object contains a union
     */
    private final boolean hasUnion;
    /**
     * Global object, may be modified by code that is not analyzed
     */
    private final boolean global;
    /**
     * The address of this variable is taken somewhere
     */
    private boolean addressTaken;
    /**
     * Edges into this variable are discovered while solving
     */
    private boolean indirectTarget;
    /**
     * Union-find parent, equal to id for a representative
     */
    private int representative;
    /**
     * Points-to set, only meaningful if this variable is a representative
     */
    private final MutableIntSet solution = new BitVectorIntSet();
    /**
     * Sorted, duplicate free list of complex constraints that dereference this variable
     */
    private List<Constraint> complex = new ArrayList<>();
    /**
     * Variables that have been unified into this one
     */
    private final MutableSparseIntSet members = MutableSparseIntSet.makeEmpty();

    ConstraintVariable(int id, String name, int offset, int size, int fullSize, FieldLayout layout,
                       boolean artificial, boolean unknownSize, boolean hasUnion, boolean global) {
        assert unknownSize || (long) offset + size <= fullSize : "Field " + name + " extends past its object";
        this.id = id;
        this.name = name;
        this.offset = offset;
        this.size = size;
        this.fullSize = fullSize;
        this.layout = layout;
        this.artificial = artificial;
        this.unknownSize = unknownSize;
        this.hasUnion = hasUnion;
        this.global = global;
        this.representative = id;
    }

    public int getId() {
        return this.id;
    }

    public String getName() {
        return this.name;
    }

    public int getOffset() {
        return this.offset;
    }

    public int getSize() {
        return this.size;
    }

    public int getFullSize() {
        return this.fullSize;
    }

    public FieldLayout getLayout() {
        return this.layout;
    }

    public boolean isArtificial() {
        return this.artificial;
    }

    public boolean isUnknownSize() {
        return this.unknownSize;
    }

    public boolean hasUnion() {
        return this.hasUnion;
    }

    public boolean isGlobal() {
        return this.global;
    }

    public boolean isAddressTaken() {
        return this.addressTaken;
    }

    public void setAddressTaken(boolean addressTaken) {
        this.addressTaken = addressTaken;
    }

    public boolean isIndirectTarget() {
        return this.indirectTarget;
    }

    public void setIndirectTarget(boolean indirectTarget) {
        this.indirectTarget = indirectTarget;
    }

    /**
     * @return the immediate union-find parent, use {@link VariableTable#getRepresentative(int)} for the representative
     */
    public int getParent() {
        return this.representative;
    }

    void setParent(int rep) {
        this.representative = rep;
    }

    public MutableIntSet getSolution() {
        return this.solution;
    }

    public List<Constraint> getComplex() {
        return Collections.unmodifiableList(this.complex);
    }

    /**
     * Add a complex constraint, keeping the list sorted and free of duplicates.
     *
     * @return true if the constraint was not already attached
     */
    public boolean addComplex(Constraint c) {
        int ind = Collections.binarySearch(this.complex, c);
        if (ind >= 0) {
            return false;
        }
        this.complex.add(-ind - 1, c);
        return true;
    }

    /**
     * Merge a sorted list of complex constraints into this one
     */
    public void unionComplex(List<Constraint> others) {
        if (others.isEmpty()) {
            return;
        }
        List<Constraint> merged = new ArrayList<>(this.complex.size() + others.size());
        int i = 0;
        int j = 0;
        while (i < this.complex.size() && j < others.size()) {
            Constraint a = this.complex.get(i);
            Constraint b = others.get(j);
            int c = a.compareTo(b);
            if (c < 0) {
                merged.add(a);
                i++;
            }
            else if (c > 0) {
                merged.add(b);
                j++;
            }
            else {
                merged.add(a);
                i++;
                j++;
            }
        }
        while (i < this.complex.size()) {
            merged.add(this.complex.get(i++));
        }
        while (j < others.size()) {
            merged.add(others.get(j++));
        }
        this.complex = merged;
    }

    public void clearComplex() {
        this.complex = new ArrayList<>();
    }

    /**
     * Replace the complex list, the new list must be sorted
     */
    public void setComplex(List<Constraint> sorted) {
        this.complex = new ArrayList<>(sorted);
    }

    public IntSet getMembers() {
        return this.members;
    }

    void addMember(int member) {
        this.members.add(member);
    }

    void addMembers(IntSet other) {
        this.members.addAll(other);
    }

    void clearMembers() {
        this.members.clear();
    }

    @Override
    public String toString() {
        return this.name;
    }
}
