package analysis.pointer.graph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.ibm.wala.util.intset.IntIterator;

/**
 * Table of all constraint variables of one analysis run, indexed by their dense ids. The first four ids are reserved
 * for the special variables created by the constructor.
 */
public class VariableTable implements Iterable<ConstraintVariable> {

    /**
     * Target of a null pointer
     */
    public static final int NULL_ID = 0;
    /**
     * Stands for any memory location
     */
    public static final int ANYTHING_ID = 1;
    /**
     * Read-only memory (e.g., string constants)
     */
    public static final int READONLY_ID = 2;
    /**
     * Pointers manufactured from integers
     */
    public static final int INTEGER_ID = 3;
    /**
     * Number of reserved variables
     */
    public static final int NUM_RESERVED = 4;

    private final List<ConstraintVariable> variables = new ArrayList<>();

    public VariableTable() {
        addReserved(NULL_ID, "NULL");
        addReserved(ANYTHING_ID, "ANYTHING");
        addReserved(READONLY_ID, "READONLY");
        addReserved(INTEGER_ID, "INTEGER");
    }

    private void addReserved(int id, String name) {
        FieldLayout layout = FieldLayout.single(id, ConstraintVariable.UNKNOWN_SIZE);
        ConstraintVariable v = addVariable(name,
                                           0,
                                           ConstraintVariable.UNKNOWN_SIZE,
                                           ConstraintVariable.UNKNOWN_SIZE,
                                           layout,
                                           true,
                                           true,
                                           false,
                                           false);
        assert v.getId() == id;
    }

    /**
     * @return the id the next variable added will get
     */
    public int nextId() {
        return this.variables.size();
    }

    /**
     * Create a new variable with id {@link #nextId()}.
     */
    public ConstraintVariable addVariable(String name, int offset, int size, int fullSize, FieldLayout layout,
                                          boolean artificial, boolean unknownSize, boolean hasUnion, boolean global) {
        ConstraintVariable v = new ConstraintVariable(this.variables.size(),
                                                      name,
                                                      offset,
                                                      size,
                                                      fullSize,
                                                      layout,
                                                      artificial,
                                                      unknownSize,
                                                      hasUnion,
                                                      global);
        this.variables.add(v);
        return v;
    }

    public ConstraintVariable get(int id) {
        if (id < 0 || id >= this.variables.size()) {
            throw new IllegalArgumentException("No variable with id " + id);
        }
        return this.variables.get(id);
    }

    public int size() {
        return this.variables.size();
    }

    /**
     * What is the representative of n? If n has not been unified with another variable then this returns n.
     */
    public int getRepresentative(int n) {
        int rep = n;
        int x = get(n).getParent();
        while (x != rep) {
            rep = x;
            x = this.variables.get(x).getParent();
        }
        return rep;
    }

    public boolean isRepresentative(int n) {
        return get(n).getParent() == n;
    }

    /**
     * Has n been unified into another variable?
     */
    public boolean isCollapsed(int n) {
        return !isRepresentative(n);
    }

    /**
     * Find the field of the object var belongs to that covers the given absolute offset. Artificial and unknown sized
     * variables stand for their whole object and resolve to themselves.
     *
     * @return id of the field, or {@link FieldLayout#NO_FIELD} if the offset is beyond the end of the object
     */
    public int firstFieldAtOffset(int var, long offset) {
        ConstraintVariable v = get(var);
        if (v.isArtificial() || v.isUnknownSize()) {
            return var;
        }
        return v.getLayout().fieldAt(offset);
    }

    /**
     * Record that from (a representative) is now represented by to. The members of from move to to, and point directly
     * at their new representative.
     */
    public void absorb(int to, int from) {
        ConstraintVariable toVar = get(to);
        ConstraintVariable fromVar = get(from);
        assert toVar.getParent() == to : "Not a representative " + toVar;
        fromVar.setParent(to);
        IntIterator iter = fromVar.getMembers().intIterator();
        while (iter.hasNext()) {
            this.variables.get(iter.next()).setParent(to);
        }
        toVar.addMember(from);
        toVar.addMembers(fromVar.getMembers());
        fromVar.clearMembers();
    }

    @Override
    public Iterator<ConstraintVariable> iterator() {
        return this.variables.iterator();
    }
}
