package analysis.pointer.registrar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import analysis.pointer.constraints.Constraint;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.constraints.ExpressionKind;
import analysis.pointer.engine.StructAliasAnalysis;
import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.FieldLayout;
import analysis.pointer.graph.VariableTable;

/**
 * Collects the constraints of one analysis run. Constraints are normalized when they are registered: trivial ones are
 * dropped, <code>*x = *y</code> is split through a temporary, and the address-taken and indirect-target flags of the
 * variables involved are recorded.
 */
public class ConstraintRegistrar {

    /**
     * Variables of the run
     */
    private final VariableTable vars;
    /**
     * Factory used to create variables for objects and temporaries
     */
    private final VariableFactory factory;
    /**
     * Normalized constraints, without duplicates
     */
    private final SortedSet<Constraint> constraints = new TreeSet<>();

    /**
     * Size in bits of a pointer, the granularity of a copy through an object without a known layout
     */
    public static final int POINTER_SIZE = 64;

    /**
     * Create a registrar for a fresh variable table and add the constraints for the reserved variables
     *
     * @param vars variable table (containing only the reserved variables)
     * @param fieldSensitive whether aggregates should be split into fields
     */
    public ConstraintRegistrar(VariableTable vars, boolean fieldSensitive) {
        this.vars = vars;
        this.factory = new VariableFactory(vars, fieldSensitive);

        // ANYTHING = &ANYTHING is the only one of its kind that is not redundant, so it does not go through
        // emitConstraint, which drops ANYTHING = ANYTHING
        this.vars.get(VariableTable.ANYTHING_ID).setAddressTaken(true);
        this.constraints.add(new Constraint(ConstraintExpression.scalar(VariableTable.ANYTHING_ID),
                                            ConstraintExpression.addressOf(VariableTable.ANYTHING_ID)));
        emitConstraint(ConstraintExpression.scalar(VariableTable.READONLY_ID),
                       ConstraintExpression.addressOf(VariableTable.ANYTHING_ID));
        emitConstraint(ConstraintExpression.scalar(VariableTable.INTEGER_ID),
                       ConstraintExpression.addressOf(VariableTable.ANYTHING_ID));
    }

    /**
     * Create the variables for an object. Every field of a global object may be modified by code that is not
     * analyzed, so it gets the constraint <code>field = &amp;ANYTHING</code>.
     *
     * @return id of the base variable of the object
     */
    public int createVariable(ObjectDescriptor d) {
        int base = this.factory.createVariable(d);
        if (d.isGlobal()) {
            pointAllFieldsToAnything(base);
        }
        return base;
    }

    /**
     * Create the variables for an incoming argument of the analyzed unit. The caller is not analyzed, so every field
     * may point to anything.
     *
     * @return id of the base variable of the argument
     */
    public int createParameterVariable(ObjectDescriptor d) {
        int base = this.factory.createVariable(d);
        pointAllFieldsToAnything(base);
        return base;
    }

    /**
     * Create the object for an allocation site, use {@link ConstraintExpression#addressOf(int)} of the result as the
     * value of the allocation.
     */
    public int createHeapVariable(String name) {
        return this.factory.createHeapVariable(name);
    }

    private void pointAllFieldsToAnything(int base) {
        for (int f : this.factory.fieldsOf(base)) {
            emitConstraint(ConstraintExpression.scalar(f), ConstraintExpression.addressOf(VariableTable.ANYTHING_ID));
        }
    }

    private void checkExpression(ConstraintExpression e) {
        if (e.getVar() >= this.vars.size()) {
            throw new IllegalArgumentException("Unknown variable in " + e);
        }
    }

    /**
     * Register the constraint lhs = rhs.
     *
     * @param lhs left hand side, either a variable or a dereference (or &amp;ANYTHING, which is turned around)
     * @param rhs right hand side
     */
    public void emitConstraint(ConstraintExpression lhs, ConstraintExpression rhs) {
        checkExpression(lhs);
        checkExpression(rhs);

        if (lhs.getVar() == VariableTable.ANYTHING_ID && rhs.getVar() == VariableTable.ANYTHING_ID) {
            // ANYTHING = ANYTHING is pointless
            return;
        }
        if (lhs.isAddressOf()) {
            if (lhs.getVar() == VariableTable.ANYTHING_ID) {
                // &ANYTHING = x becomes x = &ANYTHING
                emitConstraint(rhs, lhs);
                return;
            }
            throw new IllegalArgumentException("Cannot assign to an address: " + toString(lhs) + " = "
                    + toString(rhs));
        }
        if (rhs.isAddressOf() && rhs.getOffset() != 0) {
            throw new IllegalArgumentException("Address of a field is the address of its variable: " + toString(rhs));
        }

        if (lhs.isDeref() && rhs.isDeref() && rhs.getVar() != VariableTable.ANYTHING_ID) {
            // *x = *y becomes t = *y; *x = t
            int t = this.factory.createTemporary("doubledereftmp");
            ConstraintExpression tmp = ConstraintExpression.scalar(t);
            emitConstraint(tmp, rhs);
            emitConstraint(lhs, tmp);
            return;
        }

        if (rhs.isAddressOf()) {
            // this field and everything after it in the object can be reached from the address
            ConstraintVariable v = this.vars.get(rhs.getVar());
            FieldLayout layout = v.getLayout();
            int start = layout.indexOf(v.getId());
            assert start >= 0;
            for (int i = start; i < layout.size(); i++) {
                this.vars.get(layout.getId(i)).setAddressTaken(true);
            }
        }
        else if (!lhs.isDeref() && rhs.isDeref()) {
            // the sources of lhs are only discovered while solving
            this.vars.get(lhs.getVar()).setIndirectTarget(true);
        }
        this.constraints.add(new Constraint(lhs, rhs));
    }

    /**
     * Register the copy of an aggregate of sizeBits bits. The pointed-to objects are not known, so if both sides are
     * dereferences the copy goes through an opaque temporary, see
     * {@link #emitStructureCopy(ConstraintExpression, ConstraintExpression, int, ObjectDescriptor)} to give it a
     * layout.
     */
    public void emitStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, int sizeBits) {
        emitStructureCopy(lhs, rhs, sizeBits, null);
    }

    /**
     * Register the copy of an aggregate of sizeBits bits, field by field.
     *
     * @param lhs destination, a variable or a dereference
     * @param rhs source
     * @param sizeBits number of bits copied
     * @param copiedType type of the copied aggregate, used for the temporary of a copy between two dereferences (may
     *            be null)
     */
    public void emitStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, int sizeBits,
                                  ObjectDescriptor copiedType) {
        if (sizeBits < 0) {
            throw new IllegalArgumentException("Negative size " + sizeBits);
        }
        checkExpression(lhs);
        checkExpression(rhs);

        // special var = x is turned around
        if (isReserved(lhs.getVar()) && !isReserved(rhs.getVar())) {
            ConstraintExpression tmp = lhs;
            lhs = rhs;
            rhs = tmp;
        }

        if (rhs.isAddressOf() && !isReserved(rhs.getVar())) {
            // conservative, mostly transparent unions
            rhs = ConstraintExpression.addressOf(VariableTable.ANYTHING_ID);
        }

        if (isReserved(rhs.getVar())) {
            // every field of the lhs gets the special var
            for (int p : fieldsFrom(lhs.getVar())) {
                if (lhs.isScalar()) {
                    emitConstraint(lhs.withVar(p), rhs);
                }
                else {
                    emitConstraint(lhs.withOffset(lhs.getOffset() + this.vars.get(p).getOffset()), rhs);
                }
            }
            return;
        }

        // unknown sized objects are copied in their entirety
        long rhsSize = this.vars.get(rhs.getVar()).isUnknownSize() ? Long.MAX_VALUE : sizeBits;
        long lhsSize = this.vars.get(lhs.getVar()).isUnknownSize() ? Long.MAX_VALUE : sizeBits;
        long size = Math.min(lhsSize, rhsSize);

        if (lhs.isScalar() && rhs.isScalar()) {
            simpleStructureCopy(lhs, rhs, size);
        }
        else if (!lhs.isDeref() && rhs.isDeref()) {
            rhsDerefStructureCopy(lhs, rhs, size, sizeBits, copiedType);
        }
        else if (lhs.isDeref() && !rhs.isDeref()) {
            lhsDerefStructureCopy(lhs, rhs, size, sizeBits, copiedType);
        }
        else {
            assert lhs.isDeref() && rhs.isDeref();
            int t;
            if (copiedType == null) {
                t = this.factory.createTemporary("structcopydereftmp");
            }
            else {
                t = this.factory.createVariable(new ObjectDescriptor("structcopydereftmp",
                                                                     copiedType.getSize(),
                                                                     copiedType.getFields(),
                                                                     false,
                                                                     copiedType.isUnion(),
                                                                     copiedType.isArray(),
                                                                     copiedType.isUnknownSize()));
            }
            ConstraintExpression tmp = ConstraintExpression.scalar(t);
            emitStructureCopy(tmp, rhs, sizeBits, copiedType);
            emitStructureCopy(lhs, tmp, sizeBits, copiedType);
        }
    }

    /**
     * For each field of lhs within size, copy the field of rhs at the same relative offset. An unknown sized lhs has
     * a single field, so every field of rhs is copied into it instead.
     */
    private void simpleStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, long size) {
        ConstraintVariable start = this.vars.get(lhs.getVar());
        ConstraintVariable q = this.vars.get(rhs.getVar());
        if (start.isUnknownSize() && !q.isUnknownSize()) {
            long last = q.getOffset() + size;
            for (int qf : fieldsFrom(rhs.getVar())) {
                if (this.vars.get(qf).getOffset() >= last) {
                    break;
                }
                emitConstraint(lhs, rhs.withVar(qf));
            }
            return;
        }
        long pstart = start.getOffset();
        long last = pstart + size;
        for (int p : fieldsFrom(lhs.getVar())) {
            ConstraintVariable pv = this.vars.get(p);
            if (pv.getOffset() >= last) {
                break;
            }
            long fieldOffset = pv.getOffset() - pstart;
            int qf = this.vars.firstFieldAtOffset(q.getId(), q.getOffset() + fieldOffset);
            if (qf == FieldLayout.NO_FIELD) {
                if (StructAliasAnalysis.outputLevel >= 3) {
                    System.err.println("STRUCTURE COPY: no field of " + q.getName() + " at offset "
                            + (q.getOffset() + fieldOffset) + " for " + pv.getName());
                }
                continue;
            }
            emitConstraint(lhs.withVar(p), rhs.withVar(qf));
        }
    }

    /**
     * lhsfield = *(y + fieldoffset) for each field of lhs within size. An unknown sized lhs takes every offset of the
     * copied aggregate.
     */
    private void rhsDerefStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, long size, int sizeBits,
                                       ObjectDescriptor copiedType) {
        ConstraintVariable start = this.vars.get(lhs.getVar());
        if (start.isUnknownSize()) {
            for (int off : copiedOffsets(copiedType, sizeBits)) {
                emitConstraint(lhs, rhs.withOffset(rhs.getOffset() + off));
            }
            return;
        }
        long pstart = start.getOffset();
        long last = pstart + size;
        for (int p : fieldsFrom(lhs.getVar())) {
            ConstraintVariable pv = this.vars.get(p);
            if (pv.getOffset() >= last) {
                break;
            }
            int fieldOffset = (int) (pv.getOffset() - pstart);
            emitConstraint(lhs.withVar(p), rhs.withOffset(rhs.getOffset() + fieldOffset));
        }
    }

    /**
     * *(x + fieldoffset) = rhsfield for each field of rhs within size. An unknown sized rhs is stored at every offset
     * of the copied aggregate.
     */
    private void lhsDerefStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, long size, int sizeBits,
                                       ObjectDescriptor copiedType) {
        ConstraintVariable start = this.vars.get(rhs.getVar());
        if (start.isUnknownSize()) {
            for (int off : copiedOffsets(copiedType, sizeBits)) {
                emitConstraint(lhs.withOffset(lhs.getOffset() + off), rhs);
            }
            return;
        }
        long pstart = start.getOffset();
        long last = pstart + size;
        for (int p : fieldsFrom(rhs.getVar())) {
            ConstraintVariable pv = this.vars.get(p);
            if (pv.getOffset() >= last) {
                break;
            }
            int fieldOffset = (int) (pv.getOffset() - pstart);
            emitConstraint(lhs.withOffset(lhs.getOffset() + fieldOffset), rhs.withVar(p));
        }
    }

    /**
     * Offsets within the copied aggregate that may hold a pointer. These are the offsets of the leaf fields of
     * copiedType, or every pointer sized slot below sizeBits when the type gives no layout.
     */
    private static int[] copiedOffsets(ObjectDescriptor copiedType, int sizeBits) {
        SortedSet<Integer> offsets = new TreeSet<>();
        offsets.add(0);
        if (copiedType != null && copiedType.isAggregate() && copiedType.hasConstantSize()
                && !copiedType.isUnion() && !copiedType.isArray() && !copiedType.isUnknownSize()) {
            addLeafOffsets(copiedType.getFields(), 0, sizeBits, offsets);
        }
        else {
            for (int off = POINTER_SIZE; off < sizeBits; off += POINTER_SIZE) {
                offsets.add(off);
            }
        }
        int[] result = new int[offsets.size()];
        int i = 0;
        for (Integer off : offsets) {
            result[i++] = off;
        }
        return result;
    }

    private static void addLeafOffsets(List<FieldDescriptor> fields, int base, int sizeBits,
                                       SortedSet<Integer> offsets) {
        for (FieldDescriptor f : fields) {
            int off = base + f.getOffset();
            if (off < 0 || off >= sizeBits) {
                continue;
            }
            if (f.isAggregate() && !f.getFields().isEmpty()) {
                addLeafOffsets(f.getFields(), off, sizeBits, offsets);
            }
            else if (f.isArray() || f.isUnion() || !f.hasConstantSize()) {
                // any slot of an array or union may hold a pointer
                int end = f.hasConstantSize() ? Math.min(sizeBits, off + f.getSize()) : sizeBits;
                for (int slot = off; slot < end; slot += POINTER_SIZE) {
                    offsets.add(slot);
                }
            }
            else {
                offsets.add(off);
            }
        }
    }

    /**
     * @return the variable and the fields following it in its object, in offset order
     */
    private int[] fieldsFrom(int var) {
        FieldLayout layout = this.vars.get(var).getLayout();
        int start = layout.indexOf(var);
        assert start >= 0;
        int[] result = new int[layout.size() - start];
        for (int i = start; i < layout.size(); i++) {
            result[i - start] = layout.getId(i);
        }
        return result;
    }

    private static boolean isReserved(int var) {
        return var <= VariableTable.INTEGER_ID;
    }

    /**
     * Get an expression for what e points to. Dereferencing a dereference first loads it into a temporary.
     */
    public ConstraintExpression dereference(ConstraintExpression e) {
        switch (e.getKind()) {
        case SCALAR:
            return e.withKind(ExpressionKind.DEREF);
        case ADDRESSOF:
            return e.withKind(ExpressionKind.SCALAR);
        case DEREF:
            int t = this.factory.createTemporary("derefmp");
            emitConstraint(ConstraintExpression.scalar(t), e);
            return ConstraintExpression.deref(t);
        default:
            throw new RuntimeException("Unhandled expression kind " + e.getKind());
        }
    }

    /**
     * Get an expression for the address of e
     */
    public ConstraintExpression addressOf(ConstraintExpression e) {
        if (e.isDeref()) {
            return e.withKind(ExpressionKind.SCALAR);
        }
        if (e.isAddressOf()) {
            throw new IllegalArgumentException("Cannot take the address of an address: " + toString(e));
        }
        return ConstraintExpression.addressOf(e.getVar());
    }

    /**
     * @return the registered constraints, in their total order
     */
    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(new ArrayList<>(this.constraints));
    }

    public int numConstraints() {
        return this.constraints.size();
    }

    public VariableTable getVariableTable() {
        return this.vars;
    }

    public VariableFactory getVariableFactory() {
        return this.factory;
    }

    /**
     * Render a constraint expression using the names of the variables
     */
    public String toString(ConstraintExpression e) {
        return e.render(this.vars.get(e.getVar()).getName());
    }

    /**
     * Render a constraint using the names of the variables, e.g. <code>*x + 32 = &amp;y</code>
     */
    public String toString(Constraint c) {
        return toString(c.getLhs()) + " = " + toString(c.getRhs());
    }
}
