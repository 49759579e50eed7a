package analysis.pointer.registrar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import analysis.pointer.graph.ConstraintVariable;
import analysis.pointer.graph.FieldLayout;
import analysis.pointer.graph.VariableTable;

/**
 * Factory for the constraint variables of addressable objects. Aggregates are decomposed into one variable per leaf
 * field when field sensitivity is enabled and the layout of the object is fully known; otherwise the object is
 * represented by a single variable.
 */
public class VariableFactory {

    /**
     * Table new variables are added to
     */
    private final VariableTable vars;
    /**
     * Whether aggregates are split into fields
     */
    private final boolean fieldSensitive;
    /**
     * Number of temporaries created so far, used to make their names unique
     */
    private int tempCount = 0;

    public VariableFactory(VariableTable vars, boolean fieldSensitive) {
        this.vars = vars;
        this.fieldSensitive = fieldSensitive;
    }

    /**
     * Create the variables for an object.
     *
     * @param d description of the object
     * @return id of the variable for the first field (the base of the object)
     */
    public int createVariable(ObjectDescriptor d) {
        return createVariable(d, false);
    }

    /**
     * Create the variables for an object, artificial variables are created by the analysis itself.
     */
    private int createVariable(ObjectDescriptor d, boolean artificial) {
        String name = d.getName();
        boolean hasUnion = d.isUnion();
        List<FlatField> flattened = null;
        if (this.fieldSensitive && d.isAggregate() && !hasUnion) {
            Flattener f = new Flattener();
            f.push(d.getFields(), 0, "");
            hasUnion = f.foundUnion;
            flattened = f.leaves;
        }

        if (!d.hasConstantSize() || d.isUnknownSize() || d.isArray() || hasUnion) {
            return createUnknownSize(name, artificial, hasUnion, d.isGlobal());
        }

        if (!this.fieldSensitive || !d.isAggregate()) {
            return createSingle(name, d.getSize(), artificial, d.isGlobal());
        }

        for (FlatField ff : flattened) {
            if (!ff.field.hasConstantSize() || ff.field.isArray() || ff.offset < 0) {
                return createUnknownSize(name, artificial, false, d.isGlobal());
            }
        }
        if (flattened.isEmpty()) {
            return createUnknownSize(name, artificial, false, d.isGlobal());
        }

        Collections.sort(flattened, FIELD_ORDER);
        List<FlatField> fields = flattened;
        int fullSize = d.getSize();
        int n = fields.size();
        int[] ids = new int[n];
        int[] offsets = new int[n];
        int[] sizes = new int[n];
        int base = this.vars.nextId();
        for (int i = 0; i < n; i++) {
            FlatField ff = fields.get(i);
            ids[i] = base + i;
            offsets[i] = i == 0 ? 0 : (int) ff.offset;
            // the base covers any leading padding
            sizes[i] = i == 0 ? (int) (ff.offset + ff.field.getSize()) : ff.field.getSize();
            if ((long) offsets[i] + sizes[i] > fullSize || i > 0 && offsets[i] < offsets[i - 1] + sizes[i - 1]) {
                // fields overlap or extend past the object, treat it like a union
                return createUnknownSize(name, artificial, true, d.isGlobal());
            }
        }
        FieldLayout layout = new FieldLayout(ids, offsets, sizes, fullSize);
        for (int i = 0; i < n; i++) {
            String fieldName = i == 0 ? name : name + "." + fields.get(i).name;
            ConstraintVariable v = this.vars.addVariable(fieldName,
                                                         offsets[i],
                                                         sizes[i],
                                                         fullSize,
                                                         layout,
                                                         artificial,
                                                         false,
                                                         false,
                                                         d.isGlobal());
            assert v.getId() == ids[i];
        }
        return base;
    }

    private int createSingle(String name, int size, boolean artificial, boolean global) {
        int id = this.vars.nextId();
        ConstraintVariable v = this.vars.addVariable(name,
                                                     0,
                                                     size,
                                                     size,
                                                     FieldLayout.single(id, size),
                                                     artificial,
                                                     false,
                                                     false,
                                                     global);
        return v.getId();
    }

    private int createUnknownSize(String name, boolean artificial, boolean hasUnion, boolean global) {
        int id = this.vars.nextId();
        ConstraintVariable v = this.vars.addVariable(name,
                                                     0,
                                                     ConstraintVariable.UNKNOWN_SIZE,
                                                     ConstraintVariable.UNKNOWN_SIZE,
                                                     FieldLayout.single(id, ConstraintVariable.UNKNOWN_SIZE),
                                                     artificial,
                                                     true,
                                                     hasUnion,
                                                     global);
        return v.getId();
    }

    /**
     * Create a fresh temporary used when splitting constraints. Temporaries stand for a single pointer and are never
     * decomposed.
     *
     * @param prefix prefix of the name of the temporary
     * @return id of the new variable
     */
    public int createTemporary(String prefix) {
        return createUnknownSize(prefix + "." + (this.tempCount++), true, false, false);
    }

    /**
     * Create the object allocated at a heap allocation site. The whole allocation is represented by one artificial
     * variable.
     */
    public int createHeapVariable(String name) {
        return createVariable(ObjectDescriptor.unknown(name), true);
    }

    /**
     * @return ids of all the variables of the object whose base variable is base, in offset order
     */
    public int[] fieldsOf(int base) {
        FieldLayout layout = this.vars.get(base).getLayout();
        int[] ids = new int[layout.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = layout.getId(i);
        }
        return ids;
    }

    public VariableTable getVariableTable() {
        return this.vars;
    }

    public boolean isFieldSensitive() {
        return this.fieldSensitive;
    }

    /**
     * Leaf field with its offset within the whole object
     */
    private static final class FlatField {
        final FieldDescriptor field;
        final long offset;
        final String name;

        FlatField(FieldDescriptor field, long offset, String name) {
            this.field = field;
            this.offset = offset;
            this.name = name;
        }
    }

    private static final Comparator<FlatField> FIELD_ORDER = new Comparator<FlatField>() {
        @Override
        public int compare(FlatField o1, FlatField o2) {
            if (o1.offset != o2.offset) {
                return Long.compare(o1.offset, o2.offset);
            }
            return Integer.compare(o1.field.getSize(), o2.field.getSize());
        }
    };

    /**
     * Collects the leaf fields of nested aggregates
     */
    private static final class Flattener {
        final List<FlatField> leaves = new ArrayList<>();
        boolean foundUnion = false;

        /**
         * @return number of leaves pushed
         */
        int push(List<FieldDescriptor> fields, long offset, String prefix) {
            int count = 0;
            for (FieldDescriptor f : fields) {
                if (f.isUnion()) {
                    this.foundUnion = true;
                }
                boolean push = false;
                if (!f.isAggregate()) {
                    push = true;
                }
                else if (push(f.getFields(), offset + f.getOffset(), prefix + f.getName() + ".") == 0
                        && f.getSize() != 0) {
                    // empty aggregates may still occupy space
                    push = true;
                }
                if (push && f.getSize() == 0) {
                    // zero sized leaves cannot hold anything
                    continue;
                }
                if (push) {
                    this.leaves.add(new FlatField(f, offset + f.getOffset(), prefix + f.getName()));
                    count++;
                }
            }
            return count;
        }
    }
}
