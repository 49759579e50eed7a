package analysis.pointer.registrar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Description of an addressable object for which constraint variables are to be created: its size, its fields (if it
 * is an aggregate) and a few properties of its type and storage.
 */
public final class ObjectDescriptor {

    /**
     * Size of an object or field whose size is not a compile time constant
     */
    public static final int NON_CONSTANT = -1;

    private final String name;
    /**
     * Size in bits, or {@link #NON_CONSTANT}
     */
    private final int size;
    /**
     * Fields of an aggregate, null for a scalar
     */
    private final List<FieldDescriptor> fields;
    private final boolean global;
    private final boolean union;
    private final boolean array;
    private final boolean unknownSize;

    public ObjectDescriptor(String name, int size, List<FieldDescriptor> fields, boolean global, boolean union,
                            boolean array, boolean unknownSize) {
        if (name == null) {
            throw new IllegalArgumentException("Objects must have a name");
        }
        if (size < 0 && size != NON_CONSTANT) {
            throw new IllegalArgumentException("Negative size " + size + " for " + name);
        }
        this.name = name;
        this.size = size;
        this.fields = fields == null ? null : Collections.unmodifiableList(new ArrayList<>(fields));
        this.global = global;
        this.union = union;
        this.array = array;
        this.unknownSize = unknownSize;
    }

    public static ObjectDescriptor scalar(String name, int size) {
        return new ObjectDescriptor(name, size, null, false, false, false, false);
    }

    public static ObjectDescriptor struct(String name, int size, List<FieldDescriptor> fields) {
        return new ObjectDescriptor(name, size, fields, false, false, false, false);
    }

    /**
     * Union type, the fields overlap
     */
    public static ObjectDescriptor union(String name, int size, List<FieldDescriptor> fields) {
        return new ObjectDescriptor(name, size, fields, false, true, false, false);
    }

    public static ObjectDescriptor array(String name, int size) {
        return new ObjectDescriptor(name, size, null, false, false, true, false);
    }

    /**
     * Object whose extent is not known (e.g., variable length aggregates)
     */
    public static ObjectDescriptor unknown(String name) {
        return new ObjectDescriptor(name, NON_CONSTANT, null, false, false, false, true);
    }

    /**
     * @return the same object with global storage
     */
    public ObjectDescriptor asGlobal() {
        return new ObjectDescriptor(this.name, this.size, this.fields, true, this.union, this.array, this.unknownSize);
    }

    public String getName() {
        return this.name;
    }

    public int getSize() {
        return this.size;
    }

    public boolean hasConstantSize() {
        return this.size != NON_CONSTANT;
    }

    /**
     * @return the fields of the aggregate, or null if this is a scalar
     */
    public List<FieldDescriptor> getFields() {
        return this.fields;
    }

    public boolean isAggregate() {
        return this.fields != null;
    }

    public boolean isGlobal() {
        return this.global;
    }

    public boolean isUnion() {
        return this.union;
    }

    public boolean isArray() {
        return this.array;
    }

    public boolean isUnknownSize() {
        return this.unknownSize;
    }

    @Override
    public String toString() {
        return this.name + (this.global ? " (global)" : "") + " size " + (hasConstantSize() ? this.size : "?");
    }
}
