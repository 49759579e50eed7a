package analysis.pointer.registrar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field of an aggregate type, as computed by the front end. A field is either a leaf, or itself an aggregate with
 * nested fields whose offsets are relative to this field.
 */
public final class FieldDescriptor {

    private final String name;
    /**
     * Offset in bits relative to the enclosing aggregate
     */
    private final int offset;
    /**
     * Size in bits, or {@link ObjectDescriptor#NON_CONSTANT}
     */
    private final int size;
    /**
     * Nested fields, null for a leaf
     */
    private final List<FieldDescriptor> fields;
    private final boolean union;
    private final boolean array;

    public FieldDescriptor(String name, int offset, int size, List<FieldDescriptor> fields, boolean union,
                           boolean array) {
        assert name != null;
        this.name = name;
        this.offset = offset;
        this.size = size;
        this.fields = fields == null ? null : Collections.unmodifiableList(new ArrayList<>(fields));
        this.union = union;
        this.array = array;
    }

    /**
     * Scalar field
     */
    public static FieldDescriptor leaf(String name, int offset, int size) {
        return new FieldDescriptor(name, offset, size, null, false, false);
    }

    /**
     * Field that is itself a structure
     */
    public static FieldDescriptor nested(String name, int offset, int size, List<FieldDescriptor> fields) {
        return new FieldDescriptor(name, offset, size, fields, false, false);
    }

    /**
     * Field of union type
     */
    public static FieldDescriptor union(String name, int offset, int size) {
        return new FieldDescriptor(name, offset, size, null, true, false);
    }

    /**
     * Field of array type
     */
    public static FieldDescriptor array(String name, int offset, int size) {
        return new FieldDescriptor(name, offset, size, null, false, true);
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

    public boolean hasConstantSize() {
        return this.size != ObjectDescriptor.NON_CONSTANT;
    }

    /**
     * @return nested fields, or null if this is not an aggregate
     */
    public List<FieldDescriptor> getFields() {
        return this.fields;
    }

    public boolean isUnion() {
        return this.union;
    }

    public boolean isArray() {
        return this.array;
    }

    /**
     * Can this field be split into further fields?
     */
    public boolean isAggregate() {
        return this.fields != null && !this.union && !this.array;
    }

    @Override
    public String toString() {
        return this.name + "@" + this.offset + ":" + this.size;
    }
}
