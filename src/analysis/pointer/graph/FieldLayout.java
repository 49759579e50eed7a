package analysis.pointer.graph;

import java.util.Arrays;

import analysis.pointer.engine.InternalInconsistencyException;

/**
 * Offset-sorted fields of one base object. All constraint variables created for the fields of an object share the same
 * (immutable) layout. Offsets are absolute within the base object, in bits.
 */
public final class FieldLayout {

    /**
     * Returned by {@link #fieldAt(long)} when the offset lies at or beyond the end of the object
     */
    public static final int NO_FIELD = -1;

    /**
     * Variable ids of the fields, in ascending offset order
     */
    private final int[] ids;
    /**
     * offsets[i] is the offset of the field ids[i]
     */
    private final int[] offsets;
    /**
     * sizes[i] is the size of the field ids[i]
     */
    private final int[] sizes;
    /**
     * Size of the whole object
     */
    private final int fullSize;

    public FieldLayout(int[] ids, int[] offsets, int[] sizes, int fullSize) {
        if (ids.length != offsets.length || ids.length != sizes.length) {
            throw new IllegalArgumentException("Mismatched field arrays");
        }
        for (int i = 1; i < offsets.length; i++) {
            if (offsets[i] <= offsets[i - 1]) {
                throw new IllegalArgumentException("Field offsets must be strictly increasing: " + Arrays.toString(offsets));
            }
        }
        this.ids = ids.clone();
        this.offsets = offsets.clone();
        this.sizes = sizes.clone();
        this.fullSize = fullSize;
    }

    /**
     * Layout of an object represented by a single variable
     */
    public static FieldLayout single(int id, int size) {
        return new FieldLayout(new int[] { id }, new int[] { 0 }, new int[] { size }, size);
    }

    /**
     * Find the field covering the given offset. Offsets falling into padding between two fields resolve to the
     * preceding field.
     *
     * @param offset absolute offset in bits
     * @return id of the field or {@link #NO_FIELD} if offset is not inside the object
     */
    public int fieldAt(long offset) {
        if (this.ids.length == 0) {
            throw new InternalInconsistencyException("Field lookup on an empty layout");
        }
        if (offset < 0 || offset >= this.fullSize) {
            return NO_FIELD;
        }
        int ind = Arrays.binarySearch(this.offsets, (int) offset);
        if (ind >= 0) {
            return this.ids[ind];
        }
        int insert = -ind - 1;
        // the first field always starts at offset 0, so insert > 0
        assert insert > 0;
        return this.ids[insert - 1];
    }

    /**
     * @return number of fields
     */
    public int size() {
        return this.ids.length;
    }

    public int getId(int index) {
        return this.ids[index];
    }

    public int getOffset(int index) {
        return this.offsets[index];
    }

    public int getSize(int index) {
        return this.sizes[index];
    }

    public int getFullSize() {
        return this.fullSize;
    }

    /**
     * @return id of the base (first) field
     */
    public int getBase() {
        return this.ids[0];
    }

    /**
     * @return position of the variable id in this layout, or -1 if it is not a field of this object
     */
    public int indexOf(int id) {
        // ids are allocated consecutively, but do not rely on that
        for (int i = 0; i < this.ids.length; i++) {
            if (this.ids[i] == id) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[");
        for (int i = 0; i < this.ids.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(this.ids[i]).append("@").append(this.offsets[i]).append(":").append(this.sizes[i]);
        }
        sb.append("] / ").append(this.fullSize);
        return sb.toString();
    }
}
