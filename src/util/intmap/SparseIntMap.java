package util.intmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.ibm.wala.util.intset.IntIterator;

/**
 * Sparse int map, based on the MutableSparseIntSet WALA implementation. Keys are kept sorted so that lookup, insertion
 * point search and removal are logarithmic in the number of keys (plus the array shift).
 */
public class SparseIntMap<T> implements IntMap<T> {
    /**
     * Sorted keys, only the first size entries are valid
     */
    protected int[] keys;
    /**
     * Values, values[i] is the value for keys[i]
     */
    protected Object[] values;

    /**
     * The number of entries in the backing store that are valid.
     */
    protected int size = 0;

    public SparseIntMap() {
        this.keys = null;
        this.values = null;
        this.size = 0;
    }

    public SparseIntMap(int initialSize) {
        if (initialSize < 0) {
            throw new IllegalArgumentException("illegal initialSize: " + initialSize);
        }
        this.keys = new int[initialSize];
        this.values = new Object[initialSize];
        this.size = 0;
    }

    /**
     * @return index of x in the key array if present, otherwise (-(insertion point) - 1)
     */
    private int indexOf(int x) {
        if (keys == null) {
            return -1;
        }
        return Arrays.binarySearch(keys, 0, size, x);
    }

    @Override
    public final boolean containsKey(int x) {
        return indexOf(x) >= 0;
    }

    @Override
    public final int size() {
        return size;
    }

    @Override
    public final boolean isEmpty() {
        return size == 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("{ ");
        for (int ii = 0; ii < size; ii++) {
            if (ii > 0) {
                sb.append(", ");
            }
            sb.append(keys[ii]);
            sb.append(": ");
            sb.append(values[ii]);
        }
        sb.append("}");
        return sb.toString();
    }

    /**
     * Iterator over the keys. The map must not be modified while iterating, use {@link #keysSnapshot()} for that.
     */
    @Override
    public IntIterator keyIterator() {
        return new IntIterator() {
            int i = 0;

            @Override
            public boolean hasNext() {
                return i < size;
            }

            @Override
            public int next() throws NoSuchElementException {
                if (i >= size) {
                    throw new NoSuchElementException();
                }
                return keys[i++];
            }
        };
    }

    @Override
    public Iterator<T> valueIterator() {
        return new Iterator<T>() {
            int i = 0;

            @Override
            public boolean hasNext() {
                return i < size;
            }

            @SuppressWarnings("unchecked")
            @Override
            public T next() {
                if (i >= size) {
                    throw new NoSuchElementException();
                }
                return (T) values[i++];
            }
        };
    }

    /**
     * @return a copy of the keys, in ascending order
     */
    public int[] keysSnapshot() {
        if (keys == null) {
            return new int[0];
        }
        return Arrays.copyOf(keys, size);
    }

    /**
     * @return a copy of the values, in ascending order of their keys
     */
    @SuppressWarnings("unchecked")
    public List<T> valuesSnapshot() {
        List<T> l = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            l.add((T) values[i]);
        }
        return l;
    }

    /**
     * @return the largest key in the map
     */
    @Override
    public final int max() throws IllegalStateException {
        if (size == 0) {
            throw new IllegalStateException("Illegal to ask max() on an empty key set");
        }
        return keys[size - 1];
    }

    @SuppressWarnings("unchecked")
    @Override
    public T get(int x) {
        int ind = indexOf(x);
        if (ind >= 0) {
            return (T) values[ind];
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public T put(int key, T val) {
        if (val == null) {
            throw new IllegalArgumentException("null values are not allowed, use remove");
        }
        if (keys == null) {
            keys = new int[getInitialNonEmptySize()];
            values = new Object[getInitialNonEmptySize()];
        }
        int ind = indexOf(key);
        if (ind >= 0) {
            Object existing = values[ind];
            values[ind] = val;
            return (T) existing;
        }
        int insert = -ind - 1;
        if (size == keys.length) {
            // no space left. expand the backing array.
            int newExtent = (int) (keys.length * getExpansionFactor()) + 1;
            keys = Arrays.copyOf(keys, newExtent);
            values = Arrays.copyOf(values, newExtent);
        }
        if (size != insert) {
            System.arraycopy(keys, insert, keys, insert + 1, size - insert);
            System.arraycopy(values, insert, values, insert + 1, size - insert);
        }
        keys[insert] = key;
        values[insert] = val;
        size++;
        return null;
    }

    @SuppressWarnings("unchecked")
    @Override
    public T remove(int key) {
        int remove = indexOf(key);
        if (remove < 0) {
            // Nothing to remove
            return null;
        }
        Object existing = values[remove];
        if (remove < size - 1) {
            System.arraycopy(keys, remove + 1, keys, remove, size - remove - 1);
            System.arraycopy(values, remove + 1, values, remove, size - remove - 1);
        }
        size--;
        values[size] = null;
        return (T) existing;
    }

    protected float getExpansionFactor() {
        return 1.5f;
    }

    protected int getInitialNonEmptySize() {
        return 2;
    }

}
