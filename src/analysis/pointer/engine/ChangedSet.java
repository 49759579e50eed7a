package analysis.pointer.engine;

import com.ibm.wala.util.intset.BitVectorIntSet;

/**
 * Set of graph nodes whose solution changed since they were last processed, together with its size
 */
public class ChangedSet {

    private final BitVectorIntSet changed = new BitVectorIntSet();
    private int count = 0;

    /**
     * @return true if n was not already in the set
     */
    public boolean add(int n) {
        if (this.changed.add(n)) {
            this.count++;
            return true;
        }
        return false;
    }

    /**
     * @return true if n was in the set
     */
    public boolean remove(int n) {
        if (this.changed.remove(n)) {
            this.count--;
            assert this.count >= 0;
            return true;
        }
        return false;
    }

    public boolean contains(int n) {
        return this.changed.contains(n);
    }

    /**
     * Node from is being unified into to: if from was changed then to is changed instead.
     */
    public void transfer(int from, int to) {
        if (!this.changed.contains(from)) {
            return;
        }
        this.changed.remove(from);
        if (!this.changed.contains(to)) {
            this.changed.add(to);
        }
        else {
            assert this.count > 0;
            this.count--;
        }
    }

    public int count() {
        return this.count;
    }

    public boolean isEmpty() {
        return this.count == 0;
    }

    @Override
    public String toString() {
        return this.changed.toString();
    }
}
