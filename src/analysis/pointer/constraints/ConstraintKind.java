package analysis.pointer.constraints;

/**
 * How a constraint is handled by the solver.
 */
public enum ConstraintKind {
    /**
     * <code>x = &amp;y</code>, applied once to the initial solution
     */
    DIRECT,
    /**
     * <code>x = y + k</code>, becomes an edge of the constraint graph
     */
    COPY,
    /**
     * Any constraint with a dereference, re-evaluated every time the dereferenced variable changes
     */
    COMPLEX;
}
