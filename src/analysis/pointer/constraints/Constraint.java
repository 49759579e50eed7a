package analysis.pointer.constraints;

/**
 * Set constraint <code>lhs &#8839; rhs</code>: the targets of the left hand side must include the contribution of the
 * right hand side. Constraints are immutable; unification rewrites a stored constraint by replacing it with the result
 * of {@link #withVariable(int, int)}.
 */
public final class Constraint implements Comparable<Constraint> {

    private final ConstraintExpression lhs;
    private final ConstraintExpression rhs;

    public Constraint(ConstraintExpression lhs, ConstraintExpression rhs) {
        assert lhs != null && rhs != null;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public ConstraintExpression getLhs() {
        return this.lhs;
    }

    public ConstraintExpression getRhs() {
        return this.rhs;
    }

    /**
     * Classify this constraint.
     *
     * @return {@link ConstraintKind#COMPLEX} if either side is a dereference, {@link ConstraintKind#DIRECT} for
     *         <code>x = &amp;y</code>, and {@link ConstraintKind#COPY} for <code>x = y</code>
     */
    public ConstraintKind kind() {
        if (this.lhs.isDeref() || this.rhs.isDeref()) {
            return ConstraintKind.COMPLEX;
        }
        if (this.rhs.isAddressOf()) {
            return ConstraintKind.DIRECT;
        }
        return ConstraintKind.COPY;
    }

    /**
     * @return a constraint where every reference to variable <code>oldVar</code> is replaced by <code>newVar</code>, or
     *         this if oldVar does not occur
     */
    public Constraint withVariable(int oldVar, int newVar) {
        ConstraintExpression l = this.lhs.getVar() == oldVar ? this.lhs.withVar(newVar) : this.lhs;
        ConstraintExpression r = this.rhs.getVar() == oldVar ? this.rhs.withVar(newVar) : this.rhs;
        if (l == this.lhs && r == this.rhs) {
            return this;
        }
        return new Constraint(l, r);
    }

    @Override
    public int compareTo(Constraint o) {
        int c = this.lhs.compareTo(o.lhs);
        if (c != 0) {
            return c;
        }
        return this.rhs.compareTo(o.rhs);
    }

    @Override
    public int hashCode() {
        return 31 * this.lhs.hashCode() + this.rhs.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Constraint)) {
            return false;
        }
        Constraint other = (Constraint) obj;
        return this.lhs.equals(other.lhs) && this.rhs.equals(other.rhs);
    }

    @Override
    public String toString() {
        return this.lhs + " = " + this.rhs;
    }
}
