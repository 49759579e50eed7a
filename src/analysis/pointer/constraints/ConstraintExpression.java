package analysis.pointer.constraints;

/**
 * An expression appearing on one side of a constraint: a variable, what it points to, or its address, together with an
 * offset in bits. For a dereference the offset is added to each member of the dereferenced solution; for a scalar on
 * the right hand side it is the offset added to each member of the variable's solution.
 */
public final class ConstraintExpression implements Comparable<ConstraintExpression> {

    private final ExpressionKind kind;
    /**
     * Id of the constraint variable
     */
    private final int var;
    /**
     * Offset in bits
     */
    private final int offset;

    public ConstraintExpression(ExpressionKind kind, int var, int offset) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is null");
        }
        if (var < 0) {
            throw new IllegalArgumentException("Bad variable id " + var);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset " + offset);
        }
        this.kind = kind;
        this.var = var;
        this.offset = offset;
    }

    /**
     * @return expression for <code>x</code>
     */
    public static ConstraintExpression scalar(int var) {
        return new ConstraintExpression(ExpressionKind.SCALAR, var, 0);
    }

    /**
     * @return expression for <code>x + offset</code>
     */
    public static ConstraintExpression scalar(int var, int offset) {
        return new ConstraintExpression(ExpressionKind.SCALAR, var, offset);
    }

    /**
     * @return expression for <code>*x</code>
     */
    public static ConstraintExpression deref(int var) {
        return new ConstraintExpression(ExpressionKind.DEREF, var, 0);
    }

    /**
     * @return expression for <code>*(x + offset)</code>
     */
    public static ConstraintExpression deref(int var, int offset) {
        return new ConstraintExpression(ExpressionKind.DEREF, var, offset);
    }

    /**
     * @return expression for <code>&amp;x</code>
     */
    public static ConstraintExpression addressOf(int var) {
        return new ConstraintExpression(ExpressionKind.ADDRESSOF, var, 0);
    }

    public ExpressionKind getKind() {
        return this.kind;
    }

    public int getVar() {
        return this.var;
    }

    public int getOffset() {
        return this.offset;
    }

    public boolean isScalar() {
        return this.kind == ExpressionKind.SCALAR;
    }

    public boolean isDeref() {
        return this.kind == ExpressionKind.DEREF;
    }

    public boolean isAddressOf() {
        return this.kind == ExpressionKind.ADDRESSOF;
    }

    public ConstraintExpression withVar(int newVar) {
        if (newVar == this.var) {
            return this;
        }
        return new ConstraintExpression(this.kind, newVar, this.offset);
    }

    public ConstraintExpression withKind(ExpressionKind newKind) {
        if (newKind == this.kind) {
            return this;
        }
        return new ConstraintExpression(newKind, this.var, this.offset);
    }

    public ConstraintExpression withOffset(int newOffset) {
        if (newOffset == this.offset) {
            return this;
        }
        return new ConstraintExpression(this.kind, this.var, newOffset);
    }

    @Override
    public int compareTo(ConstraintExpression o) {
        if (this.kind != o.kind) {
            return this.kind.compareTo(o.kind);
        }
        if (this.var != o.var) {
            return Integer.compare(this.var, o.var);
        }
        return Integer.compare(this.offset, o.offset);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.kind.hashCode();
        result = prime * result + this.var;
        result = prime * result + this.offset;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConstraintExpression)) {
            return false;
        }
        ConstraintExpression other = (ConstraintExpression) obj;
        return this.kind == other.kind && this.var == other.var && this.offset == other.offset;
    }

    /**
     * Render this expression using the given name for the variable, e.g. <code>*p + 32</code>
     */
    public String render(String varName) {
        StringBuilder sb = new StringBuilder();
        if (this.kind == ExpressionKind.ADDRESSOF) {
            sb.append('&');
        }
        else if (this.kind == ExpressionKind.DEREF) {
            sb.append('*');
        }
        sb.append(varName);
        if (this.offset != 0) {
            sb.append(" + ").append(this.offset);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render("v" + this.var);
    }
}
