package analysis.pointer.constraints;

/**
 * Kind of a constraint expression. The declaration order is the order used to sort constraint expressions.
 */
public enum ExpressionKind {
    /**
     * The variable itself, <code>x</code>
     */
    SCALAR,
    /**
     * What the variable points to, <code>*x</code>
     */
    DEREF,
    /**
     * The address of the variable, <code>&amp;x</code>
     */
    ADDRESSOF;
}
