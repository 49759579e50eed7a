package analysis.pointer.engine;

/**
 * Thrown when the state of the constraint graph or the variable table violates an invariant the solver relies on.
 * Continuing would produce an unsound result, so this is never caught by the analysis.
 */
public class InternalInconsistencyException extends RuntimeException {

    private static final long serialVersionUID = -6127457460935282346L;

    public InternalInconsistencyException(String message) {
        super(message);
    }

}
