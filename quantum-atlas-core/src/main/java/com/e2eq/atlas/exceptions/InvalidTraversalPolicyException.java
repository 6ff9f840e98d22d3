package com.e2eq.atlas.exceptions;

/**
 * Thrown when a traversal policy is built with values no traversal can honor,
 * such as a negative depth limit or a non-positive result cap.
 * <p>
 * Policies are validated when they are constructed, never in the middle of a traversal.
 * </p>
 */
public class InvalidTraversalPolicyException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidTraversalPolicyException(String field, String message) {
        super("Invalid traversal policy field '" + field + "': " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
