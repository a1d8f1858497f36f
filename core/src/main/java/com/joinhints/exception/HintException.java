package com.joinhints.exception;

/**
 * Exception raised when a hint problem is escalated to a compilation failure.
 *
 * <p>Hint problems are diagnostics by default; this exception is only thrown by error handlers
 * configured to be strict.
 *
 * @see com.joinhints.hint.StrictHintErrorHandler
 */
public class HintException extends RuntimeException {

    /**
     * The kind of hint problem that was escalated.
     */
    public enum Kind {
        UNRECOGNIZED_HINT,
        RELATIONS_NOT_FOUND,
        JOIN_NOT_FOUND,
        HINT_OVERRIDDEN
    }

    private final Kind kind;

    /**
     * Creates a hint exception.
     *
     * @param kind the kind of problem
     * @param message the error message
     */
    public HintException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return the message with guidance on how to fix the query
     */
    public String getUserMessage() {
        switch (kind) {
            case UNRECOGNIZED_HINT:
                return getMessage() + ". Check the hint name for typos.";
            case RELATIONS_NOT_FOUND:
                return getMessage() + " Use a table name or alias visible where the hint is written.";
            case JOIN_NOT_FOUND:
                return getMessage() + " Move the hint onto an input of a join.";
            case HINT_OVERRIDDEN:
                return getMessage() + " Remove one of the conflicting hints.";
            default:
                return getMessage();
        }
    }
}
