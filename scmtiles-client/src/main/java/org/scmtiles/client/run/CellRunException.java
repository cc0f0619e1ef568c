package org.scmtiles.client.run;

/**
 * Failure of one step of a cell run.
 */
public class CellRunException
        extends Exception {

    private final FailureKind failureKind;

    public CellRunException(final FailureKind failureKind,
                            final String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public CellRunException(final FailureKind failureKind,
                            final String message,
                            final Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    @Override
    public String getMessage() {
        return failureKind + ": " + super.getMessage();
    }
}
