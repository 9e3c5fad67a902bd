package nl.bytesoflife.deltaspice.convergence;

public enum ErrorCategory {
    DC_CONVERGENCE(true),
    TIMESTEP_TOO_SMALL(true),
    SINGULAR_MATRIX(false),
    SOURCE_STEPPING_FAILED(true),
    UNKNOWN(false);

    private final boolean retriable;

    ErrorCategory(boolean retriable) {
        this.retriable = retriable;
    }

    /**
     * Whether relaxed tolerances have a chance of fixing this failure.
     */
    public boolean isRetriable() {
        return retriable;
    }
}
