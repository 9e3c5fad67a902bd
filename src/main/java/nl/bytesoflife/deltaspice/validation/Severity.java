package nl.bytesoflife.deltaspice.validation;

public enum Severity {
    /** Blocks simulation. */
    ERROR,
    WARNING
}
