package nl.bytesoflife.deltaspice.netlist;

/**
 * Something the generator had to work around. The netlist is still
 * produced; the issue tells the caller what was degraded.
 */
public record NetlistIssue(Kind kind, String subject, String message) {

    public enum Kind {
        UNKNOWN_ANALYSIS,
        UNCONNECTED_TERMINAL,
        DC_SWEEP_WITHOUT_SOURCE,
        UNKNOWN_OPAMP_MODEL,
        MISSING_SUBCIRCUIT_DEFINITION
    }

    @Override
    public String toString() {
        return "[" + kind + "] " + subject + ": " + message;
    }
}
