package nl.bytesoflife.deltaspice.validation;

public class ValidationIssue {

    private final Severity severity;
    private final String componentId;
    private final String description;

    public ValidationIssue(Severity severity, String componentId, String description) {
        this.severity = severity;
        this.componentId = componentId;
        this.description = description;
    }

    public Severity getSeverity() { return severity; }

    /**
     * The component the issue is about, or {@code null} for circuit-wide issues.
     */
    public String getComponentId() { return componentId; }

    public String getDescription() { return description; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(severity).append("] ");
        if (componentId != null) {
            sb.append(componentId).append(": ");
        }
        sb.append(description);
        return sb.toString();
    }
}
