package nl.bytesoflife.deltaspice.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ValidationReport {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addIssue(ValidationIssue issue) {
        issues.add(issue);
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<ValidationIssue> getErrors() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<ValidationIssue> getWarnings() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.getSeverity() == Severity.ERROR);
    }

    public boolean isValid() {
        return !hasErrors();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Validation Report:\n");
        sb.append("  Issues: ").append(issues.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (ValidationIssue issue : issues) {
            sb.append("  - ").append(issue).append("\n");
        }
        return sb.toString();
    }
}
