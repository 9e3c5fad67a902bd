package nl.bytesoflife.deltaspice.convergence;

import java.util.List;
import java.util.Objects;

/**
 * Fixed user-facing explanation of a simulation failure category.
 */
public record ErrorDiagnosis(ErrorCategory category, String message, List<String> causes, List<String> suggestions) {

    public ErrorDiagnosis {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        causes = List.copyOf(causes);
        suggestions = List.copyOf(suggestions);
    }

    public boolean retriable() {
        return category.isRetriable();
    }
}
