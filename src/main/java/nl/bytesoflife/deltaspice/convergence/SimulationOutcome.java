package nl.bytesoflife.deltaspice.convergence;

import java.util.Optional;

/**
 * Final run of a simulation request. {@code diagnosis} is present when the
 * final run failed, or when it succeeded only after relaxing tolerances.
 */
public record SimulationOutcome(SimulatorRun run, ErrorDiagnosis diagnosis, boolean relaxedTolerances, int attempts) {

    public boolean succeeded() {
        return run.succeeded();
    }

    public Optional<ErrorDiagnosis> getDiagnosis() {
        return Optional.ofNullable(diagnosis);
    }

    /**
     * Text to show the user, or empty for a clean first-attempt success. A
     * success after relaxing tolerances explains the first failure with
     * the relaxed-tolerance note in front.
     */
    public Optional<String> userMessage() {
        if (diagnosis == null) return Optional.empty();
        return Optional.of(ConvergenceClassifier.formatUserMessage(diagnosis, succeeded() && relaxedTolerances));
    }
}
