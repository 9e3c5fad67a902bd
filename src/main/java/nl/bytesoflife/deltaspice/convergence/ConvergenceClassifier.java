package nl.bytesoflife.deltaspice.convergence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps ngspice failure output to an {@link ErrorCategory} and its fixed
 * diagnosis.
 */
public final class ConvergenceClassifier {

    private record ErrorPattern(Pattern pattern, ErrorCategory category) {
    }

    // Order matters: first match wins, so the specific phrases precede the
    // generic "no convergence".
    private static final List<ErrorPattern> PATTERNS = List.of(
            new ErrorPattern(Pattern.compile("singular matrix", Pattern.CASE_INSENSITIVE),
                    ErrorCategory.SINGULAR_MATRIX),
            new ErrorPattern(Pattern.compile("no convergence in dc operating point", Pattern.CASE_INSENSITIVE),
                    ErrorCategory.DC_CONVERGENCE),
            new ErrorPattern(Pattern.compile("doAnalyses:.*timestep too small", Pattern.CASE_INSENSITIVE),
                    ErrorCategory.TIMESTEP_TOO_SMALL),
            new ErrorPattern(Pattern.compile("source stepping failed", Pattern.CASE_INSENSITIVE),
                    ErrorCategory.SOURCE_STEPPING_FAILED),
            new ErrorPattern(Pattern.compile("no convergence", Pattern.CASE_INSENSITIVE),
                    ErrorCategory.DC_CONVERGENCE)
    );

    /**
     * Options used for the single relaxed-tolerance retry.
     */
    public static final Map<String, String> RELAXED_OPTIONS;

    static {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("reltol", "0.01");
        options.put("abstol", "1e-10");
        options.put("vntol", "1e-4");
        options.put("itl1", "500");
        options.put("itl4", "200");
        RELAXED_OPTIONS = Collections.unmodifiableMap(options);
    }

    static final String RELAXED_NOTE =
            "Simulation converged with relaxed tolerances (results may be less accurate).\n";

    private static final Map<ErrorCategory, ErrorDiagnosis> DIAGNOSES = new EnumMap<>(ErrorCategory.class);

    static {
        DIAGNOSES.put(ErrorCategory.DC_CONVERGENCE, new ErrorDiagnosis(
                ErrorCategory.DC_CONVERGENCE,
                "The simulator could not find a stable DC operating point for your circuit.",
                List.of(
                        "A node is not connected to ground (floating node)",
                        "Component values are unrealistic (e.g. 0 ohm resistor, extremely large gain)",
                        "Positive feedback loop without a stable bias point"),
                List.of(
                        "Check that every node has a DC path to ground",
                        "Add a large resistor (e.g. 1G) from floating nodes to ground",
                        "Verify component values are within realistic ranges")));
        DIAGNOSES.put(ErrorCategory.TIMESTEP_TOO_SMALL, new ErrorDiagnosis(
                ErrorCategory.TIMESTEP_TOO_SMALL,
                "The transient simulation could not advance in time — the required timestep became too small.",
                List.of(
                        "Very fast switching edges combined with large time constants",
                        "Numerical oscillation in a feedback loop",
                        "Unrealistic component values causing stiff equations"),
                List.of(
                        "Increase the simulation time step in the analysis settings",
                        "Reduce the simulation duration or avoid very fast signal edges",
                        "Check for unrealistic component values (very small capacitors with very large resistors)")));
        DIAGNOSES.put(ErrorCategory.SINGULAR_MATRIX, new ErrorDiagnosis(
                ErrorCategory.SINGULAR_MATRIX,
                "The circuit equations could not be solved — the matrix is singular.",
                List.of(
                        "Two voltage sources are connected in parallel",
                        "A loop of voltage sources and/or inductors with no resistance",
                        "A node is completely disconnected from the rest of the circuit"),
                List.of(
                        "Ensure no two voltage sources are directly in parallel",
                        "Add a small series resistor (e.g. 1m ohm) to inductor or voltage-source loops",
                        "Check for disconnected nodes or components")));
        DIAGNOSES.put(ErrorCategory.SOURCE_STEPPING_FAILED, new ErrorDiagnosis(
                ErrorCategory.SOURCE_STEPPING_FAILED,
                "The simulator tried ramping sources gradually but still could not converge.",
                List.of(
                        "Circuit has a very sensitive operating point",
                        "Non-linear devices (diodes, transistors) with difficult bias conditions"),
                List.of(
                        "Simplify the circuit and add components back one at a time",
                        "Check transistor bias conditions — ensure they are in the expected region",
                        "Try different initial conditions or component values")));
        DIAGNOSES.put(ErrorCategory.UNKNOWN, new ErrorDiagnosis(
                ErrorCategory.UNKNOWN,
                "The simulation failed for an unexpected reason.",
                List.of(),
                List.of(
                        "Check the netlist for syntax errors",
                        "Verify all components are connected properly",
                        "Try a simpler circuit to isolate the problem")));
    }

    private ConvergenceClassifier() {
    }

    /**
     * Classifies stderr first and stdout second; the first stream with a
     * matching pattern decides.
     */
    public static ErrorCategory classify(String stderr, String stdout) {
        for (String text : new String[]{stderr, stdout}) {
            if (text == null || text.isEmpty()) continue;
            for (ErrorPattern p : PATTERNS) {
                if (p.pattern().matcher(text).find()) {
                    return p.category();
                }
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    public static ErrorCategory classify(String stderr) {
        return classify(stderr, "");
    }

    public static ErrorDiagnosis diagnose(String stderr, String stdout) {
        return diagnosis(classify(stderr, stdout));
    }

    public static ErrorDiagnosis diagnosis(ErrorCategory category) {
        return DIAGNOSES.get(category);
    }

    public static boolean isRetriable(ErrorCategory category) {
        return category.isRetriable();
    }

    /**
     * The relaxed-tolerance {@code .options} line.
     */
    public static List<String> formatOptionsLines() {
        return formatOptionsLines(RELAXED_OPTIONS);
    }

    /**
     * One {@code .options k=v ...} line in map order, or no lines for an
     * empty map.
     */
    public static List<String> formatOptionsLines(Map<String, String> options) {
        if (options == null) {
            return formatOptionsLines();
        }
        if (options.isEmpty()) {
            return List.of();
        }
        StringBuilder sb = new StringBuilder(".options");
        options.forEach((k, v) -> sb.append(' ').append(k).append('=').append(v));
        return List.of(sb.toString());
    }

    /**
     * Student-facing explanation: message, causes and suggestions, prefixed
     * with a note when the run only succeeded with relaxed tolerances.
     */
    public static String formatUserMessage(ErrorDiagnosis diagnosis, boolean relaxed) {
        List<String> parts = new ArrayList<>();
        if (relaxed) {
            parts.add(RELAXED_NOTE);
        }
        parts.add(diagnosis.message());
        if (!diagnosis.causes().isEmpty()) {
            parts.add("\nCommon causes:");
            for (String cause : diagnosis.causes()) {
                parts.add("  - " + cause);
            }
        }
        if (!diagnosis.suggestions().isEmpty()) {
            parts.add("\nSuggestions:");
            for (String suggestion : diagnosis.suggestions()) {
                parts.add("  - " + suggestion);
            }
        }
        return String.join("\n", parts);
    }
}
