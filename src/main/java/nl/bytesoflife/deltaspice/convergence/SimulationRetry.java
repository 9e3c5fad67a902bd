package nl.bytesoflife.deltaspice.convergence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a netlist and, when the failure is a convergence problem, retries
 * exactly once with relaxed tolerances.
 *
 * <pre>
 * SimulationOutcome outcome = new SimulationRetry(runner)
 *     .withTimeout(Duration.ofSeconds(30))
 *     .run(netlist.text());
 * </pre>
 */
public class SimulationRetry {

    private static final Logger log = LoggerFactory.getLogger(SimulationRetry.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final SimulatorRunner runner;
    private Duration timeout = DEFAULT_TIMEOUT;
    private Map<String, String> relaxedOptions = ConvergenceClassifier.RELAXED_OPTIONS;

    public SimulationRetry(SimulatorRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public SimulationRetry withTimeout(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        return this;
    }

    public SimulationRetry withRelaxedOptions(Map<String, String> options) {
        this.relaxedOptions = Objects.requireNonNull(options, "options");
        return this;
    }

    public SimulationOutcome run(String netlist) {
        SimulatorRun first = runner.run(netlist, timeout);
        if (first.succeeded()) {
            return new SimulationOutcome(first, null, false, 1);
        }

        ErrorDiagnosis diagnosis = ConvergenceClassifier.diagnose(first.stderr(), first.stdout());
        List<String> optionLines = ConvergenceClassifier.formatOptionsLines(relaxedOptions);
        if (!diagnosis.retriable() || optionLines.isEmpty()) {
            log.info("Simulation failed ({}), not retrying", diagnosis.category());
            return new SimulationOutcome(first, diagnosis, false, 1);
        }

        log.info("Simulation failed ({}), retrying once with relaxed tolerances", diagnosis.category());
        SimulatorRun second = runner.run(insertBeforeEnd(netlist, optionLines), timeout);
        if (second.succeeded()) {
            return new SimulationOutcome(second, diagnosis, true, 2);
        }
        ErrorDiagnosis retryDiagnosis = ConvergenceClassifier.diagnose(second.stderr(), second.stdout());
        log.info("Retry with relaxed tolerances failed ({})", retryDiagnosis.category());
        return new SimulationOutcome(second, retryDiagnosis, true, 2);
    }

    /**
     * Inserts {@code directives} before the last {@code .end} line, or
     * appends them when there is none.
     */
    static String insertBeforeEnd(String netlist, List<String> directives) {
        List<String> lines = new ArrayList<>(netlist.lines().toList());
        int end = -1;
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).strip().equalsIgnoreCase(".end")) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            lines.addAll(directives);
        } else {
            lines.addAll(end, directives);
        }
        return String.join("\n", lines) + "\n";
    }
}
