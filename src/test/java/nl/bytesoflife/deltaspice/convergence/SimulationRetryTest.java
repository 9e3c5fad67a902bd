package nl.bytesoflife.deltaspice.convergence;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulationRetryTest {

    private static final String NETLIST = """
            test
            R1 a 0 1k
            .op
            .control
            run
            .endc

            .end
            """;

    /** Replays canned runs and records every netlist it was given. */
    private static class ScriptedRunner implements SimulatorRunner {
        private final Deque<SimulatorRun> runs;
        private final List<String> netlists = new ArrayList<>();
        private final List<Duration> timeouts = new ArrayList<>();

        ScriptedRunner(SimulatorRun... runs) {
            this.runs = new ArrayDeque<>(List.of(runs));
        }

        @Override
        public SimulatorRun run(String netlist, Duration timeout) {
            netlists.add(netlist);
            timeouts.add(timeout);
            return runs.removeFirst();
        }
    }

    private static SimulatorRun ok() {
        return new SimulatorRun(0, "v(a) = 0", "", null);
    }

    private static SimulatorRun failed(String stderr) {
        return new SimulatorRun(1, "", stderr, null);
    }

    @Test
    void firstAttemptSuccessRunsOnce() {
        ScriptedRunner runner = new ScriptedRunner(ok());

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertTrue(outcome.succeeded());
        assertEquals(1, outcome.attempts());
        assertFalse(outcome.relaxedTolerances());
        assertTrue(outcome.getDiagnosis().isEmpty());
        assertTrue(outcome.userMessage().isEmpty());
        assertEquals(List.of(NETLIST), runner.netlists);
        assertEquals(List.of(SimulationRetry.DEFAULT_TIMEOUT), runner.timeouts);
    }

    @Test
    void convergenceFailureRetriesOnceWithRelaxedOptions() {
        ScriptedRunner runner = new ScriptedRunner(failed("no convergence in dc operating point"), ok());

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertTrue(outcome.succeeded());
        assertEquals(2, outcome.attempts());
        assertTrue(outcome.relaxedTolerances());
        assertEquals(ErrorCategory.DC_CONVERGENCE, outcome.getDiagnosis().orElseThrow().category());
        assertTrue(outcome.userMessage().orElseThrow().startsWith(ConvergenceClassifier.RELAXED_NOTE));

        List<String> retried = runner.netlists.get(1).lines().toList();
        int options = retried.indexOf(".options reltol=0.01 abstol=1e-10 vntol=1e-4 itl1=500 itl4=200");
        assertTrue(options > retried.indexOf(".endc"));
        assertEquals(".end", retried.get(options + 1));
    }

    @Test
    void failedRetryReportsRetryDiagnosis() {
        ScriptedRunner runner = new ScriptedRunner(
                failed("doAnalyses: TRAN: Timestep too small"),
                failed("singular matrix"));

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertFalse(outcome.succeeded());
        assertEquals(2, outcome.attempts());
        assertTrue(outcome.relaxedTolerances());
        assertEquals(ErrorCategory.SINGULAR_MATRIX, outcome.getDiagnosis().orElseThrow().category());
        assertFalse(outcome.userMessage().orElseThrow().startsWith(ConvergenceClassifier.RELAXED_NOTE));
    }

    @Test
    void nonRetriableFailureIsNotRetried() {
        ScriptedRunner runner = new ScriptedRunner(failed("singular matrix"));

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertFalse(outcome.succeeded());
        assertEquals(1, outcome.attempts());
        assertFalse(outcome.relaxedTolerances());
        assertEquals(ErrorCategory.SINGULAR_MATRIX, outcome.getDiagnosis().orElseThrow().category());
        assertEquals(1, runner.netlists.size());
    }

    @Test
    void unknownFailureIsNotRetried() {
        ScriptedRunner runner = new ScriptedRunner(failed("Error: unknown model"));

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertEquals(ErrorCategory.UNKNOWN, outcome.getDiagnosis().orElseThrow().category());
        assertEquals(1, outcome.attempts());
    }

    @Test
    void emptyRelaxedOptionsDisableRetry() {
        ScriptedRunner runner = new ScriptedRunner(failed("no convergence"));

        SimulationOutcome outcome = new SimulationRetry(runner).withRelaxedOptions(Map.of()).run(NETLIST);

        assertEquals(1, outcome.attempts());
        assertEquals(1, runner.netlists.size());
    }

    @Test
    void customTimeoutIsPassedToEveryRun() {
        ScriptedRunner runner = new ScriptedRunner(failed("source stepping failed"), ok());

        new SimulationRetry(runner).withTimeout(Duration.ofSeconds(5)).run(NETLIST);

        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5)), runner.timeouts);
    }

    @Test
    void failureCategoryReadFromStdoutWhenStderrIsSilent() {
        ScriptedRunner runner = new ScriptedRunner(
                new SimulatorRun(1, "Warning: no convergence in DC operating point", null, null), ok());

        SimulationOutcome outcome = new SimulationRetry(runner).run(NETLIST);

        assertEquals(2, outcome.attempts());
        assertEquals(ErrorCategory.DC_CONVERGENCE, outcome.getDiagnosis().orElseThrow().category());
    }

    @Test
    void insertBeforeEndUsesLastEndLine() {
        String netlist = "title\n.end\nR1 a 0 1\n.END\n";

        String result = SimulationRetry.insertBeforeEnd(netlist, List.of(".options reltol=0.01"));

        assertEquals("title\n.end\nR1 a 0 1\n.options reltol=0.01\n.END\n", result);
    }

    @Test
    void insertBeforeEndAppendsWhenNoEnd() {
        assertEquals("title\nR1 a 0 1\n.options x=1\n",
                SimulationRetry.insertBeforeEnd("title\nR1 a 0 1", List.of(".options x=1")));
    }
}
