package nl.bytesoflife.deltaspice.convergence;

import java.time.Duration;

/**
 * Runs the external simulator on a netlist. Implementations own process
 * handling and enforce the timeout.
 */
@FunctionalInterface
public interface SimulatorRunner {

    SimulatorRun run(String netlist, Duration timeout);
}
