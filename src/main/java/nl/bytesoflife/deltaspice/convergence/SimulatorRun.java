package nl.bytesoflife.deltaspice.convergence;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What one simulator invocation produced.
 */
public record SimulatorRun(int exitStatus, String stdout, String stderr, Path outputFile) {

    public SimulatorRun {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitStatus == 0;
    }

    public Optional<Path> output() {
        return Optional.ofNullable(outputFile);
    }
}
