package nl.bytesoflife.deltaspice.result;

/**
 * Small-signal transfer function. The impedances are {@code null} when the
 * simulator did not print them.
 */
public record TransferFunctionResult(double gain, Double outputImpedance, Double inputImpedance) {
}
