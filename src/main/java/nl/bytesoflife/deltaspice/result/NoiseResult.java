package nl.bytesoflife.deltaspice.result;

import java.util.List;

/**
 * Output- and input-referred noise spectral densities per frequency point.
 */
public record NoiseResult(List<Double> frequencies, List<Double> outputNoise, List<Double> inputNoise) {

    public NoiseResult {
        frequencies = List.copyOf(frequencies);
        outputNoise = List.copyOf(outputNoise);
        inputNoise = List.copyOf(inputNoise);
    }
}
