package nl.bytesoflife.deltaspice.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AC sweep output. Magnitude and phase series are keyed by node and aligned
 * by index with {@link #frequencies()}.
 */
public record AcResult(List<String> headers,
                       List<Double> frequencies,
                       Map<String, List<Double>> magnitude,
                       Map<String, List<Double>> phase) {

    public AcResult {
        headers = List.copyOf(headers);
        frequencies = List.copyOf(frequencies);
        magnitude = copy(magnitude);
        phase = copy(phase);
    }

    private static Map<String, List<Double>> copy(Map<String, List<Double>> series) {
        Map<String, List<Double>> result = new LinkedHashMap<>();
        series.forEach((k, v) -> result.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(result);
    }
}
