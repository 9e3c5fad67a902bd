package nl.bytesoflife.deltaspice.preset;

import nl.bytesoflife.deltaspice.model.AnalysisSpec;
import nl.bytesoflife.deltaspice.model.AnalysisType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named analysis configuration.
 */
public record SimulationPreset(String name, AnalysisType analysisType, Map<String, Object> params, boolean builtin) {

    public SimulationPreset {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(analysisType, "analysisType");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public AnalysisSpec toAnalysisSpec() {
        return new AnalysisSpec(analysisType, params);
    }
}
