package nl.bytesoflife.deltaspice.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An analysis to run plus its type-specific parameters. Values are either
 * numbers or raw strings such as {@code "10u"}.
 */
public record AnalysisSpec(AnalysisType type, Map<String, Object> params) {

    public AnalysisSpec {
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static AnalysisSpec of(AnalysisType type) {
        return new AnalysisSpec(type, Map.of());
    }

    public static AnalysisSpec of(AnalysisType type, Map<String, Object> params) {
        return new AnalysisSpec(type, params);
    }

    /**
     * First present value among the given keys, so aliases such as
     * {@code sweep_type}/{@code sweepType} resolve to the same setting.
     */
    public Object param(Object defaultValue, String... keys) {
        for (String key : keys) {
            Object v = params.get(key);
            if (v != null) return v;
        }
        return defaultValue;
    }
}
