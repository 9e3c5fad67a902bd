package nl.bytesoflife.deltaspice.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-domain waveform shapes a waveform source can produce, with their
 * positional SPICE parameters in order.
 */
public enum WaveformType {
    SIN(List.of(
            Map.entry("offset", "0"),
            Map.entry("amplitude", "5"),
            Map.entry("frequency", "1k"),
            Map.entry("delay", "0"),
            Map.entry("theta", "0"),
            Map.entry("phase", "0"))),
    PULSE(List.of(
            Map.entry("v1", "0"),
            Map.entry("v2", "5"),
            Map.entry("td", "0"),
            Map.entry("tr", "1n"),
            Map.entry("tf", "1n"),
            Map.entry("pw", "500u"),
            Map.entry("per", "1m"))),
    EXP(List.of(
            Map.entry("v1", "0"),
            Map.entry("v2", "5"),
            Map.entry("td1", "0"),
            Map.entry("tau1", "1u"),
            Map.entry("td2", "2u"),
            Map.entry("tau2", "2u")));

    private final List<Map.Entry<String, String>> parameters;

    WaveformType(List<Map.Entry<String, String>> parameters) {
        this.parameters = parameters;
    }

    public List<String> getParameterNames() {
        return parameters.stream().map(Map.Entry::getKey).toList();
    }

    public Map<String, String> defaultParameters() {
        Map<String, String> defaults = new LinkedHashMap<>();
        for (Map.Entry<String, String> p : parameters) {
            defaults.put(p.getKey(), p.getValue());
        }
        return defaults;
    }

    /**
     * Renders the SPICE source function, e.g. {@code SIN(0 5 1k 0 0 0)}.
     * Missing parameters fall back to their defaults.
     */
    public String toSpice(Map<String, String> values) {
        StringBuilder sb = new StringBuilder(name()).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(' ');
            Map.Entry<String, String> p = parameters.get(i);
            sb.append(values.getOrDefault(p.getKey(), p.getValue()));
        }
        sb.append(')');
        return sb.toString();
    }

    public static WaveformType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown waveform type: " + name, e);
        }
    }
}
