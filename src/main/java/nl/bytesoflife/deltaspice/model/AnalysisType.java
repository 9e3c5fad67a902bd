package nl.bytesoflife.deltaspice.model;

import java.util.Map;
import java.util.Optional;

public enum AnalysisType {
    DC_OPERATING_POINT("DC Operating Point"),
    DC_SWEEP("DC Sweep"),
    AC_SWEEP("AC Sweep"),
    TRANSIENT("Transient"),
    TEMPERATURE_SWEEP("Temperature Sweep"),
    NOISE("Noise"),
    SENSITIVITY("Sensitivity"),
    POLE_ZERO("Pole-Zero"),
    TRANSFER_FUNCTION("Transfer Function");

    private static final Map<String, AnalysisType> NAMES = Map.ofEntries(
            Map.entry("dc operating point", DC_OPERATING_POINT),
            Map.entry("operational point", DC_OPERATING_POINT),
            Map.entry("dc sweep", DC_SWEEP),
            Map.entry("ac sweep", AC_SWEEP),
            Map.entry("transient", TRANSIENT),
            Map.entry("temperature sweep", TEMPERATURE_SWEEP),
            Map.entry("noise", NOISE),
            Map.entry("sensitivity", SENSITIVITY),
            Map.entry("pole-zero", POLE_ZERO),
            Map.entry("transfer function", TRANSFER_FUNCTION)
    );

    private final String displayName;

    AnalysisType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a display name, including the legacy "Operational Point"
     * alias. Returns empty for names saved by a newer release.
     */
    public static Optional<AnalysisType> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(NAMES.get(name.trim().toLowerCase()));
    }

    public static AnalysisType fromName(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown analysis type: " + name));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
