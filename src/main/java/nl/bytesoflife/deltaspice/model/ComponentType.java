package nl.bytesoflife.deltaspice.model;

import java.util.Map;

/**
 * Closed catalogue of schematic component types with their terminal counts,
 * SPICE element prefix and default value.
 */
public enum ComponentType {
    RESISTOR("Resistor", "Resistor", 2, "R", "1k"),
    CAPACITOR("Capacitor", "Capacitor", 2, "C", "1u"),
    INDUCTOR("Inductor", "Inductor", 2, "L", "1m"),
    VOLTAGE_SOURCE("Voltage Source", "VoltageSource", 2, "V", "5V"),
    CURRENT_SOURCE("Current Source", "CurrentSource", 2, "I", "1A"),
    WAVEFORM_SOURCE("Waveform Source", "WaveformVoltageSource", 2, "V", "SIN(0 5 1k)"),
    GROUND("Ground", "Ground", 1, "", "0V"),
    OP_AMP("Op-Amp", "OpAmp", 3, "X", "Ideal"),
    VCVS("VCVS", "VCVS", 4, "E", "1"),
    CCVS("CCVS", "CCVS", 4, "H", "1k"),
    VCCS("VCCS", "VCCS", 4, "G", "1m"),
    CCCS("CCCS", "CCCS", 4, "F", "1"),
    BJT_NPN("BJT NPN", "BJTNPN", 3, "Q", "2N3904"),
    BJT_PNP("BJT PNP", "BJTPNP", 3, "Q", "2N3906"),
    MOSFET_NMOS("MOSFET NMOS", "MOSFETNMOS", 3, "M", "NMOS1"),
    MOSFET_PMOS("MOSFET PMOS", "MOSFETPMOS", 3, "M", "PMOS1"),
    VC_SWITCH("VC Switch", "VCSwitch", 4, "S", "VT=2.5 RON=1 ROFF=1e6"),
    DIODE("Diode", "Diode", 2, "D", "IS=1e-14 N=1"),
    LED("LED", "LEDComponent", 2, "D", "IS=1e-20 N=1.8 EG=1.9"),
    ZENER_DIODE("Zener Diode", "ZenerDiode", 2, "D", "IS=1e-14 N=1 BV=5.1 IBV=1e-3"),
    TRANSFORMER("Transformer", "Transformer", 4, "K", "10mH 10mH 0.99"),
    SUBCIRCUIT("Subcircuit", "SubcircuitInstance", 0, "X", "");

    private static final Map<String, ComponentType> NAMES = Map.ofEntries(
            Map.entry("resistor", RESISTOR),
            Map.entry("capacitor", CAPACITOR),
            Map.entry("inductor", INDUCTOR),
            Map.entry("voltage source", VOLTAGE_SOURCE),
            Map.entry("voltagesource", VOLTAGE_SOURCE),
            Map.entry("current source", CURRENT_SOURCE),
            Map.entry("currentsource", CURRENT_SOURCE),
            Map.entry("waveform source", WAVEFORM_SOURCE),
            Map.entry("waveformvoltagesource", WAVEFORM_SOURCE),
            Map.entry("ground", GROUND),
            Map.entry("op-amp", OP_AMP),
            Map.entry("opamp", OP_AMP),
            Map.entry("vcvs", VCVS),
            Map.entry("ccvs", CCVS),
            Map.entry("vccs", VCCS),
            Map.entry("cccs", CCCS),
            Map.entry("bjt npn", BJT_NPN),
            Map.entry("bjtnpn", BJT_NPN),
            Map.entry("bjt pnp", BJT_PNP),
            Map.entry("bjtpnp", BJT_PNP),
            Map.entry("mosfet nmos", MOSFET_NMOS),
            Map.entry("mosfetnmos", MOSFET_NMOS),
            Map.entry("mosfet pmos", MOSFET_PMOS),
            Map.entry("mosfetpmos", MOSFET_PMOS),
            Map.entry("vc switch", VC_SWITCH),
            Map.entry("vcswitch", VC_SWITCH),
            Map.entry("diode", DIODE),
            Map.entry("led", LED),
            Map.entry("ledcomponent", LED),
            Map.entry("zener diode", ZENER_DIODE),
            Map.entry("zenerdiode", ZENER_DIODE),
            Map.entry("transformer", TRANSFORMER),
            Map.entry("subcircuit", SUBCIRCUIT),
            Map.entry("subcircuitinstance", SUBCIRCUIT)
    );

    private final String displayName;
    private final String className;
    private final int terminalCount;
    private final String spicePrefix;
    private final String defaultValue;

    ComponentType(String displayName, String className, int terminalCount,
                  String spicePrefix, String defaultValue) {
        this.displayName = displayName;
        this.className = className;
        this.terminalCount = terminalCount;
        this.spicePrefix = spicePrefix;
        this.defaultValue = defaultValue;
    }

    public String getDisplayName() { return displayName; }
    public String getClassName() { return className; }
    public String getSpicePrefix() { return spicePrefix; }
    public String getDefaultValue() { return defaultValue; }

    /**
     * Number of terminals for this type. Subcircuits report 0 here because
     * their count comes from the instance's pin list.
     */
    public int getTerminalCount() { return terminalCount; }

    public boolean isSource() {
        return this == VOLTAGE_SOURCE || this == CURRENT_SOURCE || this == WAVEFORM_SOURCE;
    }

    public boolean isDiode() {
        return this == DIODE || this == LED || this == ZENER_DIODE;
    }

    public boolean isBjt() {
        return this == BJT_NPN || this == BJT_PNP;
    }

    public boolean isMosfet() {
        return this == MOSFET_NMOS || this == MOSFET_PMOS;
    }

    /**
     * Looks up a type by display name ("Voltage Source") or by its legacy
     * class name ("VoltageSource"), case-insensitively.
     */
    public static ComponentType fromName(String name) {
        ComponentType type = NAMES.get(name.trim().toLowerCase());
        if (type == null) {
            throw new IllegalArgumentException("Unknown component type: " + name);
        }
        return type;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
