package nl.bytesoflife.deltaspice.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A placed schematic component. Identity and type are fixed at creation,
 * everything else is editable.
 */
public class Component {

    private final String componentId;
    private final ComponentType type;
    private String value;
    private String initialCondition;

    private WaveformType waveformType;
    private final Map<WaveformType, Map<String, String>> waveformParameters = new EnumMap<>(WaveformType.class);

    private String subcircuitName;
    private final List<String> subcircuitPins = new ArrayList<>();
    private String subcircuitDefinition;

    public Component(String componentId, ComponentType type) {
        this(componentId, type, type.getDefaultValue());
    }

    public Component(String componentId, ComponentType type, String value) {
        if (componentId == null || componentId.isBlank()) {
            throw new IllegalArgumentException("Component id must not be blank");
        }
        this.componentId = componentId;
        this.type = Objects.requireNonNull(type, "type");
        this.value = value;
        if (type == ComponentType.WAVEFORM_SOURCE) {
            this.waveformType = WaveformType.SIN;
            for (WaveformType wt : WaveformType.values()) {
                waveformParameters.put(wt, wt.defaultParameters());
            }
        }
    }

    public String getComponentId() { return componentId; }
    public ComponentType getType() { return type; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public String getInitialCondition() { return initialCondition; }

    /**
     * Sets the initial condition for a capacitor (voltage) or inductor (current).
     */
    public void setInitialCondition(String initialCondition) {
        if (type != ComponentType.CAPACITOR && type != ComponentType.INDUCTOR) {
            throw new IllegalStateException("Initial conditions apply to capacitors and inductors only, not " + type);
        }
        this.initialCondition = initialCondition;
    }

    public WaveformType getWaveformType() { return waveformType; }

    public void setWaveformType(WaveformType waveformType) {
        requireWaveformSource();
        this.waveformType = Objects.requireNonNull(waveformType);
    }

    public Map<String, String> getWaveformParameters(WaveformType type) {
        Map<String, String> params = waveformParameters.get(type);
        return params == null ? Map.of() : Collections.unmodifiableMap(params);
    }

    public void setWaveformParameter(WaveformType type, String name, String value) {
        requireWaveformSource();
        if (!type.getParameterNames().contains(name)) {
            throw new IllegalArgumentException("Unknown " + type + " parameter: " + name);
        }
        waveformParameters.get(type).put(name, value);
    }

    public String getSubcircuitName() { return subcircuitName; }
    public List<String> getSubcircuitPins() { return Collections.unmodifiableList(subcircuitPins); }
    public String getSubcircuitDefinition() { return subcircuitDefinition; }

    /**
     * Binds a subcircuit instance to its definition. The pin list fixes the
     * terminal count.
     */
    public void setSubcircuit(String name, List<String> pins, String definition) {
        if (type != ComponentType.SUBCIRCUIT) {
            throw new IllegalStateException("Not a subcircuit: " + componentId);
        }
        this.subcircuitName = name;
        this.subcircuitPins.clear();
        this.subcircuitPins.addAll(pins);
        this.subcircuitDefinition = definition;
    }

    public int getTerminalCount() {
        if (type == ComponentType.SUBCIRCUIT) {
            return subcircuitPins.size();
        }
        return type.getTerminalCount();
    }

    /**
     * Value as it appears in a netlist. Waveform sources render their
     * source function, every other component its raw value.
     */
    public String getSpiceValue() {
        if (type != ComponentType.WAVEFORM_SOURCE || waveformType == null) {
            return value;
        }
        return waveformType.toSpice(waveformParameters.get(waveformType));
    }

    private void requireWaveformSource() {
        if (type != ComponentType.WAVEFORM_SOURCE) {
            throw new IllegalStateException("Not a waveform source: " + componentId);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(componentId).append(" [").append(type).append("]");
        if (value != null && !value.isEmpty()) {
            sb.append(" = ").append(value);
        }
        return sb.toString();
    }
}
