package nl.bytesoflife.deltaspice.preset;

import nl.bytesoflife.deltaspice.model.AnalysisType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads preset files:
 *
 * <pre>
 * (version 1)
 * (preset "Audio AC Sweep"
 *   (analysis "AC Sweep")
 *   (param fStart 20)
 *   (param sweepType dec))
 * </pre>
 *
 * Numeric parameter values become {@link Long} or {@link Double}, anything
 * else stays a string.
 */
public class PresetParser {

    public static final int SUPPORTED_VERSION = 1;

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private final boolean builtin;

    public PresetParser() {
        this(false);
    }

    PresetParser(boolean builtin) {
        this.builtin = builtin;
    }

    public List<SimulationPreset> parse(String content) {
        List<SNode> nodes = new SExpressionParser().parse(content);
        List<SimulationPreset> presets = new ArrayList<>();
        for (SNode node : nodes) {
            if (!(node instanceof SNode.SList list)) continue;
            switch (list.tag()) {
                case "version" -> checkVersion(list);
                case "preset" -> presets.add(parsePreset(list));
                default -> {
                    // unknown top-level entries are ignored
                }
            }
        }
        return presets;
    }

    private void checkVersion(SNode.SList list) {
        String value = list.atom(1).orElse("");
        int version;
        try {
            version = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid preset file version: '" + value + "'", e);
        }
        if (version > SUPPORTED_VERSION) {
            throw new IllegalArgumentException("Unsupported preset file version " + version
                    + " (supported up to " + SUPPORTED_VERSION + ")");
        }
    }

    private SimulationPreset parsePreset(SNode.SList list) {
        String name = list.atom(1)
                .filter(s -> !s.isBlank())
                .orElseThrow(() -> new IllegalArgumentException("Preset without a name: " + list));
        AnalysisType type = null;
        Map<String, Object> params = new LinkedHashMap<>();

        for (int i = 2; i < list.children().size(); i++) {
            if (!(list.children().get(i) instanceof SNode.SList child)) continue;
            switch (child.tag()) {
                case "analysis" -> type = AnalysisType.fromName(child.atom(1).orElse(""));
                case "param" -> {
                    String key = child.atom(1)
                            .orElseThrow(() -> new IllegalArgumentException("Parameter without a key in preset '" + name + "'"));
                    String value = child.atom(2)
                            .orElseThrow(() -> new IllegalArgumentException("Parameter '" + key + "' without a value in preset '" + name + "'"));
                    params.put(key, toValue(value));
                }
                default -> {
                }
            }
        }
        if (type == null) {
            throw new IllegalArgumentException("Preset '" + name + "' has no analysis type");
        }
        return new SimulationPreset(name, type, params, builtin);
    }

    static Object toValue(String atom) {
        if (INTEGER.matcher(atom).matches()) {
            return Long.parseLong(atom);
        }
        if (DECIMAL.matcher(atom).matches()) {
            return Double.parseDouble(atom);
        }
        return atom;
    }
}
