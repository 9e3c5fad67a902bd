package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.graph.Node;
import nl.bytesoflife.deltaspice.graph.NodeGraph;
import nl.bytesoflife.deltaspice.model.AnalysisSpec;
import nl.bytesoflife.deltaspice.model.AnalysisType;
import nl.bytesoflife.deltaspice.model.Component;
import nl.bytesoflife.deltaspice.model.ComponentType;
import nl.bytesoflife.deltaspice.model.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compiles a {@link NodeGraph} and an analysis into ngspice netlist text.
 *
 * <pre>
 * Netlist netlist = new NetlistGenerator()
 *     .withTitle("RC low-pass")
 *     .withMeasurements(List.of("tran rise TRIG v(out) VAL=0.5 RISE=1 TARG v(out) VAL=4.5 RISE=1"))
 *     .generate(graph, AnalysisSpec.of(AnalysisType.TRANSIENT, params));
 * </pre>
 *
 * Components are emitted in sorted id order, so the same inputs always give
 * byte-identical text. Problems that do not prevent generation are logged
 * and returned as {@link NetlistIssue}s instead of being thrown.
 */
public class NetlistGenerator {

    private static final Logger log = LoggerFactory.getLogger(NetlistGenerator.class);

    public static final String DEFAULT_TITLE = "My Test Circuit";

    private String title = DEFAULT_TITLE;
    private Map<String, String> spiceOptions = Map.of();
    private List<String> measurements = List.of();
    private String wrdataPath = AnalysisDirectives.DEFAULT_WRDATA_PATH;

    public NetlistGenerator withTitle(String title) {
        this.title = title;
        return this;
    }

    /**
     * Extra simulator options rendered as a single {@code .options} line, in
     * map iteration order.
     */
    public NetlistGenerator withSpiceOptions(Map<String, String> options) {
        this.spiceOptions = new LinkedHashMap<>(options);
        return this;
    }

    public NetlistGenerator withMeasurements(List<String> measurements) {
        this.measurements = List.copyOf(measurements);
        return this;
    }

    public NetlistGenerator withWrdataPath(String path) {
        this.wrdataPath = path;
        return this;
    }

    /**
     * Generates for an analysis identified by display name, as stored in
     * saved circuits. An unrecognized name yields a netlist without an
     * analysis directive and an {@link NetlistIssue.Kind#UNKNOWN_ANALYSIS}
     * issue.
     */
    public Netlist generate(NodeGraph graph, String analysisName, Map<String, Object> params) {
        Optional<AnalysisType> type = AnalysisType.lookup(analysisName);
        if (type.isPresent()) {
            return generate(graph, AnalysisSpec.of(type.get(), params));
        }
        log.warn("No directive builder for analysis type '{}', emitting netlist without analysis", analysisName);
        List<NetlistIssue> issues = new ArrayList<>();
        issues.add(new NetlistIssue(NetlistIssue.Kind.UNKNOWN_ANALYSIS, String.valueOf(analysisName),
                "unknown analysis type, no directive emitted"));
        return build(graph, null, issues);
    }

    public Netlist generate(NodeGraph graph, AnalysisSpec analysis) {
        return build(graph, analysis, new ArrayList<>());
    }

    private Netlist build(NodeGraph graph, AnalysisSpec analysis, List<NetlistIssue> issues) {
        List<Component> sorted = graph.components().stream()
                .sorted(Comparator.comparing(Component::getComponentId))
                .toList();
        Set<String> usedIds = new HashSet<>();
        for (Component c : sorted) {
            usedIds.add(c.getComponentId());
        }

        List<String> out = new ArrayList<>();
        out.add(title);
        out.add("* Generated netlist");
        out.add("");

        Map<String, String> opAmpSubckts = new LinkedHashMap<>();
        Map<String, String> userSubckts = new LinkedHashMap<>();
        Map<String, String> models = new LinkedHashMap<>();
        List<String> elements = new ArrayList<>();

        for (Component c : sorted) {
            if (c.getType() == ComponentType.GROUND) continue;
            List<String> n = new ArrayList<>();
            for (int i = 0; i < c.getTerminalCount(); i++) {
                n.add(netFor(graph, c, i, issues));
            }
            emitElement(c, n, usedIds, elements, opAmpSubckts, userSubckts, models, issues);
        }

        for (String name : opAmpSubckts.keySet()) {
            DeviceModels.OpAmpModel model = DeviceModels.opAmp(name).orElseThrow();
            out.add("* " + model.name() + " Op-Amp Subcircuit");
            out.addAll(model.definition());
            out.add("");
        }
        for (String definition : userSubckts.values()) {
            out.addAll(definition.strip().lines().toList());
            out.add("");
        }

        out.addAll(elements);

        if (!models.isEmpty()) {
            out.add("");
            out.add("* Device Models");
            for (Map.Entry<String, String> m : models.entrySet()) {
                out.add(".model " + m.getKey() + " " + m.getValue());
            }
        }

        out.add("");
        out.add("* Simulation Options");
        out.add(".option TEMP=27");
        out.add(".option TNOM=27");
        if (!spiceOptions.isEmpty()) {
            StringBuilder sb = new StringBuilder(".options");
            spiceOptions.forEach((k, v) -> sb.append(' ').append(k).append('=').append(v));
            out.add(sb.toString());
        }

        if (analysis != null) {
            out.add("");
            out.add("* Analysis Command");
            Optional<String> firstVoltageSource = sorted.stream()
                    .filter(c -> c.getType() == ComponentType.VOLTAGE_SOURCE)
                    .map(Component::getComponentId)
                    .findFirst();
            out.addAll(AnalysisDirectives.directive(analysis, firstVoltageSource, issues));
        }

        if (!measurements.isEmpty()) {
            out.add("");
            out.add("* Measurement Directives");
            for (String m : measurements) {
                out.add(measurementLine(m));
            }
        }

        TreeSet<String> nets = new TreeSet<>();
        for (Node node : graph.nodes()) {
            if (!node.isGround()) {
                nets.add(node.getNetName());
            }
        }

        out.add("");
        out.add("* Control block for batch execution");
        out.add(".control");
        AnalysisType controlType = analysis != null ? analysis.type() : AnalysisType.DC_OPERATING_POINT;
        out.addAll(AnalysisDirectives.controlCommands(controlType, new ArrayList<>(nets), wrdataPath));
        out.add(".endc");
        out.add("");
        out.add(".end");

        for (NetlistIssue issue : issues) {
            if (issue.kind() != NetlistIssue.Kind.UNKNOWN_ANALYSIS) {
                log.warn("Netlist issue: {}", issue);
            }
        }
        return new Netlist(String.join("\n", out) + "\n", issues);
    }

    private void emitElement(Component c, List<String> n, Set<String> usedIds, List<String> elements,
                             Map<String, String> opAmpSubckts, Map<String, String> userSubckts,
                             Map<String, String> models, List<NetlistIssue> issues) {
        String id = c.getComponentId();
        String value = c.getValue() == null ? "" : c.getValue().trim();
        switch (c.getType()) {
            case RESISTOR -> elements.add(id + " " + n.get(0) + " " + n.get(1) + " " + value);
            case CAPACITOR, INDUCTOR -> {
                String line = id + " " + n.get(0) + " " + n.get(1) + " " + value;
                if (c.getInitialCondition() != null && !c.getInitialCondition().isBlank()) {
                    line += " IC=" + c.getInitialCondition().trim();
                }
                elements.add(line);
            }
            case VOLTAGE_SOURCE, CURRENT_SOURCE -> elements.add(id + " " + n.get(0) + " " + n.get(1) + " DC " + value);
            case WAVEFORM_SOURCE -> elements.add(id + " " + n.get(0) + " " + n.get(1) + " " + c.getSpiceValue());
            case VCVS, VCCS -> elements.add(id + " " + n.get(2) + " " + n.get(3) + " " + n.get(0) + " " + n.get(1) + " " + value);
            case CCVS, CCCS -> {
                String sense = senseSourceName(id, usedIds);
                elements.add(sense + " " + n.get(0) + " " + n.get(1) + " 0");
                elements.add(id + " " + n.get(2) + " " + n.get(3) + " " + sense + " " + value);
            }
            case OP_AMP -> {
                DeviceModels.OpAmpModel model = DeviceModels.opAmp(value).orElse(null);
                if (model == null) {
                    issues.add(new NetlistIssue(NetlistIssue.Kind.UNKNOWN_OPAMP_MODEL, id,
                            "unknown op-amp model '" + value + "', using " + DeviceModels.DEFAULT_OPAMP));
                    model = DeviceModels.defaultOpAmp();
                }
                opAmpSubckts.putIfAbsent(model.name(), model.subcircuitName());
                elements.add("X" + id + " " + n.get(1) + " " + n.get(0) + " " + n.get(2) + " " + model.subcircuitName());
            }
            case BJT_NPN, BJT_PNP -> {
                elements.add(id + " " + n.get(0) + " " + n.get(1) + " " + n.get(2) + " " + value);
                models.putIfAbsent(value, DeviceModels.bjtCard(c.getType(), value));
            }
            case MOSFET_NMOS, MOSFET_PMOS -> {
                elements.add(id + " " + n.get(0) + " " + n.get(1) + " " + n.get(2) + " " + n.get(2) + " " + value);
                models.putIfAbsent(value, DeviceModels.mosfetCard(c.getType()));
            }
            case DIODE, LED, ZENER_DIODE -> {
                String modelName = DeviceModels.diodeModelName(c.getType());
                elements.add(id + " " + n.get(0) + " " + n.get(1) + " " + modelName);
                models.putIfAbsent(modelName, "D(" + value + ")");
            }
            case VC_SWITCH -> {
                String modelName = "SW_" + id;
                elements.add(id + " " + n.get(2) + " " + n.get(3) + " " + n.get(0) + " " + n.get(1) + " " + modelName);
                models.putIfAbsent(modelName, "SW(" + value + ")");
            }
            case TRANSFORMER -> emitTransformer(id, value, n, elements);
            case SUBCIRCUIT -> {
                String name = c.getSubcircuitName();
                if (name == null || c.getSubcircuitDefinition() == null || c.getSubcircuitDefinition().isBlank()) {
                    issues.add(new NetlistIssue(NetlistIssue.Kind.MISSING_SUBCIRCUIT_DEFINITION, id,
                            "no definition for subcircuit '" + name + "'"));
                } else {
                    userSubckts.putIfAbsent(name.toUpperCase(Locale.ROOT), c.getSubcircuitDefinition());
                }
                StringBuilder sb = new StringBuilder("X").append(id);
                for (String net : n) {
                    sb.append(' ').append(net);
                }
                sb.append(' ').append(name == null ? "UNDEFINED" : name);
                elements.add(sb.toString());
            }
            case GROUND -> {
                // topology only
            }
        }
    }

    private static void emitTransformer(String id, String value, List<String> n, List<String> elements) {
        String[] parts = value.isBlank() ? new String[0] : value.trim().split("\\s+");
        String[] defaults = ComponentType.TRANSFORMER.getDefaultValue().split(" ");
        String lp = parts.length > 0 ? parts[0] : defaults[0];
        String ls = parts.length > 1 ? parts[1] : defaults[1];
        String k = parts.length > 2 ? parts[2] : defaults[2];
        String prim = "L_prim_" + id;
        String sec = "L_sec_" + id;
        elements.add(prim + " " + n.get(0) + " " + n.get(1) + " " + lp);
        elements.add(sec + " " + n.get(2) + " " + n.get(3) + " " + ls);
        elements.add("K_" + id + " " + prim + " " + sec + " " + k);
    }

    /**
     * {@code Vsense_<id>}, suffixed until it collides with no component id or
     * earlier sense source.
     */
    private static String senseSourceName(String id, Set<String> usedIds) {
        String base = "Vsense_" + id;
        String name = base;
        int suffix = 1;
        while (containsIgnoreCase(usedIds, name)) {
            name = base + "_" + suffix++;
        }
        usedIds.add(name);
        return name;
    }

    private static boolean containsIgnoreCase(Set<String> ids, String name) {
        for (String id : ids) {
            if (id.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    private String netFor(NodeGraph graph, Component c, int index, List<NetlistIssue> issues) {
        Terminal terminal = new Terminal(c.getComponentId(), index);
        Optional<Node> node = graph.node(terminal);
        if (node.isPresent()) {
            return node.get().getNetName();
        }
        String placeholder = "nc_" + c.getComponentId() + "_" + index;
        issues.add(new NetlistIssue(NetlistIssue.Kind.UNCONNECTED_TERMINAL, terminal.toString(),
                "unconnected, using isolated net " + placeholder));
        return placeholder;
    }

    private static String measurementLine(String measurement) {
        String m = measurement.trim();
        String lower = m.toLowerCase(Locale.ROOT);
        if (lower.startsWith(".meas")) {
            return m;
        }
        return ".meas " + m;
    }
}
