package nl.bytesoflife.deltaspice.validation;

import nl.bytesoflife.deltaspice.graph.Node;
import nl.bytesoflife.deltaspice.graph.NodeGraph;
import nl.bytesoflife.deltaspice.model.AnalysisType;
import nl.bytesoflife.deltaspice.model.Component;
import nl.bytesoflife.deltaspice.model.ComponentType;
import nl.bytesoflife.deltaspice.model.Terminal;
import nl.bytesoflife.deltaspice.model.Wire;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-simulation checks. Errors block simulation, warnings do not.
 */
public class CircuitValidator {

    public ValidationReport validate(NodeGraph graph, AnalysisType analysisType) {
        ValidationReport report = new ValidationReport();

        List<Component> nonGround = graph.components().stream()
                .filter(c -> c.getType() != ComponentType.GROUND)
                .toList();
        if (nonGround.isEmpty()) {
            report.addIssue(new ValidationIssue(Severity.ERROR, null,
                    "Circuit has no components. Add at least one component to simulate."));
            return report;
        }

        boolean hasGround = graph.components().stream().anyMatch(c -> c.getType() == ComponentType.GROUND);
        if (!hasGround) {
            report.addIssue(new ValidationIssue(Severity.ERROR, null,
                    "Circuit has no ground node. Every SPICE circuit requires a ground (node 0)."));
        }

        Set<Terminal> connected = checkWires(graph, report);
        checkConnections(nonGround, connected, report);
        checkNetNames(graph, report);

        if (analysisType == AnalysisType.DC_SWEEP
                && nonGround.stream().noneMatch(c -> c.getType() == ComponentType.VOLTAGE_SOURCE)) {
            report.addIssue(new ValidationIssue(Severity.ERROR, null,
                    "DC Sweep requires at least one DC Voltage Source to sweep."));
        }

        boolean hasSource = nonGround.stream().anyMatch(c -> c.getType().isSource());
        if (!hasSource) {
            report.addIssue(new ValidationIssue(Severity.WARNING, null,
                    "Circuit has no voltage or current sources. The simulation may not produce meaningful results."));
        }

        return report;
    }

    private Set<Terminal> checkWires(NodeGraph graph, ValidationReport report) {
        Set<Terminal> connected = new HashSet<>();
        List<Wire> wires = graph.wires();
        for (int i = 0; i < wires.size(); i++) {
            Wire wire = wires.get(i);
            for (Terminal t : List.of(wire.start(), wire.end())) {
                Component c = graph.component(t.componentId()).orElse(null);
                if (c == null) {
                    report.addIssue(new ValidationIssue(Severity.ERROR, t.componentId(),
                            "Wire " + i + " references unknown component " + t.componentId() + "."));
                } else if (t.index() >= c.getTerminalCount()) {
                    report.addIssue(new ValidationIssue(Severity.ERROR, t.componentId(),
                            "Wire " + i + " references terminal " + t.index() + " but " + t.componentId()
                                    + " has " + c.getTerminalCount() + "."));
                } else {
                    connected.add(t);
                }
            }
        }
        return connected;
    }

    private void checkConnections(List<Component> components, Set<Terminal> connected, ValidationReport report) {
        for (Component c : components) {
            int count = c.getTerminalCount();
            List<Integer> unconnected = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                if (!connected.contains(new Terminal(c.getComponentId(), i))) {
                    unconnected.add(i);
                }
            }
            if (count > 0 && unconnected.size() == count) {
                report.addIssue(new ValidationIssue(Severity.ERROR, c.getComponentId(),
                        c.getComponentId() + " (" + c.getType() + ") has no connections. "
                                + "Connect its terminals to the circuit."));
            } else if (!unconnected.isEmpty()) {
                report.addIssue(new ValidationIssue(Severity.WARNING, c.getComponentId(),
                        c.getComponentId() + " (" + c.getType() + ") has unconnected terminal(s): "
                                + unconnected + "."));
            }
        }
    }

    // Two nets sharing a name would be shorted together in the netlist. A
    // custom label can also collide with another net's auto label.
    private void checkNetNames(NodeGraph graph, ValidationReport report) {
        Map<String, Integer> counts = new HashMap<>();
        for (Node node : graph.nodes()) {
            if (!node.isGround()) {
                counts.merge(node.getNetName(), 1, Integer::sum);
            }
        }
        counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .forEach(name -> report.addIssue(new ValidationIssue(Severity.WARNING, null,
                        "Net name '" + name + "' is used by " + counts.get(name)
                                + " separate nets; they will be connected in the netlist.")));
    }
}
