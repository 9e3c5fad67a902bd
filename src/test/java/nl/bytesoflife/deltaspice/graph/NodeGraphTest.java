package nl.bytesoflife.deltaspice.graph;

import nl.bytesoflife.deltaspice.model.Component;
import nl.bytesoflife.deltaspice.model.ComponentType;
import nl.bytesoflife.deltaspice.model.Terminal;
import nl.bytesoflife.deltaspice.model.Wire;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class NodeGraphTest {

    private static Terminal t(String id, int index) {
        return new Terminal(id, index);
    }

    private static NodeGraph graphWith(String... resistorIds) {
        NodeGraph graph = new NodeGraph();
        for (String id : resistorIds) {
            graph.addComponent(new Component(id, ComponentType.RESISTOR));
        }
        return graph;
    }

    @Test
    void groundComponentCreatesGroundNodeImmediately() {
        NodeGraph graph = new NodeGraph();
        graph.addComponent(new Component("GND1", ComponentType.GROUND));

        Node ground = graph.node(t("GND1", 0)).orElseThrow();
        assertTrue(ground.isGround());
        assertEquals("0", ground.getLabel());
        assertEquals("0", ground.getNetName());
        assertEquals(1, graph.nodes().size());
    }

    @Test
    void allGroundComponentsShareOneNet() {
        NodeGraph graph = new NodeGraph();
        graph.addComponent(new Component("GND1", ComponentType.GROUND));
        graph.addComponent(new Component("GND2", ComponentType.GROUND));

        assertSame(graph.node(t("GND1", 0)).orElseThrow(), graph.node(t("GND2", 0)).orElseThrow());
        assertEquals(1, graph.nodes().size());
    }

    @Test
    void wireBetweenUnconnectedTerminalsCreatesNode() {
        NodeGraph graph = graphWith("R1", "R2");
        int index = graph.addWire(Wire.of("R1", 1, "R2", 0));

        Node node = graph.node(t("R1", 1)).orElseThrow();
        assertSame(node, graph.node(t("R2", 0)).orElseThrow());
        assertEquals("nodeA", node.getLabel());
        assertEquals(Set.of(index), node.getWireIndices());
        assertFalse(node.isGround());
    }

    @Test
    void wireToExistingNodeExtendsIt() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R3", 0, "R2", 0));

        Node node = graph.node(t("R3", 0)).orElseThrow();
        assertEquals(Set.of(t("R1", 1), t("R2", 0), t("R3", 0)), node.getTerminals());
        assertEquals(Set.of(0, 1), node.getWireIndices());
        assertEquals(1, graph.nodes().size());
    }

    @Test
    void parallelWireIsRecordedWithoutNewNode() {
        NodeGraph graph = graphWith("R1", "R2");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R2", 0, "R1", 1));

        assertEquals(1, graph.nodes().size());
        assertEquals(Set.of(0, 1), graph.nodes().get(0).getWireIndices());
    }

    @Test
    void wireBetweenTwoNodesMergesIntoStartNode() {
        NodeGraph graph = graphWith("R1", "R2", "R3", "R4");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R3", 1, "R4", 0));
        Node start = graph.node(t("R1", 1)).orElseThrow();

        graph.addWire(Wire.of("R2", 0, "R3", 1));

        assertEquals(1, graph.nodes().size());
        Node merged = graph.nodes().get(0);
        assertSame(start, merged);
        assertEquals("nodeA", merged.getLabel());
        assertEquals(4, merged.getTerminals().size());
        assertEquals(Set.of(0, 1, 2), merged.getWireIndices());
        for (Terminal terminal : merged.getTerminals()) {
            assertSame(merged, graph.node(terminal).orElseThrow());
        }
    }

    @Test
    void wireToGroundTerminalMarksNodeGround() {
        NodeGraph graph = graphWith("R1");
        graph.addComponent(new Component("GND1", ComponentType.GROUND));
        graph.addWire(Wire.of("R1", 1, "GND1", 0));

        Node node = graph.node(t("R1", 1)).orElseThrow();
        assertTrue(node.isGround());
        assertEquals("0", node.getNetName());
    }

    @Test
    void mergingWithGroundYieldsGround() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addComponent(new Component("GND1", ComponentType.GROUND));
        graph.addWire(Wire.of("R1", 0, "R2", 0));
        graph.addWire(Wire.of("R3", 0, "GND1", 0));

        graph.addWire(Wire.of("R1", 0, "R3", 0));

        Node node = graph.node(t("R2", 0)).orElseThrow();
        assertTrue(node.isGround());
        assertEquals("0", node.getLabel());
        assertSame(node, graph.node(t("GND1", 0)).orElseThrow());
        assertEquals(1, graph.nodes().stream().filter(Node::isGround).count());
    }

    @Test
    void mergeKeepsReceivingNodesCustomLabel() {
        NodeGraph graph = graphWith("R1", "R2", "R3", "R4");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R3", 1, "R4", 0));
        graph.setNetName(t("R1", 1), "in");
        graph.setNetName(t("R3", 1), "out");

        graph.addWire(Wire.of("R2", 0, "R4", 0));

        assertEquals("in", graph.node(t("R4", 0)).orElseThrow().getLabel());
    }

    @Test
    void mergeAdoptsOtherSideLabelWhenReceiverHasNone() {
        NodeGraph graph = graphWith("R1", "R2", "R3", "R4");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R3", 1, "R4", 0));
        graph.setNetName(t("R3", 1), "out");

        graph.addWire(Wire.of("R1", 1, "R3", 1));

        assertEquals("out", graph.node(t("R1", 1)).orElseThrow().getLabel());
    }

    @Test
    void groundNodeWithCustomLabelIsMarkedInDisplayLabel() {
        NodeGraph graph = graphWith("R1");
        graph.addComponent(new Component("GND1", ComponentType.GROUND));
        graph.addWire(Wire.of("R1", 1, "GND1", 0));
        graph.setNetName(t("GND1", 0), "gnd");

        Node node = graph.node(t("R1", 1)).orElseThrow();
        assertEquals("gnd (ground)", node.getLabel());
        assertEquals("0", node.getNetName());
    }

    @Test
    void removeWireRebuildsWithFreshLabels() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R2", 1, "R3", 0));
        assertEquals("nodeB", graph.node(t("R3", 0)).orElseThrow().getLabel());

        graph.removeWire(0);

        assertTrue(graph.node(t("R1", 1)).isEmpty());
        assertTrue(graph.node(t("R2", 0)).isEmpty());
        Node remaining = graph.node(t("R3", 0)).orElseThrow();
        assertEquals("nodeA", remaining.getLabel());
        assertEquals(Set.of(0), remaining.getWireIndices());
        assertInverse(graph);
    }

    @Test
    void removeWireSplitsMergedNode() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R2", 0, "R3", 0));

        graph.removeWire(1);

        assertTrue(graph.node(t("R3", 0)).isEmpty());
        assertEquals(1, graph.nodes().size());
        assertInverse(graph);
    }

    @Test
    void removeWireRejectsBadIndex() {
        NodeGraph graph = graphWith("R1", "R2");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        assertThrows(IndexOutOfBoundsException.class, () -> graph.removeWire(1));
        assertThrows(IndexOutOfBoundsException.class, () -> graph.removeWire(-1));
    }

    @Test
    void customLabelSurvivesRebuild() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R2", 1, "R3", 0));
        graph.setNetName(t("R3", 0), "mid");

        graph.removeWire(0);

        assertEquals("mid", graph.node(t("R2", 1)).orElseThrow().getLabel());
    }

    @Test
    void removeComponentDropsItsWires() {
        NodeGraph graph = graphWith("R1", "R2", "R3");
        graph.addWire(Wire.of("R1", 1, "R2", 0));
        graph.addWire(Wire.of("R2", 1, "R3", 0));
        graph.addWire(Wire.of("R3", 1, "R1", 0));

        List<Integer> removed = graph.removeComponent("R1");

        assertEquals(List.of(0, 2), removed);
        assertEquals(1, graph.wires().size());
        assertTrue(graph.component("R1").isEmpty());
        assertTrue(graph.node(t("R1", 1)).isEmpty());
        assertTrue(graph.node(t("R2", 0)).isEmpty());
        assertTrue(graph.node(t("R3", 0)).isPresent());
        assertInverse(graph);
    }

    @Test
    void removeUnknownComponentIsNoOp() {
        NodeGraph graph = graphWith("R1");
        assertEquals(List.of(), graph.removeComponent("R9"));
    }

    @Test
    void removingGroundComponentClearsGroundFlagOnRebuild() {
        NodeGraph graph = graphWith("R1");
        graph.addComponent(new Component("GND1", ComponentType.GROUND));
        graph.addWire(Wire.of("R1", 1, "GND1", 0));

        graph.removeComponent("GND1");

        assertTrue(graph.nodes().stream().noneMatch(Node::isGround));
        assertTrue(graph.node(t("R1", 1)).isEmpty());
    }

    @Test
    void duplicateComponentIdIsRejected() {
        NodeGraph graph = graphWith("R1");
        assertThrows(IllegalArgumentException.class,
                () -> graph.addComponent(new Component("R1", ComponentType.CAPACITOR)));
    }

    @Test
    void netNamesMustBeBareIdentifiers() {
        NodeGraph graph = graphWith("R1", "R2");
        graph.addWire(Wire.of("R1", 1, "R2", 0));

        assertThrows(IllegalArgumentException.class, () -> graph.setNetName(t("R1", 1), "v out"));
        assertThrows(IllegalArgumentException.class, () -> graph.setNetName(t("R1", 1), "out-1"));
        assertThrows(IllegalArgumentException.class, () -> graph.setNetName(t("R1", 0), "out"));
        assertThrows(IllegalArgumentException.class, () -> graph.setNetName(t("R1", 1), "0"));

        graph.setNetName(t("R1", 1), "Vout_2");
        assertEquals("Vout_2", graph.node(t("R2", 0)).orElseThrow().getNetName());
        graph.setNetName(t("R1", 1), null);
        assertEquals("nodeA", graph.node(t("R2", 0)).orElseThrow().getNetName());
    }

    @Test
    void rebuildMatchesFreshReplayForRandomEdits() {
        Random random = new Random(42);
        List<String> ids = List.of("R1", "R2", "R3", "R4", "R5", "R6");
        NodeGraph graph = graphWith(ids.toArray(new String[0]));
        graph.addComponent(new Component("GND1", ComponentType.GROUND));

        for (int step = 0; step < 200; step++) {
            if (!graph.wires().isEmpty() && random.nextInt(3) == 0) {
                graph.removeWire(random.nextInt(graph.wires().size()));
            } else {
                Terminal a = randomTerminal(random, ids);
                Terminal b = random.nextInt(5) == 0 ? t("GND1", 0) : randomTerminal(random, ids);
                graph.addWire(new Wire(a, b));
            }
            assertInverse(graph);

            NodeGraph fresh = graphWith(ids.toArray(new String[0]));
            fresh.addComponent(new Component("GND1", ComponentType.GROUND));
            for (Wire w : graph.wires()) {
                fresh.addWire(w);
            }
            assertEquals(partition(fresh), partition(graph), "step " + step);
        }
    }

    private static Terminal randomTerminal(Random random, List<String> ids) {
        return t(ids.get(random.nextInt(ids.size())), random.nextInt(2));
    }

    private static Map<Terminal, Set<Terminal>> partition(NodeGraph graph) {
        Map<Terminal, Set<Terminal>> result = new HashMap<>();
        for (Node node : graph.nodes()) {
            Set<Terminal> members = new TreeSet<>(node.getTerminals());
            for (Terminal terminal : members) {
                result.put(terminal, members);
            }
        }
        return result;
    }

    private static void assertInverse(NodeGraph graph) {
        int total = 0;
        List<Terminal> seen = new ArrayList<>();
        for (Node node : graph.nodes()) {
            assertFalse(node.isEmpty());
            for (Terminal terminal : node.getTerminals()) {
                assertSame(node, graph.terminalToNode().get(terminal));
                seen.add(terminal);
                total++;
            }
        }
        assertEquals(total, graph.terminalToNode().size());
        assertEquals(total, new TreeSet<>(seen).size(), "terminal in more than one node");
        for (Wire wire : graph.wires()) {
            assertTrue(graph.node(wire.start()).isPresent());
            assertTrue(graph.node(wire.end()).isPresent());
        }
    }
}
