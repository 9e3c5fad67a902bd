package nl.bytesoflife.deltaspice.graph;

import nl.bytesoflife.deltaspice.model.Component;
import nl.bytesoflife.deltaspice.model.ComponentType;
import nl.bytesoflife.deltaspice.model.Terminal;
import nl.bytesoflife.deltaspice.model.Wire;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Components, the ordered wire list and the nets derived from them.
 * <p>
 * The nets are derived state: {@link #rebuildNodes()} reconstructs them by
 * replaying Ground components and then every wire, in insertion order, from
 * an empty graph. Not thread-safe.
 */
public class NodeGraph {

    private final Map<String, Component> components = new LinkedHashMap<>();
    private final List<Wire> wires = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final Map<Terminal, Node> terminalToNode = new HashMap<>();
    private final NodeLabels labels = new NodeLabels();

    public void addComponent(Component component) {
        if (components.containsKey(component.getComponentId())) {
            throw new IllegalArgumentException("Duplicate component id: " + component.getComponentId());
        }
        components.put(component.getComponentId(), component);
        if (component.getType() == ComponentType.GROUND) {
            attachGround(component);
        }
    }

    /**
     * Removes a component together with every wire touching it.
     *
     * @return the indices the removed wires had before removal, ascending
     */
    public List<Integer> removeComponent(String componentId) {
        if (components.remove(componentId) == null) {
            return List.of();
        }
        List<Integer> removed = new ArrayList<>();
        for (int i = 0; i < wires.size(); i++) {
            if (wires.get(i).touches(componentId)) {
                removed.add(i);
            }
        }
        for (int i = removed.size() - 1; i >= 0; i--) {
            wires.remove((int) removed.get(i));
        }
        rebuildNodes();
        return Collections.unmodifiableList(removed);
    }

    /**
     * Appends a wire and merges the nets of its endpoints.
     *
     * @return the wire's index
     */
    public int addWire(Wire wire) {
        wires.add(wire);
        int index = wires.size() - 1;
        connect(wire, index);
        return index;
    }

    /**
     * Removes the wire at {@code index}. Merges cannot be undone locally, so
     * the whole graph is rebuilt from the remaining wires.
     */
    public void removeWire(int index) {
        if (index < 0 || index >= wires.size()) {
            throw new IndexOutOfBoundsException("No wire at index " + index + " (" + wires.size() + " wires)");
        }
        wires.remove(index);
        rebuildNodes();
    }

    /**
     * Discards every net and replays Ground components and wires from
     * scratch. Custom labels are carried over by terminal.
     */
    public void rebuildNodes() {
        Map<Terminal, String> savedLabels = new HashMap<>();
        for (Node node : nodes) {
            if (node.getCustomLabel() != null) {
                for (Terminal t : node.getTerminals()) {
                    savedLabels.put(t, node.getCustomLabel());
                }
            }
        }

        nodes.clear();
        terminalToNode.clear();
        labels.reset();

        for (Component c : components.values()) {
            if (c.getType() == ComponentType.GROUND) {
                attachGround(c);
            }
        }
        for (int i = 0; i < wires.size(); i++) {
            connect(wires.get(i), i);
        }

        for (Node node : nodes) {
            if (node.getCustomLabel() != null) continue;
            for (Terminal t : node.getTerminals()) {
                String label = savedLabels.get(t);
                if (label != null) {
                    node.setCustomLabel(label);
                    break;
                }
            }
        }
    }

    /**
     * Names the net containing {@code terminal}; {@code null} clears the name.
     */
    public void setNetName(Terminal terminal, String label) {
        Node node = terminalToNode.get(terminal);
        if (node == null) {
            throw new IllegalArgumentException("Terminal is not connected: " + terminal);
        }
        node.setCustomLabel(label);
    }

    public Optional<Node> node(Terminal terminal) {
        return Optional.ofNullable(terminalToNode.get(terminal));
    }

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public Map<Terminal, Node> terminalToNode() {
        return Collections.unmodifiableMap(terminalToNode);
    }

    public Collection<Component> components() {
        return Collections.unmodifiableCollection(components.values());
    }

    public Optional<Component> component(String componentId) {
        return Optional.ofNullable(components.get(componentId));
    }

    public List<Wire> wires() {
        return Collections.unmodifiableList(wires);
    }

    private void attachGround(Component ground) {
        Node groundNode = null;
        for (Node node : nodes) {
            if (node.isGround()) {
                groundNode = node;
                break;
            }
        }
        if (groundNode == null) {
            groundNode = new Node(Node.GROUND_LABEL, true);
            nodes.add(groundNode);
        }
        Terminal t = new Terminal(ground.getComponentId(), 0);
        groundNode.addTerminal(t);
        terminalToNode.put(t, groundNode);
    }

    private void connect(Wire wire, int wireIndex) {
        Terminal start = wire.start();
        Terminal end = wire.end();
        Node startNode = terminalToNode.get(start);
        Node endNode = terminalToNode.get(end);
        boolean touchesGround = isGroundTerminal(start) || isGroundTerminal(end);

        Node target;
        if (startNode == null && endNode == null) {
            target = new Node(labels.nextLabel(), false);
            target.addTerminal(start);
            target.addTerminal(end);
            nodes.add(target);
            terminalToNode.put(start, target);
            terminalToNode.put(end, target);
        } else if (startNode == null) {
            target = endNode;
            target.addTerminal(start);
            terminalToNode.put(start, target);
        } else if (endNode == null) {
            target = startNode;
            target.addTerminal(end);
            terminalToNode.put(end, target);
        } else if (startNode == endNode) {
            target = startNode;
        } else {
            target = startNode;
            target.mergeWith(endNode);
            for (Terminal t : endNode.getTerminals()) {
                terminalToNode.put(t, target);
            }
            nodes.remove(endNode);
        }
        target.addWire(wireIndex);
        if (touchesGround) {
            target.markGround();
        }
    }

    private boolean isGroundTerminal(Terminal terminal) {
        Component c = components.get(terminal.componentId());
        return c != null && c.getType() == ComponentType.GROUND;
    }
}
