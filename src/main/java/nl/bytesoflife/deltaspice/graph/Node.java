package nl.bytesoflife.deltaspice.graph;

import nl.bytesoflife.deltaspice.model.Terminal;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * An electrical net: a set of terminals held at the same potential, plus the
 * wires that joined them. Nodes compare by identity.
 */
public class Node {

    public static final String GROUND_LABEL = "0";

    private static final Pattern LEGAL_LABEL = Pattern.compile("[A-Za-z0-9_]+");

    private final NavigableSet<Terminal> terminals = new TreeSet<>();
    private final NavigableSet<Integer> wireIndices = new TreeSet<>();
    private boolean ground;
    private String autoLabel;
    private String customLabel;

    Node(String autoLabel, boolean ground) {
        this.autoLabel = autoLabel;
        this.ground = ground;
    }

    public SortedSet<Terminal> getTerminals() {
        return Collections.unmodifiableSortedSet(terminals);
    }

    public SortedSet<Integer> getWireIndices() {
        return Collections.unmodifiableSortedSet(wireIndices);
    }

    public boolean isGround() { return ground; }
    public String getAutoLabel() { return autoLabel; }
    public String getCustomLabel() { return customLabel; }

    /**
     * Sets or clears ({@code null}) the user net name. Names end up verbatim
     * in netlists, so only letters, digits and underscores are accepted, and
     * {@code 0} is reserved for ground.
     */
    public void setCustomLabel(String label) {
        if (label != null && !LEGAL_LABEL.matcher(label).matches()) {
            throw new IllegalArgumentException("Net name must match [A-Za-z0-9_]+: '" + label + "'");
        }
        if (GROUND_LABEL.equals(label)) {
            throw new IllegalArgumentException("Net name '0' is reserved for ground");
        }
        this.customLabel = label;
    }

    /**
     * Display label: the custom label (with a ground marker when grounded),
     * else the auto label.
     */
    public String getLabel() {
        if (customLabel != null) {
            return ground ? customLabel + " (ground)" : customLabel;
        }
        return autoLabel;
    }

    /**
     * Identifier used in netlist text. Ground is always {@code 0}.
     */
    public String getNetName() {
        if (ground) return GROUND_LABEL;
        return customLabel != null ? customLabel : autoLabel;
    }

    public boolean isEmpty() {
        return terminals.isEmpty();
    }

    void addTerminal(Terminal terminal) {
        terminals.add(terminal);
    }

    void addWire(int wireIndex) {
        wireIndices.add(wireIndex);
    }

    void markGround() {
        ground = true;
        if (customLabel == null) {
            autoLabel = GROUND_LABEL;
        }
    }

    /**
     * Absorbs {@code other} into this node. On a label conflict this node's
     * custom label is kept.
     */
    void mergeWith(Node other) {
        terminals.addAll(other.terminals);
        wireIndices.addAll(other.wireIndices);
        if (customLabel == null && other.customLabel != null) {
            customLabel = other.customLabel;
        }
        if (other.ground) {
            markGround();
        }
    }

    @Override
    public String toString() {
        return "Node(" + getLabel() + ", terminals=" + terminals.size() + ", wires=" + wireIndices.size() + ")";
    }
}
