package nl.bytesoflife.deltaspice.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * One pin of a component, addressed by component id and terminal index.
 */
public record Terminal(String componentId, int index) implements Comparable<Terminal> {

    private static final Comparator<Terminal> ORDER = Comparator
            .comparing(Terminal::componentId)
            .thenComparingInt(Terminal::index);

    public Terminal {
        Objects.requireNonNull(componentId, "componentId");
        if (index < 0) {
            throw new IllegalArgumentException("Terminal index must be >= 0: " + index);
        }
    }

    @Override
    public int compareTo(Terminal other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return componentId + "[" + index + "]";
    }
}
