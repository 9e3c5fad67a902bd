package nl.bytesoflife.deltaspice.model;

import java.util.Objects;

/**
 * Electrical connection between two terminals. Direction carries no meaning
 * except that the start terminal's net receives the merge.
 */
public record Wire(Terminal start, Terminal end) {

    public Wire {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static Wire of(String startId, int startIndex, String endId, int endIndex) {
        return new Wire(new Terminal(startId, startIndex), new Terminal(endId, endIndex));
    }

    public boolean touches(String componentId) {
        return start.componentId().equals(componentId) || end.componentId().equals(componentId);
    }

    @Override
    public String toString() {
        return start + " -- " + end;
    }
}
