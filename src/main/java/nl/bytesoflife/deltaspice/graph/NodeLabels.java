package nl.bytesoflife.deltaspice.graph;

/**
 * Generates the auto label sequence nodeA..nodeZ, nodeAA, nodeAB, ...
 */
final class NodeLabels {

    private int next;

    String nextLabel() {
        return label(next++);
    }

    void reset() {
        next = 0;
    }

    static String label(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Label index must be >= 0: " + index);
        }
        StringBuilder letters = new StringBuilder();
        int n = index;
        do {
            letters.append((char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return "node" + letters.reverse();
    }
}
