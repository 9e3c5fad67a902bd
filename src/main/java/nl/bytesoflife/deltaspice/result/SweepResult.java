package nl.bytesoflife.deltaspice.result;

import java.util.List;

/**
 * Tabular DC or temperature sweep output. Each row has one value per header.
 */
public record SweepResult(List<String> headers, List<List<Double>> rows) {

    public SweepResult {
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
    }

    /**
     * Values of one column, or an empty list for an unknown header.
     */
    public List<Double> column(String header) {
        int index = -1;
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).equalsIgnoreCase(header)) {
                index = i;
                break;
            }
        }
        if (index < 0) return List.of();
        final int col = index;
        return rows.stream().map(r -> r.get(col)).toList();
    }
}
