package nl.bytesoflife.deltaspice.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of a wrdata dump, each keyed by sanitized column name
 * ({@code v(out)} becomes {@code out}, {@code i(v1)} becomes {@code i_v1}).
 */
public record TransientResult(List<String> columns, List<Map<String, Double>> rows) {

    public TransientResult {
        columns = List.copyOf(columns);
        List<Map<String, Double>> copy = new ArrayList<>();
        for (Map<String, Double> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public List<Double> column(String name) {
        return rows.stream().map(r -> r.get(name)).toList();
    }
}
