package nl.bytesoflife.deltaspice.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DC operating point: node voltages keyed by node name as printed, branch
 * currents keyed by lower-cased device name.
 */
public record OpResult(Map<String, Double> nodeVoltages, Map<String, Double> branchCurrents) {

    public OpResult {
        nodeVoltages = Collections.unmodifiableMap(new LinkedHashMap<>(nodeVoltages));
        branchCurrents = Collections.unmodifiableMap(new LinkedHashMap<>(branchCurrents));
    }

    public static OpResult empty() {
        return new OpResult(Map.of(), Map.of());
    }

    public boolean isEmpty() {
        return nodeVoltages.isEmpty() && branchCurrents.isEmpty();
    }
}
