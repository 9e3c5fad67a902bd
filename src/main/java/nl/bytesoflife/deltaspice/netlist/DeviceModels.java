package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.model.ComponentType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in op-amp subcircuits and semiconductor model cards.
 */
public final class DeviceModels {

    public static final String DEFAULT_OPAMP = "Ideal";

    /**
     * Op-amp macro models, all with port order {@code inp inn out}.
     */
    public record OpAmpModel(String name, String subcircuitName, List<String> body) {

        public List<String> definition() {
            List<String> lines = new ArrayList<>();
            lines.add(".subckt " + subcircuitName + " inp inn out");
            lines.addAll(body);
            lines.add(".ends");
            return lines;
        }
    }

    private static final Map<String, OpAmpModel> OPAMPS = Map.of(
            "Ideal", new OpAmpModel("Ideal", "OPAMP_IDEAL", List.of(
                    "E_amp out 0 inp inn 1e6",
                    "R_out out 0 1e-3")),
            "LM741", new OpAmpModel("LM741", "LM741", List.of(
                    "* Simplified LM741 behavioral model",
                    "* GBW ~1 MHz, DC gain ~200k, Rout ~75 ohm",
                    "Rin inp inn 2e6",
                    "E1 int1 0 inp inn 2e5",
                    "R1 int1 int2 1e6",
                    "C1 int2 0 159e-12",
                    "E2 int3 0 int2 0 1",
                    "Rout int3 out 75")),
            "TL081", new OpAmpModel("TL081", "TL081", List.of(
                    "* Simplified TL081 JFET-input behavioral model",
                    "* GBW ~4 MHz, DC gain ~200k, Rout ~50 ohm",
                    "Rin inp inn 1e12",
                    "E1 int1 0 inp inn 2e5",
                    "R1 int1 int2 1e6",
                    "C1 int2 0 39.8e-12",
                    "E2 int3 0 int2 0 1",
                    "Rout int3 out 50")),
            "LM358", new OpAmpModel("LM358", "LM358", List.of(
                    "* Simplified LM358 behavioral model",
                    "* GBW ~1 MHz, DC gain ~100k, Rout ~50 ohm",
                    "Rin inp inn 2e6",
                    "E1 int1 0 inp inn 1e5",
                    "R1 int1 int2 1e6",
                    "C1 int2 0 159e-12",
                    "E2 int3 0 int2 0 1",
                    "Rout int3 out 50"))
    );

    private static final Map<String, String> BJT_CARDS = Map.of(
            "2N3904", "NPN(BF=300 IS=1e-14 VAF=100)",
            "2N3906", "PNP(BF=200 IS=1e-14 VAF=100)"
    );

    private DeviceModels() {
    }

    public static Optional<OpAmpModel> opAmp(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(OPAMPS.get(name.trim()));
    }

    public static OpAmpModel defaultOpAmp() {
        return OPAMPS.get(DEFAULT_OPAMP);
    }

    /**
     * Model card for a transistor model name, e.g. {@code NPN(BF=300 ...)}.
     * Unknown BJT names get a generic card of the right polarity.
     */
    public static String bjtCard(ComponentType type, String modelName) {
        String known = BJT_CARDS.get(modelName);
        if (known != null) return known;
        return (type == ComponentType.BJT_PNP ? "PNP" : "NPN") + "(BF=100 IS=1e-14)";
    }

    public static String mosfetCard(ComponentType type) {
        return type == ComponentType.MOSFET_PMOS
                ? "PMOS(VTO=-0.7 KP=50u)"
                : "NMOS(VTO=0.7 KP=110u)";
    }

    /**
     * Shared model name for a diode family member.
     */
    public static String diodeModelName(ComponentType type) {
        return switch (type) {
            case LED -> "D_LED";
            case ZENER_DIODE -> "D_Zener";
            case DIODE -> "D_Ideal";
            default -> throw new IllegalArgumentException("Not a diode: " + type);
        };
    }
}
