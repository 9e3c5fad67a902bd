package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.model.AnalysisSpec;
import nl.bytesoflife.deltaspice.model.AnalysisType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Analysis dot-directives and the batch control block for each analysis
 * type. Missing parameters fall back to per-type defaults.
 */
final class AnalysisDirectives {

    static final String DEFAULT_WRDATA_PATH = "transient_data.txt";

    private AnalysisDirectives() {
    }

    /**
     * @param defaultSource first voltage source by id, used by DC sweeps that
     *                      name no source
     */
    static List<String> directive(AnalysisSpec spec, Optional<String> defaultSource, List<NetlistIssue> issues) {
        return switch (spec.type()) {
            case DC_OPERATING_POINT -> List.of(".op");
            case DC_SWEEP -> dcSweep(spec, defaultSource, issues);
            case AC_SWEEP -> List.of(".ac "
                    + format(spec.param("dec", "sweep_type", "sweepType")) + " "
                    + format(spec.param(100, "points")) + " "
                    + format(spec.param(1, "fStart")) + " "
                    + format(spec.param(1e6, "fStop")));
            case TRANSIENT -> List.of(".tran "
                    + format(spec.param("10u", "step")) + " "
                    + format(spec.param("10m", "duration")) + " "
                    + format(spec.param(0, "start", "startTime")));
            case TEMPERATURE_SWEEP -> List.of(".op", ".step temp "
                    + format(spec.param(-40, "tempStart")) + " "
                    + format(spec.param(85, "tempStop")) + " "
                    + format(spec.param(25, "tempStep")));
            case NOISE -> List.of(".noise v(" + format(spec.param("out", "output_node", "outputNode")) + ") "
                    + format(spec.param("V1", "source")) + " "
                    + format(spec.param("dec", "sweepType", "sweep_type")) + " "
                    + format(spec.param(100, "points")) + " "
                    + format(spec.param(1, "fStart")) + " "
                    + format(spec.param(1e6, "fStop")));
            case SENSITIVITY -> List.of(".sens v(" + format(spec.param("out", "output_node", "outputNode")) + ")");
            case TRANSFER_FUNCTION -> List.of(".tf "
                    + format(spec.param("v(out)", "output_var", "outputVar")) + " "
                    + format(spec.param("V1", "input_source", "inputSource")));
            case POLE_ZERO -> List.of(".pz "
                    + format(spec.param(1, "input_pos")) + " "
                    + format(spec.param(0, "input_neg")) + " "
                    + format(spec.param(2, "output_pos")) + " "
                    + format(spec.param(0, "output_neg")) + " "
                    + format(spec.param("vol", "transfer_type")) + " "
                    + format(spec.param("pz", "pz_type")));
        };
    }

    private static List<String> dcSweep(AnalysisSpec spec, Optional<String> defaultSource, List<NetlistIssue> issues) {
        Object source = spec.param(defaultSource.orElse(null), "source");
        if (source == null) {
            issues.add(new NetlistIssue(NetlistIssue.Kind.DC_SWEEP_WITHOUT_SOURCE, "DC Sweep",
                    "no voltage source to sweep, falling back to .op"));
            return List.of("* Warning: DC Sweep requires a voltage source", ".op");
        }
        return List.of(".dc " + format(source) + " "
                + format(spec.param(0, "min")) + " "
                + format(spec.param(10, "max")) + " "
                + format(spec.param(0.1, "step")));
    }

    /**
     * Commands between {@code .control} and {@code .endc}.
     *
     * @param nets non-ground net names, sorted
     */
    static List<String> controlCommands(AnalysisType type, List<String> nets, String wrdataPath) {
        List<String> lines = new ArrayList<>();
        String vectors = String.join(" ", nets.stream().map(n -> "v(" + n + ")").toList());
        switch (type) {
            case TRANSIENT -> {
                lines.add("set wr_vecnames");
                lines.add("set wr_singlescale");
                lines.add("run");
                if (nets.isEmpty()) {
                    lines.add("print all");
                } else {
                    lines.add("wrdata " + wrdataPath.replace('\\', '/') + " " + vectors);
                }
            }
            case DC_SWEEP -> {
                lines.add("run");
                lines.add(nets.isEmpty() ? "print all" : "print " + vectors);
            }
            case AC_SWEEP -> {
                lines.add("run");
                if (nets.isEmpty()) {
                    lines.add("print all");
                } else {
                    lines.add("print " + String.join(" ",
                            nets.stream().map(n -> "v(" + n + ") vp(" + n + ")").toList()));
                }
            }
            case NOISE -> {
                lines.add("run");
                lines.add("setplot noise1");
                lines.add("print onoise_spectrum inoise_spectrum");
                lines.add("wrdata " + wrdataPath.replace('\\', '/') + " onoise_spectrum inoise_spectrum");
            }
            case DC_OPERATING_POINT, TEMPERATURE_SWEEP, SENSITIVITY, POLE_ZERO, TRANSFER_FUNCTION -> {
                lines.add("run");
                lines.add("print all");
            }
        }
        return lines;
    }

    /**
     * Renders a parameter: strings verbatim, integral numbers without a
     * fraction, other numbers as plain decimals.
     */
    static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            if (!Double.isFinite(d)) {
                return Double.toString(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value).trim();
    }
}
