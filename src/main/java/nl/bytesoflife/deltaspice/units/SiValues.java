package nl.bytesoflife.deltaspice.units;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of SPICE-style SI literals such as {@code 4.7k},
 * {@code 10MEG} or {@code 100nF}.
 */
public final class SiValues {

    // Multi-character suffixes must come first.
    private static final List<Map.Entry<String, Double>> SUFFIXES = List.of(
            Map.entry("MEG", 1e6),
            Map.entry("meg", 1e6),
            Map.entry("T", 1e12),
            Map.entry("G", 1e9),
            Map.entry("k", 1e3),
            Map.entry("K", 1e3),
            Map.entry("m", 1e-3),
            Map.entry("u", 1e-6),
            Map.entry("µ", 1e-6),
            Map.entry("n", 1e-9),
            Map.entry("p", 1e-12),
            Map.entry("f", 1e-15)
    );

    // Largest first: the first prefix not above the magnitude wins.
    private static final List<Map.Entry<Double, String>> PREFIXES = List.of(
            Map.entry(1e12, "T"),
            Map.entry(1e9, "G"),
            Map.entry(1e6, "M"),
            Map.entry(1e3, "k"),
            Map.entry(1e0, ""),
            Map.entry(1e-3, "m"),
            Map.entry(1e-6, "µ"),
            Map.entry(1e-9, "n"),
            Map.entry(1e-12, "p"),
            Map.entry(1e-15, "f")
    );

    private static final Pattern LITERAL = Pattern.compile(
            "^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)\\s*(\\S*)\\s*$");

    private SiValues() {
    }

    /**
     * Parses a literal with an optional SI suffix. Unit letters after the
     * suffix are ignored ({@code 10kOhm} is 10000). A bare {@code M} means
     * milli; mega is spelled {@code MEG}.
     *
     * @throws NumberFormatException if the text is not a number
     */
    public static double parse(String text) {
        if (text == null) {
            throw new NumberFormatException("null");
        }
        Matcher m = LITERAL.matcher(text);
        if (!m.matches()) {
            throw new NumberFormatException("Not an SI value: '" + text + "'");
        }
        double number = Double.parseDouble(m.group(1));
        String suffix = m.group(2);
        if (suffix.isEmpty()) {
            return number;
        }
        if (suffix.toUpperCase(Locale.ROOT).startsWith("MEG")) {
            return number * 1e6;
        }
        for (Map.Entry<String, Double> s : SUFFIXES) {
            if (suffix.startsWith(s.getKey())) {
                return number * s.getValue();
            }
        }
        if (suffix.startsWith("M")) {
            return number * 1e-3;
        }
        if (!Character.isLetter(suffix.charAt(0))) {
            throw new NumberFormatException("Not an SI value: '" + text + "'");
        }
        // plain unit such as "V" or "Ohm"
        return number;
    }

    /**
     * Formats with the nearest prefix from femto to tera and two decimals,
     * e.g. {@code formatSi(1500, "Hz")} is {@code "1.50 kHz"}. Zero and
     * non-finite values render as {@code 0.00}. Magnitudes outside the prefix
     * range use scientific notation.
     */
    public static String formatSi(double value, String unit) {
        String u = unit == null ? "" : unit;
        if (value == 0 || !Double.isFinite(value)) {
            return u.isEmpty() ? "0.00" : "0.00 " + u;
        }
        double abs = Math.abs(value);
        if (abs < 1e-15 || abs >= 1e15) {
            String sci = String.format(Locale.US, "%.2e", value);
            return u.isEmpty() ? sci : sci + " " + u;
        }
        for (Map.Entry<Double, String> p : PREFIXES) {
            double threshold = p.getKey();
            if (abs >= threshold) {
                String scaled = String.format(Locale.US, "%.2f", value / threshold);
                String suffix = p.getValue() + u;
                return suffix.isEmpty() ? scaled : scaled + " " + suffix;
            }
        }
        throw new IllegalStateException("unreachable: " + value);
    }

    public static String formatSi(double value) {
        return formatSi(value, "");
    }
}
