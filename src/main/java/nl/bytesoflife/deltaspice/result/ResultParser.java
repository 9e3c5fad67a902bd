package nl.bytesoflife.deltaspice.result;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers structured results from ngspice's text output.
 * <p>
 * Every parser is total: malformed or foreign input yields an empty result,
 * never an exception. An empty result does not by itself mean the simulator
 * failed; callers check the exit status as well.
 */
public final class ResultParser {

    private static final Logger log = LoggerFactory.getLogger(ResultParser.class);

    static final String NUMBER = "[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?";

    private enum Quantity { VOLTAGE, CURRENT }

    private record OpPattern(Pattern pattern, Quantity quantity) {
    }

    // Tried in order per line; the first match wins.
    private static final List<OpPattern> OP_PATTERNS = List.of(
            new OpPattern(Pattern.compile("v\\((\\w+)\\)\\s*[=:]\\s*(" + NUMBER + ")",
                    Pattern.CASE_INSENSITIVE), Quantity.VOLTAGE),
            new OpPattern(Pattern.compile("(?:i\\((\\w+)\\)|@(\\w+)\\[current\\])\\s*[=:]\\s*(" + NUMBER + ")",
                    Pattern.CASE_INSENSITIVE), Quantity.CURRENT),
            new OpPattern(Pattern.compile("^\\s*V\\((\\w+)\\)\\s+(" + NUMBER + ")",
                    Pattern.CASE_INSENSITIVE), Quantity.VOLTAGE),
            new OpPattern(Pattern.compile("^\\s*I\\((\\w+)\\)\\s+(" + NUMBER + ")",
                    Pattern.CASE_INSENSITIVE), Quantity.CURRENT)
    );

    private static final int OP_TABLE_MAX_LINES = 50;

    private static final Pattern TF_GAIN = Pattern.compile(
            "transfer\\s+function.*?=\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern TF_OUTPUT_IMPEDANCE = Pattern.compile(
            "output\\s+impedance.*?=\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern TF_INPUT_IMPEDANCE = Pattern.compile(
            "input\\s+impedance.*?=\\s*(" + NUMBER + ")", Pattern.CASE_INSENSITIVE);

    private static final Pattern POLE_ZERO = Pattern.compile(
            "(pole|zero)\\s*\\(\\s*\\d+\\s*\\)\\s*=\\s*(" + NUMBER + ")\\s*,\\s*(" + NUMBER + ")",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern MEASUREMENT = Pattern.compile(
            "^\\s*(\\w+)\\s*=\\s*(" + NUMBER + ")\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEASUREMENT_FAILED = Pattern.compile(
            "^\\s*(\\w+)\\s*=\\s*failed\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern VECTOR_V = Pattern.compile("^v\\((.*?)\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern VECTOR_I = Pattern.compile("^i\\((.*?)\\)$", Pattern.CASE_INSENSITIVE);

    private ResultParser() {
    }

    /**
     * Operating point values from {@code v(x) = n}, {@code i(x) = n},
     * {@code @x[current] = n}, print-style {@code V(x)  n} lines and a
     * {@code Node  Voltage} table.
     */
    public static OpResult parseOpResults(String output) {
        if (output == null || output.isBlank()) {
            return OpResult.empty();
        }
        Map<String, Double> voltages = new LinkedHashMap<>();
        Map<String, Double> currents = new LinkedHashMap<>();
        List<String> lines = output.lines().toList();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (matchOpLine(line, voltages, currents)) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("node") && lower.contains("voltage")) {
                readVoltageTable(lines, i + 1, voltages);
            }
        }
        if (voltages.isEmpty() && currents.isEmpty()) {
            log.debug("No operating point values found");
        }
        return new OpResult(voltages, currents);
    }

    private static boolean matchOpLine(String line, Map<String, Double> voltages, Map<String, Double> currents) {
        for (OpPattern p : OP_PATTERNS) {
            Matcher m = p.pattern().matcher(line);
            if (!m.find()) continue;
            Double value = toDouble(m.group(m.groupCount()));
            if (value == null) continue;
            if (p.quantity() == Quantity.VOLTAGE) {
                voltages.put(m.group(1), value);
            } else {
                String device = m.group(1);
                if (device == null && m.groupCount() == 3) {
                    device = m.group(2);
                }
                currents.put(device.toLowerCase(Locale.ROOT), value);
            }
            return true;
        }
        return false;
    }

    private static void readVoltageTable(List<String> lines, int start, Map<String, Double> voltages) {
        int end = Math.min(start - 1 + OP_TABLE_MAX_LINES, lines.size());
        for (int j = start; j < end; j++) {
            String row = lines.get(j).strip();
            if (row.isEmpty() || row.startsWith("-")) continue;
            if (row.startsWith("*") || row.toLowerCase(Locale.ROOT).startsWith("source")) break;
            String[] parts = row.split("\\s+");
            if (parts.length < 2) continue;
            Double value = toDouble(parts[1]);
            if (value == null) continue;
            String name = parts[0].replace("v(", "").replace("V(", "").replace(")", "");
            voltages.put(name, value);
        }
    }

    /**
     * DC or temperature sweep table. The header is the line containing
     * {@code index}, or {@code sweep} together with {@code v(}. Rows that are
     * not fully numeric are skipped, so paged output with repeated headers
     * reads as one table.
     */
    public static Optional<SweepResult> parseDcResults(String output) {
        if (output == null) return Optional.empty();
        List<String> headers = null;
        List<List<Double>> rows = new ArrayList<>();
        for (String line : output.lines().toList()) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("index") || (lower.contains("sweep") && lower.contains("v("))) {
                headers = List.of(line.strip().split("\\s+"));
                continue;
            }
            if (headers == null) continue;
            String[] parts = line.strip().split("\\s+");
            if (parts.length < headers.size()) continue;
            List<Double> row = toDoubles(parts, 0, headers.size());
            if (row != null) {
                rows.add(row);
            }
        }
        if (headers == null || rows.isEmpty()) {
            log.debug("No DC sweep table found");
            return Optional.empty();
        }
        return Optional.of(new SweepResult(headers, rows));
    }

    /**
     * AC sweep table. Column 1 is the frequency; {@code vp(x)} columns are
     * phase and {@code v(x)} columns magnitude.
     */
    public static Optional<AcResult> parseAcResults(String output) {
        if (output == null) return Optional.empty();
        List<String> headers = null;
        List<Double> frequencies = new ArrayList<>();
        Map<String, List<Double>> magnitude = new LinkedHashMap<>();
        Map<String, List<Double>> phase = new LinkedHashMap<>();

        for (String line : output.lines().toList()) {
            if (line.toLowerCase(Locale.ROOT).contains("freq")) {
                headers = List.of(line.strip().split("\\s+"));
                continue;
            }
            if (headers == null || line.isBlank()) continue;
            String[] parts = line.strip().split("\\s+");
            if (parts.length < 2) continue;
            int width = Math.min(parts.length, headers.size());
            List<Double> values = toDoubles(parts, 0, Math.max(width, 2));
            if (values == null) continue;

            frequencies.add(values.get(1));
            for (int j = 2; j < width; j++) {
                String header = headers.get(j);
                String lower = header.toLowerCase(Locale.ROOT);
                if (lower.startsWith("vp(")) {
                    phase.computeIfAbsent(stripVector(header, 3), k -> new ArrayList<>()).add(values.get(j));
                } else if (lower.startsWith("v(")) {
                    magnitude.computeIfAbsent(stripVector(header, 2), k -> new ArrayList<>()).add(values.get(j));
                }
            }
        }
        if (frequencies.isEmpty()) {
            log.debug("No AC sweep table found");
            return Optional.empty();
        }
        return Optional.of(new AcResult(headers, frequencies, magnitude, phase));
    }

    /**
     * Noise spectra printed after {@code setplot noise1}. The header holds
     * {@code frequency} and {@code onoise}/{@code inoise} columns.
     */
    public static Optional<NoiseResult> parseNoiseResults(String output) {
        if (output == null) return Optional.empty();
        List<String> headers = null;
        List<Double> frequencies = new ArrayList<>();
        List<Double> onoise = new ArrayList<>();
        List<Double> inoise = new ArrayList<>();

        for (String line : output.lines().toList()) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("frequency") && (lower.contains("onoise") || lower.contains("inoise"))) {
                headers = List.of(line.strip().split("\\s+"));
                continue;
            }
            if (headers == null || line.isBlank()) continue;
            String[] parts = line.strip().split("\\s+");
            if (parts.length < 2) continue;
            List<Double> values = toDoubles(parts, 0, parts.length);
            if (values == null) continue;

            frequencies.add(parts.length > 2 ? values.get(1) : values.get(0));
            for (int j = 0; j < headers.size() && j < values.size(); j++) {
                String h = headers.get(j).toLowerCase(Locale.ROOT);
                if (h.contains("onoise")) {
                    onoise.add(values.get(j));
                } else if (h.contains("inoise")) {
                    inoise.add(values.get(j));
                }
            }
        }
        if (frequencies.isEmpty()) {
            log.debug("No noise spectrum found");
            return Optional.empty();
        }
        return Optional.of(new NoiseResult(frequencies, onoise, inoise));
    }

    /**
     * The table following {@code dc sensitivities of output ...}. Rows have
     * four columns (element, value, sensitivity, normalized) or three, in
     * which case the value is 0.
     */
    public static Optional<List<SensitivityEntry>> parseSensitivityResults(String output) {
        if (output == null) return Optional.empty();
        List<SensitivityEntry> entries = new ArrayList<>();
        boolean anchored = false;
        boolean inData = false;

        for (String line : output.lines().toList()) {
            String stripped = line.strip();
            String lower = stripped.toLowerCase(Locale.ROOT);
            if (lower.contains("dc sensitivities")) {
                anchored = true;
                continue;
            }
            if (!anchored) continue;
            if (!inData) {
                if (stripped.isEmpty() || lower.contains("element") || lower.contains("name")
                        || lower.contains("volts/") || lower.contains("amps/")) {
                    continue;
                }
                inData = true;
            }
            if (stripped.isEmpty()) {
                if (!entries.isEmpty()) break;
                continue;
            }
            String[] parts = stripped.split("\\s+");
            if (parts.length >= 4) {
                List<Double> v = toDoubles(parts, 1, 4);
                if (v != null) entries.add(new SensitivityEntry(parts[0], v.get(0), v.get(1), v.get(2)));
            } else if (parts.length == 3) {
                List<Double> v = toDoubles(parts, 1, 3);
                if (v != null) entries.add(new SensitivityEntry(parts[0], 0.0, v.get(0), v.get(1)));
            }
        }
        if (entries.isEmpty()) {
            log.debug("No sensitivity table found");
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(entries));
    }

    /**
     * {@code .tf} output. The gain line is required; impedances are optional.
     */
    public static Optional<TransferFunctionResult> parseTransferFunctionResults(String output) {
        if (output == null) return Optional.empty();
        Double gain = null;
        Double outputImpedance = null;
        Double inputImpedance = null;
        for (String line : output.lines().toList()) {
            Matcher m = TF_GAIN.matcher(line);
            if (m.find()) {
                gain = toDouble(m.group(1));
                continue;
            }
            m = TF_OUTPUT_IMPEDANCE.matcher(line);
            if (m.find()) {
                outputImpedance = toDouble(m.group(1));
                continue;
            }
            m = TF_INPUT_IMPEDANCE.matcher(line);
            if (m.find()) {
                inputImpedance = toDouble(m.group(1));
            }
        }
        if (gain == null) {
            log.debug("No transfer function found");
            return Optional.empty();
        }
        return Optional.of(new TransferFunctionResult(gain, outputImpedance, inputImpedance));
    }

    /**
     * {@code pole(n) = re, im} and {@code zero(n) = re, im} lines.
     */
    public static Optional<PoleZeroResult> parsePoleZeroResults(String output) {
        if (output == null) return Optional.empty();
        List<PoleZeroEntry> poles = new ArrayList<>();
        List<PoleZeroEntry> zeros = new ArrayList<>();
        for (String line : output.lines().toList()) {
            Matcher m = POLE_ZERO.matcher(line);
            if (!m.find()) continue;
            Double re = toDouble(m.group(2));
            Double im = toDouble(m.group(3));
            if (re == null || im == null) continue;
            PoleZeroEntry entry = PoleZeroEntry.of(re, im);
            if (m.group(1).equalsIgnoreCase("pole")) {
                poles.add(entry);
            } else {
                zeros.add(entry);
            }
        }
        if (poles.isEmpty() && zeros.isEmpty()) {
            log.debug("No poles or zeros found");
            return Optional.empty();
        }
        return Optional.of(new PoleZeroResult(poles, zeros));
    }

    /**
     * Reads a {@code wrdata} dump. The first line names the columns; rows
     * with a different column count are skipped. Empty when the file is
     * missing, empty or holds only the header.
     */
    public static Optional<TransientResult> parseTransientResults(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.error("wrdata file not found at {}", file);
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read wrdata file {}", file, e);
            return Optional.empty();
        }
        if (lines.isEmpty() || lines.get(0).isBlank()) {
            return Optional.empty();
        }

        List<String> columns = new ArrayList<>();
        for (String raw : lines.get(0).strip().split("\\s+")) {
            columns.add(sanitizeColumn(raw));
        }

        List<Map<String, Double>> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String[] parts = lines.get(i).strip().split("\\s+");
            if (parts.length != columns.size()) continue;
            List<Double> values = toDoubles(parts, 0, parts.length);
            if (values == null) continue;
            Map<String, Double> row = new LinkedHashMap<>();
            for (int c = 0; c < columns.size(); c++) {
                row.put(columns.get(c), values.get(c));
            }
            rows.add(row);
        }
        if (rows.isEmpty()) {
            log.debug("wrdata file {} has no data rows", file);
            return Optional.empty();
        }
        return Optional.of(new TransientResult(columns, rows));
    }

    static String sanitizeColumn(String header) {
        String name = VECTOR_V.matcher(header).replaceFirst("$1");
        name = VECTOR_I.matcher(name).replaceFirst("i_$1");
        return name.replace('#', '_');
    }

    /**
     * {@code .meas} results from stdout. A failed measurement maps to
     * {@code null}.
     */
    public static Optional<Map<String, Double>> parseMeasurementResults(String stdout) {
        if (stdout == null || stdout.isEmpty()) return Optional.empty();
        Map<String, Double> results = new LinkedHashMap<>();
        for (String line : stdout.lines().toList()) {
            Matcher m = MEASUREMENT.matcher(line);
            if (m.matches()) {
                Double value = toDouble(m.group(2));
                if (value != null) {
                    results.put(m.group(1), value);
                }
                continue;
            }
            Matcher failed = MEASUREMENT_FAILED.matcher(line);
            if (failed.matches()) {
                results.put(failed.group(1), null);
            }
        }
        if (results.isEmpty()) return Optional.empty();
        return Optional.of(Collections.unmodifiableMap(results));
    }

    /**
     * Renders rows as a fixed-width text table with {@code |} separators.
     */
    public static String formatResultsAsTable(List<Map<String, Double>> rows) {
        if (rows == null || rows.isEmpty()) {
            return "No data to display.";
        }
        List<String> headers = new ArrayList<>(rows.get(0).keySet());
        Map<String, Integer> widths = new LinkedHashMap<>();
        for (String h : headers) {
            int width = Math.max(h.length(), 12);
            for (Map<String, Double> row : rows) {
                width = Math.max(width, formatCell(row.get(h)).length());
            }
            widths.put(h, width);
        }

        StringBuilder sb = new StringBuilder();
        List<String> headerCells = new ArrayList<>();
        for (String h : headers) {
            headerCells.add(pad(h, widths.get(h)));
        }
        String headerLine = String.join(" | ", headerCells);
        sb.append(headerLine).append('\n');
        sb.append("-".repeat(headerLine.length()));
        for (Map<String, Double> row : rows) {
            List<String> cells = new ArrayList<>();
            for (String h : headers) {
                cells.add(pad(formatCell(row.get(h)), widths.get(h)));
            }
            sb.append('\n').append(String.join(" | ", cells));
        }
        return sb.toString();
    }

    private static String formatCell(Double value) {
        return value == null ? "" : String.format(Locale.US, "%.5e", value);
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }

    private static String stripVector(String header, int prefixLength) {
        String name = header.substring(prefixLength);
        return name.endsWith(")") ? name.substring(0, name.length() - 1) : name;
    }

    private static List<Double> toDoubles(String[] parts, int from, int to) {
        if (to > parts.length) return null;
        List<Double> values = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            Double v = toDouble(parts[i]);
            if (v == null) return null;
            values.add(v);
        }
        return values;
    }

    private static Double toDouble(String text) {
        if (text == null) return null;
        try {
            return Double.parseDouble(text.trim().replaceAll(",$", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
