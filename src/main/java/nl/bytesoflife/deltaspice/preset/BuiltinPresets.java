package nl.bytesoflife.deltaspice.preset;

import nl.bytesoflife.deltaspice.model.AnalysisType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Analysis presets bundled as a classpath resource.
 */
public class BuiltinPresets {

    static final String RESOURCE = "/presets/builtin.presets";

    private static volatile List<SimulationPreset> cached;

    public static List<SimulationPreset> all() {
        if (cached == null) {
            synchronized (BuiltinPresets.class) {
                if (cached == null) {
                    cached = List.copyOf(load());
                }
            }
        }
        return cached;
    }

    public static List<SimulationPreset> byAnalysis(AnalysisType type) {
        return all().stream()
                .filter(p -> p.analysisType() == type)
                .toList();
    }

    public static Optional<SimulationPreset> byName(String name) {
        return all().stream()
                .filter(p -> p.name().equals(name))
                .findFirst();
    }

    private static List<SimulationPreset> load() {
        try (InputStream is = BuiltinPresets.class.getResourceAsStream(RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + RESOURCE);
            String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            return new PresetParser(true).parse(content);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load built-in presets", e);
        }
    }
}
