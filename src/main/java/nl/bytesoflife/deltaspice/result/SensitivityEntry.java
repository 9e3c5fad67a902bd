package nl.bytesoflife.deltaspice.result;

public record SensitivityEntry(String element, double value, double sensitivity, double normalizedSensitivity) {
}
