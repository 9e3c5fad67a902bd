package nl.bytesoflife.deltaspice.result;

/**
 * A pole or zero in the complex plane. {@code frequencyHz} is the magnitude
 * divided by 2&pi;; a positive real part is unstable.
 */
public record PoleZeroEntry(double real, double imag, double frequencyHz, boolean unstable) {

    public static PoleZeroEntry of(double real, double imag) {
        double magnitude = Math.hypot(real, imag);
        double frequency = magnitude > 0 ? magnitude / (2 * Math.PI) : 0.0;
        return new PoleZeroEntry(real, imag, frequency, real > 0);
    }
}
