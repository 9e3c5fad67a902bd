package nl.bytesoflife.deltaspice.result;

import java.util.List;

public record PoleZeroResult(List<PoleZeroEntry> poles, List<PoleZeroEntry> zeros) {

    public PoleZeroResult {
        poles = List.copyOf(poles);
        zeros = List.copyOf(zeros);
    }

    public boolean isUnstable() {
        return poles.stream().anyMatch(PoleZeroEntry::unstable);
    }
}
