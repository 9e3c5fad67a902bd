package nl.bytesoflife.deltaspice.netlist;

import java.util.List;

/**
 * Generated SPICE source plus the issues raised while generating it.
 */
public record Netlist(String text, List<NetlistIssue> issues) {

    public Netlist {
        issues = List.copyOf(issues);
    }

    public List<String> lines() {
        return text.lines().toList();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public List<NetlistIssue> issuesOfKind(NetlistIssue.Kind kind) {
        return issues.stream()
                .filter(i -> i.kind() == kind)
                .toList();
    }
}
