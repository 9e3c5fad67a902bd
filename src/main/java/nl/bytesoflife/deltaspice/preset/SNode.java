package nl.bytesoflife.deltaspice.preset;

import java.util.List;
import java.util.Optional;

/**
 * Node of an S-expression tree: an atom or a parenthesized list.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value) implements SNode {
        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /**
         * The leading atom, e.g. {@code preset} for {@code (preset "x" ...)},
         * or an empty string.
         */
        public String tag() {
            return atom(0).orElse("");
        }

        public Optional<String> atom(int index) {
            if (index >= children.size()) return Optional.empty();
            return children.get(index) instanceof SAtom a ? Optional.of(a.value()) : Optional.empty();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
