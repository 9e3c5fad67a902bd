package nl.bytesoflife.deltaspice.preset;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads S-expressions: lists in parentheses, bare atoms and double-quoted
 * strings with backslash escapes. {@code #} and {@code ;} start a comment
 * that runs to the end of the line.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int line;
    private int lineStart;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        this.line = 1;
        this.lineStart = 0;
        List<SNode> nodes = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            char c = input.charAt(pos);
            if (c != '(') {
                throw error("Expected '(' at top level but found '" + c + "'");
            }
            nodes.add(parseList());
        }
        return nodes;
    }

    private SNode.SList parseList() {
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                throw error("Unexpected end of input, expected ')'");
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
    }

    private SNode.SAtom parseQuotedString() {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString());
            }
            if (c == '\n') {
                line++;
                lineStart = pos + 1;
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                sb.append(input.charAt(pos));
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw error("Unterminated quoted string");
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || c == ';' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return new SNode.SAtom(input.substring(start, pos));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                pos++;
                newLine();
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' || c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'");
        }
        pos++;
    }

    private ParseException error(String message) {
        int column = pos - lineStart + 1;
        return new ParseException(message + " at line " + line + ", column " + column, line, column);
    }

    public static class ParseException extends RuntimeException {
        private final int line;
        private final int column;

        public ParseException(String message, int line, int column) {
            super(message);
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }
}
