package nl.bytesoflife.deltaspice.preset;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(version 1)");
        assertEquals(1, nodes.size());
        SNode.SList list = assertInstanceOf(SNode.SList.class, nodes.get(0));
        assertEquals("version", list.tag());
        assertEquals("1", list.atom(1).orElseThrow());
        assertTrue(list.atom(2).isEmpty());
    }

    @Test
    void parseNestedLists() {
        SNode.SList list = (SNode.SList) parser.parse("(preset \"Quick\" (param step 1e-05))").get(0);
        assertEquals(3, list.children().size());
        SNode.SList param = assertInstanceOf(SNode.SList.class, list.children().get(2));
        assertEquals("param", param.tag());
        assertTrue(list.atom(2).isEmpty());
        assertEquals("(preset Quick (param step 1e-05))", list.toString());
    }

    @Test
    void parseQuotedStringWithEscapes() {
        SNode.SList list = (SNode.SList) parser.parse("(preset \"Say \\\"hi\\\" (twice)\")").get(0);
        assertEquals("Say \"hi\" (twice)", list.atom(1).orElseThrow());
    }

    @Test
    void skipComments() {
        String input = """
                # hash comment
                (version 1)
                ; semicolon comment
                (preset "a") ; trailing
                """;
        assertEquals(2, parser.parse(input).size());
    }

    @Test
    void parseEmptyAndCommentOnlyInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   \n\n  # comment only\n  ").isEmpty());
    }

    @Test
    void atomAtTopLevelIsRejectedWithPosition() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(version 1)\n  oops"));
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
    }

    @Test
    void unbalancedInputIsRejected() {
        assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(preset (analysis x)"));
        assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(preset \"unterminated)"));
    }

    @Test
    void lineCountIncludesNewlinesInsideStrings() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(a \"one\ntwo\")\nbad"));
        assertEquals(3, e.getLine());
        assertEquals(1, e.getColumn());
    }
}
