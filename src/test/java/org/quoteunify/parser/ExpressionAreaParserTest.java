package org.quoteunify.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionAreaParserTest {

    private static List<Boolean> flags(List<Chunk> chunks) {
        return chunks.stream().map(Chunk::expression).collect(Collectors.toList());
    }

    @Test
    void testPlainText() {
        assertEquals(List.of("text"), ExpressionAreaParser.split("text"));
        assertTrue(ExpressionAreaParser.findExpressionAreas("text").isEmpty());
    }

    @Test
    void testWholeBodyIsOneArea() {
        assertEquals(List.of(new ExpressionArea(0, 5)), ExpressionAreaParser.findExpressionAreas("{bcd}"));
        assertEquals(List.of(new Chunk("{bcd}", true)), ExpressionAreaParser.parse("{bcd}"));
    }

    @Test
    void testEscapedBracesAreLiteral() {
        assertTrue(ExpressionAreaParser.findExpressionAreas("{{not exp area}}").isEmpty());
        assertEquals(List.of(new Chunk("{{not exp area}}", false)), ExpressionAreaParser.parse("{{not exp area}}"));
    }

    @Test
    void testAreaBetweenEscapedBraces() {
        List<Chunk> chunks = ExpressionAreaParser.parse("{{{def}}}");

        assertEquals(List.of("{{", "{def}", "}}"), chunks.stream().map(Chunk::text).collect(Collectors.toList()));
        assertEquals(List.of(false, true, false), flags(chunks));
    }

    @Test
    void testAdjacentAreas() {
        assertEquals(List.of(new ExpressionArea(0, 3), new ExpressionArea(3, 6)),
                ExpressionAreaParser.findExpressionAreas("{b}{e}"));
        assertEquals(List.of(true, true), flags(ExpressionAreaParser.parse("{b}{e}")));
    }

    @Test
    void testNestedBracesStayInOneArea() {
        assertEquals(List.of(new Chunk("{ {1} }", true)), ExpressionAreaParser.parse("{ {1} }"));
    }

    @Test
    void testLiteralAroundArea() {
        List<Chunk> chunks = ExpressionAreaParser.parse("it's {name}!");

        assertEquals(List.of("it's ", "{name}", "!"), chunks.stream().map(Chunk::text).collect(Collectors.toList()));
        assertEquals(List.of(false, true, false), flags(chunks));
        assertTrue(chunks.get(0).contains('\''));
    }

    @Test
    void testBraceInsideNestedStringDoesNotCloseArea() {
        assertEquals(List.of(new ExpressionArea(0, 8)), ExpressionAreaParser.findExpressionAreas("{d['}']}"));
        assertTrue(ExpressionAreaParser.isExpressionArea("{d['}']}"));
    }

    @Test
    void testQuoteInFormatSpecIsFillCharacter() {
        List<Chunk> chunks = ExpressionAreaParser.parse("say \"hi\" {d[\"k\"]:\">5}");

        assertEquals(List.of("say \"hi\" ", "{d[\"k\"]:\">5}"),
                chunks.stream().map(Chunk::text).collect(Collectors.toList()));
        assertEquals(List.of(false, true), flags(chunks));
    }

    @Test
    void testAreasAfterFormatSpecQuote() {
        assertEquals(List.of(new ExpressionArea(0, 7), new ExpressionArea(8, 16)),
                ExpressionAreaParser.findExpressionAreas("{x:\">3}a{d[\"k\"]}"));
        assertEquals(List.of(true, false, true), flags(ExpressionAreaParser.parse("{x:'>3}a{d['k']}")));
    }

    @Test
    void testColonInsideBracketsDoesNotStartFormatSpec() {
        assertEquals(List.of(new ExpressionArea(0, 13)), ExpressionAreaParser.findExpressionAreas("{d[1:2]['}']}"));
        assertTrue(ExpressionAreaParser.isExpressionArea("{ {'a': '}'} }"));
    }

    @Test
    void testHasQuoteInFormatSpec() {
        assertTrue(ExpressionAreaParser.hasQuoteInFormatSpec("{x:\">3}"));
        assertTrue(ExpressionAreaParser.hasQuoteInFormatSpec("{x!r:'^{w}}"));
        assertFalse(ExpressionAreaParser.hasQuoteInFormatSpec("{d[\"k\"]:>5}"));
        assertFalse(ExpressionAreaParser.hasQuoteInFormatSpec("{x:{d['w']}}"));
        assertFalse(ExpressionAreaParser.hasQuoteInFormatSpec("{d['a:b']}"));
    }

    @Test
    void testUnterminatedAreaRunsToEnd() {
        assertEquals(List.of(new ExpressionArea(2, 6)), ExpressionAreaParser.findExpressionAreas("a {bc"));
        assertEquals(List.of(false, false), flags(ExpressionAreaParser.parse("a {bc")));
    }

    @Test
    void testChunksConcatenateToBody() {
        String body = "x{{y}} {a:{width}} z {b!r}";
        assertEquals(body, String.join("", ExpressionAreaParser.split(body)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{a}", "{ {1} }", "{a[0]}", "{x:{w}}", "{x:\">3}", "{x!r:'<{w}}"})
    void testIsExpressionArea(String chunk) {
        assertTrue(ExpressionAreaParser.isExpressionArea(chunk));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a", "{", "{{a}}", "{a}{b}", "{a} ", "x{a}"})
    void testIsNotExpressionArea(String chunk) {
        assertFalse(ExpressionAreaParser.isExpressionArea(chunk));
    }
}
