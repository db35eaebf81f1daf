package org.quoteunify.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the expression areas of an f-string body.
 *
 * <p>An f-string body alternates literal text and <code>{...}</code> expressions.
 * Quotes inside an expression follow the rules of the expression, not of the
 * enclosing literal, so the quote rewriter needs the two kinds of text apart
 * before it can decide anything.</p>
 *
 * <p>The scan is a two-state machine with a brace depth counter:</p>
 * <ul>
 *   <li>OUTSIDE: <code>{{</code> is an escaped brace and stays literal text;
 *       a single <code>{</code> opens an expression area.</li>
 *   <li>INSIDE: <code>{</code> and <code>}</code> adjust the depth, and the area closes
 *       when the depth returns to zero. A quote character starts a nested
 *       string literal that is skipped as a whole, so braces inside it do not
 *       count. After the top-level <code>:</code> of an area the text is a
 *       format spec, where a quote is a plain character (a fill character in
 *       <code>{x:"&gt;3}</code>).</li>
 * </ul>
 * <p>An area still open at the end of the body closes there.</p>
 */
public final class ExpressionAreaParser {

    // States for the finite state machine (FSM)
    private static final int OUTSIDE = 0;
    private static final int INSIDE = 1;

    private ExpressionAreaParser() {
    }

    /**
     * Locates the expression areas of an f-string body.
     *
     * @param body the body of the literal, without prefix and delimiters
     * @return the areas in order; empty if the body is all literal text
     */
    public static List<ExpressionArea> findExpressionAreas(String body) {
        List<ExpressionArea> areas = new ArrayList<>();
        int length = body.length();
        int state = OUTSIDE;
        AreaScanner area = null;
        int areaStart = 0;
        int i = 0;

        while (i < length) {
            char c = body.charAt(i);
            switch (state) {
                case OUTSIDE:
                    if (c == '{') {
                        if (i + 1 < length && body.charAt(i + 1) == '{') {
                            // Escaped brace
                            i += 2;
                            continue;
                        }
                        areaStart = i;
                        area = new AreaScanner();
                        state = INSIDE;
                    }
                    i++;
                    break;

                case INSIDE:
                    i = area.advance(body, i);
                    if (area.isClosed()) {
                        areas.add(new ExpressionArea(areaStart, i));
                        state = OUTSIDE;
                    }
                    break;

                default:
                    throw new IllegalStateException("Unknown state " + state);
            }
        }

        if (state == INSIDE) {
            areas.add(new ExpressionArea(areaStart, length));
        }
        return areas;
    }

    /**
     * Splits an f-string body into its literal and expression chunks.
     * Concatenating the chunk texts gives back the body.
     *
     * @param body the body of the literal
     * @return the chunks in order
     */
    public static List<Chunk> parse(String body) {
        List<Chunk> chunks = new ArrayList<>();
        for (String text : split(body)) {
            chunks.add(new Chunk(text, isExpressionArea(text)));
        }
        return chunks;
    }

    /**
     * Splits an f-string body into chunk texts: maximal runs of literal text,
     * and one chunk per expression area.
     *
     * @param body the body of the literal
     * @return the chunk texts in order
     */
    public static List<String> split(String body) {
        List<String> chunks = new ArrayList<>();
        int last = 0;
        for (ExpressionArea area : findExpressionAreas(body)) {
            if (area.start() > last) {
                chunks.add(body.substring(last, area.start()));
            }
            chunks.add(body.substring(area.start(), area.end()));
            last = area.end();
        }
        if (last < body.length()) {
            chunks.add(body.substring(last));
        }
        return chunks;
    }

    /**
     * Tells whether a chunk, taken on its own, is a single expression area:
     * it must open with one brace (not an escaped <code>{{</code>) and the brace
     * opened first must be the one closed by its last character.
     *
     * @param chunk the text to test
     * @return true if the chunk is wrapped by one outermost brace pair
     */
    public static boolean isExpressionArea(String chunk) {
        int length = chunk.length();
        if (length < 2 || chunk.charAt(0) != '{' || chunk.charAt(1) == '{'
                || chunk.charAt(length - 1) != '}') {
            return false;
        }

        AreaScanner area = new AreaScanner();
        int i = 1;
        while (i < length) {
            i = area.advance(chunk, i);
            if (area.isClosed()) {
                return i == length;
            }
        }
        return false;
    }

    /**
     * Tells whether the format spec of an expression area contains a quote
     * character. Such a quote is a fill character, and it changes the output
     * of the f-string if it is replaced or escaped.
     *
     * @param chunk an expression area, braces included
     * @return true if a quote occurs in the format spec at the top level of the area
     */
    public static boolean hasQuoteInFormatSpec(String chunk) {
        AreaScanner area = new AreaScanner();
        int i = 1;
        while (i < chunk.length() && !area.isClosed()) {
            char c = chunk.charAt(i);
            if ((c == '\'' || c == '"') && area.isInFormatSpec()) {
                return true;
            }
            i = area.advance(chunk, i);
        }
        return false;
    }

    /**
     * Follows one expression area from just after its opening brace.
     */
    private static final class AreaScanner {
        private int depth = 1;
        private int brackets;
        // Brace depth whose format spec is being read, 0 outside any spec
        private int specDepth;

        boolean isClosed() {
            return depth == 0;
        }

        boolean isInFormatSpec() {
            return specDepth != 0 && depth == specDepth;
        }

        // Consumes the character (or nested string literal) at i; returns the next offset
        int advance(String text, int i) {
            char c = text.charAt(i);
            boolean inSpec = isInFormatSpec();
            if ((c == '\'' || c == '"') && !inSpec) {
                return skipNestedString(text, i);
            }
            switch (c) {
                case '{' -> depth++;
                case '}' -> {
                    if (depth == specDepth) {
                        specDepth = 0;
                    }
                    depth--;
                }
                case '(', '[' -> {
                    if (!inSpec) {
                        brackets++;
                    }
                }
                case ')', ']' -> {
                    if (!inSpec && brackets > 0) {
                        brackets--;
                    }
                }
                case ':' -> {
                    if (!inSpec && depth == 1 && brackets == 0) {
                        specDepth = 1;
                    }
                }
                default -> {
                }
            }
            return i + 1;
        }
    }

    // Returns the offset after the string literal starting at 'start', or the end of text
    private static int skipNestedString(String text, int start) {
        char q = text.charAt(start);
        String triple = String.valueOf(q).repeat(3);
        String quote = text.startsWith(triple, start) ? triple : String.valueOf(q);
        int length = text.length();
        int i = start + quote.length();
        while (i < length) {
            if (text.charAt(i) == '\\') {
                i += 2;
            } else if (text.startsWith(quote, i)) {
                return i + quote.length();
            } else {
                i++;
            }
        }
        return length;
    }
}
