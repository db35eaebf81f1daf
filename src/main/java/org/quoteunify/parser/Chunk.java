package org.quoteunify.parser;

/**
 * One piece of an f-string body: either literal text or an expression area.
 *
 * @param text       the chunk text, braces included for expressions
 * @param expression true if the chunk is an expression area
 */
public record Chunk(String text, boolean expression) {

    public boolean contains(char c) {
        return text.indexOf(c) >= 0;
    }
}
