package org.quoteunify.parser;

/**
 * A brace-delimited expression region of an f-string body, as half-open
 * offsets into the body. The braces are part of the region.
 */
public record ExpressionArea(int start, int end) {
}
