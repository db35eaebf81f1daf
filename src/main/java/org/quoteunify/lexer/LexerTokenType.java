package org.quoteunify.lexer;

/**
 * Token categories produced by {@link PythonLexer}.
 * The names follow the ones used by Python's own {@code tokenize} module.
 */
public enum LexerTokenType {
    STRING,
    NAME,
    NUMBER,
    OP,
    COMMENT,
    NEWLINE,    // end of a logical line
    NL,         // line break that does not end a logical line
    INDENT,
    DEDENT,
    ERRORTOKEN, // character the lexer could not classify
    ENDMARKER
}
