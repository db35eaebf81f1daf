package org.quoteunify.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The PythonLexer class converts Python source text into a sequence of tokens.
 * <p>
 * It works one physical line at a time, the same way Python's own
 * {@code tokenize} module does: it keeps track of open brackets, backslash
 * continuations, the indentation stack and string literals that span several
 * lines. Every token records its start and end position and the line it came
 * from, so that the text between tokens (whitespace, continuation backslashes)
 * can be recovered exactly from the source lines.
 * <p>
 * String literals follow the pre-3.12 rules: an f-string is a single STRING
 * token, and its expression parts may not contain the enclosing quote.
 * <p>
 * NOTE:
 * The lexer only needs to find token boundaries, not to validate the program.
 * Numbers are scanned loosely, and characters that are not part of Python's
 * syntax become single-character ERRORTOKENs rather than errors.
 * Only conditions that make the token boundaries themselves unreliable
 * (unterminated strings, unclosed brackets at end of input, inconsistent
 * dedents) raise a {@link TokenizeException}.
 */
public class PythonLexer {
    public static final int TAB_SIZE = 8;

    // Results of findStringEnd() besides a valid end offset
    private static final int NOT_FOUND = -1;
    private static final int UNTERMINATED = -2;

    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final String[] THREE_CHAR_OPERATORS = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] TWO_CHAR_OPERATORS = {
            "!=", "%=", "&=", "**", "*=", "+=", "-=", "->", "//", "/=", ":=",
            "<<", "<=", "<>", "==", ">=", ">>", "@=", "^=", "|="
    };

    // Array to mark operator characters
    private static final boolean[] isOperator;

    static {
        isOperator = new boolean[128];
        for (char c : "()[]{}:,;+-*/|&<>=.%~^@!".toCharArray()) {
            isOperator[c] = true;
        }
    }

    private final List<String> lines;
    private final List<LexerToken> tokens = new ArrayList<>();
    private final List<Integer> indents = new ArrayList<>();

    private int parenLevel;
    private boolean continued;

    // State of a string literal that continues on the next line
    private StringBuilder contStr;
    private StringBuilder contLine;
    private String endQuote;
    private int strStartRow;
    private int strStartColumn;

    /**
     * Creates a lexer for the given source text.
     *
     * @param input the complete source text
     */
    public PythonLexer(String input) {
        this.lines = splitLines(input);
    }

    /**
     * Splits text into physical lines, keeping each line's terminator
     * ({@code \n}, {@code \r\n} or {@code \r}).
     *
     * @param input the text to split
     * @return the physical lines; joined together they give back the input
     */
    public static List<String> splitLines(String input) {
        List<String> result = new ArrayList<>();
        int start = 0;
        int length = input.length();
        for (int i = 0; i < length; i++) {
            char c = input.charAt(i);
            if (c == '\n') {
                result.add(input.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                if (i + 1 < length && input.charAt(i + 1) == '\n') {
                    i++;
                }
                result.add(input.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < length) {
            result.add(input.substring(start));
        }
        return result;
    }

    /**
     * Returns the physical lines of the source, as used for token positions.
     */
    public List<String> getLines() {
        return lines;
    }

    /**
     * Tokenizes the whole input.
     *
     * @return the tokens in source order, ending with an ENDMARKER
     * @throws TokenizeException if the input cannot be tokenized
     */
    public List<LexerToken> tokenize() {
        tokens.clear();
        indents.clear();
        indents.add(0);
        parenLevel = 0;
        continued = false;
        contStr = null;

        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            tokenizeLine(line, lineNumber);
        }

        if (contStr != null) {
            throw new TokenizeException("EOF in multi-line string", strStartRow, strStartColumn);
        }
        if (parenLevel > 0 || continued) {
            throw new TokenizeException("EOF in multi-line statement", lineNumber + 1, 0);
        }

        // A last line without terminator still ends a logical line
        if (!lines.isEmpty()) {
            String lastLine = lines.get(lines.size() - 1);
            LexerToken last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (!isLineTerminator(lastLine.charAt(lastLine.length() - 1))
                    && last != null
                    && last.type != LexerTokenType.NEWLINE
                    && last.type != LexerTokenType.NL) {
                addToken(LexerTokenType.NEWLINE, "", lineNumber, lastLine.length(),
                        lineNumber, lastLine.length(), lastLine);
            }
        }

        for (int i = 1; i < indents.size(); i++) {
            addToken(LexerTokenType.DEDENT, "", lineNumber + 1, 0, lineNumber + 1, 0, "");
        }
        addToken(LexerTokenType.ENDMARKER, "", lineNumber + 1, 0, lineNumber + 1, 0, "");
        return new ArrayList<>(tokens);
    }

    private void tokenizeLine(String line, int lineNumber) {
        int pos = 0;
        int max = line.length();

        if (contStr != null) {
            // Inside a string literal started on an earlier line
            int end = findStringEnd(line, 0, endQuote);
            if (end == UNTERMINATED) {
                throw new TokenizeException("unterminated string literal", strStartRow, strStartColumn);
            }
            contLine.append(line);
            if (end == NOT_FOUND) {
                contStr.append(line);
                return;
            }
            contStr.append(line, 0, end);
            addToken(LexerTokenType.STRING, contStr.toString(), strStartRow, strStartColumn,
                    lineNumber, end, contLine.toString());
            contStr = null;
            contLine = null;
            pos = end;
        } else if (parenLevel == 0 && !continued) {
            // Start of a new statement: measure the indentation
            int column = 0;
            while (pos < max) {
                char c = line.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / TAB_SIZE + 1) * TAB_SIZE;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos == max) {
                return;
            }

            char current = line.charAt(pos);
            if (current == '#' || isLineTerminator(current)) {
                // Blank or comment-only lines do not affect indentation
                if (current == '#') {
                    int commentEnd = contentEnd(line);
                    addToken(LexerTokenType.COMMENT, line.substring(pos, commentEnd), lineNumber, pos,
                            lineNumber, commentEnd, line);
                    pos = commentEnd;
                }
                if (pos < max) {
                    addToken(LexerTokenType.NL, line.substring(pos), lineNumber, pos, lineNumber, max, line);
                }
                return;
            }

            int top = indents.get(indents.size() - 1);
            if (column > top) {
                indents.add(column);
                addToken(LexerTokenType.INDENT, line.substring(0, pos), lineNumber, 0, lineNumber, pos, line);
            }
            while (column < indents.get(indents.size() - 1)) {
                if (!indents.contains(column)) {
                    throw new IndentationException("unindent does not match any outer indentation level",
                            lineNumber, pos);
                }
                indents.remove(indents.size() - 1);
                addToken(LexerTokenType.DEDENT, "", lineNumber, pos, lineNumber, pos, line);
            }
        } else {
            // Continuation of a bracketed or backslash-continued statement
            continued = false;
        }

        while (pos < max) {
            pos = nextToken(line, lineNumber, pos);
        }
    }

    /**
     * Reads one token (or skips whitespace) starting at {@code pos}.
     *
     * @return the position after the consumed characters
     */
    private int nextToken(String line, int lineNumber, int pos) {
        int max = line.length();
        char current = line.charAt(pos);

        if (current == ' ' || current == '\t' || current == '\f') {
            return pos + 1;
        }
        if (isLineTerminator(current)) {
            LexerTokenType type = parenLevel > 0 ? LexerTokenType.NL : LexerTokenType.NEWLINE;
            addToken(type, line.substring(pos), lineNumber, pos, lineNumber, max, line);
            return max;
        }
        if (current == '#') {
            int commentEnd = contentEnd(line);
            addToken(LexerTokenType.COMMENT, line.substring(pos, commentEnd), lineNumber, pos,
                    lineNumber, commentEnd, line);
            return commentEnd;
        }
        if (current == '\\') {
            if (pos + 1 < max && isLineTerminator(line.charAt(pos + 1))) {
                continued = true;
                return max;
            }
            addToken(LexerTokenType.ERRORTOKEN, "\\", lineNumber, pos, lineNumber, pos + 1, line);
            return pos + 1;
        }
        if (isDigit(current) || (current == '.' && pos + 1 < max && isDigit(line.charAt(pos + 1)))) {
            return consumeNumber(line, lineNumber, pos);
        }
        if (current == '\'' || current == '"') {
            return consumeString(line, lineNumber, pos, pos);
        }

        int codePoint = line.codePointAt(pos);
        if (isIdentifierStart(codePoint)) {
            int end = pos + Character.charCount(codePoint);
            while (end < max) {
                int cp = line.codePointAt(end);
                if (!isIdentifierPart(cp)) {
                    break;
                }
                end += Character.charCount(cp);
            }
            // A short run of prefix letters directly followed by a quote starts a string
            if (end < max && (line.charAt(end) == '\'' || line.charAt(end) == '"')
                    && STRING_PREFIXES.contains(line.substring(pos, end).toLowerCase(Locale.ROOT))) {
                return consumeString(line, lineNumber, pos, end);
            }
            addToken(LexerTokenType.NAME, line.substring(pos, end), lineNumber, pos, lineNumber, end, line);
            return end;
        }
        if (current < 128 && isOperator[current]) {
            return consumeOperator(line, lineNumber, pos);
        }

        int end = pos + Character.charCount(codePoint);
        addToken(LexerTokenType.ERRORTOKEN, line.substring(pos, end), lineNumber, pos, lineNumber, end, line);
        return end;
    }

    private int consumeNumber(String line, int lineNumber, int start) {
        int pos = start;
        int max = line.length();
        boolean hex = line.regionMatches(true, start, "0x", 0, 2);
        while (pos < max) {
            char c = line.charAt(pos);
            if (isAsciiLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
            } else if ((c == '+' || c == '-') && !hex && pos > start
                    && (line.charAt(pos - 1) == 'e' || line.charAt(pos - 1) == 'E')) {
                // Exponent sign
                pos++;
            } else {
                break;
            }
        }
        addToken(LexerTokenType.NUMBER, line.substring(start, pos), lineNumber, start, lineNumber, pos, line);
        return pos;
    }

    private int consumeString(String line, int lineNumber, int start, int quotePos) {
        char q = line.charAt(quotePos);
        String triple = String.valueOf(q).repeat(3);
        String quote = line.startsWith(triple, quotePos) ? triple : String.valueOf(q);
        int bodyStart = quotePos + quote.length();

        int end = findStringEnd(line, bodyStart, quote);
        if (end >= 0) {
            addToken(LexerTokenType.STRING, line.substring(start, end), lineNumber, start, lineNumber, end, line);
            return end;
        }
        if (end == UNTERMINATED) {
            throw new TokenizeException("unterminated string literal", lineNumber, start);
        }

        // The literal continues on the next line
        contStr = new StringBuilder(line.substring(start));
        contLine = new StringBuilder(line);
        endQuote = quote;
        strStartRow = lineNumber;
        strStartColumn = start;
        return line.length();
    }

    /**
     * Looks for the closing delimiter of a string literal.
     *
     * @param line  the physical line
     * @param from  where the search starts (inside the literal body)
     * @param quote the delimiter, one or three quote characters
     * @return the offset just after the closing delimiter; NOT_FOUND if the
     * line ends before it and the literal may continue; UNTERMINATED if an
     * unescaped line break ends a single-quoted literal
     */
    private static int findStringEnd(String line, int from, String quote) {
        int max = line.length();
        boolean single = quote.length() == 1;
        int i = from;
        while (i < max) {
            char c = line.charAt(i);
            if (c == '\\') {
                // Skip the escaped character, treating \r\n as one
                if (i + 2 < max && line.charAt(i + 1) == '\r' && line.charAt(i + 2) == '\n') {
                    i += 3;
                } else {
                    i += 2;
                }
            } else if (single && isLineTerminator(c)) {
                return UNTERMINATED;
            } else if (line.startsWith(quote, i)) {
                return i + quote.length();
            } else {
                i++;
            }
        }
        return NOT_FOUND;
    }

    private int consumeOperator(String line, int lineNumber, int start) {
        String operator = null;
        for (String candidate : THREE_CHAR_OPERATORS) {
            if (line.startsWith(candidate, start)) {
                operator = candidate;
                break;
            }
        }
        if (operator == null) {
            for (String candidate : TWO_CHAR_OPERATORS) {
                if (line.startsWith(candidate, start)) {
                    operator = candidate;
                    break;
                }
            }
        }
        if (operator == null) {
            operator = String.valueOf(line.charAt(start));
        }

        switch (operator) {
            case "(", "[", "{" -> parenLevel++;
            case ")", "]", "}" -> parenLevel = Math.max(0, parenLevel - 1);
            default -> {
            }
        }

        int end = start + operator.length();
        addToken(LexerTokenType.OP, operator, lineNumber, start, lineNumber, end, line);
        return end;
    }

    private void addToken(LexerTokenType type, String text, int startRow, int startColumn,
                          int endRow, int endColumn, String line) {
        tokens.add(new LexerToken(type, text, startRow, startColumn, endRow, endColumn, line));
    }

    // Offset of the line terminator, or the line length if there is none
    private static int contentEnd(String line) {
        int end = line.length();
        while (end > 0 && isLineTerminator(line.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }
}
