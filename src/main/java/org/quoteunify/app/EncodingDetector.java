package org.quoteunify.app;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out the character encoding of a Python source file.
 * <p>
 * The rules are those of PEP 263: a UTF-8 byte order mark means UTF-8,
 * otherwise a {@code coding:} or {@code coding=} declaration in a comment on
 * one of the first two lines names the encoding, and without either the file
 * is UTF-8. If the file does not decode cleanly with that encoding, or names
 * one that is not known, it is read as latin-1, which accepts any byte.
 */
public final class EncodingDetector {

    private static final Pattern CODING_COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");

    private EncodingDetector() {
    }

    /**
     * Returns the encoding to read the given file contents with.
     *
     * @param bytes the raw file contents
     * @return the detected charset; ISO-8859-1 as the fallback
     */
    public static Charset detectEncoding(byte[] bytes) {
        Charset charset = declaredEncoding(bytes);
        if (charset != null && canDecode(bytes, charset)) {
            return charset;
        }
        return StandardCharsets.ISO_8859_1;
    }

    // The encoding named by the BOM or coding cookie, UTF-8 by default, null if unknown
    private static Charset declaredEncoding(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }

        // The cookie itself is ASCII, so latin-1 is good enough to look for it
        String head = new String(bytes, 0, Math.min(bytes.length, 1024), StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\r\n|\r|\n", 3);
        for (int i = 0; i < Math.min(lines.length, 2); i++) {
            Matcher matcher = CODING_COOKIE.matcher(lines[i]);
            if (matcher.find()) {
                return charsetFor(matcher.group(1));
            }
            // The second line only counts if the first holds no code
            if (!BLANK_OR_COMMENT.matcher(lines[i]).find()) {
                break;
            }
        }
        return StandardCharsets.UTF_8;
    }

    /**
     * Maps a Python codec name onto a Java charset.
     *
     * @param name the name from the coding cookie
     * @return the charset, or null if there is none with that name
     */
    static Charset charsetFor(String name) {
        String normalized = name.toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("utf-8") || normalized.startsWith("utf-8-") || normalized.equals("utf8")) {
            return StandardCharsets.UTF_8;
        }
        if (normalized.equals("latin-1") || normalized.equals("latin1")
                || normalized.startsWith("iso-8859-1-") || normalized.startsWith("iso-latin-1")) {
            return StandardCharsets.ISO_8859_1;
        }
        try {
            return Charset.forName(normalized);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }

    private static boolean canDecode(byte[] bytes, Charset charset) {
        try {
            charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
