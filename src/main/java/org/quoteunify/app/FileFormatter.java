package org.quoteunify.app;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.quoteunify.formatter.QuoteUnifier;
import org.quoteunify.formatter.Rules;
import org.quoteunify.lexer.TokenizeException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the quote formatter on one file: reads it in its own encoding, and
 * either writes the result back or prints a unified diff.
 */
public class FileFormatter {

    private static final int DIFF_CONTEXT_LINES = 3;

    private final ArgumentParser.UnifyOptions options;
    private final Rules rules;
    private final PrintStream out;
    private final PrintStream err;

    public FileFormatter(ArgumentParser.UnifyOptions options, Rules rules, PrintStream out, PrintStream err) {
        this.options = options;
        this.rules = rules;
        this.out = out;
        this.err = err;
    }

    /**
     * Formats one file.
     *
     * @param fileName the file, as named on the command line or found below a directory
     * @return true if the file needed changes
     * @throws IOException if the file cannot be read or written
     */
    public boolean formatFile(String fileName) throws IOException {
        Path path = Paths.get(fileName);
        byte[] bytes = Files.readAllBytes(path);
        Charset encoding = EncodingDetector.detectEncoding(bytes);
        String source = new String(bytes, encoding);

        String formatted = format(source, fileName);
        if (source.equals(formatted)) {
            logDebug(fileName + ": unchanged (" + encoding.name() + ")");
            return false;
        }

        if (options.inPlace) {
            Files.write(path, formatted.getBytes(encoding));
            logDebug(fileName + ": rewritten in place");
        } else {
            out.print(unifiedDiff(source, formatted, fileName));
            logDebug(fileName + ": would change");
        }
        return true;
    }

    private String format(String source, String fileName) {
        try {
            return QuoteUnifier.formatCodeOrThrow(source, rules);
        } catch (TokenizeException e) {
            logDebug(fileName + ": left unchanged, " + e.getMessage());
            return source;
        }
    }

    /**
     * Builds a unified diff between two versions of a file, labelled
     * {@code before/<name>} and {@code after/<name>}.
     *
     * @return the diff, one line per output line, each ending in a newline
     */
    public static String unifiedDiff(String source, String formatted, String fileName) {
        List<String> original = source.lines().collect(Collectors.toList());
        List<String> revised = formatted.lines().collect(Collectors.toList());
        Patch<String> patch = DiffUtils.diff(original, revised);
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
                "before/" + fileName, "after/" + fileName, original, patch, DIFF_CONTEXT_LINES);

        StringBuilder result = new StringBuilder();
        for (String line : diff) {
            result.append(line).append('\n');
        }
        return result.toString();
    }

    /**
     * Describes an I/O failure in one line, naming the file.
     */
    public static String describe(String fileName, IOException e) {
        String reason;
        if (e instanceof NoSuchFileException) {
            reason = "No such file or directory";
        } else if (e instanceof AccessDeniedException) {
            reason = "Permission denied";
        } else {
            reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        return fileName + ": " + reason;
    }

    public void logDebug(String message) {
        if (options.debugEnabled) {
            err.println(message);
        }
    }
}
