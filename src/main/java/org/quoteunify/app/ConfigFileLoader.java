package org.quoteunify.app;

import org.quoteunify.formatter.EscapeSimple;
import org.quoteunify.formatter.ExpressionQuote;
import org.quoteunify.formatter.Quote;
import org.quoteunify.formatter.Rules;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads formatting rules from a YAML file.
 * <p>
 * The file holds a single mapping, for example:
 * <pre>
 * quote: "'"
 * escape-simple: backslash
 * f-string-expression-quote: depended
 * </pre>
 * Keys that are absent keep the value from the base rules.
 */
public final class ConfigFileLoader {

    public static final String QUOTE = "quote";
    public static final String ESCAPE_SIMPLE = "escape-simple";
    public static final String F_STRING_EXPRESSION_QUOTE = "f-string-expression-quote";

    private ConfigFileLoader() {
    }

    /**
     * Loads rules from a YAML file.
     *
     * @param path the configuration file
     * @param base the rules to start from
     * @return the base rules with the file's settings applied
     * @throws UsageException if the file cannot be read or holds invalid settings
     */
    public static Rules load(Path path, Rules base) {
        LoadSettings settings = LoadSettings.builder()
                .setLabel(path.toString())
                .setAllowDuplicateKeys(false)
                .build();
        Load load = new Load(settings);

        Object document;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            document = load.loadFromReader(reader);
        } catch (IOException e) {
            throw new UsageException("cannot read configuration file " + path + ": " + e.getMessage(), e);
        } catch (YamlEngineException e) {
            throw new UsageException("invalid configuration file " + path + ": " + e.getMessage(), e);
        }

        if (document == null) {
            return base;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new UsageException("invalid configuration file " + path + ": expected a mapping");
        }
        return apply(map, base, path);
    }

    private static Rules apply(Map<?, ?> map, Rules base, Path path) {
        Rules rules = base;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String value = String.valueOf(entry.getValue());
            try {
                switch (key) {
                    case QUOTE -> rules = rules.withPreferredQuote(Quote.fromSymbol(value));
                    case ESCAPE_SIMPLE -> rules = rules.withEscapeSimple(EscapeSimple.fromName(value));
                    case F_STRING_EXPRESSION_QUOTE ->
                            rules = rules.withFStringExpressionQuote(ExpressionQuote.fromName(value));
                    default -> throw new UsageException("unknown setting '" + key + "' in " + path);
                }
            } catch (IllegalArgumentException e) {
                throw new UsageException(path + ": " + key + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }
}
