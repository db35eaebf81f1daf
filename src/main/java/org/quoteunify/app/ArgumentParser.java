package org.quoteunify.app;

import org.quoteunify.core.Configuration;
import org.quoteunify.formatter.EscapeSimple;
import org.quoteunify.formatter.ExpressionQuote;
import org.quoteunify.formatter.Quote;
import org.quoteunify.formatter.Rules;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the UnifyOptions accordingly. It handles the flags that
 * select the output mode (diff, in-place, check-only), the directory
 * traversal, and the formatting rules.
 * <p>
 * Options and file names may be mixed; everything after {@code --} is a file name.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a UnifyOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A UnifyOptions object with settings derived from the arguments.
     * @throws UsageException if the arguments are invalid
     */
    public static UnifyOptions parseArguments(String[] args) {
        UnifyOptions parsedArgs = new UnifyOptions();

        processArgs(args, parsedArgs);

        if (!parsedArgs.helpRequested && !parsedArgs.versionRequested && parsedArgs.files.isEmpty()) {
            throw new UsageException("the following arguments are required: files");
        }
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The UnifyOptions object to configure.
     */
    private static void processArgs(String[] args, UnifyOptions parsedArgs) {
        boolean readingFiles = false; // Set once "--" has been seen

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingFiles || !arg.startsWith("-") || arg.equals("-")) {
                parsedArgs.files.add(arg);
            } else if (arg.equals("--")) {
                // "--" indicates the end of switch arguments
                readingFiles = true;
            } else if (arg.startsWith("--")) {
                // Process long-form switches (e.g., --in-place, --quote)
                i = processLongSwitches(args, parsedArgs, arg, i);
            } else {
                // Process clustered single-character switches (e.g., -ir)
                processClusteredSwitches(parsedArgs, arg);
            }
        }
    }

    /**
     * Processes clustered single-character switches (e.g., -i, -r, -ri).
     *
     * @param parsedArgs The UnifyOptions object to configure.
     * @param arg        The current argument being processed.
     */
    private static void processClusteredSwitches(UnifyOptions parsedArgs, String arg) {
        for (int j = 1; j < arg.length(); j++) {
            char switchChar = arg.charAt(j);

            switch (switchChar) {
                case 'i':
                    parsedArgs.inPlace = true;
                    break;
                case 'c':
                    parsedArgs.checkOnly = true;
                    break;
                case 'r':
                    parsedArgs.recursive = true;
                    break;
                case 'h':
                    parsedArgs.helpRequested = true;
                    break;
                default:
                    throw new UsageException("unrecognized arguments: " + arg);
            }
        }
    }

    /**
     * Processes long-form switches. Switches taking a value accept it either
     * as the next argument or after an equals sign ({@code --quote='"'}).
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The UnifyOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the switch.
     */
    private static int processLongSwitches(String[] args, UnifyOptions parsedArgs, String arg, int index) {
        String name = arg;
        String inlineValue = null;
        int equals = arg.indexOf('=');
        if (equals > 0) {
            name = arg.substring(0, equals);
            inlineValue = arg.substring(equals + 1);
        }

        switch (name) {
            case "--in-place":
                rejectValue(name, inlineValue);
                parsedArgs.inPlace = true;
                break;
            case "--check-only":
                rejectValue(name, inlineValue);
                parsedArgs.checkOnly = true;
                break;
            case "--recursive":
                rejectValue(name, inlineValue);
                parsedArgs.recursive = true;
                break;
            case "--debug":
                rejectValue(name, inlineValue);
                parsedArgs.debugEnabled = true;
                break;
            case "--version":
                rejectValue(name, inlineValue);
                parsedArgs.versionRequested = true;
                break;
            case "--help":
                rejectValue(name, inlineValue);
                parsedArgs.helpRequested = true;
                break;
            case "--quote":
                index = handleValueSwitch(args, index, name, inlineValue,
                        value -> parsedArgs.quote = Quote.fromSymbol(value));
                break;
            case "--escape-simple":
                index = handleValueSwitch(args, index, name, inlineValue,
                        value -> parsedArgs.escapeSimple = EscapeSimple.fromName(value));
                break;
            case "--f-string-expression-quote":
                index = handleValueSwitch(args, index, name, inlineValue,
                        value -> parsedArgs.fStringExpressionQuote = ExpressionQuote.fromName(value));
                break;
            case "--config":
                index = handleValueSwitch(args, index, name, inlineValue,
                        value -> parsedArgs.configFile = value);
                break;
            default:
                throw new UsageException("unrecognized arguments: " + arg);
        }
        return index;
    }

    /**
     * Reads the value of a switch and hands it to the setter.
     *
     * @return The updated index after consuming the value.
     */
    private static int handleValueSwitch(String[] args, int index, String name, String inlineValue,
                                         Consumer<String> setter) {
        String value = inlineValue;
        if (value == null) {
            if (index + 1 >= args.length) {
                throw new UsageException("argument " + name + ": expected one argument");
            }
            value = args[++index];
        }
        try {
            setter.accept(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException("argument " + name + ": " + e.getMessage(), e);
        }
        return index;
    }

    private static void rejectValue(String name, String inlineValue) {
        if (inlineValue != null) {
            throw new UsageException("argument " + name + ": ignored explicit argument '" + inlineValue + "'");
        }
    }

    /**
     * Prints the help message detailing the usage of the program and its options.
     *
     * @param out where to print
     */
    public static void printHelp(PrintStream out) {
        out.println("Usage: " + Configuration.programName + " [options] files...");
        out.println();
        out.println("Modifies strings to all use the same quote where possible.");
        out.println();
        out.println("  -i, --in-place                  make changes to files instead of printing diffs");
        out.println("  -c, --check-only                exit with status 1 if any file would be changed");
        out.println("  -r, --recursive                 drill down directories recursively");
        out.println("  --quote {',\"}                   preferred quote (default: ')");
        out.println("  --escape-simple {opposite,backslash,ignore}");
        out.println("                                  handling of strings containing one kind of quote");
        out.println("                                  (default: opposite)");
        out.println("  --f-string-expression-quote {single,double,depended}");
        out.println("                                  quote style of strings inside f-string expressions");
        out.println("  --config FILE                   read rule defaults from a YAML file");
        out.println("  --debug                         print what is done with each file");
        out.println("  --version                       print the version and exit");
        out.println("  -h, --help                      displays this help message");
    }

    /**
     * UnifyOptions holds the settings derived from the command line.
     * <p>
     * Fields:
     * - inPlace: Write formatted files back instead of printing diffs.
     * - checkOnly: Report through the exit status whether any file would change.
     * - recursive: Descend into directory arguments.
     * - debugEnabled: Print a trace line for each file to standard error.
     * - quote, escapeSimple, fStringExpressionQuote: Rule overrides; null when not given.
     * - configFile: YAML file with rule defaults, or null.
     * - files: The file and directory arguments, in command-line order.
     */
    public static class UnifyOptions {
        public boolean inPlace = false;
        public boolean checkOnly = false;
        public boolean recursive = false;
        public boolean debugEnabled = false;
        public boolean helpRequested = false;
        public boolean versionRequested = false;
        public Quote quote = null;
        public EscapeSimple escapeSimple = null;
        public ExpressionQuote fStringExpressionQuote = null;
        public String configFile = null;
        public List<String> files = new ArrayList<>();

        /**
         * Applies the rule switches given on the command line on top of
         * {@code base}.
         *
         * @param base the rules from the configuration file or the defaults
         * @return the effective rules
         */
        public Rules applyTo(Rules base) {
            Rules rules = base;
            if (quote != null) {
                rules = rules.withPreferredQuote(quote);
            }
            if (escapeSimple != null) {
                rules = rules.withEscapeSimple(escapeSimple);
            }
            if (fStringExpressionQuote != null) {
                rules = rules.withFStringExpressionQuote(fStringExpressionQuote);
            }
            return rules;
        }

        @Override
        public String toString() {
            return "UnifyOptions{\n" +
                    "    inPlace=" + inPlace + ",\n" +
                    "    checkOnly=" + checkOnly + ",\n" +
                    "    recursive=" + recursive + ",\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    quote=" + quote + ",\n" +
                    "    escapeSimple=" + escapeSimple + ",\n" +
                    "    fStringExpressionQuote=" + fStringExpressionQuote + ",\n" +
                    "    configFile=" + configFile + ",\n" +
                    "    files=" + files + "\n" +
                    "}";
        }
    }
}
