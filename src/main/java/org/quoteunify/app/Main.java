package org.quoteunify.app;

import org.quoteunify.core.Configuration;
import org.quoteunify.formatter.Rules;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Command-line entry point.
 * <p>
 * Exit status: 0 on success, 1 if a file could not be processed or if
 * {@code --check-only} found a file that needs changes, 2 for usage errors.
 */
public class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the formatter with the given arguments.
     *
     * @param args the command-line arguments
     * @param out  where diffs, help and version go
     * @param err  where errors and debug lines go
     * @return the exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        ArgumentParser.UnifyOptions options;
        Rules rules;
        try {
            options = ArgumentParser.parseArguments(args);
            if (options.helpRequested) {
                ArgumentParser.printHelp(out);
                return EXIT_OK;
            }
            if (options.versionRequested) {
                out.println(Configuration.getVersionString());
                return EXIT_OK;
            }
            Rules base = options.configFile != null
                    ? ConfigFileLoader.load(Paths.get(options.configFile), Rules.DEFAULT)
                    : Rules.DEFAULT;
            rules = options.applyTo(base);
        } catch (UsageException e) {
            err.println(Configuration.programName + ": error: " + e.getMessage());
            err.println("Try '" + Configuration.programName + " --help' for more information.");
            return EXIT_USAGE;
        }

        FileFormatter formatter = new FileFormatter(options, rules, out, err);
        formatter.logDebug("options: " + options);
        formatter.logDebug("rules: " + rules);

        boolean failed = false;
        boolean changed = false;
        for (String name : new LinkedHashSet<>(options.files)) {
            List<String> fileNames;
            if (options.recursive && Files.isDirectory(Paths.get(name))) {
                try {
                    fileNames = SourceFileFinder.findSourceFiles(Paths.get(name)).stream()
                            .map(Path::toString)
                            .toList();
                } catch (IOException | UncheckedIOException e) {
                    err.println(name + ": " + e.getMessage());
                    failed = true;
                    continue;
                }
            } else {
                fileNames = List.of(name);
            }

            for (String fileName : fileNames) {
                try {
                    changed |= formatter.formatFile(fileName);
                } catch (IOException e) {
                    err.println(FileFormatter.describe(fileName, e));
                    failed = true;
                }
            }
        }

        if (failed) {
            return EXIT_FAILURE;
        }
        if (options.checkOnly && !options.inPlace && changed) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }
}
