package org.quoteunify.core;

/**
 * Central configuration constants for the quote formatter.
 */
public final class Configuration {

    public static final String programName = "quoteunify";
    public static final String version = "1.0.0";

    // Only files with this extension are picked up when descending into directories
    public static final String sourceFileExtension = ".py";

    // Prevent instantiation
    private Configuration() {
    }

    public static String getVersionString() {
        return programName + " " + version;
    }
}
