package de.bsommerfeld.redditindexer.core.config;

import java.util.Locale;

/**
 * Selects the backends both processes run against.
 *
 * <p>
 * Set through the {@code mode} key of {@code config.json}; the system
 * property {@value #MODE_PROPERTY} overrides the file for a single run.
 */
public enum ApplicationMode {

    /** Reddit over HTTP, documents in MongoDB. */
    PROD,

    /** Synthetic listings and an in-memory store. No network access. */
    TEST;

    public static final String MODE_PROPERTY = "indexer.mode";

    /**
     * Parses a mode name, ignoring case and surrounding whitespace.
     *
     * @throws ConfigurationException for anything but {@code prod} or {@code test}
     */
    public static ApplicationMode parse(String value) throws ConfigurationException {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (ApplicationMode mode : values()) {
                if (mode.name().equals(normalized))
                    return mode;
            }
        }
        throw new ConfigurationException("Unknown mode '" + value + "', expected prod or test");
    }

    public boolean isTest() {
        return this == TEST;
    }
}
