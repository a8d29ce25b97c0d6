package org.modcat.transform;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How aggressively module bodies are elided.
 */
public enum SummaryLevel {
    /** Full code, no summarization. */
    NONE("none"),
    /** Type and callable headers only. */
    INTERFACE("interface"),
    /** Interface rules plus accessor and initializer collapsing. */
    CORE("core");

    private final String value;

    SummaryLevel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a level name, ignoring case.
     *
     * @throws IllegalArgumentException For unknown names.
     */
    public static SummaryLevel fromString(String name) {
        for (SummaryLevel level : values()) {
            if (level.value.equalsIgnoreCase(name.strip())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown summary level '" + name + "', expected one of: "
                + Arrays.stream(values()).map(SummaryLevel::value).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return value.toLowerCase(Locale.ROOT);
    }
}
