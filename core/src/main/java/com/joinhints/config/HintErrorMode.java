package com.joinhints.config;

/**
 * How hint problems are surfaced.
 *
 * <ul>
 *   <li>{@code LOG} (default) - log a warning and continue</li>
 *   <li>{@code IGNORE} - continue silently</li>
 *   <li>{@code STRICT} - fail the query with a {@link com.joinhints.exception.HintException}</li>
 * </ul>
 */
public enum HintErrorMode {
    LOG, IGNORE, STRICT;

    /**
     * Parse a mode string (case-insensitive).
     *
     * @param value "log", "ignore", or "strict"; null selects the default
     * @return the parsed mode
     * @throws IllegalArgumentException if value is not recognized
     */
    public static HintErrorMode parse(String value) {
        if (value == null) {
            return LOG;
        }
        return switch (value.trim().toLowerCase()) {
            case "log"    -> LOG;
            case "ignore" -> IGNORE;
            case "strict" -> STRICT;
            default -> throw new IllegalArgumentException(
                "Unknown hint error mode: '%s'. Valid values: log, ignore, strict".formatted(value));
        };
    }
}
