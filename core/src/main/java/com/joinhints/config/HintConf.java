package com.joinhints.config;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings that control hint analysis.
 *
 * <p>Values come from {@link #defaults()} or from JVM system properties via
 * {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@value #PROP_ERROR_MODE} - {@code log} (default), {@code ignore} or {@code strict}</li>
 *   <li>{@value #PROP_CASE_SENSITIVE} - compare relation names case-sensitively (default false)</li>
 *   <li>{@value #PROP_DISABLED} - drop every hint during analysis (default false)</li>
 * </ul>
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class HintConf {

    public static final String PROP_ERROR_MODE = "joinhints.hint.errorMode";
    public static final String PROP_CASE_SENSITIVE = "joinhints.hint.caseSensitive";
    public static final String PROP_DISABLED = "joinhints.hint.disabled";

    private static final HintConf DEFAULTS = new HintConf(HintErrorMode.LOG, false, false);

    private final HintErrorMode errorMode;
    private final boolean caseSensitive;
    private final boolean hintsDisabled;

    private HintConf(HintErrorMode errorMode, boolean caseSensitive, boolean hintsDisabled) {
        this.errorMode = Objects.requireNonNull(errorMode, "errorMode must not be null");
        this.caseSensitive = caseSensitive;
        this.hintsDisabled = hintsDisabled;
    }

    public static HintConf defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the configuration from the JVM system properties.
     *
     * @return the configuration, with defaults for unset properties
     * @throws IllegalArgumentException if the error mode is not recognized
     */
    public static HintConf fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from the given properties.
     *
     * @param props the properties to read
     * @return the configuration, with defaults for unset properties
     * @throws IllegalArgumentException if the error mode is not recognized
     */
    public static HintConf fromProperties(Properties props) {
        return new HintConf(
            HintErrorMode.parse(props.getProperty(PROP_ERROR_MODE)),
            getBoolean(props, PROP_CASE_SENSITIVE, DEFAULTS.caseSensitive),
            getBoolean(props, PROP_DISABLED, DEFAULTS.hintsDisabled));
    }

    private static boolean getBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public HintErrorMode errorMode() {
        return errorMode;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public boolean hintsDisabled() {
        return hintsDisabled;
    }

    public HintConf withErrorMode(HintErrorMode mode) {
        return new HintConf(mode, caseSensitive, hintsDisabled);
    }

    public HintConf withCaseSensitive(boolean value) {
        return new HintConf(errorMode, value, hintsDisabled);
    }

    public HintConf withHintsDisabled(boolean value) {
        return new HintConf(errorMode, caseSensitive, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HintConf)) return false;
        HintConf that = (HintConf) o;
        return errorMode == that.errorMode
            && caseSensitive == that.caseSensitive
            && hintsDisabled == that.hintsDisabled;
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorMode, caseSensitive, hintsDisabled);
    }

    @Override
    public String toString() {
        return String.format("HintConf(errorMode=%s, caseSensitive=%s, hintsDisabled=%s)",
            errorMode, caseSensitive, hintsDisabled);
    }
}
