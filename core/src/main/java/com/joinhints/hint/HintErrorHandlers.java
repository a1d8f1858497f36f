package com.joinhints.hint;

import com.joinhints.config.HintErrorMode;
import java.util.Objects;

/**
 * Factory for the built-in hint error handlers.
 */
public final class HintErrorHandlers {

    private HintErrorHandlers() {}

    /**
     * Returns the handler implementing the given error mode.
     *
     * @param mode the configured mode
     * @return the matching handler
     */
    public static HintErrorHandler forMode(HintErrorMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        return switch (mode) {
            case LOG -> HintErrorLogger.INSTANCE;
            case IGNORE -> NoopHintErrorHandler.INSTANCE;
            case STRICT -> StrictHintErrorHandler.INSTANCE;
        };
    }
}
