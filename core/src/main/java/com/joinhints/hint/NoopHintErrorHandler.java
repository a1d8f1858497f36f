package com.joinhints.hint;

import java.util.List;
import java.util.Set;

/**
 * Hint error handler that ignores every notification.
 */
public final class NoopHintErrorHandler implements HintErrorHandler {

    public static final NoopHintErrorHandler INSTANCE = new NoopHintErrorHandler();

    private NoopHintErrorHandler() {}

    @Override
    public void hintNotRecognized(String name, List<Object> parameters) {
    }

    @Override
    public void hintRelationsNotFound(String name, List<Object> parameters, Set<List<String>> invalidRelations) {
    }

    @Override
    public void joinNotFoundForJoinHint(HintInfo hint) {
    }

    @Override
    public void hintOverridden(HintInfo hint) {
    }
}
