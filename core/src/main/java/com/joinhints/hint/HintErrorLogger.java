package com.joinhints.hint;

import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default hint error handler: logs every problem as a warning and lets compilation continue.
 */
public final class HintErrorLogger implements HintErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(HintErrorLogger.class);

    public static final HintErrorLogger INSTANCE = new HintErrorLogger();

    private HintErrorLogger() {}

    @Override
    public void hintNotRecognized(String name, List<Object> parameters) {
        logger.warn("Unrecognized hint: {}", RelationIdentifiers.prettyHint(name, parameters));
    }

    @Override
    public void hintRelationsNotFound(String name, List<Object> parameters, Set<List<String>> invalidRelations) {
        String hint = RelationIdentifiers.prettyHint(name, parameters);
        for (List<String> relation : invalidRelations) {
            logger.warn("Count not find relation '{}' specified in hint '{}'.",
                RelationIdentifiers.quoted(relation), hint);
        }
    }

    @Override
    public void joinNotFoundForJoinHint(HintInfo hint) {
        logger.warn("A join hint {} is specified but it is not part of a join relation.", hint);
    }

    @Override
    public void hintOverridden(HintInfo hint) {
        logger.warn("Hint {} is overridden by another hint and will not take effect.", hint);
    }
}
