package com.joinhints.hint;

import com.joinhints.exception.HintException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hint error handler that turns every hint problem into a {@link HintException}.
 *
 * <p>Use it where a misspelled or ineffective hint should fail the query instead of being
 * silently ignored, e.g. in tests of hinted workloads.
 */
public final class StrictHintErrorHandler implements HintErrorHandler {

    public static final StrictHintErrorHandler INSTANCE = new StrictHintErrorHandler();

    private StrictHintErrorHandler() {}

    @Override
    public void hintNotRecognized(String name, List<Object> parameters) {
        throw new HintException(HintException.Kind.UNRECOGNIZED_HINT,
            "Unrecognized hint: " + RelationIdentifiers.prettyHint(name, parameters));
    }

    @Override
    public void hintRelationsNotFound(String name, List<Object> parameters, Set<List<String>> invalidRelations) {
        String relations = invalidRelations.stream()
            .map(RelationIdentifiers::quoted)
            .sorted()
            .collect(Collectors.joining("', '", "'", "'"));
        throw new HintException(HintException.Kind.RELATIONS_NOT_FOUND,
            "Could not find relation %s specified in hint '%s'.".formatted(
                relations, RelationIdentifiers.prettyHint(name, parameters)));
    }

    @Override
    public void joinNotFoundForJoinHint(HintInfo hint) {
        throw new HintException(HintException.Kind.JOIN_NOT_FOUND,
            "A join hint " + hint + " is specified but it is not part of a join relation.");
    }

    @Override
    public void hintOverridden(HintInfo hint) {
        throw new HintException(HintException.Kind.HINT_OVERRIDDEN,
            "Hint " + hint + " is overridden by another hint and will not take effect.");
    }
}
