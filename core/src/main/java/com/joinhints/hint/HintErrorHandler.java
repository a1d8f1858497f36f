package com.joinhints.hint;

import java.util.List;
import java.util.Set;

/**
 * Callback for customized handling of hint errors.
 *
 * <p>None of these conditions stops analysis or optimization: the caller always continues with
 * a well-defined fallback after notifying the handler. An implementation may log, collect, or
 * escalate by throwing; that policy belongs to the implementation.
 *
 * @see HintErrorLogger
 * @see NoopHintErrorHandler
 * @see StrictHintErrorHandler
 */
public interface HintErrorHandler {

    /**
     * Callback for an unknown hint. The hint is dropped.
     *
     * @param name the unrecognized hint name
     * @param parameters the hint parameters
     */
    void hintNotRecognized(String name, List<Object> parameters);

    /**
     * Callback for relation names specified in a hint that cannot be associated with any
     * relation in the current scope.
     *
     * @param name the hint name
     * @param parameters the hint parameters
     * @param invalidRelations the multi-part relation names that cannot be associated
     */
    void hintRelationsNotFound(String name, List<Object> parameters, Set<List<String>> invalidRelations);

    /**
     * Callback for a join hint specified on a relation that is not part of a join.
     *
     * @param hint the hint that found no join
     */
    void joinNotFoundForJoinHint(HintInfo hint);

    /**
     * Callback for a hint being overridden by another conflicting hint of the same kind.
     *
     * @param hint the hint being discarded
     */
    void hintOverridden(HintInfo hint);
}
