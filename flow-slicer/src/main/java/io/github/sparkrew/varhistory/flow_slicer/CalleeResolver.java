package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.CalleeInfo;
import io.github.sparkrew.varhistory.flow_slicer.model.SourceLocation;

/**
 * Looks up the declaration of a callee whose frame starts at a given source location.
 */
@FunctionalInterface
public interface CalleeResolver {

    CalleeResolver NONE = (calleeName, entry) -> null;

    /**
     * @param calleeName the callee name as recorded, may be null
     * @param entry      location of the first statement executed in the callee frame
     * @return parameter names, varargs flag and belonging of the declaration, or null when it cannot be found.
     * The returned {@code frame} is ignored.
     */
    CalleeInfo resolve(String calleeName, SourceLocation entry);
}
