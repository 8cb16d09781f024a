package com.familygraph.model;

import java.util.List;

/**
 * A problem found in a person's edge neighbourhood. Reported, never auto-corrected.
 */
public record ConsistencyIssue(
    Kind kind,
    Long personId,
    List<Long> relationshipIds,
    String message
) {
    public enum Kind {
        SELF_RELATIONSHIP,
        /** The same ordered pair carries a type and its reciprocal, e.g. A parent B and A child B. */
        CONFLICTING_DIRECTION,
        /** An edge is stored twice, once as its reciprocal in the other direction. */
        RECIPROCAL_DUPLICATE,
        PARENT_CYCLE,
        PARENT_BORN_AFTER_CHILD
    }

    public ConsistencyIssue {
        relationshipIds = relationshipIds == null ? List.of() : List.copyOf(relationshipIds);
    }
}
