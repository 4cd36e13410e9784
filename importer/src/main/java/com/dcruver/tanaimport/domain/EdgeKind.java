package com.dcruver.tanaimport.domain;

/**
 * Kinds of edges leaving a node.
 */
public enum EdgeKind {
    /**
     * Listed child whose owner is the listing node - rendered inline
     */
    OWNED,

    /**
     * Listed child owned by some other node - rendered as a link
     */
    REFERENCED,

    /**
     * Node used through the association map, never listed or rendered
     */
    ASSOCIATED
}
