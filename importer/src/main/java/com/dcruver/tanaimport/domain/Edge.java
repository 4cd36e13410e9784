package com.dcruver.tanaimport.domain;

import lombok.Value;

/**
 * A resolved edge from one node to another.
 */
@Value
public class Edge {
    EdgeKind kind;
    GraphNode target;

    public boolean isOwned() {
        return kind == EdgeKind.OWNED;
    }
}
