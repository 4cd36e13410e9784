package com.dcruver.tanaimport.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One node of an exported Tana graph.
 * Immutable for the duration of a conversion run.
 */
@Value
@Builder
public class GraphNode {

    public static final String TYPE_JOURNAL = "journal";
    public static final String TYPE_TUPLE = "tuple";
    public static final String TYPE_WORKSPACE = "workspace";
    public static final String TYPE_URL = "url";

    private static final int HEADING_FLAG = 2;

    String id;
    String name;
    String description;
    String docType;

    // Structural owner; may differ from the parents that list this node
    String ownerId;
    String metaNodeId;
    Integer flags;
    boolean done;
    Long created;

    @Singular
    List<String> children;

    // Nodes used by this node without being listed as children
    @Singular("association")
    Map<String, String> associationMap;

    public boolean isOfType(String type) {
        return type.equals(docType);
    }

    public boolean isOwnedBy(String parentId) {
        return ownerId != null && ownerId.equals(parentId);
    }

    public boolean isHeading() {
        return flags != null && (flags & HEADING_FLAG) != 0;
    }

    /**
     * Name, or the id when the node has no name.
     */
    public String getLabel() {
        return name != null ? name : id;
    }
}
