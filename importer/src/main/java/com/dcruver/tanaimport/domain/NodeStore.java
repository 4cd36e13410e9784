package com.dcruver.tanaimport.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id to node table for one conversion run.
 * All components receive the store explicitly and resolve edges through it.
 */
@Slf4j
public class NodeStore {

    static final String SYSTEM_CHILD_PREFIX = "SYS_";

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Notices notices;

    public NodeStore(Notices notices) {
        this.notices = notices;
    }

    /**
     * Load every node of every export into one store.
     * Cross-file references resolve by id, so all files must be loaded before classification.
     */
    public static NodeStore of(List<GraphExport> exports, Notices notices) {
        NodeStore store = new NodeStore(notices);
        for (GraphExport export : exports) {
            export.getNodes().forEach(store::add);
        }
        log.debug("Loaded {} nodes from {} export(s)", store.size(), exports.size());
        return store;
    }

    public void add(GraphNode node) {
        GraphNode existing = nodes.putIfAbsent(node.getId(), node);
        if (existing != null) {
            notices.add("Duplicate node id " + node.getId() + " ignored");
        }
    }

    public GraphNode get(String id) {
        return id != null ? nodes.get(id) : null;
    }

    public Optional<GraphNode> find(String id) {
        return Optional.ofNullable(get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Collection<GraphNode> all() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Listed children of a node in source order, tagged OWNED or REFERENCED.
     * System children are skipped; missing children are reported once and skipped.
     */
    public List<Edge> childEdges(GraphNode parent) {
        List<Edge> edges = new ArrayList<>(parent.getChildren().size());
        for (String childId : parent.getChildren()) {
            if (childId.startsWith(SYSTEM_CHILD_PREFIX)) {
                continue;
            }
            GraphNode child = nodes.get(childId);
            if (child == null) {
                notices.addOnce("Node with id " + childId + " (parent " + parent.getLabel() + ") not found");
                continue;
            }
            EdgeKind kind = child.isOwnedBy(parent.getId()) ? EdgeKind.OWNED : EdgeKind.REFERENCED;
            edges.add(new Edge(kind, child));
        }
        return edges;
    }

    /**
     * Nodes reachable through the association map.
     */
    public List<Edge> associationEdges(GraphNode node) {
        List<Edge> edges = new ArrayList<>();
        for (String targetId : node.getAssociationMap().values()) {
            GraphNode target = nodes.get(targetId);
            if (target != null) {
                edges.add(new Edge(EdgeKind.ASSOCIATED, target));
            }
        }
        return edges;
    }

    public Optional<GraphNode> metaNodeOf(GraphNode node) {
        return find(node.getMetaNodeId());
    }
}
