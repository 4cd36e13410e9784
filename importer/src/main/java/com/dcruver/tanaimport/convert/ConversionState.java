package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.Edge;
import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.Notices;
import com.dcruver.tanaimport.domain.TopLevelEntry;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable bookkeeping of one run: converted set, anchor set and top-level index.
 * Private to a single conversion and discarded afterwards.
 */
public class ConversionState {

    @Getter
    private final NodeStore store;
    @Getter
    private final Notices notices;

    private final Set<String> converted = new HashSet<>();
    private final Set<String> anchors = new HashSet<>();
    private final Map<String, TopLevelEntry> topLevel = new LinkedHashMap<>();
    private final Set<String> usedTitles = new HashSet<>();

    public ConversionState(NodeStore store, Notices notices) {
        this.store = store;
        this.notices = notices;
    }

    /**
     * @return true if the node was not converted before
     */
    public boolean markConverted(GraphNode node) {
        return converted.add(node.getId());
    }

    public boolean isConverted(String id) {
        return converted.contains(id);
    }

    public int convertedCount() {
        return converted.size();
    }

    /**
     * Mark a node and everything hanging off it (children of any kind, meta node,
     * associated nodes) as intentionally skipped. Already converted nodes stop the walk.
     */
    public void markSeen(GraphNode start) {
        Deque<GraphNode> pending = new ArrayDeque<>();
        pending.push(start);
        while (!pending.isEmpty()) {
            GraphNode node = pending.pop();
            if (!converted.add(node.getId())) {
                continue;
            }
            for (Edge edge : store.childEdges(node)) {
                pending.push(edge.getTarget());
            }
            store.metaNodeOf(node).ifPresent(pending::push);
            for (Edge edge : store.associationEdges(node)) {
                pending.push(edge.getTarget());
            }
        }
    }

    public void markAssociatedSeen(GraphNode node) {
        for (Edge edge : store.associationEdges(node)) {
            markSeen(edge.getTarget());
        }
    }

    public void addAnchor(String id) {
        anchors.add(id);
    }

    public boolean hasAnchor(String id) {
        return anchors.contains(id);
    }

    public Set<String> anchors() {
        return Collections.unmodifiableSet(anchors);
    }

    /**
     * Register a node as its own document. The title is sanitized for use as a
     * filename and made unique among the titles registered so far.
     */
    public TopLevelEntry registerTopLevel(GraphNode node, String displayName) {
        TopLevelEntry existing = topLevel.get(node.getId());
        if (existing != null) {
            return existing;
        }
        String base = TitleSanitizer.sanitize(displayName);
        String title = base;
        for (int counter = 1; !usedTitles.add(title.toLowerCase(Locale.ROOT)); counter++) {
            title = base + " " + counter;
        }
        TopLevelEntry entry = new TopLevelEntry(node, title);
        topLevel.put(node.getId(), entry);
        return entry;
    }

    public boolean isTopLevel(String id) {
        return topLevel.containsKey(id);
    }

    public TopLevelEntry topLevelEntry(String id) {
        return topLevel.get(id);
    }

    public Collection<TopLevelEntry> topLevelEntries() {
        return Collections.unmodifiableCollection(topLevel.values());
    }
}
