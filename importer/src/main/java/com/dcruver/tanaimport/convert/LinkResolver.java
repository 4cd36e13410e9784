package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.TopLevelEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a node id to the Markdown that points at it.
 */
@Slf4j
@RequiredArgsConstructor
public class LinkResolver {

    static final String UNRESOLVED_LINK = "[[#]]";

    private final ConversionState state;
    private int unresolvedCount;

    /**
     * Wiki link to a document, a block anchor inside the nearest top-level ancestor's
     * document, the raw text of a URL node, or the unresolved placeholder.
     */
    public String linkTo(String id) {
        TopLevelEntry entry = state.topLevelEntry(id);
        if (entry != null) {
            return "[[" + entry.getTitle() + "]]";
        }

        GraphNode target = state.getStore().get(id);
        if (target != null) {
            if (target.isOfType(GraphNode.TYPE_URL)) {
                state.markSeen(target);
                return target.getName() != null ? target.getName() : "";
            }
            Optional<TopLevelEntry> parent = findTopLevelAncestor(target);
            if (parent.isPresent()) {
                return "[[" + parent.get().getTitle() + "#^" + anchorOf(id) + "]]";
            }
        }

        unresolvedCount++;
        log.debug("Could not resolve link to {}", id);
        return UNRESOLVED_LINK;
    }

    /**
     * Walk owners upward until one of them is a top-level node.
     */
    public Optional<TopLevelEntry> findTopLevelAncestor(GraphNode node) {
        Set<String> visited = new HashSet<>();
        GraphNode current = state.getStore().get(node.getOwnerId());
        while (current != null && visited.add(current.getId())) {
            TopLevelEntry entry = state.topLevelEntry(current.getId());
            if (entry != null) {
                return Optional.of(entry);
            }
            current = state.getStore().get(current.getOwnerId());
        }
        return Optional.empty();
    }

    public int getUnresolvedCount() {
        return unresolvedCount;
    }

    /**
     * Block anchor token for a node id. Markdown block ids do not allow underscores.
     */
    public static String anchorOf(String id) {
        return id.replace('_', '-');
    }
}
