package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.Edge;
import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.NodeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Locates the fixed structure of a Tana workspace and decides which nodes become documents.
 */
@Slf4j
@RequiredArgsConstructor
public class StructuralClassifier {

    static final String LIBRARY_SUFFIX = "_STASH";

    // Trash, schema, sidebar layout, users, saved searches, move-to state, workspace settings, quick add
    static final List<String> SYSTEM_SUFFIXES = List.of(
        "_TRASH", "_SCHEMA", "_SIDEBAR_AREAS", "_USERS", "_SEARCHES", "_MOVETO", "_WORKSPACE", "_QUICK_ADD");

    private final ConversionState state;

    /**
     * Nodes whose name marks them as the synthetic root of an export, in store order.
     */
    public static List<GraphNode> findRoots(NodeStore store, String rootNamePrefix) {
        return store.all().stream()
            .filter(node -> node.getName() != null && node.getName().startsWith(rootNamePrefix))
            .toList();
    }

    public void classify(GraphNode root) {
        state.markConverted(root);
        log.info("Classifying workspace under root {}", root.getId());

        Optional<GraphNode> workspace = importWorkspace(root);
        markSystemNodesSeen(root);
        importLibrary(root);
        workspace.ifPresent(this::importJournal);
    }

    private Optional<GraphNode> importWorkspace(GraphNode root) {
        GraphNode workspace = root.getChildren().isEmpty() ? null : state.getStore().get(root.getChildren().get(0));
        if (workspace == null) {
            log.warn("Workspace node not found under root {}", root.getId());
            state.getNotices().add("Workspace node not found");
            return Optional.empty();
        }
        state.markConverted(workspace);
        state.registerTopLevel(workspace, workspace.getName());
        state.getStore().metaNodeOf(workspace).ifPresent(state::markSeen);
        return Optional.of(workspace);
    }

    private void markSystemNodesSeen(GraphNode root) {
        for (String suffix : SYSTEM_SUFFIXES) {
            GraphNode special = state.getStore().get(root.getId() + suffix);
            if (special != null) {
                state.markSeen(special);
            } else {
                log.warn("Special node {} not found under root {}", suffix, root.getId());
                state.getNotices().add("Special node " + suffix + " not found");
            }
        }
    }

    private void importLibrary(GraphNode root) {
        GraphNode library = state.getStore().get(root.getId() + LIBRARY_SUFFIX);
        if (library == null) {
            log.warn("Library node not found under root {}", root.getId());
            state.getNotices().add("Library node not found");
            return;
        }
        state.markConverted(library);
        for (Edge edge : state.getStore().childEdges(library)) {
            GraphNode item = edge.getTarget();
            state.registerTopLevel(item, item.getName());
        }
    }

    /**
     * Journal is year, then week, then day. Every named day becomes a document.
     */
    private void importJournal(GraphNode workspace) {
        Optional<GraphNode> journal = state.getStore().childEdges(workspace).stream()
            .filter(Edge::isOwned)
            .map(Edge::getTarget)
            .filter(node -> node.isOfType(GraphNode.TYPE_JOURNAL))
            .findFirst();
        if (journal.isEmpty()) {
            log.debug("No journal under workspace {}", workspace.getId());
            return;
        }

        NodeStore store = state.getStore();
        state.markConverted(journal.get());
        int days = 0;
        for (Edge year : store.childEdges(journal.get())) {
            state.markConverted(year.getTarget());
            for (Edge week : store.childEdges(year.getTarget())) {
                state.markConverted(week.getTarget());
                for (Edge day : store.childEdges(week.getTarget())) {
                    GraphNode dayNode = day.getTarget();
                    if (dayNode.getName() != null) {
                        state.registerTopLevel(dayNode, dayNode.getName());
                        days++;
                    }
                }
            }
        }
        log.info("Found {} daily notes", days);
    }
}
