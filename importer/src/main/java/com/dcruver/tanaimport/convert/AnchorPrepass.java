package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.Edge;
import com.dcruver.tanaimport.domain.GraphNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the nodes that are linked to from somewhere other than their owner.
 * Only these get an anchor token when rendered.
 *
 * The walk starts at the roots and then covers every other node in the store, since
 * the library and system containers are found by id and need not be listed under a root.
 */
@Slf4j
@RequiredArgsConstructor
public class AnchorPrepass {

    private final ConversionState state;

    public void run(List<GraphNode> roots) {
        Set<String> visited = new HashSet<>();
        Deque<GraphNode> pending = new ArrayDeque<>();
        roots.forEach(pending::push);
        drain(pending, visited);

        for (GraphNode node : state.getStore().all()) {
            if (!visited.contains(node.getId())) {
                pending.push(node);
                drain(pending, visited);
            }
        }
        log.debug("Anchor prepass visited {} nodes, {} anchors", visited.size(), state.anchors().size());
    }

    private void drain(Deque<GraphNode> pending, Set<String> visited) {
        while (!pending.isEmpty()) {
            GraphNode node = pending.pop();
            if (!visited.add(node.getId())) {
                continue;
            }
            MarkupTranslator.inlineReferences(node.getName()).forEach(state::addAnchor);

            for (Edge edge : state.getStore().childEdges(node)) {
                if (edge.isOwned()) {
                    pending.push(edge.getTarget());
                } else {
                    state.addAnchor(edge.getTarget().getId());
                }
            }
        }
    }
}
