package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.GraphNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports nodes that were neither rendered nor deliberately skipped.
 */
@Slf4j
@RequiredArgsConstructor
public class ReachabilityDiagnostics {

    static final String SYSTEM_ID_PREFIX = "SYS";
    static final String DETACHED = "(detached)";

    private final ConversionState state;
    private final int reportLimit;

    /**
     * @return ids of all unconverted nodes; at most reportLimit of them are added as notices
     */
    public List<String> reportOrphans(List<GraphNode> roots) {
        state.getNotices().add("Converted " + state.convertedCount() + " nodes");

        Set<String> rootIds = new HashSet<>();
        roots.forEach(root -> rootIds.add(root.getId()));

        List<String> orphans = new ArrayList<>();
        for (GraphNode node : state.getStore().all()) {
            if (state.isConverted(node.getId()) || node.getId().startsWith(SYSTEM_ID_PREFIX)
                || node.isOfType(GraphNode.TYPE_WORKSPACE)) {
                continue;
            }
            orphans.add(node.getId());
            if (orphans.size() <= reportLimit) {
                state.getNotices().add("Found unconverted node: " + pathFromRoot(node, rootIds));
            }
        }

        if (orphans.size() > reportLimit) {
            state.getNotices().add("... and " + (orphans.size() - reportLimit) + " more unconverted nodes");
        }
        if (!orphans.isEmpty()) {
            log.warn("{} nodes were not converted", orphans.size());
        }
        return orphans;
    }

    /**
     * Owner chain from a root down to the node, e.g. {@code root > Projects [a1] > Task [b2]}.
     * Chains that never reach a root start with {@code (detached)}.
     */
    String pathFromRoot(GraphNode node, Set<String> rootIds) {
        List<String> segments = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        GraphNode current = node;
        String start = DETACHED;
        while (current != null && visited.add(current.getId())) {
            if (rootIds.contains(current.getId())) {
                start = "root";
                break;
            }
            segments.add(0, current.getName() + " [" + current.getId() + "]");
            current = state.getStore().get(current.getOwnerId());
        }
        segments.add(0, start);
        return String.join(" > ", segments);
    }
}
