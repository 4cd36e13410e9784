package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.Notices;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.dcruver.tanaimport.GraphFixtures.builder;
import static com.dcruver.tanaimport.GraphFixtures.node;
import static com.dcruver.tanaimport.GraphFixtures.store;
import static org.junit.jupiter.api.Assertions.*;

class ReachabilityDiagnosticsTest {

    @Test
    void testSystemAndWorkspaceNodesAreExempt() {
        Notices notices = new Notices();
        NodeStore store = store(notices,
            node("R", "Root node for ws", null),
            node("SYS_T01", "System", null),
            builder("OTHER_WS", "Other workspace", null).docType(GraphNode.TYPE_WORKSPACE).build(),
            node("LEFT", "Left over", "R"));
        ConversionState state = new ConversionState(store, notices);
        state.markConverted(store.get("R"));

        List<String> orphans = new ReachabilityDiagnostics(state, 50).reportOrphans(List.of(store.get("R")));

        assertEquals(List.of("LEFT"), orphans);
        assertEquals(List.of("Converted 1 nodes", "Found unconverted node: root > Left over [LEFT]"),
            notices.asList());
    }

    @Test
    void testPathOfDetachedAndCyclicOwnerChains() {
        Notices notices = new Notices();
        NodeStore store = store(notices,
            node("R", "Root node for ws", null),
            node("A", "A", "B"),
            node("B", "B", "A"),
            node("C", "C", "MISSING"));
        ReachabilityDiagnostics diagnostics = new ReachabilityDiagnostics(new ConversionState(store, notices), 50);

        assertEquals("(detached) > B [B] > A [A]", diagnostics.pathFromRoot(store.get("A"), Set.of("R")));
        assertEquals("(detached) > C [C]", diagnostics.pathFromRoot(store.get("C"), Set.of("R")));
    }
}
