package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.Notices;
import com.dcruver.tanaimport.domain.TopLevelEntry;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static com.dcruver.tanaimport.GraphFixtures.builder;
import static com.dcruver.tanaimport.GraphFixtures.node;
import static com.dcruver.tanaimport.GraphFixtures.store;
import static org.junit.jupiter.api.Assertions.*;

class ConversionStateTest {

    @Test
    void testMarkSeenFollowsEveryEdgeKindAndStopsAtConvertedNodes() {
        Notices notices = new Notices();
        NodeStore store = store(notices,
            builder("A", "A", null, "B", "REF", "STOP").metaNodeId("META").association("x", "ASSOC").build(),
            node("B", "B", "A", "A"),
            node("REF", "Ref", "ELSEWHERE", "DEEP"),
            node("DEEP", "Deep", "REF"),
            node("META", null, "A"),
            node("ASSOC", "Assoc", "A"),
            node("STOP", "Stop", null, "BEYOND"),
            node("BEYOND", "Beyond", "STOP"));
        ConversionState state = new ConversionState(store, notices);
        state.markConverted(store.get("STOP"));

        state.markSeen(store.get("A"));

        assertEquals(7, state.convertedCount());
        assertTrue(state.isConverted("DEEP"));
        assertFalse(state.isConverted("BEYOND"));
    }

    @Test
    void testTopLevelTitlesAreUniqueIgnoringCase() {
        Notices notices = new Notices();
        NodeStore store = store(notices,
            node("A", "Notes", null),
            node("B", "notes", null),
            node("C", "Notes", null));
        ConversionState state = new ConversionState(store, notices);

        assertEquals("Notes", state.registerTopLevel(store.get("A"), "Notes").getTitle());
        assertEquals("notes 1", state.registerTopLevel(store.get("B"), "notes").getTitle());
        assertEquals("Notes 2", state.registerTopLevel(store.get("C"), "Notes").getTitle());

        TopLevelEntry again = state.registerTopLevel(store.get("A"), "Notes");
        assertEquals("Notes", again.getTitle());
        assertEquals(3, state.topLevelEntries().size());
    }

    @Test
    void testTitleDedupIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Notices notices = new Notices();
            NodeStore store = store(notices,
                node("A", "INBOX", null),
                node("B", "inbox", null));
            ConversionState state = new ConversionState(store, notices);

            state.registerTopLevel(store.get("A"), "INBOX");

            assertEquals("inbox 1", state.registerTopLevel(store.get("B"), "inbox").getTitle());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
