package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.Notices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dcruver.tanaimport.GraphFixtures.node;
import static com.dcruver.tanaimport.GraphFixtures.store;
import static org.junit.jupiter.api.Assertions.*;

class MarkupTranslatorTest {

    private MarkupTranslator translator;

    @BeforeEach
    void setUp() {
        Notices notices = new Notices();
        NodeStore store = store(notices, node("DOC", "Doc", null), node("PART", "Part", "DOC"));
        ConversionState state = new ConversionState(store, notices);
        state.registerTopLevel(store.get("DOC"), "Doc");
        translator = new MarkupTranslator(new LinkResolver(state));
    }

    @Test
    void testFormattingTags() {
        assertEquals("**bold** *it* ~~gone~~ `x = 1`",
            translator.translate("<b>bold</b> <i>it</i> <strike>gone</strike> <code>x = 1</code>"));
    }

    @Test
    void testReferencesInsideMarkupResolveFirst() {
        assertEquals("**see [[Doc#^PART]]** and [[Doc]]",
            translator.translate("<b>see <span data-inlineref-node=\"PART\"></span></b> and "
                + "<span data-inlineref-node=\"DOC\"></span>"));
    }

    @Test
    void testReplacementTextIsTakenLiterally() {
        assertEquals("**$1 costs \\ much**", translator.translate("<b>$1 costs \\ much</b>"));
    }

    @Test
    void testNullAndEmpty() {
        assertEquals("", translator.translate(null));
        assertEquals("", translator.translate(""));
    }

    @Test
    void testInlineReferencesInOrder() {
        assertEquals(List.of("B", "A"), MarkupTranslator.inlineReferences(
            "<span data-inlineref-node=\"B\"></span> then <span data-inlineref-node=\"A\"></span>"));
        assertTrue(MarkupTranslator.inlineReferences(null).isEmpty());
    }
}
