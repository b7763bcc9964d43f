package io.github.sparkrew.varhistory.flow_slicer.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FrameId class.
 */
class FrameIdTest {

    @Test
    void testParseAndToString() {
        FrameId frame = FrameId.parse("0.0.1");

        assertEquals(FrameId.of(0, 0, 1), frame);
        assertEquals("0.0.1", frame.toString());
        assertEquals(3, frame.depth());
        assertEquals(1, frame.childIndex());
    }

    @Test
    void testParseRejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> FrameId.parse("0.a"));
        assertThrows(IllegalArgumentException.class, () -> FrameId.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> new FrameId(List.of()));
    }

    @Test
    void testChildAndParent() {
        FrameId child = FrameId.root().child(2);

        assertEquals(FrameId.of(0, 2), child);
        assertEquals(FrameId.root(), child.parent());
        assertNull(FrameId.root().parent());
    }

    @Test
    void testAncestry() {
        FrameId root = FrameId.root();
        FrameId child = FrameId.of(0, 1);
        FrameId grandChild = FrameId.of(0, 1, 0);

        assertTrue(child.isChildOf(root));
        assertTrue(root.isParentOf(child));
        assertFalse(grandChild.isChildOf(root));
        assertTrue(root.isAncestorOf(grandChild));
        assertFalse(child.isAncestorOf(child));
        assertFalse(FrameId.of(0, 2).isAncestorOf(grandChild));
    }

    @Test
    void testOrdering() {
        List<FrameId> frames = new ArrayList<>(List.of(
                FrameId.of(0, 1), FrameId.of(0, 0, 3), FrameId.root(), FrameId.of(0, 0)));
        Collections.sort(frames);

        assertEquals(List.of(FrameId.root(), FrameId.of(0, 0), FrameId.of(0, 0, 3), FrameId.of(0, 1)), frames);
    }

    @Test
    void testJsonUsesDottedForm() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"0.0.1\"", mapper.writeValueAsString(FrameId.of(0, 0, 1)));
        assertEquals(FrameId.of(0, 2), mapper.readValue("\"0.2\"", FrameId.class));
    }
}
