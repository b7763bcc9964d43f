package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventGrouper class.
 */
class EventGrouperTest {

    private static EventRecord line(int line, String statement) {
        return EventRecord.line(null, SourceLocation.of("Demo.java", line), statement, Map.of());
    }

    @Test
    void testFlatStreamIsSplitByFrame() {
        List<EventRecord> events = List.of(
                line(1, "int a = 1;"),
                EventRecord.call(null, SourceLocation.of("Demo.java", 2), "f(a);", Map.of("a", 1), null, null),
                line(10, "g();"),
                EventRecord.call(null, SourceLocation.of("Demo.java", 10), "g();", Map.of(), null, null),
                line(20, "return;"),
                EventRecord.ret(null, Map.of(), null),
                EventRecord.ret(null, Map.of(), null),
                EventRecord.call(null, SourceLocation.of("Demo.java", 3), "f(a);", Map.of("a", 1), null, null),
                line(10, "g();"),
                EventRecord.ret(null, Map.of(), null),
                line(4, "register(a);")
        );

        Map<FrameId, List<EventRecord>> frames = EventGrouper.group(events);

        assertEquals(List.of(FrameId.of(0), FrameId.of(0, 0), FrameId.of(0, 0, 0), FrameId.of(0, 1)),
                List.copyOf(frames.keySet()));
        assertEquals(4, frames.get(FrameId.root()).size());
        assertEquals(FrameId.of(0, 0), frames.get(FrameId.root()).get(1).callee().frame());
        assertEquals(FrameId.of(0, 1), frames.get(FrameId.root()).get(2).callee().frame());
        assertEquals(FrameId.of(0, 0, 0), frames.get(FrameId.of(0, 0)).get(1).callee().frame());
        assertTrue(frames.get(FrameId.of(0, 0, 0)).get(1).isReturn());
        frames.forEach((frame, records) -> records.forEach(r -> assertEquals(frame, r.frame())));
    }

    @Test
    void testRecorderFramesAreKept() {
        CalleeInfo callee = CalleeInfo.of(null, "f", "x");
        List<EventRecord> events = List.of(
                EventRecord.call(FrameId.root(), SourceLocation.of("Demo.java", 1), "f(a);", Map.of(), callee, null),
                EventRecord.line(FrameId.of(0, 0), SourceLocation.of("Demo.java", 9), "x++;", Map.of())
        );

        Map<FrameId, List<EventRecord>> frames = EventGrouper.group(events);

        CalleeInfo grouped = frames.get(FrameId.root()).get(0).callee();
        assertEquals(FrameId.of(0, 0), grouped.frame());
        assertEquals(List.of("x"), grouped.parameters());
        assertEquals(1, frames.get(FrameId.of(0, 0)).size());
    }
}
