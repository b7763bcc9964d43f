package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.CalleeInfo;
import io.github.sparkrew.varhistory.flow_slicer.model.EventRecord;
import io.github.sparkrew.varhistory.flow_slicer.model.FrameId;
import io.github.sparkrew.varhistory.flow_slicer.utils.FrameTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a flat, chronologically ordered event stream into per-frame record lists.
 * Records that carry no frame get the one a {@link FrameTracker} assigns while replaying calls and returns.
 */
public class EventGrouper {

    private static final Logger log = LoggerFactory.getLogger(EventGrouper.class);

    public static Map<FrameId, List<EventRecord>> group(List<EventRecord> events) {
        FrameTracker tracker = new FrameTracker();
        Map<FrameId, List<EventRecord>> frames = new LinkedHashMap<>();
        for (EventRecord event : events) {
            FrameId frame = event.frame() != null ? event.frame() : tracker.current();
            EventRecord placed = event.withFrame(frame);
            switch (event.kind()) {
                case LINE -> add(frames, placed);
                case CALL -> {
                    FrameId calleeFrame = tracker.enterCall();
                    CalleeInfo callee = placed.callee();
                    if (callee == null) {
                        callee = new CalleeInfo(calleeFrame, null, null, false, null);
                    } else if (callee.frame() == null) {
                        callee = callee.withFrame(calleeFrame);
                    }
                    add(frames, placed.withCallee(callee));
                }
                case RETURN -> {
                    add(frames, placed);
                    if (tracker.depth() > 1) {
                        tracker.exitCall();
                    }
                }
            }
        }
        log.debug("Grouped {} events into {} frames", events.size(), frames.size());
        return frames;
    }

    private static void add(Map<FrameId, List<EventRecord>> frames, EventRecord record) {
        frames.computeIfAbsent(record.frame(), k -> new ArrayList<>()).add(record);
    }
}
