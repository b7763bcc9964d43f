package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.FrameId;

/**
 * The event records do not describe a possible execution, e.g. a call into a frame that has no records.
 * Never recovered.
 */
public class TraceInconsistencyException extends RuntimeException {

    private final FrameId frame;
    private final String nodeId;

    public TraceInconsistencyException(String message, FrameId frame, String nodeId) {
        super(describe(message, frame, nodeId));
        this.frame = frame;
        this.nodeId = nodeId;
    }

    public TraceInconsistencyException(String message, FrameId frame) {
        this(message, frame, null);
    }

    public FrameId frame() {
        return frame;
    }

    public String nodeId() {
        return nodeId;
    }

    private static String describe(String message, FrameId frame, String nodeId) {
        StringBuilder sb = new StringBuilder(message);
        if (frame != null) {
            sb.append(" [frame ").append(frame);
            if (nodeId != null) {
                sb.append(", node ").append(nodeId);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
