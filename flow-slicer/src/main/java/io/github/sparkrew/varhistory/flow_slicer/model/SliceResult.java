package io.github.sparkrew.varhistory.flow_slicer.model;

/**
 * Outcome of one backward pass. The slice itself is the metadata written onto the flow's nodes.
 *
 * @param stoppedAt the node the walk would have visited next when it was truncated, null otherwise
 */
public record SliceResult(Flow flow, int steps, boolean truncated, Node stoppedAt) {
}
