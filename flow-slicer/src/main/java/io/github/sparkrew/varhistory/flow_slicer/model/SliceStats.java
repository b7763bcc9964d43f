package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.List;

/**
 * Summary numbers of a slice, written next to the flow for quick inspection.
 */
public record SliceStats(
        String targetIdentifier,
        String targetNode,
        int totalNodes,
        int slicedNodes,
        int varAppearances,
        int varModifications,
        int varSwitches,
        int relevantReturns,
        int steps,
        boolean truncated
) {

    public static SliceStats of(SliceResult result) {
        Flow flow = result.flow();
        List<Node> nodes = flow.nodes();
        return new SliceStats(
                flow.targetIdentifier(),
                flow.target().id(),
                nodes.size(),
                (int) nodes.stream().filter(Node::hasSliceData).count(),
                nodes.stream().mapToInt(n -> n.varAppearances().size()).sum(),
                nodes.stream().mapToInt(n -> n.varModifications().size()).sum(),
                nodes.stream().mapToInt(n -> n.varSwitches().size()).sum(),
                (int) nodes.stream().filter(Node::isRelevantReturn).count(),
                result.steps(),
                result.truncated()
        );
    }
}
