package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat, serializable view of a node and its slice metadata. Neighbours are referenced by node id.
 */
public record NodeView(
        String id,
        String frame,
        NodeKind kind,
        String location,
        String statement,
        String prev,
        String next,
        String stepInto,
        String returnedFrom,
        List<String> tracking,
        List<VarAppearance> varAppearances,
        List<VarModification> varModifications,
        List<VarSwitch> varSwitches,
        Map<String, Set<String>> paramToArg,
        boolean relevantReturn,
        Object returnValue
) {

    public static NodeView of(Node node) {
        return new NodeView(
                node.id(),
                node.frameId().toString(),
                node.kind(),
                node.location() == null ? null : node.location().toString(),
                node.statement(),
                idOf(node.prev()),
                idOf(node.next()),
                idOf(node.stepInto()),
                idOf(node.returnedFrom()),
                node.tracking().stream().sorted().toList(),
                node.varAppearances(),
                node.varModifications(),
                node.varSwitches(),
                node.isCall() ? node.paramToArg() : null,
                node.isRelevantReturn(),
                node.hasReturned() ? node.returnValue() : null
        );
    }

    private static String idOf(Node node) {
        return node == null ? null : node.id();
    }
}
