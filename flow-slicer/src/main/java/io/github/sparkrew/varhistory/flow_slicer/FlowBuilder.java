package io.github.sparkrew.varhistory.flow_slicer;

import com.github.javaparser.ast.expr.MethodCallExpr;
import io.github.sparkrew.varhistory.flow_slicer.model.*;
import io.github.sparkrew.varhistory.flow_slicer.utils.NameFinder;
import io.github.sparkrew.varhistory.flow_slicer.utils.ParsedStatement;
import io.github.sparkrew.varhistory.flow_slicer.utils.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Assembles per-frame event records into a linked {@link Flow}.
 * <p>
 * Every frame is built on its own first: records become nodes, calls on one line are inlined, a RETURN record is
 * attached to the frame's last node. CALL nodes are then linked to their callee frames, and the target is the last
 * call of the marker method in execution order.
 */
public class FlowBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowBuilder.class);

    public static Flow build(Map<FrameId, List<EventRecord>> frames) {
        return build(frames, BuildOptions.defaults());
    }

    public static Flow build(Map<FrameId, List<EventRecord>> frames, BuildOptions options) {
        FrameId root = frames.keySet().stream()
                .filter(frame -> frame.depth() == 1)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new TraceInconsistencyException("Trace has no root frame", null));

        Map<FrameId, EventRecord> returns = new HashMap<>();
        frames.forEach((frame, records) -> {
            if (!records.isEmpty() && records.get(records.size() - 1).isReturn()) {
                returns.put(frame, records.get(records.size() - 1));
            }
        });

        Map<FrameId, List<Node>> built = new TreeMap<>();
        for (FrameId frame : new TreeSet<>(frames.keySet())) {
            built.put(frame, buildFrame(frame, frames.get(frame), frames, returns, options.resolver()));
        }
        log.debug("Built {} frames", built.size());

        linkCalls(built, root);

        List<Node> rootNodes = built.get(root);
        if (rootNodes.isEmpty()) {
            throw new TraceInconsistencyException("Root frame has no statements", root);
        }
        Flow unseeded = new Flow(rootNodes.get(0), null, null);
        Map.Entry<Node, String> target = findTarget(unseeded.nodes(), options.marker(), root);
        target.getKey().addTracking(target.getValue());
        log.info("Target is `{}` at {}, tracking {}", target.getKey().statement(), target.getKey().id(),
                target.getValue());
        return new Flow(unseeded.start(), target.getKey(), target.getValue());
    }

    private static List<Node> buildFrame(FrameId frame, List<EventRecord> records,
                                         Map<FrameId, List<EventRecord>> frames,
                                         Map<FrameId, EventRecord> returns, CalleeResolver resolver) {
        List<Node> nodes = new ArrayList<>();
        CallSiteInliner.SyntheticNames names = new CallSiteInliner.SyntheticNames();
        int i = 0;
        while (i < records.size()) {
            EventRecord record = records.get(i);
            if (record.isReturn()) {
                if (i != records.size() - 1) {
                    throw new TraceInconsistencyException("Records follow the RETURN record", frame);
                }
                if (nodes.isEmpty()) {
                    throw new TraceInconsistencyException("RETURN record without any statement before it", frame);
                }
                nodes.get(nodes.size() - 1).recordReturn(record.vars(), record.returnValue());
                i++;
                continue;
            }
            int end = groupEnd(records, i);
            List<EventRecord> group = records.subList(i, end);
            if (group.stream().noneMatch(EventRecord::isCall)) {
                nodes.add(new Node(frame, NodeKind.LINE, record.location(), record.statement(), record.vars()));
            } else {
                List<EventRecord> resolved = new ArrayList<>();
                for (EventRecord r : group) {
                    resolved.add(r.isCall() ? resolveCallee(frame, r, frames, resolver) : r);
                }
                nodes.addAll(CallSiteInliner.inline(frame, resolved, names, returns));
            }
            i = end;
        }
        for (int n = 0; n < nodes.size(); n++) {
            nodes.get(n).setIndex(n);
            if (n > 0) {
                nodes.get(n - 1).linkNext(nodes.get(n));
            }
        }
        log.debug("Frame {}: {} records, {} nodes", frame, records.size(), nodes.size());
        return nodes;
    }

    /**
     * End (exclusive) of the logical-line group starting at {@code start}: an optional leading LINE, the CALL records,
     * and an optional trailing LINE, all on the same line.
     */
    static int groupEnd(List<EventRecord> records, int start) {
        EventRecord first = records.get(start);
        boolean sawCall = first.isCall();
        int j = start + 1;
        while (j < records.size()) {
            EventRecord record = records.get(j);
            if (record.isReturn() || !sameLine(first, record)) {
                break;
            }
            if (record.isCall()) {
                sawCall = true;
                j++;
                continue;
            }
            if (sawCall) {
                // trailing LINE closes the group
                j++;
            }
            break;
        }
        return j;
    }

    private static boolean sameLine(EventRecord a, EventRecord b) {
        if (a.location() != null || b.location() != null) {
            return Objects.equals(a.location(), b.location());
        }
        return Objects.equals(a.statement(), b.statement());
    }

    private static EventRecord resolveCallee(FrameId frame, EventRecord call, Map<FrameId, List<EventRecord>> frames,
                                             CalleeResolver resolver) {
        CalleeInfo callee = call.callee();
        if (callee == null || callee.frame() == null) {
            throw new TraceInconsistencyException("CALL record `" + call.statement() + "` names no callee frame",
                    frame);
        }
        final FrameId calleeFrame = callee.frame();
        EventRecord entry = frames.getOrDefault(calleeFrame, List.of()).stream()
                .filter(r -> !r.isReturn())
                .findFirst()
                .orElseThrow(() -> new TraceInconsistencyException(
                        "Callee frame " + calleeFrame + " has no statements", frame));
        if (callee.parameters() == null || callee.belonging() == null) {
            CalleeInfo resolved = resolver.resolve(callee.name(), entry.location());
            if (resolved == null && callee.parameters() == null) {
                log.warn("Could not resolve parameters of callee {} (frame {})", callee.name(), calleeFrame);
            }
            callee = callee.mergeMissing(resolved);
        }
        if (callee.belonging() == null) {
            callee = callee.withBelonging(inferBelonging(callee, entry));
        }
        return call.withCallee(callee);
    }

    /**
     * Belonging without sources: constructors are named {@code <init>}, instance methods see {@code this}.
     */
    static FrameBelonging inferBelonging(CalleeInfo callee, EventRecord entry) {
        if ("<init>".equals(callee.name())) {
            return FrameBelonging.CONSTRUCTOR;
        }
        if (entry.vars().containsKey(ArgumentBinder.THIS)) {
            return FrameBelonging.INSTANCE_METHOD;
        }
        return FrameBelonging.UNKNOWN;
    }

    private static void linkCalls(Map<FrameId, List<Node>> built, FrameId root) {
        Set<FrameId> entered = new HashSet<>();
        for (List<Node> nodes : built.values()) {
            for (Node node : nodes) {
                if (!node.isCall()) {
                    continue;
                }
                FrameId calleeFrame = node.calleeFrame();
                if (!calleeFrame.isChildOf(node.frameId())) {
                    throw new TraceInconsistencyException(
                            "Callee frame " + calleeFrame + " is not a child of the caller", node.frameId(), node.id());
                }
                List<Node> calleeNodes = built.get(calleeFrame);
                if (calleeNodes == null || calleeNodes.isEmpty()) {
                    throw new TraceInconsistencyException(
                            "Callee frame " + calleeFrame + " has no nodes", node.frameId(), node.id());
                }
                if (!entered.add(calleeFrame)) {
                    throw new TraceInconsistencyException(
                            "Callee frame " + calleeFrame + " is entered twice", node.frameId(), node.id());
                }
                Node last = calleeNodes.get(calleeNodes.size() - 1);
                boolean returned = last.hasReturned();
                if (!returned && node.next() != null) {
                    throw new TraceInconsistencyException(
                            "Execution continues after a call whose callee " + calleeFrame + " never returned",
                            node.frameId(), node.id());
                }
                node.linkCallee(calleeNodes.get(0), returned ? last : null);
            }
        }
        for (FrameId frame : built.keySet()) {
            if (!frame.equals(root) && !entered.contains(frame)) {
                log.warn("Frame {} is never entered by a call and is ignored", frame);
            }
        }
    }

    private static Map.Entry<Node, String> findTarget(List<Node> ordered, String marker, FrameId root) {
        Node target = null;
        String identifier = null;
        int matches = 0;
        for (Node node : ordered) {
            String found = markerArgument(node, marker);
            if (found != null) {
                target = node;
                identifier = found;
                matches++;
            }
        }
        if (target == null) {
            throw new TraceInconsistencyException("No call of marker `" + marker + "` found", root);
        }
        if (matches > 1) {
            log.warn("Marker `{}` is called {} times, using the last call at {}", marker, matches, target.id());
        }
        return Map.entry(target, identifier);
    }

    /**
     * The identifier passed to a one-argument call of the marker in this node's statement, or null if there is none.
     */
    private static String markerArgument(Node node, String marker) {
        ParsedStatement parsed = StatementParser.parse(node.statement());
        if (parsed.isOpaque()) {
            return null;
        }
        String identifier = null;
        for (MethodCallExpr call : parsed.ast().findAll(MethodCallExpr.class)) {
            if (!call.getNameAsString().equals(marker) || call.getArguments().size() != 1) {
                continue;
            }
            Set<String> names = NameFinder.findNames(call.getArgument(0));
            if (names.size() != 1) {
                throw new TraceInconsistencyException("Argument of marker `" + marker
                        + "` must reference exactly one identifier: `" + node.statement() + "`",
                        node.frameId(), node.id());
            }
            identifier = names.iterator().next();
        }
        return identifier;
    }
}
