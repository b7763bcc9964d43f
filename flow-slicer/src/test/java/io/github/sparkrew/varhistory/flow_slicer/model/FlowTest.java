package io.github.sparkrew.varhistory.flow_slicer.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Flow class.
 */
class FlowTest {

    private static Node node(FrameId frame, NodeKind kind, String statement) {
        return new Node(frame, kind, null, statement, Map.of());
    }

    @Test
    void testNodesFollowExecutionOrder() {
        FrameId callee = FrameId.of(0, 0);
        Node first = node(FrameId.root(), NodeKind.LINE, "int a = 1;");
        Node call = node(FrameId.root(), NodeKind.CALL, "f(a);");
        Node last = node(FrameId.root(), NodeKind.LINE, "register(a);");
        Node body = node(callee, NodeKind.LINE, "x++;");
        Node bodyEnd = node(callee, NodeKind.LINE, "return;");
        first.linkNext(call);
        call.linkNext(last);
        body.linkNext(bodyEnd);
        call.linkCallee(body, bodyEnd);

        Flow flow = new Flow(first, last, "a");

        assertEquals(List.of(first, call, body, bodyEnd, last), flow.nodes());
        assertSame(call, body.prev());
        assertTrue(Flow.isRoot(first.prev()));
    }

    @Test
    void testResetTrackingClearsEveryNode() {
        Node first = node(FrameId.root(), NodeKind.LINE, "int a = 1;");
        Node last = node(FrameId.root(), NodeKind.LINE, "register(a);");
        first.linkNext(last);
        first.addTracking("a");
        last.addTracking("a");

        new Flow(first, last, "a").resetTracking();

        assertFalse(first.hasSliceData());
        assertFalse(last.hasSliceData());
    }
}
