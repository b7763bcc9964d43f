package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.sparkrew.varhistory.flow_slicer.Traces.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FlowBuilder class.
 */
@ExtendWith(MockitoExtension.class)
class FlowBuilderTest {

    @Mock
    CalleeResolver resolver;

    @Test
    void testStraightLineIsLinkedInOrder() {
        Flow flow = FlowBuilder.build(straightLine());
        List<Node> nodes = flow.nodes();

        assertEquals(4, nodes.size());
        assertNull(flow.start().prev());
        assertSame(nodes.get(3), flow.target());
        assertEquals("c", flow.targetIdentifier());
        assertEquals(Set.of("c"), flow.target().tracking());
        for (int i = 0; i < 3; i++) {
            assertSame(nodes.get(i + 1), nodes.get(i).next());
            assertSame(nodes.get(i), nodes.get(i + 1).prev());
        }
        assertEquals("0#2", nodes.get(2).id());
    }

    @Test
    void testCallIsLinkedToCalleeFrame() {
        Flow flow = FlowBuilder.build(mutatedArgument());
        List<Node> nodes = flow.nodes();
        Node call = nodes.get(1);
        Node callee = nodes.get(2);

        assertEquals(NodeKind.CALL, call.kind());
        assertSame(callee, call.stepInto());
        assertSame(callee, call.returnedFrom());
        assertSame(call, callee.prev());
        assertSame(nodes.get(3), call.next());
        assertEquals(FrameId.of(0, 0), callee.frameId());
        assertTrue(callee.hasReturned());
        assertEquals(Map.of("x", List.of(1, 2)), callee.varsBeforeReturn());
        assertEquals(FrameBelonging.UNKNOWN, call.calleeBelonging());
    }

    @Test
    void testResolverSuppliesMissingParameters() {
        when(resolver.resolve("f", SourceLocation.of(FILE, 10)))
                .thenReturn(new CalleeInfo(null, "f", List.of("n"), false, FrameBelonging.UNKNOWN));
        EventRecord call = EventRecord.call(FrameId.root(), SourceLocation.of(FILE, 1), "int y = f(x);",
                vars("x", 1), new CalleeInfo(FrameId.of(0, 0), "f", null, false, null), null);

        Flow flow = FlowBuilder.build(frames(
                call,
                line("0", 2, "register(y);", vars("x", 1, "y", 2)),
                line("0.0", 10, "return n + 1;", vars("n", 1)),
                ret("0.0", vars("n", 1), 2)
        ), new BuildOptions("register", resolver));

        assertEquals(Map.of("n", Set.of("x")), flow.start().paramToArg());
        verify(resolver).resolve("f", SourceLocation.of(FILE, 10));
    }

    @Test
    void testResolverBelongingBindsReceiver() {
        when(resolver.resolve(anyString(), any()))
                .thenReturn(new CalleeInfo(null, "move", List.of("dx"), false, FrameBelonging.INSTANCE_METHOD));

        Flow flow = FlowBuilder.build(frames(
                call("0", 1, "p.move(d);", vars("p", 0, "d", 1), "0.0", "move", "dx"),
                line("0", 2, "register(p);", vars("p", 1, "d", 1)),
                line("0.0", 10, "x += dx;", vars("dx", 1)),
                ret("0.0", vars("dx", 1), null)
        ), new BuildOptions(null, resolver));

        Node call = flow.start();
        assertEquals(FrameBelonging.INSTANCE_METHOD, call.calleeBelonging());
        assertEquals(Set.of("p"), call.paramToArg().get("this"));
        assertEquals(Set.of("d"), call.paramToArg().get("dx"));
    }

    @Test
    void testCompleteCalleeSkipsResolver() {
        EventRecord call = EventRecord.call(FrameId.root(), SourceLocation.of(FILE, 1), "f(a);", vars("a", 1),
                new CalleeInfo(FrameId.of(0, 0), "f", List.of("x"), false, FrameBelonging.UNKNOWN), null);

        FlowBuilder.build(frames(
                call,
                line("0", 2, "register(a);", vars("a", 1)),
                line("0.0", 10, "x = 2;", vars("x", 1)),
                ret("0.0", vars("x", 2), null)
        ), new BuildOptions("register", resolver));

        verifyNoInteractions(resolver);
    }

    @Test
    void testPrecomputedBindingIsUsedVerbatim() {
        EventRecord call = call("0", 1, "f(a, b);", vars("a", 1, "b", 2), "0.0", "f", "x", "y")
                .withBinding(Map.of("x", Set.of("b")));

        Flow flow = FlowBuilder.build(frames(
                call,
                line("0", 2, "register(a);", vars("a", 1, "b", 2)),
                line("0.0", 10, "return x;", vars("x", 2, "y", 1)),
                ret("0.0", vars("x", 2, "y", 1), 2)
        ));

        assertEquals(Map.of("x", Set.of("b")), flow.start().paramToArg());
        assertEquals(Map.of("b", Set.of("x")), flow.start().argToParam());
    }

    @Test
    void testLastMarkerCallIsTarget() {
        Flow flow = FlowBuilder.build(frames(
                line("0", 1, "int a = 1;", vars()),
                line("0", 2, "register(a);", vars("a", 1)),
                line("0", 3, "int b = a;", vars("a", 1)),
                line("0", 4, "register(b);", vars("a", 1, "b", 1))
        ));

        assertEquals("b", flow.targetIdentifier());
        assertEquals("0#3", flow.target().id());
    }

    @Test
    void testCustomMarker() {
        Flow flow = FlowBuilder.build(frames(
                line("0", 1, "int a = 1;", vars()),
                line("0", 2, "inspect(a);", vars("a", 1))
        ), new BuildOptions("inspect", null));

        assertEquals("a", flow.targetIdentifier());
    }

    @Test
    void testMissingRootFrameIsFatal() {
        assertThrows(TraceInconsistencyException.class, () -> FlowBuilder.build(frames(
                line("0.0", 1, "register(a);", vars("a", 1))
        )));
    }

    @Test
    void testMissingCalleeFrameIsFatal() {
        TraceInconsistencyException e = assertThrows(TraceInconsistencyException.class,
                () -> FlowBuilder.build(frames(
                        call("0", 1, "f(a);", vars("a", 1), "0.0", "f", "x"),
                        line("0", 2, "register(a);", vars("a", 1))
                )));
        assertEquals(FrameId.root(), e.frame());
    }

    @Test
    void testCalleeThatIsNotAChildIsFatal() {
        TraceInconsistencyException e = assertThrows(TraceInconsistencyException.class,
                () -> FlowBuilder.build(frames(
                        call("0", 1, "f(a);", vars("a", 1), "0.0.0", "f", "x"),
                        line("0", 2, "register(a);", vars("a", 1)),
                        line("0.0.0", 10, "x = 2;", vars("x", 1)),
                        ret("0.0.0", vars("x", 2), null)
                )));
        assertEquals("0#0", e.nodeId());
    }

    @Test
    void testCalleeEnteredTwiceIsFatal() {
        assertThrows(TraceInconsistencyException.class, () -> FlowBuilder.build(frames(
                call("0", 1, "f(a);", vars("a", 1), "0.0", "f", "x"),
                call("0", 2, "f(a);", vars("a", 1), "0.0", "f", "x"),
                line("0", 3, "register(a);", vars("a", 1)),
                line("0.0", 10, "x = 2;", vars("x", 1)),
                ret("0.0", vars("x", 2), null)
        )));
    }

    @Test
    void testRecordsAfterReturnAreFatal() {
        assertThrows(TraceInconsistencyException.class, () -> FlowBuilder.build(frames(
                call("0", 1, "f(a);", vars("a", 1), "0.0", "f", "x"),
                line("0", 2, "register(a);", vars("a", 1)),
                line("0.0", 10, "x = 2;", vars("x", 1)),
                ret("0.0", vars("x", 2), null),
                line("0.0", 11, "x = 3;", vars("x", 2))
        )));
    }

    @Test
    void testReturnWithoutStatementIsFatal() {
        assertThrows(TraceInconsistencyException.class, () -> FlowBuilder.build(frames(
                ret("0", vars(), null)
        )));
    }

    @Test
    void testMissingMarkerIsFatal() {
        assertThrows(TraceInconsistencyException.class, () -> FlowBuilder.build(frames(
                line("0", 1, "int a = 1;", vars())
        )));
    }

    @Test
    void testMarkerArgumentMustBeOneIdentifier() {
        TraceInconsistencyException e = assertThrows(TraceInconsistencyException.class,
                () -> FlowBuilder.build(frames(
                        line("0", 1, "int a = 1;", vars()),
                        line("0", 2, "register(a + b);", vars("a", 1, "b", 2))
                )));
        assertEquals("0#1", e.nodeId());
    }

    @Test
    void testGroupEndCoversCallsAndTrailingLine() {
        List<EventRecord> records = List.of(
                line("0", 1, "y = f(g(x));", vars()),
                call("0", 1, "y = f(g(x));", vars(), "0.0", "g", "a"),
                call("0", 1, "y = f(g(x));", vars(), "0.1", "f", "b"),
                line("0", 1, "y = f(g(x));", vars()),
                line("0", 2, "register(y);", vars())
        );

        assertEquals(4, FlowBuilder.groupEnd(records, 0));
        assertEquals(5, FlowBuilder.groupEnd(records, 4));
    }

    @Test
    void testInferBelongingWithoutSources() {
        EventRecord withThis = line("0.0", 1, "x = 1;", vars("this", 0));
        EventRecord withoutThis = line("0.0", 1, "x = 1;", vars());

        assertEquals(FrameBelonging.CONSTRUCTOR,
                FlowBuilder.inferBelonging(CalleeInfo.of(FrameId.of(0, 0), "<init>"), withThis));
        assertEquals(FrameBelonging.INSTANCE_METHOD,
                FlowBuilder.inferBelonging(CalleeInfo.of(FrameId.of(0, 0), "move"), withThis));
        assertEquals(FrameBelonging.UNKNOWN,
                FlowBuilder.inferBelonging(CalleeInfo.of(FrameId.of(0, 0), "sum"), withoutThis));
    }
}
