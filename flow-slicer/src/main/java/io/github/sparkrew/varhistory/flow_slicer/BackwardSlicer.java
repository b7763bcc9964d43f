package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.Flow;
import io.github.sparkrew.varhistory.flow_slicer.model.Node;
import io.github.sparkrew.varhistory.flow_slicer.model.SliceOptions;
import io.github.sparkrew.varhistory.flow_slicer.model.SliceResult;
import io.github.sparkrew.varhistory.flow_slicer.model.VarSwitch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a flow backward from its target and records where tracked identifiers appeared or changed.
 * <p>
 * The walk keeps two cursors, {@code current} and the node after it ({@code next}), and stops at the ROOT sentinel
 * before the first node of the root frame. At each step one of three cases applies:
 * <ol>
 *   <li>a plain statement: tracking flows back from {@code next}, and if a tracked identifier changed across the
 *   statement, everything the statement references becomes tracked;</li>
 *   <li>{@code next} is the first node of the callee of {@code current}: tracked parameters map back to the caller
 *   identifiers passed for them;</li>
 *   <li>{@code current} is a call that returned into {@code next}: the walk jumps to the callee's last node, carrying
 *   over changed arguments and, when the result was assigned, the callee's return statement.</li>
 * </ol>
 */
public class BackwardSlicer {

    private static final Logger log = LoggerFactory.getLogger(BackwardSlicer.class);

    public static SliceResult traceFlow(Flow flow) {
        return traceFlow(flow, SliceOptions.unbounded());
    }

    public static SliceResult traceFlow(Flow flow, SliceOptions options) {
        flow.resetTracking();
        Node target = flow.target();
        target.addTracking(flow.targetIdentifier());

        Node current = target.prev();
        Node next = target;
        int steps = 0;
        while (!Flow.isRoot(current)) {
            if (options.maxSteps() > 0 && steps >= options.maxSteps()) {
                log.warn("Slice stopped after {} steps at {}", steps, current.id());
                return new SliceResult(flow, steps, true, current);
            }
            steps++;
            log.trace("Step {}: {} -> {}", steps, current, next.id());
            if (current.isCall() && current.stepInto() == next) {
                enterCall(current, next);
                next = current;
                current = current.prev();
            } else if (current.isCall() && current.next() == next) {
                Node exit = returnFromCall(current, next);
                next = exit;
                current = exit.prev();
            } else {
                traceStatement(current, next);
                next = current;
                current = current.prev();
            }
        }
        log.info("Slice of {} finished after {} steps", flow.targetIdentifier(), steps);
        return new SliceResult(flow, steps, false, null);
    }

    private static void traceStatement(Node current, Node next) {
        current.syncTrackingWith(next);
        List<String> changed = current.recordVarChanges(current.vars(), next.vars());
        if (!changed.isEmpty()) {
            current.addTracking(current.names());
        }
    }

    private static void enterCall(Node call, Node calleeFirst) {
        boolean constructor = call.isConstructorCall();
        for (String param : calleeFirst.tracking()) {
            if (constructor && ArgumentBinder.THIS.equals(param)) {
                continue;
            }
            for (String arg : call.paramToArg().getOrDefault(param, Set.of())) {
                call.addTracking(arg);
                call.addVarSwitch(new VarSwitch(arg, param, call.vars().get(arg)));
            }
        }
    }

    /**
     * @return the callee's last node, where the walk continues
     */
    private static Node returnFromCall(Node call, Node next) {
        call.syncTrackingWith(next);
        Set<String> args = call.args();
        Set<String> assigned = new LinkedHashSet<>(call.names());
        assigned.removeAll(args);

        Node exit = call.returnedFrom();
        if (exit == null) {
            throw new TraceInconsistencyException("Call is followed by a statement but its callee never returned",
                    call.frameId(), call.id());
        }
        boolean constructor = call.isConstructorCall();
        if (constructor) {
            exit.addTracking(ArgumentBinder.THIS);
        }
        for (String id : call.recordVarChanges(call.vars(), next.vars())) {
            if (args.contains(id)) {
                exit.addTracking(call.argToParam().get(id));
            }
            if (assigned.contains(id) && !constructor) {
                exit.addTracking(exit.names());
                exit.markRelevantReturn();
            }
        }
        exit.recordVarChanges(exit.vars(), exit.varsBeforeReturn());
        return exit;
    }
}
