package io.github.sparkrew.varhistory.flow_slicer.model;

import java.util.*;

/**
 * One recorded execution step, as delivered by the trace recorder.
 * <p>
 * LINE records carry a statement and the variable snapshot taken before it runs. CALL records additionally describe
 * the callee and, optionally, the exact invocation text and a precomputed parameter binding. RETURN records carry the
 * callee's snapshot right before it returns (and the returned value when the recorder captured it).
 * {@code frame} may be null in a flat stream, see {@code EventGrouper}.
 */
public record EventRecord(
        FrameId frame,
        EventKind kind,
        SourceLocation location,
        String statement,
        Map<String, Object> vars,
        CalleeInfo callee,
        String callExpression,
        List<Object> argumentValues,
        Map<String, Set<String>> binding,
        Object returnValue
) {

    public EventRecord {
        if (kind == null) {
            throw new IllegalArgumentException("Event kind is required");
        }
        // Snapshot values may legitimately be null, so no Map.copyOf here
        vars = vars == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        argumentValues = argumentValues == null ? null : Collections.unmodifiableList(new ArrayList<>(argumentValues));
        if (binding != null) {
            Map<String, Set<String>> copy = new LinkedHashMap<>();
            binding.forEach((param, args) -> copy.put(param,
                    args == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(args))));
            binding = Collections.unmodifiableMap(copy);
        }
    }

    public static EventRecord line(FrameId frame, SourceLocation location, String statement,
                                   Map<String, Object> vars) {
        return new EventRecord(frame, EventKind.LINE, location, statement, vars, null, null, null, null, null);
    }

    public static EventRecord call(FrameId frame, SourceLocation location, String statement,
                                   Map<String, Object> vars, CalleeInfo callee, String callExpression) {
        return new EventRecord(frame, EventKind.CALL, location, statement, vars, callee, callExpression, null, null,
                null);
    }

    public static EventRecord ret(FrameId frame, Map<String, Object> vars, Object returnValue) {
        return new EventRecord(frame, EventKind.RETURN, null, null, vars, null, null, null, null, returnValue);
    }

    public EventRecord withFrame(FrameId newFrame) {
        return new EventRecord(newFrame, kind, location, statement, vars, callee, callExpression, argumentValues,
                binding, returnValue);
    }

    public EventRecord withCallee(CalleeInfo newCallee) {
        return new EventRecord(frame, kind, location, statement, vars, newCallee, callExpression, argumentValues,
                binding, returnValue);
    }

    public EventRecord withBinding(Map<String, Set<String>> newBinding) {
        return new EventRecord(frame, kind, location, statement, vars, callee, callExpression, argumentValues,
                newBinding, returnValue);
    }

    public boolean isCall() {
        return kind == EventKind.CALL;
    }

    public boolean isReturn() {
        return kind == EventKind.RETURN;
    }
}
