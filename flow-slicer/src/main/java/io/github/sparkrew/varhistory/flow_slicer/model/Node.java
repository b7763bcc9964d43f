package io.github.sparkrew.varhistory.flow_slicer.model;

import io.github.sparkrew.varhistory.flow_slicer.utils.NameFinder;
import io.github.sparkrew.varhistory.flow_slicer.utils.ValueDiffer;

import java.util.*;

/**
 * One executed statement or one call boundary of the flow graph.
 * <p>
 * {@code vars} is the state before this step executes. For a CALL node that is the caller's state at the call site.
 * The last node of a callee frame additionally holds the callee's state right before it returned
 * ({@code varsBeforeReturn}) and the returned value. Slicing metadata lives in an embedded {@link TrackingState} and is
 * only reachable through the accessors below.
 */
public class Node {

    private final FrameId frameId;
    private final NodeKind kind;
    private final SourceLocation location;
    private final Map<String, Object> vars;
    private final TrackingState state = new TrackingState();
    private String statement;
    private Set<String> names;
    private int index;

    private Node prev;
    private Node next;
    private Node stepInto;
    private Node returnedFrom;

    private boolean returned;
    private Map<String, Object> varsBeforeReturn;
    private Object returnValue;

    private FrameId calleeFrame;
    private FrameBelonging calleeBelonging = FrameBelonging.UNKNOWN;
    private Map<String, Set<String>> paramToArg = Collections.emptyMap();
    private Map<String, Set<String>> argToParam = Collections.emptyMap();

    public Node(FrameId frameId, NodeKind kind, SourceLocation location, String statement,
                Map<String, Object> vars) {
        this.frameId = Objects.requireNonNull(frameId, "frameId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.location = location;
        this.statement = statement == null ? "" : statement;
        this.vars = vars == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }

    public FrameId frameId() {
        return frameId;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isCall() {
        return kind == NodeKind.CALL;
    }

    public SourceLocation location() {
        return location;
    }

    public String statement() {
        return statement;
    }

    /**
     * Replace the displayed statement. Only the flow builder does this, while it linearizes nested calls.
     */
    public void rewriteStatement(String newStatement) {
        this.statement = newStatement;
        this.names = null;
    }

    /**
     * Identifiers referenced anywhere in the statement, computed once.
     */
    public Set<String> names() {
        if (names == null) {
            names = Collections.unmodifiableSet(NameFinder.findNames(statement));
        }
        return names;
    }

    public Map<String, Object> vars() {
        return vars;
    }

    public int index() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public String id() {
        return frameId + "#" + index;
    }

    // Links

    public Node prev() {
        return prev;
    }

    public Node next() {
        return next;
    }

    public Node stepInto() {
        return stepInto;
    }

    public Node returnedFrom() {
        return returnedFrom;
    }

    public void linkNext(Node following) {
        this.next = following;
        if (following != null) {
            following.prev = this;
        }
    }

    /**
     * Wire this CALL node to its callee frame. The callee's first node gets this node as its predecessor, which is
     * how the backward walk climbs out of a callee.
     */
    public void linkCallee(Node calleeFirst, Node calleeLast) {
        if (kind != NodeKind.CALL) {
            throw new IllegalStateException("Only CALL nodes have callees: " + id());
        }
        this.stepInto = calleeFirst;
        calleeFirst.prev = this;
        this.returnedFrom = calleeLast;
    }

    // Return state, set on the last node of a callee frame

    public void recordReturn(Map<String, Object> stateBeforeReturn, Object value) {
        this.returned = true;
        this.varsBeforeReturn = stateBeforeReturn == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stateBeforeReturn));
        this.returnValue = value;
    }

    public boolean hasReturned() {
        return returned;
    }

    public Map<String, Object> varsBeforeReturn() {
        return varsBeforeReturn;
    }

    public Object returnValue() {
        return returnValue;
    }

    // Call site data

    public FrameId calleeFrame() {
        return calleeFrame;
    }

    public FrameBelonging calleeBelonging() {
        return calleeBelonging;
    }

    public Map<String, Set<String>> paramToArg() {
        return paramToArg;
    }

    public Map<String, Set<String>> argToParam() {
        return argToParam;
    }

    public void setCallSite(FrameId calleeFrame, FrameBelonging belonging, Map<String, Set<String>> paramToArg,
                            Map<String, Set<String>> argToParam) {
        this.calleeFrame = calleeFrame;
        this.calleeBelonging = belonging == null ? FrameBelonging.UNKNOWN : belonging;
        this.paramToArg = paramToArg;
        this.argToParam = argToParam;
    }

    /**
     * Caller-side identifiers used in the call's arguments, receiver included.
     */
    public Set<String> args() {
        return argToParam.keySet();
    }

    public boolean isConstructorCall() {
        return calleeBelonging == FrameBelonging.CONSTRUCTOR;
    }

    // Slicing metadata

    public Set<String> tracking() {
        return Collections.unmodifiableSet(state.tracking());
    }

    public void addTracking(String... ids) {
        addTracking(Arrays.asList(ids));
    }

    public void addTracking(Collection<String> ids) {
        state.tracking().addAll(ids);
    }

    public void syncTrackingWith(Node other) {
        state.tracking().addAll(other.state.tracking());
    }

    public List<VarAppearance> varAppearances() {
        return Collections.unmodifiableList(state.varAppearances());
    }

    public List<VarModification> varModifications() {
        return Collections.unmodifiableList(state.varModifications());
    }

    public List<VarSwitch> varSwitches() {
        return Collections.unmodifiableList(state.varSwitches());
    }

    public void addVarSwitch(VarSwitch varSwitch) {
        state.varSwitches().add(varSwitch);
    }

    public boolean isRelevantReturn() {
        return state.relevantReturn();
    }

    public void markRelevantReturn() {
        state.markRelevantReturn();
    }

    public boolean hasSliceData() {
        return !state.isEmpty();
    }

    public void clearTracking() {
        state.clear();
    }

    /**
     * Compare two snapshots for every tracked identifier and record what changed on this node.
     * An identifier absent before and present after appears; a deep difference is a modification.
     *
     * @return the changed identifiers, in tracking order
     */
    public List<String> recordVarChanges(Map<String, Object> before, Map<String, Object> after) {
        List<String> changed = new ArrayList<>();
        if (after == null) {
            return changed;
        }
        for (String id : List.copyOf(state.tracking())) {
            if (!after.containsKey(id)) {
                continue;
            }
            Object newValue = after.get(id);
            if (before == null || !before.containsKey(id)) {
                state.varAppearances().add(new VarAppearance(id, newValue));
                changed.add(id);
            } else if (ValueDiffer.hasDiff(before.get(id), newValue)) {
                state.varModifications().add(new VarModification(id, before.get(id), newValue));
                changed.add(id);
            }
        }
        return changed;
    }

    @Override
    public String toString() {
        return id() + " " + kind + " `" + statement + "`";
    }
}
