package io.github.sparkrew.varhistory.flow_slicer;

import com.github.javaparser.Position;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import io.github.sparkrew.varhistory.flow_slicer.model.EventRecord;
import io.github.sparkrew.varhistory.flow_slicer.model.FrameId;
import io.github.sparkrew.varhistory.flow_slicer.model.Node;
import io.github.sparkrew.varhistory.flow_slicer.model.NodeKind;
import io.github.sparkrew.varhistory.flow_slicer.model.SourceLocation;
import io.github.sparkrew.varhistory.flow_slicer.utils.ParsedStatement;
import io.github.sparkrew.varhistory.flow_slicer.utils.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns the records of one logical line that makes calls into a chain of nodes, one CALL node per invocation.
 * <p>
 * {@code y = f(x, f(1, 1));} becomes
 * <pre>
 *   r0_ = f(1, 1);     CALL
 *   y = f(x, r0_);     CALL
 * </pre>
 * Every matched invocation is bound to a synthetic name {@code rN_}. Invocations already emitted are replaced by
 * their names in later call texts and in the rest of the line. What is left of the line becomes a LINE node, unless
 * it only discards or assigns the last result, in which case it is folded back into that CALL node.
 */
public class CallSiteInliner {

    private static final Logger log = LoggerFactory.getLogger(CallSiteInliner.class);

    /**
     * Synthetic name counter of one frame.
     */
    public static class SyntheticNames {
        private int next;

        public String fresh() {
            return "r" + next++ + "_";
        }
    }

    private record Emitted(int start, int end, String name, Node node, String callText) {
    }

    /**
     * @param group   records of one logical line, at least one of them a CALL with a resolved callee
     * @param returns the RETURN record of every frame that returned
     * @return the nodes of the line in execution order, not yet linked
     */
    public static List<Node> inline(FrameId frame, List<EventRecord> group, SyntheticNames names,
                                    Map<FrameId, EventRecord> returns) {
        List<EventRecord> calls = group.stream().filter(EventRecord::isCall).toList();
        if (calls.isEmpty()) {
            throw new IllegalArgumentException("Group has no CALL record");
        }
        EventRecord last = group.get(group.size() - 1);
        EventRecord trailing = last.isCall() ? null : last;
        if (!group.get(0).isCall()) {
            log.debug("Dropping leading LINE record of `{}` in frame {}", group.get(0).statement(), frame);
        }

        String text = statementOf(calls.get(0), trailing);
        ParsedStatement parsed = StatementParser.parse(text);
        List<Expression> candidates = parsed.isOpaque() ? List.of() : invocationsInEvaluationOrder(parsed.ast());

        List<Node> nodes = new ArrayList<>();
        List<Emitted> emitted = new ArrayList<>();
        Set<Expression> used = Collections.newSetFromMap(new IdentityHashMap<>());
        Map<String, Object> syntheticValues = new LinkedHashMap<>();

        for (EventRecord call : calls) {
            Expression match = match(candidates, used, call.callExpression());
            Map<String, Object> vars = withSynthetic(call.vars(), syntheticValues);
            Expression invocation = null;
            Node node;
            int[] span = match == null ? null : parsed.span(match);
            if (span != null) {
                used.add(match);
                String callText = render(text, span[0], span[1], emitted);
                String name = names.fresh();
                node = new Node(frame, NodeKind.CALL, call.location(), name + " = " + callText + ";", vars);
                invocation = StatementParser.parseExpression(callText).orElse(null);
                emitted.add(new Emitted(span[0], span[1], name, node, callText));
                EventRecord returned = returns.get(call.callee().frame());
                if (returned != null) {
                    syntheticValues.put(name, returned.returnValue());
                }
            } else {
                log.debug("No invocation in `{}` matches call {} in frame {}, keeping the whole statement",
                        text, call.callExpression(), frame);
                node = new Node(frame, NodeKind.CALL, call.location(), text, vars);
            }
            ArgumentBinder.Binding binding = ArgumentBinder.bind(invocation, call.callee(), call.binding());
            node.setCallSite(call.callee().frame(), call.callee().belonging(), binding.paramToArg(),
                    binding.argToParam());
            nodes.add(node);
        }

        if (emitted.isEmpty()) {
            return nodes;
        }
        String residual = render(text, 0, text.length(), emitted);
        if (foldIntoCall(residual, emitted)) {
            return nodes;
        }
        EventRecord lastCall = calls.get(calls.size() - 1);
        if (trailing == null && returns.get(lastCall.callee().frame()) == null) {
            // The last callee is still running when the trace ends, the rest of the line never executed.
            log.debug("Callee {} of `{}` never returned, no node for `{}`", lastCall.callee().frame(), text, residual);
            return nodes;
        }
        EventRecord source = trailing != null ? trailing : lastCall;
        SourceLocation location = source.location() != null ? source.location() : calls.get(0).location();
        nodes.add(new Node(frame, NodeKind.LINE, location, residual, withSynthetic(source.vars(), syntheticValues)));
        return nodes;
    }

    private static String statementOf(EventRecord firstCall, EventRecord trailing) {
        if (firstCall.statement() != null) {
            return firstCall.statement();
        }
        return trailing != null && trailing.statement() != null ? trailing.statement() : "";
    }

    /**
     * Method calls and object creations of a statement, innermost first and left to right, the order Java evaluates
     * them in. Lambda bodies and anonymous class bodies run later, if at all, and are skipped.
     */
    static List<Expression> invocationsInEvaluationOrder(com.github.javaparser.ast.Node root) {
        List<Expression> invocations = new ArrayList<>();
        collect(root, invocations);
        return invocations;
    }

    private static void collect(com.github.javaparser.ast.Node node, List<Expression> invocations) {
        List<com.github.javaparser.ast.Node> children = new ArrayList<>(node.getChildNodes());
        children.sort(Comparator.comparing((com.github.javaparser.ast.Node child) -> child.getBegin().orElse(null),
                Comparator.nullsLast(Comparator.<Position>naturalOrder())));
        for (com.github.javaparser.ast.Node child : children) {
            if (child instanceof LambdaExpr || child instanceof BodyDeclaration<?>) {
                continue;
            }
            collect(child, invocations);
        }
        if (node instanceof MethodCallExpr || node instanceof ObjectCreationExpr) {
            invocations.add((Expression) node);
        }
    }

    private static Expression match(List<Expression> candidates, Set<Expression> used, String callExpression) {
        String wanted = StatementParser.normalize(callExpression);
        for (Expression candidate : candidates) {
            if (used.contains(candidate)) {
                continue;
            }
            if (wanted == null || wanted.equals(candidate.toString())) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * The text between two offsets with every maximal emitted invocation inside it replaced by its synthetic name.
     * An invocation spanning exactly the range is not replaced.
     */
    private static String render(String text, int start, int end, List<Emitted> emitted) {
        List<Emitted> inside = emitted.stream()
                .filter(e -> e.start() >= start && e.end() <= end && !(e.start() == start && e.end() == end))
                .sorted(Comparator.comparingInt(Emitted::start).thenComparing(Emitted::end, Comparator.reverseOrder()))
                .toList();
        StringBuilder sb = new StringBuilder();
        int cursor = start;
        for (Emitted e : inside) {
            if (e.start() < cursor) {
                // nested in one already replaced
                continue;
            }
            sb.append(text, cursor, e.start()).append(e.name());
            cursor = e.end();
        }
        sb.append(text, cursor, end);
        return sb.toString();
    }

    /**
     * Fold {@code rN_;}, {@code a = rN_;} and {@code T a = rN_;} back into the CALL node that produced {@code rN_}.
     *
     * @return true when the residual statement is absorbed and needs no node of its own
     */
    private static boolean foldIntoCall(String residual, List<Emitted> emitted) {
        ParsedStatement parsed = StatementParser.parse(residual);
        if (parsed.isOpaque() || !(parsed.ast() instanceof ExpressionStmt statement)) {
            return false;
        }
        Expression expression = statement.getExpression();
        if (expression instanceof NameExpr discarded) {
            Emitted producer = producerOf(discarded, emitted);
            if (producer == null) {
                return false;
            }
            producer.node().rewriteStatement(producer.callText() + ";");
            return true;
        }
        Expression value = null;
        if (expression instanceof AssignExpr assign && assign.getOperator() == AssignExpr.Operator.ASSIGN) {
            value = assign.getValue();
        } else if (expression instanceof VariableDeclarationExpr declaration
                && declaration.getVariables().size() == 1) {
            value = declaration.getVariable(0).getInitializer().orElse(null);
        }
        if (!(value instanceof NameExpr assigned)) {
            return false;
        }
        Emitted producer = producerOf(assigned, emitted);
        int[] span = parsed.span(assigned);
        if (producer == null || span == null) {
            return false;
        }
        String merged = (residual.substring(0, span[0]) + producer.callText() + residual.substring(span[1])).strip();
        if (!merged.endsWith(";")) {
            merged = merged + ";";
        }
        producer.node().rewriteStatement(merged);
        return true;
    }

    private static Emitted producerOf(NameExpr name, List<Emitted> emitted) {
        return emitted.stream()
                .filter(e -> e.name().equals(name.getNameAsString()))
                .findFirst()
                .orElse(null);
    }

    private static Map<String, Object> withSynthetic(Map<String, Object> vars, Map<String, Object> synthetic) {
        if (synthetic.isEmpty()) {
            return vars;
        }
        Map<String, Object> merged = new LinkedHashMap<>(vars);
        synthetic.forEach(merged::putIfAbsent);
        return merged;
    }
}
