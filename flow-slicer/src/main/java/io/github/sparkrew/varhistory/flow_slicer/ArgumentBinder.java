package io.github.sparkrew.varhistory.flow_slicer;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import io.github.sparkrew.varhistory.flow_slicer.model.CalleeInfo;
import io.github.sparkrew.varhistory.flow_slicer.model.FrameBelonging;
import io.github.sparkrew.varhistory.flow_slicer.utils.NameFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Binds callee parameters to the caller identifiers that flow into them.
 * <p>
 * Every parameter maps to all identifiers referenced by its argument expression, so {@code f(a + b)} binds the
 * parameter to both {@code a} and {@code b}.
 */
public class ArgumentBinder {

    private static final Logger log = LoggerFactory.getLogger(ArgumentBinder.class);
    public static final String THIS = "this";

    /**
     * Both directions of one call's binding.
     */
    public record Binding(Map<String, Set<String>> paramToArg, Map<String, Set<String>> argToParam) {
    }

    /**
     * @param call     the invocation as it appears at the call site, may be null when it could not be located
     * @param callee   resolved callee information
     * @param explicit a binding precomputed by the recorder, used as is when present
     */
    public static Binding bind(Expression call, CalleeInfo callee, Map<String, Set<String>> explicit) {
        FrameBelonging belonging = callee.belonging() == null ? FrameBelonging.UNKNOWN : callee.belonging();
        Map<String, Set<String>> paramToArg = new LinkedHashMap<>();
        if (explicit != null) {
            explicit.forEach((param, args) -> paramToArg.put(param, new LinkedHashSet<>(args)));
        } else if (call != null) {
            bindPositional(call, callee, paramToArg);
        }
        if (belonging.bindsThis() && !paramToArg.containsKey(THIS)) {
            paramToArg.put(THIS, receiverNames(call, belonging));
        }
        return new Binding(freeze(paramToArg), freeze(invert(paramToArg)));
    }

    private static void bindPositional(Expression call, CalleeInfo callee, Map<String, Set<String>> paramToArg) {
        if (callee.parameters() == null) {
            log.debug("No parameter names known for callee {} of `{}`", callee.name(), call);
            return;
        }
        List<String> parameters = callee.parameters().stream().filter(p -> !THIS.equals(p)).toList();
        List<Expression> arguments = argumentsOf(call);
        List<String> expanded = expandParameters(parameters, callee.varargs(), arguments.size());
        if (expanded.size() != arguments.size()) {
            log.debug("Callee {} takes {} parameters but `{}` passes {} arguments",
                    callee.name(), expanded.size(), call, arguments.size());
        }
        int count = Math.min(expanded.size(), arguments.size());
        for (int i = 0; i < count; i++) {
            paramToArg.computeIfAbsent(expanded.get(i), k -> new LinkedHashSet<>())
                    .addAll(NameFinder.findNames(arguments.get(i)));
        }
    }

    /**
     * Repeat a trailing varargs parameter so there is one parameter name per actual argument.
     */
    static List<String> expandParameters(List<String> parameters, boolean varargs, int argumentCount) {
        if (!varargs || parameters.isEmpty()) {
            return parameters;
        }
        List<String> expanded = new ArrayList<>(parameters.subList(0, parameters.size() - 1));
        String rest = parameters.get(parameters.size() - 1);
        int extra = argumentCount - expanded.size();
        for (int i = 0; i < extra; i++) {
            expanded.add(rest);
        }
        return expanded;
    }

    static List<Expression> argumentsOf(Expression call) {
        if (call instanceof MethodCallExpr methodCall) {
            return methodCall.getArguments();
        }
        if (call instanceof ObjectCreationExpr creation) {
            return creation.getArguments();
        }
        return List.of();
    }

    /**
     * Caller identifiers that become the callee's {@code this}: the receiver of an instance call, or the enclosing
     * instance of a qualified {@code outer.new Inner()}.
     */
    static Set<String> receiverNames(Expression call, FrameBelonging belonging) {
        Set<String> names = new LinkedHashSet<>();
        if (call instanceof MethodCallExpr methodCall) {
            Optional<Expression> scope = methodCall.getScope();
            if (scope.isEmpty() || scope.get() instanceof SuperExpr) {
                names.add(THIS);
            } else {
                names.addAll(NameFinder.findNames(scope.get()));
            }
        } else if (call instanceof ObjectCreationExpr creation) {
            creation.getScope().ifPresent(scope -> names.addAll(NameFinder.findNames(scope)));
        } else if (call == null && belonging == FrameBelonging.INSTANCE_METHOD) {
            log.debug("Receiver of an unlocated instance call is unknown");
        }
        return names;
    }

    private static Map<String, Set<String>> invert(Map<String, Set<String>> paramToArg) {
        Map<String, Set<String>> argToParam = new LinkedHashMap<>();
        paramToArg.forEach((param, args) -> {
            for (String arg : args) {
                argToParam.computeIfAbsent(arg, k -> new LinkedHashSet<>()).add(param);
            }
        });
        return argToParam;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> map) {
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        map.forEach((key, values) -> frozen.put(key, Collections.unmodifiableSet(values)));
        return Collections.unmodifiableMap(frozen);
    }
}
