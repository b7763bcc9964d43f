package io.github.sparkrew.varhistory.flow_slicer.utils;

import io.github.sparkrew.varhistory.flow_slicer.CalleeResolver;
import io.github.sparkrew.varhistory.flow_slicer.model.CalleeInfo;
import io.github.sparkrew.varhistory.flow_slicer.model.FrameBelonging;
import io.github.sparkrew.varhistory.flow_slicer.model.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.declaration.CtType;
import spoon.reflect.visitor.filter.TypeFilter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves callee declarations from the traced program's sources with a Spoon model.
 * The innermost executable whose source range covers the callee's first executed line is the callee.
 */
public class SpoonCalleeResolver implements CalleeResolver {

    private static final Logger log = LoggerFactory.getLogger(SpoonCalleeResolver.class);

    private final List<CtExecutable<?>> executables;
    // Maps "file:line" to the resolved declaration, null results included
    private final Map<String, CalleeInfo> cache = new HashMap<>();

    public SpoonCalleeResolver(CtModel model) {
        this.executables = new ArrayList<>();
        for (CtExecutable<?> executable : model.getElements(new TypeFilter<>(CtExecutable.class))) {
            executables.add(executable);
        }
        log.debug("Spoon model has {} executables", executables.size());
    }

    /**
     * Build a Spoon model of every source file under the root. No classpath is needed.
     */
    public static SpoonCalleeResolver forSourceRoot(Path sourceRoot) {
        if (!Files.isDirectory(sourceRoot)) {
            throw new IllegalArgumentException("Source root is not a directory: " + sourceRoot);
        }
        log.info("Building Spoon model from {}", sourceRoot);
        Launcher launcher = new Launcher();
        launcher.addInputResource(sourceRoot.toString());
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setCommentEnabled(false);
        launcher.getEnvironment().setComplianceLevel(17);
        try {
            return new SpoonCalleeResolver(launcher.buildModel());
        } catch (Exception e) {
            throw new RuntimeException("Failed to build Spoon model from " + sourceRoot, e);
        }
    }

    @Override
    public CalleeInfo resolve(String calleeName, SourceLocation entry) {
        if (entry == null || entry.file() == null) {
            return null;
        }
        String key = entry.file() + ":" + entry.startLine();
        if (cache.containsKey(key)) {
            return cache.get(key);
        }
        CtExecutable<?> executable = findInnermost(entry);
        CalleeInfo info = null;
        if (executable == null) {
            log.warn("No declaration found for callee {} at {}", calleeName, entry);
        } else {
            List<CtParameter<?>> parameters = executable.getParameters();
            boolean varargs = !parameters.isEmpty() && parameters.get(parameters.size() - 1).isVarArgs();
            info = new CalleeInfo(
                    null,
                    executable.getSimpleName(),
                    parameters.stream().map(CtParameter::getSimpleName).toList(),
                    varargs,
                    belongingOf(executable));
            log.debug("Resolved callee {} at {} to {}", calleeName, entry, info);
        }
        cache.put(key, info);
        return info;
    }

    private CtExecutable<?> findInnermost(SourceLocation entry) {
        Path wanted = Path.of(entry.file());
        CtExecutable<?> best = null;
        int bestSize = Integer.MAX_VALUE;
        for (CtExecutable<?> executable : executables) {
            SourcePosition position = executable.getPosition();
            if (position == null || !position.isValidPosition() || position.getFile() == null) {
                continue;
            }
            if (!position.getFile().toPath().endsWith(wanted)) {
                continue;
            }
            if (position.getLine() > entry.startLine() || position.getEndLine() < entry.startLine()) {
                continue;
            }
            int size = position.getEndLine() - position.getLine();
            if (size < bestSize) {
                best = executable;
                bestSize = size;
            }
        }
        return best;
    }

    static FrameBelonging belongingOf(CtExecutable<?> executable) {
        if (executable instanceof CtConstructor<?>) {
            return FrameBelonging.CONSTRUCTOR;
        }
        if (executable instanceof CtMethod<?> method && !method.isStatic() && method.getParent() instanceof CtType<?>) {
            return FrameBelonging.INSTANCE_METHOD;
        }
        return FrameBelonging.UNKNOWN;
    }
}
