package io.github.sparkrew.varhistory.flow_slicer;

import io.github.sparkrew.varhistory.flow_slicer.model.*;
import io.github.sparkrew.varhistory.flow_slicer.utils.SpoonCalleeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

public class Main {

    static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CLIEntryPoint()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Command(subcommands = {Slicer.class}, mixinStandardHelpOptions = true, version = "0.1")
    public static class CLIEntryPoint implements Runnable {
        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }
    }

    @CommandLine.Command(name = "slice", mixinStandardHelpOptions = true, version = "0.1",
            description = "Explain how the variable passed to the marker method got its value.")
    static class Slicer implements Callable<Integer> {
        @CommandLine.Option(
                names = {"-t", "--trace"},
                paramLabel = "TRACE",
                description = "The JSON trace recorded from one run of the program.",
                required = true
        )
        Path tracePath;

        @CommandLine.Option(
                names = {"-o", "--output"},
                paramLabel = "OUTPUT",
                description = "Where the annotated flow is written. Defaults to 'flow.json' in the current folder.",
                defaultValue = "flow.json"
        )
        Path outputPath;

        @CommandLine.Option(
                names = {"-m", "--marker"},
                paramLabel = "MARKER",
                description = "Name of the method whose single argument is the variable to explain.",
                defaultValue = BuildOptions.DEFAULT_MARKER
        )
        String marker;

        @CommandLine.Option(
                names = {"-n", "--max-steps"},
                paramLabel = "MAX-STEPS",
                description = "Stop the backward walk after this many steps. 0 means no limit.",
                defaultValue = "0"
        )
        int maxSteps;

        @CommandLine.Option(
                names = {"-s", "--source-root"},
                paramLabel = "SOURCE-ROOT",
                description = "Source root of the traced program, used to resolve callee declarations."
        )
        Path sourceRoot;

        @CommandLine.Option(
                names = {"--stats"},
                paramLabel = "STATS",
                description = "Optional file the slice statistics are written to."
        )
        Path statsPath;

        @Override
        public Integer call() {
            CalleeResolver resolver;
            try {
                resolver = sourceRoot == null ? CalleeResolver.NONE : SpoonCalleeResolver.forSourceRoot(sourceRoot);
            } catch (RuntimeException e) {
                log.error("Failed to analyze sources under {}", sourceRoot, e);
                return 1;
            }
            try {
                Map<FrameId, List<EventRecord>> frames = TraceReader.read(tracePath);
                Flow flow = FlowBuilder.build(frames, new BuildOptions(marker, resolver));
                SliceResult result = BackwardSlicer.traceFlow(flow, new SliceOptions(maxSteps));
                FlowWriter.writeFlow(flow, outputPath);
                if (statsPath != null) {
                    FlowWriter.writeSliceStatsToJson(SliceStats.of(result), statsPath);
                }
                return 0;
            } catch (IOException e) {
                log.error("Failed to read or write {}", e.getMessage(), e);
                return 1;
            } catch (TraceInconsistencyException e) {
                log.error("Trace is inconsistent: {}", e.getMessage());
                return 2;
            }
        }
    }
}
