package io.github.sparkrew.varhistory.flow_slicer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.sparkrew.varhistory.flow_slicer.model.Flow;
import io.github.sparkrew.varhistory.flow_slicer.model.NodeView;
import io.github.sparkrew.varhistory.flow_slicer.model.SliceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes an annotated flow, and optionally its statistics, as JSON.
 */
public class FlowWriter {

    private static final Logger log = LoggerFactory.getLogger(FlowWriter.class);

    /**
     * Write every node of the flow, in execution order, as a JSON array.
     */
    public static void writeFlow(Flow flow, Path outputPath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        List<NodeView> views = flow.nodes().stream().map(NodeView::of).toList();
        mapper.writeValue(outputPath.toFile(), views);
        log.info("Wrote {} nodes to {}", views.size(), outputPath);
    }

    /**
     * Write slice statistics to a JSON file for analysis.
     */
    public static void writeSliceStatsToJson(SliceStats stats, Path statsPath) throws IOException {
        try (FileWriter writer = new FileWriter(statsPath.toFile())) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            gson.toJson(stats, writer);
        }
        log.info("Slice statistics written to: {}", statsPath);
    }
}
