package io.github.sparkrew.varhistory.flow_slicer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.github.sparkrew.varhistory.flow_slicer.model.EventRecord;
import io.github.sparkrew.varhistory.flow_slicer.model.FrameId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a recorded trace from JSON.
 * <p>
 * Two layouts are accepted: {@code {"frames": {"0": [...], "0.0": [...]}}} with records already grouped by frame,
 * and {@code {"events": [...]}}, a flat stream grouped by {@link EventGrouper}.
 */
public class TraceReader {

    private static final Logger log = LoggerFactory.getLogger(TraceReader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectReader recordsReader = objectMapper.readerFor(new TypeReference<List<EventRecord>>() {
    });

    public static Map<FrameId, List<EventRecord>> read(Path tracePath) throws IOException {
        JsonNode root = objectMapper.readTree(tracePath.toFile());
        Map<FrameId, List<EventRecord>> frames = fromTree(root);
        log.info("Loaded {} frames from {}", frames.size(), tracePath);
        return frames;
    }

    public static Map<FrameId, List<EventRecord>> fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Trace must be a JSON object");
        }
        if (root.has("frames")) {
            Map<FrameId, List<EventRecord>> frames = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.get("frames").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                FrameId frame = parseFrame(field.getKey());
                List<EventRecord> records = new ArrayList<>();
                for (EventRecord record : readRecords(field.getValue())) {
                    records.add(record.frame() == null ? record.withFrame(frame) : record);
                }
                frames.put(frame, records);
            }
            return frames;
        }
        if (root.has("events")) {
            return EventGrouper.group(readRecords(root.get("events")));
        }
        throw new IOException("Trace has neither \"frames\" nor \"events\"");
    }

    private static List<EventRecord> readRecords(JsonNode array) throws IOException {
        List<EventRecord> records = recordsReader.readValue(array);
        return records == null ? List.of() : records;
    }

    private static FrameId parseFrame(String text) throws IOException {
        try {
            return FrameId.parse(text);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid frame id in trace: " + text, e);
        }
    }
}
