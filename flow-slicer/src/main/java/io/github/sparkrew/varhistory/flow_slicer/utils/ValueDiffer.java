package io.github.sparkrew.varhistory.flow_slicer.utils;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Deep comparison of snapshot values.
 * <p>
 * Equal values (arrays compared element-wise) never differ. Otherwise both values are converted to JSON trees and the
 * trees are compared, which catches objects without a meaningful {@code equals}. Fields are read whatever their
 * visibility, so private state counts. Values that cannot be converted are
 * compared by equality alone.
 */
public class ValueDiffer {

    private static final Logger log = LoggerFactory.getLogger(ValueDiffer.class);
    private static final ObjectMapper mapper = new ObjectMapper()
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    public static boolean hasDiff(Object before, Object after) {
        if (Objects.deepEquals(before, after)) {
            return false;
        }
        if (before == null || after == null || before.getClass() != after.getClass()) {
            return true;
        }
        try {
            JsonNode beforeTree = mapper.valueToTree(before);
            JsonNode afterTree = mapper.valueToTree(after);
            return !beforeTree.equals(afterTree);
        } catch (IllegalArgumentException e) {
            log.debug("Could not convert {} for comparison, falling back to equality: {}",
                    before.getClass().getName(), e.getMessage());
            return true;
        }
    }
}
