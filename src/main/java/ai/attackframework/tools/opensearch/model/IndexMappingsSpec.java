package ai.attackframework.tools.opensearch.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapping definition used at creation time.
 *
 * @param properties field mappings
 * @param dynamic    {@code strict}, {@code true} or {@code false}
 */
public record IndexMappingsSpec(Map<String, Object> properties, String dynamic,
                                boolean dateDetection, boolean numericDetection) {

    public IndexMappingsSpec {
        properties = properties == null ? Map.of() : properties;
        dynamic = dynamic == null ? "strict" : dynamic;
    }

    public IndexMappingsSpec(Map<String, Object> properties) {
        this(properties, "strict", true, false);
    }

    public Map<String, Object> toDsl() {
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put("properties", properties);
        dsl.put("dynamic", dynamic);
        dsl.put("date_detection", dateDetection);
        dsl.put("numeric_detection", numericDetection);
        return dsl;
    }
}
