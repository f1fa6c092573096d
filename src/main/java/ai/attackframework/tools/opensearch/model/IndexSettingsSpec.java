package ai.attackframework.tools.opensearch.model;

import java.util.LinkedHashMap;
import java.util.Map;

import ai.attackframework.tools.opensearch.utils.config.OpenSearchDefaults;

/**
 * Index-level settings used at creation time.
 *
 * @param analysis optional analysis block (analyzers, tokenizers, filters)
 */
public record IndexSettingsSpec(int numberOfShards, int numberOfReplicas, String refreshInterval,
                                int maxResultWindow, Map<String, Object> analysis) {

    public IndexSettingsSpec {
        refreshInterval = refreshInterval == null ? OpenSearchDefaults.REFRESH_INTERVAL : refreshInterval;
    }

    public static IndexSettingsSpec defaults() {
        return new IndexSettingsSpec(OpenSearchDefaults.SHARDS, OpenSearchDefaults.REPLICAS,
                OpenSearchDefaults.REFRESH_INTERVAL, OpenSearchDefaults.MAX_RESULT_WINDOW, null);
    }

    /** {@code {index: {...}}} (analysis nested under index). */
    public Map<String, Object> toDsl() {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("number_of_shards", numberOfShards);
        index.put("number_of_replicas", numberOfReplicas);
        index.put("refresh_interval", refreshInterval);
        index.put("max_result_window", maxResultWindow);
        if (analysis != null) {
            index.put("analysis", analysis);
        }
        Map<String, Object> dsl = new LinkedHashMap<>();
        dsl.put("index", index);
        return dsl;
    }
}
