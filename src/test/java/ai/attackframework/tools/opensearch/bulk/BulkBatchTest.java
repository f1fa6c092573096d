package ai.attackframework.tools.opensearch.bulk;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class BulkBatchTest {

    private static List<BulkAction> actions(int n, String payload) {
        List<BulkAction> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(BulkAction.index("logs", String.valueOf(i), Map.of("msg", payload)));
        }
        return out;
    }

    @Test
    void split_byCount() {
        List<BulkBatch> batches = BulkBatch.split("logs", actions(5, "x"), 2, Long.MAX_VALUE);

        assertThat(batches).extracting(BulkBatch::size).containsExactly(2, 2, 1);
        assertThat(batches).allSatisfy(b -> assertThat(b.indexName()).isEqualTo("logs"));
    }

    @Test
    void split_byBytes() {
        List<BulkAction> big = actions(4, "y".repeat(1000));
        long one = big.get(0).estimatedBytes();

        List<BulkBatch> batches = BulkBatch.split("logs", big, 100, one * 2);

        assertThat(batches).extracting(BulkBatch::size).containsExactly(2, 2);
    }

    @Test
    void split_oversizeActionFormsOwnBatch() {
        List<BulkBatch> batches = BulkBatch.split("logs", actions(2, "z".repeat(500)), 100, 10);

        assertThat(batches).extracting(BulkBatch::size).containsExactly(1, 1);
    }

    @Test
    void sourceEstimate_matchesCompactJsonForAsciiText() {
        assertThat(BulkPayloadEstimator.estimateSource(Map.of("a", "b"))).isEqualTo("{\"a\":\"b\"}".length());
        assertThat(BulkPayloadEstimator.estimateSource(Map.of("tags", List.of("x", "y"))))
                .isEqualTo("{\"tags\":[\"x\",\"y\"]}".length());
        assertThat(BulkPayloadEstimator.estimateSource(null)).isZero();
    }

    @Test
    void sourceEstimate_countsUtf8Bytes() {
        assertThat(BulkPayloadEstimator.estimateSource(Map.of("k", "\u00e9")))
                .isEqualTo(BulkPayloadEstimator.estimateSource(Map.of("k", "e")) + 1);
    }

    @Test
    void actionEstimate_deleteIsMetadataLineOnly() {
        String line = "{\"delete\":{\"_index\":\"logs\",\"_id\":\"7\"}}\n";

        assertThat(BulkAction.delete("logs", "7").estimatedBytes()).isEqualTo(line.length());
    }

    @Test
    void actionEstimate_updateWrapsSourceInDoc() {
        Map<String, Object> partial = Map.of("price", 10);
        long index = BulkAction.index("logs", "7", partial).estimatedBytes();
        long update = BulkAction.update("logs", "7", partial).estimatedBytes();

        assertThat(update).isGreaterThan(index);
    }
}
