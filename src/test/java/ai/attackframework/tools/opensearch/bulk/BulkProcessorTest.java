package ai.attackframework.tools.opensearch.bulk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.opensearch.client.opensearch.OpenSearchClient;
import org.opensearch.client.opensearch.core.BulkRequest;
import org.opensearch.client.opensearch.core.BulkResponse;
import org.opensearch.client.opensearch.core.bulk.BulkOperation;
import org.opensearch.client.opensearch.core.bulk.BulkResponseItem;
import org.opensearch.client.opensearch.core.bulk.OperationType;

import ai.attackframework.tools.opensearch.errors.ValidationException;
import ai.attackframework.tools.opensearch.model.BulkOperationResult;

class BulkProcessorTest {

    private OpenSearchClient client;

    @BeforeEach
    void setUp() {
        client = mock(OpenSearchClient.class);
    }

    private BulkProcessor.Builder processor() {
        return BulkProcessor.builder(client).retryDelayMs(1);
    }

    private static BulkResponseItem ok(String id) {
        return BulkResponseItem.of(i -> i.operationType(OperationType.Index).index("products").id(id).status(201));
    }

    private static BulkResponseItem failed(String id, String type, int status) {
        return BulkResponseItem.of(i -> i.operationType(OperationType.Index).index("products").id(id)
                .status(status).error(e -> e.type(type).reason(type + " for " + id)));
    }

    private static BulkResponse response(BulkResponseItem... items) {
        List<BulkResponseItem> list = List.of(items);
        boolean errors = list.stream().anyMatch(i -> i.error() != null);
        return BulkResponse.of(b -> b.errors(errors).took(2).items(list));
    }

    private static List<Map<String, Object>> docs(int n) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            out.add(Map.of("sku", "SKU-" + i, "price", i * 10));
        }
        return out;
    }

    @Test
    void processBulkIndex_splitsIntoBatches() throws Exception {
        when(client.bulk(any(BulkRequest.class)))
                .thenReturn(response(ok("SKU-1"), ok("SKU-2")))
                .thenReturn(response(ok("SKU-3")));
        BulkProcessor bp = processor().batchSize(2).build();

        BulkOperationResult result = bp.processBulkIndex("products", docs(3), "sku");

        assertThat(result.total()).isEqualTo(3);
        assertThat(result.successful()).isEqualTo(3);
        assertThat(result.failed()).isZero();
        assertThat(result.hasErrors()).isFalse();
        verify(client, times(2)).bulk(any(BulkRequest.class));
        assertThat(bp.getStats())
                .containsEntry("total_batches", 2L)
                .containsEntry("successful_batches", 2L)
                .containsEntry("total_documents", 3L);
    }

    @Test
    void processBulkIndex_usesIdFieldAndUnderscoreId() throws Exception {
        when(client.bulk(any(BulkRequest.class))).thenReturn(response(ok("a"), ok("b")));
        BulkProcessor bp = processor().build();
        ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);

        bp.processBulkIndex("products", List.of(
                Map.of("sku", "A-1", "name", "x"),
                Map.of("_id", "given", "name", "y")), "sku");

        verify(client).bulk(captor.capture());
        List<BulkOperation> ops = captor.getValue().operations();
        assertThat(ops).hasSize(2);
        assertThat(ops.get(0).index().id()).isEqualTo("A-1");
        assertThat(ops.get(1).index().id()).isEqualTo("given");
        @SuppressWarnings("unchecked")
        Map<String, Object> source = (Map<String, Object>) ops.get(1).index().document();
        assertThat(source).doesNotContainKey("_id");
    }

    @Test
    void transientItemErrors_areResentAlone() throws Exception {
        when(client.bulk(any(BulkRequest.class)))
                .thenReturn(response(ok("SKU-1"), failed("SKU-2", "es_rejected_execution_exception", 429)))
                .thenReturn(response(ok("SKU-2")));
        BulkProcessor bp = processor().build();
        ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);

        BulkOperationResult result = bp.processBulkIndex("products", docs(2), "sku");

        assertThat(result.successful()).isEqualTo(2);
        assertThat(result.failed()).isZero();
        verify(client, times(2)).bulk(captor.capture());
        assertThat(captor.getAllValues().get(1).operations()).hasSize(1);
        assertThat(bp.getStats()).containsEntry("total_retries", 1L);
    }

    @Test
    void permanentItemErrors_areReportedWithoutRetry() throws Exception {
        when(client.bulk(any(BulkRequest.class)))
                .thenReturn(response(ok("SKU-1"), failed("SKU-2", "mapper_parsing_exception", 400)));
        BulkProcessor bp = processor().build();

        BulkOperationResult result = bp.processBulkIndex("products", docs(2), "sku");

        assertThat(result.successful()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).singleElement().satisfies(e -> {
            assertThat(e).containsEntry("op", "index").containsEntry("id", "SKU-2").containsEntry("status", 400);
            assertThat(e.get("error")).isEqualTo(Map.of("type", "mapper_parsing_exception",
                    "reason", "mapper_parsing_exception for SKU-2"));
        });
        verify(client, times(1)).bulk(any(BulkRequest.class));
        assertThat(bp.queuedCount("products")).isZero();
        assertThat(bp.getStats()).containsEntry("failed_batches", 1L).containsEntry("total_errors", 1L);
    }

    @Test
    void transportFailures_queueBatch_thenDrainResendsIt() throws Exception {
        when(client.bulk(any(BulkRequest.class)))
                .thenThrow(new IOException("Connection refused"))
                .thenThrow(new IOException("Connection refused"))
                .thenReturn(response(ok("SKU-1"), ok("SKU-2")));
        BulkProcessor bp = processor().maxRetries(2).build();

        BulkOperationResult result = bp.processBulkIndex("products", docs(2), "sku");

        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.errors()).containsExactly(Map.of("batch_error", "Connection refused"));
        assertThat(bp.queuedCount("products")).isEqualTo(2);

        BulkOperationResult drained = bp.drainRetryQueue("products");

        assertThat(drained.successful()).isEqualTo(2);
        assertThat(bp.queuedCount("products")).isZero();
        assertThat(bp.drainRetryQueue("products").total()).isZero();
    }

    @Test
    void processBulkUpdate_requiresIds() throws Exception {
        BulkProcessor bp = processor().build();

        assertThatThrownBy(() -> bp.processBulkUpdate("products", List.of(Map.of("price", 5))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Document missing _id field");

        when(client.bulk(any(BulkRequest.class))).thenReturn(response(ok("1")));
        ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);
        bp.processBulkUpdate("products", List.of(Map.of("_id", "1", "price", 5)));
        verify(client).bulk(captor.capture());
        BulkOperation op = captor.getValue().operations().get(0);
        assertThat(op.isUpdate()).isTrue();
        assertThat(op.update().id()).isEqualTo("1");
    }

    @Test
    void processBulkDelete_buildsDeleteOperations() throws Exception {
        when(client.bulk(any(BulkRequest.class))).thenReturn(response(ok("1"), ok("2")));
        ArgumentCaptor<BulkRequest> captor = ArgumentCaptor.forClass(BulkRequest.class);

        BulkOperationResult result = processor().build().processBulkDelete("products", List.of("1", "2"));

        verify(client).bulk(captor.capture());
        assertThat(captor.getValue().operations()).allSatisfy(op -> assertThat(op.isDelete()).isTrue());
        assertThat(result.successful()).isEqualTo(2);
    }

    @Test
    void emptyInput_sendsNothing() throws Exception {
        BulkProcessor bp = processor().build();

        assertThat(bp.processBulkIndex("products", List.of(), null).total()).isZero();
        assertThat(bp.processBulkDelete("products", null).total()).isZero();
        verify(client, times(0)).bulk(any(BulkRequest.class));
    }

    @Test
    void builder_validatesAndCapsBatchSize() {
        assertThatThrownBy(() -> processor().batchSize(0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Chunk size must be positive");
        assertThat(processor().batchSize(1_000_000).build().getStats()).containsEntry("batch_size", 5000);
    }

    @Test
    void resetStats_zeroesCounters() throws Exception {
        when(client.bulk(any(BulkRequest.class))).thenReturn(response(ok("1")));
        BulkProcessor bp = processor().build();
        bp.processBulkDelete("products", List.of("1"));

        bp.resetStats();

        assertThat(bp.getStats()).containsEntry("total_batches", 0L).containsEntry("total_documents", 0L);
    }

    @Test
    void isRetryableItemError_matchesStatusTypeOrReason() {
        assertThat(BulkProcessor.isRetryableItemError(Map.of("status", 429))).isTrue();
        assertThat(BulkProcessor.isRetryableItemError(Map.of("status", 409,
                "error", Map.of("type", "version_conflict_engine_exception", "reason", "conflict")))).isTrue();
        assertThat(BulkProcessor.isRetryableItemError(Map.of("status", 400,
                "error", Map.of("type", "mapper_parsing_exception", "reason", "failed to parse")))).isFalse();
    }
}
