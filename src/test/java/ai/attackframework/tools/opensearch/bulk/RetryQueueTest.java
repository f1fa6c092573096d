package ai.attackframework.tools.opensearch.bulk;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryQueue}: FIFO order, per-index capacity, drop accounting.
 */
class RetryQueueTest {

    private static BulkAction doc(String id) {
        return BulkAction.index("products", id, Map.of("name", "item-" + id));
    }

    @Test
    void offer_pollBatch_roundTrip() {
        RetryQueue queue = new RetryQueue(100);
        BulkAction action = doc("1");
        assertThat(queue.offer("products", action)).isTrue();
        assertThat(queue.size("products")).isEqualTo(1);

        assertThat(queue.pollBatch("products", 10)).containsExactly(action);
        assertThat(queue.size("products")).isZero();
    }

    @Test
    void offerAll_whenFull_keepsHeadAndCountsDropped() {
        RetryQueue queue = new RetryQueue(2);

        int added = queue.offerAll("products", List.of(doc("a"), doc("b"), doc("c")));

        assertThat(added).isEqualTo(2);
        assertThat(queue.pollBatch("products", 10)).extracting(BulkAction::id).containsExactly("a", "b");
        assertThat(queue.dropped("products")).isEqualTo(1);
    }

    @Test
    void offer_whenFull_returnsFalse() {
        RetryQueue queue = new RetryQueue(1);
        queue.offer("products", doc("a"));

        assertThat(queue.offer("products", doc("b"))).isFalse();
        assertThat(queue.totalDropped()).isEqualTo(1);
    }

    @Test
    void pollBatch_respectsMaxSize_andKeepsOrder() {
        RetryQueue queue = new RetryQueue(100);
        queue.offerAll("products", List.of(doc("a"), doc("b"), doc("c")));

        List<BulkAction> batch = queue.pollBatch("products", 2);

        assertThat(batch).extracting(BulkAction::id).containsExactly("a", "b");
        assertThat(queue.size("products")).isEqualTo(1);
    }

    @Test
    void pollBatch_unknownIndex_returnsEmptyList() {
        RetryQueue queue = new RetryQueue(100);
        assertThat(queue.pollBatch("no-such-index", 10)).isEmpty();
        assertThat(queue.offerAll("x", List.of())).isZero();
        assertThat(queue.dropped("x")).isZero();
    }

    @Test
    void indexes_haveIndependentCapacity() {
        RetryQueue queue = new RetryQueue(1);
        assertThat(queue.offer("a", doc("1"))).isTrue();
        assertThat(queue.offer("b", doc("2"))).isTrue();
        assertThat(queue.totalSize()).isEqualTo(2);

        queue.clear();

        assertThat(queue.totalSize()).isZero();
    }

    @Test
    void capacity_mustBePositive() {
        assertThatThrownBy(() -> new RetryQueue(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
