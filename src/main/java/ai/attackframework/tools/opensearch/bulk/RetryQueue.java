package ai.attackframework.tools.opensearch.bulk;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parks bulk actions that kept failing with a transient error, one bounded FIFO per index.
 *
 * <p>Capacity is per index. Actions that do not fit are counted as dropped and never retried.</p>
 */
public final class RetryQueue {

    private static final class Slot {
        final Deque<BulkAction> actions = new ArrayDeque<>();
        final AtomicLong dropped = new AtomicLong();
    }

    private final int capacityPerIndex;
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    public RetryQueue(int capacityPerIndex) {
        if (capacityPerIndex < 1) {
            throw new IllegalArgumentException("capacityPerIndex must be positive");
        }
        this.capacityPerIndex = capacityPerIndex;
    }

    /** @return {@code false} when the index queue is full and the action was dropped */
    public boolean offer(String indexName, BulkAction action) {
        return offerAll(indexName, List.of(action)) == 1;
    }

    /**
     * Appends actions in order until the index queue is full; the remainder is dropped.
     *
     * @return number of actions accepted
     */
    public int offerAll(String indexName, List<BulkAction> actions) {
        if (actions == null || actions.isEmpty()) {
            return 0;
        }
        Slot slot = slots.computeIfAbsent(indexName, k -> new Slot());
        synchronized (slot) {
            int room = Math.max(0, capacityPerIndex - slot.actions.size());
            int accepted = Math.min(room, actions.size());
            slot.actions.addAll(actions.subList(0, accepted));
            slot.dropped.addAndGet(actions.size() - accepted);
            return accepted;
        }
    }

    /** Removes and returns up to {@code maxSize} of the oldest actions for the index. */
    public List<BulkAction> pollBatch(String indexName, int maxSize) {
        Slot slot = slots.get(indexName);
        if (slot == null) {
            return List.of();
        }
        synchronized (slot) {
            List<BulkAction> batch = new ArrayList<>(Math.min(maxSize, slot.actions.size()));
            while (batch.size() < maxSize && !slot.actions.isEmpty()) {
                batch.add(slot.actions.pollFirst());
            }
            return batch;
        }
    }

    public int size(String indexName) {
        Slot slot = slots.get(indexName);
        if (slot == null) {
            return 0;
        }
        synchronized (slot) {
            return slot.actions.size();
        }
    }

    /** Actions rejected for the index since creation or the last {@link #clear()}. */
    public long dropped(String indexName) {
        Slot slot = slots.get(indexName);
        return slot == null ? 0 : slot.dropped.get();
    }

    public int totalSize() {
        int total = 0;
        for (String index : slots.keySet()) {
            total += size(index);
        }
        return total;
    }

    public long totalDropped() {
        return slots.values().stream().mapToLong(s -> s.dropped.get()).sum();
    }

    public void clear() {
        slots.clear();
    }
}
