package ai.attackframework.tools.opensearch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk run. Mutable; owned by the thread that builds it.
 */
public final class BulkOperationResult {

    private int total;
    private int successful;
    private int failed;
    private final List<Map<String, Object>> errors = new ArrayList<>();
    private long tookMs;
    private boolean hasErrors;

    public BulkOperationResult() {}

    public BulkOperationResult(int total) {
        this.total = total;
    }

    public int total() { return total; }
    public int successful() { return successful; }
    public int failed() { return failed; }
    public List<Map<String, Object>> errors() { return Collections.unmodifiableList(errors); }
    public long tookMs() { return tookMs; }
    public boolean hasErrors() { return hasErrors; }

    public void setTotal(int total) { this.total = total; }
    public void addSuccessful(int count) { this.successful += count; }
    public void addTook(long ms) { this.tookMs += ms; }

    /** Records one failed item. */
    public void addError(Map<String, Object> error) {
        errors.add(error);
        failed++;
        hasErrors = true;
    }

    /** Records {@code count} failed items sharing one error entry (whole-batch failure). */
    public void addFailures(int count, Map<String, Object> error) {
        errors.add(error);
        failed += count;
        hasErrors = true;
    }

    /** Folds {@code other} into this result. */
    public void merge(BulkOperationResult other) {
        total += other.total;
        successful += other.successful;
        failed += other.failed;
        errors.addAll(other.errors);
        tookMs += other.tookMs;
        hasErrors = hasErrors || other.hasErrors;
    }

    @Override
    public String toString() {
        return "BulkOperationResult{total=" + total + ", successful=" + successful
                + ", failed=" + failed + ", tookMs=" + tookMs + '}';
    }
}
