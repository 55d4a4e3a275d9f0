package courier.travel.payment;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ReconciliationStore}. Suitable for a single instance and tests.
 */
public final class InMemoryReconciliationStore implements ReconciliationStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ReconciliationResult> find(String transactionRef) {
        Entry entry = entries.get(transactionRef);
        return entry == null ? Optional.empty() : Optional.of(entry.result);
    }

    @Override
    public ReconciliationResult recordTerminal(ReconciliationResult result) {
        Objects.requireNonNull(result, "result");
        return entries.computeIfAbsent(result.transactionRef(), ref -> new Entry(result)).result;
    }

    @Override
    public boolean claimNotification(String transactionRef) {
        Entry entry = entries.get(transactionRef);
        return entry != null && entry.claim();
    }

    @Override
    public void releaseNotification(String transactionRef) {
        Entry entry = entries.get(transactionRef);
        if (entry != null) {
            entry.release();
        }
    }

    @Override
    public boolean isNotified(String transactionRef) {
        Entry entry = entries.get(transactionRef);
        return entry != null && entry.notified;
    }

    @Override
    public void confirmNotification(String transactionRef) {
        Entry entry = entries.get(transactionRef);
        if (entry != null) {
            entry.confirmed = true;
        }
    }

    @Override
    public List<ReconciliationResult> findUnconfirmedNotifications(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return entries.values().stream()
                .filter(entry -> !entry.confirmed)
                .map(entry -> entry.result)
                .sorted(Comparator.comparing(ReconciliationResult::verifiedAt))
                .limit(limit)
                .toList();
    }

    private static final class Entry {
        private final ReconciliationResult result;
        private volatile boolean notified;
        private volatile boolean confirmed;

        Entry(ReconciliationResult result) {
            this.result = result;
        }

        synchronized boolean claim() {
            if (notified) {
                return false;
            }
            notified = true;
            return true;
        }

        synchronized void release() {
            notified = false;
        }
    }
}
