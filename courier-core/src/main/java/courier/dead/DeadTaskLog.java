package courier.dead;

import courier.TaskEnvelope;
import courier.spi.BrokerTransport;
import courier.worker.DeliveryObserver;
import courier.worker.DeliveryRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, in-process record of permanently failed tasks, for inspection and manual replay.
 *
 * <p>Register it on the worker pool with {@code WorkerPool.builder().observer(deadTaskLog)}.
 * When full, the oldest entry is evicted. Nothing is ever replayed automatically.
 */
public final class DeadTaskLog implements DeliveryObserver {
    private static final Logger logger = Logger.getLogger(DeadTaskLog.class.getName());

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final ArrayDeque<DeadTask> entries;

    public DeadTaskLog() {
        this(DEFAULT_CAPACITY);
    }

    public DeadTaskLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 64));
    }

    @Override
    public void onAttempt(DeliveryRecord record) {
    }

    @Override
    public void onPermanentFailure(DeliveryRecord record, TaskEnvelope envelope) {
        synchronized (entries) {
            if (entries.size() == capacity) {
                DeadTask evicted = entries.removeFirst();
                logger.log(Level.FINE, "Dead task log full; evicted {0}", evicted.envelope().id());
            }
            entries.addLast(new DeadTask(envelope, record));
        }
    }

    /**
     * Queries dead tasks, oldest first.
     *
     * @param taskName optional task name filter ({@code null} for all)
     * @param limit    maximum number of entries to return
     * @return matching entries
     */
    public List<DeadTask> query(String taskName, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<DeadTask> result = new ArrayList<>();
        synchronized (entries) {
            for (DeadTask entry : entries) {
                if (taskName == null || taskName.equals(entry.envelope().taskName())) {
                    result.add(entry);
                    if (result.size() == limit) {
                        break;
                    }
                }
            }
        }
        return result;
    }

    /**
     * Counts dead tasks.
     *
     * @param taskName optional task name filter ({@code null} for all)
     * @return the number of matching entries
     */
    public int count(String taskName) {
        synchronized (entries) {
            if (taskName == null) {
                return entries.size();
            }
            int count = 0;
            for (DeadTask entry : entries) {
                if (taskName.equals(entry.envelope().taskName())) {
                    count++;
                }
            }
            return count;
        }
    }

    public Optional<DeadTask> find(UUID taskId) {
        synchronized (entries) {
            for (DeadTask entry : entries) {
                if (entry.envelope().id().equals(taskId)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Re-enqueues a dead task as a new envelope: fresh id, {@code attempt = 0}, same task name,
     * queue and payload. The entry is taken out of the log before publishing, so concurrent
     * replays of one id publish once; if the enqueue fails it is put back at the oldest end.
     *
     * @param taskId id of the dead envelope
     * @param broker broker to publish to
     * @return the id of the new envelope, or empty if no such dead task is held
     * @throws courier.spi.EnqueueException if the broker rejects the envelope
     */
    public Optional<UUID> replay(UUID taskId, BrokerTransport broker) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(broker, "broker");
        Optional<DeadTask> dead = take(taskId);
        if (dead.isEmpty()) {
            return Optional.empty();
        }
        TaskEnvelope original = dead.get().envelope();
        TaskEnvelope replay = TaskEnvelope.builder(original.taskName())
                .queue(original.queue())
                .payload(original.payload())
                .maxRetries(original.maxRetries())
                .schemaVersion(original.schemaVersion())
                .build();
        try {
            broker.enqueue(replay);
        } catch (RuntimeException e) {
            restore(dead.get());
            throw e;
        }
        logger.log(Level.INFO, "Replayed dead task {0} as {1}", new Object[] {taskId, replay.id()});
        return Optional.of(replay.id());
    }

    private Optional<DeadTask> take(UUID taskId) {
        synchronized (entries) {
            Iterator<DeadTask> it = entries.iterator();
            while (it.hasNext()) {
                DeadTask entry = it.next();
                if (entry.envelope().id().equals(taskId)) {
                    it.remove();
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    private void restore(DeadTask entry) {
        synchronized (entries) {
            if (entries.size() == capacity) {
                // the log refilled while the replay was in flight; the restored entry is the oldest
                logger.log(Level.FINE, "Dead task log full; dropped {0} after failed replay",
                        entry.envelope().id());
                return;
            }
            entries.addFirst(entry);
        }
    }
}
