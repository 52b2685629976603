package devicevault.pipeline.support;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.JobQueue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * FIFO queues in memory with the blocking pop semantics of the Redis adapter.
 */
public class InMemoryJobQueue implements JobQueue {

    private final Map<String, Deque<String>> queues = new HashMap<>();
    private final Map<String, Duration> expiries = new HashMap<>();
    private int failingPushes;
    private boolean unavailable;
    private BiConsumer<String, String> onPush = (queue, payload) -> {
    };

    @Override
    public void push(String queue, String payload) {
        BiConsumer<String, String> listener;
        synchronized (this) {
            if (unavailable || failingPushes > 0) {
                if (failingPushes > 0) {
                    failingPushes--;
                }
                throw new BrokerException("push to " + queue + " failed");
            }
            queues.computeIfAbsent(queue, q -> new ArrayDeque<>()).addLast(payload);
            notifyAll();
            listener = onPush;
        }
        listener.accept(queue, payload);
    }

    @Override
    public synchronized Optional<String> pop(List<String> names, Duration timeout) {
        if (unavailable) {
            throw new BrokerException("queue unavailable");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (String name : names) {
                Deque<String> queue = queues.get(name);
                if (queue != null && !queue.isEmpty()) {
                    return Optional.of(queue.pollFirst());
                }
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Optional.empty();
            }
            try {
                wait(Math.max(1, remaining / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    @Override
    public synchronized void expire(String queue, Duration ttl) {
        expiries.put(queue, ttl);
    }

    public synchronized List<String> contents(String queue) {
        Deque<String> q = queues.get(queue);
        return q == null ? List.of() : new ArrayList<>(q);
    }

    public synchronized int size(String queue) {
        Deque<String> q = queues.get(queue);
        return q == null ? 0 : q.size();
    }

    public synchronized Optional<Duration> expiryOf(String queue) {
        return Optional.ofNullable(expiries.get(queue));
    }

    /**
     * The next {@code count} pushes fail with a BrokerException.
     */
    public synchronized void failNextPushes(int count) {
        this.failingPushes = count;
    }

    public synchronized void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Called after every successful push, outside the queue's lock.
     */
    public synchronized void onPush(BiConsumer<String, String> listener) {
        this.onPush = listener;
    }
}
