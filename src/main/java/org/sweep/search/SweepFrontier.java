package org.sweep.search;

import it.unimi.dsi.fastutil.objects.ObjectArrayFIFOQueue;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Strict first-in-first-out frontier.
 *
 * <p>Every entry is enqueued with exactly one more move than the entry it was expanded from,
 * so FIFO order alone keeps dequeued move counts non-decreasing.</p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
@Accessors(fluent = true)
public final class SweepFrontier {
    private final ObjectArrayFIFOQueue<FrontierEntry> queue = new ObjectArrayFIFOQueue<>();

    // High-water mark for queued entries
    @Getter
    private int peakSize = 0;

    /**
     * Appends one entry at the back of the frontier.
     */
    public void offer(FrontierEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must be non-null");
        }
        queue.enqueue(entry);
        if (queue.size() > peakSize) {
            peakSize = queue.size();
        }
    }

    /**
     * Removes and returns the oldest entry.
     *
     * @throws EmptyFrontierException if the frontier is empty.
     */
    public FrontierEntry poll() {
        if (queue.isEmpty()) {
            throw new EmptyFrontierException("Frontier is empty");
        }
        return queue.dequeue();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
