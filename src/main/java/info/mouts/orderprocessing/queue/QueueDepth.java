package info.mouts.orderprocessing.queue;

import lombok.Value;

/**
 * Approximate number of messages held by a queue.
 */
@Value
public class QueueDepth {
    long visible;
    long inFlight;

    public long total() {
        return visible + inFlight;
    }
}
