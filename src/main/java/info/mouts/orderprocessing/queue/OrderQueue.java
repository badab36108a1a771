package info.mouts.orderprocessing.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * At-least-once message queue carrying order messages from the ingestion
 * endpoint to the queue worker.
 * <p>
 * A received message stays invisible to other receivers for the visibility
 * timeout and is redelivered afterwards unless it has been deleted. Every
 * operation throws {@link QueueUnavailableException} when the queue cannot be
 * reached.
 * </p>
 */
public interface OrderQueue {
    /**
     * Enqueues a message.
     *
     * @param body       Message body.
     * @param attributes String attributes sent along with the body.
     * @return The identifier assigned to the message.
     */
    String send(String body, Map<String, String> attributes);

    /**
     * Receives up to {@code maxMessages} messages, waiting up to
     * {@code waitTime} for at least one to arrive.
     *
     * @return The received messages, empty if none arrived in time.
     */
    List<QueueMessage> receive(int maxMessages, Duration waitTime);

    void delete(String receiptHandle);

    /**
     * Changes how long a received message stays invisible.
     * {@link Duration#ZERO} makes it visible again immediately.
     */
    void changeVisibility(String receiptHandle, Duration visibilityTimeout);

    QueueDepth depth();
}
