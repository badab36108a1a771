package info.mouts.orderprocessing.queue;

/**
 * Thrown when the queue cannot be reached or rejects a request.
 */
public class QueueUnavailableException extends RuntimeException {
    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
