package info.mouts.orderprocessing.exception;

/**
 * Thrown when a queue message body cannot be turned into an order. Such a
 * message will never succeed, however often it is redelivered.
 */
public class MalformedOrderMessageException extends RuntimeException {
    public MalformedOrderMessageException(String message) {
        super(message);
    }

    public MalformedOrderMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
