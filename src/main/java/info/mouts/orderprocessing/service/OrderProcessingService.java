package info.mouts.orderprocessing.service;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.queue.QueueMessage;

/**
 * Turns a received queue message into a stored, completed order.
 */
public interface OrderProcessingService {
    /**
     * Parses the message body, stores the order if it is not stored yet and
     * marks it completed. Safe to call again for a redelivered message.
     *
     * @param message The received queue message.
     * @return The processed order.
     * @throws info.mouts.orderprocessing.exception.MalformedOrderMessageException
     *         If the body is not a usable order.
     */
    Order processMessage(QueueMessage message);
}
