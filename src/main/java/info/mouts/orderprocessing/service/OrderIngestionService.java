package info.mouts.orderprocessing.service;

import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;

/**
 * Accepts validated order requests and hands them to the queue.
 */
public interface OrderIngestionService {
    /**
     * Assigns an identifier and total to the order and enqueues it.
     *
     * @param request The validated order request.
     * @return The message that was enqueued.
     * @throws info.mouts.orderprocessing.queue.QueueUnavailableException If the
     *         queue rejected the message. Nothing was accepted in that case.
     */
    OrderMessageDTO submitOrder(OrderRequestDTO request);
}
