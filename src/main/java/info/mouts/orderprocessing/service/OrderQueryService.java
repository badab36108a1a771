package info.mouts.orderprocessing.service;

import org.springframework.data.domain.Page;

import info.mouts.orderprocessing.domain.Order;
import info.mouts.orderprocessing.dto.OrderStatsResponseDTO;

public interface OrderQueryService {
    /**
     * @throws info.mouts.orderprocessing.exception.OrderNotFoundException If no
     *         order has the given identifier.
     */
    Order findByOrderId(String orderId);

    /**
     * @param page  1-based page number.
     * @param limit Page size between 1 and 100.
     * @throws info.mouts.orderprocessing.exception.InvalidPaginationException
     *         If either value is out of range.
     */
    Page<Order> findPage(int page, int limit);

    OrderStatsResponseDTO getStats();
}
