package info.mouts.orderprocessing.producer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import info.mouts.orderprocessing.config.AppProperties;
import info.mouts.orderprocessing.dto.OrderItemRequestDTO;
import info.mouts.orderprocessing.dto.OrderMessageDTO;
import info.mouts.orderprocessing.dto.OrderRequestDTO;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.service.OrderIngestionService;

@MockitoSettings(strictness = Strictness.LENIENT)
@ExtendWith(MockitoExtension.class)
public class SampleOrderProducerTest {
    @Mock
    private OrderIngestionService orderIngestionService;

    private AppProperties properties;
    private SampleOrderProducer producer;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        producer = new SampleOrderProducer(orderIngestionService, properties);
        when(orderIngestionService.submitOrder(any()))
                .thenReturn(OrderMessageDTO.builder().orderId("order-1").build());
    }

    @RepeatedTest(20)
    @DisplayName("Should build orders from the catalog with 1 to 3 items of quantity 1 to 5")
    void randomOrder_isValid() {
        OrderRequestDTO request = SampleOrderProducer.randomOrder(new Random());

        assertThat(request.getCustomerId()).matches("CUST-\\d{4}");
        assertThat(request.getItems()).hasSizeBetween(1, 3);
        for (OrderItemRequestDTO item : request.getItems()) {
            assertThat(item.getQuantity()).isBetween(1, 5);
            BigDecimal catalogPrice = SampleOrderProducer.CATALOG.stream()
                    .filter(product -> product.getProductId().equals(item.getProductId()))
                    .findFirst()
                    .orElseThrow()
                    .getPrice();
            assertThat(item.getPrice()).isEqualTo(catalogPrice);
        }
    }

    @Test
    @DisplayName("Should submit between the configured minimum and maximum number of orders")
    void produceBatch_submitsWithinRange() {
        int queued = producer.produceBatch();

        assertThat(queued).isBetween(1, 5);
        verify(orderIngestionService, atLeast(1)).submitOrder(any());
        verify(orderIngestionService, atMost(5)).submitOrder(any());
    }

    @Test
    @DisplayName("Should continue the batch when a submission fails")
    void produceBatch_continuesAfterFailure() {
        properties.getProducer().setMinOrders(3);
        properties.getProducer().setMaxOrders(3);
        when(orderIngestionService.submitOrder(any()))
                .thenThrow(new QueueUnavailableException("down", null))
                .thenReturn(OrderMessageDTO.builder().orderId("order-2").build());

        assertThat(producer.produceBatch()).isEqualTo(2);
        verify(orderIngestionService, times(3)).submitOrder(any());
    }
}
