package info.mouts.orderprocessing.config;

import java.net.URI;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import info.mouts.orderprocessing.queue.InMemoryOrderQueue;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.SqsOrderQueue;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

/**
 * Selects the {@link OrderQueue} implementation from
 * {@code app.queue.provider}.
 */
@Configuration
@Slf4j
public class QueueConfig {

    @Configuration
    @ConditionalOnProperty(name = "app.queue.provider", havingValue = "sqs", matchIfMissing = true)
    static class SqsQueueConfig {

        @Bean(destroyMethod = "close")
        public SqsClient sqsClient(AppProperties properties) {
            AppProperties.Queue queue = properties.getQueue();
            SqsClientBuilder builder = SqsClient.builder();

            if (queue.getRegion() != null && !queue.getRegion().isBlank()) {
                builder.region(Region.of(queue.getRegion()));
            }
            if (queue.getEndpoint() != null && !queue.getEndpoint().isBlank()) {
                builder.endpointOverride(URI.create(queue.getEndpoint()));
            }

            return builder.build();
        }

        @Bean
        public OrderQueue orderQueue(SqsClient sqsClient, AppProperties properties) {
            log.info("Using SQS order queue at {}", properties.getQueue().getUrl());
            return new SqsOrderQueue(sqsClient, properties.getQueue().getUrl());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "app.queue.provider", havingValue = "in-memory")
    static class InMemoryQueueConfig {

        @Bean
        public OrderQueue orderQueue(AppProperties properties, Clock clock) {
            AppProperties.Queue queue = properties.getQueue();
            log.info("Using in-memory order queue (visibility timeout {}, max receive count {})",
                    queue.getVisibilityTimeout(), queue.getMaxReceiveCount());
            return new InMemoryOrderQueue(queue.getVisibilityTimeout(), queue.getMaxReceiveCount(), clock);
        }
    }
}
