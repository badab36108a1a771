package info.mouts.orderprocessing.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.hibernate.validator.constraints.time.DurationMax;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Application settings bound from the {@code app.*} namespace.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    @Valid
    private Queue queue = new Queue();

    @Valid
    private Worker worker = new Worker();

    private Database database = new Database();

    @Valid
    private Producer producer = new Producer();

    public enum QueueProvider {
        SQS,
        IN_MEMORY
    }

    @Data
    public static class Queue {
        @NotNull
        private QueueProvider provider = QueueProvider.SQS;

        /**
         * URL of the orders queue. Required for the SQS provider.
         */
        private String url;

        /**
         * AWS region of the queue. Falls back to the SDK's default region chain.
         */
        private String region;

        /**
         * Overrides the SQS endpoint, e.g. for a local emulator.
         */
        private String endpoint;

        /**
         * Visibility timeout of the in-memory queue.
         */
        private Duration visibilityTimeout = Duration.ofSeconds(300);

        /**
         * Deliveries before the in-memory queue dead-letters a message.
         */
        @Min(1)
        private int maxReceiveCount = 3;

        @AssertTrue(message = "app.queue.url is required when app.queue.provider is sqs")
        public boolean isUrlConfigured() {
            return provider != QueueProvider.SQS || (url != null && !url.isBlank());
        }
    }

    @Data
    public static class Worker {
        private boolean enabled = true;

        @Min(1)
        @Max(10)
        private int batchSize = 10;

        /**
         * Long-poll wait per receive call.
         */
        @NotNull
        @DurationMax(seconds = 20)
        private Duration waitTime = Duration.ofSeconds(20);

        /**
         * Pause after a failed receive call.
         */
        @NotNull
        private Duration errorBackoff = Duration.ofSeconds(5);

        /**
         * How long shutdown waits for the in-flight batch before interrupting
         * the worker.
         */
        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(30);

        /**
         * Make malformed messages visible again immediately instead of waiting
         * for the visibility timeout, so they reach the dead-letter queue
         * sooner.
         */
        private boolean expediteMalformed = true;

        /**
         * Exit the process when an exception escapes any thread.
         */
        private boolean exitOnFatalError = true;
    }

    @Data
    public static class Database {
        /**
         * Secrets Manager secret holding the database credentials. When unset
         * the regular {@code spring.datasource.*} settings apply.
         */
        private String secretId;

        private String secretRegion;
    }

    @Data
    public static class Producer {
        private boolean enabled = false;

        /**
         * Delay between two batches. Read by the {@code @Scheduled} trigger.
         */
        @NotNull
        private Duration interval = Duration.ofMinutes(5);

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(30);

        @Min(1)
        private int minOrders = 1;

        @Min(1)
        private int maxOrders = 5;

        @AssertTrue(message = "app.producer.max-orders must not be less than app.producer.min-orders")
        public boolean isRangeValid() {
            return maxOrders >= minOrders;
        }
    }
}
