package info.mouts.orderprocessing.worker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.stereotype.Component;

import info.mouts.orderprocessing.config.AppProperties;
import info.mouts.orderprocessing.exception.MalformedOrderMessageException;
import info.mouts.orderprocessing.queue.OrderQueue;
import info.mouts.orderprocessing.queue.QueueMessage;
import info.mouts.orderprocessing.queue.QueueUnavailableException;
import info.mouts.orderprocessing.service.OrderProcessingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Background worker that long-polls the {@link OrderQueue} and hands each
 * message to the {@link OrderProcessingService}.
 * <p>
 * Messages of a batch are processed one after another. A message is deleted
 * only after it has been processed; failed messages stay in the queue and
 * are redelivered once their visibility timeout expires. Malformed messages
 * are never deleted either, so the queue's redrive policy moves them to the
 * dead-letter queue.
 * </p>
 */
@Component
@Slf4j
public class OrderQueueWorker {
    public static final String THREAD_NAME = "order-queue-worker";

    private static final String REASON_TAG = "reason";

    private final OrderQueue orderQueue;
    private final OrderProcessingService orderProcessingService;
    private final AppProperties.Worker settings;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.STOPPED);
    private ExecutorService executor;

    private Counter receivedMessagesCounter;
    private Counter processedMessagesCounter;
    private Counter malformedMessagesCounter;
    private Counter failedMessagesCounter;
    private Counter pollErrorsCounter;
    private Timer processingTimer;

    /**
     * Constructs an instance of {@code OrderQueueWorker}.
     *
     * @param orderQueue             The queue to poll.
     * @param orderProcessingService The service that stores each order.
     * @param properties             Application settings, of which the
     *                               {@code app.worker.*} part is used.
     * @param meterRegistry          The registry for collecting metrics.
     */
    public OrderQueueWorker(OrderQueue orderQueue, OrderProcessingService orderProcessingService,
            AppProperties properties, MeterRegistry meterRegistry) {
        this.orderQueue = orderQueue;
        this.orderProcessingService = orderProcessingService;
        this.settings = properties.getWorker();

        initializeMetrics(meterRegistry);
    }

    /**
     * Starts the polling loop on a dedicated thread. The queue is probed first;
     * if it cannot be reached the worker stays stopped.
     *
     * @return {@code true} if the worker was started.
     */
    public synchronized boolean start() {
        if (state.get() != WorkerState.STOPPED) {
            log.warn("Order queue worker already {}, ignoring start", state.get());
            return false;
        }

        try {
            orderQueue.depth();
        } catch (QueueUnavailableException e) {
            log.error("Order queue unreachable, worker not started: {}", e.getMessage(), e);
            return false;
        }

        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, THREAD_NAME));
        state.set(WorkerState.RUNNING);
        // execute rather than submit, so a crash reaches the uncaught exception handler
        executor.execute(this::runLoop);

        log.info("Order queue worker started (batch size {}, wait time {})", settings.getBatchSize(),
                settings.getWaitTime());
        return true;
    }

    /**
     * Stops the worker. The current receive call and batch are allowed to
     * finish for up to {@code maxWait}, after which the worker thread is
     * interrupted. Messages of an interrupted batch that were not deleted are
     * redelivered later.
     *
     * @param maxWait How long to wait for the in-flight batch.
     */
    public synchronized void stop(Duration maxWait) {
        if (!state.compareAndSet(WorkerState.RUNNING, WorkerState.STOPPING)) {
            log.debug("Order queue worker not running, nothing to stop");
            return;
        }

        log.info("Stopping order queue worker, waiting up to {} for the current batch", maxWait);
        executor.shutdown();

        try {
            if (!executor.awaitTermination(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Order queue worker did not finish within {}, interrupting", maxWait);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            state.set(WorkerState.STOPPED);
            log.info("Order queue worker stopped");
        }
    }

    public WorkerState getState() {
        return state.get();
    }

    /**
     * Runs one receive call and processes the returned batch.
     *
     * @return The number of messages processed and deleted.
     * @throws QueueUnavailableException If the receive call failed.
     */
    public int pollOnce() {
        List<QueueMessage> messages = orderQueue.receive(settings.getBatchSize(), settings.getWaitTime());
        if (messages.isEmpty()) {
            return 0;
        }

        log.debug("Received {} messages", messages.size());

        int processed = 0;
        for (QueueMessage message : messages) {
            if (processMessage(message)) {
                processed++;
            }
        }
        return processed;
    }

    private void runLoop() {
        log.info("Polling loop running on thread {}", Thread.currentThread().getName());

        while (state.get() == WorkerState.RUNNING && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (QueueUnavailableException e) {
                pollErrorsCounter.increment();
                log.error("Failed to receive messages, retrying in {}: {}", settings.getErrorBackoff(),
                        e.getMessage(), e);
                if (!pause(settings.getErrorBackoff())) {
                    break;
                }
            }
        }

        log.info("Polling loop exited");
    }

    private boolean processMessage(QueueMessage message) {
        receivedMessagesCounter.increment();

        try {
            processingTimer.record(() -> {
                orderProcessingService.processMessage(message);
            });
        } catch (MalformedOrderMessageException e) {
            malformedMessagesCounter.increment();
            log.error("Malformed message {} left for the dead-letter queue: {}. Body: {}", message.getMessageId(),
                    e.getMessage(), message.getBody());
            expediteRedelivery(message);
            return false;
        } catch (Exception e) {
            failedMessagesCounter.increment();
            log.error("Failed to process message {}, leaving it for redelivery: {}. Body: {}",
                    message.getMessageId(), e.getMessage(), message.getBody(), e);
            return false;
        }

        try {
            orderQueue.delete(message.getReceiptHandle());
        } catch (QueueUnavailableException e) {
            // The order is stored, so the redelivery will only repeat the status update.
            log.error("Processed message {} could not be deleted: {}", message.getMessageId(), e.getMessage(), e);
            return false;
        }

        processedMessagesCounter.increment();
        return true;
    }

    private void expediteRedelivery(QueueMessage message) {
        if (!settings.isExpediteMalformed()) {
            return;
        }

        try {
            orderQueue.changeVisibility(message.getReceiptHandle(), Duration.ZERO);
        } catch (QueueUnavailableException e) {
            log.warn("Failed to release malformed message {}: {}", message.getMessageId(), e.getMessage());
        }
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void initializeMetrics(MeterRegistry meterRegistry) {
        this.receivedMessagesCounter = Counter.builder("orders.queue.received")
                .description("Number of order messages received from the queue")
                .register(meterRegistry);

        this.processedMessagesCounter = Counter.builder("orders.queue.processed")
                .description("Number of order messages stored and deleted")
                .register(meterRegistry);

        this.malformedMessagesCounter = Counter.builder("orders.queue.failed")
                .description("Number of order messages that failed processing")
                .tag(REASON_TAG, "malformed")
                .register(meterRegistry);

        this.failedMessagesCounter = Counter.builder("orders.queue.failed")
                .description("Number of order messages that failed processing")
                .tag(REASON_TAG, "processing")
                .register(meterRegistry);

        this.pollErrorsCounter = Counter.builder("orders.queue.poll.errors")
                .description("Number of failed receive calls")
                .register(meterRegistry);

        this.processingTimer = Timer.builder("orders.queue.processing.time")
                .description("Time taken to store a single order message")
                .register(meterRegistry);
    }
}
