package info.mouts.orderprocessing.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import info.mouts.orderprocessing.config.AppProperties;
import info.mouts.orderprocessing.worker.OrderQueueWorker;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts and stops the {@link OrderQueueWorker} together with the application
 * context.
 * <p>
 * The phase sits between the embedded web server's start/stop phase and its
 * graceful shutdown phase. On startup the database is ready before any
 * lifecycle runs and the web server is already listening when the worker
 * starts. On shutdown the server stops accepting requests and drains them
 * first, then the worker finishes its batch, then the data source is closed
 * with the rest of the context.
 * </p>
 */
@Component
@Slf4j
public class OrderPipelineLifecycle implements SmartLifecycle {
    public static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 1536;

    private final OrderQueueWorker orderQueueWorker;
    private final AppProperties.Worker settings;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Constructs an instance of {@code OrderPipelineLifecycle}.
     *
     * @param orderQueueWorker The worker to run.
     * @param properties       Application settings.
     */
    public OrderPipelineLifecycle(OrderQueueWorker orderQueueWorker, AppProperties properties) {
        this.orderQueueWorker = orderQueueWorker;
        this.settings = properties.getWorker();
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        if (!settings.isEnabled()) {
            log.info("Order queue worker disabled, orders will only be queued");
            return;
        }

        if (!orderQueueWorker.start()) {
            log.warn("Order queue worker not running, queued orders will not be processed");
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.debug("Shutdown already in progress");
            return;
        }

        log.info("Shutting down order pipeline");
        orderQueueWorker.stop(settings.getDrainTimeout());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
