package info.mouts.orderprocessing.lifecycle;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Treats an exception escaping any thread as fatal: the application context
 * is closed, which runs the regular shutdown sequence, and the process exits
 * with status 1.
 */
@Component
@ConditionalOnProperty(prefix = "app.worker", name = "exit-on-fatal-error", havingValue = "true", matchIfMissing = true)
@Slf4j
public class FatalErrorHandler implements Thread.UncaughtExceptionHandler, ApplicationListener<ApplicationReadyEvent> {
    public static final int EXIT_CODE = 1;

    private final ApplicationContext applicationContext;
    private final IntConsumer exitFunction;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Autowired
    public FatalErrorHandler(ApplicationContext applicationContext) {
        this(applicationContext, System::exit);
    }

    FatalErrorHandler(ApplicationContext applicationContext, IntConsumer exitFunction) {
        this.applicationContext = applicationContext;
        this.exitFunction = exitFunction;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.debug("Fatal error handler installed");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        log.error("Uncaught exception on thread {}: {}", thread.getName(), throwable.getMessage(), throwable);

        if (!shuttingDown.compareAndSet(false, true)) {
            log.warn("Shutdown already in progress");
            return;
        }

        Thread shutdownThread = new Thread(this::shutdown, "fatal-error-shutdown");
        shutdownThread.start();
    }

    private void shutdown() {
        log.error("Shutting down after fatal error");
        SpringApplication.exit(applicationContext, () -> EXIT_CODE);
        exitFunction.accept(EXIT_CODE);
    }
}
