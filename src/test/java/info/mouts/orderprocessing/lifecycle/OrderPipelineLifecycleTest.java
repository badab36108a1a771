package info.mouts.orderprocessing.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.SmartLifecycle;

import info.mouts.orderprocessing.config.AppProperties;
import info.mouts.orderprocessing.worker.OrderQueueWorker;

@MockitoSettings(strictness = Strictness.LENIENT)
@ExtendWith(MockitoExtension.class)
public class OrderPipelineLifecycleTest {
    // Phases of the embedded web server's start/stop and graceful shutdown lifecycles.
    private static final int WEB_SERVER_START_STOP_PHASE = SmartLifecycle.DEFAULT_PHASE - 2048;
    private static final int WEB_SERVER_GRACEFUL_SHUTDOWN_PHASE = SmartLifecycle.DEFAULT_PHASE - 1024;

    @Mock
    private OrderQueueWorker orderQueueWorker;

    private AppProperties properties;
    private OrderPipelineLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getWorker().setDrainTimeout(Duration.ofSeconds(7));
        lifecycle = new OrderPipelineLifecycle(orderQueueWorker, properties);
        when(orderQueueWorker.start()).thenReturn(true);
    }

    @Test
    @DisplayName("Should start the worker after the web server and stop it before the server drains requests")
    void phase_isBetweenWebServerPhases() {
        assertThat(lifecycle.getPhase())
                .isGreaterThan(WEB_SERVER_START_STOP_PHASE)
                .isLessThan(WEB_SERVER_GRACEFUL_SHUTDOWN_PHASE);
    }

    @Test
    @DisplayName("Should start the worker and stop it with the drain timeout")
    void startAndStop() {
        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        verify(orderQueueWorker).start();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        verify(orderQueueWorker).stop(Duration.ofSeconds(7));
    }

    @Test
    @DisplayName("Should ignore a second stop request")
    void stop_isIdempotent() {
        lifecycle.start();

        lifecycle.stop();
        lifecycle.stop();

        verify(orderQueueWorker, times(1)).stop(any());
    }

    @Test
    @DisplayName("Should keep serving when the worker cannot start")
    void start_workerFails() {
        when(orderQueueWorker.start()).thenReturn(false);

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should not start the worker when it is disabled")
    void start_workerDisabled() {
        properties.getWorker().setEnabled(false);

        lifecycle.start();

        verify(orderQueueWorker, never()).start();
    }
}
