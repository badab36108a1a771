package info.mouts.orderprocessing.worker;

/**
 * Run state of the {@link OrderQueueWorker}.
 */
public enum WorkerState {
    STOPPED,
    RUNNING,
    /**
     * Stop requested, the in-flight batch is being finished.
     */
    STOPPING
}
