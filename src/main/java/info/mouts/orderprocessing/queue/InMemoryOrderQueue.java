package info.mouts.orderprocessing.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link OrderQueue} held in memory, for local runs and tests.
 * <p>
 * Follows SQS standard queue semantics: received messages are hidden for the
 * visibility timeout and come back unless deleted, and a message delivered
 * {@code maxReceiveCount} times is moved to a dead-letter list on its next
 * receive instead of being delivered again. The dead-letter list keeps only
 * the most recent {@code maxDeadLetters} messages.
 * </p>
 */
@Slf4j
public class InMemoryOrderQueue implements OrderQueue {
    public static final int DEFAULT_MAX_DEAD_LETTERS = 1000;

    private static final String HANDLE_SEPARATOR = "#";
    private static final long MIN_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final Duration visibilityTimeout;
    private final int maxReceiveCount;
    private final int maxDeadLetters;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageAvailable = lock.newCondition();

    private final Map<String, Entry> messages = new LinkedHashMap<>();
    private final Deque<QueueMessage> deadLetters = new ArrayDeque<>();

    /**
     * Constructs an instance of {@code InMemoryOrderQueue}.
     *
     * @param visibilityTimeout How long a received message stays hidden.
     * @param maxReceiveCount   Deliveries allowed before a message is
     *                          dead-lettered.
     * @param clock             Clock used to track visibility.
     */
    public InMemoryOrderQueue(Duration visibilityTimeout, int maxReceiveCount, Clock clock) {
        this(visibilityTimeout, maxReceiveCount, DEFAULT_MAX_DEAD_LETTERS, clock);
    }

    /**
     * Constructs an instance of {@code InMemoryOrderQueue} with a bounded
     * dead-letter list.
     *
     * @param visibilityTimeout How long a received message stays hidden.
     * @param maxReceiveCount   Deliveries allowed before a message is
     *                          dead-lettered.
     * @param maxDeadLetters    Dead-lettered messages kept; the oldest is
     *                          dropped beyond that.
     * @param clock             Clock used to track visibility.
     */
    public InMemoryOrderQueue(Duration visibilityTimeout, int maxReceiveCount, int maxDeadLetters, Clock clock) {
        this.visibilityTimeout = visibilityTimeout;
        this.maxReceiveCount = maxReceiveCount;
        this.maxDeadLetters = maxDeadLetters;
        this.clock = clock;
    }

    @Override
    public String send(String body, Map<String, String> attributes) {
        String messageId = UUID.randomUUID().toString();

        lock.lock();
        try {
            messages.put(messageId, new Entry(messageId, body, Map.copyOf(attributes)));
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }

        log.debug("Queued message {}", messageId);
        return messageId;
    }

    @Override
    public List<QueueMessage> receive(int maxMessages, Duration waitTime) {
        long deadline = System.nanoTime() + waitTime.toNanos();

        lock.lock();
        try {
            List<QueueMessage> received = collectVisible(maxMessages);

            while (received.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                messageAvailable.awaitNanos(Math.min(remaining, nanosUntilNextVisible()));
                received = collectVisible(maxMessages);
            }

            return received;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Collections.emptyList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String receiptHandle) {
        String messageId = messageIdOf(receiptHandle);

        lock.lock();
        try {
            if (messages.remove(messageId) == null) {
                log.debug("Delete ignored, message {} is no longer queued", messageId);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void changeVisibility(String receiptHandle, Duration timeout) {
        String messageId = messageIdOf(receiptHandle);

        lock.lock();
        try {
            Entry entry = messages.get(messageId);
            if (entry == null || !receiptHandle.equals(entry.receiptHandle)) {
                throw new QueueUnavailableException("Receipt handle is no longer valid: " + receiptHandle, null);
            }

            entry.invisibleUntil = clock.instant().plus(timeout);
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueDepth depth() {
        Instant now = clock.instant();

        lock.lock();
        try {
            long visible = messages.values().stream().filter(entry -> entry.isVisible(now)).count();
            return new QueueDepth(visible, messages.size() - visible);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return A snapshot of the messages moved to the dead-letter list.
     */
    public List<QueueMessage> deadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    private List<QueueMessage> collectVisible(int maxMessages) {
        Instant now = clock.instant();
        List<QueueMessage> received = new ArrayList<>();

        Iterator<Entry> iterator = messages.values().iterator();
        while (iterator.hasNext() && received.size() < maxMessages) {
            Entry entry = iterator.next();
            if (!entry.isVisible(now)) {
                continue;
            }

            if (entry.receiveCount >= maxReceiveCount) {
                iterator.remove();
                deadLetter(entry.toMessage());
                log.warn("Message {} moved to dead-letter list after {} receives", entry.messageId,
                        entry.receiveCount);
                continue;
            }

            entry.receiveCount++;
            entry.receiptHandle = entry.messageId + HANDLE_SEPARATOR + UUID.randomUUID();
            entry.invisibleUntil = now.plus(visibilityTimeout);
            received.add(entry.toMessage());
        }

        return received;
    }

    private void deadLetter(QueueMessage message) {
        deadLetters.addLast(message);

        if (deadLetters.size() > maxDeadLetters) {
            QueueMessage dropped = deadLetters.removeFirst();
            log.warn("Dead-letter list full, dropped message {}", dropped.getMessageId());
        }
    }

    private long nanosUntilNextVisible() {
        Instant now = clock.instant();

        return messages.values().stream()
                .filter(entry -> !entry.isVisible(now))
                .mapToLong(entry -> Math.max(Duration.between(now, entry.invisibleUntil).toNanos(), MIN_WAIT_NANOS))
                .min()
                .orElse(Long.MAX_VALUE);
    }

    private static String messageIdOf(String receiptHandle) {
        int separator = receiptHandle.indexOf(HANDLE_SEPARATOR);
        return separator < 0 ? receiptHandle : receiptHandle.substring(0, separator);
    }

    private static final class Entry {
        private final String messageId;
        private final String body;
        private final Map<String, String> attributes;

        private int receiveCount;
        private String receiptHandle;
        private Instant invisibleUntil;

        private Entry(String messageId, String body, Map<String, String> attributes) {
            this.messageId = messageId;
            this.body = body;
            this.attributes = attributes;
        }

        private boolean isVisible(Instant now) {
            return invisibleUntil == null || !now.isBefore(invisibleUntil);
        }

        private QueueMessage toMessage() {
            return QueueMessage.builder()
                    .messageId(messageId)
                    .receiptHandle(receiptHandle)
                    .body(body)
                    .attributes(attributes)
                    .receiveCount(receiveCount)
                    .build();
        }
    }
}
