package info.mouts.orderprocessing.queue;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A message received from an {@link OrderQueue}. The receipt handle is only
 * valid for the delivery that produced it.
 */
@Value
@Builder
public class QueueMessage {
    String messageId;
    String receiptHandle;
    String body;

    @Singular
    Map<String, String> attributes;

    /**
     * How many times this message has been delivered, including this delivery.
     */
    int receiveCount;
}
