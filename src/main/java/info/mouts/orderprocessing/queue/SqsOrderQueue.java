package info.mouts.orderprocessing.queue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * {@link OrderQueue} backed by an Amazon SQS standard queue.
 */
@Slf4j
public class SqsOrderQueue implements OrderQueue {
    private static final String ALL_ATTRIBUTES = "All";
    private static final String STRING_DATA_TYPE = "String";

    private final SqsClient sqsClient;
    private final String queueUrl;

    /**
     * Constructs an instance of {@code SqsOrderQueue}.
     *
     * @param sqsClient The SQS client.
     * @param queueUrl  URL of the orders queue.
     */
    public SqsOrderQueue(SqsClient sqsClient, String queueUrl) {
        this.sqsClient = sqsClient;
        this.queueUrl = queueUrl;
    }

    @Override
    public String send(String body, Map<String, String> attributes) {
        Map<String, MessageAttributeValue> messageAttributes = attributes.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> MessageAttributeValue.builder()
                        .dataType(STRING_DATA_TYPE)
                        .stringValue(entry.getValue())
                        .build()));

        SendMessageRequest request = SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(body)
                .messageAttributes(messageAttributes)
                .build();

        try {
            String messageId = sqsClient.sendMessage(request).messageId();
            log.debug("Sent message {} to {}", messageId, queueUrl);
            return messageId;
        } catch (SdkException e) {
            throw new QueueUnavailableException("Failed to send message to " + queueUrl, e);
        }
    }

    @Override
    public List<QueueMessage> receive(int maxMessages, Duration waitTime) {
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds((int) waitTime.toSeconds())
                .messageAttributeNames(ALL_ATTRIBUTES)
                .messageSystemAttributeNames(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT)
                .build();

        try {
            return sqsClient.receiveMessage(request).messages().stream()
                    .map(this::toQueueMessage)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new QueueUnavailableException("Failed to receive messages from " + queueUrl, e);
        }
    }

    @Override
    public void delete(String receiptHandle) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .build());
        } catch (SdkException e) {
            throw new QueueUnavailableException("Failed to delete message from " + queueUrl, e);
        }
    }

    @Override
    public void changeVisibility(String receiptHandle, Duration visibilityTimeout) {
        try {
            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .visibilityTimeout((int) visibilityTimeout.toSeconds())
                    .build());
        } catch (SdkException e) {
            throw new QueueUnavailableException("Failed to change message visibility on " + queueUrl, e);
        }
    }

    @Override
    public QueueDepth depth() {
        GetQueueAttributesRequest request = GetQueueAttributesRequest.builder()
                .queueUrl(queueUrl)
                .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES,
                        QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE)
                .build();

        try {
            GetQueueAttributesResponse response = sqsClient.getQueueAttributes(request);
            return new QueueDepth(
                    parseCount(response.attributes().get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)),
                    parseCount(response.attributes().get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE)));
        } catch (SdkException e) {
            throw new QueueUnavailableException("Failed to read attributes of " + queueUrl, e);
        }
    }

    private QueueMessage toQueueMessage(Message message) {
        Map<String, String> attributes = message.messageAttributes().entrySet().stream()
                .filter(entry -> entry.getValue().stringValue() != null)
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().stringValue()));

        String receiveCount = message.attributes().get(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT);

        return QueueMessage.builder()
                .messageId(message.messageId())
                .receiptHandle(message.receiptHandle())
                .body(message.body())
                .attributes(attributes)
                .receiveCount(receiveCount == null ? 1 : Integer.parseInt(receiveCount))
                .build();
    }

    private static long parseCount(String value) {
        return value == null ? 0 : Long.parseLong(value);
    }
}
