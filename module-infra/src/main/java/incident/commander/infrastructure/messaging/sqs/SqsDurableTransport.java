package incident.commander.infrastructure.messaging.sqs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import incident.commander.infrastructure.messaging.QueueNames;
import incident.commander.infrastructure.messaging.transport.DurableMessage;
import incident.commander.infrastructure.messaging.transport.DurableTransport;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.ListQueuesRequest;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

/**
 * SQS-backed durable transport.
 *
 * <p>Queues are created on first use with a 30s visibility timeout, 14-day retention and 20s
 * receive wait. Every non-DLQ queue gets a {@code <name>_dlq} companion and a redrive policy that
 * moves a message there after 5 receives.
 *
 * <p>Resolved queue URLs are cached for the lifetime of the transport.
 */
@Slf4j
public class SqsDurableTransport implements DurableTransport {

  static final String VISIBILITY_TIMEOUT_SECONDS = "30";
  static final String RETENTION_SECONDS = "1209600";
  static final String RECEIVE_WAIT_SECONDS = "20";
  static final String MAX_RECEIVE_COUNT = "5";

  private final SqsClient sqsClient;
  private final ObjectMapper objectMapper;
  private final Map<String, String> queueUrls = new ConcurrentHashMap<>();

  public SqsDurableTransport(SqsClient sqsClient, ObjectMapper objectMapper) {
    this.sqsClient = sqsClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public String ensureQueue(String queueName) throws JsonProcessingException {
    String cached = queueUrls.get(queueName);
    if (cached != null) {
      return cached;
    }
    String url = resolveOrCreate(queueName);
    queueUrls.put(queueName, url);
    return url;
  }

  @Override
  public void send(String queueUrl, String body, Map<String, String> attributes) {
    Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
    attributes.forEach(
        (key, value) ->
            messageAttributes.put(
                key,
                MessageAttributeValue.builder().dataType("String").stringValue(value).build()));

    sqsClient.sendMessage(
        SendMessageRequest.builder()
            .queueUrl(queueUrl)
            .messageBody(body)
            .messageAttributes(messageAttributes)
            .build());
  }

  @Override
  public List<DurableMessage> receive(String queueUrl, int maxMessages, int waitSeconds) {
    return sqsClient
        .receiveMessage(
            ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitSeconds)
                .messageAttributeNames("All")
                .build())
        .messages()
        .stream()
        .map(m -> new DurableMessage(m.body(), m.receiptHandle()))
        .toList();
  }

  @Override
  public void delete(String queueUrl, String receiptHandle) {
    sqsClient.deleteMessage(
        DeleteMessageRequest.builder().queueUrl(queueUrl).receiptHandle(receiptHandle).build());
  }

  @Override
  public long approximateLength(String queueUrl) {
    String value =
        sqsClient
            .getQueueAttributes(
                GetQueueAttributesRequest.builder()
                    .queueUrl(queueUrl)
                    .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
                    .build())
            .attributes()
            .get(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES);
    return value == null ? 0L : Long.parseLong(value);
  }

  @Override
  public boolean ping() {
    try {
      sqsClient.listQueues(ListQueuesRequest.builder().maxResults(1).build());
      return true;
    } catch (SdkException e) {
      log.warn("[SqsTransport] ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    sqsClient.close();
    log.info("[SqsTransport] SQS client closed");
  }

  private String resolveOrCreate(String queueName) throws JsonProcessingException {
    try {
      return sqsClient
          .getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build())
          .queueUrl();
    } catch (QueueDoesNotExistException e) {
      log.info("[SqsTransport] queue missing, provisioning: queue={}", queueName);
      return create(queueName);
    }
  }

  private String create(String queueName) throws JsonProcessingException {
    Map<QueueAttributeName, String> attributes = baseAttributes();

    if (!queueName.endsWith(QueueNames.DLQ_SUFFIX)) {
      String dlqUrl = ensureQueue(queueName + QueueNames.DLQ_SUFFIX);
      String dlqArn =
          sqsClient
              .getQueueAttributes(
                  GetQueueAttributesRequest.builder()
                      .queueUrl(dlqUrl)
                      .attributeNames(QueueAttributeName.QUEUE_ARN)
                      .build())
              .attributes()
              .get(QueueAttributeName.QUEUE_ARN);

      Map<String, String> redrive = new LinkedHashMap<>();
      redrive.put("deadLetterTargetArn", dlqArn);
      redrive.put("maxReceiveCount", MAX_RECEIVE_COUNT);
      attributes.put(QueueAttributeName.REDRIVE_POLICY, objectMapper.writeValueAsString(redrive));
    }

    String url =
        sqsClient
            .createQueue(
                CreateQueueRequest.builder().queueName(queueName).attributes(attributes).build())
            .queueUrl();
    log.info("[SqsTransport] queue created: queue={}, url={}", queueName, url);
    return url;
  }

  private static Map<QueueAttributeName, String> baseAttributes() {
    Map<QueueAttributeName, String> attributes = new HashMap<>();
    attributes.put(QueueAttributeName.VISIBILITY_TIMEOUT, VISIBILITY_TIMEOUT_SECONDS);
    attributes.put(QueueAttributeName.MESSAGE_RETENTION_PERIOD, RETENTION_SECONDS);
    attributes.put(QueueAttributeName.RECEIVE_MESSAGE_WAIT_TIME_SECONDS, RECEIVE_WAIT_SECONDS);
    return attributes;
  }
}
