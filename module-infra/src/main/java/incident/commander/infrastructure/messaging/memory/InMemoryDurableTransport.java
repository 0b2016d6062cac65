package incident.commander.infrastructure.messaging.memory;

import incident.commander.infrastructure.messaging.QueueNames;
import incident.commander.infrastructure.messaging.transport.DurableMessage;
import incident.commander.infrastructure.messaging.transport.DurableTransport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process stand-in for the SQS transport.
 *
 * <p>Queue URLs have the form {@code memory://<name>}. A received message stays in flight until
 * deleted. {@link #setAvailable(boolean)} simulates an outage.
 */
@Slf4j
public class InMemoryDurableTransport implements DurableTransport {

  private static final String URL_PREFIX = "memory://";

  private final Map<String, BlockingQueue<String>> queues = new ConcurrentHashMap<>();
  private final Map<String, String> inFlight = new ConcurrentHashMap<>();
  private volatile boolean available = true;

  @Override
  public String ensureQueue(String queueName) {
    checkAvailable();
    queues.computeIfAbsent(queueName, k -> new LinkedBlockingQueue<>());
    if (!queueName.endsWith(QueueNames.DLQ_SUFFIX)) {
      queues.computeIfAbsent(queueName + QueueNames.DLQ_SUFFIX, k -> new LinkedBlockingQueue<>());
    }
    return URL_PREFIX + queueName;
  }

  @Override
  public void send(String queueUrl, String body, Map<String, String> attributes) {
    checkAvailable();
    queue(queueUrl).add(body);
  }

  @Override
  public List<DurableMessage> receive(String queueUrl, int maxMessages, int waitSeconds)
      throws InterruptedException {
    checkAvailable();
    BlockingQueue<String> queue = queue(queueUrl);
    List<DurableMessage> received = new ArrayList<>(maxMessages);

    String first = queue.poll(Math.max(0, waitSeconds), TimeUnit.SECONDS);
    if (first == null) {
      return received;
    }
    received.add(track(first));
    while (received.size() < maxMessages) {
      String next = queue.poll();
      if (next == null) {
        break;
      }
      received.add(track(next));
    }
    return received;
  }

  @Override
  public void delete(String queueUrl, String receiptHandle) {
    checkAvailable();
    inFlight.remove(receiptHandle);
  }

  @Override
  public long approximateLength(String queueUrl) {
    checkAvailable();
    return queue(queueUrl).size();
  }

  @Override
  public boolean ping() {
    return available;
  }

  @Override
  public void close() {
    log.debug("[InMemoryDurable] closed: queues={}, inFlight={}", queues.size(), inFlight.size());
  }

  public void setAvailable(boolean available) {
    this.available = available;
  }

  /** Messages received but not yet deleted. */
  public int inFlightCount() {
    return inFlight.size();
  }

  private DurableMessage track(String body) {
    String handle = UUID.randomUUID().toString();
    inFlight.put(handle, body);
    return new DurableMessage(body, handle);
  }

  private BlockingQueue<String> queue(String queueUrl) {
    String name =
        queueUrl.startsWith(URL_PREFIX) ? queueUrl.substring(URL_PREFIX.length()) : queueUrl;
    return queues.computeIfAbsent(name, k -> new LinkedBlockingQueue<>());
  }

  private void checkAvailable() {
    if (!available) {
      throw new IllegalStateException("durable transport unavailable");
    }
  }
}
