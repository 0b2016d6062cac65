package incident.commander.infrastructure.messaging.redis;

import incident.commander.infrastructure.messaging.transport.LowLatencyTransport;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.BatchOptions.ExecutionMode;
import org.redisson.api.RBatch;
import org.redisson.api.RDeque;
import org.redisson.api.RDequeAsync;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Redis-backed low-latency transport.
 *
 * <p>Each queue is a Redis list accessed through Redisson {@link RDeque} with {@link StringCodec}
 * so the stored values stay plain JSON. Every push refreshes the TTL of the whole list; the push and
 * the EXPIRE go out as one {@link ExecutionMode#IN_MEMORY_ATOMIC} batch (MULTI/EXEC).
 *
 * <p>NOTE: do NOT annotate with @Component. The bean is created in the messaging configuration
 * only when the redis-sqs transport is selected.
 */
@Slf4j
public class RedisLowLatencyTransport implements LowLatencyTransport {

  private static final Duration MIN_TTL = Duration.ofSeconds(1);

  private final RedissonClient redissonClient;

  public RedisLowLatencyTransport(RedissonClient redissonClient) {
    this.redissonClient = redissonClient;
  }

  @Override
  public void pushHead(String queue, String body, Duration ttl) {
    RBatch batch = atomicBatch();
    RDequeAsync<String> deque = batch.getDeque(queue, StringCodec.INSTANCE);
    deque.addFirstAsync(body);
    deque.expireAsync(atLeastOneSecond(ttl));
    batch.execute();
  }

  @Override
  public void pushTail(String queue, String body, Duration ttl) {
    RBatch batch = atomicBatch();
    RDequeAsync<String> deque = batch.getDeque(queue, StringCodec.INSTANCE);
    deque.addLastAsync(body);
    deque.expireAsync(atLeastOneSecond(ttl));
    batch.execute();
  }

  @Override
  public String popHead(String queue) {
    return deque(queue).pollFirst();
  }

  @Override
  public long length(String queue) {
    return deque(queue).size();
  }

  @Override
  public boolean ping() {
    try {
      redissonClient.getKeys().count();
      return true;
    } catch (RuntimeException e) {
      log.warn("[RedisTransport] ping failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    if (!redissonClient.isShutdown()) {
      redissonClient.shutdown();
      log.info("[RedisTransport] Redisson client shut down");
    }
  }

  private RBatch atomicBatch() {
    return redissonClient.createBatch(
        BatchOptions.defaults().executionMode(ExecutionMode.IN_MEMORY_ATOMIC));
  }

  private RDeque<String> deque(String queue) {
    return redissonClient.getDeque(queue, StringCodec.INSTANCE);
  }

  private static Duration atLeastOneSecond(Duration ttl) {
    return (ttl == null || ttl.compareTo(MIN_TTL) < 0) ? MIN_TTL : ttl;
  }
}
