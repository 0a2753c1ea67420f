package io.vitalconnect.backend.ingestion;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** {@link DeathEventStream} on a Redis stream consumer group. */
@Component
public class RedisDeathEventStream implements DeathEventStream {

  private static final Logger log = LoggerFactory.getLogger(RedisDeathEventStream.class);

  private final StringRedisTemplate redisTemplate;
  private final IngestionProperties properties;

  public RedisDeathEventStream(StringRedisTemplate redisTemplate, IngestionProperties properties) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
  }

  @Override
  public void ensureConsumerGroup() {
    byte[] key = properties.streamKey().getBytes(StandardCharsets.UTF_8);
    try {
      redisTemplate.execute(
          (RedisCallback<String>)
              connection ->
                  connection
                      .streamCommands()
                      .xGroupCreate(key, properties.consumerGroup(), ReadOffset.from("0"), true));
      log.info(
          "Created consumer group {} on stream {}",
          properties.consumerGroup(),
          properties.streamKey());
    } catch (DataAccessException e) {
      if (!isBusyGroup(e)) {
        throw e;
      }
      log.debug("Consumer group {} already exists", properties.consumerGroup());
    }
  }

  @Override
  public List<StreamEntry> readPending(String afterId, int count) {
    return read(StreamReadOptions.empty().count(count), ReadOffset.from(afterId));
  }

  @Override
  public List<StreamEntry> readNew(int count, Duration block) {
    return read(StreamReadOptions.empty().count(count).block(block), ReadOffset.lastConsumed());
  }

  @Override
  public void acknowledge(String entryId) {
    redisTemplate
        .opsForStream()
        .acknowledge(properties.streamKey(), properties.consumerGroup(), entryId);
  }

  private List<StreamEntry> read(StreamReadOptions options, ReadOffset offset) {
    List<MapRecord<String, Object, Object>> records =
        redisTemplate
            .opsForStream()
            .read(
                Consumer.from(properties.consumerGroup(), properties.consumerName()),
                options,
                StreamOffset.create(properties.streamKey(), offset));
    if (records == null || records.isEmpty()) {
      return List.of();
    }
    return records.stream().map(RedisDeathEventStream::toEntry).toList();
  }

  private static StreamEntry toEntry(MapRecord<String, Object, Object> record) {
    Map<String, String> fields = new LinkedHashMap<>();
    record.getValue().forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
    return new StreamEntry(record.getId().getValue(), fields);
  }

  private static boolean isBusyGroup(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
        return true;
      }
    }
    return false;
  }
}
