package com.prudhvi.vlm_relay.stream;

import com.prudhvi.vlm_relay.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis Streams implementation of {@link StreamLogClient}.
 *
 * Reads use plain XREAD (no consumer group), so every relay process sees every
 * entry and no acknowledgement state is kept in Redis:
 *
 *   XREAD BLOCK <blockMs> COUNT <n> STREAMS vlm:results:stream <lastId>
 *
 * Spring Data Redis runs blocking stream reads on a dedicated connection, so a
 * parked XREAD never stalls the PING issued by {@link #connect()}.
 *
 * The connection itself is owned by the Lettuce connection factory, which
 * reconnects on its own; "connected" here tracks whether Redis has answered
 * since the last failure.
 */
@Component
public class RedisStreamLogClient implements StreamLogClient {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamLogClient.class);

    private final StringRedisTemplate redisTemplate;
    private final String streamName;

    private volatile boolean connected;

    public RedisStreamLogClient(StringRedisTemplate redisTemplate, RelayProperties properties) {
        this.redisTemplate = redisTemplate;
        this.streamName = properties.getStream().getName();
    }

    @Override
    public boolean connect() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            connected = "PONG".equalsIgnoreCase(reply);
            if (connected) {
                log.info("Connected to Redis, tailing stream {}", streamName);
            } else {
                log.error("Unexpected PING reply from Redis: {}", reply);
            }
        } catch (RuntimeException e) {
            log.error("Redis connection failed: {}", e.getMessage());
            connected = false;
        }
        return connected;
    }

    @Override
    public void disconnect() {
        if (connected) {
            log.info("Redis connection marked closed");
        }
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    /**
     * XREVRANGE stream + - COUNT 1. A missing key reads as an empty stream.
     */
    @Override
    public String latestId() {
        List<MapRecord<String, Object, Object>> newest;
        try {
            newest = redisTemplate.opsForStream()
                    .reverseRange(streamName, Range.unbounded(), Limit.limit().count(1));
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            connected = false;
            throw new UpstreamUnavailableException("Lost connection to Redis stream " + streamName, e);
        }
        if (newest == null || newest.isEmpty()) {
            return CursorPosition.EMPTY_LOG_ID;
        }
        return newest.get(0).getId().getValue();
    }

    @Override
    public List<StreamEntry> readAfter(String position, Duration maxWait, int maxCount) {
        List<MapRecord<String, Object, Object>> records;
        try {
            records = redisTemplate.opsForStream().read(
                    StreamReadOptions.empty().block(maxWait).count(maxCount),
                    StreamOffset.create(streamName, ReadOffset.from(position)));
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            // Connection refused/reset, or a command stuck behind a dead connection
            // until the client timeout fired.
            connected = false;
            throw new UpstreamUnavailableException("Lost connection to Redis stream " + streamName, e);
        }

        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<StreamEntry> entries = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> mapRecord : records) {
            entries.add(new StreamEntry(mapRecord.getId().getValue(), toStringFields(mapRecord.getValue())));
        }
        return entries;
    }

    private static Map<String, String> toStringFields(Map<Object, Object> raw) {
        Map<String, String> fields = new LinkedHashMap<>();
        raw.forEach((k, v) -> fields.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
        return fields;
    }
}
