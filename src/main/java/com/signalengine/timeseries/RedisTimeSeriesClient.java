package com.signalengine.timeseries;

import com.signalengine.exception.DataUnavailableException;
import io.lettuce.core.api.async.RedisAsyncCommands;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.output.CommandOutput;
import io.lettuce.core.output.IntegerOutput;
import io.lettuce.core.output.NestedMultiOutput;
import io.lettuce.core.output.StatusOutput;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolKeyword;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper over Spring Data Redis for Redis TimeSeries commands.
 *
 * <p>Spring Data Redis has no TS command support and its {@code connection.execute()} uses
 * a byte-array output that cannot decode integer replies, so commands are dispatched through
 * Lettuce's native connection with the output type each command needs: {@code IntegerOutput}
 * for TS.ADD, {@code StatusOutput} for TS.CREATE, {@code NestedMultiOutput} for TS.RANGE.
 *
 * <p>Writes are best effort and only log on failure; reads throw
 * {@link DataUnavailableException} so the pipeline can exclude the affected timeframe.
 */
@Component
public class RedisTimeSeriesClient {

    private static final Logger log = LoggerFactory.getLogger(RedisTimeSeriesClient.class);

    private static final ByteArrayCodec CODEC = ByteArrayCodec.INSTANCE;

    private enum TsCommand implements ProtocolKeyword {
        TS_ADD,
        TS_CREATE,
        TS_RANGE;

        private final byte[] bytes;

        TsCommand() {
            // TS_ADD → "TS.ADD"
            this.bytes = name().replace('_', '.').getBytes(StandardCharsets.US_ASCII);
        }

        @Override
        public byte[] getBytes() {
            return bytes;
        }
    }

    private final StringRedisTemplate stringRedisTemplate;

    public RedisTimeSeriesClient(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Creates a series with the given retention and duplicate policy. "key already exists"
     * replies are expected after a restart and are not logged.
     */
    public void createIfNotExists(String key, long retentionMs, String duplicatePolicy) {
        try {
            stringRedisTemplate.execute(
                    connection -> {
                        dispatch(
                                connection,
                                TsCommand.TS_CREATE,
                                new StatusOutput<>(CODEC),
                                new CommandArgs<>(CODEC)
                                        .add(bytes(key))
                                        .add(bytes("RETENTION"))
                                        .add(bytes(String.valueOf(retentionMs)))
                                        .add(bytes("DUPLICATE_POLICY"))
                                        .add(bytes(duplicatePolicy)));
                        return null;
                    },
                    true);
        } catch (RuntimeException e) {
            if (e.getMessage() == null || !e.getMessage().contains("key already exists")) {
                log.warn("TS.CREATE failed for key {}: {}", key, e.getMessage());
            }
        }
    }

    /** Appends (or, under DUPLICATE_POLICY LAST, replaces) one sample. */
    public void add(String key, long epochMs, double value) {
        try {
            stringRedisTemplate.execute(
                    connection -> {
                        dispatch(
                                connection,
                                TsCommand.TS_ADD,
                                new IntegerOutput<>(CODEC),
                                new CommandArgs<>(CODEC)
                                        .add(bytes(key))
                                        .add(bytes(String.valueOf(epochMs)))
                                        .add(bytes(String.valueOf(value))));
                        return null;
                    },
                    true);
        } catch (RuntimeException e) {
            log.error("TS.ADD failed for key {} at {}: {}", key, epochMs, e.getMessage());
        }
    }

    /**
     * Queries a range with server-side aggregation. Buckets are aligned to the epoch.
     *
     * @param aggregationType one of: "first", "max", "min", "last", "sum"
     * @return samples ordered by bucket start; empty if the key does not exist yet
     * @throws DataUnavailableException on any other Redis failure
     */
    public List<TsSample> range(
            String key, long fromEpochMs, long toEpochMs, String aggregationType, long bucketDurationMs) {

        List<Object> rawResults;
        try {
            rawResults = stringRedisTemplate.execute(
                    connection -> dispatch(
                            connection,
                            TsCommand.TS_RANGE,
                            new NestedMultiOutput<>(CODEC),
                            new CommandArgs<>(CODEC)
                                    .add(bytes(key))
                                    .add(bytes(String.valueOf(fromEpochMs)))
                                    .add(bytes(String.valueOf(toEpochMs)))
                                    .add(bytes("AGGREGATION"))
                                    .add(bytes(aggregationType))
                                    .add(bytes(String.valueOf(bucketDurationMs)))),
                    true);
        } catch (RuntimeException e) {
            if (e.getMessage() != null && e.getMessage().contains("key does not exist")) {
                return List.of();
            }
            throw new DataUnavailableException("TS.RANGE failed for key " + key, e);
        }

        List<TsSample> results = new ArrayList<>();
        if (rawResults != null) {
            for (Object entry : rawResults) {
                if (entry instanceof List<?> pair && pair.size() == 2) {
                    results.add(new TsSample(parseLong(pair.get(0)), parseDouble(pair.get(1))));
                }
            }
        }
        return results;
    }

    @SuppressWarnings("unchecked")
    private <T> T dispatch(
            RedisConnection connection,
            ProtocolKeyword command,
            CommandOutput<byte[], byte[], T> output,
            CommandArgs<byte[], byte[]> args) {
        var asyncCommands = (RedisAsyncCommands<byte[], byte[]>) connection.getNativeConnection();
        return asyncCommands.getStatefulConnection().sync().dispatch(command, output, args);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private long parseLong(Object obj) {
        if (obj instanceof Long l) return l;
        if (obj instanceof byte[] raw) return Long.parseLong(new String(raw, StandardCharsets.UTF_8));
        return Long.parseLong(obj.toString());
    }

    private double parseDouble(Object obj) {
        if (obj instanceof Double d) return d;
        if (obj instanceof byte[] raw) return Double.parseDouble(new String(raw, StandardCharsets.UTF_8));
        return Double.parseDouble(obj.toString());
    }

    /**
     * One sample of a TS.RANGE reply.
     *
     * @param timestamp epoch millisecond of the bucket start
     * @param value     aggregated value of the bucket
     */
    public record TsSample(long timestamp, double value) {}
}
