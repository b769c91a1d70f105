package com.signalengine.repository.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.config.RedisConfig;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Latest {@link AggregatedSignal} per instrument, stored as JSON with a 24h TTL.
 *
 * <p>Keys are {@code sig:signal:{VENUE}:{TICKER}}; the set {@code sig:signals:all} indexes
 * the instrument keys written so far. Index entries whose value expired are skipped on read.
 */
@Repository
@RequiredArgsConstructor
public class SignalRedisRepository {

    private static final Logger log = LoggerFactory.getLogger(SignalRedisRepository.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * @throws org.springframework.dao.DataAccessException on Redis failure
     * @throws IllegalArgumentException if the signal cannot be serialized
     */
    public void save(AggregatedSignal signal) {
        String json;
        try {
            json = objectMapper.writeValueAsString(signal);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize signal for " + signal.getInstrument(), e);
        }
        stringRedisTemplate.opsForValue().set(key(signal.getInstrument()), json, RedisConfig.DEFAULT_TTL);
        stringRedisTemplate.opsForSet().add(RedisConfig.KEY_SET_SIGNALS_ALL, signal.getInstrument());
    }

    public Optional<AggregatedSignal> findByInstrument(String instrumentKey) {
        return Optional.ofNullable(stringRedisTemplate.opsForValue().get(key(instrumentKey)))
                .flatMap(json -> parse(instrumentKey, json));
    }

    public List<AggregatedSignal> findAll() {
        Set<String> instrumentKeys = stringRedisTemplate.opsForSet().members(RedisConfig.KEY_SET_SIGNALS_ALL);
        if (instrumentKeys == null || instrumentKeys.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> keys = instrumentKeys.stream().sorted().toList();
        List<String> values = stringRedisTemplate.opsForValue().multiGet(keys.stream().map(this::key).toList());
        if (values == null) {
            return Collections.emptyList();
        }

        return IntStream.range(0, keys.size())
                .filter(i -> values.get(i) != null)
                .mapToObj(i -> parse(keys.get(i), values.get(i)).orElse(null))
                .filter(Objects::nonNull)
                .toList();
    }

    private Optional<AggregatedSignal> parse(String instrumentKey, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, AggregatedSignal.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable signal stored for {}: {}", instrumentKey, e.getMessage());
            return Optional.empty();
        }
    }

    private String key(String instrumentKey) {
        return RedisConfig.KEY_PREFIX_SIGNAL + instrumentKey;
    }
}
