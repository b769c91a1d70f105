package com.signalengine.unit.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalengine.exception.DuplicateJobException;
import com.signalengine.job.JobDeduplicator;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

@ExtendWith(MockitoExtension.class)
class JobDeduplicatorTest {

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private JobDeduplicator jobDeduplicator;

    @BeforeEach
    void setUp() {
        jobDeduplicator = new JobDeduplicator(stringRedisTemplate);
    }

    @Test
    @DisplayName("Claim sets the key only if absent, with the job timeout as TTL")
    void claimUsesSetIfAbsent() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("sig:job:dedup:bf:HOSE:VIC", "job-1", Duration.ofMinutes(30)))
                .thenReturn(true);

        jobDeduplicator.claim("bf:HOSE:VIC", "job-1", Duration.ofMinutes(30));

        verify(valueOperations).setIfAbsent("sig:job:dedup:bf:HOSE:VIC", "job-1", Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("A held key raises DuplicateJobException")
    void heldKeyIsDuplicate() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(any(), any(), any(Duration.class))).thenReturn(false);

        assertThatThrownBy(() -> jobDeduplicator.claim("bf:HOSE:VIC", "job-2", Duration.ofMinutes(30)))
                .isInstanceOf(DuplicateJobException.class);
    }

    @Test
    @DisplayName("Release deletes only when the key still holds the job id")
    @SuppressWarnings("unchecked")
    void releaseComparesJobId() {
        when(stringRedisTemplate.execute(any(RedisScript.class), eq(List.of("sig:job:dedup:bf:HOSE:VIC")), eq("job-1")))
                .thenReturn(1L);

        assertThat(jobDeduplicator.release("bf:HOSE:VIC", "job-1")).isTrue();
    }

    @Test
    @DisplayName("Release of a key taken over by another job is a no-op")
    @SuppressWarnings("unchecked")
    void releaseOfForeignKey() {
        when(stringRedisTemplate.execute(any(RedisScript.class), eq(List.of("sig:job:dedup:bf:HOSE:VIC")), eq("job-1")))
                .thenReturn(0L);

        assertThat(jobDeduplicator.release("bf:HOSE:VIC", "job-1")).isFalse();
    }
}
