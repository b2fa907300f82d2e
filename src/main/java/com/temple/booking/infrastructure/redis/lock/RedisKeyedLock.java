package com.temple.booking.infrastructure.redis.lock;

import com.temple.booking.application.port.out.KeyedLockPort;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.exception.LockAcquisitionException;
import com.temple.booking.infrastructure.config.BookingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis 기반 홀-날짜 분산락 (여러 인스턴스 배포용)
 * - SETNX 로 락 획득
 * - 소유권 확인과 삭제를 Lua 스크립트 하나로 해제
 * - Retry 로직 포함
 */
@Component
@ConditionalOnProperty(name = "booking.lock.mode", havingValue = "redis")
public class RedisKeyedLock implements KeyedLockPort {
    private static final String LOCK_PREFIX = "lock:availability:";
    private static final Logger log = LoggerFactory.getLogger(RedisKeyedLock.class);

    // 값이 내 토큰일 때만 삭제
    private static final DefaultRedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
                return redis.call('DEL', KEYS[1])
            else
                return 0
            end
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final long ttlSeconds;
    private final int retryCount;
    private final long retryDelayMillis;

    public RedisKeyedLock(StringRedisTemplate redisTemplate, BookingProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttlSeconds = properties.getLock().getTtlSeconds();
        this.retryCount = properties.getLock().getRetryCount();
        this.retryDelayMillis = properties.getLock().getRetryDelayMillis();
    }

    public static String buildLockKey(AvailabilityKey key) {
        return LOCK_PREFIX + key.asLockKey();
    }

    @Override
    public <T> T executeWithLock(AvailabilityKey key, Supplier<T> action) {
        String lockKey = buildLockKey(key);
        String lockValue = UUID.randomUUID().toString();
        int attempts = 0;

        while (attempts < retryCount) {
            if (tryLock(lockKey, lockValue)) {
                try {
                    log.debug("락 획득 성공: key={}, value={}", lockKey, lockValue);
                    return action.get();
                } finally {
                    if (unlock(lockKey, lockValue)) {
                        log.debug("락 해제 성공: key={}", lockKey);
                    } else {
                        log.warn("락 해제 실패: key={} (이미 만료되었거나 다른 소유자)", lockKey);
                    }
                }
            }

            attempts++;
            if (attempts < retryCount) {
                log.debug("락 획득 실패, 재시도 {}/{}: key={}", attempts, retryCount, lockKey);
                sleep(retryDelayMillis);
            }
        }

        throw LockAcquisitionException.of(lockKey, retryCount);
    }

    boolean tryLock(String key, String value) {
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds));
        return Boolean.TRUE.equals(success);
    }

    boolean unlock(String key, String value) {
        Long deleted = redisTemplate.execute(UNLOCK_SCRIPT, List.of(key), value);
        return deleted != null && deleted > 0;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생", e);
        }
    }
}
