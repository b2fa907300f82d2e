package com.temple.booking.infrastructure.lock;

import com.temple.booking.application.port.out.KeyedLockPort;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.exception.LockAcquisitionException;
import com.temple.booking.infrastructure.config.BookingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 단일 인스턴스용 홀-날짜 락
 * - 키마다 공정(fair) ReentrantLock 하나
 * - 잡고 있거나 기다리는 스레드가 없으면 테이블에서 제거
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "booking.lock.mode", havingValue = "local", matchIfMissing = true)
public class LocalKeyedLock implements KeyedLockPort {

    private final ConcurrentHashMap<AvailabilityKey, KeyLock> locks = new ConcurrentHashMap<>();
    private final long waitMillis;

    public LocalKeyedLock(BookingProperties properties) {
        this.waitMillis = properties.getLock().getWaitTimeout().toMillis();
    }

    @Override
    public <T> T executeWithLock(AvailabilityKey key, Supplier<T> action) {
        KeyLock lock = locks.compute(key, (k, existing) -> {
            KeyLock target = existing != null ? existing : new KeyLock();
            target.users++;
            return target;
        });

        try {
            if (!tryLock(lock)) {
                throw LockAcquisitionException.timeout(key.asLockKey(), waitMillis);
            }
            try {
                log.debug("락 획득 성공: key={}", key.asLockKey());
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private boolean tryLock(KeyLock lock) {
        try {
            return lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생", e);
        }
    }

    private static final class KeyLock extends ReentrantLock {
        // compute 안에서만 변경
        private int users;

        KeyLock() {
            super(true);
        }
    }
}
