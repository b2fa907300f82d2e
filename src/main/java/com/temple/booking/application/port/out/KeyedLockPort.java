package com.temple.booking.application.port.out;

import com.temple.booking.domain.availability.AvailabilityKey;

import java.util.function.Supplier;

/**
 * 홀-날짜 단위 직렬화 포트
 * - 같은 키의 작업은 한 번에 하나만 실행
 * - 다른 키끼리는 서로 막지 않음
 */
public interface KeyedLockPort {

    /**
     * 락을 획득하고 작업을 실행
     *
     * @param key 홀-날짜
     * @param action 실행할 작업
     * @return 작업 결과
     * @throws com.temple.booking.domain.availability.exception.LockAcquisitionException 획득 실패 시
     */
    <T> T executeWithLock(AvailabilityKey key, Supplier<T> action);
}
