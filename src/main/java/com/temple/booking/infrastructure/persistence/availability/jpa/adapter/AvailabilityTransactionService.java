package com.temple.booking.infrastructure.persistence.availability.jpa.adapter;

import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateState;
import com.temple.booking.infrastructure.persistence.availability.jpa.entity.AvailabilityRecordJpaEntity;
import com.temple.booking.infrastructure.persistence.availability.jpa.repository.AvailabilityRecordJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 키 하나의 compare-and-set 을 독립 트랜잭션으로 실행
 * - 제약 위반 예외는 호출자(어댑터)가 트랜잭션 밖에서 처리
 */
@Service
@RequiredArgsConstructor
public class AvailabilityTransactionService {

    private final AvailabilityRecordJpaRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<AvailabilityRecord> compareAndSet(AvailabilityRecord expected, AvailabilityRecord next) {
        AvailabilityKey key = expected.key();
        Optional<AvailabilityRecordJpaEntity> existing =
                repository.findByHallIdAndBookingDateWithLock(key.hallId(), key.date());

        if (!expected.isPersisted()) {
            if (existing.isPresent()) {
                return Optional.empty(); // 그 사이 다른 요청이 먼저 생성
            }
            AvailabilityRecordJpaEntity created = repository.saveAndFlush(new AvailabilityRecordJpaEntity(next));
            return Optional.of(created.toDomain());
        }

        if (existing.isEmpty() || !Objects.equals(existing.get().getVersion(), expected.version())) {
            return Optional.empty(); // 버전 불일치
        }

        AvailabilityRecordJpaEntity entity = existing.get();
        entity.apply(next);
        return Optional.of(repository.saveAndFlush(entity).toDomain());
    }

    @Transactional
    public int releaseExpiredHolds(Instant now) {
        return repository.releaseExpiredHolds(DateState.ON_HOLD, DateState.AVAILABLE, now);
    }
}
