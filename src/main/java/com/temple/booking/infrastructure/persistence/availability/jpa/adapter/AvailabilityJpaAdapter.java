package com.temple.booking.infrastructure.persistence.availability.jpa.adapter;

import com.temple.booking.application.port.out.AvailabilityRepositoryPort;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.exception.AvailabilityRepositoryUnavailableException;
import com.temple.booking.infrastructure.persistence.availability.jpa.entity.AvailabilityRecordJpaEntity;
import com.temple.booking.infrastructure.persistence.availability.jpa.repository.AvailabilityRecordJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA 기반 가용성 저장소 어댑터
 * - 경합 패배(제약 위반, 버전 충돌, 락 경합)는 empty 로
 * - 그 외 데이터 접근 오류는 AvailabilityRepositoryUnavailableException 으로
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityJpaAdapter implements AvailabilityRepositoryPort {

    private final AvailabilityRecordJpaRepository repository;
    private final AvailabilityTransactionService transactionService;

    @Override
    @Transactional(readOnly = true)
    public List<AvailabilityRecord> findAll() {
        try {
            return repository.findAllByOrderByHallIdAscBookingDateAsc().stream()
                    .map(AvailabilityRecordJpaEntity::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw unavailable("가용성 전체 조회 실패", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AvailabilityRecord> find(AvailabilityKey key) {
        try {
            return repository.findByHallIdAndBookingDate(key.hallId(), key.date())
                    .map(AvailabilityRecordJpaEntity::toDomain);
        } catch (DataAccessException e) {
            throw unavailable("가용성 조회 실패: " + key.toDisplayString(), e);
        }
    }

    @Override
    public Optional<AvailabilityRecord> compareAndSet(AvailabilityRecord expected, AvailabilityRecord next) {
        try {
            return transactionService.compareAndSet(expected, next);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException
                 | PessimisticLockingFailureException e) {
            log.warn("compare-and-set 경합: {} ({})", expected.key().toDisplayString(), e.getClass().getSimpleName());
            return Optional.empty();
        } catch (DataAccessException | TransactionException e) {
            throw unavailable("가용성 저장 실패: " + expected.key().toDisplayString(), e);
        }
    }

    @Override
    public int releaseExpiredHolds(Instant now) {
        try {
            return transactionService.releaseExpiredHolds(now);
        } catch (DataAccessException | TransactionException e) {
            throw unavailable("만료 홀드 정리 실패", e);
        }
    }

    private static AvailabilityRepositoryUnavailableException unavailable(String message, Exception cause) {
        log.error("{}: {}", message, cause.getMessage());
        return new AvailabilityRepositoryUnavailableException(message, cause);
    }
}
