package com.temple.booking.infrastructure.persistence.availability.jpa.repository;

import com.temple.booking.domain.availability.DateState;
import com.temple.booking.infrastructure.persistence.availability.jpa.entity.AvailabilityRecordJpaEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface AvailabilityRecordJpaRepository extends JpaRepository<AvailabilityRecordJpaEntity, Long> {

    Optional<AvailabilityRecordJpaEntity> findByHallIdAndBookingDate(Integer hallId, LocalDate bookingDate);

    // 비관적 락 - compare-and-set 용
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AvailabilityRecordJpaEntity a " +
            "WHERE a.hallId = :hallId " +
            "AND a.bookingDate = :bookingDate")
    Optional<AvailabilityRecordJpaEntity> findByHallIdAndBookingDateWithLock(
            @Param("hallId") Integer hallId,
            @Param("bookingDate") LocalDate bookingDate
    );

    List<AvailabilityRecordJpaEntity> findAllByOrderByHallIdAscBookingDateAsc();

    // 만료된 홀드 일괄 해제 (버전 증가로 진행 중인 compare-and-set 을 무효화)
    @Modifying(clearAutomatically = true)
    @Query("UPDATE AvailabilityRecordJpaEntity a " +
            "SET a.state = :available, a.reason = null, a.holderId = null, " +
            "a.holdExpiresAt = null, a.updatedAt = :now, a.version = a.version + 1 " +
            "WHERE a.state = :onHold " +
            "AND a.holdExpiresAt <= :now")
    int releaseExpiredHolds(
            @Param("onHold") DateState onHold,
            @Param("available") DateState available,
            @Param("now") Instant now
    );
}
