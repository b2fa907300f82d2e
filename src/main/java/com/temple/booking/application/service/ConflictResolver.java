package com.temple.booking.application.service;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.application.port.out.AvailabilityRepositoryPort;
import com.temple.booking.application.port.out.KeyedLockPort;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.availability.TransitionResult;
import com.temple.booking.infrastructure.config.BookingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * 홀-날짜 상태 전이의 유일한 쓰기 경로
 *
 * AVAILABLE -> ON_HOLD -> BOOKED, ON_HOLD -> AVAILABLE(release), BOOKED -> AVAILABLE(cancel),
 * AVAILABLE -> BOOKED 허용. 사유는 AVAILABLE 을 거치지 않고 바뀌지 않음.
 *
 * 확인-후-쓰기는 키 단위 락 안에서 실행되고, 저장소의 compare-and-set 이 한 번 더 막음.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConflictResolver {

    private final AvailabilityRepositoryPort repository;
    private final KeyedLockPort keyedLock;
    private final AvailabilityIndex index;
    private final BookingProperties properties;
    private final Clock clock;

    public TransitionResult requestHold(int hallId, LocalDate date, String reason, RequesterId requester) {
        requireReason(reason);
        Objects.requireNonNull(requester, "요청자는 필수입니다");
        AvailabilityKey key = AvailabilityKey.of(hallId, date);

        return keyedLock.executeWithLock(key, () -> {
            Instant now = clock.instant();
            AvailabilityRecord current = load(key);
            DateStatus status = current.effectiveStatus(now);

            if (!status.isAvailable()) {
                log.warn("홀드 거절: {} 현재상태={} requester={}", key.toDisplayString(), status, requester);
                return TransitionResult.conflict(key, status);
            }

            Instant expiresAt = now.plus(properties.getHold().getTtl());
            return write(current, current.toOnHold(reason, requester, expiresAt, now));
        });
    }

    public TransitionResult confirmBooking(int hallId, LocalDate date, String reason, RequesterId requester) {
        requireReason(reason);
        Objects.requireNonNull(requester, "요청자는 필수입니다");
        AvailabilityKey key = AvailabilityKey.of(hallId, date);

        return keyedLock.executeWithLock(key, () -> {
            Instant now = clock.instant();
            AvailabilityRecord current = load(key);
            DateStatus status = current.effectiveStatus(now);

            if (status.isBooked()) {
                log.warn("예약 확정 거절(이미 예약됨): {} requester={}", key.toDisplayString(), requester);
                return TransitionResult.conflict(key, status);
            }
            if (status.isOnHold()
                    && (!current.isHeldBy(requester) || !status.getReason().equals(reason.trim()))) {
                log.warn("예약 확정 거절(다른 홀드): {} 현재상태={} requester={}",
                        key.toDisplayString(), status, requester);
                return TransitionResult.conflict(key, status);
            }

            return write(current, current.toBooked(reason, requester, now));
        });
    }

    public TransitionResult release(int hallId, LocalDate date) {
        return release(AvailabilityKey.of(hallId, date), null);
    }

    /**
     * 요청자 본인의 홀드만 해제
     */
    public TransitionResult release(int hallId, LocalDate date, RequesterId requester) {
        Objects.requireNonNull(requester, "요청자는 필수입니다");
        return release(AvailabilityKey.of(hallId, date), requester);
    }

    public TransitionResult cancel(int hallId, LocalDate date) {
        AvailabilityKey key = AvailabilityKey.of(hallId, date);

        return keyedLock.executeWithLock(key, () -> {
            Instant now = clock.instant();
            AvailabilityRecord current = load(key);
            DateStatus status = current.effectiveStatus(now);

            if (status.isAvailable()) {
                // "이미 해제됨"과 구분하기 위해 성공으로 처리하지 않음
                return TransitionResult.notBooked(key);
            }
            if (status.isOnHold()) {
                return TransitionResult.conflict(key, status);
            }
            return write(current, current.toAvailable(now));
        });
    }

    /**
     * 만료된 홀드를 저장소에서 AVAILABLE 로 정리
     *
     * @return 정리된 건수
     */
    public int releaseExpiredHolds() {
        int released = repository.releaseExpiredHolds(clock.instant());
        if (released > 0) {
            log.info("[홀드만료] 만료된 홀드 {}건 해제", released);
        }
        return released;
    }

    private TransitionResult release(AvailabilityKey key, RequesterId requester) {
        return keyedLock.executeWithLock(key, () -> {
            Instant now = clock.instant();
            AvailabilityRecord current = load(key);
            DateStatus status = current.effectiveStatus(now);

            if (status.isAvailable()) {
                return TransitionResult.unchanged(key, status);
            }
            if (status.isBooked()) {
                return TransitionResult.conflict(key, status);
            }
            if (requester != null && !current.isHeldBy(requester)) {
                log.warn("홀드 해제 거절(다른 요청자): {} requester={}", key.toDisplayString(), requester);
                return TransitionResult.conflict(key, status);
            }
            return write(current, current.toAvailable(now));
        });
    }

    private AvailabilityRecord load(AvailabilityKey key) {
        return repository.find(key).orElseGet(() -> AvailabilityRecord.absent(key));
    }

    private TransitionResult write(AvailabilityRecord expected, AvailabilityRecord next) {
        Optional<AvailabilityRecord> saved = repository.compareAndSet(expected, next);

        if (saved.isEmpty()) {
            // 락 밖의 다른 쓰기(다른 인스턴스, 만료 정리 등)에 졌음
            AvailabilityRecord latest = load(expected.key());
            index.update(latest);
            log.warn("상태 전이 경합 패배: {} 현재상태={}", expected.key().toDisplayString(), latest.status());
            return TransitionResult.conflict(expected.key(), latest.effectiveStatus(clock.instant()));
        }

        AvailabilityRecord record = saved.get();
        index.update(record);
        log.info("상태 전이: {} {} -> {}", record.key().toDisplayString(), expected.status(), record.status());
        return TransitionResult.applied(record);
    }

    private static void requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("사유는 필수입니다");
        }
    }
}
