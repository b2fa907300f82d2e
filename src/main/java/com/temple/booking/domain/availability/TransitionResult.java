package com.temple.booking.domain.availability;

import java.time.Instant;

/**
 * 상태 전이 결과
 *
 * @param outcome 전이 결과 구분
 * @param key 대상 홀-날짜
 * @param status 전이 후(실패 시 현재) 상태
 * @param holdExpiresAt 홀드 만료 시각 (홀드가 아니면 null)
 */
public record TransitionResult(
        TransitionOutcome outcome,
        AvailabilityKey key,
        DateStatus status,
        Instant holdExpiresAt
) {

    public static TransitionResult applied(AvailabilityRecord record) {
        return new TransitionResult(TransitionOutcome.APPLIED, record.key(), record.status(), record.holdExpiresAt());
    }

    public static TransitionResult unchanged(AvailabilityKey key, DateStatus current) {
        return new TransitionResult(TransitionOutcome.UNCHANGED, key, current, null);
    }

    public static TransitionResult conflict(AvailabilityKey key, DateStatus current) {
        return new TransitionResult(TransitionOutcome.CONFLICT, key, current, null);
    }

    public static TransitionResult notBooked(AvailabilityKey key) {
        return new TransitionResult(TransitionOutcome.NOT_BOOKED, key, DateStatus.available(), null);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public boolean isConflict() {
        return outcome == TransitionOutcome.CONFLICT;
    }
}
