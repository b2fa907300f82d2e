package com.temple.booking.application.session;

import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.TransitionResult;

import java.time.Instant;

/**
 * 날짜 선택 결과
 *
 * @param outcome 결과 구분
 * @param key 선택한 홀-날짜
 * @param status 선택 후 상태, 거절이면 표시용 현재 상태
 * @param holdExpiresAt 홀드로 수락된 경우 만료 시각
 */
public record SelectionResult(
        SelectionOutcome outcome,
        AvailabilityKey key,
        DateStatus status,
        Instant holdExpiresAt
) {

    public static SelectionResult accepted(TransitionResult transition) {
        return new SelectionResult(SelectionOutcome.ACCEPTED, transition.key(), transition.status(),
                transition.holdExpiresAt());
    }

    public static SelectionResult outOfWindow(AvailabilityKey key) {
        return new SelectionResult(SelectionOutcome.OUT_OF_WINDOW, key, null, null);
    }

    public static SelectionResult unavailable(AvailabilityKey key, DateStatus current) {
        return new SelectionResult(SelectionOutcome.UNAVAILABLE, key, current, null);
    }

    public static SelectionResult staleConflict(AvailabilityKey key, DateStatus current) {
        return new SelectionResult(SelectionOutcome.STALE_CONFLICT, key, current, null);
    }

    public boolean isAccepted() {
        return outcome == SelectionOutcome.ACCEPTED;
    }

    public String reason() {
        return status == null ? null : status.getReason();
    }
}
