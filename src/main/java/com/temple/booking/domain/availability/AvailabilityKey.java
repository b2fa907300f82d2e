package com.temple.booking.domain.availability;

import java.time.LocalDate;

/**
 * 특정 홀의 특정 날짜를 식별하는 Value Object
 * - 가용성 레코드의 유일 키
 * - 예약 직렬화(락)의 단위
 */
public record AvailabilityKey(
        int hallId,
        LocalDate date
) {

    public AvailabilityKey {
        if (hallId <= 0) {
            throw new IllegalArgumentException("홀 ID는 양수여야 합니다: " + hallId);
        }
        if (date == null) {
            throw new IllegalArgumentException("예약 날짜는 필수입니다");
        }
    }

    public static AvailabilityKey of(int hallId, LocalDate date) {
        return new AvailabilityKey(hallId, date);
    }

    public String asLockKey() {
        return hallId + ":" + date;
    }

    public String toDisplayString() {
        return String.format("홀[%d] - 날짜[%s]", hallId, date);
    }
}
