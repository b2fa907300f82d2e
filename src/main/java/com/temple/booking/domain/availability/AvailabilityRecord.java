package com.temple.booking.domain.availability;

import java.time.Instant;
import java.util.Objects;

/**
 * 홀-날짜 하나의 저장된 상태
 * - version == null 이면 아직 저장소에 없는 레코드 (암묵적 AVAILABLE)
 * - holdExpiresAt 이 지난 홀드는 AVAILABLE 로 읽힘
 */
public record AvailabilityRecord(
        AvailabilityKey key,
        DateStatus status,
        RequesterId holderId,
        Instant holdExpiresAt,
        Instant updatedAt,
        Long version
) {

    public AvailabilityRecord {
        Objects.requireNonNull(key, "키는 필수입니다");
        Objects.requireNonNull(status, "상태는 필수입니다");
        if (status.isAvailable()) {
            holderId = null;
            holdExpiresAt = null;
        }
        if (!status.isOnHold()) {
            holdExpiresAt = null;
        }
    }

    public static AvailabilityRecord absent(AvailabilityKey key) {
        return new AvailabilityRecord(key, DateStatus.available(), null, null, null, null);
    }

    public boolean isPersisted() {
        return version != null;
    }

    /**
     * 만료를 반영한 실제 상태
     *
     * @param now 현재 시각
     * @return 만료된 홀드는 AVAILABLE, 그 외는 저장된 상태
     */
    public DateStatus effectiveStatus(Instant now) {
        if (isHoldExpired(now)) {
            return DateStatus.available();
        }
        return status;
    }

    public boolean isHoldExpired(Instant now) {
        return status.isOnHold() && holdExpiresAt != null && !now.isBefore(holdExpiresAt);
    }

    public boolean isHeldBy(RequesterId requester) {
        return holderId != null && holderId.equals(requester);
    }

    // === 전이 결과 생성 (키/버전 유지) ===

    public AvailabilityRecord toOnHold(String reason, RequesterId requester, Instant expiresAt, Instant now) {
        return new AvailabilityRecord(key, DateStatus.onHold(reason), requester, expiresAt, now, version);
    }

    public AvailabilityRecord toBooked(String reason, RequesterId requester, Instant now) {
        return new AvailabilityRecord(key, DateStatus.booked(reason), requester, null, now, version);
    }

    public AvailabilityRecord toAvailable(Instant now) {
        return new AvailabilityRecord(key, DateStatus.available(), null, null, now, version);
    }
}
