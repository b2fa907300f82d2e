package com.temple.booking.domain.availability;

import java.util.Objects;

/**
 * 홀-날짜의 상태 Value Object
 * - AVAILABLE / ON_HOLD(reason) / BOOKED(reason) 세 가지뿐
 * - reason은 표시용 자유 텍스트, category는 reason에서 도출
 */
public final class DateStatus {

    private static final DateStatus AVAILABLE = new DateStatus(DateState.AVAILABLE, null);

    private final DateState state;
    private final String reason;
    private final BookingCategory category;

    private DateStatus(DateState state, String reason) {
        this.state = Objects.requireNonNull(state, "상태는 필수입니다");
        if (state != DateState.AVAILABLE && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException(state + " 상태에는 사유가 필요합니다");
        }
        this.reason = state == DateState.AVAILABLE ? null : reason.trim();
        this.category = state == DateState.AVAILABLE ? null : BookingCategory.classify(this.reason);
    }

    public static DateStatus available() {
        return AVAILABLE;
    }

    public static DateStatus onHold(String reason) {
        return new DateStatus(DateState.ON_HOLD, reason);
    }

    public static DateStatus booked(String reason) {
        return new DateStatus(DateState.BOOKED, reason);
    }

    public static DateStatus of(DateState state, String reason) {
        return state == DateState.AVAILABLE ? AVAILABLE : new DateStatus(state, reason);
    }

    /**
     * 외부 저장소 형식(reason + is_booked)을 상태로 정규화
     * - is_booked 이면 BOOKED
     * - 사유만 있으면 ON_HOLD
     * - 둘 다 없으면 AVAILABLE
     */
    public static DateStatus fromRepository(String reason, boolean booked) {
        boolean hasReason = reason != null && !reason.isBlank();
        if (booked) {
            return booked(hasReason ? reason : DateState.BOOKED.getDisplayName());
        }
        return hasReason ? onHold(reason) : AVAILABLE;
    }

    public boolean isAvailable() {
        return state == DateState.AVAILABLE;
    }

    public boolean isOnHold() {
        return state == DateState.ON_HOLD;
    }

    public boolean isBooked() {
        return state == DateState.BOOKED;
    }

    // === Getters ===

    public DateState getState() {
        return state;
    }

    public String getReason() {
        return reason;
    }

    public BookingCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        DateStatus that = (DateStatus) obj;
        return state == that.state && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, reason);
    }

    @Override
    public String toString() {
        return reason == null ? state.name() : String.format("%s(%s)", state, reason);
    }
}
