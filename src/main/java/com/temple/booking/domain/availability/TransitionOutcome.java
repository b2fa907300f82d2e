package com.temple.booking.domain.availability;

public enum TransitionOutcome {
    // 상태가 바뀜
    APPLIED,
    // 이미 목표 상태라 아무 것도 하지 않음 (release on AVAILABLE)
    UNCHANGED,
    // 현재 상태가 요청한 전이를 허용하지 않음
    CONFLICT,
    // 예약된 적 없는 날짜의 취소
    NOT_BOOKED;

    public boolean isSuccess() {
        return this == APPLIED || this == UNCHANGED;
    }
}
