package com.temple.booking.application.session;

public enum SelectionOutcome {
    ACCEPTED,
    // 현재 선택 가능한 기간 밖 (다른 날짜를 고르면 됨)
    OUT_OF_WINDOW,
    // 이미 홀드/예약된 날짜
    UNAVAILABLE,
    // 확인 시점엔 비어 있었지만 경합에서 짐 (인덱스 갱신 후 재시도)
    STALE_CONFLICT
}
