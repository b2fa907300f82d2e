package com.temple.booking.domain.window;

// 날짜 선택 시 수행할 전이
public enum SelectionFlow {
    HOLD,
    CONFIRM
}
