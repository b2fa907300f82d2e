package com.temple.booking.domain.window;

/**
 * 예약 화면 하나의 설정
 * - 화면마다 다른 것은 look-ahead 길이와 선택 흐름뿐, 정책 로직은 동일
 */
public record BookingSurface(
        String name,
        int horizonMonths,
        SelectionFlow flow
) {

    public BookingSurface {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("화면 이름은 필수입니다");
        }
        if (horizonMonths < 0) {
            throw new IllegalArgumentException("horizonMonths는 0 이상이어야 합니다: " + horizonMonths);
        }
        if (flow == null) {
            flow = SelectionFlow.HOLD;
        }
    }
}
