package com.temple.booking.domain.availability;

import java.util.Objects;

/**
 * 홀드/예약을 요청한 호출자 식별자
 * - 인증은 외부 책임이므로 불투명한 문자열로만 다룸
 */
public final class RequesterId {
    private final String value;

    private RequesterId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("요청자 ID는 비어있을 수 없습니다");
        }
        this.value = value.trim();
    }

    public static RequesterId of(String value) {
        return new RequesterId(value);
    }

    /** null 허용 변환 (저장소에서 읽을 때) */
    public static RequesterId ofNullable(String value) {
        return value == null || value.isBlank() ? null : new RequesterId(value);
    }

    public String asString() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return (this == obj) || (obj instanceof RequesterId other && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
