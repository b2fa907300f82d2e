package com.temple.booking.domain.availability;

import java.util.Locale;

/**
 * 예약 사유의 표시용 분류
 * - 상태 전이 판단에는 절대 사용하지 않음
 * - 사유 텍스트에서 한 번만 도출 (우선순위: Wedding, Upanayana, Reception)
 */
public enum BookingCategory {
    WEDDING("wedding"),
    UPANAYANA("upanayana"),
    RECEPTION("reception"),
    OTHERS(null);

    private final String keyword;

    BookingCategory(String keyword) {
        this.keyword = keyword;
    }

    public static BookingCategory classify(String reason) {
        if (reason == null || reason.isBlank()) {
            return OTHERS;
        }
        String normalized = reason.toLowerCase(Locale.ROOT);
        for (BookingCategory category : values()) {
            if (category.keyword != null && normalized.contains(category.keyword)) {
                return category;
            }
        }
        return OTHERS;
    }
}
