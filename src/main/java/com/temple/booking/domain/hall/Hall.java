package com.temple.booking.domain.hall;

import java.util.List;

/**
 * 예약 가능한 홀 (외부 홀 관리 기능이 소유, 여기서는 읽기 전용)
 */
public record Hall(
        int id,
        String name,
        String description,
        List<String> images
) {

    public Hall {
        if (id <= 0) {
            throw new IllegalArgumentException("홀 ID는 양수여야 합니다: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("홀 이름은 필수입니다");
        }
        images = images == null ? List.of() : List.copyOf(images);
    }
}
