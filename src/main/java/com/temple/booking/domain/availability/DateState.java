package com.temple.booking.domain.availability;

public enum DateState {
    AVAILABLE("예약가능"),
    ON_HOLD("임시점유중"),
    BOOKED("예약완료");

    private final String displayName;

    DateState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
