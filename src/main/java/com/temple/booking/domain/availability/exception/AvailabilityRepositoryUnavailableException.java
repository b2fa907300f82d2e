package com.temple.booking.domain.availability.exception;

// 저장소(백엔드) 장애. 이번 시도에서는 상태가 바뀌지 않은 것으로 간주
public class AvailabilityRepositoryUnavailableException extends RuntimeException {
    public AvailabilityRepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
