package com.temple.booking.web.common;

import com.temple.booking.domain.availability.exception.AvailabilityRepositoryUnavailableException;
import com.temple.booking.domain.availability.exception.HallNotFoundException;
import com.temple.booking.domain.availability.exception.LockAcquisitionException;
import com.temple.booking.domain.availability.exception.UnknownBookingSurfaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.DateTimeException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ========== 예약 관련 예외 ==========
    @ExceptionHandler(LockAcquisitionException.class)
    ResponseEntity<ApiResponse<Void>> handleLockAcquisition(LockAcquisitionException e) {
        return respond(HttpStatus.CONFLICT, "STALE_CONFLICT", e.getMessage());
    }

    @ExceptionHandler(HallNotFoundException.class)
    ResponseEntity<ApiResponse<Void>> handleHallNotFound(HallNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "HALL_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(UnknownBookingSurfaceException.class)
    ResponseEntity<ApiResponse<Void>> handleUnknownSurface(UnknownBookingSurfaceException e) {
        return respond(HttpStatus.NOT_FOUND, "UNKNOWN_SURFACE", e.getMessage());
    }

    // ========== 저장소 장애 ==========
    @ExceptionHandler(AvailabilityRepositoryUnavailableException.class)
    ResponseEntity<ApiResponse<Void>> handleRepositoryUnavailable(AvailabilityRepositoryUnavailableException e) {
        log.error("저장소 장애: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "REPOSITORY_UNAVAILABLE", "예약 저장소를 사용할 수 없습니다");
    }

    // ========== 요청 검증 ==========
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("잘못된 요청입니다");
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "요청 본문을 읽을 수 없습니다");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    ResponseEntity<ApiResponse<Void>> handleMissingHeader(MissingRequestHeaderException e) {
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getName() + " 값이 올바르지 않습니다");
    }

    @ExceptionHandler(DateTimeException.class)
    ResponseEntity<ApiResponse<Void>> handleDateTime(DateTimeException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage());
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiResponse<Void>> handleIllegalState(IllegalStateException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_STATE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "서버 내부 오류가 발생했습니다");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(status.value(), code, message));
    }
}
