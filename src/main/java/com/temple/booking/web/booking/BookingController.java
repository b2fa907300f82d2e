package com.temple.booking.web.booking;

import com.temple.booking.application.port.in.AvailabilityQueryUseCase;
import com.temple.booking.application.service.ConflictResolver;
import com.temple.booking.application.session.BookingSession;
import com.temple.booking.application.session.BookingSessionFactory;
import com.temple.booking.application.session.SelectionResult;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.availability.TransitionResult;
import com.temple.booking.web.booking.dto.*;
import com.temple.booking.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 날짜 선택/확정/해제/취소
 * - 200 성공, 400 기간 밖, 409 이미 점유 또는 경합, 503 저장소 장애
 */
@RestController
@RequestMapping("/api/halls/{hallId}")
@RequiredArgsConstructor
@Validated
public class BookingController {

    private static final String HEADER_REQUESTER_ID = "X-Requester-Id";

    private final BookingSessionFactory sessionFactory;
    private final ConflictResolver conflictResolver;
    private final AvailabilityQueryUseCase availabilityQuery;

    // 날짜 선택 (화면 설정에 따라 홀드 또는 바로 예약)
    @PostMapping("/selections")
    public ResponseEntity<ApiResponse<SelectionResponse>> selectDate(
            @PathVariable int hallId,
            @RequestHeader(HEADER_REQUESTER_ID) String requesterId,
            @RequestBody @Validated SelectDateRequest request) {

        availabilityQuery.getHall(hallId);
        BookingSession session = sessionFactory.open(request.surface(), RequesterId.of(requesterId));
        SelectionResult result = session.selectDate(hallId, request.date(), request.reason());

        HttpStatus status = switch (result.outcome()) {
            case ACCEPTED -> HttpStatus.OK;
            case OUT_OF_WINDOW -> HttpStatus.BAD_REQUEST;
            case UNAVAILABLE, STALE_CONFLICT -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status)
                .body(ApiResponse.of(status.value(), result.outcome().name(), messageOf(result), SelectionResponse.from(result)));
    }

    // 본인 홀드 확정 (또는 빈 날짜 바로 예약)
    @PostMapping("/bookings/confirm")
    public ResponseEntity<ApiResponse<TransitionResponse>> confirmBooking(
            @PathVariable int hallId,
            @RequestHeader(HEADER_REQUESTER_ID) String requesterId,
            @RequestBody @Validated ConfirmBookingRequest request) {

        availabilityQuery.getHall(hallId);
        BookingSession session = sessionFactory.open(request.surface(), RequesterId.of(requesterId));
        return respond(session.confirm(hallId, request.date(), request.reason()));
    }

    // 본인 홀드 해제
    @PostMapping("/holds/release")
    public ResponseEntity<ApiResponse<TransitionResponse>> releaseHold(
            @PathVariable int hallId,
            @RequestHeader(HEADER_REQUESTER_ID) String requesterId,
            @RequestBody @Validated DateRequest request) {

        BookingSession session = sessionFactory.open(request.surface(), RequesterId.of(requesterId));
        return respond(session.abandon(hallId, request.date()));
    }

    // 예약 취소
    @PostMapping("/bookings/cancel")
    public ResponseEntity<ApiResponse<TransitionResponse>> cancelBooking(
            @PathVariable int hallId,
            @RequestBody @Validated DateRequest request) {

        return respond(conflictResolver.cancel(hallId, request.date()));
    }

    private static ResponseEntity<ApiResponse<TransitionResponse>> respond(TransitionResult result) {
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.CONFLICT;
        return ResponseEntity.status(status)
                .body(ApiResponse.of(status.value(), result.outcome().name(), result.outcome().name(),
                        TransitionResponse.from(result)));
    }

    private static String messageOf(SelectionResult result) {
        return switch (result.outcome()) {
            case ACCEPTED -> "선택한 날짜가 접수되었습니다";
            case OUT_OF_WINDOW -> "선택할 수 없는 기간입니다";
            case UNAVAILABLE -> "이미 점유된 날짜입니다: " + result.reason();
            case STALE_CONFLICT -> "다른 요청이 먼저 처리되었습니다. 다시 시도해 주세요";
        };
    }
}
