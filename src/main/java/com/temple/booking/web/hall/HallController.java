package com.temple.booking.web.hall;

import com.temple.booking.application.port.in.AvailabilityQueryUseCase;
import com.temple.booking.application.session.BookingSession;
import com.temple.booking.application.session.BookingSessionFactory;
import com.temple.booking.domain.window.CalendarCursor;
import com.temple.booking.web.common.ApiResponse;
import com.temple.booking.web.hall.dto.AvailabilityItemResponse;
import com.temple.booking.web.hall.dto.CalendarMonthResponse;
import com.temple.booking.web.hall.dto.HallResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/halls")
@RequiredArgsConstructor
public class HallController {

    private final AvailabilityQueryUseCase availabilityQuery;
    private final BookingSessionFactory sessionFactory;

    // 홀 목록
    @GetMapping
    public ResponseEntity<ApiResponse<List<HallResponse>>> getHalls() {
        var halls = availabilityQuery.getHalls().stream()
                .map(HallResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(halls));
    }

    // 전체 홀의 홀드/예약 현황
    @GetMapping("/availability")
    public ResponseEntity<ApiResponse<List<AvailabilityItemResponse>>> getAvailability() {
        var items = availabilityQuery.getAvailability().stream()
                .map(AvailabilityItemResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(items));
    }

    // 홀 하나의 달력 (상세 화면)
    @GetMapping("/{hallId}/calendar")
    public ResponseEntity<ApiResponse<CalendarMonthResponse>> getCalendar(
            @PathVariable int hallId,
            @RequestParam(required = false) String surface,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) String nav) {

        availabilityQuery.getHall(hallId);
        BookingSession session = navigate(sessionFactory.open(surface, null, cursorOf(year, month)), nav);
        return ResponseEntity.ok(ApiResponse.ok(CalendarMonthResponse.from(session.monthView(hallId))));
    }

    // 여러 홀 한 화면 (목록 화면)
    @GetMapping("/overview")
    public ResponseEntity<ApiResponse<List<CalendarMonthResponse>>> getOverview(
            @RequestParam(defaultValue = "hall-overview") String surface,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month,
            @RequestParam(required = false) String nav) {

        BookingSession session = navigate(sessionFactory.open(surface, null, cursorOf(year, month)), nav);
        var views = session.overview().stream()
                .map(CalendarMonthResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(views));
    }

    private static CalendarCursor cursorOf(Integer year, Integer month) {
        if (year == null || month == null) {
            return null;
        }
        return new CalendarCursor(year, month);
    }

    private static BookingSession navigate(BookingSession session, String nav) {
        if (nav == null || nav.isBlank()) {
            return session;
        }
        switch (nav.trim().toLowerCase()) {
            case "prev" -> session.prevMonth();
            case "next" -> session.nextMonth();
            default -> throw new IllegalArgumentException("nav 는 prev 또는 next 여야 합니다: " + nav);
        }
        return session;
    }
}
