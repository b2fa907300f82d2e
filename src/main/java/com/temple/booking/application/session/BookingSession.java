package com.temple.booking.application.session;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.application.port.out.HallDirectoryPort;
import com.temple.booking.application.service.ConflictResolver;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.availability.TransitionResult;
import com.temple.booking.domain.availability.exception.AvailabilityRepositoryUnavailableException;
import com.temple.booking.domain.availability.exception.HallNotFoundException;
import com.temple.booking.domain.availability.exception.LockAcquisitionException;
import com.temple.booking.domain.hall.Hall;
import com.temple.booking.domain.window.BookingSurface;
import com.temple.booking.domain.window.CalendarCursor;
import com.temple.booking.domain.window.SelectionFlow;
import com.temple.booking.domain.window.WindowPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 한 사용자의 날짜 선택 흐름
 * - 기간 검사 -> 인덱스 검사 -> ConflictResolver 전이 순서
 * - 커서(보이는 달)는 세션이 소유하고 세션과 함께 사라짐
 * - 스레드 안전하지 않음 (사용자 한 명이 순차적으로 사용)
 */
@Slf4j
public class BookingSession {

    private final BookingSurface surface;
    private final RequesterId requester;
    private final WindowPolicy windowPolicy;
    private final AvailabilityIndex index;
    private final ConflictResolver resolver;
    private final HallDirectoryPort hallDirectory;
    private final Clock clock;

    private CalendarCursor cursor;

    BookingSession(BookingSurface surface,
                   RequesterId requester,
                   CalendarCursor cursor,
                   WindowPolicy windowPolicy,
                   AvailabilityIndex index,
                   ConflictResolver resolver,
                   HallDirectoryPort hallDirectory,
                   Clock clock) {
        this.surface = surface;
        this.requester = requester;
        this.windowPolicy = windowPolicy;
        this.index = index;
        this.resolver = resolver;
        this.hallDirectory = hallDirectory;
        this.clock = clock;
        this.cursor = cursor == null ? CalendarCursor.initial(today()) : cursor.clamp(today(), surface.horizonMonths());
    }

    public SelectionResult selectDate(int hallId, LocalDate date, String reason) {
        RequesterId caller = requireRequester();
        AvailabilityKey key = AvailabilityKey.of(hallId, date);

        if (!windowPolicy.isAllowed(today(), surface.horizonMonths(), date)) {
            return SelectionResult.outOfWindow(key);
        }

        DateStatus known = index.statusOf(hallId, date);
        if (!known.isAvailable()) {
            return SelectionResult.unavailable(key, known);
        }

        TransitionResult transition;
        try {
            transition = surface.flow() == SelectionFlow.CONFIRM
                    ? resolver.confirmBooking(hallId, date, reason, caller)
                    : resolver.requestHold(hallId, date, reason, caller);
        } catch (LockAcquisitionException e) {
            // 같은 키를 다른 요청이 오래 잡고 있음 -> 경합 패배와 동일하게 처리
            log.warn("선택 락 획득 실패: {} - {}", key.toDisplayString(), e.getMessage());
            refreshIndex(key);
            return SelectionResult.staleConflict(key, index.statusOf(hallId, date));
        }

        refreshIndex(key);

        if (!transition.isSuccess()) {
            log.info("선택 경합 패배: {} surface={} requester={}", key.toDisplayString(), surface.name(), caller);
            return SelectionResult.staleConflict(key, transition.status());
        }
        return SelectionResult.accepted(transition);
    }

    /**
     * 본인 홀드를 예약으로 확정
     */
    public TransitionResult confirm(int hallId, LocalDate date, String reason) {
        TransitionResult result = resolver.confirmBooking(hallId, date, reason, requireRequester());
        refreshIndex(result.key());
        return result;
    }

    /**
     * 확정하지 않고 떠날 때 본인 홀드 해제
     */
    public TransitionResult abandon(int hallId, LocalDate date) {
        TransitionResult result = resolver.release(hallId, date, requireRequester());
        refreshIndex(result.key());
        return result;
    }

    public CalendarCursor prevMonth() {
        cursor = cursor.prevMonth(today(), surface.horizonMonths());
        return cursor;
    }

    public CalendarCursor nextMonth() {
        cursor = cursor.nextMonth(today(), surface.horizonMonths());
        return cursor;
    }

    public CalendarCursor cursor() {
        cursor = cursor.clamp(today(), surface.horizonMonths());
        return cursor;
    }

    public MonthView monthView(int hallId) {
        Hall hall = hallDirectory.findById(hallId).orElseThrow(() -> new HallNotFoundException(hallId));
        return monthView(hall);
    }

    /**
     * 여러 홀을 한 화면에 (같은 달)
     */
    public List<MonthView> overview() {
        return hallDirectory.findAll().stream()
                .map(this::monthView)
                .toList();
    }

    public BookingSurface surface() {
        return surface;
    }

    private MonthView monthView(Hall hall) {
        LocalDate today = today();
        CalendarCursor visible = cursor();
        List<MonthView.DayView> days = windowPolicy.daysOfMonth(visible, today, surface.horizonMonths()).stream()
                .map(day -> new MonthView.DayView(day, index.statusOf(hall.id(), day)))
                .toList();
        return new MonthView(
                surface.name(),
                hall,
                visible,
                visible.canGoBack(today, surface.horizonMonths()),
                visible.canGoForward(today, surface.horizonMonths()),
                days
        );
    }

    /**
     * 전이 후 인덱스 재조회. 실패해도 결과는 그대로 반환
     * (전이한 키는 ConflictResolver 가 이미 인덱스에 반영함)
     */
    private void refreshIndex(AvailabilityKey key) {
        try {
            index.refreshFromRepository();
        } catch (AvailabilityRepositoryUnavailableException e) {
            log.warn("인덱스 재조회 실패, 다음 갱신까지 캐시 유지: {} - {}", key.toDisplayString(), e.getMessage());
        }
    }

    private RequesterId requireRequester() {
        if (requester == null) {
            throw new IllegalStateException("요청자 없이 날짜를 선택할 수 없습니다");
        }
        return requester;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
