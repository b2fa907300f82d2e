package com.temple.booking.domain.window;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 예약 가능 기간(booking window) 정책 - 순수 도메인 로직
 * - today(포함)부터 horizonMonths 개월 뒤 달의 말일(포함)까지
 * - today는 항상 인자로 받음 (내부에서 시계를 읽지 않음)
 */
@Component
public class WindowPolicy {

    /**
     * 선택 가능한 모든 날짜
     *
     * @param today 오늘
     * @param horizonMonths look-ahead 개월 수
     * @return today ~ windowEnd 오름차순
     */
    public List<LocalDate> allowedDates(LocalDate today, int horizonMonths) {
        LocalDate end = windowEnd(today, horizonMonths);
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = today; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return Collections.unmodifiableList(dates);
    }

    public LocalDate windowEnd(LocalDate today, int horizonMonths) {
        return lastMonth(today, horizonMonths).atEndOfMonth();
    }

    public YearMonth lastMonth(LocalDate today, int horizonMonths) {
        checkHorizon(horizonMonths);
        return YearMonth.from(today).plusMonths(horizonMonths);
    }

    public boolean isAllowed(LocalDate today, int horizonMonths, LocalDate date) {
        return date != null
                && !date.isBefore(today)
                && !date.isAfter(windowEnd(today, horizonMonths));
    }

    /**
     * 보이는 달의 날짜 중 선택 가능한 것만 (일부만 지난 달은 일부만 포함)
     */
    public List<LocalDate> daysOfMonth(CalendarCursor cursor, LocalDate today, int horizonMonths) {
        YearMonth month = cursor.asYearMonth();
        LocalDate end = windowEnd(today, horizonMonths);
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = month.atDay(1); !d.isAfter(month.atEndOfMonth()); d = d.plusDays(1)) {
            if (!d.isBefore(today) && !d.isAfter(end)) {
                days.add(d);
            }
        }
        return Collections.unmodifiableList(days);
    }

    private static void checkHorizon(int horizonMonths) {
        if (horizonMonths < 0) {
            throw new IllegalArgumentException("horizonMonths는 0 이상이어야 합니다: " + horizonMonths);
        }
    }
}
