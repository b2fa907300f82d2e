package com.temple.booking.domain.window;

import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;

/**
 * 화면에 보이는 달 (세션 단위 임시 상태)
 * - today 가 속한 달 이전, 기간 끝 달 이후로는 이동하지 않음
 * - 경계는 호출마다 현재 today 로 다시 계산 (자정/월 넘김 대응)
 */
public record CalendarCursor(
        int year,
        int month
) {

    public CalendarCursor {
        if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
            throw new IllegalArgumentException("연도가 범위를 벗어났습니다: " + year);
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("월은 1~12 사이여야 합니다: " + month);
        }
    }

    public static CalendarCursor of(YearMonth yearMonth) {
        return new CalendarCursor(yearMonth.getYear(), yearMonth.getMonthValue());
    }

    public static CalendarCursor initial(LocalDate today) {
        return of(YearMonth.from(today));
    }

    public YearMonth asYearMonth() {
        return YearMonth.of(year, month);
    }

    public CalendarCursor prevMonth(LocalDate today, int horizonMonths) {
        CalendarCursor current = clamp(today, horizonMonths);
        YearMonth candidate = current.asYearMonth().minusMonths(1);
        return candidate.isBefore(firstMonth(today)) ? current : of(candidate);
    }

    public CalendarCursor nextMonth(LocalDate today, int horizonMonths) {
        CalendarCursor current = clamp(today, horizonMonths);
        YearMonth candidate = current.asYearMonth().plusMonths(1);
        return candidate.isAfter(lastMonth(today, horizonMonths)) ? current : of(candidate);
    }

    public boolean canGoBack(LocalDate today, int horizonMonths) {
        return clamp(today, horizonMonths).asYearMonth().isAfter(firstMonth(today));
    }

    public boolean canGoForward(LocalDate today, int horizonMonths) {
        return clamp(today, horizonMonths).asYearMonth().isBefore(lastMonth(today, horizonMonths));
    }

    /**
     * 오래된 커서를 현재 경계 안으로 되돌림
     */
    public CalendarCursor clamp(LocalDate today, int horizonMonths) {
        YearMonth current = asYearMonth();
        YearMonth lower = firstMonth(today);
        YearMonth upper = lastMonth(today, horizonMonths);
        if (current.isBefore(lower)) {
            return of(lower);
        }
        if (current.isAfter(upper)) {
            return of(upper);
        }
        return this;
    }

    private static YearMonth firstMonth(LocalDate today) {
        return YearMonth.from(today);
    }

    private static YearMonth lastMonth(LocalDate today, int horizonMonths) {
        if (horizonMonths < 0) {
            throw new IllegalArgumentException("horizonMonths는 0 이상이어야 합니다: " + horizonMonths);
        }
        return YearMonth.from(today).plusMonths(horizonMonths);
    }
}
