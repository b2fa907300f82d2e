package com.temple.booking.application.port.in;

import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.hall.Hall;

import java.time.LocalDate;
import java.util.List;

public interface AvailabilityQueryUseCase {
    List<Hall> getHalls();
    Hall getHall(int hallId);
    List<HallDateView> getAvailability();

    // AVAILABLE 이 아닌 홀-날짜 하나 (만료된 홀드는 제외)
    record HallDateView(
            int hallId,
            String hallName,
            LocalDate date,
            String reason,
            boolean booked
    ) {

        // reason + is_booked 형식에서 상태 복원
        public DateStatus status() {
            return DateStatus.fromRepository(reason, booked);
        }
    }
}
