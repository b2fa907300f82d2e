package com.temple.booking.application.service;

import com.temple.booking.application.port.in.AvailabilityQueryUseCase;
import com.temple.booking.application.port.out.AvailabilityRepositoryPort;
import com.temple.booking.application.port.out.HallDirectoryPort;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.exception.HallNotFoundException;
import com.temple.booking.domain.hall.Hall;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class AvailabilityQueryService implements AvailabilityQueryUseCase {

    private final HallDirectoryPort hallDirectory;
    private final AvailabilityRepositoryPort repository;
    private final Clock clock;

    @Override
    public List<Hall> getHalls() {
        return hallDirectory.findAll();
    }

    @Override
    public Hall getHall(int hallId) {
        return hallDirectory.findById(hallId).orElseThrow(() -> new HallNotFoundException(hallId));
    }

    /** 저장소 기준 현황 (인덱스가 아닌 원본을 읽음) */
    @Override
    public List<HallDateView> getAvailability() {
        Map<Integer, Hall> halls = hallDirectory.findAll().stream()
                .collect(Collectors.toMap(Hall::id, Function.identity()));
        Instant now = clock.instant();

        List<HallDateView> views = new ArrayList<>();
        for (AvailabilityRecord record : repository.findAll()) {
            DateStatus status = record.effectiveStatus(now);
            if (status.isAvailable()) {
                continue;
            }
            Hall hall = halls.get(record.key().hallId());
            views.add(new HallDateView(
                    record.key().hallId(),
                    hall == null ? null : hall.name(),
                    record.key().date(),
                    status.getReason(),
                    status.isBooked()
            ));
        }
        views.sort(Comparator.comparingInt(HallDateView::hallId).thenComparing(HallDateView::date));
        return views;
    }
}
