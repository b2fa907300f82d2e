package com.temple.booking.application.index;

import com.temple.booking.application.port.out.AvailabilityRepositoryPort;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 저장소 레코드의 메모리 투영 (읽기 전용 캐시)
 * - 스냅샷은 불변이며 통째로 교체됨: 읽는 쪽은 이전 또는 새 스냅샷 중 하나만 봄
 * - 상태를 만들어내지 않음. 언제든 버리고 다시 만들 수 있음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityIndex {

    private final AvailabilityRepositoryPort repository;
    private final Clock clock;

    private final Object writeMonitor = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * 전체 투영을 교체
     *
     * @param records 저장소에서 읽은 전체 레코드
     */
    public void refresh(Collection<AvailabilityRecord> records) {
        Snapshot next = Snapshot.of(records, clock.instant());
        synchronized (writeMonitor) {
            snapshot = next;
        }
        log.debug("가용성 인덱스 갱신: {}건", next.size());
    }

    /**
     * 저장소를 다시 읽어 교체 (저장소 장애는 그대로 전파)
     *
     * 읽는 동안 update 로 들어온 더 새로운 버전은 유지. 레코드는 삭제되지 않으므로
     * 읽은 결과에 없는 키는 읽은 뒤에 생긴 것
     */
    public void refreshFromRepository() {
        Snapshot fetched = Snapshot.of(repository.findAll(), clock.instant());
        synchronized (writeMonitor) {
            snapshot = fetched.keepNewer(snapshot);
        }
        log.debug("가용성 인덱스 갱신: {}건", fetched.size());
    }

    /**
     * 한 키만 새 레코드로 바꾼 스냅샷으로 교체
     */
    public void update(AvailabilityRecord record) {
        synchronized (writeMonitor) {
            snapshot = snapshot.with(record);
        }
    }

    public DateStatus statusOf(int hallId, LocalDate date) {
        return recordOf(hallId, date)
                .map(record -> record.effectiveStatus(clock.instant()))
                .orElse(DateStatus.available());
    }

    public Optional<AvailabilityRecord> recordOf(int hallId, LocalDate date) {
        Map<LocalDate, AvailabilityRecord> byDate = snapshot.byHall.get(hallId);
        return byDate == null ? Optional.empty() : Optional.ofNullable(byDate.get(date));
    }

    /**
     * 홀 하나의 알려진 모든 날짜 상태 (날짜 오름차순)
     */
    public Map<LocalDate, DateStatus> allForHall(int hallId) {
        Map<LocalDate, AvailabilityRecord> byDate = snapshot.byHall.get(hallId);
        if (byDate == null) {
            return Collections.emptyMap();
        }
        Instant now = clock.instant();
        Map<LocalDate, DateStatus> result = new TreeMap<>();
        byDate.forEach((date, record) -> result.put(date, record.effectiveStatus(now)));
        return Collections.unmodifiableMap(result);
    }

    public Instant snapshotTakenAt() {
        return snapshot.takenAt;
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), null);

        final Map<Integer, Map<LocalDate, AvailabilityRecord>> byHall;
        final Instant takenAt;

        private Snapshot(Map<Integer, Map<LocalDate, AvailabilityRecord>> byHall, Instant takenAt) {
            this.byHall = byHall;
            this.takenAt = takenAt;
        }

        static Snapshot of(Collection<AvailabilityRecord> records, Instant takenAt) {
            Map<Integer, Map<LocalDate, AvailabilityRecord>> grouped = new HashMap<>();
            for (AvailabilityRecord record : records) {
                AvailabilityKey key = record.key();
                AvailabilityRecord previous = grouped
                        .computeIfAbsent(key.hallId(), id -> new HashMap<>())
                        .put(key.date(), record);
                if (previous != null) {
                    log.warn("중복 가용성 레코드 무시: {}", key.toDisplayString());
                }
            }
            return new Snapshot(freeze(grouped), takenAt);
        }

        Snapshot with(AvailabilityRecord record) {
            Map<Integer, Map<LocalDate, AvailabilityRecord>> copy = new HashMap<>(byHall);
            Map<LocalDate, AvailabilityRecord> byDate = new HashMap<>(copy.getOrDefault(record.key().hallId(), Map.of()));
            byDate.put(record.key().date(), record);
            copy.put(record.key().hallId(), Map.copyOf(byDate));
            return new Snapshot(Map.copyOf(copy), takenAt);
        }

        Snapshot keepNewer(Snapshot current) {
            Map<Integer, Map<LocalDate, AvailabilityRecord>> merged = null;
            for (Map<LocalDate, AvailabilityRecord> byDate : current.byHall.values()) {
                for (AvailabilityRecord record : byDate.values()) {
                    AvailabilityKey key = record.key();
                    AvailabilityRecord read = byHall.getOrDefault(key.hallId(), Map.of()).get(key.date());
                    if (read != null && versionOf(read) >= versionOf(record)) {
                        continue;
                    }
                    if (merged == null) {
                        merged = mutableCopy(byHall);
                    }
                    merged.computeIfAbsent(key.hallId(), id -> new HashMap<>()).put(key.date(), record);
                }
            }
            return merged == null ? this : new Snapshot(freeze(merged), takenAt);
        }

        private static Map<Integer, Map<LocalDate, AvailabilityRecord>> mutableCopy(
                Map<Integer, Map<LocalDate, AvailabilityRecord>> source) {
            Map<Integer, Map<LocalDate, AvailabilityRecord>> copy = new HashMap<>();
            for (Map.Entry<Integer, Map<LocalDate, AvailabilityRecord>> entry : source.entrySet()) {
                copy.put(entry.getKey(), new HashMap<>(entry.getValue()));
            }
            return copy;
        }

        private static long versionOf(AvailabilityRecord record) {
            return record.version() == null ? -1L : record.version();
        }

        int size() {
            return byHall.values().stream().mapToInt(Map::size).sum();
        }

        private static Map<Integer, Map<LocalDate, AvailabilityRecord>> freeze(
                Map<Integer, Map<LocalDate, AvailabilityRecord>> grouped) {
            Map<Integer, Map<LocalDate, AvailabilityRecord>> frozen = new HashMap<>();
            grouped.forEach((hallId, byDate) -> frozen.put(hallId, Map.copyOf(byDate)));
            return Map.copyOf(frozen);
        }
    }
}
