package com.temple.booking.application.port.out;

import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 홀-날짜 상태 저장소 포트
 * - 장애 시 AvailabilityRepositoryUnavailableException
 * - 레코드는 삭제하지 않음 (취소/해제는 AVAILABLE 로의 전이)
 */
public interface AvailabilityRepositoryPort {

    /**
     * 모든 레코드 조회
     *
     * @return 저장된 전체 레코드
     */
    List<AvailabilityRecord> findAll();

    /**
     * 단건 조회
     *
     * @param key 홀-날짜
     * @return 레코드 (없으면 empty, 즉 AVAILABLE)
     */
    Optional<AvailabilityRecord> find(AvailabilityKey key);

    /**
     * 비교 후 쓰기 (키 단위 원자적)
     * - expected 가 저장되지 않은 레코드면 해당 키에 레코드가 없어야 삽입
     * - 저장된 레코드면 버전이 같아야 갱신
     *
     * @param expected 읽었던 레코드
     * @param next 쓸 레코드
     * @return 저장된 레코드 (경합에서 졌으면 empty)
     */
    Optional<AvailabilityRecord> compareAndSet(AvailabilityRecord expected, AvailabilityRecord next);

    /**
     * 만료된 홀드를 AVAILABLE 로 되돌림
     *
     * @param now 기준 시각
     * @return 해제된 건수
     */
    int releaseExpiredHolds(Instant now);
}
