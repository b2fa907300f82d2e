package com.temple.booking.application.scheduler;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.application.service.ConflictResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "booking.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AvailabilityMaintenanceScheduler {

    private final ConflictResolver conflictResolver;
    private final AvailabilityIndex availabilityIndex;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUpIndex() {
        refreshIndex();
    }

    /**
     * 확정되지 않고 만료된 홀드 해제
     */
    @Scheduled(fixedDelayString = "${booking.hold.sweep-interval-ms:30000}")
    public void sweepExpiredHolds() {
        try {
            int released = conflictResolver.releaseExpiredHolds();
            if (released > 0) {
                availabilityIndex.refreshFromRepository();
            }
        } catch (Exception e) {
            log.error("[홀드만료] 처리 중 오류 발생", e);
        }
    }

    /**
     * 인덱스 주기 갱신 (다른 인스턴스의 변경 반영)
     */
    @Scheduled(
            fixedDelayString = "${booking.index.refresh-interval-ms:60000}",
            initialDelayString = "${booking.index.refresh-interval-ms:60000}"
    )
    public void refreshIndex() {
        try {
            availabilityIndex.refreshFromRepository();
        } catch (Exception e) {
            log.error("[인덱스갱신] 처리 중 오류 발생", e);
        }
    }
}
