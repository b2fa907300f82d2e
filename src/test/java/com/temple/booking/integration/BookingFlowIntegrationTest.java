package com.temple.booking.integration;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.application.port.in.AvailabilityQueryUseCase;
import com.temple.booking.application.port.in.AvailabilityQueryUseCase.HallDateView;
import com.temple.booking.application.port.out.AvailabilityRepositoryPort;
import com.temple.booking.application.service.ConflictResolver;
import com.temple.booking.application.session.BookingSession;
import com.temple.booking.application.session.BookingSessionFactory;
import com.temple.booking.application.session.SelectionOutcome;
import com.temple.booking.application.session.SelectionResult;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.availability.TransitionOutcome;
import com.temple.booking.domain.availability.TransitionResult;
import com.temple.booking.infrastructure.persistence.availability.jpa.repository.AvailabilityRecordJpaRepository;
import com.temple.booking.infrastructure.persistence.hall.jpa.entity.HallJpaEntity;
import com.temple.booking.infrastructure.persistence.hall.jpa.repository.HallJpaRepository;
import com.temple.booking.support.MutableClock;
import com.temple.booking.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 선택 -> 확정 -> 취소 전체 흐름 (H2 + JPA 어댑터)
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class BookingFlowIntegrationTest {

    @Autowired
    private BookingSessionFactory sessionFactory;

    @Autowired
    private ConflictResolver conflictResolver;

    @Autowired
    private AvailabilityRepositoryPort repository;

    @Autowired
    private AvailabilityQueryUseCase availabilityQuery;

    @Autowired
    private AvailabilityIndex index;

    @Autowired
    private AvailabilityRecordJpaRepository availabilityJpaRepository;

    @Autowired
    private HallJpaRepository hallJpaRepository;

    @Autowired
    private MutableClock clock;

    private static final int HALL = 3;
    private static final LocalDate DATE = LocalDate.of(2025, 6, 10);

    private final RequesterId userA = RequesterId.of("user-a");
    private final RequesterId userB = RequesterId.of("user-b");

    @BeforeEach
    void setUp() {
        availabilityJpaRepository.deleteAll();
        hallJpaRepository.deleteAll();
        hallJpaRepository.save(new HallJpaEntity(HALL, "Kalyana Mantapa", "Main hall", List.of("main-1.jpg")));
        hallJpaRepository.save(new HallJpaEntity(4, "Annadana Hall", "Dining hall", List.of()));
        clock.setToday(TestClockConfig.TODAY);
        index.refresh(List.of());
    }

    @Test
    @DisplayName("홀드 -> 다른 사용자 거절 -> 확정 -> 취소")
    void 전체_흐름() {
        // given
        BookingSession sessionA = sessionFactory.open("hall-detail", userA);
        BookingSession sessionB = sessionFactory.open("hall-detail", userB);

        // when: A 가 홀드
        SelectionResult held = sessionA.selectDate(HALL, DATE, "Wedding - Sharma");

        // then
        assertThat(held.isAccepted()).isTrue();
        assertThat(held.status()).isEqualTo(DateStatus.onHold("Wedding - Sharma"));

        // when: B 는 인덱스에서 바로 거절
        SelectionResult rejected = sessionB.selectDate(HALL, DATE, "Reception");
        assertThat(rejected.outcome()).isEqualTo(SelectionOutcome.UNAVAILABLE);
        assertThat(rejected.reason()).isEqualTo("Wedding - Sharma");

        // when: A 확정
        TransitionResult confirmed = sessionA.confirm(HALL, DATE, "Wedding - Sharma");
        assertThat(confirmed.outcome()).isEqualTo(TransitionOutcome.APPLIED);

        AvailabilityRecord stored = repository.find(AvailabilityKey.of(HALL, DATE)).orElseThrow();
        assertThat(stored.status().isBooked()).isTrue();
        assertThat(stored.holderId()).isEqualTo(userA);
        assertThat(stored.version()).isEqualTo(1L);

        // when: 취소 후 재취소
        assertThat(conflictResolver.cancel(HALL, DATE).outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(conflictResolver.cancel(HALL, DATE).outcome()).isEqualTo(TransitionOutcome.NOT_BOOKED);
        assertThat(index.statusOf(HALL, DATE).isAvailable()).isTrue();
    }

    @Test
    @DisplayName("같은 정책, 다른 horizon: 목록 화면은 2개월, 상세 화면은 36개월")
    void 화면별_기간() {
        LocalDate farDate = LocalDate.of(2026, 3, 1);

        SelectionResult overview = sessionFactory.open("hall-overview", userA).selectDate(HALL, farDate, "Wedding");
        SelectionResult detail = sessionFactory.open("hall-detail", userA).selectDate(HALL, farDate, "Wedding");

        assertThat(overview.outcome()).isEqualTo(SelectionOutcome.OUT_OF_WINDOW);
        assertThat(detail.outcome()).isEqualTo(SelectionOutcome.ACCEPTED);
    }

    @Test
    void 확정_화면은_바로_예약() {
        SelectionResult result = sessionFactory.open("front-desk", userA).selectDate(HALL, DATE, "Upanayana");

        assertThat(result.isAccepted()).isTrue();
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE)).orElseThrow().status().isBooked()).isTrue();
    }

    @Test
    @DisplayName("15분 안에 확정하지 않은 홀드는 정리되고 다른 사용자가 잡을 수 있다")
    void 홀드_만료() {
        // given
        sessionFactory.open("hall-detail", userA).selectDate(HALL, DATE, "Wedding");

        // when
        clock.advance(Duration.ofMinutes(16));
        int released = conflictResolver.releaseExpiredHolds();

        // then
        assertThat(released).isEqualTo(1);
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE)).orElseThrow().status().isAvailable()).isTrue();
        assertThat(sessionFactory.open("hall-detail", userB).selectDate(HALL, DATE, "Reception").isAccepted()).isTrue();
    }

    @Test
    void 만료_전_홀드는_정리되지_않는다() {
        sessionFactory.open("hall-detail", userA).selectDate(HALL, DATE, "Wedding");
        clock.advance(Duration.ofMinutes(14));

        assertThat(conflictResolver.releaseExpiredHolds()).isZero();
    }

    @Test
    @DisplayName("현황 조회: 홀드/예약만, 홀 이름 포함, 홀-날짜 순")
    void 현황_조회() {
        // given
        conflictResolver.confirmBooking(4, DATE, "Reception", userA);
        conflictResolver.requestHold(HALL, DATE.plusDays(3), "Upanayana", userB);
        conflictResolver.confirmBooking(HALL, DATE, "Wedding", userA);
        conflictResolver.confirmBooking(HALL, DATE.plusDays(1), "Satsang", userA);
        conflictResolver.cancel(HALL, DATE.plusDays(1));

        // when
        List<HallDateView> views = availabilityQuery.getAvailability();

        // then
        assertThat(views).extracting(HallDateView::hallId, HallDateView::date, HallDateView::booked)
                .containsExactly(
                        tuple(HALL, DATE, true),
                        tuple(HALL, DATE.plusDays(3), false),
                        tuple(4, DATE, true)
                );
        assertThat(views.get(0).hallName()).isEqualTo("Kalyana Mantapa");
        assertThat(views.get(1).status()).isEqualTo(DateStatus.onHold("Upanayana"));
        assertThat(views.get(2).status()).isEqualTo(DateStatus.booked("Reception"));
    }

    @Test
    void 본인_홀드_해제() {
        BookingSession session = sessionFactory.open("hall-detail", userA);
        session.selectDate(HALL, DATE, "Wedding");

        TransitionResult result = session.abandon(HALL, DATE);

        assertThat(result.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(index.statusOf(HALL, DATE).isAvailable()).isTrue();
    }
}
