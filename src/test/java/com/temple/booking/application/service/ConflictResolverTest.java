package com.temple.booking.application.service;

import com.temple.booking.application.index.AvailabilityIndex;
import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.AvailabilityRecord;
import com.temple.booking.domain.availability.DateStatus;
import com.temple.booking.domain.availability.RequesterId;
import com.temple.booking.domain.availability.TransitionOutcome;
import com.temple.booking.domain.availability.TransitionResult;
import com.temple.booking.domain.availability.exception.AvailabilityRepositoryUnavailableException;
import com.temple.booking.infrastructure.config.BookingProperties;
import com.temple.booking.infrastructure.lock.LocalKeyedLock;
import com.temple.booking.support.InMemoryAvailabilityRepository;
import com.temple.booking.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ConflictResolverTest {

    static final int HALL = 3;
    static final LocalDate DATE = LocalDate.of(2025, 6, 10);

    MutableClock clock;
    InMemoryAvailabilityRepository repository;
    AvailabilityIndex index;
    BookingProperties properties;
    ConflictResolver resolver;

    RequesterId userA = RequesterId.of("user-a");
    RequesterId userB = RequesterId.of("user-b");

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDate.of(2025, 6, 1));
        repository = new InMemoryAvailabilityRepository();
        setUpResolver(repository);
    }

    private void setUpResolver(InMemoryAvailabilityRepository repo) {
        index = new AvailabilityIndex(repo, clock);
        properties = new BookingProperties();
        resolver = new ConflictResolver(repo, new LocalKeyedLock(properties), index, properties, clock);
    }

    @Test
    @DisplayName("홀드 -> 다른 사용자 거절 -> 확정 -> 취소 -> 재취소 NOT_BOOKED")
    void 전체_흐름() {
        // 1. A 홀드
        TransitionResult hold = resolver.requestHold(HALL, DATE, "Wedding", userA);
        assertThat(hold.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(hold.status()).isEqualTo(DateStatus.onHold("Wedding"));
        assertThat(hold.holdExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));

        // 2. B 홀드 시도 -> 현재 상태와 함께 거절
        TransitionResult other = resolver.requestHold(HALL, DATE, "Reception", userB);
        assertThat(other.outcome()).isEqualTo(TransitionOutcome.CONFLICT);
        assertThat(other.status()).isEqualTo(DateStatus.onHold("Wedding"));

        // 3. A 확정
        TransitionResult confirm = resolver.confirmBooking(HALL, DATE, "Wedding", userA);
        assertThat(confirm.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(index.statusOf(HALL, DATE)).isEqualTo(DateStatus.booked("Wedding"));

        // 4. 취소
        TransitionResult cancel = resolver.cancel(HALL, DATE);
        assertThat(cancel.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(index.statusOf(HALL, DATE).isAvailable()).isTrue();

        // 5. 재취소
        assertThat(resolver.cancel(HALL, DATE).outcome()).isEqualTo(TransitionOutcome.NOT_BOOKED);
    }

    @Test
    void 홀드없이_바로_확정() {
        TransitionResult result = resolver.confirmBooking(HALL, DATE, "Upanayana", userB);

        assertThat(result.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE)))
                .get()
                .extracting(AvailabilityRecord::status)
                .isEqualTo(DateStatus.booked("Upanayana"));
    }

    @Test
    void 예약된_날짜_재확정은_거절() {
        resolver.confirmBooking(HALL, DATE, "Wedding", userA);

        TransitionResult again = resolver.confirmBooking(HALL, DATE, "Wedding", userA);

        assertThat(again.outcome()).isEqualTo(TransitionOutcome.CONFLICT);
        assertThat(again.status().isBooked()).isTrue();
    }

    @Test
    void 다른_사람의_홀드는_확정할_수_없다() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);

        assertThat(resolver.confirmBooking(HALL, DATE, "Wedding", userB).isConflict()).isTrue();
    }

    @Test
    @DisplayName("본인 홀드라도 사유가 다르면 확정 거절 (사유는 AVAILABLE 을 거쳐야만 바뀜)")
    void 사유_변경_확정_거절() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);

        TransitionResult result = resolver.confirmBooking(HALL, DATE, "Reception", userA);

        assertThat(result.isConflict()).isTrue();
        assertThat(result.status()).isEqualTo(DateStatus.onHold("Wedding"));
    }

    @Test
    void 본인_홀드_재요청도_거절() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);

        assertThat(resolver.requestHold(HALL, DATE, "Wedding", userA).isConflict()).isTrue();
    }

    @Test
    void 가능한_날짜_해제는_변경없음() {
        TransitionResult result = resolver.release(HALL, DATE);

        assertThat(result.outcome()).isEqualTo(TransitionOutcome.UNCHANGED);
        assertThat(result.isSuccess()).isTrue();
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE))).isEmpty();
    }

    @Test
    void 예약된_날짜_해제는_거절() {
        resolver.confirmBooking(HALL, DATE, "Wedding", userA);

        assertThat(resolver.release(HALL, DATE).isConflict()).isTrue();
    }

    @Test
    void 홀드_중인_날짜_취소는_거절() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);

        TransitionResult result = resolver.cancel(HALL, DATE);

        assertThat(result.isConflict()).isTrue();
        assertThat(result.status().isOnHold()).isTrue();
    }

    @Test
    void 다른_사람의_홀드_해제는_거절_관리자_해제는_허용() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);

        assertThat(resolver.release(HALL, DATE, userB).isConflict()).isTrue();
        assertThat(resolver.release(HALL, DATE).outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(index.statusOf(HALL, DATE).isAvailable()).isTrue();
    }

    @Test
    void 본인_홀드_해제후_다른_사유로_다시_홀드() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);
        resolver.release(HALL, DATE, userA);

        TransitionResult result = resolver.requestHold(HALL, DATE, "Reception", userA);

        assertThat(result.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(result.status().getReason()).isEqualTo("Reception");
    }

    @Test
    @DisplayName("만료된 홀드는 다른 사용자가 바로 잡을 수 있다")
    void 만료_홀드_재사용() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);
        clock.advance(Duration.ofMinutes(15));

        TransitionResult result = resolver.requestHold(HALL, DATE, "Reception", userB);

        assertThat(result.outcome()).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(resolver.confirmBooking(HALL, DATE, "Wedding", userA).isConflict()).isTrue();
    }

    @Test
    void 만료_홀드_정리() {
        resolver.requestHold(HALL, DATE, "Wedding", userA);
        resolver.requestHold(HALL, DATE.plusDays(1), "Wedding", userA);
        resolver.confirmBooking(HALL, DATE.plusDays(2), "Wedding", userA);
        clock.advance(Duration.ofMinutes(20));

        int released = resolver.releaseExpiredHolds();

        assertThat(released).isEqualTo(2);
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE)).orElseThrow().status().isAvailable()).isTrue();
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE.plusDays(2))).orElseThrow().status().isBooked()).isTrue();
    }

    @Test
    @DisplayName("락 밖의 쓰기에 compare-and-set 이 지면 최신 상태와 함께 CONFLICT")
    void 경합_패배() {
        // given: compare-and-set 직전에 다른 인스턴스가 예약을 끝냄
        InMemoryAvailabilityRepository racing = new InMemoryAvailabilityRepository() {
            @Override
            public synchronized Optional<AvailabilityRecord> compareAndSet(AvailabilityRecord expected,
                                                                           AvailabilityRecord next) {
                put(expected.toBooked("Reception", RequesterId.of("other-node"), clock.instant()));
                return super.compareAndSet(expected, next);
            }
        };
        setUpResolver(racing);

        // when
        TransitionResult result = resolver.requestHold(HALL, DATE, "Wedding", userA);

        // then
        assertThat(result.isConflict()).isTrue();
        assertThat(result.status()).isEqualTo(DateStatus.booked("Reception"));
        assertThat(index.statusOf(HALL, DATE)).isEqualTo(DateStatus.booked("Reception"));
    }

    @Test
    void 저장소_장애는_그대로_전파() {
        repository.goDown();

        assertThatThrownBy(() -> resolver.requestHold(HALL, DATE, "Wedding", userA))
                .isInstanceOf(AvailabilityRepositoryUnavailableException.class);
    }

    @Test
    void 사유는_필수() {
        assertThatThrownBy(() -> resolver.requestHold(HALL, DATE, " ", userA))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("같은 날짜에 50명이 동시에 확정하면 정확히 1명만 성공")
    void 동시_확정() throws InterruptedException {
        // given
        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger conflictCount = new AtomicInteger();

        // when
        for (int i = 0; i < threadCount; i++) {
            RequesterId requester = RequesterId.of("user-" + i);
            executor.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    TransitionResult result = resolver.confirmBooking(HALL, DATE, "Wedding " + requester, requester);
                    if (result.outcome() == TransitionOutcome.APPLIED) {
                        successCount.incrementAndGet();
                    } else if (result.isConflict()) {
                        conflictCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        done.await(30, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(conflictCount.get()).isEqualTo(threadCount - 1);
        assertThat(repository.find(AvailabilityKey.of(HALL, DATE)).orElseThrow().version()).isZero();
    }
}
