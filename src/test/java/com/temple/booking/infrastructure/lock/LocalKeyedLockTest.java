package com.temple.booking.infrastructure.lock;

import com.temple.booking.domain.availability.AvailabilityKey;
import com.temple.booking.domain.availability.exception.LockAcquisitionException;
import com.temple.booking.infrastructure.config.BookingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LocalKeyedLockTest")
class LocalKeyedLockTest {

    private LocalKeyedLock keyedLock;
    private final AvailabilityKey key = AvailabilityKey.of(3, LocalDate.of(2025, 6, 10));

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.getLock().setWaitTimeout(Duration.ofMillis(200));
        keyedLock = new LocalKeyedLock(properties);
    }

    @Test
    @DisplayName("작업 결과를 돌려주고 키 테이블을 비운다")
    void 기본_동작() {
        String result = keyedLock.executeWithLock(key, () -> "success");

        assertThat(result).isEqualTo("success");
        assertThat(keyedLock.activeKeys()).isZero();
    }

    @Test
    void 예외가_나도_락은_해제된다() {
        assertThatThrownBy(() -> keyedLock.executeWithLock(key, () -> {
            throw new IllegalStateException("작업 중 예외 발생");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(keyedLock.activeKeys()).isZero();
        assertThat(keyedLock.executeWithLock(key, () -> 1)).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 키는 한 번에 하나씩만 실행")
    void 같은_키_직렬화() throws InterruptedException {
        // given
        BookingProperties properties = new BookingProperties();
        properties.getLock().setWaitTimeout(Duration.ofSeconds(10));
        LocalKeyedLock patientLock = new LocalKeyedLock(properties);

        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        // when
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    patientLock.executeWithLock(key, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(20);
                        inside.decrementAndGet();
                        return null;
                    });
                } finally {
                    done.countDown();
                }
            });
        }
        done.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // then
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(patientLock.activeKeys()).isZero();
    }

    @Test
    void 다른_키는_서로_막지_않는다() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<?> holder = executor.submit(() -> keyedLock.executeWithLock(key, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        holding.await();

        AvailabilityKey otherDate = AvailabilityKey.of(3, LocalDate.of(2025, 6, 11));
        assertThat(keyedLock.executeWithLock(otherDate, () -> "free")).isEqualTo("free");

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        executor.shutdown();
    }

    @Test
    @DisplayName("대기 시간을 넘기면 LockAcquisitionException")
    void 대기시간_초과() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<?> holder = executor.submit(() -> keyedLock.executeWithLock(key, () -> {
            holding.countDown();
            await(release);
            return null;
        }));
        holding.await();

        assertThatThrownBy(() -> keyedLock.executeWithLock(key, () -> "late"))
                .isInstanceOf(LockAcquisitionException.class)
                .hasMessageContaining(key.asLockKey());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        executor.shutdown();
        assertThat(keyedLock.activeKeys()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
