package com.tradinggateway.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradinggateway.session.ClientId;
import com.tradinggateway.session.ClientIdAllocator;
import com.tradinggateway.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ClientIdAllocator covering uniqueness, monotonicity, clock seeding
 * and concurrent allocation.
 */
class ClientIdAllocatorTest {

    @Nested
    @DisplayName("Uniqueness")
    class Uniqueness {

        @Test
        @DisplayName("10,000 allocations with a frozen clock are distinct, positive and strictly increasing")
        void tenThousandDistinctIncreasing() {
            ClientIdAllocator allocator = new ClientIdAllocator(MutableClock.at("2026-01-14T15:00:00Z"));

            Set<Integer> seen = new HashSet<>();
            int previous = 0;
            for (int i = 0; i < 10_000; i++) {
                int value = allocator.next().getValue();
                assertThat(value).isPositive();
                assertThat(value).isGreaterThan(previous);
                seen.add(value);
                previous = value;
            }

            assertThat(seen).hasSize(10_000);
            assertThat(allocator.lastIssued()).isEqualTo(previous);
        }

        @Test
        @DisplayName("Concurrent callers never receive the same identity")
        void concurrentAllocationsDistinct() throws InterruptedException {
            ClientIdAllocator allocator = new ClientIdAllocator(MutableClock.at("2026-01-14T15:00:00Z"));
            Set<Integer> seen = ConcurrentHashMap.newKeySet();
            int threads = 8;
            int perThread = 2_000;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(threads);

            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        seen.add(allocator.next().getValue());
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            assertThat(seen).hasSize(threads * perThread);
        }
    }

    @Nested
    @DisplayName("Clock Seeding")
    class ClockSeeding {

        @Test
        @DisplayName("Later process start issues identities above an earlier process's range")
        void restartedProcessDoesNotReuseIdentities() {
            Instant firstStart = Instant.parse("2026-01-14T15:00:00.123Z");
            ClientIdAllocator first = new ClientIdAllocator(new MutableClock(firstStart));
            for (int i = 0; i < 500; i++) {
                first.next();
            }

            ClientIdAllocator second = new ClientIdAllocator(new MutableClock(firstStart.plus(Duration.ofSeconds(1))));

            assertThat(second.next().getValue()).isGreaterThan(first.lastIssued());
        }

        @Test
        @DisplayName("Sequence jumps forward to the clock when the clock overtakes it")
        void followsClockWhenAhead() {
            MutableClock clock = MutableClock.at("2026-01-14T15:00:00Z");
            ClientIdAllocator allocator = new ClientIdAllocator(clock);
            int first = allocator.next().getValue();

            clock.advance(Duration.ofMinutes(1));
            int second = allocator.next().getValue();

            assertThat(second - first).isGreaterThanOrEqualTo(60_000);
        }

        @Test
        @DisplayName("A clock reading that falls on the modulus boundary still yields a positive identity")
        void zeroSeedIsPositive() {
            ClientIdAllocator allocator = new ClientIdAllocator(new MutableClock(Instant.ofEpochMilli(2_000_000_000L)));

            assertThat(allocator.next().getValue()).isEqualTo(1);
        }

        @Test
        @DisplayName("Identities carry their allocation time")
        void allocationTimeRecorded() {
            MutableClock clock = MutableClock.at("2026-01-14T15:00:00Z");
            ClientId id = new ClientIdAllocator(clock).next();

            assertThat(id.getAllocatedAt()).isEqualTo(clock.instant());
        }
    }

    @Nested
    @DisplayName("ClientId")
    class ClientIdValue {

        @Test
        @DisplayName("Zero and negative values are rejected")
        void rejectsNonPositive() {
            assertThatThrownBy(() -> new ClientId(0, Instant.EPOCH)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new ClientId(-5, Instant.EPOCH)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Equality is by value only")
        void equalityByValue() {
            ClientId a = new ClientId(42, Instant.EPOCH);
            ClientId b = new ClientId(42, Instant.parse("2026-01-14T15:00:00Z"));

            assertThat(a).isEqualTo(b);
            assertThat(List.of(a).toString()).isEqualTo("[42]");
        }
    }
}
