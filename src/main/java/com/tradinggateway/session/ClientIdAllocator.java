package com.tradinggateway.session;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands out collision-free client identities.
 *
 * <p>Identities are seeded from the wall clock so that a restarted process does not
 * reuse the previous process's identities (the gateway may still hold a half-closed
 * socket for them), and then strictly increase so that no identity is issued twice
 * within the process, however fast {@link #next()} is called.
 *
 * <p>Thread-safe and lock-free.
 */
@Component
public class ClientIdAllocator {

    private static final Logger log = LoggerFactory.getLogger(ClientIdAllocator.class);

    /** Seed modulus: keeps the seed well below Integer.MAX_VALUE so the sequence has room to grow. */
    static final int SEED_MODULUS = 1_000_000_000;

    private final Clock clock;
    private final AtomicInteger last = new AtomicInteger(0);

    public ClientIdAllocator(Clock clock) {
        this.clock = clock;
    }

    public ClientId next() {
        int value = last.updateAndGet(this::advance);
        return new ClientId(value, clock.instant());
    }

    /** The most recently issued identity value, or 0 when none has been issued. */
    public int lastIssued() {
        return last.get();
    }

    private int advance(int previous) {
        int seed = seed();
        if (previous >= Integer.MAX_VALUE - 1) {
            // Only reachable after ~1.1 billion allocations in one process
            log.warn("Client id sequence exhausted at {}, re-seeding at {}", previous, seed);
            return seed;
        }
        return Math.max(previous + 1, seed);
    }

    private int seed() {
        int seed = (int) (clock.millis() % SEED_MODULUS);
        return seed > 0 ? seed : 1;
    }
}
