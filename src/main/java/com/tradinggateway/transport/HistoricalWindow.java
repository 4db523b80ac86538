package com.tradinggateway.transport;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Time range and bar size of a historical data request.
 *
 * <p>The gateway only answers reliably for RTH-only windows of at most one hour
 * and 1000 bars; the request gate rejects anything larger instead of truncating it.
 */
@Getter
@Builder
@ToString
public class HistoricalWindow {

    private final Instant start;
    private final Instant end;

    @Builder.Default
    private final Duration barSize = Duration.ofMinutes(5);

    /** Regular trading hours only. Must stay true. */
    @Builder.Default
    private final boolean useRth = true;

    public static HistoricalWindow lastHour(Instant end, Duration barSize) {
        return HistoricalWindow.builder()
                .start(end.minus(Duration.ofHours(1)))
                .end(end)
                .barSize(barSize)
                .build();
    }

    public Duration duration() {
        if (start == null || end == null) {
            return Duration.ZERO;
        }
        return Duration.between(start, end);
    }

    /** Number of bars the window produces, rounded up. */
    public long expectedBarCount() {
        long windowMillis = duration().toMillis();
        long barMillis = barSize.toMillis();
        if (barMillis <= 0) {
            return Long.MAX_VALUE;
        }
        return (windowMillis + barMillis - 1) / barMillis;
    }

    public boolean isWellFormed() {
        return start != null && end != null && barSize != null && end.isAfter(start) && !barSize.isZero()
                && !barSize.isNegative();
    }
}
