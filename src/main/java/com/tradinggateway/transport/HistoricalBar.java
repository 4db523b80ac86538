package com.tradinggateway.transport;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class HistoricalBar {

    private final Instant timestamp;
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final long volume;
    private final BigDecimal average;
    private final int barCount;

    /**
     * OHLC integrity: all prices positive, high is the top of the bar, low is the bottom,
     * volume non-negative.
     */
    public boolean isValid() {
        if (open == null || high == null || low == null || close == null) {
            return false;
        }
        if (open.signum() <= 0 || high.signum() <= 0 || low.signum() <= 0 || close.signum() <= 0) {
            return false;
        }
        if (high.compareTo(open) < 0 || high.compareTo(close) < 0) {
            return false;
        }
        if (low.compareTo(open) > 0 || low.compareTo(close) > 0) {
            return false;
        }
        return volume >= 0;
    }
}
