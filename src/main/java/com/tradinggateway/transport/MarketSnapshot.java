package com.tradinggateway.transport;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One snapshot quote. Prices are null when the gateway sent no value for that field.
 */
@Getter
@Builder
@ToString
public class MarketSnapshot implements GatewayData {

    private final String contractKey;
    private final BigDecimal bid;
    private final BigDecimal ask;
    private final BigDecimal last;
    private final long volume;
    private final Instant timestamp;

    /**
     * Quote integrity: every present price is positive, volume is non-negative,
     * and a timestamp is present.
     */
    public boolean isValid() {
        return isPositiveOrAbsent(bid) && isPositiveOrAbsent(ask) && isPositiveOrAbsent(last)
                && volume >= 0
                && timestamp != null;
    }

    private static boolean isPositiveOrAbsent(BigDecimal price) {
        return price == null || price.signum() > 0;
    }
}
