package com.tradinggateway.health;

import com.tradinggateway.config.GatewaySettings;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Regular trading hours of the primary exchange, evaluated in the market's own time zone.
 *
 * <p>Weekends are closed. Exchange holidays are not modelled: on a holiday the staleness
 * check treats the session as open, which errs towards safe mode.
 */
public class RegularTradingHours {

    private final ZoneId zone;
    private final LocalTime open;
    private final LocalTime close;

    public RegularTradingHours(ZoneId zone, LocalTime open, LocalTime close) {
        this.zone = zone;
        this.open = open;
        this.close = close;
    }

    public static RegularTradingHours from(GatewaySettings settings) {
        return new RegularTradingHours(settings.getMarketZone(), settings.getMarketOpen(), settings.getMarketClose());
    }

    public boolean isOpen(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        DayOfWeek dow = local.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(open) && time.isBefore(close);
    }

    /** The opening bell on the market-local date of {@code instant}. */
    public Instant sessionOpen(Instant instant) {
        return instant.atZone(zone).toLocalDate().atTime(open).atZone(zone).toInstant();
    }
}
