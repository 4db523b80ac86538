package com.tradinggateway.gate;

import com.tradinggateway.transport.HistoricalWindow;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One outbound call for market or historical data.
 *
 * <p>Callers set the contract, type, optional window and optional timeout. The request gate
 * stamps {@code issuedAt} and {@code deadline} on acceptance; the deadline is then carried to
 * the transport call.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class DataRequest {

    private final String contractKey;

    @Builder.Default
    private final DataMode mode = DataMode.SNAPSHOT;

    @Builder.Default
    private final RequestType type = RequestType.SNAPSHOT_QUOTE;

    /** Required for HISTORICAL_BARS, ignored otherwise. */
    private final HistoricalWindow window;

    /** Per-request timeout; the configured default applies when null. */
    private final Duration timeout;

    private final Instant issuedAt;
    private final Instant deadline;

    public static DataRequest snapshot(String contractKey) {
        return DataRequest.builder().contractKey(contractKey).build();
    }

    public static DataRequest historicalBars(String contractKey, HistoricalWindow window) {
        return DataRequest.builder()
                .contractKey(contractKey)
                .type(RequestType.HISTORICAL_BARS)
                .window(window)
                .build();
    }

    /** Requests with the same key are coalesced while one of them is in flight. */
    public String dedupKey() {
        if (type == RequestType.HISTORICAL_BARS && window != null) {
            return type + ":" + contractKey + ":" + window.getStart() + ":" + window.getEnd() + ":"
                    + window.getBarSize();
        }
        return type + ":" + contractKey;
    }
}
