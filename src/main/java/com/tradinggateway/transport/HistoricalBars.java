package com.tradinggateway.transport;

import java.util.List;
import lombok.Getter;

@Getter
public class HistoricalBars implements GatewayData {

    private final String contractKey;
    private final HistoricalWindow window;
    private final List<HistoricalBar> bars;

    public HistoricalBars(String contractKey, HistoricalWindow window, List<HistoricalBar> bars) {
        this.contractKey = contractKey;
        this.window = window;
        this.bars = List.copyOf(bars);
    }

    public int size() {
        return bars.size();
    }
}
