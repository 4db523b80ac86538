package com.tradinggateway.gate;

public enum RequestType {
    SNAPSHOT_QUOTE,
    HISTORICAL_BARS
}
