package com.tradinggateway.health;

/** Where a health sample came from: the scheduled probe or a real data request. */
public enum SampleSource {
    PROBE,
    REQUEST
}
