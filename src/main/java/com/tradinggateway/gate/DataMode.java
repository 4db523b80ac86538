package com.tradinggateway.gate;

/**
 * How market data is requested. Only {@link #SNAPSHOT} is ever sent to the gateway:
 * persistent subscriptions overflow the gateway's buffers and are rejected by the request gate.
 */
public enum DataMode {
    SNAPSHOT,
    STREAMING
}
