package com.tradinggateway.transport;

/** Payload returned to callers of the request gate. */
public interface GatewayData {

    String getContractKey();
}
