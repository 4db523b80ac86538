package com.tradinggateway.transport;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A contract as confirmed by the gateway. Only qualified contracts carry a
 * positive {@code conId}.
 */
@Getter
@Builder
@ToString
public class ContractDetails {

    private final String contractKey;
    private final long conId;
    private final String symbol;
    private final String secType;
    private final String exchange;
    private final String currency;

    public boolean isQualified() {
        return conId > 0 && symbol != null;
    }
}
