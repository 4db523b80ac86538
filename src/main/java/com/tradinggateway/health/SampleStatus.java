package com.tradinggateway.health;

public enum SampleStatus {
    OK,
    TIMEOUT,
    ERROR;

    public boolean isOk() {
        return this == OK;
    }
}
