package com.tradinggateway.session;

public enum AttemptOutcome {
    PENDING,
    SUCCESS,
    FAILURE
}
