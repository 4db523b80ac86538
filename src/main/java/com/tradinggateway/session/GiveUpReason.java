package com.tradinggateway.session;

public enum GiveUpReason {

    /** The configured maximum number of attempts has been used. */
    BUDGET_EXHAUSTED,

    /** The failure can only be resolved by an operator (e.g. rejected credentials). */
    NOT_RETRYABLE
}
