package com.tradinggateway.event;

public enum SafeModeEventType {

    /** Capital-preservation mode entered. All order-affecting actions are vetoed. */
    ENTERED,

    /** An operator acknowledged the open degradation event. */
    ACKNOWLEDGED,

    /** The degradation event closed; trading may resume. */
    RECOVERED
}
