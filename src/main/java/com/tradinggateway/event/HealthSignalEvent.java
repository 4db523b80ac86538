package com.tradinggateway.event;

import com.tradinggateway.health.HealthSignal;
import org.springframework.context.ApplicationEvent;

public class HealthSignalEvent extends ApplicationEvent {

    private final HealthSignal signal;

    public HealthSignalEvent(Object source, HealthSignal signal) {
        super(source);
        this.signal = signal;
    }

    public HealthSignal getSignal() {
        return signal;
    }
}
