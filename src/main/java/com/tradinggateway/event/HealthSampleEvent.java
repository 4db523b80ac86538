package com.tradinggateway.event;

import com.tradinggateway.health.HealthSample;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every health sample, probe or request. The degradation coordinator counts
 * consecutive OK samples from these to decide recovery.
 */
public class HealthSampleEvent extends ApplicationEvent {

    private final HealthSample sample;

    public HealthSampleEvent(Object source, HealthSample sample) {
        super(source);
        this.sample = sample;
    }

    public HealthSample getSample() {
        return sample;
    }
}
