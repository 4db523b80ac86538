package com.tradinggateway.api.dto.response;

import com.tradinggateway.degradation.DegradationEvent;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SafeModeResponse {

    private final boolean safeModeActive;
    private final DegradationEvent openDegradation;
    private final int healthySamplesSinceReady;
    private final int healthySamplesRequired;
}
