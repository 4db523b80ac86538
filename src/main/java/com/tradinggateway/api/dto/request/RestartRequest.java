package com.tradinggateway.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestartRequest {

    /** Free-text reason for the audit log; optional. */
    private String reason;
}
