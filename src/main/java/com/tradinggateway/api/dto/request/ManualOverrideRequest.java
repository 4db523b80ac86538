package com.tradinggateway.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for forcing capital-preservation mode from the operator console.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualOverrideRequest {

    @NotBlank
    private String reason;

    /** Operator name recorded on the degradation event. */
    @NotBlank
    private String operator;
}
