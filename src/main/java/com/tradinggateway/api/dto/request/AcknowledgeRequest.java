package com.tradinggateway.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for acknowledging the open degradation event, e.g. after approving the
 * gateway's 2FA prompt out of band.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeRequest {

    @NotBlank
    private String operator;
}
