package com.lendingledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for settling a position. The amount must cover principal plus accrued interest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepayRequest {

    @NotNull
    @Positive
    private Long amount;
}
