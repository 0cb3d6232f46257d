package com.lendingledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for publishing an oracle quote. Range checks happen in the oracle store so
 * that out-of-range prices surface as INVALID_PRICE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequest {

    @NotNull
    private Long price;
}
