package com.lendingledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for changing a single risk parameter. Bounds are enforced by the parameter store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterUpdateRequest {

    @NotNull
    private Long value;
}
