package com.lendingledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a position against collateral.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanRequest {

    /** Quantity of the collateral asset backing the position. */
    @NotNull
    @Positive
    private Long collateralAmount;

    /** Principal to borrow. */
    @NotNull
    @Positive
    private Long debtAmount;
}
