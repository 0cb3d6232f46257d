package com.lendingledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Every rejection the ledger can return, with the HTTP status the REST layer maps it to.
 *
 * <p>The ledger-level codes are all caller-recoverable: a rejected operation never leaves
 * a partial write behind, so the caller may correct the input and retry.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    // Ledger rejections
    UNAUTHORIZED("UNAUTHORIZED", 403),
    INSUFFICIENT_COLLATERAL("INSUFFICIENT_COLLATERAL", 422),
    BELOW_MINIMUM("BELOW_MINIMUM", 422),
    INVALID_AMOUNT("INVALID_AMOUNT", 422),
    ALREADY_INITIALIZED("ALREADY_INITIALIZED", 409),
    NOT_INITIALIZED("NOT_INITIALIZED", 409),
    INVALID_LIQUIDATION("INVALID_LIQUIDATION", 409),
    LOAN_NOT_FOUND("LOAN_NOT_FOUND", 404),
    LOAN_NOT_ACTIVE("LOAN_NOT_ACTIVE", 409),
    INVALID_LOAN_ID("INVALID_LOAN_ID", 400),
    INVALID_PRICE("INVALID_PRICE", 422),
    INVALID_ASSET("INVALID_ASSET", 400),

    // Transport
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;

    /** True for rejections raised by ledger preconditions rather than by the transport layer. */
    public boolean isLedgerRejection() {
        return ordinal() <= INVALID_ASSET.ordinal();
    }
}
