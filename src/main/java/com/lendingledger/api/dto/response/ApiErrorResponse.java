package com.lendingledger.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lendingledger.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope written by {@link com.lendingledger.exception.GlobalExceptionHandler}.
 *
 * <p>{@code ledgerRejection} is true for codes raised by ledger preconditions. Those
 * rejections never leave a partial write behind, so the caller may fix the input and retry.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse from(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .ledgerRejection(errorCode.isLedgerRejection())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final boolean ledgerRejection;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
