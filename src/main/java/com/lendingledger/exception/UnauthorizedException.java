package com.lendingledger.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * The caller identity is missing, or it is not allowed to perform the operation.
 */
public class UnauthorizedException extends BaseException {

    private UnauthorizedException(String message, Map<String, Object> details) {
        super(ErrorCode.UNAUTHORIZED, message, details);
    }

    public static UnauthorizedException missingCaller() {
        return new UnauthorizedException("Caller identity is required", Map.of());
    }

    public static UnauthorizedException notAdministrator(String caller) {
        Map<String, Object> details = new HashMap<>();
        details.put("caller", caller);
        details.put("required", "administrator");
        return new UnauthorizedException("Caller '" + caller + "' is not the administrator", details);
    }

    public static UnauthorizedException notBorrower(String caller, long positionId) {
        return new UnauthorizedException(
                "Caller '" + caller + "' is not the borrower of position " + positionId,
                Map.of("caller", caller, "positionId", positionId));
    }
}
