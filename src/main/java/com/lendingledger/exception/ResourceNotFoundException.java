package com.lendingledger.exception;

import java.util.Map;

/**
 * No position was ever issued under the requested id. Ids are never reused, so this is
 * distinct from a position that exists but is closed.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(long positionId) {
        super(ErrorCode.LOAN_NOT_FOUND, "Position not found: " + positionId, Map.of("positionId", positionId));
    }
}
