package com.lendingledger.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Ids of a user's indexed active positions, in issuance order.
 */
@Getter
@AllArgsConstructor
public class UserPositionsResponse {

    private final String user;
    private final List<Long> positionIds;
}
