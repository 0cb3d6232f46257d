package com.lendingledger.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CollateralBalanceResponse {

    private final String user;
    private final long balance;
}
