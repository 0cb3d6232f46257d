package com.lendingledger.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PriceResponse {

    private final String asset;
    private final long price;
}
