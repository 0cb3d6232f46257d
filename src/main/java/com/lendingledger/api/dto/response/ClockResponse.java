package com.lendingledger.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ClockResponse {

    private final long height;
}
