package com.lendingledger.api.controller;

import com.lendingledger.api.ApiHeaders;
import com.lendingledger.api.dto.request.ClockAdvanceRequest;
import com.lendingledger.api.dto.response.ClockResponse;
import com.lendingledger.clock.ClockService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read and advance the logical clock. Advancing is reserved for the administrator, who
 * relays chain progress.
 */
@RestController
@RequestMapping("/api/clock")
public class ClockController {

    private final ClockService clockService;

    public ClockController(ClockService clockService) {
        this.clockService = clockService;
    }

    @GetMapping
    public ResponseEntity<ClockResponse> getHeight() {
        return ResponseEntity.ok(new ClockResponse(clockService.currentHeight()));
    }

    @PostMapping("/advance")
    public ResponseEntity<ClockResponse> advance(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody ClockAdvanceRequest request) {
        return ResponseEntity.ok(new ClockResponse(clockService.advance(caller, request.getUnits())));
    }
}
