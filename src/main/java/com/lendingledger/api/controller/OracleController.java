package com.lendingledger.api.controller;

import com.lendingledger.api.ApiHeaders;
import com.lendingledger.api.dto.request.PriceUpdateRequest;
import com.lendingledger.api.dto.response.PriceResponse;
import com.lendingledger.oracle.OracleFeedService;
import jakarta.validation.Valid;
import java.util.Locale;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the oracle feed.
 * <ul>
 *   <li>PUT /api/oracle/prices/{asset} -- publish a quote (administrator only)</li>
 *   <li>GET /api/oracle/prices/{asset} -- latest quote</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/oracle")
public class OracleController {

    private final OracleFeedService oracleFeedService;

    public OracleController(OracleFeedService oracleFeedService) {
        this.oracleFeedService = oracleFeedService;
    }

    @PutMapping("/prices/{asset}")
    public ResponseEntity<PriceResponse> setPrice(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable String asset,
            @Valid @RequestBody PriceUpdateRequest request) {
        oracleFeedService.setPrice(caller, asset, request.getPrice());
        return ResponseEntity.ok(new PriceResponse(asset.toUpperCase(Locale.ROOT), request.getPrice()));
    }

    @GetMapping("/prices/{asset}")
    public ResponseEntity<PriceResponse> getPrice(@PathVariable String asset) {
        long price = oracleFeedService.getPrice(asset);
        return ResponseEntity.ok(new PriceResponse(asset.toUpperCase(Locale.ROOT), price));
    }
}
