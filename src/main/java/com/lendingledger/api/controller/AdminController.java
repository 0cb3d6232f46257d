package com.lendingledger.api.controller;

import com.lendingledger.api.ApiHeaders;
import com.lendingledger.api.dto.request.ParameterUpdateRequest;
import com.lendingledger.domain.model.RiskParameterHistory;
import com.lendingledger.domain.model.RiskParameters;
import com.lendingledger.risk.RiskParameterPersistenceService;
import com.lendingledger.risk.RiskParameterService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for ledger administration: one-time initialization and risk parameters.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/admin/initialize -- initialize the ledger (administrator only, once)</li>
 *   <li>GET /api/admin/parameters -- current risk parameters</li>
 *   <li>PUT /api/admin/parameters/minimum-ratio -- set the minimum collateral ratio</li>
 *   <li>PUT /api/admin/parameters/liquidation-threshold -- set the liquidation threshold</li>
 *   <li>PUT /api/admin/parameters/fee-rate -- set the fee rate</li>
 *   <li>GET /api/admin/parameters/history -- parameter change audit trail</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final RiskParameterService riskParameterService;
    private final RiskParameterPersistenceService riskParameterPersistenceService;

    public AdminController(
            RiskParameterService riskParameterService,
            RiskParameterPersistenceService riskParameterPersistenceService) {
        this.riskParameterService = riskParameterService;
        this.riskParameterPersistenceService = riskParameterPersistenceService;
    }

    @PostMapping("/initialize")
    public ResponseEntity<RiskParameters> initialize(@RequestHeader(ApiHeaders.CALLER_ID) String caller) {
        return ResponseEntity.ok(riskParameterService.initialize(caller));
    }

    @GetMapping("/parameters")
    public ResponseEntity<RiskParameters> getParameters() {
        return ResponseEntity.ok(riskParameterService.getRiskParameters());
    }

    @PutMapping("/parameters/minimum-ratio")
    public ResponseEntity<RiskParameters> setMinimumRatio(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody ParameterUpdateRequest request) {
        return ResponseEntity.ok(riskParameterService.setMinimumRatio(caller, request.getValue()));
    }

    @PutMapping("/parameters/liquidation-threshold")
    public ResponseEntity<RiskParameters> setLiquidationThreshold(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody ParameterUpdateRequest request) {
        return ResponseEntity.ok(riskParameterService.setLiquidationThreshold(caller, request.getValue()));
    }

    @PutMapping("/parameters/fee-rate")
    public ResponseEntity<RiskParameters> setFeeRate(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody ParameterUpdateRequest request) {
        return ResponseEntity.ok(riskParameterService.setFeeRate(caller, request.getValue()));
    }

    /**
     * Returns recorded parameter changes, newest first. Optionally filtered by parameter name.
     */
    @GetMapping("/parameters/history")
    public ResponseEntity<List<RiskParameterHistory>> getHistory(
            @RequestParam(value = "parameter", required = false) String parameter) {
        List<RiskParameterHistory> history = parameter == null
                ? riskParameterPersistenceService.getHistory()
                : riskParameterPersistenceService.getHistory(parameter);
        return ResponseEntity.ok(history);
    }
}
