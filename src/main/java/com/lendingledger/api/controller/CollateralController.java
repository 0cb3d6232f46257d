package com.lendingledger.api.controller;

import com.lendingledger.api.ApiHeaders;
import com.lendingledger.api.dto.request.DepositRequest;
import com.lendingledger.api.dto.response.CollateralBalanceResponse;
import com.lendingledger.domain.model.LedgerStats;
import com.lendingledger.ledger.CollateralAccountService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for collateral accounting and protocol aggregates.
 * <ul>
 *   <li>POST /api/collateral/deposits -- record a custody-confirmed deposit for the caller</li>
 *   <li>GET /api/collateral/balances/{user} -- deposited balance of a user</li>
 *   <li>GET /api/stats -- protocol-wide aggregates</li>
 * </ul>
 */
@RestController
public class CollateralController {

    private final CollateralAccountService collateralAccountService;

    public CollateralController(CollateralAccountService collateralAccountService) {
        this.collateralAccountService = collateralAccountService;
    }

    @PostMapping("/api/collateral/deposits")
    public ResponseEntity<CollateralBalanceResponse> deposit(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody DepositRequest request) {
        long balance = collateralAccountService.depositCollateral(caller, request.getAmount());
        return ResponseEntity.ok(new CollateralBalanceResponse(caller, balance));
    }

    @GetMapping("/api/collateral/balances/{user}")
    public ResponseEntity<CollateralBalanceResponse> getBalance(@PathVariable String user) {
        return ResponseEntity.ok(new CollateralBalanceResponse(user, collateralAccountService.getCollateralBalance(user)));
    }

    @GetMapping("/api/stats")
    public ResponseEntity<LedgerStats> getStats() {
        return ResponseEntity.ok(collateralAccountService.getStats());
    }
}
