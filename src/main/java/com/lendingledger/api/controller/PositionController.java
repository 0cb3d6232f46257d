package com.lendingledger.api.controller;

import com.lendingledger.api.ApiHeaders;
import com.lendingledger.api.dto.request.LoanRequest;
import com.lendingledger.api.dto.request.RepayRequest;
import com.lendingledger.api.dto.response.UserPositionsResponse;
import com.lendingledger.domain.model.LiquidationCheckResult;
import com.lendingledger.domain.model.Position;
import com.lendingledger.domain.model.PositionHealth;
import com.lendingledger.ledger.PositionLedgerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the position ledger.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/positions -- open a position (request a loan)</li>
 *   <li>POST /api/positions/{id}/repay -- settle a position in full (borrower only)</li>
 *   <li>POST /api/positions/{id}/liquidation-check -- liquidate if unhealthy, otherwise no-op</li>
 *   <li>POST /api/positions/{id}/liquidate -- liquidate or fail with INVALID_LIQUIDATION</li>
 *   <li>GET /api/positions/{id} -- position details</li>
 *   <li>GET /api/positions/{id}/health -- current ratio and amount owed</li>
 *   <li>GET /api/positions/users/{user} -- a user's active position ids</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionLedgerService positionLedgerService;

    public PositionController(PositionLedgerService positionLedgerService) {
        this.positionLedgerService = positionLedgerService;
    }

    @PostMapping
    public ResponseEntity<Position> requestLoan(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @Valid @RequestBody LoanRequest request) {
        Position position =
                positionLedgerService.requestLoan(caller, request.getCollateralAmount(), request.getDebtAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(position);
    }

    @PostMapping("/{id}/repay")
    public ResponseEntity<Position> repay(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable long id,
            @Valid @RequestBody RepayRequest request) {
        return ResponseEntity.ok(positionLedgerService.repay(caller, id, request.getAmount()));
    }

    @PostMapping("/{id}/liquidation-check")
    public ResponseEntity<LiquidationCheckResult> checkLiquidation(@PathVariable long id) {
        return ResponseEntity.ok(positionLedgerService.checkLiquidation(id));
    }

    @PostMapping("/{id}/liquidate")
    public ResponseEntity<LiquidationCheckResult> liquidate(@PathVariable long id) {
        return ResponseEntity.ok(positionLedgerService.liquidate(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Position> getPosition(@PathVariable long id) {
        return ResponseEntity.ok(positionLedgerService.getPosition(id));
    }

    @GetMapping("/{id}/health")
    public ResponseEntity<PositionHealth> getHealth(@PathVariable long id) {
        return ResponseEntity.ok(positionLedgerService.getHealth(id));
    }

    @GetMapping("/users/{user}")
    public ResponseEntity<UserPositionsResponse> getUserPositions(@PathVariable String user) {
        return ResponseEntity.ok(new UserPositionsResponse(user, positionLedgerService.getUserPositions(user)));
    }
}
