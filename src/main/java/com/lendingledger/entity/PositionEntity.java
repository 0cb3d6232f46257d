package com.lendingledger.entity;

import com.lendingledger.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * Audit copy of each position's latest snapshot; the in-memory ledger is authoritative.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    private Long id;

    @Column(length = 100, nullable = false)
    private String borrower;

    @Column(name = "collateral_amount")
    private long collateralAmount;

    @Column(name = "debt_amount")
    private long debtAmount;

    @Column(name = "interest_rate")
    private long interestRate;

    @Column(name = "opened_at")
    private long openedAt;

    @Column(name = "last_accrual_at")
    private long lastAccrualAt;

    @Column(name = "closed_at")
    private Long closedAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private PositionStatus status;

    @Column(nullable = false)
    private long revision;

    @Column(name = "synced_at")
    private LocalDateTime syncedAt;
}
