package com.lendingledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_parameter_history table.
 * One row per accepted change of a global risk parameter (e.g. minimum ratio 150 -> 175).
 */
@Entity
@Table(name = "risk_parameter_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskParameterHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** minimumCollateralRatio, liquidationThreshold or feeRate. */
    @Column(name = "parameter_name", length = 50)
    private String parameterName;

    @Column(name = "old_value", length = 50)
    private String oldValue;

    @Column(name = "new_value", length = 50)
    private String newValue;

    @Column(name = "changed_by", length = 100)
    private String changedBy;

    private LocalDateTime timestamp;
}
