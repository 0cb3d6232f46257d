package com.lendingledger.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recorded change of a global risk parameter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskParameterHistory {

    private Long id;
    private String parameterName;
    private String oldValue;
    private String newValue;
    private String changedBy;
    private LocalDateTime timestamp;
}
