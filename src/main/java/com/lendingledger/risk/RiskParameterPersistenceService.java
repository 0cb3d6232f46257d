package com.lendingledger.risk;

import com.lendingledger.domain.model.RiskParameterHistory;
import com.lendingledger.entity.RiskParameterHistoryEntity;
import com.lendingledger.mapper.RiskParameterHistoryMapper;
import com.lendingledger.repository.jpa.RiskParameterHistoryJpaRepository;
import com.lendingledger.service.LedgerSyncService;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Service;

/**
 * Audit trail for risk parameter changes.
 *
 * <p>Changes are recorded after the in-memory update has committed and reach H2 through
 * the {@link LedgerSyncService} write-behind queue, so the administrator call never waits
 * on the database. Reads go straight to the table.
 */
@Service
public class RiskParameterPersistenceService {

    private final LedgerSyncService ledgerSyncService;
    private final RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository;
    private final RiskParameterHistoryMapper riskParameterHistoryMapper =
            Mappers.getMapper(RiskParameterHistoryMapper.class);

    public RiskParameterPersistenceService(
            LedgerSyncService ledgerSyncService, RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository) {
        this.ledgerSyncService = ledgerSyncService;
        this.riskParameterHistoryJpaRepository = riskParameterHistoryJpaRepository;
    }

    /**
     * Records one parameter change. Unchanged values are skipped.
     *
     * @param parameterName minimumCollateralRatio, liquidationThreshold or feeRate
     * @param changedBy     identity of the administrator
     */
    public void recordChange(String parameterName, String oldValue, String newValue, String changedBy) {
        if (Objects.equals(oldValue, newValue)) {
            return;
        }

        RiskParameterHistoryEntity entity = RiskParameterHistoryEntity.builder()
                .parameterName(parameterName)
                .oldValue(oldValue)
                .newValue(newValue)
                .changedBy(changedBy)
                .timestamp(LocalDateTime.now())
                .build();
        ledgerSyncService.queueParameterChange(entity);
    }

    /** Full change history, newest first. */
    public List<RiskParameterHistory> getHistory() {
        return riskParameterHistoryMapper.toDomainList(riskParameterHistoryJpaRepository.findAllByOrderByTimestampDesc());
    }

    public List<RiskParameterHistory> getHistory(String parameterName) {
        return riskParameterHistoryMapper.toDomainList(
                riskParameterHistoryJpaRepository.findByParameterNameOrderByTimestampDesc(parameterName));
    }
}
