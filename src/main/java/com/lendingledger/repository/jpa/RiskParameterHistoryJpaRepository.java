package com.lendingledger.repository.jpa;

import com.lendingledger.entity.RiskParameterHistoryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskParameterHistoryJpaRepository extends JpaRepository<RiskParameterHistoryEntity, Long> {

    List<RiskParameterHistoryEntity> findAllByOrderByTimestampDesc();

    List<RiskParameterHistoryEntity> findByParameterNameOrderByTimestampDesc(String parameterName);
}
