package com.lendingledger.mapper;

import com.lendingledger.domain.model.RiskParameterHistory;
import com.lendingledger.entity.RiskParameterHistoryEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper reading RiskParameterHistoryEntity rows back as RiskParameterHistory. 1:1 fields.
 */
@Mapper
public interface RiskParameterHistoryMapper {

    RiskParameterHistory toDomain(RiskParameterHistoryEntity entity);

    List<RiskParameterHistory> toDomainList(List<RiskParameterHistoryEntity> entities);
}
