package com.lendingledger.mapper;

import com.lendingledger.domain.model.Position;
import com.lendingledger.entity.PositionEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from Position snapshots to the audit PositionEntity.
 * Entity has syncedAt, stamped by the write-behind flush, which the domain model doesn't carry.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "syncedAt", ignore = true)
    PositionEntity toEntity(Position position);
}
