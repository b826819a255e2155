package com.tradecore.mapper;

import com.tradecore.domain.model.Deal;
import com.tradecore.entity.DealEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between the Deal domain model and DealEntity.
 */
@Mapper
public interface DealMapper {

    DealEntity toEntity(Deal deal);

    Deal toDomain(DealEntity entity);

    List<Deal> toDomainList(List<DealEntity> entities);

    List<DealEntity> toEntityList(List<Deal> deals);
}
