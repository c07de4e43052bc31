package com.tradejournal.mapper;

import com.tradejournal.domain.model.Fill;
import com.tradejournal.entity.FillEntity;
import java.time.LocalDate;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Fill domain model and FillEntity.
 * The trading date is not part of a Fill and is supplied separately when persisting.
 */
@Mapper
public interface FillMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "date", source = "date")
    FillEntity toEntity(Fill fill, LocalDate date);

    Fill toDomain(FillEntity entity);

    List<Fill> toDomainList(List<FillEntity> entities);
}
