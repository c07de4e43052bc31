package com.tradejournal.mapper;

import com.tradejournal.domain.model.RoundTrip;
import com.tradejournal.entity.RoundTripEntity;
import java.util.List;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;
import org.mapstruct.NullValuePropertyMappingStrategy;

/**
 * MapStruct mapper between RoundTrip domain model and RoundTripEntity.
 *
 * <p>Accounts are stored as a JSON array string. {@link #updateEntity} skips null source values, so
 * a re-ingested round trip without annotations keeps the setup, notes and chart already stored.
 */
@Mapper
public interface RoundTripMapper {

    @Mapping(source = "accounts", target = "accounts", qualifiedByName = "accountsToJson")
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    RoundTripEntity toEntity(RoundTrip roundTrip);

    @Mapping(source = "accounts", target = "accounts", qualifiedByName = "jsonToAccounts")
    RoundTrip toDomain(RoundTripEntity entity);

    List<RoundTrip> toDomainList(List<RoundTripEntity> entities);

    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(source = "accounts", target = "accounts", qualifiedByName = "accountsToJson")
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void updateEntity(RoundTrip roundTrip, @MappingTarget RoundTripEntity entity);

    @Named("accountsToJson")
    default String accountsToJson(List<String> accounts) {
        return JsonHelper.toJson(accounts);
    }

    @Named("jsonToAccounts")
    default List<String> jsonToAccounts(String json) {
        return JsonHelper.fromJsonList(json, String.class);
    }
}
