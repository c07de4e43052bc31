package com.tradejournal.mapper;

import com.tradejournal.domain.model.AccountBreakdown;
import com.tradejournal.domain.model.AccountSplit;
import com.tradejournal.domain.model.DailySummary;
import com.tradejournal.entity.DailySummaryEntity;
import java.util.List;
import org.mapstruct.InheritConfiguration;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;

/**
 * MapStruct mapper between DailySummary domain model and DailySummaryEntity.
 *
 * <p>The nested live/training breakdown is flattened into {@code live*} and {@code training*}
 * columns; symbols are stored as a JSON array string.
 */
@Mapper
public interface DailySummaryMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    @Mapping(source = "symbols", target = "symbols", qualifiedByName = "symbolsToJson")
    @Mapping(source = "byAccount.live.trades", target = "liveTrades")
    @Mapping(source = "byAccount.live.pnl", target = "livePnl")
    @Mapping(source = "byAccount.live.winners", target = "liveWinners")
    @Mapping(source = "byAccount.live.losers", target = "liveLosers")
    @Mapping(source = "byAccount.live.winRate", target = "liveWinRate")
    @Mapping(source = "byAccount.training.trades", target = "trainingTrades")
    @Mapping(source = "byAccount.training.pnl", target = "trainingPnl")
    @Mapping(source = "byAccount.training.winners", target = "trainingWinners")
    @Mapping(source = "byAccount.training.losers", target = "trainingLosers")
    @Mapping(source = "byAccount.training.winRate", target = "trainingWinRate")
    @Mapping(source = "byAccount.mixedTrades", target = "mixedTrades")
    DailySummaryEntity toEntity(DailySummary summary);

    @InheritConfiguration(name = "toEntity")
    void updateEntity(DailySummary summary, @MappingTarget DailySummaryEntity entity);

    @Mapping(source = "symbols", target = "symbols", qualifiedByName = "jsonToSymbols")
    @Mapping(source = "entity", target = "byAccount", qualifiedByName = "toAccountSplit")
    DailySummary toDomain(DailySummaryEntity entity);

    List<DailySummary> toDomainList(List<DailySummaryEntity> entities);

    @Named("symbolsToJson")
    default String symbolsToJson(List<String> symbols) {
        return JsonHelper.toJson(symbols);
    }

    @Named("jsonToSymbols")
    default List<String> jsonToSymbols(String json) {
        return JsonHelper.fromJsonList(json, String.class);
    }

    @Named("toAccountSplit")
    default AccountSplit toAccountSplit(DailySummaryEntity entity) {
        if (entity == null) {
            return null;
        }
        AccountBreakdown live = AccountBreakdown.builder()
                .trades(entity.getLiveTrades())
                .pnl(entity.getLivePnl())
                .winners(entity.getLiveWinners())
                .losers(entity.getLiveLosers())
                .winRate(entity.getLiveWinRate())
                .build();
        AccountBreakdown training = AccountBreakdown.builder()
                .trades(entity.getTrainingTrades())
                .pnl(entity.getTrainingPnl())
                .winners(entity.getTrainingWinners())
                .losers(entity.getTrainingLosers())
                .winRate(entity.getTrainingWinRate())
                .build();
        return AccountSplit.builder()
                .live(live)
                .training(training)
                .mixedTrades(entity.getMixedTrades())
                .build();
    }
}
