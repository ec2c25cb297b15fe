package com.positionledger.ledger;

import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.DailyAggregate;
import com.positionledger.domain.model.PositionSnapshot;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

/**
 * Groups snapshots by calendar date into the turnover and holdings totals the cash fold needs.
 *
 * <p>Turnover is recomputed from the same resolved fields the inference engine uses rather
 * than from its output, so this stage does not depend on transaction ordering. Every row adds
 * its valuation to the day's holdings, traded or not: a flat position held overnight still
 * contributes to that day's net liquidation.
 *
 * <p>Rows that share a date are summed. Many symbols share a date, so a last-write-wins merge
 * keyed by date would silently drop positions.
 */
@Service
public class DailyAggregator {

    private final SnapshotFieldResolver fieldResolver;

    public DailyAggregator(SnapshotFieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
    }

    /**
     * @return per-date totals in ascending date order; one entry per distinct valid date
     */
    public SortedMap<LocalDate, DailyAggregate> aggregate(List<PositionSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return Collections.emptySortedMap();
        }

        TreeMap<LocalDate, DailyAggregate> byDate = new TreeMap<>();
        for (PositionSnapshot snapshot : snapshots) {
            Optional<LocalDate> date = AsOfDates.dateOf(snapshot);
            if (date.isPresent()) {
                DailyAggregate soFar = byDate.getOrDefault(date.get(), DailyAggregate.EMPTY);
                byDate.put(date.get(), soFar.plus(contributionOf(snapshot)));
            }
        }
        return Collections.unmodifiableSortedMap(byDate);
    }

    private DailyAggregate contributionOf(PositionSnapshot snapshot) {
        SideAggregate buy = fieldResolver.resolveSide(snapshot, OrderSide.BUY);
        SideAggregate sell = fieldResolver.resolveSide(snapshot, OrderSide.SELL);

        return DailyAggregate.builder()
                .turnoverBuy(buy.isTraded() ? buy.getNotional() : BigDecimal.ZERO)
                .turnoverSell(sell.isTraded() ? sell.getNotional() : BigDecimal.ZERO)
                .holdingsValue(fieldResolver.resolveValue(snapshot))
                .txCount((buy.isTraded() ? 1 : 0) + (sell.isTraded() ? 1 : 0))
                .build();
    }
}
