package com.positionledger.ledger;

import com.positionledger.domain.model.PositionSnapshot;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered resolution table for every numeric field the ledger reads from a snapshot.
 *
 * <p>Each logical field lists its source keys from most to least preferred. The first key
 * holding a non-null value wins, even if a later alias is also populated. A field with no
 * populated key resolves to zero. See {@link SnapshotFieldResolver}.
 */
public enum SnapshotField {
    BUY_QTY(
            new Candidate("day_buy_qty", PositionSnapshot::getDayBuyQty),
            new Candidate("buy_qty", PositionSnapshot::getBuyQty)),

    BUY_PRICE(
            new Candidate("day_buy_avg_price", PositionSnapshot::getDayBuyAvgPrice),
            new Candidate("buy_avg_price", PositionSnapshot::getBuyAvgPrice),
            new Candidate("avg_buy_price", PositionSnapshot::getAvgBuyPrice)),

    SELL_QTY(
            new Candidate("day_sell_qty", PositionSnapshot::getDaySellQty),
            new Candidate("sell_qty", PositionSnapshot::getSellQty)),

    SELL_PRICE(
            new Candidate("day_sell_avg_price", PositionSnapshot::getDaySellAvgPrice),
            new Candidate("sell_avg_price", PositionSnapshot::getSellAvgPrice),
            new Candidate("avg_sell_price", PositionSnapshot::getAvgSellPrice)),

    /** Price used to value a holding when the broker did not supply {@code value}. */
    MARK_PRICE(
            new Candidate("ltp", PositionSnapshot::getLtp),
            new Candidate("last_price", PositionSnapshot::getLastPrice),
            new Candidate("close_price", PositionSnapshot::getClosePrice),
            new Candidate("avg_price", PositionSnapshot::getAvgPrice)),

    QTY(new Candidate("qty", PositionSnapshot::getQty)),

    PNL(new Candidate("pnl", PositionSnapshot::getPnl));

    private final List<Candidate> candidates;

    SnapshotField(Candidate... candidates) {
        this.candidates = List.of(candidates);
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    /** Source keys in precedence order, e.g. {@code [day_buy_qty, buy_qty]}. */
    public List<String> getKeys() {
        return candidates.stream().map(Candidate::key).toList();
    }

    public record Candidate(String key, Function<PositionSnapshot, Double> accessor) {}
}
