package com.positionledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One broker observation of a position on a given date, as produced by the position sync.
 *
 * <p>Brokers never expose a transaction log, only these periodic aggregates. Several field
 * groups exist under more than one name because different brokers and older sync versions
 * populate different aliases (e.g. {@code day_buy_qty} vs {@code buy_qty}); any subset may be
 * present. Precedence between aliases lives in {@link com.positionledger.ledger.SnapshotField},
 * not here.
 *
 * <p>Numeric fields are boxed and may be null, NaN or infinite; {@code asOfDate} and
 * {@code capturedAt} are kept as the raw strings the sync wrote so a dirty row can be
 * skipped instead of failing the whole batch.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PositionSnapshot {

    Long id;

    /** Trading date, ISO {@code YYYY-MM-DD}. A time suffix, if present, is ignored. */
    @JsonProperty("as_of_date")
    String asOfDate;

    @JsonProperty("captured_at")
    String capturedAt;

    String symbol;
    String exchange;

    /** Broker product code: CNC/DELIVERY for delivery, MIS for intraday, NRML for carry-forward F&O. */
    String product;

    /** Signed net quantity at capture time. */
    Double qty;

    @JsonProperty("remaining_qty")
    Double remainingQty;

    @JsonProperty("avg_price")
    Double avgPrice;

    Double pnl;

    @JsonProperty("last_price")
    Double lastPrice;

    @JsonProperty("close_price")
    Double closePrice;

    Double ltp;

    /** Notional already computed by the broker. Zero is treated as absent. */
    Double value;

    Double m2m;
    Double unrealised;
    Double realised;

    @JsonProperty("day_buy_qty")
    Double dayBuyQty;

    @JsonProperty("day_buy_avg_price")
    Double dayBuyAvgPrice;

    @JsonProperty("day_sell_qty")
    Double daySellQty;

    @JsonProperty("day_sell_avg_price")
    Double daySellAvgPrice;

    @JsonProperty("buy_qty")
    Double buyQty;

    @JsonProperty("buy_avg_price")
    Double buyAvgPrice;

    @JsonProperty("sell_qty")
    Double sellQty;

    @JsonProperty("sell_avg_price")
    Double sellAvgPrice;

    @JsonProperty("avg_buy_price")
    Double avgBuyPrice;

    @JsonProperty("avg_sell_price")
    Double avgSellPrice;
}
