package com.positionledger.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Chart-ready projection of a ledger: one point per cash row for each series, plus one
 * marker per inferred transaction. Series are in ascending date order.
 */
@Value
@Builder
public class LedgerCurves {

    List<CurvePoint> holdings;
    List<CurvePoint> cash;
    List<CurvePoint> netLiquidation;
    List<TradeMarker> markers;
}
