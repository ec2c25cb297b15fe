package com.positionledger.domain.model;

import com.positionledger.domain.enums.MarkerKind;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** A chart annotation for one inferred transaction, e.g. {@code B RELIANCE}. */
@Value
@Builder
public class TradeMarker {

    LocalDate ts;
    MarkerKind kind;
    String text;
}
