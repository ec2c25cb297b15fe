package com.positionledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CurvePoint {

    LocalDate ts;
    BigDecimal value;
}
