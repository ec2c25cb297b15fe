package com.positionledger.ledger;

import com.positionledger.domain.enums.OrderSide;
import com.positionledger.domain.model.PositionSnapshot;
import java.math.BigDecimal;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Resolves snapshot fields through the {@link SnapshotField} table and normalizes the
 * identity columns used to key transactions and positions.
 *
 * <p>This is the only place raw {@code Double}s are converted. NaN and infinities are coerced
 * to zero here, so nothing downstream can be poisoned by a non-finite input: a single NaN
 * would otherwise propagate through every later running cash balance.
 */
@Component
public class SnapshotFieldResolver {

    static final String DEFAULT_EXCHANGE = "NSE";

    /**
     * Returns the first non-null candidate for {@code field}, or zero if none is populated.
     * A non-finite winner resolves to zero; it does not fall through to the next alias.
     */
    public BigDecimal resolve(PositionSnapshot snapshot, SnapshotField field) {
        for (SnapshotField.Candidate candidate : field.getCandidates()) {
            Double raw = candidate.accessor().apply(snapshot);
            if (raw != null) {
                return toFiniteDecimal(raw);
            }
        }
        return BigDecimal.ZERO;
    }

    public SideAggregate resolveSide(PositionSnapshot snapshot, OrderSide side) {
        return side == OrderSide.BUY
                ? new SideAggregate(resolve(snapshot, SnapshotField.BUY_QTY), resolve(snapshot, SnapshotField.BUY_PRICE))
                : new SideAggregate(
                        resolve(snapshot, SnapshotField.SELL_QTY), resolve(snapshot, SnapshotField.SELL_PRICE));
    }

    /**
     * Point-in-time valuation of the snapshot: the broker's {@code value} when finite and
     * non-zero, otherwise {@code qty * mark price}.
     */
    public BigDecimal resolveValue(PositionSnapshot snapshot) {
        Double value = snapshot.getValue();
        if (value != null && Double.isFinite(value) && value != 0.0) {
            return BigDecimal.valueOf(value);
        }
        return resolve(snapshot, SnapshotField.QTY).multiply(resolve(snapshot, SnapshotField.MARK_PRICE));
    }

    public String symbolOf(PositionSnapshot snapshot) {
        return snapshot.getSymbol() == null ? "" : snapshot.getSymbol().toUpperCase(Locale.ROOT);
    }

    public String exchangeOf(PositionSnapshot snapshot) {
        String exchange = snapshot.getExchange();
        return exchange == null || exchange.isBlank() ? DEFAULT_EXCHANGE : exchange;
    }

    public String productOf(PositionSnapshot snapshot) {
        return snapshot.getProduct() == null ? "" : snapshot.getProduct();
    }

    private static BigDecimal toFiniteDecimal(double raw) {
        return Double.isFinite(raw) ? BigDecimal.valueOf(raw) : BigDecimal.ZERO;
    }
}
