package com.positionledger.ledger;

import com.positionledger.domain.enums.CaptureMergePolicy;
import com.positionledger.domain.model.PositionSnapshot;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link CaptureMergePolicy} to the raw snapshot list before inference and
 * aggregation, so both stages see exactly the same rows.
 *
 * <p>Under {@code LATEST_PER_DAY} the position key is (date, exchange, symbol, product). The
 * capture with the greatest {@code captured_at} survives; a missing or unparseable timestamp
 * ranks below any parseable one, and on a tie the later row in input order wins. Rows without
 * a valid date pass through so the downstream stages can drop them the usual way.
 */
@Component
public class SnapshotCaptureMerger {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCaptureMerger.class);

    private final SnapshotFieldResolver fieldResolver;

    public SnapshotCaptureMerger(SnapshotFieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
    }

    public List<PositionSnapshot> merge(List<PositionSnapshot> snapshots, CaptureMergePolicy policy) {
        if (snapshots == null || snapshots.isEmpty()) {
            return List.of();
        }
        if (policy == null || policy == CaptureMergePolicy.SUM_ALL) {
            return snapshots;
        }

        // position key -> index of the surviving capture
        Map<String, Integer> winners = new HashMap<>();
        for (int i = 0; i < snapshots.size(); i++) {
            Optional<String> key = positionKey(snapshots.get(i));
            if (key.isEmpty()) {
                continue;
            }
            Integer current = winners.get(key.get());
            if (current == null || !isNewer(snapshots.get(current), snapshots.get(i))) {
                winners.put(key.get(), i);
            }
        }

        List<PositionSnapshot> merged = new ArrayList<>(snapshots.size());
        for (int i = 0; i < snapshots.size(); i++) {
            PositionSnapshot snapshot = snapshots.get(i);
            Optional<String> key = positionKey(snapshot);
            if (key.isEmpty() || winners.get(key.get()) == i) {
                merged.add(snapshot);
            }
        }

        int dropped = snapshots.size() - merged.size();
        if (dropped > 0) {
            log.debug("Dropped {} superseded same-day captures ({} rows kept)", dropped, merged.size());
        }
        return merged;
    }

    /** True when {@code current} was captured strictly after {@code candidate}. */
    private boolean isNewer(PositionSnapshot current, PositionSnapshot candidate) {
        Instant currentAt = CaptureTimestamps.parse(current.getCapturedAt()).orElse(Instant.MIN);
        Instant candidateAt = CaptureTimestamps.parse(candidate.getCapturedAt()).orElse(Instant.MIN);
        return currentAt.isAfter(candidateAt);
    }

    private Optional<String> positionKey(PositionSnapshot snapshot) {
        Optional<LocalDate> date = AsOfDates.dateOf(snapshot);
        return date.map(d -> d + ":"
                + fieldResolver.exchangeOf(snapshot) + ":"
                + fieldResolver.symbolOf(snapshot) + ":"
                + fieldResolver.productOf(snapshot));
    }
}
