package com.positionledger.ledger;

import com.positionledger.config.LedgerProperties;
import com.positionledger.domain.enums.CaptureMergePolicy;
import com.positionledger.domain.model.DailyAggregate;
import com.positionledger.domain.model.DailyCashRow;
import com.positionledger.domain.model.DailyPnlRow;
import com.positionledger.domain.model.InferredTransaction;
import com.positionledger.domain.model.PositionLedger;
import com.positionledger.domain.model.PositionSnapshot;
import com.positionledger.exception.ErrorCode;
import com.positionledger.exception.LedgerComputationException;
import com.positionledger.pnl.DailyPnlAnalyzer;
import com.positionledger.reporting.CurveProjector;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for rebuilding a position ledger from broker snapshots.
 *
 * <p>Pipeline, in order:
 * <ol>
 *   <li>{@link SnapshotCaptureMerger} applies the same-day capture policy.</li>
 *   <li>{@link TransactionInferenceEngine} derives BUY/SELL events.</li>
 *   <li>{@link DailyAggregator} totals turnover and holdings per date.</li>
 *   <li>{@link CashFoldEngine} threads the running cash balance through the dates.</li>
 *   <li>{@link DailyPnlAnalyzer} and {@link CurveProjector} build the analysis views.</li>
 * </ol>
 *
 * <p>Every call recomputes from scratch and keeps nothing between calls: the same snapshots
 * and starting cash always produce an equal ledger.
 *
 * <p>{@link #buildLedgerWithin} treats the whole pipeline as one bounded unit of work. It
 * either returns a complete ledger or throws; a partial ledger is never exposed.
 */
@Service
public class PositionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PositionLedgerService.class);

    private final SnapshotCaptureMerger captureMerger;
    private final TransactionInferenceEngine inferenceEngine;
    private final DailyAggregator dailyAggregator;
    private final CashFoldEngine cashFoldEngine;
    private final DailyPnlAnalyzer dailyPnlAnalyzer;
    private final CurveProjector curveProjector;
    private final LedgerProperties properties;
    private final Executor ledgerExecutor;

    public PositionLedgerService(
            SnapshotCaptureMerger captureMerger,
            TransactionInferenceEngine inferenceEngine,
            DailyAggregator dailyAggregator,
            CashFoldEngine cashFoldEngine,
            DailyPnlAnalyzer dailyPnlAnalyzer,
            CurveProjector curveProjector,
            LedgerProperties properties,
            @Qualifier("ledgerExecutor") Executor ledgerExecutor) {
        this.captureMerger = captureMerger;
        this.inferenceEngine = inferenceEngine;
        this.dailyAggregator = dailyAggregator;
        this.cashFoldEngine = cashFoldEngine;
        this.dailyPnlAnalyzer = dailyPnlAnalyzer;
        this.curveProjector = curveProjector;
        this.properties = properties;
        this.ledgerExecutor = ledgerExecutor;
    }

    /** Builds a ledger with the configured starting cash and capture merge policy. */
    public PositionLedger buildLedger(List<PositionSnapshot> snapshots) {
        return buildLedger(snapshots, properties.getStartingCash(), properties.getCaptureMergePolicy());
    }

    /**
     * Builds a ledger synchronously on the calling thread.
     *
     * @param startingCash opening balance; null means zero
     * @param policy same-day capture policy; null means {@link CaptureMergePolicy#SUM_ALL}
     */
    public PositionLedger buildLedger(
            List<PositionSnapshot> snapshots, BigDecimal startingCash, CaptureMergePolicy policy) {
        BigDecimal opening = startingCash != null ? startingCash : BigDecimal.ZERO;
        CaptureMergePolicy effectivePolicy = policy != null ? policy : CaptureMergePolicy.SUM_ALL;

        List<PositionSnapshot> rows = captureMerger.merge(snapshots, effectivePolicy);
        List<InferredTransaction> transactions = inferenceEngine.infer(rows);
        SortedMap<LocalDate, DailyAggregate> aggregates = dailyAggregator.aggregate(rows);
        List<DailyCashRow> cashRows = cashFoldEngine.fold(aggregates, opening);
        List<DailyPnlRow> dailyPnl = dailyPnlAnalyzer.analyze(rows);

        PositionLedger ledger = PositionLedger.builder()
                .startingCash(opening)
                .captureMergePolicy(effectivePolicy)
                .transactions(transactions)
                .cashRows(cashRows)
                .dailyPnl(dailyPnl)
                .pnlTotals(dailyPnlAnalyzer.totals(dailyPnl))
                .curves(curveProjector.project(cashRows, transactions))
                .build();

        log.debug(
                "Ledger built: snapshots={}, rows={}, transactions={}, dates={}, policy={}, closingCash={}",
                snapshots != null ? snapshots.size() : 0,
                rows.size(),
                transactions.size(),
                cashRows.size(),
                effectivePolicy,
                cashRows.isEmpty() ? opening : cashRows.get(cashRows.size() - 1).getCashBalance());
        return ledger;
    }

    /**
     * Builds a ledger on the ledger executor, waiting at most {@code timeout}.
     *
     * @throws LedgerComputationException {@code COMPUTATION_REJECTED} when the executor has no
     *     capacity, {@code COMPUTATION_TIMEOUT} when the deadline passes (the task is cancelled), {@code COMPUTATION_INTERRUPTED} when the caller is
     *     interrupted, {@code COMPUTATION_FAILED} when the pipeline itself throws
     */
    public PositionLedger buildLedgerWithin(
            List<PositionSnapshot> snapshots,
            BigDecimal startingCash,
            CaptureMergePolicy policy,
            Duration timeout) {
        Duration limit = timeout != null ? timeout : properties.getComputeTimeout();
        int snapshotCount = snapshots != null ? snapshots.size() : 0;

        FutureTask<PositionLedger> task = new FutureTask<>(() -> buildLedger(snapshots, startingCash, policy));
        try {
            ledgerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Ledger executor saturated, rejected computation of {} snapshots", snapshotCount);
            throw new LedgerComputationException(
                    ErrorCode.COMPUTATION_REJECTED,
                    "Ledger executor is saturated, computation rejected",
                    Map.of("snapshotCount", snapshotCount),
                    e);
        }

        try {
            return task.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Ledger computation exceeded {}ms for {} snapshots, rejected", limit.toMillis(), snapshotCount);
            throw new LedgerComputationException(
                    ErrorCode.COMPUTATION_TIMEOUT,
                    "Ledger computation timed out after " + limit.toMillis() + "ms",
                    Map.of("timeoutMs", limit.toMillis(), "snapshotCount", snapshotCount),
                    e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new LedgerComputationException(
                    ErrorCode.COMPUTATION_INTERRUPTED,
                    "Interrupted while waiting for ledger computation",
                    Map.of("snapshotCount", snapshotCount),
                    e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Ledger computation failed for {} snapshots: {}", snapshotCount, cause.getMessage(), cause);
            throw new LedgerComputationException(
                    ErrorCode.COMPUTATION_FAILED,
                    "Ledger computation failed: " + cause.getMessage(),
                    Map.of("snapshotCount", snapshotCount),
                    cause);
        }
    }
}
