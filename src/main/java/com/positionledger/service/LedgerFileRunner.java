package com.positionledger.service;

import com.positionledger.config.LedgerProperties;
import com.positionledger.domain.model.DailyCashRow;
import com.positionledger.domain.model.PositionLedger;
import com.positionledger.domain.model.PositionSnapshot;
import com.positionledger.exception.BaseException;
import com.positionledger.ledger.PositionLedgerService;
import com.positionledger.mapper.SnapshotJsonCodec;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Builds a ledger from a snapshot file once the application is ready.
 *
 * <p>Idle unless {@code ledger.runner.input-file} is set. Reads the JSON snapshot array,
 * builds the ledger under {@code ledger.compute-timeout} with the configured starting cash and
 * capture policy, then writes it to {@code ledger.runner.output-file} when configured.
 *
 * <p>Failures are logged, not rethrown: a bad input file must not take the context down.
 */
@Component
public class LedgerFileRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(LedgerFileRunner.class);

    private final PositionLedgerService positionLedgerService;
    private final LedgerProperties properties;

    public LedgerFileRunner(PositionLedgerService positionLedgerService, LedgerProperties properties) {
        this.positionLedgerService = positionLedgerService;
        this.properties = properties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        String inputFile = properties.getRunner().getInputFile();
        if (inputFile == null || inputFile.isBlank()) {
            log.debug("No ledger.runner.input-file configured, snapshot file runner idle");
            return;
        }
        run(Path.of(inputFile));
    }

    /**
     * Runs one file through the ledger.
     *
     * @return the ledger, or null when reading, computing or writing failed
     */
    public PositionLedger run(Path inputFile) {
        try {
            List<PositionSnapshot> snapshots = SnapshotJsonCodec.readSnapshots(inputFile);
            log.info("Loaded {} snapshots from {}", snapshots.size(), inputFile);

            PositionLedger ledger = positionLedgerService.buildLedgerWithin(
                    snapshots,
                    properties.getStartingCash(),
                    properties.getCaptureMergePolicy(),
                    properties.getComputeTimeout());

            String outputFile = properties.getRunner().getOutputFile();
            if (outputFile != null && !outputFile.isBlank()) {
                SnapshotJsonCodec.write(Path.of(outputFile), ledger);
                log.info("Ledger written to {}", outputFile);
            }
            logSummary(ledger);
            return ledger;
        } catch (BaseException e) {
            log.error(
                    "Ledger run for {} failed [{}, retryable={}]: {} {}",
                    inputFile,
                    e.getErrorCode().getCode(),
                    e.getErrorCode().isRetryable(),
                    e.getMessage(),
                    e.getDetails(),
                    e);
            return null;
        }
    }

    private void logSummary(PositionLedger ledger) {
        List<DailyCashRow> rows = ledger.getCashRows();
        if (rows.isEmpty()) {
            log.info("Ledger is empty: no snapshot carried a valid as_of_date");
            return;
        }
        DailyCashRow last = rows.get(rows.size() - 1);
        log.info(
                "Ledger {}..{}: transactions={}, startingCash={}, closingCash={}, netLiq={}, policy={}",
                rows.get(0).getAsOfDate(),
                last.getAsOfDate(),
                ledger.getTransactions().size(),
                ledger.getStartingCash(),
                last.getCashBalance(),
                last.getNetLiq(),
                ledger.getCaptureMergePolicy());
    }
}
