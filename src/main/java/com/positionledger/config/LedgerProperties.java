package com.positionledger.config;

import com.positionledger.domain.enums.CaptureMergePolicy;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the position ledger, bound from the {@code ledger.*} prefix.
 *
 * <p>Only {@code startingCash} and {@code captureMergePolicy} influence the ledger
 * output. The remaining settings govern how the pipeline is hosted: the executor behind
 * the timeout-guarded entry point and the optional snapshot file runner.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /** Cash balance before the first snapshot date. Negative values model margin debt. */
    private BigDecimal startingCash = BigDecimal.ZERO;

    /** How multiple captures of the same position on the same date are combined. */
    private CaptureMergePolicy captureMergePolicy = CaptureMergePolicy.SUM_ALL;

    /** Upper bound for one bounded pipeline run. */
    private Duration computeTimeout = Duration.ofSeconds(2);

    private Executor executor = new Executor();

    private Runner runner = new Runner();

    @Getter
    @Setter
    public static class Executor {

        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Runner {

        /** JSON array of snapshot records. The runner stays idle when unset. */
        private String inputFile;

        /** Destination for the ledger JSON. When unset only a summary is logged. */
        private String outputFile;
    }
}
