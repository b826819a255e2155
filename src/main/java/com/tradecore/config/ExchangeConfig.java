package com.tradecore.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the exchange boundary.
 */
@Configuration
@ConfigurationProperties(prefix = "tradecore.exchange")
@Getter
@Setter
@Validated
public class ExchangeConfig {

    /** PAPER runs against the in-process paper exchange. */
    private String mode = "PAPER";

    /** Upper bound on any single exchange call. */
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(10);

    /** Attempts for idempotent queries (status and price fetches). State-changing calls are never retried. */
    @Min(1)
    private int queryAttempts = 3;

    private Duration queryRetryBackoff = Duration.ofMillis(200);

    @Min(1)
    private int callPoolSize = 4;

    /** Failure rate (percent) over the sliding window that opens the circuit. Rejections do not count. */
    private float circuitFailureRateThreshold = 50f;

    @Min(1)
    private int circuitSlidingWindowSize = 20;

    private Duration circuitOpenDuration = Duration.ofSeconds(30);

    private Paper paper = new Paper();

    @Getter
    @Setter
    public static class Paper {

        private int pricePrecision = 8;
        private int amountPrecision = 8;
        private BigDecimal minAmount = new BigDecimal("0.00000001");
        private BigDecimal minNotional = new BigDecimal("5");
    }
}
