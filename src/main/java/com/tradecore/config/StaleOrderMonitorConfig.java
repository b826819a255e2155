package com.tradecore.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the stale buy-order monitor.
 */
@Configuration
@ConfigurationProperties(prefix = "tradecore.monitor")
@Getter
@Setter
@Validated
public class StaleOrderMonitorConfig {

    private boolean enabled = true;

    /** An open buy order older than this is stale. */
    @NotNull
    private Duration maxAge = Duration.ofMinutes(15);

    /** An open buy order whose price deviates from market by more than this percentage is stale. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal maxDeviationPercent = new BigDecimal("3.0");

    @NotNull
    private Duration checkInterval = Duration.ofSeconds(30);

    /** Minimum time between two replacements for the same deal. */
    private Duration minRecreationCooldown = Duration.ofMinutes(1);

    /** Replacement buy price is placed this percentage below the market price. */
    @NotNull
    @DecimalMin("0")
    private BigDecimal replacementOffsetPercent = new BigDecimal("0.1");

    /** Orders younger than this are never evaluated. */
    private Duration gracePeriod = Duration.ZERO;
}
