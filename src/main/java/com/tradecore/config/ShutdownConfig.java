package com.tradecore.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Time bounds for the shutdown sequence.
 */
@Configuration
@ConfigurationProperties(prefix = "tradecore.shutdown")
@Getter
@Setter
public class ShutdownConfig {

    /** Wait for in-flight write-through tasks before the final resync. */
    private Duration syncAwaitTimeout = Duration.ofSeconds(10);

    /** Upper bound on the final full resync of all write-through repositories. */
    private Duration flushTimeout = Duration.ofSeconds(30);
}
