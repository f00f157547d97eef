package com.mintstream.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for subscription teardown and trade purging.
 *
 * <p>Binds to the {@code mintstream.retention.*} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "mintstream.retention")
@Getter
@Setter
public class RetentionConfig {

    /** Age after which a token's trade subscription is torn down, measured from its creation. */
    private Duration stalenessAge = Duration.ofHours(1);

    /** How often the unsubscribe sweep runs. */
    private Duration sweepInterval = Duration.ofSeconds(60);

    /** Trades older than this are purged. */
    private Duration tradeRetention = Duration.ofMinutes(10);

    /** How often the trade purge runs. */
    private Duration cleanupInterval = Duration.ofSeconds(600);
}
