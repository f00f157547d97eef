package com.mintstream.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for startup recovery.
 *
 * <p>By default the subscription set starts empty after a restart, so tokens onboarded by a
 * previous process are neither re-subscribed nor swept. Enabling
 * {@code mintstream.recovery.rebuild-subscriptions} reloads the tokens that are still inside
 * the staleness window and subscribes to them again on the first live session.
 */
@Configuration
@ConfigurationProperties(prefix = "mintstream.recovery")
@Getter
@Setter
public class RecoveryConfig {

    private boolean rebuildSubscriptions = false;
}
