package com.example.a11ybroker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for subscriptions, bound from application.yml (broker.subscriptions.*).
 * A ttl of zero means subscriptions never expire. The expiry sweeper only runs when
 * broker.subscriptions.sweeper.enabled=true.
 */
@Component
@ConfigurationProperties(prefix = "broker.subscriptions")
@Data
public class SubscriptionProperties {

    private int ttlDays = 0;
    private Sweeper sweeper = new Sweeper();

    @Data
    public static class Sweeper {
        private boolean enabled = false;
        private String schedule = "0 */10 * * * *";  // Every 10 minutes by default
    }
}
