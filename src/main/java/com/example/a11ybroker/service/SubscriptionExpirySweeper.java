package com.example.a11ybroker.service;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that marks expired subscriptions inactive. Matching already ignores expired
 * subscriptions; this keeps the stored status in line with that.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "broker.subscriptions.sweeper.enabled", havingValue = "true")
public class SubscriptionExpirySweeper {

    private final Clock clock;
    private final SubscriptionMatcher subscriptionMatcher;

    @Scheduled(cron = "${broker.subscriptions.sweeper.schedule:0 */10 * * * *}")
    public void sweepExpiredSubscriptions() {
        long startTime = clock.millis();
        log.info("Starting subscription expiry sweep at {}", startTime);

        int deactivated = subscriptionMatcher.deactivateExpired();

        long duration = clock.millis() - startTime;
        log.info("Completed subscription expiry sweep in {}ms: deactivated={}", duration, deactivated);
    }
}
