package com.splitttr.formcollab.support;

import com.splitttr.formcollab.config.CollabConfig;

import java.time.Duration;
import java.util.List;

public class TestConfig implements CollabConfig {

    public Duration idleThreshold = Duration.ofMinutes(5);
    public Duration conflictWindow = Duration.ofMillis(100);
    public int historyMaxEntries = 1000;
    public Duration historyMaxAge = Duration.ofMinutes(10);
    public int storeRetryMaxAttempts = 3;
    public List<String> colors = List.of("#EF4444", "#F59E0B", "#10B981");

    @Override
    public Duration idleThreshold() {
        return idleThreshold;
    }

    @Override
    public Duration reaperInterval() {
        return Duration.ofSeconds(60);
    }

    @Override
    public int historyMaxEntries() {
        return historyMaxEntries;
    }

    @Override
    public Duration historyMaxAge() {
        return historyMaxAge;
    }

    @Override
    public Duration conflictWindow() {
        return conflictWindow;
    }

    @Override
    public int storeRetryMaxAttempts() {
        return storeRetryMaxAttempts;
    }

    @Override
    public Duration storeRetryInitialBackoff() {
        return Duration.ofMillis(500);
    }

    @Override
    public Duration storeRetryMaxBackoff() {
        return Duration.ofSeconds(3);
    }

    @Override
    public List<String> colors() {
        return colors;
    }
}
